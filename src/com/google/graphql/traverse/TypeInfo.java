/*
 * Copyright 2024 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.graphql.traverse;

import com.google.common.annotations.VisibleForTesting;
import com.google.graphql.ast.IR;
import com.google.graphql.ast.Node;
import com.google.graphql.ast.NodeUtil;
import com.google.graphql.ast.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.nullness.Nullable;

/**
 * TypeInfo keeps track of where in a schema the current node of a traversal over an executable
 * document is: the type of the current field, the composite type whose fields are being
 * selected, the expected type of the current input value, and the field, directive, argument
 * and enum value definitions in effect.
 *
 * <p>It is driven by calling {@link #enter} and {@link #leave} for every node, normally through a
 * {@link TypeInfoVisitor}. Each node kind that establishes context pushes onto its stacks when
 * entered and pops when left, so the state after leaving a node is the state before entering it.
 *
 * <p>A traversal that stops early, by {@link Action#BREAK} or by throwing, leaves the position
 * where it stopped. {@link #reset} forgets it; entering a {@link Token#DOCUMENT} does too, and a
 * {@link TypeInfoVisitor} resets on entering the root and on a {@code BREAK}.
 *
 * <p>Positions the schema has nothing for (an unknown field, an argument the field doesn't
 * declare) are tracked as null rather than treated as errors.
 *
 * <p>Types are represented by schema nodes: output and input types by the type reference from
 * the schema (so {@code [Pet]} keeps its list wrapper) and parent types by the definition of the
 * composite type.
 */
public final class TypeInfo {
  private static final Logger logger = Logger.getLogger(TypeInfo.class.getName());

  private final TypeRegistry registry;

  private final List<@Nullable Node> typeStack = new ArrayList<>();
  private final List<@Nullable Node> parentTypeStack = new ArrayList<>();
  private final List<@Nullable Node> inputTypeStack = new ArrayList<>();
  private final List<@Nullable Node> fieldDefStack = new ArrayList<>();
  private final List<@Nullable Node> defaultValueStack = new ArrayList<>();
  private @Nullable Node directive;
  private @Nullable Node argument;
  private @Nullable Node enumValue;

  public TypeInfo(TypeRegistry registry) {
    this.registry = registry;
  }

  /** Creates a TypeInfo for the given schema document. */
  public TypeInfo(Node schema) {
    this(new TypeRegistry(schema));
  }

  public TypeRegistry getRegistry() {
    return registry;
  }

  /**
   * The output type at the current position, e.g. the declared type of the current field, or
   * null if there is none or it isn't known to the schema.
   */
  public @Nullable Node getCurrentType() {
    return peek(typeStack);
  }

  /** The definition of the composite type whose fields are currently being selected, or null. */
  public @Nullable Node getCurrentParentType() {
    return peek(parentTypeStack);
  }

  /** The type expected for the input value at the current position, or null. */
  public @Nullable Node getCurrentInputType() {
    return peek(inputTypeStack);
  }

  /** The input type enclosing the current one, e.g. the list type of the current list item. */
  public @Nullable Node getParentInputType() {
    int size = inputTypeStack.size();
    return size > 1 ? inputTypeStack.get(size - 2) : null;
  }

  /** The definition of the current field, or null. */
  public @Nullable Node getFieldDef() {
    return peek(fieldDefStack);
  }

  /** The default value of the current argument or input field, or null. */
  public @Nullable Node getDefaultValue() {
    return peek(defaultValueStack);
  }

  /** The definition of the current directive, or null. */
  public @Nullable Node getDirective() {
    return directive;
  }

  /** The definition of the current argument, or null. */
  public @Nullable Node getArgument() {
    return argument;
  }

  /** The definition of the current enum value, or null. */
  public @Nullable Node getEnumValue() {
    return enumValue;
  }

  /** Forgets the current position, as if no node had been entered. */
  public void reset() {
    typeStack.clear();
    parentTypeStack.clear();
    inputTypeStack.clear();
    fieldDefStack.clear();
    defaultValueStack.clear();
    directive = null;
    argument = null;
    enumValue = null;
  }

  @VisibleForTesting
  int getStackDepth() {
    return typeStack.size()
        + parentTypeStack.size()
        + inputTypeStack.size()
        + fieldDefStack.size()
        + defaultValueStack.size();
  }

  /** Updates the position for entering {@code n}. */
  public void enter(Node n) {
    switch (n.getToken()) {
      case DOCUMENT:
        reset();
        break;
      case SELECTION_SET:
        {
          Node namedType = registry.getNamedType(getCurrentType());
          parentTypeStack.add(TypeRegistry.isCompositeType(namedType) ? namedType : null);
          break;
        }
      case FIELD:
        {
          Node parentType = getCurrentParentType();
          Node fieldDef = null;
          Node fieldType = null;
          if (parentType != null) {
            fieldDef = registry.getField(parentType, n.getName());
            if (fieldDef != null) {
              fieldType = fieldDef.getType();
            } else {
              logMiss("field", n.getName(), parentType);
            }
          }
          fieldDefStack.add(fieldDef);
          typeStack.add(isOutputTypeReference(fieldType) ? fieldType : null);
          break;
        }
      case DIRECTIVE:
        directive = registry.getDirective(n.getName());
        if (directive == null) {
          logMiss("directive", n.getName(), null);
        }
        break;
      case OPERATION_DEFINITION:
        {
          Node rootType = registry.getRootType(n.getOperation());
          typeStack.add(
              TypeRegistry.isObjectType(rootType) ? IR.namedType(rootType.getName()) : null);
          break;
        }
      case INLINE_FRAGMENT:
      case FRAGMENT_DEFINITION:
        {
          Node typeCondition = n.getTypeCondition();
          Node outputType;
          if (typeCondition != null) {
            outputType = typeCondition;
          } else {
            Node namedType = registry.getNamedType(getCurrentType());
            outputType = namedType == null ? null : IR.namedType(namedType.getName());
          }
          typeStack.add(isOutputTypeReference(outputType) ? outputType : null);
          break;
        }
      case VARIABLE_DEFINITION:
        {
          Node inputType = n.getType();
          inputTypeStack.add(isInputTypeReference(inputType) ? inputType : null);
          break;
        }
      case ARGUMENT:
        {
          Node fieldOrDirective = directive != null ? directive : getFieldDef();
          Node argDef = null;
          Node argType = null;
          if (fieldOrDirective != null) {
            argDef = registry.getArgument(fieldOrDirective, n.getName());
            if (argDef != null) {
              argType = argDef.getType();
            } else {
              logMiss("argument", n.getName(), fieldOrDirective);
            }
          }
          argument = argDef;
          defaultValueStack.add(argDef == null ? null : argDef.getDefaultValue());
          inputTypeStack.add(isInputTypeReference(argType) ? argType : null);
          break;
        }
      case LIST_VALUE:
        {
          Node listType = NodeUtil.getNullableType(getCurrentInputType());
          Node itemType = listType != null && listType.isListType() ? listType.getType() : listType;
          defaultValueStack.add(null);
          inputTypeStack.add(isInputTypeReference(itemType) ? itemType : null);
          break;
        }
      case OBJECT_FIELD:
        {
          Node objectType = registry.getNamedType(getCurrentInputType());
          Node inputField = null;
          if (objectType != null && objectType.getToken() == Token.INPUT_OBJECT_TYPE_DEFINITION) {
            inputField = registry.getInputField(objectType, n.getName());
            if (inputField == null) {
              logMiss("input field", n.getName(), objectType);
            }
          }
          Node inputFieldType = inputField == null ? null : inputField.getType();
          defaultValueStack.add(inputField == null ? null : inputField.getDefaultValue());
          inputTypeStack.add(isInputTypeReference(inputFieldType) ? inputFieldType : null);
          break;
        }
      case ENUM_VALUE:
        {
          Node enumType = registry.getNamedType(getCurrentInputType());
          enumValue =
              enumType != null && enumType.getToken() == Token.ENUM_TYPE_DEFINITION
                  ? registry.getEnumValue(enumType, n.getLiteral())
                  : null;
          break;
        }
      case LIST_TYPE:
      case NON_NULL_TYPE:
        inputTypeStack.add(NodeUtil.unwrapType(getCurrentInputType()));
        break;
      default:
        break;
    }
  }

  /** Restores the position from before {@code n} was entered. */
  public void leave(Node n) {
    switch (n.getToken()) {
      case SELECTION_SET:
        pop(parentTypeStack);
        break;
      case FIELD:
        pop(fieldDefStack);
        pop(typeStack);
        break;
      case DIRECTIVE:
        directive = null;
        break;
      case OPERATION_DEFINITION:
      case INLINE_FRAGMENT:
      case FRAGMENT_DEFINITION:
        pop(typeStack);
        break;
      case VARIABLE_DEFINITION:
        pop(inputTypeStack);
        break;
      case ARGUMENT:
        argument = null;
        pop(defaultValueStack);
        pop(inputTypeStack);
        break;
      case LIST_VALUE:
      case OBJECT_FIELD:
        pop(defaultValueStack);
        pop(inputTypeStack);
        break;
      case ENUM_VALUE:
        enumValue = null;
        break;
      case LIST_TYPE:
      case NON_NULL_TYPE:
        pop(inputTypeStack);
        break;
      default:
        break;
    }
  }

  private boolean isOutputTypeReference(@Nullable Node type) {
    return type != null && TypeRegistry.isOutputType(registry.getNamedType(type));
  }

  private boolean isInputTypeReference(@Nullable Node type) {
    return type != null && TypeRegistry.isInputType(registry.getNamedType(type));
  }

  private static void logMiss(String what, @Nullable String name, @Nullable Node owner) {
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("No " + what + " " + name + (owner == null ? "" : " on " + owner));
    }
  }

  private static @Nullable Node peek(List<@Nullable Node> stack) {
    return stack.isEmpty() ? null : stack.get(stack.size() - 1);
  }

  private static void pop(List<@Nullable Node> stack) {
    // Tolerates a leave without a matching enter.
    if (!stack.isEmpty()) {
      stack.remove(stack.size() - 1);
    }
  }
}
