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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.graphql.ast.IR;
import com.google.graphql.ast.Node;
import com.google.graphql.ast.NodeUtil;
import com.google.graphql.ast.OperationType;
import com.google.graphql.ast.Slot;
import com.google.graphql.ast.Token;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;
import org.jspecify.nullness.Nullable;

/**
 * An index over a schema document, answering the lookups {@link TypeInfo} needs: types and
 * directives by name, the root type of each operation, and the fields, arguments, input fields
 * and enum values of a type including those added by extensions.
 *
 * <p>Types and directives built into GraphQL ({@code Int}, {@code Float}, {@code String}, {@code
 * Boolean}, {@code ID}, {@code @skip}, {@code @include}, {@code @deprecated}, {@code
 * @specifiedBy}) are available unless the schema defines its own.
 */
public final class TypeRegistry {
  private static final Logger logger = Logger.getLogger(TypeRegistry.class.getName());

  private static final ImmutableList<Node> BUILT_IN_SCALARS =
      ImmutableList.of(
          IR.scalarTypeDefinition("Int"),
          IR.scalarTypeDefinition("Float"),
          IR.scalarTypeDefinition("String"),
          IR.scalarTypeDefinition("Boolean"),
          IR.scalarTypeDefinition("ID"));

  private static final ImmutableList<Node> BUILT_IN_DIRECTIVES =
      ImmutableList.of(
          IR.directiveDefinition(
              "skip",
              ImmutableList.of(IR.inputValueDefinition("if", nonNull("Boolean"))),
              false,
              "FIELD",
              "FRAGMENT_SPREAD",
              "INLINE_FRAGMENT"),
          IR.directiveDefinition(
              "include",
              ImmutableList.of(IR.inputValueDefinition("if", nonNull("Boolean"))),
              false,
              "FIELD",
              "FRAGMENT_SPREAD",
              "INLINE_FRAGMENT"),
          IR.directiveDefinition(
              "deprecated",
              ImmutableList.of(
                  IR.inputValueDefinition(
                      "reason",
                      IR.namedType("String"),
                      IR.stringValue("No longer supported"))),
              false,
              "FIELD_DEFINITION",
              "ARGUMENT_DEFINITION",
              "INPUT_FIELD_DEFINITION",
              "ENUM_VALUE"),
          IR.directiveDefinition(
              "specifiedBy",
              ImmutableList.of(IR.inputValueDefinition("url", nonNull("String"))),
              false,
              "SCALAR"));

  static final Node TYPENAME_FIELD = IR.fieldDefinition("__typename", nonNull("String"));
  static final Node SCHEMA_FIELD = IR.fieldDefinition("__schema", nonNull("__Schema"));
  static final Node TYPE_FIELD =
      IR.fieldDefinition(
          "__type", IR.namedType("__Type"), IR.inputValueDefinition("name", nonNull("String")));

  private final Map<String, Node> types = new LinkedHashMap<>();
  private final ListMultimap<String, Node> extensions = LinkedListMultimap.create();
  private final Map<String, Node> directives = new LinkedHashMap<>();
  private final EnumMap<OperationType, String> rootTypeNames = new EnumMap<>(OperationType.class);

  /** Indexes {@code schema}, a {@link Token#DOCUMENT} of type system definitions. */
  public TypeRegistry(Node schema) {
    checkArgument(schema.isDocument(), "Expected a schema document, got %s", schema);
    boolean hasSchemaDefinition = false;
    for (Node definition : schema.getDefinitions()) {
      switch (definition.getToken()) {
        case SCHEMA_DEFINITION:
          hasSchemaDefinition = true;
          addOperationTypes(definition);
          break;
        case SCHEMA_EXTENSION:
          addOperationTypes(definition);
          break;
        case DIRECTIVE_DEFINITION:
          addUnique(directives, definition);
          break;
        default:
          if (NodeUtil.isTypeDefinition(definition)) {
            addUnique(types, definition);
          } else if (NodeUtil.isTypeExtension(definition)) {
            extensions.put(definition.getName(), definition);
          }
          // Executable definitions have no meaning in a schema and are ignored.
          break;
      }
    }
    for (Node scalar : BUILT_IN_SCALARS) {
      types.putIfAbsent(scalar.getName(), scalar);
    }
    for (Node directive : BUILT_IN_DIRECTIVES) {
      directives.putIfAbsent(directive.getName(), directive);
    }
    if (!hasSchemaDefinition) {
      for (OperationType operation : OperationType.values()) {
        Node type = types.get(operation.getDefaultTypeName());
        if (type != null && type.getToken() == Token.OBJECT_TYPE_DEFINITION) {
          rootTypeNames.putIfAbsent(operation, type.getName());
        }
      }
    }
  }

  private void addOperationTypes(Node schemaDefinition) {
    for (Node operationType : schemaDefinition.getChildren(Slot.OPERATION_TYPES)) {
      Node namedType = operationType.getType();
      if (namedType != null) {
        rootTypeNames.put(operationType.getOperation(), namedType.getName());
      }
    }
  }

  private static void addUnique(Map<String, Node> definitions, Node definition) {
    Node existing = definitions.putIfAbsent(definition.getName(), definition);
    if (existing != null) {
      logger.warning("Ignoring duplicate definition of " + definition);
    }
  }

  /** Returns the definition of the named type, or null if there is none. */
  public @Nullable Node getType(@Nullable String name) {
    return name == null ? null : types.get(name);
  }

  /** Returns the definition of the type a type reference names, ignoring wrappers. */
  public @Nullable Node getNamedType(@Nullable Node typeReference) {
    Node namedType = NodeUtil.getNamedType(typeReference);
    return namedType == null ? null : getType(namedType.getName());
  }

  public @Nullable Node getDirective(@Nullable String name) {
    return name == null ? null : directives.get(name);
  }

  /** Returns the root object type for the given operation, or null if the schema has none. */
  public @Nullable Node getRootType(OperationType operation) {
    String name = rootTypeNames.get(operation);
    return name == null ? null : types.get(name);
  }

  public ImmutableMap<String, Node> getTypes() {
    return ImmutableMap.copyOf(types);
  }

  /** Returns the field definitions of an object or interface type, extensions included. */
  public ImmutableList<Node> getFields(Node type) {
    return collect(type, Slot.FIELDS);
  }

  /** Returns the fields of an input object type, extensions included. */
  public ImmutableList<Node> getInputFields(Node type) {
    checkArgument(type.getToken() == Token.INPUT_OBJECT_TYPE_DEFINITION, type);
    return collect(type, Slot.FIELDS);
  }

  /** Returns the value definitions of an enum type, extensions included. */
  public ImmutableList<Node> getEnumValues(Node type) {
    checkArgument(type.getToken() == Token.ENUM_TYPE_DEFINITION, type);
    return collect(type, Slot.ENUM_VALUES);
  }

  /** Returns the member types of a union type, extensions included. */
  public ImmutableList<Node> getPossibleTypes(Node type) {
    checkArgument(type.getToken() == Token.UNION_TYPE_DEFINITION, type);
    ImmutableList.Builder<Node> members = ImmutableList.builder();
    for (Node member : collect(type, Slot.TYPES)) {
      Node definition = getType(member.getName());
      if (definition != null) {
        members.add(definition);
      }
    }
    return members.build();
  }

  private ImmutableList<Node> collect(Node type, Slot slot) {
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    children.addAll(type.getChildren(slot));
    for (Node extension : extensions.get(type.getName())) {
      if (NodeUtil.getExtendedToken(extension) == type.getToken()) {
        children.addAll(extension.getChildren(slot));
      }
    }
    return children.build();
  }

  /**
   * Returns the definition of the field {@code name} on a composite type, or null. Resolves the
   * meta fields {@code __typename} on every composite type, and {@code __schema} and {@code
   * __type} on the query root.
   */
  public @Nullable Node getField(Node parentType, String name) {
    if (name.equals(TYPENAME_FIELD.getName())) {
      return TYPENAME_FIELD;
    }
    if (parentType == getRootType(OperationType.QUERY)) {
      if (name.equals(SCHEMA_FIELD.getName())) {
        return SCHEMA_FIELD;
      } else if (name.equals(TYPE_FIELD.getName())) {
        return TYPE_FIELD;
      }
    }
    switch (parentType.getToken()) {
      case OBJECT_TYPE_DEFINITION:
      case INTERFACE_TYPE_DEFINITION:
        return NodeUtil.findByName(getFields(parentType), name);
      default:
        return null;
    }
  }

  /** Returns the argument {@code name} of a field or directive definition, or null. */
  public @Nullable Node getArgument(Node fieldOrDirective, String name) {
    return NodeUtil.findByName(fieldOrDirective.getArguments(), name);
  }

  /** Returns the input field {@code name} of an input object type, or null. */
  public @Nullable Node getInputField(Node inputObjectType, String name) {
    return NodeUtil.findByName(getInputFields(inputObjectType), name);
  }

  /** Returns the definition of the enum value {@code name} of an enum type, or null. */
  public @Nullable Node getEnumValue(Node enumType, String name) {
    return NodeUtil.findByName(getEnumValues(enumType), name);
  }

  /** Whether {@code type} is an object, interface or union type definition. */
  public static boolean isCompositeType(@Nullable Node type) {
    if (type == null) {
      return false;
    }
    switch (type.getToken()) {
      case OBJECT_TYPE_DEFINITION:
      case INTERFACE_TYPE_DEFINITION:
      case UNION_TYPE_DEFINITION:
        return true;
      default:
        return false;
    }
  }

  /** Whether {@code type} is an interface or union type definition. */
  public static boolean isAbstractType(@Nullable Node type) {
    return type != null
        && (type.getToken() == Token.INTERFACE_TYPE_DEFINITION
            || type.getToken() == Token.UNION_TYPE_DEFINITION);
  }

  public static boolean isObjectType(@Nullable Node type) {
    return type != null && type.getToken() == Token.OBJECT_TYPE_DEFINITION;
  }

  /** Whether {@code type} may be used for arguments and variables. */
  public static boolean isInputType(@Nullable Node type) {
    if (type == null) {
      return false;
    }
    switch (type.getToken()) {
      case SCALAR_TYPE_DEFINITION:
      case ENUM_TYPE_DEFINITION:
      case INPUT_OBJECT_TYPE_DEFINITION:
        return true;
      default:
        return false;
    }
  }

  /** Whether {@code type} may be the type of a field. */
  public static boolean isOutputType(@Nullable Node type) {
    if (type == null) {
      return false;
    }
    switch (type.getToken()) {
      case SCALAR_TYPE_DEFINITION:
      case OBJECT_TYPE_DEFINITION:
      case INTERFACE_TYPE_DEFINITION:
      case UNION_TYPE_DEFINITION:
      case ENUM_TYPE_DEFINITION:
        return true;
      default:
        return false;
    }
  }

  private static Node nonNull(String name) {
    return IR.nonNullType(IR.namedType(name));
  }
}
