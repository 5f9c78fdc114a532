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

package com.google.graphql.ast;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.nullness.Nullable;

/** An AST construction helper class. */
public class IR {

  private IR() {}

  public static Node document(Node... definitions) {
    return document(ImmutableList.copyOf(definitions));
  }

  public static Node document(List<Node> definitions) {
    for (Node definition : definitions) {
      checkState(
          NodeUtil.isExecutableDefinition(definition)
              || NodeUtil.isTypeSystemDefinition(definition),
          "Document cannot contain %s",
          definition.getToken());
    }
    return Node.builder(Token.DOCUMENT).setChildren(Slot.DEFINITIONS, definitions).build();
  }

  /** An anonymous query, i.e. the {@code { ... }} shorthand. */
  public static Node query(Node selectionSet) {
    return operation(
        OperationType.QUERY, null, ImmutableList.of(), ImmutableList.of(), selectionSet);
  }

  public static Node operation(OperationType operation, @Nullable String name, Node selectionSet) {
    return operation(operation, name, ImmutableList.of(), ImmutableList.of(), selectionSet);
  }

  public static Node operation(
      OperationType operation,
      @Nullable String name,
      List<Node> variableDefinitions,
      List<Node> directives,
      Node selectionSet) {
    checkAll(variableDefinitions, Token.VARIABLE_DEFINITION);
    checkAll(directives, Token.DIRECTIVE);
    checkState(selectionSet.isSelectionSet(), selectionSet);
    return Node.builder(Token.OPERATION_DEFINITION)
        .setOperation(checkNotNull(operation))
        .setName(name)
        .setChildren(Slot.VARIABLE_DEFINITIONS, variableDefinitions)
        .setChildren(Slot.DIRECTIVES, directives)
        .setChild(Slot.SELECTION_SET, selectionSet)
        .build();
  }

  public static Node variableDefinition(String name, Node type) {
    return variableDefinition(name, type, null, ImmutableList.of());
  }

  public static Node variableDefinition(
      String name, Node type, @Nullable Node defaultValue, List<Node> directives) {
    checkState(NodeUtil.isTypeReference(type), type);
    checkState(defaultValue == null || NodeUtil.isValue(defaultValue), defaultValue);
    checkAll(directives, Token.DIRECTIVE);
    return Node.builder(Token.VARIABLE_DEFINITION)
        .setChild(Slot.VARIABLE, variable(name))
        .setChild(Slot.TYPE, type)
        .setChild(Slot.DEFAULT_VALUE, defaultValue)
        .setChildren(Slot.DIRECTIVES, directives)
        .build();
  }

  public static Node variable(String name) {
    return named(Token.VARIABLE, name);
  }

  public static Node selectionSet(Node... selections) {
    return selectionSet(ImmutableList.copyOf(selections));
  }

  public static Node selectionSet(List<Node> selections) {
    for (Node selection : selections) {
      checkState(NodeUtil.isSelection(selection), "Selection set cannot contain %s", selection);
    }
    return Node.builder(Token.SELECTION_SET).setChildren(Slot.SELECTIONS, selections).build();
  }

  /** A leaf field without arguments. */
  public static Node field(String name) {
    return field(null, name, ImmutableList.of(), ImmutableList.of(), null);
  }

  public static Node field(String name, Node selectionSet) {
    return field(null, name, ImmutableList.of(), ImmutableList.of(), selectionSet);
  }

  public static Node field(String name, List<Node> arguments, @Nullable Node selectionSet) {
    return field(null, name, arguments, ImmutableList.of(), selectionSet);
  }

  public static Node field(
      @Nullable String alias,
      String name,
      List<Node> arguments,
      List<Node> directives,
      @Nullable Node selectionSet) {
    checkAll(arguments, Token.ARGUMENT);
    checkAll(directives, Token.DIRECTIVE);
    checkState(selectionSet == null || selectionSet.isSelectionSet(), selectionSet);
    return Node.builder(Token.FIELD)
        .setAlias(alias)
        .setName(checkNotNull(name))
        .setChildren(Slot.ARGUMENTS, arguments)
        .setChildren(Slot.DIRECTIVES, directives)
        .setChild(Slot.SELECTION_SET, selectionSet)
        .build();
  }

  public static Node argument(String name, Node value) {
    checkState(NodeUtil.isValue(value), "%s can't be an argument value", value);
    return Node.builder(Token.ARGUMENT)
        .setName(checkNotNull(name))
        .setChild(Slot.VALUE, value)
        .build();
  }

  public static Node fragmentSpread(String name, Node... directives) {
    checkAll(ImmutableList.copyOf(directives), Token.DIRECTIVE);
    return Node.builder(Token.FRAGMENT_SPREAD)
        .setName(checkNotNull(name))
        .setChildren(Slot.DIRECTIVES, ImmutableList.copyOf(directives))
        .build();
  }

  /** An inline fragment, {@code ... on TypeCondition { }}. The type condition may be null. */
  public static Node inlineFragment(@Nullable Node typeCondition, Node selectionSet) {
    return inlineFragment(typeCondition, ImmutableList.of(), selectionSet);
  }

  public static Node inlineFragment(
      @Nullable Node typeCondition, List<Node> directives, Node selectionSet) {
    checkState(typeCondition == null || typeCondition.isNamedType(), typeCondition);
    checkAll(directives, Token.DIRECTIVE);
    checkState(selectionSet.isSelectionSet(), selectionSet);
    return Node.builder(Token.INLINE_FRAGMENT)
        .setChild(Slot.TYPE_CONDITION, typeCondition)
        .setChildren(Slot.DIRECTIVES, directives)
        .setChild(Slot.SELECTION_SET, selectionSet)
        .build();
  }

  public static Node fragmentDefinition(String name, Node typeCondition, Node selectionSet) {
    checkState(typeCondition.isNamedType(), typeCondition);
    checkState(selectionSet.isSelectionSet(), selectionSet);
    return Node.builder(Token.FRAGMENT_DEFINITION)
        .setName(checkNotNull(name))
        .setChild(Slot.TYPE_CONDITION, typeCondition)
        .setChild(Slot.SELECTION_SET, selectionSet)
        .build();
  }

  public static Node directive(String name, Node... arguments) {
    checkAll(ImmutableList.copyOf(arguments), Token.ARGUMENT);
    return Node.builder(Token.DIRECTIVE)
        .setName(checkNotNull(name))
        .setChildren(Slot.ARGUMENTS, ImmutableList.copyOf(arguments))
        .build();
  }

  public static Node intValue(long value) {
    return literal(Token.INT_VALUE, Long.toString(value));
  }

  public static Node floatValue(String digits) {
    return literal(Token.FLOAT_VALUE, digits);
  }

  public static Node stringValue(String value) {
    return literal(Token.STRING_VALUE, value);
  }

  public static Node booleanValue(boolean value) {
    return literal(Token.BOOLEAN_VALUE, Boolean.toString(value));
  }

  public static Node nullValue() {
    return Node.builder(Token.NULL_VALUE).build();
  }

  public static Node enumValue(String name) {
    return literal(Token.ENUM_VALUE, name);
  }

  public static Node listValue(Node... values) {
    for (Node value : values) {
      checkState(NodeUtil.isValue(value), "%s can't be a list item", value);
    }
    return Node.builder(Token.LIST_VALUE)
        .setChildren(Slot.VALUES, ImmutableList.copyOf(values))
        .build();
  }

  public static Node objectValue(Node... fields) {
    checkAll(ImmutableList.copyOf(fields), Token.OBJECT_FIELD);
    return Node.builder(Token.OBJECT_VALUE)
        .setChildren(Slot.FIELDS, ImmutableList.copyOf(fields))
        .build();
  }

  public static Node objectField(String name, Node value) {
    checkState(NodeUtil.isValue(value), "%s can't be an object field value", value);
    return Node.builder(Token.OBJECT_FIELD)
        .setName(checkNotNull(name))
        .setChild(Slot.VALUE, value)
        .build();
  }

  public static Node namedType(String name) {
    return named(Token.NAMED_TYPE, name);
  }

  public static Node listType(Node itemType) {
    checkState(NodeUtil.isTypeReference(itemType), itemType);
    return Node.builder(Token.LIST_TYPE).setChild(Slot.TYPE, itemType).build();
  }

  public static Node nonNullType(Node type) {
    checkState(type.isNamedType() || type.isListType(), "%s can't be made non-null", type);
    return Node.builder(Token.NON_NULL_TYPE).setChild(Slot.TYPE, type).build();
  }

  // Type system

  public static Node schemaDefinition(Node... operationTypes) {
    checkAll(ImmutableList.copyOf(operationTypes), Token.OPERATION_TYPE_DEFINITION);
    return Node.builder(Token.SCHEMA_DEFINITION)
        .setChildren(Slot.OPERATION_TYPES, ImmutableList.copyOf(operationTypes))
        .build();
  }

  public static Node schemaExtension(Node... operationTypes) {
    checkAll(ImmutableList.copyOf(operationTypes), Token.OPERATION_TYPE_DEFINITION);
    return Node.builder(Token.SCHEMA_EXTENSION)
        .setChildren(Slot.OPERATION_TYPES, ImmutableList.copyOf(operationTypes))
        .build();
  }

  public static Node operationTypeDefinition(OperationType operation, String typeName) {
    return Node.builder(Token.OPERATION_TYPE_DEFINITION)
        .setOperation(checkNotNull(operation))
        .setChild(Slot.TYPE, namedType(typeName))
        .build();
  }

  public static Node scalarTypeDefinition(String name) {
    return named(Token.SCALAR_TYPE_DEFINITION, name);
  }

  public static Node objectTypeDefinition(String name, Node... fields) {
    return objectTypeDefinition(name, ImmutableList.of(), ImmutableList.copyOf(fields));
  }

  public static Node objectTypeDefinition(
      String name, List<String> interfaces, List<Node> fields) {
    return typeWithFields(Token.OBJECT_TYPE_DEFINITION, name, interfaces, fields);
  }

  public static Node objectTypeExtension(String name, Node... fields) {
    return typeWithFields(
        Token.OBJECT_TYPE_EXTENSION, name, ImmutableList.of(), ImmutableList.copyOf(fields));
  }

  public static Node interfaceTypeDefinition(String name, Node... fields) {
    return typeWithFields(
        Token.INTERFACE_TYPE_DEFINITION, name, ImmutableList.of(), ImmutableList.copyOf(fields));
  }

  public static Node interfaceTypeExtension(String name, Node... fields) {
    return typeWithFields(
        Token.INTERFACE_TYPE_EXTENSION, name, ImmutableList.of(), ImmutableList.copyOf(fields));
  }

  public static Node fieldDefinition(String name, Node type, Node... arguments) {
    checkState(NodeUtil.isTypeReference(type), type);
    checkAll(ImmutableList.copyOf(arguments), Token.INPUT_VALUE_DEFINITION);
    return Node.builder(Token.FIELD_DEFINITION)
        .setName(checkNotNull(name))
        .setChildren(Slot.ARGUMENTS, ImmutableList.copyOf(arguments))
        .setChild(Slot.TYPE, type)
        .build();
  }

  public static Node inputValueDefinition(String name, Node type) {
    return inputValueDefinition(name, type, null);
  }

  public static Node inputValueDefinition(String name, Node type, @Nullable Node defaultValue) {
    checkState(NodeUtil.isTypeReference(type), type);
    checkState(defaultValue == null || NodeUtil.isValue(defaultValue), defaultValue);
    return Node.builder(Token.INPUT_VALUE_DEFINITION)
        .setName(checkNotNull(name))
        .setChild(Slot.TYPE, type)
        .setChild(Slot.DEFAULT_VALUE, defaultValue)
        .build();
  }

  public static Node unionTypeDefinition(String name, String... members) {
    return unionType(Token.UNION_TYPE_DEFINITION, name, members);
  }

  public static Node unionTypeExtension(String name, String... members) {
    return unionType(Token.UNION_TYPE_EXTENSION, name, members);
  }

  public static Node enumTypeDefinition(String name, String... values) {
    return enumType(Token.ENUM_TYPE_DEFINITION, name, values);
  }

  public static Node enumTypeExtension(String name, String... values) {
    return enumType(Token.ENUM_TYPE_EXTENSION, name, values);
  }

  public static Node enumValueDefinition(String name) {
    return named(Token.ENUM_VALUE_DEFINITION, name);
  }

  public static Node inputObjectTypeDefinition(String name, Node... fields) {
    return inputObjectType(Token.INPUT_OBJECT_TYPE_DEFINITION, name, fields);
  }

  public static Node inputObjectTypeExtension(String name, Node... fields) {
    return inputObjectType(Token.INPUT_OBJECT_TYPE_EXTENSION, name, fields);
  }

  public static Node directiveDefinition(
      String name, List<Node> arguments, boolean repeatable, String... locations) {
    checkAll(arguments, Token.INPUT_VALUE_DEFINITION);
    checkState(locations.length > 0, "Directive %s has no locations", name);
    return Node.builder(Token.DIRECTIVE_DEFINITION)
        .setName(checkNotNull(name))
        .setChildren(Slot.ARGUMENTS, arguments)
        .setRepeatable(repeatable)
        .setLocations(ImmutableList.copyOf(locations))
        .build();
  }

  private static Node typeWithFields(
      Token token, String name, List<String> interfaces, List<Node> fields) {
    checkAll(fields, Token.FIELD_DEFINITION);
    ImmutableList.Builder<Node> interfaceTypes = ImmutableList.builder();
    for (String iface : interfaces) {
      interfaceTypes.add(namedType(iface));
    }
    return Node.builder(token)
        .setName(checkNotNull(name))
        .setChildren(Slot.INTERFACES, interfaceTypes.build())
        .setChildren(Slot.FIELDS, fields)
        .build();
  }

  private static Node unionType(Token token, String name, String... members) {
    ImmutableList.Builder<Node> types = ImmutableList.builder();
    for (String member : members) {
      types.add(namedType(member));
    }
    return Node.builder(token)
        .setName(checkNotNull(name))
        .setChildren(Slot.TYPES, types.build())
        .build();
  }

  private static Node enumType(Token token, String name, String... values) {
    ImmutableList.Builder<Node> valueDefinitions = ImmutableList.builder();
    for (String value : values) {
      valueDefinitions.add(enumValueDefinition(value));
    }
    return Node.builder(token)
        .setName(checkNotNull(name))
        .setChildren(Slot.ENUM_VALUES, valueDefinitions.build())
        .build();
  }

  private static Node inputObjectType(Token token, String name, Node... fields) {
    checkAll(ImmutableList.copyOf(fields), Token.INPUT_VALUE_DEFINITION);
    return Node.builder(token)
        .setName(checkNotNull(name))
        .setChildren(Slot.FIELDS, ImmutableList.copyOf(fields))
        .build();
  }

  private static Node named(Token token, String name) {
    return Node.builder(token).setName(checkNotNull(name)).build();
  }

  private static Node literal(Token token, String literal) {
    return Node.builder(token).setLiteral(checkNotNull(literal)).build();
  }

  private static void checkAll(List<Node> nodes, Token token) {
    for (Node n : nodes) {
      checkState(n.getToken() == token, "Expected %s but got %s", token, n.getToken());
    }
  }
}
