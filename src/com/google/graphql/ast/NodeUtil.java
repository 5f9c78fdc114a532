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

import static com.google.common.base.Preconditions.checkArgument;

import org.jspecify.nullness.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  /** Whether {@code n} may appear in a selection set. */
  public static boolean isSelection(Node n) {
    switch (n.getToken()) {
      case FIELD:
      case FRAGMENT_SPREAD:
      case INLINE_FRAGMENT:
        return true;
      default:
        return false;
    }
  }

  /** Whether {@code n} may appear where a value is expected. Variables are values. */
  public static boolean isValue(Node n) {
    switch (n.getToken()) {
      case VARIABLE:
      case INT_VALUE:
      case FLOAT_VALUE:
      case STRING_VALUE:
      case BOOLEAN_VALUE:
      case NULL_VALUE:
      case ENUM_VALUE:
      case LIST_VALUE:
      case OBJECT_VALUE:
        return true;
      default:
        return false;
    }
  }

  /** Whether {@code n} is a named, list or non-null type reference. */
  public static boolean isTypeReference(Node n) {
    switch (n.getToken()) {
      case NAMED_TYPE:
      case LIST_TYPE:
      case NON_NULL_TYPE:
        return true;
      default:
        return false;
    }
  }

  /** Whether {@code n} defines a named type in a schema document. */
  public static boolean isTypeDefinition(Node n) {
    switch (n.getToken()) {
      case SCALAR_TYPE_DEFINITION:
      case OBJECT_TYPE_DEFINITION:
      case INTERFACE_TYPE_DEFINITION:
      case UNION_TYPE_DEFINITION:
      case ENUM_TYPE_DEFINITION:
      case INPUT_OBJECT_TYPE_DEFINITION:
        return true;
      default:
        return false;
    }
  }

  /** Whether {@code n} extends a named type defined elsewhere in a schema document. */
  public static boolean isTypeExtension(Node n) {
    switch (n.getToken()) {
      case SCALAR_TYPE_EXTENSION:
      case OBJECT_TYPE_EXTENSION:
      case INTERFACE_TYPE_EXTENSION:
      case UNION_TYPE_EXTENSION:
      case ENUM_TYPE_EXTENSION:
      case INPUT_OBJECT_TYPE_EXTENSION:
        return true;
      default:
        return false;
    }
  }

  /** Whether {@code n} may be a top level definition of an executable document. */
  public static boolean isExecutableDefinition(Node n) {
    return n.isOperationDefinition() || n.getToken() == Token.FRAGMENT_DEFINITION;
  }

  /** Whether {@code n} may be a top level definition of a schema document. */
  public static boolean isTypeSystemDefinition(Node n) {
    switch (n.getToken()) {
      case SCHEMA_DEFINITION:
      case SCHEMA_EXTENSION:
      case DIRECTIVE_DEFINITION:
        return true;
      default:
        return isTypeDefinition(n) || isTypeExtension(n);
    }
  }

  /** Returns the token of the definition extended by a type extension. */
  public static Token getExtendedToken(Node extension) {
    switch (extension.getToken()) {
      case SCALAR_TYPE_EXTENSION:
        return Token.SCALAR_TYPE_DEFINITION;
      case OBJECT_TYPE_EXTENSION:
        return Token.OBJECT_TYPE_DEFINITION;
      case INTERFACE_TYPE_EXTENSION:
        return Token.INTERFACE_TYPE_DEFINITION;
      case UNION_TYPE_EXTENSION:
        return Token.UNION_TYPE_DEFINITION;
      case ENUM_TYPE_EXTENSION:
        return Token.ENUM_TYPE_DEFINITION;
      case INPUT_OBJECT_TYPE_EXTENSION:
        return Token.INPUT_OBJECT_TYPE_DEFINITION;
      default:
        throw new IllegalArgumentException("Not a type extension: " + extension);
    }
  }

  /** Returns the innermost {@link Token#NAMED_TYPE} of a type reference. */
  public static @Nullable Node getNamedType(@Nullable Node type) {
    Node current = type;
    while (current != null && !current.isNamedType()) {
      checkArgument(isTypeReference(current), "Not a type reference: %s", current);
      current = current.getType();
    }
    return current;
  }

  /** Strips a single non-null wrapper from {@code type}, if present. */
  public static @Nullable Node getNullableType(@Nullable Node type) {
    return type != null && type.isNonNullType() ? type.getType() : type;
  }

  /**
   * Removes one list or non-null wrapper from {@code type}. Returns null for named types, which
   * have nothing left to unwrap.
   */
  public static @Nullable Node unwrapType(@Nullable Node type) {
    if (type == null || type.isNamedType()) {
      return null;
    }
    return type.getType();
  }

  /** Returns the GraphQL spelling of a type reference, e.g. {@code [Pet!]!}. */
  public static String typeToString(Node type) {
    StringBuilder prefix = new StringBuilder();
    StringBuilder suffix = new StringBuilder();
    Node current = type;
    while (!current.isNamedType()) {
      if (current.isListType()) {
        prefix.append('[');
        suffix.insert(0, ']');
      } else {
        checkArgument(current.isNonNullType(), "Not a type reference: %s", current);
        suffix.insert(0, '!');
      }
      current = current.getType();
      checkArgument(current != null, "Incomplete type reference: %s", type);
    }
    return prefix + current.getName() + suffix;
  }

  /** Returns the argument or input field named {@code name} in the given list, or null. */
  public static @Nullable Node findByName(Iterable<Node> nodes, String name) {
    for (Node n : nodes) {
      if (name.equals(n.getName())) {
        return n;
      }
    }
    return null;
  }
}
