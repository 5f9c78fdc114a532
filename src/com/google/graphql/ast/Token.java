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

import static com.google.graphql.ast.Slot.ARGUMENTS;
import static com.google.graphql.ast.Slot.DEFAULT_VALUE;
import static com.google.graphql.ast.Slot.DEFINITIONS;
import static com.google.graphql.ast.Slot.DIRECTIVES;
import static com.google.graphql.ast.Slot.ENUM_VALUES;
import static com.google.graphql.ast.Slot.FIELDS;
import static com.google.graphql.ast.Slot.INTERFACES;
import static com.google.graphql.ast.Slot.OPERATION_TYPES;
import static com.google.graphql.ast.Slot.SELECTIONS;
import static com.google.graphql.ast.Slot.TYPE;
import static com.google.graphql.ast.Slot.TYPES;
import static com.google.graphql.ast.Slot.TYPE_CONDITION;
import static com.google.graphql.ast.Slot.VALUE;
import static com.google.graphql.ast.Slot.VALUES;
import static com.google.graphql.ast.Slot.VARIABLE_DEFINITIONS;

import com.google.common.collect.ImmutableList;

/**
 * The kinds of {@link Node}s in a GraphQL document, one per grammar production.
 *
 * <p>Each token declares the child slots of its nodes in traversal order.
 */
public enum Token {
  DOCUMENT(DEFINITIONS),
  // VARIABLE and SELECTION_SET name tokens too, so their slots are qualified.
  OPERATION_DEFINITION(VARIABLE_DEFINITIONS, DIRECTIVES, Slot.SELECTION_SET),
  VARIABLE_DEFINITION(Slot.VARIABLE, TYPE, DEFAULT_VALUE, DIRECTIVES),
  VARIABLE,
  SELECTION_SET(SELECTIONS),
  FIELD(ARGUMENTS, DIRECTIVES, Slot.SELECTION_SET),
  ARGUMENT(VALUE),
  FRAGMENT_SPREAD(DIRECTIVES),
  INLINE_FRAGMENT(TYPE_CONDITION, DIRECTIVES, Slot.SELECTION_SET),
  FRAGMENT_DEFINITION(VARIABLE_DEFINITIONS, TYPE_CONDITION, DIRECTIVES, Slot.SELECTION_SET),

  // Values
  INT_VALUE,
  FLOAT_VALUE,
  STRING_VALUE,
  BOOLEAN_VALUE,
  NULL_VALUE,
  ENUM_VALUE,
  LIST_VALUE(VALUES),
  OBJECT_VALUE(FIELDS),
  OBJECT_FIELD(VALUE),

  DIRECTIVE(ARGUMENTS),

  // Type references
  NAMED_TYPE,
  LIST_TYPE(TYPE),
  NON_NULL_TYPE(TYPE),

  // Type system definitions
  SCHEMA_DEFINITION(DIRECTIVES, OPERATION_TYPES),
  OPERATION_TYPE_DEFINITION(TYPE),
  SCALAR_TYPE_DEFINITION(DIRECTIVES),
  OBJECT_TYPE_DEFINITION(INTERFACES, DIRECTIVES, FIELDS),
  FIELD_DEFINITION(ARGUMENTS, TYPE, DIRECTIVES),
  INPUT_VALUE_DEFINITION(TYPE, DEFAULT_VALUE, DIRECTIVES),
  INTERFACE_TYPE_DEFINITION(INTERFACES, DIRECTIVES, FIELDS),
  UNION_TYPE_DEFINITION(DIRECTIVES, TYPES),
  ENUM_TYPE_DEFINITION(DIRECTIVES, ENUM_VALUES),
  ENUM_VALUE_DEFINITION(DIRECTIVES),
  INPUT_OBJECT_TYPE_DEFINITION(DIRECTIVES, FIELDS),
  DIRECTIVE_DEFINITION(ARGUMENTS),

  // Type system extensions
  SCHEMA_EXTENSION(DIRECTIVES, OPERATION_TYPES),
  SCALAR_TYPE_EXTENSION(DIRECTIVES),
  OBJECT_TYPE_EXTENSION(INTERFACES, DIRECTIVES, FIELDS),
  INTERFACE_TYPE_EXTENSION(INTERFACES, DIRECTIVES, FIELDS),
  UNION_TYPE_EXTENSION(DIRECTIVES, TYPES),
  ENUM_TYPE_EXTENSION(DIRECTIVES, ENUM_VALUES),
  INPUT_OBJECT_TYPE_EXTENSION(DIRECTIVES, FIELDS);

  private final ImmutableList<Slot> slots;

  Token(Slot... slots) {
    this.slots = ImmutableList.copyOf(slots);
  }

  /** Returns the child slots of nodes of this kind, in the order they are traversed. */
  public ImmutableList<Slot> getSlots() {
    return slots;
  }

  /** Returns the position of {@code slot} in {@link #getSlots()}, or -1. */
  int indexOf(Slot slot) {
    return slots.indexOf(slot);
  }
}
