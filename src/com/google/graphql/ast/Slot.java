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

import com.google.common.base.CaseFormat;

/**
 * A named position in a {@link Node} that holds visitable children. A single slot holds at most
 * one child; a sequence slot holds an ordered list of children.
 *
 * <p>The slots a node has, and the order they are visited in, are declared by its {@link Token}.
 */
public enum Slot {
  DEFINITIONS(true),
  VARIABLE(false),
  VARIABLE_DEFINITIONS(true),
  TYPE_CONDITION(false),
  ARGUMENTS(true),
  TYPE(false),
  DEFAULT_VALUE(false),
  VALUE(false),
  DIRECTIVES(true),
  SELECTION_SET(false),
  SELECTIONS(true),
  VALUES(true), // list value items
  FIELDS(true), // object value fields, object/interface/input object field definitions
  OPERATION_TYPES(true),
  INTERFACES(true),
  TYPES(true), // union members
  ENUM_VALUES(true);

  private final boolean sequence;
  private final String key;

  Slot(boolean sequence) {
    this.sequence = sequence;
    this.key = CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name());
  }

  /** Whether this slot holds an ordered list of children rather than a single optional child. */
  public boolean isSequence() {
    return sequence;
  }

  /** The name of this slot as it appears in traversal paths, e.g. {@code selectionSet}. */
  public String getKey() {
    return key;
  }
}
