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

/** The kind of an operation definition, or the operation an {@code schema} entry is bound to. */
public enum OperationType {
  QUERY("query", "Query"),
  MUTATION("mutation", "Mutation"),
  SUBSCRIPTION("subscription", "Subscription");

  private final String keyword;
  private final String defaultTypeName;

  OperationType(String keyword, String defaultTypeName) {
    this.keyword = keyword;
    this.defaultTypeName = defaultTypeName;
  }

  /** The keyword introducing the operation, e.g. {@code query}. */
  public String getKeyword() {
    return keyword;
  }

  /**
   * The name of the root type used for this operation when the schema has no explicit
   * {@code schema} definition.
   */
  public String getDefaultTypeName() {
    return defaultTypeName;
  }
}
