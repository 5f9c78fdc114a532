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

import com.google.common.collect.ImmutableList;

/**
 * Thrown when a {@link Visitor} fails during a {@link NodeTraversal}. Visitors may throw it
 * directly to abort a traversal; any other exception thrown by a visitor is wrapped in one.
 */
public class TraversalException extends RuntimeException {

  private final ImmutableList<Object> path;

  public TraversalException(String message) {
    super(message);
    this.path = ImmutableList.of();
  }

  TraversalException(String message, Throwable cause, ImmutableList<Object> path) {
    super(message, cause);
    this.path = path;
  }

  /**
   * The path from the root to the node being visited when the error occurred, as returned by
   * {@link NodeTraversal#getPath()}. Empty when thrown by a visitor directly.
   */
  public ImmutableList<Object> getPath() {
    return path;
  }
}
