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

import com.google.graphql.ast.Node;
import org.jspecify.nullness.Nullable;

/**
 * Callback for {@link NodeTraversal}s.
 *
 * <p>Both methods default to {@link Action#CONTINUE}, so a visitor only overrides what it needs
 * and switches on {@link Node#getToken()} for the kinds it cares about.
 *
 * <p>Visitors signal a fatal error by throwing. The traversal is abandoned and the error surfaces
 * as a {@link TraversalException}; no partially edited tree is returned.
 */
public interface Visitor {

  /**
   * Visits a node in preorder (before its children).
   *
   * <p>Returning {@link Action#CONTINUE} descends into the children of {@code n}. {@link
   * Action#SKIP_CHILDREN} goes straight to {@link #leave}. {@link Action#DELETE} removes the node,
   * which is then not left. A {@link Action#replace replacement} is descended into instead of
   * {@code n} and left in its place, without being entered.
   *
   * @param t The current traversal.
   * @param n The current node, as it appears in the input tree.
   * @param parent The parent of the current node, or null for the root.
   */
  default Action enter(NodeTraversal t, Node n, @Nullable Node parent) {
    return Action.CONTINUE;
  }

  /**
   * Visits a node in postorder (after its children). {@code n} already reflects the edits made to
   * its children. Returning {@link Action#DELETE} or a {@link Action#replace replacement} edits
   * the node's slot in its parent; a replacement given here is not traversed.
   *
   * @param t The current traversal.
   * @param n The current node, with edits to its children applied.
   * @param parent The parent of the current node, or null for the root.
   */
  default Action leave(NodeTraversal t, Node n, @Nullable Node parent) {
    return Action.CONTINUE;
  }
}
