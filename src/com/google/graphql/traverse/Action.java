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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import com.google.graphql.ast.Node;
import org.jspecify.nullness.Nullable;

/**
 * What a {@link Visitor} wants the {@link NodeTraversal} to do after a call to {@link
 * Visitor#enter} or {@link Visitor#leave}.
 */
@AutoValue
public abstract class Action {

  /** The kinds of actions. */
  public enum Kind {
    /** Keep going: descend into the node's children when entering. */
    CONTINUE,
    /** Do not descend into the node's children. The node is still left. */
    SKIP_CHILDREN,
    /** Stop the traversal. Edits made so far are kept. */
    BREAK,
    /** Remove the node from its slot. */
    DELETE,
    /** Put {@link #getReplacement()} in the node's slot. */
    REPLACE
  }

  public static final Action CONTINUE = create(Kind.CONTINUE, null);
  public static final Action SKIP_CHILDREN = create(Kind.SKIP_CHILDREN, null);
  public static final Action BREAK = create(Kind.BREAK, null);
  public static final Action DELETE = create(Kind.DELETE, null);

  /**
   * Substitutes {@code replacement} for the current node. A replacement returned from {@link
   * Visitor#enter} is traversed in place of the original node; one returned from {@link
   * Visitor#leave} is not.
   */
  public static Action replace(Node replacement) {
    return create(Kind.REPLACE, checkNotNull(replacement));
  }

  private static Action create(Kind kind, @Nullable Node replacement) {
    return new AutoValue_Action(kind, replacement);
  }

  public abstract Kind getKind();

  /** The replacement node of a {@link Kind#REPLACE} action, null for every other kind. */
  public abstract @Nullable Node getReplacement();

  /** Whether this action changes the tree. */
  public final boolean isEdit() {
    return getKind() == Kind.DELETE || getKind() == Kind.REPLACE;
  }
}
