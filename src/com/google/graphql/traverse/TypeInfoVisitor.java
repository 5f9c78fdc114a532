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

import com.google.graphql.ast.Node;
import org.jspecify.nullness.Nullable;

/**
 * A visitor that keeps a {@link TypeInfo} in step with the traversal and forwards every call to
 * a delegate, which can query the {@link TypeInfo} for the current schema position.
 *
 * <p>The delegate's actions are returned unchanged. When the delegate replaces a node on enter,
 * the {@link TypeInfo} is moved from the old node to the replacement, which is the node that
 * will be traversed and left; when it deletes a node, the node is left at once since the
 * traversal will not leave it.
 *
 * <p>The {@link TypeInfo} is reset when the root of a traversal is entered, so a position left
 * behind by an earlier traversal that failed is never seen, and when the delegate returns {@link
 * Action#BREAK}, since nothing is left after a break.
 */
public final class TypeInfoVisitor implements Visitor {
  private final TypeInfo typeInfo;
  private final Visitor delegate;

  public TypeInfoVisitor(TypeInfo typeInfo, Visitor delegate) {
    this.typeInfo = checkNotNull(typeInfo);
    this.delegate = checkNotNull(delegate);
  }

  public TypeInfo getTypeInfo() {
    return typeInfo;
  }

  @Override
  public Action enter(NodeTraversal t, Node n, @Nullable Node parent) {
    if (parent == null) {
      typeInfo.reset();
    }
    typeInfo.enter(n);
    Action action = delegate.enter(t, n, parent);
    switch (action.getKind()) {
      case BREAK:
        typeInfo.reset();
        break;
      case REPLACE:
        typeInfo.leave(n);
        typeInfo.enter(checkNotNull(action.getReplacement()));
        break;
      case DELETE:
        typeInfo.leave(n);
        break;
      default:
        break;
    }
    return action;
  }

  @Override
  public Action leave(NodeTraversal t, Node n, @Nullable Node parent) {
    Action action = delegate.leave(t, n, parent);
    if (action.getKind() == Action.Kind.BREAK) {
      typeInfo.reset();
    } else {
      typeInfo.leave(n);
    }
    return action;
  }
}
