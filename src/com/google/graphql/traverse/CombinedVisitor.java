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
import com.google.graphql.ast.Node;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.nullness.Nullable;

/**
 * A visitor combining multiple {@link Visitor}s, so that logically separate passes share one
 * traversal.
 *
 * <p>Each visitor behaves as if it were the only client of the traversal:
 *
 * <ul>
 *   <li>a visitor that returns {@link Action#SKIP_CHILDREN} for a node receives no calls for that
 *       node's descendants, and is called again when the node is left. The children are only
 *       traversed while some visitor still wants them;
 *   <li>a visitor that returns {@link Action#BREAK} is never called again. The traversal itself
 *       only stops once every visitor has stopped.
 * </ul>
 *
 * <p>The first visitor to return an edit ({@link Action#DELETE} or {@link Action#replace}) for a
 * node wins, and the edit is returned to the traversal. The other visitors are told about it so
 * that each still sees balanced enter and leave calls: on enter, visitors that already entered a
 * deleted or replaced node leave it, and every other visitor enters the replacement, which is
 * then traversed and left in place of the node. On leave, every visitor is still called. Edits
 * returned by the visitors that lose are ignored.
 */
public final class CombinedVisitor implements Visitor {
  private static final Logger logger = Logger.getLogger(CombinedVisitor.class.getName());

  /** The visitors that this visitor combines. */
  private final VisitorWrapper[] visitors;

  public CombinedVisitor(List<? extends Visitor> visitors) {
    checkArgument(!visitors.isEmpty(), "No visitors to combine");
    this.visitors = new VisitorWrapper[visitors.size()];
    for (int i = 0; i < visitors.size(); i++) {
      this.visitors[i] = new VisitorWrapper(visitors.get(i));
    }
  }

  public static CombinedVisitor of(Visitor... visitors) {
    return new CombinedVisitor(ImmutableList.copyOf(visitors));
  }

  /**
   * Maintains information about a visitor in order to simulate it being the exclusive client of
   * the shared {@link NodeTraversal}.
   */
  private static final class VisitorWrapper {
    /** The visitor being wrapped. Never null. */
    private final Visitor visitor;

    /**
     * The depth of the node the visitor skipped the children of, or -1. The wrapped visitor
     * doesn't receive calls until the traversal is back at this depth.
     */
    private int waitingDepth = -1;

    private boolean broken;

    /** The node most recently passed to {@link Visitor#enter}. */
    private @Nullable Node lastEntered;

    private VisitorWrapper(Visitor visitor) {
      this.visitor = visitor;
    }

    @Nullable Action enterIfActive(NodeTraversal t, Node n, @Nullable Node parent) {
      if (waitingDepth >= 0 && t.getDepth() <= waitingDepth) {
        // The skipped node was deleted or replaced by another visitor, so it is never left.
        waitingDepth = -1;
      }
      lastEntered = null;
      if (!isActive()) {
        return null;
      }
      lastEntered = n;
      Action action = visitor.enter(t, n, parent);
      switch (action.getKind()) {
        case SKIP_CHILDREN:
          waitingDepth = t.getDepth();
          break;
        case BREAK:
          broken = true;
          break;
        default:
          break;
      }
      return action.isEdit() ? action : null;
    }

    @Nullable Action leaveIfActive(NodeTraversal t, Node n, @Nullable Node parent) {
      if (waitingDepth >= 0) {
        if (t.getDepth() > waitingDepth) {
          return null;
        }
        // Back at the skipped node, which is left like any other, or above it.
        waitingDepth = -1;
      }
      if (!isActive()) {
        return null;
      }
      Action action = visitor.leave(t, n, parent);
      if (action.getKind() == Action.Kind.BREAK) {
        broken = true;
      }
      return action.isEdit() ? action : null;
    }

    boolean isActive() {
      return waitingDepth < 0 && !broken;
    }
  }

  @Override
  public Action enter(NodeTraversal t, Node n, @Nullable Node parent) {
    for (int i = 0; i < visitors.length; i++) {
      Action edit = visitors[i].enterIfActive(t, n, parent);
      if (edit != null) {
        redirect(t, n, parent, edit, i);
        return edit;
      }
    }
    if (allBroken()) {
      return Action.BREAK;
    }
    return anyActive() ? Action.CONTINUE : Action.SKIP_CHILDREN;
  }

  /**
   * Moves the visitors other than {@code editor} off {@code n}, which the traversal will not
   * leave, and onto its replacement if there is one.
   */
  private void redirect(
      NodeTraversal t, Node n, @Nullable Node parent, Action edit, int editor) {
    Node replacement = edit.getReplacement();
    for (int i = 0; i < visitors.length; i++) {
      if (i == editor) {
        continue;
      }
      VisitorWrapper visitor = visitors[i];
      if (i < editor && visitor.lastEntered == n) {
        ignore(visitor.leaveIfActive(t, n, parent), n);
      }
      if (replacement != null) {
        ignore(visitor.enterIfActive(t, replacement, parent), replacement);
      }
    }
  }

  @Override
  public Action leave(NodeTraversal t, Node n, @Nullable Node parent) {
    Action result = null;
    for (VisitorWrapper visitor : visitors) {
      Action edit = visitor.leaveIfActive(t, n, parent);
      if (result == null) {
        result = edit;
      } else {
        ignore(edit, n);
      }
    }
    if (result != null) {
      return result;
    }
    return allBroken() ? Action.BREAK : Action.CONTINUE;
  }

  private static void ignore(@Nullable Action edit, Node n) {
    if (edit != null) {
      logger.warning("Ignoring " + edit.getKind() + " of " + n + ", another visitor edited it");
    }
  }

  private boolean allBroken() {
    for (VisitorWrapper visitor : visitors) {
      if (!visitor.broken) {
        return false;
      }
    }
    return true;
  }

  private boolean anyActive() {
    for (VisitorWrapper visitor : visitors) {
      if (visitor.isActive()) {
        return true;
      }
    }
    return false;
  }
}
