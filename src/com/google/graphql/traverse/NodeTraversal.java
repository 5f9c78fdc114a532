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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.graphql.ast.Node;
import com.google.graphql.ast.Slot;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.nullness.Nullable;

/**
 * NodeTraversal walks a GraphQL syntax tree depth first, calling a {@link Visitor} before
 * (enter) and after (leave) the children of each node, and returns a new tree with the edits the
 * visitor asked for.
 *
 * <p>The input tree is never modified. Subtrees without edits are shared between the input and
 * the result, so a traversal without edits returns the root it was given.
 *
 * <p>The walk keeps its own stack of frames rather than recursing, one frame per level of the
 * tree. Each frame holds the children of its node as they were when the node was entered, a
 * cursor into them and the edits made to them so far. Edits are keyed by the child's position in
 * that snapshot and applied in one pass when the node is left, so deleting one child never
 * shifts the position of another.
 */
public class NodeTraversal {
  private static final Logger logger = Logger.getLogger(NodeTraversal.class.getName());

  private final Visitor visitor;

  /** Frames of the nodes being traversed. The first one is a synthetic frame for the root. */
  private final ArrayList<Frame> frames = new ArrayList<>();

  /** Contains the node passed to the visitor call in progress. */
  private @Nullable Node currentNode;

  /** The position of {@link #currentNode} in its parent. */
  private @Nullable Entry currentEntry;

  private boolean broken;

  public static Builder builder() {
    return new Builder();
  }

  /** Builder */
  public static final class Builder {
    private final List<Visitor> visitors = new ArrayList<>();

    private Builder() {}

    /** Sets the visitor driven by the traversal, replacing any visitors set before. */
    @CanIgnoreReturnValue
    public Builder setVisitor(Visitor x) {
      visitors.clear();
      visitors.add(checkNotNull(x));
      return this;
    }

    /**
     * Sets several visitors to be run in a single pass. See {@link CombinedVisitor} for how their
     * actions are merged.
     */
    @CanIgnoreReturnValue
    public Builder setVisitors(List<? extends Visitor> x) {
      visitors.clear();
      for (Visitor v : x) {
        visitors.add(checkNotNull(v));
      }
      return this;
    }

    public NodeTraversal build() {
      checkState(!visitors.isEmpty(), "No visitor set");
      return new NodeTraversal(
          visitors.size() == 1 ? visitors.get(0) : new CombinedVisitor(visitors));
    }

    /** Builds a traversal and runs it over {@code root}. */
    public @Nullable Node traverse(Node root) {
      return build().traverse(root);
    }
  }

  private NodeTraversal(Visitor visitor) {
    this.visitor = visitor;
  }

  /** Traverses {@code root} with {@code visitor} and returns the edited tree. */
  public static @Nullable Node traverse(Node root, Visitor visitor) {
    return NodeTraversal.builder().setVisitor(visitor).traverse(root);
  }

  /**
   * Traverses a tree iteratively and returns it with the visitor's edits applied.
   *
   * @return the edited tree, the root itself if nothing was edited, or null if the visitor deleted
   *     the root
   * @throws TraversalException if the visitor throws
   */
  public @Nullable Node traverse(Node root) {
    checkNotNull(root);
    checkState(frames.isEmpty(), "Traversal already in progress");
    try {
      return traverseFrames(root);
    } catch (TraversalException e) {
      throw e;
    } catch (Error | RuntimeException unexpectedException) {
      throw unexpected(unexpectedException);
    } finally {
      frames.clear();
      currentNode = null;
      currentEntry = null;
      broken = false;
    }
  }

  private @Nullable Node traverseFrames(Node root) {
    Frame rootFrame = Frame.forRoot(root);
    frames.add(rootFrame);
    while (true) {
      Frame frame = frames.get(frames.size() - 1);
      if (!broken && frame.hasNext()) {
        enterChild(frame, frame.cursor++);
        continue;
      }

      frames.remove(frames.size() - 1);
      if (frame == rootFrame) {
        return frame.resultAt(0);
      }
      Node rebuilt = frame.rebuild();
      Frame parentFrame = frames.get(frames.size() - 1);
      if (broken) {
        parentFrame.recordResult(frame.position, rebuilt);
      } else {
        leaveChild(parentFrame, frame.position, frame.entry, rebuilt);
      }
    }
  }

  private void enterChild(Frame frame, int position) {
    Entry entry = frame.snapshot.get(position);
    Node n = entry.node;
    Action action = call(entry, n, /* enter= */ true);
    switch (action.getKind()) {
      case CONTINUE:
        frames.add(new Frame(entry, position, n));
        break;
      case SKIP_CHILDREN:
        leaveChild(frame, position, entry, n);
        break;
      case BREAK:
        stop(n);
        break;
      case DELETE:
        frame.recordResult(position, null);
        break;
      case REPLACE:
        Node replacement = checkNotNull(action.getReplacement());
        frame.recordResult(position, replacement);
        frames.add(new Frame(entry, position, replacement));
        break;
    }
  }

  private void leaveChild(Frame frame, int position, Entry entry, Node n) {
    Action action = call(entry, n, /* enter= */ false);
    switch (action.getKind()) {
      case CONTINUE:
      case SKIP_CHILDREN:
        frame.recordResult(position, n);
        break;
      case BREAK:
        frame.recordResult(position, n);
        stop(n);
        break;
      case DELETE:
        frame.recordResult(position, null);
        break;
      case REPLACE:
        frame.recordResult(position, checkNotNull(action.getReplacement()));
        break;
    }
  }

  private Action call(Entry entry, Node n, boolean enter) {
    currentEntry = entry;
    currentNode = n;
    Node parent = getParent();
    Action action = enter ? visitor.enter(this, n, parent) : visitor.leave(this, n, parent);
    checkNotNull(action, "Visitor returned null for %s", n);
    currentNode = null;
    currentEntry = null;
    return action;
  }

  private void stop(Node n) {
    broken = true;
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Traversal stopped at " + n + " " + getPathFrom(null));
    }
  }

  private TraversalException unexpected(Throwable unexpectedException) {
    // Try to say which node the visitor failed on.
    ImmutableList<Object> path = getPathFrom(currentEntry);
    String message =
        unexpectedException.getMessage()
            + "\n"
            + formatNodeContext("Node", currentNode)
            + formatNodeContext("Parent", currentNode == null ? null : getParent())
            + "  Path: "
            + path;
    return new TraversalException(message, unexpectedException, path);
  }

  private static String formatNodeContext(String label, @Nullable Node n) {
    if (n == null) {
      return "  " + label + ": NULL\n";
    }
    return "  " + label + ": " + n + "\n";
  }

  /** Returns the node passed to the visitor call in progress, or null between calls. */
  public @Nullable Node getCurrentNode() {
    return currentNode;
  }

  /**
   * Returns the parent of the current node, with enter-time replacements applied, or null at the
   * root.
   */
  public @Nullable Node getParent() {
    return frames.isEmpty() ? null : frames.get(frames.size() - 1).node;
  }

  /** Returns the ancestors of the current node, outermost first. */
  public ImmutableList<Node> getAncestors() {
    ImmutableList.Builder<Node> ancestors = ImmutableList.builder();
    for (int i = 1; i < frames.size(); i++) {
      ancestors.add(checkNotNull(frames.get(i).node));
    }
    return ancestors.build();
  }

  /** Returns the number of ancestors of the current node. The root is at depth 0. */
  public int getDepth() {
    return Math.max(0, frames.size() - 1);
  }

  /**
   * Returns the path from the root to the current node: the key of each slot passed through,
   * followed by the index of the child for sequence slots. For example {@code [definitions, 0,
   * selectionSet, selections, 2]}.
   */
  public ImmutableList<Object> getPath() {
    return getPathFrom(currentEntry);
  }

  private ImmutableList<Object> getPathFrom(@Nullable Entry last) {
    ImmutableList.Builder<Object> path = ImmutableList.builder();
    for (int i = 1; i < frames.size(); i++) {
      frames.get(i).entry.appendTo(path);
    }
    if (last != null) {
      last.appendTo(path);
    }
    return path.build();
  }

  /** A child of a node, remembering where in the node it came from. */
  private static final class Entry {
    /** Null for the root. */
    final @Nullable Slot slot;

    /** The index within a sequence slot, -1 for single slots. */
    final int index;

    final Node node;

    Entry(@Nullable Slot slot, int index, Node node) {
      this.slot = slot;
      this.index = index;
      this.node = node;
    }

    void appendTo(ImmutableList.Builder<Object> path) {
      if (slot != null) {
        path.add(slot.getKey());
        if (index >= 0) {
          path.add(index);
        }
      }
    }
  }

  /** Traversal state for one level of the tree. */
  private static final class Frame {
    /** The position of {@link #node} in its parent; null for the root frame. */
    final @Nullable Entry entry;

    /** The index of {@link #entry} in the parent frame's snapshot. */
    final int position;

    /** The node whose children are traversed, null for the root frame. */
    final @Nullable Node node;

    /** The children of {@link #node} when it was entered. Never changes. */
    final ImmutableList<Entry> snapshot;

    int cursor;

    /** Edited children by snapshot position. Allocated on the first edit. */
    private @Nullable Node[] edits;

    private @Nullable BitSet deletions;

    private Frame(
        @Nullable Entry entry, int position, @Nullable Node node, ImmutableList<Entry> snapshot) {
      this.entry = entry;
      this.position = position;
      this.node = node;
      this.snapshot = snapshot;
    }

    Frame(Entry entry, int position, Node node) {
      this(entry, position, node, snapshotOf(node));
    }

    static Frame forRoot(Node root) {
      return new Frame(null, -1, null, ImmutableList.of(new Entry(null, -1, root)));
    }

    private static ImmutableList<Entry> snapshotOf(Node n) {
      ImmutableList.Builder<Entry> entries = ImmutableList.builder();
      for (Slot slot : n.getToken().getSlots()) {
        if (slot.isSequence()) {
          ImmutableList<Node> children = n.getChildren(slot);
          for (int i = 0; i < children.size(); i++) {
            entries.add(new Entry(slot, i, children.get(i)));
          }
        } else {
          Node child = n.getChild(slot);
          if (child != null) {
            entries.add(new Entry(slot, -1, child));
          }
        }
      }
      return entries.build();
    }

    boolean hasNext() {
      return cursor < snapshot.size();
    }

    /** Records what the child at {@code position} became; null if it was deleted. */
    void recordResult(int position, @Nullable Node result) {
      if (result == null) {
        if (deletions == null) {
          deletions = new BitSet(snapshot.size());
        }
        deletions.set(position);
        return;
      }
      if (deletions != null) {
        deletions.clear(position);
      }
      if (result == snapshot.get(position).node) {
        if (edits != null) {
          edits[position] = null;
        }
        return;
      }
      if (edits == null) {
        edits = new Node[snapshot.size()];
      }
      edits[position] = result;
    }

    @Nullable Node resultAt(int position) {
      if (deletions != null && deletions.get(position)) {
        return null;
      }
      if (edits != null && edits[position] != null) {
        return edits[position];
      }
      return snapshot.get(position).node;
    }

    private boolean isEdited() {
      if (deletions != null && !deletions.isEmpty()) {
        return true;
      }
      if (edits != null) {
        for (Node edit : edits) {
          if (edit != null) {
            return true;
          }
        }
      }
      return false;
    }

    /** Returns {@link #node} with the recorded edits applied to its children. */
    Node rebuild() {
      Node n = checkNotNull(node);
      if (!isEdited()) {
        return n;
      }
      Node.Builder builder = n.toBuilder();
      int i = 0;
      while (i < snapshot.size()) {
        Slot slot = checkNotNull(snapshot.get(i).slot);
        if (slot.isSequence()) {
          ImmutableList.Builder<Node> children = ImmutableList.builder();
          for (; i < snapshot.size() && snapshot.get(i).slot == slot; i++) {
            Node child = resultAt(i);
            if (child != null) {
              children.add(child);
            }
          }
          builder.setChildren(slot, children.build());
        } else {
          builder.setChild(slot, resultAt(i));
          i++;
        }
      }
      return builder.build();
    }
  }
}
