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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.jspecify.nullness.Nullable;

/**
 * A node in a GraphQL abstract syntax tree.
 *
 * <p>Nodes are immutable. A node owns its scalar leaf data (name, alias, description, literal
 * value, operation kind, directive locations) directly and holds one value per {@link Slot} its
 * {@link Token} declares: a single optional child, or an ordered list of children. Leaf data is
 * never visited by a traversal; only children are.
 *
 * <p>Edits produce new nodes through {@link #withChild}, {@link #withChildren} or {@link
 * #toBuilder}; unchanged children are shared between the old and the new node.
 */
public final class Node {

  private static final int INDENT = 4;

  private final Token token;
  private final @Nullable String name;
  private final @Nullable String alias;
  private final @Nullable String description;
  private final @Nullable String literal;
  private final @Nullable OperationType operation;
  private final ImmutableList<String> locations;
  private final boolean repeatable;

  /**
   * One entry per slot of {@link #token}, in slot order. A single slot holds a Node or null, a
   * sequence slot an ImmutableList of Nodes.
   */
  private final Object[] slotValues;

  private final int hash;

  private Node(Builder builder) {
    this.token = builder.token;
    this.name = builder.name;
    this.alias = builder.alias;
    this.description = builder.description;
    this.literal = builder.literal;
    this.operation = builder.operation;
    this.locations = builder.locations;
    this.repeatable = builder.repeatable;
    this.slotValues = builder.slotValues.clone();
    // Children are built first, so their hashes are already known.
    this.hash =
        Objects.hash(token, name, alias, description, literal, operation, locations, repeatable)
                * 31
            + Arrays.hashCode(slotValues);
  }

  public static Builder builder(Token token) {
    return new Builder(token);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public Token getToken() {
    return token;
  }

  /** The name of this node, e.g. a field, argument, type or fragment name. */
  public @Nullable String getName() {
    return name;
  }

  /** The response key alias of a {@link Token#FIELD}. */
  public @Nullable String getAlias() {
    return alias;
  }

  /** The description of a type system definition. */
  public @Nullable String getDescription() {
    return description;
  }

  /**
   * The literal text of a scalar value node: digits of an int or float, the contents of a string,
   * the name of an enum value, or {@code true}/{@code false}.
   */
  public @Nullable String getLiteral() {
    return literal;
  }

  public boolean getBoolean() {
    checkState(token == Token.BOOLEAN_VALUE, "Not a boolean value: %s", this);
    return Boolean.parseBoolean(literal);
  }

  /** The kind of an operation definition or of an operation type definition. */
  public @Nullable OperationType getOperation() {
    return operation;
  }

  /** The locations a {@link Token#DIRECTIVE_DEFINITION} is allowed on. */
  public ImmutableList<String> getLocations() {
    return locations;
  }

  public boolean isRepeatable() {
    return repeatable;
  }

  /** Returns the child held by a single slot, or null if the slot is empty. */
  public @Nullable Node getChild(Slot slot) {
    checkArgument(!slot.isSequence(), "%s is a sequence slot", slot);
    int index = token.indexOf(slot);
    return index < 0 ? null : (Node) slotValues[index];
  }

  /** Returns the children held by a sequence slot; empty if this node has no such slot. */
  @SuppressWarnings("unchecked") // sequence slots always hold an ImmutableList<Node>
  public ImmutableList<Node> getChildren(Slot slot) {
    checkArgument(slot.isSequence(), "%s is not a sequence slot", slot);
    int index = token.indexOf(slot);
    return index < 0 ? ImmutableList.of() : (ImmutableList<Node>) slotValues[index];
  }

  /** Returns all children of this node in traversal order. */
  public ImmutableList<Node> children() {
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    for (Slot slot : token.getSlots()) {
      if (slot.isSequence()) {
        children.addAll(getChildren(slot));
      } else {
        Node child = getChild(slot);
        if (child != null) {
          children.add(child);
        }
      }
    }
    return children.build();
  }

  public boolean hasChildren() {
    for (Slot slot : token.getSlots()) {
      if (slot.isSequence() ? !getChildren(slot).isEmpty() : getChild(slot) != null) {
        return true;
      }
    }
    return false;
  }

  /** Returns a copy of this node with {@code child} in the single slot {@code slot}. */
  @CheckReturnValue
  public Node withChild(Slot slot, @Nullable Node child) {
    return toBuilder().setChild(slot, child).build();
  }

  /** Returns a copy of this node with {@code children} in the sequence slot {@code slot}. */
  @CheckReturnValue
  public Node withChildren(Slot slot, List<Node> children) {
    return toBuilder().setChildren(slot, children).build();
  }

  public @Nullable Node getSelectionSet() {
    return getChild(Slot.SELECTION_SET);
  }

  public ImmutableList<Node> getSelections() {
    return getChildren(Slot.SELECTIONS);
  }

  public ImmutableList<Node> getArguments() {
    return getChildren(Slot.ARGUMENTS);
  }

  public ImmutableList<Node> getDirectives() {
    return getChildren(Slot.DIRECTIVES);
  }

  public ImmutableList<Node> getDefinitions() {
    return getChildren(Slot.DEFINITIONS);
  }

  public ImmutableList<Node> getFields() {
    return getChildren(Slot.FIELDS);
  }

  /** The type reference of a variable, field, input value or list/non-null wrapper. */
  public @Nullable Node getType() {
    return getChild(Slot.TYPE);
  }

  public @Nullable Node getTypeCondition() {
    return getChild(Slot.TYPE_CONDITION);
  }

  public @Nullable Node getDefaultValue() {
    return getChild(Slot.DEFAULT_VALUE);
  }

  public boolean isDocument() {
    return token == Token.DOCUMENT;
  }

  public boolean isOperationDefinition() {
    return token == Token.OPERATION_DEFINITION;
  }

  public boolean isSelectionSet() {
    return token == Token.SELECTION_SET;
  }

  public boolean isField() {
    return token == Token.FIELD;
  }

  public boolean isArgument() {
    return token == Token.ARGUMENT;
  }

  public boolean isDirective() {
    return token == Token.DIRECTIVE;
  }

  public boolean isNamedType() {
    return token == Token.NAMED_TYPE;
  }

  public boolean isListType() {
    return token == Token.LIST_TYPE;
  }

  public boolean isNonNullType() {
    return token == Token.NON_NULL_TYPE;
  }

  /**
   * Whether {@code node} has the same token, leaf data and children as this node. Compares
   * iteratively, so arbitrarily deep trees are fine.
   */
  public boolean isEquivalentTo(@Nullable Node node) {
    if (node == null) {
      return false;
    }
    Deque<Node[]> pending = new ArrayDeque<>();
    pending.push(new Node[] {this, node});
    while (!pending.isEmpty()) {
      Node[] pair = pending.pop();
      Node a = pair[0];
      Node b = pair[1];
      if (a == b) {
        continue;
      }
      if (!a.hasSameLeavesAs(b)) {
        return false;
      }
      for (int i = 0; i < a.slotValues.length; i++) {
        Object x = a.slotValues[i];
        Object y = b.slotValues[i];
        if (x instanceof ImmutableList) {
          List<?> xs = (List<?>) x;
          List<?> ys = (List<?>) y;
          if (xs.size() != ys.size()) {
            return false;
          }
          for (int j = 0; j < xs.size(); j++) {
            pending.push(new Node[] {(Node) xs.get(j), (Node) ys.get(j)});
          }
        } else if (x == null || y == null) {
          if (x != y) {
            return false;
          }
        } else {
          pending.push(new Node[] {(Node) x, (Node) y});
        }
      }
    }
    return true;
  }

  private boolean hasSameLeavesAs(Node other) {
    return hash == other.hash
        && token == other.token
        && Objects.equals(name, other.name)
        && Objects.equals(alias, other.alias)
        && Objects.equals(description, other.description)
        && Objects.equals(literal, other.literal)
        && operation == other.operation
        && locations.equals(other.locations)
        && repeatable == other.repeatable;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o instanceof Node && isEquivalentTo((Node) o);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (operation != null) {
      sb.append(' ').append(operation.getKeyword());
    }
    if (alias != null) {
      sb.append(' ').append(alias).append(':');
    }
    if (name != null) {
      sb.append(' ').append(name);
    }
    if (literal != null) {
      sb.append(' ').append(token == Token.STRING_VALUE ? '"' + literal + '"' : literal);
    }
    if (!locations.isEmpty()) {
      sb.append(" on ").append(String.join(" | ", locations));
    }
    return sb.toString();
  }

  /** Returns an indented, one node per line dump of this subtree. Used for debugging. */
  @CheckReturnValue
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    Deque<Object[]> pending = new ArrayDeque<>();
    pending.push(new Object[] {this, 0});
    while (!pending.isEmpty()) {
      Object[] entry = pending.pop();
      Node n = (Node) entry[0];
      int level = (Integer) entry[1];
      for (int i = 0; i < level * INDENT; i++) {
        sb.append(' ');
      }
      sb.append(n).append('\n');
      ImmutableList<Node> children = n.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        pending.push(new Object[] {children.get(i), level + 1});
      }
    }
    return sb.toString();
  }

  /** Builder for {@link Node}s. Slots not set are empty. */
  public static final class Builder {
    private final Token token;
    private @Nullable String name;
    private @Nullable String alias;
    private @Nullable String description;
    private @Nullable String literal;
    private @Nullable OperationType operation;
    private ImmutableList<String> locations = ImmutableList.of();
    private boolean repeatable;
    private final Object[] slotValues;

    private Builder(Token token) {
      this.token = checkNotNull(token);
      this.slotValues = new Object[token.getSlots().size()];
      for (int i = 0; i < slotValues.length; i++) {
        if (token.getSlots().get(i).isSequence()) {
          slotValues[i] = ImmutableList.of();
        }
      }
    }

    private Builder(Node node) {
      this.token = node.token;
      this.name = node.name;
      this.alias = node.alias;
      this.description = node.description;
      this.literal = node.literal;
      this.operation = node.operation;
      this.locations = node.locations;
      this.repeatable = node.repeatable;
      this.slotValues = node.slotValues.clone();
    }

    @CanIgnoreReturnValue
    public Builder setName(@Nullable String name) {
      this.name = name;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setAlias(@Nullable String alias) {
      this.alias = alias;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setDescription(@Nullable String description) {
      this.description = description;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLiteral(@Nullable String literal) {
      this.literal = literal;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setOperation(@Nullable OperationType operation) {
      this.operation = operation;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLocations(List<String> locations) {
      this.locations = ImmutableList.copyOf(locations);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setRepeatable(boolean repeatable) {
      this.repeatable = repeatable;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setChild(Slot slot, @Nullable Node child) {
      checkArgument(!slot.isSequence(), "%s is a sequence slot", slot);
      slotValues[slotIndex(slot)] = child;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setChildren(Slot slot, List<Node> children) {
      checkArgument(slot.isSequence(), "%s is not a sequence slot", slot);
      slotValues[slotIndex(slot)] = ImmutableList.copyOf(children);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addChild(Slot slot, Node child) {
      checkArgument(slot.isSequence(), "%s is not a sequence slot", slot);
      int index = slotIndex(slot);
      slotValues[index] =
          ImmutableList.<Node>builder()
              .addAll(castChildren(slotValues[index]))
              .add(checkNotNull(child))
              .build();
      return this;
    }

    private int slotIndex(Slot slot) {
      int index = token.indexOf(slot);
      checkArgument(index >= 0, "%s has no %s slot", token, slot);
      return index;
    }

    @SuppressWarnings("unchecked") // see slotValues
    private static ImmutableList<Node> castChildren(Object value) {
      return (ImmutableList<Node>) value;
    }

    public Node build() {
      return new Node(this);
    }
  }
}
