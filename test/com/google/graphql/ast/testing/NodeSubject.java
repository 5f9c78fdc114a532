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

package com.google.graphql.ast.testing;

import static com.google.common.truth.Fact.fact;
import static com.google.common.truth.Fact.simpleFact;
import static com.google.common.truth.Truth.assertAbout;

import com.google.common.truth.FailureMetadata;
import com.google.common.truth.Subject;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.graphql.ast.Node;
import com.google.graphql.ast.NodeUtil;
import com.google.graphql.ast.Slot;
import com.google.graphql.ast.Token;
import org.jspecify.nullness.Nullable;

/**
 * A Truth Subject for the Node class. Usage:
 *
 * <pre>
 *   import static com.google.graphql.ast.testing.NodeSubject.assertNode;
 *   ...
 *   assertNode(node).isEquivalentTo(other);
 *   assertNode(node).hasToken(Token.FIELD).hasName("name");
 * </pre>
 */
public final class NodeSubject extends Subject {
  private final @Nullable Node actual;

  public static NodeSubject assertNode(@Nullable Node node) {
    return assertAbout(NodeSubject::new).that(node);
  }

  private NodeSubject(FailureMetadata failureMetadata, @Nullable Node node) {
    super(failureMetadata, node);
    this.actual = node;
  }

  /** Compares trees structurally, printing both trees on failure. */
  public void isEquivalentTo(Node other) {
    isNotNull();
    if (!actual.isEquivalentTo(other)) {
      failWithoutActual(
          simpleFact("Node tree inequality"),
          fact("expected", "\n" + other.toStringTree()),
          fact("but was", "\n" + actual.toStringTree()));
    }
  }

  @CanIgnoreReturnValue
  public NodeSubject hasToken(Token token) {
    isNotNull();
    check("getToken()").that(actual.getToken()).isEqualTo(token);
    return this;
  }

  @CanIgnoreReturnValue
  public NodeSubject hasName(String name) {
    isNotNull();
    check("getName()").that(actual.getName()).isEqualTo(name);
    return this;
  }

  /** Asserts that this is a type reference spelled {@code type}, e.g. {@code [Pet]!}. */
  @CanIgnoreReturnValue
  public NodeSubject isType(String type) {
    isNotNull();
    check("typeToString()").that(NodeUtil.typeToString(actual)).isEqualTo(type);
    return this;
  }

  @CanIgnoreReturnValue
  public NodeSubject hasChildCount(Slot slot, int count) {
    isNotNull();
    check("getChildren(%s)", slot).that(actual.getChildren(slot)).hasSize(count);
    return this;
  }

  /** Returns a subject for the child in single slot {@code slot}. */
  public NodeSubject child(Slot slot) {
    isNotNull();
    return check("getChild(%s)", slot).about(NodeSubject::new).that(actual.getChild(slot));
  }

  /** Returns a subject for the {@code index}th child in sequence slot {@code slot}. */
  public NodeSubject child(Slot slot, int index) {
    isNotNull();
    return check("getChildren(%s).get(%s)", slot, index)
        .about(NodeSubject::new)
        .that(actual.getChildren(slot).get(index));
  }
}
