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

import static com.google.common.truth.Truth.assertThat;
import static com.google.graphql.ast.testing.NodeSubject.assertNode;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.graphql.ast.IR;
import com.google.graphql.ast.Node;
import com.google.graphql.ast.NodeUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.jspecify.nullness.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CombinedVisitor}. */
@RunWith(JUnit4.class)
public final class CombinedVisitorTest {

  /**
   * <pre>
   * type Query { human: Human, alien: Alien }
   * type Human { name: String }
   * type Alien { name: String }
   * </pre>
   */
  private static final Node SCHEMA =
      IR.document(
          IR.objectTypeDefinition(
              "Query",
              IR.fieldDefinition("human", IR.namedType("Human")),
              IR.fieldDefinition("alien", IR.namedType("Alien"))),
          IR.objectTypeDefinition("Human", IR.fieldDefinition("name", IR.namedType("String"))),
          IR.objectTypeDefinition("Alien", IR.fieldDefinition("name", IR.namedType("String"))));

  /** Records its calls and answers enter calls with the given function. */
  private static final class ScriptedVisitor implements Visitor {
    final List<String> calls = new ArrayList<>();
    private final Function<Node, Action> onEnter;

    ScriptedVisitor(Function<Node, Action> onEnter) {
      this.onEnter = onEnter;
    }

    ScriptedVisitor() {
      this(n -> Action.CONTINUE);
    }

    @Override
    public Action enter(NodeTraversal t, Node n, @Nullable Node parent) {
      calls.add("enter " + n);
      return onEnter.apply(n);
    }

    @Override
    public Action leave(NodeTraversal t, Node n, @Nullable Node parent) {
      calls.add("leave " + n);
      return Action.CONTINUE;
    }
  }

  private static Function<Node, Action> onField(String name, Action action) {
    return n -> n.isField() && n.getName().equals(name) ? action : Action.CONTINUE;
  }

  private static Node query(Node... selections) {
    return IR.document(IR.query(IR.selectionSet(selections)));
  }

  @Test
  public void testNeedsVisitors() {
    assertThrows(IllegalArgumentException.class, () -> new CombinedVisitor(ImmutableList.of()));
  }

  @Test
  public void testSkipOnlyAffectsThatVisitor() {
    ScriptedVisitor skipping = new ScriptedVisitor(onField("a", Action.SKIP_CHILDREN));
    ScriptedVisitor other = new ScriptedVisitor();

    NodeTraversal.traverse(
        query(IR.field("a", IR.selectionSet(IR.field("inner"))), IR.field("b")),
        CombinedVisitor.of(skipping, other));

    assertThat(skipping.calls).containsNoneOf("enter FIELD inner", "leave FIELD inner");
    assertThat(skipping.calls)
        .containsAtLeast("enter FIELD a", "leave FIELD a", "enter FIELD b")
        .inOrder();
    assertThat(other.calls)
        .containsAtLeast("enter FIELD a", "enter FIELD inner", "leave FIELD inner", "leave FIELD a")
        .inOrder();
  }

  @Test
  public void testBrokenVisitorIsNotCalledAgain() {
    ScriptedVisitor breaking = new ScriptedVisitor(onField("a", Action.BREAK));
    ScriptedVisitor other = new ScriptedVisitor();

    NodeTraversal.traverse(
        query(IR.field("a"), IR.field("b")), CombinedVisitor.of(breaking, other));

    assertThat(Iterables.getLast(breaking.calls)).isEqualTo("enter FIELD a");
    assertThat(other.calls).containsAtLeast("enter FIELD b", "leave DOCUMENT").inOrder();
  }

  @Test
  public void testTraversalStopsWhenAllVisitorsBreak() {
    ScriptedVisitor first = new ScriptedVisitor(onField("a", Action.BREAK));
    ScriptedVisitor second = new ScriptedVisitor(onField("b", Action.BREAK));

    NodeTraversal.builder()
        .setVisitors(ImmutableList.of(first, second))
        .traverse(query(IR.field("a"), IR.field("b"), IR.field("c")));

    assertThat(Iterables.getLast(first.calls)).isEqualTo("enter FIELD a");
    assertThat(Iterables.getLast(second.calls)).isEqualTo("enter FIELD b");
    assertThat(second.calls).doesNotContain("enter FIELD c");
  }

  @Test
  public void testFirstEditWins() {
    ScriptedVisitor replacing = new ScriptedVisitor(onField("a", Action.replace(IR.field("x"))));
    ScriptedVisitor deleting = new ScriptedVisitor(onField("a", Action.DELETE));

    Node result =
        NodeTraversal.traverse(
            query(IR.field("a"), IR.field("b")), CombinedVisitor.of(replacing, deleting));

    assertNode(result).isEquivalentTo(query(IR.field("x"), IR.field("b")));
    assertThat(deleting.calls).doesNotContain("enter FIELD a");
    assertThat(deleting.calls).contains("leave FIELD x");
  }

  @Test
  public void testEditsOfLaterVisitorsApply() {
    ScriptedVisitor passive = new ScriptedVisitor();
    ScriptedVisitor deleting = new ScriptedVisitor(onField("b", Action.DELETE));

    Node result =
        NodeTraversal.traverse(
            query(IR.field("a"), IR.field("b")), CombinedVisitor.of(passive, deleting));

    assertNode(result).isEquivalentTo(query(IR.field("a")));
    assertThat(passive.calls).containsAtLeast("enter FIELD b", "leave FIELD b").inOrder();
  }

  @Test
  public void testSkippedNodeDeletedByAnotherVisitor() {
    ScriptedVisitor skipping = new ScriptedVisitor(onField("a", Action.SKIP_CHILDREN));
    ScriptedVisitor deleting = new ScriptedVisitor(onField("a", Action.DELETE));

    Node result =
        NodeTraversal.traverse(
            query(IR.field("a", IR.selectionSet(IR.field("inner"))), IR.field("b")),
            CombinedVisitor.of(skipping, deleting));

    assertNode(result).isEquivalentTo(query(IR.field("b")));
    assertThat(skipping.calls)
        .containsAtLeast("enter FIELD a", "leave FIELD a", "enter FIELD b", "leave FIELD b")
        .inOrder();
    assertThat(skipping.calls).doesNotContain("enter FIELD inner");
  }

  @Test
  public void testChildrenSkippedWhenNoVisitorWantsThem() {
    CombinedVisitor combined =
        CombinedVisitor.of(
            new ScriptedVisitor(onField("a", Action.SKIP_CHILDREN)),
            new ScriptedVisitor(onField("a", Action.SKIP_CHILDREN)));
    List<String> actions = new ArrayList<>();

    NodeTraversal.traverse(
        query(IR.field("a", IR.selectionSet(IR.field("inner"))), IR.field("b")),
        new Visitor() {
          @Override
          public Action enter(NodeTraversal t, Node n, @Nullable Node parent) {
            Action action = combined.enter(t, n, parent);
            if (n.isField()) {
              actions.add(n.getName() + " " + action.getKind());
            }
            return action;
          }

          @Override
          public Action leave(NodeTraversal t, Node n, @Nullable Node parent) {
            return combined.leave(t, n, parent);
          }
        });

    assertThat(actions).containsExactly("a SKIP_CHILDREN", "b CONTINUE").inOrder();
  }

  @Test
  public void testEveryVisitorLeavesWhenOneEditsOnLeave() {
    List<String> calls = new ArrayList<>();
    Visitor replacing =
        new Visitor() {
          @Override
          public Action leave(NodeTraversal t, Node n, @Nullable Node parent) {
            return n.isField() ? Action.replace(IR.field("x")) : Action.CONTINUE;
          }
        };
    Visitor deleting =
        new Visitor() {
          @Override
          public Action leave(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.isField()) {
              calls.add("leave " + n);
              return Action.DELETE;
            }
            return Action.CONTINUE;
          }
        };

    Node result =
        NodeTraversal.traverse(query(IR.field("a")), CombinedVisitor.of(replacing, deleting));

    assertNode(result).isEquivalentTo(query(IR.field("x")));
    assertThat(calls).containsExactly("leave FIELD a");
  }

  /** Records the schema position of every field it enters. */
  private static TypeInfoVisitor tracking(List<String> positions) {
    TypeInfo typeInfo = new TypeInfo(SCHEMA);
    return new TypeInfoVisitor(
        typeInfo,
        new Visitor() {
          @Override
          public Action enter(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.isField()) {
              Node parentType = typeInfo.getCurrentParentType();
              Node type = typeInfo.getCurrentType();
              positions.add(
                  n.getName()
                      + ": parent="
                      + (parentType == null ? "null" : parentType.getName())
                      + " type="
                      + (type == null ? "null" : NodeUtil.typeToString(type)));
            }
            return Action.CONTINUE;
          }
        });
  }

  private static Visitor replacingHumanOnEnter() {
    return new Visitor() {
      @Override
      public Action enter(NodeTraversal t, Node n, @Nullable Node parent) {
        return n.isField() && n.getName().equals("human")
            ? Action.replace(IR.field("alien", IR.selectionSet(IR.field("name"))))
            : Action.CONTINUE;
      }
    };
  }

  private static Node humanAndAlien() {
    return query(IR.field("human", IR.selectionSet(IR.field("name"))), IR.field("alien"));
  }

  @Test
  public void testTypeInfoFollowsReplacementByEarlierVisitor() {
    List<String> positions = new ArrayList<>();
    TypeInfoVisitor tracking = tracking(positions);

    NodeTraversal.builder()
        .setVisitors(ImmutableList.of(replacingHumanOnEnter(), tracking))
        .traverse(humanAndAlien());

    assertThat(positions)
        .containsExactly(
            "alien: parent=Query type=Alien",
            "name: parent=Alien type=String",
            "alien: parent=Query type=Alien")
        .inOrder();
    assertThat(tracking.getTypeInfo().getStackDepth()).isEqualTo(0);
  }

  @Test
  public void testTypeInfoFollowsReplacementByLaterVisitor() {
    List<String> positions = new ArrayList<>();
    TypeInfoVisitor tracking = tracking(positions);

    NodeTraversal.builder()
        .setVisitors(ImmutableList.of(tracking, replacingHumanOnEnter()))
        .traverse(humanAndAlien());

    assertThat(positions)
        .containsExactly(
            "human: parent=Query type=Human",
            "alien: parent=Query type=Alien",
            "name: parent=Alien type=String",
            "alien: parent=Query type=Alien")
        .inOrder();
    assertThat(tracking.getTypeInfo().getStackDepth()).isEqualTo(0);
  }

  @Test
  public void testTypeInfoFollowsDeletionByLaterVisitor() {
    List<String> positions = new ArrayList<>();
    TypeInfoVisitor tracking = tracking(positions);

    Node result =
        NodeTraversal.traverse(
            humanAndAlien(),
            CombinedVisitor.of(
                tracking, new ScriptedVisitor(onField("human", Action.DELETE))));

    assertNode(result).isEquivalentTo(query(IR.field("alien")));
    assertThat(positions)
        .containsExactly("human: parent=Query type=Human", "alien: parent=Query type=Alien")
        .inOrder();
    assertThat(tracking.getTypeInfo().getStackDepth()).isEqualTo(0);
  }
}
