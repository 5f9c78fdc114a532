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

import static com.google.common.truth.Truth.assertThat;
import static com.google.graphql.ast.testing.NodeSubject.assertNode;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Node}. */
@RunWith(JUnit4.class)
public final class NodeTest {

  @Test
  public void testChildrenFollowSlotOrder() {
    Node field =
        IR.field(
            "alias",
            "human",
            ImmutableList.of(IR.argument("id", IR.intValue(4))),
            ImmutableList.of(IR.directive("include", IR.argument("if", IR.booleanValue(true)))),
            IR.selectionSet(IR.field("name")));

    ImmutableList<Node> children = field.children();

    assertThat(children).hasSize(3);
    assertNode(children.get(0)).hasToken(Token.ARGUMENT).hasName("id");
    assertNode(children.get(1)).hasToken(Token.DIRECTIVE).hasName("include");
    assertNode(children.get(2)).hasToken(Token.SELECTION_SET);
    assertThat(field.getAlias()).isEqualTo("alias");
  }

  @Test
  public void testWithChildLeavesOriginalUntouched() {
    Node selectionSet = IR.selectionSet(IR.field("a"));
    Node field = IR.field("f", selectionSet);

    Node edited = field.withChild(Slot.SELECTION_SET, null);

    assertThat(field.getSelectionSet()).isSameInstanceAs(selectionSet);
    assertThat(edited.getSelectionSet()).isNull();
    assertThat(edited.getName()).isEqualTo("f");
    assertThat(edited.hasChildren()).isFalse();
  }

  @Test
  public void testWithChildrenSharesUnchangedChildren() {
    Node a = IR.field("a");
    Node b = IR.field("b");
    Node selectionSet = IR.selectionSet(a, b);

    Node edited = selectionSet.withChildren(Slot.SELECTIONS, ImmutableList.of(b));

    assertThat(edited.getSelections()).containsExactly(b);
    assertThat(edited.getSelections().get(0)).isSameInstanceAs(b);
    assertThat(selectionSet.getSelections()).containsExactly(a, b).inOrder();
  }

  @Test
  public void testStructuralEquality() {
    Node one = IR.document(IR.query(IR.selectionSet(IR.field("a"), IR.field("b"))));
    Node two = IR.document(IR.query(IR.selectionSet(IR.field("a"), IR.field("b"))));
    Node other = IR.document(IR.query(IR.selectionSet(IR.field("b"), IR.field("a"))));

    assertThat(one).isEqualTo(two);
    assertThat(one.hashCode()).isEqualTo(two.hashCode());
    assertThat(one).isNotEqualTo(other);
    assertNode(one).isEquivalentTo(two);
  }

  @Test
  public void testLeafDataTakesPartInEquality() {
    assertThat(IR.intValue(1)).isNotEqualTo(IR.intValue(2));
    assertThat(IR.enumValue("RED")).isNotEqualTo(IR.stringValue("RED"));
    assertThat(IR.field("a")).isNotEqualTo(IR.field("b"));
    assertThat(IR.operation(OperationType.QUERY, null, IR.selectionSet()))
        .isNotEqualTo(IR.operation(OperationType.MUTATION, null, IR.selectionSet()));
  }

  @Test
  public void testDescriptionTakesPartInEquality() {
    Node human = IR.objectTypeDefinition("Human");
    Node described = human.toBuilder().setDescription("A person").build();

    assertThat(described.getDescription()).isEqualTo("A person");
    assertThat(human.getDescription()).isNull();
    assertThat(described).isNotEqualTo(human);
    assertThat(described.toBuilder().setName("Person").build().getDescription())
        .isEqualTo("A person");
  }

  @Test
  public void testSlotsOfTokensSharingSlotNames() {
    assertThat(Token.FIELD.getSlots())
        .containsExactly(Slot.ARGUMENTS, Slot.DIRECTIVES, Slot.SELECTION_SET)
        .inOrder();
    assertThat(Token.VARIABLE_DEFINITION.getSlots())
        .containsExactly(Slot.VARIABLE, Slot.TYPE, Slot.DEFAULT_VALUE, Slot.DIRECTIVES)
        .inOrder();
    assertThat(Token.VARIABLE.getSlots()).isEmpty();
  }

  @Test
  public void testSlotKeys() {
    assertThat(Slot.SELECTION_SET.getKey()).isEqualTo("selectionSet");
    assertThat(Slot.VARIABLE_DEFINITIONS.getKey()).isEqualTo("variableDefinitions");
    assertThat(Slot.TYPE.getKey()).isEqualTo("type");
  }

  @Test
  public void testDeepTreesCompareWithoutRecursion() {
    Node one = IR.intValue(0);
    Node two = IR.intValue(0);
    for (int i = 0; i < 100_000; i++) {
      one = IR.listValue(one);
      two = IR.listValue(two);
    }

    assertThat(one.isEquivalentTo(two)).isTrue();
  }

  @Test
  public void testGetChildOnSequenceSlotFails() {
    Node field = IR.field("a");

    assertThrows(IllegalArgumentException.class, () -> field.getChild(Slot.ARGUMENTS));
    assertThrows(IllegalArgumentException.class, () -> field.getChildren(Slot.SELECTION_SET));
  }

  @Test
  public void testMissingSlotIsEmpty() {
    Node name = IR.field("a");

    assertThat(name.getChild(Slot.VALUE)).isNull();
    assertThat(name.getChildren(Slot.DEFINITIONS)).isEmpty();
  }

  @Test
  public void testBuilderRejectsForeignSlot() {
    Node.Builder builder = Node.builder(Token.FIELD);

    assertThrows(
        IllegalArgumentException.class, () -> builder.setChild(Slot.TYPE, IR.namedType("Int")));
  }

  @Test
  public void testAddChild() {
    Node selectionSet =
        Node.builder(Token.SELECTION_SET)
            .addChild(Slot.SELECTIONS, IR.field("a"))
            .addChild(Slot.SELECTIONS, IR.field("b"))
            .build();

    assertThat(selectionSet).isEqualTo(IR.selectionSet(IR.field("a"), IR.field("b")));
  }

  @Test
  public void testToStringTree() {
    Node document =
        IR.document(
            IR.query(
                IR.selectionSet(
                    IR.field("human", ImmutableList.of(IR.argument("id", IR.intValue(4))), null))));

    assertThat(document.toStringTree())
        .isEqualTo(
            "DOCUMENT\n"
                + "    OPERATION_DEFINITION query\n"
                + "        SELECTION_SET\n"
                + "            FIELD human\n"
                + "                ARGUMENT id\n"
                + "                    INT_VALUE 4\n");
  }

  @Test
  public void testToString() {
    assertThat(IR.field("pic", "picture", ImmutableList.of(), ImmutableList.of(), null).toString())
        .isEqualTo("FIELD pic: picture");
    assertThat(IR.stringValue("hi").toString()).isEqualTo("STRING_VALUE \"hi\"");
    assertThat(IR.booleanValue(true).getBoolean()).isTrue();
  }
}
