/*
 * Copyright 2025 The Projectables Authors.
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

package dev.projectables.syntax;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Node}. */
@RunWith(JUnit4.class)
public final class NodeTest {

  @Test
  public void testWithChildrenReturnsSameNodeWhenUnchanged() {
    Node a = IR.name("a");
    Node b = IR.name("b");
    Node sum = IR.binaryOp(Token.ADD, a, b);

    assertThat(sum.withChildren(ImmutableList.of(a, b))).isSameInstanceAs(sum);
    assertThat(sum.withChildAtIndex(1, b)).isSameInstanceAs(sum);
  }

  @Test
  public void testWithChildrenSharesUntouchedChildren() {
    Node a = IR.name("a");
    Node sum = IR.binaryOp(Token.ADD, a, IR.name("b"));
    Node c = IR.name("c");

    Node replaced = sum.withChildAtIndex(1, c);
    assertThat(replaced).isNotSameInstanceAs(sum);
    assertThat(replaced.getToken()).isEqualTo(Token.ADD);
    assertThat(replaced.getFirstChild()).isSameInstanceAs(a);
    assertThat(replaced.getSecondChild()).isSameInstanceAs(c);
    assertThat(sum.getSecondChild().getString()).isEqualTo("b");
  }

  @Test
  public void testBadChildIndex() {
    Node paren = IR.paren(IR.name("a"));
    assertThrows(IllegalArgumentException.class, () -> paren.withChildAtIndex(1, IR.name("b")));
  }

  @Test
  public void testTrivia() {
    Node a = IR.name("a").withLeadingTrivia("  ").withTrailingTrivia("\n");
    assertThat(a.getLeadingTrivia()).isEqualTo("  ");
    assertThat(a.getTrailingTrivia()).isEqualTo("\n");
    assertThat(a.withLeadingTrivia("  ")).isSameInstanceAs(a);

    Node b = IR.name("b").withTriviaFrom(a);
    assertThat(b.getLeadingTrivia()).isEqualTo("  ");
    assertThat(b.getTrailingTrivia()).isEqualTo("\n");
    assertThat(b.withoutTrailingTrivia().getTrailingTrivia()).isEmpty();
    assertThat(b.withoutLeadingTrivia().getLeadingTrivia()).isEmpty();
  }

  @Test
  public void testIdentityEquality() {
    assertThat(IR.name("a")).isNotEqualTo(IR.name("a"));
  }

  @Test
  public void testSourcePosition() {
    Node a = IR.name("a");
    assertThat(a.getSourcePosition()).isNull();
    assertThat(a.getLineno()).isEqualTo(-1);
    assertThat(a.getCharno()).isEqualTo(-1);
    assertThat(a.getLength()).isEqualTo(0);

    Node positioned = a.withSourcePosition(new SourcePosition("Order.cs", 3, 4, 1));
    assertThat(positioned.getSourceFileName()).isEqualTo("Order.cs");
    assertThat(positioned.getLineno()).isEqualTo(3);
    assertThat(positioned.getCharno()).isEqualTo(4);
    assertThat(positioned.getLength()).isEqualTo(1);

    Node trivia = positioned.withLeadingTrivia(" ");
    assertThat(trivia.getSourcePosition()).isEqualTo(positioned.getSourcePosition());
  }

  @Test
  public void testBadSourcePosition() {
    assertThrows(IllegalArgumentException.class, () -> new SourcePosition("a.cs", 0, 0, 0));
    assertThrows(IllegalArgumentException.class, () -> new SourcePosition("a.cs", 1, -1, 0));
  }

  @Test
  public void testChildAccessors() {
    Node call = IR.call(IR.name("f"), IR.name("x"), IR.name("y"));
    assertThat(call.getChildCount()).isEqualTo(2);
    assertThat(call.getFirstChild().getString()).isEqualTo("f");
    assertThat(call.getLastChild().isArgList()).isTrue();
    assertThat(call.getLastChild().getChildAtIndex(1).getString()).isEqualTo("y");
    assertThrows(IllegalStateException.class, call::getOnlyChild);
    assertThrows(IllegalStateException.class, () -> IR.name("f").getFirstChild());
    assertThrows(IllegalStateException.class, () -> IR.nullNode().getString());
  }

  @Test
  public void testToStringTree() {
    Node n = IR.getprop(IR.name("a"), "b");
    assertThat(n.toStringTree()).isEqualTo("GETPROP\n    NAME a\n    NAME b\n");
  }
}
