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

package dev.projectables.generator;

import static com.google.common.truth.Truth.assertThat;

import dev.projectables.syntax.IR;
import dev.projectables.syntax.Node;
import dev.projectables.syntax.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link NodeUtil}. */
@RunWith(JUnit4.class)
public final class NodeUtilTest {

  @Test
  public void testGetRightmostName() {
    Node name = IR.name("Order");
    assertThat(NodeUtil.getRightmostName(name)).isSameInstanceAs(name);

    Node qualified = IR.qualifiedName("Shop", "Model", "Order");
    assertThat(NodeUtil.getRightmostName(qualified).getString()).isEqualTo("Order");

    Node alias = IR.aliasQualifiedName("global", IR.name("Scratch"));
    assertThat(NodeUtil.getRightmostName(alias).getString()).isEqualTo("Scratch");

    Node getprop = IR.getprop(IR.thisNode(), "Customer", "Name");
    assertThat(NodeUtil.getRightmostName(getprop).getString()).isEqualTo("Name");
  }

  @Test
  public void testPrecedence() {
    assertThat(NodeUtil.precedence(Token.MUL)).isGreaterThan(NodeUtil.precedence(Token.ADD));
    assertThat(NodeUtil.precedence(Token.EQ)).isGreaterThan(NodeUtil.precedence(Token.AND));
    assertThat(NodeUtil.precedence(Token.AND)).isGreaterThan(NodeUtil.precedence(Token.OR));
    assertThat(NodeUtil.precedence(Token.OR)).isGreaterThan(NodeUtil.precedence(Token.COALESCE));
    assertThat(NodeUtil.precedence(Token.COALESCE)).isGreaterThan(NodeUtil.precedence(Token.HOOK));
    assertThat(NodeUtil.precedence(Token.CAST)).isEqualTo(NodeUtil.UNARY_PRECEDENCE);
    assertThat(NodeUtil.precedence(Token.GETPROP)).isEqualTo(NodeUtil.PRIMARY_PRECEDENCE);
  }

  @Test
  public void testOpToStr() {
    assertThat(NodeUtil.opToStr(Token.COALESCE)).isEqualTo("??");
    assertThat(NodeUtil.opToStr(Token.NE)).isEqualTo("!=");
    assertThat(NodeUtil.opToStr(Token.GETPROP)).isNull();
    assertThat(NodeUtil.isRightAssociative(Token.COALESCE)).isTrue();
    assertThat(NodeUtil.isRightAssociative(Token.SUB)).isFalse();
  }

  @Test
  public void testGetWhenCondition() {
    Node plain = IR.switchArm(IR.discardPattern(), IR.number("0"));
    assertThat(NodeUtil.getWhenCondition(plain)).isNull();

    Node guarded = IR.switchArm(IR.discardPattern(), IR.name("ok"), IR.number("0"));
    assertThat(NodeUtil.getWhenCondition(guarded).getString()).isEqualTo("ok");
  }
}
