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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link IR}. */
@RunWith(JUnit4.class)
public final class IRTest {

  @Test
  public void testName() {
    assertThat(IR.name("@this").getString()).isEqualTo("@this");
    assertThrows(IllegalStateException.class, () -> IR.name("a.b"));
    assertThrows(IllegalStateException.class, () -> IR.name(""));
  }

  @Test
  public void testQualifiedName() {
    Node n = IR.qualifiedName("System", "Collections", "Generic");
    assertThat(n.isQualifiedName()).isTrue();
    assertThat(n.getLastChild().getString()).isEqualTo("Generic");
    assertThat(n.getFirstChild().isQualifiedName()).isTrue();
    assertThat(IR.qualifiedName("System").isName()).isTrue();
  }

  @Test
  public void testGetpropChain() {
    Node n = IR.getprop(IR.thisNode(), "Customer", "Name");
    assertThat(n.isGetProp()).isTrue();
    assertThat(n.getLastChild().getString()).isEqualTo("Name");
    assertThat(n.getFirstChild().getFirstChild().isThis()).isTrue();
  }

  @Test
  public void testStringEscapes() {
    assertThat(IR.string("a\"b\\n").getString()).isEqualTo("\"a\\\"b\\\\n\"");
  }

  @Test
  public void testTypesAreChecked() {
    assertThrows(IllegalStateException.class, () -> IR.cast(IR.number("1"), IR.nullNode()));
    assertThrows(IllegalStateException.class, () -> IR.nullableType(IR.thisNode()));
    assertThrows(IllegalArgumentException.class, () -> IR.genericName("List"));
  }

  @Test
  public void testExpressionsAreChecked() {
    assertThrows(IllegalStateException.class, () -> IR.paren(IR.discardPattern()));
    assertThrows(IllegalStateException.class, () -> IR.call(IR.name("f"), IR.paramList()));
    assertThrows(
        IllegalArgumentException.class,
        () -> IR.binaryOp(Token.NOT, IR.name("a"), IR.name("b")));
  }

  @Test
  public void testSwitch() {
    Node arm = IR.switchArm(IR.discardPattern(), IR.number("0"));
    assertThat(arm.getSecondChild().isEmpty()).isTrue();
    Node n = IR.switchExpr(IR.name("x"), arm);
    assertThat(n.getChildCount()).isEqualTo(2);
    assertThrows(IllegalArgumentException.class, () -> IR.switchExpr(IR.name("x")));
    assertThrows(IllegalStateException.class, () -> IR.switchArm(IR.name("y"), IR.number("0")));
  }

  @Test
  public void testInterpolation() {
    Node plain = IR.interpolation(IR.name("x"));
    assertThat(plain.hasString()).isFalse();
    Node formatted = IR.interpolation(IR.name("x"), IR.number("5"), "N2");
    assertThat(formatted.getString()).isEqualTo("N2");
    assertThat(formatted.getChildCount()).isEqualTo(2);
  }

  @Test
  public void testPatterns() {
    assertThat(IR.isPattern(IR.discardPattern())).isTrue();
    assertThat(IR.isPattern(IR.constantPattern(IR.number("1")))).isTrue();
    assertThat(IR.isPattern(IR.name("x"))).isFalse();
    assertThrows(
        IllegalStateException.class,
        () -> IR.declarationPattern(IR.name("Order"), IR.number("1")));
  }
}
