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

import dev.projectables.syntax.Node;
import dev.projectables.testing.ExpressionParser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link VariableReplacementRewriter}. */
@RunWith(JUnit4.class)
public final class VariableReplacementRewriterTest {

  private static final String CAST = "((string)(x))";

  private static String replace(String source) {
    Node replacement = ExpressionParser.parse(CAST);
    return CodePrinter.toSource(
        new VariableReplacementRewriter("s", replacement).replace(ExpressionParser.parse(source)));
  }

  private static void test(String source, String expected) {
    assertThat(replace(source)).isEqualTo(expected);
  }

  private static void testSame(String source) {
    test(source, source);
  }

  @Test
  public void testBareReference() {
    test("s", CAST);
    test("s + s", CAST + " + " + CAST);
    test("Foo(s, 1)", "Foo(" + CAST + ", 1)");
  }

  @Test
  public void testMemberAccessReceiver() {
    test("s.Length", CAST + ".Length");
    test("s.Trim().Length", CAST + ".Trim().Length");
  }

  @Test
  public void testMemberNamesAreNotReplaced() {
    testSame("other.s");
    testSame("a?.s");
  }

  @Test
  public void testOtherNamesAreNotReplaced() {
    testSame("t.Length + st");
  }

  @Test
  public void testObjectInitializerKeyIsNotReplaced() {
    test("new Foo { s = s }", "new Foo() { s = " + CAST + " }");
  }

  @Test
  public void testTypeSyntaxIsNotReplaced() {
    testSame("(s)y");
    testSame("typeof(s)");
  }

  @Test
  public void testShadowingLambdaParameter() {
    test(
        "Items.Any(s => s.Ok) && s.Length > 0",
        "Items.Any(s => s.Ok) && " + CAST + ".Length > 0");
    test("Items.Any(t => t == s)", "Items.Any(t => t == " + CAST + ")");
  }

  @Test
  public void testTriviaOfReplacedReferenceIsKept() {
    assertThat(replace("  s ")).isEqualTo("  " + CAST + " ");
  }

  @Test
  public void testUnchangedTreeIsReturnedAsIs() {
    Node root = ExpressionParser.parse("a.b + c");
    Node replacement = ExpressionParser.parse(CAST);
    assertThat(new VariableReplacementRewriter("s", replacement).replace(root))
        .isSameInstanceAs(root);
  }
}
