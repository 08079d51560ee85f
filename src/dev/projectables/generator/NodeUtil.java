/*
 * Copyright 2004 The Closure Compiler Authors.
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

import dev.projectables.syntax.Node;
import dev.projectables.syntax.Token;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  static final int PRIMARY_PRECEDENCE = 18;
  static final int UNARY_PRECEDENCE = 16;

  private NodeUtil() {}

  /**
   * Returns the binding strength of an operator; higher binds tighter. Primary expressions
   * (names, literals, accesses, calls, parenthesized expressions) bind tightest.
   */
  public static int precedence(Token type) {
    switch (type) {
      case LAMBDA:
      case ASSIGN:
        return 1;
      case HOOK:
        return 3; // ?: operator
      case COALESCE:
        return 4;
      case OR:
        return 5;
      case AND:
        return 6;
      case BITOR:
        return 7;
      case BITXOR:
        return 8;
      case BITAND:
        return 9;
      case EQ:
      case NE:
        return 10;
      case LT:
      case GT:
      case LE:
      case GE:
        return 11;
      case SUB:
      case ADD:
        return 13;
      case MUL:
      case MOD:
      case DIV:
        return 14;
      case SWITCH_EXPR:
        return 15;
      case NOT:
      case BITNOT:
      case POS:
      case NEG:
      case CAST:
        return UNARY_PRECEDENCE;
      default:
        return PRIMARY_PRECEDENCE;
    }
  }

  /** Returns the source text of an operator, or null if the token is not an operator. */
  public static @Nullable String opToStr(Token operator) {
    switch (operator) {
      case EQ:
        return "==";
      case NE:
        return "!=";
      case LT:
        return "<";
      case LE:
        return "<=";
      case GT:
        return ">";
      case GE:
        return ">=";
      case ADD:
        return "+";
      case SUB:
        return "-";
      case MUL:
        return "*";
      case DIV:
        return "/";
      case MOD:
        return "%";
      case AND:
        return "&&";
      case OR:
        return "||";
      case COALESCE:
        return "??";
      case BITAND:
        return "&";
      case BITOR:
        return "|";
      case BITXOR:
        return "^";
      case NOT:
        return "!";
      case NEG:
        return "-";
      case POS:
        return "+";
      case BITNOT:
        return "~";
      default:
        return null;
    }
  }

  /** Whether the binary operator groups right to left. */
  static boolean isRightAssociative(Token operator) {
    return operator == Token.COALESCE;
  }

  /** Returns the rightmost simple name of a (possibly qualified) name. */
  public static Node getRightmostName(Node n) {
    switch (n.getToken()) {
      case QUALIFIED_NAME:
      case ALIAS_QUALIFIED_NAME:
      case GETPROP:
        return getRightmostName(n.getLastChild());
      default:
        return n;
    }
  }

  /** For a SWITCH_ARM, the {@code when} condition, or null when the arm has none. */
  static @Nullable Node getWhenCondition(Node arm) {
    Node when = arm.getSecondChild();
    return when.isEmpty() ? null : when;
  }
}
