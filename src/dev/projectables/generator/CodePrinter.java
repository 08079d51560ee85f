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

import static com.google.common.base.Preconditions.checkState;

import dev.projectables.syntax.IR;
import dev.projectables.syntax.Node;
import dev.projectables.syntax.Token;

/**
 * CodePrinter prints a syntax tree as source text.
 *
 * <p>The leading and trailing trivia of every node are printed verbatim. Operators get a single
 * space on each side. Parentheses are printed for PAREN nodes and wherever the tree shape would
 * otherwise be read back differently because of operator precedence.
 */
public final class CodePrinter {

  private final StringBuilder sb = new StringBuilder();

  private CodePrinter() {}

  public static String toSource(Node n) {
    CodePrinter printer = new CodePrinter();
    printer.add(n);
    return printer.sb.toString();
  }

  private void add(String str) {
    sb.append(str);
  }

  private void add(Node n) {
    add(n.getLeadingTrivia());
    addBody(n);
    add(n.getTrailingTrivia());
  }

  private void addExpr(Node n, int minPrecedence) {
    if (NodeUtil.precedence(n.getToken()) < minPrecedence) {
      add("(");
      add(n);
      add(")");
    } else {
      add(n);
    }
  }

  private void addBody(Node n) {
    Token type = n.getToken();
    if (IR.isBinaryOperator(type)) {
      int p = NodeUtil.precedence(type);
      boolean rightAssoc = NodeUtil.isRightAssociative(type);
      addExpr(n.getFirstChild(), rightAssoc ? p + 1 : p);
      add(" " + NodeUtil.opToStr(type) + " ");
      addExpr(n.getLastChild(), rightAssoc ? p : p + 1);
      return;
    }
    if (IR.isUnaryOperator(type)) {
      add(NodeUtil.opToStr(type));
      addExpr(n.getFirstChild(), NodeUtil.UNARY_PRECEDENCE);
      return;
    }

    switch (type) {
      case NAME:
      case NUMBER:
      case STRINGLIT:
      case CHARLIT:
      case PREDEFINED_TYPE:
      case STRING_PART:
        add(n.getString());
        break;
      case TRUE:
        add("true");
        break;
      case FALSE:
        add("false");
        break;
      case NULL:
        add("null");
        break;
      case THIS:
        add("this");
        break;
      case BASE:
        add("base");
        break;
      case EMPTY:
        break;

      case GENERIC_NAME:
        add(n.getString());
        add("<");
        addList(n, 0);
        add(">");
        break;
      case QUALIFIED_NAME:
        add(n.getFirstChild());
        add(".");
        add(n.getLastChild());
        break;
      case ALIAS_QUALIFIED_NAME:
        add(n.getFirstChild());
        add("::");
        add(n.getLastChild());
        break;
      case NULLABLE_TYPE:
        add(n.getOnlyChild());
        add("?");
        break;
      case ARRAY_TYPE:
        add(n.getOnlyChild());
        add("[]");
        break;

      case GETPROP:
        addExpr(n.getFirstChild(), NodeUtil.PRIMARY_PRECEDENCE);
        add(".");
        add(n.getLastChild());
        break;
      case GETELEM:
        addExpr(n.getFirstChild(), NodeUtil.PRIMARY_PRECEDENCE);
        add("[");
        add(n.getLastChild());
        add("]");
        break;
      case CALL:
        addExpr(n.getFirstChild(), NodeUtil.PRIMARY_PRECEDENCE);
        add("(");
        add(n.getLastChild());
        add(")");
        break;
      case ARG_LIST:
      case PARAM_LIST:
        addList(n, 0);
        break;
      case NEW:
        add("new ");
        add(n.getFirstChild());
        add("(");
        add(n.getSecondChild());
        add(")");
        if (n.getChildCount() == 3) {
          add(" ");
          add(n.getLastChild());
        }
        break;
      case OBJECT_INITIALIZER:
        if (n.hasChildren()) {
          add("{ ");
          addList(n, 0);
          add(" }");
        } else {
          add("{ }");
        }
        break;
      case ASSIGN:
        add(n.getFirstChild());
        add(" = ");
        add(n.getLastChild());
        break;

      case HOOK:
        {
          checkState(n.getChildCount() == 3, n);
          int p = NodeUtil.precedence(type);
          addExpr(n.getFirstChild(), p + 1);
          add(" ? ");
          addExpr(n.getSecondChild(), p);
          add(" : ");
          addExpr(n.getLastChild(), p);
          break;
        }
      case CAST:
        add("(");
        add(n.getFirstChild());
        add(")");
        addExpr(n.getLastChild(), NodeUtil.UNARY_PRECEDENCE);
        break;
      case TYPEOF:
        add("typeof(");
        add(n.getOnlyChild());
        add(")");
        break;
      case DEFAULT:
        add("default(");
        add(n.getOnlyChild());
        add(")");
        break;
      case PAREN:
        add("(");
        add(n.getOnlyChild());
        add(")");
        break;

      case LAMBDA:
        {
          Node params = n.getFirstChild();
          if (params.getChildCount() == 1 && !params.getFirstChild().hasChildren()) {
            add(params.getFirstChild());
          } else {
            add("(");
            add(params);
            add(")");
          }
          add(" => ");
          add(n.getLastChild());
          break;
        }
      case PARAM:
        if (n.hasChildren()) {
          add(n.getOnlyChild());
          add(" ");
        }
        add(n.getString());
        break;

      case CONDITIONAL_ACCESS:
        addExpr(n.getFirstChild(), NodeUtil.PRIMARY_PRECEDENCE);
        add("?");
        add(n.getLastChild());
        break;
      case MEMBER_BINDING:
        add(".");
        add(n.getOnlyChild());
        break;
      case ELEMENT_BINDING:
        add("[");
        add(n.getOnlyChild());
        add("]");
        break;

      case SWITCH_EXPR:
        addExpr(n.getFirstChild(), NodeUtil.UNARY_PRECEDENCE);
        add(" switch { ");
        addList(n, 1);
        add(" }");
        break;
      case SWITCH_ARM:
        {
          add(n.getFirstChild());
          Node when = NodeUtil.getWhenCondition(n);
          if (when != null) {
            add(" when ");
            add(when);
          }
          add(" => ");
          add(n.getLastChild());
          break;
        }
      case DISCARD_PATTERN:
        add("_");
        break;
      case CONSTANT_PATTERN:
        add(n.getOnlyChild());
        break;
      case DECLARATION_PATTERN:
        add(n.getFirstChild());
        add(" ");
        if (n.getLastChild().isEmpty()) {
          add("_");
        } else {
          add(n.getLastChild());
        }
        break;
      case RELATIONAL_PATTERN:
        add(n.getString());
        add(" ");
        add(n.getOnlyChild());
        break;
      case POSITIONAL_PATTERN:
        add("(");
        addList(n, 0);
        add(")");
        break;

      case INTERPOLATED_STRING:
        add("$\"");
        for (Node part : n.children()) {
          add(part);
        }
        add("\"");
        break;
      case INTERPOLATION:
        add("{");
        add(n.getFirstChild());
        if (n.getChildCount() == 2) {
          add(",");
          add(n.getLastChild());
        }
        if (n.hasString()) {
          add(":");
          add(n.getString());
        }
        add("}");
        break;

      default:
        throw new IllegalStateException("Unexpected node to print: " + n);
    }
  }

  /** Adds the children of {@code n}, starting at {@code start}, separated by commas. */
  private void addList(Node n, int start) {
    for (int i = start; i < n.getChildCount(); i++) {
      if (i > start) {
        add(", ");
      }
      add(n.getChildAtIndex(i));
    }
  }
}
