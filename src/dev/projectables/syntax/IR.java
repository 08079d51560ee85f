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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** An AST construction helper class */
public class IR {

  private static final CharMatcher IDENTIFIER_PART =
      CharMatcher.forPredicate(Character::isLetterOrDigit).or(CharMatcher.anyOf("_@"));

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node name(String name) {
    checkState(
        !name.isEmpty() && IDENTIFIER_PART.matchesAllOf(name),
        "Invalid name '%s'. Did you mean to use IR.qualifiedName?",
        name);
    return Node.newString(Token.NAME, name);
  }

  public static Node genericName(String name, Node... typeArgs) {
    checkArgument(typeArgs.length > 0, "Generic name %s needs type arguments", name);
    for (Node typeArg : typeArgs) {
      checkState(mayBeType(typeArg), typeArg);
    }
    return Node.newString(Token.GENERIC_NAME, name, typeArgs);
  }

  /** Builds {@code a.b.c} as nested QUALIFIED_NAME nodes. */
  public static Node qualifiedName(String first, String... rest) {
    Node result = name(first);
    for (String segment : rest) {
      result = new Node(Token.QUALIFIED_NAME, result, name(segment));
    }
    return result;
  }

  public static Node qualifiedName(Node left, Node right) {
    checkState(mayBeType(left), left);
    checkState(right.isSimpleName(), right);
    return new Node(Token.QUALIFIED_NAME, left, right);
  }

  public static Node aliasQualifiedName(String alias, Node name) {
    checkState(name.isSimpleName(), name);
    return new Node(Token.ALIAS_QUALIFIED_NAME, name(alias), name);
  }

  public static Node predefinedType(String keyword) {
    return Node.newString(Token.PREDEFINED_TYPE, keyword);
  }

  public static Node nullableType(Node elementType) {
    checkState(mayBeType(elementType), elementType);
    return new Node(Token.NULLABLE_TYPE, elementType);
  }

  public static Node arrayType(Node elementType) {
    checkState(mayBeType(elementType), elementType);
    return new Node(Token.ARRAY_TYPE, elementType);
  }

  public static Node number(String text) {
    return Node.newString(Token.NUMBER, text);
  }

  /** A string literal. {@code value} is the unescaped content. */
  public static Node string(String value) {
    StringBuilder sb = new StringBuilder("\"");
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          sb.append(c);
      }
    }
    return Node.newString(Token.STRINGLIT, sb.append('"').toString());
  }

  /** A string literal kept exactly as written, quotes included. */
  public static Node rawString(String rawText) {
    checkArgument(rawText.length() >= 2, "Bad string literal %s", rawText);
    return Node.newString(Token.STRINGLIT, rawText);
  }

  public static Node charLiteral(String rawText) {
    return Node.newString(Token.CHARLIT, rawText);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  public static Node thisNode() {
    return new Node(Token.THIS);
  }

  public static Node baseNode() {
    return new Node(Token.BASE);
  }

  public static Node getprop(Node target, Node name) {
    checkState(mayBeExpression(target), target);
    checkState(name.isSimpleName(), name);
    return new Node(Token.GETPROP, target, name);
  }

  public static Node getprop(Node target, String name, String... moreNames) {
    Node result = getprop(target, name(name));
    for (String moreName : moreNames) {
      result = getprop(result, name(moreName));
    }
    return result;
  }

  public static Node getelem(Node target, Node argList) {
    checkState(mayBeExpression(target), target);
    checkState(argList.isArgList(), argList);
    return new Node(Token.GETELEM, target, argList);
  }

  public static Node call(Node target, Node argList) {
    checkState(mayBeExpression(target), target);
    checkState(argList.isArgList(), argList);
    return new Node(Token.CALL, target, argList);
  }

  public static Node call(Node target, Node... args) {
    return call(target, argList(ImmutableList.copyOf(args)));
  }

  public static Node argList(List<Node> args) {
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
    }
    return new Node(Token.ARG_LIST, args);
  }

  public static Node argList(Node... args) {
    return argList(ImmutableList.copyOf(args));
  }

  public static Node newNode(Node type, Node argList) {
    checkState(mayBeType(type), type);
    checkState(argList.isArgList(), argList);
    return new Node(Token.NEW, type, argList);
  }

  public static Node newNode(Node type, Node argList, Node initializer) {
    checkState(mayBeType(type), type);
    checkState(argList.isArgList(), argList);
    checkState(initializer.isObjectInitializer(), initializer);
    return new Node(Token.NEW, type, argList, initializer);
  }

  public static Node objectInitializer(Node... assignments) {
    for (Node assign : assignments) {
      checkState(assign.isAssign(), assign);
    }
    return new Node(Token.OBJECT_INITIALIZER, assignments);
  }

  public static Node assign(Node target, Node expr) {
    checkState(target.isName(), target);
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.ASSIGN, target, expr);
  }

  public static Node hook(Node cond, Node trueval, Node falseval) {
    checkState(mayBeExpression(cond), cond);
    checkState(mayBeExpression(trueval), trueval);
    checkState(mayBeExpression(falseval), falseval);
    return new Node(Token.HOOK, cond, trueval, falseval);
  }

  public static Node eq(Node expr1, Node expr2) {
    return binaryOp(Token.EQ, expr1, expr2);
  }

  public static Node ne(Node expr1, Node expr2) {
    return binaryOp(Token.NE, expr1, expr2);
  }

  public static Node and(Node expr1, Node expr2) {
    return binaryOp(Token.AND, expr1, expr2);
  }

  public static Node or(Node expr1, Node expr2) {
    return binaryOp(Token.OR, expr1, expr2);
  }

  public static Node not(Node expr) {
    return unaryOp(Token.NOT, expr);
  }

  public static Node binaryOp(Token token, Node expr1, Node expr2) {
    checkArgument(isBinaryOperator(token), token);
    checkState(mayBeExpression(expr1), expr1);
    checkState(mayBeExpression(expr2), expr2);
    return new Node(token, expr1, expr2);
  }

  public static Node unaryOp(Token token, Node expr) {
    checkArgument(isUnaryOperator(token), token);
    checkState(mayBeExpression(expr), expr);
    return new Node(token, expr);
  }

  public static Node cast(Node type, Node expr) {
    checkState(mayBeType(type), type);
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.CAST, type, expr);
  }

  public static Node typeOf(Node type) {
    checkState(mayBeType(type), type);
    return new Node(Token.TYPEOF, type);
  }

  public static Node defaultOf(Node type) {
    checkState(mayBeType(type), type);
    return new Node(Token.DEFAULT, type);
  }

  public static Node paren(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.PAREN, expr);
  }

  public static Node lambda(Node paramList, Node body) {
    checkState(paramList.isParamList(), paramList);
    checkState(mayBeExpression(body), body);
    return new Node(Token.LAMBDA, paramList, body);
  }

  public static Node paramList(Node... params) {
    for (Node param : params) {
      checkState(param.getToken() == Token.PARAM, param);
    }
    return new Node(Token.PARAM_LIST, params);
  }

  public static Node param(String name) {
    return Node.newString(Token.PARAM, name);
  }

  public static Node param(String name, Node type) {
    checkState(mayBeType(type), type);
    return Node.newString(Token.PARAM, name, type);
  }

  public static Node conditionalAccess(Node target, Node whenNotNull) {
    checkState(mayBeExpression(target), target);
    checkState(mayBeExpression(whenNotNull), whenNotNull);
    return new Node(Token.CONDITIONAL_ACCESS, target, whenNotNull);
  }

  public static Node memberBinding(Node name) {
    checkState(name.isSimpleName(), name);
    return new Node(Token.MEMBER_BINDING, name);
  }

  public static Node elementBinding(Node argList) {
    checkState(argList.isArgList(), argList);
    return new Node(Token.ELEMENT_BINDING, argList);
  }

  public static Node switchExpr(Node governing, Node... arms) {
    checkState(mayBeExpression(governing), governing);
    checkArgument(arms.length > 0, "A switch expression needs at least one arm");
    ImmutableList.Builder<Node> children = ImmutableList.<Node>builder().add(governing);
    for (Node arm : arms) {
      checkState(arm.isSwitchArm(), arm);
      children.add(arm);
    }
    return new Node(Token.SWITCH_EXPR, children.build());
  }

  public static Node switchArm(Node pattern, Node result) {
    return switchArm(pattern, empty(), result);
  }

  /**
   * @param when The {@code when} clause condition, or an EMPTY node when the arm has none
   */
  public static Node switchArm(Node pattern, Node when, Node result) {
    checkState(isPattern(pattern), pattern);
    checkState(when.isEmpty() || mayBeExpression(when), when);
    checkState(mayBeExpression(result), result);
    return new Node(Token.SWITCH_ARM, pattern, when, result);
  }

  public static Node discardPattern() {
    return new Node(Token.DISCARD_PATTERN);
  }

  public static Node constantPattern(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.CONSTANT_PATTERN, expr);
  }

  /**
   * @param designation The declared variable name, or an EMPTY node for a discard designation
   */
  public static Node declarationPattern(Node type, Node designation) {
    checkState(mayBeType(type), type);
    checkState(designation.isName() || designation.isEmpty(), designation);
    return new Node(Token.DECLARATION_PATTERN, type, designation);
  }

  public static Node relationalPattern(String operator, Node expr) {
    checkState(mayBeExpression(expr), expr);
    return Node.newString(Token.RELATIONAL_PATTERN, operator, expr);
  }

  public static Node positionalPattern(Node... subpatterns) {
    for (Node subpattern : subpatterns) {
      checkState(isPattern(subpattern), subpattern);
    }
    return new Node(Token.POSITIONAL_PATTERN, subpatterns);
  }

  public static Node interpolatedString(Node... parts) {
    for (Node part : parts) {
      checkState(part.getToken() == Token.STRING_PART || part.isInterpolation(), part);
    }
    return new Node(Token.INTERPOLATED_STRING, parts);
  }

  public static Node stringPart(String rawText) {
    return Node.newString(Token.STRING_PART, rawText);
  }

  public static Node interpolation(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.INTERPOLATION, expr);
  }

  /**
   * @param alignment The alignment expression, or null
   * @param format The format specifier after the colon, or null
   */
  public static Node interpolation(Node expr, @Nullable Node alignment, @Nullable String format) {
    checkState(mayBeExpression(expr), expr);
    Node[] children = alignment == null ? new Node[] {expr} : new Node[] {expr, alignment};
    return format == null
        ? new Node(Token.INTERPOLATION, children)
        : Node.newString(Token.INTERPOLATION, format, children);
  }

  public static boolean isBinaryOperator(Token token) {
    switch (token) {
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
      case ADD:
      case SUB:
      case MUL:
      case DIV:
      case MOD:
      case AND:
      case OR:
      case COALESCE:
      case BITAND:
      case BITOR:
      case BITXOR:
        return true;
      default:
        return false;
    }
  }

  public static boolean isUnaryOperator(Token token) {
    switch (token) {
      case NOT:
      case NEG:
      case POS:
      case BITNOT:
        return true;
      default:
        return false;
    }
  }

  public static boolean isPattern(Node n) {
    switch (n.getToken()) {
      case DISCARD_PATTERN:
      case CONSTANT_PATTERN:
      case DECLARATION_PATTERN:
      case RELATIONAL_PATTERN:
      case POSITIONAL_PATTERN:
        return true;
      default:
        return false;
    }
  }

  /** Whether the node may be used where type syntax is expected. */
  public static boolean mayBeType(Node n) {
    switch (n.getToken()) {
      case NAME:
      case GENERIC_NAME:
      case PREDEFINED_TYPE:
      case QUALIFIED_NAME:
      case ALIAS_QUALIFIED_NAME:
      case NULLABLE_TYPE:
      case ARRAY_TYPE:
        return true;
      default:
        return false;
    }
  }

  /** Whether the node may be used as an expression. */
  public static boolean mayBeExpression(Node n) {
    if (isBinaryOperator(n.getToken()) || isUnaryOperator(n.getToken())) {
      return true;
    }
    switch (n.getToken()) {
      case NAME:
      case GENERIC_NAME:
      case NUMBER:
      case STRINGLIT:
      case CHARLIT:
      case TRUE:
      case FALSE:
      case NULL:
      case THIS:
      case BASE:
      case GETPROP:
      case GETELEM:
      case CALL:
      case NEW:
      case HOOK:
      case CAST:
      case TYPEOF:
      case DEFAULT:
      case PAREN:
      case LAMBDA:
      case CONDITIONAL_ACCESS:
      case MEMBER_BINDING:
      case ELEMENT_BINDING:
      case SWITCH_EXPR:
      case INTERPOLATED_STRING:
        // Type names are valid receivers: global::Ns.Type.Member, int.MaxValue
      case PREDEFINED_TYPE:
      case QUALIFIED_NAME:
      case ALIAS_QUALIFIED_NAME:
        return true;
      default:
        return false;
    }
  }
}
