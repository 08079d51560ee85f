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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An immutable node of an expression syntax tree.
 *
 * <p>Nodes are never edited in place. Every "modification" returns a new node that shares the
 * untouched children with the original one. Equality is identity: two nodes built from the same
 * text are still different nodes, which is what lets a {@code SemanticModel} key its answers by
 * node.
 *
 * <p>Trivia is the whitespace the node was written with, kept verbatim so that a rewritten tree
 * prints with the formatting of the source around the replaced parts.
 */
public final class Node {

  private final Token token;
  private final @Nullable String string;
  private final ImmutableList<Node> children;
  private final String leadingTrivia;
  private final String trailingTrivia;
  private final @Nullable SourcePosition position;

  private Node(
      Token token,
      @Nullable String string,
      ImmutableList<Node> children,
      String leadingTrivia,
      String trailingTrivia,
      @Nullable SourcePosition position) {
    this.token = checkNotNull(token);
    this.string = string;
    this.children = children;
    this.leadingTrivia = checkNotNull(leadingTrivia);
    this.trailingTrivia = checkNotNull(trailingTrivia);
    this.position = position;
  }

  public Node(Token token, Node... children) {
    this(token, null, ImmutableList.copyOf(children), "", "", null);
  }

  public Node(Token token, List<Node> children) {
    this(token, null, ImmutableList.copyOf(children), "", "", null);
  }

  public static Node newString(Token token, String str) {
    return new Node(token, checkNotNull(str), ImmutableList.of(), "", "", null);
  }

  public static Node newString(Token token, String str, Node... children) {
    return new Node(token, checkNotNull(str), ImmutableList.copyOf(children), "", "", null);
  }

  public Token getToken() {
    return token;
  }

  public boolean hasString() {
    return string != null;
  }

  public String getString() {
    checkState(string != null, "%s has no string", token);
    return string;
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public int getChildCount() {
    return children.size();
  }

  public ImmutableList<Node> children() {
    return children;
  }

  public Node getChildAtIndex(int i) {
    return children.get(i);
  }

  public Node getFirstChild() {
    checkState(!children.isEmpty(), "%s has no children", token);
    return children.get(0);
  }

  public Node getSecondChild() {
    checkState(children.size() > 1, "%s has less than two children", token);
    return children.get(1);
  }

  public Node getLastChild() {
    checkState(!children.isEmpty(), "%s has no children", token);
    return children.get(children.size() - 1);
  }

  public Node getOnlyChild() {
    checkState(children.size() == 1, "%s does not have exactly one child", token);
    return children.get(0);
  }

  public String getLeadingTrivia() {
    return leadingTrivia;
  }

  public String getTrailingTrivia() {
    return trailingTrivia;
  }

  public @Nullable SourcePosition getSourcePosition() {
    return position;
  }

  public @Nullable String getSourceFileName() {
    return position == null ? null : position.sourceName();
  }

  public int getLineno() {
    return position == null ? -1 : position.lineno();
  }

  public int getCharno() {
    return position == null ? -1 : position.charno();
  }

  public int getLength() {
    return position == null ? 0 : position.length();
  }

  /**
   * Returns a node with the given children in place of this node's ones. Returns this node when
   * every new child is the same instance as the old one.
   */
  public Node withChildren(List<Node> newChildren) {
    if (newChildren.size() == children.size()) {
      boolean same = true;
      for (int i = 0; i < newChildren.size(); i++) {
        if (newChildren.get(i) != children.get(i)) {
          same = false;
          break;
        }
      }
      if (same) {
        return this;
      }
    }
    return new Node(
        token, string, ImmutableList.copyOf(newChildren), leadingTrivia, trailingTrivia, position);
  }

  public Node withChildAtIndex(int i, Node child) {
    checkArgument(i >= 0 && i < children.size(), "Bad child index %s for %s", i, token);
    if (children.get(i) == child) {
      return this;
    }
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (int j = 0; j < children.size(); j++) {
      builder.add(j == i ? child : children.get(j));
    }
    return new Node(token, string, builder.build(), leadingTrivia, trailingTrivia, position);
  }

  public Node withLeadingTrivia(String trivia) {
    if (trivia.equals(leadingTrivia)) {
      return this;
    }
    return new Node(token, string, children, trivia, trailingTrivia, position);
  }

  public Node withTrailingTrivia(String trivia) {
    if (trivia.equals(trailingTrivia)) {
      return this;
    }
    return new Node(token, string, children, leadingTrivia, trivia, position);
  }

  public Node withoutLeadingTrivia() {
    return withLeadingTrivia("");
  }

  public Node withoutTrailingTrivia() {
    return withTrailingTrivia("");
  }

  /** Copies both the leading and the trailing trivia of {@code other} onto a new node. */
  public Node withTriviaFrom(Node other) {
    return withLeadingTrivia(other.leadingTrivia).withTrailingTrivia(other.trailingTrivia);
  }

  public Node withSourcePosition(@Nullable SourcePosition position) {
    return new Node(token, string, children, leadingTrivia, trailingTrivia, position);
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isGenericName() {
    return token == Token.GENERIC_NAME;
  }

  /** Whether this is a simple name, with or without type arguments. */
  public boolean isSimpleName() {
    return token == Token.NAME || token == Token.GENERIC_NAME;
  }

  public boolean isThis() {
    return token == Token.THIS;
  }

  public boolean isBase() {
    return token == Token.BASE;
  }

  public boolean isNull() {
    return token == Token.NULL;
  }

  public boolean isGetProp() {
    return token == Token.GETPROP;
  }

  public boolean isCall() {
    return token == Token.CALL;
  }

  public boolean isArgList() {
    return token == Token.ARG_LIST;
  }

  public boolean isAssign() {
    return token == Token.ASSIGN;
  }

  public boolean isObjectInitializer() {
    return token == Token.OBJECT_INITIALIZER;
  }

  public boolean isHook() {
    return token == Token.HOOK;
  }

  public boolean isParen() {
    return token == Token.PAREN;
  }

  public boolean isLambda() {
    return token == Token.LAMBDA;
  }

  public boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public boolean isConditionalAccess() {
    return token == Token.CONDITIONAL_ACCESS;
  }

  public boolean isMemberBinding() {
    return token == Token.MEMBER_BINDING;
  }

  public boolean isElementBinding() {
    return token == Token.ELEMENT_BINDING;
  }

  public boolean isSwitchExpr() {
    return token == Token.SWITCH_EXPR;
  }

  public boolean isSwitchArm() {
    return token == Token.SWITCH_ARM;
  }

  public boolean isInterpolation() {
    return token == Token.INTERPOLATION;
  }

  public boolean isQualifiedName() {
    return token == Token.QUALIFIED_NAME;
  }

  public boolean isAliasQualifiedName() {
    return token == Token.ALIAS_QUALIFIED_NAME;
  }

  public boolean isNullableType() {
    return token == Token.NULLABLE_TYPE;
  }

  public boolean isDiscardPattern() {
    return token == Token.DISCARD_PATTERN;
  }

  public boolean isConstantPattern() {
    return token == Token.CONSTANT_PATTERN;
  }

  public boolean isDeclarationPattern() {
    return token == Token.DECLARATION_PATTERN;
  }

  public boolean isEmpty() {
    return token == Token.EMPTY;
  }

  @Override
  public String toString() {
    return string == null ? token.toString() : token + " " + string;
  }

  /** Returns a multi-line dump of this subtree, one node per line. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    sb.append(this);
    if (position != null) {
      sb.append(' ').append(position.lineno()).append(':').append(position.charno());
    }
    sb.append('\n');
    for (Node child : children) {
      child.appendStringTree(sb, level + 1);
    }
  }
}
