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

import static com.google.common.base.Preconditions.checkNotNull;

import dev.projectables.syntax.IR;
import dev.projectables.syntax.Node;

/**
 * Replaces every reference to a local variable with an expression, whether the variable is used
 * bare or as the receiver of a member access.
 *
 * <p>Matching is by name. Member names, object initializer targets and type syntax are never
 * replaced, and neither is anything inside a lambda that declares a parameter of the same name.
 */
final class VariableReplacementRewriter extends AbstractSyntaxRewriter {

  private final String variableName;
  private final Node replacement;

  VariableReplacementRewriter(String variableName, Node replacement) {
    this.variableName = checkNotNull(variableName);
    this.replacement = checkNotNull(replacement);
  }

  /** Returns {@code n} with the variable replaced. */
  Node replace(Node n) {
    return visit(n);
  }

  @Override
  protected Node transform(Node n) {
    switch (n.getToken()) {
      case NAME:
        return isVariable(n) ? replacement.withTriviaFrom(n) : n;
      case GETPROP:
        {
          Node target = n.getFirstChild();
          if (isVariable(target)) {
            return IR.getprop(replacement.withTriviaFrom(target), n.getLastChild())
                .withTriviaFrom(n);
          }
          return n.withChildAtIndex(0, visit(target));
        }
      case ASSIGN:
      case CAST:
        return n.withChildAtIndex(1, visit(n.getSecondChild()));
      case NEW:
        {
          Node result = n;
          for (int i = 1; i < n.getChildCount(); i++) {
            result = result.withChildAtIndex(i, visit(n.getChildAtIndex(i)));
          }
          return result;
        }
      case MEMBER_BINDING:
      case GENERIC_NAME:
      case QUALIFIED_NAME:
      case ALIAS_QUALIFIED_NAME:
      case NULLABLE_TYPE:
      case ARRAY_TYPE:
      case TYPEOF:
      case DEFAULT:
      case PARAM_LIST:
      case DECLARATION_PATTERN:
        return n;
      case LAMBDA:
        return declaresVariable(n.getFirstChild()) ? n : visitChildren(n);
      default:
        return visitChildren(n);
    }
  }

  private boolean isVariable(Node n) {
    return n.isName() && n.getString().equals(variableName);
  }

  private boolean declaresVariable(Node paramList) {
    for (Node param : paramList.children()) {
      if (param.getString().equals(variableName)) {
        return true;
      }
    }
    return false;
  }
}
