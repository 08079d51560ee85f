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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import dev.projectables.semantics.InvocationOperation;
import dev.projectables.semantics.MemberReferenceOperation;
import dev.projectables.semantics.MemberSymbol;
import dev.projectables.semantics.Operation;
import dev.projectables.semantics.OperationInstance;
import dev.projectables.semantics.SemanticModel;
import dev.projectables.semantics.Symbol;
import dev.projectables.semantics.SymbolKind;
import dev.projectables.semantics.TypeSymbol;
import dev.projectables.syntax.IR;
import dev.projectables.syntax.Node;
import dev.projectables.syntax.Token;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites the body of a member of a target type into an expression that stands on its own,
 * outside of the type.
 *
 * <ul>
 *   <li>{@code this} and {@code base} become the explicit receiver parameter, {@code @this}.
 *   <li>Instance members referenced without a receiver are qualified with {@code @this}, static
 *       ones with the fully qualified target type.
 *   <li>Type names are fully qualified.
 *   <li>Extension method calls become static calls on the declaring type.
 *   <li>Nullable annotations on reference types are dropped.
 *   <li>Null-conditional accesses are reported, flattened to plain accesses or expanded to a null
 *       check, depending on {@link NullConditionalRewriteSupport}.
 *   <li>Switch expressions become nested conditional expressions.
 *   <li>Interpolation holes are parenthesized.
 * </ul>
 *
 * <p>The semantic model is asked only about nodes of the original tree. An instance rewrites a
 * single expression body.
 */
public final class ExpressionSyntaxRewriter extends AbstractSyntaxRewriter {

  private static final Logger logger = Logger.getLogger(ExpressionSyntaxRewriter.class.getName());

  private final TypeSymbol targetType;
  private final NullConditionalRewriteSupport nullConditionalRewriteSupport;
  private final String thisParameterName;
  private final SemanticModel semanticModel;
  private final DiagnosticSink diagnostics;

  /**
   * Rewritten targets of the enclosing null-conditional accesses, waiting for the member or
   * element binding that applies to them.
   */
  private final Deque<Node> conditionalAccessTargets = new ArrayDeque<>();

  private boolean used;

  public ExpressionSyntaxRewriter(
      TypeSymbol targetType,
      GeneratorOptions options,
      SemanticModel semanticModel,
      DiagnosticSink diagnostics) {
    this.targetType = checkNotNull(targetType);
    this.nullConditionalRewriteSupport = options.getNullConditionalRewriteSupport();
    this.thisParameterName = options.getThisParameterName();
    this.semanticModel = checkNotNull(semanticModel);
    this.diagnostics = checkNotNull(diagnostics);
  }

  /**
   * Returns the rewritten form of an expression body. Parts that need no rewriting are shared
   * with {@code body}, and {@code body} itself is returned when nothing changes.
   *
   * @throws IllegalStateException if the body contains a switch expression arm that cannot be
   *     turned into a conditional expression
   */
  public Node rewrite(Node body) {
    checkState(!used, "An ExpressionSyntaxRewriter rewrites a single expression body");
    used = true;
    return visit(body);
  }

  @Override
  protected Node transform(Node n) {
    switch (n.getToken()) {
      case THIS:
      case BASE:
        return IR.name(thisParameterName).withTriviaFrom(n);
      case NAME:
        return visitName(n);
      case QUALIFIED_NAME:
        return visitQualifiedName(n);
      case ALIAS_QUALIFIED_NAME:
        // Already fully qualified.
        return n;
      case GETPROP:
        return visitGetProp(n);
      case CALL:
        return visitCall(n);
      case NULLABLE_TYPE:
        return visitNullableType(n);
      case INTERPOLATION:
        return visitInterpolation(n);
      case CONDITIONAL_ACCESS:
        return visitConditionalAccess(n);
      case MEMBER_BINDING:
        return visitMemberBinding(n);
      case ELEMENT_BINDING:
        return visitElementBinding(n);
      case SWITCH_EXPR:
        return visitSwitchExpr(n);
      default:
        return visitChildren(n);
    }
  }

  private Node visitName(Node n) {
    Symbol symbol = semanticModel.getSymbol(n);
    if (symbol == null) {
      return n;
    }
    Node parent = getParent();

    // For the callee of an invocation, the invocation carries the operation.
    Operation operation =
        parent != null && parent.isCall() && parent.getFirstChild() == n
            ? semanticModel.getOperation(parent)
            : semanticModel.getOperation(n);
    if (operation instanceof InvocationOperation
        || (operation instanceof MemberReferenceOperation && !isObjectInitializerTarget(n))) {
      Node qualified = qualifyImplicitMember(n, operation);
      if (qualified != null) {
        return qualified;
      }
    }

    if (symbol instanceof TypeSymbol
        && (parent == null || !parent.isQualifiedName())) {
      return AstFactory.createTypeName((TypeSymbol) symbol).withTriviaFrom(n);
    }
    return n;
  }

  /** Whether {@code n} names the member assigned by an object initializer entry. */
  private boolean isObjectInitializerTarget(Node n) {
    Node parent = getParent();
    Node grandparent = getGrandparent();
    return parent != null
        && parent.isAssign()
        && parent.getFirstChild() == n
        && grandparent != null
        && grandparent.isObjectInitializer();
  }

  /**
   * Qualifies a member of the target type referenced without a receiver, or returns null when
   * the member is not one.
   */
  private @Nullable Node qualifyImplicitMember(Node n, Operation operation) {
    OperationInstance instance = operation.getInstance();
    Node receiver;
    if (instance != null) {
      if (!instance.isImplicit() || !instance.type().equals(targetType)) {
        return null;
      }
      receiver = IR.name(thisParameterName);
    } else if (operation.getMember().getContainingType().equals(targetType)) {
      receiver = AstFactory.createTypeName(targetType);
    } else {
      return null;
    }
    return IR.getprop(receiver, n.withoutLeadingTrivia()).withLeadingTrivia(n.getLeadingTrivia());
  }

  private Node visitQualifiedName(Node n) {
    Symbol symbol = semanticModel.getSymbol(n);
    if (symbol != null && symbol.getKind() == SymbolKind.NAMED_TYPE) {
      TypeSymbol type = semanticModel.getType(n);
      if (type != null) {
        return AstFactory.createTypeName(type).withTriviaFrom(n);
      }
    }
    return visitChildren(n);
  }

  private Node visitGetProp(Node n) {
    Node target = visit(n.getFirstChild());
    Node name = n.getLastChild();
    Node rewrittenName = visit(name);
    if (!rewrittenName.isSimpleName()) {
      // The name resolved to a type that got qualified. The receiver already says where it comes
      // from. Keyword types, as in System.String.Empty, keep the name as written.
      Node rightmost = NodeUtil.getRightmostName(rewrittenName);
      rewrittenName = rightmost.isSimpleName() ? rightmost.withTriviaFrom(name) : name;
    }
    return n.withChildren(ImmutableList.of(target, rewrittenName));
  }

  private Node visitCall(Node n) {
    Node callee = n.getFirstChild();
    Symbol symbol = callee.isGetProp() ? semanticModel.getSymbol(n) : null;
    if (symbol instanceof MemberSymbol && ((MemberSymbol) symbol).isExtensionMethod()) {
      // receiver.Method(args) becomes global::Ns.Extensions.Method(receiver, args).
      MemberSymbol method = (MemberSymbol) symbol;
      Node receiver = visit(callee.getFirstChild());
      Node argList = visit(n.getLastChild());
      ImmutableList<Node> args =
          ImmutableList.<Node>builder().add(receiver).addAll(argList.children()).build();
      Node staticCallee =
          IR.getprop(
              AstFactory.createTypeName(method.getContainingType()), callee.getLastChild());
      return IR.call(staticCallee, IR.argList(args).withTriviaFrom(argList)).withTriviaFrom(n);
    }
    return visitChildren(n);
  }

  private Node visitNullableType(Node n) {
    TypeSymbol type = semanticModel.getType(n);
    if (type != null && !type.isValueType()) {
      // string? and friends: the annotation means nothing in an expression tree.
      return visit(n.getOnlyChild()).withTriviaFrom(n);
    }
    return visitChildren(n);
  }

  private Node visitInterpolation(Node n) {
    Node rewritten = visitChildren(n);
    Node expr = rewritten.getFirstChild();
    if (expr.isParen()) {
      return rewritten;
    }
    return rewritten.withChildAtIndex(0, IR.paren(expr));
  }

  private Node visitConditionalAccess(Node n) {
    // Visiting the target may consume the binding of an enclosing access.
    Node target = visit(n.getFirstChild());
    int depth = conditionalAccessTargets.size();
    Node whenNotNull = n.getLastChild();
    conditionalAccessTargets.push(target);

    switch (nullConditionalRewriteSupport) {
      case NONE:
        conditionalAccessTargets.pop();
        diagnostics.report(
            GeneratorError.at(
                n,
                ProjectableDiagnostics.NULL_CONDITIONAL_REWRITE_UNSUPPORTED,
                CodePrinter.toSource(n).trim()));
        return n;
      case IGNORE:
        {
          Node result = visit(whenNotNull);
          checkBindingConsumed(n, depth);
          return result;
        }
      case REWRITE:
        {
          TypeSymbol convertedType = semanticModel.getConvertedType(n);
          if (convertedType == null) {
            logger.fine(
                () -> "Leaving " + CodePrinter.toSource(n).trim() + " as is: its type is unknown");
            conditionalAccessTargets.pop();
            break;
          }
          Node rewrittenWhenNotNull = visit(whenNotNull);
          checkBindingConsumed(n, depth);
          return IR.paren(
                  IR.hook(
                      AstFactory.createNotNullCheck(target.withoutTrailingTrivia()),
                      IR.paren(rewrittenWhenNotNull),
                      AstFactory.createTypedNull(convertedType)))
              .withTriviaFrom(n);
        }
    }
    return n.withChildren(ImmutableList.of(target, visit(whenNotNull)));
  }

  private void checkBindingConsumed(Node conditionalAccess, int depth) {
    checkState(
        conditionalAccessTargets.size() == depth,
        "No member or element binding applied to the target of %s",
        conditionalAccess);
  }

  private Node visitMemberBinding(Node n) {
    if (conditionalAccessTargets.isEmpty()) {
      return visitChildren(n);
    }
    return IR.getprop(conditionalAccessTargets.pop(), n.getOnlyChild()).withTriviaFrom(n);
  }

  private Node visitElementBinding(Node n) {
    if (conditionalAccessTargets.isEmpty()) {
      return visitChildren(n);
    }
    Node target = conditionalAccessTargets.pop();
    return IR.getelem(target, visit(n.getOnlyChild())).withTriviaFrom(n);
  }

  /**
   * Folds the arms of a switch expression, last to first, into nested conditional expressions.
   * A trailing discard arm is the innermost fallback; without one the fallback is {@code null}.
   */
  private Node visitSwitchExpr(Node n) {
    Node governing = visit(n.getFirstChild());
    ImmutableList<Node> arms = n.children().subList(1, n.getChildCount());

    @Nullable Node result = null;
    for (Node arm : arms.reverse()) {
      Node pattern = arm.getFirstChild();
      Node armResult = visit(arm.getLastChild());
      if (pattern.isDiscardPattern()) {
        // Matches anything: the arms after it can never be reached.
        result = armResult;
        continue;
      }
      if (result == null) {
        result = IR.nullNode();
      }

      Node when = NodeUtil.getWhenCondition(arm);
      @Nullable Node rewrittenWhen = when == null ? null : visit(when);
      Node condition;
      switch (pattern.getToken()) {
        case CONSTANT_PATTERN:
          condition = IR.paren(IR.eq(governing, visit(pattern.getOnlyChild())));
          if (rewrittenWhen != null) {
            condition = IR.paren(IR.and(condition, rewrittenWhen));
          }
          break;
        case DECLARATION_PATTERN:
          {
            Node type = visit(pattern.getFirstChild());
            Node designation = pattern.getLastChild();
            if (designation.isName()) {
              Node cast =
                  IR.paren(IR.cast(type, governing.isParen() ? governing : IR.paren(governing)));
              VariableReplacementRewriter replacer =
                  new VariableReplacementRewriter(designation.getString(), cast);
              armResult = replacer.replace(armResult);
              if (rewrittenWhen != null) {
                rewrittenWhen = replacer.replace(rewrittenWhen);
              }
            }
            Node typeCheck = IR.eq(IR.call(IR.getprop(governing, "GetType")), IR.typeOf(type));
            condition =
                IR.paren(rewrittenWhen == null ? typeCheck : IR.and(typeCheck, rewrittenWhen));
            break;
          }
        default:
          throw new IllegalStateException(
              "Switch expressions rewriting supports only constant values and declaration"
                  + " patterns (Type var). Unsupported pattern: "
                  + pattern.getToken());
      }
      result = IR.hook(condition, armResult, result.isHook() ? IR.paren(result) : result);
    }
    return result.withTriviaFrom(n);
  }
}
