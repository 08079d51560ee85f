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

import com.google.common.collect.ImmutableList;
import dev.projectables.semantics.SemanticModel;
import dev.projectables.semantics.TypeSymbol;
import dev.projectables.syntax.Node;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rewrites the expression bodies of projectable members, one body at a time.
 *
 * <p>Diagnostics go to the {@link ErrorManager} shared by all bodies, and are also returned with
 * the body they were raised for. Unsupported syntax that cannot be rewritten at all surfaces as
 * an {@link IllegalStateException}.
 */
public final class ProjectableExpressionGenerator {

  private static final Logger logger =
      Logger.getLogger(ProjectableExpressionGenerator.class.getName());

  private final GeneratorOptions options;
  private final ErrorManager errorManager;

  public ProjectableExpressionGenerator(GeneratorOptions options, ErrorManager errorManager) {
    this.options = checkNotNull(options);
    this.errorManager = checkNotNull(errorManager);
  }

  public GeneratorOptions getOptions() {
    return options;
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /**
   * Rewrites the body of a member declared by {@code targetType}.
   *
   * @param body The expression body, as parsed
   * @param semanticModel The model {@code body} was bound with
   * @param targetType The type declaring the member
   */
  public RewriteResult rewrite(Node body, SemanticModel semanticModel, TypeSymbol targetType) {
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          "Rewriting body of a member of "
              + targetType.toDisplayString()
              + " with null-conditional support "
              + options.getNullConditionalRewriteSupport());
    }
    ImmutableList.Builder<GeneratorError> diagnostics = ImmutableList.builder();
    DiagnosticSink sink =
        error -> {
          diagnostics.add(error);
          errorManager.report(error);
        };
    Node rewritten =
        new ExpressionSyntaxRewriter(targetType, options, semanticModel, sink).rewrite(body);
    RewriteResult result = new RewriteResult(rewritten, diagnostics.build());
    if (!result.success()) {
      logger.fine(() -> "Body of a member of " + targetType + " was reported: " + result);
    }
    return result;
  }
}
