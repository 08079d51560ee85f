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
import dev.projectables.syntax.Node;

/**
 * The outcome of rewriting one expression body.
 *
 * @param expression The rewritten expression. When a null-conditional access was reported, the
 *     reported part is left as written.
 * @param diagnostics The errors and warnings reported while rewriting this body, in report order
 */
public record RewriteResult(Node expression, ImmutableList<GeneratorError> diagnostics) {
  public RewriteResult {
    checkNotNull(expression, "expression");
    checkNotNull(diagnostics, "diagnostics");
  }

  /** Whether no error was reported, so that {@link #expression} can be emitted. */
  public boolean success() {
    for (GeneratorError diagnostic : diagnostics) {
      if (diagnostic.severity() == DiagnosticSeverity.ERROR) {
        return false;
      }
    }
    return true;
  }
}
