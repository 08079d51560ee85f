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

/** Diagnostics reported while rewriting projectable expression bodies. */
public final class ProjectableDiagnostics {

  public static final DiagnosticType NULL_CONDITIONAL_REWRITE_UNSUPPORTED =
      DiagnosticType.error(
          "EFP0002",
          "{0} contains a null-conditional expression, which is not supported in an expression"
              + " tree. Set NullConditionalRewriteSupport to IGNORE or REWRITE to allow it.");

  private ProjectableDiagnostics() {}
}
