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

import com.google.common.collect.ImmutableList;

/**
 * Collects the diagnostics of every body a generator rewrites, and reports them once the run is
 * over.
 */
public interface ErrorManager extends DiagnosticSink {

  /** Writes the collected diagnostics and a summary to an implementation-specific medium. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  /** Errors in report order: by source, line, column and message. */
  ImmutableList<GeneratorError> getErrors();

  /** Warnings in report order. */
  ImmutableList<GeneratorError> getWarnings();

  default boolean hasErrors() {
    return getErrorCount() > 0;
  }
}
