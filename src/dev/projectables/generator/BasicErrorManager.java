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

import static java.util.Comparator.comparing;
import static java.util.Comparator.naturalOrder;
import static java.util.Comparator.nullsFirst;

import com.google.common.collect.ImmutableList;
import dev.projectables.syntax.Node;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * An error manager that keeps diagnostics in memory and produces no output. Subclasses print
 * them by overriding {@link #println} and {@link #printSummary}.
 *
 * <p>A diagnostic reported twice for the same node is kept once. Diagnostics about different
 * nodes are all kept, even when the nodes come from different bodies with the same text and no
 * source position.
 */
public class BasicErrorManager implements ErrorManager {

  /** Errors before warnings, then by location, then by message. */
  static final Comparator<GeneratorError> REPORT_ORDER =
      comparing(GeneratorError::severity)
          .thenComparing(GeneratorError::sourceName, nullsFirst(naturalOrder()))
          .thenComparingInt(GeneratorError::lineno)
          .thenComparingInt(GeneratorError::charno)
          .thenComparing(GeneratorError::message);

  private final List<GeneratorError> diagnostics = new ArrayList<>();
  private final Set<ReportedDiagnostic> reported = new HashSet<>();

  /** What makes two reports the same diagnostic. Nodes compare by identity. */
  private record ReportedDiagnostic(DiagnosticType type, String message, @Nullable Node node) {}

  @Override
  public void report(GeneratorError error) {
    if (reported.add(new ReportedDiagnostic(error.type(), error.message(), error.node()))) {
      diagnostics.add(error);
    }
  }

  @Override
  public void generateReport() {
    for (GeneratorError error : ImmutableList.sortedCopyOf(REPORT_ORDER, diagnostics)) {
      println(error);
    }
    printSummary();
  }

  /** Prints one diagnostic. Called by {@link #generateReport()} in report order. */
  protected void println(GeneratorError error) {}

  /** Prints the number of errors and warnings. */
  protected void printSummary() {}

  @Override
  public int getErrorCount() {
    return count(DiagnosticSeverity.ERROR);
  }

  @Override
  public int getWarningCount() {
    return count(DiagnosticSeverity.WARNING);
  }

  @Override
  public ImmutableList<GeneratorError> getErrors() {
    return sorted(DiagnosticSeverity.ERROR);
  }

  @Override
  public ImmutableList<GeneratorError> getWarnings() {
    return sorted(DiagnosticSeverity.WARNING);
  }

  private int count(DiagnosticSeverity severity) {
    int count = 0;
    for (GeneratorError error : diagnostics) {
      if (error.severity() == severity) {
        count++;
      }
    }
    return count;
  }

  private ImmutableList<GeneratorError> sorted(DiagnosticSeverity severity) {
    List<GeneratorError> matching = new ArrayList<>();
    for (GeneratorError error : diagnostics) {
      if (error.severity() == severity) {
        matching.add(error);
      }
    }
    return ImmutableList.sortedCopyOf(REPORT_ORDER, matching);
  }
}
