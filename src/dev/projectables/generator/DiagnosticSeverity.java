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

import java.util.logging.Level;

/** How serious a diagnostic is. An error means the body it was raised for must not be emitted. */
public enum DiagnosticSeverity {
  ERROR("error", Level.SEVERE),
  WARNING("warning", Level.WARNING);

  private final String label;
  private final Level logLevel;

  DiagnosticSeverity(String label, Level logLevel) {
    this.label = label;
    this.logLevel = logLevel;
  }

  /** The word compilers print before the diagnostic id, as in {@code error EFP0002}. */
  public String label() {
    return label;
  }

  Level logLevel() {
    return logLevel;
  }
}
