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

import dev.projectables.syntax.Node;
import dev.projectables.syntax.SourcePosition;
import org.jspecify.annotations.Nullable;

/**
 * A diagnostic raised while rewriting an expression body.
 *
 * @param type The kind of diagnostic
 * @param message The formatted message
 * @param node The node the diagnostic is about, or null when it concerns no particular node
 */
public record GeneratorError(DiagnosticType type, String message, @Nullable Node node) {
  public GeneratorError {
    checkNotNull(type, "type");
    checkNotNull(message, "message");
  }

  /** Creates a diagnostic that is not tied to a location. */
  public static GeneratorError of(DiagnosticType type, Object... arguments) {
    return new GeneratorError(type, type.formatMessage(arguments), null);
  }

  /** Creates a diagnostic located at {@code n}. */
  public static GeneratorError at(Node n, DiagnosticType type, Object... arguments) {
    return new GeneratorError(type, type.formatMessage(arguments), n);
  }

  public DiagnosticSeverity severity() {
    return type.severity();
  }

  public @Nullable SourcePosition position() {
    return node == null ? null : node.getSourcePosition();
  }

  public @Nullable String sourceName() {
    SourcePosition position = position();
    return position == null ? null : position.sourceName();
  }

  /** One-indexed line, or -1 when the location is unknown. */
  public int lineno() {
    SourcePosition position = position();
    return position == null ? -1 : position.lineno();
  }

  /** Zero-indexed column, or -1 when the location is unknown. */
  public int charno() {
    SourcePosition position = position();
    return position == null ? -1 : position.charno();
  }

  public int length() {
    SourcePosition position = position();
    return position == null ? 0 : position.length();
  }

  /**
   * Formats the diagnostic the way C# compilers print them, {@code Order.cs(3,9): error EFP0002:
   * message}, with a one-indexed column. The location prefix is left out when it is unknown.
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    SourcePosition position = position();
    if (position != null) {
      sb.append(position.sourceName() == null ? "(unknown source)" : position.sourceName())
          .append('(')
          .append(position.lineno())
          .append(',')
          .append(position.charno() + 1)
          .append("): ");
    }
    return sb.append(severity().label())
        .append(' ')
        .append(type.id())
        .append(": ")
        .append(message)
        .toString();
  }
}
