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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.text.MessageFormat;

/**
 * A kind of diagnostic the generator can raise.
 *
 * @param id The stable diagnostic id, such as {@code EFP0002}
 * @param severity The severity every diagnostic of this kind is reported with
 * @param messageFormat A {@link MessageFormat} pattern for the message
 */
public record DiagnosticType(String id, DiagnosticSeverity severity, String messageFormat) {
  public DiagnosticType {
    checkArgument(!id.isEmpty(), "A diagnostic needs an id");
    checkNotNull(severity, "severity");
    checkNotNull(messageFormat, "messageFormat");
  }

  public static DiagnosticType error(String id, String messageFormat) {
    return new DiagnosticType(id, DiagnosticSeverity.ERROR, messageFormat);
  }

  String formatMessage(Object... arguments) {
    return MessageFormat.format(messageFormat, arguments);
  }
}
