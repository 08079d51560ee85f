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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes diagnostics to a {@link Logger}, one record per diagnostic in compiler format, errors
 * at {@link Level#SEVERE} and warnings at {@link Level#WARNING}.
 */
public class LoggerErrorManager extends BasicErrorManager {

  private final Logger logger;

  public LoggerErrorManager(Logger logger) {
    this.logger = checkNotNull(logger);
  }

  @Override
  protected void println(GeneratorError error) {
    logger.log(error.severity().logLevel(), error.toString());
  }

  @Override
  protected void printSummary() {
    int errors = getErrorCount();
    int warnings = getWarningCount();
    logger.log(
        errors + warnings == 0 ? Level.INFO : Level.WARNING,
        "Projectable generation finished with {0} error(s) and {1} warning(s)",
        new Object[] {errors, warnings});
  }
}
