/*
 * Copyright 2026 The Closure Compiler Authors.
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
package com.google.pygor.translate;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An error manager that logs errors and warnings using a logger in addition to collecting them in
 * memory. Errors are logged at the SEVERE level and warnings are logged at the WARNING level.
 */
public class LoggerErrorManager implements ErrorManager {
  private final Logger logger;
  private final List<TranslationError> errors = new ArrayList<>();
  private final List<TranslationError> warnings = new ArrayList<>();

  public LoggerErrorManager(Logger logger) {
    this.logger = logger;
  }

  @Override
  public void report(CheckLevel level, TranslationError error) {
    switch (level) {
      case ERROR:
        errors.add(error);
        logger.severe(error.format(level));
        break;
      case WARNING:
        warnings.add(error);
        logger.warning(error.format(level));
        break;
      case OFF:
        break;
    }
  }

  @Override
  public void generateReport() {
    if (getErrorCount() + getWarningCount() > 0) {
      logger.log(
          getErrorCount() > 0 ? Level.WARNING : Level.INFO,
          "{0} error(s), {1} warning(s)",
          new Object[] {getErrorCount(), getWarningCount()});
    }
  }

  @Override
  public int getErrorCount() {
    return errors.size();
  }

  @Override
  public int getWarningCount() {
    return warnings.size();
  }

  @Override
  public ImmutableList<TranslationError> getErrors() {
    return ImmutableList.copyOf(errors);
  }

  @Override
  public ImmutableList<TranslationError> getWarnings() {
    return ImmutableList.copyOf(warnings);
  }
}
