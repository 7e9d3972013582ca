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

/** The error reporting interface of the translator. */
public interface ErrorManager {

  /**
   * Reports an error. The level at which the error is reported may differ from the type's
   * default level.
   */
  void report(CheckLevel level, TranslationError error);

  /** Writes a summary of the reported diagnostics. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  ImmutableList<TranslationError> getErrors();

  ImmutableList<TranslationError> getWarnings();
}
