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

import static java.util.Objects.requireNonNull;

import com.google.pygor.ast.SourcePosition;
import java.io.Serializable;

/**
 * Translation error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source file.
 * @param lineno One-indexed line number of the error location, or -1.
 * @param charno Zero-indexed column of the error location, or -1.
 */
public record TranslationError(
    DiagnosticType type, String description, String sourceName, int lineno, int charno)
    implements Serializable {
  public TranslationError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(sourceName, "sourceName");
  }

  /**
   * Creates a TranslationError at a given source location
   *
   * @param sourceName The source file name
   * @param position Position of the offending node
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static TranslationError make(
      String sourceName, SourcePosition position, DiagnosticType type, String... arguments) {
    return new TranslationError(
        type, type.format(arguments), sourceName, position.line(), position.column());
  }

  public CheckLevel getDefaultLevel() {
    return type.level;
  }

  /** Formats as {@code source:line:col: LEVEL - [KEY] description}. */
  public String format(CheckLevel level) {
    StringBuilder sb = new StringBuilder(sourceName);
    if (lineno >= 0) {
      sb.append(':').append(lineno);
      if (charno >= 0) {
        sb.append(':').append(charno);
      }
    }
    return sb.append(": ")
        .append(level)
        .append(" - [")
        .append(type.key)
        .append("] ")
        .append(description)
        .toString();
  }

  @Override
  public String toString() {
    return format(type.level);
  }
}
