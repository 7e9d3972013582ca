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
package com.google.pygor.gen;

import java.util.regex.Pattern;

/**
 * Abstracted consumer of the CodeGenerator output.
 *
 * @see CodeGenerator
 * @see CodePrinter
 */
abstract class CodeConsumer {
  private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

  /**
   * Appends a string to the code.
   *
   * <p>Do not directly append newlines with this method. Instead use {@link #startNewLine} or
   * {@link #endStatement}.
   */
  abstract void append(String str);

  void add(String str) {
    append(str);
  }

  void addIdentifier(String identifier) {
    if (!isValidIdentifier(identifier)) {
      throw new RenderException("invalid identifier \"" + identifier + "\"");
    }
    append(identifier);
  }

  static boolean isValidIdentifier(String identifier) {
    return IDENTIFIER.matcher(identifier).matches();
  }

  /** Ends the current line without ending a statement, as after a case label. */
  abstract void startNewLine();

  void endStatement() {
    startNewLine();
  }

  void increaseIndent() {}

  void decreaseIndent() {}

  void beginBlock() {
    append("{");
    startNewLine();
    increaseIndent();
  }

  void endBlock() {
    decreaseIndent();
    append("}");
  }

  void listSeparator() {
    append(", ");
  }

  /** Appends a comment running to the end of the line. */
  abstract void addLineComment(String text);

  void addBlockComment(String text) {
    append("/*" + text.replace("*/", "* /").replace('\n', ' ') + "*/");
  }
}
