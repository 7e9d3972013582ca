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
package com.google.pygor.ast;

/**
 * Location of a node in the source file.
 *
 * @param line One-indexed line number, or -1 if unknown.
 * @param column Zero-indexed column offset, or -1 if unknown.
 */
public record SourcePosition(int line, int column) {

  public static final SourcePosition UNKNOWN = new SourcePosition(-1, -1);

  public static SourcePosition of(int line, int column) {
    return new SourcePosition(line, column);
  }

  public boolean isKnown() {
    return line >= 0;
  }

  @Override
  public String toString() {
    return "line " + line + ", col " + column;
  }
}
