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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Maps source identifiers that would collide with a keyword, a predeclared type or a runtime
 * name of the output language to a disambiguated identifier. Every identifier the translator
 * emits goes through {@link #rename}.
 */
public final class RenameTable {
  /** Appended to an identifier to move it out of the way of a reserved one. */
  public static final String SUFFIX = "\u03a0";

  private static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "case", "chan", "const", "default", "defer", "fallthrough", "func", "go", "goto",
          "interface", "map", "package", "range", "select", "struct", "switch", "type", "var");

  /** Names the runtime package or the output language already claims. */
  private static final ImmutableSet<String> RESERVED =
      ImmutableSet.of(
          "Any", "Dict", "List", "Tuple", "fmt", "nil", "error", "Assert", "Contains",
          "PyException", "RaisedException");

  private static final ImmutableMap<String, String> TABLE = buildTable();

  private RenameTable() {}

  private static ImmutableMap<String, String> buildTable() {
    ImmutableMap.Builder<String, String> table = ImmutableMap.builder();
    table.put("str", "string");
    table.put("float", "float64");
    table.put("complex", "complex128");
    table.put("dict", "Dict");
    table.put("list", "List");
    table.put("tuple", "Tuple");
    for (String name : RESERVED) {
      table.put(name, name + SUFFIX);
    }
    for (String keyword : KEYWORDS) {
      table.put(keyword, keyword + SUFFIX);
    }
    return table.buildOrThrow();
  }

  /** Returns the identifier to emit for {@code name}. */
  public static String rename(String name) {
    return TABLE.getOrDefault(name, name);
  }

  public static boolean isRenamed(String name) {
    return TABLE.containsKey(name);
  }

  /** The full mapping. */
  public static ImmutableMap<String, String> entries() {
    return TABLE;
  }
}
