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

import org.jspecify.annotations.Nullable;

/**
 * One line of a struct type declaration: a named field, an embedded type (null name), or a
 * comment-only line (null name and type).
 *
 * @param initializer The value the field was initialized with in the source, kept as a trailing
 *     annotation.
 */
public record Field(
    @Nullable String name,
    @Nullable GoExpr type,
    @Nullable GoExpr initializer,
    @Nullable String comment) {

  public static Field named(String name, GoExpr type, @Nullable GoExpr initializer) {
    return new Field(name, type, initializer, null);
  }

  public static Field embedded(GoExpr type) {
    return new Field(null, type, null, null);
  }

  public static Field commentLine(String comment) {
    return new Field(null, null, null, comment);
  }
}
