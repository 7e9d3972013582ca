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

import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;

/**
 * A parameter or result of a function signature.
 *
 * @param name Parameter name, or null for an unnamed result.
 * @param type Declared type.
 * @param defaultValue A source-level default value, rendered only as an annotation after the
 *     type.
 */
public record Param(@Nullable String name, GoExpr type, @Nullable GoExpr defaultValue) {
  public Param {
    requireNonNull(type, "type");
  }

  public static Param of(String name, GoExpr type) {
    return new Param(name, type, null);
  }

  public static Param unnamed(GoExpr type) {
    return new Param(null, type, null);
  }
}
