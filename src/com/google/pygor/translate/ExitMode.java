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

/**
 * How the function being translated leaves its body. Ordered by strength: when a nested block
 * reports its mode to the enclosing one, the stronger mode wins.
 */
public enum ExitMode {
  /** The scope is not inside a function. */
  NOT_A_FUNCTION,
  NO_EXIT_SEEN,
  /** A {@code return} was translated. */
  VALUE_RETURN,
  /** A {@code yield} was translated. */
  GENERATOR_YIELD;

  ExitMode merge(ExitMode other) {
    return other.compareTo(this) > 0 ? other : this;
  }

  /** Whether a function in this mode produces a value. */
  boolean returnsValue() {
    return this == VALUE_RETURN || this == GENERATOR_YIELD;
  }
}
