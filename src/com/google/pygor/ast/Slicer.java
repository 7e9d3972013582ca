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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** The part of a subscript between the brackets. */
public interface Slicer extends SourceNode {

  enum Kind {
    INDEX,
    SLICE,
    EXT_SLICE
  }

  Kind kind();

  /** {@code x[value]} */
  record Index(Expr value, SourcePosition position) implements Slicer {
    @Override
    public Kind kind() {
      return Kind.INDEX;
    }
  }

  /** {@code x[lower:upper:step]}, each bound optional. */
  record Slice(
      @Nullable Expr lower, @Nullable Expr upper, @Nullable Expr step, SourcePosition position)
      implements Slicer {
    @Override
    public Kind kind() {
      return Kind.SLICE;
    }
  }

  /** A multi-axis subscript, {@code x[a:b, c]}. */
  record ExtSlice(ImmutableList<Slicer> dims, SourcePosition position) implements Slicer {
    @Override
    public Kind kind() {
      return Kind.EXT_SLICE;
    }
  }
}
