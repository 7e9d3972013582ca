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
 * A node of the read-only syntax tree handed to the translator.
 *
 * <p>Nodes are immutable values. The families are {@link Expr}, {@link Stmt} and {@link Slicer};
 * each family reports a {@code Kind} constant so that consumers can dispatch with an exhaustive
 * {@code switch} expression.
 */
public interface SourceNode {

  /** Where the node starts in the source file. */
  SourcePosition position();
}
