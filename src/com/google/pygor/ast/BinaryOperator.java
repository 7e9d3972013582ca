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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/** Arithmetic and bitwise binary operators. */
public enum BinaryOperator {
  ADD("Add"),
  SUB("Sub"),
  MULT("Mult"),
  MAT_MULT("MatMult"),
  DIV("Div"),
  MOD("Mod"),
  POW("Pow"),
  LSHIFT("LShift"),
  RSHIFT("RShift"),
  BIT_OR("BitOr"),
  BIT_XOR("BitXor"),
  BIT_AND("BitAnd"),
  FLOOR_DIV("FloorDiv");

  private static final ImmutableMap<String, BinaryOperator> BY_NODE_NAME =
      Maps.uniqueIndex(Arrays.asList(values()), op -> op.nodeName);

  private final String nodeName;

  BinaryOperator(String nodeName) {
    this.nodeName = nodeName;
  }

  /** The node class name the parser uses for this operator. */
  public String getNodeName() {
    return nodeName;
  }

  /** Returns the operator for a parser node class name, or null if there is none. */
  public static @Nullable BinaryOperator fromNodeName(String nodeName) {
    return BY_NODE_NAME.get(nodeName);
  }
}
