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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** Expression nodes. */
public interface Expr extends SourceNode {

  /** One constant per expression variant. */
  enum Kind {
    NUM,
    STR,
    BYTES,
    NAME_CONSTANT,
    NAME,
    ATTRIBUTE,
    SUBSCRIPT,
    CALL,
    UNARY_OP,
    BIN_OP,
    BOOL_OP,
    COMPARE,
    TUPLE,
    LIST,
    DICT,
    LAMBDA,
    IF_EXP,
    LIST_COMP,
    DICT_COMP,
    GENERATOR_EXP,
    STARRED,
    UNKNOWN
  }

  Kind kind();

  /** The three singleton constants. */
  enum Singleton {
    NONE,
    TRUE,
    FALSE
  }

  /**
   * A number literal. {@code text} is the literal as written; complex literals keep their {@code
   * j} suffix.
   */
  record Num(NumberKind numberKind, String text, SourcePosition position) implements Expr {
    public Num {
      requireNonNull(numberKind, "numberKind");
      Preconditions.checkArgument(!text.isEmpty(), "empty number literal");
    }

    @Override
    public Kind kind() {
      return Kind.NUM;
    }

    /** Whether the literal is written with a leading minus sign. */
    public boolean isNegative() {
      return text.startsWith("-");
    }
  }

  record Str(String value, SourcePosition position) implements Expr {
    @Override
    public Kind kind() {
      return Kind.STR;
    }
  }

  record Bytes(String value, SourcePosition position) implements Expr {
    @Override
    public Kind kind() {
      return Kind.BYTES;
    }
  }

  record NameConstant(Singleton value, SourcePosition position) implements Expr {
    @Override
    public Kind kind() {
      return Kind.NAME_CONSTANT;
    }
  }

  record Name(String id, SourcePosition position) implements Expr {
    public Name {
      Preconditions.checkArgument(!id.isEmpty(), "empty name");
    }

    @Override
    public Kind kind() {
      return Kind.NAME;
    }
  }

  record Attribute(Expr value, String attr, SourcePosition position) implements Expr {
    @Override
    public Kind kind() {
      return Kind.ATTRIBUTE;
    }
  }

  record Subscript(Expr value, Slicer slice, SourcePosition position) implements Expr {
    @Override
    public Kind kind() {
      return Kind.SUBSCRIPT;
    }
  }

  /**
   * A call. Star-args ({@code *xs}) and keyword-args ({@code **kw}) are kept apart from the
   * positional and keyword arguments.
   */
  record Call(
      Expr func,
      ImmutableList<Expr> args,
      ImmutableList<Keyword> keywords,
      @Nullable Expr starargs,
      @Nullable Expr kwargs,
      SourcePosition position)
      implements Expr {
    @Override
    public Kind kind() {
      return Kind.CALL;
    }
  }

  record UnaryOp(UnaryOperator op, Expr operand, SourcePosition position) implements Expr {
    @Override
    public Kind kind() {
      return Kind.UNARY_OP;
    }
  }

  record BinOp(Expr left, BinaryOperator op, Expr right, SourcePosition position)
      implements Expr {
    @Override
    public Kind kind() {
      return Kind.BIN_OP;
    }
  }

  record BoolOp(BoolOperator op, ImmutableList<Expr> values, SourcePosition position)
      implements Expr {
    public BoolOp {
      Preconditions.checkArgument(values.size() >= 2, "BoolOp needs two operands: %s", values);
    }

    @Override
    public Kind kind() {
      return Kind.BOOL_OP;
    }
  }

  /** A possibly chained comparison: {@code left ops[0] comparators[0] ops[1] ...}. */
  record Compare(
      Expr left,
      ImmutableList<CompareOperator> ops,
      ImmutableList<Expr> comparators,
      SourcePosition position)
      implements Expr {
    public Compare {
      Preconditions.checkArgument(
          !ops.isEmpty() && ops.size() == comparators.size(),
          "mismatched comparison: %s operators, %s operands",
          ops.size(),
          comparators.size());
    }

    @Override
    public Kind kind() {
      return Kind.COMPARE;
    }
  }

  record TupleLiteral(ImmutableList<Expr> elts, SourcePosition position) implements Expr {
    @Override
    public Kind kind() {
      return Kind.TUPLE;
    }
  }

  record ListLiteral(ImmutableList<Expr> elts, SourcePosition position) implements Expr {
    @Override
    public Kind kind() {
      return Kind.LIST;
    }
  }

  record DictLiteral(ImmutableList<Expr> keys, ImmutableList<Expr> values, SourcePosition position)
      implements Expr {
    public DictLiteral {
      Preconditions.checkArgument(keys.size() == values.size(), "mismatched dict literal");
    }

    @Override
    public Kind kind() {
      return Kind.DICT;
    }
  }

  record Lambda(Arguments args, Expr body, SourcePosition position) implements Expr {
    @Override
    public Kind kind() {
      return Kind.LAMBDA;
    }
  }

  record IfExp(Expr test, Expr body, Expr orelse, SourcePosition position) implements Expr {
    @Override
    public Kind kind() {
      return Kind.IF_EXP;
    }
  }

  record ListComp(Expr elt, ImmutableList<Comprehension> generators, SourcePosition position)
      implements Expr {
    public ListComp {
      Preconditions.checkArgument(!generators.isEmpty(), "comprehension without generators");
    }

    @Override
    public Kind kind() {
      return Kind.LIST_COMP;
    }
  }

  record DictComp(
      Expr key, Expr value, ImmutableList<Comprehension> generators, SourcePosition position)
      implements Expr {
    public DictComp {
      Preconditions.checkArgument(!generators.isEmpty(), "comprehension without generators");
    }

    @Override
    public Kind kind() {
      return Kind.DICT_COMP;
    }
  }

  record GeneratorExp(Expr elt, ImmutableList<Comprehension> generators, SourcePosition position)
      implements Expr {
    public GeneratorExp {
      Preconditions.checkArgument(!generators.isEmpty(), "comprehension without generators");
    }

    @Override
    public Kind kind() {
      return Kind.GENERATOR_EXP;
    }
  }

  /** {@code *value} outside of a call's argument list. */
  record Starred(Expr value, SourcePosition position) implements Expr {
    @Override
    public Kind kind() {
      return Kind.STARRED;
    }
  }

  /** An expression shape the tree model has no variant for. */
  record Unknown(String nodeType, SourcePosition position) implements Expr {
    @Override
    public Kind kind() {
      return Kind.UNKNOWN;
    }
  }
}
