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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** Output statement and declaration fragments. */
public interface GoStmt extends CodeFragment {

  enum Kind {
    EXPR,
    ASSIGN,
    VAR_DECL,
    IF,
    FOR,
    FOR_RANGE,
    SWITCH,
    RETURN,
    BREAK,
    CONTINUE,
    GO,
    SEND,
    BLOCK,
    COMMENT,
    COMMENTED,
    FUNC_DECL,
    TYPE_DECL
  }

  Kind kind();

  record ExprStmt(GoExpr x) implements GoStmt {
    @Override
    public Kind kind() {
      return Kind.EXPR;
    }
  }

  /** {@code lhs op rhs} where op is {@code =}, {@code :=} or an operator-assignment. */
  record Assign(ImmutableList<GoExpr> lhs, String op, ImmutableList<GoExpr> rhs)
      implements GoStmt {
    public Assign {
      Preconditions.checkArgument(!lhs.isEmpty() && !rhs.isEmpty(), "empty assignment side");
    }

    @Override
    public Kind kind() {
      return Kind.ASSIGN;
    }
  }

  /** {@code var names [type] [= values]}. */
  record VarDecl(ImmutableList<String> names, @Nullable GoExpr type, ImmutableList<GoExpr> values)
      implements GoStmt {
    public VarDecl {
      Preconditions.checkArgument(!names.isEmpty(), "var without names");
      Preconditions.checkArgument(
          type != null || !values.isEmpty(), "var needs a type or a value: %s", names);
    }

    @Override
    public Kind kind() {
      return Kind.VAR_DECL;
    }
  }

  /** {@code if [init;] cond { then } [else { orElse }]}; an empty else is omitted. */
  record If(
      @Nullable GoStmt init,
      GoExpr cond,
      ImmutableList<GoStmt> then,
      ImmutableList<GoStmt> orElse)
      implements GoStmt {
    @Override
    public Kind kind() {
      return Kind.IF;
    }
  }

  /** A three-clause loop; all clauses absent is the infinite loop. */
  record For(
      @Nullable GoStmt init,
      @Nullable GoExpr cond,
      @Nullable GoStmt post,
      ImmutableList<GoStmt> body)
      implements GoStmt {
    @Override
    public Kind kind() {
      return Kind.FOR;
    }
  }

  /** {@code for keys := range x}; no keys is {@code for range x}. */
  record ForRange(ImmutableList<GoExpr> keys, GoExpr x, ImmutableList<GoStmt> body)
      implements GoStmt {
    public ForRange {
      Preconditions.checkArgument(keys.size() <= 2, "range binds at most two values");
    }

    @Override
    public Kind kind() {
      return Kind.FOR_RANGE;
    }
  }

  record Switch(@Nullable GoStmt init, @Nullable GoExpr tag, ImmutableList<CaseClause> cases)
      implements GoStmt {
    @Override
    public Kind kind() {
      return Kind.SWITCH;
    }
  }

  record Return(ImmutableList<GoExpr> results) implements GoStmt {
    @Override
    public Kind kind() {
      return Kind.RETURN;
    }
  }

  record Break() implements GoStmt {
    @Override
    public Kind kind() {
      return Kind.BREAK;
    }
  }

  record Continue() implements GoStmt {
    @Override
    public Kind kind() {
      return Kind.CONTINUE;
    }
  }

  /** {@code go call}. */
  record Go(GoExpr call) implements GoStmt {
    @Override
    public Kind kind() {
      return Kind.GO;
    }
  }

  /** {@code channel <- value}. */
  record Send(GoExpr channel, GoExpr value) implements GoStmt {
    @Override
    public Kind kind() {
      return Kind.SEND;
    }
  }

  record Block(ImmutableList<GoStmt> body) implements GoStmt {
    @Override
    public Kind kind() {
      return Kind.BLOCK;
    }
  }

  /**
   * A line comment. When {@code code} is present its rendering, folded onto one line, follows
   * the text.
   */
  record Comment(String text, @Nullable GoExpr code) implements GoStmt {
    @Override
    public Kind kind() {
      return Kind.COMMENT;
    }
  }

  /** A statement followed by a line comment on the same line. */
  record Commented(GoStmt stmt, String comment, @Nullable GoExpr code) implements GoStmt {
    @Override
    public Kind kind() {
      return Kind.COMMENTED;
    }
  }

  /** A top-level function or method; a method has a receiver. */
  record FuncDecl(
      @Nullable Param receiver,
      String name,
      ImmutableList<Param> params,
      ImmutableList<Param> results,
      ImmutableList<GoStmt> body,
      ImmutableList<String> doc)
      implements GoStmt {
    @Override
    public Kind kind() {
      return Kind.FUNC_DECL;
    }
  }

  /** {@code type name struct { fields }} with its doc comment lines. */
  record TypeDecl(String name, ImmutableList<String> doc, ImmutableList<Field> fields)
      implements GoStmt {
    @Override
    public Kind kind() {
      return Kind.TYPE_DECL;
    }
  }
}
