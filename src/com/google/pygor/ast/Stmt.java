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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** Statement nodes. */
public interface Stmt extends SourceNode {

  /** One constant per statement variant. */
  enum Kind {
    EXPR,
    ASSIGN,
    AUG_ASSIGN,
    ANN_ASSIGN,
    IF,
    FOR,
    WHILE,
    TRY,
    WITH,
    FUNCTION_DEF,
    CLASS_DEF,
    IMPORT,
    IMPORT_FROM,
    RETURN,
    YIELD,
    YIELD_FROM,
    RAISE,
    ASSERT,
    PASS,
    BREAK,
    CONTINUE,
    DELETE,
    GLOBAL,
    NONLOCAL,
    UNKNOWN
  }

  Kind kind();

  /** An expression evaluated for its side effects. */
  record ExprStmt(Expr value, SourcePosition position) implements Stmt {
    @Override
    public Kind kind() {
      return Kind.EXPR;
    }
  }

  /** {@code t1 = t2 = ... = value}. */
  record Assign(ImmutableList<Expr> targets, Expr value, SourcePosition position)
      implements Stmt {
    public Assign {
      Preconditions.checkArgument(!targets.isEmpty(), "assignment without target");
    }

    @Override
    public Kind kind() {
      return Kind.ASSIGN;
    }
  }

  record AugAssign(Expr target, BinaryOperator op, Expr value, SourcePosition position)
      implements Stmt {
    @Override
    public Kind kind() {
      return Kind.AUG_ASSIGN;
    }
  }

  /** {@code target: annotation [= value]}. */
  record AnnAssign(
      Expr target, Expr annotation, @Nullable Expr value, SourcePosition position)
      implements Stmt {
    @Override
    public Kind kind() {
      return Kind.ANN_ASSIGN;
    }
  }

  record If(
      Expr test, ImmutableList<Stmt> body, ImmutableList<Stmt> orelse, SourcePosition position)
      implements Stmt {
    @Override
    public Kind kind() {
      return Kind.IF;
    }
  }

  record For(
      Expr target,
      Expr iter,
      ImmutableList<Stmt> body,
      ImmutableList<Stmt> orelse,
      SourcePosition position)
      implements Stmt {
    @Override
    public Kind kind() {
      return Kind.FOR;
    }
  }

  record While(
      Expr test, ImmutableList<Stmt> body, ImmutableList<Stmt> orelse, SourcePosition position)
      implements Stmt {
    @Override
    public Kind kind() {
      return Kind.WHILE;
    }
  }

  record Try(
      ImmutableList<Stmt> body,
      ImmutableList<ExceptHandler> handlers,
      ImmutableList<Stmt> orelse,
      ImmutableList<Stmt> finalbody,
      SourcePosition position)
      implements Stmt {
    @Override
    public Kind kind() {
      return Kind.TRY;
    }
  }

  record With(ImmutableList<WithItem> items, ImmutableList<Stmt> body, SourcePosition position)
      implements Stmt {
    @Override
    public Kind kind() {
      return Kind.WITH;
    }
  }

  record FunctionDef(
      String name,
      Arguments args,
      ImmutableList<Stmt> body,
      ImmutableList<Expr> decorators,
      @Nullable Expr returns,
      SourcePosition position)
      implements Stmt {
    @Override
    public Kind kind() {
      return Kind.FUNCTION_DEF;
    }
  }

  record ClassDef(
      String name,
      ImmutableList<Expr> bases,
      ImmutableList<Keyword> keywords,
      ImmutableList<Stmt> body,
      ImmutableList<Expr> decorators,
      SourcePosition position)
      implements Stmt {
    @Override
    public Kind kind() {
      return Kind.CLASS_DEF;
    }
  }

  record Import(ImmutableList<Alias> names, SourcePosition position) implements Stmt {
    @Override
    public Kind kind() {
      return Kind.IMPORT;
    }
  }

  /** {@code from module import names}. The module is null for {@code from . import x}. */
  record ImportFrom(
      @Nullable String module, ImmutableList<Alias> names, int level, SourcePosition position)
      implements Stmt {
    @Override
    public Kind kind() {
      return Kind.IMPORT_FROM;
    }
  }

  record Return(@Nullable Expr value, SourcePosition position) implements Stmt {
    @Override
    public Kind kind() {
      return Kind.RETURN;
    }
  }

  record Yield(@Nullable Expr value, SourcePosition position) implements Stmt {
    @Override
    public Kind kind() {
      return Kind.YIELD;
    }
  }

  record YieldFrom(Expr value, SourcePosition position) implements Stmt {
    @Override
    public Kind kind() {
      return Kind.YIELD_FROM;
    }
  }

  /** {@code raise [exc [from cause]]}. */
  record Raise(@Nullable Expr exc, @Nullable Expr cause, SourcePosition position)
      implements Stmt {
    @Override
    public Kind kind() {
      return Kind.RAISE;
    }
  }

  record Assert(Expr test, @Nullable Expr msg, SourcePosition position) implements Stmt {
    @Override
    public Kind kind() {
      return Kind.ASSERT;
    }
  }

  record Pass(SourcePosition position) implements Stmt {
    @Override
    public Kind kind() {
      return Kind.PASS;
    }
  }

  record Break(SourcePosition position) implements Stmt {
    @Override
    public Kind kind() {
      return Kind.BREAK;
    }
  }

  record Continue(SourcePosition position) implements Stmt {
    @Override
    public Kind kind() {
      return Kind.CONTINUE;
    }
  }

  record Delete(ImmutableList<Expr> targets, SourcePosition position) implements Stmt {
    @Override
    public Kind kind() {
      return Kind.DELETE;
    }
  }

  record Global(ImmutableList<String> names, SourcePosition position) implements Stmt {
    @Override
    public Kind kind() {
      return Kind.GLOBAL;
    }
  }

  record Nonlocal(ImmutableList<String> names, SourcePosition position) implements Stmt {
    @Override
    public Kind kind() {
      return Kind.NONLOCAL;
    }
  }

  /** A statement shape the tree model has no variant for. */
  record Unknown(String nodeType, SourcePosition position) implements Stmt {
    @Override
    public Kind kind() {
      return Kind.UNKNOWN;
    }
  }
}
