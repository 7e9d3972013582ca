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

/** Output expression fragments, including the type expressions of the output language. */
public interface GoExpr extends CodeFragment {

  enum Kind {
    IDENT,
    QUALIFIED,
    LITERAL,
    SELECTOR,
    INDEX,
    SLICE,
    CALL,
    BINARY,
    UNARY,
    PAREN,
    FUNC_LIT,
    COMPOSITE,
    KEY_VALUE,
    TYPE_ASSERT,
    CHAN_TYPE,
    POINTER,
    SLICE_TYPE,
    ELLIPSIS,
    COMMENTED
  }

  Kind kind();

  /** Lexical classes of literals. */
  enum LiteralKind {
    INT,
    FLOAT,
    IMAG,
    STRING
  }

  record Ident(String name) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.IDENT;
    }
  }

  /**
   * A name exported by an imported package. The printer adds the import and renders the name
   * through the package's last path segment.
   */
  record Qualified(String importPath, String name) implements GoExpr {
    public Qualified {
      Preconditions.checkArgument(!importPath.isEmpty(), "empty import path");
    }

    @Override
    public Kind kind() {
      return Kind.QUALIFIED;
    }
  }

  /** A literal. Numeric text is emitted verbatim; string text is the unquoted value. */
  record Literal(LiteralKind literalKind, String text) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.LITERAL;
    }
  }

  record Selector(GoExpr x, String sel) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.SELECTOR;
    }
  }

  record Index(GoExpr x, GoExpr index) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.INDEX;
    }
  }

  /** {@code x[lo:hi]}, each bound optional. */
  record SliceExpr(GoExpr x, @Nullable GoExpr lo, @Nullable GoExpr hi) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.SLICE;
    }
  }

  record Call(GoExpr fun, ImmutableList<GoExpr> args) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.CALL;
    }
  }

  record Binary(GoExpr left, String op, GoExpr right) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.BINARY;
    }
  }

  record Unary(String op, GoExpr x) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.UNARY;
    }
  }

  /** Explicit parentheses, kept even where precedence does not need them. */
  record Paren(GoExpr x) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.PAREN;
    }
  }

  /** An anonymous function. Named results are allowed. */
  record FuncLit(
      ImmutableList<Param> params, ImmutableList<Param> results, ImmutableList<GoStmt> body)
      implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.FUNC_LIT;
    }
  }

  /** {@code Type{elems}}. */
  record Composite(GoExpr type, ImmutableList<GoExpr> elems) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.COMPOSITE;
    }
  }

  /** {@code key: value} inside a composite literal. */
  record KeyValue(GoExpr key, GoExpr value) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.KEY_VALUE;
    }
  }

  /** {@code x.(type)}; a null type is the {@code x.(type)} of a type switch. */
  record TypeAssert(GoExpr x, @Nullable GoExpr type) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.TYPE_ASSERT;
    }
  }

  record ChanType(GoExpr elem) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.CHAN_TYPE;
    }
  }

  record Pointer(GoExpr x) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.POINTER;
    }
  }

  record SliceType(GoExpr elem) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.SLICE_TYPE;
    }
  }

  /** {@code ...elem}, the type of a variadic parameter. */
  record Ellipsis(GoExpr elem) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.ELLIPSIS;
    }
  }

  /** An expression with a block comment, placed before it when leading and after it otherwise. */
  record Commented(GoExpr x, String comment, boolean leading) implements GoExpr {
    @Override
    public Kind kind() {
      return Kind.COMMENTED;
    }
  }
}
