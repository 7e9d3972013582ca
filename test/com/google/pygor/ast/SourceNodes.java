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
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Builds syntax trees for tests. Every node sits at line 1, column 0 unless a position is
 * given.
 */
public final class SourceNodes {
  public static final SourcePosition POS = SourcePosition.of(1, 0);

  private SourceNodes() {}

  // Expressions.

  public static Expr.Name name(String id) {
    return new Expr.Name(id, POS);
  }

  /** A number literal; its kind follows the text, as the reader decides it. */
  public static Expr.Num num(String text) {
    NumberKind kind = NumberKind.INT;
    if (text.endsWith("j")) {
      kind = NumberKind.COMPLEX;
    } else if (text.contains(".") || text.contains("e")) {
      kind = NumberKind.FLOAT;
    }
    return new Expr.Num(kind, text, POS);
  }

  public static Expr.Num num(int value) {
    return num(Integer.toString(value));
  }

  public static Expr.Str str(String value) {
    return new Expr.Str(value, POS);
  }

  public static Expr.NameConstant none() {
    return new Expr.NameConstant(Expr.Singleton.NONE, POS);
  }

  public static Expr.NameConstant bool(boolean value) {
    return new Expr.NameConstant(value ? Expr.Singleton.TRUE : Expr.Singleton.FALSE, POS);
  }

  public static Expr.Attribute attr(Expr value, String attr) {
    return new Expr.Attribute(value, attr, POS);
  }

  /** {@code a.b.c} from {@code "a.b.c"}. */
  public static Expr dotted(String path) {
    String[] parts = path.split("\\.");
    Expr e = name(parts[0]);
    for (int i = 1; i < parts.length; i++) {
      e = attr(e, parts[i]);
    }
    return e;
  }

  public static Expr.Call call(Expr func, Expr... args) {
    return new Expr.Call(
        func, ImmutableList.copyOf(args), ImmutableList.of(), null, null, POS);
  }

  public static Expr.Call call(String func, Expr... args) {
    return call(dotted(func), args);
  }

  public static Expr.Call call(
      Expr func,
      ImmutableList<Expr> args,
      ImmutableList<Keyword> keywords,
      @Nullable Expr starargs,
      @Nullable Expr kwargs) {
    return new Expr.Call(func, args, keywords, starargs, kwargs, POS);
  }

  public static Keyword keyword(String arg, Expr value) {
    return new Keyword(arg, value);
  }

  public static Expr.Subscript index(Expr value, Expr index) {
    return new Expr.Subscript(value, new Slicer.Index(index, POS), POS);
  }

  public static Expr.Subscript slice(
      Expr value, @Nullable Expr lower, @Nullable Expr upper, @Nullable Expr step) {
    return new Expr.Subscript(value, new Slicer.Slice(lower, upper, step, POS), POS);
  }

  public static Expr.UnaryOp unary(UnaryOperator op, Expr operand) {
    return new Expr.UnaryOp(op, operand, POS);
  }

  public static Expr.UnaryOp neg(Expr operand) {
    return unary(UnaryOperator.USUB, operand);
  }

  public static Expr.BinOp binOp(Expr left, BinaryOperator op, Expr right) {
    return new Expr.BinOp(left, op, right, POS);
  }

  public static Expr.BoolOp boolOp(BoolOperator op, Expr... values) {
    return new Expr.BoolOp(op, ImmutableList.copyOf(values), POS);
  }

  public static Expr.Compare compare(Expr left, CompareOperator op, Expr right) {
    return new Expr.Compare(left, ImmutableList.of(op), ImmutableList.of(right), POS);
  }

  public static Expr.Compare compare(
      Expr left, ImmutableList<CompareOperator> ops, ImmutableList<Expr> comparators) {
    return new Expr.Compare(left, ops, comparators, POS);
  }

  public static Expr.TupleLiteral tuple(Expr... elts) {
    return new Expr.TupleLiteral(ImmutableList.copyOf(elts), POS);
  }

  public static Expr.ListLiteral list(Expr... elts) {
    return new Expr.ListLiteral(ImmutableList.copyOf(elts), POS);
  }

  public static Expr.DictLiteral dict(ImmutableList<Expr> keys, ImmutableList<Expr> values) {
    return new Expr.DictLiteral(keys, values, POS);
  }

  public static Expr.Lambda lambda(Arguments args, Expr body) {
    return new Expr.Lambda(args, body, POS);
  }

  public static Expr.IfExp ifExp(Expr test, Expr body, Expr orelse) {
    return new Expr.IfExp(test, body, orelse, POS);
  }

  public static Comprehension comp(Expr target, Expr iter, Expr... ifs) {
    return new Comprehension(target, iter, ImmutableList.copyOf(ifs));
  }

  public static Expr.ListComp listComp(Expr elt, Comprehension... generators) {
    return new Expr.ListComp(elt, ImmutableList.copyOf(generators), POS);
  }

  public static Expr.DictComp dictComp(Expr key, Expr value, Comprehension... generators) {
    return new Expr.DictComp(key, value, ImmutableList.copyOf(generators), POS);
  }

  public static Expr.GeneratorExp generatorExp(Expr elt, Comprehension... generators) {
    return new Expr.GeneratorExp(elt, ImmutableList.copyOf(generators), POS);
  }

  // Parameters.

  public static Arg arg(String name) {
    return new Arg(name, null, POS);
  }

  public static Arg arg(String name, Expr annotation) {
    return new Arg(name, annotation, POS);
  }

  /** Positional parameters without defaults. */
  public static Arguments args(String... names) {
    ImmutableList.Builder<Arg> positional = ImmutableList.builder();
    for (String name : names) {
      positional.add(arg(name));
    }
    return args(positional.build());
  }

  public static Arguments args(ImmutableList<Arg> positional) {
    return new Arguments(
        positional, ImmutableList.of(), null, ImmutableList.of(), ImmutableList.of(), null);
  }

  public static Arguments args(
      ImmutableList<Arg> positional,
      ImmutableList<Expr> defaults,
      @Nullable Arg vararg,
      ImmutableList<Arg> kwonly,
      ImmutableList<Optional<Expr>> kwDefaults,
      @Nullable Arg kwarg) {
    return new Arguments(positional, defaults, vararg, kwonly, kwDefaults, kwarg);
  }

  // Statements.

  public static Stmt.ExprStmt exprStmt(Expr value) {
    return new Stmt.ExprStmt(value, POS);
  }

  public static Stmt.Assign assign(Expr target, Expr value) {
    return new Stmt.Assign(ImmutableList.of(target), value, POS);
  }

  public static Stmt.Assign assign(String target, Expr value) {
    return assign(name(target), value);
  }

  public static Stmt.Assign assignChain(ImmutableList<Expr> targets, Expr value) {
    return new Stmt.Assign(targets, value, POS);
  }

  public static Stmt.AugAssign augAssign(Expr target, BinaryOperator op, Expr value) {
    return new Stmt.AugAssign(target, op, value, POS);
  }

  public static Stmt.AnnAssign annAssign(Expr target, Expr annotation, @Nullable Expr value) {
    return new Stmt.AnnAssign(target, annotation, value, POS);
  }

  public static Stmt.If ifStmt(Expr test, ImmutableList<Stmt> body, ImmutableList<Stmt> orelse) {
    return new Stmt.If(test, body, orelse, POS);
  }

  public static Stmt.For forStmt(Expr target, Expr iter, Stmt... body) {
    return new Stmt.For(target, iter, ImmutableList.copyOf(body), ImmutableList.of(), POS);
  }

  public static Stmt.For forStmt(
      Expr target, Expr iter, ImmutableList<Stmt> body, ImmutableList<Stmt> orelse) {
    return new Stmt.For(target, iter, body, orelse, POS);
  }

  public static Stmt.While whileStmt(Expr test, Stmt... body) {
    return new Stmt.While(test, ImmutableList.copyOf(body), ImmutableList.of(), POS);
  }

  public static Stmt.Try tryStmt(
      ImmutableList<Stmt> body,
      ImmutableList<ExceptHandler> handlers,
      ImmutableList<Stmt> orelse,
      ImmutableList<Stmt> finalbody) {
    return new Stmt.Try(body, handlers, orelse, finalbody, POS);
  }

  public static ExceptHandler handler(@Nullable Expr type, @Nullable String name, Stmt... body) {
    return new ExceptHandler(type, name, ImmutableList.copyOf(body), POS);
  }

  public static Stmt.With with(Expr context, @Nullable Expr vars, Stmt... body) {
    return new Stmt.With(
        ImmutableList.of(new WithItem(context, vars)), ImmutableList.copyOf(body), POS);
  }

  public static Stmt.FunctionDef def(String name, Arguments args, Stmt... body) {
    return new Stmt.FunctionDef(
        name, args, ImmutableList.copyOf(body), ImmutableList.of(), null, POS);
  }

  public static Stmt.FunctionDef def(
      String name,
      Arguments args,
      ImmutableList<Stmt> body,
      ImmutableList<Expr> decorators,
      @Nullable Expr returns) {
    return new Stmt.FunctionDef(name, args, body, decorators, returns, POS);
  }

  public static Stmt.ClassDef classDef(String name, ImmutableList<Expr> bases, Stmt... body) {
    return new Stmt.ClassDef(
        name, bases, ImmutableList.of(), ImmutableList.copyOf(body), ImmutableList.of(), POS);
  }

  public static Stmt.Import importStmt(String module, @Nullable String asName) {
    return new Stmt.Import(ImmutableList.of(new Alias(module, asName)), POS);
  }

  public static Stmt.ImportFrom importFrom(String module, Alias... names) {
    return new Stmt.ImportFrom(module, ImmutableList.copyOf(names), 0, POS);
  }

  public static Alias alias(String name, @Nullable String asName) {
    return new Alias(name, asName);
  }

  public static Stmt.Return ret(@Nullable Expr value) {
    return new Stmt.Return(value, POS);
  }

  public static Stmt.Yield yieldStmt(@Nullable Expr value) {
    return new Stmt.Yield(value, POS);
  }

  public static Stmt.Raise raise(@Nullable Expr exc, @Nullable Expr cause) {
    return new Stmt.Raise(exc, cause, POS);
  }

  public static Stmt.Assert assertStmt(Expr test, @Nullable Expr msg) {
    return new Stmt.Assert(test, msg, POS);
  }

  public static Stmt.Pass pass() {
    return new Stmt.Pass(POS);
  }

  public static Stmt.Break breakStmt() {
    return new Stmt.Break(POS);
  }

  public static Stmt.Delete delete(Expr... targets) {
    return new Stmt.Delete(ImmutableList.copyOf(targets), POS);
  }

  public static Stmt.Global global(String... names) {
    return new Stmt.Global(ImmutableList.copyOf(names), POS);
  }

  public static Module module(String sourceName, Stmt... body) {
    return new Module(sourceName, ImmutableList.copyOf(body));
  }
}
