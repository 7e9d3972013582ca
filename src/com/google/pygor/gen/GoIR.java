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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A fragment construction helper class. */
public final class GoIR {

  private GoIR() {}

  public static GoExpr.Ident ident(String name) {
    return new GoExpr.Ident(name);
  }

  public static GoExpr qualified(String importPath, String name) {
    return new GoExpr.Qualified(importPath, name);
  }

  public static GoExpr intLit(String text) {
    return new GoExpr.Literal(GoExpr.LiteralKind.INT, text);
  }

  public static GoExpr intLit(int value) {
    return intLit(Integer.toString(value));
  }

  public static GoExpr floatLit(String text) {
    return new GoExpr.Literal(GoExpr.LiteralKind.FLOAT, text);
  }

  public static GoExpr imagLit(String text) {
    return new GoExpr.Literal(GoExpr.LiteralKind.IMAG, text);
  }

  public static GoExpr stringLit(String value) {
    return new GoExpr.Literal(GoExpr.LiteralKind.STRING, value);
  }

  public static GoExpr nil() {
    return ident("nil");
  }

  public static GoExpr selector(GoExpr x, String sel) {
    return new GoExpr.Selector(x, sel);
  }

  public static GoExpr index(GoExpr x, GoExpr index) {
    return new GoExpr.Index(x, index);
  }

  public static GoExpr slice(GoExpr x, @Nullable GoExpr lo, @Nullable GoExpr hi) {
    return new GoExpr.SliceExpr(x, lo, hi);
  }

  public static GoExpr call(GoExpr fun, GoExpr... args) {
    return new GoExpr.Call(fun, ImmutableList.copyOf(args));
  }

  public static GoExpr call(GoExpr fun, List<GoExpr> args) {
    return new GoExpr.Call(fun, ImmutableList.copyOf(args));
  }

  public static GoExpr binary(GoExpr left, String op, GoExpr right) {
    return new GoExpr.Binary(left, op, right);
  }

  public static GoExpr unary(String op, GoExpr x) {
    return new GoExpr.Unary(op, x);
  }

  public static GoExpr paren(GoExpr x) {
    return new GoExpr.Paren(x);
  }

  public static GoExpr.FuncLit funcLit(
      List<Param> params, List<Param> results, List<GoStmt> body) {
    return new GoExpr.FuncLit(
        ImmutableList.copyOf(params), ImmutableList.copyOf(results), ImmutableList.copyOf(body));
  }

  /** {@code func() results { body }()}. */
  public static GoExpr invoke(List<Param> results, List<GoStmt> body) {
    return call(funcLit(ImmutableList.of(), results, body));
  }

  public static GoExpr composite(GoExpr type, List<GoExpr> elems) {
    return new GoExpr.Composite(type, ImmutableList.copyOf(elems));
  }

  public static GoExpr keyValue(GoExpr key, GoExpr value) {
    return new GoExpr.KeyValue(key, value);
  }

  public static GoExpr typeAssert(GoExpr x, @Nullable GoExpr type) {
    return new GoExpr.TypeAssert(x, type);
  }

  public static GoExpr chanType(GoExpr elem) {
    return new GoExpr.ChanType(elem);
  }

  public static GoExpr pointer(GoExpr x) {
    return new GoExpr.Pointer(x);
  }

  public static GoExpr sliceType(GoExpr elem) {
    return new GoExpr.SliceType(elem);
  }

  public static GoExpr ellipsis(GoExpr elem) {
    return new GoExpr.Ellipsis(elem);
  }

  /** A block comment placed before {@code x}. */
  public static GoExpr leadingComment(String comment, GoExpr x) {
    return new GoExpr.Commented(x, comment, true);
  }

  public static GoExpr trailingComment(GoExpr x, String comment) {
    return new GoExpr.Commented(x, comment, false);
  }

  // Statements

  public static GoStmt exprStmt(GoExpr x) {
    return new GoStmt.ExprStmt(x);
  }

  public static GoStmt assign(GoExpr lhs, GoExpr rhs) {
    return new GoStmt.Assign(ImmutableList.of(lhs), "=", ImmutableList.of(rhs));
  }

  public static GoStmt assign(List<GoExpr> lhs, String op, List<GoExpr> rhs) {
    return new GoStmt.Assign(ImmutableList.copyOf(lhs), op, ImmutableList.copyOf(rhs));
  }

  /** {@code lhs := rhs}. */
  public static GoStmt define(GoExpr lhs, GoExpr rhs) {
    return new GoStmt.Assign(ImmutableList.of(lhs), ":=", ImmutableList.of(rhs));
  }

  public static GoStmt varDecl(String name, @Nullable GoExpr type, @Nullable GoExpr value) {
    return new GoStmt.VarDecl(
        ImmutableList.of(name), type, value == null ? ImmutableList.of() : ImmutableList.of(value));
  }

  public static GoStmt ifStmt(GoExpr cond, List<GoStmt> then) {
    return new GoStmt.If(null, cond, ImmutableList.copyOf(then), ImmutableList.of());
  }

  public static GoStmt ifStmt(
      @Nullable GoStmt init, GoExpr cond, List<GoStmt> then, List<GoStmt> orElse) {
    return new GoStmt.If(init, cond, ImmutableList.copyOf(then), ImmutableList.copyOf(orElse));
  }

  public static GoStmt forLoop(
      @Nullable GoStmt init, @Nullable GoExpr cond, @Nullable GoStmt post, List<GoStmt> body) {
    return new GoStmt.For(init, cond, post, ImmutableList.copyOf(body));
  }

  public static GoStmt forRange(List<GoExpr> keys, GoExpr x, List<GoStmt> body) {
    return new GoStmt.ForRange(ImmutableList.copyOf(keys), x, ImmutableList.copyOf(body));
  }

  public static GoStmt switchStmt(
      @Nullable GoStmt init, @Nullable GoExpr tag, List<CaseClause> cases) {
    return new GoStmt.Switch(init, tag, ImmutableList.copyOf(cases));
  }

  public static CaseClause caseClause(List<GoExpr> exprs, List<GoStmt> body) {
    return new CaseClause(ImmutableList.copyOf(exprs), ImmutableList.copyOf(body));
  }

  public static GoStmt returnStmt(GoExpr... results) {
    return new GoStmt.Return(ImmutableList.copyOf(results));
  }

  public static GoStmt breakStmt() {
    return new GoStmt.Break();
  }

  public static GoStmt continueStmt() {
    return new GoStmt.Continue();
  }

  public static GoStmt go(GoExpr call) {
    return new GoStmt.Go(call);
  }

  public static GoStmt send(GoExpr channel, GoExpr value) {
    return new GoStmt.Send(channel, value);
  }

  public static GoStmt block(List<GoStmt> body) {
    return new GoStmt.Block(ImmutableList.copyOf(body));
  }

  public static GoStmt comment(String text) {
    return new GoStmt.Comment(text, null);
  }

  public static GoStmt comment(String text, GoExpr code) {
    return new GoStmt.Comment(text, code);
  }

  public static GoStmt commented(GoStmt stmt, String comment) {
    return new GoStmt.Commented(stmt, comment, null);
  }

  public static GoStmt commented(GoStmt stmt, String comment, GoExpr code) {
    return new GoStmt.Commented(stmt, comment, code);
  }
}
