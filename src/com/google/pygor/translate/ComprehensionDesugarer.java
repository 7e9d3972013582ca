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

import static com.google.pygor.gen.GoIR.call;
import static com.google.pygor.gen.GoIR.ident;

import com.google.common.collect.ImmutableList;
import com.google.pygor.ast.Comprehension;
import com.google.pygor.ast.Expr;
import com.google.pygor.gen.GoExpr;
import com.google.pygor.gen.GoIR;
import com.google.pygor.gen.GoStmt;
import com.google.pygor.gen.Param;
import java.util.List;
import java.util.function.Supplier;

/**
 * Lowers comprehensions. An eager comprehension becomes a function literal, called in place,
 * that fills an accumulator in nested loops and returns it. A generator expression becomes one
 * that starts a goroutine sending each element on a channel and returns the channel at once.
 *
 * <p>The loops are built by the for-statement lowering, so the clauses of a list comprehension
 * and of the equivalent generator expression produce the same loops.
 */
final class ComprehensionDesugarer {
  // The accumulator names carry the rename suffix, so no source name can collide with them.
  static final String LIST_RESULT = "lc" + RenameTable.SUFFIX;
  static final String DICT_RESULT = "mm" + RenameTable.SUFFIX;
  static final String CHANNEL = "c" + RenameTable.SUFFIX;

  private final TranslationContext ctx;

  ComprehensionDesugarer(TranslationContext ctx) {
    this.ctx = ctx;
  }

  GoExpr listComp(Expr.ListComp comp) {
    GoExpr result = ident(LIST_RESULT);
    ImmutableList<GoStmt> loops =
        loops(
            comp.generators(),
            () ->
                ImmutableList.of(
                    GoIR.assign(result, call(ident("append"), result, translate(comp.elt())))));
    return GoIR.invoke(
        ImmutableList.of(Param.of(LIST_RESULT, ctx.runtime("List"))),
        ImmutableList.<GoStmt>builder().addAll(loops).add(GoIR.returnStmt(result)).build());
  }

  GoExpr dictComp(Expr.DictComp comp) {
    GoExpr result = ident(DICT_RESULT);
    ImmutableList<GoStmt> loops =
        loops(
            comp.generators(),
            () ->
                ImmutableList.of(
                    GoIR.assign(
                        GoIR.index(result, translate(comp.key())), translate(comp.value()))));
    return GoIR.invoke(
        ImmutableList.of(Param.of(DICT_RESULT, ctx.runtime("Dict"))),
        ImmutableList.<GoStmt>builder()
            .add(GoIR.assign(result, GoIR.composite(ctx.runtime("Dict"), ImmutableList.of())))
            .addAll(loops)
            .add(GoIR.returnStmt(result))
            .build());
  }

  GoExpr generatorExp(Expr.GeneratorExp comp) {
    GoExpr channel = ident(CHANNEL);
    ImmutableList<GoStmt> loops =
        loops(
            comp.generators(),
            () -> ImmutableList.of(GoIR.send(channel, translate(comp.elt()))));
    GoExpr chanType = GoIR.chanType(ctx.runtime("Any"));
    GoExpr producer =
        GoIR.funcLit(
            ImmutableList.of(),
            ImmutableList.of(),
            ImmutableList.<GoStmt>builder()
                .addAll(loops)
                .add(GoIR.exprStmt(call(ident("close"), channel)))
                .build());
    return GoIR.invoke(
        ImmutableList.of(Param.of(CHANNEL, chanType)),
        ImmutableList.of(
            GoIR.assign(channel, call(ident("make"), chanType)),
            GoIR.go(call(producer)),
            GoIR.returnStmt(channel)));
  }

  /**
   * The loops of the generator clauses, outermost first. Each clause's conditions guard the rest
   * of the nest; {@code innermost} supplies the statements of the innermost point, translated in
   * the scope of the innermost loop.
   */
  ImmutableList<GoStmt> loops(
      List<Comprehension> generators, Supplier<ImmutableList<GoStmt>> innermost) {
    return loops(generators, 0, innermost);
  }

  private ImmutableList<GoStmt> loops(
      List<Comprehension> generators, int i, Supplier<ImmutableList<GoStmt>> innermost) {
    Comprehension generator = generators.get(i);
    GoStmt loop =
        ctx.statements()
            .lowerFor(
                generator.target(),
                generator.iter(),
                () -> {
                  ImmutableList<GoStmt> inner =
                      i + 1 < generators.size()
                          ? loops(generators, i + 1, innermost)
                          : innermost.get();
                  if (generator.ifs().isEmpty()) {
                    return inner;
                  }
                  return ImmutableList.of(GoIR.ifStmt(conjunction(generator.ifs()), inner));
                },
                generator.iter().position());
    return ImmutableList.of(loop);
  }

  private GoExpr conjunction(List<Expr> conditions) {
    GoExpr result = translate(conditions.get(0));
    for (int i = 1; i < conditions.size(); i++) {
      result = GoIR.binary(result, "&&", translate(conditions.get(i)));
    }
    return result;
  }

  private GoExpr translate(Expr e) {
    return ctx.expressions().translate(e);
  }
}
