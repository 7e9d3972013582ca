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

import static com.google.common.truth.Truth.assertThat;
import static com.google.pygor.ast.SourceNodes.attr;
import static com.google.pygor.ast.SourceNodes.binOp;
import static com.google.pygor.ast.SourceNodes.call;
import static com.google.pygor.ast.SourceNodes.comp;
import static com.google.pygor.ast.SourceNodes.compare;
import static com.google.pygor.ast.SourceNodes.dictComp;
import static com.google.pygor.ast.SourceNodes.generatorExp;
import static com.google.pygor.ast.SourceNodes.listComp;
import static com.google.pygor.ast.SourceNodes.name;
import static com.google.pygor.ast.SourceNodes.num;
import static com.google.pygor.ast.SourceNodes.tuple;

import com.google.pygor.ast.BinaryOperator;
import com.google.pygor.ast.CompareOperator;
import com.google.pygor.ast.Comprehension;
import com.google.pygor.ast.Expr;
import com.google.pygor.gen.GoExpr;
import com.google.pygor.gen.GoStmt;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ComprehensionDesugarer}. */
@RunWith(JUnit4.class)
public final class ComprehensionDesugarerTest {
  private TranslationTester tester;

  @Before
  public void setUp() {
    tester = new TranslationTester();
  }

  private static Comprehension positives() {
    return comp(name("x"), name("xs"), compare(name("x"), CompareOperator.GT, num(0)));
  }

  @Test
  public void testListComprehension() {
    Expr doubled = listComp(binOp(name("x"), BinaryOperator.MULT, num(2)), positives());
    assertThat(tester.expr(doubled))
        .isEqualTo(
            "func() (lcΠ List) {\n"
                + "\tfor _, x := range xs {\n"
                + "\t\tif x > 0 {\n"
                + "\t\t\tlcΠ = append(lcΠ, x * 2)\n"
                + "\t\t}\n"
                + "\t}\n"
                + "\treturn lcΠ\n"
                + "}()");
  }

  @Test
  public void testNestedClausesNestLoops() {
    Expr pairs =
        listComp(
            tuple(name("a"), name("b")),
            comp(name("a"), name("as")),
            comp(name("b"), name("bs")));
    assertThat(tester.expr(pairs))
        .isEqualTo(
            "func() (lcΠ List) {\n"
                + "\tfor _, a := range as {\n"
                + "\t\tfor _, b := range bs {\n"
                + "\t\t\tlcΠ = append(lcΠ, Tuple{a, b})\n"
                + "\t\t}\n"
                + "\t}\n"
                + "\treturn lcΠ\n"
                + "}()");
  }

  @Test
  public void testGeneratorExpression() {
    assertThat(tester.expr(generatorExp(name("x"), comp(name("x"), name("xs")))))
        .isEqualTo(
            "func() (cΠ chan Any) {\n"
                + "\tcΠ = make(chan Any)\n"
                + "\tgo func() {\n"
                + "\t\tfor _, x := range xs {\n"
                + "\t\t\tcΠ <- x\n"
                + "\t\t}\n"
                + "\t\tclose(cΠ)\n"
                + "\t}()\n"
                + "\treturn cΠ\n"
                + "}()");
  }

  @Test
  public void testDictComprehensionOverItems() {
    Expr inverse =
        dictComp(
            name("k"),
            name("v"),
            comp(tuple(name("k"), name("v")), call(attr(name("d"), "items"))));
    assertThat(tester.expr(inverse))
        .isEqualTo(
            "func() (mmΠ Dict) {\n"
                + "\tmmΠ = Dict{}\n"
                + "\tfor k, v := range d {\n"
                + "\t\tmmΠ[k] = v\n"
                + "\t}\n"
                + "\treturn mmΠ\n"
                + "}()");
  }

  @Test
  public void testTranslationIsRepeatable() {
    Expr doubled = listComp(binOp(name("x"), BinaryOperator.MULT, num(2)), positives());
    GoExpr first = tester.context().expressions().translate(doubled);
    GoExpr second = tester.context().expressions().translate(doubled);
    assertThat(second).isEqualTo(first);
  }

  @Test
  public void testLoopVariableDoesNotLeak() {
    tester.expr(listComp(name("x"), positives()));
    assertThat(tester.context().scope().isDeclared("x")).isFalse();
    assertThat(tester.context().scope().isRoot()).isTrue();
  }

  @Test
  public void testEagerAndLazyFormsShareTheirLoops() {
    ExpressionTranslator expressions = tester.context().expressions();
    GoExpr eager = expressions.translate(listComp(name("x"), positives()));
    GoExpr lazy = expressions.translate(generatorExp(name("x"), positives()));

    GoStmt.ForRange eagerLoop = (GoStmt.ForRange) body(eager).body().get(0);
    GoStmt.Go producer = (GoStmt.Go) body(lazy).body().get(1);
    GoStmt.ForRange lazyLoop = (GoStmt.ForRange) body(producer.call()).body().get(0);

    assertThat(lazyLoop.keys()).isEqualTo(eagerLoop.keys());
    assertThat(lazyLoop.x()).isEqualTo(eagerLoop.x());
    assertThat(((GoStmt.If) lazyLoop.body().get(0)).cond())
        .isEqualTo(((GoStmt.If) eagerLoop.body().get(0)).cond());
  }

  /** The function literal an invocation calls. */
  private static GoExpr.FuncLit body(GoExpr invocation) {
    return (GoExpr.FuncLit) ((GoExpr.Call) invocation).fun();
  }
}
