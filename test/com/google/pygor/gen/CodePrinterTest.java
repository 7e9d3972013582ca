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

import static com.google.common.truth.Truth.assertThat;
import static com.google.pygor.gen.GoIR.binary;
import static com.google.pygor.gen.GoIR.call;
import static com.google.pygor.gen.GoIR.ident;
import static com.google.pygor.gen.GoIR.qualified;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CodePrinter}. */
@RunWith(JUnit4.class)
public final class CodePrinterTest {
  private static final Joiner LINE_JOINER = Joiner.on('\n');
  private static final String RUNTIME = "github.com/pygor/runtime";

  private final CodePrinter printer = new CodePrinter(RUNTIME);

  private String print(GoExpr e) {
    return printer.toSource(e);
  }

  private String print(GoStmt s) {
    return printer.toSource(s);
  }

  private static GoStmt func(String name, GoStmt... body) {
    return new GoStmt.FuncDecl(
        null,
        name,
        ImmutableList.of(),
        ImmutableList.of(),
        ImmutableList.copyOf(body),
        ImmutableList.of());
  }

  @Test
  public void testFile() {
    GoFile file =
        new GoFile(
            "demo",
            ImmutableList.of(
                func(
                    "f",
                    GoIR.exprStmt(
                        call(
                            qualified("fmt", "Println"),
                            call(qualified(RUNTIME, "Contains"), ident("xs"), ident("x"))))),
                func("g")));

    assertThat(printer.print(file))
        .isEqualTo(
            LINE_JOINER.join(
                "// generated by pygor",
                "",
                "package demo",
                "",
                "import (",
                "\t\"fmt\"",
                "\t. \"github.com/pygor/runtime\"",
                ")",
                "",
                "func f() {",
                "\tfmt.Println(Contains(xs, x))",
                "}",
                "",
                "func g() {",
                "}",
                ""));
  }

  @Test
  public void testSingleImport() {
    GoStmt exit = GoIR.exprStmt(call(qualified("os", "Exit"), GoIR.intLit(1)));
    GoFile file = new GoFile("main", ImmutableList.of(func("main", exit)));

    assertThat(printer.print(file))
        .isEqualTo(
            LINE_JOINER.join(
                "// generated by pygor",
                "",
                "package main",
                "",
                "import \"os\"",
                "",
                "func main() {",
                "\tos.Exit(1)",
                "}",
                ""));
  }

  @Test
  public void testImportPathUsesLastElement() {
    assertThat(print(call(qualified("path/filepath", "Join"), ident("a"), ident("b"))))
        .isEqualTo("filepath.Join(a, b)");
  }

  @Test
  public void testInvalidIdentifierNamesTheStatement() {
    GoFile file =
        new GoFile(
            "demo", ImmutableList.of(func("ok"), GoIR.exprStmt(call(ident("not-valid")))));

    RenderException e = assertThrows(RenderException.class, () -> printer.print(file));
    assertThat(e).hasMessageThat().contains("top-level statement 2");
    assertThat(e).hasMessageThat().contains("not-valid");
  }

  @Test
  public void testInvalidPackageName() {
    GoFile file = new GoFile("my-pkg", ImmutableList.of());
    assertThrows(RenderException.class, () -> printer.print(file));
  }

  @Test
  public void testPrecedence() {
    assertThat(print(binary(binary(ident("a"), "+", ident("b")), "*", ident("c"))))
        .isEqualTo("(a + b) * c");
    assertThat(print(binary(ident("a"), "*", binary(ident("b"), "+", ident("c")))))
        .isEqualTo("a * (b + c)");
    assertThat(print(binary(ident("a"), "-", binary(ident("b"), "-", ident("c")))))
        .isEqualTo("a - (b - c)");
    assertThat(print(binary(binary(ident("a"), "-", ident("b")), "-", ident("c"))))
        .isEqualTo("a - b - c");
    assertThat(print(binary(ident("a"), "||", binary(ident("b"), "&&", ident("c")))))
        .isEqualTo("a || b && c");
    assertThat(print(GoIR.unary("-", GoIR.unary("-", ident("x"))))).isEqualTo("-(-x)");
    assertThat(print(GoIR.unary("!", binary(ident("a"), "==", ident("b")))))
        .isEqualTo("!(a == b)");
    assertThat(print(GoIR.selector(binary(ident("a"), "+", ident("b")), "c")))
        .isEqualTo("(a + b).c");
  }

  @Test
  public void testCompositeInIfHeaderIsParenthesized() {
    GoStmt s =
        GoIR.ifStmt(
            binary(
                GoIR.composite(qualified(RUNTIME, "List"), ImmutableList.of()), "==", ident("x")),
            ImmutableList.of(GoIR.breakStmt()));
    assertThat(print(s)).isEqualTo("if (List{}) == x {\n\tbreak\n}\n");
  }

  @Test
  public void testElseIf() {
    GoStmt s =
        GoIR.ifStmt(
            null,
            ident("a"),
            ImmutableList.of(GoIR.exprStmt(call(ident("f")))),
            ImmutableList.of(
                GoIR.ifStmt(
                    null,
                    ident("b"),
                    ImmutableList.of(GoIR.exprStmt(call(ident("g")))),
                    ImmutableList.of(GoIR.exprStmt(call(ident("h")))))));
    assertThat(print(s))
        .isEqualTo(
            LINE_JOINER.join(
                "if a {", "\tf()", "} else if b {", "\tg()", "} else {", "\th()", "}", ""));
  }

  @Test
  public void testLoops() {
    GoExpr i = ident("i");
    GoStmt threeClause =
        GoIR.forLoop(
            GoIR.define(i, GoIR.intLit(0)),
            binary(i, "<", GoIR.intLit(3)),
            GoIR.assign(ImmutableList.of(i), "+=", ImmutableList.of(GoIR.intLit(1))),
            ImmutableList.of(GoIR.continueStmt()));
    assertThat(print(threeClause)).isEqualTo("for i := 0; i < 3; i += 1 {\n\tcontinue\n}\n");

    GoStmt forever = GoIR.forLoop(null, null, null, ImmutableList.of(GoIR.breakStmt()));
    assertThat(print(forever)).isEqualTo("for {\n\tbreak\n}\n");

    GoStmt range =
        GoIR.forRange(
            ImmutableList.of(ident("_"), ident("v")), ident("xs"), ImmutableList.of());
    assertThat(print(range)).isEqualTo("for _, v := range xs {\n}\n");

    GoStmt drain = GoIR.forRange(ImmutableList.of(), ident("c"), ImmutableList.of());
    assertThat(print(drain)).isEqualTo("for range c {\n}\n");
  }

  @Test
  public void testTypeSwitch() {
    GoStmt s =
        GoIR.switchStmt(
            null,
            GoIR.typeAssert(ident("err"), null),
            ImmutableList.of(
                GoIR.caseClause(
                    ImmutableList.of(ident("A"), ident("B")),
                    ImmutableList.of(GoIR.returnStmt(ident("true")))),
                GoIR.caseClause(ImmutableList.of(), ImmutableList.of(GoIR.breakStmt()))));
    assertThat(print(s))
        .isEqualTo(
            LINE_JOINER.join(
                "switch err.(type) {",
                "case A, B:",
                "\treturn true",
                "default:",
                "\tbreak",
                "}",
                ""));
  }

  @Test
  public void testFunctionLiteralCalledInPlace() {
    GoExpr e =
        GoIR.invoke(
            ImmutableList.of(Param.of("r", ident("int"))),
            ImmutableList.of(GoIR.returnStmt(ident("r"))));
    assertThat(print(e)).isEqualTo("func() (r int) {\n\treturn r\n}()");
  }

  @Test
  public void testMethodWithDocAndParameters() {
    GoStmt method =
        new GoStmt.FuncDecl(
            Param.of("self", GoIR.pointer(ident("Point"))),
            "Move",
            ImmutableList.of(
                Param.of("dx", ident("int")),
                new Param("rest", GoIR.ellipsis(ident("Any")), null),
                new Param("dy", ident("int"), GoIR.intLit(0))),
            ImmutableList.of(Param.unnamed(ident("int")), Param.unnamed(ident("error"))),
            ImmutableList.of(GoIR.returnStmt(ident("dx"), GoIR.nil())),
            ImmutableList.of("@decorated", "Moves the point."));
    assertThat(print(method))
        .isEqualTo(
            LINE_JOINER.join(
                "// @decorated",
                "// Moves the point.",
                "func (self *Point) Move(dx int, rest ...Any, dy int /*= 0 */) (int, error) {",
                "\treturn dx, nil",
                "}",
                ""));
  }

  @Test
  public void testStruct() {
    GoStmt type =
        new GoStmt.TypeDecl(
            "Point",
            ImmutableList.of("A point."),
            ImmutableList.of(
                Field.embedded(ident("Base")),
                Field.named("x", ident("int"), GoIR.intLit(0)),
                Field.commentLine("extra")));
    assertThat(print(type))
        .isEqualTo(
            LINE_JOINER.join(
                "// A point.",
                "type Point struct {",
                "\tBase",
                "\tx int // = 0",
                "\t// extra",
                "}",
                ""));

    GoStmt empty = new GoStmt.TypeDecl("Empty", ImmutableList.of(), ImmutableList.of());
    assertThat(print(empty)).isEqualTo("type Empty struct{}\n");
  }

  @Test
  public void testComments() {
    assertThat(print(GoIR.comment("one\ntwo"))).isEqualTo("// one\n// two\n");
    assertThat(print(GoIR.comment("release: ", ident("f")))).isEqualTo("// release: f\n");
    assertThat(print(GoIR.commented(GoIR.returnStmt(ident("err")), "re-raise")))
        .isEqualTo("return err // re-raise\n");
    assertThat(print(GoIR.trailingComment(GoIR.nil(), " note */ here ")))
        .isEqualTo("nil /* note * / here */");
    assertThat(print(binary(ident("a"), "/", GoIR.leadingComment("floor", ident("b")))))
        .isEqualTo("a / /*floor*/ b");
  }

  @Test
  public void testCodeInCommentsIsSingleLine() {
    GoExpr lambda =
        GoIR.funcLit(
            ImmutableList.of(),
            ImmutableList.of(Param.unnamed(ident("int"))),
            ImmutableList.of(GoIR.returnStmt(GoIR.intLit(1))));
    assertThat(CodePrinter.toSingleLine(lambda, RUNTIME)).isEqualTo("func() int { return 1 }");
    assertThat(print(GoIR.comment("@", call(ident("deco"), lambda))))
        .isEqualTo("// @deco(func() int { return 1 })\n");
  }

  @Test
  public void testStringLiterals() {
    assertThat(print(GoIR.stringLit("a\"b\n\tc\\"))).isEqualTo("\"a\\\"b\\n\\tc\\\\\"");
    assertThat(print(GoIR.stringLit("\u0001"))).isEqualTo("\"\\x01\"");
    assertThat(print(GoIR.stringLit("\u03c0"))).isEqualTo("\"\u03c0\"");
  }

  @Test
  public void testGoroutineAndSend() {
    GoStmt producer =
        GoIR.go(
            call(
                GoIR.funcLit(
                    ImmutableList.of(),
                    ImmutableList.of(),
                    ImmutableList.of(GoIR.send(ident("c"), GoIR.intLit(1))))));
    assertThat(print(producer)).isEqualTo("go func() {\n\tc <- 1\n}()\n");
  }

  @Test
  public void testVarDeclarations() {
    assertThat(print(GoIR.varDecl("x", ident("int"), GoIR.intLit(1)))).isEqualTo("var x int = 1\n");
    assertThat(print(GoIR.varDecl("x", null, call(ident("f"))))).isEqualTo("var x = f()\n");
    assertThat(print(GoIR.varDecl("x", ident("Any"), null))).isEqualTo("var x Any\n");
  }
}
