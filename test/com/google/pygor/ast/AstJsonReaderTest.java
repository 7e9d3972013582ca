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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link AstJsonReader}. */
@RunWith(JUnit4.class)
public final class AstJsonReaderTest {
  private static final Joiner LINE_JOINER = Joiner.on('\n');

  private static Module read(String json) throws AstReadException {
    return AstJsonReader.read("test.py", json);
  }

  /** Reads a module with one expression statement and returns the expression. */
  private static Expr readExpr(String exprJson) throws AstReadException {
    Module module =
        read(
            "{\"_type\": \"Module\", \"body\": [{\"_type\": \"Expr\", \"value\": "
                + exprJson
                + "}]}");
    return ((Stmt.ExprStmt) module.body().get(0)).value();
  }

  private static Expr.Num readNumber(String exprJson) throws AstReadException {
    return (Expr.Num) readExpr(exprJson);
  }

  @Test
  public void testAssignmentWithPosition() throws Exception {
    Module module =
        read(
            LINE_JOINER.join(
                "{\"_type\": \"Module\", \"body\": [",
                "  {\"_type\": \"Assign\", \"lineno\": 3, \"col_offset\": 4,",
                "   \"targets\": [{\"_type\": \"Name\", \"id\": \"x\"}],",
                "   \"value\": {\"_type\": \"Constant\", \"value\": 1}}",
                "]}"));

    assertThat(module.sourceName()).isEqualTo("test.py");
    assertThat(module.body()).hasSize(1);
    Stmt.Assign assign = (Stmt.Assign) module.body().get(0);
    assertThat(assign.position()).isEqualTo(SourcePosition.of(3, 4));
    assertThat(assign.targets()).containsExactly(new Expr.Name("x", SourcePosition.UNKNOWN));
    assertThat(assign.value())
        .isEqualTo(new Expr.Num(NumberKind.INT, "1", SourcePosition.UNKNOWN));
  }

  @Test
  public void testNumberKindFollowsTheLiteralText() throws Exception {
    assertThat(readNumber("{\"_type\": \"Constant\", \"value\": 42}").numberKind())
        .isEqualTo(NumberKind.INT);
    assertThat(readNumber("{\"_type\": \"Constant\", \"value\": 1.0}").numberKind())
        .isEqualTo(NumberKind.FLOAT);
    assertThat(readNumber("{\"_type\": \"Num\", \"n\": 1e3}").numberKind())
        .isEqualTo(NumberKind.FLOAT);
    assertThat(readNumber("{\"_type\": \"Num\", \"n\": \"2j\"}").numberKind())
        .isEqualTo(NumberKind.COMPLEX);
    assertThat(readNumber("{\"_type\": \"Constant\", \"value\": \"0x1E\", \"kind\": \"int\"}")
            .numberKind())
        .isEqualTo(NumberKind.INT);
  }

  @Test
  public void testFloatKeepsItsText() throws Exception {
    Expr.Num num = readNumber("{\"_type\": \"Constant\", \"value\": 1.0}");
    assertThat(num.text()).isEqualTo("1.0");
  }

  @Test
  public void testLegacyAndModernLiterals() throws Exception {
    assertThat(readExpr("{\"_type\": \"Str\", \"s\": \"hi\"}"))
        .isEqualTo(new Expr.Str("hi", SourcePosition.UNKNOWN));
    assertThat(readExpr("{\"_type\": \"Constant\", \"value\": \"hi\"}"))
        .isEqualTo(new Expr.Str("hi", SourcePosition.UNKNOWN));
    assertThat(readExpr("{\"_type\": \"NameConstant\", \"value\": true}"))
        .isEqualTo(new Expr.NameConstant(Expr.Singleton.TRUE, SourcePosition.UNKNOWN));
    assertThat(readExpr("{\"_type\": \"Constant\", \"value\": null}"))
        .isEqualTo(new Expr.NameConstant(Expr.Singleton.NONE, SourcePosition.UNKNOWN));
  }

  @Test
  public void testStarredArgumentAndKeywordSpread() throws Exception {
    Expr.Call call =
        (Expr.Call)
            readExpr(
                LINE_JOINER.join(
                    "{\"_type\": \"Call\", \"func\": {\"_type\": \"Name\", \"id\": \"f\"},",
                    " \"args\": [{\"_type\": \"Name\", \"id\": \"a\"},",
                    "   {\"_type\": \"Starred\",",
                    "    \"value\": {\"_type\": \"Name\", \"id\": \"rest\"}}],",
                    " \"keywords\": [",
                    "   {\"arg\": \"sep\",",
                    "    \"value\": {\"_type\": \"Constant\", \"value\": \",\"}},",
                    "   {\"arg\": null, \"value\": {\"_type\": \"Name\", \"id\": \"kw\"}}]}"));

    assertThat(call.args()).containsExactly(new Expr.Name("a", SourcePosition.UNKNOWN));
    assertThat(call.starargs()).isEqualTo(new Expr.Name("rest", SourcePosition.UNKNOWN));
    assertThat(call.keywords()).hasSize(1);
    assertThat(call.keywords().get(0).arg()).isEqualTo("sep");
    assertThat(call.kwargs()).isEqualTo(new Expr.Name("kw", SourcePosition.UNKNOWN));
  }

  @Test
  public void testYieldStatements() throws Exception {
    Module module =
        read(
            LINE_JOINER.join(
                "{\"_type\": \"Module\", \"body\": [",
                "  {\"_type\": \"Expr\", \"value\": {\"_type\": \"Yield\", \"value\": null}},",
                "  {\"_type\": \"Expr\", \"value\": {\"_type\": \"YieldFrom\",",
                "     \"value\": {\"_type\": \"Name\", \"id\": \"g\"}}}",
                "]}"));

    assertThat(module.body().get(0)).isInstanceOf(Stmt.Yield.class);
    assertThat(((Stmt.Yield) module.body().get(0)).value()).isNull();
    assertThat(module.body().get(1)).isInstanceOf(Stmt.YieldFrom.class);
  }

  @Test
  public void testSlices() throws Exception {
    Expr.Subscript modern =
        (Expr.Subscript)
            readExpr(
                LINE_JOINER.join(
                    "{\"_type\": \"Subscript\", \"value\": {\"_type\": \"Name\", \"id\": \"x\"},",
                    " \"slice\": {\"_type\": \"Slice\", \"lower\": null,",
                    "   \"upper\": {\"_type\": \"Constant\", \"value\": 2}, \"step\": null}}"));
    assertThat(modern.slice()).isInstanceOf(Slicer.Slice.class);
    assertThat(((Slicer.Slice) modern.slice()).lower()).isNull();

    Expr.Subscript legacy =
        (Expr.Subscript)
            readExpr(
                LINE_JOINER.join(
                    "{\"_type\": \"Subscript\", \"value\": {\"_type\": \"Name\", \"id\": \"x\"},",
                    " \"slice\": {\"_type\": \"Index\",",
                    "   \"value\": {\"_type\": \"Num\", \"n\": 0}}}"));
    assertThat(legacy.slice()).isInstanceOf(Slicer.Index.class);

    Expr.Subscript multiAxis =
        (Expr.Subscript)
            readExpr(
                LINE_JOINER.join(
                    "{\"_type\": \"Subscript\", \"value\": {\"_type\": \"Name\", \"id\": \"m\"},",
                    " \"slice\": {\"_type\": \"Tuple\", \"elts\": [",
                    "   {\"_type\": \"Slice\"}, {\"_type\": \"Constant\", \"value\": 0}]}}"));
    assertThat(multiAxis.slice()).isInstanceOf(Slicer.ExtSlice.class);
  }

  @Test
  public void testFunctionArguments() throws Exception {
    Module module =
        read(
            LINE_JOINER.join(
                "{\"_type\": \"Module\", \"body\": [{\"_type\": \"FunctionDef\", \"name\": \"f\",",
                " \"args\": {\"_type\": \"arguments\",",
                "   \"args\": [{\"_type\": \"arg\", \"arg\": \"a\"},",
                "     {\"_type\": \"arg\", \"arg\": \"b\"}],",
                "   \"defaults\": [{\"_type\": \"Constant\", \"value\": 1}],",
                "   \"vararg\": {\"_type\": \"arg\", \"arg\": \"rest\"},",
                "   \"kwonlyargs\": [{\"_type\": \"arg\", \"arg\": \"k\"}],",
                "   \"kw_defaults\": [null],",
                "   \"kwarg\": null},",
                " \"body\": [{\"_type\": \"Pass\"}], \"decorator_list\": []}]}"));

    Stmt.FunctionDef def = (Stmt.FunctionDef) module.body().get(0);
    Arguments args = def.args();
    assertThat(args.args()).hasSize(2);
    assertThat(args.defaultFor(0)).isNull();
    assertThat(args.defaultFor(1))
        .isEqualTo(new Expr.Num(NumberKind.INT, "1", SourcePosition.UNKNOWN));
    assertThat(args.vararg().name()).isEqualTo("rest");
    assertThat(args.kwDefaults()).hasSize(1);
    assertThat(args.kwDefaults().get(0).isPresent()).isFalse();
    assertThat(args.kwarg()).isNull();
    assertThat(def.returns()).isNull();
  }

  @Test
  public void testUnknownShapes() throws Exception {
    assertThat(readExpr("{\"_type\": \"JoinedStr\", \"values\": []}"))
        .isEqualTo(new Expr.Unknown("JoinedStr", SourcePosition.UNKNOWN));
    assertThat(
            readExpr(
                "{\"_type\": \"Dict\", \"keys\": [null],"
                    + " \"values\": [{\"_type\": \"Name\", \"id\": \"d\"}]}"))
        .isEqualTo(new Expr.Unknown("DictUnpack", SourcePosition.UNKNOWN));

    Module module = read("{\"_type\": \"Module\", \"body\": [{\"_type\": \"Match\"}]}");
    assertThat(module.body()).containsExactly(new Stmt.Unknown("Match", SourcePosition.UNKNOWN));
  }

  @Test
  public void testMalformedDocuments() {
    assertThrows(AstReadException.class, () -> read("{not json"));
    assertThrows(AstReadException.class, () -> read("[]"));
    assertThrows(AstReadException.class, () -> read("{\"_type\": \"Expression\", \"body\": []}"));
    assertThrows(
        AstReadException.class,
        () -> read("{\"_type\": \"Module\", \"body\": [{\"targets\": []}]}"));
  }
}
