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
import static com.google.pygor.ast.SourceNodes.args;
import static com.google.pygor.ast.SourceNodes.assign;
import static com.google.pygor.ast.SourceNodes.call;
import static com.google.pygor.ast.SourceNodes.compare;
import static com.google.pygor.ast.SourceNodes.def;
import static com.google.pygor.ast.SourceNodes.exprStmt;
import static com.google.pygor.ast.SourceNodes.ifStmt;
import static com.google.pygor.ast.SourceNodes.module;
import static com.google.pygor.ast.SourceNodes.name;
import static com.google.pygor.ast.SourceNodes.num;
import static com.google.pygor.ast.SourceNodes.pass;
import static com.google.pygor.ast.SourceNodes.slice;
import static com.google.pygor.ast.SourceNodes.str;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.pygor.ast.CompareOperator;
import com.google.pygor.ast.Module;
import com.google.pygor.gen.GoFile;
import com.google.pygor.gen.GoIR;
import java.util.logging.Logger;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ModuleTranslator}. */
@RunWith(JUnit4.class)
public final class ModuleTranslatorTest {
  private TranslatorOptions options;
  private LoggerErrorManager errorManager;

  @Before
  public void setUp() {
    options = new TranslatorOptions();
    errorManager = new LoggerErrorManager(Logger.getLogger(ModuleTranslatorTest.class.getName()));
  }

  private GoFile translate(Module module) {
    return new ModuleTranslator(options, errorManager).translate(module);
  }

  @Test
  public void testPackageNameFor() {
    assertThat(ModuleTranslator.packageNameFor("dir/my-mod.py.json")).isEqualTo("my_mod");
    assertThat(ModuleTranslator.packageNameFor("util.py")).isEqualTo("util");
    assertThat(ModuleTranslator.packageNameFor("3d.py")).isEqualTo("_3d");
    assertThat(ModuleTranslator.packageNameFor(".py")).isEqualTo("_");
    assertThat(ModuleTranslator.packageNameFor("données.json")).isEqualTo("données");
  }

  @Test
  public void testLibraryModule() {
    GoFile file = translate(module("lib/shapes.py", assign("x", num(1))));
    assertThat(file.packageName()).isEqualTo("shapes");
    assertThat(file.decls()).containsExactly(GoIR.varDecl("x", GoIR.ident("int"), GoIR.intLit(1)));
  }

  @Test
  public void testMainGuardMakesAProgram() {
    Module program =
        module(
            "prog.py",
            def("run", args(), pass()),
            ifStmt(
                compare(name("__name__"), CompareOperator.EQ, str("__main__")),
                ImmutableList.of(exprStmt(call("run"))),
                ImmutableList.of()));
    GoFile file = translate(program);
    assertThat(file.packageName()).isEqualTo(ModuleTranslator.MAIN_PACKAGE);
    assertThat(file.decls()).hasSize(2);
  }

  @Test
  public void testFailedStatementStopsTranslation() {
    Module module =
        module("m.py", exprStmt(slice(name("xs"), null, null, num(2))), assign("y", num(1)));
    TranslationException e = assertThrows(TranslationException.class, () -> translate(module));
    assertThat(e.getError().type()).isEqualTo(TranslationDiagnostics.SLICE_STEP);
    assertThat(errorManager.getErrorCount()).isEqualTo(1);
  }

  @Test
  public void testContinueAfterErrors() {
    options.setContinueAfterErrors(true);
    Module module =
        module("m.py", exprStmt(slice(name("xs"), null, null, num(2))), assign("y", num(1)));
    GoFile file = translate(module);
    assertThat(file.decls())
        .containsExactly(
            GoIR.comment("ERROR: Slices with a step are not supported."),
            GoIR.varDecl("y", GoIR.ident("int"), GoIR.intLit(1)))
        .inOrder();
    assertThat(errorManager.getErrorCount()).isEqualTo(1);
    assertThat(errorManager.getErrors().get(0).sourceName()).isEqualTo("m.py");
  }

  @Test
  public void testScopesAreNotSharedBetweenModules() {
    ModuleTranslator translator = new ModuleTranslator(options, errorManager);
    translator.translate(module("a.py", assign("x", num(1))));
    GoFile second = translator.translate(module("b.py", assign("x", num(2))));
    assertThat(second.decls())
        .containsExactly(GoIR.varDecl("x", GoIR.ident("int"), GoIR.intLit(2)));
  }
}
