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

import com.google.pygor.ast.Expr;
import com.google.pygor.ast.Stmt;
import com.google.pygor.gen.CodePrinter;
import com.google.pygor.gen.GoExpr;
import com.google.pygor.gen.GoStmt;
import java.util.logging.Logger;

/**
 * Translates nodes in one module context and renders the results. The options may be changed
 * until the first node is translated.
 */
final class TranslationTester {
  static final String SOURCE_NAME = "test.py";

  private final TranslatorOptions options = new TranslatorOptions();
  private final LoggerErrorManager errorManager =
      new LoggerErrorManager(Logger.getLogger(TranslationTester.class.getName()));
  private TranslationContext ctx;

  TranslatorOptions options() {
    return options;
  }

  LoggerErrorManager errorManager() {
    return errorManager;
  }

  TranslationContext context() {
    if (ctx == null) {
      ctx = new TranslationContext(SOURCE_NAME, options, errorManager);
    }
    return ctx;
  }

  /** Translates and renders an expression. */
  String expr(Expr e) {
    return printer().toSource(context().expressions().translate(e));
  }

  String render(GoExpr e) {
    return printer().toSource(e);
  }

  /**
   * Translates statements into the active scope and renders everything the root scope holds.
   */
  String stmts(Stmt... stmts) {
    for (Stmt s : stmts) {
      context().statements().translate(s);
    }
    StringBuilder sb = new StringBuilder();
    for (GoStmt s : context().getRoot().getBody()) {
      sb.append(printer().toSource(s));
    }
    return sb.toString();
  }

  private CodePrinter printer() {
    return new CodePrinter(options.getRuntimePackage());
  }
}
