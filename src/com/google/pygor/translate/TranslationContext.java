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

import static java.util.Objects.requireNonNull;

import com.google.pygor.ast.SourcePosition;
import com.google.pygor.gen.GoExpr;
import com.google.pygor.gen.GoIR;
import com.google.pygor.gen.GoStmt;

/**
 * State shared by the translators while one module is translated: the options, the error
 * manager, the active scope, and the translators themselves, which call each other through it.
 */
final class TranslationContext {
  private final String sourceName;
  private final TranslatorOptions options;
  private final ErrorManager errorManager;
  private final Scope root;
  private Scope scope;
  private boolean mainGuardSeen = false;

  private final ExpressionTranslator expressions;
  private final CallTranslator calls;
  private final ComprehensionDesugarer comprehensions;
  private final StatementTranslator statements;
  private final DeclarationTranslator declarations;

  TranslationContext(String sourceName, TranslatorOptions options, ErrorManager errorManager) {
    this.sourceName = requireNonNull(sourceName);
    this.options = requireNonNull(options);
    this.errorManager = requireNonNull(errorManager);
    this.root = Scope.createRoot(options.isVerbose());
    this.scope = root;
    this.expressions = new ExpressionTranslator(this);
    this.calls = new CallTranslator(this);
    this.comprehensions = new ComprehensionDesugarer(this);
    this.statements = new StatementTranslator(this);
    this.declarations = new DeclarationTranslator(this);
  }

  String getSourceName() {
    return sourceName;
  }

  TranslatorOptions getOptions() {
    return options;
  }

  ErrorManager getErrorManager() {
    return errorManager;
  }

  ExpressionTranslator expressions() {
    return expressions;
  }

  CallTranslator calls() {
    return calls;
  }

  ComprehensionDesugarer comprehensions() {
    return comprehensions;
  }

  StatementTranslator statements() {
    return statements;
  }

  DeclarationTranslator declarations() {
    return declarations;
  }

  /** The active scope. */
  Scope scope() {
    return scope;
  }

  Scope getRoot() {
    return root;
  }

  Scope pushScope() {
    scope = scope.push();
    return scope;
  }

  Scope pushScope(ExitMode mode) {
    scope = scope.push(mode);
    return scope;
  }

  void popScope(boolean promoteExitMode) {
    scope = scope.pop(promoteExitMode);
  }

  /**
   * Abandons the scopes a failed statement left open. Their fragments and buffered methods are
   * dropped with them.
   */
  void resetToRoot() {
    scope = root;
  }

  void noteMainGuard() {
    mainGuardSeen = true;
  }

  boolean isMainGuardSeen() {
    return mainGuardSeen;
  }

  /** A name exported by the runtime package. */
  GoExpr runtime(String name) {
    return GoIR.qualified(options.getRuntimePackage(), name);
  }

  /** Creates the exception for a construct that can never be lowered. */
  TranslationException hardFailure(
      SourcePosition position, DiagnosticType type, String... arguments) {
    return new TranslationException(TranslationError.make(sourceName, position, type, arguments));
  }

  /**
   * Handles an expression without a rule: throws in PANIC mode, otherwise reports a warning and
   * returns a marker expression.
   */
  GoExpr unsupportedExpr(SourcePosition position, DiagnosticType type, String what) {
    reportUnsupported(position, type, what);
    return GoIR.trailingComment(
        GoIR.nil(), " UNKNOWN-EXPR: " + what + " at " + position + " ");
  }

  /** As {@link #unsupportedExpr}, for statements. */
  GoStmt unsupportedStmt(SourcePosition position, DiagnosticType type, String what) {
    reportUnsupported(position, type, what);
    return GoIR.comment("UNKNOWN-STMT: " + what + " at " + position);
  }

  private void reportUnsupported(SourcePosition position, DiagnosticType type, String what) {
    TranslationError error = TranslationError.make(sourceName, position, type, what);
    if (options.getUnknownConstructMode() == TranslatorOptions.UnknownConstructMode.PANIC) {
      throw new TranslationException(error);
    }
    errorManager.report(CheckLevel.WARNING, error);
  }
}
