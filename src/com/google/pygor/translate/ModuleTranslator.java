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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.pygor.ast.Module;
import com.google.pygor.ast.Stmt;
import com.google.pygor.gen.GoFile;
import com.google.pygor.gen.GoIR;
import java.io.File;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Translates one module into a file of top-level fragments. A fresh set of scopes is used for
 * every module, so an instance can translate any number of them one after the other.
 */
public final class ModuleTranslator {
  private static final Logger logger = Logger.getLogger(ModuleTranslator.class.getName());

  /** Package name of a program with an entry point. */
  public static final String MAIN_PACKAGE = "main";

  /** Stripped from the file name in this order. */
  private static final ImmutableList<String> EXTENSIONS = ImmutableList.of(".json", ".py");

  private static final Pattern NOT_IDENTIFIER_PART = Pattern.compile("[^\\p{L}\\p{N}_]");

  private final TranslatorOptions options;
  private final ErrorManager errorManager;

  public ModuleTranslator(TranslatorOptions options, ErrorManager errorManager) {
    this.options = requireNonNull(options);
    this.errorManager = requireNonNull(errorManager);
  }

  /**
   * Translates {@code module}.
   *
   * @throws TranslationException if a top-level statement cannot be translated and the options
   *     do not allow continuing after errors. The error has been reported already.
   */
  public GoFile translate(Module module) {
    TranslationContext ctx = new TranslationContext(module.sourceName(), options, errorManager);
    for (Stmt s : module.body()) {
      try {
        ctx.statements().translate(s);
      } catch (TranslationException e) {
        errorManager.report(CheckLevel.ERROR, e.getError());
        if (!options.isContinueAfterErrors()) {
          throw e;
        }
        ctx.resetToRoot();
        ctx.scope().add(GoIR.comment("ERROR: " + e.getError().description()));
      }
    }
    if (options.isVerbose()) {
      logger.info(
          module.sourceName() + ": " + module.body().size() + " top-level statement(s) translated");
    }
    String packageName =
        ctx.isMainGuardSeen() ? MAIN_PACKAGE : packageNameFor(module.sourceName());
    return new GoFile(packageName, ctx.getRoot().getBody());
  }

  /**
   * The package name for a source file: its base name without the {@code .json} and {@code .py}
   * extensions, with characters that cannot appear in an identifier replaced by underscores.
   */
  @VisibleForTesting
  static String packageNameFor(String sourceName) {
    String name = new File(sourceName).getName();
    for (String extension : EXTENSIONS) {
      if (name.endsWith(extension)) {
        name = name.substring(0, name.length() - extension.length());
      }
    }
    name = NOT_IDENTIFIER_PART.matcher(name).replaceAll("_");
    if (name.isEmpty()) {
      return "_";
    }
    return Character.isDigit(name.charAt(0)) ? "_" + name : name;
  }
}
