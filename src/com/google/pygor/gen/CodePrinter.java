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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Renders fragments as output source text: the file header, the package clause, the import block
 * discovered from qualified names, and the top-level declarations.
 */
public final class CodePrinter {
  /** First line of every rendered file. */
  public static final String HEADER = "// generated by pygor";

  private final String runtimePackage;

  public CodePrinter(String runtimePackage) {
    this.runtimePackage = requireNonNull(runtimePackage);
  }

  /**
   * Renders a whole file.
   *
   * @throws RenderException if a top-level fragment cannot be rendered; the message names the
   *     fragment's position in the file.
   */
  public String print(GoFile file) {
    Set<String> imports = new TreeSet<>();
    ImmutableList.Builder<String> decls = ImmutableList.builder();
    int i = 0;
    for (GoStmt decl : file.decls()) {
      i++;
      try {
        decls.add(render(decl, imports));
      } catch (RenderException e) {
        throw new RenderException("top-level statement " + i + ": " + e.getMessage(), e);
      }
    }
    if (!CodeConsumer.isValidIdentifier(file.packageName())) {
      throw new RenderException("invalid package name \"" + file.packageName() + "\"");
    }

    StringBuilder sb = new StringBuilder();
    sb.append(HEADER).append("\n\n");
    sb.append("package ").append(file.packageName()).append("\n");
    if (!imports.isEmpty()) {
      sb.append('\n');
      if (imports.size() == 1) {
        sb.append("import ").append(importSpec(imports.iterator().next())).append('\n');
      } else {
        sb.append("import (\n");
        for (String path : imports) {
          sb.append('\t').append(importSpec(path)).append('\n');
        }
        sb.append(")\n");
      }
    }
    for (String decl : decls.build()) {
      sb.append('\n').append(decl);
    }
    return sb.toString();
  }

  /** Renders a single statement, ending with a newline. Imports it needs are discarded. */
  public String toSource(GoStmt stmt) {
    return render(stmt, new HashSet<>());
  }

  /** Renders a single expression. */
  public String toSource(GoExpr expr) {
    PrettyCodePrinter printer = new PrettyCodePrinter();
    new CodeGenerator(printer, runtimePackage, new HashSet<>()).addExpr(expr, 0);
    return printer.getCode();
  }

  private String render(GoStmt stmt, Set<String> imports) {
    PrettyCodePrinter printer = new PrettyCodePrinter();
    new CodeGenerator(printer, runtimePackage, imports).addStatement(stmt);
    return printer.getCode();
  }

  private String importSpec(String path) {
    String quoted = CodeGenerator.quote(path);
    return path.equals(runtimePackage) ? ". " + quoted : quoted;
  }

  /** Renders an expression on one line, for embedding in a comment. */
  public static String toSingleLine(GoExpr expr, String runtimePackage) {
    CompactCodePrinter printer = new CompactCodePrinter();
    new CodeGenerator(printer, runtimePackage, new HashSet<>()).addExpr(expr, 0);
    return printer.getCode();
  }

  /** Tab-indented, one statement per line. */
  static class PrettyCodePrinter extends CodeConsumer {
    private final StringBuilder code = new StringBuilder(1024);
    private int indent = 0;
    private boolean lineStarted = false;

    @Override
    void append(String str) {
      if (!lineStarted) {
        code.append("\t".repeat(indent));
        lineStarted = true;
      }
      code.append(str);
    }

    @Override
    void startNewLine() {
      code.append('\n');
      lineStarted = false;
    }

    @Override
    void increaseIndent() {
      indent++;
    }

    @Override
    void decreaseIndent() {
      indent--;
    }

    @Override
    void addLineComment(String text) {
      append(text.isEmpty() ? "//" : "// " + text.replace('\n', ' '));
    }

    String getCode() {
      return code.toString();
    }
  }

  /** Everything on one line; statements are separated by semicolons. */
  static class CompactCodePrinter extends CodeConsumer {
    private final StringBuilder code = new StringBuilder();
    private String pendingSeparator = "";

    @Override
    void append(String str) {
      code.append(pendingSeparator);
      pendingSeparator = "";
      code.append(str);
    }

    @Override
    void startNewLine() {
      if (pendingSeparator.isEmpty()) {
        pendingSeparator = " ";
      }
    }

    @Override
    void endStatement() {
      pendingSeparator = "; ";
    }

    @Override
    void endBlock() {
      pendingSeparator = " ";
      append("}");
    }

    @Override
    void addLineComment(String text) {
      addBlockComment(" " + text + " ");
    }

    String getCode() {
      return code.toString();
    }
  }
}
