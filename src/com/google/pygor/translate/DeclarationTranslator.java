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

import static com.google.pygor.gen.GoIR.ident;

import com.google.common.collect.ImmutableList;
import com.google.pygor.ast.Arg;
import com.google.pygor.ast.Arguments;
import com.google.pygor.ast.Expr;
import com.google.pygor.ast.Keyword;
import com.google.pygor.ast.Stmt;
import com.google.pygor.gen.CodePrinter;
import com.google.pygor.gen.Field;
import com.google.pygor.gen.GoExpr;
import com.google.pygor.gen.GoIR;
import com.google.pygor.gen.GoStmt;
import com.google.pygor.gen.Param;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Translates function and class definitions.
 *
 * <p>A function at the top level becomes a function declaration, a nested one a function literal
 * bound to its name. A class becomes a struct type; its methods become functions with a receiver,
 * buffered in the scope until the type has been emitted.
 */
final class DeclarationTranslator {
  private static final Logger logger = Logger.getLogger(DeclarationTranslator.class.getName());

  /** The method name, and the signature, of the string conversion method. */
  private static final String STRINGER = "__str__";

  private final TranslationContext ctx;

  DeclarationTranslator(TranslationContext ctx) {
    this.ctx = ctx;
  }

  /**
   * A translated parameter list.
   *
   * @param receiver The receiver of a method, or null.
   */
  record Signature(@Nullable Param receiver, ImmutableList<Param> params) {}

  /** The parts of a translated function, before they are put into declaration form. */
  private record FunctionParts(
      Signature signature, ImmutableList<Param> results, ImmutableList<GoStmt> body) {}

  /**
   * Translates {@code args} and declares the parameter names in the active scope, which must be
   * the scope of the function body.
   *
   * @param className The class whose method is translated; its first positional parameter
   *     becomes the receiver. Null for plain functions.
   */
  Signature parameters(Arguments args, @Nullable String className) {
    Param receiver = null;
    ImmutableList.Builder<Param> params = ImmutableList.builder();
    for (int i = 0; i < args.args().size(); i++) {
      Arg arg = args.args().get(i);
      ctx.scope().declare(arg.name());
      if (i == 0 && className != null) {
        GoExpr type = GoIR.pointer(ident(RenameTable.rename(className)));
        receiver = Param.of(RenameTable.rename(arg.name()), type);
        continue;
      }
      params.add(parameter(arg, args.defaultFor(i)));
    }
    for (int i = 0; i < args.kwonlyargs().size(); i++) {
      Arg arg = args.kwonlyargs().get(i);
      ctx.scope().declare(arg.name());
      params.add(parameter(arg, args.kwDefaults().get(i).orElse(null)));
    }
    GoExpr any = ctx.runtime("Any");
    if (args.vararg() != null) {
      ctx.scope().declare(args.vararg().name());
      // Only the last parameter can be variadic.
      GoExpr type = args.kwarg() == null ? GoIR.ellipsis(any) : GoIR.sliceType(any);
      params.add(Param.of(RenameTable.rename(args.vararg().name()), type));
    }
    if (args.kwarg() != null) {
      ctx.scope().declare(args.kwarg().name());
      params.add(Param.of(RenameTable.rename(args.kwarg().name()), ctx.runtime("Dict")));
    }
    return new Signature(receiver, params.build());
  }

  private Param parameter(Arg arg, @Nullable Expr defaultValue) {
    GoExpr type =
        arg.annotation() == null
            ? ctx.runtime("Any")
            : ctx.expressions().typeExpr(arg.annotation());
    return new Param(
        RenameTable.rename(arg.name()),
        type,
        defaultValue == null ? null : ctx.expressions().translate(defaultValue));
  }

  /** Translates a function definition outside of a class body. */
  ImmutableList<GoStmt> function(Stmt.FunctionDef def) {
    boolean isNew = ctx.scope().declareOrAssign(def.name());
    ImmutableList<String> doc = doc(def.decorators(), def.body());
    FunctionParts parts = lower(def, null);
    String name = RenameTable.rename(def.name());
    if (ctx.scope().isRoot()) {
      return ImmutableList.of(
          new GoStmt.FuncDecl(
              null, name, parts.signature().params(), parts.results(), parts.body(), doc));
    }
    ImmutableList.Builder<GoStmt> out = ImmutableList.builder();
    for (String line : doc) {
      out.add(GoIR.comment(line));
    }
    GoExpr literal =
        GoIR.funcLit(parts.signature().params(), parts.results(), parts.body());
    out.add(isNew ? GoIR.define(ident(name), literal) : GoIR.assign(ident(name), literal));
    return out.build();
  }

  /** Translates a function definition in the body of {@code className} into a method. */
  GoStmt.FuncDecl method(Stmt.FunctionDef def, String className) {
    ImmutableList<String> doc = doc(def.decorators(), def.body());
    FunctionParts parts = lower(def, className);
    String name = RenameTable.rename(def.name());
    ImmutableList<Param> results = parts.results();
    if (def.name().equals(STRINGER)) {
      name = "String";
      results = ImmutableList.of(Param.unnamed(ident("string")));
    }
    return new GoStmt.FuncDecl(
        parts.signature().receiver(),
        name,
        parts.signature().params(),
        results,
        parts.body(),
        doc);
  }

  private FunctionParts lower(Stmt.FunctionDef def, @Nullable String className) {
    ctx.pushScope(ExitMode.NO_EXIT_SEEN);
    Signature signature = parameters(def.args(), className);
    ImmutableList<GoStmt> body =
        ctx.statements().translateStatements(withoutDocstring(def.body()));
    ExitMode exitMode = ctx.scope().getExitMode();
    ctx.popScope(false);
    if (ctx.getOptions().isVerbose()) {
      logger.info("function " + def.name() + " exits with " + exitMode);
    }
    return new FunctionParts(signature, results(def.returns(), exitMode), body);
  }

  /**
   * The declared results: none for a {@code None} annotation, one per element of a tuple
   * annotation. Without an annotation a function that returns or yields a value returns Any.
   */
  private ImmutableList<Param> results(@Nullable Expr returns, ExitMode exitMode) {
    if (returns == null) {
      return exitMode.returnsValue()
          ? ImmutableList.of(Param.unnamed(ctx.runtime("Any")))
          : ImmutableList.of();
    }
    if (returns instanceof Expr.NameConstant constant
        && constant.value() == Expr.Singleton.NONE) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<Param> results = ImmutableList.builder();
    if (returns instanceof Expr.TupleLiteral tuple) {
      for (Expr e : tuple.elts()) {
        results.add(Param.unnamed(ctx.expressions().typeExpr(e)));
      }
    } else {
      results.add(Param.unnamed(ctx.expressions().typeExpr(returns)));
    }
    return results.build();
  }

  /**
   * Translates a class definition. The type declaration goes straight into the enclosing scope,
   * ahead of the methods, and nothing is returned.
   */
  ImmutableList<GoStmt> classDef(Stmt.ClassDef def) {
    ImmutableList<String> doc = doc(def.decorators(), def.body());
    Scope enclosing = ctx.scope();
    ctx.pushScope(ExitMode.NOT_A_FUNCTION);
    ImmutableList.Builder<Field> fields = ImmutableList.builder();
    for (Expr base : def.bases()) {
      if (base instanceof Expr.Name name && name.id().equals("object")) {
        continue;
      }
      fields.add(Field.embedded(ctx.expressions().typeExpr(base)));
    }
    for (Keyword keyword : def.keywords()) {
      fields.add(
          Field.commentLine(
              keyword.arg() + "=" + singleLine(ctx.expressions().translate(keyword.value()))));
    }
    for (Stmt s : withoutDocstring(def.body())) {
      switch (s.kind()) {
        case PASS:
          break;
        case ASSIGN:
          classAssign((Stmt.Assign) s, fields);
          break;
        case ANN_ASSIGN:
          {
            Stmt.AnnAssign assign = (Stmt.AnnAssign) s;
            if (!(assign.target() instanceof Expr.Name name)) {
              throw ctx.hardFailure(
                  s.position(), TranslationDiagnostics.CLASS_BODY_STATEMENT, "annotated attribute");
            }
            fields.add(
                Field.named(
                    RenameTable.rename(name.id()),
                    ctx.expressions().typeExpr(assign.annotation()),
                    assign.value() == null ? null : ctx.expressions().translate(assign.value())));
            break;
          }
        case FUNCTION_DEF:
          ctx.scope().addMethod(method((Stmt.FunctionDef) s, def.name()));
          break;
        case EXPR:
          if (((Stmt.ExprStmt) s).value() instanceof Expr.Str str) {
            fields.add(Field.commentLine(str.value().strip()));
            break;
          }
          throw ctx.hardFailure(
              s.position(), TranslationDiagnostics.CLASS_BODY_STATEMENT, "expression");
        default:
          throw ctx.hardFailure(
              s.position(),
              TranslationDiagnostics.CLASS_BODY_STATEMENT,
              s.kind().name().toLowerCase(Locale.ROOT));
      }
    }
    enclosing.add(new GoStmt.TypeDecl(RenameTable.rename(def.name()), doc, fields.build()));
    ctx.popScope(false);
    ctx.scope().declare(def.name());
    return ImmutableList.of();
  }

  /** Class attributes become fields typed after their value, which is kept as a comment. */
  private void classAssign(Stmt.Assign assign, ImmutableList.Builder<Field> fields) {
    GoExpr value = ctx.expressions().translate(assign.value());
    GoExpr guess = ctx.expressions().typeGuess(assign.value());
    for (Expr target : assign.targets()) {
      if (!(target instanceof Expr.Name name)) {
        throw ctx.hardFailure(
            assign.position(),
            TranslationDiagnostics.CLASS_BODY_STATEMENT,
            "assignment to " + target.kind());
      }
      fields.add(
          Field.named(
              RenameTable.rename(name.id()), guess == null ? ctx.runtime("Any") : guess, value));
    }
  }

  /** Decorators, then the docstring, as documentation lines. */
  private ImmutableList<String> doc(List<Expr> decorators, List<Stmt> body) {
    ImmutableList.Builder<String> doc = ImmutableList.builder();
    for (Expr decorator : decorators) {
      doc.add("@" + singleLine(ctx.expressions().translate(decorator)));
    }
    String docstring = docstring(body);
    if (docstring != null) {
      for (String line : docstring.strip().split("\n", -1)) {
        doc.add(line.strip());
      }
    }
    return doc.build();
  }

  private String singleLine(GoExpr e) {
    return CodePrinter.toSingleLine(e, ctx.getOptions().getRuntimePackage());
  }

  private static @Nullable String docstring(List<Stmt> body) {
    if (!body.isEmpty()
        && body.get(0) instanceof Stmt.ExprStmt first
        && first.value() instanceof Expr.Str str) {
      return str.value();
    }
    return null;
  }

  private static List<Stmt> withoutDocstring(List<Stmt> body) {
    return docstring(body) == null ? body : body.subList(1, body.size());
  }
}
