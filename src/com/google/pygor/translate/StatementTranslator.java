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

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.pygor.ast.Alias;
import com.google.pygor.ast.CompareOperator;
import com.google.pygor.ast.ExceptHandler;
import com.google.pygor.ast.Expr;
import com.google.pygor.ast.NumberKind;
import com.google.pygor.ast.Slicer;
import com.google.pygor.ast.SourcePosition;
import com.google.pygor.ast.Stmt;
import com.google.pygor.ast.WithItem;
import com.google.pygor.gen.CaseClause;
import com.google.pygor.gen.GoExpr;
import com.google.pygor.gen.GoIR;
import com.google.pygor.gen.GoStmt;
import com.google.pygor.gen.Param;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Translates statements into the active scope. Every nested block is translated in a scope of
 * its own, which reports its exit mode to the enclosing one when it ends.
 */
final class StatementTranslator {
  private static final Logger logger = Logger.getLogger(StatementTranslator.class.getName());

  /** The error value of a guarded block. */
  private static final String ERR = "err";

  /** Binds the element of a loop with more than two targets. */
  static final String LOOP_TUPLE = "t" + RenameTable.SUFFIX;

  private final TranslationContext ctx;

  StatementTranslator(TranslationContext ctx) {
    this.ctx = ctx;
  }

  /** Translates {@code s} and appends the result to the active scope. */
  void translate(Stmt s) {
    if (ctx.getOptions().isVerbose()) {
      logger.info("translating " + s.kind() + " at " + s.position());
    }
    if (ctx.getOptions().isEmitLineNumbers() && s.position().isKnown()) {
      ctx.scope().add(GoIR.comment("line " + s.position().line()));
    }
    ImmutableList<GoStmt> out = lower(s);
    ctx.scope().addAll(out);
  }

  /** Translates statements into the active scope and returns everything it holds. */
  ImmutableList<GoStmt> translateStatements(List<Stmt> body) {
    for (Stmt s : body) {
      translate(s);
    }
    return ctx.scope().getBody();
  }

  /** Translates a nested block in a scope of its own. */
  ImmutableList<GoStmt> translateBlock(List<Stmt> body) {
    ctx.pushScope();
    ImmutableList<GoStmt> out = translateStatements(body);
    ctx.popScope(true);
    return out;
  }

  private ImmutableList<GoStmt> lower(Stmt s) {
    return switch (s.kind()) {
      case EXPR -> exprStatement((Stmt.ExprStmt) s);
      case ASSIGN -> assign((Stmt.Assign) s);
      case AUG_ASSIGN -> ImmutableList.of(augAssign((Stmt.AugAssign) s));
      case ANN_ASSIGN -> annAssign((Stmt.AnnAssign) s);
      case IF -> ImmutableList.of(ifStatement((Stmt.If) s));
      case FOR -> forStatement((Stmt.For) s);
      case WHILE -> whileStatement((Stmt.While) s);
      case TRY -> tryStatement((Stmt.Try) s);
      case WITH -> ImmutableList.of(withStatement((Stmt.With) s));
      case FUNCTION_DEF -> ctx.declarations().function((Stmt.FunctionDef) s);
      case CLASS_DEF -> ctx.declarations().classDef((Stmt.ClassDef) s);
      case IMPORT -> importStatement((Stmt.Import) s);
      case IMPORT_FROM -> ImmutableList.of(importFrom((Stmt.ImportFrom) s));
      case RETURN -> ImmutableList.of(returnStatement((Stmt.Return) s));
      case YIELD -> {
        Stmt.Yield y = (Stmt.Yield) s;
        ctx.scope().noteExit(ExitMode.GENERATOR_YIELD);
        GoExpr value = y.value() == null ? GoIR.nil() : expr(y.value());
        yield ImmutableList.of(GoIR.commented(GoIR.returnStmt(value), "yield"));
      }
      case YIELD_FROM -> {
        ctx.scope().noteExit(ExitMode.GENERATOR_YIELD);
        GoExpr value = expr(((Stmt.YieldFrom) s).value());
        yield ImmutableList.of(GoIR.commented(GoIR.returnStmt(value), "yield from"));
      }
      case RAISE -> ImmutableList.of(raise((Stmt.Raise) s));
      case ASSERT -> {
        Stmt.Assert assertion = (Stmt.Assert) s;
        GoExpr message =
            assertion.msg() == null ? GoIR.stringLit("") : expr(assertion.msg());
        yield ImmutableList.of(
            GoIR.exprStmt(call(ctx.runtime("Assert"), expr(assertion.test()), message)));
      }
      case PASS -> ImmutableList.of(GoIR.comment("pass"));
      case BREAK -> ImmutableList.of(GoIR.breakStmt());
      case CONTINUE -> ImmutableList.of(GoIR.continueStmt());
      case DELETE -> delete((Stmt.Delete) s);
      case GLOBAL -> declareOuter("global", ((Stmt.Global) s).names());
      case NONLOCAL -> declareOuter("nonlocal", ((Stmt.Nonlocal) s).names());
      case UNKNOWN ->
          ImmutableList.of(
              ctx.unsupportedStmt(
                  s.position(),
                  TranslationDiagnostics.UNKNOWN_STATEMENT,
                  ((Stmt.Unknown) s).nodeType()));
    };
  }

  private ImmutableList<GoStmt> exprStatement(Stmt.ExprStmt s) {
    Expr value = s.value();
    if (value instanceof Expr.Str docstring) {
      return ImmutableList.of(GoIR.comment(docstring.value().strip()));
    }
    if (value instanceof Expr.Call call && ctx.calls().isAppend(call)) {
      Expr receiver = ((Expr.Attribute) call.func()).value();
      return ImmutableList.of(GoIR.assign(expr(receiver), expr(call)));
    }
    GoExpr x = expr(value);
    if (x instanceof GoExpr.Call) {
      return ImmutableList.of(GoIR.exprStmt(x));
    }
    // Only calls can stand alone.
    return ImmutableList.of(GoIR.assign(ident("_"), x));
  }

  private ImmutableList<GoStmt> assign(Stmt.Assign s) {
    ImmutableList.Builder<GoStmt> out = ImmutableList.builder();
    Expr first = s.targets().get(0);
    boolean single = s.targets().size() == 1;
    out.addAll(assignTo(first, s.value(), null, single));
    // a = b = v: later targets take the value of the first.
    for (Expr target : s.targets().subList(1, s.targets().size())) {
      if (first instanceof Expr.Name name) {
        out.addAll(assignTo(target, first, ctx.expressions().identifier(name.id()), false));
      } else {
        out.addAll(assignTo(target, s.value(), null, false));
      }
    }
    return out.build();
  }

  /**
   * Assigns to one target. A name seen for the first time is declared, with a type guessed from
   * the value's shape when {@code typed}.
   *
   * @param value The translated value, or null to translate {@code valueNode}.
   */
  private ImmutableList<GoStmt> assignTo(
      Expr target, Expr valueNode, @Nullable GoExpr value, boolean typed) {
    switch (target.kind()) {
      case NAME:
        {
          String id = ((Expr.Name) target).id();
          GoExpr rhs = value != null ? value : expr(valueNode);
          if (ctx.scope().declareOrAssign(id)) {
            GoExpr type = typed ? ctx.expressions().typeGuess(valueNode) : null;
            return ImmutableList.of(GoIR.varDecl(RenameTable.rename(id), type, rhs));
          }
          return ImmutableList.of(GoIR.assign(ctx.expressions().identifier(id), rhs));
        }
      case ATTRIBUTE:
      case SUBSCRIPT:
        {
          GoExpr lhs = expr(target);
          return ImmutableList.of(GoIR.assign(lhs, value != null ? value : expr(valueNode)));
        }
      case TUPLE:
        return unpack(((Expr.TupleLiteral) target).elts(), valueNode, value);
      case LIST:
        return unpack(((Expr.ListLiteral) target).elts(), valueNode, value);
      default:
        return ImmutableList.of(
            ctx.unsupportedStmt(
                target.position(),
                TranslationDiagnostics.ASSIGNMENT_TARGET,
                target.kind().toString()));
    }
  }

  /**
   * {@code a, b = v}. A literal of matching length assigns element-wise, a call is taken to
   * return one value per target, and any other value is indexed.
   */
  private ImmutableList<GoStmt> unpack(
      List<Expr> targets, Expr valueNode, @Nullable GoExpr value) {
    for (Expr target : targets) {
      if (!(target instanceof Expr.Name
          || target instanceof Expr.Attribute
          || target instanceof Expr.Subscript)) {
        return ImmutableList.of(
            ctx.unsupportedStmt(
                target.position(),
                TranslationDiagnostics.ASSIGNMENT_TARGET,
                "nested " + target.kind()));
      }
    }
    List<Expr> elements = elementsOf(valueNode);
    List<GoExpr> rhs = new ArrayList<>();
    if (value == null && elements != null && elements.size() == targets.size()) {
      rhs.addAll(ctx.expressions().translateAll(elements));
    } else {
      GoExpr whole = value != null ? value : expr(valueNode);
      if (valueNode instanceof Expr.Call) {
        rhs.add(whole);
      } else {
        for (int i = 0; i < targets.size(); i++) {
          rhs.add(GoIR.index(whole, GoIR.intLit(i)));
        }
      }
    }

    List<GoExpr> lhs = new ArrayList<>();
    List<String> declared = new ArrayList<>();
    boolean allNew = true;
    for (Expr target : targets) {
      if (target instanceof Expr.Name name) {
        if (ctx.scope().declareOrAssign(name.id())) {
          declared.add(RenameTable.rename(name.id()));
        } else {
          allNew = false;
        }
        lhs.add(ctx.expressions().identifier(name.id()));
      } else {
        allNew = false;
        lhs.add(expr(target));
      }
    }
    if (allNew) {
      return ImmutableList.of(GoIR.assign(lhs, ":=", rhs));
    }
    ImmutableList.Builder<GoStmt> out = ImmutableList.builder();
    for (String name : declared) {
      out.add(GoIR.varDecl(name, ctx.runtime("Any"), null));
    }
    return out.add(GoIR.assign(lhs, "=", rhs)).build();
  }

  private static @Nullable List<Expr> elementsOf(Expr e) {
    if (e instanceof Expr.TupleLiteral tuple) {
      return tuple.elts();
    }
    if (e instanceof Expr.ListLiteral list) {
      return list.elts();
    }
    return null;
  }

  private GoStmt augAssign(Stmt.AugAssign s) {
    GoExpr target = expr(s.target());
    switch (s.op()) {
      case POW:
        return GoIR.assign(target, call(GoIR.qualified("math", "Pow"), target, expr(s.value())));
      case FLOOR_DIV:
        return GoIR.assign(
            ImmutableList.of(target),
            "/=",
            ImmutableList.of(GoIR.leadingComment("floor", expr(s.value()))));
      case MAT_MULT:
        return ctx.unsupportedStmt(
            s.position(), TranslationDiagnostics.UNKNOWN_STATEMENT, "AugAssign(MatMult)");
      default:
        return GoIR.assign(
            ImmutableList.of(target),
            ExpressionTranslator.operatorToken(s.op()) + "=",
            ImmutableList.of(expr(s.value())));
    }
  }

  private ImmutableList<GoStmt> annAssign(Stmt.AnnAssign s) {
    if (s.target() instanceof Expr.Name name) {
      GoExpr type = ctx.expressions().typeExpr(s.annotation());
      if (ctx.scope().declareOrAssign(name.id())) {
        return ImmutableList.of(
            GoIR.varDecl(
                RenameTable.rename(name.id()),
                type,
                s.value() == null ? null : expr(s.value())));
      }
      if (s.value() == null) {
        return ImmutableList.of(GoIR.comment(name.id() + ": ", type));
      }
      return ImmutableList.of(
          GoIR.assign(ctx.expressions().identifier(name.id()), expr(s.value())));
    }
    if (s.value() == null) {
      return ImmutableList.of();
    }
    return ImmutableList.of(GoIR.assign(expr(s.target()), expr(s.value())));
  }

  private GoStmt ifStatement(Stmt.If s) {
    if (ctx.scope().isRoot() && s.orelse().isEmpty() && isMainGuard(s.test())) {
      ctx.noteMainGuard();
      ctx.pushScope(ExitMode.NO_EXIT_SEEN);
      ImmutableList<GoStmt> body = translateStatements(s.body());
      ctx.popScope(false);
      return new GoStmt.FuncDecl(
          null, "main", ImmutableList.of(), ImmutableList.of(), body, ImmutableList.of());
    }
    GoExpr cond = expr(s.test());
    ImmutableList<GoStmt> then = translateBlock(s.body());
    ImmutableList<GoStmt> orElse = translateBlock(s.orelse());
    return GoIR.ifStmt(null, cond, then, orElse);
  }

  /** {@code __name__ == "__main__"}, either way round. */
  private static boolean isMainGuard(Expr test) {
    if (!(test instanceof Expr.Compare compare)
        || compare.ops().size() != 1
        || compare.ops().get(0) != CompareOperator.EQ) {
      return false;
    }
    Expr left = compare.left();
    Expr right = compare.comparators().get(0);
    return (isName(left, "__name__") && isString(right, "__main__"))
        || (isName(right, "__name__") && isString(left, "__main__"));
  }

  private static boolean isName(Expr e, String id) {
    return e instanceof Expr.Name name && name.id().equals(id);
  }

  private static boolean isString(Expr e, String value) {
    return e instanceof Expr.Str str && str.value().equals(value);
  }

  private ImmutableList<GoStmt> forStatement(Stmt.For s) {
    GoStmt loop =
        lowerFor(s.target(), s.iter(), () -> translateStatements(s.body()), s.position());
    return withElse(loop, s.orelse());
  }

  private ImmutableList<GoStmt> whileStatement(Stmt.While s) {
    GoExpr cond = isLiteralTrue(s.test()) ? null : expr(s.test());
    ImmutableList<GoStmt> body = translateBlock(s.body());
    return withElse(GoIR.forLoop(null, cond, null, body), s.orelse());
  }

  private static boolean isLiteralTrue(Expr test) {
    if (test instanceof Expr.NameConstant constant) {
      return constant.value() == Expr.Singleton.TRUE;
    }
    return test instanceof Expr.Num num
        && num.numberKind() == NumberKind.INT
        && num.text().equals("1");
  }

  /** The else clause of a loop follows it as a marked block. */
  private ImmutableList<GoStmt> withElse(GoStmt loop, List<Stmt> orelse) {
    if (orelse.isEmpty()) {
      return ImmutableList.of(loop);
    }
    ImmutableList<GoStmt> body = translateBlock(orelse);
    return ImmutableList.of(
        loop,
        GoIR.block(
            ImmutableList.<GoStmt>builder().add(GoIR.comment("else")).addAll(body).build()));
  }

  /**
   * Lowers a loop over {@code iter} binding {@code target}. Used by for statements and
   * comprehensions alike.
   *
   * @param body Supplies the loop body, translated in the loop's scope after the targets are
   *     declared.
   */
  GoStmt lowerFor(
      Expr target,
      Expr iter,
      Supplier<ImmutableList<GoStmt>> body,
      SourcePosition position) {
    if (iter instanceof Expr.Call call && isBuiltinCall(call, "range")) {
      return rangeLoop(target, call, body);
    }
    if (iter instanceof Expr.Call call
        && isBuiltinCall(call, "enumerate")
        && call.args().size() == 1
        && target instanceof Expr.TupleLiteral pair
        && pair.elts().size() == 2
        && allNames(pair.elts())) {
      GoExpr iterable = expr(call.args().get(0));
      return rangeOver(pair.elts(), iterable, body);
    }

    List<Expr> targets = elementsOf(target);
    if (targets == null) {
      targets = ImmutableList.of(target);
    }
    if (!allNames(targets)) {
      return ctx.unsupportedStmt(
          position, TranslationDiagnostics.ASSIGNMENT_TARGET, "loop target " + target.kind());
    }
    GoExpr iterable = expr(iter);
    if (targets.size() == 1) {
      return rangeOver(
          ImmutableList.of(new Expr.Name("_", target.position()), targets.get(0)),
          iterable,
          body);
    }
    if (targets.size() == 2) {
      return rangeOver(targets, iterable, body);
    }
    return rangeOverTuples(targets, iterable, body);
  }

  /** {@code for i in range(start, stop, step)} as a three-clause loop. */
  private GoStmt rangeLoop(Expr target, Expr.Call range, Supplier<ImmutableList<GoStmt>> body) {
    List<Expr> args = range.args();
    int n = args.size();
    if (n == 0 || n > 3) {
      throw ctx.hardFailure(
          range.position(), TranslationDiagnostics.RANGE_ARGUMENTS, Integer.toString(n));
    }
    if (!(target instanceof Expr.Name name)) {
      return ctx.unsupportedStmt(
          target.position(),
          TranslationDiagnostics.ASSIGNMENT_TARGET,
          "range loop target " + target.kind());
    }
    GoExpr start = n >= 2 ? expr(args.get(0)) : GoIR.intLit(0);
    GoExpr stop = expr(n == 1 ? args.get(0) : args.get(1));
    Expr stepNode = n == 3 ? args.get(2) : null;
    GoExpr step = stepNode == null ? GoIR.intLit(1) : expr(stepNode);
    String comparison =
        stepNode != null && ExpressionTranslator.isSyntacticallyNegative(stepNode) ? ">" : "<";

    ctx.pushScope();
    String id = name.id().equals("_") ? "i" + RenameTable.SUFFIX : name.id();
    ctx.scope().declare(id);
    GoExpr var = ctx.expressions().identifier(id);
    ImmutableList<GoStmt> inner = body.get();
    ctx.popScope(true);
    return GoIR.forLoop(
        GoIR.define(var, start),
        GoIR.binary(var, comparison, stop),
        GoIR.assign(ImmutableList.of(var), "+=", ImmutableList.of(step)),
        inner);
  }

  /** {@code for k, v := range x}; a lone blank target ranges without binding. */
  private GoStmt rangeOver(
      List<Expr> targets, GoExpr iterable, Supplier<ImmutableList<GoStmt>> body) {
    ctx.pushScope();
    List<GoExpr> keys = new ArrayList<>();
    for (Expr target : targets) {
      String id = ((Expr.Name) target).id();
      ctx.scope().declare(id);
      keys.add(ctx.expressions().identifier(id));
    }
    if (keys.stream().allMatch(k -> k.equals(ident("_")))) {
      keys.clear();
    }
    ImmutableList<GoStmt> inner = body.get();
    ctx.popScope(true);
    return GoIR.forRange(keys, iterable, inner);
  }

  /** More than two targets bind through the element: {@code a, b, c := t[0], t[1], t[2]}. */
  private GoStmt rangeOverTuples(
      List<Expr> targets, GoExpr iterable, Supplier<ImmutableList<GoStmt>> body) {
    ctx.pushScope();
    GoExpr tuple = ident(LOOP_TUPLE);
    List<GoExpr> names = new ArrayList<>();
    List<GoExpr> elements = new ArrayList<>();
    for (int i = 0; i < targets.size(); i++) {
      String id = ((Expr.Name) targets.get(i)).id();
      ctx.scope().declare(id);
      names.add(ctx.expressions().identifier(id));
      elements.add(GoIR.index(tuple, GoIR.intLit(i)));
    }
    ImmutableList<GoStmt> inner = body.get();
    ctx.popScope(true);
    return GoIR.forRange(
        ImmutableList.of(ident("_"), tuple),
        iterable,
        ImmutableList.<GoStmt>builder()
            .add(GoIR.assign(names, ":=", elements))
            .addAll(inner)
            .build());
  }

  private boolean isBuiltinCall(Expr.Call call, String name) {
    return call.func() instanceof Expr.Name func
        && func.id().equals(name)
        && !ctx.scope().isDeclared(name)
        && call.keywords().isEmpty()
        && call.starargs() == null
        && call.kwargs() == null;
  }

  private static boolean allNames(List<Expr> exprs) {
    return exprs.stream().allMatch(e -> e instanceof Expr.Name);
  }

  /**
   * try/except/else/finally. The guarded body runs in a function literal returning the raised
   * error; a type switch on the error picks the handler, and the else clause runs when there is
   * none. The finally clause follows unconditionally, but is skipped by a return from the
   * guarded body.
   *
   * <p>A return in the guarded body leaves the function literal, not the enclosing function, so
   * its exit mode stays with the literal.
   */
  private ImmutableList<GoStmt> tryStatement(Stmt.Try s) {
    GoExpr err = ident(ERR);
    ctx.pushScope();
    ImmutableList<GoStmt> guarded = translateStatements(s.body());
    ctx.popScope(false);
    GoExpr guard =
        GoIR.funcLit(
            ImmutableList.of(),
            ImmutableList.of(Param.unnamed(ctx.runtime("PyException"))),
            ImmutableList.<GoStmt>builder()
                .addAll(guarded)
                .add(GoIR.returnStmt(GoIR.nil()))
                .build());

    ImmutableList<GoStmt> onError;
    if (s.handlers().isEmpty()) {
      onError = ImmutableList.of(GoIR.commented(GoIR.assign(ident("_"), err), "not handled"));
    } else {
      ImmutableList.Builder<CaseClause> cases = ImmutableList.builder();
      for (ExceptHandler handler : s.handlers()) {
        cases.add(GoIR.caseClause(handlerTypes(handler), handlerBody(handler, err)));
      }
      onError =
          ImmutableList.of(GoIR.switchStmt(null, GoIR.typeAssert(err, null), cases.build()));
    }
    ImmutableList<GoStmt> orElse = translateBlock(s.orelse());
    GoStmt dispatch =
        GoIR.ifStmt(
            GoIR.define(err, call(guard)),
            GoIR.binary(err, "!=", GoIR.nil()),
            onError,
            orElse);
    if (s.finalbody().isEmpty()) {
      return ImmutableList.of(dispatch);
    }
    ImmutableList<GoStmt> finalBody = translateBlock(s.finalbody());
    return ImmutableList.of(
        dispatch,
        GoIR.block(
            ImmutableList.<GoStmt>builder()
                .add(GoIR.comment("finally"))
                .addAll(finalBody)
                .build()));
  }

  /** A bare except is the default case. */
  private ImmutableList<GoExpr> handlerTypes(ExceptHandler handler) {
    Expr type = handler.type();
    if (type == null) {
      return ImmutableList.of();
    }
    if (type instanceof Expr.TupleLiteral tuple) {
      ImmutableList.Builder<GoExpr> types = ImmutableList.builder();
      for (Expr t : tuple.elts()) {
        types.add(ctx.expressions().typeExpr(t));
      }
      return types.build();
    }
    return ImmutableList.of(ctx.expressions().typeExpr(type));
  }

  private ImmutableList<GoStmt> handlerBody(ExceptHandler handler, GoExpr err) {
    ctx.pushScope();
    ImmutableList.Builder<GoStmt> out = ImmutableList.builder();
    if (handler.name() != null) {
      ctx.scope().declare(handler.name());
      GoExpr bound = ctx.expressions().identifier(handler.name());
      out.add(GoIR.define(bound, err));
      out.add(GoIR.assign(ident("_"), bound));
    }
    out.addAll(translateStatements(handler.body()));
    ctx.popScope(true);
    return out.build();
  }

  private GoStmt raise(Stmt.Raise s) {
    if (s.exc() == null) {
      return GoIR.commented(GoIR.returnStmt(ident(ERR)), "re-raise");
    }
    GoStmt ret = GoIR.returnStmt(call(ctx.runtime("RaisedException"), expr(s.exc())));
    if (s.cause() != null) {
      return GoIR.commented(ret, "cause: ", expr(s.cause()));
    }
    return ret;
  }

  /**
   * A with block becomes a plain block binding each entered value. The release of the values is
   * only marked.
   */
  private GoStmt withStatement(Stmt.With s) {
    ctx.pushScope();
    ImmutableList.Builder<GoStmt> out = ImmutableList.builder();
    out.add(GoIR.comment("with"));
    for (WithItem item : s.items()) {
      GoExpr value = expr(item.contextExpr());
      Expr vars = item.optionalVars();
      if (vars == null) {
        out.add(GoIR.assign(ident("_"), value));
        out.add(GoIR.comment("release: ", value));
      } else if (vars instanceof Expr.Name name) {
        ctx.scope().declare(name.id());
        GoExpr bound = ctx.expressions().identifier(name.id());
        out.add(GoIR.define(bound, value));
        out.add(GoIR.comment("release: ", bound));
      } else {
        out.add(
            ctx.unsupportedStmt(
                vars.position(),
                TranslationDiagnostics.ASSIGNMENT_TARGET,
                "with target " + vars.kind()));
      }
    }
    out.addAll(translateStatements(s.body()));
    ctx.popScope(true);
    return GoIR.block(out.build());
  }

  private GoStmt returnStatement(Stmt.Return s) {
    ctx.scope().noteExit(ExitMode.VALUE_RETURN);
    return GoIR.returnStmt(s.value() == null ? GoIR.nil() : expr(s.value()));
  }

  private ImmutableList<GoStmt> delete(Stmt.Delete s) {
    ImmutableList.Builder<GoStmt> out = ImmutableList.builder();
    for (Expr target : s.targets()) {
      if (!(target instanceof Expr.Subscript subscript)) {
        out.add(
            ctx.unsupportedStmt(
                target.position(),
                TranslationDiagnostics.DELETE_TARGET,
                target.kind().toString()));
        continue;
      }
      if (!(subscript.slice() instanceof Slicer.Index index)) {
        throw ctx.hardFailure(subscript.position(), TranslationDiagnostics.DELETE_SLICE);
      }
      out.add(
          GoIR.exprStmt(call(ident("delete"), expr(subscript.value()), expr(index.value()))));
    }
    return out.build();
  }

  /** global and nonlocal names are declared here, so that writes to them assign. */
  private ImmutableList<GoStmt> declareOuter(String keyword, List<String> names) {
    for (String name : names) {
      ctx.scope().declare(name);
    }
    return ImmutableList.of(GoIR.comment(keyword + " " + Joiner.on(", ").join(names)));
  }

  private ImmutableList<GoStmt> importStatement(Stmt.Import s) {
    ImmutableList.Builder<GoStmt> out = ImmutableList.builder();
    for (Alias alias : s.names()) {
      ctx.scope().recordImport(alias.boundName(), alias.name());
      int dot = alias.name().indexOf('.');
      if (alias.asName() == null && dot > 0) {
        // import a.b also binds a.
        String head = alias.name().substring(0, dot);
        if (ctx.scope().resolveImport(head) == null) {
          ctx.scope().recordImport(head, head);
        }
      }
      String path = "\"" + alias.name().replace('.', '/') + "\"";
      out.add(
          GoIR.comment(
              alias.asName() == null ? "import " + path : "import " + alias.asName() + " " + path));
    }
    return out.build();
  }

  private GoStmt importFrom(Stmt.ImportFrom s) {
    String module = Strings.nullToEmpty(s.module());
    List<String> names = new ArrayList<>();
    for (Alias alias : s.names()) {
      if (s.level() == 0 && !alias.name().equals("*")) {
        ctx.scope().recordImport(alias.boundName(), module + "." + alias.name());
      }
      names.add(alias.asName() == null ? alias.name() : alias.name() + " as " + alias.asName());
    }
    return GoIR.comment(
        "from "
            + Strings.repeat(".", s.level())
            + module
            + " import "
            + Joiner.on(", ").join(names));
  }

  private GoExpr expr(Expr e) {
    return ctx.expressions().translate(e);
  }
}
