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

import static com.google.pygor.gen.GoIR.binary;
import static com.google.pygor.gen.GoIR.call;
import static com.google.pygor.gen.GoIR.ident;
import static com.google.pygor.gen.GoIR.qualified;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableTable;
import com.google.pygor.ast.Expr;
import com.google.pygor.ast.Keyword;
import com.google.pygor.gen.GoExpr;
import com.google.pygor.gen.GoIR;
import com.google.pygor.gen.GoStmt;
import com.google.pygor.gen.Param;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Translates calls. Calls of well-known functions and methods are rewritten to the idiomatic
 * counterpart, looked up by name and positional argument count; a known name with an unexpected
 * argument count, and everything else, is translated as a plain call. Keyword and spread
 * arguments do not take part in the lookup.
 */
final class CallTranslator {

  /** Matches a rewrite regardless of the argument count. */
  static final int ANY_ARITY = -1;

  /** A call rewrite. */
  @FunctionalInterface
  interface Rewrite {
    GoExpr apply(CallSite site);
  }

  /** Builtin functions, by name and argument count. */
  private static final ImmutableTable<String, Integer, Rewrite> FUNCTIONS =
      ImmutableTable.<String, Integer, Rewrite>builder()
          .put("print", ANY_ARITY, site -> site.genericCall(qualified("fmt", "Println")))
          .put("open", ANY_ARITY, site -> site.genericCall(qualified("os", "Open")))
          .put("type", 1, site -> call(qualified("reflect", "TypeOf"), site.arg(0)))
          .put("isinstance", 2, CallTranslator::isinstance)
          .buildOrThrow();

  /** Module functions, by dotted path after alias resolution and argument count. */
  private static final ImmutableTable<String, Integer, Rewrite> MODULE_FUNCTIONS =
      ImmutableTable.<String, Integer, Rewrite>builder()
          .put("sys.exit", 0, site -> call(qualified("os", "Exit"), GoIR.intLit(0)))
          .put("sys.exit", 1, site -> call(qualified("os", "Exit"), site.arg(0)))
          .put(
              "time.sleep",
              1,
              site ->
                  call(
                      qualified("time", "Sleep"),
                      call(
                          qualified("time", "Duration"),
                          binary(
                              site.arg(0),
                              "*",
                              call(ident("float64"), qualified("time", "Second"))))))
          .put("time.time", 0, site -> call(qualified("time", "Now")))
          .buildOrThrow();

  /** Methods, by attribute name and argument count. The receiver is the method's value. */
  private static final ImmutableTable<String, Integer, Rewrite> METHODS =
      ImmutableTable.<String, Integer, Rewrite>builder()
          .put("read", ANY_ARITY, site -> site.genericCall(GoIR.selector(site.receiver(), "Read")))
          .put(
              "write", ANY_ARITY, site -> site.genericCall(GoIR.selector(site.receiver(), "Write")))
          .put(
              "close", ANY_ARITY, site -> site.genericCall(GoIR.selector(site.receiver(), "Close")))
          .put("items", 0, CallSite::receiver)
          .put("append", 1, site -> call(ident("append"), site.receiver(), site.arg(0)))
          .put("upper", 0, site -> strings("ToUpper", site.receiver()))
          .put("lower", 0, site -> strings("ToLower", site.receiver()))
          .put("startswith", 1, site -> strings("HasPrefix", site.receiver(), site.arg(0)))
          .put("endswith", 1, site -> strings("HasSuffix", site.receiver(), site.arg(0)))
          .put("strip", 0, site -> strings("TrimSpace", site.receiver()))
          .put("strip", 1, site -> strings("Trim", site.receiver(), site.arg(0)))
          .put(
              "lstrip",
              0,
              site -> strings("TrimLeftFunc", site.receiver(), qualified("unicode", "IsSpace")))
          .put("lstrip", 1, site -> strings("TrimLeft", site.receiver(), site.arg(0)))
          .put(
              "rstrip",
              0,
              site -> strings("TrimRightFunc", site.receiver(), qualified("unicode", "IsSpace")))
          .put("rstrip", 1, site -> strings("TrimRight", site.receiver(), site.arg(0)))
          .put("split", 0, site -> strings("Fields", site.receiver()))
          .put("split", 1, site -> strings("Split", site.receiver(), site.arg(0)))
          .put(
              "split",
              2,
              site ->
                  strings(
                      "SplitN",
                      site.receiver(),
                      site.arg(0),
                      binary(site.arg(1), "+", GoIR.intLit(1))))
          .put("join", 1, site -> strings("Join", site.arg(0), site.receiver()))
          .put(
              "replace",
              2,
              site ->
                  strings("Replace", site.receiver(), site.arg(0), site.arg(1), GoIR.intLit("-1")))
          .put(
              "replace",
              3,
              site -> strings("Replace", site.receiver(), site.arg(0), site.arg(1), site.arg(2)))
          .put("count", 1, site -> strings("Count", site.receiver(), site.arg(0)))
          .put("find", 1, site -> strings("Index", site.receiver(), site.arg(0)))
          .put("isspace", 0, site -> call(site.runtime("IsSpace"), site.receiver()))
          .put("isalpha", 0, site -> call(site.runtime("IsAlpha"), site.receiver()))
          .put("isdigit", 0, site -> call(site.runtime("IsDigit"), site.receiver()))
          .put("isnumeric", 0, site -> call(site.runtime("IsNumeric"), site.receiver()))
          .put("isupper", 0, site -> call(site.runtime("IsUpper"), site.receiver()))
          .put("islower", 0, site -> call(site.runtime("IsLower"), site.receiver()))
          .put("reverse", 0, site -> call(site.runtime("Reverse"), site.receiver()))
          .buildOrThrow();

  private final TranslationContext ctx;

  CallTranslator(TranslationContext ctx) {
    this.ctx = ctx;
  }

  GoExpr translate(Expr.Call call) {
    Rewrite rewrite = null;
    GoExpr receiver = null;
    int arity = call.args().size();
    if (call.func() instanceof Expr.Name name && !ctx.scope().isDeclared(name.id())) {
      rewrite = lookup(FUNCTIONS, name.id(), arity);
    } else if (call.func() instanceof Expr.Attribute attribute) {
      String base = ExpressionTranslator.dottedName(attribute.value());
      String module = base == null ? null : ctx.expressions().moduleOf(base);
      if (module != null) {
        rewrite = lookup(MODULE_FUNCTIONS, module + "." + attribute.attr(), arity);
      } else {
        rewrite = lookup(METHODS, attribute.attr(), arity);
        if (rewrite != null) {
          receiver = ctx.expressions().translate(attribute.value());
        }
      }
    }
    CallSite site = new CallSite(call, receiver);
    if (rewrite == null) {
      return site.genericCall(ctx.expressions().translate(call.func()));
    }
    GoExpr rewritten = rewrite.apply(site);
    if (!site.extrasEmitted && hasExtras(call)) {
      // The rewrite has no place for them.
      return GoIR.trailingComment(rewritten, "ignored " + extrasOf(call));
    }
    return rewritten;
  }

  private static boolean hasExtras(Expr.Call call) {
    return !call.keywords().isEmpty() || call.starargs() != null || call.kwargs() != null;
  }

  /** The keyword names and spread markers of a call, for instance {@code end=, **}. */
  private static String extrasOf(Expr.Call call) {
    List<String> extras = new ArrayList<>();
    for (Keyword keyword : call.keywords()) {
      extras.add(keyword.arg() + "=");
    }
    if (call.starargs() != null) {
      extras.add("*");
    }
    if (call.kwargs() != null) {
      extras.add("**");
    }
    return Joiner.on(", ").join(extras);
  }

  /** Whether a call is {@code c.append(v)}, which grows {@code c} in place. */
  boolean isAppend(Expr.Call call) {
    return call.args().size() == 1
        && call.func() instanceof Expr.Attribute attribute
        && attribute.attr().equals("append")
        && !isModuleMember(attribute);
  }

  private boolean isModuleMember(Expr.Attribute attribute) {
    String base = ExpressionTranslator.dottedName(attribute.value());
    return base != null && ctx.expressions().moduleOf(base) != null;
  }

  private static @Nullable Rewrite lookup(
      ImmutableTable<String, Integer, Rewrite> table, String key, int arity) {
    Rewrite rewrite = table.get(key, arity);
    return rewrite != null ? rewrite : table.get(key, ANY_ARITY);
  }

  private static GoExpr strings(String function, GoExpr... args) {
    return call(qualified("strings", function), args);
  }

  /**
   * {@code isinstance(x, T)} asserts the type and reports success; a tuple of types becomes a
   * type switch.
   */
  private static GoExpr isinstance(CallSite site) {
    Expr types = site.call.args().get(1);
    GoExpr value = site.arg(0);
    ImmutableList<Param> results = ImmutableList.of(Param.unnamed(ident("bool")));
    if (types instanceof Expr.TupleLiteral tuple) {
      ImmutableList.Builder<GoExpr> cases = ImmutableList.builder();
      for (Expr type : tuple.elts()) {
        cases.add(site.typeExpr(type));
      }
      GoStmt typeSwitch =
          GoIR.switchStmt(
              null,
              GoIR.typeAssert(value, null),
              ImmutableList.of(
                  GoIR.caseClause(
                      cases.build(), ImmutableList.of(GoIR.returnStmt(ident("true"))))));
      return GoIR.invoke(results, ImmutableList.of(typeSwitch, GoIR.returnStmt(ident("false"))));
    }
    GoStmt check =
        GoIR.assign(
            ImmutableList.of(ident("_"), ident("ok")),
            ":=",
            ImmutableList.of(GoIR.typeAssert(value, site.typeExpr(types))));
    return GoIR.invoke(results, ImmutableList.of(check, GoIR.returnStmt(ident("ok"))));
  }

  /** A call being translated, with its arguments translated in source order. */
  final class CallSite {
    private final Expr.Call call;
    private final @Nullable GoExpr receiver;
    private final ImmutableList<GoExpr> args;
    private boolean extrasEmitted;

    CallSite(Expr.Call call, @Nullable GoExpr receiver) {
      this.call = call;
      this.receiver = receiver;
      this.args = ctx.expressions().translateAll(call.args());
    }

    GoExpr arg(int i) {
      return args.get(i);
    }

    GoExpr receiver() {
      if (receiver == null) {
        throw new IllegalStateException("not a method call: " + call);
      }
      return receiver;
    }

    GoExpr runtime(String name) {
      return ctx.runtime(name);
    }

    GoExpr typeExpr(Expr type) {
      return ctx.expressions().typeExpr(type);
    }

    /**
     * Calls {@code callee} with the positional arguments, then each keyword argument with its
     * name as a leading comment, then the spread arguments marked as such.
     */
    GoExpr genericCall(GoExpr callee) {
      extrasEmitted = true;
      List<GoExpr> all = new ArrayList<>(args);
      for (Keyword keyword : call.keywords()) {
        all.add(
            GoIR.leadingComment(
                keyword.arg() + "=", ctx.expressions().translate(keyword.value())));
      }
      if (call.starargs() != null) {
        all.add(GoIR.trailingComment(ctx.expressions().translate(call.starargs()), "..."));
      }
      if (call.kwargs() != null) {
        all.add(GoIR.trailingComment(ctx.expressions().translate(call.kwargs()), "**"));
      }
      return call(callee, all);
    }
  }
}
