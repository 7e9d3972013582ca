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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.pygor.ast.BinaryOperator;
import com.google.pygor.ast.CompareOperator;
import com.google.pygor.ast.Expr;
import com.google.pygor.ast.NumberKind;
import com.google.pygor.ast.Slicer;
import com.google.pygor.ast.UnaryOperator;
import com.google.pygor.gen.GoExpr;
import com.google.pygor.gen.GoIR;
import com.google.pygor.gen.GoStmt;
import com.google.pygor.gen.Param;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Translates expressions. Apart from comprehensions and lambdas, which open and close scopes of
 * their own, translation only reads the active scope.
 */
final class ExpressionTranslator {

  /**
   * Module members with a direct counterpart in the output language's standard library, keyed
   * by the dotted path after import aliases are resolved.
   */
  private static final ImmutableMap<String, GoExpr> WELL_KNOWN =
      ImmutableMap.<String, GoExpr>builder()
          .put("re.compile", qualified("regexp", "MustCompile"))
          .put("re.match", qualified("regexp", "MatchString"))
          .put("sys.argv", qualified("os", "Args"))
          .put("sys.stdin", qualified("os", "Stdin"))
          .put("sys.stdout", qualified("os", "Stdout"))
          .put("sys.stderr", qualified("os", "Stderr"))
          .put("os.getenv", qualified("os", "Getenv"))
          .put("os.path.join", qualified("path/filepath", "Join"))
          .put("math.pi", qualified("math", "Pi"))
          .put("math.e", qualified("math", "E"))
          .put("math.sqrt", qualified("math", "Sqrt"))
          .put("math.floor", qualified("math", "Floor"))
          .put("math.ceil", qualified("math", "Ceil"))
          .buildOrThrow();

  /** Runtime types that renamed builtins resolve to. */
  private static final ImmutableSet<String> RUNTIME_TYPES =
      ImmutableSet.of("Dict", "List", "Tuple");

  private static final Pattern SIMPLE_NAME = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

  private final TranslationContext ctx;

  ExpressionTranslator(TranslationContext ctx) {
    this.ctx = ctx;
  }

  GoExpr translate(Expr e) {
    return switch (e.kind()) {
      case NUM -> number((Expr.Num) e);
      case STR -> GoIR.stringLit(((Expr.Str) e).value());
      case BYTES -> call(GoIR.sliceType(ident("byte")), GoIR.stringLit(((Expr.Bytes) e).value()));
      case NAME_CONSTANT -> singleton(((Expr.NameConstant) e).value());
      case NAME -> name(((Expr.Name) e).id());
      case ATTRIBUTE -> attribute((Expr.Attribute) e);
      case SUBSCRIPT -> subscript((Expr.Subscript) e);
      case CALL -> ctx.calls().translate((Expr.Call) e);
      case UNARY_OP -> unary((Expr.UnaryOp) e);
      case BIN_OP -> binaryOp((Expr.BinOp) e);
      case BOOL_OP -> boolOp((Expr.BoolOp) e);
      case COMPARE -> compare((Expr.Compare) e);
      case TUPLE ->
          GoIR.composite(ctx.runtime("Tuple"), translateAll(((Expr.TupleLiteral) e).elts()));
      case LIST ->
          GoIR.composite(ctx.runtime("List"), translateAll(((Expr.ListLiteral) e).elts()));
      case DICT -> dict((Expr.DictLiteral) e);
      case LAMBDA -> lambda((Expr.Lambda) e);
      case IF_EXP -> ifExp((Expr.IfExp) e);
      case LIST_COMP -> ctx.comprehensions().listComp((Expr.ListComp) e);
      case DICT_COMP -> ctx.comprehensions().dictComp((Expr.DictComp) e);
      case GENERATOR_EXP -> ctx.comprehensions().generatorExp((Expr.GeneratorExp) e);
      case STARRED ->
          ctx.unsupportedExpr(e.position(), TranslationDiagnostics.UNKNOWN_EXPRESSION, "Starred");
      case UNKNOWN ->
          ctx.unsupportedExpr(
              e.position(),
              TranslationDiagnostics.UNKNOWN_EXPRESSION,
              ((Expr.Unknown) e).nodeType());
    };
  }

  ImmutableList<GoExpr> translateAll(List<Expr> exprs) {
    ImmutableList.Builder<GoExpr> out = ImmutableList.builder();
    for (Expr e : exprs) {
      out.add(translate(e));
    }
    return out.build();
  }

  /** A name bound by {@code from m import f} to a well-known member stands for that member. */
  private GoExpr name(String id) {
    String imported = ctx.scope().isDeclared(id) ? null : ctx.scope().resolveImport(id);
    if (imported != null) {
      GoExpr wellKnown = WELL_KNOWN.get(imported);
      if (wellKnown != null) {
        return wellKnown;
      }
    }
    return identifier(id);
  }

  /** The fragment for a source identifier, after renaming. */
  GoExpr identifier(String id) {
    String name = RenameTable.rename(id);
    return RUNTIME_TYPES.contains(name) ? ctx.runtime(name) : ident(name);
  }

  private static GoExpr number(Expr.Num num) {
    return switch (num.numberKind()) {
      case INT -> GoIR.intLit(num.text());
      case FLOAT -> GoIR.floatLit(num.text());
      case COMPLEX -> GoIR.imagLit(num.text().substring(0, num.text().length() - 1) + "i");
    };
  }

  private static GoExpr singleton(Expr.Singleton value) {
    return switch (value) {
      case NONE -> GoIR.nil();
      case TRUE -> ident("true");
      case FALSE -> ident("false");
    };
  }

  private GoExpr unary(Expr.UnaryOp op) {
    GoExpr operand = translate(op.operand());
    return switch (op.op()) {
      case INVERT -> GoIR.unary("-", binary(operand, "+", GoIR.intLit(1)));
      case NOT -> GoIR.unary("!", operand);
      case UADD -> GoIR.unary("+", operand);
      case USUB -> GoIR.unary("-", operand);
    };
  }

  private GoExpr binaryOp(Expr.BinOp op) {
    switch (op.op()) {
      case POW:
        return call(qualified("math", "Pow"), translate(op.left()), translate(op.right()));
      case MOD:
        if (op.left() instanceof Expr.Str) {
          return format(op.left(), op.right());
        }
        break;
      case FLOOR_DIV:
        return binary(
            translate(op.left()), "/", GoIR.leadingComment("floor", translate(op.right())));
      case MAT_MULT:
        return ctx.unsupportedExpr(
            op.position(), TranslationDiagnostics.UNKNOWN_EXPRESSION, "BinOp(MatMult)");
      default:
        break;
    }
    return binary(translate(op.left()), operatorToken(op.op()), translate(op.right()));
  }

  /** {@code "fmt" % args}, the right operand expanded if it is a tuple literal. */
  private GoExpr format(Expr format, Expr args) {
    List<GoExpr> callArgs = new ArrayList<>();
    callArgs.add(translate(format));
    if (args instanceof Expr.TupleLiteral tuple) {
      callArgs.addAll(translateAll(tuple.elts()));
    } else {
      callArgs.add(translate(args));
    }
    return call(qualified("fmt", "Sprintf"), callArgs);
  }

  /** The operator token for the operators that have one. */
  static String operatorToken(BinaryOperator op) {
    return switch (op) {
      case ADD -> "+";
      case SUB -> "-";
      case MULT -> "*";
      case DIV, FLOOR_DIV -> "/";
      case MOD -> "%";
      case LSHIFT -> "<<";
      case RSHIFT -> ">>";
      case BIT_OR -> "|";
      case BIT_XOR -> "^";
      case BIT_AND -> "&";
      case POW, MAT_MULT -> throw new IllegalArgumentException("no operator token for " + op);
    };
  }

  private GoExpr boolOp(Expr.BoolOp op) {
    String token =
        switch (op.op()) {
          case AND -> "&&";
          case OR -> "||";
        };
    GoExpr result = translate(op.values().get(0));
    for (int i = 1; i < op.values().size(); i++) {
      result = binary(result, token, translate(op.values().get(i)));
    }
    return result;
  }

  /**
   * {@code a < b < c} becomes {@code (a < b) && (b < c)}; the shared operand appears in both
   * comparisons.
   */
  private GoExpr compare(Expr.Compare compare) {
    if (compare.ops().size() == 1) {
      return comparison(compare.left(), compare.ops().get(0), compare.comparators().get(0));
    }
    GoExpr result = null;
    Expr left = compare.left();
    for (int i = 0; i < compare.ops().size(); i++) {
      Expr right = compare.comparators().get(i);
      GoExpr pair = GoIR.paren(comparison(left, compare.ops().get(i), right));
      result = result == null ? pair : binary(result, "&&", pair);
      left = right;
    }
    return result;
  }

  private GoExpr comparison(Expr left, CompareOperator op, Expr right) {
    return switch (op) {
      case EQ, IS -> binary(translate(left), "==", translate(right));
      case NOT_EQ, IS_NOT -> binary(translate(left), "!=", translate(right));
      case LT -> binary(translate(left), "<", translate(right));
      case LT_E -> binary(translate(left), "<=", translate(right));
      case GT -> binary(translate(left), ">", translate(right));
      case GT_E -> binary(translate(left), ">=", translate(right));
      case IN -> call(ctx.runtime("Contains"), translate(right), translate(left));
      case NOT_IN ->
          GoIR.unary("!", call(ctx.runtime("Contains"), translate(right), translate(left)));
    };
  }

  private GoExpr dict(Expr.DictLiteral dict) {
    ImmutableList.Builder<GoExpr> elems = ImmutableList.builder();
    for (int i = 0; i < dict.keys().size(); i++) {
      elems.add(GoIR.keyValue(translate(dict.keys().get(i)), translate(dict.values().get(i))));
    }
    return GoIR.composite(ctx.runtime("Dict"), elems.build());
  }

  /**
   * Attribute access. The dotted path is resolved through the module's import aliases, then
   * looked up among the well-known members; an imported module's member becomes a qualified
   * name, anything else a field selection.
   */
  private GoExpr attribute(Expr.Attribute attribute) {
    String base = dottedName(attribute.value());
    if (base != null) {
      String resolved = resolveModule(base);
      GoExpr wellKnown =
          WELL_KNOWN.get((resolved != null ? resolved : base) + "." + attribute.attr());
      if (wellKnown != null) {
        return wellKnown;
      }
      String module = moduleOf(base);
      if (module != null) {
        return qualified(module.replace('.', '/'), RenameTable.rename(attribute.attr()));
      }
    }
    return GoIR.selector(translate(attribute.value()), RenameTable.rename(attribute.attr()));
  }

  /**
   * Returns the module a dotted path names through the import aliases, or null. The longest
   * imported prefix wins: with {@code import os.path}, {@code os.path} resolves as a whole.
   */
  @Nullable String resolveModule(String dotted) {
    String prefix = dotted;
    String rest = "";
    while (true) {
      String module = ctx.scope().resolveImport(prefix);
      if (module != null && !ctx.scope().isDeclared(prefix)) {
        return module + rest;
      }
      int dot = prefix.lastIndexOf('.');
      if (dot < 0) {
        return null;
      }
      rest = prefix.substring(dot) + rest;
      prefix = prefix.substring(0, dot);
    }
  }

  /**
   * Returns the imported module a dotted path names, or null. A well-known member such as {@code
   * sys.stdout} is a value, not a module.
   */
  @Nullable String moduleOf(String dotted) {
    String module = resolveModule(dotted);
    return module != null && !WELL_KNOWN.containsKey(module) ? module : null;
  }

  /** {@code a.b.c} for a chain of attribute accesses on a name, otherwise null. */
  static @Nullable String dottedName(Expr e) {
    List<String> parts = new ArrayList<>();
    Expr current = e;
    while (current instanceof Expr.Attribute attribute) {
      parts.add(0, attribute.attr());
      current = attribute.value();
    }
    if (!(current instanceof Expr.Name name)) {
      return null;
    }
    parts.add(0, name.id());
    return Joiner.on('.').join(parts);
  }

  private GoExpr subscript(Expr.Subscript subscript) {
    Slicer slice = subscript.slice();
    GoExpr value = translate(subscript.value());
    return switch (slice.kind()) {
      case INDEX -> GoIR.index(value, bound(value, ((Slicer.Index) slice).value()));
      case SLICE -> {
        Slicer.Slice s = (Slicer.Slice) slice;
        if (s.step() != null) {
          throw ctx.hardFailure(s.step().position(), TranslationDiagnostics.SLICE_STEP);
        }
        yield GoIR.slice(
            value,
            s.lower() == null ? null : bound(value, s.lower()),
            s.upper() == null ? null : bound(value, s.upper()));
      }
      case EXT_SLICE ->
          throw ctx.hardFailure(subscript.position(), TranslationDiagnostics.EXTENDED_SLICE);
    };
  }

  /** An index or slice bound; a syntactically negative {@code -k} counts from the end. */
  private GoExpr bound(GoExpr value, Expr index) {
    Expr magnitude = negated(index);
    if (magnitude == null) {
      return translate(index);
    }
    return binary(call(ident("len"), value), "-", translate(magnitude));
  }

  /**
   * For a syntactically negative expression {@code -k}, returns {@code k}; otherwise null. The
   * operand of a unary minus need not be a literal.
   */
  static @Nullable Expr negated(Expr e) {
    if (e instanceof Expr.UnaryOp op && op.op() == UnaryOperator.USUB) {
      return op.operand();
    }
    if (e instanceof Expr.Num num && num.isNegative()) {
      return new Expr.Num(num.numberKind(), num.text().substring(1), num.position());
    }
    return null;
  }

  static boolean isSyntacticallyNegative(Expr e) {
    return negated(e) != null;
  }

  /**
   * A lambda becomes a function literal returning the body's value, called in place unless the
   * options ask for function values.
   */
  private GoExpr lambda(Expr.Lambda lambda) {
    ctx.pushScope(ExitMode.NO_EXIT_SEEN);
    DeclarationTranslator.Signature signature =
        ctx.declarations().parameters(lambda.args(), null);
    GoExpr body = translate(lambda.body());
    ctx.popScope(false);
    GoExpr literal =
        GoIR.funcLit(
            signature.params(),
            ImmutableList.of(Param.unnamed(ctx.runtime("Any"))),
            ImmutableList.of(GoIR.returnStmt(body)));
    return ctx.getOptions().isLambdasAsValues() ? literal : call(literal);
  }

  /** {@code a if t else b} becomes a function literal choosing the value, called in place. */
  private GoExpr ifExp(Expr.IfExp ifExp) {
    GoStmt choice =
        GoIR.ifStmt(
            null,
            translate(ifExp.test()),
            ImmutableList.of(GoIR.returnStmt(translate(ifExp.body()))),
            ImmutableList.of(GoIR.returnStmt(translate(ifExp.orelse()))));
    return GoIR.invoke(
        ImmutableList.of(Param.unnamed(ctx.runtime("Any"))), ImmutableList.of(choice));
  }

  /**
   * The type named by an annotation or a type argument. Unrecognized shapes become the dynamic
   * placeholder type.
   */
  GoExpr typeExpr(Expr e) {
    if (e instanceof Expr.Name name) {
      return identifier(name.id());
    }
    if (e instanceof Expr.Str str && SIMPLE_NAME.matcher(str.value()).matches()) {
      return identifier(str.value());
    }
    if (e instanceof Expr.NameConstant constant && constant.value() == Expr.Singleton.NONE) {
      return GoIR.nil();
    }
    if (e instanceof Expr.Attribute attribute) {
      String base = dottedName(attribute.value());
      if (base != null) {
        return GoIR.leadingComment(base, ident(RenameTable.rename(attribute.attr())));
      }
    }
    if (e instanceof Expr.Subscript subscript) {
      return typeExpr(subscript.value());
    }
    return ctx.runtime("Any");
  }

  /**
   * A coarse static type for a value, judged by its syntactic shape only; null when the shape
   * says nothing.
   */
  @Nullable GoExpr typeGuess(Expr value) {
    Expr e = value;
    Expr magnitude = negated(e);
    if (magnitude != null) {
      e = magnitude;
    }
    if (e instanceof Expr.Num num) {
      return ident(numberType(num.numberKind()));
    }
    return switch (e.kind()) {
      case STR -> ident("string");
      case TUPLE -> ctx.runtime("Tuple");
      case LIST, LIST_COMP -> ctx.runtime("List");
      case DICT, DICT_COMP -> ctx.runtime("Dict");
      default -> null;
    };
  }

  private static String numberType(NumberKind kind) {
    return switch (kind) {
      case INT -> "int";
      case FLOAT -> "float64";
      case COMPLEX -> "complex128";
    };
  }
}
