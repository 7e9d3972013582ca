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

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Builds a {@link Module} from the JSON serialization of a parsed source file.
 *
 * <p>Every node is a JSON object whose {@code _type} is the parser's node class name and whose
 * other members are the class's fields, plus {@code lineno} and {@code col_offset}. Operators are
 * objects carrying only {@code _type}. Node classes without a variant in the tree model are read
 * as {@link Expr.Unknown} or {@link Stmt.Unknown} so the translator can report them.
 */
public final class AstJsonReader {
  private static final String TYPE = "_type";

  private final String sourceName;

  private AstJsonReader(String sourceName) {
    this.sourceName = sourceName;
  }

  /**
   * Reads a module.
   *
   * @param sourceName Name of the source file, used in diagnostics.
   * @param json The serialized tree; the root must be a {@code Module} node.
   */
  public static Module read(String sourceName, String json) throws AstReadException {
    JsonElement root;
    try {
      root = JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new AstReadException(sourceName + ": JSON parse exception: " + e.getMessage(), e);
    }
    AstJsonReader reader = new AstJsonReader(sourceName);
    try {
      return reader.module(root);
    } catch (IllegalStateException | UnsupportedOperationException e) {
      // Gson reports a member of the wrong JSON type this way.
      throw new AstReadException(sourceName + ": malformed tree: " + e.getMessage(), e);
    }
  }

  private Module module(JsonElement root) throws AstReadException {
    if (!root.isJsonObject()) {
      throw new AstReadException(sourceName + ": expected a Module object, got " + root);
    }
    JsonObject module = root.getAsJsonObject();
    String type = nodeType(module);
    if (!type.equals("Module")) {
      throw new AstReadException(sourceName + ": expected Module, got " + type);
    }
    return new Module(sourceName, stmts(module, "body"));
  }

  private Stmt stmt(JsonObject n) throws AstReadException {
    SourcePosition pos = position(n);
    String type = nodeType(n);
    switch (type) {
      case "Expr":
        {
          JsonObject value = object(n, "value");
          switch (nodeType(value)) {
            case "Yield":
              return new Stmt.Yield(optExpr(value, "value"), pos);
            case "YieldFrom":
              return new Stmt.YieldFrom(expr(value, "value"), pos);
            default:
              return new Stmt.ExprStmt(expr(value), pos);
          }
        }
      case "Assign":
        return new Stmt.Assign(exprs(n, "targets"), expr(n, "value"), pos);
      case "AugAssign":
        return new Stmt.AugAssign(
            expr(n, "target"), binaryOperator(object(n, "op")), expr(n, "value"), pos);
      case "AnnAssign":
        return new Stmt.AnnAssign(
            expr(n, "target"), expr(n, "annotation"), optExpr(n, "value"), pos);
      case "If":
        return new Stmt.If(expr(n, "test"), stmts(n, "body"), stmts(n, "orelse"), pos);
      case "For":
        return new Stmt.For(
            expr(n, "target"), expr(n, "iter"), stmts(n, "body"), stmts(n, "orelse"), pos);
      case "While":
        return new Stmt.While(expr(n, "test"), stmts(n, "body"), stmts(n, "orelse"), pos);
      case "Try":
        {
          ImmutableList.Builder<ExceptHandler> handlers = ImmutableList.builder();
          for (JsonObject h : objects(n, "handlers")) {
            handlers.add(
                new ExceptHandler(
                    optExpr(h, "type"), optString(h, "name"), stmts(h, "body"), position(h)));
          }
          return new Stmt.Try(
              stmts(n, "body"), handlers.build(), stmts(n, "orelse"), stmts(n, "finalbody"), pos);
        }
      case "With":
        {
          ImmutableList.Builder<WithItem> items = ImmutableList.builder();
          for (JsonObject item : objects(n, "items")) {
            items.add(new WithItem(expr(item, "context_expr"), optExpr(item, "optional_vars")));
          }
          return new Stmt.With(items.build(), stmts(n, "body"), pos);
        }
      case "FunctionDef":
        return new Stmt.FunctionDef(
            string(n, "name"),
            arguments(object(n, "args")),
            stmts(n, "body"),
            exprs(n, "decorator_list"),
            optExpr(n, "returns"),
            pos);
      case "ClassDef":
        return new Stmt.ClassDef(
            string(n, "name"),
            exprs(n, "bases"),
            keywords(n),
            stmts(n, "body"),
            exprs(n, "decorator_list"),
            pos);
      case "Import":
        return new Stmt.Import(aliases(n), pos);
      case "ImportFrom":
        {
          JsonElement level = n.get("level");
          return new Stmt.ImportFrom(
              optString(n, "module"),
              aliases(n),
              level == null || level.isJsonNull() ? 0 : level.getAsInt(),
              pos);
        }
      case "Return":
        return new Stmt.Return(optExpr(n, "value"), pos);
      case "Raise":
        return new Stmt.Raise(optExpr(n, "exc"), optExpr(n, "cause"), pos);
      case "Assert":
        return new Stmt.Assert(expr(n, "test"), optExpr(n, "msg"), pos);
      case "Pass":
        return new Stmt.Pass(pos);
      case "Break":
        return new Stmt.Break(pos);
      case "Continue":
        return new Stmt.Continue(pos);
      case "Delete":
        return new Stmt.Delete(exprs(n, "targets"), pos);
      case "Global":
        return new Stmt.Global(strings(n, "names"), pos);
      case "Nonlocal":
        return new Stmt.Nonlocal(strings(n, "names"), pos);
      default:
        return new Stmt.Unknown(type, pos);
    }
  }

  private Expr expr(JsonObject n) throws AstReadException {
    SourcePosition pos = position(n);
    String type = nodeType(n);
    switch (type) {
      case "Num":
        return number(n.get("n"), optString(n, "kind"), pos);
      case "Str":
        return new Expr.Str(string(n, "s"), pos);
      case "Bytes":
        return new Expr.Bytes(string(n, "s"), pos);
      case "NameConstant":
        return singleton(n.get("value"), pos);
      case "Constant":
        return constant(n, pos);
      case "Name":
        return new Expr.Name(string(n, "id"), pos);
      case "Attribute":
        return new Expr.Attribute(expr(n, "value"), string(n, "attr"), pos);
      case "Subscript":
        return new Expr.Subscript(expr(n, "value"), slicer(object(n, "slice")), pos);
      case "Call":
        return call(n, pos);
      case "UnaryOp":
        {
          String op = nodeType(object(n, "op"));
          UnaryOperator operator = UnaryOperator.fromNodeName(op);
          if (operator == null) {
            throw malformed(n, "unknown unary operator " + op);
          }
          return new Expr.UnaryOp(operator, expr(n, "operand"), pos);
        }
      case "BinOp":
        return new Expr.BinOp(
            expr(n, "left"), binaryOperator(object(n, "op")), expr(n, "right"), pos);
      case "BoolOp":
        {
          String op = nodeType(object(n, "op"));
          BoolOperator operator = BoolOperator.fromNodeName(op);
          if (operator == null) {
            throw malformed(n, "unknown boolean operator " + op);
          }
          return new Expr.BoolOp(operator, exprs(n, "values"), pos);
        }
      case "Compare":
        {
          ImmutableList.Builder<CompareOperator> ops = ImmutableList.builder();
          for (JsonObject op : objects(n, "ops")) {
            CompareOperator operator = CompareOperator.fromNodeName(nodeType(op));
            if (operator == null) {
              throw malformed(n, "unknown comparison operator " + nodeType(op));
            }
            ops.add(operator);
          }
          return new Expr.Compare(expr(n, "left"), ops.build(), exprs(n, "comparators"), pos);
        }
      case "Tuple":
        return new Expr.TupleLiteral(exprs(n, "elts"), pos);
      case "List":
        return new Expr.ListLiteral(exprs(n, "elts"), pos);
      case "Dict":
        {
          JsonArray keys = array(n, "keys");
          for (JsonElement key : keys) {
            if (key.isJsonNull()) {
              // {**other} has no key/value pair to translate.
              return new Expr.Unknown("DictUnpack", pos);
            }
          }
          return new Expr.DictLiteral(exprs(n, "keys"), exprs(n, "values"), pos);
        }
      case "Lambda":
        return new Expr.Lambda(arguments(object(n, "args")), expr(n, "body"), pos);
      case "IfExp":
        return new Expr.IfExp(expr(n, "test"), expr(n, "body"), expr(n, "orelse"), pos);
      case "ListComp":
        return new Expr.ListComp(expr(n, "elt"), comprehensions(n), pos);
      case "DictComp":
        return new Expr.DictComp(expr(n, "key"), expr(n, "value"), comprehensions(n), pos);
      case "GeneratorExp":
        return new Expr.GeneratorExp(expr(n, "elt"), comprehensions(n), pos);
      case "Starred":
        return new Expr.Starred(expr(n, "value"), pos);
      default:
        return new Expr.Unknown(type, pos);
    }
  }

  private Expr call(JsonObject n, SourcePosition pos) throws AstReadException {
    ImmutableList.Builder<Expr> args = ImmutableList.builder();
    Expr starargs = optExpr(n, "starargs");
    for (JsonObject arg : objects(n, "args")) {
      if (nodeType(arg).equals("Starred")) {
        if (starargs != null) {
          return new Expr.Unknown("Call(multiple *args)", pos);
        }
        starargs = expr(arg, "value");
      } else {
        args.add(expr(arg));
      }
    }
    ImmutableList.Builder<Keyword> keywords = ImmutableList.builder();
    Expr kwargs = optExpr(n, "kwargs");
    for (JsonObject keyword : objects(n, "keywords")) {
      String name = optString(keyword, "arg");
      if (name == null) {
        if (kwargs != null) {
          return new Expr.Unknown("Call(multiple **kwargs)", pos);
        }
        kwargs = expr(keyword, "value");
      } else {
        keywords.add(new Keyword(name, expr(keyword, "value")));
      }
    }
    return new Expr.Call(expr(n, "func"), args.build(), keywords.build(), starargs, kwargs, pos);
  }

  private Expr constant(JsonObject n, SourcePosition pos) throws AstReadException {
    JsonElement value = n.get("value");
    String kind = optString(n, "kind");
    if (value == null || value.isJsonNull()) {
      return new Expr.NameConstant(Expr.Singleton.NONE, pos);
    }
    if (value.isJsonObject()) {
      return new Expr.Unknown(nodeType(value.getAsJsonObject()), pos);
    }
    JsonPrimitive primitive = value.getAsJsonPrimitive();
    if (primitive.isBoolean()) {
      return singleton(primitive, pos);
    }
    if (primitive.isNumber() || isNumberKind(kind)) {
      return number(primitive, kind, pos);
    }
    if ("bytes".equals(kind)) {
      return new Expr.Bytes(primitive.getAsString(), pos);
    }
    return new Expr.Str(primitive.getAsString(), pos);
  }

  private static boolean isNumberKind(@Nullable String kind) {
    return "int".equals(kind) || "float".equals(kind) || "complex".equals(kind);
  }

  /** The numeric sub-kind comes from the literal as written, never from a converted value. */
  private Expr number(@Nullable JsonElement value, @Nullable String kind, SourcePosition pos)
      throws AstReadException {
    if (value == null || !value.isJsonPrimitive()) {
      throw new AstReadException(sourceName + ": number without a value at " + pos);
    }
    String text = value.getAsString();
    NumberKind numberKind;
    if ("int".equals(kind)) {
      numberKind = NumberKind.INT;
    } else if ("float".equals(kind)) {
      numberKind = NumberKind.FLOAT;
    } else if ("complex".equals(kind) || text.endsWith("j") || text.endsWith("J")) {
      numberKind = NumberKind.COMPLEX;
    } else if (!text.startsWith("0x")
        && !text.startsWith("0X")
        && (text.contains(".") || text.contains("e") || text.contains("E"))) {
      numberKind = NumberKind.FLOAT;
    } else {
      numberKind = NumberKind.INT;
    }
    return new Expr.Num(numberKind, text, pos);
  }

  private Expr singleton(@Nullable JsonElement value, SourcePosition pos) {
    if (value == null || value.isJsonNull()) {
      return new Expr.NameConstant(Expr.Singleton.NONE, pos);
    }
    return new Expr.NameConstant(
        value.getAsBoolean() ? Expr.Singleton.TRUE : Expr.Singleton.FALSE, pos);
  }

  private Slicer slicer(JsonObject n) throws AstReadException {
    SourcePosition pos = position(n);
    switch (nodeType(n)) {
      case "Index":
        return new Slicer.Index(expr(n, "value"), pos);
      case "Slice":
        return new Slicer.Slice(
            optExpr(n, "lower"), optExpr(n, "upper"), optExpr(n, "step"), pos);
      case "ExtSlice":
        {
          ImmutableList.Builder<Slicer> dims = ImmutableList.builder();
          for (JsonObject dim : objects(n, "dims")) {
            dims.add(slicer(dim));
          }
          return new Slicer.ExtSlice(dims.build(), pos);
        }
      case "Tuple":
        {
          boolean hasSlice = false;
          ImmutableList.Builder<Slicer> dims = ImmutableList.builder();
          for (JsonObject elt : objects(n, "elts")) {
            hasSlice |= nodeType(elt).equals("Slice");
            dims.add(slicer(elt));
          }
          if (hasSlice) {
            return new Slicer.ExtSlice(dims.build(), pos);
          }
          return new Slicer.Index(expr(n), pos);
        }
      default:
        return new Slicer.Index(expr(n), pos);
    }
  }

  private Arguments arguments(JsonObject n) throws AstReadException {
    ImmutableList.Builder<Arg> args = ImmutableList.builder();
    for (JsonObject arg : objects(n, "posonlyargs")) {
      args.add(arg(arg));
    }
    for (JsonObject arg : objects(n, "args")) {
      args.add(arg(arg));
    }
    ImmutableList.Builder<Arg> kwonlyargs = ImmutableList.builder();
    for (JsonObject arg : objects(n, "kwonlyargs")) {
      kwonlyargs.add(arg(arg));
    }
    ImmutableList<Arg> kwonly = kwonlyargs.build();
    ImmutableList.Builder<Optional<Expr>> kwDefaults = ImmutableList.builder();
    JsonArray defaults = n.has("kw_defaults") ? array(n, "kw_defaults") : new JsonArray();
    for (int i = 0; i < kwonly.size(); i++) {
      JsonElement d = i < defaults.size() ? defaults.get(i) : null;
      kwDefaults.add(
          d == null || d.isJsonNull()
              ? Optional.<Expr>empty()
              : Optional.of(expr(d.getAsJsonObject())));
    }
    JsonObject vararg = optObject(n, "vararg");
    JsonObject kwarg = optObject(n, "kwarg");
    return new Arguments(
        args.build(),
        exprs(n, "defaults"),
        vararg == null ? null : arg(vararg),
        kwonly,
        kwDefaults.build(),
        kwarg == null ? null : arg(kwarg));
  }

  private Arg arg(JsonObject n) throws AstReadException {
    return new Arg(string(n, "arg"), optExpr(n, "annotation"), position(n));
  }

  private ImmutableList<Keyword> keywords(JsonObject n) throws AstReadException {
    ImmutableList.Builder<Keyword> keywords = ImmutableList.builder();
    for (JsonObject keyword : objects(n, "keywords")) {
      String name = optString(keyword, "arg");
      keywords.add(new Keyword(name == null ? "**" : name, expr(keyword, "value")));
    }
    return keywords.build();
  }

  private ImmutableList<Alias> aliases(JsonObject n) throws AstReadException {
    ImmutableList.Builder<Alias> aliases = ImmutableList.builder();
    for (JsonObject alias : objects(n, "names")) {
      aliases.add(new Alias(string(alias, "name"), optString(alias, "asname")));
    }
    return aliases.build();
  }

  private ImmutableList<Comprehension> comprehensions(JsonObject n) throws AstReadException {
    ImmutableList.Builder<Comprehension> generators = ImmutableList.builder();
    for (JsonObject c : objects(n, "generators")) {
      generators.add(new Comprehension(expr(c, "target"), expr(c, "iter"), exprs(c, "ifs")));
    }
    return generators.build();
  }

  private BinaryOperator binaryOperator(JsonObject op) throws AstReadException {
    BinaryOperator operator = BinaryOperator.fromNodeName(nodeType(op));
    if (operator == null) {
      throw malformed(op, "unknown binary operator " + nodeType(op));
    }
    return operator;
  }

  // Field accessors.

  private String nodeType(JsonObject n) throws AstReadException {
    JsonElement type = n.get(TYPE);
    if (type == null || !type.isJsonPrimitive()) {
      throw new AstReadException(sourceName + ": node without " + TYPE + ": " + n);
    }
    return type.getAsString();
  }

  private static SourcePosition position(JsonObject n) {
    JsonElement line = n.get("lineno");
    JsonElement column = n.get("col_offset");
    if (line == null || line.isJsonNull()) {
      return SourcePosition.UNKNOWN;
    }
    return SourcePosition.of(
        line.getAsInt(), column == null || column.isJsonNull() ? -1 : column.getAsInt());
  }

  private Expr expr(JsonObject n, String field) throws AstReadException {
    return expr(object(n, field));
  }

  private @Nullable Expr optExpr(JsonObject n, String field) throws AstReadException {
    JsonObject value = optObject(n, field);
    return value == null ? null : expr(value);
  }

  private ImmutableList<Expr> exprs(JsonObject n, String field) throws AstReadException {
    ImmutableList.Builder<Expr> exprs = ImmutableList.builder();
    for (JsonObject e : objects(n, field)) {
      exprs.add(expr(e));
    }
    return exprs.build();
  }

  private ImmutableList<Stmt> stmts(JsonObject n, String field) throws AstReadException {
    ImmutableList.Builder<Stmt> stmts = ImmutableList.builder();
    for (JsonObject s : objects(n, field)) {
      stmts.add(stmt(s));
    }
    return stmts.build();
  }

  private JsonObject object(JsonObject n, String field) throws AstReadException {
    JsonObject value = optObject(n, field);
    if (value == null) {
      throw malformed(n, "missing field " + field);
    }
    return value;
  }

  private static @Nullable JsonObject optObject(JsonObject n, String field) {
    JsonElement value = n.get(field);
    return value == null || value.isJsonNull() ? null : value.getAsJsonObject();
  }

  private JsonArray array(JsonObject n, String field) throws AstReadException {
    JsonElement value = n.get(field);
    if (value == null || !value.isJsonArray()) {
      throw malformed(n, "missing list " + field);
    }
    return value.getAsJsonArray();
  }

  /** Absent list fields read as empty, as the parser omits some of them. */
  private ImmutableList<JsonObject> objects(JsonObject n, String field) {
    JsonElement value = n.get(field);
    if (value == null || value.isJsonNull()) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<JsonObject> objects = ImmutableList.builder();
    for (JsonElement e : value.getAsJsonArray()) {
      objects.add(e.getAsJsonObject());
    }
    return objects.build();
  }

  private String string(JsonObject n, String field) throws AstReadException {
    String value = optString(n, field);
    if (value == null) {
      throw malformed(n, "missing field " + field);
    }
    return value;
  }

  private static @Nullable String optString(JsonObject n, String field) {
    JsonElement value = n.get(field);
    return value == null || value.isJsonNull() ? null : value.getAsString();
  }

  private static ImmutableList<String> strings(JsonObject n, String field) {
    ImmutableList.Builder<String> strings = ImmutableList.builder();
    JsonElement value = n.get(field);
    if (value != null && value.isJsonArray()) {
      for (JsonElement e : value.getAsJsonArray()) {
        strings.add(e.getAsString());
      }
    }
    return strings.build();
  }

  private AstReadException malformed(JsonObject n, String message) {
    return new AstReadException(sourceName + ": " + message + " at " + position(n));
  }
}
