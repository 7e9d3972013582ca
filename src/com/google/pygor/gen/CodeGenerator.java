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

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Walks a fragment tree and feeds its text to a {@link CodeConsumer}, inserting the parentheses
 * the output language's operator precedence requires.
 */
class CodeGenerator {
  private static final int PRIMARY = 7;
  private static final int UNARY = 6;

  private static final ImmutableMap<String, Integer> BINARY_PRECEDENCE =
      ImmutableMap.<String, Integer>builder()
          .put("*", 5)
          .put("/", 5)
          .put("%", 5)
          .put("<<", 5)
          .put(">>", 5)
          .put("&", 5)
          .put("&^", 5)
          .put("+", 4)
          .put("-", 4)
          .put("|", 4)
          .put("^", 4)
          .put("==", 3)
          .put("!=", 3)
          .put("<", 3)
          .put("<=", 3)
          .put(">", 3)
          .put(">=", 3)
          .put("&&", 2)
          .put("||", 1)
          .buildOrThrow();

  private final CodeConsumer cc;
  private final String runtimePackage;
  private final Set<String> imports;

  // Composite literals in if/for/switch headers must be parenthesized.
  private boolean inControlClause = false;

  CodeGenerator(CodeConsumer consumer, String runtimePackage, Set<String> imports) {
    this.cc = consumer;
    this.runtimePackage = runtimePackage;
    this.imports = imports;
  }

  void addStatement(GoStmt s) {
    addStatementBody(s);
    cc.endStatement();
  }

  private void addStatementBody(GoStmt s) {
    switch (s.kind()) {
      case EXPR -> addExpr(((GoStmt.ExprStmt) s).x(), 0);
      case ASSIGN, SEND -> addSimpleStatement(s);
      case VAR_DECL -> {
        GoStmt.VarDecl decl = (GoStmt.VarDecl) s;
        cc.add("var ");
        addIdentifiers(decl.names());
        if (decl.type() != null) {
          cc.add(" ");
          addExpr(decl.type(), 0);
        }
        if (!decl.values().isEmpty()) {
          cc.add(" = ");
          addList(decl.values());
        }
      }
      case IF -> addIf((GoStmt.If) s);
      case FOR -> {
        GoStmt.For loop = (GoStmt.For) s;
        cc.add("for ");
        boolean saved = enterControlClause();
        if (loop.init() == null && loop.post() == null) {
          if (loop.cond() != null) {
            addExpr(loop.cond(), 0);
            cc.add(" ");
          }
        } else {
          if (loop.init() != null) {
            addSimpleStatement(loop.init());
          }
          cc.add("; ");
          if (loop.cond() != null) {
            addExpr(loop.cond(), 0);
          }
          cc.add("; ");
          if (loop.post() != null) {
            addSimpleStatement(loop.post());
          }
          cc.add(" ");
        }
        inControlClause = saved;
        addBlock(loop.body());
      }
      case FOR_RANGE -> {
        GoStmt.ForRange loop = (GoStmt.ForRange) s;
        cc.add("for ");
        if (!loop.keys().isEmpty()) {
          addList(loop.keys());
          cc.add(" := ");
        }
        cc.add("range ");
        boolean saved = enterControlClause();
        addExpr(loop.x(), 0);
        inControlClause = saved;
        cc.add(" ");
        addBlock(loop.body());
      }
      case SWITCH -> addSwitch((GoStmt.Switch) s);
      case RETURN -> {
        GoStmt.Return ret = (GoStmt.Return) s;
        cc.add("return");
        if (!ret.results().isEmpty()) {
          cc.add(" ");
          addList(ret.results());
        }
      }
      case BREAK -> cc.add("break");
      case CONTINUE -> cc.add("continue");
      case GO -> {
        cc.add("go ");
        addExpr(((GoStmt.Go) s).call(), 0);
      }
      case BLOCK -> addBlock(((GoStmt.Block) s).body());
      case COMMENT -> {
        GoStmt.Comment comment = (GoStmt.Comment) s;
        List<String> lines = comment.text().lines().toList();
        if (lines.isEmpty()) {
          lines = List.of("");
        }
        for (int i = 0; i < lines.size() - 1; i++) {
          cc.addLineComment(lines.get(i));
          cc.startNewLine();
        }
        String last = lines.get(lines.size() - 1);
        cc.addLineComment(comment.code() == null ? last : last + toSingleLine(comment.code()));
      }
      case COMMENTED -> {
        GoStmt.Commented commented = (GoStmt.Commented) s;
        addStatementBody(commented.stmt());
        cc.add(" ");
        cc.addLineComment(
            commented.code() == null
                ? commented.comment()
                : commented.comment() + toSingleLine(commented.code()));
      }
      case FUNC_DECL -> {
        GoStmt.FuncDecl decl = (GoStmt.FuncDecl) s;
        addDoc(decl.doc());
        cc.add("func ");
        if (decl.receiver() != null) {
          cc.add("(");
          addParam(decl.receiver());
          cc.add(") ");
        }
        cc.addIdentifier(decl.name());
        addSignature(decl.params(), decl.results());
        cc.add(" ");
        addBlock(decl.body());
      }
      case TYPE_DECL -> addTypeDecl((GoStmt.TypeDecl) s);
    }
  }

  /** Statements allowed in the init and post clauses of headers. */
  private void addSimpleStatement(GoStmt s) {
    if (s instanceof GoStmt.Assign assign) {
      addList(assign.lhs());
      cc.add(" " + assign.op() + " ");
      addList(assign.rhs());
    } else if (s instanceof GoStmt.Send send) {
      addExpr(send.channel(), 0);
      cc.add(" <- ");
      addExpr(send.value(), 0);
    } else if (s instanceof GoStmt.ExprStmt exprStmt) {
      addExpr(exprStmt.x(), 0);
    } else {
      throw new RenderException("not a simple statement: " + s.kind());
    }
  }

  private void addIf(GoStmt.If s) {
    cc.add("if ");
    boolean saved = enterControlClause();
    if (s.init() != null) {
      addSimpleStatement(s.init());
      cc.add("; ");
    }
    addExpr(s.cond(), 0);
    inControlClause = saved;
    cc.add(" ");
    addBlock(s.then());
    if (!s.orElse().isEmpty()) {
      cc.add(" else ");
      if (s.orElse().size() == 1 && s.orElse().get(0) instanceof GoStmt.If elseIf) {
        addIf(elseIf);
      } else {
        addBlock(s.orElse());
      }
    }
  }

  private void addSwitch(GoStmt.Switch s) {
    cc.add("switch ");
    boolean saved = enterControlClause();
    if (s.init() != null) {
      addSimpleStatement(s.init());
      cc.add("; ");
    }
    if (s.tag() != null) {
      addExpr(s.tag(), 0);
      cc.add(" ");
    }
    inControlClause = saved;
    cc.add("{");
    cc.startNewLine();
    for (CaseClause clause : s.cases()) {
      if (clause.isDefault()) {
        cc.add("default:");
      } else {
        cc.add("case ");
        addList(clause.exprs());
        cc.add(":");
      }
      cc.startNewLine();
      cc.increaseIndent();
      for (GoStmt stmt : clause.body()) {
        addStatement(stmt);
      }
      cc.decreaseIndent();
    }
    cc.add("}");
  }

  private void addTypeDecl(GoStmt.TypeDecl decl) {
    addDoc(decl.doc());
    cc.add("type ");
    cc.addIdentifier(decl.name());
    cc.add(" struct");
    if (decl.fields().isEmpty()) {
      cc.add("{}");
      return;
    }
    cc.add(" ");
    cc.beginBlock();
    for (Field field : decl.fields()) {
      if (field.name() != null) {
        cc.addIdentifier(field.name());
        if (field.type() != null) {
          cc.add(" ");
        }
      }
      if (field.type() != null) {
        addExpr(field.type(), 0);
      }
      if (field.name() == null && field.type() == null) {
        cc.addLineComment(field.comment() == null ? "" : field.comment());
      } else if (field.initializer() != null || field.comment() != null) {
        StringBuilder comment = new StringBuilder();
        if (field.initializer() != null) {
          comment.append("= ").append(toSingleLine(field.initializer()));
        }
        if (field.comment() != null) {
          comment.append(comment.length() > 0 ? " " : "").append(field.comment());
        }
        cc.add(" ");
        cc.addLineComment(comment.toString());
      }
      cc.endStatement();
    }
    cc.endBlock();
  }

  private void addDoc(List<String> doc) {
    for (String line : doc) {
      cc.addLineComment(line);
      cc.startNewLine();
    }
  }

  private void addBlock(List<GoStmt> body) {
    boolean saved = inControlClause;
    inControlClause = false;
    cc.beginBlock();
    for (GoStmt s : body) {
      addStatement(s);
    }
    cc.endBlock();
    inControlClause = saved;
  }

  private void addSignature(List<Param> params, List<Param> results) {
    cc.add("(");
    for (int i = 0; i < params.size(); i++) {
      if (i > 0) {
        cc.listSeparator();
      }
      addParam(params.get(i));
    }
    cc.add(")");
    if (results.isEmpty()) {
      return;
    }
    if (results.size() == 1 && results.get(0).name() == null) {
      cc.add(" ");
      addExpr(results.get(0).type(), 0);
      return;
    }
    cc.add(" (");
    for (int i = 0; i < results.size(); i++) {
      if (i > 0) {
        cc.listSeparator();
      }
      addParam(results.get(i));
    }
    cc.add(")");
  }

  private void addParam(Param param) {
    if (param.name() != null) {
      cc.addIdentifier(param.name());
      cc.add(" ");
    }
    addExpr(param.type(), 0);
    if (param.defaultValue() != null) {
      cc.add(" ");
      cc.addBlockComment("= " + toSingleLine(param.defaultValue()) + " ");
    }
  }

  void addExpr(GoExpr e, int minPrecedence) {
    boolean parens =
        precedence(e) < minPrecedence
            || (inControlClause && e.kind() == GoExpr.Kind.COMPOSITE);
    if (parens) {
      cc.add("(");
    }
    boolean saved = inControlClause;
    if (parens) {
      inControlClause = false;
    }
    addExprBody(e);
    inControlClause = saved;
    if (parens) {
      cc.add(")");
    }
  }

  private void addExprBody(GoExpr e) {
    switch (e.kind()) {
      case IDENT -> cc.addIdentifier(((GoExpr.Ident) e).name());
      case QUALIFIED -> {
        GoExpr.Qualified q = (GoExpr.Qualified) e;
        imports.add(q.importPath());
        if (!q.importPath().equals(runtimePackage)) {
          cc.addIdentifier(packageName(q.importPath()));
          cc.add(".");
        }
        cc.addIdentifier(q.name());
      }
      case LITERAL -> {
        GoExpr.Literal literal = (GoExpr.Literal) e;
        if (literal.literalKind() == GoExpr.LiteralKind.STRING) {
          cc.add(quote(literal.text()));
        } else {
          if (literal.text().isEmpty()) {
            throw new RenderException("empty " + literal.literalKind() + " literal");
          }
          cc.add(literal.text());
        }
      }
      case SELECTOR -> {
        GoExpr.Selector selector = (GoExpr.Selector) e;
        addExpr(selector.x(), PRIMARY);
        cc.add(".");
        cc.addIdentifier(selector.sel());
      }
      case INDEX -> {
        GoExpr.Index index = (GoExpr.Index) e;
        addExpr(index.x(), PRIMARY);
        cc.add("[");
        addExpr(index.index(), 0);
        cc.add("]");
      }
      case SLICE -> {
        GoExpr.SliceExpr slice = (GoExpr.SliceExpr) e;
        addExpr(slice.x(), PRIMARY);
        cc.add("[");
        if (slice.lo() != null) {
          addExpr(slice.lo(), 0);
        }
        cc.add(":");
        if (slice.hi() != null) {
          addExpr(slice.hi(), 0);
        }
        cc.add("]");
      }
      case CALL -> {
        GoExpr.Call call = (GoExpr.Call) e;
        addExpr(call.fun(), PRIMARY);
        cc.add("(");
        addList(call.args());
        cc.add(")");
      }
      case BINARY -> {
        GoExpr.Binary binary = (GoExpr.Binary) e;
        int p = precedence(e);
        addExpr(binary.left(), p);
        cc.add(" " + binary.op() + " ");
        addExpr(binary.right(), p + 1);
      }
      case UNARY -> {
        GoExpr.Unary unary = (GoExpr.Unary) e;
        cc.add(unary.op());
        // "- -x" must not print as the decrement token.
        addExpr(unary.x(), startsWithSign(unary.x()) ? PRIMARY + 1 : UNARY);
      }
      case PAREN -> {
        cc.add("(");
        boolean saved = inControlClause;
        inControlClause = false;
        addExpr(((GoExpr.Paren) e).x(), 0);
        inControlClause = saved;
        cc.add(")");
      }
      case FUNC_LIT -> {
        GoExpr.FuncLit func = (GoExpr.FuncLit) e;
        cc.add("func");
        addSignature(func.params(), func.results());
        cc.add(" ");
        addBlock(func.body());
      }
      case COMPOSITE -> {
        GoExpr.Composite composite = (GoExpr.Composite) e;
        addExpr(composite.type(), PRIMARY);
        cc.add("{");
        addList(composite.elems());
        cc.add("}");
      }
      case KEY_VALUE -> {
        GoExpr.KeyValue kv = (GoExpr.KeyValue) e;
        addExpr(kv.key(), 0);
        cc.add(": ");
        addExpr(kv.value(), 0);
      }
      case TYPE_ASSERT -> {
        GoExpr.TypeAssert assertion = (GoExpr.TypeAssert) e;
        addExpr(assertion.x(), PRIMARY);
        cc.add(".(");
        if (assertion.type() == null) {
          cc.add("type");
        } else {
          addExpr(assertion.type(), 0);
        }
        cc.add(")");
      }
      case CHAN_TYPE -> {
        cc.add("chan ");
        addExpr(((GoExpr.ChanType) e).elem(), PRIMARY);
      }
      case POINTER -> {
        cc.add("*");
        addExpr(((GoExpr.Pointer) e).x(), PRIMARY);
      }
      case SLICE_TYPE -> {
        cc.add("[]");
        addExpr(((GoExpr.SliceType) e).elem(), PRIMARY);
      }
      case ELLIPSIS -> {
        cc.add("...");
        addExpr(((GoExpr.Ellipsis) e).elem(), PRIMARY);
      }
      case COMMENTED -> {
        GoExpr.Commented commented = (GoExpr.Commented) e;
        if (commented.leading()) {
          cc.addBlockComment(commented.comment());
          cc.add(" ");
          addExpr(commented.x(), 0);
        } else {
          addExpr(commented.x(), 0);
          cc.add(" ");
          cc.addBlockComment(commented.comment());
        }
      }
    }
  }

  static int precedence(GoExpr e) {
    switch (e.kind()) {
      case BINARY:
        {
          String op = ((GoExpr.Binary) e).op();
          Integer p = BINARY_PRECEDENCE.get(op);
          if (p == null) {
            throw new RenderException("unknown binary operator " + op);
          }
          return p;
        }
      case UNARY:
      case POINTER:
        return UNARY;
      case LITERAL:
        return startsWithSign(e) ? UNARY : PRIMARY;
      case COMMENTED:
        return precedence(((GoExpr.Commented) e).x());
      case KEY_VALUE:
        return 0;
      default:
        return PRIMARY;
    }
  }

  private static boolean startsWithSign(GoExpr e) {
    if (e instanceof GoExpr.Unary) {
      return true;
    }
    if (e instanceof GoExpr.Literal literal
        && literal.literalKind() != GoExpr.LiteralKind.STRING) {
      return literal.text().startsWith("-") || literal.text().startsWith("+");
    }
    return false;
  }

  private void addList(List<GoExpr> exprs) {
    for (int i = 0; i < exprs.size(); i++) {
      if (i > 0) {
        cc.listSeparator();
      }
      addExpr(exprs.get(i), 0);
    }
  }

  private void addIdentifiers(List<String> names) {
    for (int i = 0; i < names.size(); i++) {
      if (i > 0) {
        cc.listSeparator();
      }
      cc.addIdentifier(names.get(i));
    }
  }

  private boolean enterControlClause() {
    boolean saved = inControlClause;
    inControlClause = true;
    return saved;
  }

  /** Renders code embedded in a comment. Imports it mentions are not added to the file. */
  private String toSingleLine(@Nullable GoExpr e) {
    if (e == null) {
      return "";
    }
    return CodePrinter.toSingleLine(e, runtimePackage);
  }

  /** The name a package is referred to by: the last element of its import path. */
  static String packageName(String importPath) {
    return importPath.substring(importPath.lastIndexOf('/') + 1);
  }

  /** Quotes a string as an interpreted string literal. */
  static String quote(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 2);
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '"' -> sb.append("\\\"");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20 || c == 0x7f) {
            sb.append(String.format("\\x%02x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.append('"').toString();
  }
}
