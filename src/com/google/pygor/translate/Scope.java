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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.pygor.gen.GoStmt;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * One lexical nesting level of the module being translated. Scopes form a stack: a child points
 * back to its parent and folds itself into it when popped.
 *
 * <p>A scope collects the fragments translated inside it and the names declared in it. Methods
 * of classes defined inside it are buffered separately; they move up on every pop and land in the
 * body of the root scope, after the type they belong to. All scopes of one module share one
 * import-alias map.
 */
public final class Scope {
  private static final Logger logger = Logger.getLogger(Scope.class.getName());

  private final @Nullable Scope parent;
  private final int depth;
  private final Map<String, String> imports;
  private final boolean verbose;
  private final Set<String> vars = new HashSet<>();
  private final List<GoStmt> body = new ArrayList<>();
  private final List<GoStmt> methods = new ArrayList<>();
  private ExitMode exitMode;
  private boolean popped = false;

  private Scope(
      @Nullable Scope parent,
      int depth,
      Map<String, String> imports,
      boolean verbose,
      ExitMode exitMode) {
    this.parent = parent;
    this.depth = depth;
    this.imports = imports;
    this.verbose = verbose;
    this.exitMode = exitMode;
  }

  /** Creates the outermost scope of a module. */
  public static Scope createRoot(boolean verbose) {
    return new Scope(null, 0, new HashMap<>(), verbose, ExitMode.NOT_A_FUNCTION);
  }

  /** Creates a block scope, inheriting this scope's exit mode. */
  public Scope push() {
    return push(exitMode);
  }

  /** Creates a child scope starting in {@code mode}, as a function or class body does. */
  public Scope push(ExitMode mode) {
    checkState(!popped, "push on a popped scope");
    Scope child = new Scope(this, depth + 1, imports, verbose, mode);
    if (verbose) {
      logger.info("PUSH scope " + child.depth);
    }
    return child;
  }

  /**
   * Leaves this scope and returns the parent, which becomes the active scope. Buffered methods
   * move to the parent, and into the parent's body if the parent is the root. The statements of
   * this scope are not folded; the caller wraps them into the fragment that owns the block.
   *
   * @param promoteExitMode Whether the parent takes over this scope's exit mode if it is
   *     stronger. Function bodies pop without promotion.
   */
  public Scope pop(boolean promoteExitMode) {
    checkState(!popped, "scope popped twice");
    Scope p = checkNotNull(parent, "cannot pop the root scope");
    popped = true;
    p.methods.addAll(methods);
    methods.clear();
    if (p.isRoot()) {
      p.body.addAll(p.methods);
      p.methods.clear();
    }
    if (promoteExitMode) {
      p.exitMode = p.exitMode.merge(exitMode);
    }
    if (verbose) {
      logger.info("POP scope " + depth + " (" + exitMode + ")");
    }
    return p;
  }

  /**
   * Records assignments to {@code names} and reports, per name, whether the assignment declares
   * it. A name is new if neither this scope nor any ancestor has declared it.
   */
  @CanIgnoreReturnValue
  public ImmutableList<Boolean> declareOrAssign(List<String> names) {
    ImmutableList.Builder<Boolean> isNew = ImmutableList.builder();
    for (String name : names) {
      isNew.add(declareOrAssign(name));
    }
    return isNew.build();
  }

  @CanIgnoreReturnValue
  public boolean declareOrAssign(String name) {
    if (isDeclared(name)) {
      return false;
    }
    vars.add(name);
    return true;
  }

  /** Declares a name in this scope, shadowing any declaration of an ancestor. */
  public void declare(String name) {
    vars.add(name);
  }

  public boolean isDeclared(String name) {
    for (Scope s = this; s != null; s = s.parent) {
      if (s.vars.contains(name)) {
        return true;
      }
    }
    return false;
  }

  /** Records that {@code alias} names the module {@code module} in this file. */
  public void recordImport(String alias, String module) {
    imports.put(alias, module);
  }

  public @Nullable String resolveImport(String alias) {
    return imports.get(alias);
  }

  public void add(GoStmt stmt) {
    body.add(stmt);
  }

  public void addAll(List<GoStmt> stmts) {
    body.addAll(stmts);
  }

  public ImmutableList<GoStmt> getBody() {
    return ImmutableList.copyOf(body);
  }

  /** Buffers a method, to be emitted at the top level after its type. */
  public void addMethod(GoStmt method) {
    methods.add(method);
  }

  public ExitMode getExitMode() {
    return exitMode;
  }

  /** Notes a return or yield, keeping the stronger mode. */
  public void noteExit(ExitMode mode) {
    exitMode = exitMode.merge(mode);
  }

  public @Nullable Scope getParent() {
    return parent;
  }

  /** The depth of the scope. The root scope has depth 0. */
  public int getDepth() {
    return depth;
  }

  public boolean isRoot() {
    return parent == null;
  }

  @Override
  public String toString() {
    return "Scope@" + depth;
  }
}
