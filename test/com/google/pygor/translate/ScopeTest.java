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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.pygor.gen.GoIR;
import com.google.pygor.gen.GoStmt;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Scope}. */
@RunWith(JUnit4.class)
public final class ScopeTest {

  @Test
  public void testFirstAssignmentDeclares() {
    Scope root = Scope.createRoot(false);
    assertThat(root.declareOrAssign("x")).isTrue();
    assertThat(root.declareOrAssign("x")).isFalse();
    assertThat(root.declareOrAssign(ImmutableList.of("x", "y", "y")))
        .containsExactly(false, true, false)
        .inOrder();
  }

  @Test
  public void testAncestorDeclarationsAreVisible() {
    Scope root = Scope.createRoot(false);
    root.declare("x");
    Scope child = root.push();
    Scope grandchild = child.push();
    assertThat(grandchild.isDeclared("x")).isTrue();
    assertThat(grandchild.declareOrAssign("x")).isFalse();
    assertThat(grandchild.declareOrAssign("y")).isTrue();
    assertThat(child.isDeclared("y")).isFalse();
    assertThat(grandchild.getDepth()).isEqualTo(2);
  }

  @Test
  public void testPopReturnsParent() {
    Scope root = Scope.createRoot(false);
    Scope child = root.push();
    assertThat(child.getParent()).isSameInstanceAs(root);
    assertThat(child.pop(true)).isSameInstanceAs(root);
    assertThat(root.isRoot()).isTrue();
    assertThat(child.isRoot()).isFalse();
  }

  @Test
  public void testPopTwiceFails() {
    Scope child = Scope.createRoot(false).push();
    child.pop(true);
    assertThrows(IllegalStateException.class, () -> child.pop(true));
  }

  @Test
  public void testRootCannotBePopped() {
    assertThrows(NullPointerException.class, () -> Scope.createRoot(false).pop(true));
  }

  @Test
  public void testImportsAreSharedByAllScopes() {
    Scope root = Scope.createRoot(false);
    Scope child = root.push();
    child.recordImport("np", "numpy");
    assertThat(root.resolveImport("np")).isEqualTo("numpy");
    assertThat(root.push().resolveImport("np")).isEqualTo("numpy");
    assertThat(root.resolveImport("os")).isNull();
  }

  @Test
  public void testExitModePromotion() {
    Scope root = Scope.createRoot(false);
    Scope function = root.push(ExitMode.NO_EXIT_SEEN);
    Scope block = function.push();
    assertThat(block.getExitMode()).isEqualTo(ExitMode.NO_EXIT_SEEN);
    block.noteExit(ExitMode.VALUE_RETURN);
    block.pop(true);
    assertThat(function.getExitMode()).isEqualTo(ExitMode.VALUE_RETURN);

    Scope generator = function.push();
    generator.noteExit(ExitMode.GENERATOR_YIELD);
    generator.pop(true);
    assertThat(function.getExitMode()).isEqualTo(ExitMode.GENERATOR_YIELD);

    // A weaker mode never replaces a stronger one.
    function.noteExit(ExitMode.VALUE_RETURN);
    assertThat(function.getExitMode()).isEqualTo(ExitMode.GENERATOR_YIELD);

    // Function bodies do not report to the enclosing scope.
    function.pop(false);
    assertThat(root.getExitMode()).isEqualTo(ExitMode.NOT_A_FUNCTION);
  }

  @Test
  public void testMethodsAreFlushedAfterTheTopLevelBody() {
    Scope root = Scope.createRoot(false);
    GoStmt type = GoIR.comment("type");
    GoStmt method = GoIR.comment("method");

    Scope classScope = root.push(ExitMode.NOT_A_FUNCTION);
    classScope.addMethod(method);
    root.add(type);
    classScope.pop(false);

    assertThat(root.getBody()).containsExactly(type, method).inOrder();
  }

  @Test
  public void testMethodsMoveUpThroughNestedScopes() {
    Scope root = Scope.createRoot(false);
    Scope function = root.push(ExitMode.NO_EXIT_SEEN);
    Scope classScope = function.push(ExitMode.NOT_A_FUNCTION);
    GoStmt method = GoIR.comment("method");
    classScope.addMethod(method);

    classScope.pop(false);
    assertThat(function.getBody()).isEmpty();
    assertThat(root.getBody()).isEmpty();

    function.pop(false);
    assertThat(root.getBody()).containsExactly(method);
  }

  @Test
  public void testBodyIsNotFoldedIntoParent() {
    Scope root = Scope.createRoot(false);
    Scope child = root.push();
    child.add(GoIR.breakStmt());
    assertThat(child.getBody()).containsExactly(GoIR.breakStmt());
    child.pop(true);
    assertThat(root.getBody()).isEmpty();
  }
}
