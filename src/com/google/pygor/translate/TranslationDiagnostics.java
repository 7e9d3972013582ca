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

/**
 * The diagnostics the translator reports. Errors mark constructs that have no safe lowering and
 * always stop translation of the construct; warnings mark constructs without a rule, which the
 * {@link TranslatorOptions.UnknownConstructMode} decides about.
 */
public final class TranslationDiagnostics {
  private TranslationDiagnostics() {}

  public static final DiagnosticType SLICE_STEP =
      DiagnosticType.error("PYGOR_SLICE_STEP", "Slices with a step are not supported.");

  public static final DiagnosticType EXTENDED_SLICE =
      DiagnosticType.error("PYGOR_EXTENDED_SLICE", "Multi-axis slices are not supported.");

  public static final DiagnosticType RANGE_ARGUMENTS =
      DiagnosticType.error(
          "PYGOR_RANGE_ARGUMENTS", "range() takes 1 to 3 arguments in a loop, found {0}.");

  public static final DiagnosticType DELETE_SLICE =
      DiagnosticType.error("PYGOR_DELETE_SLICE", "Deleting a slice is not supported.");

  public static final DiagnosticType CLASS_BODY_STATEMENT =
      DiagnosticType.error(
          "PYGOR_CLASS_BODY_STATEMENT", "A {0} statement is not allowed in a class body.");

  public static final DiagnosticType UNKNOWN_EXPRESSION =
      DiagnosticType.warning("PYGOR_UNKNOWN_EXPR", "Unsupported expression {0}.");

  public static final DiagnosticType UNKNOWN_STATEMENT =
      DiagnosticType.warning("PYGOR_UNKNOWN_STMT", "Unsupported statement {0}.");

  public static final DiagnosticType DELETE_TARGET =
      DiagnosticType.warning("PYGOR_DELETE_TARGET", "Only a subscript can be deleted, found {0}.");

  public static final DiagnosticType ASSIGNMENT_TARGET =
      DiagnosticType.warning("PYGOR_ASSIGNMENT_TARGET", "Unsupported assignment target {0}.");
}
