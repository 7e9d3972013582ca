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

import static java.util.Objects.requireNonNull;

import java.io.Serializable;

/** Translator options. */
public class TranslatorOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  public static final String DEFAULT_RUNTIME_PACKAGE = "github.com/pygor/runtime";

  /** What to do with a construct the translator has no rule for. */
  public enum UnknownConstructMode {
    /** Stop translating the construct with an error. */
    PANIC,
    /** Emit a marker comment in place of the construct and keep going. */
    COMMENT
  }

  private UnknownConstructMode unknownConstructMode = UnknownConstructMode.COMMENT;

  /**
   * Replace a top-level statement that fails to translate with an error comment, and carry on
   * with the next one.
   */
  private boolean continueAfterErrors = false;

  /** Precede each translated statement with a comment giving its source line. */
  private boolean emitLineNumbers = false;

  /** Trace scope and statement handling at INFO level. */
  private boolean verbose = false;

  /** Import path of the support package the output calls into. */
  private String runtimePackage = DEFAULT_RUNTIME_PACKAGE;

  /** Leave a lambda as a function value instead of calling it where it appears. */
  private boolean lambdasAsValues = false;

  public UnknownConstructMode getUnknownConstructMode() {
    return unknownConstructMode;
  }

  public void setUnknownConstructMode(UnknownConstructMode mode) {
    this.unknownConstructMode = requireNonNull(mode);
  }

  public boolean isContinueAfterErrors() {
    return continueAfterErrors;
  }

  public void setContinueAfterErrors(boolean continueAfterErrors) {
    this.continueAfterErrors = continueAfterErrors;
  }

  public boolean isEmitLineNumbers() {
    return emitLineNumbers;
  }

  public void setEmitLineNumbers(boolean emitLineNumbers) {
    this.emitLineNumbers = emitLineNumbers;
  }

  public boolean isVerbose() {
    return verbose;
  }

  public void setVerbose(boolean verbose) {
    this.verbose = verbose;
  }

  public String getRuntimePackage() {
    return runtimePackage;
  }

  public void setRuntimePackage(String runtimePackage) {
    this.runtimePackage = requireNonNull(runtimePackage);
  }

  public boolean isLambdasAsValues() {
    return lambdasAsValues;
  }

  public void setLambdasAsValues(boolean lambdasAsValues) {
    this.lambdasAsValues = lambdasAsValues;
  }
}
