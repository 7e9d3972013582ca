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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A whole output source file.
 *
 * @param packageName The package clause.
 * @param decls Top-level fragments in output order.
 */
public record GoFile(String packageName, ImmutableList<GoStmt> decls) {
  public GoFile {
    Preconditions.checkArgument(!packageName.isEmpty(), "empty package name");
  }
}
