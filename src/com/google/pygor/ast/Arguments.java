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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * The formal parameter list of a function or lambda.
 *
 * @param args Positional parameters.
 * @param defaults Defaults of the last {@code defaults.size()} positional parameters.
 * @param vararg The {@code *args} parameter, if any.
 * @param kwonlyargs Keyword-only parameters.
 * @param kwDefaults One entry per keyword-only parameter, empty when it has no default.
 * @param kwarg The {@code **kwargs} parameter, if any.
 */
public record Arguments(
    ImmutableList<Arg> args,
    ImmutableList<Expr> defaults,
    @Nullable Arg vararg,
    ImmutableList<Arg> kwonlyargs,
    ImmutableList<Optional<Expr>> kwDefaults,
    @Nullable Arg kwarg) {

  public static final Arguments EMPTY =
      new Arguments(
          ImmutableList.of(),
          ImmutableList.of(),
          null,
          ImmutableList.of(),
          ImmutableList.of(),
          null);

  public Arguments {
    Preconditions.checkArgument(
        defaults.size() <= args.size(), "more defaults than positional parameters");
    Preconditions.checkArgument(
        kwDefaults.size() == kwonlyargs.size(), "keyword-only defaults do not line up");
  }

  /** Returns the default of the positional parameter at {@code index}, or null. */
  public @Nullable Expr defaultFor(int index) {
    int firstWithDefault = args.size() - defaults.size();
    return index >= firstWithDefault ? defaults.get(index - firstWithDefault) : null;
  }
}
