/*
 * Copyright 2025 The Rewind Authors
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

package org.rewindlang.tree;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.HashSet;

/**
 * The ordered parameter names of a function. The order defines positional binding, so the i-th
 * argument of a call binds the i-th name.
 */
public record FunctionSignature(ImmutableList<String> parameters) {

  public FunctionSignature {
    Preconditions.checkArgument(
        new HashSet<>(parameters).size() == parameters.size(),
        "Duplicate parameter name in %s",
        parameters);
  }

  public static FunctionSignature of(String... parameters) {
    return new FunctionSignature(ImmutableList.copyOf(parameters));
  }

  public static FunctionSignature of(FunctionDef def) {
    return new FunctionSignature(def.params().stream().map(Param::name).collect(toImmutableList()));
  }

  public int arity() {
    return parameters.size();
  }

  @Override
  public String toString() {
    return String.join(", ", parameters);
  }
}
