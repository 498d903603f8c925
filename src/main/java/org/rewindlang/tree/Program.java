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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** The result of parsing one source text: its top-level statements, in order. */
public record Program(String sourceName, ImmutableList<Stmt> statements) {

  /**
   * Returns the last top-level definition of the named function (later definitions replace earlier
   * ones when the program runs), or null if there is none.
   */
  public @Nullable FunctionDef function(String name) {
    FunctionDef result = null;
    for (Stmt stmt : statements) {
      if (stmt instanceof FunctionDef def && def.name().equals(name)) {
        result = def;
      }
    }
    return result;
  }
}
