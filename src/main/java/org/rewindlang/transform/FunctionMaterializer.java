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

package org.rewindlang.transform;

import com.google.common.base.Preconditions;
import org.rewindlang.impl.Environment;
import org.rewindlang.impl.InterpretedFunction;
import org.rewindlang.tree.FunctionDef;

/** Turns a rewritten definition into a callable function. */
public class FunctionMaterializer {

  private FunctionMaterializer() {}

  /**
   * Returns a function that executes {@code tree} with its free names resolved in {@code env}, the
   * environment of {@code original}. The result has the original's name, documentation and
   * parameter defaults. Neither {@code original} nor {@code env} is modified.
   */
  public static InterpretedFunction materialize(
      FunctionDef tree, Environment env, InterpretedFunction original) {
    Preconditions.checkArgument(
        tree.signature().equals(original.definition().signature()),
        "Parameters (%s) differ from the original's (%s)",
        tree.signature(),
        original.definition().signature());
    return InterpretedFunction.bind(
        tree, env, original.defaults(), original.name(), original.doc());
  }
}
