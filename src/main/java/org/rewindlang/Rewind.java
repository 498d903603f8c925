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

package org.rewindlang;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.Map;
import org.rewindlang.impl.Environment;
import org.rewindlang.impl.RewindFunction;
import org.rewindlang.iter.IterationWrapper;
import org.rewindlang.iter.SequenceFactory;
import org.rewindlang.transform.TailCallTransformer;
import org.rewindlang.tree.Program;

/**
 * Entry point for running Rewind source and applying the tail-call transformation to it. Each
 * call to {@link #newEnvironment} or {@link #load} returns a separate {@link Environment}.
 */
public class Rewind {
  /** The system property that sets the default for {@link #setMaxCallDepth}. */
  public static final String MAX_CALL_DEPTH_PROPERTY = "rewind.maxCallDepth";

  public static final int DEFAULT_MAX_CALL_DEPTH = 1000;

  private int maxCallDepth = Integer.getInteger(MAX_CALL_DEPTH_PROPERTY, DEFAULT_MAX_CALL_DEPTH);

  public Rewind() {}

  public int maxCallDepth() {
    return maxCallDepth;
  }

  /**
   * Sets the maximum number of nested function activations in environments created after this
   * call. Deeper recursion fails with a RuntimeError.
   */
  public void setMaxCallDepth(int maxCallDepth) {
    Preconditions.checkArgument(maxCallDepth > 0, "maxCallDepth must be positive");
    this.maxCallDepth = maxCallDepth;
  }

  /** Returns an empty environment in which {@code @tailrec} is available. */
  public Environment newEnvironment() {
    Environment env = new Environment(maxCallDepth);
    TailCallTransformer.install(env);
    return env;
  }

  /** Compiles {@code sourceText} and executes it in a new environment. */
  public Environment load(String sourceText, String sourceName) {
    Environment env = newEnvironment();
    env.load(sourceText, sourceName);
    return env;
  }

  /**
   * Executes {@code sourceText}, which must define {@code functionName}, and returns the loop
   * version of that function if it is tail-recursive in one of the recognized shapes, or the
   * function as defined otherwise. The returned function is also bound to {@code functionName} in
   * its environment.
   */
  public RewindFunction transformTailRecursive(String sourceText, String functionName) {
    Environment env = newEnvironment();
    Program program = env.load(sourceText, "<" + functionName + ">");
    Preconditions.checkArgument(
        program.function(functionName) != null, "No definition of %s", functionName);
    return TailCallTransformer.transform(env, functionName);
  }

  /** Returns a wrapper over a fresh sequence from {@code factory}. */
  public static IterationWrapper wrapIteration(
      SequenceFactory factory, List<?> args, Map<String, ?> kwargs) {
    return new IterationWrapper(factory, args, kwargs);
  }
}
