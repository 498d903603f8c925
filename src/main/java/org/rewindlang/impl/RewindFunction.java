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

package org.rewindlang.impl;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** A callable Rewind value: either a builtin or a function defined in Rewind source. */
public abstract class RewindFunction {

  RewindFunction() {}

  public abstract String name();

  /** The function's documentation string, or null if it has none. */
  public abstract @Nullable String doc();

  /**
   * Calls this function. The arguments are converted with {@link Values#fromJava}; a call that
   * doesn't match the function's parameters throws a {@link RuntimeError}.
   */
  public Object call(List<?> args, Map<String, ?> kwargs) {
    return apply(Values.fromJava(args), Values.fromJava(kwargs));
  }

  /** Calls this function with positional arguments only. */
  public Object invoke(Object... args) {
    return call(Arrays.asList(args), ImmutableMap.of());
  }

  abstract Object apply(ImmutableList<Object> args, ImmutableMap<String, Object> kwargs);

  @Override
  public String toString() {
    return "<function " + name() + ">";
  }
}
