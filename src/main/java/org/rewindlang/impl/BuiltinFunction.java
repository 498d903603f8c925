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
import org.rewindlang.util.StringUtil;

/** A function implemented in Java. Builtins only take positional arguments. */
final class BuiltinFunction extends RewindFunction {

  interface Body {
    Object apply(ImmutableList<Object> args);
  }

  private final String name;
  private final String doc;
  private final int minArgs;
  private final int maxArgs;
  private final Body body;

  /** {@code maxArgs} may be -1 for functions that take any number of arguments. */
  BuiltinFunction(String name, String doc, int minArgs, int maxArgs, Body body) {
    this.name = name;
    this.doc = doc;
    this.minArgs = minArgs;
    this.maxArgs = maxArgs;
    this.body = body;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public String doc() {
    return doc;
  }

  @Override
  Object apply(ImmutableList<Object> args, ImmutableMap<String, Object> kwargs) {
    if (!kwargs.isEmpty()) {
      throw RuntimeError.format("%s() takes no keyword arguments", name);
    }
    if (args.size() < minArgs || (maxArgs >= 0 && args.size() > maxArgs)) {
      String expected;
      if (minArgs == maxArgs) {
        expected = String.valueOf(minArgs);
      } else if (maxArgs < 0) {
        expected = "at least " + minArgs;
      } else {
        expected = minArgs + " to " + maxArgs;
      }
      throw RuntimeError.format(
          "%s() takes %s argument%s (%d given)",
          name, expected, StringUtil.plural(Math.max(minArgs, maxArgs)), args.size());
    }
    return body.apply(args);
  }
}
