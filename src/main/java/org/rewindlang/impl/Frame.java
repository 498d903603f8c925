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

import java.util.Map;
import org.jspecify.annotations.Nullable;

/** The variables visible to the statements being executed. */
final class Frame {
  final Environment env;

  /** Null when executing top-level statements, which bind globals. */
  private final @Nullable Map<String, Object> locals;

  /**
   * If this frame is running a generator body, the index of the yield whose value is wanted;
   * otherwise -1.
   */
  final int yieldTarget;

  int yieldsSeen;

  private Frame(Environment env, @Nullable Map<String, Object> locals, int yieldTarget) {
    this.env = env;
    this.locals = locals;
    this.yieldTarget = yieldTarget;
  }

  static Frame topLevel(Environment env) {
    return new Frame(env, null, -1);
  }

  static Frame call(Environment env, Map<String, Object> locals) {
    return new Frame(env, locals, -1);
  }

  static Frame generator(Environment env, Map<String, Object> locals, int yieldTarget) {
    return new Frame(env, locals, yieldTarget);
  }

  Object lookup(String name) {
    if (locals != null) {
      Object result = locals.get(name);
      if (result != null) {
        return result;
      }
    }
    return env.get(name);
  }

  void bind(String name, Object value) {
    if (locals != null) {
      locals.put(name, value);
    } else {
      env.define(name, value);
    }
  }
}
