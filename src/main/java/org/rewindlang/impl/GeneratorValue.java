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

import com.google.common.collect.ImmutableMap;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * The lazy sequence returned by calling a function whose body contains {@code yield}.
 *
 * <p>Each call to {@link #iterator} starts a fresh iteration, so a generator can be iterated any
 * number of times. There is no suspended interpreter state: the k-th element is produced by
 * executing the body from the start with the original arguments until it reaches its k-th yield.
 * Producing n elements therefore takes O(n^2) steps, and the body must give the same results each
 * time it is run.
 */
public final class GeneratorValue implements Iterable<Object> {
  private final InterpretedFunction function;
  private final ImmutableMap<String, Object> arguments;

  GeneratorValue(InterpretedFunction function, ImmutableMap<String, Object> arguments) {
    this.function = function;
    this.arguments = arguments;
  }

  public String name() {
    return function.name();
  }

  @Override
  public Iterator<Object> iterator() {
    return new Iterator<>() {
      int produced;
      @Nullable Object lookahead;
      boolean done;

      @Override
      public boolean hasNext() {
        if (lookahead == null && !done) {
          Flow flow =
              function.environment().interpreter().runGenerator(function, arguments, produced);
          if (flow.kind() == Flow.Kind.YIELD) {
            lookahead = flow.value();
          } else {
            done = true;
          }
        }
        return lookahead != null;
      }

      @Override
      public Object next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        Object result = lookahead;
        lookahead = null;
        produced++;
        return result;
      }
    };
  }

  @Override
  public String toString() {
    return "<generator " + name() + ">";
  }
}
