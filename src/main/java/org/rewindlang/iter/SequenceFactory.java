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

package org.rewindlang.iter;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Iterator;
import java.util.function.BiFunction;
import org.rewindlang.impl.RewindFunction;
import org.rewindlang.impl.Values;

/**
 * Produces a fresh sequence from a fixed set of arguments.
 *
 * <p>{@link IterationWrapper#restore} relies on {@link #open} returning the same elements every
 * time it is called with equal arguments, and on opening a sequence having no side effects. This
 * is not checked; a factory that breaks it will restore to the wrong position without any error.
 */
public interface SequenceFactory {

  /** A name for the factory, recorded in {@link WrapperState#factoryName}. */
  String name();

  /** Returns a new iterator positioned at the start of the sequence. */
  Iterator<?> open(ImmutableList<Object> args, ImmutableMap<String, Object> kwargs);

  static SequenceFactory of(
      String name,
      BiFunction<ImmutableList<Object>, ImmutableMap<String, Object>, ? extends Iterator<?>>
          open) {
    Preconditions.checkNotNull(name);
    Preconditions.checkNotNull(open);
    return new SequenceFactory() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public Iterator<?> open(ImmutableList<Object> args, ImmutableMap<String, Object> kwargs) {
        return open.apply(args, kwargs);
      }
    };
  }

  /**
   * A factory that calls {@code fn} and iterates over its result, which may be a generator, a list,
   * a range or any other iterable Rewind value.
   */
  static SequenceFactory forFunction(RewindFunction fn) {
    return of(fn.name(), (args, kwargs) -> Values.iterate(fn.call(args, kwargs)));
  }
}
