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
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.rewindlang.impl.Values;

/**
 * Everything needed to recreate an {@link IterationWrapper} at a given position, given the same
 * {@link SequenceFactory}.
 *
 * @param constructorArgs the positional arguments the factory is opened with
 * @param constructorKwargs the keyword arguments the factory is opened with
 * @param stepCount how many elements have been taken from the sequence
 * @param yieldedHistory the elements taken so far, in order
 * @param exhausted true once the sequence has been found to have no more elements
 * @param factoryName the factory's {@link SequenceFactory#name}; informational only
 */
public record WrapperState(
    ImmutableList<Object> constructorArgs,
    ImmutableMap<String, Object> constructorKwargs,
    long stepCount,
    ImmutableList<Object> yieldedHistory,
    boolean exhausted,
    @Nullable String factoryName) {

  public WrapperState {
    Preconditions.checkNotNull(constructorArgs);
    Preconditions.checkNotNull(constructorKwargs);
    Preconditions.checkNotNull(yieldedHistory);
    Preconditions.checkArgument(stepCount >= 0, "stepCount must be non-negative: %s", stepCount);
  }

  /** Creates a state, converting the given values with {@link Values#fromJava}. */
  public static WrapperState of(
      List<?> constructorArgs,
      Map<String, ?> constructorKwargs,
      long stepCount,
      List<?> yieldedHistory,
      boolean exhausted,
      @Nullable String factoryName) {
    return new WrapperState(
        Values.fromJava(constructorArgs),
        Values.fromJava(constructorKwargs),
        stepCount,
        Values.fromJava(yieldedHistory),
        exhausted,
        factoryName);
  }
}
