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
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.rewindlang.impl.Values;

/**
 * Steps through a sequence from a {@link SequenceFactory}, recording enough to save its position
 * ({@link #snapshot}) and return to it later ({@link #restore}), possibly in another process.
 *
 * <p>There is no way to save a running sequence's internal state, so restoring opens a new
 * sequence and discards the first {@link WrapperState#stepCount} elements. This takes time
 * proportional to the step count, and it only reaches the right position if the factory is
 * deterministic (see {@link SequenceFactory}).
 *
 * <p>Not thread-safe; callers sharing a wrapper between threads must synchronize all calls on it.
 */
public class IterationWrapper implements Iterator<Object> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final SequenceFactory factory;
  private ImmutableList<Object> args;
  private ImmutableMap<String, Object> kwargs;
  private Iterator<?> sequence;
  private long stepCount;
  private List<Object> history = new ArrayList<>();
  private boolean exhausted;

  /** Opens {@code factory} with the given arguments, converted with {@link Values#fromJava}. */
  public IterationWrapper(SequenceFactory factory, List<?> args, Map<String, ?> kwargs) {
    this.factory = Preconditions.checkNotNull(factory);
    this.args = Values.fromJava(args);
    this.kwargs = Values.fromJava(kwargs);
    this.sequence = factory.open(this.args, this.kwargs);
  }

  public SequenceFactory factory() {
    return factory;
  }

  public long stepCount() {
    return stepCount;
  }

  public boolean isExhausted() {
    return exhausted;
  }

  /**
   * Returns the next element of the sequence and records it. Throws {@link
   * ExhaustedIterationException} if there are no more elements, now and on every later call.
   */
  @CanIgnoreReturnValue
  public Object advance() {
    if (!exhausted && !sequence.hasNext()) {
      exhausted = true;
    }
    if (exhausted) {
      throw new ExhaustedIterationException(factory.name(), stepCount);
    }
    Object value = Values.fromJava(sequence.next());
    stepCount++;
    history.add(value);
    return value;
  }

  @Override
  public boolean hasNext() {
    return !exhausted && sequence.hasNext();
  }

  /** Equivalent to {@link #advance}. */
  @Override
  public Object next() {
    return advance();
  }

  /** Returns the current state. The wrapper is not changed. */
  public WrapperState snapshot() {
    return new WrapperState(
        args, kwargs, stepCount, ImmutableList.copyOf(history), exhausted, factory.name());
  }

  /**
   * Moves this wrapper to the position recorded in {@code state}: reopens the factory with the
   * state's arguments, silently advances the new sequence {@code state.stepCount()} times, then
   * adopts the state's history and exhausted flag. An exhausted state is adopted without opening
   * the factory.
   *
   * <p>If the new sequence ends before the recorded step count (which can only happen if the
   * factory isn't deterministic) a warning is logged and the wrapper is marked exhausted. If
   * opening or replaying the sequence throws, the wrapper is left unchanged.
   */
  public void restore(WrapperState state) {
    Preconditions.checkNotNull(state);
    if (state.factoryName() != null && !state.factoryName().equals(factory.name())) {
      logger.atFine().log(
          "Restoring state saved from %s into a wrapper of %s",
          state.factoryName(), factory.name());
    }
    Iterator<?> newSequence;
    boolean endedEarly = false;
    if (state.exhausted()) {
      newSequence = ImmutableList.of().iterator();
    } else {
      newSequence = factory.open(state.constructorArgs(), state.constructorKwargs());
      long replayed = 0;
      for (; replayed < state.stepCount(); replayed++) {
        if (!newSequence.hasNext()) {
          logger.atWarning().log(
              "Replay of %s ended after %d of %d steps; is the factory deterministic?",
              factory.name(), replayed, state.stepCount());
          endedEarly = true;
          break;
        }
        newSequence.next();
      }
      logger.atFine().log("Replayed %d steps of %s", replayed, factory.name());
    }
    args = state.constructorArgs();
    kwargs = state.constructorKwargs();
    sequence = newSequence;
    stepCount = state.stepCount();
    history = new ArrayList<>(state.yieldedHistory());
    exhausted = state.exhausted() || endedEarly;
  }

  /** Returns a new wrapper at the same position, which advances independently of this one. */
  public IterationWrapper cloneAtState() {
    WrapperState state = snapshot();
    IterationWrapper clone =
        new IterationWrapper(factory, state.constructorArgs(), state.constructorKwargs());
    clone.restore(state);
    return clone;
  }

  @Override
  public String toString() {
    return String.format(
        "IterationWrapper(%s, step %d%s)",
        factory.name(), stepCount, exhausted ? ", exhausted" : "");
  }
}
