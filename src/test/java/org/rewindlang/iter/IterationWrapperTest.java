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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rewindlang.impl.Environment;

@RunWith(JUnit4.class)
public class IterationWrapperTest {

  /** Yields the first {@code count} Fibonacci numbers; {@code scale} multiplies each. */
  private static final SequenceFactory FIBONACCI =
      SequenceFactory.of(
          "fibonacci",
          (args, kwargs) -> {
            int count = ((BigInteger) args.get(0)).intValueExact();
            BigInteger scale = (BigInteger) kwargs.getOrDefault("scale", BigInteger.ONE);
            return new Iterator<BigInteger>() {
              int produced;
              BigInteger a = BigInteger.ZERO;
              BigInteger b = BigInteger.ONE;

              @Override
              public boolean hasNext() {
                return produced < count;
              }

              @Override
              public BigInteger next() {
                BigInteger result = a.multiply(scale);
                BigInteger sum = a.add(b);
                a = b;
                b = sum;
                produced++;
                return result;
              }
            };
          });

  private static BigInteger i(long value) {
    return BigInteger.valueOf(value);
  }

  private static List<Object> advance(IterationWrapper wrapper, int steps) {
    return IntStream.range(0, steps).mapToObj(unused -> wrapper.advance()).toList();
  }

  @Test
  public void advanceRecordsHistory() {
    IterationWrapper wrapper =
        new IterationWrapper(FIBONACCI, List.of(8), ImmutableMap.of("scale", 2));
    assertThat(advance(wrapper, 4)).containsExactly(i(0), i(2), i(2), i(4)).inOrder();
    WrapperState state = wrapper.snapshot();
    assertThat(state.stepCount()).isEqualTo(4);
    assertThat(state.yieldedHistory()).containsExactly(i(0), i(2), i(2), i(4)).inOrder();
    assertThat(state.constructorArgs()).containsExactly(i(8));
    assertThat(state.constructorKwargs()).containsExactly("scale", i(2));
    assertThat(state.exhausted()).isFalse();
    assertThat(state.factoryName()).isEqualTo("fibonacci");
    assertThat(wrapper.toString()).isEqualTo("IterationWrapper(fibonacci, step 4)");
  }

  @Test
  public void exhaustion() {
    IterationWrapper wrapper = new IterationWrapper(FIBONACCI, List.of(2), ImmutableMap.of());
    assertThat(ImmutableList.copyOf(wrapper)).containsExactly(i(0), i(1)).inOrder();
    assertThat(wrapper.hasNext()).isFalse();
    ExhaustedIterationException e =
        assertThrows(ExhaustedIterationException.class, wrapper::advance);
    assertThat(e).hasMessageThat().contains("fibonacci");
    assertThat(wrapper.isExhausted()).isTrue();
    // It stays exhausted.
    assertThrows(ExhaustedIterationException.class, wrapper::next);
    assertThat(wrapper.stepCount()).isEqualTo(2);
    assertThat(wrapper.snapshot().exhausted()).isTrue();
    assertThat(wrapper.toString()).isEqualTo("IterationWrapper(fibonacci, step 2, exhausted)");
  }

  @Test
  public void restoreThroughSerializer() throws Exception {
    IterationWrapper wrapper = new IterationWrapper(FIBONACCI, List.of(20), ImmutableMap.of());
    advance(wrapper, 3);
    String encoded = new JsonStateSerializer().encode(wrapper.snapshot());

    IterationWrapper restored = new IterationWrapper(FIBONACCI, List.of(0), ImmutableMap.of());
    restored.restore(new JsonStateSerializer().decode(encoded));
    assertThat(restored.snapshot()).isEqualTo(wrapper.snapshot());
    assertThat(restored.advance()).isEqualTo(i(2));
    assertThat(restored.advance()).isEqualTo(i(3));
    assertThat(wrapper.advance()).isEqualTo(i(2));
  }

  @Test
  public void restoreFromZero() {
    IterationWrapper wrapper = new IterationWrapper(FIBONACCI, List.of(5), ImmutableMap.of());
    WrapperState initial = wrapper.snapshot();
    advance(wrapper, 4);
    wrapper.restore(initial);
    assertThat(wrapper.stepCount()).isEqualTo(0);
    assertThat(wrapper.snapshot().yieldedHistory()).isEmpty();
    assertThat(wrapper.advance()).isEqualTo(i(0));
  }

  @Test
  public void restoreExhausted() {
    IterationWrapper wrapper = new IterationWrapper(FIBONACCI, List.of(1), ImmutableMap.of());
    advance(wrapper, 1);
    assertThrows(ExhaustedIterationException.class, wrapper::advance);
    WrapperState state = wrapper.snapshot();

    IterationWrapper restored = new IterationWrapper(FIBONACCI, List.of(1), ImmutableMap.of());
    restored.restore(state);
    assertThat(restored.isExhausted()).isTrue();
    assertThat(restored.stepCount()).isEqualTo(1);
    assertThat(restored.snapshot().yieldedHistory()).containsExactly(i(0));
    assertThrows(ExhaustedIterationException.class, restored::advance);
  }

  @Test
  public void restoreExhaustedDoesNotOpenFactory() {
    AtomicInteger opened = new AtomicInteger();
    SequenceFactory counted =
        SequenceFactory.of(
            "counted",
            (args, kwargs) -> {
              opened.incrementAndGet();
              return IntStream.range(0, 3).iterator();
            });
    IterationWrapper wrapper = new IterationWrapper(counted, List.of(), ImmutableMap.of());
    assertThat(opened.get()).isEqualTo(1);
    wrapper.restore(WrapperState.of(List.of(), ImmutableMap.of(), 3, List.of(0, 1, 2), true, null));
    assertThat(opened.get()).isEqualTo(1);
    assertThat(wrapper.stepCount()).isEqualTo(3);
    assertThat(wrapper.hasNext()).isFalse();
  }

  @Test
  public void failedRestoreLeavesWrapperUnchanged() {
    // Counts from zero up to args[0], which must not be negative; throws on reaching failAt.
    SequenceFactory checked =
        SequenceFactory.of(
            "checked",
            (args, kwargs) -> {
              int bound = ((BigInteger) args.get(0)).intValueExact();
              int failAt =
                  ((BigInteger) kwargs.getOrDefault("failAt", BigInteger.ONE.negate()))
                      .intValueExact();
              Preconditions.checkArgument(bound >= 0, "negative bound %s", bound);
              return IntStream.range(0, bound)
                  .mapToObj(
                      n -> {
                        Preconditions.checkState(n != failAt, "failed at %s", n);
                        return n;
                      })
                  .iterator();
            });
    IterationWrapper wrapper = new IterationWrapper(checked, List.of(10), ImmutableMap.of());
    advance(wrapper, 2);
    WrapperState before = wrapper.snapshot();

    WrapperState badArgs =
        WrapperState.of(List.of(-1), ImmutableMap.of(), 0, List.of(), false, null);
    assertThrows(IllegalArgumentException.class, () -> wrapper.restore(badArgs));
    assertThat(wrapper.snapshot()).isEqualTo(before);

    WrapperState failsInReplay =
        WrapperState.of(
            List.of(10), ImmutableMap.of("failAt", 3), 6, List.of(0, 1, 2, 3, 4, 5), false, null);
    assertThrows(IllegalStateException.class, () -> wrapper.restore(failsInReplay));
    assertThat(wrapper.snapshot()).isEqualTo(before);

    assertThat(wrapper.advance()).isEqualTo(i(2));
    assertThat(wrapper.stepCount()).isEqualTo(3);
  }

  @Test
  public void cloneIsIndependent() {
    IterationWrapper wrapper = new IterationWrapper(FIBONACCI, List.of(10), ImmutableMap.of());
    advance(wrapper, 3);
    IterationWrapper clone = wrapper.cloneAtState();
    assertThat(clone).isNotSameInstanceAs(wrapper);
    assertThat(clone.snapshot()).isEqualTo(wrapper.snapshot());

    assertThat(advance(wrapper, 2)).containsExactly(i(2), i(3)).inOrder();
    assertThat(clone.stepCount()).isEqualTo(3);
    assertThat(advance(clone, 3)).containsExactly(i(2), i(3), i(5)).inOrder();
    assertThat(wrapper.stepCount()).isEqualTo(5);
    assertThat(wrapper.advance()).isEqualTo(i(5));
  }

  @Test
  public void nonDeterministicFactoryRestoresToWrongPosition() {
    // Each sequence opened is two elements shorter than the last, so replay can't reach the
    // recorded position.
    AtomicInteger length = new AtomicInteger(5);
    SequenceFactory shrinking =
        SequenceFactory.of(
            "shrinking",
            (args, kwargs) -> IntStream.range(0, length.getAndAdd(-2)).iterator());
    IterationWrapper wrapper = new IterationWrapper(shrinking, List.of(), ImmutableMap.of());
    advance(wrapper, 4);
    IterationWrapper clone = wrapper.cloneAtState();
    // The recorded position is kept even though the replayed sequence had only one element.
    assertThat(clone.stepCount()).isEqualTo(4);
    assertThat(clone.isExhausted()).isTrue();
    assertThat(clone.hasNext()).isFalse();
  }

  @Test
  public void rewindGenerator() throws Exception {
    Environment env = new Environment(100);
    env.load(
        """
        def countdown(n, step=1) {
          while n > 0 {
            yield n
            n -= step
          }
        }
        """,
        "test");
    SequenceFactory factory = SequenceFactory.forFunction(env.function("countdown"));
    assertThat(factory.name()).isEqualTo("countdown");
    IterationWrapper wrapper =
        new IterationWrapper(factory, List.of(10), ImmutableMap.of("step", 3));
    assertThat(advance(wrapper, 2)).containsExactly(i(10), i(7)).inOrder();

    byte[] saved = new JsonStateSerializer().encodeBytes(wrapper.snapshot());
    IterationWrapper restored = new IterationWrapper(factory, List.of(1), ImmutableMap.of());
    restored.restore(new JsonStateSerializer().decodeBytes(saved));
    assertThat(ImmutableList.copyOf(restored)).containsExactly(i(4), i(1)).inOrder();
    assertThat(restored.snapshot().yieldedHistory())
        .containsExactly(i(10), i(7), i(4), i(1))
        .inOrder();
  }

  @Test
  public void listFunctionAsFactory() {
    Environment env = new Environment(100);
    env.load("def letters(s) { return list(s) }", "test");
    SequenceFactory factory = SequenceFactory.forFunction(env.function("letters"));
    IterationWrapper wrapper = new IterationWrapper(factory, List.of("abc"), ImmutableMap.of());
    assertThat(ImmutableList.copyOf(wrapper)).containsExactly("a", "b", "c").inOrder();
  }
}
