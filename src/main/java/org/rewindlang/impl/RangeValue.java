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

import com.google.common.base.Preconditions;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.NoSuchElementException;

/** The lazy arithmetic sequence returned by {@code range(start, stop, step)}. */
public record RangeValue(long start, long stop, long step) implements Iterable<Object> {

  public RangeValue {
    Preconditions.checkArgument(step != 0, "range() step must not be zero");
  }

  public long size() {
    if (step > 0) {
      return start < stop ? (stop - start - 1) / step + 1 : 0;
    } else {
      return start > stop ? (start - stop - 1) / -step + 1 : 0;
    }
  }

  /** Returns the element at {@code index}, which must be in {@code [0, size())}. */
  public BigInteger get(long index) {
    Preconditions.checkArgument(index >= 0 && index < size(), "index %s out of range", index);
    return BigInteger.valueOf(start + index * step);
  }

  @Override
  public Iterator<Object> iterator() {
    return new Iterator<>() {
      long next = start;

      @Override
      public boolean hasNext() {
        return step > 0 ? next < stop : next > stop;
      }

      @Override
      public Object next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        long result = next;
        next += step;
        return BigInteger.valueOf(result);
      }
    };
  }

  @Override
  public String toString() {
    return step == 1
        ? String.format("range(%d, %d)", start, stop)
        : String.format("range(%d, %d, %d)", start, stop, step);
  }
}
