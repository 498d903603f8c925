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
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.rewindlang.tree.BinaryOp;

/** Static-only class defining the functions available in every {@link Environment}. */
final class Builtins {

  private Builtins() {}

  private static final ImmutableMap<String, BuiltinFunction> ALL =
      ImmutableList.of(
              new BuiltinFunction(
                  "range",
                  "range(stop) or range(start, stop[, step]): a lazy sequence of ints.",
                  1,
                  3,
                  Builtins::range),
              new BuiltinFunction("len", "The number of elements.", 1, 1, Builtins::len),
              new BuiltinFunction("abs", "The absolute value of a number.", 1, 1, Builtins::abs),
              new BuiltinFunction(
                  "min",
                  "The smallest argument, or the smallest element of a single argument.",
                  1,
                  -1,
                  args -> extreme(args, -1)),
              new BuiltinFunction(
                  "max",
                  "The largest argument, or the largest element of a single argument.",
                  1,
                  -1,
                  args -> extreme(args, 1)),
              new BuiltinFunction(
                  "sum", "sum(iterable[, start]): the total of the elements.", 1, 2, Builtins::sum),
              new BuiltinFunction(
                  "str", "The string form of a value.", 1, 1, args -> Values.str(args.get(0))),
              new BuiltinFunction("int", "Converts to an int.", 1, 1, Builtins::toInt),
              new BuiltinFunction("float", "Converts to a float.", 1, 1, Builtins::toFloat),
              new BuiltinFunction("list", "The elements of an iterable.", 1, 1, Builtins::list),
              new BuiltinFunction(
                  "append",
                  "append(list, x): a new list with x added at the end.",
                  2,
                  2,
                  Builtins::append))
          .stream()
          .collect(ImmutableMap.toImmutableMap(BuiltinFunction::name, f -> f));

  static @Nullable BuiltinFunction get(String name) {
    return ALL.get(name);
  }

  private static Object range(ImmutableList<Object> args) {
    long start = 0;
    long step = 1;
    long stop;
    if (args.size() == 1) {
      stop = toLong(args.get(0));
    } else {
      start = toLong(args.get(0));
      stop = toLong(args.get(1));
      if (args.size() == 3) {
        step = toLong(args.get(2));
        if (step == 0) {
          throw new RuntimeError("range() step must not be zero");
        }
      }
    }
    return new RangeValue(start, stop, step);
  }

  private static long toLong(Object x) {
    if (!(x instanceof BigInteger i)) {
      throw RuntimeError.format("expected an int, got '%s'", Values.typeName(x));
    }
    try {
      return i.longValueExact();
    } catch (ArithmeticException e) {
      throw new RuntimeError("int too large: " + i, e);
    }
  }

  private static Object len(ImmutableList<Object> args) {
    Object x = args.get(0);
    if (x instanceof String s) {
      return BigInteger.valueOf(s.length());
    } else if (x instanceof List<?> list) {
      return BigInteger.valueOf(list.size());
    } else if (x instanceof Map<?, ?> map) {
      return BigInteger.valueOf(map.size());
    } else if (x instanceof RangeValue range) {
      return BigInteger.valueOf(range.size());
    }
    throw RuntimeError.format("object of type '%s' has no len()", Values.typeName(x));
  }

  private static Object abs(ImmutableList<Object> args) {
    Object x = args.get(0);
    if (x instanceof BigInteger i) {
      return i.abs();
    } else if (x instanceof Double d) {
      return Math.abs(d);
    }
    throw RuntimeError.format("bad operand type for abs(): '%s'", Values.typeName(x));
  }

  /** Returns the minimum ({@code sign} -1) or maximum ({@code sign} 1). */
  private static Object extreme(ImmutableList<Object> args, int sign) {
    Iterator<Object> elements = args.size() == 1 ? Values.iterate(args.get(0)) : args.iterator();
    if (!elements.hasNext()) {
      throw RuntimeError.format("%s() arg is an empty sequence", sign < 0 ? "min" : "max");
    }
    Object result = elements.next();
    while (elements.hasNext()) {
      Object next = elements.next();
      if (Integer.signum(Values.compare(next, result)) == sign) {
        result = next;
      }
    }
    return result;
  }

  private static Object sum(ImmutableList<Object> args) {
    Object total = args.size() == 2 ? args.get(1) : BigInteger.ZERO;
    for (Iterator<Object> it = Values.iterate(args.get(0)); it.hasNext(); ) {
      total = Values.binary(BinaryOp.ADD, total, it.next());
    }
    return total;
  }

  private static Object toInt(ImmutableList<Object> args) {
    Object x = args.get(0);
    if (x instanceof BigInteger) {
      return x;
    } else if (x instanceof Boolean b) {
      return b ? BigInteger.ONE : BigInteger.ZERO;
    } else if (x instanceof Double d) {
      if (!Double.isFinite(d)) {
        throw RuntimeError.format("cannot convert %s to int", d);
      }
      return new BigDecimal(d).toBigInteger();
    } else if (x instanceof String s) {
      try {
        return new BigInteger(s.strip());
      } catch (NumberFormatException e) {
        throw new RuntimeError("invalid literal for int(): " + Values.repr(s), e);
      }
    }
    throw RuntimeError.format("cannot convert '%s' to int", Values.typeName(x));
  }

  private static Object toFloat(ImmutableList<Object> args) {
    Object x = args.get(0);
    if (x instanceof Double) {
      return x;
    } else if (x instanceof BigInteger) {
      return Values.toDouble(x);
    } else if (x instanceof Boolean b) {
      return b ? 1.0 : 0.0;
    } else if (x instanceof String s) {
      try {
        return Double.parseDouble(s.strip());
      } catch (NumberFormatException e) {
        throw new RuntimeError("invalid literal for float(): " + Values.repr(s), e);
      }
    }
    throw RuntimeError.format("cannot convert '%s' to float", Values.typeName(x));
  }

  private static Object list(ImmutableList<Object> args) {
    return ImmutableList.copyOf(Values.iterate(args.get(0)));
  }

  private static Object append(ImmutableList<Object> args) {
    if (!(args.get(0) instanceof List<?> list)) {
      throw RuntimeError.format(
          "append() expects a list, got '%s'", Values.typeName(args.get(0)));
    }
    return ImmutableList.builder().addAll(list).add(args.get(1)).build();
  }
}
