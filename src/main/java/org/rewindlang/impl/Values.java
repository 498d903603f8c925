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
import com.google.common.collect.Iterators;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.rewindlang.tree.BinaryOp;
import org.rewindlang.tree.None;
import org.rewindlang.util.StringUtil;

/**
 * Static-only class implementing the operations on Rewind values.
 *
 * <p>Rewind values are represented by {@link BigInteger} (int), {@link Double} (float), {@link
 * String} (str), {@link Boolean} (bool), {@link None#NONE}, {@link ImmutableList} (list), {@link
 * ImmutableMap} (map), {@link RangeValue}, {@link GeneratorValue} and {@link RewindFunction}. All
 * of them are immutable.
 */
public class Values {

  private Values() {}

  /**
   * Converts a Java object to a Rewind value: boxed integer types become {@link BigInteger}, {@code
   * Float} becomes {@link Double}, null becomes {@link None#NONE}, and lists and maps are copied
   * with their elements converted. Anything else is returned unchanged.
   */
  public static Object fromJava(Object value) {
    if (value == null) {
      return None.NONE;
    } else if (value instanceof Integer
        || value instanceof Long
        || value instanceof Short
        || value instanceof Byte) {
      return BigInteger.valueOf(((Number) value).longValue());
    } else if (value instanceof Float f) {
      return f.doubleValue();
    } else if (value instanceof ImmutableList<?> list && list.stream().allMatch(Values::isNormal)) {
      return list;
    } else if (value instanceof List<?> list) {
      return list.stream().map(Values::fromJava).collect(ImmutableList.toImmutableList());
    } else if (value instanceof Map<?, ?> map) {
      ImmutableMap.Builder<Object, Object> builder = ImmutableMap.builder();
      map.forEach((k, v) -> builder.put(fromJava(k), fromJava(v)));
      return builder.buildOrThrow();
    }
    return value;
  }

  private static boolean isNormal(Object value) {
    return value instanceof BigInteger
        || value instanceof Double
        || value instanceof String
        || value instanceof Boolean
        || value instanceof None;
  }

  /** Converts each element of {@code values} with {@link #fromJava}. */
  public static ImmutableList<Object> fromJava(List<?> values) {
    return values.stream().map(Values::fromJava).collect(ImmutableList.toImmutableList());
  }

  /** Converts each value of {@code values} with {@link #fromJava}, preserving key order. */
  public static ImmutableMap<String, Object> fromJava(Map<String, ?> values) {
    ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
    values.forEach((k, v) -> builder.put(k, fromJava(v)));
    return builder.buildOrThrow();
  }

  public static String typeName(Object value) {
    if (value instanceof BigInteger) {
      return "int";
    } else if (value instanceof Double) {
      return "float";
    } else if (value instanceof String) {
      return "str";
    } else if (value instanceof Boolean) {
      return "bool";
    } else if (value instanceof None) {
      return "none";
    } else if (value instanceof List) {
      return "list";
    } else if (value instanceof Map) {
      return "map";
    } else if (value instanceof RangeValue) {
      return "range";
    } else if (value instanceof GeneratorValue) {
      return "generator";
    } else if (value instanceof RewindFunction) {
      return "function";
    }
    return value.getClass().getSimpleName();
  }

  public static boolean isTruthy(Object value) {
    if (value instanceof Boolean b) {
      return b;
    } else if (value instanceof None) {
      return false;
    } else if (value instanceof BigInteger i) {
      return i.signum() != 0;
    } else if (value instanceof Double d) {
      return d != 0;
    } else if (value instanceof String s) {
      return !s.isEmpty();
    } else if (value instanceof List<?> list) {
      return !list.isEmpty();
    } else if (value instanceof Map<?, ?> map) {
      return !map.isEmpty();
    } else if (value instanceof RangeValue range) {
      return range.size() != 0;
    }
    return true;
  }

  /** Returns the source-like representation of a value; strings are quoted. */
  public static String repr(Object value) {
    if (value instanceof String s) {
      return StringUtil.escape(s);
    } else if (value instanceof Boolean b) {
      return b ? "true" : "false";
    } else if (value instanceof List<?> list) {
      return StringUtil.joinElements("[", "]", list, Values::repr);
    } else if (value instanceof Map<?, ?> map) {
      return StringUtil.joinElements(
          "{", "}", List.copyOf(map.entrySet()), e -> repr(e.getKey()) + ": " + repr(e.getValue()));
    }
    return String.valueOf(value);
  }

  /** Like {@link #repr}, but strings are returned as is. Used by the {@code str} builtin. */
  public static String str(Object value) {
    return value instanceof String s ? s : repr(value);
  }

  public static boolean equal(Object x, Object y) {
    if (isNumber(x) && isNumber(y)) {
      return compareNumbers(x, y) == 0;
    } else if (x instanceof List<?> xs && y instanceof List<?> ys) {
      if (xs.size() != ys.size()) {
        return false;
      }
      for (int i = 0; i < xs.size(); i++) {
        if (!equal(xs.get(i), ys.get(i))) {
          return false;
        }
      }
      return true;
    } else if (x instanceof Map<?, ?> xm && y instanceof Map<?, ?> ym) {
      if (xm.size() != ym.size()) {
        return false;
      }
      for (Map.Entry<?, ?> entry : xm.entrySet()) {
        Object other = ym.get(entry.getKey());
        if (other == null || !equal(entry.getValue(), other)) {
          return false;
        }
      }
      return true;
    }
    return Objects.equals(x, y);
  }

  /**
   * Orders numbers, strings, and lists (lexicographically); throws a {@link RuntimeError} for any
   * other combination.
   */
  public static int compare(Object x, Object y) {
    if (isNumber(x) && isNumber(y)) {
      return compareNumbers(x, y);
    } else if (x instanceof String xs && y instanceof String ys) {
      return xs.compareTo(ys);
    } else if (x instanceof List<?> xs && y instanceof List<?> ys) {
      for (int i = 0; i < xs.size() && i < ys.size(); i++) {
        int c = compare(xs.get(i), ys.get(i));
        if (c != 0) {
          return c;
        }
      }
      return Integer.compare(xs.size(), ys.size());
    }
    throw RuntimeError.format(
        "cannot order values of type '%s' and '%s'", typeName(x), typeName(y));
  }

  private static boolean isNumber(Object x) {
    return x instanceof BigInteger || x instanceof Double;
  }

  private static int compareNumbers(Object x, Object y) {
    if (x instanceof BigInteger xi && y instanceof BigInteger yi) {
      return xi.compareTo(yi);
    }
    double xd = toDouble(x);
    double yd = toDouble(y);
    if (Double.isNaN(xd) || Double.isNaN(yd) || Double.isInfinite(xd) || Double.isInfinite(yd)) {
      return Double.compare(xd, yd);
    }
    return toBigDecimal(x).compareTo(toBigDecimal(y));
  }

  private static BigDecimal toBigDecimal(Object x) {
    return x instanceof BigInteger i ? new BigDecimal(i) : new BigDecimal((Double) x);
  }

  static double toDouble(Object x) {
    if (x instanceof BigInteger i) {
      double d = i.doubleValue();
      if (Double.isInfinite(d)) {
        throw new RuntimeError("int too large to convert to float");
      }
      return d;
    }
    return (Double) x;
  }

  /** Applies an arithmetic or comparison operator. {@code and} and {@code or} are not handled. */
  public static Object binary(BinaryOp op, Object x, Object y) {
    switch (op) {
      case EQ:
        return equal(x, y);
      case NE:
        return !equal(x, y);
      case LT:
        return compare(x, y) < 0;
      case LE:
        return compare(x, y) <= 0;
      case GT:
        return compare(x, y) > 0;
      case GE:
        return compare(x, y) >= 0;
      case ADD:
        if (x instanceof String xs && y instanceof String ys) {
          return xs + ys;
        } else if (x instanceof List<?> xs && y instanceof List<?> ys) {
          return ImmutableList.builder().addAll(xs).addAll(ys).build();
        }
        break;
      case MUL:
        if (x instanceof BigInteger && (y instanceof String || y instanceof List)) {
          return repeat(y, (BigInteger) x);
        } else if (y instanceof BigInteger && (x instanceof String || x instanceof List)) {
          return repeat(x, (BigInteger) y);
        }
        break;
      default:
        break;
    }
    if (!isNumber(x) || !isNumber(y)) {
      throw RuntimeError.format(
          "unsupported operand types for %s: '%s' and '%s'", op.symbol, typeName(x), typeName(y));
    }
    if (x instanceof BigInteger xi && y instanceof BigInteger yi) {
      return intArithmetic(op, xi, yi);
    }
    return floatArithmetic(op, toDouble(x), toDouble(y));
  }

  private static Object intArithmetic(BinaryOp op, BigInteger x, BigInteger y) {
    switch (op) {
      case ADD:
        return x.add(y);
      case SUB:
        return x.subtract(y);
      case MUL:
        return x.multiply(y);
      case DIV:
        checkNonZero(y.signum());
        return new BigDecimal(x).divide(new BigDecimal(y), MathContext.DECIMAL128).doubleValue();
      case FLOOR_DIV:
        checkNonZero(y.signum());
        return floorDiv(x, y);
      case MOD:
        checkNonZero(y.signum());
        return x.subtract(floorDiv(x, y).multiply(y));
      default:
        throw new AssertionError(op);
    }
  }

  private static BigInteger floorDiv(BigInteger x, BigInteger y) {
    BigInteger[] qr = x.divideAndRemainder(y);
    // Java truncates toward zero; round toward negative infinity instead.
    if (qr[1].signum() != 0 && qr[1].signum() != y.signum()) {
      return qr[0].subtract(BigInteger.ONE);
    }
    return qr[0];
  }

  private static Object floatArithmetic(BinaryOp op, double x, double y) {
    switch (op) {
      case ADD:
        return x + y;
      case SUB:
        return x - y;
      case MUL:
        return x * y;
      case DIV:
        checkNonZero(y);
        return x / y;
      case FLOOR_DIV:
        checkNonZero(y);
        return Math.floor(x / y);
      case MOD:
        checkNonZero(y);
        double r = x % y;
        return (r != 0 && (r < 0) != (y < 0)) ? r + y : r;
      default:
        throw new AssertionError(op);
    }
  }

  private static void checkNonZero(double divisor) {
    if (divisor == 0) {
      throw new RuntimeError("division by zero");
    }
  }

  private static Object repeat(Object sequence, BigInteger count) {
    int n = Math.max(0, toIndex(count));
    if (sequence instanceof String s) {
      return s.repeat(n);
    }
    List<?> list = (List<?>) sequence;
    ImmutableList.Builder<Object> builder = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      builder.addAll(list);
    }
    return builder.build();
  }

  public static Object negate(Object x) {
    if (x instanceof BigInteger i) {
      return i.negate();
    } else if (x instanceof Double d) {
      return -d;
    }
    throw RuntimeError.format("bad operand type for unary -: '%s'", typeName(x));
  }

  static int toIndex(Object x) {
    if (!(x instanceof BigInteger i)) {
      throw RuntimeError.format("expected an int, got '%s'", typeName(x));
    }
    try {
      return i.intValueExact();
    } catch (ArithmeticException e) {
      throw new RuntimeError("int too large: " + i, e);
    }
  }

  /** Implements {@code target[index]}; negative indices count from the end of lists and strings. */
  public static Object index(Object target, Object index) {
    if (target instanceof Map<?, ?> map) {
      Object result = map.get(index);
      if (result == null) {
        throw new RuntimeError("key not found: " + repr(index));
      }
      return result;
    }
    long size;
    if (target instanceof List<?> list) {
      size = list.size();
    } else if (target instanceof String s) {
      size = s.length();
    } else if (target instanceof RangeValue range) {
      size = range.size();
    } else {
      throw RuntimeError.format("'%s' object is not subscriptable", typeName(target));
    }
    long i = toIndex(index);
    if (i < 0) {
      i += size;
    }
    if (i < 0 || i >= size) {
      throw RuntimeError.format("%s index out of range", typeName(target));
    }
    if (target instanceof List<?> list) {
      return list.get((int) i);
    } else if (target instanceof String s) {
      return String.valueOf(s.charAt((int) i));
    }
    return ((RangeValue) target).get(i);
  }

  /** Returns an iterator over a list, string, map (its keys), range or generator. */
  public static Iterator<Object> iterate(Object value) {
    if (value instanceof List<?> list) {
      return Iterators.transform(list.iterator(), x -> x);
    } else if (value instanceof Map<?, ?> map) {
      return Iterators.transform(map.keySet().iterator(), x -> x);
    } else if (value instanceof String s) {
      return s.chars().mapToObj(c -> (Object) String.valueOf((char) c)).iterator();
    } else if (value instanceof Iterable<?> iterable) {
      // RangeValue and GeneratorValue
      return Iterators.transform(iterable.iterator(), x -> x);
    }
    throw RuntimeError.format("'%s' object is not iterable", typeName(value));
  }
}
