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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rewindlang.tree.BinaryOp;
import org.rewindlang.tree.None;

@RunWith(JUnit4.class)
public class ValuesTest {

  private static BigInteger i(long value) {
    return BigInteger.valueOf(value);
  }

  @Test
  public void intDivision() {
    assertThat(Values.binary(BinaryOp.FLOOR_DIV, i(7), i(2))).isEqualTo(i(3));
    assertThat(Values.binary(BinaryOp.FLOOR_DIV, i(-7), i(2))).isEqualTo(i(-4));
    assertThat(Values.binary(BinaryOp.FLOOR_DIV, i(7), i(-2))).isEqualTo(i(-4));
    assertThat(Values.binary(BinaryOp.MOD, i(-7), i(2))).isEqualTo(i(1));
    assertThat(Values.binary(BinaryOp.MOD, i(7), i(-2))).isEqualTo(i(-1));
    assertThat(Values.binary(BinaryOp.MOD, i(6), i(3))).isEqualTo(i(0));
    assertThat(Values.binary(BinaryOp.DIV, i(7), i(2))).isEqualTo(3.5);
    assertThat(Values.binary(BinaryOp.DIV, i(6), i(3))).isEqualTo(2.0);
  }

  @Test
  public void floatArithmetic() {
    assertThat(Values.binary(BinaryOp.MOD, -7.0, i(2))).isEqualTo(1.0);
    assertThat(Values.binary(BinaryOp.FLOOR_DIV, 7.5, i(2))).isEqualTo(3.0);
    assertThat(Values.binary(BinaryOp.MUL, i(3), 0.5)).isEqualTo(1.5);
    assertThat(Values.binary(BinaryOp.SUB, 1.0, 1.0)).isEqualTo(0.0);
  }

  @Test
  public void divisionByZero() {
    for (BinaryOp op : List.of(BinaryOp.DIV, BinaryOp.FLOOR_DIV, BinaryOp.MOD)) {
      RuntimeError e = assertThrows(RuntimeError.class, () -> Values.binary(op, i(1), i(0)));
      assertThat(e).hasMessageThat().isEqualTo("division by zero");
      assertThrows(RuntimeError.class, () -> Values.binary(op, 1.0, 0.0));
    }
  }

  @Test
  public void sequences() {
    assertThat(Values.binary(BinaryOp.ADD, "ab", "cd")).isEqualTo("abcd");
    assertThat(Values.binary(BinaryOp.MUL, "ab", i(3))).isEqualTo("ababab");
    assertThat(Values.binary(BinaryOp.MUL, i(-1), "ab")).isEqualTo("");
    assertThat(Values.binary(BinaryOp.ADD, ImmutableList.of(i(1)), ImmutableList.of("x")))
        .isEqualTo(ImmutableList.of(i(1), "x"));
    assertThat(Values.binary(BinaryOp.MUL, i(2), ImmutableList.of(i(1))))
        .isEqualTo(ImmutableList.of(i(1), i(1)));
    RuntimeError e =
        assertThrows(RuntimeError.class, () -> Values.binary(BinaryOp.ADD, "a", i(1)));
    assertThat(e).hasMessageThat().isEqualTo("unsupported operand types for +: 'str' and 'int'");
  }

  @Test
  public void equality() {
    assertThat(Values.equal(i(1), 1.0)).isTrue();
    Object nested = ImmutableList.of(i(1), ImmutableList.of(i(2)));
    assertThat(Values.equal(nested, List.of(1.0, List.of(2.0)))).isTrue();
    assertThat(Values.equal(ImmutableMap.of("a", i(1)), ImmutableMap.of("a", 1.0))).isTrue();
    assertThat(Values.equal(ImmutableMap.of("a", i(1)), ImmutableMap.of("b", i(1)))).isFalse();
    assertThat(Values.equal(true, i(1))).isFalse();
    assertThat(Values.equal(None.NONE, None.NONE)).isTrue();
    assertThat(Values.binary(BinaryOp.NE, "a", "b")).isEqualTo(true);
  }

  @Test
  public void ordering() {
    assertThat(Values.compare(i(1), 1.5)).isLessThan(0);
    assertThat(Values.compare("b", "a")).isGreaterThan(0);
    assertThat(Values.compare(ImmutableList.of(i(1), i(2)), ImmutableList.of(i(1))))
        .isGreaterThan(0);
    assertThat(Values.compare(new BigInteger("9007199254740993"), 9007199254740992.0))
        .isGreaterThan(0);
    RuntimeError e = assertThrows(RuntimeError.class, () -> Values.compare("a", i(1)));
    assertThat(e).hasMessageThat().isEqualTo("cannot order values of type 'str' and 'int'");
  }

  @Test
  public void truthiness() {
    assertThat(Values.isTruthy(None.NONE)).isFalse();
    assertThat(Values.isTruthy(i(0))).isFalse();
    assertThat(Values.isTruthy(0.0)).isFalse();
    assertThat(Values.isTruthy("")).isFalse();
    assertThat(Values.isTruthy(ImmutableList.of())).isFalse();
    assertThat(Values.isTruthy(new RangeValue(3, 3, 1))).isFalse();
    assertThat(Values.isTruthy(i(-1))).isTrue();
    assertThat(Values.isTruthy("x")).isTrue();
  }

  @Test
  public void repr() {
    assertThat(Values.repr(ImmutableList.of("a\n", i(1), 2.5, None.NONE, false)))
        .isEqualTo("[\"a\\n\", 1, 2.5, none, false]");
    assertThat(Values.repr(ImmutableMap.of("k", ImmutableList.of()))).isEqualTo("{\"k\": []}");
    assertThat(Values.repr(new RangeValue(0, 10, 2))).isEqualTo("range(0, 10, 2)");
    assertThat(Values.str("a\n")).isEqualTo("a\n");
  }

  @Test
  public void fromJava() {
    assertThat(Values.fromJava((Object) 5)).isEqualTo(i(5));
    assertThat(Values.fromJava((Object) 5L)).isEqualTo(i(5));
    assertThat(Values.fromJava((Object) 2.5f)).isEqualTo(2.5);
    assertThat(Values.fromJava((Object) null)).isEqualTo(None.NONE);
    assertThat(Values.fromJava(Arrays.asList(1, null, List.of("x", 2))))
        .containsExactly(i(1), None.NONE, ImmutableList.of("x", i(2)))
        .inOrder();
    assertThat(Values.fromJava(ImmutableMap.of("a", 1))).containsExactly("a", i(1));
  }

  @Test
  public void indexing() {
    ImmutableList<Object> list = ImmutableList.of(i(1), i(2), i(3));
    assertThat(Values.index(list, i(-1))).isEqualTo(i(3));
    assertThat(Values.index("abc", i(1))).isEqualTo("b");
    assertThat(Values.index(new RangeValue(10, 0, -3), i(2))).isEqualTo(i(4));
    assertThat(Values.index(ImmutableMap.of("a", i(1)), "a")).isEqualTo(i(1));
    RuntimeError e = assertThrows(RuntimeError.class, () -> Values.index(list, i(3)));
    assertThat(e).hasMessageThat().isEqualTo("list index out of range");
    e = assertThrows(RuntimeError.class, () -> Values.index(ImmutableMap.of(), "b"));
    assertThat(e).hasMessageThat().isEqualTo("key not found: \"b\"");
    e = assertThrows(RuntimeError.class, () -> Values.index(i(1), i(0)));
    assertThat(e).hasMessageThat().isEqualTo("'int' object is not subscriptable");
  }

  @Test
  public void iteration() {
    assertThat(ImmutableList.copyOf(Values.iterate("ab"))).containsExactly("a", "b").inOrder();
    assertThat(ImmutableList.copyOf(Values.iterate(new RangeValue(5, 0, -2))))
        .containsExactly(i(5), i(3), i(1))
        .inOrder();
    assertThat(new RangeValue(0, 10, 3).size()).isEqualTo(4);
    assertThat(new RangeValue(0, -10, 3).size()).isEqualTo(0);
    RuntimeError e = assertThrows(RuntimeError.class, () -> Values.iterate(i(1)));
    assertThat(e).hasMessageThat().isEqualTo("'int' object is not iterable");
  }
}
