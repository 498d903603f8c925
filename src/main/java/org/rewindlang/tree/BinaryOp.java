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

package org.rewindlang.tree;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Binary operators, with their source symbol and precedence (higher binds tighter). All of them
 * are left-associative.
 */
public enum BinaryOp {
  OR("or", 1),
  AND("and", 2),
  EQ("==", 4),
  NE("!=", 4),
  LT("<", 4),
  LE("<=", 4),
  GT(">", 4),
  GE(">=", 4),
  ADD("+", 5),
  SUB("-", 5),
  MUL("*", 6),
  DIV("/", 6),
  FLOOR_DIV("//", 6),
  MOD("%", 6);

  public final String symbol;
  public final int precedence;

  BinaryOp(String symbol, int precedence) {
    this.symbol = symbol;
    this.precedence = precedence;
  }

  /** True for {@code and} and {@code or}, which only evaluate their right operand if needed. */
  public boolean isShortCircuit() {
    return this == OR || this == AND;
  }

  private static final ImmutableMap<String, BinaryOp> BY_SYMBOL =
      Arrays.stream(values())
          .collect(ImmutableMap.toImmutableMap(op -> op.symbol, Function.identity()));

  /** Returns the operator with the given symbol, or null if there is none. */
  public static @Nullable BinaryOp forSymbol(String symbol) {
    return BY_SYMBOL.get(symbol);
  }

  @Override
  public String toString() {
    return symbol;
  }
}
