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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;

/**
 * Rewind expressions. The set of kinds is closed; code that needs to handle every kind should use
 * a {@link Visitor} so that adding a kind is a compile error everywhere it matters.
 */
public sealed interface Expr {

  <C, R> R accept(Visitor<C, R> visitor, C context);

  /** The binding strength of this expression when unparsed; see {@link BinaryOp#precedence}. */
  int precedence();

  /** Precedence of calls and indexing. */
  int POSTFIX = 8;

  /** Precedence of literals, names, and bracketed expressions. */
  int ATOM = 9;

  interface Visitor<C, R> {
    R visitLiteral(Literal expr, C context);

    R visitName(Name expr, C context);

    R visitUnary(Unary expr, C context);

    R visitBinary(Binary expr, C context);

    R visitCall(Call expr, C context);

    R visitIndex(Index expr, C context);

    R visitList(ListExpr expr, C context);

    R visitMap(MapExpr expr, C context);
  }

  /**
   * A constant. The value is a {@link BigInteger}, {@link Double}, {@link String}, {@link Boolean},
   * or {@link None#NONE}.
   */
  record Literal(Object value) implements Expr {
    public static final Literal NONE = new Literal(None.NONE);

    public Literal {
      Preconditions.checkArgument(
          value instanceof BigInteger
              || value instanceof Double
              || value instanceof String
              || value instanceof Boolean
              || value instanceof None,
          "Not a literal value: %s",
          value);
    }

    public static Literal of(long i) {
      return new Literal(BigInteger.valueOf(i));
    }

    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitLiteral(this, context);
    }

    @Override
    public int precedence() {
      // Negative numbers unparse with a leading "-", so they bind like a negation.
      if (value instanceof BigInteger i && i.signum() < 0) {
        return UnaryOp.NEG.precedence;
      } else if (value instanceof Double d && (d < 0 || d.equals(-0.0))) {
        return UnaryOp.NEG.precedence;
      }
      return ATOM;
    }
  }

  record Name(String id) implements Expr {
    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitName(this, context);
    }

    @Override
    public int precedence() {
      return ATOM;
    }
  }

  record Unary(UnaryOp op, Expr operand) implements Expr {
    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitUnary(this, context);
    }

    @Override
    public int precedence() {
      return op.precedence;
    }
  }

  record Binary(BinaryOp op, Expr left, Expr right) implements Expr {
    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitBinary(this, context);
    }

    @Override
    public int precedence() {
      return op.precedence;
    }
  }

  /** A keyword argument {@code name=value} in a call. */
  record Keyword(String name, Expr value) {}

  /** A call; positional arguments are evaluated first, left to right, then keyword arguments. */
  record Call(Expr callee, ImmutableList<Expr> args, ImmutableList<Keyword> keywords)
      implements Expr {
    public static Call of(Expr callee, Expr... args) {
      return new Call(callee, ImmutableList.copyOf(args), ImmutableList.of());
    }

    /** True if this is a call of the global named {@code name} with only positional arguments. */
    public boolean isPositionalCallOf(String name) {
      return callee instanceof Name n && n.id().equals(name) && keywords.isEmpty();
    }

    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitCall(this, context);
    }

    @Override
    public int precedence() {
      return POSTFIX;
    }
  }

  record Index(Expr target, Expr index) implements Expr {
    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitIndex(this, context);
    }

    @Override
    public int precedence() {
      return POSTFIX;
    }
  }

  record ListExpr(ImmutableList<Expr> elements) implements Expr {
    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitList(this, context);
    }

    @Override
    public int precedence() {
      return ATOM;
    }
  }

  /** One {@code key: value} pair of a map literal. */
  record Entry(Expr key, Expr value) {}

  record MapExpr(ImmutableList<Entry> entries) implements Expr {
    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitMap(this, context);
    }

    @Override
    public int precedence() {
      return ATOM;
    }
  }
}
