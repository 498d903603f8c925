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
import org.jspecify.annotations.Nullable;

/** Rewind statements. Like {@link Expr}, the set of kinds is closed. */
public sealed interface Stmt
    permits Stmt.ExprStmt,
        Stmt.Assign,
        Stmt.AugAssign,
        Stmt.If,
        Stmt.While,
        Stmt.For,
        Stmt.Match,
        Stmt.Return,
        Stmt.Yield,
        Stmt.Break,
        Stmt.Continue,
        Stmt.Pass,
        FunctionDef {

  <C, R> R accept(Visitor<C, R> visitor, C context);

  interface Visitor<C, R> {
    R visitExpr(ExprStmt stmt, C context);

    R visitAssign(Assign stmt, C context);

    R visitAugAssign(AugAssign stmt, C context);

    R visitIf(If stmt, C context);

    R visitWhile(While stmt, C context);

    R visitFor(For stmt, C context);

    R visitMatch(Match stmt, C context);

    R visitReturn(Return stmt, C context);

    R visitYield(Yield stmt, C context);

    R visitBreak(Break stmt, C context);

    R visitContinue(Continue stmt, C context);

    R visitPass(Pass stmt, C context);

    R visitFunctionDef(FunctionDef stmt, C context);
  }

  /** An expression evaluated for its effect (or, first in a function body, its docstring). */
  record ExprStmt(Expr expr) implements Stmt {
    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitExpr(this, context);
    }
  }

  /**
   * {@code t1, t2, ... = v1, v2, ...}. All of the values are evaluated before any target is
   * assigned, so {@code a, b = b, a + b} sees the old {@code a} and {@code b} on the right.
   *
   * <p>If there is a single value and more than one target, the value must be a list of the same
   * length, which is unpacked.
   */
  record Assign(ImmutableList<String> targets, ImmutableList<Expr> values) implements Stmt {
    public Assign {
      Preconditions.checkArgument(!targets.isEmpty() && !values.isEmpty());
      Preconditions.checkArgument(
          values.size() == 1 || values.size() == targets.size(),
          "%s targets but %s values",
          targets.size(),
          values.size());
    }

    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitAssign(this, context);
    }
  }

  /** {@code target op= value}. */
  record AugAssign(String target, BinaryOp op, Expr value) implements Stmt {
    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitAugAssign(this, context);
    }
  }

  /** {@code if}, with {@code elif} chains represented as a nested If in {@code elseBody}. */
  record If(Expr condition, ImmutableList<Stmt> thenBody, ImmutableList<Stmt> elseBody)
      implements Stmt {
    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitIf(this, context);
    }
  }

  record While(Expr condition, ImmutableList<Stmt> body) implements Stmt {
    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitWhile(this, context);
    }
  }

  record For(String variable, Expr iterable, ImmutableList<Stmt> body) implements Stmt {
    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitFor(this, context);
    }
  }

  /**
   * A multi-arm dispatch: the subject is evaluated once and the body of the first arm whose
   * pattern (and guard, if any) matches is executed. If no arm matches, execution continues after
   * the match.
   */
  record Match(Expr subject, ImmutableList<MatchArm> arms) implements Stmt {
    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitMatch(this, context);
    }
  }

  /** {@code return}; a null value is a bare {@code return}, which returns none. */
  record Return(@Nullable Expr value) implements Stmt {
    /** Returns the value expression, with a bare return treated as {@code return none}. */
    public Expr valueOrNone() {
      return value == null ? Expr.Literal.NONE : value;
    }

    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitReturn(this, context);
    }
  }

  record Yield(Expr value) implements Stmt {
    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitYield(this, context);
    }
  }

  record Break() implements Stmt {
    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitBreak(this, context);
    }
  }

  record Continue() implements Stmt {
    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitContinue(this, context);
    }
  }

  record Pass() implements Stmt {
    @Override
    public <C, R> R accept(Visitor<C, R> visitor, C context) {
      return visitor.visitPass(this, context);
    }
  }
}
