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

package org.rewindlang.transform;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.rewindlang.tree.Expr;
import org.rewindlang.tree.MatchArm;

/** The result of {@link ShapeMatcher#match}: which tail-recursive shape a function body has. */
public sealed interface ShapeMatch
    permits ShapeMatch.GuardedTailCall, ShapeMatch.DispatchTailCall, ShapeMatch.Unrecognized {

  /**
   * <pre>
   * if condition { return baseReturn }
   * return f(tailCallArgs...)
   * </pre>
   */
  record GuardedTailCall(Expr condition, Expr baseReturn, ImmutableList<Expr> tailCallArgs)
      implements ShapeMatch {}

  /**
   * A single {@code match subject { ... }} whose arms all return, exactly one of them (at {@code
   * tailCallArmIndex}) by calling {@code f(tailCallArgs...)}.
   */
  record DispatchTailCall(
      Expr subject,
      ImmutableList<MatchArm> arms,
      int tailCallArmIndex,
      ImmutableList<Expr> tailCallArgs)
      implements ShapeMatch {

    public DispatchTailCall {
      Preconditions.checkElementIndex(tailCallArmIndex, arms.size());
    }

    public MatchArm tailCallArm() {
      return arms.get(tailCallArmIndex);
    }
  }

  /** The body has neither shape; the function must be left as it is. */
  record Unrecognized(Reason reason, String detail) implements ShapeMatch {
    @Override
    public String toString() {
      return reason + ": " + detail;
    }
  }

  enum Reason {
    SHAPE_NOT_RECOGNIZED,
    /** The body has one of the shapes, but its tail call passes the wrong number of arguments. */
    PARAMETER_ARITY_MISMATCH
  }
}
