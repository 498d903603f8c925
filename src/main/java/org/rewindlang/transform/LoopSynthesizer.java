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
import org.rewindlang.tree.FunctionSignature;
import org.rewindlang.tree.MatchArm;
import org.rewindlang.tree.Stmt;

/**
 * Builds the loop that replaces a tail-recursive body.
 *
 * <p>The tail call becomes a single {@link Stmt.Assign} of all parameters at once, so every
 * argument is evaluated with the parameter values of the current iteration before any parameter
 * changes (e.g. {@code a, b = b, a + b}).
 */
public class LoopSynthesizer {

  private LoopSynthesizer() {}

  /** Thrown when the tail call's arguments can't be paired one-to-one with the parameters. */
  public static class ArityMismatchException extends Exception {
    public final int expected;
    public final int actual;

    ArityMismatchException(int expected, int actual) {
      super(
          String.format(
              "tail call has %d arguments, function has %d parameters", actual, expected));
      this.expected = expected;
      this.actual = actual;
    }
  }

  /**
   * Returns the statements of the loop equivalent to {@code match}, which must not be {@link
   * ShapeMatch.Unrecognized}.
   *
   * <p>For a guarded tail call:
   *
   * <pre>
   * while true {
   *   if condition { return base }
   *   p1, p2 = arg1, arg2
   * }
   * </pre>
   *
   * <p>For a dispatch, the tail-call arm's return is replaced by the rebinding followed by {@code
   * continue}, and {@code return none} after the match handles a subject that no arm matches:
   *
   * <pre>
   * while true {
   *   match subject {
   *     case ... { return base }
   *     case ... {
   *       p1, p2 = arg1, arg2
   *       continue
   *     }
   *   }
   *   return none
   * }
   * </pre>
   */
  public static ImmutableList<Stmt> synthesize(ShapeMatch match, FunctionSignature signature)
      throws ArityMismatchException {
    Preconditions.checkArgument(
        !(match instanceof ShapeMatch.Unrecognized), "Cannot synthesize from %s", match);
    ImmutableList<Stmt> loopBody;
    if (match instanceof ShapeMatch.GuardedTailCall guarded) {
      Stmt guard =
          new Stmt.If(
              guarded.condition(),
              ImmutableList.of(new Stmt.Return(guarded.baseReturn())),
              ImmutableList.of());
      loopBody = ImmutableList.of(guard, rebind(guarded.tailCallArgs(), signature));
    } else {
      ShapeMatch.DispatchTailCall dispatch = (ShapeMatch.DispatchTailCall) match;
      ImmutableList.Builder<MatchArm> arms = ImmutableList.builder();
      for (int i = 0; i < dispatch.arms().size(); i++) {
        MatchArm arm = dispatch.arms().get(i);
        if (i == dispatch.tailCallArmIndex()) {
          arm =
              arm.withBody(
                  ImmutableList.of(
                      rebind(dispatch.tailCallArgs(), signature), new Stmt.Continue()));
        }
        arms.add(arm);
      }
      loopBody =
          ImmutableList.of(
              new Stmt.Match(dispatch.subject(), arms.build()),
              new Stmt.Return(Expr.Literal.NONE));
    }
    return ImmutableList.of(new Stmt.While(new Expr.Literal(true), loopBody));
  }

  /** A simultaneous assignment of {@code args} to the parameters. */
  private static Stmt rebind(ImmutableList<Expr> args, FunctionSignature signature)
      throws ArityMismatchException {
    if (args.size() != signature.arity()) {
      throw new ArityMismatchException(signature.arity(), args.size());
    } else if (args.isEmpty()) {
      // Nothing to rebind; the loop repeats with the same (empty) parameters.
      return new Stmt.Pass();
    }
    return new Stmt.Assign(signature.parameters(), args);
  }
}
