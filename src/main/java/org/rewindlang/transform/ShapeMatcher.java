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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.rewindlang.transform.ShapeMatch.Reason;
import org.rewindlang.tree.Expr;
import org.rewindlang.tree.FunctionSignature;
import org.rewindlang.tree.MatchArm;
import org.rewindlang.tree.Stmt;
import org.rewindlang.util.StringUtil;

/**
 * Classifies a function body as one of the two tail-recursive shapes that {@link LoopSynthesizer}
 * can turn into a loop.
 *
 * <p>Only {@code pass} statements and a leading docstring are ignored; any other statement that is
 * not part of a shape makes the body unrecognized. There is no partial or best-effort matching.
 */
public class ShapeMatcher {

  private ShapeMatcher() {}

  /**
   * Returns the shape of {@code body}, the statements of the function named {@code functionName}
   * with parameters {@code signature}. Does not modify anything.
   */
  public static ShapeMatch match(
      List<Stmt> body, String functionName, FunctionSignature signature) {
    ImmutableList<Stmt> stmts = meaningful(body);
    if (stmts.size() == 2) {
      return matchGuarded(stmts.get(0), stmts.get(1), functionName, signature);
    } else if (stmts.size() == 1 && stmts.get(0) instanceof Stmt.Match match) {
      return matchDispatch(match, functionName, signature);
    }
    return unrecognized(
        "body has %d statement%s; expected an if followed by a return, or a single match",
        stmts.size(), StringUtil.plural(stmts.size()));
  }

  private static ShapeMatch matchGuarded(
      Stmt first, Stmt second, String functionName, FunctionSignature signature) {
    if (!(first instanceof Stmt.If guard)) {
      return unrecognized("first statement is not an if");
    }
    if (!guard.elseBody().isEmpty()) {
      return unrecognized("if statement has an else clause");
    }
    ImmutableList<Stmt> thenBody = meaningful(guard.thenBody());
    if (thenBody.size() != 1 || !(thenBody.get(0) instanceof Stmt.Return baseReturn)) {
      return unrecognized("if statement body is not a single return");
    }
    if (!(second instanceof Stmt.Return tailReturn)) {
      return unrecognized("statement after the if is not a return");
    }
    Expr.Call call = selfCall(tailReturn, functionName);
    if (call == null) {
      return unrecognized("final return is not a call to %s", functionName);
    }
    ShapeMatch argProblem = checkArgs(call, signature);
    if (argProblem != null) {
      return argProblem;
    }
    return new ShapeMatch.GuardedTailCall(
        guard.condition(), baseReturn.valueOrNone(), call.args());
  }

  private static ShapeMatch matchDispatch(
      Stmt.Match match, String functionName, FunctionSignature signature) {
    // With a single arm there is no base case to leave the loop by.
    if (match.arms().size() < 2) {
      return unrecognized("match has %d arm; expected at least two", match.arms().size());
    }
    int tailArm = -1;
    Expr.Call tailCall = null;
    for (int i = 0; i < match.arms().size(); i++) {
      ImmutableList<Stmt> armBody = meaningful(match.arms().get(i).body());
      if (armBody.size() != 1 || !(armBody.get(0) instanceof Stmt.Return armReturn)) {
        return unrecognized("match arm %d is not a single return", i);
      }
      Expr.Call call = selfCall(armReturn, functionName);
      if (call != null) {
        if (tailArm >= 0) {
          return unrecognized(
              "match arms %d and %d both call %s; exactly one may", tailArm, i, functionName);
        }
        tailArm = i;
        tailCall = call;
      }
    }
    if (tailCall == null) {
      return unrecognized("no match arm calls %s", functionName);
    }
    ShapeMatch argProblem = checkArgs(tailCall, signature);
    if (argProblem != null) {
      return argProblem;
    }
    // Strip ignorable statements so that each arm is exactly its return.
    ImmutableList<MatchArm> arms =
        match.arms().stream()
            .map(arm -> arm.withBody(meaningful(arm.body())))
            .collect(toImmutableList());
    return new ShapeMatch.DispatchTailCall(match.subject(), arms, tailArm, tailCall.args());
  }

  /** Returns the call if {@code ret} returns the result of calling {@code functionName}. */
  private static Expr.@Nullable Call selfCall(Stmt.Return ret, String functionName) {
    if (ret.value() instanceof Expr.Call call
        && call.callee() instanceof Expr.Name name
        && name.id().equals(functionName)) {
      return call;
    }
    return null;
  }

  /** Returns null if the tail call's arguments line up with the parameters. */
  private static @Nullable ShapeMatch checkArgs(Expr.Call call, FunctionSignature signature) {
    if (!call.keywords().isEmpty()) {
      return unrecognized("tail call passes keyword arguments");
    } else if (call.args().size() != signature.arity()) {
      return new ShapeMatch.Unrecognized(
          Reason.PARAMETER_ARITY_MISMATCH,
          String.format(
              "tail call passes %d argument%s to (%s)",
              call.args().size(), StringUtil.plural(call.args().size()), signature));
    }
    return null;
  }

  private static ImmutableList<Stmt> meaningful(List<Stmt> stmts) {
    ImmutableList.Builder<Stmt> result = ImmutableList.builder();
    for (int i = 0; i < stmts.size(); i++) {
      Stmt stmt = stmts.get(i);
      if (stmt instanceof Stmt.Pass) {
        continue;
      } else if (i == 0
          && stmt instanceof Stmt.ExprStmt exprStmt
          && exprStmt.expr() instanceof Expr.Literal literal
          && literal.value() instanceof String) {
        continue;
      }
      result.add(stmt);
    }
    return result.build();
  }

  private static ShapeMatch.Unrecognized unrecognized(String format, Object... args) {
    return new ShapeMatch.Unrecognized(
        Reason.SHAPE_NOT_RECOGNIZED, String.format(format, args));
  }
}
