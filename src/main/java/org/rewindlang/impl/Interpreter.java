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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.rewindlang.tree.Expr;
import org.rewindlang.tree.FunctionDef;
import org.rewindlang.tree.MatchArm;
import org.rewindlang.tree.MatchPattern;
import org.rewindlang.tree.Param;
import org.rewindlang.tree.Stmt;
import org.rewindlang.tree.UnaryOp;

/**
 * A tree-walking evaluator. Each {@link Environment} has one; it tracks how many Rewind function
 * activations are in progress so that runaway recursion fails with a {@link RuntimeError} rather
 * than a {@link StackOverflowError}.
 *
 * <p>Not thread-safe.
 */
final class Interpreter {
  static final String TOO_DEEP = "maximum recursion depth exceeded";

  private final int maxCallDepth;
  private int depth;

  Interpreter(int maxCallDepth) {
    Preconditions.checkArgument(maxCallDepth > 0, "maxCallDepth must be positive");
    this.maxCallDepth = maxCallDepth;
  }

  int maxCallDepth() {
    return maxCallDepth;
  }

  /** Executes top-level statements, binding globals of {@code env}. */
  void executeTopLevel(List<Stmt> statements, Environment env) {
    Frame frame = Frame.topLevel(env);
    for (Stmt stmt : statements) {
      Flow flow = stmt.accept(executor, frame);
      if (flow.kind() != Flow.Kind.NORMAL) {
        throw RuntimeError.format("'%s' outside function", keyword(flow.kind()));
      }
    }
  }

  /** Runs the body of a function that is not a generator, returning its result. */
  Object call(InterpretedFunction fn, Map<String, Object> locals) {
    Flow flow = run(fn, Frame.call(fn.environment(), locals));
    return flow.kind() == Flow.Kind.RETURN ? flow.value() : Flow.END.value();
  }

  /**
   * Runs the body of a generator from the start. Returns a YIELD flow with the value of the
   * {@code yieldIndex}-th yield (counting from zero), or a RETURN flow if the body finishes first.
   */
  Flow runGenerator(
      InterpretedFunction fn, ImmutableMap<String, Object> arguments, int yieldIndex) {
    Frame frame = Frame.generator(fn.environment(), new HashMap<>(arguments), yieldIndex);
    Flow flow = run(fn, frame);
    return flow.kind() == Flow.Kind.YIELD ? flow : Flow.END;
  }

  private Flow run(InterpretedFunction fn, Frame frame) {
    if (depth >= maxCallDepth) {
      throw new RuntimeError(TOO_DEEP);
    }
    ++depth;
    try {
      Flow flow = execute(fn.definition().statements(), frame);
      if (flow.kind() == Flow.Kind.BREAK || flow.kind() == Flow.Kind.CONTINUE) {
        throw RuntimeError.format("'%s' outside loop", keyword(flow.kind()));
      }
      return flow;
    } catch (StackOverflowError e) {
      throw new RuntimeError(TOO_DEEP, e);
    } finally {
      --depth;
    }
  }

  private static String keyword(Flow.Kind kind) {
    return kind == Flow.Kind.YIELD ? "yield" : kind.name().toLowerCase(Locale.ROOT);
  }

  /** Evaluates the defaults of {@code def}'s parameters in the frame where it is being defined. */
  ImmutableMap<String, Object> evaluateDefaults(FunctionDef def, Frame frame) {
    ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
    for (Param param : def.params()) {
      if (param.defaultValue() != null) {
        builder.put(param.name(), eval(param.defaultValue(), frame));
      }
    }
    return builder.buildOrThrow();
  }

  Object eval(Expr expr, Frame frame) {
    return expr.accept(evaluator, frame);
  }

  private Flow execute(List<Stmt> statements, Frame frame) {
    for (Stmt stmt : statements) {
      Flow flow = stmt.accept(executor, frame);
      if (flow.kind() != Flow.Kind.NORMAL) {
        return flow;
      }
    }
    return Flow.NORMAL;
  }

  private final Stmt.Visitor<Frame, Flow> executor =
      new Stmt.Visitor<>() {
        @Override
        public Flow visitExpr(Stmt.ExprStmt stmt, Frame frame) {
          eval(stmt.expr(), frame);
          return Flow.NORMAL;
        }

        @Override
        public Flow visitAssign(Stmt.Assign stmt, Frame frame) {
          List<String> targets = stmt.targets();
          // All values are computed before any target is bound.
          List<Object> values;
          if (stmt.values().size() == 1 && targets.size() > 1) {
            values = ImmutableList.copyOf(Values.iterate(eval(stmt.values().get(0), frame)));
            if (values.size() != targets.size()) {
              throw RuntimeError.format(
                  "cannot unpack %d values into %d targets", values.size(), targets.size());
            }
          } else {
            values = stmt.values().stream().map(e -> eval(e, frame)).toList();
          }
          for (int i = 0; i < targets.size(); i++) {
            frame.bind(targets.get(i), values.get(i));
          }
          return Flow.NORMAL;
        }

        @Override
        public Flow visitAugAssign(Stmt.AugAssign stmt, Frame frame) {
          Object current = frame.lookup(stmt.target());
          frame.bind(stmt.target(), Values.binary(stmt.op(), current, eval(stmt.value(), frame)));
          return Flow.NORMAL;
        }

        @Override
        public Flow visitIf(Stmt.If stmt, Frame frame) {
          boolean condition = Values.isTruthy(eval(stmt.condition(), frame));
          return execute(condition ? stmt.thenBody() : stmt.elseBody(), frame);
        }

        @Override
        public Flow visitWhile(Stmt.While stmt, Frame frame) {
          while (Values.isTruthy(eval(stmt.condition(), frame))) {
            Flow flow = execute(stmt.body(), frame);
            if (flow.kind() == Flow.Kind.BREAK) {
              break;
            } else if (flow.kind() != Flow.Kind.NORMAL && flow.kind() != Flow.Kind.CONTINUE) {
              return flow;
            }
          }
          return Flow.NORMAL;
        }

        @Override
        public Flow visitFor(Stmt.For stmt, Frame frame) {
          for (Iterator<Object> it = Values.iterate(eval(stmt.iterable(), frame)); it.hasNext(); ) {
            frame.bind(stmt.variable(), it.next());
            Flow flow = execute(stmt.body(), frame);
            if (flow.kind() == Flow.Kind.BREAK) {
              break;
            } else if (flow.kind() != Flow.Kind.NORMAL && flow.kind() != Flow.Kind.CONTINUE) {
              return flow;
            }
          }
          return Flow.NORMAL;
        }

        @Override
        public Flow visitMatch(Stmt.Match stmt, Frame frame) {
          Object subject = eval(stmt.subject(), frame);
          for (MatchArm arm : stmt.arms()) {
            Map<String, Object> captures = new LinkedHashMap<>();
            if (matches(arm.pattern(), subject, captures)) {
              captures.forEach(frame::bind);
              if (arm.guard() == null || Values.isTruthy(eval(arm.guard(), frame))) {
                return execute(arm.body(), frame);
              }
            }
          }
          // No arm matched.
          return Flow.NORMAL;
        }

        @Override
        public Flow visitReturn(Stmt.Return stmt, Frame frame) {
          return Flow.returning(eval(stmt.valueOrNone(), frame));
        }

        @Override
        public Flow visitYield(Stmt.Yield stmt, Frame frame) {
          if (frame.yieldTarget < 0) {
            throw new RuntimeError("'yield' outside generator");
          }
          Object value = eval(stmt.value(), frame);
          if (frame.yieldsSeen++ == frame.yieldTarget) {
            return Flow.yielding(value);
          }
          return Flow.NORMAL;
        }

        @Override
        public Flow visitBreak(Stmt.Break stmt, Frame frame) {
          return Flow.BREAK;
        }

        @Override
        public Flow visitContinue(Stmt.Continue stmt, Frame frame) {
          return Flow.CONTINUE;
        }

        @Override
        public Flow visitPass(Stmt.Pass stmt, Frame frame) {
          return Flow.NORMAL;
        }

        @Override
        public Flow visitFunctionDef(FunctionDef def, Frame frame) {
          RewindFunction fn =
              InterpretedFunction.bind(
                  def, frame.env, evaluateDefaults(def, frame), def.name(), def.doc());
          // Decorators apply bottom-up, like nested calls.
          for (String decorator : def.decorators().reverse()) {
            fn = frame.env.decorator(decorator).apply(fn, frame.env);
          }
          // The grammar only admits definitions at top level, so they always bind globals.
          frame.env.define(def.name(), fn);
          return Flow.NORMAL;
        }
      };

  private static boolean matches(
      MatchPattern pattern, Object subject, Map<String, Object> captures) {
    if (pattern instanceof MatchPattern.Wildcard) {
      return true;
    } else if (pattern instanceof MatchPattern.Capture capture) {
      captures.put(capture.name(), subject);
      return true;
    } else if (pattern instanceof MatchPattern.Constant constant) {
      Object value = constant.literal().value();
      // true, false and none only match themselves; numbers match equal numbers of either type.
      if (value instanceof Boolean || subject instanceof Boolean) {
        return value.equals(subject);
      }
      return Values.equal(value, subject);
    }
    for (MatchPattern alternative : ((MatchPattern.Alternatives) pattern).alternatives()) {
      if (matches(alternative, subject, captures)) {
        return true;
      }
    }
    return false;
  }

  private final Expr.Visitor<Frame, Object> evaluator =
      new Expr.Visitor<>() {
        @Override
        public Object visitLiteral(Expr.Literal expr, Frame frame) {
          return expr.value();
        }

        @Override
        public Object visitName(Expr.Name expr, Frame frame) {
          return frame.lookup(expr.id());
        }

        @Override
        public Object visitUnary(Expr.Unary expr, Frame frame) {
          Object operand = eval(expr.operand(), frame);
          return expr.op() == UnaryOp.NOT ? !Values.isTruthy(operand) : Values.negate(operand);
        }

        @Override
        public Object visitBinary(Expr.Binary expr, Frame frame) {
          Object left = eval(expr.left(), frame);
          switch (expr.op()) {
            case AND:
              return Values.isTruthy(left) ? eval(expr.right(), frame) : left;
            case OR:
              return Values.isTruthy(left) ? left : eval(expr.right(), frame);
            default:
              return Values.binary(expr.op(), left, eval(expr.right(), frame));
          }
        }

        @Override
        public Object visitCall(Expr.Call expr, Frame frame) {
          Object callee = eval(expr.callee(), frame);
          if (!(callee instanceof RewindFunction fn)) {
            throw RuntimeError.format("'%s' object is not callable", Values.typeName(callee));
          }
          ImmutableList.Builder<Object> args = ImmutableList.builder();
          for (Expr arg : expr.args()) {
            args.add(eval(arg, frame));
          }
          ImmutableMap.Builder<String, Object> kwargs = ImmutableMap.builder();
          for (Expr.Keyword keyword : expr.keywords()) {
            kwargs.put(keyword.name(), eval(keyword.value(), frame));
          }
          return fn.apply(args.build(), kwargs.buildOrThrow());
        }

        @Override
        public Object visitIndex(Expr.Index expr, Frame frame) {
          return Values.index(eval(expr.target(), frame), eval(expr.index(), frame));
        }

        @Override
        public Object visitList(Expr.ListExpr expr, Frame frame) {
          ImmutableList.Builder<Object> elements = ImmutableList.builder();
          for (Expr element : expr.elements()) {
            elements.add(eval(element, frame));
          }
          return elements.build();
        }

        @Override
        public Object visitMap(Expr.MapExpr expr, Frame frame) {
          // A repeated key keeps its first position and its last value.
          Map<Object, Object> entries = new LinkedHashMap<>();
          for (Expr.Entry entry : expr.entries()) {
            Object key = eval(entry.key(), frame);
            if (!(key instanceof String)) {
              throw RuntimeError.format("map keys must be strings, not '%s'", Values.typeName(key));
            }
            entries.put(key, eval(entry.value(), frame));
          }
          return ImmutableMap.copyOf(entries);
        }
      };
}
