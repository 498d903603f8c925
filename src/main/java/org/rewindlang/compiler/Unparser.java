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

package org.rewindlang.compiler;

import com.google.common.base.Preconditions;
import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;
import org.rewindlang.tree.Expr;
import org.rewindlang.tree.FunctionDef;
import org.rewindlang.tree.MatchArm;
import org.rewindlang.tree.MatchPattern;
import org.rewindlang.tree.None;
import org.rewindlang.tree.Param;
import org.rewindlang.tree.Program;
import org.rewindlang.tree.Stmt;
import org.rewindlang.tree.UnaryOp;
import org.rewindlang.util.StringUtil;

/**
 * Renders trees as canonical Rewind source: two-space indentation, one statement per line, no
 * semicolons, and only the parentheses that precedence requires. Compiling the result yields a
 * tree that behaves the same as the original.
 */
public class Unparser {

  private Unparser() {}

  public static String unparse(Program program) {
    StringBuilder sb = new StringBuilder();
    Stmt prev = null;
    for (Stmt stmt : program.statements()) {
      if (prev instanceof FunctionDef || (prev != null && stmt instanceof FunctionDef)) {
        sb.append('\n');
      }
      stmt.accept(STMT, new Context(sb, 0));
      prev = stmt;
    }
    return sb.toString();
  }

  /** Returns the source for a single statement, ending with a newline. */
  public static String unparse(Stmt stmt) {
    StringBuilder sb = new StringBuilder();
    stmt.accept(STMT, new Context(sb, 0));
    return sb.toString();
  }

  public static String unparse(Expr expr) {
    return expr.accept(EXPR, null);
  }

  private record Context(StringBuilder sb, int indent) {
    StringBuilder line() {
      return sb.append("  ".repeat(indent));
    }

    Context nested() {
      return new Context(sb, indent + 1);
    }

    void block(List<Stmt> body) {
      sb.append(" {\n");
      Context inner = nested();
      body.forEach(s -> s.accept(STMT, inner));
      line().append('}');
    }
  }

  private static final Stmt.Visitor<Context, Void> STMT =
      new Stmt.Visitor<>() {
        @Override
        public Void visitExpr(Stmt.ExprStmt stmt, Context ctx) {
          ctx.line().append(unparse(stmt.expr())).append('\n');
          return null;
        }

        @Override
        public Void visitAssign(Stmt.Assign stmt, Context ctx) {
          ctx.line()
              .append(String.join(", ", stmt.targets()))
              .append(" = ")
              .append(StringUtil.joinElements("", "", stmt.values(), Unparser::unparse))
              .append('\n');
          return null;
        }

        @Override
        public Void visitAugAssign(Stmt.AugAssign stmt, Context ctx) {
          ctx.line()
              .append(stmt.target())
              .append(' ')
              .append(stmt.op().symbol)
              .append("= ")
              .append(unparse(stmt.value()))
              .append('\n');
          return null;
        }

        @Override
        public Void visitIf(Stmt.If stmt, Context ctx) {
          ctx.line().append("if ").append(unparse(stmt.condition()));
          ctx.block(stmt.thenBody());
          Stmt.If current = stmt;
          // An else clause holding just an If is written as "elif".
          while (current.elseBody().size() == 1
              && current.elseBody().get(0) instanceof Stmt.If elif) {
            ctx.sb().append(" elif ").append(unparse(elif.condition()));
            ctx.block(elif.thenBody());
            current = elif;
          }
          if (!current.elseBody().isEmpty()) {
            ctx.sb().append(" else");
            ctx.block(current.elseBody());
          }
          ctx.sb().append('\n');
          return null;
        }

        @Override
        public Void visitWhile(Stmt.While stmt, Context ctx) {
          ctx.line().append("while ").append(unparse(stmt.condition()));
          ctx.block(stmt.body());
          ctx.sb().append('\n');
          return null;
        }

        @Override
        public Void visitFor(Stmt.For stmt, Context ctx) {
          ctx.line()
              .append("for ")
              .append(stmt.variable())
              .append(" in ")
              .append(unparse(stmt.iterable()));
          ctx.block(stmt.body());
          ctx.sb().append('\n');
          return null;
        }

        @Override
        public Void visitMatch(Stmt.Match stmt, Context ctx) {
          ctx.line().append("match ").append(unparse(stmt.subject())).append(" {\n");
          Context armContext = ctx.nested();
          for (MatchArm arm : stmt.arms()) {
            armContext.line().append("case ").append(pattern(arm.pattern()));
            if (arm.guard() != null) {
              armContext.sb().append(" if ").append(unparse(arm.guard()));
            }
            armContext.block(arm.body());
            armContext.sb().append('\n');
          }
          ctx.line().append("}\n");
          return null;
        }

        @Override
        public Void visitReturn(Stmt.Return stmt, Context ctx) {
          ctx.line().append("return");
          if (stmt.value() != null) {
            ctx.sb().append(' ').append(unparse(stmt.value()));
          }
          ctx.sb().append('\n');
          return null;
        }

        @Override
        public Void visitYield(Stmt.Yield stmt, Context ctx) {
          ctx.line().append("yield ").append(unparse(stmt.value())).append('\n');
          return null;
        }

        @Override
        public Void visitBreak(Stmt.Break stmt, Context ctx) {
          ctx.line().append("break\n");
          return null;
        }

        @Override
        public Void visitContinue(Stmt.Continue stmt, Context ctx) {
          ctx.line().append("continue\n");
          return null;
        }

        @Override
        public Void visitPass(Stmt.Pass stmt, Context ctx) {
          ctx.line().append("pass\n");
          return null;
        }

        @Override
        public Void visitFunctionDef(FunctionDef def, Context ctx) {
          for (String decorator : def.decorators()) {
            ctx.line().append('@').append(decorator).append('\n');
          }
          ctx.line()
              .append("def ")
              .append(def.name())
              .append(StringUtil.joinElements("(", ")", def.params(), Unparser::param));
          ctx.block(def.body());
          ctx.sb().append('\n');
          return null;
        }
      };

  private static String param(Param param) {
    return param.defaultValue() == null
        ? param.name()
        : param.name() + "=" + unparse(param.defaultValue());
  }

  private static String pattern(MatchPattern pattern) {
    if (pattern instanceof MatchPattern.Wildcard) {
      return "_";
    } else if (pattern instanceof MatchPattern.Capture capture) {
      return capture.name();
    } else if (pattern instanceof MatchPattern.Constant constant) {
      return literal(constant.literal().value());
    } else {
      return ((MatchPattern.Alternatives) pattern)
          .alternatives().stream().map(Unparser::pattern).collect(Collectors.joining(" | "));
    }
  }

  private static String literal(Object value) {
    if (value instanceof String s) {
      return StringUtil.escape(s);
    } else if (value instanceof Boolean b) {
      return b ? "true" : "false";
    } else if (value instanceof None) {
      return "none";
    } else if (value instanceof Double d) {
      Preconditions.checkArgument(Double.isFinite(d), "%s has no literal form", d);
      return d.toString();
    } else {
      return ((BigInteger) value).toString();
    }
  }

  /** Returns {@code expr}'s source, parenthesized if it binds less tightly than {@code minimum}. */
  private static String operand(Expr expr, int minimum) {
    String s = unparse(expr);
    return expr.precedence() < minimum ? "(" + s + ")" : s;
  }

  private static final Expr.Visitor<Void, String> EXPR =
      new Expr.Visitor<>() {
        @Override
        public String visitLiteral(Expr.Literal expr, Void unused) {
          return literal(expr.value());
        }

        @Override
        public String visitName(Expr.Name expr, Void unused) {
          return expr.id();
        }

        @Override
        public String visitUnary(Expr.Unary expr, Void unused) {
          if (expr.op() == UnaryOp.NOT) {
            return "not " + operand(expr.operand(), UnaryOp.NOT.precedence);
          }
          // "--x" would also parse, but reads badly.
          return "-" + operand(expr.operand(), UnaryOp.NEG.precedence + 1);
        }

        @Override
        public String visitBinary(Expr.Binary expr, Void unused) {
          int precedence = expr.op().precedence;
          // Binary operators are left-associative, so an equal-precedence right operand needs
          // parentheses.
          return operand(expr.left(), precedence)
              + " "
              + expr.op().symbol
              + " "
              + operand(expr.right(), precedence + 1);
        }

        @Override
        public String visitCall(Expr.Call expr, Void unused) {
          StringBuilder sb = new StringBuilder(operand(expr.callee(), Expr.POSTFIX)).append('(');
          String separator = "";
          for (Expr arg : expr.args()) {
            sb.append(separator).append(unparse(arg));
            separator = ", ";
          }
          for (Expr.Keyword keyword : expr.keywords()) {
            sb.append(separator).append(keyword.name()).append('=');
            sb.append(unparse(keyword.value()));
            separator = ", ";
          }
          return sb.append(')').toString();
        }

        @Override
        public String visitIndex(Expr.Index expr, Void unused) {
          return operand(expr.target(), Expr.POSTFIX) + "[" + unparse(expr.index()) + "]";
        }

        @Override
        public String visitList(Expr.ListExpr expr, Void unused) {
          return StringUtil.joinElements("[", "]", expr.elements(), Unparser::unparse);
        }

        @Override
        public String visitMap(Expr.MapExpr expr, Void unused) {
          return StringUtil.joinElements(
              "{", "}", expr.entries(), e -> unparse(e.key()) + ": " + unparse(e.value()));
        }
      };
}
