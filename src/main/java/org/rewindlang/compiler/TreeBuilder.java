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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.rewindlang.tree.BinaryOp;
import org.rewindlang.tree.Expr;
import org.rewindlang.tree.FunctionDef;
import org.rewindlang.tree.MatchArm;
import org.rewindlang.tree.MatchPattern;
import org.rewindlang.tree.Param;
import org.rewindlang.tree.Program;
import org.rewindlang.tree.Stmt;
import org.rewindlang.tree.UnaryOp;
import org.rewindlang.util.StringUtil;

/** Converts an ANTLR parse tree into {@link Program}, {@link Stmt} and {@link Expr} trees. */
class TreeBuilder {
  private final String sourceName;
  private final StmtVisitor stmtVisitor = new StmtVisitor();
  private final ExprVisitor exprVisitor = new ExprVisitor();
  private final PatternVisitor patternVisitor = new PatternVisitor();

  TreeBuilder(String sourceName) {
    this.sourceName = sourceName;
  }

  Program program(RewindParser.ProgramContext ctx) {
    ImmutableList.Builder<Stmt> statements = ImmutableList.builder();
    for (RewindParser.TopLevelContext topLevel : ctx.topLevel()) {
      if (topLevel.functionDef() != null) {
        statements.add(functionDef(topLevel.functionDef()));
      } else {
        statements.add(statement(topLevel.statement()));
      }
    }
    return new Program(sourceName, statements.build());
  }

  private FunctionDef functionDef(RewindParser.FunctionDefContext ctx) {
    ImmutableList<String> decorators =
        ctx.decorator().stream().map(d -> d.ID().getText()).collect(toImmutableList());
    ImmutableList.Builder<Param> params = ImmutableList.builder();
    Set<String> seen = new HashSet<>();
    boolean sawDefault = false;
    for (RewindParser.ParamContext param : ctx.param()) {
      String name = param.ID().getText();
      if (!seen.add(name)) {
        throw CompileError.at(sourceName, param, "duplicate parameter '" + name + "'");
      }
      Expr defaultValue = null;
      if (param.expr() != null) {
        defaultValue = expr(param.expr());
        sawDefault = true;
      } else if (sawDefault) {
        throw CompileError.at(
            sourceName, param, "parameter without default follows parameter with default");
      }
      params.add(new Param(name, defaultValue));
    }
    return new FunctionDef(decorators, ctx.name.getText(), params.build(), block(ctx.block()));
  }

  private ImmutableList<Stmt> block(RewindParser.BlockContext ctx) {
    return ctx.statement().stream().map(this::statement).collect(toImmutableList());
  }

  private Stmt statement(RewindParser.StatementContext ctx) {
    return stmtVisitor.visit(ctx);
  }

  private Expr expr(RewindParser.ExprContext ctx) {
    return exprVisitor.visit(ctx);
  }

  private ImmutableList<Expr> exprs(List<RewindParser.ExprContext> ctxs) {
    return ctxs.stream().map(this::expr).collect(toImmutableList());
  }

  private static BinaryOp binaryOp(Token op) {
    BinaryOp result = BinaryOp.forSymbol(op.getText());
    if (result == null) {
      throw new AssertionError(op.getText());
    }
    return result;
  }

  private static String stringValue(TerminalNode node) {
    return StringUtil.unescape(node.getText());
  }

  private class StmtVisitor extends RewindBaseVisitor<Stmt> {
    @Override
    public Stmt visitIfStmt(RewindParser.IfStmtContext ctx) {
      ImmutableList<Stmt> elseBody =
          ctx.elseClause() == null ? ImmutableList.of() : block(ctx.elseClause().block());
      // "elif" chains become nested Ifs, built from the last one outward.
      List<RewindParser.ElifClauseContext> elifs = ctx.elifClause();
      for (int i = elifs.size() - 1; i >= 0; i--) {
        RewindParser.ElifClauseContext elif = elifs.get(i);
        elseBody = ImmutableList.of(new Stmt.If(expr(elif.expr()), block(elif.block()), elseBody));
      }
      return new Stmt.If(expr(ctx.expr()), block(ctx.block()), elseBody);
    }

    @Override
    public Stmt visitWhileStmt(RewindParser.WhileStmtContext ctx) {
      return new Stmt.While(expr(ctx.expr()), block(ctx.block()));
    }

    @Override
    public Stmt visitForStmt(RewindParser.ForStmtContext ctx) {
      return new Stmt.For(ctx.ID().getText(), expr(ctx.expr()), block(ctx.block()));
    }

    @Override
    public Stmt visitMatchStmt(RewindParser.MatchStmtContext ctx) {
      ImmutableList<MatchArm> arms =
          ctx.matchArm().stream()
              .map(
                  arm ->
                      new MatchArm(
                          patternVisitor.pattern(arm.pattern()),
                          arm.guard == null ? null : expr(arm.guard),
                          block(arm.block())))
              .collect(toImmutableList());
      return new Stmt.Match(expr(ctx.expr()), arms);
    }

    @Override
    public Stmt visitReturnStmt(RewindParser.ReturnStmtContext ctx) {
      return new Stmt.Return(ctx.expr() == null ? null : expr(ctx.expr()));
    }

    @Override
    public Stmt visitYieldStmt(RewindParser.YieldStmtContext ctx) {
      return new Stmt.Yield(expr(ctx.expr()));
    }

    @Override
    public Stmt visitBreakStmt(RewindParser.BreakStmtContext ctx) {
      return new Stmt.Break();
    }

    @Override
    public Stmt visitContinueStmt(RewindParser.ContinueStmtContext ctx) {
      return new Stmt.Continue();
    }

    @Override
    public Stmt visitPassStmt(RewindParser.PassStmtContext ctx) {
      return new Stmt.Pass();
    }

    @Override
    public Stmt visitAssignStmt(RewindParser.AssignStmtContext ctx) {
      ImmutableList<String> targets =
          ctx.ID().stream().map(TerminalNode::getText).collect(toImmutableList());
      ImmutableList<Expr> values = exprs(ctx.expr());
      if (values.size() != 1 && values.size() != targets.size()) {
        throw CompileError.at(
            sourceName,
            ctx,
            String.format(
                "cannot assign %d values to %d targets", values.size(), targets.size()));
      }
      return new Stmt.Assign(targets, values);
    }

    @Override
    public Stmt visitAugAssignStmt(RewindParser.AugAssignStmtContext ctx) {
      String symbol = ctx.op.getText();
      BinaryOp op = BinaryOp.forSymbol(symbol.substring(0, symbol.length() - 1));
      return new Stmt.AugAssign(ctx.ID().getText(), op, expr(ctx.expr()));
    }

    @Override
    public Stmt visitExprStmt(RewindParser.ExprStmtContext ctx) {
      return new Stmt.ExprStmt(expr(ctx.expr()));
    }
  }

  private class ExprVisitor extends RewindBaseVisitor<Expr> {
    @Override
    public Expr visitPrimaryExpr(RewindParser.PrimaryExprContext ctx) {
      return visit(ctx.primary());
    }

    @Override
    public Expr visitCallExpr(RewindParser.CallExprContext ctx) {
      ImmutableList.Builder<Expr> args = ImmutableList.builder();
      ImmutableList.Builder<Expr.Keyword> keywords = ImmutableList.builder();
      Set<String> keywordNames = new HashSet<>();
      for (RewindParser.ArgContext arg : ctx.arg()) {
        Expr value = expr(arg.expr());
        if (arg.ID() == null) {
          if (!keywordNames.isEmpty()) {
            throw CompileError.at(sourceName, arg, "positional argument follows keyword argument");
          }
          args.add(value);
        } else {
          String name = arg.ID().getText();
          if (!keywordNames.add(name)) {
            throw CompileError.at(sourceName, arg, "repeated keyword argument '" + name + "'");
          }
          keywords.add(new Expr.Keyword(name, value));
        }
      }
      return new Expr.Call(expr(ctx.expr()), args.build(), keywords.build());
    }

    @Override
    public Expr visitIndexExpr(RewindParser.IndexExprContext ctx) {
      return new Expr.Index(expr(ctx.expr(0)), expr(ctx.expr(1)));
    }

    @Override
    public Expr visitNegExpr(RewindParser.NegExprContext ctx) {
      return new Expr.Unary(UnaryOp.NEG, expr(ctx.expr()));
    }

    @Override
    public Expr visitNotExpr(RewindParser.NotExprContext ctx) {
      return new Expr.Unary(UnaryOp.NOT, expr(ctx.expr()));
    }

    @Override
    public Expr visitMulExpr(RewindParser.MulExprContext ctx) {
      return binary(binaryOp(ctx.op), ctx.expr());
    }

    @Override
    public Expr visitAddExpr(RewindParser.AddExprContext ctx) {
      return binary(binaryOp(ctx.op), ctx.expr());
    }

    @Override
    public Expr visitCompareExpr(RewindParser.CompareExprContext ctx) {
      return binary(binaryOp(ctx.op), ctx.expr());
    }

    @Override
    public Expr visitAndExpr(RewindParser.AndExprContext ctx) {
      return binary(BinaryOp.AND, ctx.expr());
    }

    @Override
    public Expr visitOrExpr(RewindParser.OrExprContext ctx) {
      return binary(BinaryOp.OR, ctx.expr());
    }

    private Expr binary(BinaryOp op, List<RewindParser.ExprContext> operands) {
      return new Expr.Binary(op, expr(operands.get(0)), expr(operands.get(1)));
    }

    @Override
    public Expr visitIntLiteral(RewindParser.IntLiteralContext ctx) {
      return new Expr.Literal(new BigInteger(ctx.INT().getText()));
    }

    @Override
    public Expr visitFloatLiteral(RewindParser.FloatLiteralContext ctx) {
      return new Expr.Literal(Double.parseDouble(ctx.FLOAT().getText()));
    }

    @Override
    public Expr visitStringLiteral(RewindParser.StringLiteralContext ctx) {
      return new Expr.Literal(stringValue(ctx.STRING()));
    }

    @Override
    public Expr visitTrueLiteral(RewindParser.TrueLiteralContext ctx) {
      return new Expr.Literal(true);
    }

    @Override
    public Expr visitFalseLiteral(RewindParser.FalseLiteralContext ctx) {
      return new Expr.Literal(false);
    }

    @Override
    public Expr visitNoneLiteral(RewindParser.NoneLiteralContext ctx) {
      return Expr.Literal.NONE;
    }

    @Override
    public Expr visitNameRef(RewindParser.NameRefContext ctx) {
      return new Expr.Name(ctx.ID().getText());
    }

    @Override
    public Expr visitParenExpr(RewindParser.ParenExprContext ctx) {
      return expr(ctx.expr());
    }

    @Override
    public Expr visitListLiteral(RewindParser.ListLiteralContext ctx) {
      return new Expr.ListExpr(exprs(ctx.expr()));
    }

    @Override
    public Expr visitMapLiteral(RewindParser.MapLiteralContext ctx) {
      return new Expr.MapExpr(
          ctx.entry().stream()
              .map(e -> new Expr.Entry(expr(e.expr(0)), expr(e.expr(1))))
              .collect(toImmutableList()));
    }
  }

  private class PatternVisitor extends RewindBaseVisitor<MatchPattern> {
    MatchPattern pattern(RewindParser.PatternContext ctx) {
      List<RewindParser.SimplePatternContext> simple = ctx.simplePattern();
      if (simple.size() == 1) {
        return visit(simple.get(0));
      }
      ImmutableList<MatchPattern> alternatives =
          simple.stream().map(this::visit).collect(toImmutableList());
      for (int i = 0; i < alternatives.size(); i++) {
        if (alternatives.get(i) instanceof MatchPattern.Capture) {
          throw CompileError.at(sourceName, simple.get(i), "alternatives may not bind names");
        }
      }
      return new MatchPattern.Alternatives(alternatives);
    }

    @Override
    public MatchPattern visitNamePattern(RewindParser.NamePatternContext ctx) {
      String name = ctx.ID().getText();
      return name.equals("_") ? new MatchPattern.Wildcard() : new MatchPattern.Capture(name);
    }

    @Override
    public MatchPattern visitNumberPattern(RewindParser.NumberPatternContext ctx) {
      boolean negative = ctx.getChild(0).getText().equals("-");
      Object value;
      if (ctx.INT() != null) {
        BigInteger i = new BigInteger(ctx.INT().getText());
        value = negative ? i.negate() : i;
      } else {
        double d = Double.parseDouble(ctx.FLOAT().getText());
        value = negative ? -d : d;
      }
      return constant(value);
    }

    @Override
    public MatchPattern visitStringPattern(RewindParser.StringPatternContext ctx) {
      return constant(stringValue(ctx.STRING()));
    }

    @Override
    public MatchPattern visitTruePattern(RewindParser.TruePatternContext ctx) {
      return constant(true);
    }

    @Override
    public MatchPattern visitFalsePattern(RewindParser.FalsePatternContext ctx) {
      return constant(false);
    }

    @Override
    public MatchPattern visitNonePattern(RewindParser.NonePatternContext ctx) {
      return new MatchPattern.Constant(Expr.Literal.NONE);
    }

    private MatchPattern constant(Object value) {
      return new MatchPattern.Constant(new Expr.Literal(value));
    }
  }
}
