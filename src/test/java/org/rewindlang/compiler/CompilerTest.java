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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import org.antlr.v4.runtime.CharStreams;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rewindlang.tree.BinaryOp;
import org.rewindlang.tree.Expr;
import org.rewindlang.tree.FunctionDef;
import org.rewindlang.tree.MatchArm;
import org.rewindlang.tree.MatchPattern;
import org.rewindlang.tree.Param;
import org.rewindlang.tree.Program;
import org.rewindlang.tree.Stmt;
import org.rewindlang.tree.UnaryOp;

@RunWith(JUnit4.class)
public class CompilerTest {

  private static Stmt compileOne(String source) {
    Program program = Compiler.compile(source, "test");
    assertThat(program.statements()).hasSize(1);
    return program.statements().get(0);
  }

  private static Expr compileExpr(String source) {
    return ((Stmt.ExprStmt) compileOne(source)).expr();
  }

  private static Expr.Literal integer(long value) {
    return new Expr.Literal(BigInteger.valueOf(value));
  }

  @Test
  public void precedence() {
    assertThat(compileExpr("1 + 2 * 3"))
        .isEqualTo(
            new Expr.Binary(
                BinaryOp.ADD, integer(1), new Expr.Binary(BinaryOp.MUL, integer(2), integer(3))));
    assertThat(compileExpr("a - b - c"))
        .isEqualTo(
            new Expr.Binary(
                BinaryOp.SUB,
                new Expr.Binary(BinaryOp.SUB, new Expr.Name("a"), new Expr.Name("b")),
                new Expr.Name("c")));
    assertThat(compileExpr("not a and b"))
        .isEqualTo(
            new Expr.Binary(
                BinaryOp.AND,
                new Expr.Unary(UnaryOp.NOT, new Expr.Name("a")),
                new Expr.Name("b")));
    assertThat(compileExpr("-x[0]"))
        .isEqualTo(
            new Expr.Unary(UnaryOp.NEG, new Expr.Index(new Expr.Name("x"), integer(0))));
  }

  @Test
  public void literals() {
    assertThat(compileExpr("1.5")).isEqualTo(new Expr.Literal(1.5));
    assertThat(compileExpr("2e3")).isEqualTo(new Expr.Literal(2000.0));
    assertThat(compileExpr("\"a\\tb\\u0041\"")).isEqualTo(new Expr.Literal("a\tbA"));
    assertThat(compileExpr("none")).isEqualTo(Expr.Literal.NONE);
    assertThat(compileExpr("99999999999999999999"))
        .isEqualTo(new Expr.Literal(new BigInteger("99999999999999999999")));
  }

  @Test
  public void callWithKeywords() {
    Expr.Call call = (Expr.Call) compileExpr("f(1, x=2, y=3,)");
    assertThat(call.callee()).isEqualTo(new Expr.Name("f"));
    assertThat(call.args()).containsExactly(integer(1));
    assertThat(call.keywords())
        .containsExactly(new Expr.Keyword("x", integer(2)), new Expr.Keyword("y", integer(3)))
        .inOrder();
  }

  @Test
  public void functionDef() {
    FunctionDef def =
        (FunctionDef)
            compileOne(
                """
                @tailrec
                def f(n, acc=1) {
                  "Docs."
                  return acc
                }
                """);
    assertThat(def.decorators()).containsExactly("tailrec");
    assertThat(def.name()).isEqualTo("f");
    assertThat(def.params()).containsExactly(Param.of("n"), new Param("acc", integer(1))).inOrder();
    assertThat(def.doc()).isEqualTo("Docs.");
    assertThat(def.statements()).containsExactly(new Stmt.Return(new Expr.Name("acc")));
    assertThat(def.body()).hasSize(2);
    assertThat(def.isGenerator()).isFalse();
  }

  @Test
  public void generatorDef() {
    FunctionDef def =
        (FunctionDef) compileOne("def g(n) { for i in range(n) { if i > 1 { yield i } } }");
    assertThat(def.isGenerator()).isTrue();
    assertThat(def.doc()).isNull();
  }

  @Test
  public void elifBecomesNestedIf() {
    Stmt.If stmt =
        (Stmt.If)
            compileOne(
                """
                if a { x = 1 } elif b { x = 2 } else { x = 3 }
                """);
    assertThat(stmt.condition()).isEqualTo(new Expr.Name("a"));
    Stmt.If elif = (Stmt.If) stmt.elseBody().get(0);
    assertThat(stmt.elseBody()).hasSize(1);
    assertThat(elif.condition()).isEqualTo(new Expr.Name("b"));
    assertThat(elif.elseBody())
        .containsExactly(new Stmt.Assign(ImmutableList.of("x"), ImmutableList.of(integer(3))));
  }

  @Test
  public void matchPatterns() {
    Stmt.Match match =
        (Stmt.Match)
            compileOne(
                """
                match x {
                  case 0 | -1 | 2.5 { pass }
                  case "s" | true | none { pass }
                  case y if y > 3 { pass }
                  case _ { pass }
                }
                """);
    ImmutableList<MatchArm> arms = match.arms();
    assertThat(arms.get(0).pattern())
        .isEqualTo(
            new MatchPattern.Alternatives(
                ImmutableList.of(
                    new MatchPattern.Constant(integer(0)),
                    new MatchPattern.Constant(integer(-1)),
                    new MatchPattern.Constant(new Expr.Literal(2.5)))));
    assertThat(arms.get(1).pattern())
        .isEqualTo(
            new MatchPattern.Alternatives(
                ImmutableList.of(
                    new MatchPattern.Constant(new Expr.Literal("s")),
                    new MatchPattern.Constant(new Expr.Literal(true)),
                    new MatchPattern.Constant(Expr.Literal.NONE))));
    assertThat(arms.get(2).pattern()).isEqualTo(new MatchPattern.Capture("y"));
    assertThat(arms.get(2).guard()).isNotNull();
    assertThat(arms.get(3).pattern()).isEqualTo(new MatchPattern.Wildcard());
    assertThat(arms.get(3).guard()).isNull();
  }

  @Test
  public void augmentedAssignment() {
    assertThat(compileOne("total %= 2"))
        .isEqualTo(new Stmt.AugAssign("total", BinaryOp.MOD, integer(2)));
  }

  @Test
  public void compileFromCharStream() {
    Program program = Compiler.compile(CharStreams.fromString("x = 1; y = 2"), "stream");
    assertThat(program.sourceName()).isEqualTo("stream");
    assertThat(program.statements()).hasSize(2);
  }

  @Test
  public void syntaxError() {
    CompileError e =
        assertThrows(CompileError.class, () -> Compiler.compile("x = 1\ny = (2", "broken"));
    assertThat(e.sourceName).isEqualTo("broken");
    assertThat(e.line).isEqualTo(2);
    assertThat(e).hasMessageThat().startsWith("broken:2:");
  }

  @Test
  public void definitionsOnlyAtTopLevel() {
    CompileError e =
        assertThrows(
            CompileError.class,
            () -> Compiler.compile("def f() {\n  def g() { pass }\n}", "t"));
    assertThat(e.line).isEqualTo(2);
    assertThat(e).hasMessageThat().startsWith("t:2:");
  }

  @Test
  public void duplicateParameter() {
    CompileError e =
        assertThrows(CompileError.class, () -> Compiler.compile("def f(a, a) { pass }", "t"));
    assertThat(e).hasMessageThat().isEqualTo("t:1:10: duplicate parameter 'a'");
    assertThat(e.column).isEqualTo(10);
  }

  @Test
  public void parameterOrder() {
    CompileError e =
        assertThrows(CompileError.class, () -> Compiler.compile("def f(a=1, b) { pass }", "t"));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("t:1:12: parameter without default follows parameter with default");
  }

  @Test
  public void assignmentCount() {
    CompileError e =
        assertThrows(CompileError.class, () -> Compiler.compile("a, b = 1, 2, 3", "t"));
    assertThat(e).hasMessageThat().isEqualTo("t:1:1: cannot assign 3 values to 2 targets");
  }

  @Test
  public void argumentErrors() {
    CompileError e = assertThrows(CompileError.class, () -> Compiler.compile("f(x=1, 2)", "t"));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("t:1:8: positional argument follows keyword argument");
    e = assertThrows(CompileError.class, () -> Compiler.compile("f(x=1, x=2)", "t"));
    assertThat(e).hasMessageThat().isEqualTo("t:1:8: repeated keyword argument 'x'");
  }

  @Test
  public void alternativesMayNotCapture() {
    CompileError e =
        assertThrows(
            CompileError.class,
            () -> Compiler.compile("match x { case 1 | y { pass } }", "t"));
    assertThat(e).hasMessageThat().isEqualTo("t:1:20: alternatives may not bind names");
  }
}
