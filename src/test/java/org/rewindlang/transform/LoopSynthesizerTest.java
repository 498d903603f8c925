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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rewindlang.compiler.Compiler;
import org.rewindlang.compiler.Unparser;
import org.rewindlang.transform.ShapeMatch.Reason;
import org.rewindlang.tree.Expr;
import org.rewindlang.tree.FunctionDef;
import org.rewindlang.tree.FunctionSignature;
import org.rewindlang.tree.Stmt;

@RunWith(JUnit4.class)
public class LoopSynthesizerTest {

  private static String synthesize(String source) throws Exception {
    FunctionDef def = (FunctionDef) Compiler.compile(source, "test").statements().get(0);
    ShapeMatch match = ShapeMatcher.match(def.statements(), def.name(), def.signature());
    ImmutableList<Stmt> loop = LoopSynthesizer.synthesize(match, def.signature());
    assertThat(loop).hasSize(1);
    assertThat(loop.get(0)).isInstanceOf(Stmt.While.class);
    return Unparser.unparse(loop.get(0));
  }

  @Test
  public void guarded() throws Exception {
    assertThat(
            synthesize(
                """
                def f(n, acc) {
                  if n <= 1 { return acc }
                  return f(n - 1, acc * n)
                }
                """))
        .isEqualTo(
            """
            while true {
              if n <= 1 {
                return acc
              }
              n, acc = n - 1, acc * n
            }
            """);
  }

  @Test
  public void dispatch() throws Exception {
    assertThat(
            synthesize(
                """
                def f(a, b) {
                  match b {
                    case 0 { return a }
                    case _ { return f(b, a % b) }
                  }
                }
                """))
        .isEqualTo(
            """
            while true {
              match b {
                case 0 {
                  return a
                }
                case _ {
                  a, b = b, a % b
                  continue
                }
              }
              return none
            }
            """);
  }

  @Test
  public void rebindIsSimultaneous() throws Exception {
    FunctionDef def =
        (FunctionDef)
            Compiler.compile(
                    """
                    def fib(n, a, b) {
                      if n == 0 { return a }
                      return fib(n - 1, b, a + b)
                    }
                    """,
                    "test")
                .statements()
                .get(0);
    ShapeMatch match = ShapeMatcher.match(def.statements(), def.name(), def.signature());
    Stmt.While loop = (Stmt.While) LoopSynthesizer.synthesize(match, def.signature()).get(0);
    // One assignment of all three parameters, not three assignments.
    Stmt.Assign rebind = (Stmt.Assign) loop.body().get(1);
    assertThat(rebind.targets()).containsExactly("n", "a", "b").inOrder();
    assertThat(rebind.values()).hasSize(3);
  }

  @Test
  public void noParameters() throws Exception {
    assertThat(
            synthesize(
                """
                def f() {
                  if true { return 1 }
                  return f()
                }
                """))
        .isEqualTo(
            """
            while true {
              if true {
                return 1
              }
              pass
            }
            """);
  }

  @Test
  public void arityMismatch() {
    ShapeMatch match =
        new ShapeMatch.GuardedTailCall(
            new Expr.Name("done"),
            new Expr.Name("acc"),
            ImmutableList.of(new Expr.Name("acc")));
    LoopSynthesizer.ArityMismatchException e =
        assertThrows(
            LoopSynthesizer.ArityMismatchException.class,
            () -> LoopSynthesizer.synthesize(match, FunctionSignature.of("done", "acc")));
    assertThat(e.expected).isEqualTo(2);
    assertThat(e.actual).isEqualTo(1);
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("tail call has 1 arguments, function has 2 parameters");
  }

  @Test
  public void unrecognizedIsRejected() {
    ShapeMatch match = new ShapeMatch.Unrecognized(Reason.SHAPE_NOT_RECOGNIZED, "no");
    assertThrows(
        IllegalArgumentException.class,
        () -> LoopSynthesizer.synthesize(match, FunctionSignature.of("n")));
  }
}
