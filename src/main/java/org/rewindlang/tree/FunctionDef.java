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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A function definition: {@code @decorator ... def name(params) { body }}.
 *
 * <p>If the first statement of the body is a string literal it is the function's docstring; it is
 * kept in {@link #body} (so that unparsing reproduces it) but excluded from {@link #statements}.
 */
public record FunctionDef(
    ImmutableList<String> decorators,
    String name,
    ImmutableList<Param> params,
    ImmutableList<Stmt> body)
    implements Stmt {

  public FunctionSignature signature() {
    return FunctionSignature.of(this);
  }

  /** Returns the docstring, or null if the body doesn't start with one. */
  public @Nullable String doc() {
    if (!body.isEmpty()
        && body.get(0) instanceof ExprStmt stmt
        && stmt.expr() instanceof Expr.Literal literal
        && literal.value() instanceof String s) {
      return s;
    }
    return null;
  }

  /** The body without its docstring, if it has one. */
  public ImmutableList<Stmt> statements() {
    return doc() == null ? body : body.subList(1, body.size());
  }

  /**
   * Returns a copy of this definition whose body is the given statements, preceded by this
   * definition's docstring if it has one.
   */
  public FunctionDef withStatements(List<Stmt> statements) {
    ImmutableList.Builder<Stmt> newBody = ImmutableList.builder();
    if (doc() != null) {
      newBody.add(body.get(0));
    }
    return new FunctionDef(decorators, name, params, newBody.addAll(statements).build());
  }

  /** Returns a copy of this definition with the given decorators. */
  public FunctionDef withDecorators(ImmutableList<String> newDecorators) {
    return new FunctionDef(newDecorators, name, params, body);
  }

  /** True if the body contains a {@code yield}, making calls return a lazy sequence. */
  public boolean isGenerator() {
    return containsYield(body);
  }

  private static boolean containsYield(List<Stmt> stmts) {
    for (Stmt stmt : stmts) {
      if (stmt instanceof Yield) {
        return true;
      } else if (stmt instanceof If s) {
        if (containsYield(s.thenBody()) || containsYield(s.elseBody())) {
          return true;
        }
      } else if (stmt instanceof While s) {
        if (containsYield(s.body())) {
          return true;
        }
      } else if (stmt instanceof For s) {
        if (containsYield(s.body())) {
          return true;
        }
      } else if (stmt instanceof Match s) {
        if (s.arms().stream().anyMatch(arm -> containsYield(arm.body()))) {
          return true;
        }
      }
      // Nested FunctionDefs have their own yields, and no other statement has a body.
    }
    return false;
  }

  @Override
  public <C, R> R accept(Visitor<C, R> visitor, C context) {
    return visitor.visitFunctionDef(this, context);
  }
}
