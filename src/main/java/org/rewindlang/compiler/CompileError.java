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

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

/** Thrown when Rewind source is malformed. Line and column numbers are 1-based. */
public class CompileError extends RuntimeException {
  public final String sourceName;
  public final int line;
  public final int column;

  public CompileError(String sourceName, int line, int column, String message) {
    super(String.format("%s:%d:%d: %s", sourceName, line, column, message));
    this.sourceName = sourceName;
    this.line = line;
    this.column = column;
  }

  static CompileError at(String sourceName, Token token, String message) {
    return new CompileError(
        sourceName, token.getLine(), token.getCharPositionInLine() + 1, message);
  }

  static CompileError at(String sourceName, ParserRuleContext ctx, String message) {
    return at(sourceName, ctx.getStart(), message);
  }
}
