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

import com.google.common.flogger.FluentLogger;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.rewindlang.tree.Program;

/** Static-only class that parses Rewind source into a {@link Program}. */
public class Compiler {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private Compiler() {}

  /**
   * Parses the given source. Throws a {@link CompileError} at the first syntax error; no attempt is
   * made to recover and report more than one.
   */
  public static Program compile(CharStream input, String sourceName) {
    ErrorListener errorListener = new ErrorListener(sourceName);
    RewindLexer lexer = new RewindLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    RewindParser parser = new RewindParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    Program program = new TreeBuilder(sourceName).program(parser.program());
    logger.atFine().log(
        "Compiled %s: %d top-level statements", sourceName, program.statements().size());
    return program;
  }

  public static Program compile(String source, String sourceName) {
    return compile(CharStreams.fromString(source, sourceName), sourceName);
  }

  private static class ErrorListener extends BaseErrorListener {
    final String sourceName;

    ErrorListener(String sourceName) {
      this.sourceName = sourceName;
    }

    @Override
    public void syntaxError(
        Recognizer<?, ?> recognizer,
        Object offendingSymbol,
        int line,
        int charPositionInLine,
        String msg,
        RecognitionException e) {
      throw new CompileError(sourceName, line, charPositionInLine + 1, msg);
    }
  }
}
