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
import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import org.rewindlang.compiler.Unparser;
import org.rewindlang.impl.Environment;
import org.rewindlang.impl.InterpretedFunction;
import org.rewindlang.impl.RewindFunction;
import org.rewindlang.tree.FunctionDef;
import org.rewindlang.tree.Stmt;

/**
 * Replaces tail-recursive functions with equivalent loops.
 *
 * <p>A function whose body doesn't have one of the shapes recognized by {@link ShapeMatcher} is
 * left alone; that is not an error, and the caller gets back the original function.
 */
public class TailCallTransformer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** The decorator that applies {@link #transform} when a definition is executed. */
  public static final String DECORATOR = "tailrec";

  private TailCallTransformer() {}

  /**
   * Makes {@code @tailrec} available to definitions executed in {@code env}. The definition binds
   * the loop version in place of the original.
   */
  public static void install(Environment env) {
    env.registerDecorator(DECORATOR, (fn, unused) -> loopVersion(fn));
  }

  /**
   * Returns {@code def} with its body replaced by a loop, without its {@code @tailrec} decorator;
   * or {@code def} itself if its body has no recognized shape.
   */
  public static FunctionDef rewrite(FunctionDef def) {
    ShapeMatch match = ShapeMatcher.match(def.statements(), def.name(), def.signature());
    if (match instanceof ShapeMatch.Unrecognized unrecognized) {
      logger.atFine().log("Leaving %s unchanged (%s)", def.name(), unrecognized);
      return def;
    }
    ImmutableList<Stmt> loop;
    try {
      loop = LoopSynthesizer.synthesize(match, def.signature());
    } catch (LoopSynthesizer.ArityMismatchException e) {
      logger.atFine().withCause(e).log("Leaving %s unchanged", def.name());
      return def;
    }
    logger.atFine().log("Rewrote %s (%s)", def.name(), match.getClass().getSimpleName());
    return def.withStatements(loop)
        .withDecorators(
            def.decorators().stream().filter(d -> !d.equals(DECORATOR)).collect(toImmutableList()));
  }

  /**
   * Looks up the function bound to {@code name} in {@code env}, and if it can be rewritten binds
   * {@code name} to the rewritten version. Returns the function now bound to {@code name}.
   */
  public static RewindFunction transform(Environment env, String name) {
    return transform(env.function(name), env);
  }

  /**
   * If {@code fn} can be rewritten, returns the rewritten function and binds it in {@code env}
   * under {@code fn}'s name; otherwise returns {@code fn}. Builtins are returned unchanged.
   */
  public static RewindFunction transform(RewindFunction fn, Environment env) {
    Preconditions.checkNotNull(env);
    RewindFunction result = loopVersion(fn);
    if (result != fn) {
      env.define(fn.name(), result);
    }
    return result;
  }

  /** Returns the loop version of {@code fn}, or {@code fn} if it can't be rewritten. */
  private static RewindFunction loopVersion(RewindFunction fn) {
    if (!(fn instanceof InterpretedFunction original)) {
      return fn;
    }
    FunctionDef def = original.definition();
    FunctionDef rewritten = rewrite(def);
    if (rewritten == def) {
      return fn;
    }
    logger.atFine().log(
        "Loop version of %s:\n%s", fn.name(), lazy(() -> Unparser.unparse(rewritten)));
    return FunctionMaterializer.materialize(rewritten, original.environment(), original);
  }
}
