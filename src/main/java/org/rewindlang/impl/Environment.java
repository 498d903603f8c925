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
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.rewindlang.compiler.Compiler;
import org.rewindlang.tree.Program;

/**
 * The global namespace that Rewind code runs in. Names that are not bound here fall back to the
 * builtins.
 *
 * <p>Functions keep a reference to the Environment they were defined in, so a function created
 * later against the same Environment (see {@code FunctionMaterializer}) sees the same globals.
 *
 * <p>Not thread-safe.
 */
public class Environment {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Transforms a function when a definition carrying {@code @name} is executed. */
  public interface Decorator {
    RewindFunction apply(RewindFunction fn, Environment env);
  }

  private final Interpreter interpreter;
  private final Map<String, Object> globals = new LinkedHashMap<>();
  private final Map<String, Decorator> decorators = new HashMap<>();

  /**
   * @param maxCallDepth the maximum number of nested function activations before a call fails
   *     with "maximum recursion depth exceeded"
   */
  public Environment(int maxCallDepth) {
    this.interpreter = new Interpreter(maxCallDepth);
  }

  Interpreter interpreter() {
    return interpreter;
  }

  public int maxCallDepth() {
    return interpreter.maxCallDepth();
  }

  public void registerDecorator(String name, Decorator decorator) {
    Preconditions.checkNotNull(decorator);
    decorators.put(name, decorator);
  }

  Decorator decorator(String name) {
    Decorator result = decorators.get(name);
    if (result == null) {
      throw new RuntimeError("unknown decorator '@" + name + "'");
    }
    return result;
  }

  /** Executes the top-level statements of {@code program}. */
  public void execute(Program program) {
    interpreter.executeTopLevel(program.statements(), this);
    logger.atFine().log("Executed %s; globals are %s", program.sourceName(), globals.keySet());
  }

  /** Compiles and executes {@code source}, returning the compiled program. */
  public Program load(String source, String sourceName) {
    Program program = Compiler.compile(source, sourceName);
    execute(program);
    return program;
  }

  /** Returns the value of a global or builtin, or null if the name is unbound. */
  public @Nullable Object lookup(String name) {
    Object result = globals.get(name);
    return (result != null) ? result : Builtins.get(name);
  }

  /** Returns the value of a global or builtin; throws a {@link RuntimeError} if it is unbound. */
  public Object get(String name) {
    Object result = lookup(name);
    if (result == null) {
      throw new RuntimeError("name '" + name + "' is not defined");
    }
    return result;
  }

  /** Binds a global, replacing any previous binding. */
  public void define(String name, Object value) {
    globals.put(name, Values.fromJava(value));
  }

  /** Returns the function bound to {@code name}. */
  public RewindFunction function(String name) {
    Object value = lookup(name);
    Preconditions.checkArgument(value != null, "'%s' is not defined", name);
    Preconditions.checkArgument(
        value instanceof RewindFunction,
        "'%s' is a %s, not a function",
        name,
        Values.typeName(value));
    return (RewindFunction) value;
  }

  /** A snapshot of the current global bindings, in the order they were first made. */
  public ImmutableMap<String, Object> globals() {
    return ImmutableMap.copyOf(globals);
  }
}
