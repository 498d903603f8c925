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
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.rewindlang.tree.FunctionDef;
import org.rewindlang.tree.Param;
import org.rewindlang.util.StringUtil;

/**
 * A function defined in Rewind source, bound to the {@link Environment} its free names resolve
 * against.
 */
public final class InterpretedFunction extends RewindFunction {
  private final FunctionDef definition;
  private final Environment env;
  private final ImmutableMap<String, Object> defaults;
  private final String name;
  private final @Nullable String doc;
  private final boolean isGenerator;

  private InterpretedFunction(
      FunctionDef definition,
      Environment env,
      ImmutableMap<String, Object> defaults,
      String name,
      @Nullable String doc) {
    this.definition = definition;
    this.env = env;
    this.defaults = defaults;
    this.name = name;
    this.doc = doc;
    this.isGenerator = definition.isGenerator();
  }

  /**
   * Returns a function executing {@code definition} in {@code env}.
   *
   * @param defaults the values of parameters that have defaults, already evaluated
   * @param name the name reported by {@link #name}, which need not match the definition's
   * @param doc the documentation reported by {@link #doc}
   */
  public static InterpretedFunction bind(
      FunctionDef definition,
      Environment env,
      ImmutableMap<String, Object> defaults,
      String name,
      @Nullable String doc) {
    for (String param : defaults.keySet()) {
      Preconditions.checkArgument(
          definition.signature().parameters().contains(param),
          "Default for %s, which is not a parameter of %s",
          param,
          definition.name());
    }
    return new InterpretedFunction(definition, env, defaults, name, doc);
  }

  public FunctionDef definition() {
    return definition;
  }

  public Environment environment() {
    return env;
  }

  /** The evaluated default values, keyed by parameter name. */
  public ImmutableMap<String, Object> defaults() {
    return defaults;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public @Nullable String doc() {
    return doc;
  }

  @Override
  Object apply(ImmutableList<Object> args, ImmutableMap<String, Object> kwargs) {
    ImmutableList<Param> params = definition.params();
    if (args.size() > params.size()) {
      throw RuntimeError.format(
          "%s() takes %d positional argument%s but %d were given",
          name, params.size(), StringUtil.plural(params.size()), args.size());
    }
    Map<String, Object> locals = new HashMap<>();
    for (int i = 0; i < args.size(); i++) {
      locals.put(params.get(i).name(), args.get(i));
    }
    kwargs.forEach(
        (key, value) -> {
          if (!definition.signature().parameters().contains(key)) {
            throw RuntimeError.format("%s() got an unexpected keyword argument '%s'", name, key);
          } else if (locals.putIfAbsent(key, value) != null) {
            throw RuntimeError.format("%s() got multiple values for argument '%s'", name, key);
          }
        });
    for (Param param : params) {
      if (!locals.containsKey(param.name())) {
        Object value = defaults.get(param.name());
        if (value == null) {
          throw RuntimeError.format("%s() missing required argument '%s'", name, param.name());
        }
        locals.put(param.name(), value);
      }
    }
    if (isGenerator) {
      return new GeneratorValue(this, ImmutableMap.copyOf(locals));
    }
    return env.interpreter().call(this, locals);
  }
}
