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
import org.jspecify.annotations.Nullable;

/** One {@code case pattern [if guard] { body }} arm of a {@link Stmt.Match}. */
public record MatchArm(MatchPattern pattern, @Nullable Expr guard, ImmutableList<Stmt> body) {

  /** Returns a copy of this arm with the given body. */
  public MatchArm withBody(ImmutableList<Stmt> newBody) {
    return new MatchArm(pattern, guard, newBody);
  }
}
