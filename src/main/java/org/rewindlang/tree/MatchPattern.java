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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** The pattern of a {@link MatchArm}. */
public sealed interface MatchPattern {

  /** {@code _}: matches anything and binds nothing. */
  record Wildcard() implements MatchPattern {}

  /** A bare name: matches anything and binds it to the subject. */
  record Capture(String name) implements MatchPattern {}

  /** Matches subjects equal (by Rewind equality) to the literal's value. */
  record Constant(Expr.Literal literal) implements MatchPattern {}

  /** {@code p1 | p2 | ...}: matches if any alternative matches, tried left to right. */
  record Alternatives(ImmutableList<MatchPattern> alternatives) implements MatchPattern {
    public Alternatives {
      Preconditions.checkArgument(alternatives.size() >= 2);
    }
  }
}
