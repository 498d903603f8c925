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

/**
 * The Rewind {@code none} value. Rewind code never sees Java nulls; anything that would be null
 * (a bare {@code return}, a missing value from Java) is represented by {@link #NONE}, which also
 * lets it live in Guava's null-hostile immutable collections.
 */
public enum None {
  NONE;

  @Override
  public String toString() {
    return "none";
  }
}
