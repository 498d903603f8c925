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

package org.rewindlang.iter;

import java.util.NoSuchElementException;

/** Thrown by {@link IterationWrapper#advance} when the sequence has no more elements. */
public class ExhaustedIterationException extends NoSuchElementException {

  ExhaustedIterationException(String factoryName, long stepCount) {
    super(String.format("%s is exhausted after %d steps", factoryName, stepCount));
  }
}
