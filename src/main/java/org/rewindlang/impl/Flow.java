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

import org.jspecify.annotations.Nullable;
import org.rewindlang.tree.None;

/**
 * How execution of a statement finished. Anything but {@link Kind#NORMAL} stops execution of the
 * enclosing block and is handled by the nearest loop (BREAK, CONTINUE) or function (RETURN, YIELD).
 */
record Flow(Kind kind, @Nullable Object value) {

  enum Kind {
    NORMAL,
    BREAK,
    CONTINUE,
    RETURN,
    /** Only returned from the yield a generator run is waiting for. */
    YIELD
  }

  static final Flow NORMAL = new Flow(Kind.NORMAL, null);
  static final Flow BREAK = new Flow(Kind.BREAK, null);
  static final Flow CONTINUE = new Flow(Kind.CONTINUE, null);
  static final Flow END = new Flow(Kind.RETURN, None.NONE);

  static Flow returning(Object value) {
    return new Flow(Kind.RETURN, value);
  }

  static Flow yielding(Object value) {
    return new Flow(Kind.YIELD, value);
  }
}
