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

/**
 * Thrown when executing Rewind code fails: an undefined name, a bad operand, a call with the wrong
 * arguments, or a call chain deeper than the configured limit.
 */
public class RuntimeError extends RuntimeException {

  public RuntimeError(String message) {
    super(message);
  }

  public RuntimeError(String message, Throwable cause) {
    super(message, cause);
  }

  static RuntimeError format(String format, Object... args) {
    return new RuntimeError(String.format(format, args));
  }
}
