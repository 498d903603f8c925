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

import java.nio.charset.StandardCharsets;

/**
 * Converts {@link WrapperState}s to and from a portable text form. For every state {@code s} that
 * {@link #encode} accepts, {@code decode(encode(s))} equals {@code s}.
 */
public interface StateSerializer {

  String encode(WrapperState state) throws SerializationException;

  WrapperState decode(String encoded) throws SerializationException;

  /** The UTF-8 bytes of {@link #encode}. */
  default byte[] encodeBytes(WrapperState state) throws SerializationException {
    return encode(state).getBytes(StandardCharsets.UTF_8);
  }

  default WrapperState decodeBytes(byte[] encoded) throws SerializationException {
    return decode(new String(encoded, StandardCharsets.UTF_8));
  }
}
