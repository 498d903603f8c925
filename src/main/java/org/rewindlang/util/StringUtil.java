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

package org.rewindlang.util;

import java.util.List;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Static-only class with methods for joining, escaping, and unescaping strings. */
public class StringUtil {

  private StringUtil() {}

  /**
   * Formats each element of {@code elements} with {@code format}, separates them with {@code ", "},
   * and adds the given prefix and suffix.
   */
  public static <T> String joinElements(
      String prefix, String suffix, List<T> elements, Function<? super T, String> format) {
    return elements.stream().map(format).collect(Collectors.joining(", ", prefix, suffix));
  }

  /**
   * Given a (quoted) Rewind string literal, returns the corresponding Java string.
   *
   * <p>Caller is responsible for ensuring that the literal is well formed, i.e. that it begins and
   * ends with {@code "} and that any {@code \} characters are part of a valid escape sequence. The
   * lexer only produces STRING tokens that satisfy this.
   */
  public static String unescape(String s) {
    // Drop the beginning and ending '"'.
    s = s.substring(1, s.length() - 1);
    int escape = s.indexOf('\\');
    if (escape < 0) {
      return s;
    }
    StringBuilder result = new StringBuilder(s.length() - 1);
    int next = 0;
    for (; ; ) {
      result.append(s, next, escape);
      char c = s.charAt(escape + 1);
      next = escape + 2;
      switch (c) {
        case '"', '\'', '\\' -> result.append(c);
        case 'b' -> result.append('\b');
        case 't' -> result.append('\t');
        case 'n' -> result.append('\n');
        case 'f' -> result.append('\f');
        case 'r' -> result.append('\r');
        case 'u' -> {
          result.appendCodePoint(Integer.parseUnsignedInt(s.substring(next, next + 4), 16));
          next += 4;
        }
        default -> throw new AssertionError("Bad escape: \\" + c);
      }
      escape = s.indexOf('\\', next);
      if (escape < 0) {
        return result.append(s, next, s.length()).toString();
      }
    }
  }

  private static final Pattern NEEDS_ESCAPE = Pattern.compile("[\"\b\t\n\f\r\\\\]");

  // The results are Matcher replacement strings, so backslashes are doubled once more.
  private static String escapeChar(MatchResult mr, String s) {
    return switch (s.charAt(mr.start())) {
      case '\"' -> "\\\\\"";
      case '\\' -> "\\\\\\\\";
      case '\b' -> "\\\\b";
      case '\t' -> "\\\\t";
      case '\n' -> "\\\\n";
      case '\f' -> "\\\\f";
      case '\r' -> "\\\\r";
      default -> throw new AssertionError();
    };
  }

  /** Given a string, returns an equivalent quoted Rewind string literal. */
  public static String escape(String s) {
    Matcher m = NEEDS_ESCAPE.matcher(s);
    String escaped = m.replaceAll(mr -> escapeChar(mr, s));
    return "\"" + escaped + "\"";
  }

  /** Returns {@code "s"} unless {@code count} is 1. */
  public static String plural(long count) {
    return count == 1 ? "" : "s";
  }
}
