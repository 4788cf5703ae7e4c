/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.simplify.parse;

import static com.google.common.base.Preconditions.checkArgument;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /**
   * Given quoted string {@code "abc"} returns {@code abc}; {@code "\t"} returns
   * the tab character; <code>"&#92;u{41}"</code> returns "A". Also accepts a
   * triple-quoted string, {@code """abc"""}.
   */
  public static String unquoteString(String s) {
    final int quotes = s.startsWith("\"\"\"") && s.length() >= 6 ? 3 : 1;
    checkArgument(s.length() >= 2 * quotes);
    checkArgument(s.charAt(0) == '"');
    checkArgument(s.charAt(s.length() - 1) == '"');
    s = s.substring(quotes, s.length() - quotes);
    if (!s.contains("\\")) {
      // There are no escaped characters. Take the quick route.
      return s;
    }
    final StringParser p = new StringParser(s);
    final StringBuilder b = new StringBuilder();
    while (p.i < p.s.length()) {
      b.appendCodePoint(p.parseChar());
    }
    return b.toString();
  }

  /** Given quoted char literal {@code 'a'} returns {@code a}. The result is
   * a string because the character may be outside the basic plane. */
  public static String unquoteCharLiteral(String s) {
    checkArgument(s.length() >= 3);
    checkArgument(s.charAt(0) == '\'');
    checkArgument(s.charAt(s.length() - 1) == '\'');
    s = s.substring(1, s.length() - 1);
    final StringParser p = new StringParser(s);
    final int c = p.parseChar();
    if (p.i != s.length()) {
      throw new IllegalArgumentException(
          "character literal not length 1");
    }
    return new String(Character.toChars(c));
  }

  /** Parses characters in a string or char literal. */
  static class StringParser {
    final String s;
    int i = 0;

    StringParser(String s) {
      this.s = s;
    }

    /**
     * Parses a single character in a string literal or character literal,
     * and returns its code point. Advances {@code i} to the next character
     * in the string.
     */
    int parseChar() {
      final int c = s.codePointAt(i);
      i += Character.charCount(c);
      if (c != '\\') {
        return c;
      }
      if (i >= s.length()) {
        throw new IllegalArgumentException(
            "illegal escape; no character after \\");
      }
      final char c2 = s.charAt(i++);
      switch (c2) {
        case '"':
        case '\'':
        case '\\':
          return c2;

        case 't':
          return '\t';

        case 'n':
          return '\n';

        case 'r':
          return '\r';

        case 'u':
          // Unicode escape, "\\u{1F600}"
          final int end = s.indexOf('}', i);
          if (i >= s.length() || s.charAt(i) != '{' || end < 0) {
            throw new IllegalArgumentException(
                "illegal unicode escape; expected \\u{...}");
          }
          final int codePoint = Integer.parseInt(s.substring(i + 1, end), 16);
          i = end + 1;
          return codePoint;

        default:
          throw new IllegalArgumentException("illegal escape \\" + c2);
      }
    }
  }
}

// End Parsers.java
