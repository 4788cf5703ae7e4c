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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.math.BigInteger;
import net.hydromatic.simplify.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts source text into a list of {@link Token}s.
 *
 * <p>Each token records its position (1-based line and column, end column
 * exclusive), whether it is the first token on its line, and whether white
 * space precedes it. The parser uses these to apply layout rules and to
 * tell "r.field" (access) from "f .field" (access function).
 */
public class Lexer {
  static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of("if", "then", "else", "case", "of", "let", "in",
          "module", "exposing", "import", "as", "type", "alias", "port");

  private static final String OPERATOR_CHARS = "+-/*=.<>:&|^?%!";

  private final String s;
  private final String file;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
  private int i = 0;
  private int line = 1;
  private int lineStart = 0;
  private boolean firstOnLine = true;
  private boolean spaceBefore = true;
  private Token.@Nullable Kind previousKind;

  // state at the start of the current token
  private int tokenStart;
  private int tokenLine;
  private int tokenColumn;

  public Lexer(String s, String file) {
    this.s = s;
    this.file = file;
  }

  /** Converts a string into tokens. The last token is always
   * {@link Token.Kind#EOF}. */
  public static ImmutableList<Token> tokenize(String s, String file) {
    return new Lexer(s, file).tokenize();
  }

  public ImmutableList<Token> tokenize() {
    for (;;) {
      skipSpaceAndComments();
      start();
      if (i >= s.length()) {
        add(Token.Kind.EOF, null);
        return tokens.build();
      }
      next();
    }
  }

  private void next() {
    final char c = s.charAt(i);
    switch (c) {
      case '(':
        advance(1);
        add(Token.Kind.LPAREN, null);
        return;
      case ')':
        advance(1);
        add(Token.Kind.RPAREN, null);
        return;
      case '[':
        advance(1);
        add(Token.Kind.LBRACKET, null);
        return;
      case ']':
        advance(1);
        add(Token.Kind.RBRACKET, null);
        return;
      case '{':
        advance(1);
        add(Token.Kind.LBRACE, null);
        return;
      case '}':
        advance(1);
        add(Token.Kind.RBRACE, null);
        return;
      case ',':
        advance(1);
        add(Token.Kind.COMMA, null);
        return;
      case '\\':
        advance(1);
        add(Token.Kind.BACKSLASH, null);
        return;
      case '"':
        string();
        return;
      case '\'':
        charLiteral();
        return;
      case '_':
        if (!isIdentifierPart(charAt(i + 1))) {
          advance(1);
          add(Token.Kind.UNDERSCORE, null);
          return;
        }
        identifier();
        return;
      default:
        break;
    }
    if (c == '.' && Character.isLowerCase(charAt(i + 1))) {
      access();
    } else if (Character.isDigit(c)) {
      number();
    } else if (Character.isLetter(c)) {
      identifier();
    } else if (OPERATOR_CHARS.indexOf(c) >= 0) {
      operator();
    } else {
      advance(1);
      throw error("unexpected character '" + c + "'");
    }
  }

  private void access() {
    final Token.Kind kind;
    if (!spaceBefore
        && (previousKind == Token.Kind.LOWER_ID
            || previousKind == Token.Kind.RPAREN
            || previousKind == Token.Kind.RBRACE
            || previousKind == Token.Kind.ACCESS)) {
      kind = Token.Kind.ACCESS;
    } else {
      kind = Token.Kind.ACCESS_FN;
    }
    advance(1);
    final int nameStart = i;
    while (isIdentifierPart(charAt(i))) {
      advance(1);
    }
    add(kind, ImmutableList.of(), s.substring(nameStart, i), null);
  }

  private void identifier() {
    final ImmutableList.Builder<String> moduleName = ImmutableList.builder();
    String name = word();
    while (Character.isUpperCase(name.charAt(0))
        && charAt(i) == '.'
        && Character.isLetter(charAt(i + 1))) {
      moduleName.add(name);
      advance(1);
      name = word();
    }
    final ImmutableList<String> segments = moduleName.build();
    if (segments.isEmpty() && KEYWORDS.contains(name)) {
      add(Token.Kind.KEYWORD, null);
    } else if (Character.isUpperCase(name.charAt(0))) {
      add(Token.Kind.UPPER_ID, segments, name, null);
    } else {
      add(Token.Kind.LOWER_ID, segments, name, null);
    }
  }

  private String word() {
    final int start = i;
    while (isIdentifierPart(charAt(i))) {
      advance(1);
    }
    return s.substring(start, i);
  }

  private void number() {
    if (charAt(i) == '0' && (charAt(i + 1) == 'x' || charAt(i + 1) == 'X')) {
      advance(2);
      final int start = i;
      while (Character.digit(charAt(i), 16) >= 0) {
        advance(1);
      }
      if (start == i) {
        throw error("invalid hexadecimal literal");
      }
      final BigInteger value = new BigInteger(s.substring(start, i), 16);
      add(Token.Kind.INT, new BigDecimal(value));
      return;
    }
    boolean isFloat = false;
    digits();
    if (charAt(i) == '.' && Character.isDigit(charAt(i + 1))) {
      isFloat = true;
      advance(1);
      digits();
    }
    if (charAt(i) == 'e' || charAt(i) == 'E') {
      int j = i + 1;
      if (charAt(j) == '+' || charAt(j) == '-') {
        ++j;
      }
      if (Character.isDigit(charAt(j))) {
        isFloat = true;
        advance(j - i);
        digits();
      }
    }
    final BigDecimal value = new BigDecimal(s.substring(tokenStart, i));
    add(isFloat ? Token.Kind.FLOAT : Token.Kind.INT, value);
  }

  private void digits() {
    while (Character.isDigit(charAt(i))) {
      advance(1);
    }
  }

  private void string() {
    final boolean triple = s.startsWith("\"\"\"", i);
    advance(triple ? 3 : 1);
    for (;;) {
      if (i >= s.length()) {
        throw error("unterminated string literal");
      }
      final char c = s.charAt(i);
      if (c == '\\') {
        advance(2);
      } else if (triple && s.startsWith("\"\"\"", i)) {
        advance(3);
        break;
      } else if (!triple && c == '"') {
        advance(1);
        break;
      } else if (!triple && c == '\n') {
        throw error("unterminated string literal");
      } else {
        advance(1);
      }
    }
    final String text = s.substring(tokenStart, i);
    add(Token.Kind.STRING, unquote(text, false));
  }

  private void charLiteral() {
    advance(1);
    for (;;) {
      if (i >= s.length() || s.charAt(i) == '\n') {
        throw error("unterminated char literal");
      }
      final char c = s.charAt(i);
      if (c == '\\') {
        advance(2);
      } else if (c == '\'') {
        advance(1);
        break;
      } else {
        advance(1);
      }
    }
    final String text = s.substring(tokenStart, i);
    add(Token.Kind.CHAR, unquote(text, true));
  }

  private String unquote(String text, boolean isChar) {
    try {
      return isChar
          ? Parsers.unquoteCharLiteral(text)
          : Parsers.unquoteString(text);
    } catch (IllegalArgumentException e) {
      throw error(e.getMessage());
    }
  }

  private void operator() {
    while (OPERATOR_CHARS.indexOf(charAt(i)) >= 0) {
      advance(1);
    }
    switch (s.substring(tokenStart, i)) {
      case "=":
        add(Token.Kind.EQUALS, null);
        return;
      case "->":
        add(Token.Kind.ARROW, null);
        return;
      case ":":
        add(Token.Kind.COLON, null);
        return;
      case "|":
        add(Token.Kind.BAR, null);
        return;
      case "..":
        add(Token.Kind.DOTDOT, null);
        return;
      default:
        add(Token.Kind.OPERATOR, null);
    }
  }

  private void skipSpaceAndComments() {
    for (;;) {
      if (i >= s.length()) {
        return;
      }
      final char c = s.charAt(i);
      if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
        advance(1);
        spaceBefore = true;
      } else if (s.startsWith("--", i)) {
        while (i < s.length() && s.charAt(i) != '\n') {
          advance(1);
        }
        spaceBefore = true;
      } else if (s.startsWith("{-", i)) {
        start();
        int depth = 0;
        do {
          if (i >= s.length()) {
            throw error("unterminated comment");
          }
          if (s.startsWith("{-", i)) {
            ++depth;
            advance(2);
          } else if (s.startsWith("-}", i)) {
            --depth;
            advance(2);
          } else {
            advance(1);
          }
        } while (depth > 0);
        spaceBefore = true;
      } else {
        return;
      }
    }
  }

  /** Advances {@code n} characters, keeping track of line breaks. */
  private void advance(int n) {
    for (int j = 0; j < n && i < s.length(); j++) {
      if (s.charAt(i) == '\n') {
        ++line;
        lineStart = i + 1;
        firstOnLine = true;
      }
      ++i;
    }
  }

  private char charAt(int j) {
    return j < s.length() ? s.charAt(j) : '\0';
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private void start() {
    tokenStart = i;
    tokenLine = line;
    tokenColumn = i - lineStart + 1;
  }

  private void add(Token.Kind kind, @Nullable Object value) {
    final String text = s.substring(tokenStart, i);
    add(kind, ImmutableList.of(), text, value);
  }

  private void add(Token.Kind kind, ImmutableList<String> moduleName,
      String name, @Nullable Object value) {
    final String text = s.substring(tokenStart, i);
    final Pos pos =
        new Pos(file, tokenLine, tokenColumn, line, i - lineStart + 1);
    tokens.add(
        new Token(kind, text, moduleName, name, value, pos, firstOnLine,
            spaceBefore));
    previousKind = kind;
    firstOnLine = false;
    spaceBefore = false;
  }

  private SimplifyParseException error(String message) {
    return new SimplifyParseException(message,
        new Pos(file, tokenLine, tokenColumn, line, i - lineStart + 1));
  }
}

// End Lexer.java
