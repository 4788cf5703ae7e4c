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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.simplify.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Lexical token. */
public class Token {
  /** Kind of token. */
  public enum Kind {
    /** Identifier starting with a lower-case letter, possibly qualified,
     * e.g. "x", "List.map". */
    LOWER_ID,
    /** Identifier starting with an upper-case letter, possibly qualified,
     * e.g. "Just", "Maybe.Just", "Json.Decode". */
    UPPER_ID,
    INT,
    FLOAT,
    STRING,
    CHAR,
    /** Infix operator, e.g. "+", "|>", "::". */
    OPERATOR,
    /** Field access that immediately follows an expression, ".field" in
     * "r.field". */
    ACCESS,
    /** Record access function, ".field" in "List.map .field". */
    ACCESS_FN,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    COMMA,
    EQUALS,
    ARROW,
    COLON,
    BAR,
    BACKSLASH,
    DOTDOT,
    UNDERSCORE,
    KEYWORD,
    EOF
  }

  public final Kind kind;
  /** Source text of the token. */
  public final String text;
  /** Module qualifier of an identifier; empty if not qualified. */
  public final List<String> moduleName;
  /** Unqualified name of an identifier, field name of an access; otherwise
   * the same as {@link #text}. */
  public final String name;
  /** Value of a literal: a {@link java.math.BigDecimal} for numbers, a
   * {@link String} for strings and chars. */
  public final @Nullable Object value;
  public final Pos pos;
  /** Whether this is the first token on its line. */
  public final boolean firstOnLine;
  /** Whether white space or a comment precedes this token. */
  public final boolean spaceBefore;

  Token(Kind kind, String text, ImmutableList<String> moduleName, String name,
      @Nullable Object value, Pos pos, boolean firstOnLine,
      boolean spaceBefore) {
    this.kind = requireNonNull(kind);
    this.text = requireNonNull(text);
    this.moduleName = requireNonNull(moduleName);
    this.name = requireNonNull(name);
    this.value = value;
    this.pos = requireNonNull(pos);
    this.firstOnLine = firstOnLine;
    this.spaceBefore = spaceBefore;
  }

  public int column() {
    return pos.startColumn;
  }

  /** Returns whether this token is a given keyword. */
  public boolean isKeyword(String keyword) {
    return kind == Kind.KEYWORD && text.equals(keyword);
  }

  /** Returns whether this token is a given operator. */
  public boolean isOperator(String symbol) {
    return kind == Kind.OPERATOR && text.equals(symbol);
  }

  @Override public String toString() {
    return kind + "(" + text + ")@" + pos;
  }
}

// End Token.java
