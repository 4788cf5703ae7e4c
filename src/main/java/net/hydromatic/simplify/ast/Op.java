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
package net.hydromatic.simplify.ast;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID(true),
  OP_REF(true),
  RECORD_ACCESS_FN(true),

  // literals
  INT_LITERAL(true),
  FLOAT_LITERAL(true),
  STRING_LITERAL(true),
  CHAR_LITERAL(true),
  UNIT_LITERAL(true),

  // patterns
  ID_PAT(true),
  WILDCARD_PAT(true),
  UNIT_PAT(true),
  INT_LITERAL_PAT(true),
  FLOAT_LITERAL_PAT(true),
  STRING_LITERAL_PAT(true),
  CHAR_LITERAL_PAT(true),
  CON_PAT(" ", 20, 21),
  TUPLE_PAT(true),
  RECORD_PAT(true),
  LIST_PAT(true),
  CONS_PAT(" :: ", 11, 10),
  AS_PAT(" as ", 0, 0),
  PARENS_PAT(true),

  // declarations and other non-expression nodes
  MODULE,
  IMPORT,
  TYPE_DECL,
  ALIAS_DECL,
  FUN_DECL(" = "),
  DESTRUCT_DECL(" = "),
  SETTER(" = "),
  MATCH(" -> "),

  // value constructors
  PARENS(true),
  TUPLE(true),
  LIST(true),
  RECORD(true),
  RECORD_UPDATE(true),
  RECORD_ACCESS(true),

  // expressions that extend as far to the right as possible
  FN(" -> ", 0, 0),
  IF(null, 0, 0),
  CASE(null, 0, 0),
  LET(null, 0, 0),

  /** Function application; binds tighter than any infix operator. */
  APPLY(" ", 20, 21),
  /** Unary minus. Its operand must be atomic. */
  NEGATE("-", 20, 22),

  // infix operators, with the precedence and associativity of the
  // core library
  PIPE_LEFT(" <| ", 0, false),
  PIPE_RIGHT(" |> ", 0),
  OR(" || ", 2, false),
  AND(" && ", 3, false),
  EQ(" == ", 4),
  NE(" /= ", 4),
  LT(" < ", 4),
  GT(" > ", 4),
  LE(" <= ", 4),
  GE(" >= ", 4),
  APPEND(" ++ ", 5, false),
  CONS(" :: ", 5, false),
  KEEPER(" |= ", 5),
  IGNORER(" |. ", 6),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  TIMES(" * ", 7),
  DIVIDE(" / ", 7),
  INT_DIVIDE(" // ", 7),
  SLASH(" </> ", 7, false),
  POWER(" ^ ", 8, false),
  COMPOSE_LEFT(" << ", 9),
  COMPOSE_RIGHT(" >> ", 9, false);

  /** Padded name, e.g. " + ". */
  public final @Nullable String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;
  /** Operator symbol, e.g. "+"; null if this is not an infix operator. */
  public final @Nullable String symbol;

  /** Infix operators, keyed by symbol. */
  public static final ImmutableMap<String, Op> BY_SYMBOL;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.symbol != null) {
        b.put(op.symbol, op);
      }
    }
    BY_SYMBOL = b.build();
  }

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 198, 199);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int precedence) {
    this(padded, precedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0),
        true);
  }

  Op(@Nullable String padded, int left, int right) {
    this(padded, left, right, false);
  }

  Op(@Nullable String padded, int left, int right, boolean infix) {
    this.padded = padded;
    this.left = left;
    this.right = right;
    this.symbol = infix && padded != null ? padded.trim() : null;
  }

  /** Returns whether this is an infix operator such as {@code +}. */
  public boolean isInfix() {
    return symbol != null;
  }

  /** Returns whether this is a pipe operator, {@code <|} or {@code |>}. */
  public boolean isPipe() {
    return this == PIPE_LEFT || this == PIPE_RIGHT;
  }

  /** Returns whether this is a composition operator, {@code <<} or
   * {@code >>}. */
  public boolean isComposition() {
    return this == COMPOSE_LEFT || this == COMPOSE_RIGHT;
  }

  /** Returns whether this operator compares two values of the same type. */
  public boolean isComparison() {
    switch (this) {
      case EQ:
      case NE:
      case LT:
      case GT:
      case LE:
      case GE:
        return true;
      default:
        return false;
    }
  }

  /** Converts the op of a literal expression to the corresponding op
   * of a pattern. */
  public Op toPat() {
    switch (this) {
      case INT_LITERAL:
        return INT_LITERAL_PAT;
      case FLOAT_LITERAL:
        return FLOAT_LITERAL_PAT;
      case STRING_LITERAL:
        return STRING_LITERAL_PAT;
      case CHAR_LITERAL:
        return CHAR_LITERAL_PAT;
      case UNIT_LITERAL:
        return UNIT_PAT;
      default:
        throw new AssertionError("unknown op " + this);
    }
  }
}

// End Op.java
