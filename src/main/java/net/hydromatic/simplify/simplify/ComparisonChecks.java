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
package net.hydromatic.simplify.simplify;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Op;

/** Rules for the comparison operators "==", "/=", "&lt;", "&gt;",
 * "&lt;=" and "&gt;=". */
final class ComparisonChecks {
  private ComparisonChecks() {}

  private static final List<String> BOOLEAN_DETAILS =
      ImmutableList.of("The result of the expression is the same with or "
          + "without the comparison.");
  private static final List<String> NEGATION_DETAILS =
      ImmutableList.of("Both sides are negated using `not`, so both "
          + "negations can be removed.");
  private static final List<String> SAME_DETAILS =
      ImmutableList.of("Both sides of the comparison always have the same "
          + "value.");
  private static final List<String> DIFFERENT_DETAILS =
      ImmutableList.of("The two sides of the comparison always have "
          + "different values.");
  private static final List<String> LITERAL_DETAILS =
      ImmutableList.of("Both sides are numeric literals, so the result of "
          + "the comparison is known.");

  /** Simplifies "a == b" and "a /= b". */
  static List<Finding> equality(Ast.Exp exp, Context cx) {
    final Ast.InfixCall call = (Ast.InfixCall) exp;
    final boolean eq = exp.op == Op.EQ;

    // "x == True" and "x /= False" become "x"
    final Boolean b0 = Normalize.booleanValue(call.a0, cx.resolution);
    final Boolean b1 = Normalize.booleanValue(call.a1, cx.resolution);
    if (b1 != null && b1 == eq && b0 == null) {
      return ImmutableList.of(
          cx.replaceBy("Unnecessary comparison with boolean",
              BOOLEAN_DETAILS, call.a0));
    }
    if (b0 != null && b0 == eq && b1 == null) {
      return ImmutableList.of(
          cx.replaceBy("Unnecessary comparison with boolean",
              BOOLEAN_DETAILS, call.a1));
    }

    // "not a == not b" becomes "a == b"
    final Ast.Exp n0 = cx.negated(call.a0);
    final Ast.Exp n1 = cx.negated(call.a1);
    if (n0 != null && n1 != null) {
      return ImmutableList.of(
          cx.finding("Unnecessary negation on both sides", NEGATION_DETAILS,
              ImmutableList.<Edit>builder()
                  .addAll(
                      Context.replaceBy(call.a0, 0, exp.op.left, n0))
                  .addAll(
                      Context.replaceBy(call.a1, exp.op.right, 0, n1))
                  .build()));
    }

    switch (cx.equivalence.compare(call.a0, call.a1)) {
      case EQUAL:
        return ImmutableList.of(always(cx, eq, SAME_DETAILS));
      case NOT_EQUAL:
        return ImmutableList.of(always(cx, !eq, DIFFERENT_DETAILS));
      default:
        return ImmutableList.of();
    }
  }

  private static Finding always(Context cx, boolean b,
      List<String> details) {
    final String value = b ? "True" : "False";
    return cx.replaceByText("Condition is always " + value, details,
        cx.qualify("Basics", value), Op.ID);
  }

  /** Simplifies "a &lt; b", "a &gt; b", "a &lt;= b" and "a &gt;= b" if
   * both sides are numeric literals. */
  static List<Finding> ordering(Ast.Exp exp, Context cx) {
    final Ast.InfixCall call = (Ast.InfixCall) exp;
    final BigDecimal n0 = Equivalence.number(call.a0);
    final BigDecimal n1 = Equivalence.number(call.a1);
    if (n0 == null || n1 == null) {
      return ImmutableList.of();
    }
    final int c = n0.compareTo(n1);
    final boolean b;
    switch (exp.op) {
      case LT:
        b = c < 0;
        break;
      case GT:
        b = c > 0;
        break;
      case LE:
        b = c <= 0;
        break;
      default:
        b = c >= 0;
        break;
    }
    final String value = b ? "True" : "False";
    return ImmutableList.of(
        cx.replaceByText("Comparison is always " + value, LITERAL_DETAILS,
            cx.qualify("Basics", value), Op.ID));
  }
}

// End ComparisonChecks.java
