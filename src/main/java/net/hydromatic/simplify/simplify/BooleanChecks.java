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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Rules for boolean operators and {@code not}. */
final class BooleanChecks {
  private BooleanChecks() {}

  static final List<String> DOUBLE_NEGATION_DETAILS =
      ImmutableList.of("Negating a value twice gives back the original "
          + "value.");
  private static final List<String> UNNECESSARY_DETAILS =
      ImmutableList.of("This part of the expression does not change the "
          + "result and can be removed.");
  private static final List<String> ALWAYS_DETAILS =
      ImmutableList.of("The right side of the expression will never be "
          + "evaluated.");
  private static final List<String> NOT_DETAILS =
      ImmutableList.of("The negation of a literal boolean can be replaced by "
          + "the opposite literal.");

  /** Simplifies "a || b". */
  static List<Finding> or(Ast.Exp exp, Context cx) {
    return booleanOperator((Ast.InfixCall) exp, cx, true);
  }

  /** Simplifies "a &amp;&amp; b". */
  static List<Finding> and(Ast.Exp exp, Context cx) {
    return booleanOperator((Ast.InfixCall) exp, cx, false);
  }

  /** Simplifies "a || b" (if {@code or}) or "a &amp;&amp; b".
   *
   * <p>A literal that makes the result constant ("True" for "||", "False"
   * for "&amp;&amp;") absorbs the other side; a literal that has no effect
   * ("False" for "||", "True" for "&amp;&amp;") is removed. */
  private static List<Finding> booleanOperator(Ast.InfixCall call,
      Context cx, boolean or) {
    final Boolean b0 = Normalize.booleanValue(call.a0, cx.resolution);
    final Boolean b1 = Normalize.booleanValue(call.a1, cx.resolution);
    if (b0 != null && b0 == or) {
      return ImmutableList.of(
          cx.replaceBy("Comparison is always " + (or ? "True" : "False"),
              ALWAYS_DETAILS, call.a0));
    }
    if (b1 != null && b1 == or) {
      return ImmutableList.of(
          cx.replaceBy("Part of the expression is unnecessary",
              UNNECESSARY_DETAILS, call.a1));
    }
    final String neutral = or ? "`|| False`" : "`&& True`";
    if (b0 != null) {
      return ImmutableList.of(
          cx.replaceBy("Unnecessary check for " + neutral,
              UNNECESSARY_DETAILS, call.a1));
    }
    if (b1 != null) {
      return ImmutableList.of(
          cx.replaceBy("Unnecessary check for " + neutral,
              UNNECESSARY_DETAILS, call.a0));
    }
    final Finding duplicate = duplicate(call, cx);
    return duplicate == null ? ImmutableList.of()
        : ImmutableList.of(duplicate);
  }

  /** Finds an operand that repeats an earlier operand in a chain such as
   * "a || b || a", and removes it with the operator before it.
   *
   * <p>Only looks at the root of the chain, so that each chain is reported
   * once. */
  private static @Nullable Finding duplicate(Ast.InfixCall call,
      Context cx) {
    if (cx.parent != null && cx.parent.op == call.op) {
      return null;
    }
    final List<Ast.Exp> operands = new ArrayList<>();
    flatten(call, call.op, operands);
    for (int j = 1; j < operands.size(); j++) {
      for (int i = 0; i < j; i++) {
        if (cx.sameValue(operands.get(i), operands.get(j))) {
          final Ast.Exp duplicate = operands.get(j);
          return cx.finding("Part of the expression is unnecessary",
              UNNECESSARY_DETAILS, duplicate.pos,
              ImmutableList.of(
                  Edit.removeRange(
                      Fixes.range(operands.get(j - 1).pos.end(),
                          duplicate.pos))));
        }
      }
    }
    return null;
  }

  private static void flatten(Ast.Exp exp, Op op, List<Ast.Exp> operands) {
    if (exp.op == op) {
      final Ast.InfixCall call = (Ast.InfixCall) exp;
      flatten(call.a0, op, operands);
      flatten(call.a1, op, operands);
    } else {
      operands.add(exp);
    }
  }

  /** Simplifies "not True", "not False" and "not (not x)". */
  static @Nullable Finding not(CallView call, Context cx) {
    if (call.argCount() != 1) {
      return null;
    }
    final Ast.Exp arg = call.arg(0);
    final Boolean b = Normalize.booleanValue(arg, cx.resolution);
    if (b != null) {
      final String result = b ? "False" : "True";
      return cx.replaceByText("Expression is equal to " + result,
          NOT_DETAILS, cx.qualify("Basics", result), Op.ID);
    }
    final Ast.Exp negated = cx.negated(arg);
    if (negated != null) {
      return cx.replaceBy("Unnecessary double negation",
          DOUBLE_NEGATION_DETAILS, negated);
    }
    return null;
  }
}

// End BooleanChecks.java
