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
import org.checkerframework.checker.nullness.qual.Nullable;

/** Rules for arithmetic. */
final class NumberChecks {
  private NumberChecks() {}

  private static final List<String> IDENTITY_DETAILS =
      ImmutableList.of("This operation does not change the value, so it can "
          + "be removed.");
  private static final List<String> ZERO_DETAILS =
      ImmutableList.of("Multiplying by 0 always gives 0.");
  private static final List<String> NEGATE_DETAILS =
      ImmutableList.of("Subtracting from 0 is the same as negating the "
          + "value.");

  /** Returns whether an expression is a numeric literal with a given
   * value. */
  private static boolean is(Ast.Exp exp, int value) {
    final Ast.Exp e = Normalize.unwrapParens(exp);
    return e instanceof Ast.Literal
        && ((Ast.Literal) e).isNumber()
        && ((BigDecimal) ((Ast.Literal) e).value)
            .compareTo(BigDecimal.valueOf(value)) == 0;
  }

  /** Simplifies "n + 0" and "0 + n". */
  static List<Finding> plus(Ast.Exp exp, Context cx) {
    final Ast.InfixCall call = (Ast.InfixCall) exp;
    if (is(call.a1, 0)) {
      return ImmutableList.of(
          cx.replaceBy("Unnecessary addition with 0", IDENTITY_DETAILS,
              call.a0));
    }
    if (is(call.a0, 0)) {
      return ImmutableList.of(
          cx.replaceBy("Unnecessary addition with 0", IDENTITY_DETAILS,
              call.a1));
    }
    return ImmutableList.of();
  }

  /** Simplifies "n - 0" and "0 - n". */
  static List<Finding> minus(Ast.Exp exp, Context cx) {
    final Ast.InfixCall call = (Ast.InfixCall) exp;
    if (is(call.a1, 0)) {
      return ImmutableList.of(
          cx.replaceBy("Unnecessary subtraction with 0", IDENTITY_DETAILS,
              call.a0));
    }
    if (is(call.a0, 0)) {
      final Ast.Exp n = Normalize.unwrapParens(call.a1);
      return ImmutableList.of(
          cx.replaceByText("Unnecessary subtracting from 0", NEGATE_DETAILS,
              "-" + cx.textIn(n, Op.NEGATE.right, Op.NEGATE.right),
              Op.NEGATE));
    }
    return ImmutableList.of();
  }

  /** Simplifies "n * 1", "1 * n", "n * 0" and "0 * n". */
  static List<Finding> times(Ast.Exp exp, Context cx) {
    final Ast.InfixCall call = (Ast.InfixCall) exp;
    if (is(call.a1, 1)) {
      return ImmutableList.of(
          cx.replaceBy("Unnecessary multiplication by 1", IDENTITY_DETAILS,
              call.a0));
    }
    if (is(call.a0, 1)) {
      return ImmutableList.of(
          cx.replaceBy("Unnecessary multiplication by 1", IDENTITY_DETAILS,
              call.a1));
    }
    if (is(call.a1, 0)) {
      return ImmutableList.of(
          cx.replaceBy("Multiplication by 0 should be replaced",
              ZERO_DETAILS, call.a1));
    }
    if (is(call.a0, 0)) {
      return ImmutableList.of(
          cx.replaceBy("Multiplication by 0 should be replaced",
              ZERO_DETAILS, call.a0));
    }
    return ImmutableList.of();
  }

  /** Simplifies "n / 1" and "n // 1". */
  static List<Finding> divide(Ast.Exp exp, Context cx) {
    final Ast.InfixCall call = (Ast.InfixCall) exp;
    if (is(call.a1, 1)) {
      return ImmutableList.of(
          cx.replaceBy("Unnecessary division by 1", IDENTITY_DETAILS,
              call.a0));
    }
    return ImmutableList.of();
  }

  /** Simplifies "-(-n)". */
  static List<Finding> negate(Ast.Exp exp, Context cx) {
    final Ast.Exp inner = Normalize.unwrapParens(((Ast.Negate) exp).exp);
    if (inner instanceof Ast.Negate) {
      return ImmutableList.of(
          cx.replaceBy("Unnecessary double negation",
              BooleanChecks.DOUBLE_NEGATION_DETAILS,
              ((Ast.Negate) inner).exp));
    }
    return ImmutableList.of();
  }

  /** Simplifies "negate (negate n)". */
  static @Nullable Finding negateCall(CallView call, Context cx) {
    if (call.argCount() != 1) {
      return null;
    }
    final Ast.Exp arg = Normalize.unwrapParens(call.arg(0));
    final CallView inner = CallView.of(arg);
    if (inner != null
        && inner.argCount() == 1
        && cx.resolves(inner.fn, "Basics", "negate")) {
      return cx.replaceBy("Unnecessary double negation",
          BooleanChecks.DOUBLE_NEGATION_DETAILS, inner.arg(0));
    }
    if (arg instanceof Ast.Negate) {
      return cx.replaceBy("Unnecessary double negation",
          BooleanChecks.DOUBLE_NEGATION_DETAILS, ((Ast.Negate) arg).exp);
    }
    return null;
  }
}

// End NumberChecks.java
