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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Rules for functions: {@code identity}, {@code always}, composition,
 * operators used as prefix functions, and lambdas applied to arguments. */
final class FunctionChecks {
  private FunctionChecks() {}

  private static final List<String> IDENTITY_DETAILS =
      ImmutableList.of("`identity` returns its argument unchanged, so the "
          + "call can be replaced by the argument.");
  private static final List<String> ALWAYS_DETAILS =
      ImmutableList.of("The second argument is ignored by `always`.");
  private static final List<String> ALWAYS_COMPOSITION_DETAILS =
      ImmutableList.of("The result of the first function is ignored by the "
          + "function that always returns the same value.");
  private static final List<String> PREFIX_DETAILS =
      ImmutableList.of("Operators are easier to read in infix form.");
  private static final List<String> UNIT_DETAILS =
      ImmutableList.of("The function takes a unit and is given a unit, so "
          + "both can be removed.");
  private static final List<String> WILDCARD_DETAILS =
      ImmutableList.of("The argument is ignored by the function, so it can "
          + "be removed along with the wildcard.");

  /** "identity x" becomes "x"; "identity f x" becomes "f x". */
  static @Nullable Finding identity(CallView call, Context cx) {
    if (call.argCount() == 1) {
      return cx.replaceBy("`identity` should be removed", IDENTITY_DETAILS,
          call.arg(0));
    }
    if (call.node instanceof Ast.Apply
        && ((Ast.Apply) call.node).fn == call.fn) {
      return cx.finding("`identity` should be removed", IDENTITY_DETAILS,
          ImmutableList.of(
              Edit.removeRange(call.fn.pos.upToStartOf(call.arg(0).pos))));
    }
    return null;
  }

  /** "always x y" becomes "x". */
  static @Nullable Finding always(CallView call, Context cx) {
    if (call.argCount() == 2) {
      return cx.replaceBy(
          "Expression can be replaced by the first argument given to "
              + "`always`",
          ALWAYS_DETAILS, call.arg(0));
    }
    return null;
  }

  /** Simplifies "f >> g" and "g << f". */
  static List<Finding> composition(Ast.Exp exp, Context cx) {
    final Ast.InfixCall call = (Ast.InfixCall) exp;
    final Ast.Exp first = exp.op == Op.COMPOSE_RIGHT ? call.a0 : call.a1;
    final Ast.Exp second = exp.op == Op.COMPOSE_RIGHT ? call.a1 : call.a0;
    if (Normalize.isIdentity(first, cx.resolution)) {
      return ImmutableList.of(
          cx.replaceBy("`identity` should be removed", IDENTITY_DETAILS,
              second));
    }
    if (Normalize.isIdentity(second, cx.resolution)) {
      return ImmutableList.of(
          cx.replaceBy("`identity` should be removed", IDENTITY_DETAILS,
              first));
    }
    if (Normalize.alwaysBody(second, cx.resolution) != null) {
      return ImmutableList.of(
          cx.replaceBy("Function composed with always will be ignored",
              ALWAYS_COMPOSITION_DETAILS, second));
    }
    for (String name : ImmutableList.of("not", "negate")) {
      if (cx.resolves(first, "Basics", name)
          && cx.resolves(second, "Basics", name)) {
        return ImmutableList.of(
            cx.replaceByText("Unnecessary double negation",
                BooleanChecks.DOUBLE_NEGATION_DETAILS,
                cx.qualify("Basics", "identity"), Op.ID));
      }
    }
    return ImmutableList.of();
  }

  /** "(+) a b" becomes "a + b". */
  static @Nullable Finding prefixOperator(CallView call, Context cx) {
    if (call.argCount() != 2) {
      return null;
    }
    final Op op = ((Ast.OpRef) call.fn).operator;
    final String text =
        cx.textIn(Normalize.unwrapParens(call.arg(0)), 0, op.left)
            + requireNonNull(op.padded)
            + cx.textIn(Normalize.unwrapParens(call.arg(1)), op.right, 0);
    final String symbol = requireNonNull(op.symbol);
    return cx.replaceByText(
        "Use the infix form (a " + symbol + " b) over the prefix form (("
            + symbol + ") a b)",
        PREFIX_DETAILS, text, op);
  }

  /** "(\() -> x) ()" becomes "x"; "(\_ y -> x) a" becomes "(\y -> x)". */
  static @Nullable Finding appliedLambda(CallView call, Context cx) {
    final Ast.Fn fn = (Ast.Fn) call.fn;
    final Ast.Pat pat = fn.pats.get(0);
    final String message;
    final List<String> details;
    if (pat.op == Op.UNIT_PAT
        && Normalize.unwrapParens(call.arg(0)).op == Op.UNIT_LITERAL) {
      message = "Unnecessary unit argument";
      details = UNIT_DETAILS;
    } else if (pat.op == Op.WILDCARD_PAT) {
      message = "Unnecessary wildcard argument";
      details = WILDCARD_DETAILS;
    } else {
      return null;
    }
    if (fn.pats.size() == 1 && call.argCount() == 1) {
      return cx.replaceBy(message, details, fn.exp);
    }
    if (!(call.node instanceof Ast.Apply)
        || Normalize.unwrapParens(((Ast.Apply) call.node).fn) != fn
        || fn.pats.size() == 1) {
      return null;
    }
    // Remove the first parameter and the first argument, keeping the
    // remaining parameters and arguments.
    final Ast.Apply apply = (Ast.Apply) call.node;
    final Edit removeArg = call.argCount() > 1
        ? Edit.removeRange(call.arg(0).pos.upToStartOf(call.arg(1).pos))
        : Edit.removeRange(Fixes.range(apply.fn.pos.end(), call.arg(0).pos));
    return cx.finding(message, details,
        ImmutableList.of(
            Edit.removeRange(pat.pos.upToStartOf(fn.pats.get(1).pos)),
            removeArg));
  }
}

// End FunctionChecks.java
