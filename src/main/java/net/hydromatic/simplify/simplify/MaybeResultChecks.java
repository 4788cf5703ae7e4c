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

import static net.hydromatic.simplify.simplify.Calls.details;

import java.util.List;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Rules for the {@code Maybe} and {@code Result} modules.
 *
 * <p>Both modules have a "success" constructor that wraps a value
 * ({@code Just}, {@code Ok}) and a "failure" constructor
 * ({@code Nothing}, {@code Err}); most rules apply to both. */
final class MaybeResultChecks {
  private MaybeResultChecks() {}

  private static final List<String> RESULT_DETAILS =
      details("The result of the call is known, so the call can be "
          + "replaced by its result.");

  /** Describes the constructors of {@code Maybe} or {@code Result}. */
  private enum Kind {
    MAYBE("Maybe", "Just", "Nothing", "Nothing"),
    RESULT("Result", "Ok", "Err", "an error");

    final String moduleName;
    final String success;
    final String failure;
    /** How a failure value is described in messages. */
    final String failureText;

    Kind(String moduleName, String success, String failure,
        String failureText) {
      this.moduleName = moduleName;
      this.success = success;
      this.failure = failure;
      this.failureText = failureText;
    }

    String name(String function) {
      return moduleName + "." + function;
    }

    /** Returns whether an expression is a failure value, "Nothing" or
     * "Err e". */
    boolean isFailure(Ast.Exp exp, Context cx) {
      if (this == MAYBE) {
        return cx.resolves(exp, moduleName, failure);
      }
      return Calls.constructorArg(exp, cx, moduleName, failure) != null;
    }

    /** If an expression is a success value, "Just x" or "Ok x", returns
     * the wrapped value. */
    Ast.@Nullable Exp successArg(Ast.Exp exp, Context cx) {
      return Calls.constructorArg(exp, cx, moduleName, success);
    }
  }

  static void register(RuleTable.Builder b) {
    for (Kind kind : Kind.values()) {
      b.call(kind.name("map"), (call, cx) -> map(call, cx, kind));
      b.call(kind.name("map"), Calls.identityGivesArgument(kind.name("map")));
      b.call(kind.name("andThen"), (call, cx) -> andThen(call, cx, kind));
      b.call(kind.name("withDefault"),
          (call, cx) -> withDefault(call, cx, kind));
    }
    b.call("Result.mapError", MaybeResultChecks::mapError);
    b.call("Result.mapError", Calls.identityGivesArgument("Result.mapError"));
    b.call("Result.toMaybe", MaybeResultChecks::toMaybe);
  }

  /** Simplifies "Maybe.map f Nothing" to "Nothing" and
   * "Maybe.map f (Just x)" to "Just (f x)"; similarly for Result. */
  private static @Nullable Finding map(CallView call, Context cx,
      Kind kind) {
    if (call.argCount() != 2) {
      return null;
    }
    final String name = kind.name("map");
    if (kind.isFailure(call.arg(1), cx)) {
      return cx.replaceBy(
          "Using " + name + " on " + kind.failureText + " will result in "
              + kind.failureText,
          RESULT_DETAILS, call.arg(1));
    }
    final Ast.Exp value = kind.successArg(call.arg(1), cx);
    if (value != null) {
      return cx.replaceByText(
          "Calling " + name + " on a value that is known to be "
              + kind.success,
          details("The function can be applied to the value directly."),
          Calls.constructorText(cx, kind.moduleName, kind.success,
              "(" + Calls.applyText(cx, call.arg(0), value) + ")"),
          Op.APPLY);
    }
    return null;
  }

  private static @Nullable Finding andThen(CallView call, Context cx,
      Kind kind) {
    final String name = kind.name("andThen");
    if (call.argCount() == 2) {
      if (kind.isFailure(call.arg(1), cx)) {
        return cx.replaceBy(
            "Using " + name + " on " + kind.failureText + " will result in "
                + kind.failureText,
            RESULT_DETAILS, call.arg(1));
      }
      if (cx.resolves(call.arg(0), kind.moduleName, kind.success)) {
        return cx.replaceBy(
            "Using " + name + " with a function that will always return "
                + kind.success + " is the same as not using " + name,
            details("You can remove this call and replace it by the value "
                + "itself."),
            call.arg(1));
      }
      final Ast.Exp value = kind.successArg(call.arg(1), cx);
      if (value != null) {
        return cx.replaceByText(
            "Calling " + name + " on a value that is known to be "
                + kind.success,
            details("The function can be applied to the value directly."),
            Calls.applyText(cx, call.arg(0), value), Op.APPLY);
      }
    }
    return Calls.lambdaAlwaysWraps(call, cx, kind.moduleName, kind.success,
        "Use " + kind.name("map") + " instead",
        details("Using " + name + " with a function that always returns "
            + kind.success + " is the same as using "
            + kind.name("map") + "."),
        cx.qualify(kind.moduleName, "map"));
  }

  /** Simplifies "Maybe.withDefault d Nothing" to "d" and
   * "Maybe.withDefault d (Just x)" to "x"; similarly for Result. */
  private static @Nullable Finding withDefault(CallView call, Context cx,
      Kind kind) {
    if (call.argCount() != 2) {
      return null;
    }
    final String name = kind.name("withDefault");
    if (kind.isFailure(call.arg(1), cx)) {
      return cx.replaceBy(
          "Using " + name + " on " + kind.failureText + " will result in "
              + "the default value",
          RESULT_DETAILS, call.arg(0));
    }
    final Ast.Exp value = kind.successArg(call.arg(1), cx);
    if (value != null) {
      return cx.replaceBy(
          "Using " + name + " on a value that is " + kind.success
              + " will result in that value",
          RESULT_DETAILS, value);
    }
    return null;
  }

  private static @Nullable Finding mapError(CallView call, Context cx) {
    if (call.argCount() == 2
        && Kind.RESULT.successArg(call.arg(1), cx) != null) {
      return cx.replaceBy(
          "Using Result.mapError on a value that is Ok will result in "
              + "that value",
          RESULT_DETAILS, call.arg(1));
    }
    return null;
  }

  private static @Nullable Finding toMaybe(CallView call, Context cx) {
    if (call.argCount() != 1) {
      return null;
    }
    final Ast.Exp value = Kind.RESULT.successArg(call.arg(0), cx);
    if (value != null) {
      return cx.replaceByText(
          "Using Result.toMaybe on a value that is Ok will result in Just "
              + "that value",
          RESULT_DETAILS,
          Calls.constructorText(cx, "Maybe", "Just", cx.argText(value)),
          Op.APPLY);
    }
    if (Kind.RESULT.isFailure(call.arg(0), cx)) {
      return cx.replaceByText(
          "Using Result.toMaybe on an error will result in Nothing",
          RESULT_DETAILS, cx.qualify("Maybe", "Nothing"), Op.ID);
    }
    return null;
  }
}

// End MaybeResultChecks.java
