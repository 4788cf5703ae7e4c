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

import static net.hydromatic.simplify.simplify.Calls.bool;
import static net.hydromatic.simplify.simplify.Calls.details;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Rules for the {@code String} module. */
final class StringChecks {
  private StringChecks() {}

  private static final String EMPTY = "an empty string";
  private static final List<String> RESULT_DETAILS =
      details("The result of the call is known, so the call can be "
          + "replaced by its result.");

  static void register(RuleTable.Builder b) {
    for (String name
        : ImmutableList.of("reverse", "toUpper", "toLower", "trim",
            "trimLeft", "trimRight")) {
      b.call("String." + name,
          Calls.emptyGivesEmpty("String." + name, 1, EMPTY,
              StringChecks::isEmptyString));
    }
    for (String name
        : ImmutableList.of("left", "right", "dropLeft", "dropRight",
            "filter", "map")) {
      b.call("String." + name,
          Calls.emptyGivesEmpty("String." + name, 2, EMPTY,
              StringChecks::isEmptyString));
    }
    b.call("String.reverse", ListChecks.doubleCall("String", "reverse"));
    b.call("String.isEmpty", StringChecks::isEmpty);
    b.call("String.length", StringChecks::length);
    b.call("String.concat", StringChecks::concat);
    b.call("String.join", StringChecks::join);
    b.call("String.repeat", StringChecks::repeat);
    b.call("String.toList", StringChecks::toList);
    b.call("String.fromList", StringChecks::fromList);
    b.call("String.append", StringChecks::append);
  }

  static boolean isEmptyString(Ast.Exp exp, Context cx) {
    return Normalize.isEmptyString(exp);
  }

  /** Returns the value of a string literal, or null. */
  private static @Nullable String stringValue(Ast.Exp exp) {
    final Ast.Exp e = Normalize.unwrapParens(exp);
    if (e.op == Op.STRING_LITERAL) {
      return (String) ((Ast.Literal) e).value;
    }
    return null;
  }

  private static Finding empty(Context cx, String message) {
    return cx.replaceByText(message, RESULT_DETAILS, "\"\"",
        Op.STRING_LITERAL);
  }

  private static @Nullable Finding isEmpty(CallView call, Context cx) {
    if (call.argCount() != 1) {
      return null;
    }
    final String s = stringValue(call.arg(0));
    if (s == null) {
      return null;
    }
    final boolean b = s.isEmpty();
    return cx.replaceByText(
        "The call to String.isEmpty will result in " + (b ? "True" : "False"),
        RESULT_DETAILS, bool(cx, b), Op.ID);
  }

  private static @Nullable Finding length(CallView call, Context cx) {
    if (call.argCount() != 1) {
      return null;
    }
    final String s = stringValue(call.arg(0));
    if (s == null) {
      return null;
    }
    return cx.replaceByText("The length of the string is " + s.length(),
        RESULT_DETAILS, Integer.toString(s.length()), Op.INT_LITERAL);
  }

  private static @Nullable Finding concat(CallView call, Context cx) {
    if (call.argCount() == 1 && Normalize.isEmptyList(call.arg(0))) {
      return empty(cx,
          "Using String.concat on an empty list will result in an empty "
              + "string");
    }
    return null;
  }

  private static @Nullable Finding join(CallView call, Context cx) {
    if (call.argCount() == 2 && Normalize.isEmptyList(call.arg(1))) {
      return empty(cx,
          "Using String.join on an empty list will result in an empty "
              + "string");
    }
    if (call.argCount() >= 1 && Normalize.isEmptyString(call.arg(0))) {
      return Calls.replaceFunction(call, 1, cx,
          "Use String.concat instead",
          details("Using String.join with an empty separator is the same "
              + "as using String.concat."),
          cx.qualify("String", "concat"));
    }
    return null;
  }

  private static @Nullable Finding repeat(CallView call, Context cx) {
    if (call.argCount() != 2) {
      return null;
    }
    if (Normalize.isEmptyString(call.arg(1))) {
      return empty(cx,
          "Using String.repeat with an empty string will result in an "
              + "empty string");
    }
    final BigDecimal n = Equivalence.number(call.arg(0));
    if (n != null && n.signum() <= 0) {
      return empty(cx,
          "String.repeat will result in an empty string");
    }
    if (n != null && n.compareTo(BigDecimal.ONE) == 0) {
      return cx.replaceBy("String.repeat 1 will always return the same "
              + "given string to repeat",
          RESULT_DETAILS, call.arg(1));
    }
    return null;
  }

  /** Simplifies "String.toList ''" to "[]". "String.words ''" and
   * "String.lines ''" are not simplified; they return [""]. */
  private static @Nullable Finding toList(CallView call, Context cx) {
    if (call.argCount() == 1 && Normalize.isEmptyString(call.arg(0))) {
      return cx.replaceByText(
          "Using String.toList on an empty string will result in "
              + "an empty list",
          RESULT_DETAILS, "[]", Op.LIST);
    }
    return null;
  }

  private static @Nullable Finding fromList(CallView call, Context cx) {
    if (call.argCount() == 1 && Normalize.isEmptyList(call.arg(0))) {
      return empty(cx,
          "Using String.fromList on an empty list will result in an empty "
              + "string");
    }
    return null;
  }

  private static @Nullable Finding append(CallView call, Context cx) {
    if (call.argCount() != 2) {
      return null;
    }
    for (int i = 0; i < 2; i++) {
      if (Normalize.isEmptyString(call.arg(i))) {
        return cx.replaceBy("Unnecessary concatenation with an empty string",
            details("Appending an empty string does not change the "
                + "value."),
            call.arg(1 - i));
      }
    }
    return null;
  }
}

// End StringChecks.java
