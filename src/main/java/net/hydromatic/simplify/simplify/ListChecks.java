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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Rules for lists: the {@code List} module, and the "++" and "::"
 * operators. */
final class ListChecks {
  private ListChecks() {}

  private static final String EMPTY = "an empty list";
  private static final List<String> RESULT_DETAILS =
      details("The result of the call is known, so the call can be "
          + "replaced by its result.");
  private static final List<String> SINGLE_LIST_DETAILS =
      details("Lists written one after another can be merged into one "
          + "list.");

  static void register(RuleTable.Builder b) {
    for (String name
        : ImmutableList.of("map", "indexedMap", "filter", "filterMap",
            "concatMap", "sortBy", "sortWith", "intersperse")) {
      b.call("List." + name,
          Calls.emptyGivesEmpty("List." + name, 2, EMPTY,
              Calls::isEmptyList));
    }
    for (String name : ImmutableList.of("reverse", "sort", "concat")) {
      b.call("List." + name,
          Calls.emptyGivesEmpty("List." + name, 1, EMPTY,
              Calls::isEmptyList));
    }
    b.call("List.map", Calls.identityGivesArgument("List.map"));
    b.call("List.filter", ListChecks::filter);
    b.call("List.filterMap", ListChecks::filterMap);
    b.call("List.concatMap", ListChecks::concatMap);
    b.call("List.concat", ListChecks::concat);
    b.call("List.reverse", doubleCall("List", "reverse"));
    b.call("List.isEmpty", ListChecks::isEmpty);
    b.call("List.length", ListChecks::length);
    b.call("List.all", (call, cx) -> allOrAny(call, cx, true));
    b.call("List.any", (call, cx) -> allOrAny(call, cx, false));
    b.call("List.sum", (call, cx) -> sumOrProduct(call, cx, "sum", "0"));
    b.call("List.product",
        (call, cx) -> sumOrProduct(call, cx, "product", "1"));
    b.call("List.head", ListChecks::head);
    b.call("List.tail", ListChecks::tail);
    b.call("List.maximum", (call, cx) -> extreme(call, cx, "maximum"));
    b.call("List.minimum", (call, cx) -> extreme(call, cx, "minimum"));
    b.call("List.member", ListChecks::member);
    b.call("List.foldl", (call, cx) -> fold(call, cx, "foldl"));
    b.call("List.foldr", (call, cx) -> fold(call, cx, "foldr"));
    b.call("List.append", ListChecks::appendCall);
    b.call("List.partition", ListChecks::partition);
    b.call("List.take", ListChecks::take);
    b.call("List.drop", ListChecks::drop);
  }

  /** Returns a check that removes a function applied twice, such as
   * "List.reverse (List.reverse x)". */
  static CallCheck doubleCall(String moduleName, String name) {
    return (call, cx) -> {
      if (call.argCount() != 1) {
        return null;
      }
      final CallView inner = CallView.of(Normalize.unwrapParens(call.arg(0)));
      if (inner != null
          && inner.argCount() == 1
          && cx.resolves(inner.fn, moduleName, name)) {
        return cx.replaceBy("Unnecessary double reversal",
            details("Reversing twice gives back the original value."),
            inner.arg(0));
      }
      return null;
    };
  }

  private static @Nullable Finding filter(CallView call, Context cx) {
    if (call.argCount() != 2) {
      return null;
    }
    if (Normalize.isAlwaysBoolean(call.arg(0), true, cx.resolution)) {
      return cx.replaceBy(
          "Using List.filter with a function that will always return True "
              + "is the same as not using List.filter",
          details("You can remove this call and replace it by the list "
              + "itself."),
          call.arg(1));
    }
    if (Normalize.isAlwaysBoolean(call.arg(0), false, cx.resolution)) {
      return cx.replaceByText(
          "Using List.filter with a function that will always return False "
              + "will result in an empty list",
          details("You can replace this call by an empty list."), "[]",
          Op.LIST);
    }
    return null;
  }

  private static @Nullable Finding filterMap(CallView call, Context cx) {
    if (call.argCount() == 2) {
      if (cx.resolves(call.arg(0), "Maybe", "Just")) {
        return cx.replaceBy(
            "Using List.filterMap with a function that will always return "
                + "Just is the same as not using List.filterMap",
            details("You can remove this call and replace it by the list "
                + "itself."),
            call.arg(1));
      }
      final Ast.Exp body = Normalize.alwaysBody(call.arg(0), cx.resolution);
      if (body != null && cx.resolves(body, "Maybe", "Nothing")) {
        return cx.replaceByText(
            "Using List.filterMap with a function that will always return "
                + "Nothing will result in an empty list",
            details("You can replace this call by an empty list."), "[]",
            Op.LIST);
      }
    }
    return Calls.lambdaAlwaysWraps(call, cx, "Maybe", "Just",
        "Use List.map instead",
        details("Using List.filterMap with a function that always returns "
            + "Just is the same as using List.map."),
        cx.qualify("List", "map"));
  }

  private static @Nullable Finding concatMap(CallView call, Context cx) {
    if (call.argCount() >= 1
        && Normalize.isIdentity(call.arg(0), cx.resolution)) {
      return Calls.replaceFunction(call, 1, cx,
          "Using List.concatMap with an identity function is the same as "
              + "using List.concat",
          details("You can replace this call by List.concat."),
          cx.qualify("List", "concat"));
    }
    return null;
  }

  /** Simplifies "List.concat [x]" to "x", and merges list literals in
   * "List.concat [[a], [b], c]". */
  private static @Nullable Finding concat(CallView call, Context cx) {
    if (call.argCount() != 1) {
      return null;
    }
    final Ast.ListExp list = Normalize.listLiteral(call.arg(0));
    if (list == null || list.args.isEmpty()) {
      return null;
    }
    if (list.args.size() == 1) {
      return cx.replaceBy(
          "Unnecessary use of List.concat on a list with 1 element",
          details("The value of the call is the element of the list."),
          list.args.get(0));
    }
    // Group consecutive list literals.
    final List<String> groups = new ArrayList<>();
    final List<Ast.Exp> pending = new ArrayList<>();
    boolean merged = false;
    for (Ast.Exp arg : list.args) {
      final Ast.ListExp inner = Normalize.listLiteral(arg);
      if (inner != null) {
        if (!pending.isEmpty()) {
          merged = true;
        }
        pending.addAll(inner.args);
        if (pending.isEmpty()) {
          // "[]" inside the list; it is merged with its neighbors
          merged = true;
        }
        continue;
      }
      if (!pending.isEmpty()) {
        groups.add(Calls.listText(cx, pending));
        pending.clear();
      }
      groups.add(cx.text(arg));
    }
    if (groups.isEmpty()) {
      return cx.replaceByText(
          "Expression could be simplified to be a single List",
          SINGLE_LIST_DETAILS, Calls.listText(cx, pending), Op.LIST);
    }
    if (!merged) {
      return null;
    }
    if (!pending.isEmpty()) {
      groups.add(Calls.listText(cx, pending));
    }
    return cx.finding("Consecutive literal lists should be merged",
        SINGLE_LIST_DETAILS,
        ImmutableList.of(
            Edit.replaceRangeBy(list.pos,
                "[" + String.join(", ", groups) + "]")));
  }

  private static @Nullable Finding isEmpty(CallView call, Context cx) {
    if (call.argCount() != 1) {
      return null;
    }
    final Ast.ListExp list = Normalize.listLiteral(call.arg(0));
    if (list == null) {
      return null;
    }
    final boolean b = list.args.isEmpty();
    return cx.replaceByText(
        "The call to List.isEmpty will result in " + (b ? "True" : "False"),
        RESULT_DETAILS, bool(cx, b), Op.ID);
  }

  private static @Nullable Finding length(CallView call, Context cx) {
    if (call.argCount() != 1) {
      return null;
    }
    final Ast.ListExp list = Normalize.listLiteral(call.arg(0));
    if (list == null) {
      return null;
    }
    final int n = list.args.size();
    return cx.replaceByText("The length of the list is " + n,
        RESULT_DETAILS, Integer.toString(n), Op.INT_LITERAL);
  }

  /** Simplifies "List.all f []" and "List.all (always True) x" to "True",
   * and "List.any f []" and "List.any (always False) x" to "False". */
  private static @Nullable Finding allOrAny(CallView call, Context cx,
      boolean all) {
    if (call.argCount() != 2) {
      return null;
    }
    if (Normalize.isEmptyList(call.arg(1))
        || Normalize.isAlwaysBoolean(call.arg(0), all, cx.resolution)) {
      final String value = all ? "True" : "False";
      return cx.replaceByText(
          "The call to List." + (all ? "all" : "any") + " will result in "
              + value,
          RESULT_DETAILS, bool(cx, all), Op.ID);
    }
    return null;
  }

  private static @Nullable Finding sumOrProduct(CallView call, Context cx,
      String name, String emptyValue) {
    if (call.argCount() != 1) {
      return null;
    }
    final Ast.ListExp list = Normalize.listLiteral(call.arg(0));
    if (list == null) {
      return null;
    }
    switch (list.args.size()) {
      case 0:
        return cx.replaceByText(
            "The call to List." + name + " will result in " + emptyValue,
            RESULT_DETAILS, emptyValue, Op.INT_LITERAL);
      case 1:
        return cx.replaceBy(
            "Using List." + name + " on a list with a single element will "
                + "result in the element itself",
            RESULT_DETAILS, list.args.get(0));
      default:
        return null;
    }
  }

  private static @Nullable Finding head(CallView call, Context cx) {
    if (call.argCount() != 1) {
      return null;
    }
    final Ast.ListExp list = Normalize.listLiteral(call.arg(0));
    if (list == null) {
      return null;
    }
    if (list.args.isEmpty()) {
      return nothing(cx, "List.head");
    }
    return cx.replaceByText(
        "Using List.head on a list with a first element will result in Just "
            + "the first element",
        RESULT_DETAILS,
        Calls.constructorText(cx, "Maybe", "Just",
            cx.argText(list.args.get(0))),
        Op.APPLY);
  }

  private static @Nullable Finding tail(CallView call, Context cx) {
    if (call.argCount() != 1) {
      return null;
    }
    final Ast.ListExp list = Normalize.listLiteral(call.arg(0));
    if (list == null) {
      return null;
    }
    if (list.args.isEmpty()) {
      return nothing(cx, "List.tail");
    }
    return cx.replaceByText(
        "Using List.tail on a list with some elements will result in Just "
            + "the remaining elements",
        RESULT_DETAILS,
        Calls.constructorText(cx, "Maybe", "Just",
            Calls.listText(cx, list.args.subList(1, list.args.size()))),
        Op.APPLY);
  }

  private static @Nullable Finding extreme(CallView call, Context cx,
      String name) {
    if (call.argCount() != 1) {
      return null;
    }
    final Ast.ListExp list = Normalize.listLiteral(call.arg(0));
    if (list == null) {
      return null;
    }
    switch (list.args.size()) {
      case 0:
        return nothing(cx, "List." + name);
      case 1:
        return cx.replaceByText(
            "Using List." + name + " on a list with a single element will "
                + "result in Just that element",
            RESULT_DETAILS,
            Calls.constructorText(cx, "Maybe", "Just",
                cx.argText(list.args.get(0))),
            Op.APPLY);
      default:
        return null;
    }
  }

  private static Finding nothing(Context cx, String name) {
    return cx.replaceByText(
        "Using " + name + " on an empty list will result in Nothing",
        RESULT_DETAILS, cx.qualify("Maybe", "Nothing"), Op.ID);
  }

  private static @Nullable Finding member(CallView call, Context cx) {
    if (call.argCount() == 2 && Normalize.isEmptyList(call.arg(1))) {
      return cx.replaceByText(
          "Using List.member on an empty list will result in False",
          RESULT_DETAILS, bool(cx, false), Op.ID);
    }
    return null;
  }

  private static @Nullable Finding fold(CallView call, Context cx,
      String name) {
    if (call.argCount() == 3 && Normalize.isEmptyList(call.arg(2))) {
      return cx.replaceBy(
          "The call to List." + name + " will result in the initial "
              + "accumulator",
          RESULT_DETAILS, call.arg(1));
    }
    return null;
  }

  private static @Nullable Finding appendCall(CallView call, Context cx) {
    if (call.argCount() != 2) {
      return null;
    }
    if (Normalize.isEmptyList(call.arg(0))) {
      return cx.replaceBy("Appending [] does not change the list",
          RESULT_DETAILS, call.arg(1));
    }
    if (Normalize.isEmptyList(call.arg(1))) {
      return cx.replaceBy("Appending [] does not change the list",
          RESULT_DETAILS, call.arg(0));
    }
    return null;
  }

  private static @Nullable Finding partition(CallView call, Context cx) {
    if (call.argCount() != 2) {
      return null;
    }
    final String list = cx.text(call.arg(1));
    if (Normalize.isEmptyList(call.arg(1))) {
      return cx.replaceByText(
          "Using List.partition on an empty list will result in a tuple of "
              + "empty lists",
          RESULT_DETAILS, "([], [])", Op.TUPLE);
    }
    if (Normalize.isAlwaysBoolean(call.arg(0), true, cx.resolution)) {
      return cx.replaceByText("All elements will go to the first list",
          RESULT_DETAILS, "(" + list + ", [])", Op.TUPLE);
    }
    if (Normalize.isAlwaysBoolean(call.arg(0), false, cx.resolution)) {
      return cx.replaceByText("All elements will go to the second list",
          RESULT_DETAILS, "([], " + list + ")", Op.TUPLE);
    }
    return null;
  }

  private static boolean isZero(Ast.Exp exp) {
    final BigDecimal n = Equivalence.number(exp);
    return n != null && n.signum() == 0;
  }

  private static @Nullable Finding take(CallView call, Context cx) {
    if (call.argCount() == 2 && isZero(call.arg(0))) {
      return cx.replaceByText(
          "Taking 0 items from a list will result in []",
          RESULT_DETAILS, "[]", Op.LIST);
    }
    return null;
  }

  private static @Nullable Finding drop(CallView call, Context cx) {
    if (call.argCount() == 2 && isZero(call.arg(0))) {
      return cx.replaceBy(
          "Dropping 0 items from a list will result in the list itself",
          RESULT_DETAILS, call.arg(1));
    }
    return null;
  }

  // Operators

  /** Simplifies "a ++ b" if either side is empty, or both are list
   * literals, or the left side is a list with one element. */
  static List<Finding> append(Ast.Exp exp, Context cx) {
    final Ast.InfixCall call = (Ast.InfixCall) exp;
    for (int i = 0; i < 2; i++) {
      final Ast.Exp side = i == 0 ? call.a0 : call.a1;
      final Ast.Exp other = i == 0 ? call.a1 : call.a0;
      if (Normalize.isEmptyString(side)) {
        return ImmutableList.of(
            cx.replaceBy("Unnecessary concatenation with an empty string",
                details("Appending an empty string does not change the "
                    + "value."),
                other));
      }
      if (Normalize.isEmptyList(side)) {
        return ImmutableList.of(
            cx.replaceBy("Unnecessary concatenation with an empty list",
                details("Appending an empty list does not change the "
                    + "value."),
                other));
      }
    }
    final Ast.ListExp list0 = Normalize.listLiteral(call.a0);
    final Ast.ListExp list1 = Normalize.listLiteral(call.a1);
    if (list0 != null && list1 != null) {
      return ImmutableList.of(
          cx.replaceByText("Expression could be simplified to be a single "
                  + "List", SINGLE_LIST_DETAILS,
              Calls.listText(cx,
                  ImmutableList.<Ast.Exp>builder().addAll(list0.args)
                      .addAll(list1.args).build()),
              Op.LIST));
    }
    if (list0 != null && list0.args.size() == 1) {
      final Ast.Exp element = list0.args.get(0);
      return ImmutableList.of(
          cx.replaceByText("Should use (::) instead of (++)",
              details("Adding one element to the front of a list is "
                  + "better written using (::)."),
              cx.textIn(element, 0, Op.CONS.left) + " :: "
                  + cx.textIn(Normalize.unwrapParens(call.a1),
                      Op.CONS.right, 0),
              Op.CONS));
    }
    return ImmutableList.of();
  }

  /** Simplifies "a :: [b, c]" to "[a, b, c]". */
  static List<Finding> cons(Ast.Exp exp, Context cx) {
    final Ast.InfixCall call = (Ast.InfixCall) exp;
    final Ast.ListExp list = Normalize.listLiteral(call.a1);
    if (list == null) {
      return ImmutableList.of();
    }
    return ImmutableList.of(
        cx.replaceByText("Element added to the beginning of the list could "
                + "be included in the list",
            details("The element can be written as the first element of "
                + "the list literal."),
            Calls.listText(cx,
                ImmutableList.<Ast.Exp>builder().add(call.a0)
                    .addAll(list.args).build()),
            Op.LIST));
  }
}

// End ListChecks.java
