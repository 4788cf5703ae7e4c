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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Rules for containers other than lists and strings: {@code Set},
 * {@code Dict}, {@code Cmd}, {@code Sub}, {@code Tuple}, and the
 * {@code oneOf} functions of parsers and decoders. */
final class ContainerChecks {
  private ContainerChecks() {}

  private static final List<String> RESULT_DETAILS =
      details("The result of the call is known, so the call can be "
          + "replaced by its result.");

  static void register(RuleTable.Builder b) {
    registerSet(b);
    registerDict(b);
    for (String module : ImmutableList.of("Platform.Cmd", "Platform.Sub")) {
      b.call(module + ".batch", (call, cx) -> batch(call, cx, module));
      b.call(module + ".map", (call, cx) -> mapNone(call, cx, module));
      b.call(module + ".map", Calls.identityGivesArgument(module + ".map"));
    }
    for (String module
        : ImmutableList.of("Parser", "Parser.Advanced", "Json.Decode")) {
      b.call(module + ".oneOf", ContainerChecks::oneOf);
    }
    b.call("Tuple.first", (call, cx) -> tuplePart(call, cx, 0));
    b.call("Tuple.second", (call, cx) -> tuplePart(call, cx, 1));
    b.call("Tuple.pair", ContainerChecks::pair);
  }

  private static void registerSet(RuleTable.Builder b) {
    for (String name : ImmutableList.of("map", "filter", "remove")) {
      b.call("Set." + name,
          Calls.emptyGivesEmpty("Set." + name, 2, "Set.empty",
              Calls.isEmpty("Set")));
    }
    b.call("Set.map", Calls.identityGivesArgument("Set.map"));
    b.call("Set.fromList", ContainerChecks::setFromList);
    b.call("Set.insert", ContainerChecks::setInsert);
    b.call("Set.size", ContainerChecks::setSize);
    b.call("Set.isEmpty", (call, cx) -> isEmpty(call, cx, "Set"));
    b.call("Set.member", (call, cx) -> member(call, cx, "Set"));
    b.call("Set.toList", (call, cx) -> toList(call, cx, "Set", "toList"));
    b.call("Set.union", (call, cx) -> union(call, cx, "Set"));
  }

  private static void registerDict(RuleTable.Builder b) {
    for (String name : ImmutableList.of("map", "filter", "remove")) {
      b.call("Dict." + name,
          Calls.emptyGivesEmpty("Dict." + name, 2, "Dict.empty",
              Calls.isEmpty("Dict")));
    }
    b.call("Dict.fromList", ContainerChecks::dictFromList);
    b.call("Dict.size", ContainerChecks::dictSize);
    b.call("Dict.isEmpty", (call, cx) -> isEmpty(call, cx, "Dict"));
    b.call("Dict.member", (call, cx) -> member(call, cx, "Dict"));
    b.call("Dict.get", ContainerChecks::dictGet);
    for (String name : ImmutableList.of("toList", "keys", "values")) {
      b.call("Dict." + name, (call, cx) -> toList(call, cx, "Dict", name));
    }
    b.call("Dict.union", (call, cx) -> union(call, cx, "Dict"));
  }

  // Set and Dict

  private static @Nullable Finding setFromList(CallView call, Context cx) {
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
            "The call to Set.fromList will result in Set.empty",
            RESULT_DETAILS, cx.qualify("Set", "empty"), Op.ID);
      case 1:
        return cx.replaceByText(
            "The call to Set.fromList will result in Set.singleton",
            RESULT_DETAILS,
            cx.qualify("Set", "singleton") + " "
                + cx.argText(list.args.get(0)),
            Op.APPLY);
      default:
        return null;
    }
  }

  private static @Nullable Finding setInsert(CallView call, Context cx) {
    if (call.argCount() == 2 && cx.resolves(call.arg(1), "Set", "empty")) {
      return cx.replaceByText(
          "Use Set.singleton instead of inserting in Set.empty",
          details("Inserting into an empty set gives a set with one "
              + "element."),
          cx.qualify("Set", "singleton") + " " + cx.argText(call.arg(0)),
          Op.APPLY);
    }
    return null;
  }

  private static @Nullable Finding setSize(CallView call, Context cx) {
    if (call.argCount() != 1) {
      return null;
    }
    final Integer size = setSize(call.arg(0), cx);
    if (size == null) {
      return null;
    }
    return cx.replaceByText("The size of the set is " + size,
        RESULT_DETAILS, Integer.toString(size), Op.INT_LITERAL);
  }

  /** Returns the number of elements of a set expression, or null if it
   * cannot be determined. Elements of "Set.fromList [...]" are counted
   * once per distinct value, and only if every pair of elements can be
   * compared. */
  private static @Nullable Integer setSize(Ast.Exp exp, Context cx) {
    if (cx.resolves(exp, "Set", "empty")) {
      return 0;
    }
    final CallView call = CallView.of(Normalize.unwrapParens(exp));
    if (call == null || call.argCount() != 1) {
      return null;
    }
    if (cx.resolves(call.fn, "Set", "singleton")) {
      return 1;
    }
    if (!cx.resolves(call.fn, "Set", "fromList")) {
      return null;
    }
    final Ast.ListExp list = Normalize.listLiteral(call.arg(0));
    if (list == null) {
      return null;
    }
    int distinct = 0;
    for (int i = 0; i < list.args.size(); i++) {
      boolean duplicate = false;
      for (int j = 0; j < i; j++) {
        switch (cx.equivalence.compare(list.args.get(j), list.args.get(i))) {
          case EQUAL:
            duplicate = true;
            break;
          case UNKNOWN:
            return null;
          default:
            break;
        }
      }
      if (!duplicate) {
        ++distinct;
      }
    }
    return distinct;
  }

  private static @Nullable Finding dictFromList(CallView call, Context cx) {
    if (call.argCount() == 1 && Normalize.isEmptyList(call.arg(0))) {
      return cx.replaceByText(
          "The call to Dict.fromList will result in Dict.empty",
          RESULT_DETAILS, cx.qualify("Dict", "empty"), Op.ID);
    }
    return null;
  }

  private static @Nullable Finding dictSize(CallView call, Context cx) {
    if (call.argCount() != 1) {
      return null;
    }
    final int size;
    if (cx.resolves(call.arg(0), "Dict", "empty")) {
      size = 0;
    } else {
      final CallView inner = CallView.of(Normalize.unwrapParens(call.arg(0)));
      if (inner == null
          || inner.argCount() != 2
          || !cx.resolves(inner.fn, "Dict", "singleton")) {
        return null;
      }
      size = 1;
    }
    return cx.replaceByText("The size of the Dict is " + size,
        RESULT_DETAILS, Integer.toString(size), Op.INT_LITERAL);
  }

  private static @Nullable Finding isEmpty(CallView call, Context cx,
      String module) {
    if (call.argCount() != 1) {
      return null;
    }
    final boolean b;
    if (cx.resolves(call.arg(0), module, "empty")) {
      b = true;
    } else {
      final CallView inner = CallView.of(Normalize.unwrapParens(call.arg(0)));
      if (inner == null || !cx.resolves(inner.fn, module, "singleton")) {
        return null;
      }
      b = false;
    }
    return cx.replaceByText(
        "The call to " + module + ".isEmpty will result in "
            + (b ? "True" : "False"),
        RESULT_DETAILS, bool(cx, b), Op.ID);
  }

  private static @Nullable Finding member(CallView call, Context cx,
      String module) {
    if (call.argCount() == 2 && cx.resolves(call.arg(1), module, "empty")) {
      return cx.replaceByText(
          "Using " + module + ".member on " + module + ".empty will result "
              + "in False",
          RESULT_DETAILS, bool(cx, false), Op.ID);
    }
    return null;
  }

  private static @Nullable Finding dictGet(CallView call, Context cx) {
    if (call.argCount() == 2 && cx.resolves(call.arg(1), "Dict", "empty")) {
      return cx.replaceByText(
          "Using Dict.get on Dict.empty will result in Nothing",
          RESULT_DETAILS, cx.qualify("Maybe", "Nothing"), Op.ID);
    }
    return null;
  }

  private static @Nullable Finding toList(CallView call, Context cx,
      String module, String name) {
    if (call.argCount() == 1 && cx.resolves(call.arg(0), module, "empty")) {
      return cx.replaceByText(
          "Using " + module + "." + name + " on " + module + ".empty will "
              + "result in []",
          RESULT_DETAILS, "[]", Op.LIST);
    }
    return null;
  }

  private static @Nullable Finding union(CallView call, Context cx,
      String module) {
    if (call.argCount() != 2) {
      return null;
    }
    for (int i = 0; i < 2; i++) {
      if (cx.resolves(call.arg(i), module, "empty")) {
        return cx.replaceBy("Unnecessary union with " + module + ".empty",
            details("A union with an empty " + module + " does not change "
                + "the value."),
            call.arg(1 - i));
      }
    }
    return null;
  }

  // Cmd and Sub

  /** Simplifies "Cmd.batch []" to "Cmd.none", "Cmd.batch [x]" to "x", and
   * removes "Cmd.none" from the list of a batch. */
  private static @Nullable Finding batch(CallView call, Context cx,
      String module) {
    if (call.argCount() != 1) {
      return null;
    }
    final Ast.ListExp list = Normalize.listLiteral(call.arg(0));
    if (list == null) {
      return null;
    }
    final String display = Calls.displayName(module + ".batch");
    final String none = Calls.displayName(module + ".none");
    if (list.args.isEmpty()) {
      return cx.replaceByText(
          "Replace by " + none,
          details(display + " [] and " + none + " are equivalent but the "
              + "latter is more idiomatic."),
          cx.qualify(module, "none"), Op.ID);
    }
    if (list.args.size() == 1) {
      return cx.replaceBy("Unnecessary " + display,
          details(display + " with a single element is equal to that "
              + "element."),
          list.args.get(0));
    }
    final List<Integer> nones = new ArrayList<>();
    for (int i = 0; i < list.args.size(); i++) {
      if (cx.resolves(list.args.get(i), module, "none")) {
        nones.add(i);
      }
    }
    if (nones.isEmpty()) {
      return null;
    }
    if (nones.size() == list.args.size()) {
      return cx.replaceByText("Unnecessary " + none,
          details(none + " will be ignored by " + display + "."),
          cx.qualify(module, "none"), Op.ID);
    }
    // Remove each "none" with the separator that follows it; trailing
    // "none" elements go with the separator before them.
    final int last = list.args.size() - 1;
    int trailing = last + 1;
    while (nones.contains(trailing - 1)) {
      --trailing;
    }
    final ImmutableList.Builder<Edit> edits = ImmutableList.builder();
    for (int i : nones) {
      if (i < trailing) {
        edits.add(
            Edit.removeRange(
                list.args.get(i).pos.upToStartOf(list.args.get(i + 1).pos)));
      }
    }
    if (trailing <= last) {
      edits.add(
          Edit.removeRange(
              list.args.get(trailing - 1).pos
                  .fromEndTo(list.args.get(last).pos)));
    }
    final Ast.Exp first = list.args.get(nones.get(0));
    return cx.finding("Unnecessary " + none,
        details(none + " will be ignored by " + display + "."),
        first.pos, edits.build());
  }

  private static @Nullable Finding mapNone(CallView call, Context cx,
      String module) {
    if (call.argCount() == 2 && cx.resolves(call.arg(1), module, "none")) {
      final String none = Calls.displayName(module + ".none");
      return cx.replaceBy(
          "Using " + Calls.displayName(module + ".map") + " on " + none
              + " will result in " + none,
          RESULT_DETAILS, call.arg(1));
    }
    return null;
  }

  // Parsers and decoders

  private static @Nullable Finding oneOf(CallView call, Context cx) {
    if (call.argCount() == 1 && Calls.isSingletonList(call.arg(0))) {
      final Ast.ListExp list =
          (Ast.ListExp) Normalize.unwrapParens(call.arg(0));
      return cx.replaceBy("Unnecessary oneOf",
          details("There is only a single element in the list of elements "
              + "to try out."),
          list.args.get(0));
    }
    return null;
  }

  // Tuple

  private static @Nullable Finding tuplePart(CallView call, Context cx,
      int i) {
    if (call.argCount() != 1) {
      return null;
    }
    final Ast.Exp arg = Normalize.unwrapParens(call.arg(0));
    if (arg.op == Op.TUPLE && ((Ast.Tuple) arg).args.size() == 2) {
      return cx.replaceBy(
          "Using Tuple." + (i == 0 ? "first" : "second") + " on a known "
              + "tuple will result in the " + (i == 0 ? "first" : "second")
              + " element",
          RESULT_DETAILS, ((Ast.Tuple) arg).args.get(i));
    }
    final CallView pair = CallView.of(arg);
    if (pair != null
        && pair.argCount() == 2
        && cx.resolves(pair.fn, "Tuple", "pair")) {
      return cx.replaceBy(
          "Using Tuple." + (i == 0 ? "first" : "second") + " on a known "
              + "tuple will result in the " + (i == 0 ? "first" : "second")
              + " element",
          RESULT_DETAILS, pair.arg(i));
    }
    return null;
  }

  private static @Nullable Finding pair(CallView call, Context cx) {
    if (call.argCount() != 2) {
      return null;
    }
    return cx.replaceByText("Use a tuple literal instead of Tuple.pair",
        details("A tuple literal is easier to read."),
        "(" + cx.text(call.arg(0)) + ", " + cx.text(call.arg(1)) + ")",
        Op.TUPLE);
  }
}

// End ContainerChecks.java
