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
import java.util.List;
import java.util.function.BiPredicate;
import java.util.stream.Collectors;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Op;
import net.hydromatic.simplify.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for rules about calls to library functions. */
final class Calls {
  private Calls() {}

  /** Returns how a function is named in messages; for example
   * "Platform.Cmd.batch" becomes "Cmd.batch". */
  static String displayName(String qualifiedName) {
    if (qualifiedName.startsWith("Platform.Cmd.")
        || qualifiedName.startsWith("Platform.Sub.")) {
      return qualifiedName.substring("Platform.".length());
    }
    return qualifiedName;
  }

  static List<String> details(String... lines) {
    return ImmutableList.copyOf(lines);
  }

  /** Returns whether an expression is "[]". */
  static boolean isEmptyList(Ast.Exp exp, Context cx) {
    return Normalize.isEmptyList(exp);
  }

  /** Returns whether an expression is a list literal with exactly one
   * element. */
  static boolean isSingletonList(Ast.Exp exp) {
    final Ast.ListExp list = Normalize.listLiteral(exp);
    return list != null && list.args.size() == 1;
  }

  /** Returns a predicate that tests whether an expression is the "empty"
   * value of a module, for example "Set.empty". */
  static BiPredicate<Ast.Exp, Context> isEmpty(String moduleName) {
    return (exp, cx) -> cx.resolves(exp, moduleName, "empty");
  }

  /** If an expression is a given constructor applied to one argument, as
   * in "Just x", returns the argument. */
  static Ast.@Nullable Exp constructorArg(Ast.Exp exp, Context cx,
      String moduleName, String constructor) {
    final CallView call = CallView.of(Normalize.unwrapParens(exp));
    if (call != null
        && call.argCount() == 1
        && cx.resolves(call.fn, moduleName, constructor)) {
      return call.arg(0);
    }
    return null;
  }

  /** Returns the text of a call "f x", with parentheses as needed. */
  static String applyText(Context cx, Ast.Exp f, Ast.Exp x) {
    return cx.textIn(Normalize.unwrapParens(f), 0, Op.APPLY.left) + " "
        + cx.argText(Normalize.unwrapParens(x));
  }

  /** Returns the text of a constructor applied to an argument, such as
   * "Just x". */
  static String constructorText(Context cx, String moduleName,
      String constructor, String argText) {
    return cx.qualify(moduleName, constructor) + " " + argText;
  }

  /** Returns the text of a list literal. */
  static String listText(Context cx, List<Ast.Exp> elements) {
    return elements.stream()
        .map(cx::text)
        .collect(Collectors.joining(", ", "[", "]"));
  }

  /** Returns the text that refers to a boolean literal. */
  static String bool(Context cx, boolean b) {
    return cx.qualify("Basics", b ? "True" : "False");
  }

  /** Returns a finding that replaces the function and its first {@code n}
   * arguments by another function, for example "List.concatMap identity"
   * by "List.concat". Returns null if the function and arguments are not
   * next to each other in the source. */
  static @Nullable Finding replaceFunction(CallView call, int n, Context cx,
      String message, List<String> details, String newFunction) {
    final Pos pos = call.prefixRange(n);
    if (pos == null) {
      return null;
    }
    return cx.finding(message, details,
        ImmutableList.of(Edit.replaceRangeBy(pos, newFunction)));
  }

  /** Replaces "f (\a -> Just b) x" by "g (\a -> b) x"; for example,
   * "List.filterMap (\a -> Just b) x" by "List.map (\a -> b) x". The
   * lambda must be the first argument and its body must be a call to the
   * constructor. */
  static @Nullable Finding lambdaAlwaysWraps(CallView call, Context cx,
      String moduleName, String constructor, String message,
      List<String> details, String newFunction) {
    if (call.argCount() < 1) {
      return null;
    }
    final Ast.Exp fn = Normalize.unwrapParens(call.arg(0));
    if (!(fn instanceof Ast.Fn) || ((Ast.Fn) fn).pats.size() != 1) {
      return null;
    }
    final Ast.Exp body = ((Ast.Fn) fn).exp;
    final Ast.Exp arg = constructorArg(body, cx, moduleName, constructor);
    if (arg == null || body instanceof Ast.Parens) {
      return null;
    }
    return cx.finding(message, details,
        ImmutableList.<Edit>builder()
            .add(Edit.replaceRangeBy(call.fn.pos, newFunction))
            .addAll(Context.replaceBy(body, 0, 0, arg))
            .build());
  }

  /** Returns a check for a function that returns its collection argument
   * unchanged when that argument is empty, such as "List.map f []". The
   * collection is the last argument. */
  static CallCheck emptyGivesEmpty(String name, int arity, String what,
      BiPredicate<Ast.Exp, Context> isEmpty) {
    final String message = "Using " + displayName(name) + " on "
        + what + " will result in " + what;
    final List<String> details =
        details("You can replace this call by " + what + ".");
    return (call, cx) -> {
      if (call.argCount() == arity
          && isEmpty.test(call.lastArg(), cx)) {
        return cx.replaceBy(message, details, call.lastArg());
      }
      return null;
    };
  }

  /** Returns a check for a function that is the identity function when its
   * first argument is {@code identity}, such as "List.map identity". */
  static CallCheck identityGivesArgument(String name) {
    final String display = displayName(name);
    final String message = "Using " + display + " with an identity function "
        + "is the same as not using " + display;
    final List<String> details =
        details("You can remove this call and replace it by the value "
            + "itself.");
    return (call, cx) -> {
      if (!Normalize.isIdentity(call.arg(0), cx.resolution)) {
        return null;
      }
      switch (call.argCount()) {
        case 1:
          return cx.replaceBy(message, details, call.arg(0));
        case 2:
          return cx.replaceBy(message, details, call.arg(1));
        default:
          return null;
      }
    };
  }
}

// End Calls.java
