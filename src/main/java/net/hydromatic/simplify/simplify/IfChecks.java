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
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Op;

/** Rules for "if" expressions. */
final class IfChecks {
  private IfChecks() {}

  private static final List<String> THEN_DETAILS =
      ImmutableList.of("The expression can be replaced by the contents of "
          + "its `then` branch.");
  private static final List<String> ELSE_DETAILS =
      ImmutableList.of("The expression can be replaced by the contents of "
          + "its `else` branch.");
  private static final List<String> CONDITION_DETAILS =
      ImmutableList.of("The expression can be replaced by its condition.");
  private static final List<String> INVERSE_DETAILS =
      ImmutableList.of("The expression can be replaced by the negation of "
          + "its condition.");
  private static final List<String> SAME_DETAILS =
      ImmutableList.of("The expression can be replaced by the contents of "
          + "either branch.");

  /** Simplifies "if c then a else b".
   *
   * <p>The condition is known if it is a literal, or if the same condition
   * (or its negation) was tested by an enclosing "if", "&amp;&amp;" or
   * "||". */
  static List<Finding> ifThenElse(Ast.Exp exp, Context cx) {
    final Ast.If anIf = (Ast.If) exp;
    final Boolean condition = cx.knownBoolean(anIf.condition);
    if (condition != null) {
      return ImmutableList.of(condition
          ? cx.replaceBy("The condition will always evaluate to True",
              THEN_DETAILS, anIf.ifTrue)
          : cx.replaceBy("The condition will always evaluate to False",
              ELSE_DETAILS, anIf.ifFalse));
    }

    final Boolean b0 = Normalize.booleanValue(anIf.ifTrue, cx.resolution);
    final Boolean b1 = Normalize.booleanValue(anIf.ifFalse, cx.resolution);
    if (b0 != null && b1 != null && b0 != b1) {
      if (b0) {
        return ImmutableList.of(
            cx.replaceBy("The if expression's value is the same as the "
                + "condition", CONDITION_DETAILS, anIf.condition));
      }
      final Ast.Exp c = Normalize.unwrapParens(anIf.condition);
      return ImmutableList.of(
          cx.replaceByText("The if expression's value is the inverse of the "
                  + "condition", INVERSE_DETAILS,
              cx.qualify("Basics", "not") + " " + cx.argText(c), Op.APPLY));
    }

    if (cx.sameValue(anIf.ifTrue, anIf.ifFalse)) {
      return ImmutableList.of(
          cx.replaceBy("The values in both branches is the same.",
              SAME_DETAILS, anIf.ifTrue));
    }
    return ImmutableList.of();
  }
}

// End IfChecks.java
