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

/** Rules for "case" expressions. */
final class CaseChecks {
  private CaseChecks() {}

  private static final List<String> SAME_DETAILS =
      ImmutableList.of("All the branches of this case expression have the "
          + "same value, so the case expression can be replaced by that "
          + "value.");
  private static final List<String> LET_DETAILS =
      ImmutableList.of("A case expression with a single pattern is better "
          + "written as a let expression.");
  private static final List<String> IF_DETAILS =
      ImmutableList.of("A condition is better checked using an `if` "
          + "expression.");

  /** Simplifies a "case" expression. Tries, in order: all arms have the
   * same value; the arms match "True" and "False"; there is one arm. */
  static List<Finding> caseOf(Ast.Exp exp, Context cx) {
    final Ast.Case kase = (Ast.Case) exp;
    Finding finding = sameArms(kase, cx);
    if (finding == null) {
      finding = booleanCase(kase, cx);
    }
    if (finding == null) {
      finding = destructure(kase, cx);
    }
    return finding == null ? ImmutableList.of() : ImmutableList.of(finding);
  }

  private static Ast.Pat unwrap(Ast.Pat pat) {
    while (pat instanceof Ast.ParensPat) {
      pat = ((Ast.ParensPat) pat).pat;
    }
    return pat;
  }

  /** Reports a case expression whose arms all evaluate to the same value.
   *
   * <p>Does not fire if an arm's body uses a variable that its pattern
   * binds, or if a pattern uses a constructor of a type that the
   * configuration says to ignore. */
  private static @Nullable Finding sameArms(Ast.Case kase, Context cx) {
    final Ast.Exp first = kase.matchList.get(0).exp;
    for (Ast.Match match : kase.matchList) {
      if (!cx.sameValue(first, match.exp)
          || Normalize.usesAny(match.exp, Normalize.bindings(match.pat))
          || usesIgnoredType(match.pat, cx)) {
        return null;
      }
    }
    return cx.replaceBy("Unnecessary case expression", SAME_DETAILS, first);
  }

  private static boolean usesIgnoredType(Ast.Pat pat, Context cx) {
    final List<Ast.Id> constructors = new ArrayList<>();
    pat.visit(p -> {
      if (p instanceof Ast.ConPat) {
        constructors.add(((Ast.ConPat) p).con);
      }
    });
    for (Ast.Id con : constructors) {
      final String type = cx.resolution.typeOfConstructor(con);
      if (type != null && cx.configuration.ignoresType(type)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the value of a "True" or "False" pattern, or null. */
  private static @Nullable Boolean booleanPattern(Ast.Pat pat, Context cx) {
    if (pat instanceof Ast.ConPat && ((Ast.ConPat) pat).args.isEmpty()) {
      final Ast.Id con = ((Ast.ConPat) pat).con;
      if (cx.resolves(con, "Basics", "True")) {
        return true;
      }
      if (cx.resolves(con, "Basics", "False")) {
        return false;
      }
    }
    return null;
  }

  /** Converts "case c of True -> a; False -> b" to "if c then a else b".
   * The second pattern may be a wildcard. */
  private static @Nullable Finding booleanCase(Ast.Case kase, Context cx) {
    if (kase.matchList.size() != 2) {
      return null;
    }
    final Ast.Match m0 = kase.matchList.get(0);
    final Ast.Match m1 = kase.matchList.get(1);
    final Boolean b0 = booleanPattern(unwrap(m0.pat), cx);
    final Boolean b1 = booleanPattern(unwrap(m1.pat), cx);
    if (b0 == null
        || (b1 == null ? unwrap(m1.pat).op != Op.WILDCARD_PAT : b0 == b1)) {
      return null;
    }
    final String prefix;
    final String suffix;
    if (b0) {
      prefix = "if ";
      suffix = " then ";
    } else if (Context.needsParens(kase.exp.op, Op.APPLY.right,
        Op.APPLY.right)) {
      prefix = "if " + cx.qualify("Basics", "not") + " (";
      suffix = ") then ";
    } else {
      prefix = "if " + cx.qualify("Basics", "not") + " ";
      suffix = " then ";
    }
    return cx.finding("Replace `case..of` by an `if` condition", IF_DETAILS,
        ImmutableList.of(
            Edit.replaceRangeBy(kase.pos.upToStartOf(kase.exp.pos), prefix),
            Edit.replaceRangeBy(kase.exp.pos.between(m0.exp.pos), suffix),
            Edit.replaceRangeBy(m0.exp.pos.between(m1.exp.pos), " else ")));
  }

  /** Converts "case x of (a, b) -> e" to "let (a, b) = x in e".
   *
   * <p>The pattern must always match: a tuple, a record, a variable, or a
   * constructor of a type that has only one constructor. Does not fire if
   * the pattern uses a constructor of a type that the configuration says
   * to ignore. The fix is
   * offered only if the pattern and the matched expression each fit on a
   * line. */
  private static @Nullable Finding destructure(Ast.Case kase, Context cx) {
    if (kase.matchList.size() != 1) {
      return null;
    }
    final Ast.Match match = kase.matchList.get(0);
    if (usesIgnoredType(match.pat, cx)
        || !alwaysMatches(unwrap(match.pat), cx)) {
      return null;
    }
    final String message = "Use a let expression to destructure data";
    if (!match.pat.pos.isSingleLine() || !kase.exp.pos.isSingleLine()) {
      return Finding.withoutFix(message, LET_DETAILS, kase.pos);
    }
    return cx.finding(message, LET_DETAILS,
        ImmutableList.of(
            Edit.replaceRangeBy(kase.pos.upToStartOf(match.exp.pos),
                "let " + cx.text(match.pat) + " = " + cx.text(kase.exp)
                    + " in ")));
  }

  private static boolean alwaysMatches(Ast.Pat pat, Context cx) {
    switch (pat.op) {
      case TUPLE_PAT:
      case RECORD_PAT:
      case ID_PAT:
        return true;
      case CON_PAT:
        final Ast.Id con = ((Ast.ConPat) pat).con;
        final String moduleName = cx.resolution.moduleOf(con);
        if (moduleName == null || moduleName.isEmpty()) {
          return false;
        }
        final String type =
            cx.resolution.dependencies().typeOfConstructor(moduleName,
                con.name);
        if (type == null) {
          return false;
        }
        final List<String> constructors =
            cx.resolution.dependencies().typeExists(moduleName, type);
        return constructors != null && constructors.size() == 1;
      default:
        return false;
    }
  }
}

// End CaseChecks.java
