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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.List;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Pos;

/** Rules for "let" expressions. */
final class LetChecks {
  private LetChecks() {}

  private static final List<String> JOIN_DETAILS =
      ImmutableList.of("The declarations of the inner let can be moved into "
          + "the outer let.");

  /** Joins "let a = 1 in let b = 2 in e" into "let a = 1; b = 2 in e".
   *
   * <p>The inner declarations are moved to the column of the outer
   * declarations. If a line cannot be moved left because it does not start
   * with enough spaces, there is no fix. */
  static List<Finding> let(Ast.Exp exp, Context cx) {
    final Ast.Let outer = (Ast.Let) exp;
    if (!(outer.exp instanceof Ast.Let)) {
      return ImmutableList.of();
    }
    final Ast.Let inner = (Ast.Let) outer.exp;
    final Ast.Decl lastOuter = Iterables.getLast(outer.decls);
    final Ast.Decl firstInner = inner.decls.get(0);
    final Ast.Decl lastInner = Iterables.getLast(inner.decls);
    final int column = outer.decls.get(0).pos.startColumn;
    final int shift = column - firstInner.pos.startColumn;

    final ImmutableList.Builder<Edit> edits = ImmutableList.builder();
    edits.add(
        Edit.replaceRangeBy(lastOuter.pos.between(firstInner.pos),
            "\n" + Strings.repeat(" ", column - 1)));
    for (int line = firstInner.pos.startLine + 1;
         line <= lastInner.pos.endLine; line++) {
      final String text = cx.source.line(line);
      if (text.trim().isEmpty() || shift == 0) {
        continue;
      }
      final Pos start = new Pos(exp.pos.file, line, 1, line, 1);
      if (shift > 0) {
        edits.add(Edit.insertAt(start, Strings.repeat(" ", shift)));
      } else if (text.startsWith(Strings.repeat(" ", -shift))) {
        edits.add(
            Edit.removeRange(new Pos(exp.pos.file, line, 1, line,
                1 - shift)));
      } else {
        return ImmutableList.of(
            Finding.withoutFix("Let blocks can be joined together",
                JOIN_DETAILS, inner.pos));
      }
    }
    return ImmutableList.of(
        cx.finding("Let blocks can be joined together", JOIN_DETAILS,
            inner.pos, edits.build()));
  }
}

// End LetChecks.java
