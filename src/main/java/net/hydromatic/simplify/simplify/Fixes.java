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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.simplify.ast.Pos;

/** Utilities for building and applying fixes. */
public final class Fixes {
  private Fixes() {}

  /** Sorts a list of edits, removes edits that do nothing, and checks that
   * no two edits overlap. */
  static ImmutableList<Edit> check(List<Edit> edits) {
    final List<Edit> list = new ArrayList<>();
    for (Edit edit : edits) {
      if (edit.kind == Edit.Kind.REMOVE && edit.pos.isEmpty()
          || edit.kind != Edit.Kind.REMOVE && edit.pos.isEmpty()
              && edit.text.isEmpty()) {
        continue;
      }
      list.add(edit);
    }
    list.sort(null);
    for (int i = 1; i < list.size(); i++) {
      checkArgument(!conflict(list.get(i - 1), list.get(i)),
          "edits overlap: %s, %s", list.get(i - 1), list.get(i));
    }
    return ImmutableList.copyOf(list);
  }

  /** Returns whether two edits cannot both be applied. Edits that are
   * adjacent do not conflict. */
  static boolean conflict(Edit e0, Edit e1) {
    return e0.pos.overlaps(e1.pos);
  }

  /** Returns edits that replace an expression by one of its
   * sub-expressions, keeping the sub-expression's text. */
  public static List<Edit> keepOnly(Pos outer, Pos sub) {
    checkArgument(outer.contains(sub), "%s does not contain %s", outer, sub);
    return ImmutableList.of(Edit.removeRange(outer.upToStartOf(sub)),
        Edit.removeRange(sub.between(outer.end())));
  }

  /** Returns edits that replace an expression by one of its
   * sub-expressions, wrapped in parentheses. */
  public static List<Edit> keepOnlyParenthesized(Pos outer, Pos sub) {
    checkArgument(outer.contains(sub), "%s does not contain %s", outer, sub);
    return ImmutableList.of(
        Edit.replaceRangeBy(outer.upToStartOf(sub), "("),
        Edit.replaceRangeBy(sub.between(outer.end()), ")"));
  }

  /** Returns the range from the start of one position to the end of
   * another. */
  public static Pos range(Pos start, Pos end) {
    return new Pos(start.file, start.startLine, start.startColumn,
        end.endLine, end.endColumn);
  }

  /** Applies a list of non-overlapping edits to a source text. */
  public static String apply(String source, List<Edit> edits) {
    final SourceText text = new SourceText(source);
    final List<Edit> sorted = check(edits);
    final StringBuilder b = new StringBuilder(source);
    for (int i = sorted.size() - 1; i >= 0; i--) {
      final Edit edit = sorted.get(i);
      b.replace(text.startOffset(edit.pos), text.endOffset(edit.pos),
          edit.text);
    }
    return b.toString();
  }

  /** Applies the fixes of several findings. A fix that conflicts with the
   * fix of an earlier finding is skipped. */
  public static String applyAll(String source, List<Finding> findings) {
    final List<Edit> accepted = new ArrayList<>();
    for (Finding finding : findings) {
      if (finding.fix == null || finding.fix.isEmpty()) {
        continue;
      }
      if (conflicts(accepted, finding.fix)) {
        continue;
      }
      accepted.addAll(finding.fix);
    }
    return apply(source, accepted);
  }

  private static boolean conflicts(List<Edit> accepted, List<Edit> edits) {
    for (Edit edit : edits) {
      for (Edit a : accepted) {
        if (conflict(a, edit) || a.pos.equals(edit.pos)) {
          return true;
        }
      }
    }
    return false;
  }
}

// End Fixes.java
