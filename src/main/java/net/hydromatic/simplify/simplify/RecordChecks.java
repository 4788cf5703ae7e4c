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

/** Rules for records. */
final class RecordChecks {
  private RecordChecks() {}

  private static final String ACCESS = "Field access can be simplified";
  private static final List<String> ACCESS_DETAILS =
      ImmutableList.of("Accessing a field of a record literal or record "
          + "update can be replaced by the field's value.");
  private static final List<String> UNRELATED_ACCESS_DETAILS =
      ImmutableList.of("The record update does not assign this field, so "
          + "the field can be accessed on the original record.");
  private static final List<String> PUSH_DOWN_DETAILS =
      ImmutableList.of("Every branch produces a record, so the field can be "
          + "accessed in each branch.");
  private static final List<String> ASSIGNMENT_DETAILS =
      ImmutableList.of("The field is being set to its own value.");

  /** Simplifies "{ a = x }.a", "{ r | a = x }.a", "{ r | b = x }.a", and
   * access to a field of an "if", "case" or "let" whose branches are all
   * records. */
  static List<Finding> recordAccess(Ast.Exp exp, Context cx) {
    final Ast.RecordAccess access = (Ast.RecordAccess) exp;
    final String field = access.field.name;
    final Ast.Exp record = Normalize.unwrapParens(access.exp);
    final Finding finding = project(record, field, cx);
    if (finding != null) {
      return ImmutableList.of(finding);
    }
    if (!(record instanceof Ast.If
        || record instanceof Ast.Case
        || record instanceof Ast.Let)) {
      return ImmutableList.of();
    }
    final List<Ast.Exp> leaves = new ArrayList<>();
    addLeaves(record, leaves);
    final ImmutableList.Builder<Edit> edits = ImmutableList.builder();
    for (Ast.Exp leaf : leaves) {
      final List<Edit> leafEdits = projectLeaf(leaf, field, cx);
      if (leafEdits == null) {
        return ImmutableList.of();
      }
      edits.addAll(leafEdits);
    }
    edits.add(Edit.removeRange(access.exp.pos.fromEndTo(access.pos)));
    return ImmutableList.of(
        cx.finding(ACCESS, PUSH_DOWN_DETAILS, edits.build()));
  }

  /** Simplifies ".a { a = x }". */
  static @Nullable Finding accessFunction(CallView call, Context cx) {
    if (call.argCount() != 1) {
      return null;
    }
    return project(Normalize.unwrapParens(call.arg(0)),
        ((Ast.RecordAccessFn) call.fn).field, cx);
  }

  /** If a record expression is a literal or an update, returns a finding
   * that replaces the current node by the value of a field. */
  private static @Nullable Finding project(Ast.Exp record, String field,
      Context cx) {
    if (record instanceof Ast.Record) {
      final Ast.Setter setter = ((Ast.Record) record).setter(field);
      return setter == null ? null
          : cx.replaceBy(ACCESS, ACCESS_DETAILS, setter.exp);
    }
    if (record instanceof Ast.RecordUpdate) {
      final Ast.RecordUpdate update = (Ast.RecordUpdate) record;
      final Ast.Setter setter = update.setter(field);
      if (setter != null) {
        return cx.replaceBy(ACCESS, ACCESS_DETAILS, setter.exp);
      }
      return cx.replaceByText(ACCESS, UNRELATED_ACCESS_DETAILS,
          cx.text(update.record) + "." + field, Op.RECORD_ACCESS);
    }
    return null;
  }

  private static void addLeaves(Ast.Exp exp, List<Ast.Exp> leaves) {
    final Ast.Exp e = Normalize.unwrapParens(exp);
    switch (e.op) {
      case IF:
        addLeaves(((Ast.If) e).ifTrue, leaves);
        addLeaves(((Ast.If) e).ifFalse, leaves);
        break;
      case CASE:
        for (Ast.Match match : ((Ast.Case) e).matchList) {
          addLeaves(match.exp, leaves);
        }
        break;
      case LET:
        addLeaves(((Ast.Let) e).exp, leaves);
        break;
      default:
        leaves.add(exp);
    }
  }

  /** Returns edits that replace a branch that is a record by the value of
   * one of its fields, or null if the branch is not a record. */
  private static @Nullable List<Edit> projectLeaf(Ast.Exp leaf,
      String field, Context cx) {
    final Ast.Exp record = Normalize.unwrapParens(leaf);
    if (record instanceof Ast.Record) {
      final Ast.Setter setter = ((Ast.Record) record).setter(field);
      return setter == null ? null
          : Context.replaceBy(leaf, 0, 0, setter.exp);
    }
    if (record instanceof Ast.RecordUpdate) {
      final Ast.RecordUpdate update = (Ast.RecordUpdate) record;
      final Ast.Setter setter = update.setter(field);
      if (setter != null) {
        return Context.replaceBy(leaf, 0, 0, setter.exp);
      }
      return ImmutableList.of(
          Edit.replaceRangeBy(leaf.pos,
              cx.text(update.record) + "." + field));
    }
    return null;
  }

  /** Removes assignments such as "a = r.a" from "{ r | a = r.a }". If every
   * assignment is removed, the update becomes "r". */
  static List<Finding> recordUpdate(Ast.Exp exp, Context cx) {
    final Ast.RecordUpdate update = (Ast.RecordUpdate) exp;
    final List<Integer> redundant = new ArrayList<>();
    for (int i = 0; i < update.setters.size(); i++) {
      if (assignsItself(update, update.setters.get(i), cx)) {
        redundant.add(i);
      }
    }
    if (redundant.isEmpty()) {
      return ImmutableList.of();
    }
    if (redundant.size() == update.setters.size()) {
      return ImmutableList.of(
          cx.replaceBy("Unnecessary field assignment", ASSIGNMENT_DETAILS,
              update.record));
    }
    final ImmutableList.Builder<Finding> findings = ImmutableList.builder();
    for (int i : redundant) {
      final Ast.Setter setter = update.setters.get(i);
      final Edit edit = i > 0
          ? Edit.removeRange(
              Fixes.range(update.setters.get(i - 1).pos.end(), setter.pos))
          : Edit.removeRange(
              setter.pos.upToStartOf(update.setters.get(1).pos));
      findings.add(
          cx.finding("Unnecessary field assignment", ASSIGNMENT_DETAILS,
              setter.pos, ImmutableList.of(edit)));
    }
    return findings.build();
  }

  private static boolean assignsItself(Ast.RecordUpdate update,
      Ast.Setter setter, Context cx) {
    final Ast.Exp value = Normalize.unwrapParens(setter.exp);
    if (value instanceof Ast.RecordAccess) {
      final Ast.RecordAccess access = (Ast.RecordAccess) value;
      return access.field.name.equals(setter.name())
          && cx.sameValue(access.exp, update.record);
    }
    return false;
  }
}

// End RecordChecks.java
