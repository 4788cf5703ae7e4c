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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.AstNode;
import net.hydromatic.simplify.ast.Op;
import net.hydromatic.simplify.ast.Pos;
import net.hydromatic.simplify.resolve.Resolution;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Everything a rule knows about the expression it is checking.
 *
 * <p>A context is immutable. It holds the services shared by all rules in a
 * module (source text, name resolution, equivalence, configuration) and
 * the state of the current node: the precedence of the surrounding syntax,
 * the enclosing parentheses, and the conditions known to be true or false
 * on the path from the root. The simplifier creates a new context for
 * each node it visits.
 */
public class Context {
  public final Ast.Module module;
  public final SourceText source;
  public final Resolution resolution;
  public final Equivalence equivalence;
  public final Configuration configuration;

  /** The node being checked. */
  public final Ast.Exp node;
  /** The node's parent, or null if it is the body of a declaration. */
  public final Ast.@Nullable Exp parent;
  /** Left precedence of the node's position. */
  final int left;
  /** Right precedence of the node's position. */
  final int right;
  /** Left precedence of the parent's position. */
  final int parentLeft;
  /** Right precedence of the parent's position. */
  final int parentRight;
  /** Conditions whose value is known, innermost last. */
  final ImmutableList<Fact> facts;

  Context(Ast.Module module, SourceText source, Resolution resolution,
      Equivalence equivalence, Configuration configuration, Ast.Exp node,
      Ast.@Nullable Exp parent, int left, int right, int parentLeft,
      int parentRight, ImmutableList<Fact> facts) {
    this.module = requireNonNull(module);
    this.source = requireNonNull(source);
    this.resolution = requireNonNull(resolution);
    this.equivalence = requireNonNull(equivalence);
    this.configuration = requireNonNull(configuration);
    this.node = requireNonNull(node);
    this.parent = parent;
    this.left = left;
    this.right = right;
    this.parentLeft = parentLeft;
    this.parentRight = parentRight;
    this.facts = requireNonNull(facts);
  }

  /** Returns the dotted name of the module under analysis. */
  public String moduleName() {
    return String.join(".", module.moduleName);
  }

  /** Returns the source text of a node. */
  public String text(AstNode node) {
    return source.text(node.pos);
  }

  /** Returns the source text of a range. */
  public String text(Pos pos) {
    return source.text(pos);
  }

  /** Shorthand for {@link Resolution#resolves}. */
  public boolean resolves(Ast.Exp exp, String moduleName, String name) {
    return resolution.resolves(exp, moduleName, name);
  }

  /** Shorthand for {@link Resolution#qualify}. */
  public String qualify(String moduleName, String name) {
    return resolution.qualify(moduleName, name);
  }

  /** Shorthand for {@link Equivalence#sameValue}. */
  public boolean sameValue(Ast.Exp e0, Ast.Exp e1) {
    return equivalence.sameValue(e0, e1);
  }

  /** Returns the value of a boolean expression if it is known: a literal
   * {@code True} or {@code False}, a condition whose value is known on the
   * path to this node, or the negation of either. Returns null if the
   * value is not known. */
  public @Nullable Boolean knownBoolean(Ast.Exp exp) {
    final Boolean b = Normalize.booleanValue(exp, resolution);
    if (b != null) {
      return b;
    }
    for (Fact fact : facts.reverse()) {
      if (equivalence.sameValue(fact.exp, exp)) {
        return fact.value;
      }
    }
    final Ast.Exp negated = negated(exp);
    if (negated != null) {
      final Boolean b2 = knownBoolean(negated);
      return b2 == null ? null : !b2;
    }
    return null;
  }

  /** If an expression is a call to {@code not}, returns its argument. */
  public Ast.@Nullable Exp negated(Ast.Exp exp) {
    final CallView call = CallView.of(Normalize.unwrapParens(exp));
    if (call != null
        && call.argCount() == 1
        && resolves(call.fn, "Basics", "not")) {
      return call.arg(0);
    }
    return null;
  }

  // Fixes

  /** Returns whether an expression with a given operator would need
   * parentheses in a position with given left and right precedence. */
  static boolean needsParens(Op op, int left, int right) {
    return left > op.left || op.right < right;
  }

  /** Returns whether an expression would need parentheses if it replaced
   * the current node. */
  public boolean needsParens(Op op) {
    return needsParens(op, left, right);
  }

  /** Returns whether the current node can be replaced by an expression
   * without the parentheses that enclose the node. */
  private boolean canStripParens(Op op) {
    return parent instanceof Ast.Parens
        && !needsParens(op, parentLeft, parentRight);
  }

  /** Returns edits that replace the current node by one of its
   * sub-expressions, adding parentheses if the sub-expression needs them
   * and removing the node's own parentheses if it no longer needs them.
   * Parentheses around the sub-expression are not kept unless needed. */
  public List<Edit> replaceBy(Ast.Exp exp) {
    final Ast.Exp sub = Normalize.unwrapParens(exp);
    if (canStripParens(sub.op)) {
      return Fixes.keepOnly(requireNonNull(parent).pos, sub.pos);
    }
    return replaceBy(node, left, right, sub);
  }

  /** Returns edits that replace a node, in a position with given
   * precedence, by one of its sub-expressions. */
  public static List<Edit> replaceBy(Ast.Exp target, int left, int right,
      Ast.Exp sub) {
    if (target == sub) {
      return ImmutableList.of();
    }
    if (needsParens(sub.op, left, right)) {
      return Fixes.keepOnlyParenthesized(target.pos, sub.pos);
    }
    return Fixes.keepOnly(target.pos, sub.pos);
  }

  /** Returns edits that replace the current node by some text. The
   * operator is that of the expression the text represents, and determines
   * whether the text needs parentheses. */
  public List<Edit> replaceByText(String text, Op op) {
    if (canStripParens(op)) {
      return ImmutableList.of(
          Edit.replaceRangeBy(requireNonNull(parent).pos, text));
    }
    return ImmutableList.of(
        Edit.replaceRangeBy(node.pos,
            needsParens(op) ? "(" + text + ")" : text));
  }

  /** Returns the text of an expression, in parentheses if it would need
   * them in a position with given precedence. */
  public String textIn(Ast.Exp exp, int left, int right) {
    final String text = text(exp);
    return needsParens(exp.op, left, right) ? "(" + text + ")" : text;
  }

  /** Returns the text of an expression, in parentheses if it would need
   * them as the argument of a function. */
  public String argText(Ast.Exp exp) {
    return textIn(exp, Op.APPLY.right, Op.APPLY.right);
  }

  /** Creates a finding at the current node. */
  public Finding finding(String message, List<String> details,
      List<Edit> fix) {
    return Finding.of(message, details, node.pos, fix);
  }

  /** Creates a finding at a given range. */
  public Finding finding(String message, List<String> details, Pos pos,
      List<Edit> fix) {
    return Finding.of(message, details, pos, fix);
  }

  /** Creates a finding that replaces the current node by one of its
   * sub-expressions. */
  public Finding replaceBy(String message, List<String> details,
      Ast.Exp sub) {
    return finding(message, details, replaceBy(sub));
  }

  /** Creates a finding that replaces the current node by some text. */
  public Finding replaceByText(String message, List<String> details,
      String text, Op op) {
    return finding(message, details, replaceByText(text, op));
  }

  /** A condition whose value is known. */
  static class Fact {
    final Ast.Exp exp;
    final boolean value;

    Fact(Ast.Exp exp, boolean value) {
      this.exp = requireNonNull(exp);
      this.value = value;
    }
  }
}

// End Context.java
