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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Op;
import net.hydromatic.simplify.ast.Visitor;
import net.hydromatic.simplify.parse.Parser;
import net.hydromatic.simplify.parse.SimplifyParseException;
import net.hydromatic.simplify.resolve.Dependencies;
import net.hydromatic.simplify.resolve.Resolution;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Finds expressions that can be simplified.
 *
 * <p>A simplifier is immutable. It visits each expression of each module,
 * outermost first, and applies the rules in its {@link RuleTable}. Findings
 * are returned, and also reported to the {@link Tracer}.
 *
 * <p>Example:
 *
 * <blockquote><pre>
 * Simplifier.create(Configuration.defaults())
 *     .simplify("module A exposing (..)\na = x || True\n");
 * </pre></blockquote>
 */
public class Simplifier {
  private final Configuration configuration;
  private final Dependencies dependencies;
  private final Tracer tracer;
  private final RuleTable ruleTable;

  private Simplifier(Configuration configuration, Dependencies dependencies,
      Tracer tracer, RuleTable ruleTable) {
    this.configuration = requireNonNull(configuration);
    this.dependencies = requireNonNull(dependencies);
    this.tracer = requireNonNull(tracer);
    this.ruleTable = requireNonNull(ruleTable);
  }

  /** Creates a simplifier with the standard rules and the core library. */
  public static Simplifier create(Configuration configuration) {
    return new Simplifier(configuration, Dependencies.core(),
        Tracers.empty(), RuleTable.standard());
  }

  /** Returns a copy of this simplifier with a given tracer. */
  public Simplifier withTracer(Tracer tracer) {
    return new Simplifier(configuration, dependencies, tracer, ruleTable);
  }

  /** Returns a copy of this simplifier with given dependencies. */
  public Simplifier withDependencies(Dependencies dependencies) {
    return new Simplifier(configuration, dependencies, tracer, ruleTable);
  }

  /** Returns a copy of this simplifier with a given rule table. */
  public Simplifier withRuleTable(RuleTable ruleTable) {
    return new Simplifier(configuration, dependencies, tracer, ruleTable);
  }

  /** Checks a single module. */
  public List<Finding> simplify(String source) {
    return run(ImmutableMap.of("", source));
  }

  /** Checks a project, given the source of each of its modules keyed by
   * file name.
   *
   * <p>If the configuration refers to types that do not exist, reports one
   * global finding, before the findings of the modules. */
  public List<Finding> run(Map<String, String> sources) {
    final Map<String, Ast.Module> modules = new LinkedHashMap<>();
    sources.forEach((file, source) -> {
      try {
        modules.put(file, Parser.parse(source, file));
      } catch (SimplifyParseException e) {
        if (!tracer.onParseException(e)) {
          throw e;
        }
      }
    });

    Dependencies projectDependencies = dependencies;
    for (Ast.Module module : modules.values()) {
      projectDependencies = projectDependencies.plus(module);
    }

    final List<Finding> findings = new ArrayList<>();
    final ConfigurationError error =
        configuration.validate(projectDependencies);
    if (error != null) {
      tracer.onConfigurationError(error);
      final Finding finding = error.toFinding();
      tracer.onFinding(finding);
      findings.add(finding);
    }

    for (Map.Entry<String, Ast.Module> entry : modules.entrySet()) {
      final Ast.Module module = entry.getValue();
      tracer.onModule(module);
      final Resolution resolution =
          Resolution.of(module, projectDependencies);
      final Walker walker =
          new Walker(module, new SourceText(sources.get(entry.getKey())),
              resolution);
      module.accept(walker);
      findings.addAll(walker.findings);
    }
    return findings;
  }

  /** Returns the conditions known to hold when an expression has a given
   * value. "a &amp;&amp; b" being True means that "a" and "b" are True;
   * "a || b" being False means that "a" and "b" are False; "not a" being
   * True means that "a" is False. */
  static List<Context.Fact> assume(Ast.Exp exp, boolean value,
      Resolution resolution) {
    final List<Context.Fact> facts = new ArrayList<>();
    assume(Normalize.unwrapParens(exp), value, resolution, facts);
    return facts;
  }

  private static void assume(Ast.Exp exp, boolean value,
      Resolution resolution, List<Context.Fact> facts) {
    facts.add(new Context.Fact(exp, value));
    if (exp.op == (value ? Op.AND : Op.OR)) {
      final Ast.InfixCall call = (Ast.InfixCall) exp;
      assume(Normalize.unwrapParens(call.a0), value, resolution, facts);
      assume(Normalize.unwrapParens(call.a1), value, resolution, facts);
      return;
    }
    final CallView call = CallView.of(exp);
    if (call != null
        && call.argCount() == 1
        && resolution.resolves(call.fn, "Basics", "not")) {
      assume(Normalize.unwrapParens(call.arg(0)), !value, resolution, facts);
    }
  }

  /** Visits every expression of a module, keeping track of each
   * expression's position and of the conditions known to hold. */
  private class Walker extends Visitor {
    final Ast.Module module;
    final SourceText source;
    final Resolution resolution;
    final Equivalence equivalence;
    final List<Finding> findings = new ArrayList<>();
    /** Calls that are part of a larger call that has been reported. */
    final Set<Ast.Exp> ignored =
        Collections.newSetFromMap(new IdentityHashMap<>());

    Ast.@Nullable Exp parent = null;
    int left = 0;
    int right = 0;
    int parentLeft = 0;
    int parentRight = 0;
    ImmutableList<Context.Fact> facts = ImmutableList.of();

    Walker(Ast.Module module, SourceText source, Resolution resolution) {
      this.module = module;
      this.source = source;
      this.resolution = resolution;
      this.equivalence = new Equivalence(resolution);
    }

    /** Applies the rules to an expression. */
    void check(Ast.Exp exp) {
      if (ignored.contains(exp)) {
        return;
      }
      final Context cx =
          new Context(module, source, resolution, equivalence, configuration,
              exp, parent, left, right, parentLeft, parentRight, facts);
      final List<Finding> list = ruleTable.check(exp, cx);
      if (list.isEmpty()) {
        return;
      }
      for (Finding finding : list) {
        tracer.onFinding(finding);
        findings.add(finding);
      }
      ignorePartialCalls(exp);
    }

    /** After a call has been reported, ignores the partial applications
     * within it; in "List.map f x", ignores "List.map f". */
    void ignorePartialCalls(Ast.Exp exp) {
      final Ast.Exp fn;
      switch (exp.op) {
        case APPLY:
          fn = Normalize.unwrapParens(((Ast.Apply) exp).fn);
          break;
        case PIPE_RIGHT:
          fn = Normalize.unwrapParens(((Ast.InfixCall) exp).a1);
          break;
        case PIPE_LEFT:
          fn = Normalize.unwrapParens(((Ast.InfixCall) exp).a0);
          break;
        default:
          return;
      }
      if (fn.op == Op.APPLY) {
        ignored.add(fn);
        ignorePartialCalls(fn);
      }
    }

    /** Visits a child expression at a given position. */
    void descend(Ast.@Nullable Exp parent, Ast.Exp child, int left,
        int right, ImmutableList<Context.Fact> facts) {
      final Ast.Exp saveParent = this.parent;
      final int saveLeft = this.left;
      final int saveRight = this.right;
      final int saveParentLeft = this.parentLeft;
      final int saveParentRight = this.parentRight;
      final ImmutableList<Context.Fact> saveFacts = this.facts;
      this.parent = parent;
      this.parentLeft = saveLeft;
      this.parentRight = saveRight;
      this.left = left;
      this.right = right;
      this.facts = facts;
      try {
        child.accept(this);
      } finally {
        this.parent = saveParent;
        this.left = saveLeft;
        this.right = saveRight;
        this.parentLeft = saveParentLeft;
        this.parentRight = saveParentRight;
        this.facts = saveFacts;
      }
    }

    /** Visits a child expression that can be written anywhere, such as an
     * element of a list, with the same known conditions as its parent. */
    void descend(Ast.Exp parent, Ast.Exp child) {
      descend(parent, child, 0, 0, facts);
    }

    ImmutableList<Context.Fact> plus(Ast.Exp condition, boolean value) {
      return ImmutableList.<Context.Fact>builder()
          .addAll(facts)
          .addAll(assume(condition, value, resolution))
          .build();
    }

    // leaves

    @Override protected void visit(Ast.Literal literal) {
      check(literal);
    }

    @Override protected void visit(Ast.Id id) {
      check(id);
    }

    @Override protected void visit(Ast.OpRef opRef) {
      check(opRef);
    }

    @Override protected void visit(Ast.RecordAccessFn recordAccessFn) {
      check(recordAccessFn);
    }

    // data

    @Override protected void visit(Ast.Parens parens) {
      check(parens);
      descend(parens, parens.exp);
    }

    @Override protected void visit(Ast.Tuple tuple) {
      check(tuple);
      tuple.args.forEach(arg -> descend(tuple, arg));
    }

    @Override protected void visit(Ast.ListExp list) {
      check(list);
      list.args.forEach(arg -> descend(list, arg));
    }

    @Override protected void visit(Ast.Record record) {
      check(record);
      record.setters.forEach(setter -> descend(record, setter.exp));
    }

    @Override protected void visit(Ast.RecordUpdate recordUpdate) {
      check(recordUpdate);
      recordUpdate.setters.forEach(setter ->
          descend(recordUpdate, setter.exp));
    }

    @Override protected void visit(Ast.RecordAccess recordAccess) {
      check(recordAccess);
      descend(recordAccess, recordAccess.exp, Op.RECORD_ACCESS.left,
          Op.RECORD_ACCESS.left, facts);
    }

    // control flow

    @Override protected void visit(Ast.If anIf) {
      check(anIf);
      descend(anIf, anIf.condition);
      descend(anIf, anIf.ifTrue, 0, 0, plus(anIf.condition, true));
      descend(anIf, anIf.ifFalse, 0, 0, plus(anIf.condition, false));
    }

    @Override protected void visit(Ast.Case kase) {
      check(kase);
      descend(kase, kase.exp);
      kase.matchList.forEach(match -> descend(kase, match.exp));
    }

    @Override protected void visit(Ast.Let let) {
      check(let);
      let.decls.forEach(this::accept);
      descend(let, let.exp);
    }

    @Override protected void visit(Ast.Fn fn) {
      check(fn);
      descend(fn, fn.exp);
    }

    // calls

    @Override protected void visit(Ast.Apply apply) {
      check(apply);
      descend(apply, apply.fn, left, Op.APPLY.left, facts);
      apply.args.forEach(arg ->
          descend(apply, arg, Op.APPLY.right, Op.APPLY.right, facts));
    }

    @Override protected void visit(Ast.InfixCall call) {
      check(call);
      final ImmutableList<Context.Fact> facts1;
      switch (call.op) {
        case AND:
          facts1 = plus(call.a0, true);
          break;
        case OR:
          facts1 = plus(call.a0, false);
          break;
        default:
          facts1 = facts;
      }
      descend(call, call.a0, left, call.op.left, facts);
      descend(call, call.a1, call.op.right, right, facts1);
    }

    @Override protected void visit(Ast.Negate negate) {
      check(negate);
      descend(negate, negate.exp, Op.NEGATE.right, Op.NEGATE.right, facts);
    }

    // declarations

    @Override protected void visit(Ast.FunDecl funDecl) {
      descend(null, funDecl.exp, 0, 0, facts);
    }

    @Override protected void visit(Ast.DestructDecl destructDecl) {
      descend(null, destructDecl.exp, 0, 0, facts);
    }
  }
}

// End Simplifier.java
