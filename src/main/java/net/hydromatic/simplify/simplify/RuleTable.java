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
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rules, indexed by the kind of expression they apply to.
 *
 * <p>Rules for an expression are tried in the order they were registered,
 * and the first rule that reports anything wins. Calls to library functions
 * ("List.map f x", "x |> List.map f") are dispatched a second time, on the
 * canonical name of the function.
 */
public class RuleTable {
  private final ImmutableMap<Op, ImmutableList<Rule>> rules;
  private final ImmutableMap<String, ImmutableList<CallCheck>> calls;

  private RuleTable(ImmutableMap<Op, ImmutableList<Rule>> rules,
      ImmutableMap<String, ImmutableList<CallCheck>> calls) {
    this.rules = rules;
    this.calls = calls;
  }

  /** Creates an empty builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the table of all standard rules. */
  public static RuleTable standard() {
    final Builder b = builder();

    // Basics
    b.rule(Op.OR, BooleanChecks::or);
    b.rule(Op.AND, BooleanChecks::and);
    b.rule(Op.EQ, ComparisonChecks::equality);
    b.rule(Op.NE, ComparisonChecks::equality);
    for (Op op : ImmutableList.of(Op.LT, Op.GT, Op.LE, Op.GE)) {
      b.rule(op, ComparisonChecks::ordering);
    }
    b.rule(Op.PLUS, NumberChecks::plus);
    b.rule(Op.MINUS, NumberChecks::minus);
    b.rule(Op.TIMES, NumberChecks::times);
    b.rule(Op.DIVIDE, NumberChecks::divide);
    b.rule(Op.INT_DIVIDE, NumberChecks::divide);
    b.rule(Op.NEGATE, NumberChecks::negate);
    b.rule(Op.COMPOSE_LEFT, FunctionChecks::composition);
    b.rule(Op.COMPOSE_RIGHT, FunctionChecks::composition);
    b.call("Basics.identity", FunctionChecks::identity);
    b.call("Basics.always", FunctionChecks::always);
    b.call("Basics.not", BooleanChecks::not);
    b.call("Basics.negate", NumberChecks::negateCall);

    // Control flow and data
    b.rule(Op.IF, IfChecks::ifThenElse);
    b.rule(Op.CASE, CaseChecks::caseOf);
    b.rule(Op.LET, LetChecks::let);
    b.rule(Op.RECORD_ACCESS, RecordChecks::recordAccess);
    b.rule(Op.RECORD_UPDATE, RecordChecks::recordUpdate);
    b.rule(Op.APPEND, ListChecks::append);
    b.rule(Op.CONS, ListChecks::cons);

    // Library modules
    ListChecks.register(b);
    StringChecks.register(b);
    MaybeResultChecks.register(b);
    ContainerChecks.register(b);
    return b.build();
  }

  /** Returns the rules for a kind of expression. */
  public List<Rule> rules(Op op) {
    final ImmutableList<Rule> list = rules.get(op);
    return list == null ? ImmutableList.of() : list;
  }

  /** Checks an expression, returning the findings of the first rule that
   * has any. Function calls are then checked by the function called. */
  public List<Finding> check(Ast.Exp exp, Context cx) {
    for (Rule rule : rules(exp.op)) {
      final List<Finding> findings = rule.check(exp, cx);
      if (!findings.isEmpty()) {
        return findings;
      }
    }
    if (exp.op == Op.APPLY || exp.op.isPipe()) {
      return checkCall(exp, cx);
    }
    return ImmutableList.of();
  }

  /** Checks a function call by the function being called. */
  private List<Finding> checkCall(Ast.Exp exp, Context cx) {
    final CallView call = CallView.of(exp);
    if (call == null) {
      return ImmutableList.of();
    }
    final @Nullable Finding finding;
    switch (call.fn.op) {
      case ID:
        finding = checkLibraryCall(call, cx);
        break;
      case OP_REF:
        finding = FunctionChecks.prefixOperator(call, cx);
        break;
      case FN:
        finding = FunctionChecks.appliedLambda(call, cx);
        break;
      case RECORD_ACCESS_FN:
        finding = RecordChecks.accessFunction(call, cx);
        break;
      default:
        finding = null;
    }
    return finding == null ? ImmutableList.of() : ImmutableList.of(finding);
  }

  private @Nullable Finding checkLibraryCall(CallView call, Context cx) {
    final Ast.Id id = (Ast.Id) call.fn;
    final String moduleName = cx.resolution.moduleOf(id);
    if (moduleName == null || moduleName.isEmpty()) {
      return null;
    }
    final ImmutableList<CallCheck> checks =
        calls.get(moduleName + "." + id.name);
    if (checks == null) {
      return null;
    }
    for (CallCheck check : checks) {
      final Finding finding = check.check(call, cx);
      if (finding != null) {
        return finding;
      }
    }
    return null;
  }

  /** Builder for a {@link RuleTable}. */
  public static class Builder {
    private final Map<Op, ImmutableList.Builder<Rule>> rules =
        new LinkedHashMap<>();
    private final Map<String, ImmutableList.Builder<CallCheck>> calls =
        new LinkedHashMap<>();

    /** Adds a rule for a kind of expression. */
    public Builder rule(Op op, Rule rule) {
      rules.computeIfAbsent(op, k -> ImmutableList.builder()).add(rule);
      return this;
    }

    /** Adds a check for calls to a function, given its canonical name,
     * such as "List.map" or "Platform.Cmd.batch". */
    public Builder call(String qualifiedName, CallCheck check) {
      calls.computeIfAbsent(qualifiedName, name -> ImmutableList.builder())
          .add(check);
      return this;
    }

    public RuleTable build() {
      final ImmutableMap.Builder<String, ImmutableList<CallCheck>> callMap =
          ImmutableMap.builder();
      calls.forEach((name, b) -> callMap.put(name, b.build()));
      final ImmutableMap.Builder<Op, ImmutableList<Rule>> ruleMap =
          ImmutableMap.builder();
      rules.forEach((op, b) -> ruleMap.put(op, b.build()));
      return new RuleTable(ruleMap.build(), callMap.build());
    }
  }
}

// End RuleTable.java
