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
import java.math.BigDecimal;
import java.util.List;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Op;
import net.hydromatic.simplify.resolve.Resolution;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides whether two expressions always evaluate to the same value.
 *
 * <p>The decision is sound but incomplete. {@link Result#EQUAL} means the
 * expressions are guaranteed to have the same value, {@link Result#NOT_EQUAL}
 * means they are guaranteed to have different values, and
 * {@link Result#UNKNOWN} means that neither could be proved.
 *
 * <p>Comparison looks through parentheses, pipes and the various ways of
 * writing a call, and treats identifiers as equal if they resolve to the
 * same definition.
 */
public class Equivalence {
  private final Resolution resolution;

  public Equivalence(Resolution resolution) {
    this.resolution = requireNonNull(resolution);
  }

  /** Result of a comparison. */
  public enum Result {
    EQUAL, NOT_EQUAL, UNKNOWN;

    /** Returns the result for a boolean value: {@link #EQUAL} for true,
     * {@link #NOT_EQUAL} for false. */
    public static Result of(boolean b) {
      return b ? EQUAL : NOT_EQUAL;
    }
  }

  /** Returns whether two expressions are guaranteed to have the same
   * value. */
  public boolean sameValue(Ast.Exp e0, Ast.Exp e1) {
    return compare(e0, e1) == Result.EQUAL;
  }

  /** Compares two expressions. */
  public Result compare(Ast.Exp e0, Ast.Exp e1) {
    e0 = Normalize.unwrapParens(e0);
    e1 = Normalize.unwrapParens(e1);

    final BigDecimal n0 = number(e0);
    final BigDecimal n1 = number(e1);
    if (n0 != null && n1 != null) {
      return Result.of(n0.compareTo(n1) == 0);
    }

    if (e0 instanceof Ast.Literal && e1 instanceof Ast.Literal) {
      final Ast.Literal l0 = (Ast.Literal) e0;
      final Ast.Literal l1 = (Ast.Literal) e1;
      if (l0.op != l1.op) {
        return Result.UNKNOWN;
      }
      return Result.of(l0.value.equals(l1.value));
    }

    final Constructed c0 = constructed(e0);
    final Constructed c1 = constructed(e1);
    if (c0 != null && c1 != null) {
      return compareConstructed(c0, c1);
    }

    switch (e0.op) {
      case ID:
        if (e1 instanceof Ast.Id) {
          return compareIds((Ast.Id) e0, (Ast.Id) e1);
        }
        break;

      case OP_REF:
        if (e1 instanceof Ast.OpRef) {
          return ((Ast.OpRef) e0).operator == ((Ast.OpRef) e1).operator
              ? Result.EQUAL
              : Result.UNKNOWN;
        }
        break;

      case RECORD_ACCESS_FN:
        if (e1 instanceof Ast.RecordAccessFn) {
          return ((Ast.RecordAccessFn) e0).field.equals(
              ((Ast.RecordAccessFn) e1).field)
              ? Result.EQUAL
              : Result.UNKNOWN;
        }
        break;

      case LIST:
        if (e1 instanceof Ast.ListExp) {
          final List<Ast.Exp> args0 = ((Ast.ListExp) e0).args;
          final List<Ast.Exp> args1 = ((Ast.ListExp) e1).args;
          if (args0.size() != args1.size()) {
            return Result.NOT_EQUAL;
          }
          return compareData(args0, args1);
        }
        break;

      case TUPLE:
        if (e1 instanceof Ast.Tuple) {
          final List<Ast.Exp> args0 = ((Ast.Tuple) e0).args;
          final List<Ast.Exp> args1 = ((Ast.Tuple) e1).args;
          if (args0.size() == args1.size()) {
            return compareData(args0, args1);
          }
        }
        break;

      case RECORD:
        if (e1 instanceof Ast.Record) {
          return compareRecords((Ast.Record) e0, (Ast.Record) e1);
        }
        break;

      case RECORD_UPDATE:
        if (e1 instanceof Ast.RecordUpdate) {
          return compareRecordUpdates((Ast.RecordUpdate) e0,
              (Ast.RecordUpdate) e1);
        }
        break;

      case NEGATE:
        if (e1 instanceof Ast.Negate) {
          return compare(((Ast.Negate) e0).exp, ((Ast.Negate) e1).exp);
        }
        break;

      case IF:
        if (e1 instanceof Ast.If) {
          final Ast.If if0 = (Ast.If) e0;
          final Ast.If if1 = (Ast.If) e1;
          return allEqual(compare(if0.condition, if1.condition),
              compare(if0.ifTrue, if1.ifTrue),
              compare(if0.ifFalse, if1.ifFalse));
        }
        break;

      case CASE:
        if (e1 instanceof Ast.Case) {
          return compareCases((Ast.Case) e0, (Ast.Case) e1);
        }
        break;

      case LET:
        if (e1 instanceof Ast.Let) {
          return compareLets((Ast.Let) e0, (Ast.Let) e1);
        }
        break;

      case FN:
        if (e1 instanceof Ast.Fn) {
          final Ast.Fn fn0 = (Ast.Fn) e0;
          final Ast.Fn fn1 = (Ast.Fn) e1;
          if (fn0.pats.toString().equals(fn1.pats.toString())) {
            return allEqual(compare(fn0.exp, fn1.exp));
          }
        }
        break;

      case COMPOSE_LEFT:
      case COMPOSE_RIGHT:
        if (e1.op.isComposition()) {
          final List<Ast.Exp> chain0 = Normalize.compositionChain(e0);
          final List<Ast.Exp> chain1 = Normalize.compositionChain(e1);
          if (chain0.size() == chain1.size()) {
            return compareCall(chain0, chain1);
          }
        }
        return Result.UNKNOWN;

      default:
        break;
    }

    final Access a0 = access(e0);
    final Access a1 = access(e1);
    if (a0 != null && a1 != null) {
      if (a0.field.equals(a1.field)) {
        return allEqual(compare(a0.exp, a1.exp));
      }
      return Result.UNKNOWN;
    }

    final CallView call0 = CallView.ofAny(e0);
    final CallView call1 = CallView.ofAny(e1);
    if (call0 != null && call1 != null) {
      return compareCalls(call0, call1);
    }
    return Result.UNKNOWN;
  }

  /** Evaluates an expression that consists of numeric literals, negation,
   * addition, subtraction and multiplication; returns null if the
   * expression is not of that form.
   *
   * <p>Arithmetic on integer literals is exact. Once a float literal is
   * involved, arithmetic is in {@code double}, and the result is the exact
   * value of that {@code double}; so "0.1 + 0.2" is not equal to "0.3". */
  public static @Nullable BigDecimal number(Ast.Exp exp) {
    final Number n = evaluate(exp);
    if (n instanceof Double) {
      final double d = (Double) n;
      return Double.isFinite(d) ? new BigDecimal(d) : null;
    }
    return (BigDecimal) n;
  }

  /** Evaluates a numeric expression. Returns a {@link BigDecimal} if every
   * literal is an integer, a {@link Double} if any literal is a float, or
   * null. */
  private static @Nullable Number evaluate(Ast.Exp exp) {
    exp = Normalize.unwrapParens(exp);
    switch (exp.op) {
      case INT_LITERAL:
        return (BigDecimal) ((Ast.Literal) exp).value;
      case FLOAT_LITERAL:
        return ((BigDecimal) ((Ast.Literal) exp).value).doubleValue();
      case NEGATE:
        final Number n = evaluate(((Ast.Negate) exp).exp);
        if (n instanceof Double) {
          return -((Double) n);
        }
        return n == null ? null : ((BigDecimal) n).negate();
      case PLUS:
      case MINUS:
      case TIMES:
        final Ast.InfixCall call = (Ast.InfixCall) exp;
        final Number n0 = evaluate(call.a0);
        final Number n1 = evaluate(call.a1);
        if (n0 == null || n1 == null) {
          return null;
        }
        if (n0 instanceof Double || n1 instanceof Double) {
          final double d0 = n0.doubleValue();
          final double d1 = n1.doubleValue();
          return exp.op == Op.PLUS ? d0 + d1
              : exp.op == Op.MINUS ? d0 - d1
              : d0 * d1;
        }
        final BigDecimal b0 = (BigDecimal) n0;
        final BigDecimal b1 = (BigDecimal) n1;
        return exp.op == Op.PLUS ? b0.add(b1)
            : exp.op == Op.MINUS ? b0.subtract(b1)
            : b0.multiply(b1);
      default:
        return null;
    }
  }

  private Result compareIds(Ast.Id id0, Ast.Id id1) {
    if (!id0.name.equals(id1.name)) {
      return Result.UNKNOWN;
    }
    final String module0 = resolution.moduleOf(id0);
    final String module1 = resolution.moduleOf(id1);
    if (module0 == null && module1 == null) {
      // Neither is resolved; equal only if written the same way.
      return id0.moduleName.equals(id1.moduleName)
          ? Result.EQUAL
          : Result.UNKNOWN;
    }
    return module0 != null && module0.equals(module1)
        ? Result.EQUAL
        : Result.UNKNOWN;
  }

  private Result compareConstructed(Constructed c0, Constructed c1) {
    final String module0 = resolution.moduleOf(c0.con);
    final String module1 = resolution.moduleOf(c1.con);
    if (module0 == null || !module0.equals(module1)) {
      return Result.UNKNOWN;
    }
    if (c0.con.name.equals(c1.con.name)) {
      if (c0.args.size() != c1.args.size()) {
        return Result.UNKNOWN;
      }
      return compareData(c0.args, c1.args);
    }
    final String type0 = resolution.typeOfConstructor(c0.con);
    final String type1 = resolution.typeOfConstructor(c1.con);
    return type0 != null && type0.equals(type1)
        ? Result.NOT_EQUAL
        : Result.UNKNOWN;
  }

  private Result compareRecords(Ast.Record r0, Ast.Record r1) {
    if (r0.setters.size() != r1.setters.size()) {
      return Result.UNKNOWN;
    }
    Result result = Result.EQUAL;
    for (Ast.Setter setter0 : r0.setters) {
      final Ast.Setter setter1 = r1.setter(setter0.name());
      if (setter1 == null) {
        return Result.UNKNOWN;
      }
      final Result c = compare(setter0.exp, setter1.exp);
      if (c == Result.NOT_EQUAL) {
        return c;
      }
      if (c == Result.UNKNOWN) {
        result = Result.UNKNOWN;
      }
    }
    return result;
  }

  /** Compares two record updates. They can be equal only if they update
   * the same record. Whatever the records, they differ if a field that both
   * assign has different values. */
  private Result compareRecordUpdates(Ast.RecordUpdate u0,
      Ast.RecordUpdate u1) {
    final boolean sameRecord =
        compareIds(u0.record, u1.record) == Result.EQUAL;
    boolean sameFields = sameRecord && u0.setters.size() == u1.setters.size();
    Result result = Result.EQUAL;
    for (Ast.Setter setter0 : u0.setters) {
      final Ast.Setter setter1 = u1.setter(setter0.name());
      if (setter1 == null) {
        sameFields = false;
        continue;
      }
      final Result c = compare(setter0.exp, setter1.exp);
      if (c == Result.NOT_EQUAL) {
        return c;
      }
      if (c == Result.UNKNOWN) {
        result = Result.UNKNOWN;
      }
    }
    return sameFields ? result : Result.UNKNOWN;
  }

  private Result compareCases(Ast.Case case0, Ast.Case case1) {
    if (case0.matchList.size() != case1.matchList.size()
        || !sameValue(case0.exp, case1.exp)) {
      return Result.UNKNOWN;
    }
    for (int i = 0; i < case0.matchList.size(); i++) {
      final Ast.Match m0 = case0.matchList.get(i);
      final Ast.Match m1 = case1.matchList.get(i);
      if (!m0.pat.toString().equals(m1.pat.toString())
          || !sameValue(m0.exp, m1.exp)) {
        return Result.UNKNOWN;
      }
    }
    return Result.EQUAL;
  }

  private Result compareLets(Ast.Let let0, Ast.Let let1) {
    if (let0.decls.size() != let1.decls.size()) {
      return Result.UNKNOWN;
    }
    for (int i = 0; i < let0.decls.size(); i++) {
      final Ast.Decl d0 = let0.decls.get(i);
      final Ast.Decl d1 = let1.decls.get(i);
      if (d0 instanceof Ast.FunDecl && d1 instanceof Ast.FunDecl) {
        final Ast.FunDecl f0 = (Ast.FunDecl) d0;
        final Ast.FunDecl f1 = (Ast.FunDecl) d1;
        if (!f0.name.name.equals(f1.name.name)
            || !f0.pats.toString().equals(f1.pats.toString())
            || !sameValue(f0.exp, f1.exp)) {
          return Result.UNKNOWN;
        }
      } else if (d0 instanceof Ast.DestructDecl
          && d1 instanceof Ast.DestructDecl) {
        final Ast.DestructDecl x0 = (Ast.DestructDecl) d0;
        final Ast.DestructDecl x1 = (Ast.DestructDecl) d1;
        if (!x0.pat.toString().equals(x1.pat.toString())
            || !sameValue(x0.exp, x1.exp)) {
          return Result.UNKNOWN;
        }
      } else {
        return Result.UNKNOWN;
      }
    }
    return allEqual(compare(let0.exp, let1.exp));
  }

  private Result compareCalls(CallView call0, CallView call1) {
    if (call0.argCount() != call1.argCount()) {
      return Result.UNKNOWN;
    }
    if (compare(call0.fn, call1.fn) != Result.EQUAL) {
      return Result.UNKNOWN;
    }
    if (compareCall(call0.args, call1.args) == Result.EQUAL) {
      return Result.EQUAL;
    }
    if (call0.argCount() == 2 && isCommutative(call0.fn)) {
      return allEqual(compare(call0.arg(0), call1.arg(1)),
          compare(call0.arg(1), call1.arg(0)));
    }
    return Result.UNKNOWN;
  }

  private boolean isCommutative(Ast.Exp fn) {
    if (fn instanceof Ast.OpRef) {
      switch (((Ast.OpRef) fn).operator) {
        case PLUS:
        case TIMES:
        case EQ:
        case NE:
        case AND:
        case OR:
          return true;
        default:
          return false;
      }
    }
    return false;
  }

  /** Compares the arguments of two calls to the same function. Two calls
   * are known to be equal if their arguments are equal; nothing is known if
   * any argument differs. */
  private Result compareCall(List<Ast.Exp> args0, List<Ast.Exp> args1) {
    for (int i = 0; i < args0.size(); i++) {
      if (compare(args0.get(i), args1.get(i)) != Result.EQUAL) {
        return Result.UNKNOWN;
      }
    }
    return Result.EQUAL;
  }

  /** Compares the components of two values built by the same constructor.
   * The values differ if any component differs. */
  private Result compareData(List<Ast.Exp> args0, List<Ast.Exp> args1) {
    Result result = Result.EQUAL;
    for (int i = 0; i < args0.size(); i++) {
      final Result c = compare(args0.get(i), args1.get(i));
      if (c == Result.NOT_EQUAL) {
        return c;
      }
      if (c == Result.UNKNOWN) {
        result = Result.UNKNOWN;
      }
    }
    return result;
  }

  private static Result allEqual(Result... results) {
    for (Result result : results) {
      if (result != Result.EQUAL) {
        return Result.UNKNOWN;
      }
    }
    return Result.EQUAL;
  }

  /** If an expression is a constructor, possibly applied to arguments,
   * returns the constructor and its arguments. */
  private static @Nullable Constructed constructed(Ast.Exp exp) {
    if (exp instanceof Ast.Id && ((Ast.Id) exp).isConstructor()) {
      return new Constructed((Ast.Id) exp, ImmutableList.of());
    }
    final CallView call = CallView.of(exp);
    if (call != null
        && call.fn instanceof Ast.Id
        && ((Ast.Id) call.fn).isConstructor()) {
      return new Constructed((Ast.Id) call.fn, call.args);
    }
    return null;
  }

  /** If an expression accesses a record field, as in "r.f" or ".f r",
   * returns the record and field. */
  private static @Nullable Access access(Ast.Exp exp) {
    if (exp instanceof Ast.RecordAccess) {
      final Ast.RecordAccess recordAccess = (Ast.RecordAccess) exp;
      return new Access(recordAccess.exp, recordAccess.field.name);
    }
    final CallView call = CallView.of(exp);
    if (call != null
        && call.argCount() == 1
        && call.fn instanceof Ast.RecordAccessFn) {
      return new Access(call.arg(0), ((Ast.RecordAccessFn) call.fn).field);
    }
    return null;
  }

  /** A constructor and its arguments. */
  private static class Constructed {
    final Ast.Id con;
    final List<Ast.Exp> args;

    Constructed(Ast.Id con, List<Ast.Exp> args) {
      this.con = con;
      this.args = args;
    }
  }

  /** Access to a field of a record. */
  private static class Access {
    final Ast.Exp exp;
    final String field;

    Access(Ast.Exp exp, String field) {
      this.exp = exp;
      this.field = field;
    }
  }
}

// End Equivalence.java
