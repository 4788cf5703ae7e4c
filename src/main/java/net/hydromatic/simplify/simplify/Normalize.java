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
import java.util.Collection;
import java.util.List;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Op;
import net.hydromatic.simplify.ast.Visitor;
import net.hydromatic.simplify.resolve.Resolution;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers that look through parentheses, pipes and composition, and
 * recognize common function shapes. Side-effect free. */
public final class Normalize {
  private Normalize() {}

  /** Removes any number of parentheses around an expression. */
  public static Ast.Exp unwrapParens(Ast.Exp exp) {
    while (exp instanceof Ast.Parens) {
      exp = ((Ast.Parens) exp).exp;
    }
    return exp;
  }

  /** Returns the list literal, ignoring parentheses, or null. */
  public static Ast.@Nullable ListExp listLiteral(Ast.Exp exp) {
    final Ast.Exp e = unwrapParens(exp);
    return e instanceof Ast.ListExp ? (Ast.ListExp) e : null;
  }

  public static boolean isListLiteral(Ast.Exp exp) {
    return listLiteral(exp) != null;
  }

  /** Returns whether an expression is the empty list "[]". */
  public static boolean isEmptyList(Ast.Exp exp) {
    final Ast.ListExp list = listLiteral(exp);
    return list != null && list.args.isEmpty();
  }

  /** Returns whether an expression is the empty string {@code ""}. */
  public static boolean isEmptyString(Ast.Exp exp) {
    final Ast.Exp e = unwrapParens(exp);
    return e.op == Op.STRING_LITERAL && "".equals(((Ast.Literal) e).value);
  }

  /** Returns whether an expression is a literal {@code True} or
   * {@code False}; returns null if it is neither. */
  public static @Nullable Boolean booleanValue(Ast.Exp exp,
      Resolution resolution) {
    if (resolution.resolves(exp, "Basics", "True")) {
      return Boolean.TRUE;
    }
    if (resolution.resolves(exp, "Basics", "False")) {
      return Boolean.FALSE;
    }
    return null;
  }

  /** If a function always returns the same value, regardless of its
   * argument, returns the expression for that value; otherwise null.
   *
   * <p>Recognizes "always x", "always <| x", "x |> always", "\_ -> x", and
   * "\y -> x" where "y" does not occur in "x". */
  public static Ast.@Nullable Exp alwaysBody(Ast.Exp fn,
      Resolution resolution) {
    final Ast.Exp e = unwrapParens(fn);
    final CallView call = CallView.of(e);
    if (call != null
        && call.argCount() == 1
        && resolution.resolves(call.fn, "Basics", "always")) {
      return call.arg(0);
    }
    if (e instanceof Ast.Fn) {
      final Ast.Fn lambda = (Ast.Fn) e;
      if (lambda.pats.size() == 1) {
        final Ast.Pat pat = lambda.pats.get(0);
        if (pat instanceof Ast.WildcardPat) {
          return lambda.exp;
        }
        if (pat instanceof Ast.IdPat
            && !usesAny(lambda.exp,
                ImmutableList.of(((Ast.IdPat) pat).name))) {
          return lambda.exp;
        }
      }
    }
    return null;
  }

  /** Returns whether a function always returns a given boolean value. */
  public static boolean isAlwaysBoolean(Ast.Exp fn, boolean value,
      Resolution resolution) {
    final Ast.Exp body = alwaysBody(fn, resolution);
    return body != null
        && Boolean.valueOf(value).equals(booleanValue(body, resolution));
  }

  /** Returns whether a function is the identity function, "identity" or
   * "\x -> x". */
  public static boolean isIdentity(Ast.Exp fn, Resolution resolution) {
    final Ast.Exp e = unwrapParens(fn);
    if (resolution.resolves(e, "Basics", "identity")) {
      return true;
    }
    if (e instanceof Ast.Fn) {
      final Ast.Fn lambda = (Ast.Fn) e;
      if (lambda.pats.size() == 1
          && lambda.pats.get(0) instanceof Ast.IdPat) {
        final Ast.Exp body = unwrapParens(lambda.exp);
        return body instanceof Ast.Id
            && ((Ast.Id) body).moduleName.isEmpty()
            && ((Ast.Id) body).name.equals(
                ((Ast.IdPat) lambda.pats.get(0)).name);
      }
    }
    return false;
  }

  /** Flattens a chain of function compositions into the list of functions
   * in the order that they are applied.
   *
   * <p>Both "f >> g >> h" and "h << g << f" become [f, g, h]. An
   * expression that is not a composition becomes a singleton list. */
  public static List<Ast.Exp> compositionChain(Ast.Exp exp) {
    final List<Ast.Exp> list = new ArrayList<>();
    addToChain(exp, list);
    return list;
  }

  private static void addToChain(Ast.Exp exp, List<Ast.Exp> list) {
    if (exp.op == Op.COMPOSE_RIGHT) {
      final Ast.InfixCall call = (Ast.InfixCall) exp;
      addToChain(call.a0, list);
      addToChain(call.a1, list);
    } else if (exp.op == Op.COMPOSE_LEFT) {
      final Ast.InfixCall call = (Ast.InfixCall) exp;
      addToChain(call.a1, list);
      addToChain(call.a0, list);
    } else {
      list.add(exp);
    }
  }

  /** Returns whether an expression contains an unqualified reference to
   * any of the given names. */
  public static boolean usesAny(Ast.Exp exp, Collection<String> names) {
    if (names.isEmpty()) {
      return false;
    }
    final boolean[] found = {false};
    exp.accept(new Visitor() {
      @Override protected void visit(Ast.Id id) {
        if (id.moduleName.isEmpty() && names.contains(id.name)) {
          found[0] = true;
        }
      }
    });
    return found[0];
  }

  /** Returns the names bound by a pattern. */
  public static List<String> bindings(Ast.Pat pat) {
    final List<String> names = new ArrayList<>();
    pat.visit(p -> {
      if (p instanceof Ast.IdPat) {
        names.add(((Ast.IdPat) p).name);
      }
    });
    return names;
  }
}

// End Normalize.java
