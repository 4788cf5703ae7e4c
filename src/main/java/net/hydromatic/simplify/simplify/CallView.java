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
import static net.hydromatic.simplify.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Op;
import net.hydromatic.simplify.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A function call, however it is written.
 *
 * <p>"f a b", "b |> f a", "f a <| b" and "(f a) b" all have function "f" and
 * arguments "a" and "b". Rules match on this view so that they do not need
 * to handle each form of pipe.
 */
public class CallView {
  /** The whole expression. */
  public final Ast.Exp node;
  /** The function being called, without parentheses. */
  public final Ast.Exp fn;
  /** Arguments, in the order that they are applied. */
  public final List<Ast.Exp> args;

  private CallView(Ast.Exp node, Ast.Exp fn, ImmutableList<Ast.Exp> args) {
    this.node = requireNonNull(node);
    this.fn = requireNonNull(fn);
    this.args = requireNonNull(args);
  }

  /** Returns a view of a call, or null if the expression is not a function
   * application or a pipe. Does not look through parentheses around the
   * whole expression. */
  public static @Nullable CallView of(Ast.Exp exp) {
    switch (exp.op) {
      case APPLY:
        final Ast.Apply apply = (Ast.Apply) exp;
        final Ast.Exp fn = Normalize.unwrapParens(apply.fn);
        if (fn instanceof Ast.Apply) {
          final CallView inner = requireNonNull(of(fn));
          return new CallView(exp, inner.fn,
              ImmutableList.<Ast.Exp>builder().addAll(inner.args)
                  .addAll(apply.args).build());
        }
        return new CallView(exp, fn, ImmutableList.copyOf(apply.args));

      case PIPE_RIGHT:
      case PIPE_LEFT:
        final Ast.InfixCall pipe = (Ast.InfixCall) exp;
        final Ast.Exp function =
            Normalize.unwrapParens(exp.op == Op.PIPE_RIGHT ? pipe.a1 : pipe.a0);
        final Ast.Exp arg = exp.op == Op.PIPE_RIGHT ? pipe.a0 : pipe.a1;
        final CallView partial = of(function);
        if (partial != null && function.op == Op.APPLY) {
          return new CallView(exp, partial.fn,
              ImmutableList.<Ast.Exp>builder().addAll(partial.args).add(arg)
                  .build());
        }
        return new CallView(exp, function, ImmutableList.of(arg));

      default:
        return null;
    }
  }

  /** Returns a view of a call, also treating a call to an infix operator
   * such as "a + b" as a call to the function "(+)". */
  public static @Nullable CallView ofAny(Ast.Exp exp) {
    if (exp instanceof Ast.InfixCall
        && !exp.op.isPipe()
        && !exp.op.isComposition()) {
      final Ast.InfixCall call = (Ast.InfixCall) exp;
      return new CallView(exp, ast.opRef(call.opPos, call.op),
          ImmutableList.of(call.a0, call.a1));
    }
    return of(exp);
  }

  /** Returns the number of arguments. */
  public int argCount() {
    return args.size();
  }

  public Ast.Exp arg(int i) {
    return args.get(i);
  }

  /** Returns the last argument. */
  public Ast.Exp lastArg() {
    return args.get(args.size() - 1);
  }

  /** Returns whether the call is written as an application without pipes,
   * as in "f a b". */
  public boolean isDirect() {
    return node.op == Op.APPLY;
  }

  /** Returns the range that contains the function and its first {@code n}
   * arguments, if they are written next to each other, as in "f a" within
   * "f a b" or "b |> f a"; otherwise null. */
  public @Nullable Pos prefixRange(int n) {
    Pos previous = fn.pos;
    for (int i = 0; i < n; i++) {
      final Pos pos = args.get(i).pos;
      if (pos.compareTo(previous) <= 0) {
        return null;
      }
      previous = pos;
    }
    return Fixes.range(fn.pos, previous);
  }

  @Override public String toString() {
    return "call(" + fn + ", " + args + ")";
  }
}

// End CallView.java
