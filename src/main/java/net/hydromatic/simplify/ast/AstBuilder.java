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
package net.hydromatic.simplify.ast;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Text of the unit literal and the unit pattern. */
  public static final String UNIT = "()";

  // identifiers

  /** Creates an unqualified identifier. */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, ImmutableList.of(), name);
  }

  /** Creates an identifier, qualified by a module name if the list is not
   * empty. */
  public Ast.Id id(Pos pos, List<String> moduleName, String name) {
    return new Ast.Id(pos, ImmutableList.copyOf(moduleName), name);
  }

  public Ast.OpRef opRef(Pos pos, Op op) {
    return new Ast.OpRef(pos, op);
  }

  public Ast.RecordAccessFn recordAccessFn(Pos pos, String field) {
    return new Ast.RecordAccessFn(pos, field);
  }

  // literals

  /** Creates an integer literal; the text may be hexadecimal, "0x1F". */
  public Ast.Literal intLiteral(Pos pos, BigDecimal value, String text) {
    return new Ast.Literal(pos, Op.INT_LITERAL, value, text);
  }

  /** Creates an integer literal from its value. */
  public Ast.Literal intLiteral(Pos pos, int value) {
    return intLiteral(pos, BigDecimal.valueOf(value), Integer.toString(value));
  }

  public Ast.Literal floatLiteral(Pos pos, BigDecimal value, String text) {
    return new Ast.Literal(pos, Op.FLOAT_LITERAL, value, text);
  }

  /** Creates a string literal; {@code text} includes the quotes. */
  public Ast.Literal stringLiteral(Pos pos, String value, String text) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value, text);
  }

  /** Creates a char literal; {@code text} includes the quotes. */
  public Ast.Literal charLiteral(Pos pos, String value, String text) {
    return new Ast.Literal(pos, Op.CHAR_LITERAL, value, text);
  }

  public Ast.Literal unitLiteral(Pos pos) {
    return new Ast.Literal(pos, Op.UNIT_LITERAL, UNIT, UNIT);
  }

  // value constructors

  public Ast.Parens parens(Pos pos, Ast.Exp exp) {
    return new Ast.Parens(pos, exp);
  }

  public Ast.Tuple tuple(Pos pos, Iterable<? extends Ast.Exp> args) {
    return new Ast.Tuple(pos, ImmutableList.copyOf(args));
  }

  public Ast.ListExp list(Pos pos, Iterable<? extends Ast.Exp> args) {
    return new Ast.ListExp(pos, ImmutableList.copyOf(args));
  }

  public Ast.Setter setter(Pos pos, Ast.Id field, Ast.Exp exp) {
    return new Ast.Setter(pos, field, exp);
  }

  public Ast.Record record(Pos pos, Iterable<Ast.Setter> setters) {
    return new Ast.Record(pos, ImmutableList.copyOf(setters));
  }

  public Ast.RecordUpdate recordUpdate(Pos pos, Ast.Id record,
      Iterable<Ast.Setter> setters) {
    return new Ast.RecordUpdate(pos, record, ImmutableList.copyOf(setters));
  }

  public Ast.RecordAccess recordAccess(Pos pos, Ast.Exp exp, Ast.Id field) {
    return new Ast.RecordAccess(pos, exp, field);
  }

  // calls

  /** Creates a function application. If {@code fn} is itself an
   * application, adds {@code arg} to its arguments, so that "f a b" is one
   * node. */
  public Ast.Apply apply(Ast.Exp fn, Ast.Exp arg) {
    final Pos pos = fn.pos.plus(arg.pos);
    if (fn instanceof Ast.Apply) {
      final Ast.Apply apply = (Ast.Apply) fn;
      return new Ast.Apply(pos, apply.fn,
          ImmutableList.<Ast.Exp>builder().addAll(apply.args).add(arg)
              .build());
    }
    return new Ast.Apply(pos, fn, ImmutableList.of(arg));
  }

  public Ast.Apply apply(Pos pos, Ast.Exp fn,
      Iterable<? extends Ast.Exp> args) {
    return new Ast.Apply(pos, fn, ImmutableList.copyOf(args));
  }

  public Ast.InfixCall infixCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1,
      Pos opPos) {
    return new Ast.InfixCall(pos, op, a0, a1, opPos);
  }

  public Ast.Negate negate(Pos pos, Ast.Exp exp) {
    return new Ast.Negate(pos, exp);
  }

  // control

  public Ast.Fn fn(Pos pos, Iterable<? extends Ast.Pat> pats, Ast.Exp exp) {
    return new Ast.Fn(pos, ImmutableList.copyOf(pats), exp);
  }

  public Ast.If ifThenElse(Pos pos, Ast.Exp condition, Ast.Exp ifTrue,
      Ast.Exp ifFalse) {
    return new Ast.If(pos, condition, ifTrue, ifFalse);
  }

  public Ast.Match match(Pos pos, Ast.Pat pat, Ast.Exp exp) {
    return new Ast.Match(pos, pat, exp);
  }

  public Ast.Case caseOf(Pos pos, Ast.Exp exp,
      Iterable<? extends Ast.Match> matchList) {
    return new Ast.Case(pos, exp, ImmutableList.copyOf(matchList));
  }

  public Ast.Let let(Pos pos, Iterable<? extends Ast.Decl> decls,
      Ast.Exp exp) {
    return new Ast.Let(pos, ImmutableList.copyOf(decls), exp);
  }

  // patterns

  public Ast.IdPat idPat(Pos pos, String name) {
    return new Ast.IdPat(pos, name);
  }

  public Ast.WildcardPat wildcardPat(Pos pos) {
    return new Ast.WildcardPat(pos);
  }

  /** Creates a literal pattern from the corresponding literal expression. */
  public Ast.LiteralPat literalPat(Ast.Literal literal) {
    return new Ast.LiteralPat(literal.pos, literal.op.toPat(), literal.value,
        literal.text);
  }

  public Ast.ConPat conPat(Pos pos, Ast.Id con,
      Iterable<? extends Ast.Pat> args) {
    return new Ast.ConPat(pos, con, ImmutableList.copyOf(args));
  }

  public Ast.TuplePat tuplePat(Pos pos, Iterable<? extends Ast.Pat> args) {
    return new Ast.TuplePat(pos, ImmutableList.copyOf(args));
  }

  public Ast.ListPat listPat(Pos pos, Iterable<? extends Ast.Pat> args) {
    return new Ast.ListPat(pos, ImmutableList.copyOf(args));
  }

  public Ast.ConsPat consPat(Ast.Pat p0, Ast.Pat p1) {
    return new Ast.ConsPat(p0.pos.plus(p1.pos), p0, p1);
  }

  public Ast.RecordPat recordPat(Pos pos, Iterable<Ast.IdPat> fields) {
    return new Ast.RecordPat(pos, ImmutableList.copyOf(fields));
  }

  public Ast.AsPat asPat(Pos pos, Ast.Pat pat, Ast.IdPat id) {
    return new Ast.AsPat(pos, pat, id);
  }

  public Ast.ParensPat parensPat(Pos pos, Ast.Pat pat) {
    return new Ast.ParensPat(pos, pat);
  }

  // declarations

  public Ast.FunDecl funDecl(Pos pos, Ast.Id name,
      Iterable<? extends Ast.Pat> pats, Ast.Exp exp) {
    return new Ast.FunDecl(pos, name, ImmutableList.copyOf(pats), exp);
  }

  public Ast.DestructDecl destructDecl(Pos pos, Ast.Pat pat, Ast.Exp exp) {
    return new Ast.DestructDecl(pos, pat, exp);
  }

  public Ast.TypeDecl typeDecl(Pos pos, String name,
      Iterable<Ast.Id> constructors) {
    return new Ast.TypeDecl(pos, name, ImmutableList.copyOf(constructors));
  }

  public Ast.AliasDecl aliasDecl(Pos pos, String name) {
    return new Ast.AliasDecl(pos, name);
  }

  public Ast.Exposing exposing(boolean all, Iterable<String> values,
      Iterable<String> types, Iterable<String> openTypes) {
    if (all) {
      return Ast.Exposing.ALL;
    }
    if (!values.iterator().hasNext()
        && !types.iterator().hasNext()
        && !openTypes.iterator().hasNext()) {
      return Ast.Exposing.NONE;
    }
    return new Ast.Exposing(false, ImmutableList.copyOf(values),
        ImmutableList.copyOf(types), ImmutableList.copyOf(openTypes));
  }

  public Ast.Import import_(Pos pos, List<String> moduleName,
      @Nullable String alias, Ast.Exposing exposing) {
    return new Ast.Import(pos, ImmutableList.copyOf(moduleName), alias,
        exposing);
  }

  public Ast.Module module(Pos pos, List<String> moduleName,
      Ast.Exposing exposing, Iterable<Ast.Import> imports,
      Iterable<? extends Ast.Decl> decls) {
    return new Ast.Module(pos, ImmutableList.copyOf(moduleName), exposing,
        ImmutableList.copyOf(imports), ImmutableList.copyOf(decls));
  }
}

// End AstBuilder.java
