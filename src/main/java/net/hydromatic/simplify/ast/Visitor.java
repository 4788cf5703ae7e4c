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

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.Id id) {}

  protected void visit(Ast.OpRef opRef) {}

  protected void visit(Ast.RecordAccessFn recordAccessFn) {}

  protected void visit(Ast.Parens parens) {
    parens.exp.accept(this);
  }

  protected void visit(Ast.Tuple tuple) {
    tuple.args.forEach(this::accept);
  }

  protected void visit(Ast.ListExp list) {
    list.args.forEach(this::accept);
  }

  protected void visit(Ast.Record record) {
    record.setters.forEach(this::accept);
  }

  protected void visit(Ast.RecordUpdate recordUpdate) {
    recordUpdate.record.accept(this);
    recordUpdate.setters.forEach(this::accept);
  }

  protected void visit(Ast.Setter setter) {
    setter.exp.accept(this);
  }

  protected void visit(Ast.RecordAccess recordAccess) {
    recordAccess.exp.accept(this);
  }

  protected void visit(Ast.If anIf) {
    anIf.condition.accept(this);
    anIf.ifTrue.accept(this);
    anIf.ifFalse.accept(this);
  }

  protected void visit(Ast.Let let) {
    let.decls.forEach(this::accept);
    let.exp.accept(this);
  }

  protected void visit(Ast.Case kase) {
    kase.exp.accept(this);
    kase.matchList.forEach(this::accept);
  }

  protected void visit(Ast.Match match) {
    match.pat.accept(this);
    match.exp.accept(this);
  }

  protected void visit(Ast.Fn fn) {
    fn.pats.forEach(this::accept);
    fn.exp.accept(this);
  }

  // calls

  protected void visit(Ast.Apply apply) {
    apply.fn.accept(this);
    apply.args.forEach(this::accept);
  }

  protected void visit(Ast.InfixCall infixCall) {
    infixCall.a0.accept(this);
    infixCall.a1.accept(this);
  }

  protected void visit(Ast.Negate negate) {
    negate.exp.accept(this);
  }

  // patterns

  protected void visit(Ast.IdPat idPat) {}

  protected void visit(Ast.LiteralPat literalPat) {}

  protected void visit(Ast.WildcardPat wildcardPat) {}

  protected void visit(Ast.ConPat conPat) {
    conPat.args.forEach(this::accept);
  }

  protected void visit(Ast.TuplePat tuplePat) {
    tuplePat.args.forEach(this::accept);
  }

  protected void visit(Ast.ListPat listPat) {
    listPat.args.forEach(this::accept);
  }

  protected void visit(Ast.ConsPat consPat) {
    consPat.p0.accept(this);
    consPat.p1.accept(this);
  }

  protected void visit(Ast.RecordPat recordPat) {
    recordPat.fields.forEach(this::accept);
  }

  protected void visit(Ast.AsPat asPat) {
    asPat.pat.accept(this);
    asPat.id.accept(this);
  }

  protected void visit(Ast.ParensPat parensPat) {
    parensPat.pat.accept(this);
  }

  // declarations

  protected void visit(Ast.FunDecl funDecl) {
    funDecl.pats.forEach(this::accept);
    funDecl.exp.accept(this);
  }

  protected void visit(Ast.DestructDecl destructDecl) {
    destructDecl.pat.accept(this);
    destructDecl.exp.accept(this);
  }

  protected void visit(Ast.TypeDecl typeDecl) {}

  protected void visit(Ast.AliasDecl aliasDecl) {}

  protected void visit(Ast.Import anImport) {}

  protected void visit(Ast.Module module) {
    module.imports.forEach(this::accept);
    module.decls.forEach(this::accept);
  }
}

// End Visitor.java
