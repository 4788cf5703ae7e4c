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
package net.hydromatic.simplify.parse;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Op;
import net.hydromatic.simplify.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests for {@link Parser} and {@link Lexer}. */
public class ParserTest {
  private static Ast.Exp exp(String s) {
    return Parser.parseExpression(s);
  }

  private static Ast.InfixCall infix(String s) {
    final Ast.Exp exp = exp(s);
    assertThat(exp, instanceOf(Ast.InfixCall.class));
    return (Ast.InfixCall) exp;
  }

  @Test void testPrecedence() {
    assertThat(infix("a + b * c").op, is(Op.PLUS));
    assertThat(infix("a + b * c").a1.op, is(Op.TIMES));
    assertThat(infix("a * b + c").a0.op, is(Op.TIMES));
    assertThat(infix("a == b + 1").op, is(Op.EQ));
    assertThat(infix("a || b && c").a1.op, is(Op.AND));
    assertThat(infix("x |> f >> g").a1.op, is(Op.COMPOSE_RIGHT));
    assertThat(infix("a :: b ++ c").a1.op, is(Op.APPEND));
  }

  @Test void testAssociativity() {
    assertThat(infix("a - b - c").a0.op, is(Op.MINUS));
    assertThat(infix("a || b || c").a1.op, is(Op.OR));
    assertThat(infix("x |> f |> g").a0.op, is(Op.PIPE_RIGHT));
    assertThat(infix("f <| g <| x").a1.op, is(Op.PIPE_LEFT));
    assertThat(infix("a :: b :: c").a1.op, is(Op.CONS));
    assertThat(infix("a ^ b ^ c").a1.op, is(Op.POWER));
  }

  @Test void testApply() {
    final Ast.Exp exp = exp("f a (g b) c");
    assertThat(exp.op, is(Op.APPLY));
    final Ast.Apply apply = (Ast.Apply) exp;
    assertThat(apply.args.size(), is(3));
    assertThat(apply.args.get(1).op, is(Op.PARENS));
    assertThat(infix("f a + g b").a0.op, is(Op.APPLY));
  }

  @Test void testNegate() {
    assertThat(exp("-x").op, is(Op.NEGATE));
    assertThat(exp("-(f x)").op, is(Op.NEGATE));
    assertThat(infix("a - x").op, is(Op.MINUS));
    assertThat(infix("a -x").op, is(Op.MINUS));
  }

  @Test void testLiterals() {
    assertThat(((Ast.Literal) exp("0x1F")).value,
        is((Comparable) BigDecimal.valueOf(31)));
    assertThat(exp("1.5").op, is(Op.FLOAT_LITERAL));
    assertThat(((Ast.Literal) exp("\"a\\nb\"")).value,
        is((Comparable) "a\nb"));
    assertThat(((Ast.Literal) exp("\"\"\"x\"\"\"")).value,
        is((Comparable) "x"));
    assertThat(exp("'c'").op, is(Op.CHAR_LITERAL));
    assertThat(exp("()").op, is(Op.UNIT_LITERAL));
  }

  @Test void testNames() {
    final Ast.Id id = (Ast.Id) exp("Json.Decode.map");
    assertThat(id.moduleName, is(ImmutableList.of("Json", "Decode")));
    assertThat(id.name, is("map"));
    assertThat(exp("(+)").op, is(Op.OP_REF));
    assertThat(exp(".name").op, is(Op.RECORD_ACCESS_FN));
    final Ast.Exp access = exp("r.a.b");
    assertThat(access.op, is(Op.RECORD_ACCESS));
    assertThat(((Ast.RecordAccess) access).field.name, is("b"));
    assertThat(((Ast.RecordAccess) access).exp.op, is(Op.RECORD_ACCESS));
    assertThat(exp("f .a").op, is(Op.APPLY));
  }

  @Test void testCollections() {
    assertThat(exp("(1, 2)").op, is(Op.TUPLE));
    assertThat(exp("[1, 2, 3]").op, is(Op.LIST));
    assertThat(exp("[]").op, is(Op.LIST));
    assertThat(exp("{ a = 1, b = 2 }").op, is(Op.RECORD));
    final Ast.Exp update = exp("{ r | a = 1 }");
    assertThat(update.op, is(Op.RECORD_UPDATE));
    assertThat(((Ast.RecordUpdate) update).record.name, is("r"));
    assertThat(exp("{ a = 1 }.a").op, is(Op.RECORD_ACCESS));
  }

  @Test void testLambdaIfLet() {
    final Ast.Fn fn = (Ast.Fn) exp("\\_ y -> y + 1");
    assertThat(fn.pats.size(), is(2));
    assertThat(fn.pats.get(0).op, is(Op.WILDCARD_PAT));
    assertThat(fn.exp.op, is(Op.PLUS));
    final Ast.If anIf = (Ast.If) exp("if a then b else if c then d else e");
    assertThat(anIf.ifFalse.op, is(Op.IF));
    final Ast.Let let = (Ast.Let) exp("let a = 1 in a + 1");
    assertThat(let.decls.size(), is(1));
    assertThat(let.exp.op, is(Op.PLUS));
  }

  @Test void testPositions() {
    final Ast.InfixCall call = infix("a + bc");
    assertThat(call.pos, is(Pos.of(1, 1, 1, 7)));
    assertThat(call.a1.pos, is(Pos.of(1, 5, 1, 7)));
    assertThat(call.opPos, is(Pos.of(1, 3, 1, 4)));
  }

  @Test void testModule() {
    final Ast.Module module =
        Parser.parse("module A.B exposing (f, T(..))\n"
            + "\n"
            + "import List as L exposing (map)\n"
            + "import Set\n"
            + "\n"
            + "type T\n"
            + "    = C Int\n"
            + "    | D\n"
            + "\n"
            + "type alias R = { x : Int }\n"
            + "\n"
            + "f : Int -> Int\n"
            + "f x =\n"
            + "    x + 1\n");
    assertThat(module.moduleName, is(ImmutableList.of("A", "B")));
    assertThat(module.imports.size(), is(2));
    assertThat(module.imports.get(0).alias, is("L"));
    assertThat(module.imports.get(0).exposing.values,
        is(ImmutableList.of("map")));
    assertThat(module.imports.get(1).alias, nullValue());
    assertThat(module.decls.size(), is(3));
    final Ast.TypeDecl typeDecl = (Ast.TypeDecl) module.decls.get(0);
    assertThat(typeDecl.name, is("T"));
    assertThat(typeDecl.constructors.size(), is(2));
    final Ast.FunDecl funDecl = (Ast.FunDecl) module.decls.get(2);
    assertThat(funDecl.name.name, is("f"));
    assertThat(funDecl.pats.size(), is(1));
  }

  @Test void testModuleWithoutHeader() {
    final Ast.Module module = Parser.parse("a = 1\n\nb = 2\n");
    assertThat(module.moduleName, is(ImmutableList.of("Main")));
    assertThat(module.decls.size(), is(2));
  }

  @Test void testComments() {
    final Ast.Module module =
        Parser.parse("-- leading comment\n"
            + "a = 1 -- trailing\n"
            + "\n"
            + "{- block {- nested -} still comment -}\n"
            + "b = 2\n");
    assertThat(module.decls.size(), is(2));
  }

  @Test void testCaseLayout() {
    final Ast.Module module =
        Parser.parse("a =\n"
            + "    case x of\n"
            + "        Just y ->\n"
            + "            f y\n"
            + "                z\n"
            + "\n"
            + "        Nothing ->\n"
            + "            0\n"
            + "\n"
            + "b = 1\n");
    assertThat(module.decls.size(), is(2));
    final Ast.Case kase = (Ast.Case) ((Ast.FunDecl) module.decls.get(0)).exp;
    assertThat(kase.matchList.size(), is(2));
    assertThat(((Ast.Apply) kase.matchList.get(0).exp).args.size(), is(2));
  }

  @Test void testLetLayout() {
    final Ast.Module module =
        Parser.parse("a =\n"
            + "    let\n"
            + "        b = 1\n"
            + "\n"
            + "        ( c, d ) =\n"
            + "            t\n"
            + "    in\n"
            + "    b + c\n");
    final Ast.Let let = (Ast.Let) ((Ast.FunDecl) module.decls.get(0)).exp;
    assertThat(let.decls.size(), is(2));
    assertThat(let.decls.get(1), instanceOf(Ast.DestructDecl.class));
  }

  @Test void testParseError() {
    final SimplifyParseException e =
        assertThrows(SimplifyParseException.class,
            () -> Parser.parse("a = (1\n", "A.elm"));
    assertThat(e.pos().file, is("A.elm"));
    assertThrows(SimplifyParseException.class,
        () -> Parser.parse("a = \"unterminated\n"));
    assertThrows(SimplifyParseException.class,
        () -> Parser.parseExpression("1 +"));
  }
}

// End ParserTest.java
