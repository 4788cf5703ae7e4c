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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.stream.Stream;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.parse.Parser;
import net.hydromatic.simplify.resolve.Dependencies;
import net.hydromatic.simplify.resolve.Resolution;
import net.hydromatic.simplify.simplify.Equivalence.Result;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/** Tests for {@link Equivalence}. */
public class EquivalenceTest {
  /** Compares the two sides of "a = x == y", in a module that may have
   * some imports and declarations before it. */
  private static Result compare(String prefix, String e0, String e1) {
    final Ast.Module module =
        Parser.parse(prefix + "a = " + e0 + " == " + e1 + "\n");
    final Resolution resolution = Resolution.of(module, Dependencies.core());
    final Ast.FunDecl decl =
        (Ast.FunDecl) module.decls.get(module.decls.size() - 1);
    final Ast.InfixCall call = (Ast.InfixCall) decl.exp;
    return new Equivalence(resolution).compare(call.a0, call.a1);
  }

  private static Result compare(String e0, String e1) {
    return compare("", e0, e1);
  }

  /** Expressions of every kind, for {@link #testReflexive(String)}. */
  @SuppressWarnings("unused")
  static Stream<String> expressions() {
    return Stream.of(
        // identifiers
        "x", "List.map", "Set.empty", "(+)", "(::)", ".name",
        // literals
        "1", "0x1F", "1.5", "-0.3", "\"abc\"", "'c'", "()",
        // constructors
        "Nothing", "Just x", "Ok (f x)",
        // collections and records
        "((x))", "(x, 1)", "[]", "[ x, y ]", "{ a = 1, b = x }",
        "{ r | a = 1 }", "r.a", "(f x).a", ".a r",
        // calls and operators
        "f x y", "not x", "-x", "-(f x)", "x + y * 2", "a || b && c",
        "x :: xs", "a ++ b", "x |> f", "f <| g x", "f << g", "(f >> g)",
        "(f >> g >> h) x", "(\\y -> y + 1)",
        // functions and control flow
        "\\y -> y + 1", "\\( a, b ) _ -> a", "\\() -> 1",
        "if c then 1 else 2",
        "if c then\n    1\n\nelse if d then\n    2\n\nelse\n    3",
        "case m of\n    Just y ->\n        y\n\n    Nothing ->\n        0",
        "case t of\n    ( a, _ ) ->\n        a",
        "let\n    y =\n        1\nin\ny + 1",
        "let\n    ( a, b ) =\n        t\n\n    g z =\n        z\nin\ng a");
  }

  /** Tests that every expression is equal to a copy of itself. */
  @ParameterizedTest
  @MethodSource("expressions")
  void testReflexive(String exp) {
    final String body = "    " + exp.replace("\n", "\n    ")
        .replace("\n    \n", "\n\n");
    final Ast.Module module =
        Parser.parse("first =\n" + body + "\n\nsecond =\n" + body + "\n");
    final Resolution resolution = Resolution.of(module, Dependencies.core());
    final Ast.Exp e0 = ((Ast.FunDecl) module.decls.get(0)).exp;
    final Ast.Exp e1 = ((Ast.FunDecl) module.decls.get(1)).exp;
    final Equivalence equivalence = new Equivalence(resolution);
    assertThat(equivalence.compare(e0, e1), is(Result.EQUAL));
    assertThat(equivalence.compare(e0, e0), is(Result.EQUAL));
    assertThat(equivalence.sameValue(e1, e0), is(true));
  }

  @Test void testLiterals() {
    assertThat(compare("1", "1"), is(Result.EQUAL));
    assertThat(compare("1", "2"), is(Result.NOT_EQUAL));
    assertThat(compare("0x10", "16"), is(Result.EQUAL));
    assertThat(compare("1.0", "1"), is(Result.EQUAL));
    assertThat(compare("1 + 2", "3"), is(Result.EQUAL));
    assertThat(compare("0.1 + 0.2", "0.3"), is(Result.NOT_EQUAL));
    assertThat(compare("0.5 + 0.25", "0.75"), is(Result.EQUAL));
    assertThat(compare("-(0.1 + 0.2)", "-0.3"), is(Result.NOT_EQUAL));
    assertThat(compare("-1", "1"), is(Result.NOT_EQUAL));
    assertThat(compare("\"a\"", "\"a\""), is(Result.EQUAL));
    assertThat(compare("\"a\"", "\"b\""), is(Result.NOT_EQUAL));
    assertThat(compare("'a'", "'b'"), is(Result.NOT_EQUAL));
  }

  @Test void testParenthesesAndPipes() {
    assertThat(compare("(x)", "x"), is(Result.EQUAL));
    assertThat(compare("f x", "x |> f"), is(Result.EQUAL));
    assertThat(compare("f x y", "f x <| y"), is(Result.EQUAL));
    assertThat(compare("f (g x)", "x |> g |> f"), is(Result.EQUAL));
  }

  @Test void testIdentifiers() {
    assertThat(compare("x", "x"), is(Result.EQUAL));
    assertThat(compare("x", "y"), is(Result.UNKNOWN));
    assertThat(compare("List.map", "List.map"), is(Result.EQUAL));
    assertThat(compare("import List exposing (map)\n\n", "map", "List.map"),
        is(Result.EQUAL));
  }

  @Test void testConstructors() {
    assertThat(compare("Just 1", "Just 1"), is(Result.EQUAL));
    assertThat(compare("Just 1", "Just 2"), is(Result.NOT_EQUAL));
    assertThat(compare("Just x", "Nothing"), is(Result.NOT_EQUAL));
    assertThat(compare("Just x", "Just y"), is(Result.UNKNOWN));
    assertThat(compare("Ok 1", "Err 1"), is(Result.NOT_EQUAL));
  }

  @Test void testCollections() {
    assertThat(compare("[1, 2]", "[1, 2]"), is(Result.EQUAL));
    assertThat(compare("[1, 2]", "[1]"), is(Result.NOT_EQUAL));
    assertThat(compare("[x]", "[y]"), is(Result.UNKNOWN));
    assertThat(compare("[x, 1]", "[y, 2]"), is(Result.NOT_EQUAL));
    assertThat(compare("(1, x)", "(1, x)"), is(Result.EQUAL));
    assertThat(compare("(1, x)", "(2, x)"), is(Result.NOT_EQUAL));
  }

  @Test void testRecords() {
    assertThat(compare("{ a = 1, b = 2 }", "{ b = 2, a = 1 }"),
        is(Result.EQUAL));
    assertThat(compare("{ a = 1 }", "{ a = 2 }"), is(Result.NOT_EQUAL));
    assertThat(compare("{ a = 1 }", "{ b = 1 }"), is(Result.UNKNOWN));
    assertThat(compare("{ r | a = 1 }", "{ r | a = 1 }"), is(Result.EQUAL));
    assertThat(compare("{ r | a = 1 }", "{ r | a = 2 }"),
        is(Result.NOT_EQUAL));
    assertThat(compare("{ r | a = 1 }", "{ s | a = 1 }"),
        is(Result.UNKNOWN));
    assertThat(compare("{ r | a = 1 }", "{ s | a = 2 }"),
        is(Result.NOT_EQUAL));
    assertThat(compare("{ r | a = 1 }", "{ s | b = 2 }"),
        is(Result.UNKNOWN));
    assertThat(compare("r.a", "r.a"), is(Result.EQUAL));
    assertThat(compare("r.a", ".a r"), is(Result.EQUAL));
  }

  @Test void testOperators() {
    assertThat(compare("(a + b)", "(b + a)"), is(Result.EQUAL));
    assertThat(compare("(a * b)", "(b * a)"), is(Result.EQUAL));
    assertThat(compare("(a - b)", "(b - a)"), is(Result.UNKNOWN));
    assertThat(compare("(a + b)", "((+) a b)"), is(Result.EQUAL));
    assertThat(compare("(f >> g)", "(g << f)"), is(Result.EQUAL));
  }

  @Test void testControlFlow() {
    assertThat(compare("(if c then 1 else 2)", "(if c then 1 else 2)"),
        is(Result.EQUAL));
    assertThat(compare("(\\y -> y + 1)", "(\\y -> y + 1)"),
        is(Result.EQUAL));
    assertThat(compare("(let b = 1 in b)", "(let b = 1 in b)"),
        is(Result.EQUAL));
  }
}

// End EquivalenceTest.java
