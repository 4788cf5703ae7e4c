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
package net.hydromatic.simplify.resolve;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.parse.Parser;
import org.junit.jupiter.api.Test;

/** Tests for {@link Resolver} and {@link Resolution}. */
public class ResolverTest {
  /** Parses a module, resolves it, and returns the function of the call
   * in the last declaration. */
  private static Fixture fixture(String source) {
    final Ast.Module module = Parser.parse(source);
    final Resolution resolution = Resolution.of(module, Dependencies.core());
    final Ast.FunDecl decl =
        (Ast.FunDecl) module.decls.get(module.decls.size() - 1);
    return new Fixture(resolution, decl.exp);
  }

  /** A resolved module and the body of its last declaration. */
  private static class Fixture {
    final Resolution resolution;
    final Ast.Exp exp;

    Fixture(Resolution resolution, Ast.Exp exp) {
      this.resolution = resolution;
      this.exp = exp;
    }

    Ast.Id fn() {
      return (Ast.Id) ((Ast.Apply) exp).fn;
    }

    Ast.Id arg(int i) {
      return (Ast.Id) ((Ast.Apply) exp).args.get(i);
    }
  }

  @Test void testDefaultImports() {
    final Fixture f = fixture("a = List.map not x");
    assertThat(f.resolution.moduleOf(f.fn()), is("List"));
    assertThat(f.resolution.moduleOf(f.arg(0)), is("Basics"));
    assertThat(f.resolution.moduleOf(f.arg(1)), nullValue());
    assertThat(f.resolution.resolves(f.fn(), "List", "map"), is(true));
    assertThat(f.resolution.resolves(f.arg(0), "Basics", "not"), is(true));
  }

  @Test void testAlias() {
    final Fixture f = fixture("import Platform.Cmd as C\n\na = C.batch x\n");
    assertThat(f.resolution.moduleOf(f.fn()), is("Platform.Cmd"));
    final Fixture g = fixture("a = Cmd.batch x");
    assertThat(g.resolution.moduleOf(g.fn()), is("Platform.Cmd"));
  }

  @Test void testExposing() {
    final Fixture f =
        fixture("import Set exposing (fromList)\n\na = fromList x\n");
    assertThat(f.resolution.moduleOf(f.fn()), is("Set"));
    final Fixture g =
        fixture("import Dict exposing (..)\n\na = get k d\n");
    assertThat(g.resolution.moduleOf(g.fn()), is("Dict"));
  }

  @Test void testUnimportedModule() {
    final Fixture f = fixture("a = Set.fromList x");
    assertThat(f.resolution.moduleOf(f.fn()), is("Set"));
    final Fixture g = fixture("a = Set.noSuchFunction x");
    assertThat(g.resolution.moduleOf(g.fn()), nullValue());
  }

  @Test void testLocalBindingShadows() {
    final Fixture f = fixture("a not = not x");
    assertThat(f.resolution.moduleOf(f.fn()), is(""));
    assertThat(f.resolution.isLocal(f.fn()), is(true));
    assertThat(f.resolution.resolves(f.fn(), "Basics", "not"), is(false));
  }

  @Test void testLambdaBinding() {
    final Ast.Module module = Parser.parse("a = \\identity -> identity x");
    final Resolution resolution =
        Resolution.of(module, Dependencies.core());
    final Ast.Fn fn = (Ast.Fn) ((Ast.FunDecl) module.decls.get(0)).exp;
    final Ast.Id id = (Ast.Id) ((Ast.Apply) fn.exp).fn;
    assertThat(resolution.isLocal(id), is(true));
  }

  @Test void testTopLevel() {
    final Fixture f = fixture("module A exposing (..)\n"
        + "\n"
        + "map f x = x\n"
        + "\n"
        + "b = map g y\n");
    assertThat(f.resolution.moduleOf(f.fn()), is("A"));
    assertThat(f.resolution.resolves(f.fn(), "List", "map"), is(false));
  }

  @Test void testConstructors() {
    final Fixture f = fixture("module A exposing (..)\n"
        + "\n"
        + "type Color = Red | Green\n"
        + "\n"
        + "b = f Red Nothing\n");
    assertThat(f.resolution.moduleOf(f.arg(0)), is("A"));
    assertThat(f.resolution.typeOfConstructor(f.arg(0)), is("A.Color"));
    assertThat(f.resolution.typeOfConstructor(f.arg(1)),
        is("Maybe.Maybe"));
  }

  @Test void testQualify() {
    final Fixture f = fixture("import Set as S\n"
        + "import List exposing (map)\n"
        + "\n"
        + "a = f x\n");
    assertThat(f.resolution.qualify("Set", "empty"), is("S.empty"));
    assertThat(f.resolution.qualify("List", "map"), is("map"));
    assertThat(f.resolution.qualify("List", "filter"), is("List.filter"));
    assertThat(f.resolution.qualify("Basics", "not"), is("not"));
    assertThat(f.resolution.qualify("Maybe", "Just"), is("Just"));
    assertThat(f.resolution.qualify("Dict", "empty"), is("Dict.empty"));
    assertThat(f.resolution.qualify("Platform.Cmd", "none"),
        is("Cmd.none"));
  }

  @Test void testDependenciesPlus() {
    final Ast.Module module =
        Parser.parse("module A exposing (..)\n"
            + "\n"
            + "type Shape = Circle Float | Square Float\n"
            + "\n"
            + "area s = 0\n");
    final Dependencies dependencies = Dependencies.core().plus(module);
    final List<String> constructors =
        dependencies.typeExists("A", "Shape");
    assertThat(constructors, is(ImmutableList.of("Circle", "Square")));
    assertThat(dependencies.typeOfConstructor("A", "Square"), is("Shape"));
    assertThat(dependencies.typeExists("A", "Circle"), nullValue());
    assertThat(dependencies.typeExists("Maybe", "Maybe"),
        is(ImmutableList.of("Just", "Nothing")));
  }
}

// End ResolverTest.java
