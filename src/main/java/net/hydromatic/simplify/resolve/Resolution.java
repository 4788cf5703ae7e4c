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

import static java.util.Objects.requireNonNull;

import net.hydromatic.simplify.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Answers whether an identifier refers to a particular function or
 * constructor, however the module under analysis imported it.
 *
 * <p>For example, in a module that contains "import Set as S exposing
 * (empty)", the identifiers "S.empty" and "empty" both resolve to
 * ("Set", "empty"). If the lookup table has no entry for an identifier,
 * the identifier does not resolve to anything.
 */
public class Resolution {
  private final ModuleNameLookupTable table;
  private final Dependencies dependencies;

  public Resolution(ModuleNameLookupTable table, Dependencies dependencies) {
    this.table = requireNonNull(table);
    this.dependencies = requireNonNull(dependencies);
  }

  /** Resolves a module against a set of dependencies. */
  public static Resolution of(Ast.Module module, Dependencies dependencies) {
    final Dependencies allDependencies = dependencies.plus(module);
    return new Resolution(Resolver.resolve(module, allDependencies),
        allDependencies);
  }

  public Dependencies dependencies() {
    return dependencies;
  }

  /** Returns whether an expression, ignoring parentheses, is a reference to
   * a given function or constructor.
   *
   * @param exp Expression
   * @param moduleName Dotted name of the defining module, e.g. "List"
   * @param name Name, e.g. "map"
   */
  public boolean resolves(Ast.Exp exp, String moduleName, String name) {
    while (exp instanceof Ast.Parens) {
      exp = ((Ast.Parens) exp).exp;
    }
    if (!(exp instanceof Ast.Id)) {
      return false;
    }
    final Ast.Id id = (Ast.Id) exp;
    return id.name.equals(name) && moduleName.equals(moduleOf(id));
  }

  /** Returns the module that defines an identifier, the empty string if it
   * is a local binding, or null if unknown. */
  public @Nullable String moduleOf(Ast.Id id) {
    return table.moduleNameFor(id);
  }

  /** Returns whether an identifier is a local binding. */
  public boolean isLocal(Ast.Id id) {
    return "".equals(moduleOf(id));
  }

  /** Returns the type that a constructor belongs to, as a qualified name
   * such as "Maybe.Maybe", or null if unknown. */
  public @Nullable String typeOfConstructor(Ast.Id con) {
    final String moduleName = moduleOf(con);
    if (moduleName == null || moduleName.isEmpty()) {
      return null;
    }
    final String type = dependencies.typeOfConstructor(moduleName, con.name);
    return type == null ? null : moduleName + "." + type;
  }

  /** Returns the text with which the module under analysis can refer to a
   * function or constructor.
   *
   * <p>For example, {@code qualify("Basics", "not")} returns "not", and
   * {@code qualify("Set", "empty")} returns "Set.empty", or "S.empty" if the
   * module was imported with an alias, or "empty" if it is exposed. */
  public String qualify(String moduleName, String name) {
    if (moduleName.equals(table.unqualified.get(name))) {
      return name;
    }
    final String qualifier = table.qualifiers.get(moduleName);
    return (qualifier != null ? qualifier : moduleName) + "." + name;
  }
}

// End Resolution.java
