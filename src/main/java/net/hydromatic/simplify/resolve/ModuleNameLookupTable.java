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

import com.google.common.collect.ImmutableMap;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * For each identifier in a module, the module that defines it.
 *
 * <p>Built by {@link Resolver}. Module names are dotted, e.g. "Json.Decode";
 * an identifier bound locally (function argument, lambda parameter, "let"
 * declaration, case pattern) maps to the empty string.
 */
public class ModuleNameLookupTable {
  /** Dotted name of the module that was resolved. */
  public final String moduleName;
  private final ImmutableMap<Pos, String> modules;
  /** Module that each unqualified name refers to at the top level. */
  final ImmutableMap<String, String> unqualified;
  /** Qualifier with which each imported module is referenced, e.g.
   * "Set" for "import Set", "D" for "import Json.Decode as D". */
  final ImmutableMap<String, String> qualifiers;

  ModuleNameLookupTable(String moduleName, ImmutableMap<Pos, String> modules,
      ImmutableMap<String, String> unqualified,
      ImmutableMap<String, String> qualifiers) {
    this.moduleName = requireNonNull(moduleName);
    this.modules = requireNonNull(modules);
    this.unqualified = requireNonNull(unqualified);
    this.qualifiers = requireNonNull(qualifiers);
  }

  /** Returns the module that defines an identifier; the empty string if the
   * identifier is a local binding; null if unknown. */
  public @Nullable String moduleNameFor(Ast.Id id) {
    return modules.get(id.pos);
  }

  /** Returns the module of the identifier at a given position. */
  public @Nullable String moduleNameAt(Pos pos) {
    return modules.get(pos);
  }

  /** Returns the number of identifiers resolved. */
  public int size() {
    return modules.size();
  }
}

// End ModuleNameLookupTable.java
