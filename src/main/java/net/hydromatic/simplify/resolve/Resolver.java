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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Pos;
import net.hydromatic.simplify.ast.Visitor;
import net.hydromatic.simplify.parse.Parser;

/**
 * Resolves each identifier in a module to the module that defines it.
 *
 * <p>Takes into account the imports that every module has implicitly,
 * explicit imports (with aliases and exposing lists), the module's own
 * top-level declarations, and local bindings, which shadow everything
 * else.
 */
public class Resolver {
  /** Imports that every module has. */
  static final ImmutableList<Ast.Import> DEFAULT_IMPORTS =
      ImmutableList.copyOf(
          Parser.parse("import Basics exposing (..)\n"
                  + "import List exposing (List, (::))\n"
                  + "import Maybe exposing (Maybe(..))\n"
                  + "import Result exposing (Result(..))\n"
                  + "import String exposing (String)\n"
                  + "import Char exposing (Char)\n"
                  + "import Tuple\n"
                  + "import Debug\n"
                  + "import Platform exposing (Program)\n"
                  + "import Platform.Cmd as Cmd exposing (Cmd)\n"
                  + "import Platform.Sub as Sub exposing (Sub)\n")
              .imports);

  private final Dependencies dependencies;
  private final String moduleName;
  private final Map<String, String> unqualified = new HashMap<>();
  private final Map<String, List<String>> modulesByQualifier =
      new HashMap<>();
  private final Map<String, String> qualifiers = new LinkedHashMap<>();
  private final Map<Pos, String> modules = new HashMap<>();

  private Resolver(Dependencies dependencies, String moduleName) {
    this.dependencies = dependencies;
    this.moduleName = moduleName;
  }

  /** Resolves the identifiers in a module. */
  public static ModuleNameLookupTable resolve(Ast.Module module,
      Dependencies dependencies) {
    final Resolver resolver =
        new Resolver(dependencies, String.join(".", module.moduleName));
    DEFAULT_IMPORTS.forEach(resolver::addImport);
    module.imports.forEach(resolver::addImport);
    resolver.addTopLevel(module);
    module.accept(resolver.new ResolvingVisitor());
    return new ModuleNameLookupTable(resolver.moduleName,
        ImmutableMap.copyOf(resolver.modules),
        ImmutableMap.copyOf(resolver.unqualified),
        ImmutableMap.copyOf(resolver.qualifiers));
  }

  private void addImport(Ast.Import anImport) {
    final String module = String.join(".", anImport.moduleName);
    final String qualifier = anImport.alias != null ? anImport.alias : module;
    modulesByQualifier.computeIfAbsent(qualifier, k -> new ArrayList<>())
        .add(module);
    qualifiers.put(module, qualifier);

    final Dependencies.ModuleInfo info = dependencies.module(module);
    final Ast.Exposing exposing = anImport.exposing;
    if (exposing.all) {
      if (info != null) {
        info.values.forEach(value -> unqualified.put(value, module));
        info.types.values().forEach(constructors ->
            constructors.forEach(c -> unqualified.put(c, module)));
      }
      return;
    }
    exposing.values.forEach(value -> unqualified.put(value, module));
    for (String type : exposing.openTypes) {
      final List<String> constructors =
          info == null ? null : info.types.get(type);
      if (constructors != null) {
        constructors.forEach(c -> unqualified.put(c, module));
      }
    }
  }

  private void addTopLevel(Ast.Module module) {
    for (Ast.Decl decl : module.decls) {
      if (decl instanceof Ast.FunDecl) {
        unqualified.put(((Ast.FunDecl) decl).name.name, moduleName);
      } else if (decl instanceof Ast.TypeDecl) {
        ((Ast.TypeDecl) decl).constructors.forEach(c ->
            unqualified.put(c.name, moduleName));
      }
    }
  }

  /** Resolves a qualified or unqualified identifier that is not a local
   * binding. */
  private void resolveGlobal(Ast.Id id) {
    if (id.moduleName.isEmpty()) {
      final String module = unqualified.get(id.name);
      if (module != null) {
        modules.put(id.pos, module);
      }
      return;
    }
    final String qualifier = String.join(".", id.moduleName);
    final List<String> candidates = modulesByQualifier.get(qualifier);
    if (candidates == null) {
      // Not imported; a known module is still recognized by its full name.
      final Dependencies.ModuleInfo info = dependencies.module(qualifier);
      if (info != null && info.defines(id.name)) {
        modules.put(id.pos, qualifier);
      }
      return;
    }
    for (String candidate : candidates) {
      final Dependencies.ModuleInfo info = dependencies.module(candidate);
      if (info != null && info.defines(id.name)) {
        modules.put(id.pos, candidate);
        return;
      }
    }
    if (candidates.size() == 1) {
      // A module that we know nothing about, such as another module in
      // the same project.
      modules.put(id.pos, candidates.get(0));
    }
  }

  /** Adds the names bound by a pattern to a list. */
  static void addBindings(Ast.Pat pat, List<String> names) {
    pat.visit(p -> {
      if (p instanceof Ast.IdPat) {
        names.add(((Ast.IdPat) p).name);
      }
    });
  }

  /** Visitor that keeps track of local bindings. */
  private class ResolvingVisitor extends Visitor {
    private final List<String> locals = new ArrayList<>();

    private void pop(int size) {
      while (locals.size() > size) {
        locals.remove(locals.size() - 1);
      }
    }

    @Override protected void visit(Ast.Id id) {
      if (id.moduleName.isEmpty() && locals.contains(id.name)) {
        modules.put(id.pos, "");
      } else {
        resolveGlobal(id);
      }
    }

    @Override protected void visit(Ast.ConPat conPat) {
      resolveGlobal(conPat.con);
      super.visit(conPat);
    }

    @Override protected void visit(Ast.FunDecl funDecl) {
      final int size = locals.size();
      funDecl.pats.forEach(pat -> addBindings(pat, locals));
      super.visit(funDecl);
      pop(size);
    }

    @Override protected void visit(Ast.Fn fn) {
      final int size = locals.size();
      fn.pats.forEach(pat -> addBindings(pat, locals));
      super.visit(fn);
      pop(size);
    }

    @Override protected void visit(Ast.Let let) {
      final int size = locals.size();
      for (Ast.Decl decl : let.decls) {
        if (decl instanceof Ast.FunDecl) {
          locals.add(((Ast.FunDecl) decl).name.name);
        } else if (decl instanceof Ast.DestructDecl) {
          addBindings(((Ast.DestructDecl) decl).pat, locals);
        }
      }
      super.visit(let);
      pop(size);
    }

    @Override protected void visit(Ast.Match match) {
      final int size = locals.size();
      addBindings(match.pat, locals);
      super.visit(match);
      pop(size);
    }
  }
}

// End Resolver.java
