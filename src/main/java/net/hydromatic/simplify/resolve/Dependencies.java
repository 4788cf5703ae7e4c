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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.simplify.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Describes the modules that a module under analysis can import: the values
 * each module exposes, and its custom types with their constructors.
 *
 * <p>{@link #core()} describes the standard library.
 */
public class Dependencies {
  private static final Splitter SPACE_SPLITTER =
      Splitter.on(' ').omitEmptyStrings().trimResults();
  private static final Splitter BAR_SPLITTER =
      Splitter.on('|').omitEmptyStrings().trimResults();

  private static final Dependencies CORE = createCore();

  /** Modules, keyed by dotted name, e.g. "Json.Decode". */
  public final ImmutableMap<String, ModuleInfo> modules;

  private Dependencies(ImmutableMap<String, ModuleInfo> modules) {
    this.modules = requireNonNull(modules);
  }

  /** Returns the standard library. */
  public static Dependencies core() {
    return CORE;
  }

  /** Returns an empty builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the description of a module, or null if there is no such
   * module. */
  public @Nullable ModuleInfo module(String moduleName) {
    return modules.get(moduleName);
  }

  /** Returns the constructors of a type, or null if the type does not
   * exist.
   *
   * <p>For example, {@code typeExists("Maybe", "Maybe")} returns
   * ["Just", "Nothing"]; {@code typeExists("Dict", "Dict")} returns an empty
   * list, because {@code Dict} is opaque;
   * {@code typeExists("Maybe", "Perhaps")} returns null. */
  public @Nullable List<String> typeExists(String moduleName,
      String typeName) {
    final ModuleInfo module = modules.get(moduleName);
    return module == null ? null : module.types.get(typeName);
  }

  /** Returns the type that a constructor belongs to, or null. */
  public @Nullable String typeOfConstructor(String moduleName,
      String constructor) {
    final ModuleInfo module = modules.get(moduleName);
    if (module != null) {
      for (Map.Entry<String, ImmutableList<String>> e
          : module.types.entrySet()) {
        if (e.getValue().contains(constructor)) {
          return e.getKey();
        }
      }
    }
    return null;
  }

  /** Returns these dependencies plus the module under analysis: its
   * top-level values and its custom types. */
  public Dependencies plus(Ast.Module module) {
    final Builder b = new Builder();
    b.modules.putAll(modules);
    final ImmutableSet.Builder<String> values = ImmutableSet.builder();
    final ImmutableMap.Builder<String, ImmutableList<String>> types =
        ImmutableMap.builder();
    for (Ast.Decl decl : module.decls) {
      if (decl instanceof Ast.FunDecl) {
        values.add(((Ast.FunDecl) decl).name.name);
      } else if (decl instanceof Ast.TypeDecl) {
        final Ast.TypeDecl typeDecl = (Ast.TypeDecl) decl;
        final ImmutableList.Builder<String> constructors =
            ImmutableList.builder();
        typeDecl.constructors.forEach(c -> constructors.add(c.name));
        types.put(typeDecl.name, constructors.build());
      } else if (decl instanceof Ast.AliasDecl) {
        types.put(((Ast.AliasDecl) decl).name, ImmutableList.of());
      }
    }
    final String name = String.join(".", module.moduleName);
    b.modules.put(name,
        new ModuleInfo(name, values.build(), types.buildKeepingLast()));
    return b.build();
  }

  /** Description of a module. */
  public static class ModuleInfo {
    public final String name;
    public final ImmutableSet<String> values;
    /** Custom types, each with its list of constructors. Opaque types have
     * an empty list. */
    public final ImmutableMap<String, ImmutableList<String>> types;

    ModuleInfo(String name, ImmutableSet<String> values,
        ImmutableMap<String, ImmutableList<String>> types) {
      this.name = requireNonNull(name);
      this.values = requireNonNull(values);
      this.types = requireNonNull(types);
    }

    /** Returns whether this module exposes a value or a constructor with a
     * given name. */
    public boolean defines(String name) {
      if (values.contains(name)) {
        return true;
      }
      for (ImmutableList<String> constructors : types.values()) {
        if (constructors.contains(name)) {
          return true;
        }
      }
      return false;
    }

    @Override public String toString() {
      return name;
    }
  }

  /** Builder for {@link Dependencies}. */
  public static class Builder {
    private final Map<String, ModuleInfo> modules = new LinkedHashMap<>();

    /** Adds a module.
     *
     * @param name Dotted module name, e.g. "Json.Decode"
     * @param values Space-separated list of values
     * @param types Type declarations, each either a name ("Int") or a name
     *              with constructors ("Bool = True | False")
     */
    public Builder module(String name, String values, String... types) {
      final ImmutableMap.Builder<String, ImmutableList<String>> typeMap =
          ImmutableMap.builder();
      for (String type : types) {
        final int eq = type.indexOf('=');
        if (eq < 0) {
          typeMap.put(type.trim(), ImmutableList.of());
        } else {
          typeMap.put(type.substring(0, eq).trim(),
              ImmutableList.copyOf(
                  BAR_SPLITTER.split(type.substring(eq + 1))));
        }
      }
      modules.put(name,
          new ModuleInfo(name,
              ImmutableSet.copyOf(SPACE_SPLITTER.split(values)),
              typeMap.build()));
      return this;
    }

    public Dependencies build() {
      return new Dependencies(ImmutableMap.copyOf(modules));
    }
  }

  private static Dependencies createCore() {
    return builder()
        .module("Basics",
            "toFloat round floor ceiling truncate max min compare not xor "
                + "modBy remainderBy negate abs clamp sqrt logBase e pi cos "
                + "sin tan acos asin atan atan2 degrees radians turns "
                + "toPolar fromPolar isNaN isInfinite identity always never "
                + "(+) (-) (*) (/) (//) (^) (==) (/=) (<) (>) (<=) (>=) "
                + "(&&) (||) (++) (<|) (|>) (<<) (>>)",
            "Int", "Float", "Bool = True | False", "Order = LT | EQ | GT",
            "Never")
        .module("List",
            "singleton repeat range (::) map indexedMap foldl foldr filter "
                + "filterMap length reverse member all any maximum minimum "
                + "sum product append concat concatMap intersperse map2 map3 "
                + "map4 map5 sort sortBy sortWith isEmpty head tail take "
                + "drop partition unzip",
            "List")
        .module("Maybe", "withDefault map map2 map3 map4 map5 andThen",
            "Maybe = Just | Nothing")
        .module("Result",
            "map map2 map3 map4 map5 andThen withDefault toMaybe fromMaybe "
                + "mapError",
            "Result = Ok | Err")
        .module("String",
            "isEmpty length reverse repeat replace append concat split join "
                + "words lines slice left right dropLeft dropRight contains "
                + "startsWith endsWith indexes indices toInt fromInt toFloat "
                + "fromFloat fromChar cons uncons toList fromList toUpper "
                + "toLower pad padLeft padRight trim trimLeft trimRight map "
                + "filter foldl foldr any all",
            "String")
        .module("Char",
            "isUpper isLower isAlpha isAlphaNum isDigit isOctDigit "
                + "isHexDigit toUpper toLower toLocaleUpper toLocaleLower "
                + "toCode fromCode",
            "Char")
        .module("Tuple", "pair first second mapFirst mapSecond mapBoth")
        .module("Debug", "toString log todo")
        .module("Set",
            "empty singleton insert remove isEmpty member size union "
                + "intersect diff toList fromList map foldl foldr filter "
                + "partition",
            "Set")
        .module("Dict",
            "empty singleton insert update remove isEmpty member get size "
                + "keys values toList fromList map foldl foldr filter "
                + "partition union intersect diff merge",
            "Dict")
        .module("Array",
            "empty initialize repeat fromList isEmpty length get set push "
                + "append slice toList toIndexedList map indexedMap foldl "
                + "foldr filter",
            "Array")
        .module("Platform", "worker sendToApp sendToSelf",
            "Program", "Task", "ProcessId", "Router")
        .module("Platform.Cmd", "none batch map", "Cmd")
        .module("Platform.Sub", "none batch map", "Sub")
        .module("Task",
            "succeed fail map map2 map3 map4 map5 andThen sequence perform "
                + "attempt mapError onError",
            "Task")
        .module("Json.Decode",
            "string bool int float nullable list array dict keyValuePairs "
                + "oneOrMore field at index maybe oneOf decodeString "
                + "decodeValue errorToString map map2 map3 map4 map5 map6 "
                + "map7 map8 lazy value null succeed fail andThen",
            "Decoder", "Value",
            "Error = Field | Index | OneOf | Failure")
        .module("Json.Encode",
            "encode string int float bool null list array set object dict",
            "Value")
        .module("Parser",
            "run int float number symbol keyword variable end succeed "
                + "problem oneOf map andThen backtrackable commit lazy token "
                + "sequence loop spaces lineComment multiComment chompIf "
                + "chompWhile chompUntil chompUntilEndOr getChompedString "
                + "mapChompedString withIndent getIndent getPosition getRow "
                + "getCol getOffset getSource deadEndsToString (|.) (|=)",
            "Parser", "Trailing = Forbidden | Optional | Mandatory",
            "Step = Loop | Done", "Nestable = NotNestable | Nestable",
            "Problem = Expecting | ExpectingInt | ExpectingHex "
                + "| ExpectingOctal | ExpectingBinary | ExpectingFloat "
                + "| ExpectingNumber | ExpectingVariable | ExpectingSymbol "
                + "| ExpectingKeyword | ExpectingEnd | UnexpectedChar "
                + "| Problem | BadRepeat")
        .module("Parser.Advanced",
            "run int float number symbol keyword variable end succeed "
                + "problem oneOf map andThen backtrackable commit lazy token "
                + "sequence loop spaces lineComment multiComment chompIf "
                + "chompWhile chompUntil chompUntilEndOr getChompedString "
                + "mapChompedString withIndent getIndent getPosition getRow "
                + "getCol getOffset getSource inContext (|.) (|=)",
            "Parser", "Token = Token",
            "Trailing = Forbidden | Optional | Mandatory",
            "Step = Loop | Done", "Nestable = NotNestable | Nestable")
        .build();
  }
}

// End Dependencies.java
