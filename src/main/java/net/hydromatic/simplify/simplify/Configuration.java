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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.simplify.resolve.Dependencies;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Configuration of the simplifier. Immutable.
 *
 * <p>Create a configuration by calling {@link #defaults()} and then calling
 * builder methods, each of which returns a new configuration:
 *
 * <blockquote><pre>
 * Configuration c = Configuration.defaults()
 *     .ignoreCaseOfForTypes(Arrays.asList("Json.Decode.Error"));
 * </pre></blockquote>
 */
public class Configuration {
  private static final Configuration DEFAULT =
      new Configuration(ImmutableList.of());

  /** Qualified names of types, such as "Maybe.Maybe", whose constructors
   * prevent a case expression from being reported as unnecessary. */
  public final List<String> ignoreCaseOfForTypes;

  private Configuration(ImmutableList<String> ignoreCaseOfForTypes) {
    this.ignoreCaseOfForTypes = requireNonNull(ignoreCaseOfForTypes);
  }

  /** Returns the default configuration. */
  public static Configuration defaults() {
    return DEFAULT;
  }

  /** Returns a configuration that also ignores case expressions whose
   * patterns use constructors of the given types. Each type name has the
   * form "Module.Type", for example "Json.Decode.Error". */
  public Configuration ignoreCaseOfForTypes(List<String> typeNames) {
    return new Configuration(
        ImmutableList.<String>builder().addAll(ignoreCaseOfForTypes)
            .addAll(typeNames).build());
  }

  /** Returns whether a qualified type name is in the ignore list. */
  public boolean ignoresType(String qualifiedTypeName) {
    return ignoreCaseOfForTypes.contains(qualifiedTypeName);
  }

  /** Checks that every type in the ignore list exists; returns an error
   * listing the names that do not, or null if all are valid.
   *
   * <p>Names are reported in order of first appearance, without
   * duplicates. */
  public @Nullable ConfigurationError validate(Dependencies dependencies) {
    final Set<String> badNames = new LinkedHashSet<>();
    for (String typeName : ignoreCaseOfForTypes) {
      if (!isValid(typeName, dependencies)) {
        badNames.add(typeName);
      }
    }
    return badNames.isEmpty()
        ? null
        : new ConfigurationError(ImmutableList.copyOf(badNames));
  }

  /** Checks that every type in the ignore list exists; throws if not. */
  public void validateOrThrow(Dependencies dependencies) {
    final ConfigurationError error = validate(dependencies);
    if (error != null) {
      throw new ConfigurationException(error);
    }
  }

  private static boolean isValid(String typeName,
      Dependencies dependencies) {
    final int dot = typeName.lastIndexOf('.');
    if (dot <= 0 || dot == typeName.length() - 1) {
      // empty, or no module name
      return false;
    }
    final String moduleName = typeName.substring(0, dot);
    final String name = typeName.substring(dot + 1);
    return dependencies.typeExists(moduleName, name) != null;
  }

  @Override public String toString() {
    return "Configuration{ignoreCaseOfForTypes=" + ignoreCaseOfForTypes + "}";
  }
}

// End Configuration.java
