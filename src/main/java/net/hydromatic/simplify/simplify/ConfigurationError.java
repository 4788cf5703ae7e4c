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
import java.util.List;
import java.util.stream.Collectors;

/** Error in the configuration: some type names could not be found. */
public class ConfigurationError {
  /** Invalid type names, in order of first appearance. */
  public final List<String> typeNames;

  ConfigurationError(ImmutableList<String> typeNames) {
    this.typeNames = requireNonNull(typeNames);
  }

  /** Returns the message, for example
   * "Could not find type names: `Maybe.Perhaps`, `Foo`". */
  public String message() {
    return "Could not find type names: "
        + typeNames.stream().map(name -> "`" + name + "`")
            .collect(Collectors.joining(", "));
  }

  public List<String> details() {
    return ImmutableList.of(
        "I expected to find these custom types in the dependencies, but I "
            + "could not find them.",
        "Please check whether these types and their module names are "
            + "spelled correctly. Each name must be qualified by its module, "
            + "for example `Maybe.Maybe`.");
  }

  /** Converts this error to a global finding. */
  public Finding toFinding() {
    return Finding.global(message(), details());
  }

  @Override public String toString() {
    return message();
  }
}

// End ConfigurationError.java
