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

import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.parse.SimplifyParseException;

/** Called on various events during simplification. */
public interface Tracer {
  /** Called when a module has been parsed, before it is checked. */
  void onModule(Ast.Module module);

  /** Called for each finding. */
  void onFinding(Finding finding);

  /** Called, at most once per run, if the configuration is invalid. */
  void onConfigurationError(ConfigurationError error);

  /**
   * Called with the exception thrown while parsing a module. Returns whether
   * a handler was found; if not, the exception is rethrown.
   */
  boolean onParseException(SimplifyParseException e);
}

// End Tracer.java
