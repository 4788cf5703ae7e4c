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

import java.util.List;
import net.hydromatic.simplify.ast.Ast;

/**
 * Simplification rule.
 *
 * <p>A rule looks at one expression and returns the findings it has for
 * it, usually zero or one. A rule must not throw; if it cannot prove that a
 * simplification is safe it returns an empty list.
 *
 * @see RuleTable
 */
@FunctionalInterface
public interface Rule {
  /** Checks an expression.
   *
   * @param exp Expression; the same as {@code cx.node}
   * @param cx Context
   * @return Findings, possibly empty
   */
  List<Finding> check(Ast.Exp exp, Context cx);
}

// End Rule.java
