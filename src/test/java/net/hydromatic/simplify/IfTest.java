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
package net.hydromatic.simplify;

import static net.hydromatic.simplify.Sml.sml;

import org.junit.jupiter.api.Test;

/** Tests for simplification of "if" expressions. */
public class IfTest {
  @Test void testConstantCondition() {
    sml("a = if True then 1 else 2")
        .assertFinding("The condition will always evaluate to True",
            "a = 1");
    sml("a = if False then 1 else 2")
        .assertFinding("The condition will always evaluate to False",
            "a = 2");
    sml("a = f (if True then g x else 2)")
        .assertFinding("The condition will always evaluate to True",
            "a = f (g x)");
  }

  @Test void testBooleanBranches() {
    sml("a = if c then True else False")
        .assertFinding("The if expression's value is the same as the "
            + "condition", "a = c");
    sml("a = if c then False else True")
        .assertFinding("The if expression's value is the inverse of the "
            + "condition", "a = not c");
    sml("a = if f x then False else True")
        .assertFinding("The if expression's value is the inverse of the "
            + "condition", "a = not (f x)");
  }

  @Test void testSameBranches() {
    sml("a = if c then f x else f x")
        .assertFinding("The values in both branches is the same.",
            "a = f x");
    sml("a = if c then x else y")
        .assertNoFindings();
  }

  @Test void testKnownCondition() {
    sml("a = if x then (if x then 1 else 2) else 3")
        .assertFinding("The condition will always evaluate to True",
            "a = if x then 1 else 3");
    sml("a = if x then 1 else if x then 2 else 3")
        .assertFinding("The condition will always evaluate to False",
            "a = if x then 1 else 3");
  }

  @Test void testKnownConditionFromAnd() {
    sml("a = if x && y then (if x then 1 else 2) else 3")
        .assertFinding("The condition will always evaluate to True",
            "a = if x && y then 1 else 3");
    sml("a = x && (if x then y else z)")
        .assertFinding("The condition will always evaluate to True",
            "a = x && y");
    sml("a = x || (if x then y else z)")
        .assertFinding("The condition will always evaluate to False",
            "a = x || z");
  }

  @Test void testKnownConditionFromNot() {
    sml("a = if not x then 1 else (if x then 2 else 3)")
        .assertFinding("The condition will always evaluate to True",
            "a = if not x then 1 else 2");
    sml("a = if x then (if not x then 1 else 2) else 3")
        .assertFinding("The condition will always evaluate to False",
            "a = if x then 2 else 3");
  }

  /** A condition that holds in one branch says nothing about code
   * outside the "if". */
  @Test void testConditionScope() {
    sml("a = (if x then 1 else 2) + (if x then 3 else 4)")
        .assertNoFindings();
  }
}

// End IfTest.java
