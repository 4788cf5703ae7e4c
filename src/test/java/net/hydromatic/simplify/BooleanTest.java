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

/** Tests for simplification of boolean operators and comparisons. */
public class BooleanTest {
  @Test void testOrTrue() {
    sml("a = True || x")
        .assertFinding("Comparison is always True", "a = True");
    sml("a = x || True")
        .assertFinding("Part of the expression is unnecessary", "a = True");
  }

  @Test void testOrFalse() {
    sml("a = x || False")
        .assertFinding("Unnecessary check for `|| False`", "a = x");
    sml("a = False || x")
        .assertFinding("Unnecessary check for `|| False`", "a = x");
  }

  @Test void testAnd() {
    sml("a = x && True")
        .assertFinding("Unnecessary check for `&& True`", "a = x");
    sml("a = True && x")
        .assertFinding("Unnecessary check for `&& True`", "a = x");
    sml("a = x && False")
        .assertFinding("Part of the expression is unnecessary", "a = False");
    sml("a = False && x")
        .assertFinding("Comparison is always False", "a = False");
  }

  @Test void testQualifiedLiteral() {
    sml("a = x || Basics.True")
        .assertFinding("Part of the expression is unnecessary",
            "a = Basics.True");
  }

  @Test void testDuplicateOperand() {
    sml("a = x || y || x")
        .assertFinding("Part of the expression is unnecessary",
            "a = x || y");
    sml("a = x && y && x")
        .assertFinding("Part of the expression is unnecessary",
            "a = x && y");
    sml("a = f x || g y || f x")
        .assertFinding("Part of the expression is unnecessary",
            "a = f x || g y");
    sml("a = x || y || z")
        .assertNoFindings();
  }

  @Test void testNotLiteral() {
    sml("a = not True")
        .assertFinding("Expression is equal to False", "a = False");
    sml("a = not False")
        .assertFinding("Expression is equal to True", "a = True");
    sml("a = True |> not")
        .assertFinding("Expression is equal to False", "a = False");
  }

  @Test void testDoubleNegation() {
    sml("a = not (not x)")
        .assertFinding("Unnecessary double negation", "a = x");
    sml("a = x |> not |> not")
        .assertFinding("Unnecessary double negation", "a = x");
    sml("a = not <| not x")
        .assertFinding("Unnecessary double negation", "a = x");
    sml("a = not >> not")
        .assertFinding("Unnecessary double negation", "a = identity");
  }

  @Test void testComparisonWithBoolean() {
    sml("a = x == True")
        .assertFinding("Unnecessary comparison with boolean", "a = x");
    sml("a = True == x")
        .assertFinding("Unnecessary comparison with boolean", "a = x");
    sml("a = x /= False")
        .assertFinding("Unnecessary comparison with boolean", "a = x");
    sml("a = f x == True")
        .assertFinding("Unnecessary comparison with boolean", "a = f x");
    sml("a = x == False")
        .assertNoFindings();
  }

  @Test void testNegationOnBothSides() {
    sml("a = not x == not y")
        .assertFinding("Unnecessary negation on both sides", "a = x == y");
  }

  @Test void testSameValues() {
    sml("a = 1 == 1")
        .assertFinding("Condition is always True", "a = True");
    sml("a = x == x")
        .assertFinding("Condition is always True", "a = True");
    sml("a = x /= x")
        .assertFinding("Condition is always False", "a = False");
    sml("a = (a + b) == (b + a)")
        .assertFinding("Condition is always True", "a = True");
    sml("a = f x == (f x)")
        .assertFinding("Condition is always True", "a = True");
  }

  @Test void testDifferentValues() {
    sml("a = \"a\" == \"b\"")
        .assertFinding("Condition is always False", "a = False");
    sml("a = 'a' /= 'b'")
        .assertFinding("Condition is always True", "a = True");
    sml("a = [1, 2] == [1, 2, 3]")
        .assertFinding("Condition is always False", "a = False");
    sml("a = Just 1 == Nothing")
        .assertFinding("Condition is always False", "a = False");
    sml("a = (1, x) == (2, y)")
        .assertFinding("Condition is always False", "a = False");
    sml("a = 1 == 1.0")
        .assertFinding("Condition is always True", "a = True");
  }

  @Test void testUnknownComparison() {
    sml("a = x == y")
        .assertNoFindings();
    sml("a = f x == f y")
        .assertNoFindings();
    sml("a = [x] == [y]")
        .assertNoFindings();
  }

  @Test void testOrdering() {
    sml("a = 1 < 2")
        .assertFinding("Comparison is always True", "a = True");
    sml("a = 2 <= 1")
        .assertFinding("Comparison is always False", "a = False");
    sml("a = 3 >= 3")
        .assertFinding("Comparison is always True", "a = True");
    sml("a = x > 1")
        .assertNoFindings();
  }
}

// End BooleanTest.java
