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

/** Tests for comparisons between numeric literals and arithmetic on
 * them. Float arithmetic follows {@code double}. */
public class ComparisonTest {
  @Test void testIntArithmetic() {
    sml("a = 1 + 2 == 3")
        .assertFinding("Condition is always True", "a = True");
    sml("a = 2 * 3 /= 6")
        .assertFinding("Condition is always False", "a = False");
    sml("a = 10 - 4 < 5")
        .assertFinding("Comparison is always False", "a = False");
  }

  @Test void testFloatArithmeticIsNotExact() {
    sml("a = 0.1 + 0.2 == 0.3")
        .assertFinding("Condition is always False", "a = False");
    sml("a = 0.1 + 0.2 /= 0.3")
        .assertFinding("Condition is always True", "a = True");
    sml("a = 0.1 + 0.2 > 0.3")
        .assertFinding("Comparison is always True", "a = True");
    sml("a = 0.3 >= 0.1 + 0.2")
        .assertFinding("Comparison is always False", "a = False");
    sml("a = 0.1 * 3 == 0.3")
        .assertFinding("Condition is always False", "a = False");
  }

  @Test void testFloatArithmeticThatIsExact() {
    sml("a = 0.5 + 0.25 == 0.75")
        .assertFinding("Condition is always True", "a = True");
    sml("a = 1.5 * 2 == 3")
        .assertFinding("Condition is always True", "a = True");
    sml("a = -0.5 < 0")
        .assertFinding("Comparison is always True", "a = True");
  }
}

// End ComparisonTest.java
