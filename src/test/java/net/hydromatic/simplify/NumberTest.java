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

/** Tests for simplification of arithmetic. */
public class NumberTest {
  @Test void testAddZero() {
    sml("a = n + 0")
        .assertFinding("Unnecessary addition with 0", "a = n");
    sml("a = 0 + n")
        .assertFinding("Unnecessary addition with 0", "a = n");
    sml("a = n + 0.0")
        .assertFinding("Unnecessary addition with 0", "a = n");
    sml("a = n + 0x0")
        .assertFinding("Unnecessary addition with 0", "a = n");
  }

  @Test void testSubtract() {
    sml("a = n - 0")
        .assertFinding("Unnecessary subtraction with 0", "a = n");
    sml("a = 0 - n")
        .assertFinding("Unnecessary subtracting from 0", "a = -n");
    sml("a = 0 - f x")
        .assertFinding("Unnecessary subtracting from 0", "a = -(f x)");
  }

  @Test void testMultiply() {
    sml("a = n * 1")
        .assertFinding("Unnecessary multiplication by 1", "a = n");
    sml("a = 1 * n")
        .assertFinding("Unnecessary multiplication by 1", "a = n");
    sml("a = n * 0")
        .assertFinding("Multiplication by 0 should be replaced", "a = 0");
    sml("a = 0 * f x")
        .assertFinding("Multiplication by 0 should be replaced", "a = 0");
  }

  @Test void testDivide() {
    sml("a = n / 1")
        .assertFinding("Unnecessary division by 1", "a = n");
    sml("a = n // 1")
        .assertFinding("Unnecessary division by 1", "a = n");
    sml("a = n / 2")
        .assertNoFindings();
  }

  @Test void testDoubleNegation() {
    sml("a = -(-n)")
        .assertFinding("Unnecessary double negation", "a = n");
    sml("a = negate (negate n)")
        .assertFinding("Unnecessary double negation", "a = n");
    sml("a = negate (-n)")
        .assertFinding("Unnecessary double negation", "a = n");
    sml("a = n |> negate |> negate")
        .assertFinding("Unnecessary double negation", "a = n");
    sml("a = negate >> negate")
        .assertFinding("Unnecessary double negation", "a = identity");
  }

  /** Parentheses that are no longer needed are removed with the
   * operation. */
  @Test void testParentheses() {
    sml("a = (n + 0) * 2")
        .assertFinding("Unnecessary addition with 0", "a = n * 2");
    sml("a = (x + y + 0) * 2")
        .assertFinding("Unnecessary addition with 0", "a = (x + y) * 2");
    sml("a = f (n * 1)")
        .assertFinding("Unnecessary multiplication by 1", "a = f n");
    sml("a = f (g n * 1)")
        .assertFinding("Unnecessary multiplication by 1", "a = f (g n)");
  }
}

// End NumberTest.java
