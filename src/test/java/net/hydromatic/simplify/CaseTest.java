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

/** Tests for simplification of "case" expressions. */
public class CaseTest {
  private static final String SAME_ARMS = "a =\n"
      + "    case x of\n"
      + "        Just y ->\n"
      + "            1\n"
      + "\n"
      + "        Nothing ->\n"
      + "            1\n";

  @Test void testSameArms() {
    sml(SAME_ARMS)
        .assertFinding("Unnecessary case expression", "a =\n    1\n");
  }

  @Test void testSameArmsIgnoredType() {
    sml(SAME_ARMS)
        .withIgnoreCaseOfForTypes("Maybe.Maybe")
        .assertNoFindings();
    sml(SAME_ARMS)
        .withIgnoreCaseOfForTypes("Result.Result")
        .assertFinding("Unnecessary case expression", "a =\n    1\n");
  }

  @Test void testSameArmsUsingBinding() {
    sml("a =\n"
        + "    case x of\n"
        + "        Just y ->\n"
        + "            y\n"
        + "\n"
        + "        Nothing ->\n"
        + "            y\n")
        .assertNoFindings();
  }

  @Test void testBooleanCase() {
    sml("a =\n"
        + "    case x of\n"
        + "        True ->\n"
        + "            1\n"
        + "\n"
        + "        False ->\n"
        + "            2\n")
        .assertFinding("Replace `case..of` by an `if` condition",
            "a =\n    if x then 1 else 2\n");
    sml("a =\n"
        + "    case f x of\n"
        + "        False ->\n"
        + "            1\n"
        + "\n"
        + "        _ ->\n"
        + "            2\n")
        .assertFinding("Replace `case..of` by an `if` condition",
            "a =\n    if not (f x) then 1 else 2\n");
  }

  @Test void testDestructure() {
    sml("a =\n"
        + "    case t of\n"
        + "        ( x, y ) ->\n"
        + "            x + y\n")
        .assertFinding("Use a let expression to destructure data",
            "a =\n    let ( x, y ) = t in x + y\n");
  }

  @Test void testDestructureSingleConstructorType() {
    sml("module A exposing (..)\n"
        + "\n"
        + "type Id = Id Int\n"
        + "\n"
        + "a =\n"
        + "    case i of\n"
        + "        Id n ->\n"
        + "            n + 1\n")
        .assertFinding("Use a let expression to destructure data",
            "module A exposing (..)\n"
                + "\n"
                + "type Id = Id Int\n"
                + "\n"
                + "a =\n"
                + "    let Id n = i in n + 1\n");
  }

  @Test void testDestructureIgnoredType() {
    final String source = "module A exposing (..)\n"
        + "\n"
        + "type Wrapper = Wrapper Int\n"
        + "\n"
        + "a =\n"
        + "    case w of\n"
        + "        Wrapper n ->\n"
        + "            n + 1\n";
    sml(source)
        .withIgnoreCaseOfForTypes("A.Wrapper")
        .assertNoFindings();
    sml(source)
        .withIgnoreCaseOfForTypes("Maybe.Maybe")
        .assertFinding("Use a let expression to destructure data",
            "module A exposing (..)\n"
                + "\n"
                + "type Wrapper = Wrapper Int\n"
                + "\n"
                + "a =\n"
                + "    let Wrapper n = w in n + 1\n");

    // An ignored constructor nested inside a tuple pattern also blocks it.
    final String tupleSource = "module A exposing (..)\n"
        + "\n"
        + "type Wrapper = Wrapper Int\n"
        + "\n"
        + "a =\n"
        + "    case p of\n"
        + "        ( Wrapper n, m ) ->\n"
        + "            n + m\n";
    sml(tupleSource)
        .withIgnoreCaseOfForTypes("A.Wrapper")
        .assertNoFindings();
    sml(tupleSource)
        .assertMessages("Use a let expression to destructure data");
  }

  @Test void testNoDestructureForTwoConstructors() {
    sml("a =\n"
        + "    case m of\n"
        + "        Just n ->\n"
        + "            n + 1\n")
        .assertNoFindings();
  }

  @Test void testDifferentArms() {
    sml("a =\n"
        + "    case x of\n"
        + "        Just y ->\n"
        + "            1\n"
        + "\n"
        + "        Nothing ->\n"
        + "            2\n")
        .assertNoFindings();
  }
}

// End CaseTest.java
