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

/** Tests for simplification of calls to the {@code String}, {@code Set},
 * {@code Dict}, {@code Cmd}, {@code Tuple} and parser modules. */
public class StringSetDictTest {
  @Test void testStringEmpty() {
    sml("a = String.toUpper \"\"")
        .assertFinding("Using String.toUpper on an empty string will result "
            + "in an empty string", "a = \"\"");
    sml("a = String.left 3 \"\"")
        .assertFinding("Using String.left on an empty string will result in "
            + "an empty string", "a = \"\"");
    sml("a = String.isEmpty \"\"")
        .assertFinding("The call to String.isEmpty will result in True",
            "a = True");
    sml("a = String.length \"abc\"")
        .assertFinding("The length of the string is 3", "a = 3");
    sml("a = String.toList \"\"")
        .assertFinding("Using String.toList on an empty string will result in "
            + "an empty list", "a = []");
  }

  /** String.words and String.lines of an empty string return [""]. */
  @Test void testStringWordsAndLinesOfEmpty() {
    sml("a = String.words \"\"").assertNoFindings();
    sml("a = String.lines \"\"").assertNoFindings();
  }

  @Test void testStringReverse() {
    sml("a = String.reverse (String.reverse s)")
        .assertFinding("Unnecessary double reversal", "a = s");
  }

  @Test void testStringJoin() {
    sml("a = String.join \", \" []")
        .assertFinding("Using String.join on an empty list will result in an "
            + "empty string", "a = \"\"");
    sml("a = String.join \"\" x")
        .assertFinding("Use String.concat instead", "a = String.concat x");
    sml("a = String.concat []")
        .assertFinding("Using String.concat on an empty list will result in "
            + "an empty string", "a = \"\"");
  }

  @Test void testStringRepeat() {
    sml("a = String.repeat n \"\"")
        .assertFinding("Using String.repeat with an empty string will result "
            + "in an empty string", "a = \"\"");
    sml("a = String.repeat 0 s")
        .assertFinding("String.repeat will result in an empty string",
            "a = \"\"");
    sml("a = String.repeat 1 s")
        .assertFinding("String.repeat 1 will always return the same given "
            + "string to repeat", "a = s");
  }

  @Test void testSet() {
    sml("a = Set.map f Set.empty")
        .assertFinding("Using Set.map on Set.empty will result in Set.empty",
            "a = Set.empty");
    sml("a = Set.fromList []")
        .assertFinding("The call to Set.fromList will result in Set.empty",
            "a = Set.empty");
    sml("a = Set.fromList [ x ]")
        .assertFinding("The call to Set.fromList will result in "
            + "Set.singleton", "a = Set.singleton x");
    sml("a = Set.insert x Set.empty")
        .assertFinding("Use Set.singleton instead of inserting in Set.empty",
            "a = Set.singleton x");
    sml("a = Set.union s Set.empty")
        .assertFinding("Unnecessary union with Set.empty", "a = s");
    sml("a = Set.member x Set.empty")
        .assertFinding("Using Set.member on Set.empty will result in False",
            "a = False");
  }

  @Test void testSetSize() {
    sml("a = Set.size Set.empty")
        .assertFinding("The size of the set is 0", "a = 0");
    sml("a = Set.size (Set.singleton x)")
        .assertFinding("The size of the set is 1", "a = 1");
    sml("a = Set.size (Set.fromList [1, 2, 3, 3, 0x3])")
        .assertFinding("The size of the set is 3", "a = 3");
    sml("a = Set.size (Set.fromList [x, y])")
        .assertNoFindings();
    sml("a = Set.size (Set.fromList [0.1 + 0.2, 0.3])")
        .assertFinding("The size of the set is 2", "a = 2");
    sml("a = Set.size (Set.fromList [0.5 + 0.25, 0.75])")
        .assertFinding("The size of the set is 1", "a = 1");
  }

  @Test void testSetExposed() {
    sml("import Set exposing (Set, empty)\n"
        + "\n"
        + "a = Set.fromList []\n")
        .assertFinding("The call to Set.fromList will result in Set.empty",
            "import Set exposing (Set, empty)\n\na = empty\n");
  }

  @Test void testDict() {
    sml("a = Dict.fromList []")
        .assertFinding("The call to Dict.fromList will result in Dict.empty",
            "a = Dict.empty");
    sml("a = Dict.size Dict.empty")
        .assertFinding("The size of the Dict is 0", "a = 0");
    sml("a = Dict.get k Dict.empty")
        .assertFinding("Using Dict.get on Dict.empty will result in Nothing",
            "a = Nothing");
    sml("a = Dict.keys Dict.empty")
        .assertFinding("Using Dict.keys on Dict.empty will result in []",
            "a = []");
    sml("a = Dict.filter f Dict.empty")
        .assertFinding("Using Dict.filter on Dict.empty will result in "
            + "Dict.empty", "a = Dict.empty");
  }

  @Test void testCmdBatch() {
    sml("a = Cmd.batch []")
        .assertFinding("Replace by Cmd.none", "a = Cmd.none");
    sml("a = Cmd.batch [ c ]")
        .assertFinding("Unnecessary Cmd.batch", "a = c");
    sml("a = Cmd.batch [ c, Cmd.none, d ]")
        .assertFinding("Unnecessary Cmd.none", "a = Cmd.batch [ c, d ]");
    sml("a = Cmd.batch [ c, d, Cmd.none ]")
        .assertFinding("Unnecessary Cmd.none", "a = Cmd.batch [ c, d ]");
    sml("a = Sub.batch [ Sub.none, Sub.none ]")
        .assertFinding("Unnecessary Sub.none", "a = Sub.none");
    sml("a = Cmd.map f Cmd.none")
        .assertFinding("Using Cmd.map on Cmd.none will result in Cmd.none",
            "a = Cmd.none");
  }

  @Test void testOneOf() {
    sml("import Json.Decode\n"
        + "\n"
        + "a = Json.Decode.oneOf [ d ]\n")
        .assertFinding("Unnecessary oneOf",
            "import Json.Decode\n\na = d\n");
    sml("import Parser exposing (oneOf)\n"
        + "\n"
        + "a = oneOf [ p ]\n")
        .assertFinding("Unnecessary oneOf",
            "import Parser exposing (oneOf)\n\na = p\n");
  }

  @Test void testTuple() {
    sml("a = Tuple.first ( x, y )")
        .assertFinding("Using Tuple.first on a known tuple will result in "
            + "the first element", "a = x");
    sml("a = Tuple.second (Tuple.pair x y)")
        .assertMessages("Using Tuple.second on a known tuple will result in "
                + "the second element",
            "Use a tuple literal instead of Tuple.pair");
    sml("a = Tuple.pair x y")
        .assertFinding("Use a tuple literal instead of Tuple.pair",
            "a = (x, y)");
  }
}

// End StringSetDictTest.java
