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

/** Tests for simplification of calls to the {@code List} module and of the
 * list operators. */
public class ListTest {
  @Test void testEmptyGivesEmpty() {
    sml("a = List.map f []")
        .assertFinding("Using List.map on an empty list will result in an "
            + "empty list", "a = []");
    sml("a = [] |> List.map f")
        .assertFinding("Using List.map on an empty list will result in an "
            + "empty list", "a = []");
    sml("a = List.reverse []")
        .assertFinding("Using List.reverse on an empty list will result in "
            + "an empty list", "a = []");
    sml("a = List.sortBy f []")
        .assertFinding("Using List.sortBy on an empty list will result in "
            + "an empty list", "a = []");
  }

  @Test void testMapIdentity() {
    sml("a = List.map identity x")
        .assertFinding("Using List.map with an identity function is the "
            + "same as not using List.map", "a = x");
    sml("a = List.map (\\y -> y) x")
        .assertFinding("Using List.map with an identity function is the "
            + "same as not using List.map", "a = x");
    sml("import List exposing (map)\n"
        + "\n"
        + "a = map identity x\n")
        .assertFinding("Using List.map with an identity function is the "
            + "same as not using List.map",
            "import List exposing (map)\n\na = x\n");
  }

  @Test void testFilter() {
    sml("a = List.filter (always True) x")
        .assertFinding("Using List.filter with a function that will always "
            + "return True is the same as not using List.filter", "a = x");
    sml("a = List.filter (\\y -> False) x")
        .assertFinding("Using List.filter with a function that will always "
            + "return False will result in an empty list", "a = []");
    sml("a = List.filter f x")
        .assertNoFindings();
  }

  @Test void testFilterMap() {
    sml("a = List.filterMap Just x")
        .assertFinding("Using List.filterMap with a function that will "
            + "always return Just is the same as not using List.filterMap",
            "a = x");
    sml("a = List.filterMap (always Nothing) x")
        .assertFinding("Using List.filterMap with a function that will "
            + "always return Nothing will result in an empty list",
            "a = []");
    sml("a = List.filterMap (\\y -> Just (y + 1)) x")
        .assertFinding("Use List.map instead",
            "a = List.map (\\y -> (y + 1)) x");
  }

  @Test void testConcatMap() {
    sml("a = List.concatMap identity x")
        .assertFinding("Using List.concatMap with an identity function is "
            + "the same as using List.concat", "a = List.concat x");
  }

  @Test void testConcat() {
    sml("a = List.concat [ x ]")
        .assertFinding("Unnecessary use of List.concat on a list with 1 "
            + "element", "a = x");
    sml("a = List.concat [ [ 1 ], [ 2, 3 ] ]")
        .assertFinding("Expression could be simplified to be a single List",
            "a = [1, 2, 3]");
    sml("a = List.concat [ [ 1 ], [ 2 ], x ]")
        .assertFinding("Consecutive literal lists should be merged",
            "a = List.concat [[1, 2], x]");
    sml("a = List.concat [ [ 1 ], x, [ 2 ] ]")
        .assertNoFindings();
  }

  @Test void testDoubleReverse() {
    sml("a = List.reverse (List.reverse x)")
        .assertFinding("Unnecessary double reversal", "a = x");
    sml("a = x |> List.reverse |> List.reverse")
        .assertFinding("Unnecessary double reversal", "a = x");
  }

  @Test void testKnownResults() {
    sml("a = List.isEmpty []")
        .assertFinding("The call to List.isEmpty will result in True",
            "a = True");
    sml("a = List.isEmpty [ x ]")
        .assertFinding("The call to List.isEmpty will result in False",
            "a = False");
    sml("a = List.length [ 1, 2, 3 ]")
        .assertFinding("The length of the list is 3", "a = 3");
    sml("a = List.all f []")
        .assertFinding("The call to List.all will result in True",
            "a = True");
    sml("a = List.any (always False) x")
        .assertFinding("The call to List.any will result in False",
            "a = False");
    sml("a = List.member x []")
        .assertFinding("Using List.member on an empty list will result in "
            + "False", "a = False");
  }

  @Test void testSumAndProduct() {
    sml("a = List.sum []")
        .assertFinding("The call to List.sum will result in 0", "a = 0");
    sml("a = List.product []")
        .assertFinding("The call to List.product will result in 1",
            "a = 1");
    sml("a = List.sum [ x ]")
        .assertFinding("Using List.sum on a list with a single element will "
            + "result in the element itself", "a = x");
  }

  @Test void testHead() {
    sml("a = List.head []")
        .assertFinding("Using List.head on an empty list will result in "
            + "Nothing", "a = Nothing");
    sml("a = List.head [ x, y ]")
        .assertFinding("Using List.head on a list with a first element will "
            + "result in Just the first element", "a = Just x");
    sml("a = List.maximum []")
        .assertFinding("Using List.maximum on an empty list will result in "
            + "Nothing", "a = Nothing");
  }

  @Test void testFold() {
    sml("a = List.foldl f 0 []")
        .assertFinding("The call to List.foldl will result in the initial "
            + "accumulator", "a = 0");
    sml("a = [] |> List.foldr f x")
        .assertFinding("The call to List.foldr will result in the initial "
            + "accumulator", "a = x");
  }

  @Test void testPartition() {
    sml("a = List.partition f []")
        .assertFinding("Using List.partition on an empty list will result in "
            + "a tuple of empty lists", "a = ([], [])");
    sml("a = List.partition (always True) x")
        .assertFinding("All elements will go to the first list",
            "a = (x, [])");
  }

  @Test void testTakeDrop() {
    sml("a = List.take 0 x")
        .assertFinding("Taking 0 items from a list will result in []",
            "a = []");
    sml("a = List.drop 0 x")
        .assertFinding("Dropping 0 items from a list will result in the "
            + "list itself", "a = x");
    sml("a = List.take 1 x")
        .assertNoFindings();
  }

  @Test void testAppend() {
    sml("a = List.append [] x")
        .assertFinding("Appending [] does not change the list", "a = x");
    sml("a = x ++ []")
        .assertFinding("Unnecessary concatenation with an empty list",
            "a = x");
    sml("a = \"\" ++ s")
        .assertFinding("Unnecessary concatenation with an empty string",
            "a = s");
    sml("a = [ 1 ] ++ [ 2, 3 ]")
        .assertFinding("Expression could be simplified to be a single List",
            "a = [1, 2, 3]");
    sml("a = [ f x ] ++ y")
        .assertFinding("Should use (::) instead of (++)", "a = f x :: y");
    sml("a = x ++ y")
        .assertNoFindings();
  }

  @Test void testCons() {
    sml("a = 1 :: [ 2, 3 ]")
        .assertFinding("Element added to the beginning of the list could be "
            + "included in the list", "a = [1, 2, 3]");
    sml("a = 1 :: x")
        .assertNoFindings();
  }
}

// End ListTest.java
