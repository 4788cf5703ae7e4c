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

/** Tests for simplification of "let" expressions. */
public class LetTest {
  @Test void testJoinLets() {
    sml("a =\n"
        + "    let\n"
        + "        b = 1\n"
        + "    in\n"
        + "    let\n"
        + "        c = 2\n"
        + "    in\n"
        + "    b + c\n")
        .assertFinding("Let blocks can be joined together",
            "a =\n"
                + "    let\n"
                + "        b = 1\n"
                + "        c = 2\n"
                + "    in\n"
                + "    b + c\n");
  }

  @Test void testJoinLetsReindent() {
    sml("a =\n"
        + "    let\n"
        + "        b = 1\n"
        + "    in\n"
        + "    let\n"
        + "      c =\n"
        + "        2\n"
        + "    in\n"
        + "    b + c\n")
        .assertFinding("Let blocks can be joined together",
            "a =\n"
                + "    let\n"
                + "        b = 1\n"
                + "        c =\n"
                + "          2\n"
                + "    in\n"
                + "    b + c\n");
  }

  @Test void testSingleLet() {
    sml("a =\n"
        + "    let\n"
        + "        b = 1\n"
        + "    in\n"
        + "    f b\n")
        .assertNoFindings();
  }
}

// End LetTest.java
