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

/** Tests for simplification of record access and record update. */
public class RecordTest {
  @Test void testAccessRecordLiteral() {
    sml("a = { b = 1, c = 2 }.b")
        .assertFinding("Field access can be simplified", "a = 1");
    sml("a = .c { b = 1, c = f x }")
        .assertFinding("Field access can be simplified", "a = f x");
    sml("a = { b = 1 }.c")
        .assertNoFindings();
  }

  @Test void testAccessRecordUpdate() {
    sml("a = { r | b = 1 }.b")
        .assertFinding("Field access can be simplified", "a = 1");
    sml("a = { r | b = 1 }.c")
        .assertFinding("Field access can be simplified", "a = r.c");
  }

  @Test void testAccessBranches() {
    sml("a = (if x then { b = 1 } else { b = 2 }).b")
        .assertFinding("Field access can be simplified",
            "a = (if x then 1 else 2)");
    sml("a = (if x then { b = 1 } else r).b")
        .assertNoFindings();
  }

  @Test void testAccessLet() {
    sml("a = (let c = 1 in { b = c }).b")
        .assertFinding("Field access can be simplified",
            "a = (let c = 1 in c)");
  }

  @Test void testUpdateAssignsItself() {
    sml("a = { b | d = b.d }")
        .assertFinding("Unnecessary field assignment", "a = b");
    sml("a = { b | c = 1, d = b.d }")
        .assertFinding("Unnecessary field assignment", "a = { b | c = 1 }");
    sml("a = { b | d = b.d, c = 1 }")
        .assertFinding("Unnecessary field assignment", "a = { b | c = 1 }");
    sml("a = { b | d = c.d }")
        .assertNoFindings();
  }
}

// End RecordTest.java
