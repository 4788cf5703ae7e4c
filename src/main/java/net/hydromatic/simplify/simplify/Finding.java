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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.simplify.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A simplification that was found in a module, with an optional fix.
 *
 * <p>A global finding, such as a configuration error, is not attached to
 * any node, and its position is {@link Pos#ZERO}.
 */
public class Finding {
  public final String message;
  public final List<String> details;
  public final Pos pos;
  /** Edits that perform the simplification, or null if there is no
   * automatic fix. */
  public final @Nullable List<Edit> fix;
  public final boolean global;

  private Finding(String message, ImmutableList<String> details, Pos pos,
      @Nullable ImmutableList<Edit> fix, boolean global) {
    this.message = requireNonNull(message);
    this.details = requireNonNull(details);
    this.pos = requireNonNull(pos);
    this.fix = fix;
    this.global = global;
  }

  /** Creates a finding with a fix. The edits are sorted by position, and
   * must not overlap. */
  public static Finding of(String message, List<String> details, Pos pos,
      List<Edit> fix) {
    return new Finding(message, ImmutableList.copyOf(details), pos,
        Fixes.check(fix), false);
  }

  /** Creates a finding that has no fix. */
  public static Finding withoutFix(String message, List<String> details,
      Pos pos) {
    return new Finding(message, ImmutableList.copyOf(details), pos, null,
        false);
  }

  /** Creates a finding that applies to the whole run. */
  public static Finding global(String message, List<String> details) {
    return new Finding(message, ImmutableList.copyOf(details), Pos.ZERO,
        null, true);
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    if (!global) {
      pos.describeTo(buf).append(": ");
    }
    buf.append(message);
    for (String detail : details) {
      buf.append("\n  ").append(detail);
    }
    return buf;
  }
}

// End Finding.java
