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

import java.util.Objects;
import net.hydromatic.simplify.ast.Pos;

/**
 * Textual edit of the source of a module.
 *
 * <p>Ranges refer to the original source. An insert has an empty range.
 */
public class Edit implements Comparable<Edit> {
  /** Kind of edit. */
  public enum Kind {
    REMOVE, REPLACE, INSERT
  }

  public final Kind kind;
  public final Pos pos;
  /** Replacement text; empty for {@link Kind#REMOVE}. */
  public final String text;

  private Edit(Kind kind, Pos pos, String text) {
    this.kind = requireNonNull(kind);
    this.pos = requireNonNull(pos);
    this.text = requireNonNull(text);
  }

  /** Creates an edit that removes a range. */
  public static Edit removeRange(Pos pos) {
    return new Edit(Kind.REMOVE, pos, "");
  }

  /** Creates an edit that replaces a range by some text. */
  public static Edit replaceRangeBy(Pos pos, String text) {
    return new Edit(Kind.REPLACE, pos, text);
  }

  /** Creates an edit that inserts text at the start of a position. */
  public static Edit insertAt(Pos pos, String text) {
    return new Edit(Kind.INSERT, pos.start(), text);
  }

  @Override public int compareTo(Edit o) {
    return pos.compareTo(o.pos);
  }

  @Override public int hashCode() {
    return Objects.hash(kind, pos, text);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Edit
        && kind == ((Edit) o).kind
        && pos.equals(((Edit) o).pos)
        && text.equals(((Edit) o).text);
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder();
    switch (kind) {
      case REMOVE:
        b.append("remove ");
        break;
      case REPLACE:
        b.append("replace ");
        break;
      default:
        b.append("insert at ");
    }
    pos.describeTo(b);
    if (kind != Kind.REMOVE) {
      b.append(" \"").append(text).append('"');
    }
    return b.toString();
  }
}

// End Edit.java
