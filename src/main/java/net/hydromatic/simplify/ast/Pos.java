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
package net.hydromatic.simplify.ast;

import java.util.List;
import java.util.Objects;

/**
 * Position of a parse-tree node.
 *
 * <p>Lines and columns are 1-based. The end column is exclusive: the node
 * "abc" on line 1, column 5 has {@code endColumn} 8. A position whose start
 * equals its end is empty; edits use empty positions to insert text.
 */
public class Pos implements Comparable<Pos> {
  public static final Pos ZERO = new Pos("", 0, 0, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  /** Creates a Pos. */
  public Pos(
      String file, int startLine, int startColumn, int endLine, int endColumn) {
    this.file = file;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Creates a Pos without a file name. */
  public static Pos of(int startLine, int startColumn, int endLine,
      int endColumn) {
    return new Pos("", startLine, startColumn, endLine, endColumn);
  }

  /** Creates a Pos from two offsets into a string. */
  public static Pos of(String ml, String file, int startOffset, int endOffset) {
    final int[] start = lineCol(ml, startOffset);
    final int[] end = lineCol(ml, endOffset);
    return new Pos(file, start[0], start[1], end[0], end[1]);
  }

  /** Returns the empty position at the start of this position. */
  public Pos start() {
    return new Pos(file, startLine, startColumn, startLine, startColumn);
  }

  /** Returns the empty position at the end of this position. */
  public Pos end() {
    return new Pos(file, endLine, endColumn, endLine, endColumn);
  }

  /** Returns a position from the start of this to the start of another. */
  public Pos upToStartOf(Pos pos) {
    return new Pos(file, startLine, startColumn, pos.startLine,
        pos.startColumn);
  }

  /** Returns a position from the end of this to the end of another. */
  public Pos fromEndTo(Pos pos) {
    return new Pos(file, endLine, endColumn, pos.endLine, pos.endColumn);
  }

  /** Returns a position from the end of this to the start of another. */
  public Pos between(Pos pos) {
    return new Pos(file, endLine, endColumn, pos.startLine, pos.startColumn);
  }

  /** Returns whether this position is empty. */
  public boolean isEmpty() {
    return startLine == endLine && startColumn == endColumn;
  }

  /** Returns whether this position lies on one line. */
  public boolean isSingleLine() {
    return startLine == endLine;
  }

  /** Returns whether this position contains another. */
  public boolean contains(Pos pos) {
    return compare(startLine, startColumn, pos.startLine, pos.startColumn) <= 0
        && compare(pos.endLine, pos.endColumn, endLine, endColumn) <= 0;
  }

  /** Returns whether this position and another have characters in
   * common. Adjacent positions do not overlap. */
  public boolean overlaps(Pos pos) {
    return compare(startLine, startColumn, pos.endLine, pos.endColumn) < 0
        && compare(pos.startLine, pos.startColumn, endLine, endColumn) < 0;
  }

  private static int compare(int line0, int column0, int line1, int column1) {
    return line0 != line1
        ? Integer.compare(line0, line1)
        : Integer.compare(column0, column1);
  }

  @Override public int compareTo(Pos o) {
    final int c = compare(startLine, startColumn, o.startLine, o.startColumn);
    return c != 0 ? c : compare(endLine, endColumn, o.endLine, o.endColumn);
  }

  @Override public int hashCode() {
    return Objects.hash(startLine, startColumn, endLine, endColumn);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
        && this.startLine == ((Pos) o).startLine
        && this.startColumn == ((Pos) o).startColumn
        && this.endLine == ((Pos) o).endLine
        && this.endColumn == ((Pos) o).endColumn;
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn != startColumn + 1 || endLine != startLine) {
      buf.append('-')
          .append(endLine)
          .append('.')
          .append(endColumn);
    }
    return buf;
  }

  /**
   * Combines a list of parser positions to create a position which spans
   * from the beginning of the first to the end of the last.
   */
  public static Pos sum(List<? extends AstNode> nodes) {
    switch (nodes.size()) {
      case 0:
        throw new AssertionError();
      case 1:
        return nodes.get(0).pos;
      default:
        Pos p = nodes.get(0).pos;
        for (AstNode node : nodes) {
          p = p.plus(node.pos);
        }
        return p;
    }
  }

  /** Returns the smallest position that contains this and another. */
  public Pos plus(Pos pos) {
    int startLine = this.startLine;
    int startColumn = this.startColumn;
    if (pos.startLine < startLine
        || pos.startLine == startLine
        && pos.startColumn < startColumn) {
      startLine = pos.startLine;
      startColumn = pos.startColumn;
    }
    int endLine = pos.endLine;
    int endColumn = pos.endColumn;
    if (this.endLine > endLine
        || this.endLine == endLine
        && this.endColumn > endColumn) {
      endLine = this.endLine;
      endColumn = this.endColumn;
    }
    return new Pos(file, startLine, startColumn, endLine, endColumn);
  }

  /** Returns the 1-based line and column of an offset. */
  private static int[] lineCol(String s, int offset) {
    int line = 1;
    int lineStart = 0;
    int i;
    final int n = Math.min(s.length(), offset);
    for (i = 0; i < n; i++) {
      if (s.charAt(i) == '\n') {
        ++line;
        lineStart = i + 1;
      }
    }
    if (i == offset) {
      return new int[] {line, offset - lineStart + 1};
    } else {
      throw new IllegalArgumentException("not found");
    }
  }
}

// End Pos.java
