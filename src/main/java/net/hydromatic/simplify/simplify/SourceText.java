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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.simplify.ast.AstNode;
import net.hydromatic.simplify.ast.Pos;

/** Source text of a module, with a mapping from positions to offsets. */
public class SourceText {
  public final String text;
  /** Offset of the first character of each line; element 0 is line 1. */
  private final int[] lineStarts;

  public SourceText(String text) {
    this.text = text;
    final List<Integer> starts = new ArrayList<>();
    starts.add(0);
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        starts.add(i + 1);
      }
    }
    this.lineStarts = starts.stream().mapToInt(i -> i).toArray();
  }

  /** Returns the offset of a 1-based line and column. */
  public int offset(int line, int column) {
    checkArgument(line >= 1 && line <= lineStarts.length,
        "line %s out of range", line);
    final int offset = lineStarts[line - 1] + column - 1;
    checkArgument(offset >= 0 && offset <= text.length(),
        "column %s out of range", column);
    return offset;
  }

  public int startOffset(Pos pos) {
    return offset(pos.startLine, pos.startColumn);
  }

  public int endOffset(Pos pos) {
    return offset(pos.endLine, pos.endColumn);
  }

  /** Returns the text of a range. */
  public String text(Pos pos) {
    return text.substring(startOffset(pos), endOffset(pos));
  }

  /** Returns the source text of a node. */
  public String text(AstNode node) {
    return text(node.pos);
  }

  /** Returns the text of a 1-based line, without its line break. */
  public String line(int line) {
    final int start = lineStarts[line - 1];
    final int end = line < lineStarts.length
        ? lineStarts[line] - 1
        : text.length();
    return text.substring(start, end);
  }

  /** Returns the number of lines. */
  public int lineCount() {
    return lineStarts.length;
  }
}

// End SourceText.java
