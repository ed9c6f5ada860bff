/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.template.expr.sourcemap;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkPositionIndexes;

/**
 * Maps offsets relative to an embedded substring back to absolute positions in the template that
 * contains it.
 *
 * <p>The expression parser only sees the text of one expression, so every position it hands out is
 * relative to that text. This class turns those into template positions, keeping track of the
 * newlines crossed on the way.
 */
public final class SourceLocationRemapper {
  private final SourceLocation base;
  // Line and column of every relative offset, computed once. Index i holds the position of
  // relative offset i; the extra last entry is the end of the substring.
  private final FilePosition[] positions;

  public SourceLocationRemapper(SourceLocation base) {
    this.base = base;
    String text = base.source();
    this.positions = new FilePosition[text.length() + 1];
    FilePosition current = base.start();
    positions[0] = current;
    int line = current.getLine();
    int column = current.getColumn();
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        line++;
        column = 1;
      } else {
        column++;
      }
      positions[i + 1] = new FilePosition(current.getOffset() + i + 1, line, column);
    }
  }

  public SourceLocationRemapper(FilePosition start, String source) {
    this(SourceLocation.of(start, source));
  }

  public SourceLocation getBase() {
    return base;
  }

  /** Returns the absolute position of a zero-based offset into the substring. */
  public FilePosition position(int relativeOffset) {
    checkElementIndex(relativeOffset, positions.length, "relative offset");
    return positions[relativeOffset];
  }

  /** Returns the absolute location of the substring range {@code [relStart, relEnd)}. */
  public SourceLocation location(int relStart, int relEnd) {
    checkPositionIndexes(relStart, relEnd, base.source().length());
    return new SourceLocation(
        positions[relStart], positions[relEnd], base.source().substring(relStart, relEnd));
  }
}
