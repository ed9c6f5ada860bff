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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

/**
 * Represents a position in a template source file.
 *
 * <p>The offset is zero based. Line and column numbers both start at 1, matching what editors
 * display.
 */
public final class FilePosition {
  public static final FilePosition START = new FilePosition(0, 1, 1);

  private final int offset;
  private final int line;
  private final int column;

  public FilePosition(int offset, int line, int column) {
    checkArgument(offset >= 0, "negative offset: %s", offset);
    checkArgument(line >= 1 && column >= 1, "bad line/column: %s:%s", line, column);
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  /** Returns the number of characters between the start of the file and this position. */
  public int getOffset() {
    return offset;
  }

  /** Returns the line number of this position, with the first line being 1. */
  public int getLine() {
    return line;
  }

  /** Returns the character index on the line of this position, with the first column being 1. */
  public int getColumn() {
    return column;
  }

  /**
   * Returns the position reached after reading the first {@code count} characters of {@code text},
   * where {@code text} starts at this position. A newline moves to column 1 of the next line.
   */
  public FilePosition advance(String text, int count) {
    checkArgument(count >= 0 && count <= text.length(), "count %s out of range", count);
    int newLine = line;
    int newColumn = column;
    for (int i = 0; i < count; i++) {
      if (text.charAt(i) == '\n') {
        newLine++;
        newColumn = 1;
      } else {
        newColumn++;
      }
    }
    return new FilePosition(offset + count, newLine, newColumn);
  }

  /** Returns the position reached after reading all of {@code text}. */
  public FilePosition advance(String text) {
    return advance(text, text.length());
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof FilePosition)) {
      return false;
    }
    FilePosition that = (FilePosition) o;
    return offset == that.offset && line == that.line && column == that.column;
  }

  @Override
  public int hashCode() {
    return Objects.hash(offset, line, column);
  }

  @Override
  public String toString() {
    return line + ":" + column + " (" + offset + ")";
  }
}
