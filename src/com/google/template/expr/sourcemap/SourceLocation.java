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
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A span of template source: where it starts, where it ends (exclusive) and the exact text it
 * covers.
 */
public record SourceLocation(FilePosition start, FilePosition end, String source) {

  public SourceLocation {
    checkNotNull(start);
    checkNotNull(end);
    checkNotNull(source);
    checkArgument(
        end.getOffset() - start.getOffset() == source.length(),
        "span [%s, %s) does not match source of length %s",
        start.getOffset(),
        end.getOffset(),
        source.length());
  }

  /** Creates the location of {@code source} when it begins at {@code start}. */
  public static SourceLocation of(FilePosition start, String source) {
    return new SourceLocation(start, start.advance(source), source);
  }

  public int length() {
    return source.length();
  }

  /** Whether {@code other} lies entirely within this span. */
  public boolean contains(SourceLocation other) {
    return start.getOffset() <= other.start().getOffset()
        && other.end().getOffset() <= end.getOffset();
  }

  @Override
  public String toString() {
    return "[" + start + " - " + end + "] " + source;
  }
}
