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

package com.google.template.expr.compiler;

import static java.lang.Math.max;
import static java.lang.Math.min;

import com.google.common.base.Splitter;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Lightweight message formatter. The format of messages this formatter produces is very compact
 * and to the point:
 *
 * <pre>
 * App.vue:1:4: ERROR - [TEMPLATE_EXPRESSION_PARSE_ERROR] Error parsing JavaScript expression: ...
 * {{ a( }}
 *    ^^
 * </pre>
 */
public final class LightweightMessageFormatter implements MessageFormatter {
  private final @Nullable List<String> sourceLines;
  private boolean includeLocation = true;
  private boolean includeLevel = true;

  /** Creates a formatter that quotes the offending line of {@code templateSource}. */
  public LightweightMessageFormatter(String templateSource) {
    this.sourceLines = Splitter.on('\n').splitToList(templateSource);
  }

  private LightweightMessageFormatter() {
    this.sourceLines = null;
  }

  /** A formatter for when the client doesn't care about source excerpts. */
  public static LightweightMessageFormatter withoutSource() {
    return new LightweightMessageFormatter();
  }

  @CanIgnoreReturnValue
  public LightweightMessageFormatter setIncludeLocation(boolean includeLocation) {
    this.includeLocation = includeLocation;
    return this;
  }

  @CanIgnoreReturnValue
  public LightweightMessageFormatter setIncludeLevel(boolean includeLevel) {
    this.includeLevel = includeLevel;
    return this;
  }

  @Override
  public String formatError(TemplateError error) {
    return format(error, CheckLevel.ERROR);
  }

  @Override
  public String formatWarning(TemplateError warning) {
    return format(warning, CheckLevel.WARNING);
  }

  private String format(TemplateError error, CheckLevel level) {
    StringBuilder b = new StringBuilder();
    if (includeLocation) {
      appendPosition(b, error.sourceName(), error.lineno(), error.charno());
    }
    if (includeLevel) {
      b.append(level).append(" - [").append(error.type().key).append("] ");
    }
    b.append(error.description()).append('\n');

    String line = getLine(error.lineno());
    if (line != null) {
      b.append(line).append('\n');
      // charno is one based; charno - 1 == line.length() points just past the end of the line.
      int column = error.charno() - 1;
      if (0 <= column && column <= line.length()) {
        padLine(b, line, column, error.length());
      }
    }
    return b.toString();
  }

  private @Nullable String getLine(int lineNumber) {
    if (sourceLines == null || lineNumber < 1 || lineNumber > sourceLines.size()) {
      return null;
    }
    String line = sourceLines.get(lineNumber - 1);
    return line.isEmpty() ? null : line;
  }

  private static void appendPosition(
      StringBuilder b, @Nullable String sourceName, int lineNumber, int charno) {
    if (sourceName != null) {
      b.append(sourceName);
      if (lineNumber > 0) {
        b.append(':').append(lineNumber);
        if (charno > 0) {
          b.append(':').append(charno);
        }
      }
      b.append(": ");
    }
  }

  private static void padLine(StringBuilder b, String line, int column, int errLength) {
    // Keep tabs so the caret lines up with the excerpt
    for (int i = 0; i < column; i++) {
      b.append(line.charAt(i) == '\t' ? '\t' : ' ');
    }
    int length = max(1, min(errLength, line.length() - column));
    for (int i = 0; i < length; i++) {
      b.append('^');
    }
    b.append('\n');
  }
}
