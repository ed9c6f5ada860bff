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

package com.google.template.expr.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.template.expr.sourcemap.FilePosition;
import com.google.template.expr.sourcemap.SourceLocation;
import org.jspecify.annotations.Nullable;

/**
 * A template tree construction helper.
 *
 * <p>Every node is located in the template source by searching for its text, starting just after
 * the start of the previously created node. Creating nodes in document order (parents before children,
 * siblings left to right) therefore picks the right occurrence of repeated text.
 */
public final class TemplateIR {
  private final String source;
  private int cursor = 0;

  public TemplateIR(String source) {
    this.source = checkNotNull(source);
  }

  public String getSource() {
    return source;
  }

  /** Returns the location of the next occurrence of {@code text} and moves the search start just past it. */
  public SourceLocation locate(String text) {
    int start = source.indexOf(text, cursor);
    checkArgument(start >= 0, "'%s' not found after offset %s in %s", text, cursor, source);
    cursor = start + 1;
    return locationOf(start, text.length());
  }

  private SourceLocation locationOf(int start, int length) {
    FilePosition begin = FilePosition.START.advance(source, start);
    return SourceLocation.of(begin, source.substring(start, start + length));
  }

  public RootNode root() {
    return new RootNode(SourceLocation.of(FilePosition.START, source));
  }

  /** An element located at its {@code <tag}; directives and children are added by the caller. */
  public ElementNode element(String tag) {
    SourceLocation open = locate("<" + tag);
    int end = source.indexOf('>', open.start().getOffset());
    int start = open.start().getOffset();
    SourceLocation location = end < 0 ? open : locationOf(start, end + 1 - start);
    return new ElementNode(tag, location);
  }

  public TextNode text(String text) {
    return new TextNode(locate(text));
  }

  /** A non-static expression with the given content. */
  public SimpleExpressionNode expression(String content) {
    return new SimpleExpressionNode(content, false, locate(content));
  }

  /**
   * An interpolation such as {@code {{ a + b }}}; the expression is the text between the
   * delimiters with surrounding whitespace removed.
   */
  public InterpolationNode interpolation(String raw) {
    checkArgument(raw.startsWith("{{") && raw.endsWith("}}"), "not an interpolation: %s", raw);
    SourceLocation location = locate(raw);
    String inner = raw.substring(2, raw.length() - 2);
    String content = inner.trim();
    int contentStart = location.start().getOffset() + 2 + inner.indexOf(content);
    SimpleExpressionNode expression =
        new SimpleExpressionNode(content, false, locationOf(contentStart, content.length()));
    return new InterpolationNode(expression, location);
  }

  /**
   * A directive attribute, e.g. {@code v-bind:[key]="value"}, {@code :id="x"}, {@code @click="f"}
   * or {@code v-else}. Bracketed arguments are dynamic; others are static.
   */
  public DirectiveNode directive(String raw) {
    SourceLocation location = locate(raw);
    int base = location.start().getOffset();

    String name;
    int i;
    if (raw.startsWith("v-")) {
      i = 2;
      while (i < raw.length() && ":.=".indexOf(raw.charAt(i)) < 0) {
        i++;
      }
      name = raw.substring(2, i);
      if (i < raw.length() && raw.charAt(i) == ':') {
        i++;
      }
    } else if (raw.startsWith(":")) {
      name = "bind";
      i = 1;
    } else if (raw.startsWith("@")) {
      name = "on";
      i = 1;
    } else if (raw.startsWith("#")) {
      name = "slot";
      i = 1;
    } else {
      throw new IllegalArgumentException("not a directive: " + raw);
    }

    int eq = raw.indexOf('=', i);
    int argEnd = eq < 0 ? raw.length() : eq;
    SimpleExpressionNode arg = null;
    if (argEnd > i && raw.charAt(i) == '[') {
      int close = raw.lastIndexOf(']', argEnd);
      checkArgument(close > i, "unterminated dynamic argument in %s", raw);
      arg =
          new SimpleExpressionNode(
              raw.substring(i + 1, close), false, locationOf(base + i + 1, close - i - 1));
    } else if (argEnd > i) {
      int end = i;
      while (end < argEnd && raw.charAt(end) != '.') {
        end++;
      }
      arg = new SimpleExpressionNode(raw.substring(i, end), true, locationOf(base + i, end - i));
    }

    SimpleExpressionNode exp = null;
    if (eq >= 0) {
      char quote = raw.charAt(eq + 1);
      checkArgument(quote == '"' || quote == '\'', "unquoted value in %s", raw);
      int valueStart = eq + 2;
      int valueEnd = raw.indexOf(quote, valueStart);
      checkArgument(valueEnd >= 0, "unterminated value in %s", raw);
      exp =
          new SimpleExpressionNode(
              raw.substring(valueStart, valueEnd),
              false,
              locationOf(base + valueStart, valueEnd - valueStart));
    }
    return new DirectiveNode(name, arg, exp, location);
  }

  /** A loop over {@code expression}, the text of a {@code v-for} value such as {@code i in list}. */
  public ForNode forNode(String expression) {
    SimpleExpressionNode exp = expression(expression);
    return new ForNode(exp, exp.getLocation());
  }

  public IfNode ifNode() {
    return new IfNode(locate("v-if"));
  }

  /** A branch with a condition; pass null for the {@code v-else} branch. */
  public IfBranchNode ifBranch(@Nullable String condition) {
    if (condition == null) {
      return new IfBranchNode(null, locate("v-else"));
    }
    SimpleExpressionNode exp = expression(condition);
    return new IfBranchNode(exp, exp.getLocation());
  }
}
