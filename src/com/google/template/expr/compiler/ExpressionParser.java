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

import com.google.template.expr.rhino.ErrorReporter;
import com.google.template.expr.rhino.Node;
import com.google.template.expr.rhino.Parser;
import org.jspecify.annotations.Nullable;

/** Adapts the expression {@link Parser} to a result object; malformed input never throws. */
final class ExpressionParser {

  private ExpressionParser() {}

  /** The outcome of a parse: either a tree or the first syntax error. */
  record ParseResult(@Nullable Node root, @Nullable String errorMessage, int errorOffset) {
    boolean isSuccess() {
      return root != null;
    }
  }

  static ParseResult parseExpression(String source) {
    FirstErrorReporter reporter = new FirstErrorReporter();
    Node root = new Parser(source, reporter).parseExpression();
    return reporter.toResult(root);
  }

  static ParseResult parseBindingPattern(String source) {
    FirstErrorReporter reporter = new FirstErrorReporter();
    Node root = new Parser(source, reporter).parseBindingPattern();
    return reporter.toResult(root);
  }

  private static final class FirstErrorReporter implements ErrorReporter {
    private @Nullable String message;
    private int offset = -1;

    @Override
    public void error(String message, int sourceOffset) {
      if (this.message == null) {
        this.message = message;
        this.offset = sourceOffset;
      }
    }

    ParseResult toResult(@Nullable Node root) {
      if (root != null) {
        return new ParseResult(root, null, -1);
      }
      return new ParseResult(null, message != null ? message : "Unexpected end of input", offset);
    }
  }
}
