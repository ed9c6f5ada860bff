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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.template.expr.sourcemap.SourceLocation;
import org.jspecify.annotations.Nullable;

/**
 * The state shared by the passes of one template compile: the options, the bindings of the
 * constructs currently entered and the diagnostics sink.
 */
public final class TransformContext {
  private final CompilerOptions options;
  private final GlobalAllowlist allowlist;
  private final ErrorHandler errorHandler;
  private final ScopeStack scopes = new ScopeStack();
  private final ExpressionRewriter rewriter;

  public TransformContext(CompilerOptions options, ErrorHandler errorHandler) {
    this.options = checkNotNull(options);
    this.errorHandler = checkNotNull(errorHandler);
    this.allowlist = GlobalAllowlist.of(options.getGlobalAllowlist());
    this.rewriter = new ExpressionRewriter(this);
  }

  public CompilerOptions getOptions() {
    return options;
  }

  public GlobalAllowlist getAllowlist() {
    return allowlist;
  }

  public ScopeStack getScopes() {
    return scopes;
  }

  public ExpressionRewriter getRewriter() {
    return rewriter;
  }

  public @Nullable String getSourceName() {
    return options.getSourceName();
  }

  /** Reports a diagnostic at its default level. */
  public void report(SourceLocation location, DiagnosticType type, String... arguments) {
    TemplateError error = TemplateError.make(getSourceName(), location, type, arguments);
    errorHandler.report(error.defaultLevel(), error);
  }
}
