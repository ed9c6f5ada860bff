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

import com.google.common.collect.ImmutableList;
import com.google.template.expr.ast.RootNode;
import java.util.logging.Logger;

/**
 * Runs the expression passes over a template tree.
 *
 * <p>Each call to {@link #transform} is an independent compile with its own scope stack and error
 * manager. Expressions are replaced in place on the tree.
 */
public final class TemplateCompiler {

  /**
   * Logger for the whole com.google.template.expr domain - setting configuration for this logger
   * affects all loggers in other classes within the compiler.
   */
  public static final Logger logger = Logger.getLogger("com.google.template.expr");

  private final CompilerOptions options;

  public TemplateCompiler(CompilerOptions options) {
    this.options = checkNotNull(options);
  }

  public CompilerOptions getOptions() {
    return options;
  }

  /** Rewrites every expression of the template rooted at {@code root}. */
  public Result transform(RootNode root) {
    ErrorManager errorManager =
        new LoggerErrorManager(new LightweightMessageFormatter(root.getSource()), logger);
    ErrorHandler hostHandler = options.getErrorHandler();
    ErrorHandler handler =
        hostHandler == null
            ? errorManager
            : (level, error) -> {
              errorManager.report(level, error);
              hostHandler.report(level, error);
            };

    TransformContext context = new TransformContext(options, handler);
    logger.fine(() -> "Transforming expressions of " + describe(context));

    new CombinedTemplatePass(
            context,
            new TransformIf(context),
            new TransformFor(context),
            new TransformExpressions(context))
        .process(root);

    if (!context.getScopes().isEmpty()) {
      logger.warning(
          "Scope stack not empty after transforming "
              + describe(context)
              + ": "
              + context.getScopes().getBoundNames());
    }

    errorManager.generateReport();
    return new Result(
        ImmutableList.copyOf(errorManager.getErrors()),
        ImmutableList.copyOf(errorManager.getWarnings()));
  }

  private static String describe(TransformContext context) {
    String sourceName = context.getSourceName();
    return sourceName != null ? sourceName : "(unnamed template)";
  }
}
