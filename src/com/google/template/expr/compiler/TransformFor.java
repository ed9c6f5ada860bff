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

import com.google.common.collect.ImmutableSet;
import com.google.template.expr.ast.ExpressionNode;
import com.google.template.expr.ast.ForNode;
import com.google.template.expr.ast.RootNode;
import com.google.template.expr.ast.SimpleExpressionNode;
import com.google.template.expr.ast.TemplateNode;
import com.google.template.expr.sourcemap.SourceLocation;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Handles {@code v-for} loops: rewrites the iterated expression in the scope around the loop and
 * binds the loop aliases for everything inside it.
 *
 * <p>Accepted forms are {@code alias in source} and {@code alias of source}, where the aliases
 * are {@code value}, {@code (value, key)} or {@code (value, key, index)} and the value alias may
 * be a destructuring pattern.
 */
final class TransformFor implements TemplatePass, TemplateTraversal.Callback {
  private static final Logger logger = Logger.getLogger(TransformFor.class.getName());

  static final DiagnosticType MALFORMED_FOR_EXPRESSION =
      DiagnosticType.error("TEMPLATE_FOR_MALFORMED_EXPRESSION", "v-for has invalid expression: {0}");

  private static final Pattern FOR_ALIAS =
      Pattern.compile("([\\s\\S]*?)\\s+(?:in|of)\\s+(\\S[\\s\\S]*)");
  private static final Pattern FOR_ITERATOR =
      Pattern.compile(",([^,\\}\\]]*)(?:,([^,\\}\\]]*))?$");
  private static final Pattern STRIP_PARENS = Pattern.compile("^\\(|\\)$");

  private final TransformContext context;

  TransformFor(TransformContext context) {
    this.context = context;
  }

  @Override
  public void process(RootNode root) {
    TemplateTraversal.traverse(context, root, this);
  }

  @Override
  public boolean shouldTraverse(TemplateTraversal t, TemplateNode n, @Nullable TemplateNode parent) {
    if (n instanceof ForNode) {
      enterLoop((ForNode) n);
    }
    return true;
  }

  @Override
  public void visit(TemplateTraversal t, TemplateNode n, @Nullable TemplateNode parent) {
    if (n instanceof ForNode) {
      context.getScopes().popFrame();
    }
  }

  private void enterLoop(ForNode loop) {
    SimpleExpressionNode expression = loop.getExpression();
    LoopParts parts = split(expression);
    if (parts == null) {
      context.report(expression.getLocation(), MALFORMED_FOR_EXPRESSION, expression.getContent());
      // The matching visit() still pops a frame.
      context.getScopes().pushFrame(ImmutableSet.of());
      return;
    }

    ExpressionRewriter rewriter = context.getRewriter();
    loop.setSource(rewriter.rewrite(parts.source()));
    ExpressionNode value = rewriteAlias(parts.value());
    ExpressionNode key = rewriteAlias(parts.key());
    ExpressionNode index = rewriteAlias(parts.index());
    loop.setAliases(value, key, index);

    Set<String> names = new LinkedHashSet<>();
    for (ExpressionNode alias : new ExpressionNode[] {value, key, index}) {
      if (alias != null) {
        names.addAll(alias.getIdentifiers());
      }
    }
    logger.fine(() -> "v-for binds " + names + " at " + expression.getLocation().start());
    context.getScopes().pushFrame(names);
  }

  private @Nullable ExpressionNode rewriteAlias(@Nullable SimpleExpressionNode alias) {
    return alias == null ? null : context.getRewriter().rewriteBindingPattern(alias);
  }

  private record LoopParts(
      SimpleExpressionNode source,
      @Nullable SimpleExpressionNode value,
      @Nullable SimpleExpressionNode key,
      @Nullable SimpleExpressionNode index) {}

  /** Splits the loop expression into its parts, or returns null if it is not a loop expression. */
  private static @Nullable LoopParts split(SimpleExpressionNode expression) {
    String exp = expression.getContent();
    Matcher inMatch = FOR_ALIAS.matcher(exp);
    if (!inMatch.find()) {
      return null;
    }
    String lhs = inMatch.group(1);
    String rhs = inMatch.group(2);

    SimpleExpressionNode source =
        alias(expression, rhs.trim(), exp.indexOf(rhs, lhs.length()));

    String valueContent = STRIP_PARENS.matcher(lhs.trim()).replaceAll("").trim();
    int trimmedOffset = lhs.indexOf(valueContent);

    SimpleExpressionNode key = null;
    SimpleExpressionNode index = null;
    Matcher iteratorMatch = FOR_ITERATOR.matcher(valueContent);
    if (iteratorMatch.find()) {
      String keyGroup = iteratorMatch.group(1);
      String indexGroup = iteratorMatch.group(2);
      valueContent = valueContent.substring(0, iteratorMatch.start()).trim();

      String keyContent = keyGroup.trim();
      int keyOffset = -1;
      if (!keyContent.isEmpty()) {
        keyOffset = exp.indexOf(keyContent, trimmedOffset + valueContent.length());
        key = alias(expression, keyContent, keyOffset);
      }
      if (indexGroup != null) {
        String indexContent = indexGroup.trim();
        if (!indexContent.isEmpty()) {
          int from =
              key != null
                  ? keyOffset + keyContent.length()
                  : trimmedOffset + valueContent.length();
          index = alias(expression, indexContent, exp.indexOf(indexContent, from));
        }
      }
    }

    SimpleExpressionNode value =
        valueContent.isEmpty() ? null : alias(expression, valueContent, trimmedOffset);
    return new LoopParts(source, value, key, index);
  }

  /** A part of the loop expression found at {@code offset} within it. */
  private static SimpleExpressionNode alias(
      SimpleExpressionNode expression, String content, int offset) {
    SourceLocation location =
        SourceLocation.of(
            expression.getLocation().start().advance(expression.getContent(), offset), content);
    return new SimpleExpressionNode(content, false, location);
  }
}
