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
import com.google.template.expr.ast.DirectiveNode;
import com.google.template.expr.ast.ElementNode;
import com.google.template.expr.ast.ExpressionNode;
import com.google.template.expr.ast.InterpolationNode;
import com.google.template.expr.ast.RootNode;
import com.google.template.expr.ast.SimpleExpressionNode;
import com.google.template.expr.ast.TemplateNode;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites the expressions of interpolations and directives.
 *
 * <p>Directive values and dynamic arguments are rewritten; static arguments are not expressions.
 * {@code v-for} values belong to {@link TransformFor}. A {@code v-slot} value declares slot props:
 * it is processed as a binding pattern and its names stay bound for the children of the element.
 */
final class TransformExpressions implements TemplatePass, TemplateTraversal.Callback {
  private final TransformContext context;

  TransformExpressions(TransformContext context) {
    this.context = context;
  }

  @Override
  public void process(RootNode root) {
    TemplateTraversal.traverse(context, root, this);
  }

  @Override
  public boolean shouldTraverse(TemplateTraversal t, TemplateNode n, @Nullable TemplateNode parent) {
    ExpressionRewriter rewriter = context.getRewriter();
    if (n instanceof InterpolationNode) {
      InterpolationNode interpolation = (InterpolationNode) n;
      if (interpolation.getContent() instanceof SimpleExpressionNode) {
        interpolation.setContent(
            rewriter.rewrite((SimpleExpressionNode) interpolation.getContent()));
      }
    } else if (n instanceof ElementNode) {
      ImmutableSet.Builder<String> slotProps = ImmutableSet.builder();
      for (DirectiveNode directive : ((ElementNode) n).getDirectives()) {
        if (directive.getName().equals("for")) {
          continue;
        }
        ExpressionNode arg = directive.getArg();
        if (arg instanceof SimpleExpressionNode && !((SimpleExpressionNode) arg).isStatic()) {
          directive.setArg(rewriter.rewrite((SimpleExpressionNode) arg));
        }
        ExpressionNode exp = directive.getExp();
        if (exp instanceof SimpleExpressionNode) {
          if (isSlot(directive)) {
            ExpressionNode props = rewriter.rewriteBindingPattern((SimpleExpressionNode) exp);
            directive.setExp(props);
            slotProps.addAll(props.getIdentifiers());
          } else {
            directive.setExp(rewriter.rewrite((SimpleExpressionNode) exp));
          }
        }
      }
      if (hasSlot((ElementNode) n)) {
        context.getScopes().pushFrame(slotProps.build());
      }
    }
    return true;
  }

  @Override
  public void visit(TemplateTraversal t, TemplateNode n, @Nullable TemplateNode parent) {
    if (n instanceof ElementNode && hasSlot((ElementNode) n)) {
      context.getScopes().popFrame();
    }
  }

  private static boolean isSlot(DirectiveNode directive) {
    return directive.getName().equals("slot");
  }

  private static boolean hasSlot(ElementNode element) {
    for (DirectiveNode directive : element.getDirectives()) {
      if (isSlot(directive)) {
        return true;
      }
    }
    return false;
  }
}
