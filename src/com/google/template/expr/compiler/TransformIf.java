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

import com.google.template.expr.ast.ExpressionNode;
import com.google.template.expr.ast.IfBranchNode;
import com.google.template.expr.ast.RootNode;
import com.google.template.expr.ast.SimpleExpressionNode;
import com.google.template.expr.ast.TemplateNode;
import org.jspecify.annotations.Nullable;

/** Rewrites the conditions of {@code v-if} and {@code v-else-if} branches. */
final class TransformIf implements TemplatePass, TemplateTraversal.Callback {
  private final TransformContext context;

  TransformIf(TransformContext context) {
    this.context = context;
  }

  @Override
  public void process(RootNode root) {
    TemplateTraversal.traverse(context, root, this);
  }

  @Override
  public boolean shouldTraverse(TemplateTraversal t, TemplateNode n, @Nullable TemplateNode parent) {
    if (n instanceof IfBranchNode) {
      IfBranchNode branch = (IfBranchNode) n;
      ExpressionNode condition = branch.getCondition();
      if (condition instanceof SimpleExpressionNode) {
        branch.setCondition(context.getRewriter().rewrite((SimpleExpressionNode) condition));
      }
    }
    return true;
  }

  @Override
  public void visit(TemplateTraversal t, TemplateNode n, @Nullable TemplateNode parent) {}
}
