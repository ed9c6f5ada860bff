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

import com.google.template.expr.ast.TemplateNode;
import org.jspecify.annotations.Nullable;

/** TemplateTraversal allows an iteration through the nodes in the template tree. */
public final class TemplateTraversal {
  private final TransformContext context;
  private final Callback callback;

  /**
   * Callback for tree-based traversals
   */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether its children should be
     * traversed. If this method returns false, the node is not visited by {@link
     * #visit(TemplateTraversal, TemplateNode, TemplateNode)} either.
     *
     * <p>Siblings are always visited left-to-right.
     */
    boolean shouldTraverse(TemplateTraversal t, TemplateNode n, @Nullable TemplateNode parent);

    /**
     * Visits a node in postorder (after its children). A node is visited in postorder iff {@link
     * #shouldTraverse(TemplateTraversal, TemplateNode, TemplateNode)} returned true for it.
     */
    void visit(TemplateTraversal t, TemplateNode n, @Nullable TemplateNode parent);
  }

  private TemplateTraversal(TransformContext context, Callback callback) {
    this.context = context;
    this.callback = callback;
  }

  /** Traverses {@code root} and everything below it. */
  public static void traverse(TransformContext context, TemplateNode root, Callback callback) {
    new TemplateTraversal(context, callback).traverseBranch(root, null);
  }

  public TransformContext getContext() {
    return context;
  }

  private void traverseBranch(TemplateNode n, @Nullable TemplateNode parent) {
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }
    for (TemplateNode child : n.getChildren()) {
      traverseBranch(child, n);
    }
    callback.visit(this, n, parent);
  }
}
