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

import com.google.common.collect.ImmutableList;
import com.google.template.expr.ast.RootNode;
import com.google.template.expr.ast.TemplateNode;
import com.google.template.expr.compiler.TemplateTraversal.Callback;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A pass combining multiple {@link Callback} objects in one traversal of the template.
 *
 * <p>Preorder visits reach the callbacks in the order given and postorder visits in the reverse
 * order, so a callback that pushes a scope frame before the others see a node pops it after they
 * are done with the node.
 */
final class CombinedTemplatePass implements TemplatePass, Callback {

  /** The callbacks that this pass combines. */
  private final ImmutableList<CallbackWrapper> callbacks;

  private final TransformContext context;

  CombinedTemplatePass(TransformContext context, Callback... callbacks) {
    this(context, ImmutableList.copyOf(callbacks));
  }

  CombinedTemplatePass(TransformContext context, List<Callback> callbacks) {
    this.context = context;
    ImmutableList.Builder<CallbackWrapper> wrappers = ImmutableList.builder();
    for (Callback callback : callbacks) {
      wrappers.add(new CallbackWrapper(callback));
    }
    this.callbacks = wrappers.build();
  }

  /**
   * Maintains information about a callback in order to simulate it being the exclusive client of
   * the shared {@link TemplateTraversal}. In particular, this class simulates abbreviating the
   * traversal when the wrapped callback returns false for {@link Callback#shouldTraverse}. The
   * callback becomes inactive (i.e., traversal messages are not sent to it) until the main
   * traversal revisits the node during the post-order visit.
   */
  private static class CallbackWrapper {
    /** The callback being wrapped. Never null. */
    private final Callback callback;

    /**
     * The node that {@link Callback#shouldTraverse} returned false for. The wrapped callback
     * doesn't receive messages until after this node is revisited in the post-order traversal.
     */
    private @Nullable TemplateNode waiting = null;

    private CallbackWrapper(Callback callback) {
      this.callback = callback;
    }

    /** Visits the node unless the wrapped callback is inactive. Activates the callback if appropriate. */
    void visitOrMaybeActivate(TemplateTraversal t, TemplateNode n, @Nullable TemplateNode parent) {
      if (isActive()) {
        callback.visit(t, n, parent);
      } else if (waiting == n) {
        waiting = null;
      }
    }

    void shouldTraverseIfActive(
        TemplateTraversal t, TemplateNode n, @Nullable TemplateNode parent) {
      if (isActive() && !callback.shouldTraverse(t, n, parent)) {
        waiting = n;
      }
    }

    boolean isActive() {
      return waiting == null;
    }
  }

  @Override
  public void process(RootNode root) {
    TemplateTraversal.traverse(context, root, this);
  }

  @Override
  public boolean shouldTraverse(TemplateTraversal t, TemplateNode n, @Nullable TemplateNode parent) {
    for (CallbackWrapper callback : callbacks) {
      callback.shouldTraverseIfActive(t, n, parent);
    }
    return true;
  }

  @Override
  public void visit(TemplateTraversal t, TemplateNode n, @Nullable TemplateNode parent) {
    for (CallbackWrapper callback : callbacks.reverse()) {
      callback.visitOrMaybeActivate(t, n, parent);
    }
  }
}
