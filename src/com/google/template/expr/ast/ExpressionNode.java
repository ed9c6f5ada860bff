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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import com.google.template.expr.sourcemap.SourceLocation;

/**
 * An expression embedded in a template: either a {@link SimpleExpressionNode} holding text or a
 * {@link CompoundExpressionNode} splicing literal text with rewritten identifiers.
 *
 * <p>Expression nodes are immutable; the rewriter produces new ones.
 */
public abstract class ExpressionNode {
  private final SourceLocation location;
  private final ImmutableSet<String> identifiers;

  ExpressionNode(SourceLocation location, ImmutableSet<String> identifiers) {
    this.location = checkNotNull(location);
    this.identifiers = checkNotNull(identifiers);
  }

  /** The template span this expression was written at. */
  public final SourceLocation getLocation() {
    return location;
  }

  /**
   * The names this expression binds when it was rewritten as a binding pattern (a loop alias such
   * as {@code { a, b: [c] }}), empty otherwise.
   */
  public final ImmutableSet<String> getIdentifiers() {
    return identifiers;
  }

  public abstract boolean isSimple();

  /** The expression text as code generation would emit it. */
  public abstract String toSourceString();
}
