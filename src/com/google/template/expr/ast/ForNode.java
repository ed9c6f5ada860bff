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

import com.google.template.expr.sourcemap.SourceLocation;
import org.jspecify.annotations.Nullable;

/**
 * A {@code v-for} loop. It starts out holding only the raw loop expression, e.g. {@code (item,
 * index) in items}; the loop pass splits it into its source and its aliases.
 */
public final class ForNode extends ParentNode<TemplateNode> {
  private final SimpleExpressionNode expression;

  private @Nullable ExpressionNode source;
  private @Nullable ExpressionNode valueAlias;
  private @Nullable ExpressionNode keyAlias;
  private @Nullable ExpressionNode indexAlias;

  public ForNode(SimpleExpressionNode expression, SourceLocation location) {
    super(location);
    this.expression = checkNotNull(expression);
  }

  @Override
  public Kind getKind() {
    return Kind.FOR;
  }

  /** The unparsed loop expression. */
  public SimpleExpressionNode getExpression() {
    return expression;
  }

  /** The iterated expression, or null before the loop pass ran or if it failed. */
  public @Nullable ExpressionNode getSource() {
    return source;
  }

  public void setSource(ExpressionNode source) {
    this.source = checkNotNull(source);
  }

  public @Nullable ExpressionNode getValueAlias() {
    return valueAlias;
  }

  public @Nullable ExpressionNode getKeyAlias() {
    return keyAlias;
  }

  public @Nullable ExpressionNode getIndexAlias() {
    return indexAlias;
  }

  public void setAliases(
      @Nullable ExpressionNode valueAlias,
      @Nullable ExpressionNode keyAlias,
      @Nullable ExpressionNode indexAlias) {
    this.valueAlias = valueAlias;
    this.keyAlias = keyAlias;
    this.indexAlias = indexAlias;
  }
}
