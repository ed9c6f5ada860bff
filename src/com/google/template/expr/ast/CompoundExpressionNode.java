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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.template.expr.sourcemap.SourceLocation;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An expression made of literal text fragments and nested simple expressions. Concatenating the
 * children in order yields the rewritten expression.
 */
public final class CompoundExpressionNode extends ExpressionNode {
  private final ImmutableList<Child> children;

  public CompoundExpressionNode(
      ImmutableList<Child> children, SourceLocation location, ImmutableSet<String> identifiers) {
    super(location, identifiers);
    checkArgument(!children.isEmpty(), "a compound expression needs children");
    this.children = children;
  }

  public ImmutableList<Child> getChildren() {
    return children;
  }

  @Override
  public boolean isSimple() {
    return false;
  }

  @Override
  public String toSourceString() {
    StringBuilder sb = new StringBuilder();
    for (Child child : children) {
      sb.append(child.isText() ? child.getText() : child.getExpression().getContent());
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return "Compound" + children + " " + getLocation();
  }

  /** Either a literal text fragment or a nested simple expression. */
  public static final class Child {
    private final @Nullable String text;
    private final @Nullable SimpleExpressionNode expression;

    private Child(@Nullable String text, @Nullable SimpleExpressionNode expression) {
      this.text = text;
      this.expression = expression;
    }

    public static Child text(String text) {
      return new Child(checkNotNull(text), null);
    }

    public static Child expression(SimpleExpressionNode expression) {
      return new Child(null, checkNotNull(expression));
    }

    public boolean isText() {
      return text != null;
    }

    public String getText() {
      return checkNotNull(text, "not a text fragment");
    }

    public SimpleExpressionNode getExpression() {
      return checkNotNull(expression, "not an expression");
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Child)) {
        return false;
      }
      Child that = (Child) o;
      return Objects.equals(text, that.text) && Objects.equals(expression, that.expression);
    }

    @Override
    public int hashCode() {
      return Objects.hash(text, expression);
    }

    @Override
    public String toString() {
      return text != null ? '"' + text + '"' : String.valueOf(expression);
    }
  }
}
