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
import java.util.Objects;

/**
 * An expression held as plain text.
 *
 * <p>A static node is a literal value (a static directive argument, for instance) and is never
 * rewritten.
 */
public final class SimpleExpressionNode extends ExpressionNode {
  private final String content;
  private final boolean isStatic;

  public SimpleExpressionNode(String content, boolean isStatic, SourceLocation location) {
    this(content, isStatic, location, ImmutableSet.of());
  }

  public SimpleExpressionNode(
      String content, boolean isStatic, SourceLocation location, ImmutableSet<String> identifiers) {
    super(location, identifiers);
    this.content = checkNotNull(content);
    this.isStatic = isStatic;
  }

  public String getContent() {
    return content;
  }

  public boolean isStatic() {
    return isStatic;
  }

  @Override
  public boolean isSimple() {
    return true;
  }

  @Override
  public String toSourceString() {
    return content;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SimpleExpressionNode)) {
      return false;
    }
    SimpleExpressionNode that = (SimpleExpressionNode) o;
    return content.equals(that.content)
        && isStatic == that.isStatic
        && getLocation().equals(that.getLocation())
        && getIdentifiers().equals(that.getIdentifiers());
  }

  @Override
  public int hashCode() {
    return Objects.hash(content, isStatic, getLocation());
  }

  @Override
  public String toString() {
    return "Simple(" + content + (isStatic ? ", static" : "") + ") " + getLocation();
  }
}
