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
 * A directive attribute such as {@code v-on:[event]="handler"}.
 *
 * <p>The argument is static ({@code v-on:click}) or dynamic ({@code v-on:[event]}); only dynamic
 * arguments are expressions. The value is absent for directives written without one.
 */
public final class DirectiveNode extends TemplateNode {
  private final String name;
  private @Nullable ExpressionNode arg;
  private @Nullable ExpressionNode exp;

  public DirectiveNode(
      String name,
      @Nullable ExpressionNode arg,
      @Nullable ExpressionNode exp,
      SourceLocation location) {
    super(location);
    this.name = checkNotNull(name);
    this.arg = arg;
    this.exp = exp;
  }

  @Override
  public Kind getKind() {
    return Kind.DIRECTIVE;
  }

  /** The directive name without the {@code v-} prefix, e.g. {@code on}. */
  public String getName() {
    return name;
  }

  public @Nullable ExpressionNode getArg() {
    return arg;
  }

  public void setArg(ExpressionNode arg) {
    this.arg = checkNotNull(arg);
  }

  public @Nullable ExpressionNode getExp() {
    return exp;
  }

  public void setExp(ExpressionNode exp) {
    this.exp = checkNotNull(exp);
  }
}
