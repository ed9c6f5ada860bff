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
import static com.google.common.base.Preconditions.checkState;

import com.google.template.expr.sourcemap.SourceLocation;
import org.jspecify.annotations.Nullable;

/** One branch of an {@link IfNode}. The {@code v-else} branch has no condition. */
public final class IfBranchNode extends ParentNode<TemplateNode> {
  private @Nullable ExpressionNode condition;

  public IfBranchNode(@Nullable ExpressionNode condition, SourceLocation location) {
    super(location);
    this.condition = condition;
  }

  @Override
  public Kind getKind() {
    return Kind.IF_BRANCH;
  }

  public @Nullable ExpressionNode getCondition() {
    return condition;
  }

  public void setCondition(ExpressionNode condition) {
    checkState(this.condition != null, "an else branch has no condition");
    this.condition = checkNotNull(condition);
  }
}
