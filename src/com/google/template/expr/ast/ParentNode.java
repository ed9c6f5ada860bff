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

import com.google.common.collect.ImmutableList;
import com.google.template.expr.sourcemap.SourceLocation;
import java.util.ArrayList;
import java.util.List;

/** A template node that owns an ordered list of child nodes. */
public abstract class ParentNode<C extends TemplateNode> extends TemplateNode {
  private final List<C> children = new ArrayList<>();

  ParentNode(SourceLocation location) {
    super(location);
  }

  public final void addChild(C child) {
    children.add(child);
  }

  @Override
  public final ImmutableList<TemplateNode> getChildren() {
    return ImmutableList.copyOf(children);
  }

  /** The children with their precise type. */
  public final List<C> getTypedChildren() {
    return children;
  }
}
