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

import com.google.common.collect.ImmutableList;
import com.google.template.expr.sourcemap.SourceLocation;
import java.util.ArrayList;
import java.util.List;

/** An element such as {@code <div v-bind:id="x">}. Directives are kept apart from children. */
public final class ElementNode extends ParentNode<TemplateNode> {
  private final String tag;
  private final List<DirectiveNode> directives = new ArrayList<>();

  public ElementNode(String tag, SourceLocation location) {
    super(location);
    this.tag = checkNotNull(tag);
  }

  @Override
  public Kind getKind() {
    return Kind.ELEMENT;
  }

  public String getTag() {
    return tag;
  }

  public void addDirective(DirectiveNode directive) {
    directives.add(directive);
  }

  public ImmutableList<DirectiveNode> getDirectives() {
    return ImmutableList.copyOf(directives);
  }
}
