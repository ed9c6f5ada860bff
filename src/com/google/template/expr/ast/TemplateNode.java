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

/**
 * Base class of the template tree. The tree is built by the markup parser; the expression passes
 * only replace the expression fields of its nodes.
 */
public abstract class TemplateNode {

  /** The concrete node kinds. */
  public enum Kind {
    ROOT,
    ELEMENT,
    TEXT,
    INTERPOLATION,
    DIRECTIVE,
    FOR,
    IF,
    IF_BRANCH,
  }

  private final SourceLocation location;

  TemplateNode(SourceLocation location) {
    this.location = checkNotNull(location);
  }

  public abstract Kind getKind();

  public final SourceLocation getLocation() {
    return location;
  }

  /** The nodes traversed below this one, in source order. Leaves have none. */
  public ImmutableList<TemplateNode> getChildren() {
    return ImmutableList.of();
  }

  @Override
  public String toString() {
    return getKind() + " " + location;
  }
}
