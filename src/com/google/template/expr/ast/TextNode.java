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

import com.google.template.expr.sourcemap.SourceLocation;

/** Plain text between tags. Never rewritten. */
public final class TextNode extends TemplateNode {

  public TextNode(SourceLocation location) {
    super(location);
  }

  @Override
  public Kind getKind() {
    return Kind.TEXT;
  }

  public String getContent() {
    return getLocation().source();
  }
}
