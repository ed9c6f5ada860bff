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

package com.google.template.expr.compiler;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import java.io.Serializable;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** Compiler options */
public class CompilerOptions implements Serializable {
  private static final long serialVersionUID = 7L;

  public static final String DEFAULT_CONTEXT_PREFIX = "_ctx.";

  /**
   * Whether free identifiers in expressions are rewritten into context lookups. When off, every
   * expression is left exactly as written.
   */
  private boolean prefixIdentifiers = true;

  /** Text put in front of a free identifier, e.g. {@code _ctx.} turns {@code foo} into {@code _ctx.foo}. */
  private String contextPrefix = DEFAULT_CONTEXT_PREFIX;

  /** Names never rewritten. */
  private ImmutableSet<String> globalAllowlist = GlobalAllowlist.DEFAULT_GLOBALS;

  /** Receives every diagnostic in addition to the compiler's own error manager. */
  private transient @Nullable ErrorHandler errorHandler;

  /** Name of the template, used in diagnostics. */
  private @Nullable String sourceName;

  public CompilerOptions() {}

  public boolean getPrefixIdentifiers() {
    return prefixIdentifiers;
  }

  public void setPrefixIdentifiers(boolean prefixIdentifiers) {
    this.prefixIdentifiers = prefixIdentifiers;
  }

  public String getContextPrefix() {
    return contextPrefix;
  }

  public void setContextPrefix(String contextPrefix) {
    checkArgument(!contextPrefix.isEmpty(), "the context prefix must not be empty");
    this.contextPrefix = contextPrefix;
  }

  public ImmutableSet<String> getGlobalAllowlist() {
    return globalAllowlist;
  }

  /** Replaces the allowed globals, including the defaults. */
  public void setGlobalAllowlist(Set<String> globalAllowlist) {
    this.globalAllowlist = ImmutableSet.copyOf(globalAllowlist);
  }

  /** Allows {@code names} in addition to the globals already allowed. */
  public void addAllowedGlobals(String... names) {
    this.globalAllowlist =
        ImmutableSet.<String>builder().addAll(globalAllowlist).add(names).build();
  }

  public @Nullable ErrorHandler getErrorHandler() {
    return errorHandler;
  }

  public void setErrorHandler(@Nullable ErrorHandler errorHandler) {
    this.errorHandler = errorHandler;
  }

  public @Nullable String getSourceName() {
    return sourceName;
  }

  public void setSourceName(String sourceName) {
    this.sourceName = checkNotNull(sourceName);
  }
}
