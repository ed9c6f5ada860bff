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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

/**
 * The names bound by the template constructs enclosing the node being compiled, such as {@code
 * v-for} aliases and slot props.
 *
 * <p>Frames are pushed when a construct is entered and popped when it is left. A name stays bound
 * as long as any frame on the stack declares it, so popping an inner frame that shadows an outer
 * binding leaves the outer binding in place.
 */
public final class ScopeStack {
  private final Deque<ImmutableSet<String>> frames = new ArrayDeque<>();
  // How many frames currently declare each name.
  private final Multiset<String> bindingCounts = HashMultiset.create();

  public void pushFrame(Set<String> names) {
    ImmutableSet<String> frame = ImmutableSet.copyOf(names);
    frames.push(frame);
    bindingCounts.addAll(frame);
  }

  public void popFrame() {
    checkState(!frames.isEmpty(), "popFrame() called on an empty scope stack");
    for (String name : frames.pop()) {
      bindingCounts.remove(name);
    }
  }

  public boolean isBound(String name) {
    return bindingCounts.contains(name);
  }

  public int depth() {
    return frames.size();
  }

  public boolean isEmpty() {
    return frames.isEmpty();
  }

  /** All names currently bound by at least one frame. */
  public ImmutableSet<String> getBoundNames() {
    return ImmutableSet.copyOf(bindingCounts.elementSet());
  }
}
