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

import com.google.common.collect.ImmutableSet;
import java.util.Set;

/** Global names that template expressions may use directly, without going through the context. */
public final class GlobalAllowlist {

  public static final ImmutableSet<String> DEFAULT_GLOBALS =
      ImmutableSet.of(
          "Infinity",
          "undefined",
          "NaN",
          "isFinite",
          "isNaN",
          "parseFloat",
          "parseInt",
          "decodeURI",
          "decodeURIComponent",
          "encodeURI",
          "encodeURIComponent",
          "Math",
          "Number",
          "Date",
          "Array",
          "Object",
          "Boolean",
          "String",
          "RegExp",
          "Map",
          "Set",
          "JSON",
          "Intl");

  private static final GlobalAllowlist DEFAULT = new GlobalAllowlist(DEFAULT_GLOBALS);

  private final ImmutableSet<String> names;

  private GlobalAllowlist(Set<String> names) {
    this.names = ImmutableSet.copyOf(names);
  }

  public static GlobalAllowlist defaults() {
    return DEFAULT;
  }

  public static GlobalAllowlist of(Set<String> names) {
    return new GlobalAllowlist(names);
  }

  public boolean isAllowed(String name) {
    return names.contains(name);
  }

  public ImmutableSet<String> getNames() {
    return names;
  }
}
