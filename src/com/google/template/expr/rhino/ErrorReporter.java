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

package com.google.template.expr.rhino;

/** This is interface defines a protocol for the reporting of errors during parsing. */
public interface ErrorReporter {

  /**
   * Report an error.
   *
   * @param message a String describing the error
   * @param sourceOffset zero-based offset of the offending token in the parsed string
   */
  void error(String message, int sourceOffset);
}
