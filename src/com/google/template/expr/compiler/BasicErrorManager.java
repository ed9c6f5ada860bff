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

import java.util.ArrayList;
import java.util.List;

/**
 * An error manager that keeps every diagnostic in the order it was reported.
 *
 * <p>This error manager does not produce any output, but subclasses can override the {@link
 * #println(CheckLevel, TemplateError)} method to generate custom output.
 */
public class BasicErrorManager implements ErrorManager {

  private final List<ErrorWithLevel> messages = new ArrayList<>();
  private int errorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, TemplateError error) {
    if (!level.isOn()) {
      return;
    }
    messages.add(new ErrorWithLevel(error, level));
    if (level == CheckLevel.ERROR) {
      errorCount++;
    } else {
      warningCount++;
    }
  }

  @Override
  public void generateReport() {
    for (ErrorWithLevel message : messages) {
      println(message.level(), message.error());
    }
    printSummary();
  }

  /**
   * Print a message with a trailing new line. This method is called by the {@link
   * #generateReport()} method when generating messages.
   */
  public void println(CheckLevel level, TemplateError error) {}

  /** Print the summary of the compilation - number of errors and warnings. */
  protected void printSummary() {}

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public TemplateError[] getErrors() {
    return toArray(CheckLevel.ERROR);
  }

  @Override
  public TemplateError[] getWarnings() {
    return toArray(CheckLevel.WARNING);
  }

  private TemplateError[] toArray(CheckLevel level) {
    List<TemplateError> errors = new ArrayList<>(messages.size());
    for (ErrorWithLevel p : messages) {
      if (p.level() == level) {
        errors.add(p.error());
      }
    }
    return errors.toArray(new TemplateError[0]);
  }

  private record ErrorWithLevel(TemplateError error, CheckLevel level) {}
}
