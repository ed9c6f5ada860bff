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

import static com.google.common.base.Strings.emptyToNull;
import static java.util.Objects.requireNonNull;

import com.google.template.expr.sourcemap.SourceLocation;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * Template compile error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the template source
 * @param lineno One-indexed line number of the error location.
 * @param charno One-indexed column of the error location.
 * @param offset Zero-indexed character offset of the error location in the template.
 * @param length Length of the error region.
 * @param defaultLevel The level the error is reported at unless the reporter overrides it.
 */
public record TemplateError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno,
    int offset,
    int length,
    CheckLevel defaultLevel)
    implements Serializable {
  public TemplateError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  private static final int DEFAULT_LINENO = -1;
  private static final int DEFAULT_CHARNO = -1;

  /**
   * Creates a TemplateError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static TemplateError make(DiagnosticType type, String... arguments) {
    return new TemplateError(
        type, type.format(arguments), null, DEFAULT_LINENO, DEFAULT_CHARNO, -1, 0, type.level);
  }

  /**
   * Creates a TemplateError covering a span of the template.
   *
   * @param sourceName The template name, or null if unknown
   * @param location The span the error applies to
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static TemplateError make(
      @Nullable String sourceName,
      SourceLocation location,
      DiagnosticType type,
      String... arguments) {
    return new TemplateError(
        type,
        type.format(arguments),
        sourceName,
        location.start().getLine(),
        location.start().getColumn(),
        location.start().getOffset(),
        location.length(),
        type.level);
  }

  /** @return the default rendering of an error as text. */
  @Override
  public final String toString() {
    String sourceName =
        emptyToNull(this.sourceName()) != null ? this.sourceName() : "(unknown source)";
    String lineno =
        this.lineno() != DEFAULT_LINENO ? String.valueOf(this.lineno()) : "(unknown line)";
    String charno =
        this.charno() != DEFAULT_CHARNO ? String.valueOf(this.charno()) : "(unknown column)";

    return this.type().key
        + ". "
        + this.description()
        + " at "
        + sourceName
        + " line "
        + lineno
        + " : "
        + charno;
  }

  /**
   * Format a message at the given level.
   *
   * @return the formatted message or {@code null}
   */
  public final @Nullable String format(CheckLevel level, MessageFormatter formatter) {
    return switch (level) {
      case ERROR -> formatter.formatError(this);
      case WARNING -> formatter.formatWarning(this);
      default -> null;
    };
  }
}
