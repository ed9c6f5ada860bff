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

import static com.google.common.truth.Truth.assertThat;

import com.google.template.expr.sourcemap.FilePosition;
import com.google.template.expr.sourcemap.SourceLocation;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LightweightMessageFormatterTest {
  private static final DiagnosticType FOO_TYPE =
      DiagnosticType.error("TEST_FOO", "error description here");
  private static final DiagnosticType BAR_TYPE =
      DiagnosticType.warning("TEST_BAR", "warning description here");

  private static TemplateError errorAt(String source, int offset, String text) {
    SourceLocation location = SourceLocation.of(FilePosition.START.advance(source, offset), text);
    return TemplateError.make("App.vue", location, FOO_TYPE);
  }

  @Test
  public void testFormatErrorWithExcerpt() {
    String source = "{{ a( }}";
    LightweightMessageFormatter formatter = new LightweightMessageFormatter(source);
    assertThat(formatter.formatError(errorAt(source, 3, "a(")))
        .isEqualTo(
            "App.vue:1:4: ERROR - [TEST_FOO] error description here\n"
                + "{{ a( }}\n"
                + "   ^^\n");
  }

  @Test
  public void testFormatErrorOnLaterLine() {
    String source = "<div>\n  {{ a( }}\n</div>";
    LightweightMessageFormatter formatter = new LightweightMessageFormatter(source);
    assertThat(formatter.formatError(errorAt(source, 11, "a(")))
        .isEqualTo(
            "App.vue:2:6: ERROR - [TEST_FOO] error description here\n"
                + "  {{ a( }}\n"
                + "     ^^\n");
  }

  @Test
  public void testTabsAreKeptInPadding() {
    String source = "\t{{ a }}";
    LightweightMessageFormatter formatter = new LightweightMessageFormatter(source);
    assertThat(formatter.formatError(errorAt(source, 4, "a")))
        .isEqualTo(
            "App.vue:1:5: ERROR - [TEST_FOO] error description here\n"
                + "\t{{ a }}\n"
                + "\t   ^\n");
  }

  @Test
  public void testEmptySpanGetsOneCaret() {
    String source = "{{ a( }}";
    LightweightMessageFormatter formatter = new LightweightMessageFormatter(source);
    assertThat(formatter.formatError(errorAt(source, 5, "")))
        .isEqualTo(
            "App.vue:1:6: ERROR - [TEST_FOO] error description here\n"
                + "{{ a( }}\n"
                + "     ^\n");
  }

  @Test
  public void testWithoutSource() {
    LightweightMessageFormatter formatter = LightweightMessageFormatter.withoutSource();
    assertThat(formatter.formatError(errorAt("{{ a( }}", 3, "a(")))
        .isEqualTo("App.vue:1:4: ERROR - [TEST_FOO] error description here\n");
  }

  @Test
  public void testWarning() {
    LightweightMessageFormatter formatter = LightweightMessageFormatter.withoutSource();
    assertThat(formatter.formatWarning(TemplateError.make(BAR_TYPE)))
        .isEqualTo("WARNING - [TEST_BAR] warning description here\n");
  }

  @Test
  public void testWithoutLevel() {
    LightweightMessageFormatter formatter =
        LightweightMessageFormatter.withoutSource().setIncludeLevel(false);
    assertThat(formatter.formatError(errorAt("{{ a( }}", 3, "a(")))
        .isEqualTo("App.vue:1:4: error description here\n");
  }

  @Test
  public void testWithoutLocation() {
    LightweightMessageFormatter formatter =
        LightweightMessageFormatter.withoutSource().setIncludeLocation(false);
    assertThat(formatter.formatError(errorAt("{{ a( }}", 3, "a(")))
        .isEqualTo("ERROR - [TEST_FOO] error description here\n");
  }

  @Test
  public void testErrorWithoutSourceName() {
    LightweightMessageFormatter formatter = new LightweightMessageFormatter("{{ a( }}");
    assertThat(formatter.formatError(TemplateError.make(FOO_TYPE)))
        .isEqualTo("ERROR - [TEST_FOO] error description here\n");
  }
}
