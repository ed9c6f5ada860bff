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
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BasicErrorManagerTest {
  private static final DiagnosticType FOO_ERROR = DiagnosticType.error("TEST_FOO", "Foo {0}");
  private static final DiagnosticType BAR_WARNING = DiagnosticType.warning("TEST_BAR", "Bar");

  private final List<String> printed = new ArrayList<>();
  private int summaries = 0;

  private final BasicErrorManager manager =
      new BasicErrorManager() {
        @Override
        public void println(CheckLevel level, TemplateError error) {
          printed.add(level + " " + error.type().key);
        }

        @Override
        protected void printSummary() {
          summaries++;
        }
      };

  @Test
  public void testCounts() {
    manager.report(CheckLevel.ERROR, TemplateError.make(FOO_ERROR, "x"));
    manager.report(CheckLevel.WARNING, TemplateError.make(BAR_WARNING));
    manager.report(CheckLevel.ERROR, TemplateError.make(FOO_ERROR, "y"));

    assertThat(manager.getErrorCount()).isEqualTo(2);
    assertThat(manager.getWarningCount()).isEqualTo(1);
    assertThat(manager.hasErrors()).isTrue();
    assertThat(manager.getErrors()).hasLength(2);
    assertThat(manager.getErrors()[1].description()).isEqualTo("Foo y");
    assertThat(manager.getWarnings()[0].type()).isEqualTo(BAR_WARNING);
  }

  @Test
  public void testOffIsIgnored() {
    manager.report(CheckLevel.OFF, TemplateError.make(FOO_ERROR, "x"));
    assertThat(manager.getErrorCount()).isEqualTo(0);
    assertThat(manager.hasErrors()).isFalse();
    manager.generateReport();
    assertThat(printed).isEmpty();
  }

  @Test
  public void testReportKeepsReportingOrder() {
    manager.report(CheckLevel.WARNING, TemplateError.make(BAR_WARNING));
    manager.report(CheckLevel.ERROR, TemplateError.make(FOO_ERROR, "x"));
    manager.generateReport();
    assertThat(printed).containsExactly("WARNING TEST_BAR", "ERROR TEST_FOO").inOrder();
    assertThat(summaries).isEqualTo(1);
  }

  @Test
  public void testWarningTypeReportedAsError() {
    manager.report(CheckLevel.ERROR, TemplateError.make(BAR_WARNING));
    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.getErrors()[0].defaultLevel()).isEqualTo(CheckLevel.WARNING);
  }

  @Test
  public void testErrorToString() {
    SourceLocation location = SourceLocation.of(new FilePosition(4, 2, 3), "abc");
    TemplateError error = TemplateError.make("App.vue", location, FOO_ERROR, "x");
    assertThat(error.toString()).isEqualTo("TEST_FOO. Foo x at App.vue line 2 : 3");
    assertThat(TemplateError.make(FOO_ERROR, "x").toString())
        .isEqualTo("TEST_FOO. Foo x at (unknown source) line (unknown line) : (unknown column)");
  }
}
