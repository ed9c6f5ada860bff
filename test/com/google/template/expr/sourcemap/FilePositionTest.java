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

package com.google.template.expr.sourcemap;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FilePositionTest {

  @Test
  public void testAdvanceOnOneLine() {
    FilePosition pos = FilePosition.START.advance("abc");
    assertThat(pos).isEqualTo(new FilePosition(3, 1, 4));
  }

  @Test
  public void testAdvanceAcrossNewlines() {
    FilePosition pos = FilePosition.START.advance("ab\ncd", 4);
    assertThat(pos.getOffset()).isEqualTo(4);
    assertThat(pos.getLine()).isEqualTo(2);
    assertThat(pos.getColumn()).isEqualTo(2);
  }

  @Test
  public void testAdvanceFromMiddleOfFile() {
    FilePosition pos = new FilePosition(10, 3, 5).advance("x\n\ny");
    assertThat(pos).isEqualTo(new FilePosition(14, 5, 2));
  }

  @Test
  public void testSourceLocationSpan() {
    SourceLocation loc = SourceLocation.of(new FilePosition(4, 1, 5), "foo\nbar");
    assertThat(loc.end()).isEqualTo(new FilePosition(11, 2, 4));
    assertThat(loc.length()).isEqualTo(7);
    assertThat(loc.contains(SourceLocation.of(new FilePosition(8, 2, 1), "bar"))).isTrue();
    assertThat(loc.contains(SourceLocation.of(new FilePosition(2, 1, 3), "xx"))).isFalse();
  }

  @Test
  public void testSourceLocationRejectsMismatchedSpan() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> new SourceLocation(FilePosition.START, new FilePosition(2, 1, 3), "abc"));
    assertThat(e).hasMessageThat().contains("does not match");
  }
}
