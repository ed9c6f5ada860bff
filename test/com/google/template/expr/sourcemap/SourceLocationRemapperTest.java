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
public final class SourceLocationRemapperTest {

  // "foo(\n bar)" starting at column 4 of the first line.
  private final SourceLocationRemapper remapper =
      new SourceLocationRemapper(new FilePosition(3, 1, 4), "foo(\n bar)");

  @Test
  public void testStartOfSubstring() {
    assertThat(remapper.position(0)).isEqualTo(new FilePosition(3, 1, 4));
  }

  @Test
  public void testPositionOnSameLine() {
    assertThat(remapper.position(3)).isEqualTo(new FilePosition(6, 1, 7));
  }

  @Test
  public void testPositionAfterNewline() {
    assertThat(remapper.position(6)).isEqualTo(new FilePosition(9, 2, 2));
  }

  @Test
  public void testLocation() {
    SourceLocation loc = remapper.location(6, 9);
    assertThat(loc.source()).isEqualTo("bar");
    assertThat(loc.start()).isEqualTo(new FilePosition(9, 2, 2));
    assertThat(loc.end()).isEqualTo(new FilePosition(12, 2, 5));
  }

  @Test
  public void testEmptyLocationAtEnd() {
    SourceLocation loc = remapper.location(10, 10);
    assertThat(loc.source()).isEmpty();
    assertThat(loc.start()).isEqualTo(remapper.getBase().end());
  }

  @Test
  public void testOutOfRange() {
    assertThrows(IndexOutOfBoundsException.class, () -> remapper.position(11));
    assertThrows(IndexOutOfBoundsException.class, () -> remapper.location(3, 11));
  }
}
