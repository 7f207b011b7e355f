/*
 * Copyright 2026 The Solir Authors.
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
package com.solir.ir;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceFileTest {
  // "€" is three bytes in UTF-8.
  private final SourceFile file = new SourceFile("dir\\A.sol", "a\n€b\n");

  @Test
  public void testPathUsesForwardSlashes() {
    assertThat(file.getPath()).isEqualTo("dir/A.sol");
  }

  @Test
  public void testLinesAndColumnsCountBytes() {
    assertThat(file.getNumBytes()).isEqualTo(7);
    assertThat(file.getNumLines()).isEqualTo(3);
    assertThat(file.getLineOfOffset(0)).isEqualTo(1);
    assertThat(file.getLineOfOffset(1)).isEqualTo(1);
    assertThat(file.getLineOfOffset(2)).isEqualTo(2);
    assertThat(file.getLineOfOffset(5)).isEqualTo(2);
    assertThat(file.getColumnOfOffset(5)).isEqualTo(3);
    assertThat(file.getLineOffset(3)).isEqualTo(7);
    assertThat(file.getOffset(2, 3)).isEqualTo(5);
  }

  @Test
  public void testText() {
    assertThat(file.getText(2, 3)).isEqualTo("€");
    assertThat(file.getText(5, 1)).isEqualTo("b");
    assertThrows(IllegalArgumentException.class, () -> file.getText(5, 3));
  }

  @Test
  public void testLineOutOfRange() {
    assertThrows(IllegalArgumentException.class, () -> file.getLineOffset(0));
    assertThrows(IllegalArgumentException.class, () -> file.getLineOffset(4));
  }
}
