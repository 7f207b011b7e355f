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

import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.Math.min;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * The text of one Solidity source file. Positions reported by the compiler are UTF-8 byte
 * offsets, so line lookups are computed over the encoded bytes.
 */
public final class SourceFile {

  private final String path;
  private final String code;
  private final byte[] bytes;
  private int[] lineOffsets = null;

  public SourceFile(String path, String code) {
    this.path = path.replace('\\', '/');
    this.code = code;
    this.bytes = code.getBytes(StandardCharsets.UTF_8);
  }

  public String getPath() {
    return path;
  }

  public String getCode() {
    return code;
  }

  public int getNumBytes() {
    return bytes.length;
  }

  /** Returns the text covered by the given byte range. */
  public String getText(int offset, int length) {
    checkArgument(offset >= 0 && length >= 0 && offset + length <= bytes.length,
        "Range %s:%s outside of %s", offset, length, path);
    return new String(bytes, offset, length, StandardCharsets.UTF_8);
  }

  private void findLineOffsets() {
    if (lineOffsets != null) {
      return;
    }
    int numLines = 1;
    for (byte b : bytes) {
      if (b == '\n') {
        numLines++;
      }
    }
    int[] offsets = new int[numLines];
    int index = 1; // line 1 always starts at byte 0
    for (int i = 0; i < bytes.length; i++) {
      if (bytes[i] == '\n') {
        offsets[index++] = i + 1;
      }
    }
    lineOffsets = offsets;
  }

  public int getNumLines() {
    findLineOffsets();
    return lineOffsets.length;
  }

  /** Returns the byte offset at which the one-based line starts. */
  public int getLineOffset(int lineno) {
    findLineOffsets();
    if (lineno < 1 || lineno > lineOffsets.length) {
      throw new IllegalArgumentException(
          "Expected line number between 1 and " + lineOffsets.length + "\nActual: " + lineno);
    }
    return lineOffsets[lineno - 1];
  }

  /** Returns the one-based line containing the byte offset. */
  public int getLineOfOffset(int offset) {
    findLineOffsets();
    int search = Arrays.binarySearch(lineOffsets, offset);
    if (search >= 0) {
      return search + 1;
    } else {
      int insertionPoint = -1 * (search + 1);
      return min(insertionPoint - 1, lineOffsets.length - 1) + 1;
    }
  }

  /** Returns the zero-based byte column of the offset within its line. */
  public int getColumnOfOffset(int offset) {
    int line = getLineOfOffset(offset);
    return offset - lineOffsets[line - 1];
  }

  /** Converts a one-based line and zero-based byte column to an offset. */
  public int getOffset(int lineno, int column) {
    return getLineOffset(lineno) + column;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SourceFile)) {
      return false;
    }
    SourceFile other = (SourceFile) o;
    return path.equals(other.path) && code.equals(other.code);
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, code);
  }

  @Override
  public String toString() {
    return path;
  }
}
