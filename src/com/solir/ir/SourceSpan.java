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
import static java.util.Objects.requireNonNull;

/**
 * A byte range in a source file.
 *
 * @param path Absolute path of the file as reported by the compiler.
 * @param offset Zero-based byte offset of the first byte.
 * @param length Number of bytes covered.
 */
public record SourceSpan(String path, int offset, int length) {
  public SourceSpan {
    requireNonNull(path, "path");
    checkArgument(offset >= 0, "negative offset %s", offset);
    checkArgument(length >= 0, "negative length %s", length);
  }

  public int end() {
    return offset + length;
  }

  /** Whether the byte at {@code position} lies inside this span. */
  public boolean contains(int position) {
    return position >= offset && position < end();
  }

  /** Whether {@code other} lies completely within this span. */
  public boolean contains(SourceSpan other) {
    return path.equals(other.path) && other.offset >= offset && other.end() <= end();
  }

  @Override
  public String toString() {
    return path + ":" + offset + ":" + length;
  }
}
