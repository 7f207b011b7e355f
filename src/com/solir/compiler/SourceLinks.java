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

package com.solir.compiler;

import com.solir.ir.Node;
import org.jspecify.annotations.Nullable;

/**
 * Formats editor links to source locations from a template such as {@link
 * CompilerOptions#DEFAULT_LINK_FORMAT}. Lines and columns in links are one-based.
 */
public final class SourceLinks {

  private SourceLinks() {}

  /** Substitutes {@code {path}}, {@code {line}} and {@code {col}} in {@code linkFormat}. */
  public static String format(String linkFormat, String path, int line, int column) {
    return linkFormat
        .replace("{path}", path)
        .replace("{line}", Integer.toString(line))
        .replace("{col}", Integer.toString(column));
  }

  /** A link to the first byte of {@code n}, or null if {@code n} has no known location. */
  public static @Nullable String forNode(String linkFormat, Node n) {
    String path = n.getSourceFileName();
    int line = n.getLineno();
    if (path == null || line < 0) {
      return null;
    }
    return format(linkFormat, path, line, n.getCharno() + 1);
  }
}
