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

import org.jspecify.annotations.Nullable;

/**
 * Thrown when an AST document does not match any shape known for its compiler version. The
 * affected file is left out of the build.
 */
public final class StructuralDecodeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final @Nullable String nodeType;
  private final String path;

  public StructuralDecodeException(@Nullable String nodeType, String path, String message) {
    super(message + " (node kind " + nodeType + " in " + path + ")");
    this.nodeType = nodeType;
    this.path = path;
  }

  /** The {@code nodeType} of the offending node, or null if the tag itself is missing. */
  public @Nullable String getNodeType() {
    return nodeType;
  }

  public String getPath() {
    return path;
  }
}
