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

import static com.google.common.base.Preconditions.checkNotNull;

import com.solir.ir.Node;
import com.solir.ir.SourceSpan;
import org.jspecify.annotations.Nullable;

/**
 * Identifies a declaration independently of the compilation run it was built from. Two runs that
 * compile the same file agree on the span and canonical name of each declaration even when their
 * node ids and node shapes differ.
 */
public record DeclarationKey(String path, int offset, int length, String canonicalName) {

  public DeclarationKey {
    checkNotNull(path);
    checkNotNull(canonicalName);
  }

  /** Returns the key of a declaration or source unit, or null if it has no source location. */
  public static @Nullable DeclarationKey of(Node declaration) {
    if (!NodeUtil.isDeclaration(declaration)) {
      return null;
    }
    SourceSpan span = declaration.getSpan();
    if (span == null) {
      return null;
    }
    return new DeclarationKey(
        span.path(), span.offset(), span.length(), NodeUtil.getCanonicalName(declaration));
  }

  @Override
  public String toString() {
    return canonicalName + "@" + path + ":" + offset + ":" + length;
  }
}
