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

import static java.util.Objects.requireNonNull;

/**
 * One entry of an inline assembly block's {@code externalReferences} table: a Yul identifier
 * that names a Solidity declaration.
 *
 * @param declarationId Run-local id of the referenced declaration.
 * @param offset Byte offset of the Yul identifier.
 * @param length Byte length of the Yul identifier.
 * @param suffix {@code slot}, {@code offset}, {@code length}, {@code selector}, {@code address}
 *     or the empty string.
 */
public record ExternalReference(long declarationId, int offset, int length, String suffix) {
  public ExternalReference {
    requireNonNull(suffix, "suffix");
  }
}
