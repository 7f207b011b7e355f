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

/** Why a reference-capable node could not be bound to a declaration. */
public enum UnresolvedReason {
  /** No declaration of that name is visible from the node. */
  NOT_FOUND,
  /** Several declarations match equally well. */
  AMBIGUOUS,
  /** The node is a member access whose base does not have a known member scope. */
  NO_MEMBER_SCOPE,
  /** The compiler named a declaration in a file that is absent from the build. */
  TARGET_UNAVAILABLE
}
