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

package com.solir.plugin;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** Selects the source units a plugin run walks. */
public final class VisitScope {
  private static final VisitScope ALL = new VisitScope(null);

  // Null means every file of the build.
  private final @Nullable ImmutableSet<String> paths;

  private VisitScope(@Nullable ImmutableSet<String> paths) {
    this.paths = paths;
  }

  public static VisitScope all() {
    return ALL;
  }

  public static VisitScope paths(Set<String> paths) {
    return new VisitScope(ImmutableSet.copyOf(paths));
  }

  public boolean includes(String path) {
    return paths == null || paths.contains(path);
  }

  public boolean isAll() {
    return paths == null;
  }

  @Override
  public String toString() {
    return paths == null ? "VisitScope.all()" : "VisitScope.paths(" + paths + ")";
  }
}
