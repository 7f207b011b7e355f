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

import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;

/** A source of plugins, such as a directory or a package on the class path. */
public interface PluginProvider {

  /** Unique among the providers of a registry. Packages are ordered by it. */
  String getId();

  PluginSource getSource();

  /**
   * A hash of everything {@link #load} reads. The registry reloads a provider when it changes.
   */
  HashCode fingerprint() throws PluginLoadException;

  /** Creates new instances of every plugin of this provider. */
  ImmutableList<Plugin> load() throws PluginLoadException;
}
