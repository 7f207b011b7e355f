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

/** Where a plugin provider comes from. Earlier constants take precedence. */
public enum PluginSource {
  /** Plugins kept with the project being analyzed. */
  PROJECT_LOCAL,
  /** Plugins installed for the current user. */
  USER_GLOBAL,
  /** Plugins shipped in a package on the class path. */
  PACKAGE
}
