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

import static com.google.common.base.Preconditions.checkNotNull;

import com.solir.ir.Node;
import org.jspecify.annotations.Nullable;

/**
 * A plugin that threw. The plugin is skipped for the rest of the run in which it failed.
 *
 * @param pluginName the failing plugin
 * @param state the phase the failure happened in
 * @param node the node being visited, or null outside the walk
 * @param exception what the plugin threw
 */
public record PluginFailure(
    String pluginName, EngineState state, @Nullable Node node, Throwable exception) {
  public PluginFailure {
    checkNotNull(pluginName);
    checkNotNull(state);
    checkNotNull(exception);
  }

  @Override
  public String toString() {
    return pluginName + " failed while " + state + (node == null ? "" : " at " + node) + ": "
        + exception;
  }
}
