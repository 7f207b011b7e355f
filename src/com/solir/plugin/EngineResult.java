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
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.solir.compiler.IrError;

/**
 * The outcome of one plugin engine run.
 *
 * @param findings the findings of each plugin that completed, keyed by plugin name
 * @param failures the plugins that threw, in order of failure
 * @param errors a {@code PLUGIN_EXECUTION_ERROR} per failure
 * @param walkedPaths the source units that were walked
 * @param suppressedCount findings dropped because of suppression comments
 */
public record EngineResult(
    ImmutableListMultimap<String, Finding> findings,
    ImmutableList<PluginFailure> failures,
    ImmutableList<IrError> errors,
    ImmutableSet<String> walkedPaths,
    int suppressedCount) {

  public ImmutableList<Finding> getFindings(String pluginName) {
    return findings.get(pluginName);
  }

  public boolean hasFailed(String pluginName) {
    for (PluginFailure failure : failures) {
      if (failure.pluginName().equals(pluginName)) {
        return true;
      }
    }
    return false;
  }
}
