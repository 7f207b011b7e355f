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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;
import java.time.Duration;

/** Compiler options */
public class CompilerOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Editor link understood by VS Code and most of its forks. */
  public static final String DEFAULT_LINK_FORMAT = "vscode://file/{path}:{line}:{col}";

  // Template for source links. {path}, {line} and {col} are substituted.
  private String linkFormat = DEFAULT_LINK_FORMAT;

  private boolean computeControlFlowGraphs = true;

  private boolean treatAlwaysRevertingCallsAsRevert = false;

  private Duration debounceDelay = Duration.ofMillis(300);

  private Duration pluginTimeout = Duration.ofSeconds(30);

  public String getLinkFormat() {
    return linkFormat;
  }

  public void setLinkFormat(String linkFormat) {
    this.linkFormat = checkNotNull(linkFormat);
  }

  public boolean shouldComputeControlFlowGraphs() {
    return computeControlFlowGraphs;
  }

  public void setComputeControlFlowGraphs(boolean computeControlFlowGraphs) {
    this.computeControlFlowGraphs = computeControlFlowGraphs;
  }

  /**
   * Whether a call to an internal function that never returns normally is wired to the revert
   * exit of the caller. Best effort: only direct calls to resolved function definitions count.
   */
  public boolean shouldTreatAlwaysRevertingCallsAsRevert() {
    return treatAlwaysRevertingCallsAsRevert;
  }

  public void setTreatAlwaysRevertingCallsAsRevert(boolean value) {
    this.treatAlwaysRevertingCallsAsRevert = value;
  }

  /** How long a build request waits for further requests before it starts. */
  public Duration getDebounceDelay() {
    return debounceDelay;
  }

  public void setDebounceDelay(Duration debounceDelay) {
    checkArgument(!debounceDelay.isNegative(), "Negative debounce delay %s", debounceDelay);
    this.debounceDelay = debounceDelay;
  }

  public Duration getPluginTimeout() {
    return pluginTimeout;
  }

  public void setPluginTimeout(Duration pluginTimeout) {
    checkArgument(
        !pluginTimeout.isNegative() && !pluginTimeout.isZero(),
        "Plugin timeout must be positive: %s",
        pluginTimeout);
    this.pluginTimeout = pluginTimeout;
  }
}
