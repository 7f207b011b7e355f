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

/** The phases of a plugin engine run, in order. */
public enum EngineState {
  /** Plugins are prepared for the run. */
  CONFIGURING,
  /** The source units to walk are selected. */
  SCANNING,
  /** The selected source units are walked and callbacks invoked. */
  DISPATCHING,
  /** Each plugin reports its findings. */
  REPORTING,
  /** The run is over. */
  DONE
}
