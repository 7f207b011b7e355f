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

import com.google.common.collect.ImmutableList;

/** The error handler. Errors are scoped to the file, node or plugin they affect. */
public interface ErrorManager {

  /**
   * Reports an error. The level may be different from the level of the error's type.
   *
   * @param level the reporting level
   * @param error the error to report
   */
  void report(CheckLevel level, IrError error);

  /** Reports an error at the level of its own. */
  default void report(IrError error) {
    report(error.level(), error);
  }

  /** Writes a report to an implementation-specific medium. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  ImmutableList<IrError> getErrors();

  ImmutableList<IrError> getWarnings();

  /** Whether any error with an original ERROR level was reported. */
  boolean hasHaltingErrors();
}
