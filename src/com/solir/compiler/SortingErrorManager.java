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
import com.google.common.collect.ImmutableSet;
import java.util.Comparator;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A customizable error manager that sorts all errors and warnings reported to it, and has
 * customizable output through the {@link ErrorReportGenerator} interface.
 */
public class SortingErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledIrErrorComparator());
  private int originalErrorCount = 0;
  private int promotedErrorCount = 0;
  private int warningCount = 0;

  /** Responsible for generating the report of the errors at the end of a build */
  private final ImmutableSet<ErrorReportGenerator> errorReportGenerators;

  public SortingErrorManager() {
    this(ImmutableSet.of());
  }

  public SortingErrorManager(Set<ErrorReportGenerator> errorReportGenerators) {
    this.errorReportGenerators = ImmutableSet.copyOf(errorReportGenerators);
  }

  @Override
  public synchronized void report(CheckLevel level, IrError error) {
    ErrorWithLevel e = new ErrorWithLevel(error, level);
    if (messages.add(e)) {
      if (level == CheckLevel.ERROR) {
        if (error.type().level == CheckLevel.ERROR) {
          originalErrorCount++;
        } else {
          promotedErrorCount++;
        }
      } else if (level == CheckLevel.WARNING) {
        warningCount++;
      }
    }
  }

  @Override
  public synchronized boolean hasHaltingErrors() {
    return originalErrorCount != 0;
  }

  @Override
  public synchronized int getErrorCount() {
    return originalErrorCount + promotedErrorCount;
  }

  @Override
  public synchronized int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<IrError> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<IrError> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  synchronized ImmutableList<ErrorWithLevel> getSortedDiagnostics() {
    return ImmutableList.copyOf(messages);
  }

  private synchronized ImmutableList<IrError> toList(CheckLevel level) {
    ImmutableList.Builder<IrError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  @Override
  public void generateReport() {
    for (ErrorReportGenerator generator : this.errorReportGenerators) {
      generator.generateReport(this);
    }
  }

  /** Strategy for customizing the output format of the error report */
  public interface ErrorReportGenerator {
    void generateReport(SortingErrorManager manager);
  }

  /**
   * Comparator of {@link IrError} with an associated {@link CheckLevel}. The ordering is the
   * standard lexical ordering on the quintuple (file name, line number, {@link CheckLevel},
   * character number, description).
   */
  static final class LeveledIrErrorComparator implements Comparator<ErrorWithLevel> {
    private static final int P1_LT_P2 = -1;
    private static final int P1_GT_P2 = 1;

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      // null is the smallest value
      if (p2 == null) {
        return p1 == null ? 0 : P1_GT_P2;
      } else if (p1 == null) {
        return P1_LT_P2;
      }

      if (p1.level != p2.level) {
        return p2.level.compareTo(p1.level);
      }

      String source1 = p1.error.sourceName();
      String source2 = p2.error.sourceName();
      if (source1 != null && source2 != null) {
        int sourceCompare = source1.compareTo(source2);
        if (sourceCompare != 0) {
          return sourceCompare;
        }
      } else if (source1 == null && source2 != null) {
        return P1_LT_P2;
      } else if (source1 != null && source2 == null) {
        return P1_GT_P2;
      }

      int lineno1 = p1.error.lineno();
      int lineno2 = p2.error.lineno();
      if (lineno1 != lineno2) {
        return Integer.compare(lineno1, lineno2);
      }

      int charno1 = p1.error.charno();
      int charno2 = p2.error.charno();
      if (charno1 != charno2) {
        return Integer.compare(charno1, charno2);
      }

      int keyCompare = p1.error.type().compareTo(p2.error.type());
      if (keyCompare != 0) {
        return keyCompare;
      }
      return p1.error.description().compareTo(p2.error.description());
    }
  }

  static final class ErrorWithLevel {
    final IrError error;
    final CheckLevel level;

    ErrorWithLevel(IrError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }

    @Override
    public int hashCode() {
      return Objects.hash(level, error);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ErrorWithLevel)) {
        return false;
      }
      ErrorWithLevel e = (ErrorWithLevel) obj;
      return level == e.level && error.equals(e.error);
    }
  }
}
