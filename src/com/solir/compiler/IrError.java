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

import static com.google.common.base.Strings.emptyToNull;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.solir.ir.Node;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Build or analysis error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Path of the source file.
 * @param lineno One-indexed line number of the error location.
 * @param charno Zero-indexed byte column of the error location.
 * @param length Length of the error region.
 * @param node Node where the error occurred.
 * @param level The level the error is reported at.
 * @param cause The exception behind the error, for plugin and decode failures.
 */
public record IrError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno,
    int length,
    @Nullable Node node,
    CheckLevel level,
    @Nullable Throwable cause) {
  public IrError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(level, "level");
  }

  private static final int DEFAULT_LINENO = -1;
  private static final int DEFAULT_CHARNO = -1;

  /** Creates an IrError with no source information. */
  public static IrError make(DiagnosticType type, Object... arguments) {
    return builder(type, arguments).build();
  }

  /** Creates an IrError for a whole file. */
  public static IrError make(String sourceName, DiagnosticType type, Object... arguments) {
    return builder(type, arguments).setSourceLocation(sourceName, DEFAULT_LINENO, DEFAULT_CHARNO)
        .build();
  }

  /** Creates an IrError at the position of a node. */
  public static IrError make(Node n, DiagnosticType type, Object... arguments) {
    return builder(type, arguments).setNode(n).build();
  }

  /** Builder for errors that carry a cause or an explicit level. */
  public static final class Builder {
    private final DiagnosticType type;
    private final Object[] args;

    private CheckLevel level;
    private @Nullable Node n = null;
    private @Nullable String sourceName = null;
    private int lineno = DEFAULT_LINENO;
    private int charno = DEFAULT_CHARNO;
    private int length = 0;
    private @Nullable Throwable cause = null;

    private Builder(DiagnosticType type, Object... args) {
      this.type = type;
      this.args = args;
      this.level = type.level;
    }

    @CanIgnoreReturnValue
    public Builder setNode(Node n) {
      Preconditions.checkState(
          sourceName == null, "Cannot provide a Node when there's already a source name");
      this.n = n;
      this.sourceName = n.getSourceFileName();
      this.lineno = n.getLineno();
      this.charno = n.getCharno();
      this.length = n.getLength();
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSourceLocation(String sourceName, int lineno, int charno) {
      Preconditions.checkState(
          this.n == null, "Cannot provide a source location when there is already a Node");
      this.sourceName = sourceName;
      this.lineno = lineno;
      this.charno = charno;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLevel(CheckLevel level) {
      this.level = Preconditions.checkNotNull(level);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCause(Throwable cause) {
      this.cause = Preconditions.checkNotNull(cause);
      return this;
    }

    public IrError build() {
      return new IrError(
          type, type.format(args), sourceName, lineno, charno, length, n, level, cause);
    }
  }

  public static Builder builder(DiagnosticType type, Object... arguments) {
    return new Builder(type, arguments);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof IrError)) {
      return false;
    }
    IrError e = (IrError) o;
    return type.equals(e.type)
        && description.equals(e.description)
        && Objects.equals(sourceName, e.sourceName)
        && lineno == e.lineno
        && charno == e.charno
        && level == e.level;
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, description, sourceName, lineno, charno, level);
  }

  /** @return the default rendering of an error as text. */
  @Override
  public String toString() {
    String sourceName =
        emptyToNull(this.sourceName) != null ? this.sourceName : "(unknown source)";
    String lineno = this.lineno != DEFAULT_LINENO ? String.valueOf(this.lineno) : "(unknown line)";
    String charno =
        this.charno != DEFAULT_CHARNO ? String.valueOf(this.charno) : "(unknown column)";
    return type.key + ". " + description + " at " + sourceName + " line " + lineno + " : "
        + charno;
  }
}
