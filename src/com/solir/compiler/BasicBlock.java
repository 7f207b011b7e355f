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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.solir.ir.Node;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Represents a section of code that is uninterrupted by control structures. A block holds its
 * statements in execution order, optionally followed by the statement whose condition decides
 * which outgoing edge is taken.
 */
public final class BasicBlock {

  private final int id;
  private final @Nullable String label;
  private final List<Node> statements = new ArrayList<>();
  private @Nullable Node controlStatement;

  BasicBlock(int id, @Nullable String label) {
    this.id = id;
    this.label = label;
  }

  void addStatement(Node statement) {
    checkState(controlStatement == null, "Block %s already ends in %s", this, controlStatement);
    statements.add(statement);
  }

  void setControlStatement(Node statement) {
    checkState(controlStatement == null, "Block %s already ends in %s", this, controlStatement);
    this.controlStatement = statement;
  }

  /** Unique within its graph. */
  public int getId() {
    return id;
  }

  public ImmutableList<Node> getStatements() {
    return ImmutableList.copyOf(statements);
  }

  /**
   * The if, loop, try or switch statement executed last in this block, whose outcome selects the
   * outgoing edge. Null for blocks that end unconditionally.
   */
  public @Nullable Node getControlStatement() {
    return controlStatement;
  }

  public boolean isEmpty() {
    return statements.isEmpty() && controlStatement == null;
  }

  int indexOf(Node statement) {
    return statements.indexOf(statement);
  }

  @Override
  public String toString() {
    return label != null ? label : "B" + id;
  }
}
