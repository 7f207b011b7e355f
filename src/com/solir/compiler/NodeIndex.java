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

import com.solir.ir.Node;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Maps the ids of one compilation run to the nodes built from it. */
public final class NodeIndex {
  private final String runId;
  private final Map<Long, Node> nodes = new HashMap<>();

  public NodeIndex(String runId) {
    this.runId = runId;
  }

  public String getRunId() {
    return runId;
  }

  /** Registers a node; returns false if the id is already taken by another node. */
  boolean register(Node n) {
    Node existing = nodes.putIfAbsent(n.getAstId(), n);
    return existing == null || existing == n;
  }

  public @Nullable Node get(long id) {
    return nodes.get(id);
  }

  public int size() {
    return nodes.size();
  }
}
