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
import com.solir.ir.Node;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The cross-run alias table of one build. Maps {@link DeclarationKey}s to the canonical
 * declaration nodes of the build, and the run-local ids of every run to keys.
 *
 * <p>Compiler hints carry run-local ids. They are only ever translated through this table so that
 * a hint from one run can name a declaration built from another run.
 */
public final class DeclarationIndex {
  private final Map<DeclarationKey, Node> declarations = new LinkedHashMap<>();
  private final Map<String, Map<Long, DeclarationKey>> keysByRun = new HashMap<>();

  /** Registers every declaration of a canonical tree. */
  void addCanonicalTree(Node root) {
    NodeUtil.visitPreOrder(
        root,
        n -> {
          DeclarationKey key = DeclarationKey.of(n);
          if (key != null) {
            declarations.putIfAbsent(key, n);
          }
        });
  }

  /** Records the run-local ids of the declarations in a tree built from {@code runId}. */
  void addRunIds(String runId, Node root) {
    Map<Long, DeclarationKey> keys = keysByRun.computeIfAbsent(runId, k -> new HashMap<>());
    NodeUtil.visitPreOrder(
        root,
        n -> {
          if (!n.hasAstId()) {
            return;
          }
          DeclarationKey key = DeclarationKey.of(n);
          if (key != null) {
            keys.put(n.getAstId(), key);
          }
        });
  }

  /**
   * Carries over the ids recorded for {@code runId} by an earlier build, for trees that are
   * retained from it and still carry its hints.
   */
  void inheritRunIds(DeclarationIndex earlier, String runId) {
    Map<Long, DeclarationKey> keys = earlier.keysByRun.get(runId);
    if (keys != null) {
      keysByRun.computeIfAbsent(runId, k -> new HashMap<>()).putAll(keys);
    }
  }

  boolean hasRunIds(String runId) {
    return keysByRun.containsKey(runId);
  }

  public @Nullable Node get(DeclarationKey key) {
    return declarations.get(key);
  }

  /** Returns the key a run-local id stands for, or null if the run never declared that id. */
  public @Nullable DeclarationKey getKey(String runId, long id) {
    Map<Long, DeclarationKey> keys = keysByRun.get(runId);
    return keys == null ? null : keys.get(id);
  }

  /**
   * Translates a compiler hint into the canonical declaration of this build, or null if the hint
   * is unknown or points into a file absent from the build.
   */
  public @Nullable Node resolveHint(String runId, long id) {
    DeclarationKey key = getKey(runId, id);
    return key == null ? null : declarations.get(key);
  }

  /** Returns every canonical declaration with the given canonical name. */
  public ImmutableList<Node> findByCanonicalName(String canonicalName) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Map.Entry<DeclarationKey, Node> entry : declarations.entrySet()) {
      if (entry.getKey().canonicalName().equals(canonicalName)) {
        result.add(entry.getValue());
      }
    }
    return result.build();
  }

  public int size() {
    return declarations.size();
  }
}
