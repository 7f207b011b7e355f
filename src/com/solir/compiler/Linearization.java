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
import com.google.common.collect.Lists;
import com.solir.ir.Node;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Computes C3 linearizations of contracts, most derived first. Bases are merged right to left,
 * so for {@code contract C is A, B} the order is C, B, A.
 */
final class Linearization {
  private final Function<Node, List<Node>> directBases;
  private final Map<Node, Optional<ImmutableList<Node>>> memo = new HashMap<>();
  private final Set<Node> inProgress = new HashSet<>();

  /**
   * @param directBases returns the resolved base contracts of a contract in declaration order
   */
  Linearization(Function<Node, List<Node>> directBases) {
    this.directBases = directBases;
  }

  /** Returns the linearization, or null if the hierarchy is cyclic or inconsistent. */
  @Nullable ImmutableList<Node> linearize(Node contract) {
    Optional<ImmutableList<Node>> known = memo.get(contract);
    if (known != null) {
      return known.orElse(null);
    }
    if (!inProgress.add(contract)) {
      return null;
    }
    ImmutableList<Node> result = compute(contract);
    inProgress.remove(contract);
    memo.put(contract, Optional.ofNullable(result));
    return result;
  }

  private @Nullable ImmutableList<Node> compute(Node contract) {
    List<Node> bases = Lists.reverse(directBases.apply(contract));
    List<LinkedList<Node>> sequences = new ArrayList<>();
    for (Node base : bases) {
      ImmutableList<Node> baseOrder = linearize(base);
      if (baseOrder == null) {
        return null;
      }
      sequences.add(new LinkedList<>(baseOrder));
    }
    sequences.add(new LinkedList<>(bases));

    ImmutableList.Builder<Node> result = ImmutableList.builder();
    result.add(contract);
    while (true) {
      sequences.removeIf(List::isEmpty);
      if (sequences.isEmpty()) {
        return result.build();
      }
      Node head = null;
      for (LinkedList<Node> candidate : sequences) {
        Node first = candidate.getFirst();
        if (!appearsInTail(first, sequences)) {
          head = first;
          break;
        }
      }
      if (head == null) {
        return null;
      }
      result.add(head);
      for (LinkedList<Node> sequence : sequences) {
        if (sequence.getFirst() == head) {
          sequence.removeFirst();
        }
      }
    }
  }

  private static boolean appearsInTail(Node n, List<LinkedList<Node>> sequences) {
    for (LinkedList<Node> sequence : sequences) {
      for (int i = 1; i < sequence.size(); i++) {
        if (sequence.get(i) == n) {
          return true;
        }
      }
    }
    return false;
  }
}
