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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.solir.ir.Node;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The reference links of one build, kept apart from the nodes themselves. Nodes are keyed by
 * identity. The map also holds the reverse index from declarations to the nodes referring to them
 * and the override set of every overridden function and modifier.
 *
 * <p>A map is filled by the resolver while its build is assembled and is read-only once the build
 * is published.
 */
public final class ReferenceMap {
  private final Map<Node, Reference> references = new LinkedHashMap<>();
  private final SetMultimap<Node, Node> referrers = LinkedHashMultimap.create();
  private final SetMultimap<Node, Node> overriders = LinkedHashMultimap.create();

  /**
   * Records a reference. Re-recording a node is allowed only with the same resolution.
   *
   * @return false if the node already had an identical resolution
   */
  boolean put(Reference reference) {
    Reference existing = references.get(reference.getNode());
    if (existing != null) {
      checkArgument(
          existing.hasSameResolution(reference),
          "%s was resolved to %s and now to %s",
          reference.getNode(),
          existing,
          reference);
      return false;
    }
    references.put(reference.getNode(), reference);
    if (reference.getTarget() != null) {
      referrers.put(reference.getTarget(), reference.getNode());
    }
    return true;
  }

  void putOverriders(Node declaration, Collection<Node> overridingDeclarations) {
    overriders.replaceValues(declaration, overridingDeclarations);
  }

  public @Nullable Reference get(Node n) {
    return references.get(n);
  }

  public boolean contains(Node n) {
    return references.containsKey(n);
  }

  /** Returns the nodes that refer to {@code declaration}, in resolution order. */
  public ImmutableList<Node> getReferrers(Node declaration) {
    return ImmutableList.copyOf(referrers.get(declaration));
  }

  /** Returns every declaration that overrides {@code declaration}, directly or transitively. */
  public ImmutableSet<Node> getOverriders(Node declaration) {
    return ImmutableSet.copyOf(overriders.get(declaration));
  }

  /** Returns all references that could not be bound. */
  public ImmutableList<Reference> getUnresolved() {
    ImmutableList.Builder<Reference> result = ImmutableList.builder();
    for (Reference reference : references.values()) {
      if (!reference.isResolved()) {
        result.add(reference);
      }
    }
    return result.build();
  }

  public Collection<Reference> getAll() {
    return Collections.unmodifiableCollection(references.values());
  }

  public int size() {
    return references.size();
  }
}
