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

package com.solir.compiler.graph;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A directed graph using adjacency lists kept on the nodes. Node iteration follows insertion
 * order, which keeps renderings stable.
 *
 * @param <N> Value type that the graph node stores.
 * @param <E> Value type that the graph edge stores.
 */
public class LinkedDirectedGraph<N, E> extends DiGraph<N, E> {

  private final Map<N, LinkedDirectedGraphNode<N, E>> nodes = new LinkedHashMap<>();

  public static <N, E> LinkedDirectedGraph<N, E> create() {
    return new LinkedDirectedGraph<>();
  }

  protected LinkedDirectedGraph() {}

  @Override
  @CanIgnoreReturnValue
  public LinkedDirectedGraphNode<N, E> createNode(N value) {
    checkNotNull(value);
    return nodes.computeIfAbsent(value, LinkedDirectedGraphNode::new);
  }

  @Override
  public @Nullable LinkedDirectedGraphNode<N, E> getNode(N value) {
    return nodes.get(value);
  }

  @Override
  public boolean hasNode(N value) {
    return nodes.containsKey(value);
  }

  private LinkedDirectedGraphNode<N, E> getNodeOrFail(N value) {
    LinkedDirectedGraphNode<N, E> node = nodes.get(value);
    checkArgument(node != null, "%s does not exist in graph", value);
    return node;
  }

  @Override
  @CanIgnoreReturnValue
  public LinkedDirectedGraphEdge<N, E> connect(N source, E edgeValue, N destination) {
    LinkedDirectedGraphNode<N, E> src = getNodeOrFail(source);
    LinkedDirectedGraphNode<N, E> dest = getNodeOrFail(destination);
    LinkedDirectedGraphEdge<N, E> edge = new LinkedDirectedGraphEdge<>(src, edgeValue, dest);
    src.outEdges.add(edge);
    dest.inEdges.add(edge);
    return edge;
  }

  @Override
  public void disconnect(DiGraphEdge<N, E> edge) {
    LinkedDirectedGraphNode<N, E> src = getNodeOrFail(edge.getSource().getValue());
    LinkedDirectedGraphNode<N, E> dest = getNodeOrFail(edge.getDestination().getValue());
    src.outEdges.remove(edge);
    dest.inEdges.remove(edge);
  }

  @Override
  public void removeNode(N value) {
    LinkedDirectedGraphNode<N, E> node = getNodeOrFail(value);
    for (DiGraphEdge<N, E> edge : ImmutableList.copyOf(node.outEdges)) {
      disconnect(edge);
    }
    for (DiGraphEdge<N, E> edge : ImmutableList.copyOf(node.inEdges)) {
      disconnect(edge);
    }
    nodes.remove(value);
  }

  @Override
  public Collection<LinkedDirectedGraphNode<N, E>> getNodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  @Override
  public int getNodeCount() {
    return nodes.size();
  }

  @Override
  public List<LinkedDirectedGraphEdge<N, E>> getEdges() {
    List<LinkedDirectedGraphEdge<N, E>> result = new ArrayList<>();
    for (LinkedDirectedGraphNode<N, E> node : nodes.values()) {
      result.addAll(node.outEdges);
    }
    return Collections.unmodifiableList(result);
  }

  @Override
  public List<LinkedDirectedGraphEdge<N, E>> getOutEdges(N value) {
    return Collections.unmodifiableList(getNodeOrFail(value).outEdges);
  }

  @Override
  public List<LinkedDirectedGraphEdge<N, E>> getInEdges(N value) {
    return Collections.unmodifiableList(getNodeOrFail(value).inEdges);
  }

  @Override
  public List<DiGraphNode<N, E>> getDirectedSuccNodes(DiGraphNode<N, E> n) {
    List<DiGraphNode<N, E>> result = new ArrayList<>();
    for (DiGraphEdge<N, E> edge : n.getOutEdges()) {
      result.add(edge.getDestination());
    }
    return result;
  }

  @Override
  public List<DiGraphNode<N, E>> getDirectedPredNodes(DiGraphNode<N, E> n) {
    List<DiGraphNode<N, E>> result = new ArrayList<>();
    for (DiGraphEdge<N, E> edge : n.getInEdges()) {
      result.add(edge.getSource());
    }
    return result;
  }

  @Override
  public boolean isConnectedInDirection(N source, N destination) {
    LinkedDirectedGraphNode<N, E> src = nodes.get(source);
    if (src == null) {
      return false;
    }
    for (DiGraphEdge<N, E> edge : src.outEdges) {
      if (Objects.equals(edge.getDestination().getValue(), destination)) {
        return true;
      }
    }
    return false;
  }

  /** A directed graph node that stores outgoing and incoming edges. */
  public static final class LinkedDirectedGraphNode<N, E> implements DiGraphNode<N, E> {
    private final N value;
    private final List<LinkedDirectedGraphEdge<N, E>> inEdges = new ArrayList<>();
    private final List<LinkedDirectedGraphEdge<N, E>> outEdges = new ArrayList<>();

    LinkedDirectedGraphNode(N value) {
      this.value = value;
    }

    @Override
    public N getValue() {
      return value;
    }

    @Override
    public List<LinkedDirectedGraphEdge<N, E>> getOutEdges() {
      return Collections.unmodifiableList(outEdges);
    }

    @Override
    public List<LinkedDirectedGraphEdge<N, E>> getInEdges() {
      return Collections.unmodifiableList(inEdges);
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  /** A directed graph edge. */
  public static final class LinkedDirectedGraphEdge<N, E> implements DiGraphEdge<N, E> {
    private final LinkedDirectedGraphNode<N, E> sourceNode;
    private final LinkedDirectedGraphNode<N, E> destNode;
    private final E value;

    LinkedDirectedGraphEdge(
        LinkedDirectedGraphNode<N, E> sourceNode,
        E edgeValue,
        LinkedDirectedGraphNode<N, E> destNode) {
      this.sourceNode = sourceNode;
      this.value = edgeValue;
      this.destNode = destNode;
    }

    @Override
    public E getValue() {
      return value;
    }

    @Override
    public LinkedDirectedGraphNode<N, E> getSource() {
      return sourceNode;
    }

    @Override
    public LinkedDirectedGraphNode<N, E> getDestination() {
      return destNode;
    }

    @Override
    public String toString() {
      return sourceNode + " -> " + destNode + " [" + value + "]";
    }
  }
}
