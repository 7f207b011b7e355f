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

import java.util.Collection;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A directed graph.
 *
 * @param <N> Value type that the graph node stores.
 * @param <E> Value type that the graph edge stores.
 */
public abstract class DiGraph<N, E> {

  /** A node in the graph. */
  public interface DiGraphNode<N, E> {
    N getValue();

    List<? extends DiGraphEdge<N, E>> getOutEdges();

    List<? extends DiGraphEdge<N, E>> getInEdges();
  }

  /** An edge in the graph. */
  public interface DiGraphEdge<N, E> {
    E getValue();

    DiGraphNode<N, E> getSource();

    DiGraphNode<N, E> getDestination();
  }

  public abstract Collection<? extends DiGraphNode<N, E>> getNodes();

  public abstract List<? extends DiGraphEdge<N, E>> getEdges();

  public abstract int getNodeCount();

  /** Creates the node for {@code value}, or returns the existing one. */
  public abstract DiGraphNode<N, E> createNode(N value);

  public abstract @Nullable DiGraphNode<N, E> getNode(N value);

  public abstract boolean hasNode(N value);

  public abstract DiGraphEdge<N, E> connect(N source, E edgeValue, N destination);

  public abstract void disconnect(DiGraphEdge<N, E> edge);

  /** Removes the node and every edge touching it. */
  public abstract void removeNode(N value);

  public abstract List<? extends DiGraphEdge<N, E>> getOutEdges(N value);

  public abstract List<? extends DiGraphEdge<N, E>> getInEdges(N value);

  public abstract List<? extends DiGraphNode<N, E>> getDirectedSuccNodes(DiGraphNode<N, E> n);

  public abstract List<? extends DiGraphNode<N, E>> getDirectedPredNodes(DiGraphNode<N, E> n);

  /** Whether there is a direct edge from {@code source} to {@code destination}. */
  public abstract boolean isConnectedInDirection(N source, N destination);
}
