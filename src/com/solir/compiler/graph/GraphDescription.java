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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A rendering-neutral description of a directed graph: labelled vertices that may belong to named
 * groups, and labelled edges between them.
 */
public final class GraphDescription {

  /**
   * A vertex.
   *
   * @param id Identifier unique within the graph.
   * @param label Text describing the vertex.
   * @param groups Names of the subgraphs the vertex belongs to.
   */
  public record Vertex(String id, String label, ImmutableSet<String> groups) {
    public Vertex {
      requireNonNull(id, "id");
      requireNonNull(label, "label");
      requireNonNull(groups, "groups");
    }
  }

  /** A directed edge between two vertex ids. */
  public record Edge(String source, String target, String label) {
    public Edge {
      requireNonNull(source, "source");
      requireNonNull(target, "target");
      requireNonNull(label, "label");
    }
  }

  private final String name;
  private final ImmutableList<Vertex> vertices;
  private final ImmutableList<Edge> edges;

  private GraphDescription(String name, ImmutableList<Vertex> vertices, ImmutableList<Edge> edges) {
    this.name = name;
    this.vertices = vertices;
    this.edges = edges;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Vertex> getVertices() {
    return vertices;
  }

  public ImmutableList<Edge> getEdges() {
    return edges;
  }

  /** Returns the vertices that belong to the given group. */
  public ImmutableList<Vertex> getVertices(String group) {
    return vertices.stream()
        .filter(v -> v.groups().contains(group))
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the edges whose both ends belong to the given group. */
  public ImmutableList<Edge> getEdges(String group) {
    ImmutableSet<String> ids =
        getVertices(group).stream().map(Vertex::id).collect(ImmutableSet.toImmutableSet());
    return edges.stream()
        .filter(e -> ids.contains(e.source()) && ids.contains(e.target()))
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public String toString() {
    return DotFormatter.toDot(this);
  }

  /** Builder for {@link GraphDescription}. */
  public static final class Builder {
    private final String name;
    private final Map<String, Vertex> vertices = new LinkedHashMap<>();
    private final ImmutableList.Builder<Edge> edges = ImmutableList.builder();

    private Builder(String name) {
      this.name = name;
    }

    @CanIgnoreReturnValue
    public Builder addVertex(String id, String label, Iterable<String> groups) {
      checkArgument(!vertices.containsKey(id), "Duplicate vertex %s", id);
      vertices.put(id, new Vertex(id, label, ImmutableSet.copyOf(groups)));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addEdge(String source, String target, String label) {
      checkArgument(vertices.containsKey(source), "Unknown vertex %s", source);
      checkArgument(vertices.containsKey(target), "Unknown vertex %s", target);
      edges.add(new Edge(source, target, label));
      return this;
    }

    public GraphDescription build() {
      return new GraphDescription(name, ImmutableList.copyOf(vertices.values()), edges.build());
    }
  }
}
