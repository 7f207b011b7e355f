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

import java.util.Arrays;
import java.util.List;

/**
 * <p>DotFormatter prints a {@link GraphDescription} as a dot file. For a detailed description of
 * the dot format and visualization tool refer to <a href="http://www.graphviz.org">Graphviz</a>.
 * </p>
 */
public final class DotFormatter {
  private static final String INDENT = "  ";
  private static final String ARROW = " -> ";

  private DotFormatter() {}

  /**
   * Outputs a string in DOT format that presents the graph. Vertices in the {@code revert} group
   * and in no other group are drawn in a separate color.
   *
   * @param graph Input graph.
   * @return A string in Dot format that presents the graph.
   */
  public static String toDot(GraphDescription graph) {
    StringBuilder builder = new StringBuilder();
    builder.append("digraph");
    builder.append(INDENT);
    builder.append(quote(graph.getName()));
    builder.append(" {\n");
    builder.append(INDENT);
    builder.append("node [color=lightblue2, style=filled];\n");

    List<GraphDescription.Vertex> vertices = graph.getVertices();
    String[] nodeNames = new String[vertices.size()];
    for (int i = 0; i < nodeNames.length; i++) {
      GraphDescription.Vertex v = vertices.get(i);
      String color =
          v.groups().size() == 1 && v.groups().contains("revert") ? "salmon" : "lightblue2";
      nodeNames[i] = quote(v.id()) + " [label=" + quote(v.label()) + " color=\"" + color + "\"]";
    }

    // We sort the nodes so we get a deterministic output every time regardless
    // of the implementation of the graph data structure.
    Arrays.sort(nodeNames);
    for (String nodeName : nodeNames) {
      builder.append(INDENT);
      builder.append(nodeName);
      builder.append(";\n");
    }

    List<GraphDescription.Edge> edges = graph.getEdges();
    String[] edgeNames = new String[edges.size()];
    for (int i = 0; i < edgeNames.length; i++) {
      GraphDescription.Edge edge = edges.get(i);
      edgeNames[i] =
          quote(edge.source()) + ARROW + quote(edge.target()) + " [label=" + quote(edge.label())
              + "]";
    }
    Arrays.sort(edgeNames);
    for (String edgeName : edgeNames) {
      builder.append(INDENT);
      builder.append(edgeName);
      builder.append(";\n");
    }

    builder.append("}\n");
    return builder.toString();
  }

  private static String quote(String s) {
    return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
  }
}
