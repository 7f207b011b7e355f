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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class GraphDescriptionTest {

  private static GraphDescription diamond() {
    return GraphDescription.builder("C.f")
        .addVertex("B0", "entry", ImmutableSet.of("success", "revert"))
        .addVertex("B1", "success", ImmutableSet.of("success"))
        .addVertex("B2", "revert", ImmutableSet.of("revert"))
        .addVertex("B3", "unreachable();", ImmutableSet.of())
        .addEdge("B0", "B1", "x on_false")
        .addEdge("B0", "B2", "x on_true")
        .addEdge("B3", "B1", "uncond")
        .build();
  }

  @Test
  public void testGroups() {
    GraphDescription graph = diamond();
    assertThat(
            graph.getVertices("revert").stream()
                .map(GraphDescription.Vertex::id)
                .collect(toImmutableList()))
        .containsExactly("B0", "B2")
        .inOrder();
    assertThat(graph.getEdges("success"))
        .containsExactly(new GraphDescription.Edge("B0", "B1", "x on_false"));
    assertThat(graph.getEdges("nothing")).isEmpty();
    assertThat(graph.getVertices()).hasSize(4);
  }

  @Test
  public void testRejectsDanglingEdges() {
    GraphDescription.Builder builder =
        GraphDescription.builder("g").addVertex("a", "a", ImmutableList.of());
    assertThrows(IllegalArgumentException.class, () -> builder.addEdge("a", "b", ""));
    assertThrows(
        IllegalArgumentException.class, () -> builder.addVertex("a", "again", ImmutableList.of()));
  }

  @Test
  public void testToDot() {
    assertThat(DotFormatter.toDot(diamond()))
        .isEqualTo(
            "digraph  \"C.f\" {\n"
                + "  node [color=lightblue2, style=filled];\n"
                + "  \"B0\" [label=\"entry\" color=\"lightblue2\"];\n"
                + "  \"B1\" [label=\"success\" color=\"lightblue2\"];\n"
                + "  \"B2\" [label=\"revert\" color=\"salmon\"];\n"
                + "  \"B3\" [label=\"unreachable();\" color=\"lightblue2\"];\n"
                + "  \"B0\" -> \"B1\" [label=\"x on_false\"];\n"
                + "  \"B0\" -> \"B2\" [label=\"x on_true\"];\n"
                + "  \"B3\" -> \"B1\" [label=\"uncond\"];\n"
                + "}\n");
  }

  @Test
  public void testToDotEscapesLabels() {
    GraphDescription graph =
        GraphDescription.builder("g")
            .addVertex("a", "require(s == \"x\");\ng();", ImmutableList.of())
            .build();
    assertThat(graph.toString()).contains("[label=\"require(s == \\\"x\\\");\\ng();\"");
  }
}
