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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.solir.compiler.graph.DiGraph.DiGraphEdge;
import com.solir.compiler.graph.LinkedDirectedGraph;
import com.solir.ir.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Control flow graph of a single function or modifier body.
 *
 * <p>Every graph has a single entry block and two terminal blocks: one reached when execution
 * returns normally and one reached when it reverts. A function whose body is empty has a graph
 * where the entry and the success exit are the same block.
 *
 * <p>Blocks that cannot be reached from the entry are kept in the graph, so that statements after
 * a {@code return} or {@code revert} still belong to some block.
 */
public final class ControlFlowGraph
    extends LinkedDirectedGraph<BasicBlock, ControlFlowGraph.Branch> {

  /** The label on an edge. */
  public enum Branch {
    /** Unconditional branch. */
    UNCOND,
    /** The condition evaluated to true. */
    ON_TRUE,
    /** The condition evaluated to false. */
    ON_FALSE,
    /** From the end of a loop body back to its header. */
    LOOP_BACK,
    /** A revert, failed {@code require} or failed {@code assert}. */
    ON_REVERT,
    /** The external call of a try statement returned. */
    TRY_SUCCEEDED,
    /** The external call reverted with an {@code Error(string)} reason. */
    TRY_REVERTED,
    /** The external call failed with a {@code Panic(uint256)} code. */
    TRY_PANICKED,
    /** The external call failed in any other way. */
    TRY_FAILED,
    /** A switch case matched. */
    SWITCH_MATCHED,
    /** No switch case matched. */
    SWITCH_DEFAULT;

    public boolean isConditional() {
      return this != UNCOND && this != LOOP_BACK;
    }
  }

  private final Node root;
  private final BasicBlock entry;
  private final BasicBlock successExit;
  private final BasicBlock revertExit;
  private ImmutableMap<Node, BasicBlock> blockByStatement = ImmutableMap.of();

  ControlFlowGraph(Node root, BasicBlock entry, BasicBlock successExit, BasicBlock revertExit) {
    this.root = root;
    this.entry = entry;
    this.successExit = successExit;
    this.revertExit = revertExit;
    createNode(entry);
    createNode(successExit);
    createNode(revertExit);
  }

  void indexStatements() {
    ImmutableMap.Builder<Node, BasicBlock> builder = ImmutableMap.builder();
    for (LinkedDirectedGraphNode<BasicBlock, Branch> node : getNodes()) {
      BasicBlock block = node.getValue();
      for (Node statement : block.getStatements()) {
        builder.put(statement, block);
      }
      if (block.getControlStatement() != null) {
        builder.put(block.getControlStatement(), block);
      }
    }
    blockByStatement = builder.buildOrThrow();
  }

  /** The function or modifier this graph was computed for. */
  public Node getRoot() {
    return root;
  }

  public BasicBlock getEntry() {
    return entry;
  }

  public BasicBlock getSuccessExit() {
    return successExit;
  }

  public BasicBlock getRevertExit() {
    return revertExit;
  }

  public ImmutableList<BasicBlock> getBlocks() {
    ImmutableList.Builder<BasicBlock> blocks = ImmutableList.builder();
    for (LinkedDirectedGraphNode<BasicBlock, Branch> node : getNodes()) {
      blocks.add(node.getValue());
    }
    return blocks.build();
  }

  /** Returns the block holding {@code statement}, or null if it is not part of this graph. */
  public @Nullable BasicBlock getBlock(Node statement) {
    return blockByStatement.get(statement);
  }

  /** Blocks on some path from the entry to the success exit. */
  public ImmutableSet<BasicBlock> getSuccessBlocks() {
    return blocksOnPathsTo(successExit);
  }

  /** Blocks on some path from the entry to the revert exit. Empty if no path reverts. */
  public ImmutableSet<BasicBlock> getRevertBlocks() {
    return blocksOnPathsTo(revertExit);
  }

  /** The subgraph induced by {@link #getSuccessBlocks}. */
  public LinkedDirectedGraph<BasicBlock, Branch> getSuccessGraph() {
    return inducedSubgraph(getSuccessBlocks());
  }

  /** The subgraph induced by {@link #getRevertBlocks}. */
  public LinkedDirectedGraph<BasicBlock, Branch> getRevertGraph() {
    return inducedSubgraph(getRevertBlocks());
  }

  /** Blocks holding code that no path from the entry reaches. */
  public ImmutableList<BasicBlock> getUnreachableBlocks() {
    Set<BasicBlock> reachable = forwardClosure(entry);
    ImmutableList.Builder<BasicBlock> result = ImmutableList.builder();
    for (BasicBlock block : getBlocks()) {
      if (!reachable.contains(block) && block != successExit && block != revertExit) {
        result.add(block);
      }
    }
    return result.build();
  }

  /** Whether there is a path of one or more edges from {@code from} to {@code to}. */
  public boolean hasPath(BasicBlock from, BasicBlock to) {
    for (DiGraphEdge<BasicBlock, Branch> edge : getOutEdges(from)) {
      if (forwardClosure(edge.getDestination().getValue()).contains(to)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Whether {@code to} may execute after {@code from} in the same invocation. Statements in the
   * same block are ordered by position, unless the block lies on a cycle.
   */
  public boolean isReachable(Node from, Node to) {
    BasicBlock fromBlock = getBlock(from);
    BasicBlock toBlock = getBlock(to);
    checkArgument(fromBlock != null, "%s is not part of this graph", from);
    checkArgument(toBlock != null, "%s is not part of this graph", to);
    if (fromBlock != toBlock) {
      return hasPath(fromBlock, toBlock);
    }
    if (to == toBlock.getControlStatement()) {
      return true;
    }
    if (from == fromBlock.getControlStatement()) {
      return hasPath(fromBlock, fromBlock);
    }
    return fromBlock.indexOf(from) <= toBlock.indexOf(to) || hasPath(fromBlock, fromBlock);
  }

  private ImmutableSet<BasicBlock> blocksOnPathsTo(BasicBlock exit) {
    Set<BasicBlock> forward = forwardClosure(entry);
    if (!forward.contains(exit)) {
      return ImmutableSet.of();
    }
    Set<BasicBlock> backward = backwardClosure(exit);
    ImmutableSet.Builder<BasicBlock> result = ImmutableSet.builder();
    for (BasicBlock block : forward) {
      if (backward.contains(block)) {
        result.add(block);
      }
    }
    return result.build();
  }

  private Set<BasicBlock> forwardClosure(BasicBlock start) {
    Set<BasicBlock> seen = new LinkedHashSet<>();
    Deque<BasicBlock> worklist = new ArrayDeque<>();
    worklist.add(start);
    while (!worklist.isEmpty()) {
      BasicBlock block = worklist.remove();
      if (seen.add(block)) {
        for (DiGraphEdge<BasicBlock, Branch> edge : getOutEdges(block)) {
          worklist.add(edge.getDestination().getValue());
        }
      }
    }
    return seen;
  }

  private Set<BasicBlock> backwardClosure(BasicBlock start) {
    Set<BasicBlock> seen = new LinkedHashSet<>();
    Deque<BasicBlock> worklist = new ArrayDeque<>();
    worklist.add(start);
    while (!worklist.isEmpty()) {
      BasicBlock block = worklist.remove();
      if (seen.add(block)) {
        for (DiGraphEdge<BasicBlock, Branch> edge : getInEdges(block)) {
          worklist.add(edge.getSource().getValue());
        }
      }
    }
    return seen;
  }

  private LinkedDirectedGraph<BasicBlock, Branch> inducedSubgraph(Set<BasicBlock> blocks) {
    LinkedDirectedGraph<BasicBlock, Branch> graph = LinkedDirectedGraph.create();
    for (BasicBlock block : blocks) {
      graph.createNode(block);
    }
    for (BasicBlock block : blocks) {
      for (DiGraphEdge<BasicBlock, Branch> edge : getOutEdges(block)) {
        BasicBlock destination = edge.getDestination().getValue();
        if (blocks.contains(destination)) {
          graph.connect(block, edge.getValue(), destination);
        }
      }
    }
    return graph;
  }

  @Override
  public String toString() {
    return "ControlFlowGraph("
        + NodeUtil.getCanonicalName(root)
        + ", "
        + getNodeCount()
        + " blocks)";
  }
}
