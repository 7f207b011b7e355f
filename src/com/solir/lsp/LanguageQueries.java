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

package com.solir.lsp;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.solir.compiler.BasicBlock;
import com.solir.compiler.BuildService;
import com.solir.compiler.CompilerOptions;
import com.solir.compiler.ControlFlowGraph;
import com.solir.compiler.ControlFlowGraph.Branch;
import com.solir.compiler.NodeUtil;
import com.solir.compiler.ProjectBuild;
import com.solir.compiler.Reference;
import com.solir.compiler.SourceLinks;
import com.solir.compiler.graph.DiGraph.DiGraphEdge;
import com.solir.compiler.graph.GraphDescription;
import com.solir.ir.Node;
import com.solir.ir.SourceFile;
import com.solir.ir.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * The queries a language server front end asks of the latest build.
 *
 * <p>Each query reads the build once, so an answer never mixes two builds. Queries issued before
 * the first build is published return null or nothing.
 */
public final class LanguageQueries {
  /** Group of the blocks on a path to the success exit. */
  public static final String SUCCESS_GROUP = "success";

  /** Group of the blocks on a path to the revert exit. */
  public static final String REVERT_GROUP = "revert";

  private final Supplier<@Nullable ProjectBuild> builds;
  private final CompilerOptions options;

  public LanguageQueries(BuildService service, CompilerOptions options) {
    checkNotNull(service);
    this.builds = service::getCurrentBuild;
    this.options = checkNotNull(options);
  }

  public LanguageQueries(ProjectBuild build, CompilerOptions options) {
    checkNotNull(build);
    this.builds = () -> build;
    this.options = checkNotNull(options);
  }

  /**
   * Returns the declaration at a byte offset of a file: the declaration itself when the position
   * is on one, or the target of the innermost resolved reference around the position.
   */
  public @Nullable Node declarationAt(String path, int offset) {
    ProjectBuild build = builds.get();
    if (build == null) {
      return null;
    }
    Node unit = build.getSourceUnit(path);
    if (unit == null) {
      return null;
    }
    Node n = NodeUtil.getInnermostNodeAt(unit, offset);
    for (; n != null; n = n.getParent()) {
      Reference reference = build.getReference(n);
      if (reference != null && reference.getTarget() != null) {
        return reference.getTarget();
      }
      if (NodeUtil.isDeclaration(n)) {
        return n;
      }
    }
    return null;
  }

  /** Like {@link #declarationAt(String, int)} for a one-based line and zero-based column. */
  public @Nullable Node declarationAt(String path, int line, int column) {
    ProjectBuild build = builds.get();
    Node unit = build == null ? null : build.getSourceUnit(path);
    SourceFile file = unit == null ? null : unit.getSourceFile();
    if (file == null || line < 1 || line > file.getNumLines()) {
      return null;
    }
    return declarationAt(path, file.getOffset(line, column));
  }

  /** Every node that refers to {@code declaration}, across all files of the build. */
  public ImmutableList<Node> findReferences(Node declaration) {
    ProjectBuild build = builds.get();
    return build == null ? ImmutableList.of() : build.getReferencesTo(declaration);
  }

  /** Every function, modifier or variable that overrides {@code declaration}. */
  public ImmutableSet<Node> findImplementations(Node declaration) {
    ProjectBuild build = builds.get();
    return build == null ? ImmutableSet.of() : build.getOverriders(declaration);
  }

  /**
   * Describes the control flow graph of a function or modifier. Blocks are grouped into {@link
   * #SUCCESS_GROUP} and {@link #REVERT_GROUP} by the exits they can reach; unreachable blocks
   * belong to neither.
   */
  public @Nullable GraphDescription controlFlowGraph(Node declaration) {
    ProjectBuild build = builds.get();
    ControlFlowGraph cfg = build == null ? null : build.getControlFlowGraph(declaration);
    if (cfg == null) {
      return null;
    }
    ImmutableSet<BasicBlock> success = cfg.getSuccessBlocks();
    ImmutableSet<BasicBlock> revert = cfg.getRevertBlocks();
    GraphDescription.Builder graph =
        GraphDescription.builder(NodeUtil.getCanonicalName(declaration));
    for (BasicBlock block : cfg.getBlocks()) {
      List<String> groups = new ArrayList<>();
      if (success.contains(block)) {
        groups.add(SUCCESS_GROUP);
      }
      if (revert.contains(block)) {
        groups.add(REVERT_GROUP);
      }
      graph.addVertex(vertexId(block), describe(cfg, block), groups);
    }
    for (DiGraphEdge<BasicBlock, Branch> edge : cfg.getEdges()) {
      BasicBlock source = edge.getSource().getValue();
      graph.addEdge(
          vertexId(source),
          vertexId(edge.getDestination().getValue()),
          describe(edge.getValue(), source.getControlStatement()));
    }
    return graph.build();
  }

  /** An editor link to {@code n}, or null if its location is unknown. */
  public @Nullable String locationLink(Node n) {
    return SourceLinks.forNode(options.getLinkFormat(), n);
  }

  /** An editor link to a one-based line and column of a file. */
  public String locationLink(String path, int line, int column) {
    return SourceLinks.format(options.getLinkFormat(), path, line, column);
  }

  private static String vertexId(BasicBlock block) {
    return "B" + block.getId();
  }

  private static String describe(ControlFlowGraph cfg, BasicBlock block) {
    if (block == cfg.getEntry() && block.isEmpty()) {
      return "entry";
    } else if (block == cfg.getSuccessExit()) {
      return SUCCESS_GROUP;
    } else if (block == cfg.getRevertExit()) {
      return REVERT_GROUP;
    }
    List<String> lines = new ArrayList<>();
    for (Node statement : block.getStatements()) {
      lines.add(sourceOf(statement));
    }
    Node control = block.getControlStatement();
    if (control != null && !block.getStatements().contains(control)) {
      lines.add(sourceOf(control));
    }
    return lines.isEmpty() ? block.toString() : Joiner.on('\n').join(lines);
  }

  private static String describe(Branch branch, @Nullable Node control) {
    String label = Ascii.toLowerCase(branch.name());
    Node condition = control == null || !branch.isConditional() ? null : conditionOf(control);
    return condition == null ? label : sourceOf(condition) + " " + label;
  }

  private static @Nullable Node conditionOf(Node control) {
    if (control.getToken() == Token.IF_STATEMENT
        || control.getToken() == Token.YUL_IF
        || NodeUtil.isLoopStructure(control)) {
      Node condition = NodeUtil.getConditionExpression(control);
      return condition.isEmpty() ? null : condition;
    }
    if (control.getToken() == Token.EXPRESSION_STATEMENT) {
      return control.getFirstChild();
    }
    return null;
  }

  private static String sourceOf(Node n) {
    String text = n.getSourceText();
    if (text == null) {
      return n.getToken().toString();
    }
    int newline = text.indexOf('\n');
    return newline < 0 ? text : text.substring(0, newline) + " ...";
  }
}
