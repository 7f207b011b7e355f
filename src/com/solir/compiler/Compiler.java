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
import com.google.common.collect.ImmutableSetMultimap;
import com.solir.ir.Node;
import com.solir.ir.Node.Prop;
import com.solir.ir.Token;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Turns the AST documents of one or more compilation runs into a {@link ProjectBuild}.
 *
 * <p>The passes run in order on the calling thread: tree building, alias table construction,
 * reference resolution and control flow analysis. Each file is decoded from the first run that
 * supplies it. The other runs only contribute their ids to the alias table, so that their hints
 * can still be translated.
 *
 * <p>An incremental build takes the previous build and the set of changed paths. Changed, new and
 * removed files and, transitively, the files importing them are rebuilt. Every other source unit is
 * shared with the previous build.
 */
public final class Compiler {
  private static final Logger logger = Logger.getLogger(Compiler.class.getName());

  public static final DiagnosticType STRUCTURAL_DECODE_ERROR =
      DiagnosticType.error("SOLIR_STRUCTURAL_DECODE_ERROR", "Cannot decode {0}: {1}");

  // Makes the hint scopes of successive builds distinct, as run ids are chosen by callers.
  private static final AtomicLong buildSerial = new AtomicLong();

  private final CompilerOptions options;

  public Compiler(CompilerOptions options) {
    this.options = options;
  }

  public Compiler() {
    this(new CompilerOptions());
  }

  public CompilerOptions getOptions() {
    return options;
  }

  /** Builds every file of {@code runs} from scratch. */
  public ProjectBuild compile(List<CompilationRun> runs) {
    return compile(runs, null, ImmutableSet.of(), CancellationToken.create());
  }

  /**
   * Builds the files of {@code runs}, reusing the unaffected parts of {@code previous}.
   *
   * @param runs every run of the project, in order of preference
   * @param previous the build to reuse trees from, or null for a full build
   * @param changedPaths paths whose content changed since {@code previous}
   * @throws BuildCancelledException if {@code token} is cancelled before the build completes
   */
  public ProjectBuild compile(
      List<CompilationRun> runs,
      @Nullable ProjectBuild previous,
      Set<String> changedPaths,
      CancellationToken token) {
    checkArgument(!runs.isEmpty(), "Nothing to compile");
    long serial = buildSerial.incrementAndGet();
    ErrorManager errorManager = new LoggerErrorManager(logger);

    Set<String> allPaths = new LinkedHashSet<>();
    for (CompilationRun run : runs) {
      for (AstDocument doc : run.getDocuments()) {
        allPaths.add(doc.getPath());
      }
    }
    Set<String> affected = computeAffectedPaths(allPaths, previous, changedPaths);
    Set<String> rebuilt = new LinkedHashSet<>(affected);
    if (previous != null) {
      for (String path : previous.getSourceUnits().keySet()) {
        if (!allPaths.contains(path)) {
          rebuilt.add(path);
        }
      }
    }
    logger.fine(
        () -> "Build #" + serial + ": " + affected.size() + " of " + allPaths.size() + " files");

    // Tree building
    Map<String, Node> units = new LinkedHashMap<>();
    Set<String> attempted = new HashSet<>();
    DeclarationIndex declarations = new DeclarationIndex();
    List<Node> idOnlyTrees = new ArrayList<>();
    for (CompilationRun run : runs) {
      NodeIndex index = new NodeIndex(run.getRunId() + "@" + serial);
      for (AstDocument doc : run.getDocuments()) {
        token.throwIfCancelled();
        String path = doc.getPath();
        boolean canonical = affected.contains(path) && attempted.add(path);
        try {
          Node root = TreeBuilder.build(run, doc, index);
          if (canonical) {
            units.put(path, root);
          }
          declarations.addRunIds(index.getRunId(), root);
          if (!canonical) {
            idOnlyTrees.add(root);
          }
        } catch (StructuralDecodeException e) {
          if (canonical) {
            errorManager.report(
                IrError.builder(STRUCTURAL_DECODE_ERROR, path, e.getMessage())
                    .setSourceLocation(path, -1, -1)
                    .setCause(e)
                    .build());
          } else {
            logger.fine(() -> "Ignoring ids of " + path + " from " + run + ": " + e.getMessage());
          }
        }
      }
    }
    if (previous != null) {
      Set<String> inheritedScopes = new HashSet<>();
      for (Map.Entry<String, Node> entry : previous.getSourceUnits().entrySet()) {
        if (allPaths.contains(entry.getKey()) && !affected.contains(entry.getKey())) {
          Node unit = entry.getValue();
          units.put(entry.getKey(), unit);
          String scope = unit.getStringProp(Prop.RUN_ID);
          if (scope != null && inheritedScopes.add(scope)) {
            declarations.inheritRunIds(previous.getDeclarationIndex(), scope);
          }
        }
      }
    }
    ImmutableMap<String, Node> sourceUnits = sortByInputOrder(units, allPaths);
    for (Node unit : sourceUnits.values()) {
      declarations.addCanonicalTree(unit);
    }
    logger.fine(
        () -> idOnlyTrees.size() + " trees only contributed ids, "
            + declarations.size() + " declarations indexed");

    // Resolution
    ReferenceMap references = new ReferenceMap();
    ReferenceResolver resolver =
        new ReferenceResolver(
            sourceUnits,
            declarations,
            references,
            previous != null ? previous.getReferences() : null,
            rebuilt,
            errorManager,
            token);
    resolver.process();

    // Control flow
    Map<Node, ControlFlowGraph> cfgs = new LinkedHashMap<>();
    if (options.shouldComputeControlFlowGraphs()) {
      cfgs = computeControlFlowGraphs(sourceUnits, references, previous, rebuilt, token);
    }

    errorManager.generateReport();
    ProjectBuild build =
        new ProjectBuild(
            serial,
            sourceUnits,
            declarations,
            references,
            resolver.getLinearizations(),
            cfgs,
            buildImportGraph(sourceUnits),
            ImmutableSet.copyOf(rebuilt),
            errorManager);
    logger.fine(() -> "Finished " + build);
    return build;
  }

  private static Set<String> computeAffectedPaths(
      Set<String> allPaths, @Nullable ProjectBuild previous, Set<String> changedPaths) {
    if (previous == null) {
      return allPaths;
    }
    Set<String> affected = new LinkedHashSet<>();
    Deque<String> worklist = new ArrayDeque<>();
    for (String path : allPaths) {
      if (changedPaths.contains(path) || previous.getSourceUnit(path) == null) {
        worklist.add(path);
      }
    }
    for (String path : previous.getSourceUnits().keySet()) {
      if (!allPaths.contains(path) || changedPaths.contains(path)) {
        worklist.add(path);
      }
    }
    Set<String> seen = new HashSet<>();
    while (!worklist.isEmpty()) {
      String path = worklist.remove();
      if (!seen.add(path)) {
        continue;
      }
      if (allPaths.contains(path)) {
        affected.add(path);
      }
      worklist.addAll(previous.getImportedBy(path));
    }
    return affected;
  }

  private static ImmutableMap<String, Node> sortByInputOrder(
      Map<String, Node> units, Set<String> order) {
    ImmutableMap.Builder<String, Node> sorted = ImmutableMap.builder();
    for (String path : order) {
      Node unit = units.get(path);
      if (unit != null) {
        sorted.put(path, unit);
      }
    }
    return sorted.buildOrThrow();
  }

  static ImmutableSetMultimap<String, String> buildImportGraph(
      ImmutableMap<String, Node> sourceUnits) {
    ImmutableSetMultimap.Builder<String, String> imports = ImmutableSetMultimap.builder();
    for (Map.Entry<String, Node> entry : sourceUnits.entrySet()) {
      for (Node child : entry.getValue().children()) {
        if (child.getToken() == Token.IMPORT_DIRECTIVE) {
          String target = child.getStringProp(Prop.ABSOLUTE_PATH);
          if (target != null) {
            imports.put(entry.getKey(), target);
          }
        }
      }
    }
    return imports.build();
  }

  private Map<Node, ControlFlowGraph> computeControlFlowGraphs(
      ImmutableMap<String, Node> sourceUnits,
      ReferenceMap references,
      @Nullable ProjectBuild previous,
      Set<String> rebuilt,
      CancellationToken token) {
    Map<Node, ControlFlowGraph> cfgs = new LinkedHashMap<>();
    boolean heuristic = options.shouldTreatAlwaysRevertingCallsAsRevert();
    for (Map.Entry<String, Node> entry : sourceUnits.entrySet()) {
      token.throwIfCancelled();
      boolean retained = previous != null && !rebuilt.contains(entry.getKey());
      for (Node executable : executablesOf(entry.getValue())) {
        ControlFlowGraph cfg = retained ? previous.getControlFlowGraph(executable) : null;
        if (cfg == null || heuristic) {
          cfg = computeCfg(executable, references, declaration -> false);
        }
        cfgs.put(executable, cfg);
      }
    }
    if (!heuristic) {
      return cfgs;
    }

    Set<Node> alwaysReverting = new HashSet<>();
    for (ControlFlowGraph cfg : cfgs.values()) {
      if (cfg.getRoot().isFunctionDefinition() && cfg.getSuccessBlocks().isEmpty()) {
        alwaysReverting.add(cfg.getRoot());
      }
    }
    logger.fine(() -> alwaysReverting.size() + " functions never return normally");
    if (alwaysReverting.isEmpty()) {
      return cfgs;
    }
    Map<Node, ControlFlowGraph> refined = new LinkedHashMap<>();
    for (Node executable : cfgs.keySet()) {
      token.throwIfCancelled();
      refined.put(executable, computeCfg(executable, references, alwaysReverting::contains));
    }
    return refined;
  }

  static ControlFlowGraph computeCfg(
      Node executable, ReferenceMap references, Predicate<Node> alwaysReverts) {
    ControlFlowAnalysis analysis = new ControlFlowAnalysis(executable, references, alwaysReverts);
    analysis.process();
    return analysis.getCfg();
  }

  static ImmutableList<Node> executablesOf(Node unit) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    NodeUtil.visitPreOrder(
        unit,
        n -> {
          if (NodeUtil.isExecutable(n)) {
            result.add(n);
          }
        });
    return result.build();
  }
}
