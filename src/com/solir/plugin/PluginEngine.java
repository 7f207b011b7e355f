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

package com.solir.plugin;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.solir.compiler.CancellationToken;
import com.solir.compiler.CompilerOptions;
import com.solir.compiler.DiagnosticType;
import com.solir.compiler.ErrorManager;
import com.solir.compiler.IrError;
import com.solir.compiler.NodeTraversal;
import com.solir.compiler.NodeTraversal.AbstractPreOrderCallback;
import com.solir.compiler.ProjectBuild;
import com.solir.compiler.SortingErrorManager;
import com.solir.ir.Node;
import com.solir.ir.SourceFile;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Runs plugins over a build.
 *
 * <p>A run goes through the {@link EngineState}s in order. All plugins share a single pre-order
 * walk of the selected source units, and each node is offered to the plugins in registration
 * order. A plugin that throws is recorded as a {@link PluginFailure} and skipped for the rest of
 * the run. The other plugins are not affected. This covers errors as well as exceptions, including
 * a {@link StackOverflowError}; only the other {@link VirtualMachineError}s end the run.
 *
 * <p>An engine is not thread safe. Each run must finish before the next one starts.
 */
public final class PluginEngine {
  private static final Logger logger = Logger.getLogger(PluginEngine.class.getName());

  public static final DiagnosticType PLUGIN_EXECUTION_ERROR =
      DiagnosticType.error("SOLIR_PLUGIN_EXECUTION_ERROR", "Plugin {0} failed while {1}: {2}");

  private final ImmutableList<Plugin> plugins;
  private final CompilerOptions options;
  private volatile EngineState state = EngineState.DONE;

  public PluginEngine(List<Plugin> plugins, CompilerOptions options) {
    this.plugins = ImmutableList.copyOf(plugins);
    this.options = options;
  }

  public ImmutableList<Plugin> getPlugins() {
    return plugins;
  }

  /** The phase of the current run, or {@link EngineState#DONE} between runs. */
  public EngineState getState() {
    return state;
  }

  public EngineResult run(ProjectBuild build, VisitScope scope) {
    return run(build, scope, CancellationToken.create());
  }

  /**
   * Runs every plugin over the source units of {@code build} selected by {@code scope}.
   *
   * @throws com.solir.compiler.BuildCancelledException if {@code token} is cancelled between two
   *     source units
   */
  public EngineResult run(ProjectBuild build, VisitScope scope, CancellationToken token) {
    checkState(state == EngineState.DONE, "A run is already in progress");
    try {
      return new Run(build, scope, token).execute();
    } finally {
      state = EngineState.DONE;
    }
  }

  /** The state of one run. */
  private final class Run {
    private final ProjectBuild build;
    private final VisitScope scope;
    private final CancellationToken token;
    private final ErrorManager errorManager = new SortingErrorManager();
    private final List<PluginFailure> failures = new ArrayList<>();
    // Plugins still taking part in the run, with their capabilities.
    private final Map<Plugin, PluginCapabilities> active = new LinkedHashMap<>();
    private final Map<String, SuppressionComments> suppressions = new HashMap<>();

    Run(ProjectBuild build, VisitScope scope, CancellationToken token) {
      this.build = build;
      this.scope = scope;
      this.token = token;
    }

    EngineResult execute() {
      state = EngineState.CONFIGURING;
      PluginContext context = new PluginContext(build, scope, options);
      for (Plugin plugin : plugins) {
        try {
          plugin.beginRun(context);
          active.put(plugin, PluginCapabilities.of(plugin));
        } catch (Throwable e) {
          rethrowIfFatal(e);
          fail(plugin, null, e);
        }
      }

      state = EngineState.SCANNING;
      Map<String, Node> units = new LinkedHashMap<>();
      for (Map.Entry<String, Node> entry : build.getSourceUnits().entrySet()) {
        if (scope.includes(entry.getKey())) {
          units.put(entry.getKey(), entry.getValue());
        }
      }
      logger.fine(() -> "Walking " + units.size() + " source units with " + active.size()
          + " plugins");

      state = EngineState.DISPATCHING;
      NodeTraversal.builder()
          .setCancellationToken(token)
          .setCallback(
              new AbstractPreOrderCallback() {
                @Override
                public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
                  dispatch(n);
                  return true;
                }
              })
          .traverseRoots(units.values());

      state = EngineState.REPORTING;
      ImmutableListMultimap.Builder<String, Finding> findings = ImmutableListMultimap.builder();
      int suppressed = 0;
      for (Plugin plugin : ImmutableList.copyOf(active.keySet())) {
        List<Finding> reported;
        try {
          reported = plugin.report();
        } catch (Throwable e) {
          rethrowIfFatal(e);
          fail(plugin, null, e);
          continue;
        }
        for (Finding finding : reported) {
          if (isSuppressed(safeName(plugin), finding.node())) {
            suppressed++;
          } else {
            findings.put(safeName(plugin), finding);
          }
        }
      }
      state = EngineState.DONE;
      return new EngineResult(
          findings.build(),
          ImmutableList.copyOf(failures),
          errorManager.getErrors(),
          ImmutableSet.copyOf(units.keySet()),
          suppressed);
    }

    private void dispatch(Node n) {
      if (active.isEmpty()) {
        return;
      }
      for (Map.Entry<Plugin, PluginCapabilities> entry :
          ImmutableList.copyOf(active.entrySet())) {
        PluginCapabilities capabilities = entry.getValue();
        if (!capabilities.handles(n.getToken())) {
          continue;
        }
        try {
          capabilities.dispatch(entry.getKey(), n);
        } catch (Throwable e) {
          rethrowIfFatal(e);
          fail(entry.getKey(), n, e);
        }
      }
    }

    private void fail(Plugin plugin, @Nullable Node n, Throwable e) {
      active.remove(plugin);
      String name = safeName(plugin);
      PluginFailure failure = new PluginFailure(name, state, n, e);
      failures.add(failure);
      logger.log(Level.SEVERE, failure.toString(), e);
      IrError.Builder error =
          IrError.builder(PLUGIN_EXECUTION_ERROR, name, state, e).setCause(e);
      if (n != null && n.getSourceFileName() != null) {
        error.setNode(n);
      }
      errorManager.report(error.build());
    }

    private boolean isSuppressed(String pluginName, Node node) {
      String path = node.getSourceFileName();
      SourceFile file = node.getSourceFile();
      if (path == null || file == null) {
        return false;
      }
      return suppressions
          .computeIfAbsent(path, p -> SuppressionComments.parse(file))
          .isSuppressed(pluginName, node);
    }
  }

  /** Lets errors the JVM cannot recover from escape. A stack overflow unwinds cleanly. */
  static void rethrowIfFatal(Throwable e) {
    if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
      throw (VirtualMachineError) e;
    }
  }

  private static String safeName(Plugin plugin) {
    try {
      return plugin.name();
    } catch (RuntimeException e) {
      return plugin.getClass().getName();
    }
  }
}
