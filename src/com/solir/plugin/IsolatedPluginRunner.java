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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Throwables.throwIfInstanceOf;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import com.solir.compiler.CancellationToken;
import com.solir.compiler.CompilerOptions;
import com.solir.compiler.ForestSnapshot;
import com.solir.compiler.NodeUtil;
import com.solir.compiler.ProjectBuild;
import com.solir.ir.Node;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Runs the plugin engine on a worker thread against a serialized copy of the build.
 *
 * <p>The worker only sees the files it walks and the files their references point into, copied
 * through a {@link ForestSnapshot}. Findings and failures are mapped back onto the nodes of the
 * original build. A run that exceeds {@link CompilerOptions#getPluginTimeout} is cancelled, and
 * the worker thread is abandoned and replaced.
 *
 * <p>The plugins of an abandoned run may still be executing on the old thread, so they are never
 * run again. A runner backed by a registry or a factory replaces them with new instances before the
 * next run. A runner over a fixed list leaves them out of later runs.
 *
 * <p>The worker shares the host JVM. A plugin that ignores interruption keeps its abandoned thread
 * busy, and a plugin that exhausts the heap or exits the JVM takes the host with it.
 */
public final class IsolatedPluginRunner implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(IsolatedPluginRunner.class.getName());

  static final long WORKER_STACK_SIZE = 1 << 26;

  private final @Nullable PluginRegistry registry;
  private final @Nullable Supplier<? extends List<Plugin>> factory;
  private final CompilerOptions options;

  @GuardedBy("this")
  private ImmutableList<Plugin> instances;

  // Plugins held by abandoned runs, compared by identity.
  @GuardedBy("this")
  private final Set<Plugin> abandoned = Sets.newIdentityHashSet();

  @GuardedBy("this")
  private ExecutorService worker = newWorker();

  /** A runner over a fixed list of plugins. */
  public IsolatedPluginRunner(List<Plugin> plugins, CompilerOptions options) {
    this.registry = null;
    this.factory = null;
    this.instances = ImmutableList.copyOf(plugins);
    this.options = checkNotNull(options);
  }

  /**
   * A runner over plugins created by {@code factory}, which is called once now and again whenever
   * a run is abandoned.
   */
  public IsolatedPluginRunner(Supplier<? extends List<Plugin>> factory, CompilerOptions options) {
    this.registry = null;
    this.factory = checkNotNull(factory);
    this.instances = ImmutableList.copyOf(factory.get());
    this.options = checkNotNull(options);
  }

  /**
   * A runner over whatever plugins the registry resolves at the start of each run. The registry is
   * refreshed first, so that plugins whose source changed are reloaded.
   */
  public IsolatedPluginRunner(PluginRegistry registry, CompilerOptions options) {
    this.registry = checkNotNull(registry);
    this.factory = null;
    this.instances = ImmutableList.of();
    this.options = checkNotNull(options);
  }

  private static ExecutorService newWorker() {
    return Executors.newSingleThreadExecutor(
        new ThreadFactory() {
          @Override
          public Thread newThread(Runnable r) {
            Thread t = new Thread(null, r, "solir-plugin-worker", WORKER_STACK_SIZE);
            t.setDaemon(true);
            return t;
          }
        });
  }

  /**
   * Runs the plugins over the source units of {@code build} selected by {@code scope}.
   *
   * @throws TimeoutException if the run did not finish within the plugin timeout
   */
  public EngineResult run(ProjectBuild build, VisitScope scope) throws TimeoutException {
    Set<String> walked = new LinkedHashSet<>();
    for (String path : build.getSourceUnits().keySet()) {
      if (scope.includes(path)) {
        walked.add(path);
      }
    }
    String json = ForestSnapshot.capture(build, walked).toJson();
    ImmutableList<Plugin> selected = selectPlugins();
    CancellationToken token = CancellationToken.create();
    Duration timeout = options.getPluginTimeout();

    Future<Isolated> future;
    synchronized (this) {
      future =
          worker.submit(
              () -> {
                ForestSnapshot snapshot = ForestSnapshot.fromJson(json);
                ProjectBuild copy = snapshot.restore();
                EngineResult result =
                    new PluginEngine(selected, options)
                        .run(copy, VisitScope.paths(snapshot.getWalkedPaths()), token);
                return new Isolated(copy, result);
              });
    }

    Isolated isolated;
    try {
      isolated = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      token.cancel();
      future.cancel(true);
      abandon(selected);
      logger.severe("Plugin run over " + walked + " timed out after " + timeout);
      throw e;
    } catch (InterruptedException e) {
      token.cancel();
      future.cancel(true);
      abandon(selected);
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for plugins", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      throwIfInstanceOf(cause, RuntimeException.class);
      // The engine only lets errors escape that leave the plugins in an unknown state.
      abandon(selected);
      throw new IllegalStateException("Plugin worker failed", cause);
    }
    return new NodeMapping(isolated.build, build).translate(isolated.result);
  }

  /** The plugins for the next run, leaving out instances held by abandoned runs. */
  private synchronized ImmutableList<Plugin> selectPlugins() {
    List<Plugin> candidates;
    if (registry != null) {
      registry.refresh();
      candidates = registry.getPlugins();
    } else {
      candidates = instances;
    }
    ImmutableList.Builder<Plugin> selected = ImmutableList.builder();
    for (Plugin plugin : candidates) {
      if (abandoned.contains(plugin)) {
        logger.warning("Skipping plugin " + plugin.getClass().getName() + " of an abandoned run");
      } else {
        selected.add(plugin);
      }
    }
    return selected.build();
  }

  /** Replaces the worker and the plugin instances an unfinished run may still be using. */
  private synchronized void abandon(ImmutableList<Plugin> plugins) {
    worker.shutdownNow();
    worker = newWorker();
    abandoned.addAll(plugins);
    if (registry != null) {
      registry.reinstantiate(plugins);
    } else if (factory != null) {
      try {
        instances = ImmutableList.copyOf(factory.get());
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Cannot recreate plugins", e);
      }
    }
  }

  @Override
  public synchronized void close() {
    worker.shutdownNow();
  }

  private static final class Isolated {
    final ProjectBuild build;
    final EngineResult result;

    Isolated(ProjectBuild build, EngineResult result) {
      this.build = build;
      this.result = result;
    }
  }

  /** Pairs the nodes of a restored copy with the nodes of the build it was captured from. */
  private static final class NodeMapping {
    private final Map<Node, Node> originals = new LinkedHashMap<>();

    NodeMapping(ProjectBuild copy, ProjectBuild original) {
      for (Map.Entry<String, Node> unit : copy.getSourceUnits().entrySet()) {
        Node originalUnit = original.getSourceUnit(unit.getKey());
        if (originalUnit == null) {
          continue;
        }
        List<Node> copied = preOrder(unit.getValue());
        List<Node> originalNodes = preOrder(originalUnit);
        for (int i = 0; i < copied.size() && i < originalNodes.size(); i++) {
          originals.put(copied.get(i), originalNodes.get(i));
        }
      }
    }

    private static List<Node> preOrder(Node root) {
      List<Node> nodes = new ArrayList<>();
      NodeUtil.visitPreOrder(root, nodes::add);
      return nodes;
    }

    private Node map(Node copy) {
      Node original = originals.get(copy);
      return original != null ? original : copy;
    }

    private @Nullable Node mapNullable(@Nullable Node copy) {
      return copy == null ? null : map(copy);
    }

    Finding translate(Finding finding) {
      ImmutableList.Builder<Finding> related = ImmutableList.builder();
      for (Finding subfinding : finding.subfindings()) {
        related.add(translate(subfinding));
      }
      return new Finding(
          map(finding.node()),
          finding.message(),
          finding.impact(),
          finding.confidence(),
          related.build(),
          finding.uri());
    }

    EngineResult translate(EngineResult result) {
      ImmutableListMultimap.Builder<String, Finding> findings = ImmutableListMultimap.builder();
      for (Map.Entry<String, Finding> entry : result.findings().entries()) {
        findings.put(entry.getKey(), translate(entry.getValue()));
      }
      ImmutableList.Builder<PluginFailure> failures = ImmutableList.builder();
      for (PluginFailure failure : result.failures()) {
        failures.add(
            new PluginFailure(
                failure.pluginName(),
                failure.state(),
                mapNullable(failure.node()),
                failure.exception()));
      }
      return new EngineResult(
          findings.build(),
          failures.build(),
          result.errors(),
          ImmutableSet.copyOf(result.walkedPaths()),
          result.suppressedCount());
    }
  }
}
