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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Keeps the current {@link ProjectBuild} of a long-lived session up to date.
 *
 * <p>Requests are debounced: a request starts only after no newer request arrived for the
 * configured delay. A newer request supersedes older ones. A pending request is dropped, and a
 * running build is cancelled through its {@link CancellationToken}. Only the result of the latest
 * request is ever published, by swapping it into the current build in one step.
 *
 * <p>Builds run one at a time on a dedicated daemon thread with a large stack.
 */
public final class BuildService implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BuildService.class.getName());

  // Tree building and resolution recurse over the depth of the tree.
  static final long BUILD_STACK_SIZE = 1 << 26;

  private final Compiler compiler;
  private final ScheduledExecutorService executor;
  private final AtomicReference<ProjectBuild> current = new AtomicReference<>();
  private final List<Consumer<ProjectBuild>> listeners = new CopyOnWriteArrayList<>();

  private final Object lock = new Object();

  @GuardedBy("lock")
  private long generation;

  // Paths changed since the current build was published.
  @GuardedBy("lock")
  private final Set<String> pendingChanges = new LinkedHashSet<>();

  @GuardedBy("lock")
  private boolean fullBuildRequested;

  @GuardedBy("lock")
  private @Nullable Request pending;

  @GuardedBy("lock")
  private @Nullable Request running;

  /** One call to {@link #requestBuild}. */
  private static final class Request {
    final long generation;
    final ImmutableList<CompilationRun> runs;
    final CancellationToken token = CancellationToken.create();
    final SettableFuture<ProjectBuild> result = SettableFuture.create();
    @Nullable ScheduledFuture<?> scheduled;

    Request(long generation, List<CompilationRun> runs) {
      this.generation = generation;
      this.runs = ImmutableList.copyOf(runs);
    }
  }

  public BuildService(Compiler compiler) {
    this.compiler = compiler;
    this.executor =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactory() {
              @Override
              public Thread newThread(Runnable r) {
                Thread t = new Thread(null, r, "solir-build", BUILD_STACK_SIZE);
                t.setDaemon(true);
                return t;
              }
            });
  }

  /** The latest published build, or null before the first build completes. */
  public @Nullable ProjectBuild getCurrentBuild() {
    return current.get();
  }

  /** Registers a callback invoked on the build thread after each publication. */
  public void addListener(Consumer<ProjectBuild> listener) {
    listeners.add(listener);
  }

  /**
   * Requests a build of {@code runs} after {@code changedPaths} changed. The returned future
   * completes with the published build, or is cancelled if a newer request supersedes this one.
   */
  public ListenableFuture<ProjectBuild> requestBuild(
      List<CompilationRun> runs, Set<String> changedPaths) {
    synchronized (lock) {
      generation++;
      pendingChanges.addAll(changedPaths);
      if (pending != null) {
        pending.scheduled.cancel(false);
        pending.result.cancel(false);
        logger.fine(() -> "Request #" + pending.generation + " superseded before it started");
      }
      if (running != null && running.token.cancel()) {
        logger.fine(() -> "Cancelling build of request #" + running.generation);
      }
      Request request = new Request(generation, runs);
      request.scheduled =
          executor.schedule(
              () -> execute(request),
              compiler.getOptions().getDebounceDelay().toMillis(),
              TimeUnit.MILLISECONDS);
      pending = request;
      return request.result;
    }
  }

  /** Requests a build that reuses nothing from the current build. */
  public ListenableFuture<ProjectBuild> requestFullBuild(List<CompilationRun> runs) {
    synchronized (lock) {
      fullBuildRequested = true;
    }
    return requestBuild(runs, ImmutableSet.of());
  }

  private void execute(Request request) {
    ImmutableSet<String> changes;
    boolean full;
    synchronized (lock) {
      if (request.generation != generation) {
        return;
      }
      pending = null;
      running = request;
      changes = ImmutableSet.copyOf(pendingChanges);
      full = fullBuildRequested;
    }
    ProjectBuild base = full ? null : current.get();
    ProjectBuild build;
    try {
      build = compiler.compile(request.runs, base, changes, request.token);
    } catch (BuildCancelledException e) {
      logger.fine(() -> "Build of request #" + request.generation + " cancelled");
      request.result.cancel(false);
      clearRunning(request);
      return;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Build of request #" + request.generation + " failed", e);
      request.result.setException(e);
      clearRunning(request);
      return;
    }

    synchronized (lock) {
      if (running == request) {
        running = null;
      }
      if (request.generation != generation || request.token.isCancelled()) {
        logger.fine(() -> "Discarding superseded " + build);
        request.result.cancel(false);
        return;
      }
      current.set(build);
      pendingChanges.removeAll(changes);
      if (full) {
        fullBuildRequested = false;
      }
    }
    logger.fine(() -> "Published " + build);
    request.result.set(build);
    for (Consumer<ProjectBuild> listener : listeners) {
      try {
        listener.accept(build);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Build listener " + listener + " failed", e);
      }
    }
  }

  private void clearRunning(Request request) {
    synchronized (lock) {
      if (running == request) {
        running = null;
      }
    }
  }

  @Override
  public void close() {
    synchronized (lock) {
      if (pending != null) {
        pending.result.cancel(false);
      }
      if (running != null) {
        running.token.cancel();
      }
    }
    executor.shutdownNow();
  }
}
