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

import com.solir.compiler.CompilerOptions;
import com.solir.compiler.ControlFlowGraph;
import com.solir.compiler.ProjectBuild;
import com.solir.compiler.Reference;
import com.solir.compiler.SourceLinks;
import com.solir.ir.Node;
import org.jspecify.annotations.Nullable;

/** What a plugin can see of the build it runs on. */
public final class PluginContext {
  private final ProjectBuild build;
  private final VisitScope scope;
  private final CompilerOptions options;

  PluginContext(ProjectBuild build, VisitScope scope, CompilerOptions options) {
    this.build = build;
    this.scope = scope;
    this.options = options;
  }

  public ProjectBuild getBuild() {
    return build;
  }

  public VisitScope getScope() {
    return scope;
  }

  public CompilerOptions getOptions() {
    return options;
  }

  public @Nullable Reference getReference(Node n) {
    return build.getReference(n);
  }

  /** Returns the declaration {@code n} refers to, or null if it refers to none. */
  public @Nullable Node getTarget(Node n) {
    Reference reference = build.getReference(n);
    return reference == null ? null : reference.getTarget();
  }

  public @Nullable ControlFlowGraph getControlFlowGraph(Node declaration) {
    return build.getControlFlowGraph(declaration);
  }

  /** An editor link to {@code n}, or null if its location is unknown. */
  public @Nullable String getLocationLink(Node n) {
    return SourceLinks.forNode(options.getLinkFormat(), n);
  }

  /** An editor link to a one-based line and column of a file. */
  public String getLocationLink(String path, int line, int column) {
    return SourceLinks.format(options.getLinkFormat(), path, line, column);
  }
}
