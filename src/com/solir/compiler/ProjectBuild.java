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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.solir.ir.Node;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The result of one build: the source unit forest, the alias table, the references, the
 * linearizations, the import graph and the control flow graphs.
 *
 * <p>A build is immutable once published. Source units that were not affected by a change are
 * shared by identity with the build they were retained from.
 */
public final class ProjectBuild {
  private final long serial;
  private final ImmutableMap<String, Node> sourceUnits;
  private final DeclarationIndex declarations;
  private final ReferenceMap references;
  private final ImmutableMap<Node, ImmutableList<Node>> linearizations;
  private final ImmutableMap<Node, ControlFlowGraph> cfgs;
  private final ImmutableSetMultimap<String, String> imports;
  private final ImmutableSetMultimap<String, String> importedBy;
  private final ImmutableSet<String> rebuiltPaths;
  private final ImmutableList<IrError> errors;
  private final ImmutableList<IrError> warnings;

  ProjectBuild(
      long serial,
      Map<String, Node> sourceUnits,
      DeclarationIndex declarations,
      ReferenceMap references,
      Map<Node, ImmutableList<Node>> linearizations,
      Map<Node, ControlFlowGraph> cfgs,
      ImmutableSetMultimap<String, String> imports,
      ImmutableSet<String> rebuiltPaths,
      ErrorManager errorManager) {
    this.serial = serial;
    this.sourceUnits = ImmutableMap.copyOf(sourceUnits);
    this.declarations = declarations;
    this.references = references;
    this.linearizations = ImmutableMap.copyOf(linearizations);
    this.cfgs = ImmutableMap.copyOf(cfgs);
    this.imports = imports;
    this.importedBy = imports.inverse();
    this.rebuiltPaths = rebuiltPaths;
    this.errors = errorManager.getErrors();
    this.warnings = errorManager.getWarnings();
  }

  /** Increases with every build made by the same process. */
  public long getSerial() {
    return serial;
  }

  public ImmutableMap<String, Node> getSourceUnits() {
    return sourceUnits;
  }

  public @Nullable Node getSourceUnit(String path) {
    return sourceUnits.get(path);
  }

  public DeclarationIndex getDeclarationIndex() {
    return declarations;
  }

  public @Nullable Node getDeclaration(DeclarationKey key) {
    return declarations.get(key);
  }

  public ReferenceMap getReferences() {
    return references;
  }

  public @Nullable Reference getReference(Node n) {
    return references.get(n);
  }

  /** Nodes of this build that resolve to {@code declaration}. */
  public ImmutableList<Node> getReferencesTo(Node declaration) {
    return references.getReferrers(declaration);
  }

  /** Declarations that override {@code declaration}, directly or transitively. */
  public ImmutableSet<Node> getOverriders(Node declaration) {
    return references.getOverriders(declaration);
  }

  /** The C3 linearization of a contract, most derived first, or null for unknown contracts. */
  public @Nullable ImmutableList<Node> getLinearization(Node contract) {
    return linearizations.get(contract);
  }

  public @Nullable ControlFlowGraph getControlFlowGraph(Node declaration) {
    return cfgs.get(declaration);
  }

  ImmutableMap<Node, ControlFlowGraph> getControlFlowGraphs() {
    return cfgs;
  }

  /** Absolute paths imported by the file at {@code path}. */
  public ImmutableSet<String> getImports(String path) {
    return imports.get(path);
  }

  /** Paths of the files importing the file at {@code path}. */
  public ImmutableSet<String> getImportedBy(String path) {
    return importedBy.get(path);
  }

  ImmutableSetMultimap<String, String> getImportGraph() {
    return imports;
  }

  /** Paths whose trees were built for this build rather than retained. */
  public ImmutableSet<String> getRebuiltPaths() {
    return rebuiltPaths;
  }

  public ImmutableList<IrError> getErrors() {
    return errors;
  }

  public ImmutableList<IrError> getWarnings() {
    return warnings;
  }

  @Override
  public String toString() {
    return "ProjectBuild#" + serial + sourceUnits.keySet();
  }
}
