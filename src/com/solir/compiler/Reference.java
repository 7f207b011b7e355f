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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.solir.ir.Node;
import org.jspecify.annotations.Nullable;

/**
 * The resolution of a single reference-capable node. A reference never owns what it points to:
 * the target is looked up in the forest of the build that holds this reference.
 */
public final class Reference {

  /** What a reference was bound to. */
  public enum Kind {
    /** A declaration node of the build. */
    DECLARATION,
    /** A symbol built into the language. */
    GLOBAL,
    /** A variable or function declared inside inline assembly. */
    YUL_LOCAL,
    /** An instruction of the assembly dialect, such as {@code mload}. */
    YUL_BUILTIN,
    UNRESOLVED
  }

  private final Node node;
  private final Kind kind;
  private final @Nullable Node target;
  private final @Nullable GlobalSymbol symbol;
  private final @Nullable UnresolvedReason reason;
  private final ImmutableList<Node> pathTargets;
  private final boolean virtual;

  private Reference(
      Node node,
      Kind kind,
      @Nullable Node target,
      @Nullable GlobalSymbol symbol,
      @Nullable UnresolvedReason reason,
      ImmutableList<Node> pathTargets,
      boolean virtual) {
    this.node = checkNotNull(node);
    this.kind = kind;
    this.target = target;
    this.symbol = symbol;
    this.reason = reason;
    this.pathTargets = pathTargets;
    this.virtual = virtual;
  }

  static Reference toDeclaration(Node node, Node target) {
    return new Reference(
        node, Kind.DECLARATION, checkNotNull(target), null, null, ImmutableList.of(), false);
  }

  static Reference toGlobal(Node node, GlobalSymbol symbol) {
    return new Reference(
        node, Kind.GLOBAL, null, checkNotNull(symbol), null, ImmutableList.of(), false);
  }

  static Reference toYulLocal(Node node, Node target) {
    return new Reference(
        node, Kind.YUL_LOCAL, checkNotNull(target), null, null, ImmutableList.of(), false);
  }

  static Reference toYulBuiltin(Node node) {
    return new Reference(node, Kind.YUL_BUILTIN, null, null, null, ImmutableList.of(), false);
  }

  static Reference unresolved(Node node, UnresolvedReason reason) {
    return new Reference(
        node, Kind.UNRESOLVED, null, null, checkNotNull(reason), ImmutableList.of(), false);
  }

  /** Returns a copy that also records the declaration named by each segment of a dotted path. */
  Reference withPathTargets(ImmutableList<Node> targets) {
    return new Reference(node, kind, target, symbol, reason, targets, virtual);
  }

  /** Returns a copy marked as dispatching dynamically to overrides of the target. */
  Reference asVirtual() {
    return new Reference(node, kind, target, symbol, reason, pathTargets, true);
  }

  /** The referencing node. */
  public Node getNode() {
    return node;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isResolved() {
    return kind != Kind.UNRESOLVED;
  }

  /** The declaration for DECLARATION and YUL_LOCAL references, otherwise null. */
  public @Nullable Node getTarget() {
    return target;
  }

  public @Nullable GlobalSymbol getSymbol() {
    return symbol;
  }

  public @Nullable UnresolvedReason getReason() {
    return reason;
  }

  /**
   * For dotted paths such as {@code L.S}, the declaration of each segment from left to right.
   * Empty for other references.
   */
  public ImmutableList<Node> getPathTargets() {
    return pathTargets;
  }

  /**
   * Whether a call through this reference may reach an override of the target. The overriding
   * declarations are available from {@link ReferenceMap#getOverriders}.
   */
  public boolean isVirtual() {
    return virtual;
  }

  /** Whether the target is the same as that of {@code other}, ignoring the referencing node. */
  boolean hasSameResolution(Reference other) {
    return kind == other.kind
        && target == other.target
        && symbol == other.symbol
        && reason == other.reason;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("node", node)
        .add("kind", kind)
        .add("target", target)
        .add("symbol", symbol)
        .add("reason", reason)
        .toString();
  }
}
