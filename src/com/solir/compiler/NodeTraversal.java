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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.solir.ir.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/** NodeTraversal allows an iteration through the nodes in the IR. */
public class NodeTraversal {
  private final Callback callback;
  private final CancellationToken cancellationToken;

  /** Contains the current node */
  private @Nullable Node currentNode;

  /** Contains the enclosing SOURCE_UNIT node if there is one, otherwise null. */
  private @Nullable Node currentSourceUnit;

  /** Enclosing contracts, innermost last. */
  private final Deque<Node> contracts = new ArrayDeque<>();

  /** Enclosing functions and modifiers, innermost last. */
  private final Deque<Node> executables = new ArrayDeque<>();

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether the node and its children
     * should be traversed.
     *
     * <p>If this method returns false, the node will not be visited by {@link #visit} and its
     * children will be visited by neither method. Siblings are always visited left-to-right.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     * @return whether the children of this node should be visited
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children).
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return true;
    }
  }

  /** Abstract callback to visit all nodes in postorder. */
  @FunctionalInterface
  public static interface AbstractPostOrderCallbackInterface {
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Abstract callback to visit all nodes in preorder. */
  public abstract static class AbstractPreOrderCallback implements Callback {
    @Override
    public final void visit(NodeTraversal t, Node n, @Nullable Node parent) {}
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder */
  public static final class Builder {
    private Callback callback;
    private CancellationToken cancellationToken = CancellationToken.create();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setCallback(Callback x) {
      this.callback = x;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCallback(AbstractPostOrderCallbackInterface x) {
      this.callback =
          new AbstractPostOrderCallback() {
            @Override
            public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
              x.visit(t, n, parent);
            }
          };
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCancellationToken(CancellationToken x) {
      this.cancellationToken = x;
      return this;
    }

    public NodeTraversal build() {
      return new NodeTraversal(this);
    }

    public void traverse(Node root) {
      this.build().traverse(root);
    }

    /** Traverses several roots, checking for cancellation before each one. */
    public void traverseRoots(Iterable<Node> roots) {
      NodeTraversal t = this.build();
      for (Node root : roots) {
        t.cancellationToken.throwIfCancelled();
        t.traverse(root);
      }
    }
  }

  private NodeTraversal(Builder builder) {
    this.callback = checkNotNull(builder.callback);
    this.cancellationToken = checkNotNull(builder.cancellationToken);
  }

  /** Traverses {@code root} with {@code cb}. */
  public static void traverse(Node root, Callback cb) {
    builder().setCallback(cb).traverse(root);
  }

  private void throwUnexpectedException(RuntimeException unexpectedException) {
    // If there's an unexpected exception, try to get the
    // position of the code that caused it.
    String message = unexpectedException.getMessage();
    if (currentNode != null) {
      message =
          message
              + "\n"
              + formatNodeContext("Node", currentNode)
              + formatNodeContext("Parent", currentNode.getParent());
    }
    throw new IllegalStateException(message, unexpectedException);
  }

  private static String formatNodeContext(String label, @Nullable Node n) {
    if (n == null) {
      return "  " + label + ": NULL";
    }
    return "  " + label + "(" + n + "): " + n.getSourceFileName() + ":" + n.getLineno() + "\n";
  }

  private void traverse(Node root) {
    try {
      currentSourceUnit = root.getSourceUnit();
      traverseBranch(root, null);
    } catch (BuildCancelledException e) {
      throw e;
    } catch (RuntimeException unexpectedException) {
      throwUnexpectedException(unexpectedException);
    } finally {
      contracts.clear();
      executables.clear();
    }
  }

  private void traverseBranch(Node n, @Nullable Node parent) {
    currentNode = n;
    if (n.isSourceUnit()) {
      currentSourceUnit = n;
    }
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }

    boolean isContract = n.isContractDefinition();
    boolean isExecutable = NodeUtil.isExecutable(n);
    if (isContract) {
      contracts.addLast(n);
    }
    if (isExecutable) {
      executables.addLast(n);
    }

    for (Node child = n.getFirstChild(); child != null; ) {
      Node next = child.getNext();
      traverseBranch(child, n);
      child = next;
    }

    if (isExecutable) {
      executables.removeLast();
    }
    if (isContract) {
      contracts.removeLast();
    }

    currentNode = n;
    callback.visit(this, n, parent);
  }

  /** Returns the node currently being traversed. */
  public @Nullable Node getCurrentNode() {
    return currentNode;
  }

  public @Nullable Node getCurrentSourceUnit() {
    return currentSourceUnit;
  }

  /** Returns the path of the file being traversed. */
  public @Nullable String getSourceName() {
    return currentSourceUnit == null ? null : currentSourceUnit.getString();
  }

  /** Returns the closest enclosing contract, or null at file level. */
  public @Nullable Node getEnclosingContract() {
    return contracts.peekLast();
  }

  /** Returns the closest enclosing function or modifier, or null. */
  public @Nullable Node getEnclosingExecutable() {
    return executables.peekLast();
  }

  public CancellationToken getCancellationToken() {
    return cancellationToken;
  }
}
