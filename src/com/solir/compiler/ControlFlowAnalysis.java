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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.solir.compiler.ControlFlowGraph.Branch;
import com.solir.compiler.graph.DiGraph.DiGraphEdge;
import com.solir.compiler.graph.LinkedDirectedGraph.LinkedDirectedGraphEdge;
import com.solir.ir.Node;
import com.solir.ir.Token;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * Computes the control flow graph of a function or modifier body.
 *
 * <p>Statements are appended to a current block. A statement that transfers control elsewhere
 * ({@code return}, {@code revert}, {@code break}, {@code continue}) closes the current block, and
 * whatever follows it lands in a fresh block without predecessors. Conditional statements record
 * themselves as the control statement of the block they end. Inline assembly is walked with the
 * same rules applied to its own grammar.
 *
 * <p>Calls are not followed. When an always-reverting predicate is supplied, a call whose callee
 * resolves to a declaration it accepts is treated as a revert.
 */
public final class ControlFlowAnalysis {

  private final Node root;
  private final @Nullable ReferenceMap references;
  private final Predicate<Node> alwaysReverts;

  private ControlFlowGraph cfg;
  private int nextBlockId;
  private BasicBlock current;
  private final Deque<LoopContext> loops = new ArrayDeque<>();

  /** Where {@code break} and {@code continue} inside a loop body go. */
  private static final class LoopContext {
    final BasicBlock breakTarget;
    final BasicBlock continueTarget;
    final Branch continueBranch;

    LoopContext(BasicBlock breakTarget, BasicBlock continueTarget, Branch continueBranch) {
      this.breakTarget = breakTarget;
      this.continueTarget = continueTarget;
      this.continueBranch = continueBranch;
    }
  }

  /**
   * @param root a FUNCTION_DEFINITION or MODIFIER_DEFINITION
   * @param references resolution results used to recognize calls to {@code revert}, {@code
   *     require} and friends; when null, callees are recognized by name
   * @param alwaysReverts accepts declarations whose every call reverts
   */
  public ControlFlowAnalysis(
      Node root, @Nullable ReferenceMap references, Predicate<Node> alwaysReverts) {
    checkArgument(NodeUtil.isExecutable(root), "Cannot compute a CFG for %s", root);
    this.root = root;
    this.references = references;
    this.alwaysReverts = alwaysReverts;
  }

  public ControlFlowAnalysis(Node root, @Nullable ReferenceMap references) {
    this(root, references, declaration -> false);
  }

  public ControlFlowGraph getCfg() {
    checkState(cfg != null, "process() has not been called");
    return cfg;
  }

  public void process() {
    Node body = NodeUtil.getBody(root);
    if (body == null || !body.hasChildren()) {
      BasicBlock only = new BasicBlock(nextBlockId++, "entry");
      cfg = new ControlFlowGraph(root, only, only, new BasicBlock(nextBlockId++, "revert"));
      cfg.indexStatements();
      return;
    }
    BasicBlock entry = new BasicBlock(nextBlockId++, "entry");
    BasicBlock success = new BasicBlock(nextBlockId++, "success");
    BasicBlock revert = new BasicBlock(nextBlockId++, "revert");
    cfg = new ControlFlowGraph(root, entry, success, revert);
    current = entry;
    traverse(body);
    cfg.connect(current, Branch.UNCOND, success);
    normalize();
    cfg.indexStatements();
  }

  private BasicBlock newBlock() {
    BasicBlock block = new BasicBlock(nextBlockId++, null);
    cfg.createNode(block);
    return block;
  }

  /** Ends the current block with a jump and continues in a block nothing jumps to. */
  private void jump(Branch branch, BasicBlock target) {
    cfg.connect(current, branch, target);
    current = newBlock();
  }

  private void traverse(Node statement) {
    switch (statement.getToken()) {
      case BLOCK:
      case UNCHECKED_BLOCK:
      case YUL_BLOCK:
        for (Node child : statement.children()) {
          traverse(child);
        }
        return;
      case INLINE_ASSEMBLY:
        current.addStatement(statement);
        if (statement.hasChildren()) {
          traverse(statement.getFirstChild());
        }
        return;
      case IF_STATEMENT:
        handleIf(statement);
        return;
      case YUL_IF:
        handleYulIf(statement);
        return;
      case WHILE_STATEMENT:
        handleWhile(statement);
        return;
      case DO_WHILE_STATEMENT:
        handleDoWhile(statement);
        return;
      case FOR_STATEMENT:
        handleFor(statement);
        return;
      case YUL_FOR_LOOP:
        handleYulFor(statement);
        return;
      case TRY_STATEMENT:
        handleTry(statement);
        return;
      case YUL_SWITCH:
        handleSwitch(statement);
        return;
      case BREAK:
      case YUL_BREAK:
        current.addStatement(statement);
        jump(Branch.UNCOND, enclosingLoop(statement).breakTarget);
        return;
      case CONTINUE:
      case YUL_CONTINUE:
        {
          current.addStatement(statement);
          LoopContext loop = enclosingLoop(statement);
          jump(loop.continueBranch, loop.continueTarget);
          return;
        }
      case RETURN:
      case YUL_LEAVE:
        current.addStatement(statement);
        jump(Branch.UNCOND, cfg.getSuccessExit());
        return;
      case REVERT_STATEMENT:
      case THROW:
        current.addStatement(statement);
        jump(Branch.ON_REVERT, cfg.getRevertExit());
        return;
      case EXPRESSION_STATEMENT:
        handleExpressionStatement(statement);
        return;
      case YUL_EXPRESSION_STATEMENT:
        handleYulExpressionStatement(statement);
        return;
      default:
        current.addStatement(statement);
    }
  }

  private LoopContext enclosingLoop(Node statement) {
    checkState(!loops.isEmpty(), "%s outside of a loop", statement);
    return loops.peek();
  }

  private void handleIf(Node ifStatement) {
    Node thenBranch = ifStatement.getSecondChild();
    Node elseBranch = ifStatement.getChildAtIndex(2);
    BasicBlock condition = current;
    condition.setControlStatement(ifStatement);
    BasicBlock after = newBlock();

    BasicBlock thenBlock = newBlock();
    cfg.connect(condition, Branch.ON_TRUE, thenBlock);
    current = thenBlock;
    traverse(thenBranch);
    cfg.connect(current, Branch.UNCOND, after);

    if (elseBranch.isEmpty()) {
      cfg.connect(condition, Branch.ON_FALSE, after);
    } else {
      BasicBlock elseBlock = newBlock();
      cfg.connect(condition, Branch.ON_FALSE, elseBlock);
      current = elseBlock;
      traverse(elseBranch);
      cfg.connect(current, Branch.UNCOND, after);
    }
    current = after;
  }

  private void handleYulIf(Node yulIf) {
    BasicBlock condition = current;
    condition.setControlStatement(yulIf);
    BasicBlock after = newBlock();
    BasicBlock body = newBlock();
    cfg.connect(condition, Branch.ON_TRUE, body);
    cfg.connect(condition, Branch.ON_FALSE, after);
    current = body;
    traverse(yulIf.getSecondChild());
    cfg.connect(current, Branch.UNCOND, after);
    current = after;
  }

  private void handleWhile(Node loop) {
    BasicBlock header = newBlock();
    cfg.connect(current, Branch.UNCOND, header);
    header.setControlStatement(loop);
    BasicBlock after = newBlock();
    BasicBlock body = newBlock();
    cfg.connect(header, Branch.ON_TRUE, body);
    cfg.connect(header, Branch.ON_FALSE, after);
    traverseLoopBody(
        NodeUtil.getLoopBody(loop), body, new LoopContext(after, header, Branch.LOOP_BACK));
    cfg.connect(current, Branch.LOOP_BACK, header);
    current = after;
  }

  private void handleDoWhile(Node loop) {
    BasicBlock body = newBlock();
    cfg.connect(current, Branch.UNCOND, body);
    BasicBlock header = newBlock();
    header.setControlStatement(loop);
    BasicBlock after = newBlock();
    traverseLoopBody(
        NodeUtil.getLoopBody(loop), body, new LoopContext(after, header, Branch.UNCOND));
    cfg.connect(current, Branch.UNCOND, header);
    cfg.connect(header, Branch.LOOP_BACK, body);
    cfg.connect(header, Branch.ON_FALSE, after);
    current = after;
  }

  private void handleFor(Node loop) {
    Node init = loop.getFirstChild();
    Node condition = loop.getSecondChild();
    Node update = loop.getChildAtIndex(2);
    if (!init.isEmpty()) {
      current.addStatement(init);
    }
    BasicBlock header = newBlock();
    cfg.connect(current, Branch.UNCOND, header);
    BasicBlock after = newBlock();
    BasicBlock body = newBlock();
    header.setControlStatement(loop);
    if (condition.isEmpty()) {
      cfg.connect(header, Branch.UNCOND, body);
    } else {
      cfg.connect(header, Branch.ON_TRUE, body);
      cfg.connect(header, Branch.ON_FALSE, after);
    }
    BasicBlock post = newBlock();
    if (!update.isEmpty()) {
      post.addStatement(update);
    }
    cfg.connect(post, Branch.LOOP_BACK, header);
    traverseLoopBody(
        NodeUtil.getLoopBody(loop), body, new LoopContext(after, post, Branch.UNCOND));
    cfg.connect(current, Branch.UNCOND, post);
    current = after;
  }

  private void handleYulFor(Node loop) {
    traverse(loop.getFirstChild());
    BasicBlock header = newBlock();
    cfg.connect(current, Branch.UNCOND, header);
    header.setControlStatement(loop);
    BasicBlock after = newBlock();
    BasicBlock body = newBlock();
    cfg.connect(header, Branch.ON_TRUE, body);
    cfg.connect(header, Branch.ON_FALSE, after);
    BasicBlock post = newBlock();
    traverseLoopBody(
        NodeUtil.getLoopBody(loop), body, new LoopContext(after, post, Branch.UNCOND));
    cfg.connect(current, Branch.UNCOND, post);
    current = post;
    traverse(loop.getChildAtIndex(2));
    cfg.connect(current, Branch.LOOP_BACK, header);
    current = after;
  }

  private void traverseLoopBody(Node body, BasicBlock start, LoopContext context) {
    loops.push(context);
    current = start;
    traverse(body);
    loops.pop();
  }

  private void handleTry(Node tryStatement) {
    BasicBlock call = current;
    call.setControlStatement(tryStatement);
    BasicBlock after = newBlock();
    boolean hasFallback = false;
    boolean first = true;
    for (Node clause : tryStatement.children()) {
      if (clause.getToken() != Token.TRY_CATCH_CLAUSE) {
        continue;
      }
      Branch branch;
      if (first) {
        branch = Branch.TRY_SUCCEEDED;
        first = false;
      } else if ("Error".equals(clause.getString())) {
        branch = Branch.TRY_REVERTED;
      } else if ("Panic".equals(clause.getString())) {
        branch = Branch.TRY_PANICKED;
      } else {
        branch = Branch.TRY_FAILED;
        hasFallback = true;
      }
      BasicBlock clauseBlock = newBlock();
      cfg.connect(call, branch, clauseBlock);
      current = clauseBlock;
      traverse(clause.getLastChild());
      cfg.connect(current, Branch.UNCOND, after);
    }
    if (!hasFallback) {
      cfg.connect(call, Branch.TRY_FAILED, cfg.getRevertExit());
    }
    current = after;
  }

  private void handleSwitch(Node yulSwitch) {
    BasicBlock selector = current;
    selector.setControlStatement(yulSwitch);
    BasicBlock after = newBlock();
    boolean hasDefault = false;
    for (Node yulCase : yulSwitch.children()) {
      if (yulCase.getToken() != Token.YUL_CASE) {
        continue;
      }
      boolean isDefault = yulCase.getFirstChild().isEmpty();
      hasDefault |= isDefault;
      BasicBlock caseBlock = newBlock();
      cfg.connect(selector, isDefault ? Branch.SWITCH_DEFAULT : Branch.SWITCH_MATCHED, caseBlock);
      current = caseBlock;
      traverse(yulCase.getLastChild());
      cfg.connect(current, Branch.UNCOND, after);
    }
    if (!hasDefault) {
      cfg.connect(selector, Branch.SWITCH_DEFAULT, after);
    }
    current = after;
  }

  private void handleExpressionStatement(Node statement) {
    BasicBlock next = newBlock();
    if (processExpression(statement.getFirstChild(), current, next)) {
      current.setControlStatement(statement);
      current = next;
    } else {
      cfg.removeNode(next);
      current.addStatement(statement);
    }
  }

  /**
   * Adds the edges leaving {@code block} caused by evaluating {@code expression}. Returns false if
   * evaluation simply falls through, in which case no edges were added.
   */
  private boolean processExpression(Node expression, BasicBlock block, BasicBlock next) {
    if (expression.getToken() == Token.CONDITIONAL) {
      BasicBlock whenTrue = newBlock();
      BasicBlock whenFalse = newBlock();
      cfg.connect(block, Branch.ON_TRUE, whenTrue);
      cfg.connect(block, Branch.ON_FALSE, whenFalse);
      boolean trueTransfers = processExpression(expression.getSecondChild(), whenTrue, next);
      boolean falseTransfers = processExpression(expression.getLastChild(), whenFalse, next);
      if (!trueTransfers) {
        cfg.removeNode(whenTrue);
        if (falseTransfers) {
          cfg.connect(block, Branch.ON_TRUE, next);
        }
      }
      if (!falseTransfers) {
        cfg.removeNode(whenFalse);
        if (trueTransfers) {
          cfg.connect(block, Branch.ON_FALSE, next);
        }
      }
      return trueTransfers || falseTransfers;
    }
    if (!expression.isFunctionCall()) {
      return false;
    }
    GlobalSymbol symbol = getCalledGlobal(expression);
    if (symbol == GlobalSymbol.REVERT) {
      cfg.connect(block, Branch.ON_REVERT, cfg.getRevertExit());
      return true;
    }
    if (symbol == GlobalSymbol.REQUIRE || symbol == GlobalSymbol.ASSERT) {
      Node condition = expression.getSecondChild();
      if (condition != null && !NodeUtil.isLiteralFalse(condition)) {
        cfg.connect(block, Branch.ON_TRUE, next);
      }
      cfg.connect(block, Branch.ON_FALSE, cfg.getRevertExit());
      return true;
    }
    if (symbol == GlobalSymbol.SELFDESTRUCT || symbol == GlobalSymbol.SUICIDE) {
      cfg.connect(block, Branch.UNCOND, cfg.getSuccessExit());
      return true;
    }
    Node target = getCalledDeclaration(expression);
    if (target != null && alwaysReverts.test(target)) {
      cfg.connect(block, Branch.ON_REVERT, cfg.getRevertExit());
      return true;
    }
    return false;
  }

  private @Nullable GlobalSymbol getCalledGlobal(Node call) {
    Node callee = NodeUtil.getCallee(call);
    if (!callee.isIdentifier()) {
      return null;
    }
    Reference reference = references != null ? references.get(callee) : null;
    if (reference != null) {
      return reference.getKind() == Reference.Kind.GLOBAL ? reference.getSymbol() : null;
    }
    return GlobalSymbol.forName(callee.getString());
  }

  private @Nullable Node getCalledDeclaration(Node call) {
    if (references == null) {
      return null;
    }
    Reference reference = references.get(NodeUtil.getCallee(call));
    if (reference == null || reference.getKind() != Reference.Kind.DECLARATION) {
      return null;
    }
    Node target = reference.getTarget();
    return target != null && target.getToken() == Token.FUNCTION_DEFINITION ? target : null;
  }

  private void handleYulExpressionStatement(Node statement) {
    current.addStatement(statement);
    Node call = statement.getFirstChild();
    if (call.getToken() != Token.YUL_FUNCTION_CALL) {
      return;
    }
    switch (call.getFirstChild().getString()) {
      case "revert":
      case "invalid":
        jump(Branch.ON_REVERT, cfg.getRevertExit());
        break;
      case "return":
      case "stop":
      case "selfdestruct":
        jump(Branch.UNCOND, cfg.getSuccessExit());
        break;
      default:
        break;
    }
  }

  /**
   * Removes the scaffolding left by the walk: empty blocks that nothing jumps to, and empty blocks
   * that only forward to another block.
   */
  private void normalize() {
    boolean changed = true;
    while (changed) {
      changed = false;
      for (BasicBlock block : cfg.getBlocks()) {
        if (!cfg.hasNode(block) || isTerminal(block) || !block.isEmpty()) {
          continue;
        }
        if (cfg.getInEdges(block).isEmpty()) {
          cfg.removeNode(block);
          changed = true;
        } else if (bypass(block)) {
          changed = true;
        }
      }
    }
  }

  private boolean isTerminal(BasicBlock block) {
    return block == cfg.getEntry() || block == cfg.getSuccessExit() || block == cfg.getRevertExit();
  }

  private boolean bypass(BasicBlock block) {
    List<LinkedDirectedGraphEdge<BasicBlock, Branch>> outEdges = cfg.getOutEdges(block);
    if (outEdges.size() != 1) {
      return false;
    }
    DiGraphEdge<BasicBlock, Branch> out = outEdges.get(0);
    BasicBlock target = out.getDestination().getValue();
    if (target == block || out.getValue().isConditional()) {
      return false;
    }
    // A conditional edge cannot also carry a loop back edge, so the block stays between them.
    if (out.getValue() == Branch.LOOP_BACK) {
      for (DiGraphEdge<BasicBlock, Branch> in : cfg.getInEdges(block)) {
        if (in.getValue().isConditional()) {
          return false;
        }
      }
    }
    for (DiGraphEdge<BasicBlock, Branch> in : ImmutableList.copyOf(cfg.getInEdges(block))) {
      BasicBlock source = in.getSource().getValue();
      Branch branch = in.getValue() == Branch.UNCOND ? out.getValue() : in.getValue();
      cfg.connect(source, branch, target);
    }
    cfg.removeNode(block);
    return true;
  }
}
