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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import com.solir.compiler.ControlFlowGraph.Branch;
import com.solir.compiler.graph.DiGraph.DiGraphEdge;
import com.solir.ir.Node;
import com.solir.ir.Node.Prop;
import com.solir.ir.Token;
import java.util.HashSet;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ControlFlowAnalysisTest {

  private static Node n(Token token, Node... children) {
    return n(token, null, children);
  }

  private static Node n(Token token, String string, Node... children) {
    Node node = new Node(token, string);
    for (Node child : children) {
      node.addChildToBack(child);
    }
    return node;
  }

  private static Node name(String name) {
    return n(Token.IDENTIFIER, name);
  }

  /** An expression statement calling {@code callee} with the given arguments. */
  private static Node callStatement(String callee, Node... arguments) {
    Node call = n(Token.FUNCTION_CALL, name(callee));
    for (Node argument : arguments) {
      call.addChildToBack(argument);
    }
    return n(Token.EXPRESSION_STATEMENT, call);
  }

  private static Node yulCallStatement(String callee) {
    return n(
        Token.YUL_EXPRESSION_STATEMENT,
        n(Token.YUL_FUNCTION_CALL, n(Token.YUL_IDENTIFIER, callee),
            n(Token.YUL_LITERAL, "0"), n(Token.YUL_LITERAL, "0")));
  }

  private static Node function(Node... statements) {
    Node f =
        n(Token.FUNCTION_DEFINITION, "f",
            n(Token.PARAMETER_LIST), n(Token.PARAMETER_LIST), n(Token.BLOCK, statements));
    f.putProp(Prop.CANONICAL_NAME, "C.f");
    return f;
  }

  private static ControlFlowGraph cfgOf(Node function) {
    ControlFlowAnalysis analysis = new ControlFlowAnalysis(function, null);
    analysis.process();
    return analysis.getCfg();
  }

  private static Set<Branch> outBranches(ControlFlowGraph cfg, BasicBlock block) {
    Set<Branch> branches = new HashSet<>();
    for (DiGraphEdge<BasicBlock, Branch> edge : cfg.getOutEdges(block)) {
      branches.add(edge.getValue());
    }
    return branches;
  }

  private static BasicBlock target(ControlFlowGraph cfg, BasicBlock block, Branch branch) {
    for (DiGraphEdge<BasicBlock, Branch> edge : cfg.getOutEdges(block)) {
      if (edge.getValue() == branch) {
        return edge.getDestination().getValue();
      }
    }
    throw new AssertionError("No " + branch + " edge from " + block);
  }

  @Test
  public void testEmptyBodyIsSingleBlock() {
    ControlFlowGraph cfg = cfgOf(function());
    assertThat(cfg.getEntry()).isSameInstanceAs(cfg.getSuccessExit());
    assertThat(cfg.getSuccessBlocks()).containsExactly(cfg.getEntry());
    assertThat(cfg.getRevertBlocks()).isEmpty();
    assertThat(cfg.toString()).isEqualTo("ControlFlowGraph(C.f, 2 blocks)");
  }

  @Test
  public void testUnconditionalRevertHasNoSuccessPath() {
    Node revert = callStatement("revert");
    ControlFlowGraph cfg = cfgOf(function(revert));

    assertThat(cfg.getEntry().getControlStatement()).isSameInstanceAs(revert);
    assertThat(target(cfg, cfg.getEntry(), Branch.ON_REVERT)).isSameInstanceAs(cfg.getRevertExit());
    assertThat(cfg.getSuccessBlocks()).isEmpty();
    assertThat(cfg.getSuccessGraph().getNodeCount()).isEqualTo(0);
    assertThat(cfg.getRevertBlocks()).containsExactly(cfg.getEntry(), cfg.getRevertExit());
  }

  @Test
  public void testStatementsAfterRevertAreKeptUnreachable() {
    Node revert = n(Token.REVERT_STATEMENT, n(Token.FUNCTION_CALL, name("Failed")));
    Node dead = callStatement("g");
    ControlFlowGraph cfg = cfgOf(function(revert, dead));

    BasicBlock deadBlock = cfg.getBlock(dead);
    assertThat(deadBlock).isNotNull();
    assertThat(cfg.getUnreachableBlocks()).containsExactly(deadBlock);
    assertThat(cfg.getBlock(revert)).isSameInstanceAs(cfg.getEntry());
    assertThat(cfg.getSuccessBlocks()).isEmpty();
  }

  @Test
  public void testBreakFirstLeavesLoopBodyUnreachable() {
    Node breakStatement = n(Token.BREAK);
    Node skipped = callStatement("x");
    Node loop = n(Token.WHILE_STATEMENT, name("c"), n(Token.BLOCK, breakStatement, skipped));
    Node after = callStatement("y");
    ControlFlowGraph cfg = cfgOf(function(loop, after));

    BasicBlock header = cfg.getBlock(loop);
    assertThat(header.getControlStatement()).isSameInstanceAs(loop);
    assertThat(outBranches(cfg, header)).containsExactly(Branch.ON_TRUE, Branch.ON_FALSE);

    BasicBlock skippedBlock = cfg.getBlock(skipped);
    assertThat(cfg.getUnreachableBlocks()).containsExactly(skippedBlock);
    assertThat(outBranches(cfg, skippedBlock)).containsExactly(Branch.LOOP_BACK);
    assertThat(cfg.isReachable(breakStatement, after)).isTrue();
    assertThat(cfg.isReachable(breakStatement, skipped)).isFalse();
  }

  @Test
  public void testLoopBodyReachesItself() {
    Node body = callStatement("x");
    Node loop = n(Token.WHILE_STATEMENT, name("c"), n(Token.BLOCK, body));
    ControlFlowGraph cfg = cfgOf(function(loop));

    BasicBlock bodyBlock = cfg.getBlock(body);
    assertThat(outBranches(cfg, bodyBlock)).containsExactly(Branch.LOOP_BACK);
    assertThat(cfg.hasPath(bodyBlock, bodyBlock)).isTrue();
    assertThat(cfg.isReachable(body, body)).isTrue();
  }

  @Test
  public void testRequireBranchesToRevertExit() {
    Node require = callStatement("require", name("ok"));
    Node next = callStatement("g");
    ControlFlowGraph cfg = cfgOf(function(require, next));

    BasicBlock entry = cfg.getEntry();
    assertThat(entry.getControlStatement()).isSameInstanceAs(require);
    assertThat(target(cfg, entry, Branch.ON_FALSE)).isSameInstanceAs(cfg.getRevertExit());
    assertThat(target(cfg, entry, Branch.ON_TRUE)).isSameInstanceAs(cfg.getBlock(next));
    assertThat(cfg.getSuccessBlocks()).contains(cfg.getBlock(next));
    assertThat(cfg.getRevertBlocks()).containsExactly(entry, cfg.getRevertExit());
  }

  @Test
  public void testRequireFalseAlwaysReverts() {
    Node literal = n(Token.LITERAL, "false");
    literal.putProp(Prop.LITERAL_KIND, "bool");
    ControlFlowGraph cfg = cfgOf(function(callStatement("require", literal)));

    assertThat(outBranches(cfg, cfg.getEntry())).containsExactly(Branch.ON_FALSE);
    assertThat(cfg.getSuccessBlocks()).isEmpty();
  }

  @Test
  public void testTryWithoutFallbackFailsToRevertExit() {
    Node succeeded = callStatement("a");
    Node reverted = callStatement("b");
    Node tryStatement =
        n(Token.TRY_STATEMENT,
            n(Token.FUNCTION_CALL, n(Token.MEMBER_ACCESS, "run", name("other"))),
            n(Token.TRY_CATCH_CLAUSE, "", Node.newEmpty(), n(Token.BLOCK, succeeded)),
            n(Token.TRY_CATCH_CLAUSE, "Error", n(Token.PARAMETER_LIST), n(Token.BLOCK, reverted)));
    ControlFlowGraph cfg = cfgOf(function(tryStatement));

    BasicBlock call = cfg.getBlock(tryStatement);
    assertThat(outBranches(cfg, call))
        .containsExactly(Branch.TRY_SUCCEEDED, Branch.TRY_REVERTED, Branch.TRY_FAILED);
    assertThat(target(cfg, call, Branch.TRY_SUCCEEDED)).isSameInstanceAs(cfg.getBlock(succeeded));
    assertThat(target(cfg, call, Branch.TRY_REVERTED)).isSameInstanceAs(cfg.getBlock(reverted));
    assertThat(target(cfg, call, Branch.TRY_FAILED)).isSameInstanceAs(cfg.getRevertExit());
  }

  @Test
  public void testAssemblyRevertInsideIf() {
    Node revert = yulCallStatement("revert");
    Node yulIf =
        n(Token.YUL_IF, n(Token.YUL_IDENTIFIER, "c"), n(Token.YUL_BLOCK, revert));
    Node assembly = n(Token.INLINE_ASSEMBLY, n(Token.YUL_BLOCK, yulIf));
    ControlFlowGraph cfg = cfgOf(function(assembly));

    BasicBlock entry = cfg.getEntry();
    assertThat(entry.getStatements()).containsExactly(assembly);
    assertThat(entry.getControlStatement()).isSameInstanceAs(yulIf);
    BasicBlock body = target(cfg, entry, Branch.ON_TRUE);
    assertThat(body.getStatements()).containsExactly(revert);
    assertThat(target(cfg, body, Branch.ON_REVERT)).isSameInstanceAs(cfg.getRevertExit());
    assertThat(cfg.getSuccessBlocks()).containsExactly(entry, cfg.getSuccessExit());
  }

  @Test
  public void testAssemblySwitch() {
    Node matched = yulCallStatement("stop");
    Node yulSwitch =
        n(Token.YUL_SWITCH,
            n(Token.YUL_IDENTIFIER, "selector"),
            n(Token.YUL_CASE, n(Token.YUL_LITERAL, "1"), n(Token.YUL_BLOCK, matched)),
            n(Token.YUL_CASE, Node.newEmpty(), n(Token.YUL_BLOCK, yulCallStatement("revert"))));
    ControlFlowGraph cfg = cfgOf(function(n(Token.INLINE_ASSEMBLY, n(Token.YUL_BLOCK, yulSwitch))));

    BasicBlock selector = cfg.getBlock(yulSwitch);
    assertThat(outBranches(cfg, selector))
        .containsExactly(Branch.SWITCH_MATCHED, Branch.SWITCH_DEFAULT);
    BasicBlock matchedBlock = target(cfg, selector, Branch.SWITCH_MATCHED);
    assertThat(target(cfg, matchedBlock, Branch.UNCOND)).isSameInstanceAs(cfg.getSuccessExit());
    BasicBlock defaultBlock = target(cfg, selector, Branch.SWITCH_DEFAULT);
    assertThat(target(cfg, defaultBlock, Branch.ON_REVERT)).isSameInstanceAs(cfg.getRevertExit());
  }

  @Test
  public void testAssemblyForLoop() {
    Node post = n(Token.YUL_ASSIGNMENT, n(Token.YUL_IDENTIFIER, "i"), n(Token.YUL_LITERAL, "1"));
    Node body = yulCallStatement("log0");
    Node loop =
        n(Token.YUL_FOR_LOOP,
            n(Token.YUL_BLOCK),
            n(Token.YUL_IDENTIFIER, "c"),
            n(Token.YUL_BLOCK, post),
            n(Token.YUL_BLOCK, body));
    ControlFlowGraph cfg = cfgOf(function(n(Token.INLINE_ASSEMBLY, n(Token.YUL_BLOCK, loop))));

    BasicBlock header = cfg.getBlock(loop);
    assertThat(outBranches(cfg, header)).containsExactly(Branch.ON_TRUE, Branch.ON_FALSE);
    BasicBlock postBlock = cfg.getBlock(post);
    assertThat(outBranches(cfg, postBlock)).containsExactly(Branch.LOOP_BACK);
    assertThat(cfg.isReachable(body, post)).isTrue();
    assertThat(cfg.isReachable(post, body)).isTrue();
  }

  @Test
  public void testForWithoutConditionOnlyLeavesThroughBreak() {
    Node breakStatement = n(Token.BREAK);
    Node loop =
        n(Token.FOR_STATEMENT,
            Node.newEmpty(), Node.newEmpty(), Node.newEmpty(), n(Token.BLOCK, breakStatement));
    ControlFlowGraph cfg = cfgOf(function(loop));

    BasicBlock header = cfg.getBlock(loop);
    assertThat(outBranches(cfg, header)).containsExactly(Branch.UNCOND);
    assertThat(cfg.getSuccessBlocks()).contains(cfg.getBlock(breakStatement));
    assertThat(ImmutableSet.copyOf(cfg.getUnreachableBlocks())).isEmpty();
  }

  @Test
  public void testLoopBodyEndingInIfKeepsItsBackEdge() {
    Node first = callStatement("x");
    Node inner = callStatement("y");
    Node ifStatement = n(Token.IF_STATEMENT, name("d"), n(Token.BLOCK, inner), Node.newEmpty());
    Node loop = n(Token.WHILE_STATEMENT, name("c"), n(Token.BLOCK, first, ifStatement));
    ControlFlowGraph cfg = cfgOf(function(loop));

    BasicBlock bodyBlock = cfg.getBlock(first);
    assertThat(bodyBlock.getControlStatement()).isSameInstanceAs(ifStatement);
    BasicBlock join = target(cfg, bodyBlock, Branch.ON_FALSE);
    assertThat(join.isEmpty()).isTrue();
    assertThat(target(cfg, cfg.getBlock(inner), Branch.UNCOND)).isSameInstanceAs(join);
    assertThat(outBranches(cfg, join)).containsExactly(Branch.LOOP_BACK);
    assertThat(target(cfg, join, Branch.LOOP_BACK)).isSameInstanceAs(cfg.getBlock(loop));
  }

  @Test
  public void testDoWhileRunsBodyBeforeCondition() {
    Node body = callStatement("x");
    Node loop = n(Token.DO_WHILE_STATEMENT, n(Token.BLOCK, body), name("c"));
    Node after = callStatement("y");
    ControlFlowGraph cfg = cfgOf(function(loop, after));

    BasicBlock bodyBlock = cfg.getBlock(body);
    BasicBlock header = cfg.getBlock(loop);
    assertThat(target(cfg, cfg.getEntry(), Branch.UNCOND)).isSameInstanceAs(bodyBlock);
    assertThat(target(cfg, bodyBlock, Branch.UNCOND)).isSameInstanceAs(header);
    assertThat(outBranches(cfg, header)).containsExactly(Branch.LOOP_BACK, Branch.ON_FALSE);
    assertThat(target(cfg, header, Branch.LOOP_BACK)).isSameInstanceAs(bodyBlock);
    assertThat(target(cfg, header, Branch.ON_FALSE)).isSameInstanceAs(cfg.getBlock(after));
  }

  @Test
  public void testContinueInDoWhileJumpsToCondition() {
    Node continueStatement = n(Token.CONTINUE);
    Node skipped = callStatement("x");
    Node loop =
        n(Token.DO_WHILE_STATEMENT, n(Token.BLOCK, continueStatement, skipped), name("c"));
    ControlFlowGraph cfg = cfgOf(function(loop));

    BasicBlock continueBlock = cfg.getBlock(continueStatement);
    assertThat(target(cfg, continueBlock, Branch.UNCOND)).isSameInstanceAs(cfg.getBlock(loop));
    assertThat(cfg.getUnreachableBlocks()).containsExactly(cfg.getBlock(skipped));
  }

  @Test
  public void testContinueInForJumpsToUpdate() {
    Node init = n(Token.VARIABLE_DECLARATION_STATEMENT);
    Node update = n(Token.EXPRESSION_STATEMENT, n(Token.UNARY_OPERATION, "++", name("i")));
    Node continueStatement = n(Token.CONTINUE);
    Node rest = callStatement("x");
    Node loop =
        n(Token.FOR_STATEMENT,
            init,
            name("c"),
            update,
            n(Token.BLOCK,
                n(Token.IF_STATEMENT,
                    name("d"), n(Token.BLOCK, continueStatement), Node.newEmpty()),
                rest));
    ControlFlowGraph cfg = cfgOf(function(loop));

    BasicBlock post = cfg.getBlock(update);
    assertThat(cfg.getBlock(init)).isSameInstanceAs(cfg.getEntry());
    assertThat(target(cfg, cfg.getBlock(continueStatement), Branch.UNCOND)).isSameInstanceAs(post);
    assertThat(target(cfg, cfg.getBlock(rest), Branch.UNCOND)).isSameInstanceAs(post);
    assertThat(outBranches(cfg, post)).containsExactly(Branch.LOOP_BACK);
    assertThat(target(cfg, post, Branch.LOOP_BACK)).isSameInstanceAs(cfg.getBlock(loop));
    assertThat(target(cfg, cfg.getBlock(loop), Branch.ON_FALSE))
        .isSameInstanceAs(cfg.getSuccessExit());
  }

  @Test
  public void testTryCatchClausesByKind() {
    Node succeeded = callStatement("a");
    Node reverted = callStatement("b");
    Node panicked = callStatement("c");
    Node failed = callStatement("d");
    Node tryStatement =
        n(Token.TRY_STATEMENT,
            n(Token.FUNCTION_CALL, n(Token.MEMBER_ACCESS, "run", name("other"))),
            n(Token.TRY_CATCH_CLAUSE, "", Node.newEmpty(), n(Token.BLOCK, succeeded)),
            n(Token.TRY_CATCH_CLAUSE, "Error", n(Token.PARAMETER_LIST), n(Token.BLOCK, reverted)),
            n(Token.TRY_CATCH_CLAUSE, "Panic", n(Token.PARAMETER_LIST), n(Token.BLOCK, panicked)),
            n(Token.TRY_CATCH_CLAUSE, "", Node.newEmpty(), n(Token.BLOCK, failed)));
    ControlFlowGraph cfg = cfgOf(function(tryStatement));

    BasicBlock call = cfg.getBlock(tryStatement);
    assertThat(outBranches(cfg, call))
        .containsExactly(
            Branch.TRY_SUCCEEDED, Branch.TRY_REVERTED, Branch.TRY_PANICKED, Branch.TRY_FAILED);
    assertThat(target(cfg, call, Branch.TRY_PANICKED)).isSameInstanceAs(cfg.getBlock(panicked));
    assertThat(target(cfg, call, Branch.TRY_FAILED)).isSameInstanceAs(cfg.getBlock(failed));
    assertThat(cfg.getRevertBlocks()).isEmpty();
    assertThat(cfg.getSuccessBlocks())
        .containsAtLeast(
            cfg.getBlock(succeeded),
            cfg.getBlock(reverted),
            cfg.getBlock(panicked),
            cfg.getBlock(failed));
  }

  @Test
  public void testIfWithBothBranchesRevertingEndsThePath() {
    Node thenRevert = callStatement("revert");
    Node elseRevert = callStatement("revert");
    Node ifStatement =
        n(Token.IF_STATEMENT,
            name("c"), n(Token.BLOCK, thenRevert), n(Token.BLOCK, elseRevert));
    Node after = callStatement("x");
    ControlFlowGraph cfg = cfgOf(function(ifStatement, after));

    BasicBlock entry = cfg.getEntry();
    assertThat(entry.getControlStatement()).isSameInstanceAs(ifStatement);
    assertThat(cfg.getSuccessBlocks()).isEmpty();
    assertThat(cfg.getUnreachableBlocks()).containsExactly(cfg.getBlock(after));
    assertThat(cfg.getRevertBlocks())
        .containsExactly(
            entry, cfg.getBlock(thenRevert), cfg.getBlock(elseRevert), cfg.getRevertExit());
  }
}
