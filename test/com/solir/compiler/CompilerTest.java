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
import static com.solir.compiler.ExampleProject.NEW_VERSION;
import static com.solir.compiler.ExampleProject.OLD_VERSION;
import static com.solir.compiler.TreeBuilderTest.findFunction;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.solir.compiler.ControlFlowGraph.Branch;
import com.solir.ir.Node;
import com.solir.ir.Node.Prop;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CompilerTest {

  private final Compiler compiler = new Compiler();

  private static ImmutableList<CompilationRun> libAndMain() {
    AstDocument libNew = ExampleProject.lib(NEW_VERSION, 500);
    return ImmutableList.of(
        AstFixture.run("old", OLD_VERSION, ExampleProject.lib(OLD_VERSION, 1)),
        AstFixture.run(
            "new", NEW_VERSION, libNew, ExampleProject.main(NEW_VERSION, 600, libNew)));
  }

  private static Node kCall(ProjectBuild build) {
    Node h = findFunction(build.getSourceUnit("Main.sol").getLastChild(), "h");
    Node statement = NodeUtil.getBody(h).getFirstChild();
    return NodeUtil.getCallee(statement.getFirstChild());
  }

  @Test
  public void testControlFlowGraphOfBothReleases() {
    for (String version : ImmutableList.of(OLD_VERSION, NEW_VERSION)) {
      ProjectBuild build =
          compiler.compile(
              ImmutableList.of(AstFixture.run("r", version, ExampleProject.a(version, 1))));
      assertThat(build.getErrors()).isEmpty();

      Node f = findFunction(build.getSourceUnit("A.sol").getLastChild(), "f");
      ControlFlowGraph cfg = build.getControlFlowGraph(f);
      assertThat(cfg).isNotNull();

      Node ifStatement = NodeUtil.getBody(f).getFirstChild();
      Node revertStatement = ifStatement.getSecondChild();
      Node gStatement = NodeUtil.getBody(f).getLastChild();

      BasicBlock entry = cfg.getEntry();
      assertThat(entry.getControlStatement()).isSameInstanceAs(ifStatement);
      BasicBlock reverting = cfg.getBlock(revertStatement);
      assertThat(reverting.getControlStatement()).isSameInstanceAs(revertStatement);
      BasicBlock calling = cfg.getBlock(gStatement);
      assertThat(calling.getStatements()).containsExactly(gStatement);

      assertThat(cfg.getRevertBlocks()).containsExactly(entry, reverting, cfg.getRevertExit());
      assertThat(cfg.getSuccessBlocks()).containsExactly(entry, calling, cfg.getSuccessExit());
      assertThat(cfg.isConnectedInDirection(entry, reverting)).isTrue();
      assertThat(cfg.getOutEdges(reverting)).hasSize(1);
      assertThat(cfg.getOutEdges(reverting).get(0).getValue()).isEqualTo(Branch.ON_REVERT);
      assertThat(cfg.getUnreachableBlocks()).isEmpty();
      assertThat(cfg.isReachable(revertStatement, gStatement)).isFalse();
    }
  }

  @Test
  public void testReferenceTargetsMatchAcrossReleases() {
    DeclarationKey[] keys = new DeclarationKey[2];
    List<String> versions = ImmutableList.of(OLD_VERSION, NEW_VERSION);
    for (int i = 0; i < 2; i++) {
      String version = versions.get(i);
      ProjectBuild build =
          compiler.compile(
              ImmutableList.of(AstFixture.run("r" + i, version, ExampleProject.a(version, 1))));
      Node f = findFunction(build.getSourceUnit("A.sol").getLastChild(), "f");
      Node callee = NodeUtil.getCallee(NodeUtil.getBody(f).getLastChild().getFirstChild());

      Reference reference = build.getReference(callee);
      assertThat(reference.getKind()).isEqualTo(Reference.Kind.DECLARATION);
      Node g = reference.getTarget();
      assertThat(NodeUtil.getCanonicalName(g)).isEqualTo("A.g");
      assertThat(build.getReferencesTo(g)).containsExactly(callee);
      keys[i] = DeclarationKey.of(g);
    }
    assertThat(keys[0]).isEqualTo(keys[1]);
  }

  @Test
  public void testRevertResolvesToGlobal() {
    ProjectBuild build =
        compiler.compile(
            ImmutableList.of(
                AstFixture.run("r", NEW_VERSION, ExampleProject.a(NEW_VERSION, 1))));
    Node f = findFunction(build.getSourceUnit("A.sol").getLastChild(), "f");
    Node revertCall = NodeUtil.getBody(f).getFirstChild().getSecondChild().getFirstChild();

    Reference reference = build.getReference(NodeUtil.getCallee(revertCall));
    assertThat(reference.getKind()).isEqualTo(Reference.Kind.GLOBAL);
    assertThat(reference.getSymbol()).isEqualTo(GlobalSymbol.REVERT);
  }

  @Test
  public void testOverridesAndLinearization() {
    ProjectBuild build =
        compiler.compile(
            ImmutableList.of(
                AstFixture.run("r", NEW_VERSION, ExampleProject.a(NEW_VERSION, 1))));
    Node unit = build.getSourceUnit("A.sol");
    Node b = unit.getFirstChild();
    Node a = unit.getLastChild();

    assertThat(build.getOverriders(findFunction(b, "h"))).containsExactly(findFunction(a, "h"));
    assertThat(build.getLinearization(a)).containsExactly(a, b).inOrder();
    assertThat(build.getReference(NodeUtil.getBaseContractPaths(a).get(0)).getTarget())
        .isSameInstanceAs(b);
  }

  @Test
  public void testHintsOfAnotherRunAreTranslated() {
    ProjectBuild build = compiler.compile(libAndMain());

    Node libUnit = build.getSourceUnit("Lib.sol");
    assertThat(libUnit.getStringProp(Prop.RUN_ID)).startsWith("old@");
    assertThat(build.getSourceUnit("Main.sol").getStringProp(Prop.RUN_ID)).startsWith("new@");

    Node l = libUnit.getFirstChild();
    Node kBool = l.getLastChild();
    assertThat(kBool.getString()).isEqualTo("k");

    Reference reference = build.getReference(kCall(build));
    assertThat(reference.getTarget()).isSameInstanceAs(kBool);

    Node m = build.getSourceUnit("Main.sol").getLastChild();
    assertThat(build.getReference(NodeUtil.getBaseContractPaths(m).get(0)).getTarget())
        .isSameInstanceAs(l);
    assertThat(build.getOverriders(findFunction(l, "h"))).containsExactly(findFunction(m, "h"));
    assertThat(build.getImports("Main.sol")).containsExactly("Lib.sol");
    assertThat(build.getImportedBy("Lib.sol")).containsExactly("Main.sol");
  }

  @Test
  public void testIncrementalBuildRetainsUnaffectedFiles() {
    ProjectBuild first = compiler.compile(libAndMain());
    ProjectBuild second =
        compiler.compile(
            libAndMain(), first, ImmutableSet.of("Main.sol"), CancellationToken.create());

    assertThat(second.getRebuiltPaths()).containsExactly("Main.sol");
    assertThat(second.getSourceUnit("Lib.sol")).isSameInstanceAs(first.getSourceUnit("Lib.sol"));
    assertThat(second.getSourceUnit("Main.sol"))
        .isNotSameInstanceAs(first.getSourceUnit("Main.sol"));

    Node kBool = second.getSourceUnit("Lib.sol").getFirstChild().getLastChild();
    assertThat(second.getReference(kCall(second)).getTarget()).isSameInstanceAs(kBool);
  }

  @Test
  public void testChangedImportRebuildsImporters() {
    ProjectBuild first = compiler.compile(libAndMain());
    ProjectBuild second =
        compiler.compile(
            libAndMain(), first, ImmutableSet.of("Lib.sol"), CancellationToken.create());

    assertThat(second.getRebuiltPaths()).containsExactly("Lib.sol", "Main.sol");
    assertThat(second.getSourceUnit("Lib.sol"))
        .isNotSameInstanceAs(first.getSourceUnit("Lib.sol"));
    Node kBool = second.getSourceUnit("Lib.sol").getFirstChild().getLastChild();
    assertThat(second.getReference(kCall(second)).getTarget()).isSameInstanceAs(kBool);
  }

  @Test
  public void testDecodeErrorIsReported() {
    AstFixture broken = new AstFixture("X.sol", "contract X {}\n", NEW_VERSION, 900);
    AstFixture.Obj unit = broken.sourceUnit(broken.nodeAt("NoSuchNode", "contract X", 0));
    ProjectBuild build =
        compiler.compile(
            ImmutableList.of(
                AstFixture.run(
                    "r", NEW_VERSION, ExampleProject.a(NEW_VERSION, 1), broken.document(unit))));

    assertThat(build.getSourceUnit("A.sol")).isNotNull();
    assertThat(build.getSourceUnit("X.sol")).isNull();
    assertThat(build.getErrors()).hasSize(1);
    assertThat(build.getErrors().get(0).type()).isEqualTo(Compiler.STRUCTURAL_DECODE_ERROR);
  }

  @Test(expected = BuildCancelledException.class)
  public void testCancelledBuildThrows() {
    CancellationToken token = CancellationToken.create();
    token.cancel();
    compiler.compile(libAndMain(), null, ImmutableSet.of(), token);
  }
}
