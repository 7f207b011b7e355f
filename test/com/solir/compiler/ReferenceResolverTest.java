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
import static com.solir.compiler.AstFixture.list;
import static com.solir.compiler.ExampleProject.NEW_VERSION;
import static com.solir.compiler.TreeBuilderTest.findFunction;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.solir.compiler.AstFixture.Obj;
import com.solir.ir.Node;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ReferenceResolverTest {

  private static final String TOK_SOURCE =
      "struct Pair {\n"
          + "    uint256 left;\n"
          + "    uint256 right;\n"
          + "}\n"
          + "\n"
          + "contract Tok {\n"
          + "    function mint() public {}\n"
          + "}\n";

  private static final String USE_SOURCE =
      "import \"Tok.sol\" as T;\n"
          + "import {Tok as Token, Pair} from \"Tok.sol\";\n"
          + "\n"
          + "contract Use {\n"
          + "    Pair p;\n"
          + "    T.Pair q;\n"
          + "\n"
          + "    function run() public {\n"
          + "        T.Tok;\n"
          + "        Token;\n"
          + "        p.left;\n"
          + "    }\n"
          + "}\n";

  private static final String KIDS_SOURCE =
      "contract Base {\n"
          + "    function ping() public virtual {}\n"
          + "}\n"
          + "\n"
          + "contract Child is Base {\n"
          + "    function ping() public override {\n"
          + "        super.ping();\n"
          + "        this.ping();\n"
          + "    }\n"
          + "}\n";

  private static final String BROKEN_SOURCE =
      "import \"Gone.sol\";\n"
          + "\n"
          + "contract Broken {\n"
          + "    bool flag;\n"
          + "\n"
          + "    function k(uint256 a) public {}\n"
          + "\n"
          + "    function k(bool a) public {}\n"
          + "\n"
          + "    function run() public {\n"
          + "        missing();\n"
          + "        flag.size;\n"
          + "        k(flag);\n"
          + "    }\n"
          + "}\n";

  private final Compiler compiler = new Compiler();

  /** {@code Tok.sol} and {@code Use.sol}, which imports it under an alias and by symbol. */
  private static CompilationRun importingRun() {
    AstFixture tok = new AstFixture("Tok.sol", TOK_SOURCE, NEW_VERSION, 1);
    Obj pair =
        tok.nodeAt("StructDefinition", "struct Pair", 0)
            .with("name", "Pair")
            .with("visibility", "public")
            .with(
                "members",
                list(
                    tok.variable("left", "uint256 left", 0, tok.elementary("uint256", 0)),
                    tok.variable("right", "uint256 right", 0, tok.elementary("uint256", 1))));
    Obj tokContract =
        tok.contract("Tok", 0).with("nodes", list(tok.withBody(tok.function("mint", 0))));
    tokContract.with("linearizedBaseContracts", list(tokContract.id()));
    Obj tokUnit = tok.sourceUnit(pair, tokContract);

    AstFixture use = new AstFixture("Use.sol", USE_SOURCE, NEW_VERSION, 100);
    Obj aliasImport =
        use.nodeAt("ImportDirective", "import \"Tok.sol\" as", 0)
            .with("file", "Tok.sol")
            .with("absolutePath", "Tok.sol")
            .with("sourceUnit", tokUnit.id())
            .with("unitAlias", "T")
            .with("symbolAliases", list());
    Obj symbolImport =
        use.node("ImportDirective", "import {Tok as Token, Pair} from \"Tok.sol\";", 0)
            .with("file", "Tok.sol")
            .with("absolutePath", "Tok.sol")
            .with("sourceUnit", tokUnit.id())
            .with("unitAlias", "")
            .with(
                "symbolAliases",
                list(
                    new Obj()
                        .with("foreign", use.identifier("Tok", 1, tokContract.id()))
                        .with("local", "Token"),
                    new Obj().with("foreign", use.identifier("Pair", 0, pair.id()))));
    Obj contract = use.contract("Use", 0);
    contract.with("linearizedBaseContracts", list(contract.id()));
    Obj p =
        use.variable(
                "p", "Pair p", 0, use.userType("Pair", pair.id(), 1).with("name", "struct Pair"))
            .with("stateVariable", true);
    Obj q =
        use.variable(
                "q",
                "T.Pair q",
                0,
                use.userType("T.Pair", pair.id(), 0).with("name", "struct Pair"))
            .with("stateVariable", true);
    Obj run =
        use.withBody(
            use.function("run", 0),
            use.expressionStatement(
                "T.Tok;",
                0,
                use.memberAccess("T.Tok", 0, "Tok", use.identifier("T", 2, tokUnit.id()))),
            use.expressionStatement("Token;", 0, use.identifier("Token", 1, tokContract.id())),
            use.expressionStatement(
                "p.left;",
                0,
                use.memberAccess("p.left", 0, "left", use.identifier("p", 1, p.id()))));
    contract.with("nodes", list(p, q, run));

    return AstFixture.run(
        "r",
        NEW_VERSION,
        tok.document(tokUnit),
        use.document(use.sourceUnit(aliasImport, symbolImport, contract)));
  }

  private static CompilationRun inheritingRun() {
    AstFixture k = new AstFixture("Kids.sol", KIDS_SOURCE, NEW_VERSION, 1);
    Obj basePing = k.withBody(k.function("ping", 0).with("virtual", true));
    Obj base = k.contract("Base", 0).with("nodes", list(basePing));
    base.with("linearizedBaseContracts", list(base.id()));

    Obj child = k.contract("Child", 0).with("baseContracts", list(k.inheritance("Base", base, 1)));
    child.with("linearizedBaseContracts", list(child.id(), base.id()));
    Obj childPing =
        k.withBody(
            k.function("ping", 1)
                .with("baseFunctions", list(basePing.id()))
                .with(
                    "overrides",
                    k.node("OverrideSpecifier", "override", 0).with("overrides", list())),
            k.expressionStatement(
                "super.ping();",
                0,
                k.call(
                    "super.ping()",
                    0,
                    k.memberAccess("super.ping", 0, "ping", k.identifier("super", 0, -25)))),
            k.expressionStatement(
                "this.ping();",
                0,
                k.call(
                    "this.ping()",
                    0,
                    k.memberAccess("this.ping", 0, "ping", k.identifier("this", 0, -28)))));
    child.with("nodes", list(childPing));
    return AstFixture.run("r", NEW_VERSION, k.document(k.sourceUnit(base, child)));
  }

  private static CompilationRun brokenRun() {
    AstFixture b = new AstFixture("Broken.sol", BROKEN_SOURCE, NEW_VERSION, 1);
    Obj directive =
        b.nodeAt("ImportDirective", "import", 0)
            .with("file", "Gone.sol")
            .with("absolutePath", "Gone.sol")
            .with("sourceUnit", 9999)
            .with("unitAlias", "")
            .with("symbolAliases", list());
    Obj contract = b.contract("Broken", 0);
    contract.with("linearizedBaseContracts", list(contract.id()));
    Obj flag =
        b.variable("flag", "bool flag", 0, b.elementary("bool", 0)).with("stateVariable", true);
    Obj kUint =
        b.withBody(
            b.withParameters(
                b.function("k", 0), b.variable("a", "uint256 a", 0, b.elementary("uint256", 0))));
    Obj kBool =
        b.withBody(
            b.withParameters(
                b.function("k", 1), b.variable("a", "bool a", 0, b.elementary("bool", 1))));
    Obj run =
        b.withBody(
            b.function("run", 0),
            b.expressionStatement(
                "missing();", 0, b.call("missing()", 0, b.identifier("missing", 0, 9998))),
            b.expressionStatement(
                "flag.size;",
                0,
                b.memberAccess("flag.size", 0, "size", b.identifier("flag", 1, flag.id()))),
            b.expressionStatement(
                "k(flag);",
                0,
                b.call(
                    "k(flag)",
                    0,
                    b.identifier("k", 2, 9997),
                    b.identifier("flag", 2, flag.id()))));
    contract.with("nodes", list(flag, kUint, kBool, run));
    return AstFixture.run("r", NEW_VERSION, b.document(b.sourceUnit(directive, contract)));
  }

  /** The callee or expression of the statements of a function body, in order. */
  private static List<Node> expressionsOf(Node function) {
    List<Node> result = new ArrayList<>();
    for (Node statement : NodeUtil.getBody(function).children()) {
      Node expression = statement.getFirstChild();
      result.add(expression.isFunctionCall() ? NodeUtil.getCallee(expression) : expression);
    }
    return result;
  }

  @Test
  public void testUnitAliasAndSymbolImports() {
    ProjectBuild build = compiler.compile(ImmutableList.of(importingRun()));
    assertThat(build.getWarnings()).isEmpty();

    Node tokUnit = build.getSourceUnit("Tok.sol");
    Node pair = tokUnit.getFirstChild();
    Node tok = tokUnit.getLastChild();
    Node useUnit = build.getSourceUnit("Use.sol");
    Node aliasImport = useUnit.getFirstChild();
    Node symbolImport = aliasImport.getNext();

    assertThat(build.getReference(aliasImport).getTarget()).isSameInstanceAs(tokUnit);
    assertThat(build.getReference(symbolImport.getFirstChild()).getTarget()).isSameInstanceAs(tok);
    assertThat(build.getReference(symbolImport.getSecondChild()).getTarget())
        .isSameInstanceAs(pair);

    List<Node> expressions = expressionsOf(findFunction(useUnit.getLastChild(), "run"));
    Node aliasAccess = expressions.get(0);
    assertThat(build.getReference(aliasAccess.getFirstChild()).getTarget())
        .isSameInstanceAs(tokUnit);
    assertThat(build.getReference(aliasAccess).getTarget()).isSameInstanceAs(tok);
    assertThat(build.getReference(expressions.get(1)).getTarget()).isSameInstanceAs(tok);
    assertThat(build.getReferencesTo(tok)).hasSize(3);
  }

  @Test
  public void testStructMemberAndDottedPath() {
    ProjectBuild build = compiler.compile(ImmutableList.of(importingRun()));
    Node pair = build.getSourceUnit("Tok.sol").getFirstChild();
    Node use = build.getSourceUnit("Use.sol").getLastChild();

    Node fieldAccess = expressionsOf(findFunction(use, "run")).get(2);
    assertThat(build.getReference(fieldAccess).getTarget())
        .isSameInstanceAs(NodeUtil.getFields(pair).get(0));

    Node qType = NodeUtil.getVariableTypeName(NodeUtil.getMemberDeclarations(use).get(1));
    Node qPath = qType.getFirstChild();
    Reference path = build.getReference(qPath);
    assertThat(path.getTarget()).isSameInstanceAs(pair);
    assertThat(path.getPathTargets())
        .containsExactly(build.getSourceUnit("Tok.sol"), pair)
        .inOrder();
    assertThat(build.getReference(qType).getTarget()).isSameInstanceAs(pair);
  }

  @Test
  public void testSuperAndThisMembers() {
    ProjectBuild build = compiler.compile(ImmutableList.of(inheritingRun()));
    Node unit = build.getSourceUnit("Kids.sol");
    Node basePing = findFunction(unit.getFirstChild(), "ping");
    Node childPing = findFunction(unit.getLastChild(), "ping");

    List<Node> accesses = expressionsOf(childPing);
    Reference viaSuper = build.getReference(accesses.get(0));
    assertThat(build.getReference(accesses.get(0).getFirstChild()).getSymbol())
        .isEqualTo(GlobalSymbol.SUPER);
    assertThat(viaSuper.getTarget()).isSameInstanceAs(basePing);
    assertThat(viaSuper.isVirtual()).isFalse();

    Reference viaThis = build.getReference(accesses.get(1));
    assertThat(viaThis.getTarget()).isSameInstanceAs(childPing);
    assertThat(viaThis.isVirtual()).isTrue();
  }

  @Test
  public void testUnresolvedReferencesAreRecordedAndTheBuildContinues() {
    ProjectBuild build = compiler.compile(ImmutableList.of(brokenRun()));
    Node unit = build.getSourceUnit("Broken.sol");
    assertThat(unit).isNotNull();
    assertThat(build.getErrors()).isEmpty();

    Reference gone = build.getReference(unit.getFirstChild());
    assertThat(gone.isResolved()).isFalse();
    assertThat(gone.getReason()).isEqualTo(UnresolvedReason.TARGET_UNAVAILABLE);

    Node run = findFunction(unit.getLastChild(), "run");
    List<Node> expressions = expressionsOf(run);
    assertThat(build.getReference(expressions.get(0)).getReason())
        .isEqualTo(UnresolvedReason.NOT_FOUND);
    assertThat(build.getReference(expressions.get(1)).getReason())
        .isEqualTo(UnresolvedReason.NO_MEMBER_SCOPE);
    assertThat(build.getReference(expressions.get(2)).getReason())
        .isEqualTo(UnresolvedReason.AMBIGUOUS);

    Node flag = NodeUtil.getMemberDeclarations(unit.getLastChild()).get(0);
    assertThat(build.getReference(expressions.get(1).getFirstChild()).getTarget())
        .isSameInstanceAs(flag);
    int unresolved = 0;
    for (IrError warning : build.getWarnings()) {
      if (warning.type() == ReferenceResolver.UNRESOLVED_REFERENCE) {
        unresolved++;
      }
    }
    assertThat(unresolved).isEqualTo(4);
    assertThat(build.getControlFlowGraph(run)).isNotNull();
  }

  @Test
  public void testRebuildOfUnchangedFileIsEquivalent() {
    CompilationRun firstRun =
        AstFixture.run("first", NEW_VERSION, ExampleProject.a(NEW_VERSION, 1));
    CompilationRun secondRun =
        AstFixture.run("second", NEW_VERSION, ExampleProject.a(NEW_VERSION, 700));
    ProjectBuild first = compiler.compile(ImmutableList.of(firstRun));
    ProjectBuild second =
        compiler.compile(
            ImmutableList.of(secondRun),
            first,
            ImmutableSet.of("A.sol"),
            CancellationToken.create());

    Node before = first.getSourceUnit("A.sol");
    Node after = second.getSourceUnit("A.sol");
    assertThat(after).isNotSameInstanceAs(before);
    assertThat(after.isEquivalentTo(before)).isTrue();

    List<Node> beforeNodes = new ArrayList<>();
    NodeUtil.visitPreOrder(before, beforeNodes::add);
    List<Node> afterNodes = new ArrayList<>();
    NodeUtil.visitPreOrder(after, afterNodes::add);
    assertThat(afterNodes).hasSize(beforeNodes.size());

    int compared = 0;
    for (int i = 0; i < beforeNodes.size(); i++) {
      Reference was = first.getReference(beforeNodes.get(i));
      Reference is = second.getReference(afterNodes.get(i));
      if (was == null) {
        assertThat(is).isNull();
        continue;
      }
      assertThat(is).isNotNull();
      assertThat(is.getKind()).isEqualTo(was.getKind());
      assertThat(is.getSymbol()).isEqualTo(was.getSymbol());
      if (was.getTarget() != null) {
        assertThat(is.getTarget()).isNotSameInstanceAs(was.getTarget());
        assertThat(is.getTarget().getSpan()).isEqualTo(was.getTarget().getSpan());
      }
      compared++;
    }
    assertThat(compared).isGreaterThan(0);
  }
}
