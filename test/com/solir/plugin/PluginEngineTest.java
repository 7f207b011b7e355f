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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static com.solir.compiler.ExampleProject.NEW_VERSION;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.solir.compiler.AstDocument;
import com.solir.compiler.AstFixture;
import com.solir.compiler.AstFixture.Obj;
import com.solir.compiler.Compiler;
import com.solir.compiler.CompilerOptions;
import com.solir.compiler.ExampleProject;
import com.solir.compiler.ProjectBuild;
import com.solir.ir.Node;
import com.solir.ir.Token;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PluginEngineTest {

  private final CompilerOptions options = new CompilerOptions();

  static ProjectBuild exampleBuild() {
    return new Compiler()
        .compile(
            ImmutableList.of(
                AstFixture.run("r", NEW_VERSION, ExampleProject.a(NEW_VERSION, 1))));
  }

  @Test
  public void testPluginsShareOneWalk() {
    EngineResult result =
        new PluginEngine(
                ImmutableList.of(new SamplePlugins.Calls(), new SamplePlugins.Reverts()), options)
            .run(exampleBuild(), VisitScope.all());

    assertThat(result.failures()).isEmpty();
    assertThat(result.walkedPaths()).containsExactly("A.sol");
    assertThat(
            result.getFindings("calls").stream().map(Finding::message).collect(toImmutableList()))
        .containsExactly("call of revert", "call of g")
        .inOrder();

    ImmutableList<Finding> reverts = result.getFindings("reverts");
    assertThat(reverts).hasSize(1);
    assertThat(reverts.get(0).message()).isEqualTo("f can revert");
    assertThat(reverts.get(0).subfindings()).hasSize(1);
    assertThat(reverts.get(0).subfindings().get(0).node().getSourceText()).isEqualTo("revert();");
  }

  @Test
  public void testFailingPluginIsIsolated() {
    EngineResult result =
        new PluginEngine(
                ImmutableList.of(new SamplePlugins.Throwing(), new SamplePlugins.Calls()), options)
            .run(exampleBuild(), VisitScope.all());

    assertThat(result.hasFailed("throwing")).isTrue();
    assertThat(result.hasFailed("calls")).isFalse();
    PluginFailure failure = result.failures().get(0);
    assertThat(failure.state()).isEqualTo(EngineState.DISPATCHING);
    assertThat(failure.node().getToken()).isEqualTo(Token.IDENTIFIER);
    assertThat(failure.node().getString()).isEqualTo("x");
    assertThat(failure.exception()).isInstanceOf(IllegalStateException.class);

    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0).type()).isEqualTo(PluginEngine.PLUGIN_EXECUTION_ERROR);
    assertThat(result.errors().get(0).sourceName()).isEqualTo("A.sol");
    assertThat(result.getFindings("calls")).hasSize(2);
    assertThat(result.getFindings("throwing")).isEmpty();
  }

  @Test
  public void testAssertionErrorInPluginIsIsolated() {
    EngineResult result =
        new PluginEngine(
                ImmutableList.of(new SamplePlugins.Asserting(), new SamplePlugins.Calls()), options)
            .run(exampleBuild(), VisitScope.all());

    assertThat(result.hasFailed("asserting")).isTrue();
    assertThat(result.failures()).hasSize(1);
    assertThat(result.failures().get(0).exception()).isInstanceOf(AssertionError.class);
    assertThat(result.failures().get(0).node().getString()).isEqualTo("x");
    assertThat(result.getFindings("calls")).hasSize(2);
  }

  @Test
  public void testStackOverflowInPluginIsIsolated() {
    EngineResult result =
        new PluginEngine(
                ImmutableList.of(new SamplePlugins.Overflowing(), new SamplePlugins.Calls()),
                options)
            .run(exampleBuild(), VisitScope.all());

    assertThat(result.hasFailed("overflowing")).isTrue();
    assertThat(result.failures().get(0).exception()).isInstanceOf(StackOverflowError.class);
    assertThat(result.errors()).hasSize(1);
    assertThat(result.getFindings("calls")).hasSize(2);
  }

  @Test
  public void testOutOfMemoryEndsTheRun() {
    Plugin exhausted =
        new SamplePlugins.Named("exhausted") {
          @Override
          public void visitSourceUnit(Node n) {
            throw new OutOfMemoryError("simulated");
          }
        };
    PluginEngine engine =
        new PluginEngine(ImmutableList.of(exhausted, new SamplePlugins.Calls()), options);

    assertThrows(OutOfMemoryError.class, () -> engine.run(exampleBuild(), VisitScope.all()));
    assertThat(engine.getState()).isEqualTo(EngineState.DONE);
  }

  @Test
  public void testFailureWhileReportingKeepsOtherFindings() {
    Plugin failingReport =
        new SamplePlugins.Named("broken") {
          @Override
          public List<Finding> report() {
            throw new UnsupportedOperationException();
          }
        };
    EngineResult result =
        new PluginEngine(ImmutableList.of(failingReport, new SamplePlugins.Calls()), options)
            .run(exampleBuild(), VisitScope.all());

    assertThat(result.failures()).hasSize(1);
    assertThat(result.failures().get(0).state()).isEqualTo(EngineState.REPORTING);
    assertThat(result.failures().get(0).node()).isNull();
    assertThat(result.getFindings("calls")).hasSize(2);
  }

  @Test
  public void testStatesOfARun() {
    List<EngineState> seen = new ArrayList<>();
    PluginEngine[] engine = new PluginEngine[1];
    Plugin recorder =
        new SamplePlugins.Named("recorder") {
          @Override
          public void beginRun(PluginContext context) {
            seen.add(engine[0].getState());
          }

          @Override
          public void visitSourceUnit(Node n) {
            seen.add(engine[0].getState());
          }

          @Override
          public List<Finding> report() {
            seen.add(engine[0].getState());
            return ImmutableList.of();
          }
        };
    engine[0] = new PluginEngine(ImmutableList.of(recorder), options);

    assertThat(engine[0].getState()).isEqualTo(EngineState.DONE);
    engine[0].run(exampleBuild(), VisitScope.all());
    assertThat(seen)
        .containsExactly(EngineState.CONFIGURING, EngineState.DISPATCHING, EngineState.REPORTING)
        .inOrder();
    assertThat(engine[0].getState()).isEqualTo(EngineState.DONE);
  }

  @Test
  public void testScopeSelectsFiles() {
    AstDocument lib = ExampleProject.lib(NEW_VERSION, 1);
    ProjectBuild build =
        new Compiler()
            .compile(
                ImmutableList.of(
                    AstFixture.run(
                        "r", NEW_VERSION, lib, ExampleProject.main(NEW_VERSION, 100, lib))));

    EngineResult result =
        new PluginEngine(ImmutableList.of(new SamplePlugins.Calls()), options)
            .run(build, VisitScope.paths(ImmutableSet.of("Main.sol")));
    assertThat(result.walkedPaths()).containsExactly("Main.sol");
    assertThat(result.getFindings("calls")).hasSize(1);
    assertThat(result.getFindings("calls").get(0).message()).isEqualTo("call of k");
  }

  @Test
  public void testSuppressionComments() {
    String source =
        "contract S {\n"
            + "    function a() public {\n"
            + "        g(); // solir-disable-line calls\n"
            + "        g();\n"
            + "        // solir-disable-next-line\n"
            + "        g();\n"
            + "    }\n"
            + "\n"
            + "    function g() public {}\n"
            + "}\n";
    AstFixture s = new AstFixture("S.sol", source, NEW_VERSION, 1);
    Obj g = s.withBody(s.function("g", 0));
    List<Object> statements = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      statements.add(
          s.expressionStatement("g();", i, s.call("g()", i, s.identifier("g", i, g.id()))));
    }
    Obj a = s.withBody(s.function("a", 0), statements.toArray());
    Obj contract = s.contract("S", 0).with("nodes", AstFixture.list(a, g));
    ProjectBuild build =
        new Compiler()
            .compile(
                ImmutableList.of(
                    AstFixture.run("r", NEW_VERSION, s.document(s.sourceUnit(contract)))));

    EngineResult result =
        new PluginEngine(ImmutableList.of(new SamplePlugins.Calls()), options)
            .run(build, VisitScope.all());
    assertThat(result.getFindings("calls")).hasSize(1);
    assertThat(result.getFindings("calls").get(0).node().getLineno()).isEqualTo(4);
    assertThat(result.suppressedCount()).isEqualTo(2);
  }

  @Test
  public void testContextLinks() {
    options.setLinkFormat("vscode://file/{path}:{line}:{col}");
    String[] link = new String[2];
    Plugin linker =
        new SamplePlugins.Named("linker") {
          private PluginContext context;

          @Override
          public void beginRun(PluginContext context) {
            this.context = context;
            link[1] = context.getLocationLink("A.sol", 3, 7);
          }

          @Override
          public void visitIfStatement(Node n) {
            link[0] = context.getLocationLink(n);
          }
        };
    new PluginEngine(ImmutableList.of(linker), options).run(exampleBuild(), VisitScope.all());

    assertThat(link[0]).isEqualTo("vscode://file/A.sol:11:9");
    assertThat(link[1]).isEqualTo("vscode://file/A.sol:3:7");
  }
}
