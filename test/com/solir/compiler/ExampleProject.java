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

import static com.solir.compiler.AstFixture.list;

import com.google.gson.JsonObject;
import com.solir.compiler.AstFixture.Obj;

/** Small projects shared by the compiler, plugin and language server tests. */
public final class ExampleProject {

  public static final String OLD_VERSION = "0.7.6";
  public static final String NEW_VERSION = "0.8.19";

  public static final String A_SOURCE =
      "contract B {\n"
          + "    function h() public virtual {}\n"
          + "}\n"
          + "\n"
          + "contract A is B {\n"
          + "    bool x;\n"
          + "\n"
          + "    function g() public {}\n"
          + "\n"
          + "    function f() public {\n"
          + "        if (x) revert();\n"
          + "        g();\n"
          + "    }\n"
          + "\n"
          + "    function h() public override {}\n"
          + "}\n";

  public static final String LIB_SOURCE =
      "contract L {\n"
          + "    function h() public virtual {}\n"
          + "\n"
          + "    function k(uint256 v) public {}\n"
          + "\n"
          + "    function k(bool v) public {}\n"
          + "}\n";

  public static final String MAIN_SOURCE =
      "import \"Lib.sol\";\n"
          + "\n"
          + "contract M is L {\n"
          + "    function h() public override {\n"
          + "        k(flag);\n"
          + "    }\n"
          + "\n"
          + "    bool flag;\n"
          + "}\n";

  private ExampleProject() {}

  /** {@code A.sol} as emitted by the given release, with ids starting at {@code firstId}. */
  public static AstDocument a(String version, long firstId) {
    AstFixture a = new AstFixture("A.sol", A_SOURCE, version, firstId);
    Obj baseH = a.withBody(a.function("h", 0).with("virtual", true));
    Obj b = a.contract("B", 0).with("nodes", list(baseH));
    b.with("linearizedBaseContracts", list(b.id()));

    Obj contract = a.contract("A", 0).with("baseContracts", list(a.inheritance("B", b, 1)));
    contract.with("linearizedBaseContracts", list(contract.id(), b.id()));
    Obj x = a.variable("x", "bool x", 0, a.elementary("bool", 0)).with("stateVariable", true);
    Obj g = a.withBody(a.function("g", 0));
    Obj revert = a.identifier("revert", 0, -19);
    Obj f =
        a.withBody(
            a.function("f", 0),
            a.ifStatement(
                0,
                a.identifier("x", 1, x.id()),
                a.expressionStatement("revert()", 0, a.call("revert()", 0, revert)),
                null),
            a.expressionStatement("g();", 0, a.call("g()", 1, a.identifier("g", 1, g.id()))));
    Obj h =
        a.withBody(
            a.function("h", 1)
                .with("baseFunctions", list(baseH.id()))
                .with("overrides", a.node("OverrideSpecifier", "override", 0)
                    .with("overrides", list())));
    contract.with("nodes", list(x, g, f, h));
    return a.document(a.sourceUnit(b, contract));
  }

  /** {@code Lib.sol}: contract L with a virtual h and two overloads of k. */
  public static AstDocument lib(String version, long firstId) {
    AstFixture l = new AstFixture("Lib.sol", LIB_SOURCE, version, firstId);
    Obj contract = l.contract("L", 0);
    contract.with("linearizedBaseContracts", list(contract.id()));
    Obj h = l.withBody(l.function("h", 0).with("virtual", true));
    Obj kUint =
        l.withBody(
            l.withParameters(
                l.function("k", 0),
                l.variable("v", "uint256 v", 0, l.elementary("uint256", 0))));
    Obj kBool =
        l.withBody(
            l.withParameters(
                l.function("k", 1), l.variable("v", "bool v", 0, l.elementary("bool", 0))));
    contract.with("nodes", list(h, kUint, kBool));
    return l.document(l.sourceUnit(contract));
  }

  /**
   * {@code Main.sol}: contract M inheriting from L, whose hints refer to the ids of {@code lib}.
   * The call {@code k(flag)} can only be told apart from its overload through the hint.
   */
  public static AstDocument main(String version, long firstId, AstDocument lib) {
    JsonObject libUnit = lib.getAst();
    JsonObject libContract = libUnit.getAsJsonArray("nodes").get(0).getAsJsonObject();
    long libUnitId = libUnit.get("id").getAsLong();
    long libContractId = libContract.get("id").getAsLong();
    long libHId = memberId(libContract, 0);
    long libKBoolId = memberId(libContract, 2);

    AstFixture m = new AstFixture("Main.sol", MAIN_SOURCE, version, firstId);
    Obj directive =
        m.nodeAt("ImportDirective", "import", 0)
            .with("file", "Lib.sol")
            .with("absolutePath", "Lib.sol")
            .with("sourceUnit", libUnitId)
            .with("unitAlias", "")
            .with("symbolAliases", list());
    Obj contract = m.contract("M", 0);
    contract.with("linearizedBaseContracts", list(contract.id(), libContractId));
    contract.with(
        "baseContracts",
        list(
            m.node("InheritanceSpecifier", "L", 0)
                .with("baseName", m.namePath("L", libContractId, 0))));
    Obj flag =
        m.variable("flag", "bool flag", 0, m.elementary("bool", 0)).with("stateVariable", true);
    Obj h =
        m.withBody(
            m.function("h", 0)
                .with("baseFunctions", list(libHId))
                .with("overrides", m.node("OverrideSpecifier", "override", 0)
                    .with("overrides", list())),
            m.expressionStatement(
                "k(flag);",
                0,
                m.call("k(flag)", 0, m.identifier("k", 0, libKBoolId),
                    m.identifier("flag", 0, flag.id()))));
    contract.with("nodes", list(h, flag));
    return m.document(m.sourceUnit(directive, contract));
  }

  private static long memberId(JsonObject contract, int index) {
    return contract.getAsJsonArray("nodes").get(index).getAsJsonObject().get("id").getAsLong();
  }
}
