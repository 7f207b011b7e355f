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

import static com.google.common.truth.Truth.assertThat;

import com.solir.ir.Node;
import com.solir.ir.SourceFile;
import com.solir.ir.SourceSpan;
import com.solir.ir.Token;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SuppressionCommentsTest {

  private static final String SOURCE =
      "contract C {\n"
          + "    function f() public {\n"
          + "        a(); // solir-disable-line x, y\n"
          + "        // solir-disable-next-line\n"
          + "        b();\n"
          + "        // solir-disable x\n"
          + "        c();\n"
          + "        // solir-enable x\n"
          + "        d();\n"
          + "        e(\"// solir-disable-line\");\n"
          + "    }\n"
          + "}\n";

  private SourceFile file;
  private Node unit;
  private SuppressionComments comments;

  @Before
  public void setUp() {
    file = new SourceFile("C.sol", SOURCE);
    unit = new Node(Token.SOURCE_UNIT);
    unit.putProp(Node.Prop.SOURCE_FILE, file);
    unit.setSpan(new SourceSpan("C.sol", 0, file.getNumBytes()));
    comments = SuppressionComments.parse(file);
  }

  private Node statementOn(int firstLine, int lastLine) {
    return nodeOn(Token.EXPRESSION_STATEMENT, firstLine, lastLine);
  }

  private Node nodeOn(Token token, int firstLine, int lastLine) {
    int start = file.getLineOffset(firstLine) + 4;
    int end = file.getLineOffset(lastLine) + 6;
    Node n = new Node(token);
    n.setSpan(new SourceSpan("C.sol", start, end - start));
    unit.addChildToBack(n);
    return n;
  }

  @Test
  public void testDisableLineNamesPlugins() {
    Node a = statementOn(3, 3);
    assertThat(comments.isSuppressed("x", a)).isTrue();
    assertThat(comments.isSuppressed("y", a)).isTrue();
    assertThat(comments.isSuppressed("z", a)).isFalse();
  }

  @Test
  public void testDisableNextLineWithoutNamesAppliesToAll() {
    Node b = statementOn(5, 5);
    assertThat(comments.isSuppressed("x", b)).isTrue();
    assertThat(comments.isSuppressed("anything", b)).isTrue();
  }

  @Test
  public void testDisabledRegionEndsAtEnable() {
    assertThat(comments.isSuppressed("x", statementOn(7, 7))).isTrue();
    assertThat(comments.isSuppressed("y", statementOn(7, 7))).isFalse();
    assertThat(comments.isSuppressed("x", statementOn(9, 9))).isFalse();
  }

  @Test
  public void testCommentMarkerInStringIsIgnored() {
    assertThat(comments.isSuppressed("x", statementOn(10, 10))).isFalse();
  }

  @Test
  public void testStatementEndingOnDisabledLine() {
    assertThat(comments.isSuppressed("x", statementOn(2, 3))).isTrue();
  }

  @Test
  public void testDeclarationOnlyChecksItsFirstLine() {
    assertThat(comments.isSuppressed("x", nodeOn(Token.FUNCTION_DEFINITION, 2, 3))).isFalse();
  }

  @Test
  public void testDetachedNodeIsNeverSuppressed() {
    Node detached = new Node(Token.EXPRESSION_STATEMENT);
    detached.setSpan(new SourceSpan("C.sol", file.getLineOffset(3), 4));
    assertThat(comments.isSuppressed("x", detached)).isFalse();
  }
}
