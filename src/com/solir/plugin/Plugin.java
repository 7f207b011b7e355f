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

import com.solir.ir.Node;
import java.util.List;

/**
 * A detector or printer run by the {@link PluginEngine}.
 *
 * <p>During a run the engine walks the selected source units in pre-order. For every node it
 * calls the category callbacks that apply, then the callback for the node's kind. All callbacks
 * default to doing nothing, and the engine skips the ones a plugin does not override. After the
 * walk, {@link #report()} is called once.
 *
 * <p>Plugins are instantiated once and reused across runs, so per-run state must be reset in
 * {@link #beginRun}.
 */
public interface Plugin {

  /** The name plugins are selected and shadowed by. */
  String name();

  /** Called before the walk of each run. */
  default void beginRun(PluginContext context) {}

  /** Returns the findings of the run that just ended. */
  List<Finding> report();

  // Category callbacks

  default void visitDeclaration(Node n) {}

  default void visitStatement(Node n) {}

  default void visitExpression(Node n) {}

  default void visitTypeName(Node n) {}

  default void visitMeta(Node n) {}

  /** Called for every inline assembly node, before its category callback. */
  default void visitYul(Node n) {}

  // Kind callbacks

  default void visitSourceUnit(Node n) {}

  default void visitPragmaDirective(Node n) {}

  default void visitImportDirective(Node n) {}

  default void visitInheritanceSpecifier(Node n) {}

  default void visitModifierInvocation(Node n) {}

  default void visitOverrideSpecifier(Node n) {}

  default void visitParameterList(Node n) {}

  default void visitStructuredDocumentation(Node n) {}

  default void visitTryCatchClause(Node n) {}

  default void visitUsingForDirective(Node n) {}

  default void visitIdentifierPath(Node n) {}

  default void visitContractDefinition(Node n) {}

  default void visitFunctionDefinition(Node n) {}

  default void visitModifierDefinition(Node n) {}

  default void visitEventDefinition(Node n) {}

  default void visitErrorDefinition(Node n) {}

  default void visitStructDefinition(Node n) {}

  default void visitEnumDefinition(Node n) {}

  default void visitEnumValue(Node n) {}

  default void visitVariableDeclaration(Node n) {}

  default void visitBlock(Node n) {}

  default void visitUncheckedBlock(Node n) {}

  default void visitPlaceholderStatement(Node n) {}

  default void visitIfStatement(Node n) {}

  default void visitTryStatement(Node n) {}

  default void visitWhileStatement(Node n) {}

  default void visitDoWhileStatement(Node n) {}

  default void visitForStatement(Node n) {}

  default void visitContinue(Node n) {}

  default void visitBreak(Node n) {}

  default void visitReturn(Node n) {}

  default void visitThrow(Node n) {}

  default void visitEmitStatement(Node n) {}

  default void visitRevertStatement(Node n) {}

  default void visitVariableDeclarationStatement(Node n) {}

  default void visitExpressionStatement(Node n) {}

  default void visitInlineAssembly(Node n) {}

  default void visitAssignment(Node n) {}

  default void visitBinaryOperation(Node n) {}

  default void visitConditional(Node n) {}

  default void visitElementaryTypeNameExpression(Node n) {}

  default void visitFunctionCall(Node n) {}

  default void visitFunctionCallOptions(Node n) {}

  default void visitIdentifier(Node n) {}

  default void visitIndexAccess(Node n) {}

  default void visitIndexRangeAccess(Node n) {}

  default void visitLiteral(Node n) {}

  default void visitMemberAccess(Node n) {}

  default void visitNewExpression(Node n) {}

  default void visitTupleExpression(Node n) {}

  default void visitUnaryOperation(Node n) {}

  default void visitArrayTypeName(Node n) {}

  default void visitElementaryTypeName(Node n) {}

  default void visitFunctionTypeName(Node n) {}

  default void visitMapping(Node n) {}

  default void visitUserDefinedTypeName(Node n) {}

  default void visitYulBlock(Node n) {}

  default void visitYulVariableDeclaration(Node n) {}

  default void visitYulAssignment(Node n) {}

  default void visitYulExpressionStatement(Node n) {}

  default void visitYulIf(Node n) {}

  default void visitYulSwitch(Node n) {}

  default void visitYulCase(Node n) {}

  default void visitYulForLoop(Node n) {}

  default void visitYulBreak(Node n) {}

  default void visitYulContinue(Node n) {}

  default void visitYulLeave(Node n) {}

  default void visitYulFunctionDefinition(Node n) {}

  default void visitYulFunctionCall(Node n) {}

  default void visitYulIdentifier(Node n) {}

  default void visitYulLiteral(Node n) {}

  default void visitYulTypedName(Node n) {}
}
