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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import com.solir.ir.Node;
import com.solir.ir.Token;
import com.solir.ir.Token.Category;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The callbacks a plugin class overrides. Computed once per class, so that the engine can skip a
 * plugin for node kinds it has no interest in.
 *
 * <p>Overrides are found by looking up each callback on the plugin class and checking whether
 * {@link Plugin} still declares it. Plugins are loaded from directories and packages this project
 * does not compile, so reflection is the only way to learn their callbacks without asking every
 * plugin author to list them by hand and keep the list in sync. The lookup runs once per class
 * through a {@link ClassValue}; dispatch itself is a plain {@code switch}.
 */
public final class PluginCapabilities {

  private static final ImmutableMap<Token, String> KIND_CALLBACKS =
      ImmutableMap.<Token, String>builder()
          .put(Token.SOURCE_UNIT, "visitSourceUnit")
          .put(Token.PRAGMA_DIRECTIVE, "visitPragmaDirective")
          .put(Token.IMPORT_DIRECTIVE, "visitImportDirective")
          .put(Token.INHERITANCE_SPECIFIER, "visitInheritanceSpecifier")
          .put(Token.MODIFIER_INVOCATION, "visitModifierInvocation")
          .put(Token.OVERRIDE_SPECIFIER, "visitOverrideSpecifier")
          .put(Token.PARAMETER_LIST, "visitParameterList")
          .put(Token.STRUCTURED_DOCUMENTATION, "visitStructuredDocumentation")
          .put(Token.TRY_CATCH_CLAUSE, "visitTryCatchClause")
          .put(Token.USING_FOR_DIRECTIVE, "visitUsingForDirective")
          .put(Token.IDENTIFIER_PATH, "visitIdentifierPath")
          .put(Token.CONTRACT_DEFINITION, "visitContractDefinition")
          .put(Token.FUNCTION_DEFINITION, "visitFunctionDefinition")
          .put(Token.MODIFIER_DEFINITION, "visitModifierDefinition")
          .put(Token.EVENT_DEFINITION, "visitEventDefinition")
          .put(Token.ERROR_DEFINITION, "visitErrorDefinition")
          .put(Token.STRUCT_DEFINITION, "visitStructDefinition")
          .put(Token.ENUM_DEFINITION, "visitEnumDefinition")
          .put(Token.ENUM_VALUE, "visitEnumValue")
          .put(Token.VARIABLE_DECLARATION, "visitVariableDeclaration")
          .put(Token.BLOCK, "visitBlock")
          .put(Token.UNCHECKED_BLOCK, "visitUncheckedBlock")
          .put(Token.PLACEHOLDER_STATEMENT, "visitPlaceholderStatement")
          .put(Token.IF_STATEMENT, "visitIfStatement")
          .put(Token.TRY_STATEMENT, "visitTryStatement")
          .put(Token.WHILE_STATEMENT, "visitWhileStatement")
          .put(Token.DO_WHILE_STATEMENT, "visitDoWhileStatement")
          .put(Token.FOR_STATEMENT, "visitForStatement")
          .put(Token.CONTINUE, "visitContinue")
          .put(Token.BREAK, "visitBreak")
          .put(Token.RETURN, "visitReturn")
          .put(Token.THROW, "visitThrow")
          .put(Token.EMIT_STATEMENT, "visitEmitStatement")
          .put(Token.REVERT_STATEMENT, "visitRevertStatement")
          .put(Token.VARIABLE_DECLARATION_STATEMENT, "visitVariableDeclarationStatement")
          .put(Token.EXPRESSION_STATEMENT, "visitExpressionStatement")
          .put(Token.INLINE_ASSEMBLY, "visitInlineAssembly")
          .put(Token.ASSIGNMENT, "visitAssignment")
          .put(Token.BINARY_OPERATION, "visitBinaryOperation")
          .put(Token.CONDITIONAL, "visitConditional")
          .put(Token.ELEMENTARY_TYPE_NAME_EXPRESSION, "visitElementaryTypeNameExpression")
          .put(Token.FUNCTION_CALL, "visitFunctionCall")
          .put(Token.FUNCTION_CALL_OPTIONS, "visitFunctionCallOptions")
          .put(Token.IDENTIFIER, "visitIdentifier")
          .put(Token.INDEX_ACCESS, "visitIndexAccess")
          .put(Token.INDEX_RANGE_ACCESS, "visitIndexRangeAccess")
          .put(Token.LITERAL, "visitLiteral")
          .put(Token.MEMBER_ACCESS, "visitMemberAccess")
          .put(Token.NEW_EXPRESSION, "visitNewExpression")
          .put(Token.TUPLE_EXPRESSION, "visitTupleExpression")
          .put(Token.UNARY_OPERATION, "visitUnaryOperation")
          .put(Token.ARRAY_TYPE_NAME, "visitArrayTypeName")
          .put(Token.ELEMENTARY_TYPE_NAME, "visitElementaryTypeName")
          .put(Token.FUNCTION_TYPE_NAME, "visitFunctionTypeName")
          .put(Token.MAPPING, "visitMapping")
          .put(Token.USER_DEFINED_TYPE_NAME, "visitUserDefinedTypeName")
          .put(Token.YUL_BLOCK, "visitYulBlock")
          .put(Token.YUL_VARIABLE_DECLARATION, "visitYulVariableDeclaration")
          .put(Token.YUL_ASSIGNMENT, "visitYulAssignment")
          .put(Token.YUL_EXPRESSION_STATEMENT, "visitYulExpressionStatement")
          .put(Token.YUL_IF, "visitYulIf")
          .put(Token.YUL_SWITCH, "visitYulSwitch")
          .put(Token.YUL_CASE, "visitYulCase")
          .put(Token.YUL_FOR_LOOP, "visitYulForLoop")
          .put(Token.YUL_BREAK, "visitYulBreak")
          .put(Token.YUL_CONTINUE, "visitYulContinue")
          .put(Token.YUL_LEAVE, "visitYulLeave")
          .put(Token.YUL_FUNCTION_DEFINITION, "visitYulFunctionDefinition")
          .put(Token.YUL_FUNCTION_CALL, "visitYulFunctionCall")
          .put(Token.YUL_IDENTIFIER, "visitYulIdentifier")
          .put(Token.YUL_LITERAL, "visitYulLiteral")
          .put(Token.YUL_TYPED_NAME, "visitYulTypedName")
          .buildOrThrow();

  private static final ImmutableMap<Category, String> CATEGORY_CALLBACKS =
      ImmutableMap.of(
          Category.DECLARATION, "visitDeclaration",
          Category.STATEMENT, "visitStatement",
          Category.EXPRESSION, "visitExpression",
          Category.TYPE_NAME, "visitTypeName",
          Category.META, "visitMeta");

  private static final ClassValue<PluginCapabilities> CACHE =
      new ClassValue<PluginCapabilities>() {
        @Override
        protected PluginCapabilities computeValue(Class<?> type) {
          return compute(type.asSubclass(Plugin.class));
        }
      };

  private final Set<Token> kinds;
  private final Set<Category> categories;
  private final boolean yul;

  private PluginCapabilities(Set<Token> kinds, Set<Category> categories, boolean yul) {
    this.kinds = Sets.immutableEnumSet(kinds);
    this.categories = Sets.immutableEnumSet(categories);
    this.yul = yul;
  }

  public static PluginCapabilities of(Plugin plugin) {
    return CACHE.get(plugin.getClass());
  }

  private static PluginCapabilities compute(Class<? extends Plugin> type) {
    Set<Token> kinds = EnumSet.noneOf(Token.class);
    for (Map.Entry<Token, String> entry : KIND_CALLBACKS.entrySet()) {
      if (overrides(type, entry.getValue())) {
        kinds.add(entry.getKey());
      }
    }
    Set<Category> categories = EnumSet.noneOf(Category.class);
    for (Map.Entry<Category, String> entry : CATEGORY_CALLBACKS.entrySet()) {
      if (overrides(type, entry.getValue())) {
        categories.add(entry.getKey());
      }
    }
    return new PluginCapabilities(kinds, categories, overrides(type, "visitYul"));
  }

  private static boolean overrides(Class<? extends Plugin> type, String callback) {
    try {
      return type.getMethod(callback, Node.class).getDeclaringClass() != Plugin.class;
    } catch (NoSuchMethodException e) {
      throw new IllegalStateException("Missing callback " + callback, e);
    }
  }

  /** Whether any callback of the plugin applies to nodes of the given kind. */
  public boolean handles(Token kind) {
    return kinds.contains(kind)
        || categories.contains(kind.getCategory())
        || (yul && kind.isYul());
  }

  /** Invokes the callbacks of {@code plugin} that apply to {@code n}, most general first. */
  void dispatch(Plugin plugin, Node n) {
    Token kind = n.getToken();
    if (yul && kind.isYul()) {
      plugin.visitYul(n);
    }
    if (categories.contains(kind.getCategory())) {
      switch (kind.getCategory()) {
        case DECLARATION:
          plugin.visitDeclaration(n);
          break;
        case STATEMENT:
          plugin.visitStatement(n);
          break;
        case EXPRESSION:
          plugin.visitExpression(n);
          break;
        case TYPE_NAME:
          plugin.visitTypeName(n);
          break;
        case META:
          plugin.visitMeta(n);
          break;
      }
    }
    if (kinds.contains(kind)) {
      dispatchKind(plugin, n);
    }
  }

  private static void dispatchKind(Plugin plugin, Node n) {
    switch (n.getToken()) {
      case SOURCE_UNIT:
        plugin.visitSourceUnit(n);
        return;
      case PRAGMA_DIRECTIVE:
        plugin.visitPragmaDirective(n);
        return;
      case IMPORT_DIRECTIVE:
        plugin.visitImportDirective(n);
        return;
      case INHERITANCE_SPECIFIER:
        plugin.visitInheritanceSpecifier(n);
        return;
      case MODIFIER_INVOCATION:
        plugin.visitModifierInvocation(n);
        return;
      case OVERRIDE_SPECIFIER:
        plugin.visitOverrideSpecifier(n);
        return;
      case PARAMETER_LIST:
        plugin.visitParameterList(n);
        return;
      case STRUCTURED_DOCUMENTATION:
        plugin.visitStructuredDocumentation(n);
        return;
      case TRY_CATCH_CLAUSE:
        plugin.visitTryCatchClause(n);
        return;
      case USING_FOR_DIRECTIVE:
        plugin.visitUsingForDirective(n);
        return;
      case IDENTIFIER_PATH:
        plugin.visitIdentifierPath(n);
        return;
      case CONTRACT_DEFINITION:
        plugin.visitContractDefinition(n);
        return;
      case FUNCTION_DEFINITION:
        plugin.visitFunctionDefinition(n);
        return;
      case MODIFIER_DEFINITION:
        plugin.visitModifierDefinition(n);
        return;
      case EVENT_DEFINITION:
        plugin.visitEventDefinition(n);
        return;
      case ERROR_DEFINITION:
        plugin.visitErrorDefinition(n);
        return;
      case STRUCT_DEFINITION:
        plugin.visitStructDefinition(n);
        return;
      case ENUM_DEFINITION:
        plugin.visitEnumDefinition(n);
        return;
      case ENUM_VALUE:
        plugin.visitEnumValue(n);
        return;
      case VARIABLE_DECLARATION:
        plugin.visitVariableDeclaration(n);
        return;
      case BLOCK:
        plugin.visitBlock(n);
        return;
      case UNCHECKED_BLOCK:
        plugin.visitUncheckedBlock(n);
        return;
      case PLACEHOLDER_STATEMENT:
        plugin.visitPlaceholderStatement(n);
        return;
      case IF_STATEMENT:
        plugin.visitIfStatement(n);
        return;
      case TRY_STATEMENT:
        plugin.visitTryStatement(n);
        return;
      case WHILE_STATEMENT:
        plugin.visitWhileStatement(n);
        return;
      case DO_WHILE_STATEMENT:
        plugin.visitDoWhileStatement(n);
        return;
      case FOR_STATEMENT:
        plugin.visitForStatement(n);
        return;
      case CONTINUE:
        plugin.visitContinue(n);
        return;
      case BREAK:
        plugin.visitBreak(n);
        return;
      case RETURN:
        plugin.visitReturn(n);
        return;
      case THROW:
        plugin.visitThrow(n);
        return;
      case EMIT_STATEMENT:
        plugin.visitEmitStatement(n);
        return;
      case REVERT_STATEMENT:
        plugin.visitRevertStatement(n);
        return;
      case VARIABLE_DECLARATION_STATEMENT:
        plugin.visitVariableDeclarationStatement(n);
        return;
      case EXPRESSION_STATEMENT:
        plugin.visitExpressionStatement(n);
        return;
      case INLINE_ASSEMBLY:
        plugin.visitInlineAssembly(n);
        return;
      case ASSIGNMENT:
        plugin.visitAssignment(n);
        return;
      case BINARY_OPERATION:
        plugin.visitBinaryOperation(n);
        return;
      case CONDITIONAL:
        plugin.visitConditional(n);
        return;
      case ELEMENTARY_TYPE_NAME_EXPRESSION:
        plugin.visitElementaryTypeNameExpression(n);
        return;
      case FUNCTION_CALL:
        plugin.visitFunctionCall(n);
        return;
      case FUNCTION_CALL_OPTIONS:
        plugin.visitFunctionCallOptions(n);
        return;
      case IDENTIFIER:
        plugin.visitIdentifier(n);
        return;
      case INDEX_ACCESS:
        plugin.visitIndexAccess(n);
        return;
      case INDEX_RANGE_ACCESS:
        plugin.visitIndexRangeAccess(n);
        return;
      case LITERAL:
        plugin.visitLiteral(n);
        return;
      case MEMBER_ACCESS:
        plugin.visitMemberAccess(n);
        return;
      case NEW_EXPRESSION:
        plugin.visitNewExpression(n);
        return;
      case TUPLE_EXPRESSION:
        plugin.visitTupleExpression(n);
        return;
      case UNARY_OPERATION:
        plugin.visitUnaryOperation(n);
        return;
      case ARRAY_TYPE_NAME:
        plugin.visitArrayTypeName(n);
        return;
      case ELEMENTARY_TYPE_NAME:
        plugin.visitElementaryTypeName(n);
        return;
      case FUNCTION_TYPE_NAME:
        plugin.visitFunctionTypeName(n);
        return;
      case MAPPING:
        plugin.visitMapping(n);
        return;
      case USER_DEFINED_TYPE_NAME:
        plugin.visitUserDefinedTypeName(n);
        return;
      case YUL_BLOCK:
        plugin.visitYulBlock(n);
        return;
      case YUL_VARIABLE_DECLARATION:
        plugin.visitYulVariableDeclaration(n);
        return;
      case YUL_ASSIGNMENT:
        plugin.visitYulAssignment(n);
        return;
      case YUL_EXPRESSION_STATEMENT:
        plugin.visitYulExpressionStatement(n);
        return;
      case YUL_IF:
        plugin.visitYulIf(n);
        return;
      case YUL_SWITCH:
        plugin.visitYulSwitch(n);
        return;
      case YUL_CASE:
        plugin.visitYulCase(n);
        return;
      case YUL_FOR_LOOP:
        plugin.visitYulForLoop(n);
        return;
      case YUL_BREAK:
        plugin.visitYulBreak(n);
        return;
      case YUL_CONTINUE:
        plugin.visitYulContinue(n);
        return;
      case YUL_LEAVE:
        plugin.visitYulLeave(n);
        return;
      case YUL_FUNCTION_DEFINITION:
        plugin.visitYulFunctionDefinition(n);
        return;
      case YUL_FUNCTION_CALL:
        plugin.visitYulFunctionCall(n);
        return;
      case YUL_IDENTIFIER:
        plugin.visitYulIdentifier(n);
        return;
      case YUL_LITERAL:
        plugin.visitYulLiteral(n);
        return;
      case YUL_TYPED_NAME:
        plugin.visitYulTypedName(n);
        return;
      case EMPTY:
        return;
    }
    throw new IllegalStateException("Unexpected kind " + n.getToken());
  }

  @Override
  public String toString() {
    return "PluginCapabilities" + kinds + categories + (yul ? "+yul" : "");
  }
}
