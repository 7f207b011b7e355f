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

package com.solir.ir;

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The kinds of IR nodes. Each kind remembers the {@code nodeType} tag the compiler uses for it in
 * the AST document, and the syntactic category it belongs to.
 *
 * <p>Child layouts of the fixed-shape kinds are documented next to the constant. Optional parts
 * that are absent in the source are filled with {@link #EMPTY}.
 */
public enum Token {
  /** Placeholder for an absent optional child. Never produced by the compiler. */
  EMPTY(null, Category.META, false),

  /** Children: the top-level nodes of the file, in source order. */
  SOURCE_UNIT("SourceUnit", Category.META, false),
  PRAGMA_DIRECTIVE("PragmaDirective", Category.META, false),
  /** Children: one IDENTIFIER per imported symbol, for {@code import {a as b} from "x"}. */
  IMPORT_DIRECTIVE("ImportDirective", Category.META, false),
  /** Children: IDENTIFIER_PATH base name, then the constructor arguments. */
  INHERITANCE_SPECIFIER("InheritanceSpecifier", Category.META, false),
  /** Children: IDENTIFIER_PATH modifier name, then the arguments. */
  MODIFIER_INVOCATION("ModifierInvocation", Category.META, false),
  /** Children: IDENTIFIER_PATH for each named base. */
  OVERRIDE_SPECIFIER("OverrideSpecifier", Category.META, false),
  /** Children: VARIABLE_DECLARATION for each parameter. */
  PARAMETER_LIST("ParameterList", Category.META, false),
  STRUCTURED_DOCUMENTATION("StructuredDocumentation", Category.META, false),
  /** Children: PARAMETER_LIST or EMPTY, BLOCK. The string is the error name. */
  TRY_CATCH_CLAUSE("TryCatchClause", Category.META, false),
  /** Children: IDENTIFIER_PATH library or function list, then type name or EMPTY. */
  USING_FOR_DIRECTIVE("UsingForDirective", Category.META, false),
  /** A dotted name such as {@code A.B}. The string is the full text. */
  IDENTIFIER_PATH("IdentifierPath", Category.META, false),

  /** Children: documentation, INHERITANCE_SPECIFIERs, then members. */
  CONTRACT_DEFINITION("ContractDefinition", Category.DECLARATION, false),
  /**
   * Children: documentation, OVERRIDE_SPECIFIER, PARAMETER_LIST parameters, PARAMETER_LIST return
   * parameters, MODIFIER_INVOCATIONs, BLOCK body or EMPTY.
   */
  FUNCTION_DEFINITION("FunctionDefinition", Category.DECLARATION, false),
  /** Children: documentation, OVERRIDE_SPECIFIER, PARAMETER_LIST, BLOCK body or EMPTY. */
  MODIFIER_DEFINITION("ModifierDefinition", Category.DECLARATION, false),
  EVENT_DEFINITION("EventDefinition", Category.DECLARATION, false),
  ERROR_DEFINITION("ErrorDefinition", Category.DECLARATION, false),
  STRUCT_DEFINITION("StructDefinition", Category.DECLARATION, false),
  ENUM_DEFINITION("EnumDefinition", Category.DECLARATION, false),
  ENUM_VALUE("EnumValue", Category.DECLARATION, false),
  USER_DEFINED_VALUE_TYPE_DEFINITION(
      "UserDefinedValueTypeDefinition", Category.DECLARATION, false),
  /** Children: documentation, OVERRIDE_SPECIFIER, type name or EMPTY, value or EMPTY. */
  VARIABLE_DECLARATION("VariableDeclaration", Category.DECLARATION, false),

  BLOCK("Block", Category.STATEMENT, false),
  UNCHECKED_BLOCK("UncheckedBlock", Category.STATEMENT, false),
  PLACEHOLDER_STATEMENT("PlaceholderStatement", Category.STATEMENT, false),
  /** Children: condition, true body, false body or EMPTY. */
  IF_STATEMENT("IfStatement", Category.STATEMENT, false),
  /** Children: FUNCTION_CALL external call, TRY_CATCH_CLAUSEs. */
  TRY_STATEMENT("TryStatement", Category.STATEMENT, false),
  /** Children: condition, body. */
  WHILE_STATEMENT("WhileStatement", Category.STATEMENT, false),
  /** Children: body, condition. */
  DO_WHILE_STATEMENT("DoWhileStatement", Category.STATEMENT, false),
  /** Children: initialization or EMPTY, condition or EMPTY, loop expression or EMPTY, body. */
  FOR_STATEMENT("ForStatement", Category.STATEMENT, false),
  CONTINUE("Continue", Category.STATEMENT, false),
  BREAK("Break", Category.STATEMENT, false),
  /** Children: the returned expression, if any. */
  RETURN("Return", Category.STATEMENT, false),
  THROW("Throw", Category.STATEMENT, false),
  EMIT_STATEMENT("EmitStatement", Category.STATEMENT, false),
  REVERT_STATEMENT("RevertStatement", Category.STATEMENT, false),
  /** Children: VARIABLE_DECLARATION or EMPTY per tuple slot, then initial value or EMPTY. */
  VARIABLE_DECLARATION_STATEMENT("VariableDeclarationStatement", Category.STATEMENT, false),
  EXPRESSION_STATEMENT("ExpressionStatement", Category.STATEMENT, false),
  /** Children: the YUL_BLOCK, absent for documents that only carry the assembly text. */
  INLINE_ASSEMBLY("InlineAssembly", Category.STATEMENT, false),

  ASSIGNMENT("Assignment", Category.EXPRESSION, false),
  BINARY_OPERATION("BinaryOperation", Category.EXPRESSION, false),
  /** Children: condition, true expression, false expression. */
  CONDITIONAL("Conditional", Category.EXPRESSION, false),
  ELEMENTARY_TYPE_NAME_EXPRESSION("ElementaryTypeNameExpression", Category.EXPRESSION, false),
  /** Children: callee, then the arguments. */
  FUNCTION_CALL("FunctionCall", Category.EXPRESSION, false),
  FUNCTION_CALL_OPTIONS("FunctionCallOptions", Category.EXPRESSION, false),
  IDENTIFIER("Identifier", Category.EXPRESSION, false),
  /** Children: base, index or EMPTY. */
  INDEX_ACCESS("IndexAccess", Category.EXPRESSION, false),
  /** Children: base, start or EMPTY, end or EMPTY. */
  INDEX_RANGE_ACCESS("IndexRangeAccess", Category.EXPRESSION, false),
  LITERAL("Literal", Category.EXPRESSION, false),
  /** Children: the accessed expression. The string is the member name. */
  MEMBER_ACCESS("MemberAccess", Category.EXPRESSION, false),
  NEW_EXPRESSION("NewExpression", Category.EXPRESSION, false),
  TUPLE_EXPRESSION("TupleExpression", Category.EXPRESSION, false),
  UNARY_OPERATION("UnaryOperation", Category.EXPRESSION, false),

  /** Children: base type, length or EMPTY. */
  ARRAY_TYPE_NAME("ArrayTypeName", Category.TYPE_NAME, false),
  ELEMENTARY_TYPE_NAME("ElementaryTypeName", Category.TYPE_NAME, false),
  /** Children: PARAMETER_LIST parameter types, PARAMETER_LIST return types. */
  FUNCTION_TYPE_NAME("FunctionTypeName", Category.TYPE_NAME, false),
  /** Children: key type, value type. */
  MAPPING("Mapping", Category.TYPE_NAME, false),
  /** Children: the IDENTIFIER_PATH naming the type. */
  USER_DEFINED_TYPE_NAME("UserDefinedTypeName", Category.TYPE_NAME, false),

  YUL_BLOCK("YulBlock", Category.STATEMENT, true),
  /** Children: YUL_TYPED_NAMEs, then value or EMPTY. */
  YUL_VARIABLE_DECLARATION("YulVariableDeclaration", Category.STATEMENT, true),
  /** Children: YUL_IDENTIFIERs, then value. */
  YUL_ASSIGNMENT("YulAssignment", Category.STATEMENT, true),
  YUL_EXPRESSION_STATEMENT("YulExpressionStatement", Category.STATEMENT, true),
  /** Children: condition, body. */
  YUL_IF("YulIf", Category.STATEMENT, true),
  /** Children: expression, YUL_CASEs. */
  YUL_SWITCH("YulSwitch", Category.STATEMENT, true),
  /** Children: YUL_LITERAL value or EMPTY for the default case, body. */
  YUL_CASE("YulCase", Category.META, true),
  /** Children: pre block, condition, post block, body. */
  YUL_FOR_LOOP("YulForLoop", Category.STATEMENT, true),
  YUL_BREAK("YulBreak", Category.STATEMENT, true),
  YUL_CONTINUE("YulContinue", Category.STATEMENT, true),
  YUL_LEAVE("YulLeave", Category.STATEMENT, true),
  /** Children: YUL_TYPED_NAME parameters, YUL_TYPED_NAME return variables, body. */
  YUL_FUNCTION_DEFINITION("YulFunctionDefinition", Category.STATEMENT, true),
  /** Children: YUL_IDENTIFIER function name, then the arguments. */
  YUL_FUNCTION_CALL("YulFunctionCall", Category.EXPRESSION, true),
  YUL_IDENTIFIER("YulIdentifier", Category.EXPRESSION, true),
  YUL_LITERAL("YulLiteral", Category.EXPRESSION, true),
  YUL_TYPED_NAME("YulTypedName", Category.META, true);

  /** The syntactic category of a node kind. */
  public enum Category {
    DECLARATION,
    STATEMENT,
    EXPRESSION,
    TYPE_NAME,
    META
  }

  private static final ImmutableMap<String, Token> BY_TAG;

  static {
    ImmutableMap.Builder<String, Token> builder = ImmutableMap.builder();
    for (Token token : values()) {
      if (token.tag != null) {
        builder.put(token.tag, token);
      }
    }
    BY_TAG = builder.buildOrThrow();
  }

  private final @Nullable String tag;
  private final Category category;
  private final boolean yul;

  Token(@Nullable String tag, Category category, boolean yul) {
    this.tag = tag;
    this.category = category;
    this.yul = yul;
  }

  /** Returns the token for a compiler {@code nodeType} tag, or null if the tag is unknown. */
  public static @Nullable Token fromTag(String tag) {
    return BY_TAG.get(tag);
  }

  /** The {@code nodeType} used by the compiler, or null for synthetic kinds. */
  public @Nullable String getTag() {
    return tag;
  }

  public Category getCategory() {
    return category;
  }

  /** Whether this kind belongs to the inline assembly grammar. */
  public boolean isYul() {
    return yul;
  }

  public boolean isDeclaration() {
    return category == Category.DECLARATION;
  }

  public boolean isStatement() {
    return category == Category.STATEMENT;
  }

  public boolean isExpression() {
    return category == Category.EXPRESSION;
  }

  public boolean isTypeName() {
    return category == Category.TYPE_NAME;
  }

  /** Whether nodes of this kind may carry a link to the declaration they name. */
  public boolean isReferenceCapable() {
    switch (this) {
      case IDENTIFIER:
      case MEMBER_ACCESS:
      case IDENTIFIER_PATH:
      case USER_DEFINED_TYPE_NAME:
      case IMPORT_DIRECTIVE:
      case YUL_IDENTIFIER:
        return true;
      default:
        return false;
    }
  }
}
