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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.solir.ir.ExternalReference;
import com.solir.ir.Node;
import com.solir.ir.Node.Prop;
import com.solir.ir.SourceFile;
import com.solir.ir.SourceSpan;
import com.solir.ir.Token;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Converts the AST document of one source file into a tree of {@link Node}s.
 *
 * <p>Documents emitted by different compiler releases describe some constructs differently. The
 * decoding rules branch on the version of the run the document belongs to, and both shapes are
 * normalized into the same node kind:
 *
 * <ul>
 *   <li>a user defined type name carries a {@code name} before 0.8.0 and a {@code pathNode} from
 *       0.8.0 on; both become a USER_DEFINED_TYPE_NAME owning an IDENTIFIER_PATH,
 *   <li>base contracts, overrides and using-for libraries are user defined type names before
 *       0.8.0 and identifier paths from 0.8.0 on; both become IDENTIFIER_PATH,
 *   <li>modifier names are identifiers before 0.8.0; both become IDENTIFIER_PATH,
 *   <li>elementary type name expressions carry a plain string before 0.6.0,
 *   <li>documentation is a plain string before 0.6.3,
 *   <li>inline assembly only carries its text before 0.6.0.
 * </ul>
 *
 * <p>Anything else that does not match fails with a {@link StructuralDecodeException}.
 */
public final class TreeBuilder {
  private static final Logger logger = Logger.getLogger(TreeBuilder.class.getName());

  private final String runId;
  private final SolidityVersion version;
  private final NodeIndex index;
  private final SourceFile sourceFile;
  private final String path;

  // Names of the enclosing declarations, outermost first.
  private final Deque<String> scopeNames = new ArrayDeque<>();

  private TreeBuilder(CompilationRun run, AstDocument doc, NodeIndex index) {
    this.runId = index.getRunId();
    this.version = run.getVersion();
    this.index = index;
    this.sourceFile = doc.getSourceFile();
    this.path = doc.getPath();
  }

  /**
   * Builds the SOURCE_UNIT tree of {@code doc} and registers every numbered node in {@code index}.
   *
   * @throws StructuralDecodeException if the document has an unknown or malformed shape
   */
  public static Node build(CompilationRun run, AstDocument doc, NodeIndex index) {
    checkNotNull(run.getDocument(doc.getPath()), "%s is not part of %s", doc, run);
    TreeBuilder builder = new TreeBuilder(run, doc, index);
    Node root = builder.decode(doc.getAst());
    if (!root.isSourceUnit()) {
      throw builder.error(doc.getAst(), "Document root is not a source unit");
    }
    logger.fine(() -> "Built " + doc.getPath() + " from run " + run.getRunId());
    return root;
  }

  private Node decode(JsonObject o) {
    String tag = nodeType(o);
    Token token = Token.fromTag(tag);
    if (token == null) {
      throw error(o, "Unknown node kind");
    }
    switch (token) {
      case SOURCE_UNIT:
        return decodeSourceUnit(o);
      case PRAGMA_DIRECTIVE:
        return decodePragma(o);
      case IMPORT_DIRECTIVE:
        return decodeImport(o);
      case INHERITANCE_SPECIFIER:
        return decodeInheritanceSpecifier(o);
      case MODIFIER_INVOCATION:
        return decodeModifierInvocation(o);
      case OVERRIDE_SPECIFIER:
        return decodeOverrideSpecifier(o);
      case PARAMETER_LIST:
        return decodeParameterList(o);
      case STRUCTURED_DOCUMENTATION:
        return newNode(Token.STRUCTURED_DOCUMENTATION, o, str(o, "text"));
      case TRY_CATCH_CLAUSE:
        return decodeTryCatchClause(o);
      case USING_FOR_DIRECTIVE:
        return decodeUsingFor(o);
      case IDENTIFIER_PATH:
        return decodeIdentifierPath(o);

      case CONTRACT_DEFINITION:
        return decodeContract(o);
      case FUNCTION_DEFINITION:
        return decodeFunction(o);
      case MODIFIER_DEFINITION:
        return decodeModifier(o);
      case EVENT_DEFINITION:
      case ERROR_DEFINITION:
        return decodeEventOrError(token, o);
      case STRUCT_DEFINITION:
        return decodeStruct(o);
      case ENUM_DEFINITION:
        return decodeEnum(o);
      case ENUM_VALUE:
        return declare(newNode(Token.ENUM_VALUE, o, str(o, "name")));
      case USER_DEFINED_VALUE_TYPE_DEFINITION:
        return decodeUserDefinedValueType(o);
      case VARIABLE_DECLARATION:
        return decodeVariable(o);

      case BLOCK:
      case UNCHECKED_BLOCK:
        return decodeBlock(token, o);
      case PLACEHOLDER_STATEMENT:
      case CONTINUE:
      case BREAK:
      case THROW:
        return newNode(token, o);
      case IF_STATEMENT:
        return decodeIf(o);
      case TRY_STATEMENT:
        return decodeTry(o);
      case WHILE_STATEMENT:
        return decodeWhile(o);
      case DO_WHILE_STATEMENT:
        return decodeDoWhile(o);
      case FOR_STATEMENT:
        return decodeFor(o);
      case RETURN:
        return decodeReturn(o);
      case EMIT_STATEMENT:
        return withChildren(newNode(token, o), decodeExpression(obj(o, "eventCall")));
      case REVERT_STATEMENT:
        return withChildren(newNode(token, o), decodeExpression(obj(o, "errorCall")));
      case VARIABLE_DECLARATION_STATEMENT:
        return decodeVariableDeclarationStatement(o);
      case EXPRESSION_STATEMENT:
        return withChildren(newNode(token, o), decodeExpression(obj(o, "expression")));
      case INLINE_ASSEMBLY:
        return decodeInlineAssembly(o);

      case ASSIGNMENT:
        return decodeOperation(token, o, "leftHandSide", "rightHandSide");
      case BINARY_OPERATION:
        return decodeOperation(token, o, "leftExpression", "rightExpression");
      case UNARY_OPERATION:
        return decodeUnary(o);
      case CONDITIONAL:
        return withChildren(
            expression(Token.CONDITIONAL, o),
            decodeExpression(obj(o, "condition")),
            decodeExpression(obj(o, "trueExpression")),
            decodeExpression(obj(o, "falseExpression")));
      case ELEMENTARY_TYPE_NAME_EXPRESSION:
        return decodeElementaryTypeNameExpression(o);
      case FUNCTION_CALL:
        return decodeFunctionCall(o);
      case FUNCTION_CALL_OPTIONS:
        return decodeFunctionCallOptions(o);
      case IDENTIFIER:
        return decodeIdentifier(o);
      case INDEX_ACCESS:
        return withChildren(
            expression(Token.INDEX_ACCESS, o),
            decodeExpression(obj(o, "baseExpression")),
            optExpression(o, "indexExpression"));
      case INDEX_RANGE_ACCESS:
        return withChildren(
            expression(Token.INDEX_RANGE_ACCESS, o),
            decodeExpression(obj(o, "baseExpression")),
            optExpression(o, "startExpression"),
            optExpression(o, "endExpression"));
      case LITERAL:
        return decodeLiteral(o);
      case MEMBER_ACCESS:
        return decodeMemberAccess(o);
      case NEW_EXPRESSION:
        return withChildren(
            expression(Token.NEW_EXPRESSION, o), decodeTypeName(obj(o, "typeName")));
      case TUPLE_EXPRESSION:
        return decodeTuple(o);

      case ARRAY_TYPE_NAME:
        return withChildren(
            expression(Token.ARRAY_TYPE_NAME, o),
            decodeTypeName(obj(o, "baseType")),
            optExpression(o, "length"));
      case ELEMENTARY_TYPE_NAME:
        return decodeElementaryTypeName(o);
      case FUNCTION_TYPE_NAME:
        return decodeFunctionTypeName(o);
      case MAPPING:
        return withChildren(
            expression(Token.MAPPING, o),
            decodeTypeName(obj(o, "keyType")),
            decodeTypeName(obj(o, "valueType")));
      case USER_DEFINED_TYPE_NAME:
        return decodeUserDefinedTypeName(o);

      case YUL_BLOCK:
        return decodeYulBlock(o);
      case YUL_VARIABLE_DECLARATION:
        return decodeYulVariableDeclaration(o);
      case YUL_ASSIGNMENT:
        return decodeYulAssignment(o);
      case YUL_EXPRESSION_STATEMENT:
        return withChildren(newNode(token, o), decodeYulExpression(obj(o, "expression")));
      case YUL_IF:
        return withChildren(
            newNode(token, o),
            decodeYulExpression(obj(o, "condition")),
            decodeYulBlock(obj(o, "body")));
      case YUL_SWITCH:
        return decodeYulSwitch(o);
      case YUL_CASE:
        return decodeYulCase(o);
      case YUL_FOR_LOOP:
        return withChildren(
            newNode(token, o),
            decodeYulBlock(obj(o, "pre")),
            decodeYulExpression(obj(o, "condition")),
            decodeYulBlock(obj(o, "post")),
            decodeYulBlock(obj(o, "body")));
      case YUL_BREAK:
      case YUL_CONTINUE:
      case YUL_LEAVE:
        return newNode(token, o);
      case YUL_FUNCTION_DEFINITION:
        return decodeYulFunctionDefinition(o);
      case YUL_FUNCTION_CALL:
        return decodeYulFunctionCall(o);
      case YUL_IDENTIFIER:
        return newNode(Token.YUL_IDENTIFIER, o, str(o, "name"));
      case YUL_LITERAL:
        return decodeYulLiteral(o);
      case YUL_TYPED_NAME:
        return newNode(Token.YUL_TYPED_NAME, o, str(o, "name"));
      case EMPTY:
        break;
    }
    throw error(o, "Unexpected node kind");
  }

  // Meta nodes

  private Node decodeSourceUnit(JsonObject o) {
    Node unit = newNode(Token.SOURCE_UNIT, o, path);
    unit.putProp(Prop.SOURCE_FILE, sourceFile);
    unit.putProp(Prop.RUN_ID, runId);
    unit.putProp(Prop.LICENSE, optStr(o, "license"));
    for (JsonObject child : objects(o, "nodes")) {
      unit.addChildToBack(decode(child));
    }
    return unit;
  }

  private Node decodePragma(JsonObject o) {
    List<String> literals = new ArrayList<>();
    for (JsonElement e : arr(o, "literals")) {
      literals.add(e.getAsString());
    }
    String text =
        literals.isEmpty()
            ? ""
            : literals.get(0) + " " + Joiner.on("").join(literals.subList(1, literals.size()));
    return newNode(Token.PRAGMA_DIRECTIVE, o, text.trim());
  }

  private Node decodeImport(JsonObject o) {
    Node n = newNode(Token.IMPORT_DIRECTIVE, o, str(o, "file"));
    n.putProp(Prop.IMPORT_PATH, str(o, "file"));
    n.putProp(Prop.ABSOLUTE_PATH, str(o, "absolutePath"));
    String unitAlias = optStr(o, "unitAlias");
    n.putProp(Prop.UNIT_ALIAS, unitAlias == null || unitAlias.isEmpty() ? null : unitAlias);
    n.putProp(Prop.REFERENCED_DECLARATION_ID, optLong(o, "sourceUnit"));
    ImmutableList.Builder<String> locals = ImmutableList.builder();
    for (JsonObject alias : objects(o, "symbolAliases")) {
      JsonElement foreign = alias.get("foreign");
      Node symbol;
      if (foreign != null && foreign.isJsonObject()) {
        symbol = decodeExpression(foreign.getAsJsonObject());
        if (!symbol.isIdentifier()) {
          throw error(o, "Imported symbol is not an identifier");
        }
      } else if (foreign != null && foreign.isJsonPrimitive()) {
        // Releases before 0.5.0 only record the id of the imported declaration.
        symbol = new Node(Token.IDENTIFIER);
        symbol.putProp(Prop.REFERENCED_DECLARATION_ID, foreign.getAsLong());
      } else {
        throw error(o, "Malformed symbol alias");
      }
      n.addChildToBack(symbol);
      String local = optStr(alias, "local");
      locals.add(local == null ? "" : local);
    }
    n.putProp(Prop.SYMBOL_ALIASES, locals.build());
    return n;
  }

  private Node decodeInheritanceSpecifier(JsonObject o) {
    Node n = newNode(Token.INHERITANCE_SPECIFIER, o);
    n.addChildToBack(decodeNamePath(obj(o, "baseName")));
    for (JsonObject arg : objects(o, "arguments")) {
      n.addChildToBack(decodeExpression(arg));
    }
    return n;
  }

  private Node decodeModifierInvocation(JsonObject o) {
    Node n = newNode(Token.MODIFIER_INVOCATION, o);
    n.putProp(Prop.MODIFIER_INVOCATION_KIND, optStr(o, "kind"));
    JsonObject name = obj(o, "modifierName");
    if (version.isBefore(SolidityVersion.V0_8_0)) {
      if (!"Identifier".equals(nodeType(name))) {
        throw error(name, "Expected an identifier as modifier name");
      }
      Node path = newNode(Token.IDENTIFIER_PATH, name, str(name, "name"));
      path.putProp(Prop.REFERENCED_DECLARATION_ID, optLong(name, "referencedDeclaration"));
      n.addChildToBack(path);
    } else {
      n.addChildToBack(decodeNamePath(name));
    }
    for (JsonObject arg : objects(o, "arguments")) {
      n.addChildToBack(decodeExpression(arg));
    }
    return n;
  }

  private Node decodeOverrideSpecifier(JsonObject o) {
    Node n = newNode(Token.OVERRIDE_SPECIFIER, o);
    for (JsonObject base : objects(o, "overrides")) {
      n.addChildToBack(decodeNamePath(base));
    }
    return n;
  }

  private Node decodeParameterList(JsonObject o) {
    Node n = newNode(Token.PARAMETER_LIST, o);
    for (JsonObject p : objects(o, "parameters")) {
      Node param = decode(p);
      if (!param.isVariableDeclaration()) {
        throw error(p, "Expected a variable declaration in a parameter list");
      }
      n.addChildToBack(param);
    }
    return n;
  }

  private Node decodeTryCatchClause(JsonObject o) {
    Node n = newNode(Token.TRY_CATCH_CLAUSE, o, str(o, "errorName"));
    JsonObject params = optObj(o, "parameters");
    n.addChildToBack(params == null ? Node.newEmpty() : decodeParameterList(params));
    n.addChildToBack(decodeBlock(Token.BLOCK, obj(o, "block")));
    return n;
  }

  private Node decodeUsingFor(JsonObject o) {
    Node n = newNode(Token.USING_FOR_DIRECTIVE, o);
    n.putBooleanProp(Prop.GLOBAL, bool(o, "global"));
    JsonObject library = optObj(o, "libraryName");
    if (library != null) {
      n.addChildToBack(decodeNamePath(library));
    } else {
      for (JsonObject entry : objects(o, "functionList")) {
        JsonObject function = optObj(entry, "function");
        JsonObject definition = function != null ? function : obj(entry, "definition");
        n.addChildToBack(decodeNamePath(definition));
      }
    }
    JsonObject type = optObj(o, "typeName");
    n.addChildToBack(type == null ? Node.newEmpty() : decodeTypeName(type));
    return n;
  }

  private Node decodeIdentifierPath(JsonObject o) {
    Node n = newNode(Token.IDENTIFIER_PATH, o, str(o, "name"));
    n.putProp(Prop.REFERENCED_DECLARATION_ID, optLong(o, "referencedDeclaration"));
    return n;
  }

  /**
   * Decodes a name that refers to a contract, modifier, function or type. Releases before 0.8.0
   * describe it as a user defined type name, later ones as an identifier path.
   */
  private Node decodeNamePath(JsonObject o) {
    String tag = nodeType(o);
    if (version.isBefore(SolidityVersion.V0_8_0)) {
      if (!"UserDefinedTypeName".equals(tag)) {
        throw error(o, "Expected a user defined type name");
      }
      Node n = newNode(Token.IDENTIFIER_PATH, o, str(o, "name"));
      n.putProp(Prop.REFERENCED_DECLARATION_ID, optLong(o, "referencedDeclaration"));
      return n;
    }
    if (!"IdentifierPath".equals(tag)) {
      throw error(o, "Expected an identifier path");
    }
    return decodeIdentifierPath(o);
  }

  // Declarations

  private Node decodeContract(JsonObject o) {
    String name = str(o, "name");
    Node n = declare(newNode(Token.CONTRACT_DEFINITION, o, name));
    n.putProp(Prop.CONTRACT_KIND, str(o, "contractKind"));
    n.putBooleanProp(Prop.ABSTRACT, bool(o, "abstract"));
    n.putProp(Prop.LINEARIZED_BASE_CONTRACT_IDS, longs(o, "linearizedBaseContracts"));
    addDocumentation(n, o);
    for (JsonObject base : objects(o, "baseContracts")) {
      n.addChildToBack(decodeInheritanceSpecifier(base));
    }
    scopeNames.addLast(name);
    try {
      for (JsonObject member : objects(o, "nodes")) {
        n.addChildToBack(decode(member));
      }
    } finally {
      scopeNames.removeLast();
    }
    return n;
  }

  private Node decodeFunction(JsonObject o) {
    String name = str(o, "name");
    String kind = optStr(o, "kind");
    if (kind == null) {
      if (bool(o, "isConstructor")) {
        kind = "constructor";
      } else {
        kind = name.isEmpty() ? "fallback" : "function";
      }
    }
    Node n = newNode(Token.FUNCTION_DEFINITION, o, name);
    declare(n, name.isEmpty() ? kind : name);
    n.putProp(Prop.FUNCTION_KIND, kind);
    n.putProp(Prop.VISIBILITY, optStr(o, "visibility"));
    n.putProp(Prop.STATE_MUTABILITY, stateMutability(o));
    n.putBooleanProp(Prop.VIRTUAL, bool(o, "virtual"));
    n.putProp(Prop.BASE_FUNCTION_IDS, longs(o, "baseFunctions"));
    addDocumentation(n, o);
    addOverrides(n, o);
    scopeNames.addLast(name.isEmpty() ? kind : name);
    try {
      n.addChildToBack(decodeParameterList(obj(o, "parameters")));
      n.addChildToBack(decodeParameterList(obj(o, "returnParameters")));
      for (JsonObject modifier : objects(o, "modifiers")) {
        n.addChildToBack(decodeModifierInvocation(modifier));
      }
      JsonObject body = optObj(o, "body");
      n.addChildToBack(body == null ? Node.newEmpty() : decodeBlock(Token.BLOCK, body));
    } finally {
      scopeNames.removeLast();
    }
    return n;
  }

  private @Nullable String stateMutability(JsonObject o) {
    String mutability = optStr(o, "stateMutability");
    if (mutability != null) {
      return mutability;
    }
    if (bool(o, "constant")) {
      return "view";
    }
    return bool(o, "payable") ? "payable" : "nonpayable";
  }

  private Node decodeModifier(JsonObject o) {
    String name = str(o, "name");
    Node n = declare(newNode(Token.MODIFIER_DEFINITION, o, name));
    n.putProp(Prop.VISIBILITY, optStr(o, "visibility"));
    n.putBooleanProp(Prop.VIRTUAL, bool(o, "virtual"));
    n.putProp(Prop.BASE_MODIFIER_IDS, longs(o, "baseModifiers"));
    addDocumentation(n, o);
    addOverrides(n, o);
    scopeNames.addLast(name);
    try {
      n.addChildToBack(decodeParameterList(obj(o, "parameters")));
      JsonObject body = optObj(o, "body");
      n.addChildToBack(body == null ? Node.newEmpty() : decodeBlock(Token.BLOCK, body));
    } finally {
      scopeNames.removeLast();
    }
    return n;
  }

  private Node decodeEventOrError(Token token, JsonObject o) {
    String name = str(o, "name");
    Node n = declare(newNode(token, o, name));
    n.putBooleanProp(Prop.ANONYMOUS, bool(o, "anonymous"));
    addDocumentation(n, o);
    scopeNames.addLast(name);
    try {
      n.addChildToBack(decodeParameterList(obj(o, "parameters")));
    } finally {
      scopeNames.removeLast();
    }
    return n;
  }

  private Node decodeStruct(JsonObject o) {
    String name = str(o, "name");
    Node n = declare(newNode(Token.STRUCT_DEFINITION, o, name));
    n.putProp(Prop.VISIBILITY, optStr(o, "visibility"));
    addDocumentation(n, o);
    scopeNames.addLast(name);
    try {
      for (JsonObject member : objects(o, "members")) {
        n.addChildToBack(decodeVariable(member));
      }
    } finally {
      scopeNames.removeLast();
    }
    return n;
  }

  private Node decodeEnum(JsonObject o) {
    String name = str(o, "name");
    Node n = declare(newNode(Token.ENUM_DEFINITION, o, name));
    addDocumentation(n, o);
    scopeNames.addLast(name);
    try {
      for (JsonObject member : objects(o, "members")) {
        n.addChildToBack(decode(member));
      }
    } finally {
      scopeNames.removeLast();
    }
    return n;
  }

  private Node decodeUserDefinedValueType(JsonObject o) {
    Node n = declare(newNode(Token.USER_DEFINED_VALUE_TYPE_DEFINITION, o, str(o, "name")));
    n.addChildToBack(decodeTypeName(obj(o, "underlyingType")));
    return n;
  }

  private Node decodeVariable(JsonObject o) {
    if (!"VariableDeclaration".equals(nodeType(o))) {
      throw error(o, "Expected a variable declaration");
    }
    Node n = declare(newNode(Token.VARIABLE_DECLARATION, o, str(o, "name")));
    boolean constant = bool(o, "constant");
    n.putBooleanProp(Prop.CONSTANT, constant);
    String mutability = optStr(o, "mutability");
    n.putProp(
        Prop.MUTABILITY, mutability != null ? mutability : (constant ? "constant" : "mutable"));
    n.putBooleanProp(Prop.STATE_VARIABLE, bool(o, "stateVariable"));
    n.putProp(Prop.STORAGE_LOCATION, optStr(o, "storageLocation"));
    n.putProp(Prop.VISIBILITY, optStr(o, "visibility"));
    n.putBooleanProp(Prop.INDEXED, bool(o, "indexed"));
    n.putProp(Prop.TYPE_STRING, typeString(o));
    addDocumentation(n, o);
    addOverrides(n, o);
    JsonObject type = optObj(o, "typeName");
    n.addChildToBack(type == null ? Node.newEmpty() : decodeTypeName(type));
    n.addChildToBack(optExpression(o, "value"));
    return n;
  }

  private void addDocumentation(Node n, JsonObject o) {
    JsonElement doc = o.get("documentation");
    if (doc == null || doc.isJsonNull()) {
      return;
    }
    if (doc.isJsonPrimitive()) {
      if (version.isAtLeast(SolidityVersion.V0_6_3) && !n.isContractDefinition()) {
        throw error(o, "Expected structured documentation");
      }
      n.addChildToBack(new Node(Token.STRUCTURED_DOCUMENTATION, doc.getAsString()));
    } else {
      Node structured = decode(doc.getAsJsonObject());
      if (structured.getToken() != Token.STRUCTURED_DOCUMENTATION) {
        throw error(o, "Expected structured documentation");
      }
      n.addChildToBack(structured);
    }
  }

  private void addOverrides(Node n, JsonObject o) {
    JsonObject overrides = optObj(o, "overrides");
    if (overrides != null) {
      n.addChildToBack(decodeOverrideSpecifier(overrides));
    }
  }

  // Statements

  private Node decodeStatement(JsonObject o) {
    Node n = decode(o);
    if (!n.getToken().isStatement() || n.getToken().isYul()) {
      throw error(o, "Expected a statement");
    }
    return n;
  }

  private Node decodeBlock(Token token, JsonObject o) {
    Token actual = Token.fromTag(nodeType(o));
    if (actual != Token.BLOCK && actual != Token.UNCHECKED_BLOCK) {
      throw error(o, "Expected a block");
    }
    Node n = newNode(actual, o);
    for (JsonObject statement : objects(o, "statements")) {
      n.addChildToBack(decodeStatement(statement));
    }
    return n;
  }

  private Node decodeIf(JsonObject o) {
    JsonObject falseBody = optObj(o, "falseBody");
    return withChildren(
        newNode(Token.IF_STATEMENT, o),
        decodeExpression(obj(o, "condition")),
        decodeStatement(obj(o, "trueBody")),
        falseBody == null ? Node.newEmpty() : decodeStatement(falseBody));
  }

  private Node decodeTry(JsonObject o) {
    Node n = newNode(Token.TRY_STATEMENT, o);
    Node call = decodeExpression(obj(o, "externalCall"));
    if (!call.isFunctionCall()) {
      throw error(o, "Expected a function call as the external call of try");
    }
    n.addChildToBack(call);
    List<JsonObject> clauses = objects(o, "clauses");
    if (clauses.isEmpty()) {
      throw error(o, "Try statement without clauses");
    }
    for (JsonObject clause : clauses) {
      n.addChildToBack(decodeTryCatchClause(clause));
    }
    return n;
  }

  private Node decodeWhile(JsonObject o) {
    return withChildren(
        newNode(Token.WHILE_STATEMENT, o),
        decodeExpression(obj(o, "condition")),
        decodeStatement(obj(o, "body")));
  }

  private Node decodeDoWhile(JsonObject o) {
    return withChildren(
        newNode(Token.DO_WHILE_STATEMENT, o),
        decodeStatement(obj(o, "body")),
        decodeExpression(obj(o, "condition")));
  }

  private Node decodeFor(JsonObject o) {
    JsonObject init = optObj(o, "initializationExpression");
    JsonObject loop = optObj(o, "loopExpression");
    return withChildren(
        newNode(Token.FOR_STATEMENT, o),
        init == null ? Node.newEmpty() : decodeStatement(init),
        optExpression(o, "condition"),
        loop == null ? Node.newEmpty() : decodeStatement(loop),
        decodeStatement(obj(o, "body")));
  }

  private Node decodeReturn(JsonObject o) {
    Node n = newNode(Token.RETURN, o);
    JsonObject expression = optObj(o, "expression");
    if (expression != null) {
      n.addChildToBack(decodeExpression(expression));
    }
    return n;
  }

  private Node decodeVariableDeclarationStatement(JsonObject o) {
    Node n = newNode(Token.VARIABLE_DECLARATION_STATEMENT, o);
    for (JsonElement e : arr(o, "declarations")) {
      n.addChildToBack(e.isJsonNull() ? Node.newEmpty() : decodeVariable(e.getAsJsonObject()));
    }
    n.addChildToBack(optExpression(o, "initialValue"));
    return n;
  }

  private Node decodeInlineAssembly(JsonObject o) {
    Node n = newNode(Token.INLINE_ASSEMBLY, o);
    if (version.isBefore(SolidityVersion.V0_6_0)) {
      n.putProp(Prop.OPERATIONS, optStr(o, "operations"));
    } else {
      n.addChildToBack(decodeYulBlock(obj(o, "AST")));
    }
    ImmutableList.Builder<ExternalReference> refs = ImmutableList.builder();
    for (JsonObject ref : objects(o, "externalReferences")) {
      JsonObject entry = ref;
      if (!ref.has("declaration")) {
        // Before 0.6.0 every entry is a single-key map from the identifier name.
        if (ref.size() != 1) {
          throw error(o, "Malformed external reference");
        }
        Map.Entry<String, JsonElement> only = ref.entrySet().iterator().next();
        entry = only.getValue().getAsJsonObject();
      }
      SourceSpan span = span(entry, true);
      if (span == null) {
        continue;
      }
      String suffix = optStr(entry, "suffix");
      if (suffix == null) {
        suffix = bool(entry, "isSlot") ? "slot" : bool(entry, "isOffset") ? "offset" : "";
      }
      refs.add(new ExternalReference(
          entry.get("declaration").getAsLong(), span.offset(), span.length(), suffix));
    }
    n.putProp(Prop.EXTERNAL_REFERENCES, refs.build());
    return n;
  }

  // Expressions

  private Node decodeExpression(JsonObject o) {
    Node n = decode(o);
    if (!n.getToken().isExpression() && !n.getToken().isTypeName()) {
      throw error(o, "Expected an expression");
    }
    if (n.getToken().isYul()) {
      throw error(o, "Unexpected assembly expression");
    }
    return n;
  }

  private Node optExpression(JsonObject o, String field) {
    JsonObject e = optObj(o, field);
    return e == null ? Node.newEmpty() : decodeExpression(e);
  }

  private Node expression(Token token, JsonObject o) {
    Node n = newNode(token, o);
    n.putProp(Prop.TYPE_STRING, typeString(o));
    return n;
  }

  private Node decodeOperation(Token token, JsonObject o, String left, String right) {
    Node n = expression(token, o);
    n.putProp(Prop.OPERATOR, str(o, "operator"));
    n.addChildToBack(decodeExpression(obj(o, left)));
    n.addChildToBack(decodeExpression(obj(o, right)));
    return n;
  }

  private Node decodeUnary(JsonObject o) {
    Node n = expression(Token.UNARY_OPERATION, o);
    n.putProp(Prop.OPERATOR, str(o, "operator"));
    n.putBooleanProp(Prop.PREFIX, bool(o, "prefix"));
    n.addChildToBack(decodeExpression(obj(o, "subExpression")));
    return n;
  }

  private Node decodeElementaryTypeNameExpression(JsonObject o) {
    Node n = expression(Token.ELEMENTARY_TYPE_NAME_EXPRESSION, o);
    JsonElement type = o.get("typeName");
    if (version.isBefore(SolidityVersion.V0_6_0)) {
      if (type == null || !type.isJsonPrimitive()) {
        throw error(o, "Expected the type name as a string");
      }
      Node typeName = new Node(Token.ELEMENTARY_TYPE_NAME, type.getAsString());
      typeName.setSpan(n.getSpan());
      n.addChildToBack(typeName);
    } else {
      if (type == null || !type.isJsonObject()) {
        throw error(o, "Expected an elementary type name");
      }
      n.addChildToBack(decodeElementaryTypeName(type.getAsJsonObject()));
    }
    return n;
  }

  private Node decodeFunctionCall(JsonObject o) {
    Node n = expression(Token.FUNCTION_CALL, o);
    n.putProp(Prop.CALL_KIND, optStr(o, "kind"));
    n.putBooleanProp(Prop.TRY_CALL, bool(o, "tryCall"));
    n.putProp(Prop.ARGUMENT_NAMES, strings(o, "names"));
    n.addChildToBack(decodeExpression(obj(o, "expression")));
    for (JsonObject arg : objects(o, "arguments")) {
      n.addChildToBack(decodeExpression(arg));
    }
    return n;
  }

  private Node decodeFunctionCallOptions(JsonObject o) {
    Node n = expression(Token.FUNCTION_CALL_OPTIONS, o);
    n.putProp(Prop.OPTION_NAMES, strings(o, "names"));
    n.addChildToBack(decodeExpression(obj(o, "expression")));
    for (JsonObject option : objects(o, "options")) {
      n.addChildToBack(decodeExpression(option));
    }
    return n;
  }

  private Node decodeIdentifier(JsonObject o) {
    Node n = expression(Token.IDENTIFIER, o);
    n.setString(str(o, "name"));
    n.putProp(Prop.REFERENCED_DECLARATION_ID, optLong(o, "referencedDeclaration"));
    n.putProp(Prop.OVERLOADED_DECLARATION_IDS, longs(o, "overloadedDeclarations"));
    return n;
  }

  private Node decodeLiteral(JsonObject o) {
    Node n = expression(Token.LITERAL, o);
    n.setString(optStr(o, "value"));
    n.putProp(Prop.LITERAL_KIND, str(o, "kind"));
    n.putProp(Prop.HEX_VALUE, optStr(o, "hexValue"));
    n.putProp(Prop.SUBDENOMINATION, optStr(o, "subdenomination"));
    return n;
  }

  private Node decodeMemberAccess(JsonObject o) {
    Node n = expression(Token.MEMBER_ACCESS, o);
    n.setString(str(o, "memberName"));
    n.putProp(Prop.REFERENCED_DECLARATION_ID, optLong(o, "referencedDeclaration"));
    n.addChildToBack(decodeExpression(obj(o, "expression")));
    return n;
  }

  private Node decodeTuple(JsonObject o) {
    Node n = expression(Token.TUPLE_EXPRESSION, o);
    n.putBooleanProp(Prop.INLINE_ARRAY, bool(o, "isInlineArray"));
    for (JsonElement e : arr(o, "components")) {
      n.addChildToBack(e.isJsonNull() ? Node.newEmpty() : decodeExpression(e.getAsJsonObject()));
    }
    return n;
  }

  // Type names

  private Node decodeTypeName(JsonObject o) {
    Node n = decode(o);
    if (!n.getToken().isTypeName()) {
      throw error(o, "Expected a type name");
    }
    return n;
  }

  private Node decodeElementaryTypeName(JsonObject o) {
    if (!"ElementaryTypeName".equals(nodeType(o))) {
      throw error(o, "Expected an elementary type name");
    }
    Node n = expression(Token.ELEMENTARY_TYPE_NAME, o);
    n.setString(str(o, "name"));
    n.putProp(Prop.STATE_MUTABILITY, optStr(o, "stateMutability"));
    return n;
  }

  private Node decodeFunctionTypeName(JsonObject o) {
    Node n = expression(Token.FUNCTION_TYPE_NAME, o);
    n.putProp(Prop.VISIBILITY, optStr(o, "visibility"));
    n.putProp(Prop.STATE_MUTABILITY, optStr(o, "stateMutability"));
    n.addChildToBack(decodeParameterList(obj(o, "parameterTypes")));
    n.addChildToBack(decodeParameterList(obj(o, "returnParameterTypes")));
    return n;
  }

  private Node decodeUserDefinedTypeName(JsonObject o) {
    Node n = expression(Token.USER_DEFINED_TYPE_NAME, o);
    Long hint = optLong(o, "referencedDeclaration");
    n.putProp(Prop.REFERENCED_DECLARATION_ID, hint);
    if (version.isBefore(SolidityVersion.V0_8_0)) {
      String name = str(o, "name");
      n.setString(name);
      Node path = new Node(Token.IDENTIFIER_PATH, name);
      path.setSpan(n.getSpan());
      path.putProp(Prop.REFERENCED_DECLARATION_ID, hint);
      n.addChildToBack(path);
    } else {
      Node path = decodeNamePath(obj(o, "pathNode"));
      n.setString(path.getString());
      n.addChildToBack(path);
    }
    return n;
  }

  // Inline assembly

  private Node decodeYulStatement(JsonObject o) {
    Node n = decode(o);
    if (!n.getToken().isYul() || !n.getToken().isStatement()) {
      throw error(o, "Expected an assembly statement");
    }
    return n;
  }

  private Node decodeYulExpression(JsonObject o) {
    Node n = decode(o);
    if (!n.getToken().isYul() || !n.getToken().isExpression()) {
      throw error(o, "Expected an assembly expression");
    }
    return n;
  }

  private Node decodeYulBlock(JsonObject o) {
    if (!"YulBlock".equals(nodeType(o))) {
      throw error(o, "Expected an assembly block");
    }
    Node n = newNode(Token.YUL_BLOCK, o);
    for (JsonObject statement : objects(o, "statements")) {
      n.addChildToBack(decodeYulStatement(statement));
    }
    return n;
  }

  private Node decodeYulVariableDeclaration(JsonObject o) {
    Node n = newNode(Token.YUL_VARIABLE_DECLARATION, o);
    for (JsonObject variable : objects(o, "variables")) {
      n.addChildToBack(decodeYulTypedName(variable));
    }
    JsonObject value = optObj(o, "value");
    n.addChildToBack(value == null ? Node.newEmpty() : decodeYulExpression(value));
    return n;
  }

  private Node decodeYulAssignment(JsonObject o) {
    Node n = newNode(Token.YUL_ASSIGNMENT, o);
    for (JsonObject name : objects(o, "variableNames")) {
      Node identifier = decodeYulExpression(name);
      if (identifier.getToken() != Token.YUL_IDENTIFIER) {
        throw error(name, "Expected an assembly identifier");
      }
      n.addChildToBack(identifier);
    }
    n.addChildToBack(decodeYulExpression(obj(o, "value")));
    return n;
  }

  private Node decodeYulSwitch(JsonObject o) {
    Node n = newNode(Token.YUL_SWITCH, o);
    n.addChildToBack(decodeYulExpression(obj(o, "expression")));
    for (JsonObject c : objects(o, "cases")) {
      n.addChildToBack(decodeYulCase(c));
    }
    return n;
  }

  private Node decodeYulCase(JsonObject o) {
    if (!"YulCase".equals(nodeType(o))) {
      throw error(o, "Expected a switch case");
    }
    Node n = newNode(Token.YUL_CASE, o);
    JsonElement value = o.get("value");
    if (value != null && value.isJsonObject()) {
      n.addChildToBack(decodeYulLiteral(value.getAsJsonObject()));
    } else if (value != null && value.isJsonPrimitive() && "default".equals(value.getAsString())) {
      n.addChildToBack(Node.newEmpty());
    } else {
      throw error(o, "Malformed switch case value");
    }
    n.addChildToBack(decodeYulBlock(obj(o, "body")));
    return n;
  }

  private Node decodeYulFunctionDefinition(JsonObject o) {
    String name = str(o, "name");
    Node n = newNode(Token.YUL_FUNCTION_DEFINITION, o, name);
    List<JsonObject> parameters = objects(o, "parameters");
    n.putIntProp(Prop.YUL_PARAMETER_COUNT, parameters.size());
    for (JsonObject p : parameters) {
      n.addChildToBack(decodeYulTypedName(p));
    }
    for (JsonObject r : objects(o, "returnVariables")) {
      n.addChildToBack(decodeYulTypedName(r));
    }
    n.addChildToBack(decodeYulBlock(obj(o, "body")));
    return n;
  }

  private Node decodeYulFunctionCall(JsonObject o) {
    Node n = newNode(Token.YUL_FUNCTION_CALL, o);
    Node name = decodeYulExpression(obj(o, "functionName"));
    if (name.getToken() != Token.YUL_IDENTIFIER) {
      throw error(o, "Expected an assembly identifier as function name");
    }
    n.addChildToBack(name);
    for (JsonObject arg : objects(o, "arguments")) {
      n.addChildToBack(decodeYulExpression(arg));
    }
    return n;
  }

  private Node decodeYulLiteral(JsonObject o) {
    if (!"YulLiteral".equals(nodeType(o))) {
      throw error(o, "Expected an assembly literal");
    }
    String value = optStr(o, "value");
    Node n = newNode(Token.YUL_LITERAL, o, value != null ? value : optStr(o, "hexValue"));
    n.putProp(Prop.LITERAL_KIND, str(o, "kind"));
    n.putProp(Prop.HEX_VALUE, optStr(o, "hexValue"));
    return n;
  }

  private Node decodeYulTypedName(JsonObject o) {
    if (!"YulTypedName".equals(nodeType(o))) {
      throw error(o, "Expected an assembly typed name");
    }
    return newNode(Token.YUL_TYPED_NAME, o, str(o, "name"));
  }

  // Helpers

  private Node newNode(Token token, JsonObject o) {
    return newNode(token, o, null);
  }

  private Node newNode(Token token, JsonObject o, @Nullable String string) {
    Node n = new Node(token, string);
    n.setSpan(span(o, token.isYul()));
    if (!token.isYul() && token != Token.STRUCTURED_DOCUMENTATION || o.has("id")) {
      JsonElement id = o.get("id");
      if (id == null || !id.isJsonPrimitive()) {
        throw error(o, "Missing node id");
      }
      n.setAstId(id.getAsLong());
      if (!index.register(n)) {
        throw error(o, "Duplicate node id " + n.getAstId());
      }
    }
    return n;
  }

  /** Records the canonical name of a declaration named after its own string. */
  private Node declare(Node n) {
    return declare(n, n.getString());
  }

  private Node declare(Node n, String name) {
    StringBuilder sb = new StringBuilder();
    for (String scope : scopeNames) {
      sb.append(scope).append('.');
    }
    n.putProp(Prop.CANONICAL_NAME, sb.append(name).toString());
    return n;
  }

  private static Node withChildren(Node parent, Node... children) {
    for (Node child : children) {
      parent.addChildToBack(child);
    }
    return parent;
  }

  private @Nullable SourceSpan span(JsonObject o, boolean optional) {
    JsonElement src = o.get("src");
    if (src == null || !src.isJsonPrimitive()) {
      if (optional) {
        return null;
      }
      throw error(o, "Missing source location");
    }
    String[] parts = src.getAsString().split(":");
    if (parts.length < 2) {
      throw error(o, "Malformed source location " + src.getAsString());
    }
    int offset;
    int length;
    try {
      offset = Integer.parseInt(parts[0]);
      length = Integer.parseInt(parts[1]);
    } catch (NumberFormatException e) {
      throw error(o, "Malformed source location " + src.getAsString());
    }
    if (offset < 0 || length < 0) {
      return null;
    }
    return new SourceSpan(path, offset, length);
  }

  private @Nullable String nodeTypeOrNull(JsonObject o) {
    JsonElement tag = o.get("nodeType");
    return tag != null && tag.isJsonPrimitive() ? tag.getAsString() : null;
  }

  private String nodeType(JsonObject o) {
    String tag = nodeTypeOrNull(o);
    if (tag == null) {
      throw new StructuralDecodeException(null, path, "Missing node kind");
    }
    return tag;
  }

  private StructuralDecodeException error(JsonObject o, String message) {
    return new StructuralDecodeException(nodeTypeOrNull(o), path, message);
  }

  private JsonObject obj(JsonObject o, String field) {
    JsonObject value = optObj(o, field);
    if (value == null) {
      throw error(o, "Missing field " + field);
    }
    return value;
  }

  private @Nullable JsonObject optObj(JsonObject o, String field) {
    JsonElement e = o.get(field);
    if (e == null || e.isJsonNull()) {
      return null;
    }
    if (!e.isJsonObject()) {
      throw error(o, "Field " + field + " is not an object");
    }
    return e.getAsJsonObject();
  }

  private JsonArray arr(JsonObject o, String field) {
    JsonElement e = o.get(field);
    if (e == null || !e.isJsonArray()) {
      throw error(o, "Missing array " + field);
    }
    return e.getAsJsonArray();
  }

  /** Returns the objects of an optional array field; absent or null arrays are empty. */
  private List<JsonObject> objects(JsonObject o, String field) {
    JsonElement e = o.get(field);
    List<JsonObject> result = new ArrayList<>();
    if (e == null || e.isJsonNull()) {
      return result;
    }
    if (!e.isJsonArray()) {
      throw error(o, "Field " + field + " is not an array");
    }
    for (JsonElement element : e.getAsJsonArray()) {
      if (!element.isJsonObject()) {
        throw error(o, "Unexpected element in " + field);
      }
      result.add(element.getAsJsonObject());
    }
    return result;
  }

  private String str(JsonObject o, String field) {
    String value = optStr(o, field);
    if (value == null) {
      throw error(o, "Missing field " + field);
    }
    return value;
  }

  private static @Nullable String optStr(JsonObject o, String field) {
    JsonElement e = o.get(field);
    return e == null || e.isJsonNull() || !e.isJsonPrimitive() ? null : e.getAsString();
  }

  private static boolean bool(JsonObject o, String field) {
    JsonElement e = o.get(field);
    return e != null && e.isJsonPrimitive() && e.getAsBoolean();
  }

  private static @Nullable Long optLong(JsonObject o, String field) {
    JsonElement e = o.get(field);
    return e == null || e.isJsonNull() || !e.isJsonPrimitive() ? null : e.getAsLong();
  }

  private static @Nullable ImmutableList<Long> longs(JsonObject o, String field) {
    JsonElement e = o.get(field);
    if (e == null || !e.isJsonArray()) {
      return null;
    }
    ImmutableList.Builder<Long> result = ImmutableList.builder();
    for (JsonElement element : e.getAsJsonArray()) {
      result.add(element.getAsLong());
    }
    return result.build();
  }

  private static @Nullable ImmutableList<String> strings(JsonObject o, String field) {
    JsonElement e = o.get(field);
    if (e == null || !e.isJsonArray()) {
      return null;
    }
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (JsonElement element : e.getAsJsonArray()) {
      result.add(element.getAsString());
    }
    return result.build();
  }

  private static @Nullable String typeString(JsonObject o) {
    JsonElement descriptions = o.get("typeDescriptions");
    if (descriptions == null || !descriptions.isJsonObject()) {
      return null;
    }
    return optStr(descriptions.getAsJsonObject(), "typeString");
  }
}
