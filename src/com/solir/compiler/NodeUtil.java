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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.solir.ir.Node;
import com.solir.ir.Node.Prop;
import com.solir.ir.Token;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful IR utilities. */
public final class NodeUtil {

  // Utility class; do not instantiate.
  private NodeUtil() {}

  /** Whether {@code n} declares something that references may bind to. */
  public static boolean isDeclaration(Node n) {
    return n.getToken().isDeclaration() || n.isSourceUnit();
  }

  /** Whether {@code n} has a body of statements that a control flow graph is built for. */
  public static boolean isExecutable(Node n) {
    return n.isFunctionDefinition() || n.isModifierDefinition();
  }

  /** Returns the fully qualified name of a declaration, or the empty string for a source unit. */
  public static String getCanonicalName(Node n) {
    if (n.isSourceUnit()) {
      return "";
    }
    String name = n.getStringProp(Prop.CANONICAL_NAME);
    checkArgument(name != null, "Not a declaration: %s", n);
    return name;
  }

  /** The name a declaration is looked up by, empty for unnamed functions. */
  public static String getDeclaredName(Node n) {
    String name = n.getString();
    return name == null ? "" : name;
  }

  public static @Nullable Node getEnclosingContract(Node n) {
    return n.getAncestorOfType(Token.CONTRACT_DEFINITION);
  }

  /** Returns the closest enclosing function or modifier, or null. */
  public static @Nullable Node getEnclosingExecutable(Node n) {
    for (Node ancestor = n.getParent(); ancestor != null; ancestor = ancestor.getParent()) {
      if (isExecutable(ancestor)) {
        return ancestor;
      }
    }
    return null;
  }

  /** Returns the parameter list of a function, modifier, event or error. */
  public static Node getParameters(Node n) {
    Node params = n.getFirstChildOfType(Token.PARAMETER_LIST);
    checkState(params != null, "No parameters on %s", n);
    return params;
  }

  public static Node getReturnParameters(Node function) {
    checkArgument(
        function.isFunctionDefinition() || function.getToken() == Token.FUNCTION_TYPE_NAME);
    return getParameters(function).getNext();
  }

  /** Returns the body of a function or modifier, or null if it is not implemented. */
  public static @Nullable Node getBody(Node executable) {
    checkArgument(isExecutable(executable), executable);
    Node body = executable.getLastChild();
    return body.isEmpty() ? null : body;
  }

  /**
   * Returns how many arguments a call to the declaration takes, or -1 if the declaration is not
   * callable by name.
   */
  public static int getParameterCount(Node declaration) {
    switch (declaration.getToken()) {
      case FUNCTION_DEFINITION:
      case MODIFIER_DEFINITION:
      case EVENT_DEFINITION:
      case ERROR_DEFINITION:
        return getParameters(declaration).getChildCount();
      case STRUCT_DEFINITION:
        return declaration.getChildCount() - countLeadingMeta(declaration);
      default:
        return -1;
    }
  }

  private static int countLeadingMeta(Node n) {
    int count = 0;
    for (Node child : n.children()) {
      if (child.getToken() != Token.STRUCTURED_DOCUMENTATION) {
        break;
      }
      count++;
    }
    return count;
  }

  /** Returns the type name of a variable declaration, or null for {@code var} declarations. */
  public static @Nullable Node getVariableTypeName(Node variable) {
    checkArgument(variable.isVariableDeclaration(), variable);
    Node type = variable.getChildAtIndex(variable.getChildCount() - 2);
    return type.isEmpty() ? null : type;
  }

  /** The base contract names of a contract, in declaration order. */
  public static ImmutableList<Node> getBaseContractPaths(Node contract) {
    checkArgument(contract.isContractDefinition(), contract);
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Node child : contract.children()) {
      if (child.getToken() == Token.INHERITANCE_SPECIFIER) {
        result.add(child.getFirstChild());
      }
    }
    return result.build();
  }

  /** The declarations owned directly by a contract or source unit. */
  public static ImmutableList<Node> getMemberDeclarations(Node scope) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Node child : scope.children()) {
      if (child.getToken().isDeclaration()) {
        result.add(child);
      }
    }
    return result.build();
  }

  /** The members of a struct or the values of an enum. */
  public static ImmutableList<Node> getFields(Node n) {
    checkArgument(
        n.getToken() == Token.STRUCT_DEFINITION || n.getToken() == Token.ENUM_DEFINITION, n);
    return getMemberDeclarations(n);
  }

  /** Returns the condition of an if or loop statement. An absent for condition is EMPTY. */
  public static Node getConditionExpression(Node n) {
    switch (n.getToken()) {
      case IF_STATEMENT:
      case WHILE_STATEMENT:
      case CONDITIONAL:
        return n.getFirstChild();
      case DO_WHILE_STATEMENT:
      case FOR_STATEMENT:
        return n.getSecondChild();
      case YUL_IF:
        return n.getFirstChild();
      case YUL_FOR_LOOP:
        return n.getSecondChild();
      default:
        throw new IllegalArgumentException(n + " does not have a condition.");
    }
  }

  public static Node getLoopBody(Node n) {
    switch (n.getToken()) {
      case WHILE_STATEMENT:
      case FOR_STATEMENT:
      case YUL_FOR_LOOP:
        return n.getLastChild();
      case DO_WHILE_STATEMENT:
        return n.getFirstChild();
      default:
        throw new IllegalArgumentException(n + " is not a loop.");
    }
  }

  public static boolean isLoopStructure(Node n) {
    switch (n.getToken()) {
      case WHILE_STATEMENT:
      case DO_WHILE_STATEMENT:
      case FOR_STATEMENT:
      case YUL_FOR_LOOP:
        return true;
      default:
        return false;
    }
  }

  /** Returns the callee of a call, looking through call options such as {@code {value: 1}}. */
  public static Node getCallee(Node call) {
    checkArgument(call.isFunctionCall() || call.getToken() == Token.YUL_FUNCTION_CALL, call);
    Node callee = call.getFirstChild();
    while (callee.getToken() == Token.FUNCTION_CALL_OPTIONS) {
      callee = callee.getFirstChild();
    }
    return callee;
  }

  public static int getArgumentCount(Node call) {
    return call.getChildCount() - 1;
  }

  /** Whether {@code n} is the literal {@code false}. */
  public static boolean isLiteralFalse(Node n) {
    return n.isLiteral()
        && "bool".equals(n.getStringProp(Prop.LITERAL_KIND))
        && "false".equals(n.getString());
  }

  /** Whether {@code n} is the callee position of a call, or the name of a modifier invocation. */
  public static boolean isCallee(Node n) {
    Node parent = n.getParent();
    if (parent == null) {
      return false;
    }
    while (parent.getToken() == Token.FUNCTION_CALL_OPTIONS && parent.getFirstChild() == n) {
      n = parent;
      parent = parent.getParent();
    }
    return (parent.isFunctionCall() && parent.getFirstChild() == n)
        || (parent.getToken() == Token.MODIFIER_INVOCATION && parent.getFirstChild() == n);
  }

  /** Returns the call {@code n} is the callee of, or null. */
  public static @Nullable Node getEnclosingCall(Node n) {
    if (!isCallee(n)) {
      return null;
    }
    Node parent = n.getParent();
    while (parent.getToken() == Token.FUNCTION_CALL_OPTIONS) {
      parent = parent.getParent();
    }
    return parent;
  }

  /** Visits {@code root} and all of its descendants in pre-order. */
  public static void visitPreOrder(Node root, Consumer<Node> visitor) {
    visitor.accept(root);
    for (Node child = root.getFirstChild(); child != null; child = child.getNext()) {
      visitPreOrder(child, visitor);
    }
  }

  /** Returns the innermost node of {@code root} whose span contains {@code offset}. */
  public static @Nullable Node getInnermostNodeAt(Node root, int offset) {
    if (root.getSpan() != null && !root.getSpan().contains(offset)) {
      return null;
    }
    for (Node child = root.getFirstChild(); child != null; child = child.getNext()) {
      Node found = getInnermostNodeAt(child, offset);
      if (found != null) {
        return found;
      }
    }
    return root.getSpan() == null ? null : root;
  }
}
