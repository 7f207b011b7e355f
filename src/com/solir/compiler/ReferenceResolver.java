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

import com.google.common.base.Splitter;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.SetMultimap;
import com.solir.ir.ExternalReference;
import com.solir.ir.Node;
import com.solir.ir.Node.Prop;
import com.solir.ir.SourceSpan;
import com.solir.ir.Token;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Binds every reference-capable node of a build to the declaration it names.
 *
 * <p>Names are looked up lexically, from the innermost enclosing scope outwards: blocks,
 * function parameters, the enclosing contract and its bases in linearization order, the source
 * unit and what it imports. Member accesses and dotted paths resolve their leftmost part first and
 * then search the member scope of what it resolved to. The compiler's own hints are only used when
 * the lexical search does not decide, and are always translated through the {@link
 * DeclarationIndex}.
 *
 * <p>The resolver runs in four steps: base contract names, linearizations, all other references,
 * override sets. Nodes of trees retained from the previous build keep their previous resolution
 * unless it points into a rebuilt file.
 */
final class ReferenceResolver {
  private static final Logger logger = Logger.getLogger(ReferenceResolver.class.getName());

  static final DiagnosticType UNRESOLVED_REFERENCE =
      DiagnosticType.warning("SOLIR_UNRESOLVED_REFERENCE", "Cannot resolve {0}: {1}");

  static final DiagnosticType LINEARIZATION_FAILED =
      DiagnosticType.warning(
          "SOLIR_LINEARIZATION_FAILED",
          "Inheritance graph of {0} cannot be linearized, using the compiler order");

  private static final Splitter DOT = Splitter.on('.');

  // Suffixes that inline assembly appends to names of Solidity variables.
  private static final ImmutableSet<String> ASSEMBLY_SUFFIXES =
      ImmutableSet.of("slot", "offset", "length", "address", "selector");

  private static final Pattern USER_TYPE_STRING =
      Pattern.compile("^(?:type\\()?(?:struct|contract|enum|library|interface) ([A-Za-z0-9_$.]+)");

  private final ImmutableMap<String, Node> units;
  private final DeclarationIndex declarations;
  private final ReferenceMap references;
  private final @Nullable ReferenceMap previous;
  private final Set<String> rebuiltPaths;
  private final ErrorManager errorManager;
  private final CancellationToken cancellationToken;

  private final Map<Node, ImmutableList<Node>> linearizations = new LinkedHashMap<>();
  private final Map<Node, ListMultimap<String, Node>> memberScopes = new HashMap<>();
  private final Map<Node, ListMultimap<String, Node>> unitScopes = new HashMap<>();
  private final Set<Node> unitScopesInProgress = new HashSet<>();

  /**
   * @param units the source units of the build by path
   * @param previous the references of the previous build, for retained trees
   * @param rebuiltPaths paths whose trees were rebuilt or dropped in this build
   */
  ReferenceResolver(
      ImmutableMap<String, Node> units,
      DeclarationIndex declarations,
      ReferenceMap references,
      @Nullable ReferenceMap previous,
      Set<String> rebuiltPaths,
      ErrorManager errorManager,
      CancellationToken cancellationToken) {
    this.units = units;
    this.declarations = declarations;
    this.references = references;
    this.previous = previous;
    this.rebuiltPaths = rebuiltPaths;
    this.errorManager = errorManager;
    this.cancellationToken = cancellationToken;
  }

  void process() {
    for (Node unit : units.values()) {
      cancellationToken.throwIfCancelled();
      for (Node contract : contractsOf(unit)) {
        for (Node base : NodeUtil.getBaseContractPaths(contract)) {
          resolve(base);
        }
      }
    }

    Linearization c3 = new Linearization(this::getDirectBases);
    for (Node unit : units.values()) {
      for (Node contract : contractsOf(unit)) {
        linearizations.put(contract, linearize(c3, contract));
      }
    }

    NodeTraversal.builder()
        .setCancellationToken(cancellationToken)
        .setCallback(
            (NodeTraversal t, Node n, @Nullable Node parent) -> {
              if (n.getToken().isReferenceCapable()) {
                resolve(n);
              }
            })
        .traverseRoots(units.values());

    computeOverrideSets();
    logger.fine(() -> "Resolved " + references.size() + " references");
  }

  /** The linearization of every contract of the build, most derived first. */
  ImmutableMap<Node, ImmutableList<Node>> getLinearizations() {
    return ImmutableMap.copyOf(linearizations);
  }

  private static List<Node> contractsOf(Node unit) {
    List<Node> result = new ArrayList<>();
    for (Node child : unit.children()) {
      if (child.isContractDefinition()) {
        result.add(child);
      }
    }
    return result;
  }

  private List<Node> getDirectBases(Node contract) {
    List<Node> result = new ArrayList<>();
    for (Node path : NodeUtil.getBaseContractPaths(contract)) {
      Reference ref = references.get(path);
      if (ref != null && ref.getTarget() != null && ref.getTarget().isContractDefinition()) {
        result.add(ref.getTarget());
      }
    }
    return result;
  }

  private ImmutableList<Node> linearize(Linearization c3, Node contract) {
    ImmutableList<Node> order = c3.linearize(contract);
    if (order != null) {
      return order;
    }
    errorManager.report(IrError.make(contract, LINEARIZATION_FAILED, contract.getString()));
    List<Long> hint = hintList(contract, Prop.LINEARIZED_BASE_CONTRACT_IDS);
    LinkedHashSet<Node> result = new LinkedHashSet<>();
    result.add(contract);
    for (long id : hint) {
      Node base = declarations.resolveHint(hintScope(contract), id);
      if (base != null && base.isContractDefinition()) {
        result.add(base);
      }
    }
    return ImmutableList.copyOf(result);
  }

  /** Returns the linearization of a contract, or just the contract if none was computed. */
  private ImmutableList<Node> linearizationOf(Node contract) {
    ImmutableList<Node> order = linearizations.get(contract);
    return order != null ? order : ImmutableList.of(contract);
  }

  // Resolution of single nodes

  /** Resolves {@code n} if it was not resolved yet, and returns its reference. */
  Reference resolve(Node n) {
    Reference existing = references.get(n);
    if (existing != null) {
      return existing;
    }
    Reference reference = reuseRetained(n);
    if (reference == null) {
      reference = compute(n);
      if (!reference.isResolved()) {
        errorManager.report(
            IrError.make(n, UNRESOLVED_REFERENCE, describe(n), reference.getReason()));
      }
    }
    references.put(reference);
    return reference;
  }

  private @Nullable Reference reuseRetained(Node n) {
    if (previous == null) {
      return null;
    }
    String path = n.getSourceFileName();
    if (path == null || rebuiltPaths.contains(path)) {
      return null;
    }
    Reference old = previous.get(n);
    if (old == null || !old.isResolved()) {
      return null;
    }
    if (old.getTarget() != null && !isAvailable(old.getTarget())) {
      return null;
    }
    for (Node segment : old.getPathTargets()) {
      if (!isAvailable(segment)) {
        return null;
      }
    }
    return old;
  }

  private boolean isAvailable(Node target) {
    String path = target.getSourceFileName();
    return path != null
        && !rebuiltPaths.contains(path)
        && units.get(path) == target.getSourceUnit();
  }

  private static String describe(Node n) {
    String text = n.getString();
    return n.getToken() + (text == null ? "" : " " + text);
  }

  private Reference compute(Node n) {
    switch (n.getToken()) {
      case IDENTIFIER:
        return resolveIdentifier(n);
      case MEMBER_ACCESS:
        return resolveMemberAccess(n);
      case IDENTIFIER_PATH:
        return resolvePath(n);
      case USER_DEFINED_TYPE_NAME:
        return mirror(n, resolve(n.getFirstChild()));
      case IMPORT_DIRECTIVE:
        return resolveImport(n);
      case YUL_IDENTIFIER:
        return resolveYulIdentifier(n);
      default:
        throw new IllegalArgumentException("Not a reference: " + n);
    }
  }

  private static Reference mirror(Node n, Reference of) {
    switch (of.getKind()) {
      case DECLARATION:
        return Reference.toDeclaration(n, of.getTarget()).withPathTargets(of.getPathTargets());
      case GLOBAL:
        return Reference.toGlobal(n, of.getSymbol());
      default:
        return Reference.unresolved(
            n, of.getReason() != null ? of.getReason() : UnresolvedReason.NOT_FOUND);
    }
  }

  private Reference resolveIdentifier(Node n) {
    Node parent = n.getParent();
    if (parent != null && parent.getToken() == Token.IMPORT_DIRECTIVE) {
      return resolveImportedSymbol(n, parent);
    }
    String name = n.getString();
    if (name == null) {
      return fromHint(n, UnresolvedReason.NOT_FOUND);
    }
    List<Node> candidates = lookup(n, name);
    if (!candidates.isEmpty()) {
      return choose(n, name, candidates, NodeUtil.getEnclosingCall(n));
    }
    GlobalSymbol symbol = GlobalSymbol.forName(name);
    if (symbol != null) {
      return Reference.toGlobal(n, symbol);
    }
    return fromHint(n, UnresolvedReason.NOT_FOUND);
  }

  private Reference resolveImport(Node n) {
    String absolutePath = n.getStringProp(Prop.ABSOLUTE_PATH);
    Node target = absolutePath == null ? null : units.get(absolutePath);
    if (target != null) {
      return Reference.toDeclaration(n, target);
    }
    return fromHint(n, UnresolvedReason.TARGET_UNAVAILABLE);
  }

  private Reference resolveImportedSymbol(Node n, Node importDirective) {
    Reference unit = resolve(importDirective);
    String name = n.getString();
    if (unit.getTarget() == null || name == null) {
      return fromHint(n, UnresolvedReason.TARGET_UNAVAILABLE);
    }
    List<Node> candidates = unitScope(unit.getTarget()).get(name);
    if (candidates.isEmpty()) {
      return fromHint(n, UnresolvedReason.NOT_FOUND);
    }
    return choose(n, name, candidates, null);
  }

  private Reference resolveMemberAccess(Node n) {
    String name = checkNotNull(n.getString(), n);
    Node base = n.getFirstChild();
    Node call = NodeUtil.getEnclosingCall(n);

    MemberScope scope = memberScopeOf(base);
    if (scope != null && scope.symbolOwner != null) {
      GlobalSymbol symbol = GlobalSymbol.forMember(scope.symbolOwner, name);
      if (symbol != null) {
        return Reference.toGlobal(n, symbol);
      }
    }
    if (scope != null && scope.declaration != null) {
      List<Node> members = findMembers(scope.declaration, name, scope.skipFirst);
      if (!members.isEmpty()) {
        Reference ref = choose(n, name, members, call);
        return scope.dynamic && ref.getTarget() != null && isOverridable(ref.getTarget())
            ? ref.asVirtual()
            : ref;
      }
    }

    List<Node> attached = findAttachedFunctions(n, name);
    if (!attached.isEmpty()) {
      Reference ref = chooseAttached(n, attached, call);
      if (ref != null) {
        return ref;
      }
    }

    GlobalSymbol typeMember =
        GlobalSymbol.forMemberOfType(base.getStringProp(Prop.TYPE_STRING), name);
    if (typeMember != null) {
      return Reference.toGlobal(n, typeMember);
    }
    return fromHint(
        n, scope == null ? UnresolvedReason.NO_MEMBER_SCOPE : UnresolvedReason.NOT_FOUND);
  }

  private Reference resolvePath(Node n) {
    String text = checkNotNull(n.getString(), n);
    List<String> segments = DOT.splitToList(text);
    Node parent = n.getParent();
    Node call =
        parent != null && parent.getToken() == Token.MODIFIER_INVOCATION
            ? null
            : NodeUtil.getEnclosingCall(n);

    Node lookupFrom = n;
    if (parent != null && parent.getToken() == Token.INHERITANCE_SPECIFIER) {
      // Base names are not looked up inside the contract they extend.
      lookupFrom = parent.getParent();
    }
    List<Node> candidates = lookup(lookupFrom, segments.get(0));
    ImmutableList.Builder<Node> pathTargets = ImmutableList.builder();
    for (int i = 1; i < segments.size() && !candidates.isEmpty(); i++) {
      if (candidates.size() != 1) {
        candidates = ImmutableList.of();
        break;
      }
      Node scope = candidates.get(0);
      pathTargets.add(scope);
      candidates = findMembers(scope, segments.get(i), false);
    }
    if (candidates.isEmpty()) {
      return fromHint(n, UnresolvedReason.NOT_FOUND);
    }
    Reference ref = choose(n, segments.get(segments.size() - 1), candidates, call);
    if (!ref.isResolved()) {
      return ref;
    }
    if (segments.size() > 1) {
      return ref.withPathTargets(pathTargets.add(ref.getTarget()).build());
    }
    boolean isModifierName = parent != null && parent.getToken() == Token.MODIFIER_INVOCATION;
    return isModifierName && isOverridable(ref.getTarget()) ? ref.asVirtual() : ref;
  }

  private Reference resolveYulIdentifier(Node n) {
    String name = checkNotNull(n.getString(), n);
    Node assembly = n.getAncestorOfType(Token.INLINE_ASSEMBLY);
    checkNotNull(assembly, "Assembly identifier outside of assembly: %s", n);

    ExternalReference external = findExternalReference(assembly, n);
    if (external != null) {
      String scope = hintScope(n);
      Node target = declarations.resolveHint(scope, external.declarationId());
      if (target != null) {
        return Reference.toDeclaration(n, target);
      }
      if (declarations.getKey(scope, external.declarationId()) != null) {
        return Reference.unresolved(n, UnresolvedReason.TARGET_UNAVAILABLE);
      }
    }

    Node local = lookupYulLocal(n, name);
    if (local != null) {
      return Reference.toYulLocal(n, local);
    }
    Node parent = n.getParent();
    if (parent.getToken() == Token.YUL_FUNCTION_CALL && parent.getFirstChild() == n) {
      return Reference.toYulBuiltin(n);
    }

    String solidityName = stripAssemblySuffix(name);
    List<Node> candidates = lookup(assembly, solidityName);
    if (!candidates.isEmpty()) {
      return choose(n, solidityName, candidates, null);
    }
    return Reference.unresolved(n, UnresolvedReason.NOT_FOUND);
  }

  private static @Nullable ExternalReference findExternalReference(Node assembly, Node n) {
    SourceSpan span = n.getSpan();
    Object refs = assembly.getProp(Prop.EXTERNAL_REFERENCES);
    if (span == null || !(refs instanceof List)) {
      return null;
    }
    for (Object o : (List<?>) refs) {
      ExternalReference ref = (ExternalReference) o;
      if (ref.offset() == span.offset()) {
        return ref;
      }
    }
    return null;
  }

  private static String stripAssemblySuffix(String name) {
    int dot = name.lastIndexOf('.');
    if (dot > 0 && ASSEMBLY_SUFFIXES.contains(name.substring(dot + 1))) {
      return name.substring(0, dot);
    }
    return name;
  }

  /** Finds a variable or function declared inside the assembly block, visible from {@code n}. */
  private static @Nullable Node lookupYulLocal(Node n, String name) {
    Node child = n;
    for (Node scope = n.getParent();
        scope != null && scope.getToken() != Token.INLINE_ASSEMBLY;
        child = scope, scope = scope.getParent()) {
      switch (scope.getToken()) {
        case YUL_BLOCK:
          for (Node statement : scope.children()) {
            if (statement.getToken() == Token.YUL_FUNCTION_DEFINITION
                && name.equals(statement.getString())) {
              return statement;
            }
          }
          for (Node statement = scope.getFirstChild();
              statement != null && statement != child;
              statement = statement.getNext()) {
            Node declared = findYulVariable(statement, name);
            if (declared != null) {
              return declared;
            }
          }
          break;
        case YUL_FOR_LOOP:
          if (child != scope.getFirstChild()) {
            for (Node statement : scope.getFirstChild().children()) {
              Node declared = findYulVariable(statement, name);
              if (declared != null) {
                return declared;
              }
            }
          }
          break;
        case YUL_FUNCTION_DEFINITION:
          for (Node param : scope.children()) {
            if (param.getToken() == Token.YUL_TYPED_NAME && name.equals(param.getString())) {
              return param;
            }
          }
          break;
        default:
          break;
      }
    }
    return null;
  }

  private static @Nullable Node findYulVariable(Node statement, String name) {
    if (statement.getToken() != Token.YUL_VARIABLE_DECLARATION) {
      return null;
    }
    for (Node typed : statement.children()) {
      if (typed.getToken() == Token.YUL_TYPED_NAME && name.equals(typed.getString())) {
        return typed;
      }
    }
    return null;
  }

  // Lexical lookup

  /**
   * Returns the declarations named {@code name} in the innermost scope around {@code from} that
   * declares that name at all.
   */
  private List<Node> lookup(Node from, String name) {
    Node child = from;
    for (Node scope = from.getParent(); scope != null; child = scope, scope = scope.getParent()) {
      List<Node> found = lookupIn(scope, child, name);
      if (!found.isEmpty()) {
        return found;
      }
    }
    return ImmutableList.of();
  }

  private List<Node> lookupIn(Node scope, Node child, String name) {
    switch (scope.getToken()) {
      case BLOCK:
      case UNCHECKED_BLOCK:
        {
          List<Node> found = new ArrayList<>();
          for (Node statement = scope.getFirstChild();
              statement != null && statement != child;
              statement = statement.getNext()) {
            addDeclaredVariables(statement, name, found);
          }
          return found;
        }
      case FOR_STATEMENT:
        {
          List<Node> found = new ArrayList<>();
          if (child != scope.getFirstChild()) {
            addDeclaredVariables(scope.getFirstChild(), name, found);
          }
          return found;
        }
      case TRY_CATCH_CLAUSE:
        return child == scope.getLastChild() && !scope.getFirstChild().isEmpty()
            ? named(scope.getFirstChild().children(), name)
            : ImmutableList.of();
      case FUNCTION_DEFINITION:
      case MODIFIER_DEFINITION:
        {
          List<Node> found = new ArrayList<>();
          for (Node params : scope.children()) {
            if (params.getToken() == Token.PARAMETER_LIST) {
              found.addAll(named(params.children(), name));
            }
          }
          return found;
        }
      case CONTRACT_DEFINITION:
        return findMembers(scope, name, false);
      case SOURCE_UNIT:
        return unitScope(scope).get(name);
      default:
        return ImmutableList.of();
    }
  }

  private static void addDeclaredVariables(Node statement, String name, List<Node> found) {
    if (statement.getToken() != Token.VARIABLE_DECLARATION_STATEMENT) {
      return;
    }
    for (Node declaration : statement.children()) {
      if (declaration.isVariableDeclaration() && name.equals(declaration.getString())) {
        found.add(declaration);
      }
    }
  }

  private static List<Node> named(Iterable<Node> nodes, String name) {
    List<Node> result = new ArrayList<>();
    for (Node n : nodes) {
      if (name.equals(n.getString()) && NodeUtil.isDeclaration(n)) {
        result.add(n);
      }
    }
    return result;
  }

  /**
   * Searches the members of a contract through its linearization, or the members of any other
   * declaration with a member scope.
   *
   * @param skipFirst start after the contract itself, for {@code super}
   */
  private List<Node> findMembers(Node declaration, String name, boolean skipFirst) {
    switch (declaration.getToken()) {
      case CONTRACT_DEFINITION:
        {
          ImmutableList<Node> order = linearizationOf(declaration);
          for (int i = skipFirst ? 1 : 0; i < order.size(); i++) {
            Node contract = order.get(i);
            List<Node> found = new ArrayList<>();
            for (Node member : memberScope(contract).get(name)) {
              if (contract == declaration
                  || !"private".equals(member.getStringProp(Prop.VISIBILITY))) {
                found.add(member);
              }
            }
            if (!found.isEmpty()) {
              return found;
            }
          }
          return ImmutableList.of();
        }
      case SOURCE_UNIT:
        return unitScope(declaration).get(name);
      case ENUM_DEFINITION:
      case STRUCT_DEFINITION:
        return named(NodeUtil.getFields(declaration), name);
      default:
        return ImmutableList.of();
    }
  }

  private ListMultimap<String, Node> memberScope(Node contract) {
    return memberScopes.computeIfAbsent(
        contract,
        c -> {
          ListMultimap<String, Node> scope = ArrayListMultimap.create();
          for (Node member : NodeUtil.getMemberDeclarations(c)) {
            scope.put(NodeUtil.getDeclaredName(member), member);
          }
          return scope;
        });
  }

  /** The names visible at file level in a unit: its own declarations and what it imports. */
  private ListMultimap<String, Node> unitScope(Node unit) {
    ListMultimap<String, Node> known = unitScopes.get(unit);
    if (known != null) {
      return known;
    }
    if (!unitScopesInProgress.add(unit)) {
      // Symbol imports that cycle back see only what is declared locally.
      ListMultimap<String, Node> local = ArrayListMultimap.create();
      addOwnDeclarations(unit, local);
      return local;
    }
    ListMultimap<String, Node> scope = ArrayListMultimap.create();
    Set<Node> visited = new HashSet<>();
    Deque<Node> worklist = new ArrayDeque<>();
    worklist.add(unit);
    while (!worklist.isEmpty()) {
      Node current = worklist.removeFirst();
      if (!visited.add(current)) {
        continue;
      }
      addOwnDeclarations(current, scope);
      for (Node directive : current.children()) {
        if (directive.getToken() != Token.IMPORT_DIRECTIVE) {
          continue;
        }
        Node target = importedUnit(directive);
        if (target == null) {
          continue;
        }
        String alias = directive.getStringProp(Prop.UNIT_ALIAS);
        if (alias != null) {
          scope.put(alias, target);
        } else if (directive.hasChildren()) {
          addSymbolAliases(directive, target, scope);
        } else {
          worklist.add(target);
        }
      }
    }
    unitScopesInProgress.remove(unit);
    for (Map.Entry<String, Collection<Node>> entry : scope.asMap().entrySet()) {
      List<Node> unique = ImmutableList.copyOf(new LinkedHashSet<>(entry.getValue()));
      scope.replaceValues(entry.getKey(), unique);
    }
    unitScopes.put(unit, scope);
    return scope;
  }

  private static void addOwnDeclarations(Node unit, ListMultimap<String, Node> scope) {
    for (Node declaration : NodeUtil.getMemberDeclarations(unit)) {
      scope.put(NodeUtil.getDeclaredName(declaration), declaration);
    }
  }

  private void addSymbolAliases(Node directive, Node target, ListMultimap<String, Node> scope) {
    @SuppressWarnings("unchecked")
    List<String> locals = (List<String>) directive.getProp(Prop.SYMBOL_ALIASES);
    int i = 0;
    for (Node symbol : directive.children()) {
      String local = locals != null && i < locals.size() ? locals.get(i) : "";
      i++;
      String foreign = symbol.getString();
      if (foreign == null) {
        continue;
      }
      String boundName = local.isEmpty() ? foreign : local;
      for (Node declaration : unitScope(target).get(foreign)) {
        scope.put(boundName, declaration);
      }
    }
  }

  private @Nullable Node importedUnit(Node directive) {
    String absolutePath = directive.getStringProp(Prop.ABSOLUTE_PATH);
    return absolutePath == null ? null : units.get(absolutePath);
  }

  // Member scopes

  /** Where the members of an accessed expression are looked up. */
  private static final class MemberScope {
    final @Nullable Node declaration;
    final @Nullable String symbolOwner;
    final boolean skipFirst;
    final boolean dynamic;

    MemberScope(
        @Nullable Node declaration,
        @Nullable String symbolOwner,
        boolean skipFirst,
        boolean dynamic) {
      this.declaration = declaration;
      this.symbolOwner = symbolOwner;
      this.skipFirst = skipFirst;
      this.dynamic = dynamic;
    }
  }

  private @Nullable MemberScope memberScopeOf(Node base) {
    if (base.getToken() == Token.ELEMENTARY_TYPE_NAME_EXPRESSION) {
      return new MemberScope(null, base.getFirstChild().getString(), false, false);
    }
    if (base.getToken().isReferenceCapable()) {
      Reference ref = resolve(base);
      if (ref.getKind() == Reference.Kind.GLOBAL) {
        GlobalSymbol symbol = ref.getSymbol();
        Node contract = NodeUtil.getEnclosingContract(base);
        switch (symbol) {
          case SUPER:
            return contract == null ? null : new MemberScope(contract, null, true, false);
          case THIS:
            return contract == null ? null : new MemberScope(contract, null, false, true);
          default:
            return symbol.isNamespace()
                ? new MemberScope(null, symbol.getName(), false, false)
                : null;
        }
      }
      if (ref.getTarget() != null) {
        MemberScope scope = memberScopeOfDeclaration(ref.getTarget());
        if (scope != null) {
          return scope;
        }
      }
    }
    Node typed = declarationOfTypeString(base.getStringProp(Prop.TYPE_STRING));
    return typed == null ? null : new MemberScope(typed, null, false, false);
  }

  private @Nullable MemberScope memberScopeOfDeclaration(Node target) {
    switch (target.getToken()) {
      case CONTRACT_DEFINITION:
      case SOURCE_UNIT:
      case ENUM_DEFINITION:
        return new MemberScope(target, null, false, false);
      case USER_DEFINED_VALUE_TYPE_DEFINITION:
        return new MemberScope(null, "udvt", false, false);
      case VARIABLE_DECLARATION:
        {
          Node type = NodeUtil.getVariableTypeName(target);
          if (type == null || type.getToken() != Token.USER_DEFINED_TYPE_NAME) {
            return null;
          }
          Node typeDeclaration = resolve(type).getTarget();
          if (typeDeclaration == null) {
            return null;
          }
          if (typeDeclaration.getToken() == Token.STRUCT_DEFINITION) {
            return new MemberScope(typeDeclaration, null, false, false);
          }
          if (typeDeclaration.isContractDefinition()) {
            return new MemberScope(typeDeclaration, null, false, true);
          }
          return null;
        }
      default:
        return null;
    }
  }

  /** Finds the struct, contract or enum that a compiler type string names. */
  private @Nullable Node declarationOfTypeString(@Nullable String typeString) {
    if (typeString == null) {
      return null;
    }
    Matcher m = USER_TYPE_STRING.matcher(typeString);
    if (!m.find()) {
      return null;
    }
    ImmutableList<Node> found = declarations.findByCanonicalName(m.group(1));
    return found.size() == 1 ? found.get(0) : null;
  }

  /** Library functions attached with {@code using ... for} in the scope of {@code n}. */
  private List<Node> findAttachedFunctions(Node n, String name) {
    List<Node> found = new ArrayList<>();
    Node contract = NodeUtil.getEnclosingContract(n);
    List<Node> scopes = new ArrayList<>();
    if (contract != null) {
      scopes.add(contract);
    }
    Node unit = n.getSourceUnit();
    if (unit != null) {
      scopes.add(unit);
    }
    for (Node scope : scopes) {
      for (Node directive : scope.children()) {
        if (directive.getToken() != Token.USING_FOR_DIRECTIVE) {
          continue;
        }
        for (Node path : directive.children()) {
          if (path.getToken() != Token.IDENTIFIER_PATH) {
            continue;
          }
          Node attached = resolve(path).getTarget();
          if (attached == null) {
            continue;
          }
          if (attached.isContractDefinition()) {
            for (Node member : memberScope(attached).get(name)) {
              if (member.isFunctionDefinition()) {
                found.add(member);
              }
            }
          } else if (attached.isFunctionDefinition() && name.equals(attached.getString())) {
            found.add(attached);
          }
        }
      }
    }
    return found;
  }

  private @Nullable Reference chooseAttached(Node n, List<Node> candidates, @Nullable Node call) {
    if (candidates.size() == 1) {
      return Reference.toDeclaration(n, candidates.get(0));
    }
    Reference hinted = fromHint(n, UnresolvedReason.AMBIGUOUS);
    if (hinted.getTarget() != null && candidates.contains(hinted.getTarget())) {
      return hinted;
    }
    if (call != null) {
      // The accessed value is passed as the first argument.
      Node match = null;
      int matches = 0;
      for (Node candidate : candidates) {
        if (NodeUtil.getParameterCount(candidate) == NodeUtil.getArgumentCount(call) + 1) {
          match = candidate;
          matches++;
        }
      }
      if (matches == 1) {
        return Reference.toDeclaration(n, match);
      }
    }
    return null;
  }

  // Overloads and hints

  /**
   * Picks one declaration out of the candidates found for a name. Uses the compiler hint when it
   * names one of them, then the number of call arguments.
   */
  private Reference choose(Node n, String name, List<Node> candidates, @Nullable Node call) {
    if (candidates.size() == 1) {
      return declarationReference(n, candidates.get(0));
    }
    Reference hinted = fromHint(n, UnresolvedReason.AMBIGUOUS);
    Node hintedTarget = hinted.getTarget();
    if (hintedTarget != null && candidates.contains(hintedTarget)) {
      return declarationReference(n, hintedTarget);
    }
    if (call != null) {
      List<Node> matching = new ArrayList<>();
      for (Node candidate : candidates) {
        if (NodeUtil.getParameterCount(candidate) == NodeUtil.getArgumentCount(call)) {
          matching.add(candidate);
        }
      }
      if (matching.size() == 1) {
        return declarationReference(n, matching.get(0));
      }
    }
    if (hintedTarget != null && name.equals(hintedTarget.getString())) {
      return declarationReference(n, hintedTarget);
    }
    return Reference.unresolved(n, UnresolvedReason.AMBIGUOUS);
  }

  /** References through a plain name to a function or modifier may reach its overrides. */
  private static Reference declarationReference(Node n, Node target) {
    Reference ref = Reference.toDeclaration(n, target);
    return n.isIdentifier() && isOverridable(target) ? ref.asVirtual() : ref;
  }

  private static boolean isOverridable(Node target) {
    return (target.isFunctionDefinition() || target.isModifierDefinition())
        && NodeUtil.getEnclosingContract(target) != null;
  }

  /**
   * Resolves {@code n} through the compiler hint. Returns an unresolved reference with {@code
   * fallback} if there is no usable hint.
   */
  private Reference fromHint(Node n, UnresolvedReason fallback) {
    Object id = n.getProp(Prop.REFERENCED_DECLARATION_ID);
    if (!(id instanceof Long)) {
      return Reference.unresolved(n, fallback);
    }
    long hint = (Long) id;
    if (hint < 0) {
      GlobalSymbol symbol = GlobalSymbol.fromId(hint);
      return symbol != null ? Reference.toGlobal(n, symbol) : Reference.unresolved(n, fallback);
    }
    String scope = hintScope(n);
    Node target = declarations.resolveHint(scope, hint);
    if (target != null) {
      return Reference.toDeclaration(n, target);
    }
    if (declarations.getKey(scope, hint) != null) {
      return Reference.unresolved(n, UnresolvedReason.TARGET_UNAVAILABLE);
    }
    return Reference.unresolved(n, fallback);
  }

  private static String hintScope(Node n) {
    Node unit = checkNotNull(n.getSourceUnit(), n);
    return checkNotNull(unit.getStringProp(Prop.RUN_ID), unit);
  }

  private static List<Long> hintList(Node n, Prop prop) {
    @SuppressWarnings("unchecked")
    List<Long> ids = (List<Long>) n.getProp(prop);
    return ids == null ? ImmutableList.of() : ids;
  }

  // Override sets

  private void computeOverrideSets() {
    SetMultimap<Node, Node> direct = LinkedHashMultimap.create();
    for (Node contract : linearizations.keySet()) {
      for (Node member : NodeUtil.getMemberDeclarations(contract)) {
        for (Node base : overriddenBy(contract, member)) {
          direct.put(base, member);
        }
      }
    }
    for (Node overridden : ImmutableList.copyOf(direct.keySet())) {
      Set<Node> all = new LinkedHashSet<>();
      Deque<Node> worklist = new ArrayDeque<>(direct.get(overridden));
      while (!worklist.isEmpty()) {
        Node next = worklist.removeFirst();
        if (next != overridden && all.add(next)) {
          worklist.addAll(direct.get(next));
        }
      }
      references.putOverriders(overridden, all);
    }
  }

  /** Returns the declarations that {@code member} of {@code contract} directly overrides. */
  private List<Node> overriddenBy(Node contract, Node member) {
    Prop hintProp;
    if (member.isFunctionDefinition()) {
      hintProp = Prop.BASE_FUNCTION_IDS;
    } else if (member.isModifierDefinition()) {
      hintProp = Prop.BASE_MODIFIER_IDS;
    } else if (member.isVariableDeclaration() && member.getProp(Prop.BASE_FUNCTION_IDS) != null) {
      hintProp = Prop.BASE_FUNCTION_IDS;
    } else {
      return ImmutableList.of();
    }
    List<Node> result = new ArrayList<>();
    if (member.getProp(hintProp) != null) {
      for (long id : hintList(member, hintProp)) {
        Node base = declarations.resolveHint(hintScope(member), id);
        if (base != null && base != member) {
          result.add(base);
        }
      }
      return result;
    }
    String name = member.getString();
    if (name == null || name.isEmpty()) {
      return result;
    }
    ImmutableList<Node> order = linearizationOf(contract);
    for (int i = 1; i < order.size(); i++) {
      for (Node candidate : memberScope(order.get(i)).get(name)) {
        if (candidate.getToken() == member.getToken()
            && NodeUtil.getParameterCount(candidate) == NodeUtil.getParameterCount(member)) {
          result.add(candidate);
        }
      }
    }
    return result;
  }
}
