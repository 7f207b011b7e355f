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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the intermediate representation.
 *
 * <p>A node owns its children through a sibling-linked list; the parent pointer is the only
 * upward link. Links from a reference to the declaration it names are never stored here, so the
 * ownership structure of a tree stays acyclic.
 */
public class Node {

  /** Marker for nodes the compiler does not number, such as assembly nodes. */
  public static final long NO_AST_ID = -1;

  /** Kind-specific payload. */
  public enum Prop {
    // A SourceFile for the file a SOURCE_UNIT describes.
    SOURCE_FILE,
    // The compilation run that produced this SOURCE_UNIT.
    RUN_ID,
    LICENSE,
    // The import path as written, and as resolved by the compiler.
    IMPORT_PATH,
    ABSOLUTE_PATH,
    UNIT_ALIAS,
    // Local names of the symbols imported by an IMPORT_DIRECTIVE, parallel to its children.
    SYMBOL_ALIASES,
    // Fully qualified name of a declaration.
    CANONICAL_NAME,
    CONTRACT_KIND,
    ABSTRACT,
    FUNCTION_KIND,
    VISIBILITY,
    STATE_MUTABILITY,
    VIRTUAL,
    MUTABILITY,
    CONSTANT,
    STATE_VARIABLE,
    STORAGE_LOCATION,
    INDEXED,
    ANONYMOUS,
    GLOBAL,
    MODIFIER_INVOCATION_KIND,
    OPERATOR,
    PREFIX,
    CALL_KIND,
    TRY_CALL,
    ARGUMENT_NAMES,
    OPTION_NAMES,
    LITERAL_KIND,
    HEX_VALUE,
    SUBDENOMINATION,
    INLINE_ARRAY,
    // Type description string computed by the compiler.
    TYPE_STRING,
    // Assembly text of documents that carry no Yul tree.
    OPERATIONS,
    YUL_PARAMETER_COUNT,
    // Compiler hints. All ids are local to the run that produced the tree.
    REFERENCED_DECLARATION_ID,
    OVERLOADED_DECLARATION_IDS,
    BASE_FUNCTION_IDS,
    BASE_MODIFIER_IDS,
    LINEARIZED_BASE_CONTRACT_IDS,
    EXTERNAL_REFERENCES,
  }

  private abstract static class PropListItem {
    final @Nullable PropListItem next;
    final byte propType;

    PropListItem(byte propType, @Nullable PropListItem next) {
      this.propType = propType;
      this.next = next;
    }

    abstract int getIntValue();

    abstract Object getObjectValue();

    abstract PropListItem chain(@Nullable PropListItem next);
  }

  private static final class ObjectPropListItem extends PropListItem {
    private final Object objectValue;

    ObjectPropListItem(byte propType, Object objectValue, @Nullable PropListItem next) {
      super(propType, next);
      this.objectValue = checkNotNull(objectValue);
    }

    @Override
    int getIntValue() {
      throw new UnsupportedOperationException();
    }

    @Override
    Object getObjectValue() {
      return objectValue;
    }

    @Override
    PropListItem chain(@Nullable PropListItem next) {
      return new ObjectPropListItem(propType, objectValue, next);
    }

    @Override
    public String toString() {
      return String.valueOf(objectValue);
    }
  }

  private static final class IntPropListItem extends PropListItem {
    final int intValue;

    IntPropListItem(byte propType, int intValue, @Nullable PropListItem next) {
      super(propType, next);
      this.intValue = intValue;
      checkState(this.intValue != 0);
    }

    @Override
    int getIntValue() {
      return intValue;
    }

    @Override
    Object getObjectValue() {
      throw new UnsupportedOperationException();
    }

    @Override
    PropListItem chain(@Nullable PropListItem next) {
      return new IntPropListItem(propType, intValue, next);
    }

    @Override
    public String toString() {
      return String.valueOf(intValue);
    }
  }

  private final Token token;
  private @Nullable String string;
  private long astId = NO_AST_ID;
  private @Nullable SourceSpan span;

  private @Nullable Node parent;
  private @Nullable Node first; // first.previous is the last child
  private @Nullable Node next;
  private @Nullable Node previous;

  private @Nullable PropListItem propListHead;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, @Nullable String string) {
    this(token);
    this.string = string;
  }

  public static Node newEmpty() {
    return new Node(Token.EMPTY);
  }

  public final Token getToken() {
    return token;
  }

  /** The name, operator or literal value carried by this node, or null. */
  public final @Nullable String getString() {
    return string;
  }

  public final void setString(@Nullable String string) {
    this.string = string;
  }

  public final long getAstId() {
    return astId;
  }

  public final void setAstId(long astId) {
    this.astId = astId;
  }

  public final boolean hasAstId() {
    return astId != NO_AST_ID;
  }

  public final @Nullable SourceSpan getSpan() {
    return span;
  }

  public final void setSpan(@Nullable SourceSpan span) {
    this.span = span;
  }

  public final @Nullable String getSourceFileName() {
    return span != null ? span.path() : null;
  }

  public final int getSourceOffset() {
    return span != null ? span.offset() : -1;
  }

  public final int getLength() {
    return span != null ? span.length() : 0;
  }

  /** Returns the root SOURCE_UNIT of the tree this node belongs to, or null if detached. */
  public final @Nullable Node getSourceUnit() {
    Node n = this;
    while (n != null && n.token != Token.SOURCE_UNIT) {
      n = n.parent;
    }
    return n;
  }

  public final @Nullable SourceFile getSourceFile() {
    Node unit = getSourceUnit();
    return unit != null ? (SourceFile) unit.getProp(Prop.SOURCE_FILE) : null;
  }

  /** One-based line of the first byte, or -1 if unknown. */
  public final int getLineno() {
    SourceFile file = getSourceFile();
    if (file == null || span == null) {
      return -1;
    }
    return file.getLineOfOffset(span.offset());
  }

  /** Zero-based column of the first byte, or -1 if unknown. */
  public final int getCharno() {
    SourceFile file = getSourceFile();
    if (file == null || span == null) {
      return -1;
    }
    return file.getColumnOfOffset(span.offset());
  }

  /** Returns the source text covered by this node, or null if unknown. */
  public final @Nullable String getSourceText() {
    SourceFile file = getSourceFile();
    if (file == null || span == null) {
      return null;
    }
    return file.getText(span.offset(), span.length());
  }

  // Tree structure

  public final @Nullable Node getParent() {
    return parent;
  }

  public final @Nullable Node getGrandparent() {
    return parent == null ? null : parent.parent;
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild(), "Expected one child: %s", this);
    return first;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  /** Gets the ith child. This is O(N) in the number of children. */
  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public final int getIndexOfChild(Node child) {
    Node n = first;
    int i = 0;
    while (n != null) {
      if (child == n) {
        return i;
      }
      n = n.next;
      i++;
    }
    return -1;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  /** Returns the first child of the given kind, or null. */
  public final @Nullable Node getFirstChildOfType(Token type) {
    for (Node c = first; c != null; c = c.next) {
      if (c.token == type) {
        return c;
      }
    }
    return null;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);

    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    child.parent = this;
  }

  public final void addChildToFront(Node child) {
    checkArgument(child.parent == null);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);
    child.parent = this;
    child.next = first;
    if (first == null) {
      child.previous = child;
    } else {
      child.previous = first.previous;
      first.previous = child;
    }
    first = child;
  }

  /** Whether {@code node} is this node or one of its descendants. */
  public final boolean isAncestorOf(Node node) {
    for (Node n = node; n != null; n = n.parent) {
      if (n == this) {
        return true;
      }
    }
    return false;
  }

  /** Returns the nearest ancestor of the given kind, excluding this node, or null. */
  public final @Nullable Node getAncestorOfType(Token type) {
    for (Node n = parent; n != null; n = n.parent) {
      if (n.token == type) {
        return n;
      }
    }
    return null;
  }

  /**
   * Iterates over the direct children.
   *
   * <pre>for (Node child : n.children()) { ...</pre>
   */
  public final Iterable<Node> children() {
    if (first == null) {
      return Collections.emptySet();
    } else {
      return new SiblingNodeIterable(first);
    }
  }

  private static final class SiblingNodeIterable implements Iterable<Node> {
    private final Node start;

    SiblingNodeIterable(Node start) {
      this.start = start;
    }

    @Override
    public Iterator<Node> iterator() {
      return new SiblingNodeIterator(start);
    }
  }

  private static final class SiblingNodeIterator implements Iterator<Node> {
    private @Nullable Node current;

    SiblingNodeIterator(Node start) {
      this.current = start;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node n = current;
      current = current.getNext();
      return n;
    }
  }

  // Properties

  private @Nullable PropListItem lookupProperty(Prop prop) {
    byte propType = (byte) prop.ordinal();
    PropListItem x = propListHead;
    while (x != null && propType != x.propType) {
      x = x.next;
    }
    return x;
  }

  private static @Nullable PropListItem rebuildListWithoutProp(
      @Nullable PropListItem item, Prop prop) {
    if (item == null) {
      return null;
    } else if (item.propType == prop.ordinal()) {
      return item.next;
    } else {
      PropListItem result = rebuildListWithoutProp(item.next, prop);
      return (result == item.next) ? item : item.chain(result);
    }
  }

  public final @Nullable Object getProp(Prop prop) {
    PropListItem item = lookupProperty(prop);
    return item == null ? null : item.getObjectValue();
  }

  public final @Nullable String getStringProp(Prop prop) {
    return (String) getProp(prop);
  }

  public final boolean getBooleanProp(Prop prop) {
    return getIntProp(prop) != 0;
  }

  /** Returns the integer value for the property, or 0 if the property is not defined. */
  public final int getIntProp(Prop prop) {
    PropListItem item = lookupProperty(prop);
    return item == null ? 0 : item.getIntValue();
  }

  public final void putProp(Prop prop, @Nullable Object value) {
    this.propListHead = rebuildListWithoutProp(this.propListHead, prop);
    if (value != null) {
      this.propListHead = new ObjectPropListItem((byte) prop.ordinal(), value, this.propListHead);
    }
  }

  public final void putBooleanProp(Prop prop, boolean value) {
    putIntProp(prop, value ? 1 : 0);
  }

  public final void putIntProp(Prop prop, int value) {
    this.propListHead = rebuildListWithoutProp(this.propListHead, prop);
    if (value != 0) {
      this.propListHead = new IntPropListItem((byte) prop.ordinal(), value, this.propListHead);
    }
  }

  // Kind predicates

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public final boolean isSourceUnit() {
    return token == Token.SOURCE_UNIT;
  }

  public final boolean isContractDefinition() {
    return token == Token.CONTRACT_DEFINITION;
  }

  public final boolean isFunctionDefinition() {
    return token == Token.FUNCTION_DEFINITION;
  }

  public final boolean isModifierDefinition() {
    return token == Token.MODIFIER_DEFINITION;
  }

  public final boolean isVariableDeclaration() {
    return token == Token.VARIABLE_DECLARATION;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK || token == Token.UNCHECKED_BLOCK;
  }

  public final boolean isIdentifier() {
    return token == Token.IDENTIFIER;
  }

  public final boolean isMemberAccess() {
    return token == Token.MEMBER_ACCESS;
  }

  public final boolean isFunctionCall() {
    return token == Token.FUNCTION_CALL;
  }

  public final boolean isLiteral() {
    return token == Token.LITERAL;
  }

  /**
   * Whether this tree has the same shape, kinds, payload strings and spans as {@code other}. Run
   * local ids and properties are not compared.
   */
  public final boolean isEquivalentTo(Node other) {
    if (token != other.token
        || !Objects.equals(string, other.string)
        || !Objects.equals(span, other.span)) {
      return false;
    }
    Node a = first;
    Node b = other.first;
    while (a != null && b != null) {
      if (!a.isEquivalentTo(b)) {
        return false;
      }
      a = a.next;
      b = b.next;
    }
    return a == null && b == null;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (string != null) {
      sb.append(' ').append(string);
    }
    if (span != null) {
      sb.append(" [").append(span.offset()).append(':').append(span.length()).append(']');
    }
    return sb.toString();
  }

  public final String toStringTree() {
    try {
      StringBuilder s = new StringBuilder();
      appendStringTree(s);
      return s.toString();
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
  }

  public final void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(Node n, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Node cursor = n.first; cursor != null; cursor = cursor.next) {
      toStringTreeHelper(cursor, level + 1, sb);
    }
  }
}
