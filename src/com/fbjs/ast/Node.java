/*
 * Copyright 2009 The FBJS Authors.
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

package com.fbjs.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CheckReturnValue;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the intermediate representation.
 *
 * <p>A node owns its children, which form an intrusive doubly linked list. A child node is its
 * own position handle: inserting or removing one child never invalidates the others, so a pass may
 * mutate the list while walking it as long as it reads {@link #getNext()} first.
 *
 * <p>Every kind has a fixed number of slots. An optional slot that is not present holds a node of
 * token {@link Token#ABSENT} rather than nothing.
 */
public class Node {

  /** Boolean properties attached to a node. */
  public enum Prop {
    // The STRING value still carries the quotes it had in the source.
    QUOTED,
    // Whether INC/DEC is postfix (true) or prefix (false).
    INCRDECR,
    // The VAR is the left-hand side of a for-in loop.
    FOR_ITERATOR,
  }

  public static final Prop QUOTED_PROP = Prop.QUOTED;
  public static final Prop INCRDECR_PROP = Prop.INCRDECR;
  public static final Prop FOR_ITERATOR_PROP = Prop.FOR_ITERATOR;

  private static final class NumberNode extends Node {

    private double number;

    NumberNode(double number) {
      super(Token.NUMBER);
      this.number = number;
    }

    @Override
    public double getDouble() {
      return this.number;
    }

    @Override
    public void setDouble(double d) {
      this.number = d;
    }

    @Override
    boolean isEquivalentToShallow(Node node) {
      if (!super.isEquivalentToShallow(node)) {
        return false;
      }
      double other = ((NumberNode) node).number;
      return number == other || (Double.isNaN(number) && Double.isNaN(other));
    }

    @Override
    NumberNode cloneNode() {
      NumberNode clone = new NumberNode(number);
      copyBaseNodeFields(this, clone);
      return clone;
    }
  }

  private static final class StringNode extends Node {

    private String str;

    StringNode(Token token, String str) {
      super(token);
      this.str = str;
    }

    @Override
    public String getString() {
      return this.str;
    }

    @Override
    public void setString(String str) {
      checkArgument(str != null, "StringNode: str is null");
      this.str = str;
    }

    @Override
    boolean isEquivalentToShallow(Node node) {
      return super.isEquivalentToShallow(node) && this.str.equals(((StringNode) node).str);
    }

    @Override
    StringNode cloneNode() {
      StringNode clone = new StringNode(getToken(), str);
      copyBaseNodeFields(this, clone);
      return clone;
    }
  }

  private static final class RegExpNode extends Node {

    private final String pattern;
    private final String flags;

    RegExpNode(String pattern, String flags) {
      super(Token.REGEXP);
      this.pattern = pattern;
      this.flags = flags;
    }

    @Override
    public String getString() {
      return pattern;
    }

    @Override
    public String getRegExpFlags() {
      return flags;
    }

    @Override
    boolean isEquivalentToShallow(Node node) {
      if (!super.isEquivalentToShallow(node)) {
        return false;
      }
      RegExpNode other = (RegExpNode) node;
      return pattern.equals(other.pattern) && flags.equals(other.flags);
    }

    @Override
    RegExpNode cloneNode() {
      RegExpNode clone = new RegExpNode(pattern, flags);
      copyBaseNodeFields(this, clone);
      return clone;
    }
  }

  private Token token;
  private @Nullable Node next; // next sibling, a linked list
  private @Nullable Node previous; // previous sibling, a circular linked list
  private @Nullable Node first; // first element of a linked list of children
  private @Nullable Node parent;
  // We get the last child as first.previous. But last.next is null, not first.

  /** Source line of this node; 0 for synthetic nodes. */
  private int lineno;

  /** Bit set of {@link Prop} ordinals. */
  private int props;

  public Node(Token token) {
    this.token = token;
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public static Node newNumber(double number) {
    return new NumberNode(number);
  }

  /** Creates a NAME or STRING node. */
  public static Node newString(Token token, String str) {
    checkArgument(token == Token.NAME || token == Token.STRING, token);
    return new StringNode(token, str);
  }

  public static Node newRegExp(String pattern, String flags) {
    return new RegExpNode(pattern, flags);
  }

  public final Token getToken() {
    return token;
  }

  public final int getLineno() {
    return lineno;
  }

  public final Node setLineno(int lineno) {
    checkArgument(lineno >= 0, "negative line number: %s", lineno);
    this.lineno = lineno;
    return this;
  }

  /** Copies the source line of {@code other} onto this node. */
  public final Node srcref(Node other) {
    this.lineno = other.lineno;
    return this;
  }

  // ==========================================================================
  // Payload accessors

  public double getDouble() {
    throw new UnsupportedOperationException(this + " is not a number node");
  }

  public void setDouble(double value) {
    throw new UnsupportedOperationException(this + " is not a number node");
  }

  /** Returns the identifier name, the raw string literal text or the regex pattern. */
  public String getString() {
    throw new UnsupportedOperationException(this + " is not a string node");
  }

  /** Renames an identifier or replaces the raw text of a string literal. */
  public void setString(String str) {
    throw new UnsupportedOperationException(this + " is not a string node");
  }

  public String getRegExpFlags() {
    throw new UnsupportedOperationException(this + " is not a regular expression");
  }

  /**
   * Returns the value of a STRING node without the source quotes it may carry. Escape sequences
   * are left as written.
   */
  public final String getUnquotedString() {
    checkState(isString(), this);
    String str = getString();
    if (getBooleanProp(Prop.QUOTED) && str.length() >= 2) {
      return str.substring(1, str.length() - 1);
    }
    return str;
  }

  // ==========================================================================
  // Properties

  public final boolean getBooleanProp(Prop prop) {
    return (props & (1 << prop.ordinal())) != 0;
  }

  public final void putBooleanProp(Prop prop, boolean value) {
    if (value) {
      props |= 1 << prop.ordinal();
    } else {
      props &= ~(1 << prop.ordinal());
    }
  }

  public final boolean isForIterator() {
    return getBooleanProp(Prop.FOR_ITERATOR);
  }

  public final Node setForIterator(boolean iterator) {
    checkState(isVar(), this);
    putBooleanProp(Prop.FOR_ITERATOR, iterator);
    return this;
  }

  // ==========================================================================
  // Children

  public final boolean hasChildren() {
    return first != null;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first != null ? first.next : null;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @param i The index
   * @return The ith child
   */
  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public final boolean hasXChildren(int x) {
    return getChildCount() == x;
  }

  /** Appends {@code child} as the last slot. */
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
      // NOTE: child.next remains null
      child.previous = last;
      first.previous = child;
    }

    child.parent = this;
  }

  /** Inserts {@code child} as the first slot. */
  public final void addChildToFront(Node child) {
    checkArgument(child.parent == null);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);
    child.parent = this;
    child.next = first;
    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
    } else {
      Node last = first.previous;
      // NOTE: last.next remains null
      child.previous = last;
      first.previous = child;
    }
    first = child;
  }

  /** Inserts {@code newChild} immediately before the slot {@code node}. */
  public final void addChildBefore(Node newChild, Node node) {
    checkArgument(node.parent == this, "The existing child node of the parent should not be null.");
    checkArgument(newChild.parent == null, "Cannot add already-owned child node: %s", newChild);
    newChild.insertBefore(node);
  }

  /** Inserts {@code newChild} immediately after the slot {@code node}. */
  public final void addChildAfter(Node newChild, Node node) {
    checkArgument(node.parent == this, "The existing child node of the parent should not be null.");
    checkArgument(newChild.parent == null, "Cannot add already-owned child node: %s", newChild);
    newChild.insertAfter(node);
  }

  /**
   * Detaches {@code child} and returns it. The caller owns the result and must attach it elsewhere
   * or drop it.
   */
  public final Node removeChild(Node child) {
    checkArgument(child.parent == this, "%s is not a child of %s", child, this);
    return child.detach();
  }

  /**
   * Puts {@code newChild} into the slot held by {@code child} and returns the detached {@code
   * child}.
   */
  public final Node replaceChild(Node child, Node newChild) {
    checkArgument(child.parent == this, "%s is not a child of %s", child, this);
    checkArgument(newChild.parent == null, "Cannot add already-owned child node: %s", newChild);
    child.replaceWith(newChild);
    return child;
  }

  public final @Nullable Node removeFirstChild() {
    Node child = first;
    if (child != null) {
      child.detach();
    }
    return child;
  }

  /** Read-only view of the child slots, in order. */
  public final Iterable<Node> children() {
    if (first == null) {
      return Collections.emptySet();
    } else {
      return new SiblingNodeIterable(first);
    }
  }

  private void insertBefore(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    final Node existingParent = existing.parent;
    final Node existingPrevious = existing.previous;

    this.parent = existingParent;

    this.next = existing;
    existing.previous = this;

    this.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = this;
      // existingPrevious.next remains null
    } else {
      // existingParent.first remains existing
      existingPrevious.next = this;
    }
  }

  private void insertAfter(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    final Node existingParent = existing.parent;
    final Node existingNext = existing.next;

    this.parent = existingParent;

    existing.next = this;
    this.previous = existing;

    if (existingNext == null) {
      existingParent.first.previous = this;
      // this.next remains null
    } else {
      existingNext.previous = this;
      this.next = existingNext;
    }
  }

  /** Swaps {@code replacement} and its subtree into the position of this node. */
  public final void replaceWith(Node replacement) {
    this.checkAttached();
    replacement.checkDetached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    // The sequence below also has to work when `this` is an only child, which can cause many of
    // the variables to point to the same object.

    this.parent = null;
    replacement.parent = existingParent;

    this.previous = null;
    replacement.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = replacement;
      // existingPrevious.next remains null
    } else {
      existingPrevious.next = replacement;
    }

    if (existingNext == null) {
      existingParent.first.previous = replacement;
      // replacement.next remains null
    } else {
      this.next = null;
      existingNext.previous = replacement;
      replacement.next = existingNext;
    }
  }

  /** Removes this node from its parent, but retains its subtree. */
  public final Node detach() {
    this.checkAttached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    this.parent = null;

    if (existingNext == null) {
      existingParent.first.previous = existingPrevious;
    } else {
      this.next = null;
      existingNext.previous = existingPrevious;
    }

    this.previous = null;
    if (existingPrevious.next == null) {
      existingParent.first = existingNext;
    } else {
      existingPrevious.next = existingNext;
    }

    return this;
  }

  private void checkAttached() {
    checkState(this.parent != null, "Has no parent: %s", this);
  }

  private void checkDetached() {
    checkState(this.parent == null, "Has parent: %s", this);
    checkState(this.next == null, "Has next: %s", this);
    checkState(this.previous == null, "Has previous: %s", this);
  }

  /** @see Node#children() */
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

  /** @see Node#children() */
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

  // ==========================================================================
  // Equivalence and cloning

  /**
   * Whether this subtree is structurally equal to {@code node}: same kinds, same payloads and
   * properties, and pairwise equivalent children of the same count.
   */
  public final boolean isEquivalentTo(Node node) {
    if (!isEquivalentToShallow(node)) {
      return false;
    }
    Node n = first;
    Node n2 = node.first;
    while (n != null && n2 != null) {
      if (!n.isEquivalentTo(n2)) {
        return false;
      }
      n = n.next;
      n2 = n2.next;
    }
    return n == null && n2 == null;
  }

  /** Compares everything but the children. */
  boolean isEquivalentToShallow(Node node) {
    return token == node.token && props == node.props && this.getClass() == node.getClass();
  }

  /** Returns a detached clone of the Node, specifically excluding its children. */
  @CheckReturnValue
  Node cloneNode() {
    Node clone = new Node(token);
    copyBaseNodeFields(this, clone);
    return clone;
  }

  private static void copyBaseNodeFields(Node source, Node dest) {
    dest.lineno = source.lineno;
    dest.props = source.props;
  }

  /** Returns a detached clone of the Node and all its children. */
  @CheckReturnValue
  public final Node cloneTree() {
    Node result = cloneNode();
    for (Node n2 = first; n2 != null; n2 = n2.next) {
      result.addChildToBack(n2.cloneTree());
    }
    return result;
  }

  // ==========================================================================
  // Kind predicates

  /** Identifiers and member accesses may be assigned to; parentheses are transparent. */
  public final boolean isValidAssignmentTarget() {
    switch (token) {
      case NAME:
      case GETPROP:
      case GETELEM:
        return true;
      case PAREN:
        return first.isValidAssignmentTarget();
      default:
        return false;
    }
  }

  public final boolean isAbsent() {
    return token == Token.ABSENT;
  }

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public final boolean isStatementList() {
    return token == Token.STATEMENT_LIST;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isString() {
    return token == Token.STRING;
  }

  public final boolean isNumber() {
    return token == Token.NUMBER;
  }

  public final boolean isParen() {
    return token == Token.PAREN;
  }

  public final boolean isIf() {
    return token == Token.IF;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isVar() {
    return token == Token.VAR;
  }

  public final boolean isCase() {
    return token == Token.CASE;
  }

  public final boolean isDefaultCase() {
    return token == Token.DEFAULT_CASE;
  }

  public final boolean isGetElem() {
    return token == Token.GETELEM;
  }

  public final boolean isObjectProperty() {
    return token == Token.OBJECT_PROPERTY;
  }

  public final boolean isPostfix() {
    return (token == Token.INC || token == Token.DEC) && getBooleanProp(Prop.INCRDECR);
  }

  // ==========================================================================
  // Debugging

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    switch (token) {
      case NUMBER:
        sb.append(' ').append(getDouble());
        break;
      case NAME:
      case STRING:
        sb.append(' ').append(getString());
        break;
      case REGEXP:
        sb.append(" /").append(getString()).append('/').append(getRegExpFlags());
        break;
      default:
        break;
    }
    for (Prop prop : Prop.values()) {
      if (getBooleanProp(prop)) {
        sb.append(" [").append(prop.name().toLowerCase()).append(']');
      }
    }
    if (lineno > 0) {
      sb.append(' ').append(lineno);
    }
    return sb.toString();
  }

  /** Returns an indented dump of the subtree, one node per line. */
  @CheckReturnValue
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    toStringTreeHelper(this, 0, sb);
    return sb.toString();
  }

  private static void toStringTreeHelper(Node n, int level, StringBuilder sb) {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n);
    sb.append('\n');
    for (Node cursor = n.first; cursor != null; cursor = cursor.next) {
      toStringTreeHelper(cursor, level + 1, sb);
    }
  }
}
