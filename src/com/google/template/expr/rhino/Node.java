/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.template.expr.rhino;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the expression intermediate representation.
 *
 * <p>Children are kept in a singly linked sibling list. Source positions are character offsets
 * into the string that was handed to the {@link Parser}; mapping them back to the enclosing
 * template is the caller's business.
 */
public class Node {

  enum Prop {
    // Is this Node within parentheses
    IS_PARENTHESIZED,
    // Set if the node is an arrow function.
    ARROW_FN,
    // Set on a STRING_KEY written as `{ foo }`.
    SHORTHAND_PROPERTY,
    // Set to indicate a quoted object lit key
    QUOTED,
    // Whether incrdecr is pre (false) or post (true)
    INCRDECR,
    // A `new` expression written without an argument list.
    NO_ARGUMENTS,
  }

  private Token token;

  private @Nullable String string;

  private double number;

  private final EnumSet<Prop> props = EnumSet.noneOf(Prop.class);

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node last;
  private @Nullable Node next;

  private int sourceOffset = -1;
  private int length = -1;

  public Node(Token token) {
    this.token = checkNotNull(token);
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

  public static Node newString(Token token, String str) {
    Node n = new Node(token);
    n.string = checkNotNull(str);
    return n;
  }

  public static Node newString(String str) {
    return newString(Token.STRINGLIT, str);
  }

  public static Node newNumber(double number) {
    Node n = new Node(Token.NUMBER);
    n.number = number;
    return n;
  }

  public final Token getToken() {
    return token;
  }

  public final void setToken(Token token) {
    this.token = checkNotNull(token);
  }

  // ---------------------------------------------------------------------------------------------
  // Children

  public final boolean hasChildren() {
    return first != null;
  }

  public final boolean hasOneChild() {
    return first != null && first == last;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return last;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild(), this);
    return first;
  }

  public final int getChildCount() {
    int count = 0;
    for (Node c = first; c != null; c = c.next) {
      count++;
    }
    return count;
  }

  public final Node getChildAtIndex(int i) {
    checkArgument(i >= 0, i);
    Node n = first;
    while (i > 0) {
      n = checkNotNull(n, "index out of range").next;
      i--;
    }
    return checkNotNull(n, "index out of range");
  }

  public final void addChildToBack(Node child) {
    checkArgument(child.parent == null, "new child has existing parent");
    checkArgument(child.next == null, "new child has existing sibling");
    child.parent = this;
    if (last == null) {
      first = child;
    } else {
      last.next = child;
    }
    last = child;
  }

  /** Iterates over the direct children in source order. */
  public final Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node current = first;

          @Override
          public boolean hasNext() {
            return current != null;
          }

          @Override
          public Node next() {
            if (current == null) {
              throw new NoSuchElementException();
            }
            Node result = current;
            current = current.next;
            return result;
          }
        };
  }

  // ---------------------------------------------------------------------------------------------
  // Values

  /** Returns the string of a NAME, PROPERTY_NAME, STRING_KEY, STRINGLIT or similar node. */
  public final String getString() {
    checkState(string != null, "%s has no string", token);
    return string;
  }

  public final double getDouble() {
    checkState(token == Token.NUMBER, "%s is not a number", token);
    return number;
  }

  // ---------------------------------------------------------------------------------------------
  // Properties

  public final boolean getIsParenthesized() {
    return props.contains(Prop.IS_PARENTHESIZED);
  }

  public final void setIsParenthesized(boolean b) {
    putBooleanProp(Prop.IS_PARENTHESIZED, b);
  }

  public final boolean isArrowFunction() {
    return props.contains(Prop.ARROW_FN);
  }

  public final void setIsArrowFunction(boolean b) {
    putBooleanProp(Prop.ARROW_FN, b);
  }

  public final boolean isShorthandProperty() {
    return props.contains(Prop.SHORTHAND_PROPERTY);
  }

  public final void setShorthandProperty(boolean b) {
    putBooleanProp(Prop.SHORTHAND_PROPERTY, b);
  }

  public final boolean isQuotedString() {
    return props.contains(Prop.QUOTED);
  }

  public final void setQuotedString() {
    putBooleanProp(Prop.QUOTED, true);
  }

  public final boolean isPostfix() {
    return props.contains(Prop.INCRDECR);
  }

  public final void setIsPostfix(boolean b) {
    putBooleanProp(Prop.INCRDECR, b);
  }

  public final boolean hasNoArguments() {
    return props.contains(Prop.NO_ARGUMENTS);
  }

  public final void setHasNoArguments(boolean b) {
    putBooleanProp(Prop.NO_ARGUMENTS, b);
  }

  private void putBooleanProp(Prop prop, boolean value) {
    if (value) {
      props.add(prop);
    } else {
      props.remove(prop);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Source position

  /** Returns the offset of the first character of this node, or -1 if unknown. */
  public final int getSourceOffset() {
    return sourceOffset;
  }

  /** Returns the offset just past the last character of this node. */
  public final int getSourceEnd() {
    return sourceOffset + length;
  }

  @CanIgnoreReturnValue
  public final Node setSourceRange(int start, int end) {
    checkArgument(start >= 0 && end >= start, "bad range [%s, %s)", start, end);
    this.sourceOffset = start;
    this.length = end - start;
    return this;
  }

  @CanIgnoreReturnValue
  public final Node srcref(Node other) {
    this.sourceOffset = other.sourceOffset;
    this.length = other.length;
    return this;
  }

  // ---------------------------------------------------------------------------------------------
  // Predicates

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public final boolean isStringKey() {
    return token == Token.STRING_KEY;
  }

  public final boolean isComputedProp() {
    return token == Token.COMPUTED_PROP;
  }

  public final boolean isObjectLit() {
    return token == Token.OBJECTLIT;
  }

  public final boolean isArrayLit() {
    return token == Token.ARRAYLIT;
  }

  public final boolean isObjectPattern() {
    return token == Token.OBJECT_PATTERN;
  }

  public final boolean isArrayPattern() {
    return token == Token.ARRAY_PATTERN;
  }

  public final boolean isDestructuringPattern() {
    return isObjectPattern() || isArrayPattern();
  }

  public final boolean isDefaultValue() {
    return token == Token.DEFAULT_VALUE;
  }

  public final boolean isRoot() {
    return token == Token.ROOT;
  }

  // ---------------------------------------------------------------------------------------------
  // Debugging

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (string != null) {
      sb.append(' ').append(string);
    } else if (token == Token.NUMBER) {
      sb.append(' ').append(number);
    }
    if (sourceOffset >= 0) {
      sb.append(" [").append(sourceOffset).append(", ").append(getSourceEnd()).append(')');
    }
    for (Prop p : props) {
      sb.append(" [").append(p.name().toLowerCase()).append(']');
    }
    return sb.toString();
  }

  /** Prints the whole subtree, one node per line, indented by depth. */
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    sb.append(this).append('\n');
    for (Node c = first; c != null; c = c.next) {
      c.appendStringTree(sb, level + 1);
    }
  }
}
