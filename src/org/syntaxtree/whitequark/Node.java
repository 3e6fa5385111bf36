/*
 * Copyright 2026 The Syntax Tree Translation Authors.
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
package org.syntaxtree.whitequark;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.syntaxtree.source.SourceRange;

/**
 * A node of the parser gem's AST. Children are other nodes, {@link RubySymbol}s, {@link String}s,
 * {@link BigInteger}s, {@link Double}s, {@link RubyRational}s, {@link RubyComplex}es, or null.
 *
 * <p>Nodes are immutable; {@link #updated} returns a modified copy. {@link #equals} is structural
 * and ignores locations, matching {@code AST::Node#==}. {@link #isEquivalentTo(Node, boolean)}
 * can compare locations as well.
 */
public final class Node {
  private final NodeType type;
  private final List<@Nullable Object> children;
  private final SourceMap location;

  public Node(NodeType type, List<?> children, SourceMap location) {
    this.type = checkNotNull(type);
    this.location = checkNotNull(location);
    List<@Nullable Object> copy = new ArrayList<>(children);
    for (Object child : copy) {
      checkArgument(
          child == null
              || child instanceof Node
              || child instanceof RubySymbol
              || child instanceof String
              || child instanceof BigInteger
              || child instanceof Double
              || child instanceof RubyRational
              || child instanceof RubyComplex,
          "unexpected child %s of %s",
          child,
          type);
    }
    this.children = Collections.unmodifiableList(copy);
  }

  public static Node of(NodeType type, SourceMap location, @Nullable Object... children) {
    return new Node(type, Arrays.asList(children), location);
  }

  public NodeType getType() {
    return type;
  }

  public List<@Nullable Object> getChildren() {
    return children;
  }

  public @Nullable Object getChild(int index) {
    return children.get(index);
  }

  public int getChildCount() {
    return children.size();
  }

  /** Returns the child at {@code index}, which must be a node. */
  public Node getNode(int index) {
    Object child = children.get(index);
    checkArgument(child instanceof Node, "child %s of %s is not a node: %s", index, type, child);
    return (Node) child;
  }

  /** The children that are nodes, in order. */
  public ImmutableList<Node> getNodeChildren() {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (Object child : children) {
      if (child instanceof Node) {
        builder.add((Node) child);
      }
    }
    return builder.build();
  }

  public SourceMap getLocation() {
    return location;
  }

  public @Nullable SourceRange getExpression() {
    return location.getExpression();
  }

  public boolean isType(NodeType other) {
    return type == other;
  }

  /** Returns a copy with the given fields replaced; null arguments keep the current value. */
  public Node updated(
      @Nullable NodeType newType, @Nullable List<?> newChildren, @Nullable SourceMap newLocation) {
    return new Node(
        newType != null ? newType : type,
        newChildren != null ? newChildren : children,
        newLocation != null ? newLocation : location);
  }

  /** Returns a copy with {@code child} appended. */
  public Node append(@Nullable Object child) {
    List<@Nullable Object> newChildren = new ArrayList<>(children);
    newChildren.add(child);
    return new Node(type, newChildren, location);
  }

  /**
   * Whether the two trees have the same shape and values, and, when {@code compareLocations} is
   * set, the same source maps at every node.
   */
  public boolean isEquivalentTo(Node other, boolean compareLocations) {
    if (type != other.type || children.size() != other.children.size()) {
      return false;
    }
    if (compareLocations && !location.equals(other.location)) {
      return false;
    }
    for (int i = 0; i < children.size(); i++) {
      Object mine = children.get(i);
      Object theirs = other.children.get(i);
      if (mine instanceof Node && theirs instanceof Node) {
        if (!((Node) mine).isEquivalentTo((Node) theirs, compareLocations)) {
          return false;
        }
      } else if (!Objects.equals(mine, theirs)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o instanceof Node && isEquivalentTo((Node) o, false);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, children);
  }

  /** Prints the tree in the parser gem's s-expression format. */
  public String toSexp() {
    StringBuilder sb = new StringBuilder();
    appendSexp(sb, 0);
    return sb.toString();
  }

  private void appendSexp(StringBuilder sb, int indent) {
    sb.append(Strings.repeat("  ", indent)).append('(').append(type.getName());
    for (Object child : children) {
      if (child instanceof Node) {
        sb.append('\n');
        ((Node) child).appendSexp(sb, indent + 1);
      } else {
        sb.append(' ').append(inspect(child));
      }
    }
    sb.append(')');
  }

  @Override
  public String toString() {
    return toSexp();
  }

  /** Renders a non-node child the way Ruby's {@code inspect} would. */
  public static String inspect(@Nullable Object value) {
    if (value == null) {
      return "nil";
    } else if (value instanceof String) {
      return inspectString((String) value);
    } else if (value instanceof Double) {
      return inspectFloat((Double) value);
    }
    return value.toString();
  }

  static String inspectFloat(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    } else if (Double.isInfinite(value)) {
      return value > 0 ? "Infinity" : "-Infinity";
    }
    String text = Double.toString(value);
    int exponent = text.indexOf('E');
    if (exponent < 0) {
      return text;
    }
    String mantissa = text.substring(0, exponent);
    String power = text.substring(exponent + 1);
    return mantissa + "e" + (power.startsWith("-") ? power : "+" + power);
  }

  /** Quotes a string the way Ruby's {@code String#inspect} does for the common escapes. */
  public static String inspectString(String value) {
    StringBuilder sb = new StringBuilder("\"");
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\u000b':
          sb.append("\\v");
          break;
        case '\u0007':
          sb.append("\\a");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\u001b':
          sb.append("\\e");
          break;
        case '#':
          char next = i + 1 < value.length() ? value.charAt(i + 1) : 0;
          sb.append(next == '{' || next == '$' || next == '@' ? "\\#" : "#");
          break;
        default:
          if (c < 0x20 || c == 0x7f) {
            sb.append(String.format("\\x%02X", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.append('"').toString();
  }
}
