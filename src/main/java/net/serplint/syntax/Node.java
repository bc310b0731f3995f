// Copyright 2026 The Serplint Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.serplint.syntax;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A node of a Serpent syntax tree.
 *
 * <p>Serpent trees are untyped: every node carries a kind, which is an operator symbol ({@code +},
 * {@code =}, {@code .}), a keyword ({@code def}, {@code if}, {@code seq}), or the name of the
 * function being called ({@code send}, {@code log}). Leaves have kind {@link #TOKEN} and carry the
 * source text of an identifier, number or string literal as their value. Nodes are immutable.
 */
public final class Node {

  /** The kind of every leaf. */
  public static final String TOKEN = "token";

  private final String kind;
  private final ImmutableList<Node> children;
  @Nullable private final String value;
  private final Position position;

  private Node(
      String kind, ImmutableList<Node> children, @Nullable String value, Position position) {
    this.kind = Preconditions.checkNotNull(kind);
    this.children = Preconditions.checkNotNull(children);
    this.value = value;
    this.position = Preconditions.checkNotNull(position);
  }

  /** Returns a leaf holding the source text of a token. */
  public static Node leaf(String value, Position position) {
    return new Node(TOKEN, ImmutableList.of(), Preconditions.checkNotNull(value), position);
  }

  /** Returns an interior node of the given kind. */
  public static Node of(String kind, Position position, Iterable<Node> children) {
    Preconditions.checkArgument(!kind.equals(TOKEN), "interior node may not have kind %s", TOKEN);
    return new Node(kind, ImmutableList.copyOf(children), null, position);
  }

  public static Node of(String kind, Position position, Node... children) {
    return of(kind, position, ImmutableList.copyOf(children));
  }

  public String kind() {
    return kind;
  }

  public ImmutableList<Node> children() {
    return children;
  }

  /** Returns the number of children. */
  public int size() {
    return children.size();
  }

  public Node child(int i) {
    return children.get(i);
  }

  /** Returns the children from index {@code from} onwards. */
  public ImmutableList<Node> childrenFrom(int from) {
    return from >= children.size() ? ImmutableList.of() : children.subList(from, children.size());
  }

  /** Returns the source text of a leaf, or null for an interior node. */
  @Nullable
  public String value() {
    return value;
  }

  public Position position() {
    return position;
  }

  public boolean isLeaf() {
    return value != null;
  }

  /**
   * Returns the value of a leaf, or the kind of an interior node. This is the "name" of a node in
   * the sense used by declarations: the label of {@code (foo a b)} is {@code foo}.
   */
  public String label() {
    return value != null ? value : kind;
  }

  @Override
  public boolean equals(Object that) {
    if (this == that) {
      return true;
    }
    if (!(that instanceof Node)) {
      return false;
    }
    Node other = (Node) that;
    return kind.equals(other.kind)
        && Objects.equals(value, other.value)
        && position.equals(other.position)
        && children.equals(other.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value, position, children);
  }

  /** Returns the tree in s-expression form, e.g. {@code (= x (+ y 1))}. Positions are omitted. */
  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    print(buf);
    return buf.toString();
  }

  private void print(StringBuilder buf) {
    if (isLeaf()) {
      buf.append(value);
      return;
    }
    buf.append('(').append(kind);
    for (Node child : children) {
      buf.append(' ');
      child.print(buf);
    }
    buf.append(')');
  }
}
