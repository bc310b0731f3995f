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

package net.serplint.lint;

import java.util.Objects;
import net.serplint.syntax.Node;
import net.serplint.syntax.Position;

/**
 * A Token is a use of a canonical name at a position. Two tokens with the same name on the same
 * line are the same token.
 */
final class Token {

  private final String name;
  private final Position position;

  Token(String name, Position position) {
    this.name = name;
    this.position = position;
  }

  static Token of(Node leaf) {
    return new Token(leaf.label(), leaf.position());
  }

  String name() {
    return name;
  }

  Position position() {
    return position;
  }

  @Override
  public boolean equals(Object that) {
    if (this == that) {
      return true;
    }
    if (!(that instanceof Token)) {
      return false;
    }
    Token other = (Token) that;
    return name.equals(other.name) && position.line() == other.position.line();
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, position.line());
  }

  @Override
  public String toString() {
    return name + "@" + position;
  }
}
