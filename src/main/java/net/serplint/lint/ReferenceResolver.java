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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.Set;
import net.serplint.syntax.Node;
import net.serplint.syntax.Parser;

/**
 * ReferenceResolver turns syntax trees into canonical names and reference tokens.
 *
 * <p>Resolving an index expression or gathering the tokens of a call may report diagnostics, so
 * a resolver belongs to the {@link Analysis} of one run.
 */
final class ReferenceResolver {

  /** The name of a node that has no name. It is not an identifier, so it is never bound. */
  static final String UNKNOWN = "__unknown__";

  private final Analysis analysis;

  ReferenceResolver(Analysis analysis) {
    this.analysis = analysis;
  }

  /** Reports whether the text can name a variable: it starts with an ASCII letter. */
  static boolean isReference(String text) {
    if (text.isEmpty()) {
      return false;
    }
    char c = text.charAt(0);
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  /** Reports whether a node kind looks like an operation the linter has no handler for. */
  static boolean isOpcode(String kind) {
    if (!kind.isEmpty() && Character.isDigit(kind.charAt(0))) {
      return false;
    }
    return !Registries.GLOBALS.contains(kind)
        && !Registries.KEYWORDS.contains(kind)
        && !Registries.BUILTINS.contains(kind);
  }

  /** Returns the name bound by a function parameter, looking through a type annotation. */
  static Node parameterName(Node param) {
    if (!param.isLeaf() && param.kind().equals(":") && param.size() > 0) {
      return parameterName(param.child(0));
    }
    return param;
  }

  String resolveName(Node node, String function) {
    return node.isLeaf() ? node.value() : resolveAccess(node, function);
  }

  /**
   * Returns the canonical name of an assignment target or declaration. The references in any
   * index expression are checked on the way.
   */
  String resolveAccess(Node node, String function) {
    if (node.isLeaf()) {
      return node.value();
    }
    switch (node.kind()) {
      case Parser.ACCESS:
        for (Token token : gatherTokens(node.childrenFrom(1), function)) {
          analysis.check(token, function);
        }
        return node.size() > 0 ? resolveAccess(node.child(0), function) : UNKNOWN;
      case ".":
        return dottedName(node, function);
      default:
        return node.size() > 0 ? node.child(0).label() : UNKNOWN;
    }
  }

  // Returns the innermost operand of a chain of selections and index operations.
  private static Node chainHead(Node node) {
    while (!node.isLeaf()
        && node.size() > 0
        && (node.kind().equals(".") || node.kind().equals(Parser.ACCESS))) {
      node = node.child(0);
    }
    return node;
  }

  private String dottedName(Node node, String function) {
    StringBuilder buf = new StringBuilder();
    for (Node part : node.children()) {
      if (buf.length() > 0) {
        buf.append('.');
      }
      buf.append(resolveName(part, function));
    }
    return buf.toString();
  }

  /**
   * Returns the distinct reference tokens of sibling nodes, in order of first occurrence. Keyword
   * arguments not accepted by builtins are reported.
   */
  ImmutableList<Token> gatherTokens(Iterable<Node> nodes, String function) {
    Set<Token> tokens = new LinkedHashSet<>();
    for (Node node : nodes) {
      collect(node, function, tokens);
    }
    return ImmutableList.copyOf(tokens);
  }

  private void collect(Node node, String function, Set<Token> tokens) {
    if (node.isLeaf()) {
      if (isReference(node.value())) {
        tokens.add(Token.of(node));
      }
      return;
    }
    switch (node.kind()) {
      case ".":
        String name = dottedName(node, function);
        if (isReference(name)) {
          tokens.add(new Token(name, node.position()));
        }
        // The head of a chain is a use of that name, but only a local one: a.b reads argument a,
        // while msg.sender names no variable msg.
        Node head = chainHead(node);
        if (head.isLeaf() && isReference(head.value())) {
          analysis.markReferenced(head.value(), function);
        }
        break;
      case ":":
        if (node.size() > 0) {
          collect(node.child(0), function, tokens);
        }
        break;
      case "=":
        if (node.size() > 0) {
          Node keyword = node.child(0);
          if (!Registries.BUILTIN_KEYWORD_ARGUMENTS.contains(keyword.label())) {
            analysis.log().logf(
                keyword.position(),
                DiagnosticCode.INVALID_KEYWORD_ARGUMENT,
                "Invalid keyword argument \"%s\"",
                keyword.label());
          }
        }
        for (Node value : node.childrenFrom(1)) {
          collect(value, function, tokens);
        }
        break;
      default:
        for (Node child : node.children()) {
          collect(child, function, tokens);
        }
    }
  }
}
