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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Range;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The checks the Serpent compiler applies to a well-formed tree before generating code: function
 * definitions are top-level and unique, and built-in operations are called with the number of
 * arguments they take.
 */
final class CompileChecker {

  // Argument counts accepted by fixed-arity built-in operations.
  private static final ImmutableMap<String, Range<Integer>> ARITY =
      ImmutableMap.<String, Range<Integer>>builder()
          .put("calldatacopy", Range.singleton(3))
          .put("calldataload", Range.singleton(1))
          .put("div", Range.singleton(2))
          .put("mcopy", Range.singleton(3))
          .put("send", Range.closed(2, 3))
          .put("string", Range.singleton(1))
          .put("~invalid", Range.singleton(0))
          .buildOrThrow();

  private final FileLocations locs;
  private final List<SyntaxError> errors = new ArrayList<>();
  private final Set<String> functions = new HashSet<>();

  CompileChecker(FileLocations locs) {
    this.locs = locs;
  }

  ImmutableList<SyntaxError> errors() {
    return ImmutableList.copyOf(errors);
  }

  void check(Node root) {
    visit(root, /* inFunction= */ false);
  }

  private void visit(Node node, boolean inFunction) {
    if (node.isLeaf()) {
      return;
    }
    String kind = node.kind();
    if (kind.equals(TokenKind.DEF.toString()) && node.size() > 0) {
      String name = node.child(0).label();
      if (inFunction) {
        errorf(node, "Cannot define a function inside another function: %s", name);
      } else if (!functions.add(name)) {
        errorf(node, "Function defined twice: %s", name);
      }
      inFunction = true;
    }
    Range<Integer> arity = ARITY.get(kind);
    if (arity != null && !arity.contains(node.size())) {
      errorf(node, "Invalid argument count or LLL function: %s", kind);
    }
    for (Node child : node.children()) {
      visit(child, inFunction);
    }
  }

  // Reports an error at a node, converting its position to a 1-based absolute line and column.
  @FormatMethod
  private void errorf(Node node, String format, Object... args) {
    Position pos = node.position();
    errors.add(
        new SyntaxError(
            locs.file(),
            pos.line() + 1,
            pos.character() + locs.indentation(pos.line()) + 1,
            String.format(format, args)));
  }
}
