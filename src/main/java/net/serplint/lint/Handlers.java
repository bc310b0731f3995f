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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.serplint.syntax.Node;
import net.serplint.syntax.Parser;

/** The handlers of the node kinds the linter understands, keyed by kind. */
final class Handlers {

  private Handlers() {}

  private static final ImmutableSet<String> OPERATORS =
      ImmutableSet.of(
          "+", "-", "*", "/", "%", "**", "^", "&", "|", "<<", ">>", "!", "not", "~", "<", ">", "<=",
          ">=", "==", "!=", "and", "or", "+=", "-=", "*=", "/=", "%=", "^=", "**=", "&=", "|=");

  // Calls whose operands are all plain references.
  private static final ImmutableSet<String> CALLS =
      ImmutableSet.of(
          Parser.FUN,
          "mcopy",
          "send",
          "calldatacopy",
          "calldataload",
          "div",
          "string",
          "~invalid",
          "return",
          "~return");

  static final ImmutableMap<String, NodeHandler> TABLE = buildTable();

  private static ImmutableMap<String, NodeHandler> buildTable() {
    ImmutableMap.Builder<String, NodeHandler> table = ImmutableMap.builder();
    for (String kind : OPERATORS) {
      table.put(kind, Handlers::operands);
    }
    for (String kind : CALLS) {
      table.put(kind, Handlers::operands);
    }
    for (String kind : ImmutableList.of("if", "elif", "while")) {
      table.put(kind, Handlers::conditional);
    }
    table.put("for", Handlers::forLoop);
    table.put("else", Handlers::children);
    table.put(Parser.SEQ, Handlers::children);
    table.put(":", Handlers::annotation);
    table.put("=", Handlers::assignment);
    table.put("def", Handlers::def);
    table.put("data", Handlers::data);
    table.put("event", Handlers::event);
    table.put("macro", Handlers::macro);
    table.put("log", Handlers::log);
    return table.buildOrThrow();
  }

  /** Checks every reference in the node itself. */
  static ImmutableList<Node> operands(Analysis analysis, Node node, String function) {
    analysis.checkReferences(ImmutableList.of(node), function);
    return ImmutableList.of();
  }

  private static ImmutableList<Node> children(Analysis analysis, Node node, String function) {
    return node.children();
  }

  private static ImmutableList<Node> conditional(Analysis analysis, Node node, String function) {
    if (node.size() == 0) {
      return ImmutableList.of();
    }
    analysis.checkReferences(ImmutableList.of(node.child(0)), function);
    return node.childrenFrom(1);
  }

  // (for var iterable body)
  private static ImmutableList<Node> forLoop(Analysis analysis, Node node, String function) {
    if (node.size() < 2) {
      return node.children();
    }
    Node var = node.child(0);
    if (var.isLeaf() && ReferenceResolver.isReference(var.value())) {
      analysis.bind(function, var, var.value(), Binding.Kind.ASSIGNMENT);
    }
    analysis.checkReferences(ImmutableList.of(node.child(1)), function);
    return node.childrenFrom(2);
  }

  private static ImmutableList<Node> annotation(Analysis analysis, Node node, String function) {
    if (node.size() > 0) {
      analysis.checkReferences(ImmutableList.of(node.child(0)), function);
    }
    return ImmutableList.of();
  }

  // (= target value)
  private static ImmutableList<Node> assignment(Analysis analysis, Node node, String function) {
    if (node.size() == 0) {
      return ImmutableList.of();
    }
    Node target = node.child(0);
    String name = analysis.resolver().resolveName(target, function);
    if (ReferenceResolver.isReference(name)) {
      Binding.Kind kind =
          analysis.registries().isData(name)
              ? Binding.Kind.DATA_ASSIGNMENT
              : Binding.Kind.ASSIGNMENT;
      analysis.bind(function, target, name, kind);
    }
    analysis.checkReferences(node.childrenFrom(1), function);
    return ImmutableList.of();
  }

  // (def (name params...) body), visited with the function already set to name.
  private static ImmutableList<Node> def(Analysis analysis, Node node, String function) {
    if (node.size() == 0) {
      return ImmutableList.of();
    }
    Node signature = node.child(0);
    analysis.registries().addMethod("self." + signature.label());
    for (Node param : signature.children()) {
      Node name = ReferenceResolver.parameterName(param);
      analysis.bind(
          function,
          name,
          analysis.resolver().resolveName(name, function),
          Binding.Kind.ARGUMENT);
    }
    ImmutableList<Node> body = node.childrenFrom(1);
    if (body.size() == 1 && TABLE.containsKey(body.get(0).kind())) {
      return body;
    }
    analysis.checkReferences(body, function);
    return ImmutableList.of();
  }

  private static ImmutableList<Node> data(Analysis analysis, Node node, String function) {
    for (Node declaration : node.children()) {
      declareData(analysis, declaration, function, "self");
    }
    return ImmutableList.of();
  }

  private static void declareData(Analysis analysis, Node decl, String function, String prefix) {
    ReferenceResolver resolver = analysis.resolver();
    if (!isStruct(decl)) {
      analysis.registries().addData(prefix + "." + resolver.resolveAccess(decl, function));
      return;
    }
    ImmutableList<Node> fields;
    String name;
    if (decl.kind().equals(Parser.FUN)) {
      name =
          decl.size() > 0
              ? resolver.resolveAccess(decl.child(0), function)
              : ReferenceResolver.UNKNOWN;
      fields = decl.childrenFrom(1);
    } else {
      name = decl.kind();
      fields = decl.children();
    }
    String struct = prefix + "." + name;
    analysis.registries().addData(struct);
    for (Node field : fields) {
      if (isStruct(field)) {
        declareData(analysis, field, function, struct);
      } else {
        analysis.registries().addData(struct + "." + resolver.resolveAccess(field, function));
      }
    }
  }

  // A struct is declared in call form: accounts[](balance, owner) or person(name, age).
  private static boolean isStruct(Node decl) {
    if (decl.isLeaf()) {
      return false;
    }
    String kind = decl.kind();
    return kind.equals(Parser.FUN)
        || (ReferenceResolver.isReference(kind) && !kind.equals(Parser.ACCESS));
  }

  private static ImmutableList<Node> event(Analysis analysis, Node node, String function) {
    if (node.size() > 0) {
      analysis.registries().addEvent(node.child(0).label());
    }
    return ImmutableList.of();
  }

  // (macro pattern body)
  private static ImmutableList<Node> macro(Analysis analysis, Node node, String function) {
    if (node.size() == 0) {
      return ImmutableList.of();
    }
    analysis.registries().addMacro(node.child(0).label());
    return node.childrenFrom(1);
  }

  // The first argument of log names the event.
  private static ImmutableList<Node> log(Analysis analysis, Node node, String function) {
    analysis.checkReferences(node.childrenFrom(1), function);
    return ImmutableList.of();
  }
}
