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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.serplint.syntax.Node;

/**
 * Analysis is the mutable state of one lint run: registries, scopes, pending reference checks and
 * the diagnostic log. It is created by {@link Linter#lint} and discarded afterwards.
 */
final class Analysis {

  private final DiagnosticLog log;
  private final Registries registries = new Registries();
  private final ScopeTable scopes = new ScopeTable();
  private final ReferenceResolver resolver = new ReferenceResolver(this);
  private final List<Token> pending = new ArrayList<>();

  Analysis(String file, String source) {
    this.log = new DiagnosticLog(file, source);
  }

  DiagnosticLog log() {
    return log;
  }

  Registries registries() {
    return registries;
  }

  ScopeTable scopes() {
    return scopes;
  }

  ReferenceResolver resolver() {
    return resolver;
  }

  /**
   * Records a use of a name. A name already bound in the function is marked referenced at once;
   * any other name is queued for resolution against the registries once the whole file has been
   * walked, when all methods and data fields are known. Names that cannot be variables are
   * ignored.
   */
  void check(Token token, String function) {
    if (!ReferenceResolver.isReference(token.name())) {
      return;
    }
    if (scopes.get(function, token.name()) != null) {
      markReferenced(token.name(), function);
      return;
    }
    pending.add(token);
  }

  /** Marks a name bound in the function as referenced. Unbound names are ignored. */
  void markReferenced(String name, String function) {
    Binding binding = scopes.get(function, name);
    if (binding != null) {
      binding.markReferenced();
    }
  }

  /** Checks every reference token reachable from the given nodes. */
  void checkReferences(Iterable<Node> nodes, String function) {
    for (Token token : resolver.gatherTokens(nodes, function)) {
      check(token, function);
    }
  }

  /**
   * Binds a name in a function's scope. Rebinding a function argument is reported at the target
   * node.
   */
  void bind(String function, Node target, String name, Binding.Kind kind) {
    Binding existing = scopes.get(function, name);
    if (existing != null && existing.kind() == Binding.Kind.ARGUMENT) {
      log.logf(
          target.position(),
          DiagnosticCode.ASSIGNED_TO_ARGUMENT,
          "Assigned a value to an argument \"%s\"",
          name);
    }
    scopes.bind(function, new Binding(name, kind, target.position()));
  }

  // Names that may be declared anywhere in the file. Function scopes are consulted when a name is
  // used, so a use above the binding of a local name is undefined.
  private boolean isDeclaredAnywhere(String name) {
    return registries.isDeclared(name)
        || Registries.BUILTINS.contains(name)
        || Registries.GLOBALS.contains(name);
  }

  /** Resolves the queued checks in order, reporting names that are not in scope. */
  void resolvePendingChecks() {
    for (Token token : pending) {
      if (!isDeclaredAnywhere(token.name())) {
        log.logf(
            token.position(),
            DiagnosticCode.UNDEFINED_VARIABLE,
            "Undefined variable \"%s\"",
            token.name());
      }
    }
    pending.clear();
  }

  /** Reports the arguments and assignments that were never referenced. */
  void sweep() {
    for (Map.Entry<String, ImmutableList<Binding>> scope : scopes.snapshot().entrySet()) {
      for (Binding binding : scope.getValue()) {
        if (binding.isReferenced()) {
          continue;
        }
        switch (binding.kind()) {
          case ARGUMENT:
            log.logf(
                binding.declaredAt(),
                DiagnosticCode.UNUSED_ARGUMENT,
                "Unused argument \"%s\"",
                binding.name());
            break;
          case ASSIGNMENT:
            if (!Registries.GLOBALS.contains(binding.name())) {
              log.logf(
                  binding.declaredAt(),
                  DiagnosticCode.UNREFERENCED_ASSIGNMENT,
                  "Unreferenced assignment \"%s\"",
                  binding.name());
            }
            break;
          case DATA_ASSIGNMENT:
            break;
        }
      }
    }
  }

  LintResult result() {
    return LintResult.create(log.diagnostics(), !log.failed());
  }
}
