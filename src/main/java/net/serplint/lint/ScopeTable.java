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
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * ScopeTable maps each function name to the bindings of that function, in binding order.
 * Scopes are created on their first binding and remembered in creation order.
 */
final class ScopeTable {

  /** The scope key of statements outside any function. */
  static final String TOPLEVEL = "";

  private final Map<String, Map<String, Binding>> scopes = new LinkedHashMap<>();

  @Nullable
  Binding get(String function, String name) {
    Map<String, Binding> scope = scopes.get(function);
    return scope == null ? null : scope.get(name);
  }

  /** Binds a name in a function's scope, replacing any earlier binding of that name. */
  void bind(String function, Binding binding) {
    scopes.computeIfAbsent(function, f -> new LinkedHashMap<>()).put(binding.name(), binding);
  }

  /** Returns the bindings of every scope, scopes and bindings in creation order. */
  ImmutableMap<String, ImmutableList<Binding>> snapshot() {
    ImmutableMap.Builder<String, ImmutableList<Binding>> result = ImmutableMap.builder();
    for (Map.Entry<String, Map<String, Binding>> e : scopes.entrySet()) {
      result.put(e.getKey(), ImmutableList.copyOf(e.getValue().values()));
    }
    return result.buildOrThrow();
  }
}
