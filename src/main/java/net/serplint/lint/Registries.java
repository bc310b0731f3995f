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

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Registries holds the names declared by a contract (data fields, events, macros and methods)
 * together with the names every contract may use without declaring them.
 */
final class Registries {

  static final ImmutableSet<String> BUILTINS =
      ImmutableSet.of(
          "calldatacopy", "calldataload", "div", "log", "return", "send", "string", "~invalid");

  static final ImmutableSet<String> GLOBALS =
      ImmutableSet.of(
          "block.coinbase",
          "block.difficulty",
          "block.gaslimit",
          "block.number",
          "block.prevhash",
          "block.timestamp",
          "msg.gas",
          "msg.sender",
          "msg.value",
          "self",
          "self.balance",
          "self.storage",
          "tx.gasprice");

  static final ImmutableSet<String> KEYWORDS = ImmutableSet.of("data", "event");

  static final ImmutableSet<String> BUILTIN_KEYWORD_ARGUMENTS =
      ImmutableSet.of("items", "outitems");

  private final Set<String> data = new LinkedHashSet<>();
  private final Set<String> events = new LinkedHashSet<>();
  private final Set<String> macros = new LinkedHashSet<>();
  private final Set<String> methods = new LinkedHashSet<>();

  void addData(String name) {
    data.add(name);
  }

  void addEvent(String name) {
    events.add(name);
  }

  void addMacro(String name) {
    macros.add(name);
  }

  void addMethod(String name) {
    methods.add(name);
  }

  boolean isData(String name) {
    return data.contains(name);
  }

  /** Reports whether a node kind names a user macro or method, making it a call. */
  boolean isCallable(String name) {
    return macros.contains(name) || methods.contains(name);
  }

  /** Reports whether the name was declared by any registry. */
  boolean isDeclared(String name) {
    return data.contains(name)
        || events.contains(name)
        || macros.contains(name)
        || methods.contains(name);
  }

  ImmutableSet<String> data() {
    return ImmutableSet.copyOf(data);
  }

  ImmutableSet<String> events() {
    return ImmutableSet.copyOf(events);
  }

  ImmutableSet<String> macros() {
    return ImmutableSet.copyOf(macros);
  }

  ImmutableSet<String> methods() {
    return ImmutableSet.copyOf(methods);
  }
}
