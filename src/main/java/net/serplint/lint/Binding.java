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

import com.google.common.base.Preconditions;
import java.util.Locale;
import net.serplint.syntax.Position;

/** A Binding is a name bound in the scope of one function. */
final class Binding {

  /** How a name came to be bound. */
  enum Kind {
    ARGUMENT,
    ASSIGNMENT,
    DATA_ASSIGNMENT;

    @Override
    public String toString() {
      return super.toString().toLowerCase(Locale.ROOT);
    }
  }

  private final String name;
  private final Kind kind;
  private final Position declaredAt;
  private boolean referenced;

  Binding(String name, Kind kind, Position declaredAt) {
    this.name = Preconditions.checkNotNull(name);
    this.kind = Preconditions.checkNotNull(kind);
    this.declaredAt = Preconditions.checkNotNull(declaredAt);
  }

  String name() {
    return name;
  }

  Kind kind() {
    return kind;
  }

  Position declaredAt() {
    return declaredAt;
  }

  boolean isReferenced() {
    return referenced;
  }

  void markReferenced() {
    referenced = true;
  }

  @Override
  public String toString() {
    return String.format("%s %s at %s%s", kind, name, declaredAt, referenced ? " (used)" : "");
  }
}
