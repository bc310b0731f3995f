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

import com.google.auto.value.AutoValue;

/**
 * A Diagnostic is one finding of the linter. Line and character are 1-based and absolute.
 * Diagnostics are values: two diagnostics are equal when they would print identically.
 */
@AutoValue
public abstract class Diagnostic {

  public static Diagnostic create(
      String file, int line, int character, DiagnosticCode code, String message) {
    return new AutoValue_Diagnostic(file, line, character, code, message);
  }

  public abstract String file();

  public abstract int line();

  public abstract int character();

  public abstract DiagnosticCode code();

  public abstract String message();

  public DiagnosticCode.Severity severity() {
    return code().severity();
  }

  /** Returns the diagnostic in the form {@code file:line:char code message}. */
  @Override
  public final String toString() {
    return String.format("%s:%d:%d %s %s", file(), line(), character(), code(), message());
  }
}
