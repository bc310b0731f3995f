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

import java.util.Locale;

/**
 * The stable codes of linter diagnostics. The first letter of a code's mnemonic gives its
 * severity: {@code E} for errors, {@code W} for warnings.
 */
public enum DiagnosticCode {
  /** The front end failed to compile the file. */
  COMPILE_ERROR("E100"),
  /** The front end failed to parse the file. */
  PARSE_ERROR("E101"),
  UNDEFINED_VARIABLE("E200"),
  ASSIGNED_TO_ARGUMENT("E201"),
  INVALID_KEYWORD_ARGUMENT("E202"),
  UNUSED_ARGUMENT("W202"),
  UNREFERENCED_ASSIGNMENT("W203");

  /** Severity of a diagnostic. */
  public enum Severity {
    ERROR,
    WARNING;

    @Override
    public String toString() {
      return super.toString().toLowerCase(Locale.ROOT);
    }
  }

  private final String mnemonic;

  DiagnosticCode(String mnemonic) {
    this.mnemonic = mnemonic;
  }

  public Severity severity() {
    return mnemonic.charAt(0) == 'E' ? Severity.ERROR : Severity.WARNING;
  }

  public boolean isError() {
    return severity() == Severity.ERROR;
  }

  @Override
  public String toString() {
    return mnemonic;
  }
}
