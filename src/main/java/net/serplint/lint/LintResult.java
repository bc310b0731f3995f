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
import com.google.common.collect.ImmutableList;

/** The outcome of linting one file. */
@AutoValue
public abstract class LintResult {

  static LintResult create(ImmutableList<Diagnostic> diagnostics, boolean ok) {
    return new AutoValue_LintResult(diagnostics, ok);
  }

  /** Returns the diagnostics in the order they were reported. */
  public abstract ImmutableList<Diagnostic> diagnostics();

  /** Reports whether no error-class diagnostic was reported. Warnings do not fail a run. */
  public abstract boolean ok();

  /** Returns the process exit status of the run: 0 if ok, 1 otherwise. */
  public int exitCode() {
    return ok() ? 0 : 1;
  }
}
