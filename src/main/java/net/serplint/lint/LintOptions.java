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
 * LintOptions is the set of options of a {@link Linter}. The options do not change which
 * diagnostics are reported.
 */
@AutoValue
public abstract class LintOptions {

  /** The default options: no tracing. */
  public static final LintOptions DEFAULT = builder().build();

  /**
   * Trace the traversal of the syntax tree, and dump the registries and scopes after the run,
   * through the logger at INFO level.
   */
  public abstract boolean debug();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_LintOptions.Builder().debug(false);
  }

  /** Builder for {@link LintOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder debug(boolean value);

    public abstract LintOptions build();
  }
}
