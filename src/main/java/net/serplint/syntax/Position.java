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

import com.google.auto.value.AutoValue;

/**
 * A Position is the place of a syntax node in its file, in the convention of the Serpent compiler:
 * the line is 0-based, and the character is a 0-based offset counted from the first non-blank
 * character of that line, so leading indentation is not included.
 *
 * <p>Clients that report positions to users must add the line's indentation back; see {@code
 * net.serplint.lint.DiagnosticLog}.
 */
@AutoValue
public abstract class Position {

  public static Position of(int line, int character) {
    return new AutoValue_Position(line, character);
  }

  /** The 0-based line number. */
  public abstract int line();

  /** The 0-based character offset, relative to the line's indentation. */
  public abstract int character();

  @Override
  public final String toString() {
    return line() + ":" + character();
  }
}
