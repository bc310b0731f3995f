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

/**
 * A FrontendException reports that a Serpent front end could not compile or parse its input. By
 * convention its message has the form {@code Error (file "f", line L, char C): message}, with a
 * 1-based line and character.
 */
public final class FrontendException extends Exception {

  public FrontendException(String message) {
    super(message);
  }

  /** Returns a message in the conventional form for an error of the given file and position. */
  static String format(String file, int line, int character, String message) {
    return String.format(
        "Error (file \"%s\", line %d, char %d): %s", file, line, character, message);
  }

  static FrontendException of(SyntaxError error) {
    return new FrontendException(
        format(error.file(), error.line(), error.column(), error.message()));
  }
}
