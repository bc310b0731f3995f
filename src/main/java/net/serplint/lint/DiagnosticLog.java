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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.serplint.syntax.Position;

/**
 * DiagnosticLog accumulates the diagnostics of one run, in the order they are logged, dropping
 * any diagnostic whose printed form was already logged. It also records whether an error-class
 * diagnostic was logged.
 */
final class DiagnosticLog {

  private static final Splitter LINES = Splitter.onPattern("\r?\n");

  private final String file;
  private final List<String> lines;
  private final Set<String> printed = new HashSet<>();
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private boolean failed;

  DiagnosticLog(String file, String source) {
    this.file = file;
    this.lines = LINES.splitToList(source);
  }

  /** Logs a diagnostic at a syntax tree position. */
  @FormatMethod
  void logf(Position pos, DiagnosticCode code, String format, Object... args) {
    log(pos.line(), pos.character(), code, String.format(format, args));
  }

  /**
   * Logs a diagnostic at a 0-based line and an indentation-relative character, as reported by
   * the syntax tree. The position is converted to a 1-based line and an absolute 1-based
   * character by adding the leading whitespace of the source line.
   */
  void log(int line, int character, DiagnosticCode code, String message) {
    add(Diagnostic.create(file, line + 1, character + 1 + indentation(line), code, message));
  }

  /**
   * Logs a diagnostic reported by the front end. Its position is already 1-based and absolute,
   * and is used as is.
   */
  void logUpstream(int line, int character, DiagnosticCode code, String message) {
    add(Diagnostic.create(file, line, character, code, message));
  }

  private void add(Diagnostic diagnostic) {
    if (!printed.add(diagnostic.toString())) {
      return;
    }
    diagnostics.add(diagnostic);
    if (diagnostic.code().isError()) {
      failed = true;
    }
  }

  // Returns the length of the leading whitespace of a 0-based line, or 0 if there is no such line.
  private int indentation(int line) {
    if (line < 0 || line >= lines.size()) {
      return 0;
    }
    String text = lines.get(line);
    int first = CharMatcher.whitespace().negate().indexIn(text);
    return first < 0 ? text.length() : first;
  }

  /** Reports whether an error-class diagnostic has been logged. */
  boolean failed() {
    return failed;
  }

  ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }
}
