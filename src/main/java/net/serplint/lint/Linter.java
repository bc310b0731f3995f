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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.serplint.syntax.FrontendException;
import net.serplint.syntax.Node;
import net.serplint.syntax.ParserInput;
import net.serplint.syntax.SerpentCompiler;
import net.serplint.syntax.SerpentFrontend;

/**
 * A Linter reports suspicious code in Serpent contracts: undefined variables, assignments to
 * arguments, invalid keyword arguments, unused arguments and unreferenced assignments.
 *
 * <p>A file is first compiled and parsed by a {@link SerpentFrontend}; a front-end failure is
 * reported as the only diagnostic of the run. The syntax tree is then walked once. Declarations
 * and bindings are recorded as they are met, while uses of names are queued and resolved after
 * the walk, so that a name may be used above its declaration. Finally, unused bindings are
 * reported.
 *
 * <p>Linters are immutable and may be used concurrently.
 */
public final class Linter {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final Pattern FRONTEND_ERROR =
      Pattern.compile(
          "line (?<line>\\d+), char (?<character>\\d+)\\): (?<message>.*)$",
          Pattern.CASE_INSENSITIVE);

  private final SerpentFrontend frontend;
  private final LintOptions options;

  private Linter(SerpentFrontend frontend, LintOptions options) {
    this.frontend = Preconditions.checkNotNull(frontend);
    this.options = Preconditions.checkNotNull(options);
  }

  /** Returns a linter using the built-in Serpent front end and default options. */
  public static Linter create() {
    return create(SerpentCompiler.INSTANCE, LintOptions.DEFAULT);
  }

  public static Linter create(SerpentFrontend frontend, LintOptions options) {
    return new Linter(frontend, options);
  }

  /**
   * Lints one file.
   *
   * @throws LintException if the front end fails with a message that has no position
   */
  public LintResult lint(ParserInput input) throws LintException {
    Analysis analysis = new Analysis(input.getFile(), input.getText());

    try {
      frontend.compile(input);
    } catch (FrontendException ex) {
      reportFrontendError(analysis, ex, DiagnosticCode.COMPILE_ERROR);
      return analysis.result();
    }

    Node root;
    try {
      root = frontend.parse(input);
    } catch (FrontendException ex) {
      reportFrontendError(analysis, ex, DiagnosticCode.PARSE_ERROR);
      return analysis.result();
    }

    traverse(analysis, root, ScopeTable.TOPLEVEL, 0);
    analysis.resolvePendingChecks();
    analysis.sweep();

    if (options.debug()) {
      dump(analysis);
    }
    return analysis.result();
  }

  private static void reportFrontendError(
      Analysis analysis, FrontendException ex, DiagnosticCode code) throws LintException {
    String message = Strings.nullToEmpty(ex.getMessage());
    Matcher m = FRONTEND_ERROR.matcher(message);
    if (!m.find()) {
      throw new LintException(message, ex);
    }
    int line;
    int character;
    try {
      line = Integer.parseInt(m.group("line"));
      character = Integer.parseInt(m.group("character"));
    } catch (NumberFormatException e) {
      throw new LintException(message, ex);
    }
    analysis.log().logUpstream(line, character, code, m.group("message"));
  }

  private void traverse(Analysis analysis, Node node, String function, int depth) {
    if (node.isLeaf()) {
      analysis.check(Token.of(node), function);
      return;
    }
    String kind = node.kind();
    if (options.debug()) {
      logger.atInfo().log(
          "%s%s %s", Strings.repeat("  ", depth), kind, labels(node.children()));
    }

    if (kind.equals("def") && node.size() > 0) {
      function = node.child(0).label();
    }

    NodeHandler handler = Handlers.TABLE.get(kind);
    if (handler == null) {
      if (!analysis.registries().isCallable(kind)) {
        if (ReferenceResolver.isOpcode(kind)) {
          logger.at(options.debug() ? Level.INFO : Level.FINE).log(
              "%d unknown opcode %s", node.position().line() + 1, kind);
        }
        return;
      }
      handler = Handlers::operands;
    }
    for (Node child : handler.handle(analysis, node, function)) {
      traverse(analysis, child, function, depth + 1);
    }
  }

  private static String labels(List<Node> nodes) {
    ImmutableList.Builder<String> labels = ImmutableList.builder();
    for (Node n : nodes) {
      labels.add(n.label());
    }
    return Joiner.on(' ').join(labels.build());
  }

  private static void dump(Analysis analysis) {
    Registries registries = analysis.registries();
    logger.atInfo().log("data: %s", registries.data());
    logger.atInfo().log("events: %s", registries.events());
    logger.atInfo().log("macros: %s", registries.macros());
    logger.atInfo().log("methods: %s", registries.methods());
    for (Map.Entry<String, ImmutableList<Binding>> scope :
        analysis.scopes().snapshot().entrySet()) {
      logger.atInfo().log("scope %s: %s", scope.getKey(), scope.getValue());
    }
  }
}
