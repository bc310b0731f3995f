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

package net.serplint.cmd;

import java.io.IOException;
import java.io.PrintStream;
import net.serplint.lint.Diagnostic;
import net.serplint.lint.LintException;
import net.serplint.lint.LintOptions;
import net.serplint.lint.LintResult;
import net.serplint.lint.Linter;
import net.serplint.syntax.ParserInput;
import net.serplint.syntax.SerpentCompiler;
import net.serplint.syntax.SerpentFrontend;

/** Main is the serplint command: it lints one Serpent file and prints its diagnostics. */
public final class Main {

  static final String VERSION = "1.2.0";

  private static final String USAGE =
      "usage: serplint [-v|--verbose] [-d|--debug] [-e|--exit-status] [--version] file";

  private Main() {}

  /**
   * Runs the command with the given arguments, printing diagnostics to {@code out} and failures
   * to {@code err}, and returns the process exit status.
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    return run(args, SerpentCompiler.INSTANCE, out, err);
  }

  static int run(String[] args, SerpentFrontend frontend, PrintStream out, PrintStream err) {
    boolean verbose = false;
    boolean debug = false;
    boolean exitStatus = false;
    String file = null;

    // parse flags
    int i;
    for (i = 0; i < args.length; i++) {
      if (!args[i].startsWith("-")) {
        break;
      }
      if (args[i].equals("--")) {
        i++;
        break;
      }
      switch (args[i]) {
        case "-v":
        case "--verbose":
          verbose = true;
          break;
        case "-d":
        case "--debug":
          debug = true;
          break;
        case "-e":
        case "--exit-status":
          exitStatus = true;
          break;
        case "--version":
          out.println("serplint, version " + VERSION);
          return 0;
        default:
          err.println("unknown flag: " + args[i]);
          err.println(USAGE);
          return 1;
      }
    }
    // positional arguments
    if (i < args.length) {
      if (i + 1 < args.length) {
        err.println("too many positional arguments");
        err.println(USAGE);
        return 1;
      }
      file = args[i];
    }
    if (file == null) {
      err.println(USAGE);
      return 1;
    }

    ParserInput input;
    try {
      input = ParserInput.readFile(file);
    } catch (IOException e) {
      err.format("Error reading %s: %s\n", file, e);
      return 1;
    }

    if (verbose) {
      out.println("Linting " + file);
      out.println();
    }

    LintOptions options = LintOptions.builder().debug(debug).build();
    LintResult result;
    try {
      result = Linter.create(frontend, options).lint(input);
    } catch (LintException e) {
      err.println("Exception: " + e.getMessage());
      return 1;
    }
    for (Diagnostic diagnostic : result.diagnostics()) {
      out.println(diagnostic);
    }
    return exitStatus ? result.exitCode() : 0;
  }

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }
}
