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

import com.google.common.flogger.GoogleLogger;

/**
 * The built-in Serpent front end: {@link Parser} for parsing, and parsing followed by the {@link
 * CompileChecker} for compilation.
 */
public final class SerpentCompiler implements SerpentFrontend {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  public static final SerpentCompiler INSTANCE = new SerpentCompiler();

  private SerpentCompiler() {}

  @Override
  public void compile(ParserInput input) throws FrontendException {
    Node root = parse(input);
    CompileChecker checker =
        new CompileChecker(FileLocations.create(input.getContent(), input.getFile()));
    checker.check(root);
    if (!checker.errors().isEmpty()) {
      logger.atFine().log(
          "%s: %d compile errors", input.getFile(), checker.errors().size());
      throw FrontendException.of(checker.errors().get(0));
    }
  }

  @Override
  public Node parse(ParserInput input) throws FrontendException {
    Parser.ParseResult result = Parser.parseFile(input);
    if (!result.ok()) {
      logger.atFine().log("%s: %d syntax errors", input.getFile(), result.errors.size());
      throw FrontendException.of(result.errors.get(0));
    }
    return result.root;
  }
}
