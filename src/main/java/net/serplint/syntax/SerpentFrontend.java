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
 * The front end that turns Serpent source into a syntax tree. The linter treats both operations
 * as fallible pre-steps: a compile failure and a parse failure are each reported as a single
 * diagnostic, positioned by the {@code line L, char C)} fragment of the exception message.
 */
public interface SerpentFrontend {

  /** Compiles the input, discarding the result, and fails if the compiler rejects it. */
  void compile(ParserInput input) throws FrontendException;

  /** Parses the input into a tree rooted at a {@code seq} node. */
  Node parse(ParserInput input) throws FrontendException;
}
