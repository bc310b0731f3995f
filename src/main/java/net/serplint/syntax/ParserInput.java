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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/** The contents of a Serpent source file, and the name under which diagnostics report it. */
public final class ParserInput {

  private final char[] content;
  private final String file;

  private ParserInput(char[] content, String file) {
    this.content = content;
    this.file = Preconditions.checkNotNull(file);
  }

  /** Returns the content of the input. The caller must not modify the result. */
  char[] getContent() {
    return content;
  }

  /** Returns the content of the input as a string. */
  public String getText() {
    return new String(content);
  }

  /** Returns the name of the input file, as it appears in diagnostics. */
  public String getFile() {
    return file;
  }

  /** Returns an input for the specified text and file name. */
  public static ParserInput fromString(String content, String file) {
    return new ParserInput(content.toCharArray(), file);
  }

  /** Returns an unnamed input whose content is the given lines joined by newlines. */
  public static ParserInput fromLines(String... lines) {
    return fromString(Joiner.on("\n").join(lines), "");
  }

  /** Reads the named file, decoding it as UTF-8. */
  public static ParserInput readFile(String filename) throws IOException {
    Path path = Paths.get(filename);
    return fromString(new String(Files.readAllBytes(path), UTF_8), filename);
  }
}
