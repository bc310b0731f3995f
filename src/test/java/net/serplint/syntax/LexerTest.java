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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of tokenization behavior of the {@link Lexer}. */
@RunWith(JUnit4.class)
public class LexerTest {

  private final List<SyntaxError> errors = new ArrayList<>();

  private Lexer createLexer(String input) {
    errors.clear();
    return new Lexer(ParserInput.fromString(input, "test.se"), errors);
  }

  // Lexes the input and returns its tokens, each printed as its source text or its kind.
  private String names(String input) {
    Lexer lexer = createLexer(input);
    List<String> result = new ArrayList<>();
    do {
      lexer.nextToken();
      result.add(lexer.raw != null ? lexer.raw : lexer.kind.toString());
    } while (lexer.kind != TokenKind.EOF);
    return Joiner.on(' ').join(result);
  }

  @Test
  public void testBasics() {
    assertThat(names("x = 1 + 2")).isEqualTo("x = 1 + 2 newline EOF");
    assertThat(names("a **= b")).isEqualTo("a **= b newline EOF");
    assertThat(names("a << 2 >> 3 != 4")).isEqualTo("a << 2 >> 3 != 4 newline EOF");
    assertThat(names("a ^ b ** c")).isEqualTo("a ^ b ** c newline EOF");
    assertThat(errors).isEmpty();
  }

  @Test
  public void testLiterals() {
    assertThat(names("0x1F 42")).isEqualTo("0x1F 42 newline EOF");
    assertThat(names("\"hi\" 'there'")).isEqualTo("\"hi\" 'there' newline EOF");
    assertThat(errors).isEmpty();
  }

  @Test
  public void testMacroVariablesAndOpcodes() {
    assertThat(names("$x ~invalid()")).isEqualTo("$x ~invalid ( ) newline EOF");
    assertThat(names("~ x")).isEqualTo("~ x newline EOF");
  }

  @Test
  public void testKeywords() {
    assertThat(names("data event def macro"))
        .isEqualTo("data event def macro newline EOF");
    Lexer lexer = createLexer("while");
    lexer.nextToken();
    assertThat(lexer.kind).isEqualTo(TokenKind.WHILE);
    assertThat(lexer.isKeyword()).isTrue();
  }

  @Test
  public void testComments() {
    assertThat(names("x # note\ny")).isEqualTo("x newline y newline EOF");
    assertThat(names("# only a comment\nx")).isEqualTo("x newline EOF");
  }

  @Test
  public void testIndentation() {
    assertThat(names("if x:\n    y\nz"))
        .isEqualTo("if x : newline indent y newline outdent z newline EOF");
  }

  @Test
  public void testNewlinesInsideParensAreIgnored() {
    assertThat(names("f(a,\n  b)")).isEqualTo("f ( a , b ) newline EOF");
  }

  @Test
  public void testErrors() {
    names("x = 1$");
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).message()).isEqualTo("invalid character: '$'");
    assertThat(errors.get(0).line()).isEqualTo(1);
    assertThat(errors.get(0).column()).isEqualTo(6);

    names("s = \"open");
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).message()).isEqualTo("unclosed string literal");
  }
}
