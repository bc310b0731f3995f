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
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the {@link SerpentCompiler} front end. */
@RunWith(JUnit4.class)
public class SerpentCompilerTest {

  private static final SerpentFrontend frontend = SerpentCompiler.INSTANCE;

  private static String compileError(String... lines) {
    FrontendException ex =
        assertThrows(
            FrontendException.class,
            () -> frontend.compile(ParserInput.fromString(String.join("\n", lines), "c.se")));
    return ex.getMessage();
  }

  @Test
  public void testValidContractCompiles() throws Exception {
    ParserInput input =
        ParserInput.fromString(
            String.join(
                "\n",
                "data balances[]",
                "def transfer(to, value):",
                "    if self.balances[msg.sender] >= value:",
                "        self.balances[msg.sender] -= value",
                "        self.balances[to] += value",
                "        return(1)",
                "    return(0)"),
            "c.se");
    frontend.compile(input);
    assertThat(frontend.parse(input).size()).isEqualTo(2);
  }

  @Test
  public void testNestedFunction() {
    assertThat(compileError("def f():", "    def g():", "        return(1)"))
        .isEqualTo(
            "Error (file \"c.se\", line 2, char 5): "
                + "Cannot define a function inside another function: g");
  }

  @Test
  public void testFunctionDefinedTwice() {
    assertThat(compileError("def f():", "    return(1)", "def f():", "    return(2)"))
        .isEqualTo("Error (file \"c.se\", line 3, char 1): Function defined twice: f");
  }

  @Test
  public void testBuiltinArity() {
    assertThat(compileError("def f():", "    x = div(1)", "    return(x)"))
        .isEqualTo(
            "Error (file \"c.se\", line 2, char 9): Invalid argument count or LLL function: div");
    assertThat(compileError("~invalid(1)"))
        .endsWith("Invalid argument count or LLL function: ~invalid");
  }

  @Test
  public void testSyntaxErrorFailsCompileAndParse() {
    ParserInput input = ParserInput.fromString("x = 1 +", "c.se");
    FrontendException compile =
        assertThrows(FrontendException.class, () -> frontend.compile(input));
    FrontendException parse = assertThrows(FrontendException.class, () -> frontend.parse(input));
    assertThat(compile.getMessage()).isEqualTo(parse.getMessage());
    assertThat(parse.getMessage())
        .isEqualTo(
            "Error (file \"c.se\", line 1, char 8): "
                + "syntax error at 'newline': expected expression");
  }
}
