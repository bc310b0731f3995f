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

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the syntax trees built by the {@link Parser}. */
@RunWith(JUnit4.class)
public class ParserTest {

  private static Node parse(String... lines) throws SyntaxError.Exception {
    return Parser.parse(ParserInput.fromLines(lines));
  }

  // Parses a single expression statement and returns it in s-expression form.
  private static String expr(String source) throws SyntaxError.Exception {
    Node root = parse(source);
    assertThat(root.size()).isEqualTo(1);
    return root.child(0).toString();
  }

  private static List<String> errors(String... lines) {
    Parser.ParseResult result = Parser.parseFile(ParserInput.fromLines(lines));
    List<String> messages = new ArrayList<>();
    for (SyntaxError error : result.errors) {
      messages.add(error.message());
    }
    return messages;
  }

  @Test
  public void testPrecedence() throws Exception {
    assertThat(expr("a + b * c")).isEqualTo("(+ a (* b c))");
    assertThat(expr("a - b - c")).isEqualTo("(- (- a b) c)");
    assertThat(expr("a or b and not c")).isEqualTo("(or a (and b (not c)))");
    assertThat(expr("a < b | c")).isEqualTo("(< a (| b c))");
    assertThat(expr("2 ^ 3 ^ 4")).isEqualTo("(^ 2 (^ 3 4))");
    assertThat(expr("-a ** 2")).isEqualTo("(- (** a 2))");
    assertThat(expr("(a + b) * c")).isEqualTo("(* (+ a b) c)");
  }

  @Test
  public void testSuffixes() throws Exception {
    assertThat(expr("self.balances[msg.sender]"))
        .isEqualTo("(access (. self balances) (. msg sender))");
    assertThat(expr("f(x, y)")).isEqualTo("(f x y)");
    assertThat(expr("self.foo(x)")).isEqualTo("(fun (. self foo) x)");
    assertThat(expr("send(to=a, 1)")).isEqualTo("(send (= to a) 1)");
    assertThat(expr("[1, 2, 3]")).isEqualTo("(array_lit 1 2 3)");
    assertThat(expr("self.event")).isEqualTo("(. self event)");
  }

  @Test
  public void testAssignments() throws Exception {
    assertThat(expr("x = y + 1")).isEqualTo("(= x (+ y 1))");
    assertThat(expr("x += 2")).isEqualTo("(+= x 2)");
    assertThat(expr("self.a[k] **= 2")).isEqualTo("(**= (access (. self a) k) 2)");
    assertThat(expr("x = y:arr")).isEqualTo("(= x (: y arr))");
  }

  @Test
  public void testDeclarations() throws Exception {
    assertThat(expr("data balances[]")).isEqualTo("(data (access balances))");
    assertThat(expr("data accounts[](balance, owner)"))
        .isEqualTo("(data (fun (access accounts) balance owner))");
    assertThat(expr("data person(name, age)")).isEqualTo("(data (person name age))");
    assertThat(expr("event Transfer(to:address, value)"))
        .isEqualTo("(event (Transfer (: to address) value))");
  }

  @Test
  public void testFunctionDefinition() throws Exception {
    Node def = parse("def f(a, b:arr):", "    return(a:arr)").child(0);
    assertThat(def.toString()).isEqualTo("(def (f a (: b arr)) (seq (return (: a arr))))");
  }

  @Test
  public void testMacroDefinition() throws Exception {
    assertThat(expr("macro double($x):\n    $x * 2"))
        .isEqualTo("(macro (double $x) (seq (* $x 2)))");
  }

  @Test
  public void testControlFlow() throws Exception {
    assertThat(
            parse(
                    "if a:", //
                    "    x = 1",
                    "elif b:",
                    "    x = 2",
                    "else:",
                    "    pass")
                .child(0)
                .toString())
        .isEqualTo("(if a (seq (= x 1)) (elif b (seq (= x 2)) (else (seq (pass)))))");
    assertThat(expr("while i < 10: i += 1")).isEqualTo("(while (< i 10) (seq (+= i 1)))");
    assertThat(expr("for v in xs:\n    stop")).isEqualTo("(for v xs (seq (stop)))");
    assertThat(expr("return")).isEqualTo("(return)");
  }

  @Test
  public void testSemicolons() throws Exception {
    Node root = parse("x = 1; y = 2");
    assertThat(root.toString()).isEqualTo("(seq (= x 1) (= y 2))");
  }

  @Test
  public void testPositions() throws Exception {
    Node root =
        parse(
            "def f(a):", //
            "    if a:",
            "        x = a + 1");
    Node def = root.child(0);
    assertThat(def.position()).isEqualTo(Position.of(0, 0));
    Node param = def.child(0).child(0);
    assertThat(param.position()).isEqualTo(Position.of(0, 6));

    Node cond = def.child(1).child(0);
    assertThat(cond.kind()).isEqualTo("if");
    // Characters are measured from the first non-blank character of the line.
    assertThat(cond.position()).isEqualTo(Position.of(1, 0));
    assertThat(cond.child(0).position()).isEqualTo(Position.of(1, 3));

    Node assign = cond.child(1).child(0);
    assertThat(assign.position()).isEqualTo(Position.of(2, 0));
    Node rhs = assign.child(1);
    assertThat(rhs.child(0).position()).isEqualTo(Position.of(2, 4));
  }

  @Test
  public void testSyntaxErrors() {
    assertThat(errors("x = 1 +")).containsExactly("syntax error at 'newline': expected expression");
    assertThat(errors("def f(:", "    pass")).isNotEmpty();
    assertThat(errors("if x:", "y = 1")).containsExactly("expected an indented block");
  }

  @Test
  public void testParseThrowsAllErrors() {
    SyntaxError.Exception ex =
        assertThrows(SyntaxError.Exception.class, () -> parse("x = (1", "y = ]"));
    assertThat(ex.errors()).isNotEmpty();
    assertThat(ex.getMessage()).contains("syntax error");
  }

  @Test
  public void testNodeEquality() throws Exception {
    assertThat(parse("x = 1")).isEqualTo(parse("x = 1"));
    assertThat(parse("x = 1")).isNotEqualTo(parse("x = 2"));
    assertThat(Joiner.on(',').join(parse("a; b").children())).isEqualTo("a,b");
  }
}
