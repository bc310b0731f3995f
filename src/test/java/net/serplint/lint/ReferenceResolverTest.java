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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.serplint.syntax.Node;
import net.serplint.syntax.Parser;
import net.serplint.syntax.ParserInput;
import net.serplint.syntax.Position;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link ReferenceResolver}. */
@RunWith(JUnit4.class)
public class ReferenceResolverTest {

  private Analysis analysis;

  // Parses a one-line expression statement and prepares a fresh analysis of it.
  private Node parse(String source) throws Exception {
    analysis = new Analysis("t.se", source);
    return Parser.parse(ParserInput.fromString(source, "t.se")).child(0);
  }

  private List<String> tokenNames(Node node) {
    List<String> names = new ArrayList<>();
    for (Token token :
        analysis.resolver().gatherTokens(ImmutableList.of(node), ScopeTable.TOPLEVEL)) {
      names.add(token.name());
    }
    return names;
  }

  private List<String> diagnostics() {
    List<String> result = new ArrayList<>();
    for (Diagnostic d : analysis.log().diagnostics()) {
      result.add(d.toString());
    }
    return result;
  }

  @Test
  public void testIsReference() {
    assertThat(ReferenceResolver.isReference("x")).isTrue();
    assertThat(ReferenceResolver.isReference("Transfer")).isTrue();
    assertThat(ReferenceResolver.isReference("self.balance")).isTrue();
    assertThat(ReferenceResolver.isReference("_x")).isFalse();
    assertThat(ReferenceResolver.isReference("$x")).isFalse();
    assertThat(ReferenceResolver.isReference("~invalid")).isFalse();
    assertThat(ReferenceResolver.isReference("42")).isFalse();
    assertThat(ReferenceResolver.isReference("\"s\"")).isFalse();
    assertThat(ReferenceResolver.isReference("")).isFalse();
    assertThat(ReferenceResolver.isReference(ReferenceResolver.UNKNOWN)).isFalse();
  }

  @Test
  public void testIsOpcode() {
    assertThat(ReferenceResolver.isOpcode("sha3")).isTrue();
    assertThat(ReferenceResolver.isOpcode("7")).isFalse();
    assertThat(ReferenceResolver.isOpcode("self")).isFalse();
    assertThat(ReferenceResolver.isOpcode("data")).isFalse();
    assertThat(ReferenceResolver.isOpcode("send")).isFalse();
  }

  @Test
  public void testResolveAccess() throws Exception {
    ReferenceResolver resolver;
    Node node = parse("self.balances[msg.sender][k]");
    resolver = analysis.resolver();
    assertThat(resolver.resolveAccess(node, ScopeTable.TOPLEVEL)).isEqualTo("self.balances");

    // The index references were checked; k is undefined, msg.sender is a global.
    analysis.resolvePendingChecks();
    assertThat(diagnostics()).containsExactly("t.se:1:27 E200 Undefined variable \"k\"");
  }

  @Test
  public void testResolveName() throws Exception {
    Node node = parse("a.b.c");
    assertThat(analysis.resolver().resolveName(node, ScopeTable.TOPLEVEL)).isEqualTo("a.b.c");
    Node leaf = node.child(1);
    assertThat(analysis.resolver().resolveName(leaf, ScopeTable.TOPLEVEL)).isEqualTo("c");
  }

  @Test
  public void testResolveAccessOfChildlessNode() throws Exception {
    parse("pass");
    Node empty = Node.of("f", Position.of(0, 0));
    assertThat(analysis.resolver().resolveAccess(empty, ScopeTable.TOPLEVEL))
        .isEqualTo(ReferenceResolver.UNKNOWN);
  }

  @Test
  public void testGatherTokens() throws Exception {
    assertThat(tokenNames(parse("a + a * b.c - 1 + \"s\" + $m")))
        .containsExactly("a", "b.c")
        .inOrder();
    assertThat(tokenNames(parse("f(x:arr, self.storage[y])")))
        .containsExactly("x", "self.storage", "y")
        .inOrder();
    assertThat(diagnostics()).isEmpty();
  }

  @Test
  public void testGatherTokensDeduplicatesByNameAndLine() throws Exception {
    assertThat(tokenNames(parse("a + a"))).containsExactly("a");

    analysis = new Analysis("t.se", "a\na");
    Node root = Parser.parse(ParserInput.fromString("a\na", "t.se"));
    Node twoLines = Node.of("+", Position.of(0, 0), root.child(0), root.child(1));
    assertThat(tokenNames(twoLines)).containsExactly("a", "a");
  }

  @Test
  public void testKeywordArguments() throws Exception {
    assertThat(tokenNames(parse("send(to=dest, items=n)"))).containsExactly("dest", "n").inOrder();
    assertThat(diagnostics()).containsExactly("t.se:1:6 E202 Invalid keyword argument \"to\"");
  }

  @Test
  public void testParameterName() throws Exception {
    Node def = parse("def f(a, b:arr): pass");
    Node signature = def.child(0);
    assertThat(ReferenceResolver.parameterName(signature.child(0)).value()).isEqualTo("a");
    assertThat(ReferenceResolver.parameterName(signature.child(1)).value()).isEqualTo("b");
  }
}
