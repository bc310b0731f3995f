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

/** A TokenKind represents the kind of a lexical token. */
public enum TokenKind {
  AMPERSAND("&"),
  AMPERSAND_EQUALS("&="),
  AND("and"),
  BANG("!"),
  BREAK("break"),
  CARET("^"),
  CARET_EQUALS("^="),
  COLON(":"),
  COMMA(","),
  CONTINUE("continue"),
  DATA("data"),
  DEF("def"),
  DOT("."),
  ELIF("elif"),
  ELSE("else"),
  EOF("EOF"),
  EQUALS("="),
  EQUALS_EQUALS("=="),
  EVENT("event"),
  FOR("for"),
  GREATER(">"),
  GREATER_EQUALS(">="),
  GREATER_GREATER(">>"),
  IDENTIFIER("identifier"),
  IF("if"),
  ILLEGAL("illegal character"),
  IN("in"),
  INDENT("indent"),
  INT("integer literal"),
  LBRACKET("["),
  LESS("<"),
  LESS_EQUALS("<="),
  LESS_LESS("<<"),
  LPAREN("("),
  MACRO("macro"),
  MINUS("-"),
  MINUS_EQUALS("-="),
  NEWLINE("newline"),
  NOT("not"),
  NOT_EQUALS("!="),
  OR("or"),
  OUTDENT("outdent"),
  PASS("pass"),
  PERCENT("%"),
  PERCENT_EQUALS("%="),
  PIPE("|"),
  PIPE_EQUALS("|="),
  PLUS("+"),
  PLUS_EQUALS("+="),
  RBRACKET("]"),
  RETURN("return"),
  RPAREN(")"),
  SEMI(";"),
  SLASH("/"),
  SLASH_EQUALS("/="),
  STAR("*"),
  STAR_EQUALS("*="),
  STAR_STAR("**"),
  STAR_STAR_EQUALS("**="),
  STOP("stop"),
  STRING("string literal"),
  TILDE("~"),
  WHILE("while");

  private final String name;

  TokenKind(String name) {
    this.name = name;
  }

  /**
   * Returns the operator symbol or keyword spelling of this token kind. For operators and keywords
   * this is also the kind of the syntax node the parser builds for it.
   */
  @Override
  public String toString() {
    return name;
  }
}
