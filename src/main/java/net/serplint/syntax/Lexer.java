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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/** A scanner for Serpent. */
final class Lexer {

  // --- These fields are accessed directly by the parser: ---

  // Mapping from file offsets to positions.
  final FileLocations locs;

  // Information about current token. Updated by nextToken.
  TokenKind kind;
  int start; // start offset
  int end; // end offset
  String raw; // source text of token; null for layout tokens

  // --- end of parser-visible fields ---

  private final List<SyntaxError> errors;

  // Input buffer and position
  private final char[] buffer;
  private int pos;

  // The stack of enclosing indentation levels in columns.
  // The first (outermost) element is always zero.
  private final Deque<Integer> indentStack = new ArrayDeque<>();

  // The number of unclosed open-parens ('(' or '[') at the current point in
  // the stream. Newlines and indentation are ignored when this is nonzero.
  private int openParenStackDepth = 0;

  // True after a NEWLINE token: we are outside an expression and have to check the indentation.
  private boolean checkIndentation;

  // Number of saved INDENT (>0) or OUTDENT (<0) tokens detected but not yet returned.
  private int dents;

  // Characters that can come immediately prior to an '=' character to generate
  // a different token
  private static final ImmutableMap<Character, TokenKind> EQUAL_TOKENS =
      ImmutableMap.<Character, TokenKind>builder()
          .put('=', TokenKind.EQUALS_EQUALS)
          .put('!', TokenKind.NOT_EQUALS)
          .put('>', TokenKind.GREATER_EQUALS)
          .put('<', TokenKind.LESS_EQUALS)
          .put('+', TokenKind.PLUS_EQUALS)
          .put('-', TokenKind.MINUS_EQUALS)
          .put('*', TokenKind.STAR_EQUALS)
          .put('/', TokenKind.SLASH_EQUALS)
          .put('%', TokenKind.PERCENT_EQUALS)
          .put('^', TokenKind.CARET_EQUALS)
          .put('&', TokenKind.AMPERSAND_EQUALS)
          .put('|', TokenKind.PIPE_EQUALS)
          .buildOrThrow();

  private static final ImmutableMap<String, TokenKind> KEYWORDS =
      ImmutableMap.<String, TokenKind>builder()
          .put("and", TokenKind.AND)
          .put("break", TokenKind.BREAK)
          .put("continue", TokenKind.CONTINUE)
          .put("data", TokenKind.DATA)
          .put("def", TokenKind.DEF)
          .put("elif", TokenKind.ELIF)
          .put("else", TokenKind.ELSE)
          .put("event", TokenKind.EVENT)
          .put("for", TokenKind.FOR)
          .put("if", TokenKind.IF)
          .put("in", TokenKind.IN)
          .put("macro", TokenKind.MACRO)
          .put("not", TokenKind.NOT)
          .put("or", TokenKind.OR)
          .put("pass", TokenKind.PASS)
          .put("return", TokenKind.RETURN)
          .put("stop", TokenKind.STOP)
          .put("while", TokenKind.WHILE)
          .buildOrThrow();

  // Constructs a lexer which tokenizes the parser input.
  // Errors are appended to errors.
  Lexer(ParserInput input, List<SyntaxError> errors) {
    this.locs = FileLocations.create(input.getContent(), input.getFile());
    this.buffer = input.getContent();
    this.pos = 0;
    this.errors = errors;
    this.checkIndentation = true;
    this.dents = 0;

    indentStack.push(0);
  }

  /**
   * Reads the next token, updating the Lexer's token fields. It is an error to call nextToken after
   * an EOF token.
   */
  void nextToken() {
    boolean afterNewline = kind == TokenKind.NEWLINE;
    tokenize();
    Preconditions.checkState(kind != null);

    // Like Python, always end with a NEWLINE token, even if no '\n' in input:
    if (kind == TokenKind.EOF && !afterNewline) {
      kind = TokenKind.NEWLINE;
    }
  }

  /** Returns true if the current token is a keyword, which may also be used as a field name. */
  boolean isKeyword() {
    return raw != null && KEYWORDS.containsKey(raw);
  }

  private void popParen() {
    if (openParenStackDepth == 0) {
      error("unbalanced closing bracket", pos - 1);
    } else {
      openParenStackDepth--;
    }
  }

  private void error(String message, int pos) {
    errors.add(
        new SyntaxError(locs.file(), locs.line(pos) + 1, locs.column(pos) + 1, message));
  }

  private void setToken(TokenKind kind, int start, int end) {
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.raw = null;
  }

  // Records the source text of an IDENTIFIER, INT, STRING or keyword token.
  private void setRaw() {
    this.raw = bufferSlice(start, end);
  }

  private void newline() {
    if (openParenStackDepth > 0) {
      newlineInsideExpression(); // in an expression: ignore space
    } else {
      checkIndentation = true;
      setToken(TokenKind.NEWLINE, pos - 1, pos);
    }
  }

  private void newlineInsideExpression() {
    while (pos < buffer.length) {
      switch (buffer[pos]) {
        case ' ': case '\t': case '\r':
          pos++;
          break;
        default:
          return;
      }
    }
  }

  /** Computes indentation (updates dent) and advances pos. */
  private void computeIndentation() {
    // we're in a stmt: suck up space at beginning of next line
    int indentLen = 0;
    while (pos < buffer.length) {
      char c = buffer[pos];
      if (c == ' ' || c == '\t') {
        indentLen++;
        pos++;
      } else if (c == '\r') {
        pos++;
      } else if (c == '\n') { // entirely blank line: discard
        indentLen = 0;
        pos++;
      } else if (c == '#') { // line containing only a comment
        while (pos < buffer.length && buffer[pos] != '\n') {
          pos++;
        }
        indentLen = 0;
      } else { // printing character
        break;
      }
    }

    if (pos == buffer.length) {
      indentLen = 0;
    } // trailing space on last line

    int peekedIndent = indentStack.peek();
    if (peekedIndent < indentLen) { // push a level
      indentStack.push(indentLen);
      dents++;

    } else if (peekedIndent > indentLen) { // pop one or more levels
      while (peekedIndent > indentLen) {
        indentStack.pop();
        dents--;
        peekedIndent = indentStack.peek();
      }

      if (peekedIndent < indentLen) {
        error("indentation error", pos - 1);
      }
    }
  }

  /**
   * Scans a string literal delimited by 'quot'. The token's raw text keeps its quotes, so that a
   * string is never mistaken for an identifier.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the first delimiter. ON EXIT: 'pos' is 1 + the index of
   * the last delimiter.
   */
  private void stringLiteral(char quot) {
    int literalStartPos = pos - 1;
    while (pos < buffer.length) {
      char c = buffer[pos++];
      if (c == '\n') {
        break;
      } else if (c == '\\') {
        if (pos < buffer.length && buffer[pos] != '\n') {
          pos++;
        }
      } else if (c == quot) {
        setToken(TokenKind.STRING, literalStartPos, pos);
        setRaw();
        return;
      }
    }
    error("unclosed string literal", literalStartPos);
    if (pos > 0 && pos <= buffer.length && buffer[pos - 1] == '\n') {
      pos--; // leave the newline for the next token
    }
    setToken(TokenKind.STRING, literalStartPos, pos);
    setRaw();
  }

  /**
   * Scans an identifier or keyword. Identifiers may start with '$' (macro variables) or '~'
   * (low-level opcodes such as {@code ~invalid}).
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the first char in the identifier. ON EXIT: 'pos' is 1 +
   * the index of the last char in the identifier.
   */
  private void identifierOrKeyword() {
    int oldPos = pos - 1;
    while (pos < buffer.length && isIdentifierPart(buffer[pos])) {
      pos++;
    }
    String id = bufferSlice(oldPos, pos);
    TokenKind keyword = KEYWORDS.get(id);
    setToken(keyword != null ? keyword : TokenKind.IDENTIFIER, oldPos, pos);
    setRaw();
  }

  private static boolean isIdentifierStart(int c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isIdentifierPart(int c) {
    return isIdentifierStart(c) || isdigit(c);
  }

  /**
   * Tokenizes a two-char operator.
   *
   * @return true if it tokenized an operator
   */
  private boolean tokenizeTwoChars() {
    if (pos + 1 >= buffer.length) {
      return false;
    }
    char c1 = buffer[pos];
    char c2 = buffer[pos + 1];
    TokenKind tok = null;
    if (c2 == '=') {
      tok = EQUAL_TOKENS.get(c1);
    } else if (c1 == '*' && c2 == '*') {
      if (peek(2) == '=') {
        setToken(TokenKind.STAR_STAR_EQUALS, pos, pos + 3);
        pos++;
        return true;
      }
      tok = TokenKind.STAR_STAR;
    } else if (c1 == '<' && c2 == '<') {
      tok = TokenKind.LESS_LESS;
    } else if (c1 == '>' && c2 == '>') {
      tok = TokenKind.GREATER_GREATER;
    }
    if (tok == null) {
      return false;
    }
    setToken(tok, pos, pos + 2);
    return true;
  }

  // Returns the ith unconsumed char, or -1 for EOF.
  private int peek(int i) {
    return pos + i < buffer.length ? buffer[pos + i] : -1;
  }

  /**
   * Performs tokenization of the character buffer of file contents provided to the constructor. At
   * least one token will be added to the tokens queue.
   */
  private void tokenize() {
    if (checkIndentation) {
      checkIndentation = false;
      computeIndentation();
    }

    // Return saved indentation tokens.
    if (dents != 0) {
      if (dents < 0) {
        dents++;
        setToken(TokenKind.OUTDENT, pos - 1, pos);
      } else {
        dents--;
        setToken(TokenKind.INDENT, pos - 1, pos);
      }
      return;
    }

    kind = null;
    while (pos < buffer.length) {
      if (tokenizeTwoChars()) {
        pos += 2;
        return;
      }
      char c = buffer[pos];
      pos++;
      switch (c) {
        case '(':
          setToken(TokenKind.LPAREN, pos - 1, pos);
          openParenStackDepth++;
          break;
        case ')':
          setToken(TokenKind.RPAREN, pos - 1, pos);
          popParen();
          break;
        case '[':
          setToken(TokenKind.LBRACKET, pos - 1, pos);
          openParenStackDepth++;
          break;
        case ']':
          setToken(TokenKind.RBRACKET, pos - 1, pos);
          popParen();
          break;
        case '>':
          setToken(TokenKind.GREATER, pos - 1, pos);
          break;
        case '<':
          setToken(TokenKind.LESS, pos - 1, pos);
          break;
        case ':':
          setToken(TokenKind.COLON, pos - 1, pos);
          break;
        case ',':
          setToken(TokenKind.COMMA, pos - 1, pos);
          break;
        case '+':
          setToken(TokenKind.PLUS, pos - 1, pos);
          break;
        case '-':
          setToken(TokenKind.MINUS, pos - 1, pos);
          break;
        case '|':
          setToken(TokenKind.PIPE, pos - 1, pos);
          break;
        case '=':
          setToken(TokenKind.EQUALS, pos - 1, pos);
          break;
        case '%':
          setToken(TokenKind.PERCENT, pos - 1, pos);
          break;
        case '&':
          setToken(TokenKind.AMPERSAND, pos - 1, pos);
          break;
        case '^':
          setToken(TokenKind.CARET, pos - 1, pos);
          break;
        case '/':
          setToken(TokenKind.SLASH, pos - 1, pos);
          break;
        case ';':
          setToken(TokenKind.SEMI, pos - 1, pos);
          break;
        case '*':
          setToken(TokenKind.STAR, pos - 1, pos);
          break;
        case '!':
          setToken(TokenKind.BANG, pos - 1, pos);
          break;
        case '.':
          setToken(TokenKind.DOT, pos - 1, pos);
          break;
        case '~':
          if (isIdentifierStart(peek(0))) {
            identifierOrKeyword();
          } else {
            setToken(TokenKind.TILDE, pos - 1, pos);
          }
          break;
        case '$':
          if (isIdentifierStart(peek(0))) {
            identifierOrKeyword();
          } else {
            setToken(TokenKind.ILLEGAL, pos - 1, pos);
            setRaw();
            error("invalid character: '$'", pos - 1);
          }
          break;
        case ' ':
        case '\t':
        case '\r':
          /* ignore */
          break;
        case '\\':
          // Backslash character is valid only at the end of a line (or in a string)
          if (peek(0) == '\n') {
            pos += 1; // skip the end of line character
          } else if (peek(0) == '\r' && peek(1) == '\n') {
            pos += 2; // skip the CRLF at the end of line
          } else {
            setToken(TokenKind.ILLEGAL, pos - 1, pos);
            setRaw();
            error("invalid character: '\\'", pos - 1);
          }
          break;
        case '\n':
          newline();
          break;
        case '#':
          while (pos < buffer.length && buffer[pos] != '\n') {
            pos++;
          }
          break;
        case '\'':
        case '"':
          stringLiteral(c);
          break;
        default:
          if (isdigit(c)) {
            pos--; // unconsume
            scanNumber();
            break;
          }

          if (isIdentifierStart(c)) {
            identifierOrKeyword();
          } else {
            setToken(TokenKind.ILLEGAL, pos - 1, pos);
            setRaw();
            error("invalid character: '" + c + "'", pos - 1);
          }
          break;
      } // switch
      if (kind != null) { // stop here if we scanned a token
        return;
      }
    } // while

    if (indentStack.size() > 1) { // bottom of stack is always zero
      setToken(TokenKind.NEWLINE, pos - 1, pos);
      while (indentStack.size() > 1) {
        indentStack.pop();
        dents--;
      }
      return;
    }

    setToken(TokenKind.EOF, pos, pos);
  }

  // Scans a decimal or hexadecimal integer literal.
  private void scanNumber() {
    int start = pos;
    if (peek(0) == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
      pos += 2;
      if (!isxdigit(peek(0))) {
        error("invalid hex literal", start);
      }
      while (isxdigit(peek(0))) {
        pos++;
      }
    } else {
      while (isdigit(peek(0))) {
        pos++;
      }
    }
    if (isIdentifierStart(peek(0))) {
      error("invalid integer literal", start);
      while (isIdentifierPart(peek(0))) {
        pos++;
      }
    }
    setToken(TokenKind.INT, start, pos);
    setRaw();
  }

  private static boolean isdigit(int c) {
    return '0' <= c && c <= '9';
  }

  private static boolean isxdigit(int c) {
    return isdigit(c) || ('A' <= c && c <= 'F') || ('a' <= c && c <= 'f');
  }

  /**
   * Returns parts of the source buffer based on offsets
   *
   * @param start the beginning offset for the slice
   * @param end the offset immediately following the slice
   * @return the text at offset start with length end - start
   */
  String bufferSlice(int start, int end) {
    return new String(this.buffer, start, end - start);
  }
}
