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
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Parser is a recursive-descent parser for Serpent. It produces the untyped trees described in
 * {@link Node}: every statement, operator and call becomes a node whose kind names it, and every
 * suite becomes a {@code seq} node.
 */
public final class Parser {

  /** Combines the parser result into a single value object. */
  public static final class ParseResult {
    /** The root {@code seq} node of the parsed file. */
    public final Node root;

    /** Errors encountered during scanning or parsing. */
    public final ImmutableList<SyntaxError> errors;

    private ParseResult(Node root, List<SyntaxError> errors) {
      this.root = Preconditions.checkNotNull(root);
      this.errors = ImmutableList.copyOf(errors);
    }

    public boolean ok() {
      return errors.isEmpty();
    }
  }

  /** Kind of a statement list or file. */
  public static final String SEQ = "seq";

  /** Kind of a call whose callee is not a bare name, e.g. {@code self.foo(x)}. */
  public static final String FUN = "fun";

  /** Kind of an index expression {@code a[i]}. */
  public static final String ACCESS = "access";

  /** Kind of an array literal {@code [a, b]}. */
  public static final String ARRAY_LIT = "array_lit";

  private static final EnumSet<TokenKind> STATEMENT_TERMINATOR_SET =
      EnumSet.of(TokenKind.EOF, TokenKind.NEWLINE, TokenKind.SEMI);

  private static final EnumSet<TokenKind> EXPR_TERMINATOR_SET =
      EnumSet.of(
          TokenKind.COLON,
          TokenKind.COMMA,
          TokenKind.EOF,
          TokenKind.NEWLINE,
          TokenKind.RBRACKET,
          TokenKind.RPAREN);

  private static final ImmutableMap<TokenKind, TokenKind> augmentedAssignments =
      ImmutableMap.<TokenKind, TokenKind>builder()
          .put(TokenKind.PLUS_EQUALS, TokenKind.PLUS)
          .put(TokenKind.MINUS_EQUALS, TokenKind.MINUS)
          .put(TokenKind.STAR_EQUALS, TokenKind.STAR)
          .put(TokenKind.STAR_STAR_EQUALS, TokenKind.STAR_STAR)
          .put(TokenKind.SLASH_EQUALS, TokenKind.SLASH)
          .put(TokenKind.PERCENT_EQUALS, TokenKind.PERCENT)
          .put(TokenKind.AMPERSAND_EQUALS, TokenKind.AMPERSAND)
          .put(TokenKind.CARET_EQUALS, TokenKind.CARET)
          .put(TokenKind.PIPE_EQUALS, TokenKind.PIPE)
          .buildOrThrow();

  /**
   * Highest precedence goes last. Unary operators and the power operators ({@code ^} and {@code
   * **}, which Serpent spells both ways) bind tighter than all of these.
   */
  private static final ImmutableList<EnumSet<TokenKind>> operatorPrecedence =
      ImmutableList.of(
          EnumSet.of(TokenKind.OR),
          EnumSet.of(TokenKind.AND),
          EnumSet.of(TokenKind.NOT),
          EnumSet.of(
              TokenKind.EQUALS_EQUALS,
              TokenKind.NOT_EQUALS,
              TokenKind.LESS,
              TokenKind.LESS_EQUALS,
              TokenKind.GREATER,
              TokenKind.GREATER_EQUALS),
          EnumSet.of(TokenKind.PIPE),
          EnumSet.of(TokenKind.AMPERSAND),
          EnumSet.of(TokenKind.GREATER_GREATER, TokenKind.LESS_LESS),
          EnumSet.of(TokenKind.MINUS, TokenKind.PLUS),
          EnumSet.of(TokenKind.SLASH, TokenKind.STAR, TokenKind.PERCENT));

  /** Current lookahead token. */
  private final Lexer token; // token.kind is a prettier alias for lexer.kind

  private final Lexer lexer;
  private final FileLocations locs;
  private final List<SyntaxError> errors;

  private int errorsCount;
  private boolean recoveryMode; // stop reporting errors until next statement

  private Parser(Lexer lexer, List<SyntaxError> errors) {
    this.lexer = lexer;
    this.locs = lexer.locs;
    this.errors = errors;
    this.token = lexer;
    nextToken();
  }

  /** Parses a file, recording scanner and parser errors in the result. */
  public static ParseResult parseFile(ParserInput input) {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, errors);
    Parser parser = new Parser(lexer, errors);
    ImmutableList<Node> statements = parser.parseFileInput();
    return new ParseResult(Node.of(SEQ, Position.of(0, 0), statements), errors);
  }

  /** Parses a file, throwing an exception holding all errors if there were any. */
  public static Node parse(ParserInput input) throws SyntaxError.Exception {
    ParseResult result = parseFile(input);
    if (!result.ok()) {
      throw new SyntaxError.Exception(result.errors);
    }
    return result.root;
  }

  // Returns a token's string form as used in error messages.
  private static String tokenString(TokenKind kind, String raw) {
    return raw == null ? kind.toString() : raw;
  }

  private Position position(int offset) {
    return locs.getPosition(offset);
  }

  @FormatMethod
  private void reportError(int offset, String format, Object... args) {
    errorsCount++;
    // Limit the number of reported errors to avoid spamming output.
    if (errorsCount <= 5) {
      errors.add(
          new SyntaxError(
              locs.file(),
              locs.line(offset) + 1,
              locs.column(offset) + 1,
              String.format(format, args)));
    }
  }

  private void syntaxError(String message) {
    if (!recoveryMode) {
      if (token.kind == TokenKind.INDENT) {
        reportError(token.start, "indentation error");
      } else {
        reportError(
            token.start,
            "syntax error at '%s': %s",
            tokenString(token.kind, token.raw),
            message);
      }
      recoveryMode = true;
    }
  }

  // Consumes the current token and returns its position, like nextToken.
  // Reports a syntax error if the new token is not of the expected kind.
  private int expect(TokenKind kind) {
    if (token.kind != kind) {
      syntaxError("expected " + kind);
    }
    return nextToken();
  }

  // Like expect, but stops recovery mode if the token was expected.
  private int expectAndRecover(TokenKind kind) {
    if (token.kind != kind) {
      syntaxError("expected " + kind);
    } else {
      recoveryMode = false;
    }
    return nextToken();
  }

  /**
   * Consume tokens until we reach the first token that has a kind that is in the set of
   * terminatingTokens.
   *
   * @return the end offset of the last consumed token.
   */
  private int syncTo(EnumSet<TokenKind> terminatingTokens) {
    // EOF must be in the set to prevent an infinite loop
    Preconditions.checkState(terminatingTokens.contains(TokenKind.EOF));
    // read past the problematic token
    int previous = token.end;
    nextToken();
    int current = previous;
    while (!terminatingTokens.contains(token.kind)) {
      nextToken();
      previous = current;
      current = token.end;
    }
    return previous;
  }

  private int nextToken() {
    int prev = token.start;
    if (token.kind != TokenKind.EOF) {
      lexer.nextToken();
    }
    return prev;
  }

  // Returns a leaf whose content is the input from start to end.
  private Node makeErrorExpression(int start, int end) {
    return Node.leaf(lexer.bufferSlice(start, Math.max(start, end)), position(start));
  }

  // file_input = ('\n' | stmt)* EOF
  private ImmutableList<Node> parseFileInput() {
    ImmutableList.Builder<Node> list = ImmutableList.builder();
    try {
      while (token.kind != TokenKind.EOF) {
        if (token.kind == TokenKind.NEWLINE) {
          expectAndRecover(TokenKind.NEWLINE);
        } else if (recoveryMode) {
          // If there was a parse error, we want to recover here
          // before starting a new top-level statement.
          syncTo(STATEMENT_TERMINATOR_SET);
          recoveryMode = false;
        } else {
          parseStatement(list);
        }
      }
    } catch (StackOverflowError ex) {
      // Deeply nested input can exhaust the stack; report it as a parse error.
      reportError(
          token.end,
          "internal error: stack overflow in Serpent parser while parsing %s.\n%s",
          locs.file(),
          Throwables.getStackTraceAsString(ex));
    }
    return list.build();
  }

  // stmt = simple_stmt
  //      | def_stmt
  //      | macro_stmt
  //      | if_stmt
  //      | while_stmt
  //      | for_stmt
  private void parseStatement(ImmutableList.Builder<Node> list) {
    switch (token.kind) {
      case DEF:
        list.add(parseDefStatement());
        break;
      case MACRO:
        list.add(parseMacroStatement());
        break;
      case IF:
        list.add(parseIfStatement());
        break;
      case WHILE:
        list.add(parseWhileStatement());
        break;
      case FOR:
        list.add(parseForStatement());
        break;
      default:
        parseSimpleStatement(list);
    }
  }

  // simple_stmt = small_stmt (';' small_stmt)* ';'? NEWLINE
  private void parseSimpleStatement(ImmutableList.Builder<Node> list) {
    list.add(parseSmallStatement());

    while (token.kind == TokenKind.SEMI) {
      nextToken();
      if (token.kind == TokenKind.NEWLINE) {
        break;
      }
      list.add(parseSmallStatement());
    }
    expectAndRecover(TokenKind.NEWLINE);
  }

  //     small_stmt = assign_stmt
  //                | expr
  //                | data_stmt
  //                | event_stmt
  //                | return_stmt
  //                | PASS | STOP | BREAK | CONTINUE
  //
  //     assign_stmt = annotated ('=' | augassign) annotated
  private Node parseSmallStatement() {
    switch (token.kind) {
      case RETURN:
        return parseReturnStatement();
      case DATA:
        {
          int offset = nextToken();
          return Node.of(TokenKind.DATA.toString(), position(offset), parseAnnotated());
        }
      case EVENT:
        {
          int offset = nextToken();
          return Node.of(TokenKind.EVENT.toString(), position(offset), parsePrimaryWithSuffix());
        }
      case PASS:
      case STOP:
      case BREAK:
      case CONTINUE:
        {
          TokenKind kind = token.kind;
          int offset = nextToken();
          return Node.of(kind.toString(), position(offset));
        }
      default:
        break;
    }

    Node lhs = parseAnnotated();

    // lhs = rhs  or  lhs += rhs
    if (token.kind == TokenKind.EQUALS || augmentedAssignments.containsKey(token.kind)) {
      TokenKind op = token.kind;
      nextToken();
      Node rhs = parseAnnotated();
      return Node.of(op.toString(), lhs.position(), lhs, rhs);
    }
    return lhs;
  }

  // annotated = test [':' primary_with_suffix]
  // Serpent spells types as annotations, e.g. "x:arr" or "return(out:str)".
  private Node parseAnnotated() {
    Node expr = parseTest();
    if (token.kind == TokenKind.COLON) {
      nextToken();
      Node type = parsePrimaryWithSuffix();
      return Node.of(TokenKind.COLON.toString(), expr.position(), expr, type);
    }
    return expr;
  }

  // return_stmt = RETURN [annotated]
  private Node parseReturnStatement() {
    int returnOffset = expect(TokenKind.RETURN);
    if (STATEMENT_TERMINATOR_SET.contains(token.kind)) {
      return Node.of(TokenKind.RETURN.toString(), position(returnOffset));
    }
    return Node.of(TokenKind.RETURN.toString(), position(returnOffset), parseAnnotated());
  }

  // def_stmt = DEF IDENTIFIER '(' parameters ')' ':' suite
  private Node parseDefStatement() {
    int defOffset = expect(TokenKind.DEF);
    Node name = parseIdent();
    expect(TokenKind.LPAREN);
    ImmutableList<Node> params = parseParameters();
    expect(TokenKind.RPAREN);
    expect(TokenKind.COLON);
    Node body = parseSuite();
    Node signature = Node.of(callKind(name), name.position(), params);
    return Node.of(TokenKind.DEF.toString(), position(defOffset), signature, body);
  }

  // parameters = ( (param ',')* param ','? )?
  // param = IDENTIFIER [':' primary_with_suffix]
  private ImmutableList<Node> parseParameters() {
    boolean hasParam = false;
    ImmutableList.Builder<Node> list = ImmutableList.builder();
    while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
      if (hasParam) {
        expect(TokenKind.COMMA);
        // The list may end with a comma.
        if (token.kind == TokenKind.RPAREN) {
          break;
        }
      }
      Node id = parseIdent();
      if (token.kind == TokenKind.COLON) {
        nextToken();
        Node type = parsePrimaryWithSuffix();
        id = Node.of(TokenKind.COLON.toString(), id.position(), id, type);
      }
      list.add(id);
      hasParam = true;
      if (recoveryMode) {
        break;
      }
    }
    return list.build();
  }

  // macro_stmt = MACRO test ':' suite
  private Node parseMacroStatement() {
    int macroOffset = expect(TokenKind.MACRO);
    Node pattern = parseTest();
    expect(TokenKind.COLON);
    Node body = parseSuite();
    return Node.of(TokenKind.MACRO.toString(), position(macroOffset), pattern, body);
  }

  // if_stmt = IF test ':' suite [ELIF test ':' suite]* [ELSE ':' suite]?
  private Node parseIfStatement() {
    int ifOffset = expect(TokenKind.IF);
    return parseConditional(TokenKind.IF, ifOffset);
  }

  // Parses the condition, suite and else-chain of an if or elif clause whose keyword has been
  // consumed. The chain nests: (if c (seq) (elif c (seq) (else (seq)))).
  private Node parseConditional(TokenKind kind, int offset) {
    Node cond = parseTest();
    expect(TokenKind.COLON);
    Node body = parseSuite();
    if (token.kind == TokenKind.ELIF) {
      int elifOffset = nextToken();
      Node elif = parseConditional(TokenKind.ELIF, elifOffset);
      return Node.of(kind.toString(), position(offset), cond, body, elif);
    }
    if (token.kind == TokenKind.ELSE) {
      int elseOffset = nextToken();
      expect(TokenKind.COLON);
      Node elseBody = parseSuite();
      Node orElse = Node.of(TokenKind.ELSE.toString(), position(elseOffset), elseBody);
      return Node.of(kind.toString(), position(offset), cond, body, orElse);
    }
    return Node.of(kind.toString(), position(offset), cond, body);
  }

  // while_stmt = WHILE test ':' suite
  private Node parseWhileStatement() {
    int whileOffset = expect(TokenKind.WHILE);
    Node cond = parseTest();
    expect(TokenKind.COLON);
    Node body = parseSuite();
    return Node.of(TokenKind.WHILE.toString(), position(whileOffset), cond, body);
  }

  // for_stmt = FOR IDENTIFIER IN test ':' suite
  private Node parseForStatement() {
    int forOffset = expect(TokenKind.FOR);
    Node var = parseIdent();
    expect(TokenKind.IN);
    Node collection = parseTest();
    expect(TokenKind.COLON);
    Node body = parseSuite();
    return Node.of(TokenKind.FOR.toString(), position(forOffset), var, collection, body);
  }

  // suite is what follows a colon (e.g. after def or if).
  // suite = simple_stmt
  //       | NEWLINE INDENT stmt+ OUTDENT
  private Node parseSuite() {
    ImmutableList.Builder<Node> list = ImmutableList.builder();
    int start = token.start;
    if (token.kind == TokenKind.NEWLINE) {
      expect(TokenKind.NEWLINE);
      if (token.kind != TokenKind.INDENT) {
        reportError(token.start, "expected an indented block");
        return Node.of(SEQ, position(start), list.build());
      }
      expect(TokenKind.INDENT);
      start = token.start;
      while (token.kind != TokenKind.OUTDENT && token.kind != TokenKind.EOF) {
        parseStatement(list);
      }
      expectAndRecover(TokenKind.OUTDENT);
    } else {
      parseSimpleStatement(list);
    }
    return Node.of(SEQ, position(start), list.build());
  }

  // Parses any expression.
  // test = or_expr
  private Node parseTest() {
    return parseTest(0);
  }

  private Node parseTest(int prec) {
    if (prec >= operatorPrecedence.size()) {
      return parseUnary();
    }
    if (token.kind == TokenKind.NOT && operatorPrecedence.get(prec).contains(TokenKind.NOT)) {
      return parseNotExpression(prec);
    }
    return parseBinOpExpression(prec);
  }

  // not_expr = 'not' expr
  private Node parseNotExpression(int prec) {
    int notOffset = expect(TokenKind.NOT);
    Node x = parseTest(prec);
    return Node.of(TokenKind.NOT.toString(), position(notOffset), x);
  }

  // binop_expression = binop_expression OP binop_expression
  //                  | unary
  // This function takes care of precedence between operators (see operatorPrecedence for
  // the order), and it assumes left-to-right associativity.
  private Node parseBinOpExpression(int prec) {
    Node x = parseTest(prec + 1);
    while (operatorPrecedence.get(prec).contains(token.kind)) {
      TokenKind op = token.kind;
      nextToken();
      Node y = parseTest(prec + 1);
      x = Node.of(op.toString(), x.position(), x, y);
    }
    return x;
  }

  // unary = ('-' | '+' | '!' | '~') unary
  //       | power
  private Node parseUnary() {
    switch (token.kind) {
      case MINUS:
      case PLUS:
      case BANG:
      case TILDE:
        {
          TokenKind op = token.kind;
          int offset = nextToken();
          Node x = parseUnary();
          return Node.of(op.toString(), position(offset), x);
        }
      default:
        return parsePower();
    }
  }

  // power = primary_with_suffix [('^' | '**') unary]
  // Exponentiation is right-associative.
  private Node parsePower() {
    Node x = parsePrimaryWithSuffix();
    if (token.kind == TokenKind.CARET || token.kind == TokenKind.STAR_STAR) {
      TokenKind op = token.kind;
      nextToken();
      Node y = parseUnary();
      return Node.of(op.toString(), x.position(), x, y);
    }
    return x;
  }

  //  primary = INT
  //          | STRING
  //          | IDENTIFIER
  //          | '[' (test (',' test)* ','?)? ']'
  //          | '(' annotated ')'
  private Node parsePrimary() {
    switch (token.kind) {
      case INT:
      case STRING:
      case IDENTIFIER:
        {
          Node leaf = Node.leaf(token.raw, position(token.start));
          nextToken();
          return leaf;
        }

      case LBRACKET:
        {
          int lbracketOffset = nextToken();
          ImmutableList.Builder<Node> elems = ImmutableList.builder();
          while (token.kind != TokenKind.RBRACKET && token.kind != TokenKind.EOF) {
            elems.add(parseTest());
            if (token.kind != TokenKind.COMMA) {
              break;
            }
            nextToken();
          }
          expect(TokenKind.RBRACKET);
          return Node.of(ARRAY_LIT, position(lbracketOffset), elems.build());
        }

      case LPAREN:
        {
          nextToken();
          Node e = parseAnnotated();
          expect(TokenKind.RPAREN);
          return e;
        }

      default:
        {
          int start = token.start;
          syntaxError("expected expression");
          int end = syncTo(EXPR_TERMINATOR_SET);
          return makeErrorExpression(start, end);
        }
    }
  }

  // primary_with_suffix = primary (selector_suffix | index_suffix | call_suffix)*
  private Node parsePrimaryWithSuffix() {
    Node e = parsePrimary();
    while (true) {
      if (token.kind == TokenKind.DOT) {
        e = parseSelectorSuffix(e);
      } else if (token.kind == TokenKind.LBRACKET) {
        e = parseIndexSuffix(e);
      } else if (token.kind == TokenKind.LPAREN) {
        e = parseCallSuffix(e);
      } else {
        return e;
      }
    }
  }

  // selector_suffix = '.' (IDENTIFIER | keyword)
  private Node parseSelectorSuffix(Node e) {
    expect(TokenKind.DOT);
    if (token.kind == TokenKind.IDENTIFIER || token.isKeyword()) {
      Node field = Node.leaf(token.raw, position(token.start));
      nextToken();
      return Node.of(TokenKind.DOT.toString(), e.position(), e, field);
    }

    syntaxError("expected identifier after dot");
    syncTo(EXPR_TERMINATOR_SET);
    return e;
  }

  // index_suffix = '[' test? ']'
  // The empty index appears in declarations of dynamic arrays, e.g. "data balances[]".
  private Node parseIndexSuffix(Node e) {
    expect(TokenKind.LBRACKET);
    if (token.kind == TokenKind.RBRACKET) {
      nextToken();
      return Node.of(ACCESS, e.position(), e);
    }
    Node index = parseTest();
    expect(TokenKind.RBRACKET);
    return Node.of(ACCESS, e.position(), e, index);
  }

  // call_suffix = '(' arg_list? ')'
  // A call of a bare name f(x) becomes (f x); any other callee c(x) becomes (fun c x).
  private Node parseCallSuffix(Node fn) {
    expect(TokenKind.LPAREN);
    ImmutableList<Node> args = ImmutableList.of();
    if (token.kind != TokenKind.RPAREN) {
      args = parseArguments();
    }
    expect(TokenKind.RPAREN);
    if (fn.isLeaf() && isName(fn.value()) && !fn.value().equals(Node.TOKEN)) {
      return Node.of(fn.value(), fn.position(), args);
    }
    return Node.of(
        FUN, fn.position(), ImmutableList.<Node>builder().add(fn).addAll(args).build());
  }

  // arg_list = ( (arg ',')* arg ','? )?
  // arg = IDENTIFIER '=' test
  //     | annotated
  private ImmutableList<Node> parseArguments() {
    boolean seenArg = false;
    ImmutableList.Builder<Node> list = ImmutableList.builder();
    while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
      if (seenArg) {
        expect(TokenKind.COMMA);
        // If nonempty, the list may end with a comma.
        if (token.kind == TokenKind.RPAREN) {
          break;
        }
      }
      Node arg = parseAnnotated();
      if (arg.isLeaf() && token.kind == TokenKind.EQUALS) {
        // keyword argument
        nextToken();
        Node value = parseTest();
        arg = Node.of(TokenKind.EQUALS.toString(), arg.position(), arg, value);
      }
      list.add(arg);
      seenArg = true;
      if (recoveryMode) {
        break;
      }
    }
    return list.build();
  }

  private Node parseIdent() {
    if (token.kind != TokenKind.IDENTIFIER) {
      int start = token.start;
      int end = expect(TokenKind.IDENTIFIER);
      return makeErrorExpression(start, end);
    }
    Node id = Node.leaf(token.raw, position(token.start));
    nextToken();
    return id;
  }

  // Returns the kind of the signature node of a definition named by the given leaf.
  private static String callKind(Node name) {
    return name.value().isEmpty() || name.value().equals(Node.TOKEN) ? FUN : name.value();
  }

  private static boolean isName(String text) {
    return !text.isEmpty() && !Character.isDigit(text.charAt(0)) && text.charAt(0) != '"'
        && text.charAt(0) != '\'';
  }
}
