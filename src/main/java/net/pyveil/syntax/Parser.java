// Copyright 2025 The Bazel Authors. All rights reserved.
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

package net.pyveil.syntax;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Parser is a recursive-descent parser for Python. */
final class Parser {

  /** Combines the parser result into a single value object. */
  static final class ParseResult {
    // Maps char offsets in the file to Locations.
    final FileLocations locs;

    /** The top-level statements of the parsed file. */
    final ImmutableList<Statement> statements;

    // Errors encountered during scanning or parsing.
    // These lists are ultimately owned by PyFile.
    final List<SyntaxError> errors;

    private ParseResult(
        FileLocations locs, ImmutableList<Statement> statements, List<SyntaxError> errors) {
      this.locs = locs;
      // No need to copy here; when the object is created, the parser instance is just about to go
      // out of scope and be garbage collected.
      this.statements = Preconditions.checkNotNull(statements);
      this.errors = errors;
    }
  }

  private static final EnumSet<TokenKind> STATEMENT_TERMINATOR_SET =
      EnumSet.of(TokenKind.EOF, TokenKind.NEWLINE, TokenKind.SEMI);

  private static final EnumSet<TokenKind> EXPR_LIST_TERMINATOR_SET =
      EnumSet.of(
          TokenKind.COLON,
          TokenKind.EOF,
          TokenKind.EQUALS,
          TokenKind.IN,
          TokenKind.NEWLINE,
          TokenKind.RBRACE,
          TokenKind.RBRACKET,
          TokenKind.RPAREN,
          TokenKind.SEMI);

  private static final EnumSet<TokenKind> EXPR_TERMINATOR_SET =
      EnumSet.of(
          TokenKind.COLON,
          TokenKind.COMMA,
          TokenKind.EOF,
          TokenKind.FOR,
          TokenKind.NEWLINE,
          TokenKind.RBRACE,
          TokenKind.RBRACKET,
          TokenKind.RPAREN,
          TokenKind.SEMI);

  private static final EnumSet<TokenKind> YIELD_TERMINATOR_SET =
      EnumSet.of(
          TokenKind.EOF,
          TokenKind.NEWLINE,
          TokenKind.RBRACE,
          TokenKind.RBRACKET,
          TokenKind.RPAREN,
          TokenKind.SEMI);

  /** Current lookahead token. May be mutated by the parser. */
  private final Lexer token; // token.kind is a prettier alias for lexer.kind

  private final Lexer lexer;
  private final FileLocations locs;
  private final List<SyntaxError> errors;
  private final ParserInput input;

  private static final Map<TokenKind, TokenKind> augmentedAssignments =
      new ImmutableMap.Builder<TokenKind, TokenKind>()
          .put(TokenKind.PLUS_EQUALS, TokenKind.PLUS)
          .put(TokenKind.MINUS_EQUALS, TokenKind.MINUS)
          .put(TokenKind.STAR_EQUALS, TokenKind.STAR)
          .put(TokenKind.AT_EQUALS, TokenKind.AT)
          .put(TokenKind.SLASH_EQUALS, TokenKind.SLASH)
          .put(TokenKind.SLASH_SLASH_EQUALS, TokenKind.SLASH_SLASH)
          .put(TokenKind.PERCENT_EQUALS, TokenKind.PERCENT)
          .put(TokenKind.STAR_STAR_EQUALS, TokenKind.STAR_STAR)
          .put(TokenKind.AMPERSAND_EQUALS, TokenKind.AMPERSAND)
          .put(TokenKind.CARET_EQUALS, TokenKind.CARET)
          .put(TokenKind.PIPE_EQUALS, TokenKind.PIPE)
          .put(TokenKind.GREATER_GREATER_EQUALS, TokenKind.GREATER_GREATER)
          .put(TokenKind.LESS_LESS_EQUALS, TokenKind.LESS_LESS)
          .buildOrThrow();

  /**
   * Highest precedence goes last. Based on:
   * https://docs.python.org/3/reference/expressions.html#operator-precedence
   *
   * <p>The NOT and comparison levels are parsed specially; unary operators and {@code **} bind
   * tighter than every level in this table.
   */
  private static final List<EnumSet<TokenKind>> operatorPrecedence =
      ImmutableList.of(
          EnumSet.of(TokenKind.OR),
          EnumSet.of(TokenKind.AND),
          EnumSet.of(TokenKind.NOT),
          EnumSet.copyOf(ComparisonExpression.OPERATORS),
          EnumSet.of(TokenKind.PIPE),
          EnumSet.of(TokenKind.CARET),
          EnumSet.of(TokenKind.AMPERSAND),
          EnumSet.of(TokenKind.GREATER_GREATER, TokenKind.LESS_LESS),
          EnumSet.of(TokenKind.MINUS, TokenKind.PLUS),
          EnumSet.of(
              TokenKind.SLASH,
              TokenKind.SLASH_SLASH,
              TokenKind.STAR,
              TokenKind.AT,
              TokenKind.PERCENT));

  private static final int NOT_PREC = 2;
  private static final int COMPARISON_PREC = 3;
  private static final int BITOR_PREC = 4;

  private int errorsCount;
  private boolean recoveryMode; // stop reporting errors until next statement

  private Parser(Lexer lexer, List<SyntaxError> errors, ParserInput input) {
    this.lexer = lexer;
    this.locs = lexer.locs;
    this.errors = errors;
    this.token = lexer;
    this.input = input;
    nextToken();
  }

  // Returns a token's string form as used in error messages.
  private static String tokenString(TokenKind kind, @Nullable Object value) {
    if (kind == TokenKind.STRING) {
      return "\"" + value + "\"";
    }
    return value instanceof String || value instanceof Number ? value.toString() : kind.toString();
  }

  // Main entry point for parsing a file.
  static ParseResult parseFile(ParserInput input) {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, errors);
    Parser parser = new Parser(lexer, errors, input);
    ImmutableList<Statement> statements = parser.parseFileInput();
    return new ParseResult(lexer.locs, statements, errors);
  }

  /** Parses an expression, possibly followed by newlines. */
  static Expression parseExpression(ParserInput input) throws SyntaxError.Exception {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, errors);
    Parser parser = new Parser(lexer, errors, input);
    Expression result = null;
    try {
      result = parser.parseTestListStarExpr();
      while (parser.token.kind == TokenKind.NEWLINE) {
        parser.nextToken();
      }
      parser.expect(TokenKind.EOF);
    } catch (StackOverflowError ex) {
      // See rationale at parseFileInput.
      parser.reportError(
          lexer.end,
          "internal error: stack overflow while parsing expression <<%s>>.\n%s",
          new String(input.getContent()),
          Throwables.getStackTraceAsString(ex));
    }
    if (!errors.isEmpty()) {
      throw new SyntaxError.Exception(errors);
    }
    return result;
  }

  // Records the source offset of a node built by this parser.
  @CanIgnoreReturnValue
  private <N extends Node> N at(int offset, N node) {
    node.setPosition(locs, offset);
    return node;
  }

  // stmt = simple_stmt | compound_stmt
  private void parseStatement(ImmutableList.Builder<Statement> list) {
    switch (token.kind) {
      case AT:
        parseDecoratedStatement(list);
        break;
      case DEF:
        list.add(parseDefStatement(token.start, ImmutableList.of()));
        break;
      case CLASS:
        list.add(parseClassStatement(token.start, ImmutableList.of()));
        break;
      case IF:
        list.add(parseIfStatement());
        break;
      case FOR:
        list.add(parseForStatement());
        break;
      case WHILE:
        list.add(parseWhileStatement());
        break;
      case TRY:
        list.add(parseTryStatement());
        break;
      case WITH:
        list.add(parseWithStatement());
        break;
      case ASYNC:
        reportError(token.start, "async syntax is not supported");
        nextToken();
        break;
      default:
        parseSimpleStatement(list);
        break;
    }
  }

  @FormatMethod
  private void reportError(int offset, String format, Object... args) {
    errorsCount++;
    // Limit the number of reported errors to avoid spamming output.
    if (errorsCount <= 5) {
      Location location = locs.getLocation(offset);
      errors.add(new SyntaxError(location, String.format(format, args)));
    }
  }

  private void syntaxError(String message) {
    syntaxError(token.start, token.kind, token.value, message);
  }

  private void syntaxError(int offset, TokenKind tokenKind, Object tokenValue, String message) {
    if (!recoveryMode) {
      if (tokenKind == TokenKind.INDENT) {
        reportError(offset, "unexpected indent");
      } else {
        reportError(
            offset, "syntax error at '%s': %s", tokenString(tokenKind, tokenValue), message);
      }
      recoveryMode = true;
    }
  }

  // Consumes the current token and returns its position, like nextToken.
  // Reports a syntax error if the new token is not of the expected kind.
  @CanIgnoreReturnValue
  private int expect(TokenKind kind) {
    if (token.kind != kind) {
      syntaxError("expected " + kind);
    }
    return nextToken();
  }

  // Like expect, but stops recovery mode if the token was expected.
  @CanIgnoreReturnValue
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
   * @return the end offset of the last token consumed.
   */
  private int syncTo(EnumSet<TokenKind> terminatingTokens) {
    // EOF must be in the set to prevent an infinite loop
    Preconditions.checkState(terminatingTokens.contains(TokenKind.EOF));
    // read past the problematic token
    int previous = token.end;
    nextToken();
    while (!terminatingTokens.contains(token.kind)) {
      previous = token.end;
      nextToken();
    }
    return previous;
  }

  // Consumes the current token and returns its start offset.
  @CanIgnoreReturnValue
  private int nextToken() {
    int prev = token.start;
    lexer.nextToken();
    return prev;
  }

  // create an error expression
  private Identifier makeErrorExpression(int start, int end) {
    // It's tempting to define a dedicated BadExpression type,
    // but it is convenient for parseIdent to return an Identifier
    // even when it fails.
    return at(start, new Identifier(lexer.bufferSlice(start, Math.max(start, end))));
  }

  // file_input = ('\n' | stmt)* EOF
  private ImmutableList<Statement> parseFileInput() {
    ImmutableList.Builder<Statement> list = ImmutableList.builder();
    try {
      while (token.kind != TokenKind.EOF) {
        if (token.kind == TokenKind.NEWLINE) {
          expectAndRecover(TokenKind.NEWLINE);
        } else {
          parseStatement(list);
        }
      }
    } catch (StackOverflowError ex) {
      // JVM threads have very limited stack, and deeply nested inputs can
      // easily cause the parser to consume all available stack. It is hard
      // to anticipate all the possible recursions in the parser, especially
      // when considering error recovery.
      //
      // So, for robustness, the parser treats StackOverflowError as a parse
      // error, exhorting the user to report a bug.
      reportError(
          token.end,
          "internal error: stack overflow in Python parser. Please report the bug and include"
              + " the text of %s.\n"
              + "%s",
          locs.file(),
          Throwables.getStackTraceAsString(ex));
    }
    return list.build();
  }

  // simple_stmt = small_stmt (';' small_stmt)* ';'? NEWLINE
  private void parseSimpleStatement(ImmutableList.Builder<Statement> list) {
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
  //                | return_stmt
  //                | flow_stmt
  //                | import_stmt
  //                | del_stmt | global_stmt | nonlocal_stmt | raise_stmt | assert_stmt
  //     assign_stmt = expr ('=' | augassign) expr
  //     augassign = '+=' | '-=' | '*=' | '@=' | '/=' | '%=' | '&=' | '|=' | '^=' | '<<=' | '>>='
  //               | '**=' | '//='
  // Note that these are in Python, but not implemented here (at least for now):
  // '>>' print statements (Python 2), assignment expressions.
  private Statement parseSmallStatement() {
    int start = token.start;
    switch (token.kind) {
      case RETURN:
        return parseReturnStatement();
      case BREAK:
      case CONTINUE:
      case PASS:
        {
          TokenKind kind = token.kind;
          nextToken();
          return at(start, new FlowStatement(kind));
        }
      case IMPORT:
        return parseImportStatement();
      case FROM:
        return parseFromImportStatement();
      case DEL:
        {
          nextToken();
          ImmutableList<Expression> targets = parseTargetList();
          for (Expression target : targets) {
            checkTarget(target, "delete");
          }
          return at(start, new DelStatement(targets));
        }
      case GLOBAL:
      case NONLOCAL:
        {
          TokenKind kind = token.kind;
          nextToken();
          ImmutableList.Builder<Identifier> names = ImmutableList.builder();
          names.add(parseIdent());
          while (token.kind == TokenKind.COMMA) {
            nextToken();
            names.add(parseIdent());
          }
          return at(start, new ScopeStatement(kind, names.build()));
        }
      case RAISE:
        {
          nextToken();
          Expression exception = null;
          Expression cause = null;
          if (!STATEMENT_TERMINATOR_SET.contains(token.kind)) {
            exception = parseTest();
            if (token.kind == TokenKind.FROM) {
              nextToken();
              cause = parseTest();
            }
          }
          return at(start, new RaiseStatement(exception, cause));
        }
      case ASSERT:
        {
          nextToken();
          Expression condition = parseTest();
          Expression message = null;
          if (token.kind == TokenKind.COMMA) {
            nextToken();
            message = parseTest();
          }
          return at(start, new AssertStatement(condition, message));
        }
      default:
        return parseExpressionOrAssignment();
    }
  }

  private Statement parseExpressionOrAssignment() {
    int start = token.start;
    Expression lhs = parseAssignmentValue();

    // lhs: type [= rhs]
    if (token.kind == TokenKind.COLON) {
      nextToken();
      Expression type = parseTest();
      Expression rhs = null;
      if (token.kind == TokenKind.EQUALS) {
        nextToken();
        rhs = parseAssignmentValue();
      }
      checkTarget(lhs, "annotate");
      return at(start, new AssignmentStatement(ImmutableList.of(lhs), null, type, rhs));
    }

    // lhs op= rhs
    TokenKind op = augmentedAssignments.get(token.kind);
    if (op != null) {
      nextToken();
      Expression rhs = parseAssignmentValue();
      if (lhs.kind() == Expression.Kind.LIST_EXPR || lhs.kind() == Expression.Kind.STARRED) {
        reportError(lhs.getStartOffset(), "illegal expression for augmented assignment");
      } else {
        checkTarget(lhs, "assign");
      }
      return at(start, new AssignmentStatement(ImmutableList.of(lhs), op, null, rhs));
    }

    // lhs = [lhs = ...] rhs
    if (token.kind == TokenKind.EQUALS) {
      List<Expression> exprs = new ArrayList<>();
      exprs.add(lhs);
      while (token.kind == TokenKind.EQUALS) {
        nextToken();
        exprs.add(parseAssignmentValue());
      }
      Expression rhs = exprs.remove(exprs.size() - 1);
      for (Expression target : exprs) {
        checkTarget(target, "assign");
      }
      return at(start, new AssignmentStatement(ImmutableList.copyOf(exprs), null, null, rhs));
    }

    return at(start, new ExpressionStatement(lhs));
  }

  // The right-hand side of '=', or an expression statement: a yield or a testlist_star_expr.
  private Expression parseAssignmentValue() {
    return token.kind == TokenKind.YIELD ? parseYield() : parseTestListStarExpr();
  }

  // Reports an error unless expr may appear on the left side of an assignment.
  private void checkTarget(Expression expr, String what) {
    switch (expr.kind()) {
      case IDENTIFIER:
      case DOT:
      case INDEX:
      case SLICE:
        return;
      case LIST_EXPR:
        for (Expression elem : ((ListExpression) expr).getElements()) {
          checkTarget(elem, what);
        }
        return;
      case STARRED:
        checkTarget(((StarredExpression) expr).getValue(), what);
        return;
      default:
        reportError(expr.getStartOffset(), "cannot %s to %s", what, describe(expr));
    }
  }

  private static String describe(Expression expr) {
    switch (expr.kind()) {
      case CALL:
        return "function call";
      case INT_LITERAL:
      case FLOAT_LITERAL:
      case STRING_LITERAL:
      case BYTES_LITERAL:
      case BOOL_LITERAL:
      case NONE_LITERAL:
      case ELLIPSIS:
        return "literal";
      default:
        return "expression";
    }
  }

  // decorated = ('@' test NEWLINE)+ (def_stmt | class_stmt)
  private void parseDecoratedStatement(ImmutableList.Builder<Statement> list) {
    int start = token.start;
    ImmutableList.Builder<Expression> decorators = ImmutableList.builder();
    while (token.kind == TokenKind.AT) {
      nextToken();
      decorators.add(parseTest());
      expectAndRecover(TokenKind.NEWLINE);
    }
    if (token.kind == TokenKind.ASYNC) {
      reportError(token.start, "async syntax is not supported");
      nextToken();
    }
    if (token.kind == TokenKind.DEF) {
      list.add(parseDefStatement(start, decorators.build()));
    } else if (token.kind == TokenKind.CLASS) {
      list.add(parseClassStatement(start, decorators.build()));
    } else {
      syntaxError("expected def or class after decorator");
    }
  }

  // def_stmt = DEF IDENTIFIER '(' parameters ')' ['->' test] ':' suite
  private DefStatement parseDefStatement(int start, ImmutableList<Expression> decorators) {
    expect(TokenKind.DEF);
    Identifier ident = parseIdent();
    expect(TokenKind.LPAREN);
    ImmutableList<Parameter> params = parseParameters(/* defStatement= */ true);
    expect(TokenKind.RPAREN);
    Expression returnType = null;
    if (token.kind == TokenKind.ARROW) {
      nextToken();
      returnType = parseTest();
    }
    expect(TokenKind.COLON);
    ImmutableList<Statement> block = parseSuite();
    return at(start, new DefStatement(decorators, ident, params, returnType, block));
  }

  // class_stmt = CLASS IDENTIFIER ['(' arguments ')'] ':' suite
  private ClassStatement parseClassStatement(int start, ImmutableList<Expression> decorators) {
    expect(TokenKind.CLASS);
    Identifier ident = parseIdent();
    ImmutableList<Argument> bases = ImmutableList.of();
    if (token.kind == TokenKind.LPAREN) {
      nextToken();
      bases = parseArguments();
      expect(TokenKind.RPAREN);
    }
    expect(TokenKind.COLON);
    ImmutableList<Statement> block = parseSuite();
    return at(start, new ClassStatement(decorators, ident, bases, block));
  }

  // Parse a list of function parameters.
  // Validation of parameter ordering and uniqueness is left to the Python compiler.
  private ImmutableList<Parameter> parseParameters(boolean defStatement) {
    boolean hasParam = false;
    ImmutableList.Builder<Parameter> list = ImmutableList.builder();

    while (token.kind != TokenKind.RPAREN
        && token.kind != TokenKind.COLON
        && token.kind != TokenKind.EOF) {
      if (hasParam) {
        expect(TokenKind.COMMA);
        // The list may end with a comma.
        if (token.kind == TokenKind.RPAREN || token.kind == TokenKind.COLON) {
          break;
        }
      }
      Parameter param = parseParameter(defStatement);
      hasParam = true;
      list.add(param);
    }
    return list.build();
  }

  // param = IDENTIFIER [':' test] ['=' test]
  //       | '/'
  //       | '*' [IDENTIFIER [':' test]]
  //       | '**' IDENTIFIER [':' test]
  // Annotations are accepted only in def statements.
  private Parameter parseParameter(boolean defStatement) {
    int start = token.start;
    if (token.kind == TokenKind.SLASH) {
      nextToken();
      return at(start, new Parameter.Slash());
    }
    if (token.kind == TokenKind.STAR_STAR) {
      nextToken();
      Identifier id = parseIdent();
      Expression type = maybeParseAnnotation(defStatement);
      return at(start, new Parameter.StarStar(id, type));
    }
    if (token.kind == TokenKind.STAR) {
      nextToken();
      if (token.kind == TokenKind.IDENTIFIER) {
        Identifier id = parseIdent();
        Expression type = maybeParseAnnotation(defStatement);
        return at(start, new Parameter.Star(id, type));
      }
      return at(start, new Parameter.Star(null, null));
    }
    Identifier id = parseIdent();
    Expression type = maybeParseAnnotation(defStatement);
    if (token.kind == TokenKind.EQUALS) {
      nextToken();
      Expression defaultValue = parseTest();
      return at(start, new Parameter.Optional(id, type, defaultValue));
    }
    return at(start, new Parameter.Mandatory(id, type));
  }

  @Nullable
  private Expression maybeParseAnnotation(boolean allowed) {
    if (allowed && token.kind == TokenKind.COLON) {
      nextToken();
      return parseTest();
    }
    return null;
  }

  // suite is typically what follows a colon (e.g. after def or for).
  // suite = simple_stmt
  //       | NEWLINE INDENT stmt+ OUTDENT
  private ImmutableList<Statement> parseSuite() {
    int start = token.start;
    ImmutableList.Builder<Statement> list = ImmutableList.builder();
    if (token.kind == TokenKind.NEWLINE) {
      expect(TokenKind.NEWLINE);
      if (token.kind != TokenKind.INDENT) {
        reportError(token.start, "expected an indented block");
        return ImmutableList.of(at(start, FlowStatement.pass()));
      }
      expect(TokenKind.INDENT);
      while (token.kind != TokenKind.OUTDENT && token.kind != TokenKind.EOF) {
        parseStatement(list);
      }
      expectAndRecover(TokenKind.OUTDENT);
    } else {
      parseSimpleStatement(list);
    }
    ImmutableList<Statement> block = list.build();
    // Only reachable after an error.
    return block.isEmpty() ? ImmutableList.of(at(start, FlowStatement.pass())) : block;
  }

  // if_stmt = IF test ':' suite [ELIF test ':' suite]* [ELSE ':' suite]?
  // An elif clause is an if statement that forms the whole else block.
  private IfStatement parseIfStatement() {
    int start = nextToken(); // IF or ELIF
    Expression cond = parseTest();
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    ImmutableList<Statement> elseBlock = null;
    if (token.kind == TokenKind.ELIF) {
      elseBlock = ImmutableList.of(parseIfStatement());
    } else {
      elseBlock = parseOptionalElse();
    }
    return at(start, new IfStatement(cond, body, elseBlock));
  }

  @Nullable
  private ImmutableList<Statement> parseOptionalElse() {
    if (token.kind != TokenKind.ELSE) {
      return null;
    }
    nextToken();
    expect(TokenKind.COLON);
    return parseSuite();
  }

  // for_stmt = FOR exprlist IN testlist ':' suite [ELSE ':' suite]
  private ForStatement parseForStatement() {
    int start = expect(TokenKind.FOR);
    Expression vars = parseForLoopVariables();
    checkTarget(vars, "assign");
    expect(TokenKind.IN);
    Expression collection = parseTestListStarExpr();
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    ImmutableList<Statement> elseBlock = parseOptionalElse();
    return at(start, new ForStatement(vars, collection, body, elseBlock));
  }

  // while_stmt = WHILE test ':' suite [ELSE ':' suite]
  private WhileStatement parseWhileStatement() {
    int start = expect(TokenKind.WHILE);
    Expression cond = parseTest();
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    ImmutableList<Statement> elseBlock = parseOptionalElse();
    return at(start, new WhileStatement(cond, body, elseBlock));
  }

  // try_stmt = TRY ':' suite
  //            (except_clause ':' suite)* [ELSE ':' suite] [FINALLY ':' suite]
  // except_clause = EXCEPT [test [AS IDENTIFIER]]
  private TryStatement parseTryStatement() {
    int start = expect(TokenKind.TRY);
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    ImmutableList.Builder<TryStatement.ExceptHandler> handlers = ImmutableList.builder();
    boolean hasHandler = false;
    while (token.kind == TokenKind.EXCEPT) {
      int handlerStart = nextToken();
      if (token.kind == TokenKind.STAR) {
        reportError(token.start, "except* is not supported");
        nextToken();
      }
      Expression type = null;
      Identifier name = null;
      if (token.kind != TokenKind.COLON) {
        type = parseTest();
        if (token.kind == TokenKind.AS) {
          nextToken();
          name = parseIdent();
        }
      }
      expect(TokenKind.COLON);
      ImmutableList<Statement> handlerBody = parseSuite();
      handlers.add(at(handlerStart, new TryStatement.ExceptHandler(type, name, handlerBody)));
      hasHandler = true;
    }
    ImmutableList<Statement> elseBlock = parseOptionalElse();
    ImmutableList<Statement> finallyBlock = null;
    if (token.kind == TokenKind.FINALLY) {
      nextToken();
      expect(TokenKind.COLON);
      finallyBlock = parseSuite();
    }
    if (!hasHandler) {
      if (elseBlock != null) {
        reportError(start, "try statement with else requires an except clause");
        elseBlock = null;
      }
      if (finallyBlock == null) {
        reportError(start, "expected 'except' or 'finally' block");
        finallyBlock = ImmutableList.of(at(start, FlowStatement.pass()));
      }
    }
    return at(start, new TryStatement(body, handlers.build(), elseBlock, finallyBlock));
  }

  // with_stmt = WITH with_item (',' with_item)* ':' suite
  // with_item = test [AS expr]
  private WithStatement parseWithStatement() {
    int start = expect(TokenKind.WITH);
    ImmutableList.Builder<WithStatement.Item> items = ImmutableList.builder();
    do {
      if (token.kind == TokenKind.COMMA) {
        nextToken();
      }
      Expression context = parseTest();
      Expression target = null;
      if (token.kind == TokenKind.AS) {
        nextToken();
        target = parseTest(BITOR_PREC);
        checkTarget(target, "assign");
      }
      items.add(new WithStatement.Item(context, target));
    } while (token.kind == TokenKind.COMMA);
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    return at(start, new WithStatement(items.build(), body));
  }

  // import_stmt = IMPORT dotted_name [AS IDENTIFIER] (',' dotted_name [AS IDENTIFIER])*
  private ImportStatement parseImportStatement() {
    int start = expect(TokenKind.IMPORT);
    ImmutableList.Builder<ImportAlias> aliases = ImmutableList.builder();
    do {
      if (token.kind == TokenKind.COMMA) {
        nextToken();
      }
      String name = parseDottedName();
      String asName = null;
      if (token.kind == TokenKind.AS) {
        nextToken();
        asName = parseName();
      }
      aliases.add(new ImportAlias(name, asName));
    } while (token.kind == TokenKind.COMMA);
    return at(start, new ImportStatement(aliases.build()));
  }

  // from_stmt = FROM ('.'* dotted_name | '.'+) IMPORT ('*' | '(' names ')' | names)
  // names = IDENTIFIER [AS IDENTIFIER] (',' IDENTIFIER [AS IDENTIFIER])* [',']
  private FromImportStatement parseFromImportStatement() {
    int start = expect(TokenKind.FROM);
    int level = 0;
    while (token.kind == TokenKind.DOT || token.kind == TokenKind.ELLIPSIS) {
      level += token.kind == TokenKind.DOT ? 1 : 3;
      nextToken();
    }
    String module = null;
    if (token.kind != TokenKind.IMPORT || level == 0) {
      module = parseDottedName();
    }
    expect(TokenKind.IMPORT);
    if (token.kind == TokenKind.STAR) {
      nextToken();
      return at(start, new FromImportStatement(module, level, ImmutableList.of(), true));
    }
    boolean parenthesized = token.kind == TokenKind.LPAREN;
    if (parenthesized) {
      nextToken();
    }
    ImmutableList.Builder<ImportAlias> aliases = ImmutableList.builder();
    while (true) {
      String name = parseName();
      String asName = null;
      if (token.kind == TokenKind.AS) {
        nextToken();
        asName = parseName();
      }
      aliases.add(new ImportAlias(name, asName));
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
      if (parenthesized && token.kind == TokenKind.RPAREN) {
        break;
      }
      if (!parenthesized && STATEMENT_TERMINATOR_SET.contains(token.kind)) {
        syntaxError("trailing comma not allowed without surrounding parentheses");
        break;
      }
    }
    if (parenthesized) {
      expect(TokenKind.RPAREN);
    }
    return at(start, new FromImportStatement(module, level, aliases.build(), false));
  }

  // dotted_name = IDENTIFIER ('.' IDENTIFIER)*
  private String parseDottedName() {
    StringBuilder name = new StringBuilder(parseName());
    while (token.kind == TokenKind.DOT) {
      nextToken();
      name.append('.').append(parseName());
    }
    return name.toString();
  }

  private String parseName() {
    if (token.kind != TokenKind.IDENTIFIER) {
      expect(TokenKind.IDENTIFIER);
      return "";
    }
    String name = (String) token.value;
    nextToken();
    return name;
  }

  // return_stmt = RETURN [testlist_star_expr]
  private ReturnStatement parseReturnStatement() {
    int returnOffset = expect(TokenKind.RETURN);

    Expression result = null;
    if (!STATEMENT_TERMINATOR_SET.contains(token.kind)) {
      result = parseTestListStarExpr();
    }
    return at(returnOffset, new ReturnStatement(result));
  }

  // yield_expr = YIELD [FROM test | testlist_star_expr]
  private YieldExpression parseYield() {
    int start = expect(TokenKind.YIELD);
    if (token.kind == TokenKind.FROM) {
      nextToken();
      return at(start, new YieldExpression(parseTest(), true));
    }
    Expression value = null;
    if (!YIELD_TERMINATOR_SET.contains(token.kind)) {
      value = parseTestListStarExpr();
    }
    return at(start, new YieldExpression(value, false));
  }

  // ==== Expressions ====

  // Parses every kind of expression, including unparenthesized tuples and starred elements.
  //
  // In Python the corresponding grammar production is called `testlist_star_expr`.
  //
  // In many cases we need to use parseTest() in place of parseTestListStarExpr() to avoid
  // ambiguity, e.g.:
  //
  //   f(x, y)  vs  f((x, y))
  private Expression parseTestListStarExpr() {
    int start = token.start;
    Expression e = parseTestOrStar();
    if (token.kind != TokenKind.COMMA) {
      return e;
    }

    // unparenthesized tuple
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(e);
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (EXPR_LIST_TERMINATOR_SET.contains(token.kind)) {
        break;
      }
      elems.add(parseTestOrStar());
    }
    return at(start, new ListExpression(/* isTuple= */ true, elems.build()));
  }

  private Expression parseTestOrStar() {
    if (token.kind == TokenKind.STAR) {
      int start = nextToken();
      return at(start, new StarredExpression(parseTest(BITOR_PREC)));
    }
    return parseTest();
  }

  // exprlist = (expr | star_expr) (',' (expr | star_expr))* [',']
  private ImmutableList<Expression> parseTargetList() {
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(parseTargetElement());
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (EXPR_LIST_TERMINATOR_SET.contains(token.kind)) {
        break;
      }
      elems.add(parseTargetElement());
    }
    return elems.build();
  }

  private Expression parseTargetElement() {
    if (token.kind == TokenKind.STAR) {
      int start = nextToken();
      return at(start, new StarredExpression(parseTest(BITOR_PREC)));
    }
    return parseTest(BITOR_PREC);
  }

  // Parses the variables of a for loop or comprehension clause. Several variables form a tuple.
  private Expression parseForLoopVariables() {
    int start = token.start;
    boolean trailingComma = false;
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    Expression first = parseTargetElement();
    elems.add(first);
    int count = 1;
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (EXPR_LIST_TERMINATOR_SET.contains(token.kind)) {
        trailingComma = true;
        break;
      }
      elems.add(parseTargetElement());
      count++;
    }
    if (count == 1 && !trailingComma) {
      return first;
    }
    return at(start, new ListExpression(/* isTuple= */ true, elems.build()));
  }

  // Parses any expression except for an unparenthesized tuple.
  //
  // In Python the corresponding grammar production is called `test`.
  private Expression parseTest() {
    int start = token.start;
    if (token.kind == TokenKind.LAMBDA) {
      return parseLambda(/* allowCond= */ true);
    }

    Expression expr = parseTest(0);
    if (token.kind == TokenKind.IF) {
      nextToken();
      Expression condition = parseTest(0);
      if (token.kind == TokenKind.ELSE) {
        nextToken();
        Expression elseClause = parseTest();
        return at(start, new ConditionalExpression(expr, condition, elseClause));
      } else {
        reportError(start, "missing else clause in conditional expression");
        return expr; // Try to recover from error: drop the if and the expression after it. Ouch.
      }
    }
    return expr;
  }

  private Expression parseTest(int prec) {
    if (prec >= operatorPrecedence.size()) {
      return parseFactor();
    }
    if (prec == NOT_PREC) {
      return token.kind == TokenKind.NOT ? parseNotExpression(prec) : parseTest(prec + 1);
    }
    if (prec == COMPARISON_PREC) {
      return parseComparison();
    }
    return parseBinOpExpression(prec);
  }

  // parseLambda parses a lambda expression.
  // The allowCond flag allows the body to be an 'a if b else c' conditional.
  private LambdaExpression parseLambda(boolean allowCond) {
    int start = expect(TokenKind.LAMBDA);
    ImmutableList<Parameter> params = parseParameters(/* defStatement= */ false);
    expect(TokenKind.COLON);
    Expression body = allowCond ? parseTest() : parseTestNoCond();
    return at(start, new LambdaExpression(params, body));
  }

  // parseTestNoCond parses a single-component expression without
  // consuming a trailing 'if expr else expr'.
  private Expression parseTestNoCond() {
    if (token.kind == TokenKind.LAMBDA) {
      return parseLambda(/* allowCond= */ false);
    }
    return parseTest(0);
  }

  // not_expr = 'not' expr
  private Expression parseNotExpression(int prec) {
    int notOffset = expect(TokenKind.NOT);
    Expression x = parseTest(prec);
    return at(notOffset, new UnaryOperatorExpression(TokenKind.NOT, x));
  }

  // binop_expression = expr (op expr)*
  // All the binary operators of a level are left-associative.
  private Expression parseBinOpExpression(int prec) {
    int start = token.start;
    Expression x = parseTest(prec + 1);
    while (operatorPrecedence.get(prec).contains(token.kind)) {
      TokenKind op = token.kind;
      nextToken();
      Expression y = parseTest(prec + 1);
      x = at(start, new BinaryOperatorExpression(x, op, y));
    }
    return x;
  }

  // comparison = expr (comp_op expr)*
  // comp_op = '<' | '>' | '==' | '>=' | '<=' | '!=' | 'in' | 'not' 'in' | 'is' | 'is' 'not'
  private Expression parseComparison() {
    int start = token.start;
    Expression first = parseTest(COMPARISON_PREC + 1);
    ImmutableList.Builder<TokenKind> ops = ImmutableList.builder();
    ImmutableList.Builder<Expression> operands = ImmutableList.builder();
    boolean any = false;
    while (true) {
      TokenKind op;
      if (token.kind == TokenKind.NOT) {
        nextToken();
        expect(TokenKind.IN);
        op = TokenKind.NOT_IN;
      } else if (token.kind == TokenKind.IS) {
        nextToken();
        op = TokenKind.IS;
        if (token.kind == TokenKind.NOT) {
          nextToken();
          op = TokenKind.IS_NOT;
        }
      } else if (operatorPrecedence.get(COMPARISON_PREC).contains(token.kind)) {
        op = token.kind;
        nextToken();
      } else {
        break;
      }
      ops.add(op);
      operands.add(parseTest(COMPARISON_PREC + 1));
      any = true;
    }
    if (!any) {
      return first;
    }
    return at(start, new ComparisonExpression(first, ops.build(), operands.build()));
  }

  // factor = ('+' | '-' | '~') factor | power
  private Expression parseFactor() {
    int start = token.start;
    if (token.kind == TokenKind.MINUS
        || token.kind == TokenKind.PLUS
        || token.kind == TokenKind.TILDE) {
      TokenKind op = token.kind;
      nextToken();
      Expression x = parseFactor();
      return at(start, new UnaryOperatorExpression(op, x));
    }
    if (token.kind == TokenKind.AWAIT) {
      reportError(start, "await is not supported");
      nextToken();
    }
    return parsePower();
  }

  // power = primary_with_suffix ['**' factor]
  // The right operand is a factor, making ** right-associative and binding tighter than a unary
  // operator on its left: -2**2 == -(2**2).
  private Expression parsePower() {
    int start = token.start;
    Expression x = parsePrimaryWithSuffix();
    if (token.kind == TokenKind.STAR_STAR) {
      nextToken();
      Expression y = parseFactor();
      return at(start, new BinaryOperatorExpression(x, TokenKind.STAR_STAR, y));
    }
    return x;
  }

  // primary_with_suffix = primary selector_suffix*
  //                     | primary subscript_suffix*
  //                     | primary call_suffix*
  private Expression parsePrimaryWithSuffix() {
    int start = token.start;
    Expression expr = parsePrimary();
    while (true) {
      if (token.kind == TokenKind.DOT) {
        expr = parseSelectorSuffix(start, expr);
      } else if (token.kind == TokenKind.LBRACKET) {
        expr = parseSubscriptSuffix(start, expr);
      } else if (token.kind == TokenKind.LPAREN) {
        expr = parseCallSuffix(start, expr);
      } else {
        break;
      }
    }
    return expr;
  }

  // selector_suffix = '.' IDENTIFIER
  private Expression parseSelectorSuffix(int start, Expression e) {
    expect(TokenKind.DOT);
    if (token.kind == TokenKind.IDENTIFIER) {
      String field = (String) token.value;
      nextToken();
      return at(start, new DotExpression(e, field));
    }
    syntaxError("expected identifier after dot");
    int end = syncTo(EXPR_TERMINATOR_SET);
    return makeErrorExpression(start, end);
  }

  // call_suffix = '(' arg_list? ')'
  private Expression parseCallSuffix(int start, Expression fn) {
    expect(TokenKind.LPAREN);
    ImmutableList<Argument> args = parseArguments();
    expect(TokenKind.RPAREN);
    return at(start, new CallExpression(fn, args));
  }

  // arg_list = ( (arg ',')* arg ','? )?
  // A sole positional argument may be followed by comprehension clauses, forming a generator.
  private ImmutableList<Argument> parseArguments() {
    boolean hasArgs = false;
    ImmutableList.Builder<Argument> list = ImmutableList.builder();
    while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
      if (hasArgs) {
        expect(TokenKind.COMMA);
        // The list may end with a comma.
        if (token.kind == TokenKind.RPAREN) {
          break;
        }
      }
      int start = token.start;
      Argument arg = parseArgument();
      if (!hasArgs && token.kind == TokenKind.FOR && arg instanceof Argument.Positional) {
        Expression gen =
            parseComprehensionSuffix(start, arg.getValue(), Comprehension.Type.GENERATOR);
        arg = at(start, new Argument.Positional(gen));
      }
      hasArgs = true;
      list.add(arg);
    }
    return list.build();
  }

  // arg = IDENTIFIER '=' test
  //     | test
  //     | '*' test
  //     | '**' test
  private Argument parseArgument() {
    int start = token.start;
    Expression expr;
    // parse **expr
    if (token.kind == TokenKind.STAR_STAR) {
      nextToken();
      expr = parseTest();
      return at(start, new Argument.StarStar(expr));
    }
    // parse *expr
    if (token.kind == TokenKind.STAR) {
      nextToken();
      expr = parseTest();
      return at(start, new Argument.Star(expr));
    }

    expr = parseTest();
    if (token.kind == TokenKind.EQUALS) {
      String name = "_";
      if (expr instanceof Identifier id) {
        name = id.getName();
      } else {
        reportError(start, "keyword argument name must be an identifier");
      }
      nextToken();
      Expression value = parseTest();
      return at(start, new Argument.Keyword(name, value));
    }
    return at(start, new Argument.Positional(expr));
  }

  // subscript_suffix = '[' subscript (',' subscript)* [','] ']'
  // subscript = test | [test] ':' [test] [':' [test]]
  private Expression parseSubscriptSuffix(int start, Expression object) {
    int keyStart = expect(TokenKind.LBRACKET);
    Expression lo = null;
    if (token.kind != TokenKind.COLON) {
      lo = parseTestOrStar();
      if (token.kind == TokenKind.COMMA) {
        // x[a, b]: the key is a tuple
        ImmutableList.Builder<Expression> elems = ImmutableList.builder();
        elems.add(lo);
        while (token.kind == TokenKind.COMMA) {
          nextToken();
          if (token.kind == TokenKind.RBRACKET) {
            break;
          }
          elems.add(parseTestOrStar());
        }
        if (token.kind == TokenKind.COLON) {
          reportError(token.start, "slices inside a subscript tuple are not supported");
        }
        lo = at(keyStart, new ListExpression(/* isTuple= */ true, elems.build()));
      }
      if (token.kind != TokenKind.COLON) {
        expect(TokenKind.RBRACKET);
        return at(start, new IndexExpression(object, lo));
      }
    }

    // slice
    expect(TokenKind.COLON);
    Expression hi = null;
    Expression step = null;
    boolean secondColon = false;
    if (token.kind != TokenKind.COLON && token.kind != TokenKind.RBRACKET) {
      hi = parseTest();
    }
    if (token.kind == TokenKind.COLON) {
      secondColon = true;
      nextToken();
      if (token.kind != TokenKind.RBRACKET) {
        step = parseTest();
      }
    }
    expect(TokenKind.RBRACKET);
    return at(start, new SliceExpression(object, lo, hi, step, secondColon));
  }

  // primary = INTEGER
  //         | FLOAT
  //         | STRING+
  //         | IDENTIFIER
  //         | TRUE | FALSE | NONE | '...'
  //         | list_expression
  //         | '(' ')'                    // a tuple with zero elements
  //         | '(' yield_expr ')'
  //         | '(' expr ')'               // a parenthesized expression
  //         | '(' expr comprehension ')' // a generator
  //         | dict_or_set_expression
  private Expression parsePrimary() {
    int start = token.start;
    switch (token.kind) {
      case INT:
        {
          IntLiteral literal = new IntLiteral((java.math.BigInteger) token.value);
          nextToken();
          return at(start, literal);
        }

      case FLOAT:
        {
          FloatLiteral literal = new FloatLiteral((Double) token.value);
          nextToken();
          return at(start, literal);
        }

      case STRING:
      case BYTES:
      case FSTRING:
        return parseStringLiterals();

      case IDENTIFIER:
        return parseIdent();

      case TRUE:
      case FALSE:
        {
          boolean value = token.kind == TokenKind.TRUE;
          nextToken();
          return at(start, new BoolLiteral(value));
        }

      case NONE:
        nextToken();
        return at(start, new NoneLiteral());

      case ELLIPSIS:
        nextToken();
        return at(start, new Ellipsis());

      case LBRACKET: // e.g. [1, 2]
        return parseListMaker();

      case LBRACE: // e.g. {x: y} or {x}
        return parseDictOrSetExpression();

      case LPAREN:
        {
          nextToken();

          // empty tuple: ()
          if (token.kind == TokenKind.RPAREN) {
            nextToken();
            return at(start, new ListExpression(/* isTuple= */ true, ImmutableList.of()));
          }

          // (yield x)
          if (token.kind == TokenKind.YIELD) {
            Expression y = parseYield();
            expect(TokenKind.RPAREN);
            return y;
          }

          Expression e = parseTestOrStar();

          // parenthesized generator: (e for x in y)
          if (token.kind == TokenKind.FOR) {
            Expression gen = parseComprehensionSuffix(start, e, Comprehension.Type.GENERATOR);
            expect(TokenKind.RPAREN);
            return gen;
          }

          // parenthesized tuple: (e, ...)
          if (token.kind == TokenKind.COMMA) {
            ImmutableList.Builder<Expression> elems = ImmutableList.builder();
            elems.add(e);
            while (token.kind == TokenKind.COMMA) {
              nextToken();
              if (token.kind == TokenKind.RPAREN) {
                break;
              }
              elems.add(parseTestOrStar());
            }
            expect(TokenKind.RPAREN);
            return at(start, new ListExpression(/* isTuple= */ true, elems.build()));
          }

          // parenthesized expression: (e)
          expect(TokenKind.RPAREN);
          return e;
        }

      default:
        {
          syntaxError("expected expression");
          if (token.kind == TokenKind.NEWLINE || token.kind == TokenKind.EOF) {
            return makeErrorExpression(start, start);
          }
          int end = syncTo(EXPR_TERMINATOR_SET);
          return makeErrorExpression(start, end);
        }
    }
  }

  private Identifier parseIdent() {
    if (token.kind != TokenKind.IDENTIFIER) {
      int start = token.start;
      int end = expect(TokenKind.IDENTIFIER);
      return makeErrorExpression(start, end);
    }

    String name = (String) token.value;
    int offset = nextToken();
    return at(offset, new Identifier(name));
  }

  // list_maker = '[' ']'
  //            | '[' expr ']'
  //            | '[' expr expr_list ']'
  //            | '[' expr comprehension_suffix ']'
  private Expression parseListMaker() {
    int start = expect(TokenKind.LBRACKET);
    if (token.kind == TokenKind.RBRACKET) { // empty List
      nextToken();
      return at(start, new ListExpression(/* isTuple= */ false, ImmutableList.of()));
    }

    Expression expression = parseTestOrStar();
    if (token.kind == TokenKind.FOR) {
      // list comprehension
      Expression comp = parseComprehensionSuffix(start, expression, Comprehension.Type.LIST);
      expect(TokenKind.RBRACKET);
      return comp;
    }

    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(expression);
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (token.kind == TokenKind.RBRACKET) {
        break;
      }
      elems.add(parseTestOrStar());
    }
    expect(TokenKind.RBRACKET);
    return at(start, new ListExpression(/* isTuple= */ false, elems.build()));
  }

  // dict_or_set = '{' '}'
  //             | '{' dict_entry (',' dict_entry)* [','] '}'
  //             | '{' dict_entry comprehension_suffix '}'
  //             | '{' elem (',' elem)* [','] '}'
  //             | '{' elem comprehension_suffix '}'
  private Expression parseDictOrSetExpression() {
    int start = expect(TokenKind.LBRACE);
    if (token.kind == TokenKind.RBRACE) { // empty Dict
      nextToken();
      return at(start, new DictExpression(ImmutableList.of()));
    }

    int entryStart = token.start;
    if (token.kind != TokenKind.STAR_STAR) {
      Expression first = parseTestOrStar();
      if (token.kind != TokenKind.COLON) {
        // set display or set comprehension
        if (token.kind == TokenKind.FOR) {
          Expression comp = parseComprehensionSuffix(start, first, Comprehension.Type.SET);
          expect(TokenKind.RBRACE);
          return comp;
        }
        ImmutableList.Builder<Expression> elems = ImmutableList.builder();
        elems.add(first);
        while (token.kind == TokenKind.COMMA) {
          nextToken();
          if (token.kind == TokenKind.RBRACE) {
            break;
          }
          elems.add(parseTestOrStar());
        }
        expect(TokenKind.RBRACE);
        return at(start, new SetExpression(elems.build()));
      }
      nextToken();
      Expression value = parseTest();
      DictExpression.Entry entry = at(entryStart, new DictExpression.Entry(first, value));
      if (token.kind == TokenKind.FOR) {
        Expression comp = parseComprehensionSuffix(start, entry, Comprehension.Type.DICT);
        expect(TokenKind.RBRACE);
        return comp;
      }
      return parseDictEntries(start, entry);
    }
    return parseDictEntries(start, parseDictEntry());
  }

  private Expression parseDictEntries(int start, DictExpression.Entry first) {
    ImmutableList.Builder<DictExpression.Entry> entries = ImmutableList.builder();
    entries.add(first);
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (token.kind == TokenKind.RBRACE) {
        break;
      }
      entries.add(parseDictEntry());
    }
    expect(TokenKind.RBRACE);
    return at(start, new DictExpression(entries.build()));
  }

  // dict_entry = test ':' test | '**' expr
  private DictExpression.Entry parseDictEntry() {
    int start = token.start;
    if (token.kind == TokenKind.STAR_STAR) {
      nextToken();
      Expression value = parseTest(BITOR_PREC);
      return at(start, new DictExpression.Entry(null, value));
    }
    Expression key = parseTest();
    expect(TokenKind.COLON);
    Expression value = parseTest();
    return at(start, new DictExpression.Entry(key, value));
  }

  // comprehension_suffix = (FOR exprlist IN or_test | IF test_nocond)+
  // The caller consumes the closing bracket.
  private Expression parseComprehensionSuffix(int start, Node body, Comprehension.Type type) {
    ImmutableList.Builder<Comprehension.Clause> clauses = ImmutableList.builder();
    while (true) {
      if (token.kind == TokenKind.FOR) {
        int forOffset = nextToken();
        Expression vars = parseForLoopVariables();
        checkTarget(vars, "assign");
        expect(TokenKind.IN);
        // The expression cannot be a ternary expression ('x if y else z') due to
        // conflicts in Python grammar ('if' is used by the comprehension).
        Expression seq = parseTest(0);
        clauses.add(at(forOffset, new Comprehension.For(vars, seq)));
      } else if (token.kind == TokenKind.IF) {
        int ifOffset = nextToken();
        Expression cond = parseTestNoCond();
        clauses.add(at(ifOffset, new Comprehension.If(cond)));
      } else if (token.kind == TokenKind.ASYNC) {
        reportError(token.start, "async comprehensions are not supported");
        nextToken();
      } else {
        break;
      }
    }
    return at(start, new Comprehension(type, body, clauses.build()));
  }

  // ==== String literals ====

  // Parses a sequence of adjacent string, bytes and f-string literals, which Python concatenates.
  // Bytes may not be mixed with the other two.
  private Expression parseStringLiterals() {
    int start = token.start;
    boolean sawStr = false;
    boolean sawBytes = false;
    boolean sawFormat = false;
    StringBuilder text = new StringBuilder();
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    ImmutableList.Builder<FStringExpression.Part> parts = ImmutableList.builder();
    while (token.kind == TokenKind.STRING
        || token.kind == TokenKind.BYTES
        || token.kind == TokenKind.FSTRING) {
      switch (token.kind) {
        case STRING:
          sawStr = true;
          text.append((String) token.value);
          break;
        case BYTES:
          sawBytes = true;
          bytes.writeBytes((byte[]) token.value);
          break;
        default:
          sawFormat = true;
          Lexer.FStringBody body = (Lexer.FStringBody) token.value;
          parseFStringParts(body, 0, /* inSpec= */ false, text, parts);
          break;
      }
      nextToken();
    }
    if (sawBytes) {
      if (sawStr || sawFormat) {
        reportError(start, "cannot mix bytes and nonbytes literals");
      }
      return at(start, new BytesLiteral(bytes.toByteArray()));
    }
    if (!sawFormat) {
      return at(start, new StringLiteral(text.toString()));
    }
    flushText(text, parts);
    return at(start, new FStringExpression(parts.build()));
  }

  private static void flushText(
      StringBuilder text, ImmutableList.Builder<FStringExpression.Part> parts) {
    if (text.length() > 0) {
      parts.add(new FStringExpression.Text(text.toString()));
      text.setLength(0);
    }
  }

  /**
   * Splits the body of an f-string, starting at index i, into decoded text (appended to text) and
   * replacement fields (added to parts, after flushing text). Within a format spec, scanning stops
   * at the first unmatched '}'.
   *
   * @return the index at which scanning stopped
   */
  @CanIgnoreReturnValue
  private int parseFStringParts(
      Lexer.FStringBody fb,
      int i,
      boolean inSpec,
      StringBuilder text,
      ImmutableList.Builder<FStringExpression.Part> parts) {
    String body = fb.body;
    StringBuilder raw = new StringBuilder();
    while (i < body.length()) {
      char c = body.charAt(i);
      if (c == '{') {
        if (!inSpec && i + 1 < body.length() && body.charAt(i + 1) == '{') {
          raw.append('{');
          i += 2;
          continue;
        }
        text.append(decodeFStringText(fb, raw));
        raw.setLength(0);
        i = parseFStringField(fb, i, text, parts);
      } else if (c == '}') {
        if (inSpec) {
          break;
        }
        if (i + 1 < body.length() && body.charAt(i + 1) == '}') {
          raw.append('}');
          i += 2;
          continue;
        }
        reportError(fb.bodyStart + i, "f-string: single '}' is not allowed");
        i++;
      } else if (c == '\\' && i + 1 < body.length()) {
        raw.append(c).append(body.charAt(i + 1));
        i += 2;
      } else {
        raw.append(c);
        i++;
      }
    }
    text.append(decodeFStringText(fb, raw));
    return i;
  }

  private String decodeFStringText(Lexer.FStringBody fb, StringBuilder raw) {
    String s = raw.toString();
    return fb.isRaw ? s.replace("\r\n", "\n") : lexer.unescape(s, false, fb.bodyStart);
  }

  // Parses one replacement field '{' expr ['='] ['!' conv] [':' spec] '}' starting at body[i].
  private int parseFStringField(
      Lexer.FStringBody fb,
      int i,
      StringBuilder text,
      ImmutableList.Builder<FStringExpression.Part> parts) {
    String body = fb.body;
    int exprStart = i + 1;
    int j = scanFieldExpression(body, exprStart);
    if (j >= body.length()) {
      reportError(fb.bodyStart + i, "f-string: expecting '}'");
      return body.length();
    }
    String exprText = body.substring(exprStart, j);
    Expression value;
    if (exprText.isBlank()) {
      reportError(fb.bodyStart + i, "f-string: empty expression not allowed");
      value = at(fb.bodyStart + i, new Identifier(""));
    } else {
      value = parseFieldExpression(fb.bodyStart + i, fb.bodyStart + j);
    }

    // self-documenting expression: f"{x=}" prints "x=" followed by repr(x)
    boolean selfDocumenting = false;
    if (body.charAt(j) == '=') {
      selfDocumenting = true;
      int k = j + 1;
      while (k < body.length() && Character.isWhitespace(body.charAt(k))) {
        k++;
      }
      text.append(body, exprStart, k);
      j = k;
    }

    char conversion = 0;
    if (j < body.length() && body.charAt(j) == '!') {
      if (j + 1 < body.length() && "sra".indexOf(body.charAt(j + 1)) >= 0) {
        conversion = body.charAt(j + 1);
      } else {
        reportError(fb.bodyStart + j, "f-string: invalid conversion character");
      }
      j += 2;
    }

    FStringExpression formatSpec = null;
    if (j < body.length() && body.charAt(j) == ':') {
      int specStart = fb.bodyStart + j;
      StringBuilder specText = new StringBuilder();
      ImmutableList.Builder<FStringExpression.Part> specParts = ImmutableList.builder();
      j = parseFStringParts(fb, j + 1, /* inSpec= */ true, specText, specParts);
      flushText(specText, specParts);
      formatSpec = at(specStart, new FStringExpression(specParts.build()));
    }

    if (selfDocumenting && conversion == 0 && formatSpec == null) {
      conversion = 'r';
    }
    if (j >= body.length() || body.charAt(j) != '}') {
      reportError(fb.bodyStart + Math.min(j, body.length()), "f-string: expecting '}'");
      return body.length();
    }
    flushText(text, parts);
    parts.add(new FStringExpression.Field(value, conversion, formatSpec));
    return j + 1;
  }

  /**
   * Returns the index of the character ending the expression of a replacement field: a '}', '!',
   * ':' or self-documenting '=' outside any brackets or quotes; or body.length() if there is none.
   */
  private static int scanFieldExpression(String body, int from) {
    int depth = 0;
    char quote = 0;
    for (int j = from; j < body.length(); j++) {
      char c = body.charAt(j);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
        continue;
      }
      char next = j + 1 < body.length() ? body.charAt(j + 1) : 0;
      switch (c) {
        case '\'':
        case '"':
          quote = c;
          break;
        case '(':
        case '[':
        case '{':
          depth++;
          break;
        case ')':
        case ']':
          depth--;
          break;
        case '}':
          if (depth == 0) {
            return j;
          }
          depth--;
          break;
        case '!':
          if (depth == 0 && next != '=') {
            return j;
          }
          j++; // skip '!='
          break;
        case ':':
          if (depth == 0) {
            return j;
          }
          break;
        case '<':
        case '>':
          if (next == '=') {
            j++;
          }
          break;
        case '=':
          if (next == '=') {
            j++;
          } else if (depth == 0) {
            return j;
          }
          break;
        default:
          break;
      }
    }
    return body.length();
  }

  /**
   * Parses the expression of a replacement field lying strictly between the given file offsets,
   * which hold its delimiters. The expression is parsed by a sub-parser over a copy of the input
   * in which the delimiters are replaced by parentheses, so that node offsets are file offsets.
   */
  private Expression parseFieldExpression(int open, int close) {
    char[] content = Arrays.copyOf(input.getContent(), close + 1);
    content[open] = '(';
    content[close] = ')';
    ParserInput fieldInput = ParserInput.fromString(new String(content), input.getFile());
    Lexer fieldLexer = new Lexer(fieldInput, errors, open);
    Parser fieldParser = new Parser(fieldLexer, errors, fieldInput);
    Expression e = fieldParser.parseTestListStarExpr();
    if (fieldParser.token.kind != TokenKind.NEWLINE && fieldParser.token.kind != TokenKind.EOF) {
      fieldParser.syntaxError("f-string: expecting '}'");
    }
    return e;
  }
}
