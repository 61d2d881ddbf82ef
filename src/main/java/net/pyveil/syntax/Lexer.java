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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/** A scanner for Python source. */
final class Lexer {

  // --- These fields are accessed directly by the parser: ---

  // Mapping from file offsets to Locations.
  final FileLocations locs;

  // Information about current token. Updated by nextToken.
  // raw and value are defined only for STRING, BYTES, FSTRING, INT, FLOAT and IDENTIFIER.
  TokenKind kind;
  int start; // start offset
  int end; // end offset
  String raw; // source text of token
  Object value; // String, byte[], FStringBody, BigInteger or Double value of token

  // --- end of parser-visible fields ---

  /** The undecoded body of an f-string literal. The parser splits it into text and fields. */
  static final class FStringBody {
    final String body;
    final boolean isRaw;
    final int bodyStart;

    FStringBody(String body, boolean isRaw, int bodyStart) {
      this.body = body;
      this.isRaw = isRaw;
      this.bodyStart = bodyStart;
    }
  }

  private final List<SyntaxError> errors;

  // Input buffer and position
  private final char[] buffer;
  private int pos;

  // The stack of enclosing indentation levels in columns.
  // The first (outermost) element is always zero.
  private final Deque<Integer> indentStack = new ArrayDeque<>();

  // The number of unclosed open-parens ("(", '{', '[') at the current point in
  // the stream. Whitespace is handled differently when this is nonzero.
  private int openParenStackDepth = 0;

  // True after a NEWLINE token. In other words, we are outside an
  // expression and we have to check the indentation.
  private boolean checkIndentation;

  // Number of saved INDENT (>0) or OUTDENT (<0) tokens detected but not yet returned.
  private int dents;

  // Characters that can come immediately prior to an '=' character to generate
  // a different token
  private static final ImmutableMap<Character, TokenKind> EQUAL_TOKENS =
      ImmutableMap.<Character, TokenKind>builder()
          .put('=', TokenKind.EQUALS_EQUALS)
          .put('!', TokenKind.NOT_EQUALS)
          .put('+', TokenKind.PLUS_EQUALS)
          .put('%', TokenKind.PERCENT_EQUALS)
          .put('^', TokenKind.CARET_EQUALS)
          .put('&', TokenKind.AMPERSAND_EQUALS)
          .put('|', TokenKind.PIPE_EQUALS)
          .put('@', TokenKind.AT_EQUALS)
          .build();

  private static final ImmutableSet<String> STRING_PREFIXES =
      ImmutableSet.of("r", "u", "b", "f", "br", "rb", "fr", "rf");

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
    skipShebang();
  }

  // Constructs a lexer that tokenizes a single expression starting at offset start of the input,
  // ignoring indentation. Used for the replacement fields of f-strings.
  Lexer(ParserInput input, List<SyntaxError> errors, int start) {
    this.locs = FileLocations.create(input.getContent(), input.getFile());
    this.buffer = input.getContent();
    this.pos = start;
    this.errors = errors;
    this.checkIndentation = false;
    this.dents = 0;

    indentStack.push(0);
  }

  // A "#!" first line is a comment as far as the grammar is concerned.
  private void skipShebang() {
    if (buffer.length >= 2 && buffer[0] == '#' && buffer[1] == '!') {
      while (pos < buffer.length && buffer[pos] != '\n') {
        pos++;
      }
    }
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

  private void popParen() {
    if (openParenStackDepth == 0) {
      error("unmatched '" + buffer[pos - 1] + "'", pos - 1);
    } else {
      openParenStackDepth--;
    }
  }

  void error(String message, int pos) {
    errors.add(new SyntaxError(locs.getLocation(pos), message));
  }

  private void setToken(TokenKind kind, int start, int end) {
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.value = null;
    this.raw = null;
  }

  // setValue sets the value associated with a literal or IDENTIFIER token,
  // and records the raw text of the token.
  private void setValue(Object value) {
    this.value = value;
    this.raw = bufferSlice(start, end);
  }

  /**
   * Parses an end-of-line sequence, handling statement indentation correctly.
   *
   * <p>UNIX newlines are assumed (LF). Carriage returns are always ignored.
   */
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
        case ' ': case '\t': case '\r': case '\f':
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
      if (c == ' ') {
        indentLen++;
        pos++;
      } else if (c == '\r' || c == '\f') {
        pos++;
      } else if (c == '\t') {
        indentLen = (indentLen / 8 + 1) * 8;
        pos++;
      } else if (c == '\n') { // entirely blank line: discard
        indentLen = 0;
        pos++;
      } else if (c == '#') { // line containing only indented comment
        while (pos < buffer.length && buffer[pos] != '\n') {
          pos++;
        }
        indentLen = 0;
      } else if (c == '\\' && peek(1) == '\n') { // explicit continuation of a blank line
        pos += 2;
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
        error("unindent does not match any outer indentation level", pos - 1);
      }
    }
  }

  /**
   * Returns true if current position is in the middle of a triple quote
   * delimiter (3 x quot), and advances 'pos' by two if so.
   */
  private boolean skipTripleQuote(char quot) {
    if (peek(0) == quot && peek(1) == quot) {
      pos += 2;
      return true;
    } else {
      return false;
    }
  }

  /**
   * Scans a string, bytes or f-string literal delimited by 'quot'.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the first delimiter; 'literalStartPos' is the index of
   * the first prefix character, if any. ON EXIT: 'pos' is 1 + the index of the last delimiter.
   */
  private void stringLiteral(char quot, int literalStartPos, String prefix) {
    boolean isRaw = prefix.indexOf('r') >= 0;
    boolean isBytes = prefix.indexOf('b') >= 0;
    boolean isFormat = prefix.indexOf('f') >= 0;
    boolean inTriplequote = skipTripleQuote(quot);
    int contentStartPos = pos;
    int contentEndPos = -1;

    while (pos < buffer.length) {
      char c = buffer[pos++];
      if (c == '\\') {
        // An escaped character never closes the literal, even in a raw string.
        if (pos < buffer.length) {
          pos++;
        }
      } else if (c == '\n' && !inTriplequote) {
        break;
      } else if (c == quot) {
        if (!inTriplequote) {
          contentEndPos = pos - 1;
          break;
        } else if (skipTripleQuote(quot)) {
          contentEndPos = pos - 3;
          break;
        }
      }
    }

    if (contentEndPos < 0) {
      error("unclosed string literal", literalStartPos);
      contentEndPos = Math.min(pos, buffer.length);
    }
    String body = bufferSlice(contentStartPos, contentEndPos);

    if (isFormat) {
      setToken(TokenKind.FSTRING, literalStartPos, pos);
      setValue(new FStringBody(body, isRaw, contentStartPos));
      return;
    }
    String decoded = isRaw ? body.replace("\r\n", "\n") : unescape(body, isBytes, literalStartPos);
    if (isBytes) {
      byte[] bytes = new byte[decoded.length()];
      for (int i = 0; i < decoded.length(); i++) {
        char c = decoded.charAt(i);
        if (c > 0xff) {
          error("bytes can only contain ASCII literal characters", literalStartPos);
          break;
        }
        bytes[i] = (byte) c;
      }
      setToken(TokenKind.BYTES, literalStartPos, pos);
      setValue(bytes);
    } else {
      setToken(TokenKind.STRING, literalStartPos, pos);
      setValue(decoded);
    }
  }

  /**
   * Decodes the backslash escapes of a literal body. In a bytes literal, {@code \\u}, {@code \\U}
   * and {@code \\N} are not escapes. Unknown escapes are kept verbatim, backslash included.
   */
  String unescape(String body, boolean isBytes, int errorPos) {
    if (body.indexOf('\\') < 0) {
      return body.replace("\r\n", "\n");
    }
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < body.length()) {
      char c = body.charAt(i++);
      if (c == '\r' && i < body.length() && body.charAt(i) == '\n') {
        continue;
      }
      if (c != '\\' || i == body.length()) {
        literal.append(c);
        continue;
      }
      c = body.charAt(i++);
      switch (c) {
        case '\r':
          if (i < body.length() && body.charAt(i) == '\n') {
            i++;
          }
          break;
        case '\n':
          // ignore end of line character
          break;
        case 'n':
          literal.append('\n');
          break;
        case 'r':
          literal.append('\r');
          break;
        case 't':
          literal.append('\t');
          break;
        case 'a':
          literal.append('\u0007');
          break;
        case 'b':
          literal.append('\b');
          break;
        case 'f':
          literal.append('\f');
          break;
        case 'v':
          literal.append('\u000b');
          break;
        case '\\':
        case '\'':
        case '"':
          literal.append(c);
          break;
        case '0': case '1': case '2': case '3':
        case '4': case '5': case '6': case '7':
          { // octal escape
            int octal = c - '0';
            for (int n = 0; n < 2 && i < body.length(); n++) {
              char d = body.charAt(i);
              if (d < '0' || d > '7') {
                break;
              }
              octal = (octal << 3) | (d - '0');
              i++;
            }
            if (isBytes && octal > 0xff) {
              error("octal escape sequence out of range (maximum is \\377)", errorPos);
            }
            literal.append((char) (isBytes ? octal & 0xff : octal));
            break;
          }
        case 'x':
          i = hexEscape(body, i, 2, literal, errorPos);
          break;
        case 'u':
        case 'U':
          if (isBytes) {
            literal.append('\\').append(c);
          } else {
            i = hexEscape(body, i, c == 'u' ? 4 : 8, literal, errorPos);
          }
          break;
        case 'N':
          if (!isBytes) {
            error("named unicode escapes (\\N{...}) are not supported", errorPos);
          }
          literal.append('\\').append(c);
          break;
        default:
          // unknown char escape => "\literal"
          literal.append('\\');
          literal.append(c);
          break;
      }
    }
    return literal.toString();
  }

  // Decodes exactly 'digits' hex digits at body[i:], appending the code point.
  private int hexEscape(String body, int i, int digits, StringBuilder out, int errorPos) {
    if (i + digits > body.length()) {
      error("truncated \\x, \\u or \\U escape", errorPos);
      return body.length();
    }
    int codePoint;
    try {
      codePoint = Integer.parseInt(body.substring(i, i + digits), 16);
    } catch (NumberFormatException ex) {
      error("invalid hex escape: " + body.substring(i, i + digits), errorPos);
      return i + digits;
    }
    if (!Character.isValidCodePoint(codePoint)) {
      error("illegal Unicode character in escape", errorPos);
      return i + digits;
    }
    out.appendCodePoint(codePoint);
    return i + digits;
  }

  private static final ImmutableMap<String, TokenKind> KEYWORDS =
      ImmutableMap.<String, TokenKind>builder()
          .put("False", TokenKind.FALSE)
          .put("None", TokenKind.NONE)
          .put("True", TokenKind.TRUE)
          .put("and", TokenKind.AND)
          .put("as", TokenKind.AS)
          .put("assert", TokenKind.ASSERT)
          .put("async", TokenKind.ASYNC)
          .put("await", TokenKind.AWAIT)
          .put("break", TokenKind.BREAK)
          .put("class", TokenKind.CLASS)
          .put("continue", TokenKind.CONTINUE)
          .put("def", TokenKind.DEF)
          .put("del", TokenKind.DEL)
          .put("elif", TokenKind.ELIF)
          .put("else", TokenKind.ELSE)
          .put("except", TokenKind.EXCEPT)
          .put("finally", TokenKind.FINALLY)
          .put("for", TokenKind.FOR)
          .put("from", TokenKind.FROM)
          .put("global", TokenKind.GLOBAL)
          .put("if", TokenKind.IF)
          .put("import", TokenKind.IMPORT)
          .put("in", TokenKind.IN)
          .put("is", TokenKind.IS)
          .put("lambda", TokenKind.LAMBDA)
          .put("nonlocal", TokenKind.NONLOCAL)
          .put("not", TokenKind.NOT)
          .put("or", TokenKind.OR)
          .put("pass", TokenKind.PASS)
          .put("raise", TokenKind.RAISE)
          .put("return", TokenKind.RETURN)
          .put("try", TokenKind.TRY)
          .put("while", TokenKind.WHILE)
          .put("with", TokenKind.WITH)
          .put("yield", TokenKind.YIELD)
          .buildOrThrow();

  /**
   * Scans an identifier, keyword, or prefixed string literal.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the first char in the identifier.
   * ON EXIT: 'pos' is 1 + the index of the last char in the identifier.
   */
  private void identifierOrKeyword() {
    int oldPos = pos - 1;
    String id = scanIdentifier();
    int c = peek(0);
    if ((c == '\'' || c == '"') && STRING_PREFIXES.contains(Ascii.toLowerCase(id))) {
      pos++;
      stringLiteral((char) c, oldPos, Ascii.toLowerCase(id));
      return;
    }
    TokenKind kind = KEYWORDS.get(id);
    if (kind == null) {
      setToken(TokenKind.IDENTIFIER, oldPos, pos);
      setValue(id);
    } else {
      setToken(kind, oldPos, pos);
    }
  }

  private String scanIdentifier() {
    // Keep consistent with Identifier.isValid.
    int oldPos = pos - 1;
    while (pos < buffer.length && isIdentifierPart(buffer[pos])) {
      pos++;
    }
    return bufferSlice(oldPos, pos);
  }

  static boolean isIdentifierStart(char c) {
    return c == '_' || Character.isLetter(c);
  }

  static boolean isIdentifierPart(char c) {
    return c == '_' || Character.isLetterOrDigit(c);
  }

  /**
   * Tokenizes a two-char operator ending in '='.
   *
   * @return true if it tokenized an operator
   */
  private boolean tokenizeTwoChars() {
    if (pos + 1 >= buffer.length || buffer[pos + 1] != '=') {
      return false;
    }
    TokenKind tok = EQUAL_TOKENS.get(buffer[pos]);
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

  // Consumes a char and returns the next unconsumed char, or -1 for EOF.
  private int next() {
    pos++;
    return peek(0);
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
        case '{':
          setToken(TokenKind.LBRACE, pos - 1, pos);
          openParenStackDepth++;
          break;
        case '}':
          setToken(TokenKind.RBRACE, pos - 1, pos);
          popParen();
          break;
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
          if (peek(0) == '>' && peek(1) == '=') {
            setToken(TokenKind.GREATER_GREATER_EQUALS, pos - 1, pos + 2);
            pos += 2;
          } else if (peek(0) == '>') {
            setToken(TokenKind.GREATER_GREATER, pos - 1, pos + 1);
            pos += 1;
          } else if (peek(0) == '=') {
            setToken(TokenKind.GREATER_EQUALS, pos - 1, pos + 1);
            pos += 1;
          } else {
            setToken(TokenKind.GREATER, pos - 1, pos);
          }
          break;
        case '<':
          if (peek(0) == '<' && peek(1) == '=') {
            setToken(TokenKind.LESS_LESS_EQUALS, pos - 1, pos + 2);
            pos += 2;
          } else if (peek(0) == '<') {
            setToken(TokenKind.LESS_LESS, pos - 1, pos + 1);
            pos += 1;
          } else if (peek(0) == '=') {
            setToken(TokenKind.LESS_EQUALS, pos - 1, pos + 1);
            pos += 1;
          } else {
            setToken(TokenKind.LESS, pos - 1, pos);
          }
          break;
        case ':':
          if (peek(0) == '=') {
            error("assignment expressions (:=) are not supported", pos - 1);
          }
          setToken(TokenKind.COLON, pos - 1, pos);
          break;
        case ',':
          setToken(TokenKind.COMMA, pos - 1, pos);
          break;
        case '+':
          setToken(TokenKind.PLUS, pos - 1, pos);
          break;
        case '-':
          if (peek(0) == '>') {
            setToken(TokenKind.ARROW, pos - 1, pos + 1);
            pos += 1;
          } else if (peek(0) == '=') {
            setToken(TokenKind.MINUS_EQUALS, pos - 1, pos + 1);
            pos += 1;
          } else {
            setToken(TokenKind.MINUS, pos - 1, pos);
          }
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
        case '~':
          setToken(TokenKind.TILDE, pos - 1, pos);
          break;
        case '&':
          setToken(TokenKind.AMPERSAND, pos - 1, pos);
          break;
        case '^':
          setToken(TokenKind.CARET, pos - 1, pos);
          break;
        case '@':
          setToken(TokenKind.AT, pos - 1, pos);
          break;
        case '/':
          if (peek(0) == '/' && peek(1) == '=') {
            setToken(TokenKind.SLASH_SLASH_EQUALS, pos - 1, pos + 2);
            pos += 2;
          } else if (peek(0) == '/') {
            setToken(TokenKind.SLASH_SLASH, pos - 1, pos + 1);
            pos += 1;
          } else if (peek(0) == '=') {
            setToken(TokenKind.SLASH_EQUALS, pos - 1, pos + 1);
            pos += 1;
          } else {
            setToken(TokenKind.SLASH, pos - 1, pos);
          }
          break;
        case ';':
          setToken(TokenKind.SEMI, pos - 1, pos);
          break;
        case '*':
          if (peek(0) == '*' && peek(1) == '=') {
            setToken(TokenKind.STAR_STAR_EQUALS, pos - 1, pos + 2);
            pos += 2;
          } else if (peek(0) == '*') {
            setToken(TokenKind.STAR_STAR, pos - 1, pos + 1);
            pos += 1;
          } else if (peek(0) == '=') {
            setToken(TokenKind.STAR_EQUALS, pos - 1, pos + 1);
            pos += 1;
          } else {
            setToken(TokenKind.STAR, pos - 1, pos);
          }
          break;
        case ' ':
        case '\t':
        case '\r':
        case '\f':
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
            setValue(Character.toString(c));
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
        case '\"':
          stringLiteral(c, pos - 1, "");
          break;
        default:
          // int or float literal, or dot
          if (c == '.' || isdigit(c)) {
            pos--; // unconsume
            scanNumberOrDot(c);
            break;
          }

          if (isIdentifierStart(c)) {
            identifierOrKeyword();
          } else {
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

  // Scans a number (INT or FLOAT), DOT or ELLIPSIS.
  // Precondition: c == peek(0) (a dot or digit)
  private void scanNumberOrDot(int c) {
    int start = this.pos;
    boolean fraction = false;
    boolean exponent = false;

    if (c == '.') {
      if (peek(1) == '.' && peek(2) == '.') {
        pos += 3;
        setToken(TokenKind.ELLIPSIS, start, pos);
        return;
      }
      // dot or start of fraction
      if (!isdigit(peek(1))) {
        pos++; // consume '.'
        setToken(TokenKind.DOT, start, pos);
        return;
      }
      fraction = true;

    } else if (c == '0' && isRadixPrefix(peek(1))) {
      // hex, octal or binary; IntLiteral.scan validates the digits
      next();
      c = next();
      while (isxdigit(c) || c == '_') {
        c = next();
      }

    } else {
      // decimal
      while (isdigit(c) || c == '_') {
        c = next();
      }
      if (c == '.') {
        fraction = true;
      } else if (c == 'e' || c == 'E') {
        exponent = true;
      }
    }

    if (fraction) {
      c = next(); // consume '.'
      while (isdigit(c) || c == '_') {
        c = next();
      }

      if (c == 'e' || c == 'E') {
        exponent = true;
      }
    }

    if (exponent) {
      c = next(); // consume [eE]
      if (c == '+' || c == '-') {
        c = next();
      }
      while (isdigit(c) || c == '_') {
        c = next();
      }
    }

    if (c == 'j' || c == 'J') {
      next();
      error("complex literals are not supported", start);
      // The token stands in for the literal so that parsing can go on.
      if (fraction || exponent) {
        setToken(TokenKind.FLOAT, start, pos);
        setValue(0.0);
      } else {
        setToken(TokenKind.INT, start, pos);
        setValue(BigInteger.ZERO);
      }
      return;
    }

    // float?
    if (fraction || exponent) {
      setToken(TokenKind.FLOAT, start, pos);
      double value = 0.0;
      String literal = bufferSlice(start, pos);
      try {
        if (literal.contains("__") || literal.endsWith("_")) {
          throw new NumberFormatException(literal);
        }
        value = Double.parseDouble(literal.replace("_", ""));
        if (!Double.isFinite(value)) {
          error("floating-point literal too large", start);
        }
      } catch (NumberFormatException ex) {
        error("invalid float literal", start);
      }
      setValue(value);
      return;
    }

    // int
    setToken(TokenKind.INT, start, pos);
    String literal = bufferSlice(start, pos);
    BigInteger value = BigInteger.ZERO;
    try {
      value = IntLiteral.scan(literal);
    } catch (NumberFormatException ex) {
      error(ex.getMessage(), start);
    }
    setValue(value);
  }

  private static boolean isRadixPrefix(int c) {
    return c == 'x' || c == 'X' || c == 'o' || c == 'O' || c == 'b' || c == 'B';
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
