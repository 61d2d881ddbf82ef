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

import static com.google.common.truth.Truth.assertThat;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of tokenization behavior of the {@link Lexer}. */
@RunWith(JUnit4.class)
public final class LexerTest {

  private final List<SyntaxError> errors = new ArrayList<>();

  private Lexer createLexer(String input) {
    errors.clear();
    return new Lexer(ParserInput.fromString(input, "test.py"), errors);
  }

  /**
   * Returns a string containing the names of the tokens and their associated values. (String
   * literals are printed without escaping.)
   */
  private String names(String input) {
    Lexer lexer = createLexer(input);
    StringBuilder buffer = new StringBuilder();
    do {
      lexer.nextToken();
      if (buffer.length() > 0) {
        buffer.append(' ');
      }
      buffer.append(lexer.kind.name());
      if (lexer.value instanceof String || lexer.value instanceof Number) {
        buffer.append('(').append(lexer.value).append(')');
      }
    } while (lexer.kind != TokenKind.EOF);
    return buffer.toString();
  }

  // Returns the value of the first token of input.
  private Object firstValue(String input) {
    Lexer lexer = createLexer(input);
    lexer.nextToken();
    return lexer.value;
  }

  private String lastError() {
    return errors.isEmpty() ? "" : errors.get(errors.size() - 1).message();
  }

  @Test
  public void testBasics() {
    assertThat(names("x = 1 + 2\n"))
        .isEqualTo("IDENTIFIER(x) EQUALS INT(1) PLUS INT(2) NEWLINE EOF");
    assertThat(names("a.b(c, d=e)"))
        .isEqualTo(
            "IDENTIFIER(a) DOT IDENTIFIER(b) LPAREN IDENTIFIER(c) COMMA IDENTIFIER(d) EQUALS"
                + " IDENTIFIER(e) RPAREN NEWLINE EOF");
    assertThat(names("x **= y // z")).isEqualTo(
        "IDENTIFIER(x) STAR_STAR_EQUALS IDENTIFIER(y) SLASH_SLASH IDENTIFIER(z) NEWLINE EOF");
    assertThat(names("a -> b >>= c != d")).isEqualTo(
        "IDENTIFIER(a) ARROW IDENTIFIER(b) GREATER_GREATER_EQUALS IDENTIFIER(c) NOT_EQUALS"
            + " IDENTIFIER(d) NEWLINE EOF");
    assertThat(names("...")).isEqualTo("ELLIPSIS NEWLINE EOF");
    assertThat(errors).isEmpty();
  }

  @Test
  public void testKeywords() {
    assertThat(names("if not x is None: pass"))
        .isEqualTo("IF NOT IDENTIFIER(x) IS NONE COLON PASS NEWLINE EOF");
    assertThat(names("lambda: True or False"))
        .isEqualTo("LAMBDA COLON TRUE OR FALSE NEWLINE EOF");
    // match is a soft keyword, and print is an ordinary name
    assertThat(names("match print")).isEqualTo("IDENTIFIER(match) IDENTIFIER(print) NEWLINE EOF");
  }

  @Test
  public void testIndentation() {
    assertThat(names("if x:\n  y\nz\n"))
        .isEqualTo(
            "IF IDENTIFIER(x) COLON NEWLINE INDENT IDENTIFIER(y) NEWLINE OUTDENT IDENTIFIER(z)"
                + " NEWLINE EOF");
    assertThat(names("if x:\n    if y:\n        z\n"))
        .isEqualTo(
            "IF IDENTIFIER(x) COLON NEWLINE INDENT IF IDENTIFIER(y) COLON NEWLINE INDENT"
                + " IDENTIFIER(z) NEWLINE OUTDENT OUTDENT NEWLINE EOF");
    assertThat(errors).isEmpty();
  }

  @Test
  public void testBlankLinesAndCommentsAreSkipped() {
    assertThat(names("# comment\n\n   \nx # trailing\n\n"))
        .isEqualTo("IDENTIFIER(x) NEWLINE EOF");
  }

  @Test
  public void testShebangIsSkipped() {
    assertThat(names("#!/usr/bin/env python3\nx\n")).isEqualTo("IDENTIFIER(x) NEWLINE EOF");
  }

  @Test
  public void testImplicitLineJoining() {
    assertThat(names("f(1,\n      2)\n"))
        .isEqualTo("IDENTIFIER(f) LPAREN INT(1) COMMA INT(2) RPAREN NEWLINE EOF");
    assertThat(names("x = 1 + \\\n  2\n"))
        .isEqualTo("IDENTIFIER(x) EQUALS INT(1) PLUS INT(2) NEWLINE EOF");
  }

  @Test
  public void testNumbers() {
    assertThat(firstValue("123")).isEqualTo(BigInteger.valueOf(123));
    assertThat(firstValue("1_000")).isEqualTo(BigInteger.valueOf(1000));
    assertThat(firstValue("0xff")).isEqualTo(BigInteger.valueOf(255));
    assertThat(firstValue("0o17")).isEqualTo(BigInteger.valueOf(15));
    assertThat(firstValue("0b101")).isEqualTo(BigInteger.valueOf(5));
    assertThat(firstValue("123456789012345678901234567890"))
        .isEqualTo(new BigInteger("123456789012345678901234567890"));
    assertThat(firstValue("1.5")).isEqualTo(1.5);
    assertThat(firstValue("1e3")).isEqualTo(1000.0);
    assertThat(firstValue(".25")).isEqualTo(0.25);
    assertThat(errors).isEmpty();
  }

  @Test
  public void testStringEscapes() {
    assertThat(firstValue("'a\\tb'")).isEqualTo("a\tb");
    assertThat(firstValue("'\\x41\\u00e9\\U0001F600'")).isEqualTo("A\u00e9\uD83D\uDE00");
    assertThat(firstValue("'\\101'")).isEqualTo("A");
    assertThat(firstValue("\"it's\"")).isEqualTo("it's");
    assertThat(firstValue("'\\d'")).isEqualTo("\\d");
    assertThat(firstValue("r'a\\n'")).isEqualTo("a\\n");
    assertThat(firstValue("'''a\nb'''")).isEqualTo("a\nb");
    assertThat(firstValue("'a\\\nb'")).isEqualTo("ab");
    assertThat(errors).isEmpty();
  }

  @Test
  public void testBytes() {
    assertThat((byte[]) firstValue("b'\\x00\\xffA'")).isEqualTo(new byte[] {0, -1, 'A'});
    assertThat((byte[]) firstValue("rb'\\x'")).isEqualTo(new byte[] {'\\', 'x'});
    assertThat(errors).isEmpty();

    firstValue("b'\u00e9\u0100'");
    assertThat(lastError()).isEqualTo("bytes can only contain ASCII literal characters");
  }

  @Test
  public void testFormatStringBody() {
    Lexer lexer = createLexer("f'a{b}c'");
    lexer.nextToken();
    assertThat(lexer.kind).isEqualTo(TokenKind.FSTRING);
    Lexer.FStringBody body = (Lexer.FStringBody) lexer.value;
    assertThat(body.body).isEqualTo("a{b}c");
    assertThat(body.isRaw).isFalse();
    assertThat(body.bodyStart).isEqualTo(2);
  }

  @Test
  public void testErrors() {
    names("x := 1");
    assertThat(lastError()).isEqualTo("assignment expressions (:=) are not supported");

    names("z = 1j");
    assertThat(lastError()).isEqualTo("complex literals are not supported");

    assertThat(names("z = 2.5J + 1"))
        .isEqualTo("IDENTIFIER(z) EQUALS FLOAT(0.0) PLUS INT(1) NEWLINE EOF");
    assertThat(errors).hasSize(1);
    assertThat(lastError()).isEqualTo("complex literals are not supported");

    names("x)");
    assertThat(lastError()).isEqualTo("unmatched ')'");

    names("'abc");
    assertThat(lastError()).isEqualTo("unclosed string literal");

    names("x = 017");
    assertThat(lastError()).startsWith("invalid octal literal");

    names("x = '\\N{DASH}'");
    assertThat(lastError()).isEqualTo("named unicode escapes (\\N{...}) are not supported");

    names("if x:\n    y\n  z\n");
    assertThat(lastError()).isEqualTo("unindent does not match any outer indentation level");
  }

  @Test
  public void testErrorLocation() {
    names("x = 1\ny = $\n");
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).toString()).isEqualTo("test.py:2:5: invalid character: '$'");
  }
}
