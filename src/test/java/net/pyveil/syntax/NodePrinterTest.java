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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link Node#toString} and {@code NodePrinter}. */
@RunWith(JUnit4.class)
public final class NodePrinterTest {

  private static PyFile parseFile(String... lines) throws SyntaxError.Exception {
    return PyFile.parseOrThrow(ParserInput.fromLines(lines));
  }

  private static Expression parseExpression(String... lines) throws SyntaxError.Exception {
    return Expression.parse(ParserInput.fromLines(lines));
  }

  /** Asserts that the given node's pretty print at a given indent level matches the string. */
  private static void assertPrettyMatches(Node node, int indentLevel, String expected) {
    StringBuilder buf = new StringBuilder();
    new NodePrinter(buf, indentLevel).printNode(node);
    assertThat(buf.toString()).isEqualTo(expected);
  }

  /** Asserts that an expression prints as the given string. */
  private static void assertExprPrettyMatches(String source, String expected)
      throws SyntaxError.Exception {
    assertPrettyMatches(parseExpression(source), 0, expected);
  }

  /** Asserts that an expression prints back as its source. */
  private static void assertExprRoundTrips(String source) throws SyntaxError.Exception {
    assertExprPrettyMatches(source, source);
  }

  /** Asserts that a file prints back as its source, given line by line. */
  private static void assertFileRoundTrips(String... lines) throws SyntaxError.Exception {
    assertThat(parseFile(lines).toString()).isEqualTo(Joiner.on('\n').join(lines) + "\n");
  }

  @Test
  public void binaryOperators() throws Exception {
    assertExprRoundTrips("a + b * c");
    assertExprRoundTrips("(a + b) * c");
    assertExprRoundTrips("a - b - c");
    assertExprRoundTrips("a - (b - c)");
    assertExprRoundTrips("a or b and c");
    assertExprRoundTrips("(a or b) and c");
    assertExprRoundTrips("a | b & c ^ d");
    assertExprRoundTrips("(a | b) << 2");
    assertExprPrettyMatches("((a)) // (b)", "a // b");
    assertExprPrettyMatches("a@b", "a @ b");
  }

  @Test
  public void powerAndUnaryOperators() throws Exception {
    assertExprRoundTrips("-2 ** 2");
    assertExprRoundTrips("(-2) ** 2");
    assertExprRoundTrips("2 ** -1");
    assertExprRoundTrips("a ** b ** c");
    assertExprRoundTrips("(a ** b) ** c");
    assertExprRoundTrips("not a == b");
    assertExprRoundTrips("not (a and b)");
    assertExprRoundTrips("~x + -y");
  }

  @Test
  public void syntheticNegativeLiteralsAreParenthesized() {
    Expression pow =
        new BinaryOperatorExpression(IntLiteral.of(-2), TokenKind.STAR_STAR, IntLiteral.of(2));
    assertThat(pow.toString()).isEqualTo("(-2) ** 2");

    Expression attr = new DotExpression(IntLiteral.of(7), "real");
    assertThat(attr.toString()).isEqualTo("(7).real");
  }

  @Test
  public void comparisonsAndConditionals() throws Exception {
    assertExprRoundTrips("a < b <= c");
    assertExprRoundTrips("a not in b");
    assertExprRoundTrips("a is not None");
    assertExprRoundTrips("(a < b) == c");
    assertExprRoundTrips("x if c else y");
    assertExprRoundTrips("(x if c else y) if d else z");
    assertExprRoundTrips("x if c else y if d else z");
    assertExprRoundTrips("lambda x, y=1: x + y");
    assertExprRoundTrips("lambda: 0");
    assertExprRoundTrips("(lambda: 0)()");
  }

  @Test
  public void collections() throws Exception {
    assertExprRoundTrips("[1, 2, 3]");
    assertExprRoundTrips("(1, 2)");
    assertExprRoundTrips("(1,)");
    assertExprRoundTrips("()");
    assertExprPrettyMatches("a, b", "(a, b)");
    assertExprRoundTrips("{'a': 1, **m}");
    assertExprRoundTrips("{1, 2}");
    assertExprRoundTrips("{}");
    assertExprRoundTrips("[*a, b]");
  }

  @Test
  public void comprehensions() throws Exception {
    assertExprRoundTrips("[x * 2 for x in y if x]");
    assertExprRoundTrips("{k: v for (k, v) in d.items()}");
    assertExprPrettyMatches("{k: v for k, v in d.items()}", "{k: v for (k, v) in d.items()}");
    assertExprRoundTrips("{x for x in y}");
    assertExprRoundTrips("(x for x in y for z in x)");
    assertExprPrettyMatches("sum(x for x in y)", "sum((x for x in y))");
  }

  @Test
  public void callsAndSubscripts() throws Exception {
    assertExprRoundTrips("f(a, *b, c=1, **d)");
    assertExprRoundTrips("a.b.c(d)[e]");
    assertExprRoundTrips("x[1:2]");
    assertExprRoundTrips("x[::2]");
    assertExprRoundTrips("x[a:]");
    assertExprRoundTrips("x[:]");
    assertExprRoundTrips("x[1:2:3]");
    assertExprPrettyMatches("x[1, 2]", "x[(1, 2)]");
    assertExprRoundTrips("(a + b).c");
    assertExprRoundTrips("f(lambda: 0)");
    assertExprRoundTrips("f((yield))");
  }

  @Test
  public void stringLiterals() throws Exception {
    assertExprRoundTrips("'abc'");
    assertExprPrettyMatches("\"abc\"", "'abc'");
    assertExprRoundTrips("\"it's\"");
    assertExprPrettyMatches("'it\\'s \"q\"'", "'it\\'s \"q\"'");
    assertExprRoundTrips("'a\\nb\\tc\\\\'");
    assertExprPrettyMatches("'\\x01\\x7f'", "'\\x01\\x7f'");
    assertExprPrettyMatches("'\\u00e9\\u200b'", "'\u00e9\\u200b'");
    assertExprPrettyMatches("'''multi\nline'''", "'multi\\nline'");
  }

  @Test
  public void bytesLiterals() throws Exception {
    assertExprRoundTrips("b'abc'");
    assertExprRoundTrips("b'\\x00\\xff\\n'");
    assertExprRoundTrips("b\"'\"");
  }

  @Test
  public void floatLiterals() throws Exception {
    assertExprRoundTrips("1.5");
    assertExprPrettyMatches("1.", "1.0");
    assertExprPrettyMatches("1e3", "1000.0");
    assertExprPrettyMatches("1e16", "1e+16");
    assertExprPrettyMatches("1.5e-5", "1.5e-05");
    assertExprRoundTrips("0.0001");
    assertExprRoundTrips("0.1");
    assertExprPrettyMatches("123456789012345678.0", "1.2345678901234568e+17");
    assertThat(NodePrinter.floatRepr(Double.POSITIVE_INFINITY)).isEqualTo("float('inf')");
    assertThat(NodePrinter.floatRepr(-0.0)).isEqualTo("-0.0");
  }

  @Test
  public void formatStrings() throws Exception {
    assertExprRoundTrips("f'a{b!r:>{w}}c'");
    assertExprPrettyMatches("f'{x=}'", "f'x={x!r}'");
    assertExprRoundTrips("f'{{literal}}'");
    assertExprRoundTrips("f\"{d['k']}\"");
    assertExprPrettyMatches("f'{ {1: 2}[1]}'", "f'{ {1: 2}[1]}'");
    assertExprPrettyMatches("'a' f'{b}'", "f'a{b}'");
    assertExprRoundTrips("f'{(lambda: 1)()}'");
    assertExprRoundTrips("f'line\\n{x}'");
  }

  @Test
  public void statements() throws Exception {
    assertFileRoundTrips(
        "import os.path as p, sys",
        "from ..pkg import a as b, c",
        "from . import x",
        "from m import *",
        "x = y = 1",
        "(a, *b) = c",
        "x += 1",
        "x: int = 1",
        "y: str",
        "del a, b[0]",
        "assert x, 'msg'",
        "raise E from e",
        "raise");
  }

  @Test
  public void compoundStatements() throws Exception {
    assertFileRoundTrips(
        "@dec",
        "@other(1)",
        "def f(a, b: int = 1, /, *args, c=2, **kw) -> str:",
        "    global g",
        "    for i in range(3):",
        "        if i:",
        "            continue",
        "        elif a:",
        "            break",
        "        else:",
        "            pass",
        "    else:",
        "        pass",
        "    while a:",
        "        a -= 1",
        "    try:",
        "        g()",
        "    except (E1, E2) as e:",
        "        raise",
        "    except:",
        "        pass",
        "    else:",
        "        x = 1",
        "    finally:",
        "        del a",
        "    with open(p) as fh, lock:",
        "        return fh",
        "    return (yield x)",
        "class A(B, metaclass=M):",
        "    def m(self, *, k):",
        "        nonlocal z",
        "        return lambda *a, **kw: 0",
        "class C:",
        "    pass");
  }

  @Test
  public void elseBlockWithMoreThanAnIfIsNotElif() {
    Statement inner =
        new IfStatement(
            new Identifier("b"), ImmutableList.of(FlowStatement.pass()), /* elseBlock= */ null);
    Statement outer =
        new IfStatement(
            new Identifier("a"),
            ImmutableList.of(FlowStatement.pass()),
            ImmutableList.of(inner, FlowStatement.pass()));
    assertThat(outer.toString())
        .isEqualTo(
            Joiner.on('\n')
                .join("if a:", "    pass", "else:", "    if b:", "        pass", "    pass", ""));
  }

  @Test
  public void indentLevel() throws Exception {
    Statement stmt = parseFile("if x:", "    y").getStatements().get(0);
    assertPrettyMatches(stmt, 1, "    if x:\n        y\n");
  }

  @Test
  public void shebangIsKept() throws Exception {
    assertFileRoundTrips("#!/usr/bin/env python3", "x = 1");
  }
}
