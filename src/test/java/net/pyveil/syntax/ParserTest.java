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
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of parser behavior. */
@RunWith(JUnit4.class)
public final class ParserTest {

  private static PyFile parseFile(String... lines) throws SyntaxError.Exception {
    return PyFile.parseOrThrow(ParserInput.fromLines(lines));
  }

  private static Statement parseStatement(String... lines) throws SyntaxError.Exception {
    return parseFile(lines).getStatements().get(0);
  }

  private static Expression parseExpression(String... lines) throws SyntaxError.Exception {
    return Expression.parse(ParserInput.fromLines(lines));
  }

  // Parses a file that contains errors and returns the error messages, one per line.
  private static String errorsOf(String... lines) {
    PyFile file = PyFile.parse(ParserInput.fromLines(lines));
    assertThat(file.ok()).isFalse();
    StringBuilder buf = new StringBuilder();
    for (SyntaxError error : file.errors()) {
      buf.append(error.message()).append('\n');
    }
    return buf.toString();
  }

  @Test
  public void testPrecedence() throws Exception {
    BinaryOperatorExpression e = (BinaryOperatorExpression) parseExpression("a + b * c");
    assertThat(e.getOperator()).isEqualTo(TokenKind.PLUS);
    assertThat(e.getY().kind()).isEqualTo(Expression.Kind.BINARY_OPERATOR);

    e = (BinaryOperatorExpression) parseExpression("a or b and c");
    assertThat(e.getOperator()).isEqualTo(TokenKind.OR);

    e = (BinaryOperatorExpression) parseExpression("a | b ^ c & d << e");
    assertThat(e.getOperator()).isEqualTo(TokenKind.PIPE);

    e = (BinaryOperatorExpression) parseExpression("a - b - c");
    assertThat(e.getX().kind()).isEqualTo(Expression.Kind.BINARY_OPERATOR);
    assertThat(e.getY().kind()).isEqualTo(Expression.Kind.IDENTIFIER);
  }

  @Test
  public void testPowerIsRightAssociativeAndBindsTighterThanUnaryMinus() throws Exception {
    UnaryOperatorExpression neg = (UnaryOperatorExpression) parseExpression("-2 ** 2");
    assertThat(neg.getOperator()).isEqualTo(TokenKind.MINUS);
    assertThat(neg.getX().kind()).isEqualTo(Expression.Kind.BINARY_OPERATOR);

    BinaryOperatorExpression pow = (BinaryOperatorExpression) parseExpression("a ** b ** c");
    assertThat(pow.getX().kind()).isEqualTo(Expression.Kind.IDENTIFIER);
    assertThat(pow.getY().kind()).isEqualTo(Expression.Kind.BINARY_OPERATOR);

    pow = (BinaryOperatorExpression) parseExpression("2 ** -1");
    assertThat(pow.getY().kind()).isEqualTo(Expression.Kind.UNARY_OPERATOR);
  }

  @Test
  public void testComparisons() throws Exception {
    ComparisonExpression c = (ComparisonExpression) parseExpression("a < b <= c");
    assertThat(c.getOperators()).containsExactly(TokenKind.LESS, TokenKind.LESS_EQUALS).inOrder();
    assertThat(c.getOperands()).hasSize(2);

    c = (ComparisonExpression) parseExpression("a not in b");
    assertThat(c.getOperators()).containsExactly(TokenKind.NOT_IN);

    c = (ComparisonExpression) parseExpression("a is not None");
    assertThat(c.getOperators()).containsExactly(TokenKind.IS_NOT);

    UnaryOperatorExpression not = (UnaryOperatorExpression) parseExpression("not a == b");
    assertThat(not.getX().kind()).isEqualTo(Expression.Kind.COMPARISON);
  }

  @Test
  public void testLiterals() throws Exception {
    assertThat(((IntLiteral) parseExpression("0x10")).getValue()).isEqualTo(BigInteger.valueOf(16));
    assertThat(((FloatLiteral) parseExpression("2.5")).getValue()).isEqualTo(2.5);
    assertThat(((StringLiteral) parseExpression("'a' \"b\"")).getValue()).isEqualTo("ab");
    assertThat(((BytesLiteral) parseExpression("b'a' b'b'")).getValue())
        .isEqualTo(new byte[] {'a', 'b'});
    assertThat(((BoolLiteral) parseExpression("True")).getValue()).isTrue();
    assertThat(parseExpression("None").kind()).isEqualTo(Expression.Kind.NONE_LITERAL);
    assertThat(parseExpression("...").kind()).isEqualTo(Expression.Kind.ELLIPSIS);
  }

  @Test
  public void testTuplesAndParentheses() throws Exception {
    ListExpression tuple = (ListExpression) parseExpression("a, b,");
    assertThat(tuple.isTuple()).isTrue();
    assertThat(tuple.getElements()).hasSize(2);

    tuple = (ListExpression) parseExpression("()");
    assertThat(tuple.getElements()).isEmpty();

    tuple = (ListExpression) parseExpression("(a,)");
    assertThat(tuple.getElements()).hasSize(1);

    assertThat(parseExpression("(a)").kind()).isEqualTo(Expression.Kind.IDENTIFIER);
  }

  @Test
  public void testCallArguments() throws Exception {
    CallExpression call = (CallExpression) parseExpression("f(a, *b, c=1, **d)");
    assertThat(call.getArguments()).hasSize(4);
    assertThat(call.getArguments().get(0)).isInstanceOf(Argument.Positional.class);
    assertThat(call.getArguments().get(1)).isInstanceOf(Argument.Star.class);
    assertThat(call.getArguments().get(2).getName()).isEqualTo("c");
    assertThat(call.getArguments().get(3)).isInstanceOf(Argument.StarStar.class);

    call = (CallExpression) parseExpression("sum(x for x in y)");
    Comprehension gen = (Comprehension) call.getArguments().get(0).getValue();
    assertThat(gen.getType()).isEqualTo(Comprehension.Type.GENERATOR);
  }

  @Test
  public void testSubscriptsAndSlices() throws Exception {
    IndexExpression index = (IndexExpression) parseExpression("x[1, 2]");
    assertThat(index.getKey().kind()).isEqualTo(Expression.Kind.LIST_EXPR);

    SliceExpression slice = (SliceExpression) parseExpression("x[::2]");
    assertThat(slice.getStart()).isNull();
    assertThat(slice.getStop()).isNull();
    assertThat(slice.hasSecondColon()).isTrue();
    assertThat(slice.getStep()).isNotNull();

    slice = (SliceExpression) parseExpression("x[a:]");
    assertThat(slice.getStart()).isNotNull();
    assertThat(slice.getStop()).isNull();
    assertThat(slice.hasSecondColon()).isFalse();
  }

  @Test
  public void testComprehensions() throws Exception {
    Comprehension comp = (Comprehension) parseExpression("[x for x in y if x for z in x]");
    assertThat(comp.getType()).isEqualTo(Comprehension.Type.LIST);
    assertThat(comp.getClauses()).hasSize(3);

    comp = (Comprehension) parseExpression("{k: v for k, v in d}");
    assertThat(comp.getType()).isEqualTo(Comprehension.Type.DICT);
    assertThat(((Comprehension.For) comp.getClauses().get(0)).getVars().kind())
        .isEqualTo(Expression.Kind.LIST_EXPR);

    comp = (Comprehension) parseExpression("{x for x in y}");
    assertThat(comp.getType()).isEqualTo(Comprehension.Type.SET);
  }

  @Test
  public void testDictAndSetDisplays() throws Exception {
    DictExpression dict = (DictExpression) parseExpression("{'a': 1, **m}");
    assertThat(dict.getEntries()).hasSize(2);
    assertThat(dict.getEntries().get(1).getKey()).isNull();

    assertThat(parseExpression("{}").kind()).isEqualTo(Expression.Kind.DICT_EXPR);
    assertThat(parseExpression("{1, 2}").kind()).isEqualTo(Expression.Kind.SET_EXPR);
  }

  @Test
  public void testFormatString() throws Exception {
    FStringExpression fstring = (FStringExpression) parseExpression("f'a{b!r:>{w}}c'");
    assertThat(fstring.getParts()).hasSize(3);
    FStringExpression.Field field = (FStringExpression.Field) fstring.getParts().get(1);
    assertThat(((Identifier) field.getValue()).getName()).isEqualTo("b");
    assertThat(field.getConversion()).isEqualTo('r');
    assertThat(field.getFormatSpec().getParts()).hasSize(2);
    assertThat(((FStringExpression.Text) fstring.getParts().get(2)).getValue()).isEqualTo("c");
  }

  @Test
  public void testFormatStringFieldExpressions() throws Exception {
    FStringExpression fstring = (FStringExpression) parseExpression("f\"{d['k'] + f(x, y)}\\n\"");
    FStringExpression.Field field = (FStringExpression.Field) fstring.getParts().get(0);
    assertThat(field.getValue().kind()).isEqualTo(Expression.Kind.BINARY_OPERATOR);
    assertThat(((FStringExpression.Text) fstring.getParts().get(1)).getValue()).isEqualTo("\n");

    fstring = (FStringExpression) parseExpression("f'{x=}'");
    assertThat(((FStringExpression.Text) fstring.getParts().get(0)).getValue()).isEqualTo("x=");
    field = (FStringExpression.Field) fstring.getParts().get(1);
    assertThat(field.getConversion()).isEqualTo('r');

    fstring = (FStringExpression) parseExpression("f'{a != b}{{}}'");
    field = (FStringExpression.Field) fstring.getParts().get(0);
    assertThat(field.getValue().kind()).isEqualTo(Expression.Kind.COMPARISON);
    assertThat(((FStringExpression.Text) fstring.getParts().get(1)).getValue()).isEqualTo("{}");
  }

  @Test
  public void testFormatStringFieldLocations() throws Exception {
    PyFile file = parseFile("x = 1", "y = f'ab{x}'");
    AssignmentStatement assign = (AssignmentStatement) file.getStatements().get(1);
    FStringExpression fstring = (FStringExpression) assign.getRHS();
    FStringExpression.Field field = (FStringExpression.Field) fstring.getParts().get(1);
    assertThat(field.getValue().getStartLocation().toString()).isEqualTo("<input>:2:10");
  }

  @Test
  public void testAssignments() throws Exception {
    AssignmentStatement assign = (AssignmentStatement) parseStatement("a = b = 1");
    assertThat(assign.getTargets()).hasSize(2);

    assign = (AssignmentStatement) parseStatement("a, *b = c");
    assertThat(assign.getLHS().kind()).isEqualTo(Expression.Kind.LIST_EXPR);

    assign = (AssignmentStatement) parseStatement("x += 1");
    assertThat(assign.isAugmented()).isTrue();
    assertThat(assign.getOperator()).isEqualTo(TokenKind.PLUS);

    assign = (AssignmentStatement) parseStatement("x: int = 1");
    assertThat(assign.getType()).isNotNull();
    assertThat(assign.getRHS()).isNotNull();

    assign = (AssignmentStatement) parseStatement("x: int");
    assertThat(assign.getRHS()).isNull();

    assign = (AssignmentStatement) parseStatement("x = yield y");
    assertThat(assign.getRHS().kind()).isEqualTo(Expression.Kind.YIELD);
  }

  @Test
  public void testImports() throws Exception {
    ImportStatement imp = (ImportStatement) parseStatement("import os.path, sys as s");
    assertThat(imp.getAliases()).hasSize(2);
    assertThat(imp.getAliases().get(0).getName()).isEqualTo("os.path");
    assertThat(imp.getAliases().get(1).getAsName()).isEqualTo("s");

    FromImportStatement from =
        (FromImportStatement) parseStatement("from ..pkg import (a as b,", "    c,)");
    assertThat(from.getLevel()).isEqualTo(2);
    assertThat(from.getModule()).isEqualTo("pkg");
    assertThat(from.getAliases()).hasSize(2);

    from = (FromImportStatement) parseStatement("from . import x");
    assertThat(from.getModule()).isNull();
    assertThat(from.getLevel()).isEqualTo(1);

    from = (FromImportStatement) parseStatement("from m import *");
    assertThat(from.isStar()).isTrue();
  }

  @Test
  public void testCompoundStatements() throws Exception {
    PyFile file =
        parseFile(
            "@dec",
            "def f(a, b: int = 1, /, *args, c, **kw) -> str:",
            "    '''doc'''",
            "    for i in range(3):",
            "        if i:",
            "            continue",
            "        elif a:",
            "            break",
            "    else:",
            "        pass",
            "    while a:",
            "        a -= 1",
            "    try:",
            "        g()",
            "    except (E1, E2) as e:",
            "        raise X from e",
            "    except:",
            "        pass",
            "    finally:",
            "        del a",
            "    with open(p) as fh, lock:",
            "        return fh",
            "class A(B, metaclass=M):",
            "    x = 1",
            "    def m(self): return self.x");
    assertThat(file.getStatements()).hasSize(2);

    DefStatement def = (DefStatement) file.getStatements().get(0);
    assertThat(def.getDecorators()).hasSize(1);
    assertThat(def.getParameters()).hasSize(6);
    assertThat(def.getReturnType()).isNotNull();
    assertThat(def.getBody()).hasSize(5);

    ForStatement loop = (ForStatement) def.getBody().get(1);
    assertThat(loop.getElseBlock()).isNotNull();
    IfStatement ifStmt = (IfStatement) loop.getBody().get(0);
    assertThat(ifStmt.getElseBlock().get(0)).isInstanceOf(IfStatement.class);

    TryStatement tryStmt = (TryStatement) def.getBody().get(3);
    assertThat(tryStmt.getHandlers()).hasSize(2);
    assertThat(tryStmt.getHandlers().get(0).getName().getName()).isEqualTo("e");
    assertThat(tryStmt.getHandlers().get(1).getType()).isNull();
    assertThat(tryStmt.getFinallyBlock()).hasSize(1);

    WithStatement with = (WithStatement) def.getBody().get(4);
    assertThat(with.getItems()).hasSize(2);
    assertThat(with.getItems().get(1).getTarget()).isNull();

    ClassStatement cls = (ClassStatement) file.getStatements().get(1);
    assertThat(cls.getBases()).hasSize(2);
    assertThat(cls.getBody()).hasSize(2);
  }

  @Test
  public void testSimpleStatementsOnOneLine() throws Exception {
    PyFile file = parseFile("global a, b; nonlocal c; assert x, 'm'; pass;");
    assertThat(file.getStatements()).hasSize(4);
    ScopeStatement global = (ScopeStatement) file.getStatements().get(0);
    assertThat(global.getScopeKind()).isEqualTo(TokenKind.GLOBAL);
    assertThat(global.getNames()).hasSize(2);
  }

  @Test
  public void testLocations() throws Exception {
    PyFile file = parseFile("x = 1", "if y:", "    z()");
    assertThat(file.getStatements().get(0).getStartLocation().toString())
        .isEqualTo("<input>:1:1");
    IfStatement ifStmt = (IfStatement) file.getStatements().get(1);
    assertThat(ifStmt.getStartLocation().line()).isEqualTo(2);
    Statement call = ifStmt.getThenBlock().get(0);
    assertThat(call.getStartLocation().line()).isEqualTo(3);
    assertThat(call.getStartLocation().column()).isEqualTo(5);
  }

  @Test
  public void testSyntaxErrors() {
    assertThat(errorsOf("def f(:", "  pass")).contains("syntax error at ':': expected )");
    assertThat(errorsOf("x = ")).contains("syntax error at 'newline': expected expression");
    assertThat(errorsOf("1 = x")).contains("cannot assign to literal");
    assertThat(errorsOf("f() = 1")).contains("cannot assign to function call");
    assertThat(errorsOf("x, y += 1")).contains("illegal expression for augmented assignment");
    assertThat(errorsOf("if x:", "y")).contains("expected an indented block");
    assertThat(errorsOf("try:", "    x")).contains("expected 'except' or 'finally' block");
    assertThat(errorsOf("b'a' 'b'")).contains("cannot mix bytes and nonbytes literals");
    assertThat(errorsOf("x = 1 if y")).contains("missing else clause in conditional expression");
    assertThat(errorsOf("  x = 1")).contains("unexpected indent");
  }

  @Test
  public void testUnsupportedSyntax() {
    assertThat(errorsOf("async def f():", "    pass")).contains("async syntax is not supported");
    assertThat(errorsOf("def f():", "    await g()")).contains("await is not supported");
    assertThat(errorsOf("x = 1j")).contains("complex literals are not supported");
  }

  @Test
  public void testFormatStringErrors() {
    assertThat(errorsOf("f'{}'")).contains("f-string: empty expression not allowed");
    assertThat(errorsOf("f'}'")).contains("f-string: single '}' is not allowed");
    assertThat(errorsOf("f'{x'")).contains("f-string: expecting '}'");
    assertThat(errorsOf("f'{x!z}'")).contains("f-string: invalid conversion character");
  }

  @Test
  public void testParseOrThrowReportsAllErrors() {
    SyntaxError.Exception ex =
        assertThrows(SyntaxError.Exception.class, () -> parseFile("1 = a", "2 = b"));
    assertThat(ex.errors()).hasSize(2);
    assertThat(ex.getMessage()).isEqualTo("<input>:1:1: cannot assign to literal (and 1 more)");
    assertThat(ex.describe())
        .isEqualTo(
            Joiner.on('\n')
                .join(
                    "<input>:1:1: cannot assign to literal",
                    "<input>:2:1: cannot assign to literal"));
  }

  @Test
  public void testRecoveryAfterError() {
    PyFile file = PyFile.parse(ParserInput.fromLines("x = = 1", "y = 2"));
    assertThat(file.ok()).isFalse();
    assertThat(file.getStatements()).hasSize(2);
  }
}
