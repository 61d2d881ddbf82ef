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

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;

/**
 * A pretty-printer for Python syntax trees. The output is valid Python that parses back to an
 * equivalent tree: blocks are indented by four spaces and parentheses are inserted only where
 * operator precedence requires them (tuples are always parenthesized).
 */
final class NodePrinter {

  // Precedence levels, loosest first.
  private static final int PREC_YIELD = 0;
  private static final int PREC_LAMBDA = 1;
  private static final int PREC_CONDITIONAL = 2;
  private static final int PREC_OR = 3;
  private static final int PREC_AND = 4;
  private static final int PREC_NOT = 5;
  private static final int PREC_COMPARISON = 6;
  private static final int PREC_BITOR = 7;
  private static final int PREC_BITXOR = 8;
  private static final int PREC_BITAND = 9;
  private static final int PREC_SHIFT = 10;
  private static final int PREC_ARITH = 11;
  private static final int PREC_TERM = 12;
  private static final int PREC_UNARY = 13;
  private static final int PREC_POWER = 14;
  private static final int PREC_ATOM = 15;

  private static final String[] FSTRING_QUOTES = {"'", "\"", "'''", "\"\"\""};

  private final StringBuilder buf;
  private int indent;

  NodePrinter(StringBuilder buf) {
    this(buf, 0);
  }

  NodePrinter(StringBuilder buf, int indent) {
    this.buf = buf;
    this.indent = indent;
  }

  /** Returns the source form of a node. */
  static String print(Node node) {
    StringBuilder buf = new StringBuilder();
    new NodePrinter(buf).printNode(node);
    return buf.toString();
  }

  // Main entry point for an arbitrary node.
  void printNode(Node n) {
    if (n instanceof Expression e) {
      printExpr(e, PREC_YIELD);

    } else if (n instanceof Statement s) {
      printStmt(s);

    } else if (n instanceof PyFile file) {
      if (file.getShebang() != null) {
        buf.append(file.getShebang()).append('\n');
      }
      printBlock(file.getStatements());

    } else if (n instanceof Comprehension.Clause clause) {
      printClause(clause);

    } else if (n instanceof DictExpression.Entry entry) {
      printDictEntry(entry);

    } else if (n instanceof Argument arg) {
      printArgument(arg);

    } else if (n instanceof Parameter param) {
      printParameter(param, /* spaced= */ true);

    } else if (n instanceof TryStatement.ExceptHandler handler) {
      printExceptHandler(handler);

    } else {
      throw new IllegalArgumentException("unexpected: " + n.getClass());
    }
  }

  private void printIndent() {
    for (int i = 0; i < indent; i++) {
      buf.append("    ");
    }
  }

  private void printBlock(List<Statement> block) {
    for (Statement stmt : block) {
      printStmt(stmt);
    }
  }

  private void printSuite(List<Statement> block) {
    buf.append(":\n");
    indent++;
    printBlock(block);
    indent--;
  }

  private void printStmt(Statement s) {
    printIndent();
    switch (s.kind()) {
      case ASSERT:
        {
          AssertStatement stmt = (AssertStatement) s;
          buf.append("assert ");
          printExpr(stmt.getCondition(), PREC_LAMBDA);
          if (stmt.getMessage() != null) {
            buf.append(", ");
            printExpr(stmt.getMessage(), PREC_LAMBDA);
          }
          buf.append('\n');
          break;
        }

      case ASSIGNMENT:
        {
          AssignmentStatement stmt = (AssignmentStatement) s;
          if (stmt.isAugmented()) {
            printExpr(stmt.getLHS(), PREC_LAMBDA);
            buf.append(' ').append(stmt.getOperator()).append("= ");
          } else if (stmt.getType() != null) {
            printExpr(stmt.getLHS(), PREC_LAMBDA);
            buf.append(": ");
            printExpr(stmt.getType(), PREC_LAMBDA);
            if (stmt.getRHS() != null) {
              buf.append(" = ");
            }
          } else {
            for (Expression target : stmt.getTargets()) {
              printExpr(target, PREC_LAMBDA);
              buf.append(" = ");
            }
          }
          if (stmt.getRHS() != null) {
            printExpr(stmt.getRHS(), PREC_YIELD);
          }
          buf.append('\n');
          break;
        }

      case CLASS:
        {
          ClassStatement stmt = (ClassStatement) s;
          printDecorators(stmt.getDecorators());
          buf.append("class ").append(stmt.getIdentifier().getName());
          if (!stmt.getBases().isEmpty()) {
            buf.append('(');
            printArguments(stmt.getBases());
            buf.append(')');
          }
          printSuite(stmt.getBody());
          break;
        }

      case DEF:
        {
          DefStatement stmt = (DefStatement) s;
          printDecorators(stmt.getDecorators());
          buf.append("def ").append(stmt.getIdentifier().getName()).append('(');
          printParameters(stmt.getParameters(), /* spaced= */ true);
          buf.append(')');
          if (stmt.getReturnType() != null) {
            buf.append(" -> ");
            printExpr(stmt.getReturnType(), PREC_LAMBDA);
          }
          printSuite(stmt.getBody());
          break;
        }

      case DEL:
        buf.append("del ");
        printExprList(((DelStatement) s).getTargets(), PREC_BITOR);
        buf.append('\n');
        break;

      case EXPRESSION:
        printExpr(((ExpressionStatement) s).getExpression(), PREC_YIELD);
        buf.append('\n');
        break;

      case FLOW:
        buf.append(((FlowStatement) s).getFlowKind()).append('\n');
        break;

      case FOR:
        {
          ForStatement stmt = (ForStatement) s;
          buf.append("for ");
          printExpr(stmt.getVars(), PREC_BITOR);
          buf.append(" in ");
          printExpr(stmt.getIterable(), PREC_LAMBDA);
          printSuite(stmt.getBody());
          printElse(stmt.getElseBlock());
          break;
        }

      case FROM_IMPORT:
        {
          FromImportStatement stmt = (FromImportStatement) s;
          buf.append("from ");
          buf.append(".".repeat(stmt.getLevel()));
          if (stmt.getModule() != null) {
            buf.append(stmt.getModule());
          }
          buf.append(" import ");
          if (stmt.isStar()) {
            buf.append('*');
          } else {
            printImportAliases(stmt.getAliases());
          }
          buf.append('\n');
          break;
        }

      case IF:
        printIf((IfStatement) s, "if ");
        break;

      case IMPORT:
        buf.append("import ");
        printImportAliases(((ImportStatement) s).getAliases());
        buf.append('\n');
        break;

      case RAISE:
        {
          RaiseStatement stmt = (RaiseStatement) s;
          buf.append("raise");
          if (stmt.getException() != null) {
            buf.append(' ');
            printExpr(stmt.getException(), PREC_LAMBDA);
            if (stmt.getCause() != null) {
              buf.append(" from ");
              printExpr(stmt.getCause(), PREC_LAMBDA);
            }
          }
          buf.append('\n');
          break;
        }

      case RETURN:
        {
          ReturnStatement stmt = (ReturnStatement) s;
          buf.append("return");
          if (stmt.getResult() != null) {
            buf.append(' ');
            printExpr(stmt.getResult(), PREC_LAMBDA);
          }
          buf.append('\n');
          break;
        }

      case SCOPE:
        {
          ScopeStatement stmt = (ScopeStatement) s;
          buf.append(stmt.getScopeKind()).append(' ');
          String sep = "";
          for (Identifier id : stmt.getNames()) {
            buf.append(sep).append(id.getName());
            sep = ", ";
          }
          buf.append('\n');
          break;
        }

      case TRY:
        {
          TryStatement stmt = (TryStatement) s;
          buf.append("try");
          printSuite(stmt.getBody());
          for (TryStatement.ExceptHandler handler : stmt.getHandlers()) {
            printIndent();
            printExceptHandler(handler);
          }
          printElse(stmt.getElseBlock());
          if (stmt.getFinallyBlock() != null) {
            printIndent();
            buf.append("finally");
            printSuite(stmt.getFinallyBlock());
          }
          break;
        }

      case WHILE:
        {
          WhileStatement stmt = (WhileStatement) s;
          buf.append("while ");
          printExpr(stmt.getCondition(), PREC_LAMBDA);
          printSuite(stmt.getBody());
          printElse(stmt.getElseBlock());
          break;
        }

      case WITH:
        {
          WithStatement stmt = (WithStatement) s;
          buf.append("with ");
          String sep = "";
          for (WithStatement.Item item : stmt.getItems()) {
            buf.append(sep);
            printExpr(item.getContext(), PREC_LAMBDA);
            if (item.getTarget() != null) {
              buf.append(" as ");
              printExpr(item.getTarget(), PREC_BITOR);
            }
            sep = ", ";
          }
          printSuite(stmt.getBody());
          break;
        }
    }
  }

  private void printDecorators(List<Expression> decorators) {
    for (Expression decorator : decorators) {
      buf.append('@');
      printExpr(decorator, PREC_LAMBDA);
      buf.append('\n');
      printIndent();
    }
  }

  // An else block consisting of a single if statement prints as elif.
  private void printIf(IfStatement stmt, String keyword) {
    buf.append(keyword);
    printExpr(stmt.getCondition(), PREC_LAMBDA);
    printSuite(stmt.getThenBlock());
    ImmutableList<Statement> elseBlock = stmt.getElseBlock();
    if (elseBlock != null
        && elseBlock.size() == 1
        && elseBlock.get(0) instanceof IfStatement elif) {
      printIndent();
      printIf(elif, "elif ");
    } else {
      printElse(elseBlock);
    }
  }

  private void printElse(List<Statement> elseBlock) {
    if (elseBlock != null) {
      printIndent();
      buf.append("else");
      printSuite(elseBlock);
    }
  }

  private void printExceptHandler(TryStatement.ExceptHandler handler) {
    buf.append("except");
    if (handler.getType() != null) {
      buf.append(' ');
      printExpr(handler.getType(), PREC_LAMBDA);
      if (handler.getName() != null) {
        buf.append(" as ").append(handler.getName().getName());
      }
    }
    printSuite(handler.getBody());
  }

  private void printImportAliases(List<ImportAlias> aliases) {
    String sep = "";
    for (ImportAlias alias : aliases) {
      buf.append(sep).append(alias.getName());
      if (alias.getAsName() != null) {
        buf.append(" as ").append(alias.getAsName());
      }
      sep = ", ";
    }
  }

  private void printParameters(List<Parameter> params, boolean spaced) {
    String sep = "";
    for (Parameter param : params) {
      buf.append(sep);
      printParameter(param, spaced);
      sep = ", ";
    }
  }

  // Annotated parameters put spaces around '=', as PEP 8 asks.
  private void printParameter(Parameter param, boolean spaced) {
    if (param instanceof Parameter.Slash) {
      buf.append('/');
      return;
    }
    if (param instanceof Parameter.Star) {
      buf.append('*');
    } else if (param instanceof Parameter.StarStar) {
      buf.append("**");
    }
    if (param.getName() != null) {
      buf.append(param.getName());
    }
    if (param.getType() != null && spaced) {
      buf.append(": ");
      printExpr(param.getType(), PREC_LAMBDA);
    }
    if (param.getDefaultValue() != null) {
      buf.append(param.getType() != null && spaced ? " = " : "=");
      printExpr(param.getDefaultValue(), PREC_LAMBDA);
    }
  }

  private void printArguments(List<Argument> args) {
    String sep = "";
    for (Argument arg : args) {
      buf.append(sep);
      printArgument(arg);
      sep = ", ";
    }
  }

  private void printArgument(Argument arg) {
    if (arg instanceof Argument.Star) {
      buf.append('*');
    } else if (arg instanceof Argument.StarStar) {
      buf.append("**");
    } else if (arg instanceof Argument.Keyword) {
      buf.append(arg.getName()).append('=');
    }
    printExpr(arg.getValue(), PREC_LAMBDA);
  }

  private void printExprList(List<Expression> list, int prec) {
    String sep = "";
    for (Expression e : list) {
      buf.append(sep);
      printExpr(e, prec);
      sep = ", ";
    }
  }

  private void printDictEntry(DictExpression.Entry entry) {
    if (entry.getKey() == null) {
      buf.append("**");
      printExpr(entry.getValue(), PREC_BITOR);
    } else {
      printExpr(entry.getKey(), PREC_LAMBDA);
      buf.append(": ");
      printExpr(entry.getValue(), PREC_LAMBDA);
    }
  }

  private void printClause(Comprehension.Clause clause) {
    if (clause instanceof Comprehension.For forClause) {
      buf.append("for ");
      printExpr(forClause.getVars(), PREC_BITOR);
      buf.append(" in ");
      printExpr(forClause.getIterable(), PREC_OR);
    } else {
      buf.append("if ");
      printExpr(((Comprehension.If) clause).getCondition(), PREC_OR);
    }
  }

  /** Returns the precedence level of the outermost operator of e. */
  private static int precedence(Expression e) {
    switch (e.kind()) {
      case YIELD:
        return PREC_YIELD;
      case LAMBDA:
      case STARRED:
        return PREC_LAMBDA;
      case CONDITIONAL:
        return PREC_CONDITIONAL;
      case COMPARISON:
        return PREC_COMPARISON;
      case UNARY_OPERATOR:
        return ((UnaryOperatorExpression) e).getOperator() == TokenKind.NOT
            ? PREC_NOT
            : PREC_UNARY;
      case BINARY_OPERATOR:
        return precedence(((BinaryOperatorExpression) e).getOperator());
      case INT_LITERAL:
        return ((IntLiteral) e).getValue().signum() < 0 ? PREC_UNARY : PREC_ATOM;
      case FLOAT_LITERAL:
        {
          double value = ((FloatLiteral) e).getValue();
          return value < 0 || (value == 0 && 1 / value < 0) ? PREC_UNARY : PREC_ATOM;
        }
      default:
        return PREC_ATOM;
    }
  }

  private static int precedence(TokenKind op) {
    switch (op) {
      case OR:
        return PREC_OR;
      case AND:
        return PREC_AND;
      case PIPE:
        return PREC_BITOR;
      case CARET:
        return PREC_BITXOR;
      case AMPERSAND:
        return PREC_BITAND;
      case LESS_LESS:
      case GREATER_GREATER:
        return PREC_SHIFT;
      case PLUS:
      case MINUS:
        return PREC_ARITH;
      case STAR_STAR:
        return PREC_POWER;
      default:
        return PREC_TERM;
    }
  }

  // Prints e, parenthesized if its precedence is looser than minPrec.
  private void printExpr(Expression e, int minPrec) {
    if (precedence(e) < minPrec) {
      buf.append('(');
      printExpr(e, PREC_YIELD);
      buf.append(')');
      return;
    }

    switch (e.kind()) {
      case BINARY_OPERATOR:
        {
          BinaryOperatorExpression binop = (BinaryOperatorExpression) e;
          int prec = precedence(binop.getOperator());
          if (binop.getOperator() == TokenKind.STAR_STAR) {
            // right-associative, and the left operand may not be a unary expression
            printExpr(binop.getX(), PREC_ATOM);
            buf.append(" ** ");
            printExpr(binop.getY(), PREC_UNARY);
          } else {
            printExpr(binop.getX(), prec);
            buf.append(' ').append(binop.getOperator()).append(' ');
            printExpr(binop.getY(), prec + 1);
          }
          break;
        }

      case BOOL_LITERAL:
        buf.append(((BoolLiteral) e).getValue() ? "True" : "False");
        break;

      case BYTES_LITERAL:
        buf.append(bytesRepr(((BytesLiteral) e).getValue()));
        break;

      case CALL:
        {
          CallExpression call = (CallExpression) e;
          printExpr(call.getFunction(), PREC_ATOM);
          buf.append('(');
          printArguments(call.getArguments());
          buf.append(')');
          break;
        }

      case COMPARISON:
        {
          ComparisonExpression comp = (ComparisonExpression) e;
          printExpr(comp.getFirst(), PREC_BITOR);
          for (int i = 0; i < comp.getOperators().size(); i++) {
            buf.append(' ').append(comp.getOperators().get(i)).append(' ');
            printExpr(comp.getOperands().get(i), PREC_BITOR);
          }
          break;
        }

      case COMPREHENSION:
        {
          Comprehension comp = (Comprehension) e;
          String brackets;
          switch (comp.getType()) {
            case LIST:
              brackets = "[]";
              break;
            case GENERATOR:
              brackets = "()";
              break;
            default:
              brackets = "{}";
              break;
          }
          buf.append(brackets.charAt(0));
          if (comp.getBody() instanceof DictExpression.Entry entry) {
            printDictEntry(entry);
          } else {
            printExpr((Expression) comp.getBody(), PREC_LAMBDA);
          }
          for (Comprehension.Clause clause : comp.getClauses()) {
            buf.append(' ');
            printClause(clause);
          }
          buf.append(brackets.charAt(1));
          break;
        }

      case CONDITIONAL:
        {
          ConditionalExpression cond = (ConditionalExpression) e;
          printExpr(cond.getThenCase(), PREC_OR);
          buf.append(" if ");
          printExpr(cond.getCondition(), PREC_OR);
          buf.append(" else ");
          printExpr(cond.getElseCase(), PREC_CONDITIONAL);
          break;
        }

      case DICT_EXPR:
        {
          buf.append('{');
          String sep = "";
          for (DictExpression.Entry entry : ((DictExpression) e).getEntries()) {
            buf.append(sep);
            printDictEntry(entry);
            sep = ", ";
          }
          buf.append('}');
          break;
        }

      case DOT:
        {
          DotExpression dot = (DotExpression) e;
          // 1.real would scan as a float
          if (dot.getObject().kind() == Expression.Kind.INT_LITERAL) {
            buf.append('(');
            printExpr(dot.getObject(), PREC_YIELD);
            buf.append(')');
          } else {
            printExpr(dot.getObject(), PREC_ATOM);
          }
          buf.append('.').append(dot.getField());
          break;
        }

      case ELLIPSIS:
        buf.append("...");
        break;

      case FLOAT_LITERAL:
        buf.append(floatRepr(((FloatLiteral) e).getValue()));
        break;

      case FSTRING:
        printFString((FStringExpression) e);
        break;

      case IDENTIFIER:
        buf.append(((Identifier) e).getName());
        break;

      case INDEX:
        {
          IndexExpression index = (IndexExpression) e;
          printExpr(index.getObject(), PREC_ATOM);
          buf.append('[');
          printExpr(index.getKey(), PREC_LAMBDA);
          buf.append(']');
          break;
        }

      case INT_LITERAL:
        buf.append(((IntLiteral) e).getValue());
        break;

      case LAMBDA:
        {
          LambdaExpression lambda = (LambdaExpression) e;
          buf.append("lambda");
          if (!lambda.getParameters().isEmpty()) {
            buf.append(' ');
            printParameters(lambda.getParameters(), /* spaced= */ false);
          }
          buf.append(": ");
          printExpr(lambda.getBody(), PREC_LAMBDA);
          break;
        }

      case LIST_EXPR:
        {
          ListExpression list = (ListExpression) e;
          buf.append(list.isTuple() ? '(' : '[');
          printExprList(list.getElements(), PREC_LAMBDA);
          if (list.isTuple() && list.getElements().size() == 1) {
            buf.append(',');
          }
          buf.append(list.isTuple() ? ')' : ']');
          break;
        }

      case NONE_LITERAL:
        buf.append("None");
        break;

      case SET_EXPR:
        buf.append('{');
        printExprList(((SetExpression) e).getElements(), PREC_LAMBDA);
        buf.append('}');
        break;

      case SLICE:
        {
          SliceExpression slice = (SliceExpression) e;
          printExpr(slice.getObject(), PREC_ATOM);
          buf.append('[');
          if (slice.getStart() != null) {
            printExpr(slice.getStart(), PREC_LAMBDA);
          }
          buf.append(':');
          if (slice.getStop() != null) {
            printExpr(slice.getStop(), PREC_LAMBDA);
          }
          if (slice.hasSecondColon() || slice.getStep() != null) {
            buf.append(':');
            if (slice.getStep() != null) {
              printExpr(slice.getStep(), PREC_LAMBDA);
            }
          }
          buf.append(']');
          break;
        }

      case STARRED:
        buf.append('*');
        printExpr(((StarredExpression) e).getValue(), PREC_BITOR);
        break;

      case STRING_LITERAL:
        buf.append(repr(((StringLiteral) e).getValue()));
        break;

      case UNARY_OPERATOR:
        {
          UnaryOperatorExpression unop = (UnaryOperatorExpression) e;
          if (unop.getOperator() == TokenKind.NOT) {
            buf.append("not ");
            printExpr(unop.getX(), PREC_NOT);
          } else {
            buf.append(unop.getOperator());
            printExpr(unop.getX(), PREC_UNARY);
          }
          break;
        }

      case YIELD:
        {
          YieldExpression yield = (YieldExpression) e;
          buf.append(yield.isFrom() ? "yield from" : "yield");
          if (yield.getValue() != null) {
            buf.append(' ');
            printExpr(yield.getValue(), PREC_LAMBDA);
          }
          break;
        }
    }
  }

  // ==== f-strings ====

  // Field expressions may not contain the enclosing quote, so the quote is chosen after the
  // fields are printed.
  private void printFString(FStringExpression fstring) {
    StringBuilder fields = new StringBuilder();
    collectFieldSources(fstring, fields);
    String quote = FSTRING_QUOTES[0];
    for (String q : FSTRING_QUOTES) {
      if (!fields.toString().contains(q)) {
        quote = q;
        break;
      }
    }
    buf.append('f').append(quote);
    printFStringParts(fstring, quote.charAt(0));
    buf.append(quote);
  }

  private static void collectFieldSources(FStringExpression fstring, StringBuilder out) {
    for (FStringExpression.Part part : fstring.getParts()) {
      if (part instanceof FStringExpression.Field field) {
        out.append(print(field.getValue())).append('\n');
        if (field.getFormatSpec() != null) {
          collectFieldSources(field.getFormatSpec(), out);
        }
      }
    }
  }

  private void printFStringParts(FStringExpression fstring, char quote) {
    for (FStringExpression.Part part : fstring.getParts()) {
      if (part instanceof FStringExpression.Text text) {
        String escaped = escape(text.getValue(), quote);
        buf.append(escaped.replace("{", "{{").replace("}", "}}"));
      } else {
        FStringExpression.Field field = (FStringExpression.Field) part;
        String source = print(field.getValue());
        buf.append('{');
        // '{{' would be read as an escaped brace
        if (source.startsWith("{")) {
          buf.append(' ');
        }
        // a lambda's colon would start the format spec
        if (precedence(field.getValue()) < PREC_CONDITIONAL) {
          buf.append('(').append(source).append(')');
        } else {
          buf.append(source);
        }
        if (field.getConversion() != 0) {
          buf.append('!').append(field.getConversion());
        }
        if (field.getFormatSpec() != null) {
          buf.append(':');
          printFStringParts(field.getFormatSpec(), quote);
        }
        buf.append('}');
      }
    }
  }

  // ==== literal spelling ====

  /** Returns the Python {@code repr} of a string: quoted, with non-printable chars escaped. */
  static String repr(String s) {
    char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
    return quote + escape(s, quote) + quote;
  }

  private static String escape(String s, char quote) {
    StringBuilder out = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); ) {
      int c = s.codePointAt(i);
      i += Character.charCount(c);
      if (c == quote || c == '\\') {
        out.append('\\').appendCodePoint(c);
      } else if (c == '\t') {
        out.append("\\t");
      } else if (c == '\n') {
        out.append("\\n");
      } else if (c == '\r') {
        out.append("\\r");
      } else if (c < ' ' || c == 0x7f) {
        out.append(String.format("\\x%02x", c));
      } else if (c < 0x7f || isPrintable(c)) {
        out.appendCodePoint(c);
      } else if (c <= 0xff) {
        out.append(String.format("\\x%02x", c));
      } else if (c <= 0xffff) {
        out.append(String.format("\\u%04x", c));
      } else {
        out.append(String.format("\\U%08x", c));
      }
    }
    return out.toString();
  }

  // Follows Python's str.isprintable.
  private static boolean isPrintable(int c) {
    switch (Character.getType(c)) {
      case Character.CONTROL:
      case Character.FORMAT:
      case Character.SURROGATE:
      case Character.PRIVATE_USE:
      case Character.UNASSIGNED:
      case Character.LINE_SEPARATOR:
      case Character.PARAGRAPH_SEPARATOR:
      case Character.SPACE_SEPARATOR:
        return false;
      default:
        return true;
    }
  }

  /** Returns the Python {@code repr} of a bytes value. */
  static String bytesRepr(byte[] bytes) {
    boolean hasSingle = false;
    boolean hasDouble = false;
    for (byte b : bytes) {
      hasSingle |= b == '\'';
      hasDouble |= b == '"';
    }
    char quote = hasSingle && !hasDouble ? '"' : '\'';
    StringBuilder out = new StringBuilder(bytes.length + 3);
    out.append('b').append(quote);
    for (byte b : bytes) {
      int c = b & 0xff;
      if (c == quote || c == '\\') {
        out.append('\\').append((char) c);
      } else if (c == '\t') {
        out.append("\\t");
      } else if (c == '\n') {
        out.append("\\n");
      } else if (c == '\r') {
        out.append("\\r");
      } else if (c < ' ' || c >= 0x7f) {
        out.append(String.format("\\x%02x", c));
      } else {
        out.append((char) c);
      }
    }
    return out.append(quote).toString();
  }

  /**
   * Returns the Python {@code repr} of a float: the shortest digits that round-trip, in
   * positional notation when the decimal exponent is in [-4, 16) and in scientific notation
   * otherwise. Infinities and NaN, which have no literal form, print as {@code float('...')}
   * calls.
   */
  static String floatRepr(double d) {
    if (Double.isNaN(d)) {
      return "float('nan')";
    }
    if (Double.isInfinite(d)) {
      return d > 0 ? "float('inf')" : "float('-inf')";
    }
    if (d == 0) {
      return 1 / d < 0 ? "-0.0" : "0.0";
    }
    BigDecimal dec = new BigDecimal(Double.toString(Math.abs(d))).stripTrailingZeros();
    String digits = dec.unscaledValue().toString();
    int exp = digits.length() - dec.scale() - 1;
    StringBuilder out = new StringBuilder();
    if (d < 0) {
      out.append('-');
    }
    if (exp >= -4 && exp < 16) {
      if (exp < 0) {
        out.append("0.").append("0".repeat(-exp - 1)).append(digits);
      } else if (digits.length() <= exp + 1) {
        out.append(digits).append("0".repeat(exp + 1 - digits.length())).append(".0");
      } else {
        out.append(digits, 0, exp + 1).append('.').append(digits, exp + 1, digits.length());
      }
    } else {
      out.append(digits.charAt(0));
      if (digits.length() > 1) {
        out.append('.').append(digits, 1, digits.length());
      }
      out.append('e').append(exp < 0 ? '-' : '+');
      int abs = Math.abs(exp);
      if (abs < 10) {
        out.append('0');
      }
      out.append(abs);
    }
    return out.toString();
  }
}
