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

/**
 * Base class for all expression nodes in the AST.
 *
 * <p>The expressions permitted on the left-hand side of an assignment are identifiers, dot
 * expressions, index and slice expressions, list and tuple expressions, and starred expressions
 * inside those.
 */
public abstract class Expression extends Node {

  /**
   * Kind of the expression. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public enum Kind {
    BINARY_OPERATOR,
    BOOL_LITERAL,
    BYTES_LITERAL,
    CALL,
    COMPARISON,
    COMPREHENSION,
    CONDITIONAL,
    DICT_EXPR,
    DOT,
    ELLIPSIS,
    FLOAT_LITERAL,
    FSTRING,
    IDENTIFIER,
    INDEX,
    INT_LITERAL,
    LAMBDA,
    LIST_EXPR,
    NONE_LITERAL,
    SET_EXPR,
    SLICE,
    STARRED,
    STRING_LITERAL,
    UNARY_OPERATOR,
    YIELD,
  }

  // Materialize kind as a field so its accessor can be non-virtual.
  private final Kind kind;

  Expression(Kind kind) {
    this.kind = kind;
  }

  /**
   * Kind of the expression. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public final Kind kind() {
    return kind;
  }

  /** Parses an expression. */
  public static Expression parse(ParserInput input) throws SyntaxError.Exception {
    return Parser.parseExpression(input);
  }
}
