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
import com.google.common.collect.ImmutableSet;

/**
 * A BinaryOperatorExpression represents a binary operator expression 'x op y', including the
 * short-circuit operators {@code and} and {@code or}. Comparisons are {@link
 * ComparisonExpression}s.
 */
public final class BinaryOperatorExpression extends Expression {

  /** The operators accepted by this node. */
  public static final ImmutableSet<TokenKind> OPERATORS =
      ImmutableSet.of(
          TokenKind.AND,
          TokenKind.OR,
          TokenKind.PIPE,
          TokenKind.CARET,
          TokenKind.AMPERSAND,
          TokenKind.LESS_LESS,
          TokenKind.GREATER_GREATER,
          TokenKind.PLUS,
          TokenKind.MINUS,
          TokenKind.STAR,
          TokenKind.AT,
          TokenKind.SLASH,
          TokenKind.SLASH_SLASH,
          TokenKind.PERCENT,
          TokenKind.STAR_STAR);

  private final Expression x;
  private final TokenKind op;
  private final Expression y;

  public BinaryOperatorExpression(Expression x, TokenKind op, Expression y) {
    super(Kind.BINARY_OPERATOR);
    Preconditions.checkArgument(OPERATORS.contains(op), "not a binary operator: %s", op);
    this.x = Preconditions.checkNotNull(x);
    this.op = op;
    this.y = Preconditions.checkNotNull(y);
  }

  /** Returns the left operand. */
  public Expression getX() {
    return x;
  }

  /** Returns the operator. */
  public TokenKind getOperator() {
    return op;
  }

  /** Returns the right operand. */
  public Expression getY() {
    return y;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
