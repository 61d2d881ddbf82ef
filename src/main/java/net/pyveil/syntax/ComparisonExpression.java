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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A possibly chained comparison {@code a < b <= c}, which Python evaluates as {@code a < b and b
 * <= c} with {@code b} evaluated once.
 */
public final class ComparisonExpression extends Expression {

  /** The comparison operators. */
  public static final ImmutableSet<TokenKind> OPERATORS =
      ImmutableSet.of(
          TokenKind.EQUALS_EQUALS,
          TokenKind.NOT_EQUALS,
          TokenKind.LESS,
          TokenKind.LESS_EQUALS,
          TokenKind.GREATER,
          TokenKind.GREATER_EQUALS,
          TokenKind.IN,
          TokenKind.NOT_IN,
          TokenKind.IS,
          TokenKind.IS_NOT);

  private final Expression first;
  private final ImmutableList<TokenKind> operators;
  private final ImmutableList<Expression> operands;

  public ComparisonExpression(
      Expression first, ImmutableList<TokenKind> operators, ImmutableList<Expression> operands) {
    super(Kind.COMPARISON);
    Preconditions.checkArgument(!operators.isEmpty() && operators.size() == operands.size());
    Preconditions.checkArgument(OPERATORS.containsAll(operators));
    this.first = Preconditions.checkNotNull(first);
    this.operators = operators;
    this.operands = operands;
  }

  /** Returns the simple comparison {@code x op y}. */
  public static ComparisonExpression of(Expression x, TokenKind op, Expression y) {
    return new ComparisonExpression(x, ImmutableList.of(op), ImmutableList.of(y));
  }

  public Expression getFirst() {
    return first;
  }

  public ImmutableList<TokenKind> getOperators() {
    return operators;
  }

  /** Returns the right-hand operands; operand {@code i} follows operator {@code i}. */
  public ImmutableList<Expression> getOperands() {
    return operands;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
