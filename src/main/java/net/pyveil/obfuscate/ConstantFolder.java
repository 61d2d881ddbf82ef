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

package net.pyveil.obfuscate;

import java.math.BigInteger;
import javax.annotation.Nullable;
import net.pyveil.syntax.BinaryOperatorExpression;
import net.pyveil.syntax.BoolLiteral;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.ComparisonExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.IntLiteral;
import net.pyveil.syntax.TokenKind;
import net.pyveil.syntax.UnaryOperatorExpression;

/**
 * Evaluates the integer and boolean expressions that the literal encoders produce. Anything that is
 * not built from literals with the supported operators folds to null.
 */
public final class ConstantFolder {

  // Shifts beyond this are left unevaluated.
  private static final int MAX_SHIFT = 4096;

  private ConstantFolder() {}

  /** Returns the value of an integer expression, or null if it is not constant. */
  @Nullable
  public static BigInteger foldInt(Expression expr) {
    switch (expr.kind()) {
      case INT_LITERAL:
        return ((IntLiteral) expr).getValue();
      case UNARY_OPERATOR:
        {
          UnaryOperatorExpression unary = (UnaryOperatorExpression) expr;
          BigInteger x = foldInt(unary.getX());
          if (x == null) {
            return null;
          }
          return switch (unary.getOperator()) {
            case MINUS -> x.negate();
            case PLUS -> x;
            case TILDE -> x.not();
            default -> null;
          };
        }
      case BINARY_OPERATOR:
        {
          BinaryOperatorExpression binop = (BinaryOperatorExpression) expr;
          BigInteger x = foldInt(binop.getX());
          if (x == null) {
            return null;
          }
          BigInteger y = foldInt(binop.getY());
          if (y == null) {
            return null;
          }
          return apply(x, binop.getOperator(), y);
        }
      default:
        return null;
    }
  }

  @Nullable
  private static BigInteger apply(BigInteger x, TokenKind op, BigInteger y) {
    switch (op) {
      case PLUS:
        return x.add(y);
      case MINUS:
        return x.subtract(y);
      case STAR:
        return x.multiply(y);
      case CARET:
        return x.xor(y);
      case AMPERSAND:
        return x.and(y);
      case PIPE:
        return x.or(y);
      case LESS_LESS:
        return y.signum() < 0 || y.bitLength() > 31 || y.intValue() > MAX_SHIFT
            ? null
            : x.shiftLeft(y.intValue());
      case GREATER_GREATER:
        if (y.signum() < 0) {
          return null;
        }
        if (y.bitLength() > 31) {
          return BigInteger.valueOf(x.signum() < 0 ? -1 : 0);
        }
        return x.shiftRight(y.intValue());
      case SLASH_SLASH:
        return y.signum() == 0 ? null : floorDiv(x, y);
      case PERCENT:
        return y.signum() == 0 ? null : x.subtract(floorDiv(x, y).multiply(y));
      default:
        return null;
    }
  }

  private static BigInteger floorDiv(BigInteger x, BigInteger y) {
    BigInteger[] qr = x.divideAndRemainder(y);
    // Round toward negative infinity, as Python does.
    if (qr[1].signum() != 0 && (qr[1].signum() != y.signum())) {
      return qr[0].subtract(BigInteger.ONE);
    }
    return qr[0];
  }

  /**
   * Returns the truth value of a constant condition, or null if it is not constant. Handles boolean
   * literals, integers, {@code not}, {@code bool(...)} and chains of integer comparisons.
   */
  @Nullable
  public static Boolean foldTruth(Expression expr) {
    if (expr instanceof BoolLiteral bool) {
      return bool.getValue();
    }
    if (expr instanceof UnaryOperatorExpression unary && unary.getOperator() == TokenKind.NOT) {
      Boolean x = foldTruth(unary.getX());
      return x == null ? null : !x;
    }
    if (expr instanceof CallExpression call
        && call.isCallOf("bool")
        && call.getArguments().size() == 1
        && call.hasOnlySimpleArguments()) {
      return foldTruth(call.getArguments().get(0).getValue());
    }
    if (expr instanceof ComparisonExpression cmp) {
      return foldComparison(cmp);
    }
    BigInteger value = foldInt(expr);
    return value == null ? null : value.signum() != 0;
  }

  @Nullable
  private static Boolean foldComparison(ComparisonExpression cmp) {
    BigInteger left = foldInt(cmp.getFirst());
    if (left == null) {
      return null;
    }
    boolean result = true;
    for (int i = 0; i < cmp.getOperators().size(); i++) {
      BigInteger right = foldInt(cmp.getOperands().get(i));
      if (right == null) {
        return null;
      }
      int c = left.compareTo(right);
      Boolean holds =
          switch (cmp.getOperators().get(i)) {
            case EQUALS_EQUALS -> c == 0;
            case NOT_EQUALS -> c != 0;
            case LESS -> c < 0;
            case LESS_EQUALS -> c <= 0;
            case GREATER -> c > 0;
            case GREATER_EQUALS -> c >= 0;
            default -> null;
          };
      if (holds == null) {
        return null;
      }
      result &= holds;
      left = right;
    }
    return result;
  }

  /**
   * Reports whether the condition has the shape of a synthetic dead guard: an equality between two
   * constant integers that differ. Integer encodings of either side are seen through.
   */
  public static boolean isFalseGuard(Expression condition) {
    if (!(condition instanceof ComparisonExpression cmp)
        || cmp.getOperators().size() != 1
        || cmp.getOperators().get(0) != TokenKind.EQUALS_EQUALS) {
      return false;
    }
    BigInteger x = foldInt(cmp.getFirst());
    BigInteger y = foldInt(cmp.getOperands().get(0));
    return x != null && y != null && !x.equals(y);
  }
}
