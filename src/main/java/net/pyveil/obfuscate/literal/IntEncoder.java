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

package net.pyveil.obfuscate.literal;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.math.BigInteger;
import net.pyveil.obfuscate.ObfuscationConfig.IntMode;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.syntax.BinaryOperatorExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.IntLiteral;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.TokenKind;

/**
 * Replaces integer literals with arithmetic that evaluates to them:
 *
 * <ul>
 *   <li>xor: {@code (v ^ k) ^ k}, the first operand folded
 *   <li>arith: {@code ((v + k) - k) + 0}, with {@code v + k} folded
 *   <li>split: {@code p + (v - p)}, with {@code v - p} folded
 * </ul>
 */
public final class IntEncoder extends LiteralPass {

  private static final ImmutableList<IntMode> LEAF_MODES =
      ImmutableList.of(IntMode.XOR, IntMode.ARITH, IntMode.SPLIT);

  private IntEncoder(PassContext ctx) {
    super(ctx, Counter.INTS);
  }

  public static PyFile apply(PyFile file, PassContext ctx) {
    return new IntEncoder(ctx).run(file);
  }

  @Override
  ImmutableSet<String> requiredBuiltins() {
    return ImmutableSet.of();
  }

  @Override
  public Expression rewrite(IntLiteral node) {
    IntMode mode = ctx.config().intMode();
    if (mode == IntMode.MIXED) {
      mode = random.choose(LEAF_MODES);
    }
    BigInteger v = node.getValue();
    changed();
    switch (mode) {
      case XOR:
        {
          BigInteger k = BigInteger.valueOf(random.nextInt(1, 1 << 15));
          return new BinaryOperatorExpression(intLit(v.xor(k)), TokenKind.CARET, intLit(k));
        }
      case ARITH:
        {
          BigInteger k = BigInteger.valueOf(random.nextInt(1, 1000));
          Expression diff =
              new BinaryOperatorExpression(intLit(v.add(k)), TokenKind.MINUS, intLit(k));
          return new BinaryOperatorExpression(diff, TokenKind.PLUS, intLit(0));
        }
      case SPLIT:
        {
          BigInteger p = BigInteger.valueOf(random.nextInt(-5000, 5000));
          return new BinaryOperatorExpression(intLit(p), TokenKind.PLUS, intLit(v.subtract(p)));
        }
      case MIXED:
        break;
    }
    throw new IllegalStateException("unresolved int mode: " + mode);
  }
}
