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
import net.pyveil.obfuscate.ObfuscationConfig.BoolMode;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.syntax.BinaryOperatorExpression;
import net.pyveil.syntax.BoolLiteral;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.ComparisonExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.TokenKind;

/**
 * Replaces {@code True} and {@code False} with an integer equality that holds or fails ({@code a ==
 * b}), or with {@code bool(l ^ r)} where {@code l ^ r} is 1 or 0.
 */
public final class BoolEncoder extends LiteralPass {

  private static final ImmutableList<BoolMode> LEAF_MODES =
      ImmutableList.of(BoolMode.COMPARE, BoolMode.XOR);

  private BoolEncoder(PassContext ctx) {
    super(ctx, Counter.BOOLS);
  }

  public static PyFile apply(PyFile file, PassContext ctx) {
    return new BoolEncoder(ctx).run(file);
  }

  @Override
  ImmutableSet<String> requiredBuiltins() {
    return ctx.config().boolMode() == BoolMode.COMPARE
        ? ImmutableSet.of()
        : ImmutableSet.of("bool");
  }

  @Override
  public Expression rewrite(BoolLiteral node) {
    BoolMode mode = ctx.config().boolMode();
    if (mode == BoolMode.MIXED) {
      mode = random.choose(LEAF_MODES);
    }
    changed();
    boolean value = node.getValue();
    if (mode == BoolMode.XOR) {
      int left = random.nextInt(10, 10000);
      int right = left ^ (value ? 1 : 0);
      return CallExpression.of(
          "bool", new BinaryOperatorExpression(intLit(left), TokenKind.CARET, intLit(right)));
    }
    int a = random.nextInt(10, 9999);
    int b = value ? a : a + random.nextInt(1, 100);
    return ComparisonExpression.of(intLit(a), TokenKind.EQUALS_EQUALS, intLit(b));
  }
}
