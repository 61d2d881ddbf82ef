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
import net.pyveil.obfuscate.ObfuscationConfig.NoneMode;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.ComparisonExpression;
import net.pyveil.syntax.ConditionalExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.LambdaExpression;
import net.pyveil.syntax.NoneLiteral;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.TokenKind;

/**
 * Replaces {@code None} with {@code 0 if a == b else None}, where a != b, or with {@code (lambda:
 * None)()}.
 */
public final class NoneEncoder extends LiteralPass {

  private static final ImmutableList<NoneMode> LEAF_MODES =
      ImmutableList.of(NoneMode.LAMBDA, NoneMode.IFEXPR);

  private NoneEncoder(PassContext ctx) {
    super(ctx, Counter.NONE);
  }

  public static PyFile apply(PyFile file, PassContext ctx) {
    return new NoneEncoder(ctx).run(file);
  }

  @Override
  ImmutableSet<String> requiredBuiltins() {
    return ImmutableSet.of();
  }

  @Override
  public Expression rewrite(NoneLiteral node) {
    NoneMode mode = ctx.config().noneMode();
    if (mode == NoneMode.MIXED) {
      mode = random.choose(LEAF_MODES);
    }
    changed();
    if (mode == NoneMode.IFEXPR) {
      int a = random.nextInt(10, 999);
      int b = a + random.nextInt(1, 20);
      return new ConditionalExpression(
          intLit(0),
          ComparisonExpression.of(intLit(a), TokenKind.EQUALS_EQUALS, intLit(b)),
          new NoneLiteral());
    }
    return CallExpression.of(LambdaExpression.of(new NoneLiteral()));
  }
}
