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
import net.pyveil.obfuscate.ObfuscationConfig.FloatMode;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.DotExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.FloatLiteral;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.IndexExpression;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.StringLiteral;

/**
 * Replaces float literals with {@code float.fromhex('...')} or with an unpack of their IEEE 754
 * bytes through the {@code struct} module. NaN and infinities are left alone.
 */
public final class FloatEncoder extends LiteralPass {

  private static final ImmutableList<FloatMode> LEAF_MODES =
      ImmutableList.of(FloatMode.HEX, FloatMode.STRUCT);

  private FloatEncoder(PassContext ctx) {
    super(ctx, Counter.FLOATS);
  }

  public static PyFile apply(PyFile file, PassContext ctx) {
    return new FloatEncoder(ctx).run(file);
  }

  @Override
  ImmutableSet<String> requiredBuiltins() {
    switch (ctx.config().floatMode()) {
      case HEX:
        return ImmutableSet.of("float");
      case STRUCT:
        return ImmutableSet.of("__import__", "bytes");
      case MIXED:
        break;
    }
    return ImmutableSet.of("float", "__import__", "bytes");
  }

  @Override
  public Expression rewrite(FloatLiteral node) {
    double value = node.getValue();
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return node;
    }
    FloatMode mode = ctx.config().floatMode();
    if (mode == FloatMode.MIXED) {
      mode = random.choose(LEAF_MODES);
    }
    changed();
    if (mode == FloatMode.STRUCT) {
      // __import__('struct').unpack('!d', bytes.fromhex('...'))[0]
      Expression module = CallExpression.of("__import__", new StringLiteral("struct"));
      Expression bytes =
          CallExpression.of(
              new DotExpression(new Identifier("bytes"), "fromhex"),
              new StringLiteral(String.format("%016x", Double.doubleToRawLongBits(value))));
      Expression unpack =
          CallExpression.of(
              new DotExpression(module, "unpack"), new StringLiteral("!d"), bytes);
      return new IndexExpression(unpack, intLit(0));
    }
    return CallExpression.of(
        new DotExpression(new Identifier("float"), "fromhex"), new StringLiteral(toHex(value)));
  }

  /** Returns the spelling of Python's {@code float.hex}, such as {@code 0x1.8000000000000p+1}. */
  static String toHex(double value) {
    long bits = Double.doubleToRawLongBits(value);
    String sign = bits < 0 ? "-" : "";
    int exponent = (int) ((bits >>> 52) & 0x7ff);
    long mantissa = bits & 0xfffffffffffffL;
    if (exponent == 0 && mantissa == 0) {
      return sign + "0x0.0p+0";
    }
    if (exponent == 0) {
      return String.format("%s0x0.%013xp-1022", sign, mantissa);
    }
    return String.format("%s0x1.%013xp%+d", sign, mantissa, exponent - 1023);
  }
}
