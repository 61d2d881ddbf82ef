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
import java.util.Arrays;
import net.pyveil.obfuscate.ObfuscationConfig.BytesMode;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.syntax.BinaryOperatorExpression;
import net.pyveil.syntax.BytesLiteral;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.Comprehension;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.ListExpression;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.TokenKind;

/**
 * Replaces bytes literals with {@code bytes((...))} of their values, with {@code bytes(_b ^ k for
 * _b in (...))} of the values xored with a key, or with a concatenation of 1 to 6 byte pieces each
 * encoded one of those two ways.
 */
public final class BytesEncoder extends LiteralPass {

  private static final ImmutableList<BytesMode> MODES =
      ImmutableList.of(BytesMode.XOR, BytesMode.LIST, BytesMode.SPLIT);
  private static final ImmutableList<BytesMode> LEAF_MODES =
      ImmutableList.of(BytesMode.XOR, BytesMode.LIST);
  private static final int MAX_PIECE = 6;

  private BytesEncoder(PassContext ctx) {
    super(ctx, Counter.BYTES);
  }

  public static PyFile apply(PyFile file, PassContext ctx) {
    return new BytesEncoder(ctx).run(file);
  }

  @Override
  ImmutableSet<String> requiredBuiltins() {
    return ImmutableSet.of("bytes");
  }

  @Override
  public Expression rewrite(BytesLiteral node) {
    BytesMode mode = ctx.config().bytesMode();
    if (mode == BytesMode.MIXED) {
      mode = random.choose(MODES);
    }
    changed();
    byte[] data = node.getValue();
    return mode == BytesMode.SPLIT ? split(data) : leaf(data, mode);
  }

  private Expression split(byte[] data) {
    if (data.length <= 1) {
      return leaf(data, BytesMode.XOR);
    }
    ImmutableList.Builder<byte[]> pieces = ImmutableList.builder();
    for (int i = 0; i < data.length; ) {
      int step = random.nextInt(1, Math.min(MAX_PIECE, data.length - i));
      pieces.add(Arrays.copyOfRange(data, i, i + step));
      i += step;
    }
    ImmutableList<byte[]> list = pieces.build();
    if (list.size() == 1) {
      return leaf(list.get(0), BytesMode.XOR);
    }
    Expression result = null;
    for (byte[] piece : list) {
      Expression e = leaf(piece, random.choose(LEAF_MODES));
      result = result == null ? e : new BinaryOperatorExpression(result, TokenKind.PLUS, e);
    }
    return result;
  }

  private Expression leaf(byte[] data, BytesMode mode) {
    if (mode == BytesMode.LIST) {
      return CallExpression.of("bytes", values(data, 0));
    }
    int key = random.nextInt(1, 255);
    Expression element =
        new BinaryOperatorExpression(new Identifier("_b"), TokenKind.CARET, intLit(key));
    Comprehension gen =
        new Comprehension(
            Comprehension.Type.GENERATOR,
            element,
            ImmutableList.of(new Comprehension.For(new Identifier("_b"), values(data, key))));
    return CallExpression.of("bytes", gen);
  }

  private static ListExpression values(byte[] data, int key) {
    ImmutableList.Builder<Expression> values = ImmutableList.builder();
    for (byte b : data) {
      values.add(intLit((b & 0xff) ^ key));
    }
    return ListExpression.tuple(values.build());
  }
}
