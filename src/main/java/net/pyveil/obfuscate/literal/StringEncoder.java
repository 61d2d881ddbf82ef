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
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.pyveil.obfuscate.Blocks;
import net.pyveil.obfuscate.ObfuscationConfig;
import net.pyveil.obfuscate.ObfuscationConfig.StringMode;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.syntax.BinaryOperatorExpression;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.FStringExpression;
import net.pyveil.syntax.ListExpression;
import net.pyveil.syntax.Node;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.StringLiteral;
import net.pyveil.syntax.TokenKind;

/**
 * Replaces string literals with calls to the string decoder {@code helper(mode, payload)}:
 *
 * <ul>
 *   <li>xor (mode 0): the text cut into chunks, each a {@code (key, (codes...))} pair whose codes
 *       are the code points xored with the key;
 *   <li>b85 (mode 1): the base85 text of the UTF-8 bytes;
 *   <li>reverse (mode 2): the reversed text;
 *   <li>split: the text cut into chunks, each encoded with a random mode above, joined by {@code
 *       +}.
 * </ul>
 *
 * <p>Empty strings and f-strings are left alone, and so are docstrings when they are kept. A module
 * docstring followed by {@code from __future__} imports is always kept.
 */
public final class StringEncoder extends LiteralPass {

  private static final ImmutableList<StringMode> MODES =
      ImmutableList.of(StringMode.XOR, StringMode.B85, StringMode.REVERSE, StringMode.SPLIT);
  private static final ImmutableList<StringMode> LEAF_MODES =
      ImmutableList.of(StringMode.XOR, StringMode.B85, StringMode.REVERSE);

  // Decoder mode arguments.
  public static final int MODE_XOR = 0;
  public static final int MODE_B85 = 1;
  public static final int MODE_REVERSE = 2;

  private final Set<Node> docstrings;
  private final int chunkMin;
  private final int chunkMax;

  private StringEncoder(PassContext ctx, Set<Node> docstrings) {
    super(ctx, Counter.STRINGS);
    this.docstrings = docstrings;
    ObfuscationConfig config = ctx.config();
    this.chunkMin = config.stringChunkMin();
    this.chunkMax = config.stringChunkMax();
  }

  public static PyFile apply(PyFile file, PassContext ctx) {
    Set<Node> docstrings =
        ctx.config().keepDocstrings() ? Blocks.docstrings(file) : Blocks.pinnedDocstring(file);
    return new StringEncoder(ctx, docstrings).run(file);
  }

  // The decoder calls chr for mode 0, which b85 falls back to for lone surrogates.
  @Override
  ImmutableSet<String> requiredBuiltins() {
    return ctx.config().stringMode() == StringMode.REVERSE
        ? ImmutableSet.of()
        : ImmutableSet.of("chr");
  }

  @Override
  public Expression rewrite(StringLiteral node) {
    if (node.getValue().isEmpty() || docstrings.contains(node)) {
      return node;
    }
    changed();
    StringMode mode = ctx.config().stringMode();
    if (mode == StringMode.MIXED) {
      mode = random.choose(MODES);
    }
    return mode == StringMode.SPLIT ? split(node.getValue()) : leaf(node.getValue(), mode);
  }

  // Field expressions would have to be printed inside the f-string's own quotes.
  @Override
  public Expression rewrite(FStringExpression node) {
    return node;
  }

  private Expression split(String value) {
    int[] codePoints = value.codePoints().toArray();
    if (codePoints.length <= 1) {
      return leaf(value, StringMode.XOR);
    }
    List<String> parts = new ArrayList<>();
    for (int[] range : chunks(codePoints.length)) {
      parts.add(new String(codePoints, range[0], range[1] - range[0]));
    }
    if (parts.size() == 1) {
      return leaf(parts.get(0), StringMode.XOR);
    }
    Expression result = null;
    for (String part : parts) {
      Expression e = leaf(part, random.choose(LEAF_MODES));
      result = result == null ? e : new BinaryOperatorExpression(result, TokenKind.PLUS, e);
    }
    return result;
  }

  private Expression leaf(String value, StringMode mode) {
    String helper = ctx.useStringHelper();
    switch (mode) {
      case XOR:
        return CallExpression.of(helper, intLit(MODE_XOR), xorPayload(value));
      case B85:
        if (!isWellFormed(value)) {
          // Lone surrogates have no UTF-8 encoding.
          return CallExpression.of(helper, intLit(MODE_XOR), xorPayload(value));
        }
        return CallExpression.of(
            helper,
            intLit(MODE_B85),
            new StringLiteral(Base85.encode(value.getBytes(StandardCharsets.UTF_8))));
      case REVERSE:
        return CallExpression.of(
            helper, intLit(MODE_REVERSE), new StringLiteral(reverse(value)));
      default:
        throw new IllegalArgumentException("not a leaf mode: " + mode);
    }
  }

  private ListExpression xorPayload(String value) {
    int[] codePoints = value.codePoints().toArray();
    ImmutableList.Builder<Expression> chunks = ImmutableList.builder();
    for (int[] range : chunks(codePoints.length)) {
      int key = random.nextInt(1, 255);
      ImmutableList.Builder<Expression> codes = ImmutableList.builder();
      for (int i = range[0]; i < range[1]; i++) {
        codes.add(intLit(codePoints[i] ^ key));
      }
      chunks.add(ListExpression.tuple(intLit(key), ListExpression.tuple(codes.build())));
    }
    return ListExpression.tuple(chunks.build());
  }

  /** Cuts {@code [0, length)} into consecutive ranges whose sizes lie in the chunk window. */
  private List<int[]> chunks(int length) {
    List<int[]> result = new ArrayList<>();
    for (int i = 0; i < length; ) {
      int hi = Math.min(chunkMax, length - i);
      int lo = Math.min(chunkMin, hi);
      int step = random.nextInt(lo, hi);
      result.add(new int[] {i, i + step});
      i += step;
    }
    return result;
  }

  /** Reverses by code point. */
  static String reverse(String value) {
    return new StringBuilder(value).reverse().toString();
  }

  private static boolean isWellFormed(String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (Character.isHighSurrogate(c)) {
        if (i + 1 >= value.length() || !Character.isLowSurrogate(value.charAt(i + 1))) {
          return false;
        }
        i++;
      } else if (Character.isLowSurrogate(c)) {
        return false;
      }
    }
    return true;
  }
}
