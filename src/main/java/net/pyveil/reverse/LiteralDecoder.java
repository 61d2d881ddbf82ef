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

package net.pyveil.reverse;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.util.Set;
import java.util.function.Predicate;
import javax.annotation.Nullable;
import net.pyveil.obfuscate.ConstantFolder;
import net.pyveil.obfuscate.literal.Base85;
import net.pyveil.syntax.BinaryOperatorExpression;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.ListExpression;
import net.pyveil.syntax.StringLiteral;
import net.pyveil.syntax.TokenKind;

/**
 * Replaces calls of the string decoder with the text they produce. Mode 0 payloads are {@code
 * ((key, (codes...)), ...)} chunks, mode 1 payloads base85 of UTF-8 and mode 2 payloads reversed
 * text. The mode, keys and codes are constant-folded first, so later integer encodings do not hide
 * them. Concatenations of two decoded strings, as split encoding produces, are joined.
 */
final class LiteralDecoder extends Recognizer {

  private final Predicate<String> isHelper;
  private final Set<Expression> decoded = Sets.newIdentityHashSet();

  LiteralDecoder(Predicate<String> isHelper) {
    this.isHelper = isHelper;
  }

  @Override
  public Expression rewrite(CallExpression node) {
    Expression e = super.rewrite(node);
    ImmutableList<Expression> args = Shapes.callArgs(e, 2);
    if (args == null
        || !(((CallExpression) e).getFunction() instanceof Identifier fn)
        || !isHelper.test(fn.getName())) {
      return e;
    }
    BigInteger mode = ConstantFolder.foldInt(args.get(0));
    if (mode == null || mode.bitLength() > 2) {
      return e;
    }
    String text =
        switch (mode.intValue()) {
          case 0 -> decodeXor(args.get(1));
          case 1 -> decodeBase85(args.get(1));
          case 2 -> reverse(args.get(1));
          default -> null;
        };
    if (text == null) {
      return e;
    }
    found();
    StringLiteral lit = new StringLiteral(text);
    decoded.add(lit);
    return lit;
  }

  @Override
  public Expression rewrite(BinaryOperatorExpression node) {
    Expression e = super.rewrite(node);
    if (e instanceof BinaryOperatorExpression bin
        && bin.getOperator() == TokenKind.PLUS
        && decoded.contains(bin.getX())
        && decoded.contains(bin.getY())) {
      StringLiteral joined =
          new StringLiteral(
              ((StringLiteral) bin.getX()).getValue() + ((StringLiteral) bin.getY()).getValue());
      decoded.add(joined);
      return joined;
    }
    return e;
  }

  @Nullable
  private static String decodeXor(Expression payload) {
    if (!(payload instanceof ListExpression chunks) || !chunks.isTuple()) {
      return null;
    }
    StringBuilder buf = new StringBuilder();
    for (Expression chunk : chunks.getElements()) {
      if (!(chunk instanceof ListExpression pair)
          || pair.getElements().size() != 2
          || !(pair.getElements().get(1) instanceof ListExpression codes)) {
        return null;
      }
      Integer key = Shapes.codePoint(pair.getElements().get(0));
      if (key == null) {
        return null;
      }
      for (Expression code : codes.getElements()) {
        Integer c = Shapes.codePoint(code);
        if (c == null || (c ^ key) > Character.MAX_CODE_POINT) {
          return null;
        }
        buf.appendCodePoint(c ^ key);
      }
    }
    return buf.toString();
  }

  @Nullable
  private static String decodeBase85(Expression payload) {
    String text = Shapes.stringValue(payload);
    if (text == null) {
      return null;
    }
    byte[] bytes;
    try {
      bytes = Base85.decode(text);
    } catch (IllegalArgumentException ex) {
      return null; // not base85: leave the call in place
    }
    try {
      return UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException ex) {
      return null; // not UTF-8: leave the call in place
    }
  }

  @Nullable
  private static String reverse(Expression payload) {
    String text = Shapes.stringValue(payload);
    return text == null ? null : new StringBuilder(text).reverse().toString();
  }
}
