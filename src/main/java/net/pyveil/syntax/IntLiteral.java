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
import java.math.BigInteger;

/** Syntax node for an int literal. Python ints have arbitrary precision. */
public final class IntLiteral extends Expression {

  private final BigInteger value;

  public IntLiteral(BigInteger value) {
    super(Kind.INT_LITERAL);
    this.value = Preconditions.checkNotNull(value);
  }

  public static IntLiteral of(long value) {
    return new IntLiteral(BigInteger.valueOf(value));
  }

  public BigInteger getValue() {
    return value;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /**
   * Returns the value denoted by a decimal, hexadecimal ({@code 0x}), octal ({@code 0o}), or binary
   * ({@code 0b}) integer literal, which may contain single underscores between digits.
   *
   * @throws NumberFormatException if the literal is malformed.
   */
  static BigInteger scan(String str) throws NumberFormatException {
    String s = str;
    if (s.startsWith("_") || s.endsWith("_") || s.contains("__")) {
      throw new NumberFormatException("invalid underscore in int literal: " + str);
    }
    int radix = 10;
    if (s.length() > 1 && s.charAt(0) == '0') {
      char c = Character.toLowerCase(s.charAt(1));
      if (c == 'x') {
        radix = 16;
        s = s.substring(2);
      } else if (c == 'o') {
        radix = 8;
        s = s.substring(2);
      } else if (c == 'b') {
        radix = 2;
        s = s.substring(2);
      } else if (!s.replace("_", "").chars().allMatch(ch -> ch == '0')) {
        throw new NumberFormatException(
            "invalid octal literal: " + str + " (use '0o" + s.substring(1) + "')");
      }
      if (s.startsWith("_")) {
        s = s.substring(1);
      }
    }
    s = s.replace("_", "");
    if (s.isEmpty()) {
      throw new NumberFormatException("invalid int literal: " + str);
    }
    try {
      return new BigInteger(s, radix);
    } catch (NumberFormatException unused) {
      throw new NumberFormatException("invalid int literal: " + str);
    }
  }
}
