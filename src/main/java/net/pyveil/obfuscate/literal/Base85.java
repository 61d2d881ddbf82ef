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

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * The base85 variant of Python's {@code base64.b85encode}, without padding: the final group is
 * zero-filled to four bytes, encoded, and truncated by the number of fill bytes.
 */
public final class Base85 {

  private static final String ALPHABET =
      "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz!#$%&()*+-;<=>?@^_`{|}~";

  private static final int[] DECODE = new int[128];

  static {
    Arrays.fill(DECODE, -1);
    for (int i = 0; i < ALPHABET.length(); i++) {
      DECODE[ALPHABET.charAt(i)] = i;
    }
  }

  private Base85() {}

  public static String encode(byte[] data) {
    int padding = (4 - data.length % 4) % 4;
    StringBuilder out = new StringBuilder((data.length + padding) / 4 * 5);
    char[] group = new char[5];
    for (int i = 0; i < data.length; i += 4) {
      long acc = 0;
      for (int j = 0; j < 4; j++) {
        int b = i + j < data.length ? data[i + j] & 0xff : 0;
        acc = (acc << 8) | b;
      }
      for (int j = 4; j >= 0; j--) {
        group[j] = ALPHABET.charAt((int) (acc % 85));
        acc /= 85;
      }
      out.append(group);
    }
    out.setLength(out.length() - padding);
    return out.toString();
  }

  /**
   * Decodes base85 text.
   *
   * @throws IllegalArgumentException if the text contains a character outside the alphabet or a
   *     group that overflows 32 bits
   */
  public static byte[] decode(String text) {
    int padding = (5 - text.length() % 5) % 5;
    ByteArrayOutputStream out = new ByteArrayOutputStream(text.length() / 5 * 4 + 4);
    for (int i = 0; i < text.length(); i += 5) {
      long acc = 0;
      for (int j = 0; j < 5; j++) {
        int digit = 84;
        if (i + j < text.length()) {
          char c = text.charAt(i + j);
          digit = c < 128 ? DECODE[c] : -1;
          if (digit < 0) {
            throw new IllegalArgumentException(
                String.format("bad base85 character '%c' at position %d", c, i + j));
          }
        }
        acc = acc * 85 + digit;
      }
      if (acc > 0xffffffffL) {
        throw new IllegalArgumentException("base85 overflow in group starting at " + i);
      }
      for (int shift = 24; shift >= 0; shift -= 8) {
        out.write((int) (acc >>> shift) & 0xff);
      }
    }
    byte[] bytes = out.toByteArray();
    return Arrays.copyOf(bytes, bytes.length - padding);
  }
}
