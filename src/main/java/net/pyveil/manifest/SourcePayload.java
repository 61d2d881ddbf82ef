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

package net.pyveil.manifest;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;
import net.pyveil.obfuscate.literal.Base85;

/**
 * The verbatim copy of the original text carried by a manifest: UTF-8, zlib-compressed at level 9,
 * then base85-encoded with the Python alphabet.
 */
public final class SourcePayload {

  private static final int BUFFER_SIZE = 8192;

  private SourcePayload() {}

  public static String encode(String source) {
    Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
    try {
      deflater.setInput(source.getBytes(UTF_8));
      deflater.finish();
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      byte[] buf = new byte[BUFFER_SIZE];
      while (!deflater.finished()) {
        int n = deflater.deflate(buf);
        out.write(buf, 0, n);
      }
      return Base85.encode(out.toByteArray());
    } finally {
      deflater.end();
    }
  }

  /**
   * Decodes a payload.
   *
   * @throws IllegalArgumentException if the payload is not valid base85 or zlib data
   */
  public static String decode(String payload) {
    byte[] compressed = Base85.decode(payload);
    Inflater inflater = new Inflater();
    try {
      inflater.setInput(compressed);
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      byte[] buf = new byte[BUFFER_SIZE];
      while (!inflater.finished()) {
        int n = inflater.inflate(buf);
        if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
          throw new IllegalArgumentException("truncated source payload");
        }
        out.write(buf, 0, n);
      }
      return out.toString(UTF_8);
    } catch (DataFormatException ex) {
      throw new IllegalArgumentException("corrupt source payload", ex);
    } finally {
      inflater.end();
    }
  }
}
