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

package net.pyveil.obfuscate;

import net.pyveil.syntax.DefStatement;
import net.pyveil.syntax.ParserInput;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.SyntaxError;

/** The functions the passes synthesize: runtime helpers and inert filler. */
public final class Helpers {

  private Helpers() {}

  /**
   * Returns the string decoder. Mode 0 takes {@code ((key, (codes...)), ...)} chunks, mode 1 a
   * base85 text of the UTF-8 bytes and mode 2 the reversed string.
   */
  public static DefStatement stringHelper(String name) {
    return parseDef(
        "def "
            + name
            + "(mode, payload):\n"
            + "    if mode == 0:\n"
            + "        return ''.join(\n"
            + "            ''.join(chr(c ^ key) for c in data) for key, data in payload)\n"
            + "    if mode == 1:\n"
            + "        import base64\n"
            + "        return base64.b85decode(payload.encode('ascii')).decode('utf-8')\n"
            + "    return payload[::-1]\n");
  }

  /** Returns the call trampoline {@code name(fn, args, kwargs)}. */
  public static DefStatement callHelper(String name) {
    return parseDef("def " + name + "(fn, args, kwargs):\n    return fn(*args, **kwargs)\n");
  }

  /** Returns a self-contained function with no effect, whose parameter defaults to {@code seed}. */
  public static DefStatement inertFunction(String name, int seed) {
    return parseDef(
        "def "
            + name
            + "(x="
            + seed
            + "):\n"
            + "    y = ((x ^ 1337) + 97) - 97\n"
            + "    if y == -1:\n"
            + "        return y\n"
            + "    return y ^ 0\n");
  }

  private static DefStatement parseDef(String source) {
    try {
      PyFile file = PyFile.parseOrThrow(ParserInput.fromString(source, "<helper>"));
      return (DefStatement) file.getStatements().get(0);
    } catch (SyntaxError.Exception e) {
      throw new IllegalStateException("invalid helper source", e);
    }
  }
}
