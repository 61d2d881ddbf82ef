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

import com.google.common.collect.ImmutableSet;
import net.pyveil.syntax.ParserInput;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.SyntaxError;

/** Fixtures shared by the pass tests. */
public final class PassTesting {

  public static final long SEED = 1234L;

  private PassTesting() {}

  public static PyFile parse(String... lines) throws SyntaxError.Exception {
    return PyFile.parseOrThrow(ParserInput.fromLines(lines));
  }

  /** Returns a seeded builder with exactly the given transforms enabled. */
  public static ObfuscationConfig.Builder config(Transform... transforms) {
    return ObfuscationConfig.builder().seed(SEED).transforms(ImmutableSet.copyOf(transforms));
  }

  /** Returns a fresh context whose name generator avoids every name in {@code file}. */
  public static PassContext context(ObfuscationConfig config, PyFile file) {
    RandomSource random = new RandomSource(config.seed());
    return new PassContext(
        config,
        random,
        new NameGenerator(
            NameGenerator.collectIdentifiers(file), config.nameStrategy(), random));
  }

  /** Prints a file without its trailing newline, for single-statement assertions. */
  public static String print(PyFile file) {
    String s = file.toString();
    return s.endsWith("\n") ? s.substring(0, s.length() - 1) : s;
  }
}
