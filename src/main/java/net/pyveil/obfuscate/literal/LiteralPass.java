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

import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import java.math.BigInteger;
import net.pyveil.obfuscate.BoundNames;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.obfuscate.RandomSource;
import net.pyveil.syntax.IntLiteral;
import net.pyveil.syntax.NodeRewriter;
import net.pyveil.syntax.PyFile;

/**
 * Base class of the literal encoders: a rewriter that counts the literals it replaces. Encodings
 * call builtins by name, so a program that binds one of them is left alone.
 */
abstract class LiteralPass extends NodeRewriter {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  final PassContext ctx;
  final RandomSource random;
  private final Counter counter;
  private int changed;

  LiteralPass(PassContext ctx, Counter counter) {
    this.ctx = ctx;
    this.random = ctx.random();
    this.counter = counter;
  }

  /** Names of the builtins the encodings for the configured mode look up. */
  abstract ImmutableSet<String> requiredBuiltins();

  /** Rewrites the file and records the count. */
  final PyFile run(PyFile file) {
    ImmutableSet<String> bound = BoundNames.all(file);
    for (String name : requiredBuiltins()) {
      if (bound.contains(name)) {
        String warning = String.format("%s skipped: program binds %s", counter.token(), name);
        logger.atInfo().log("%s", warning);
        ctx.warn(warning);
        return file;
      }
    }
    PyFile result = rewrite(file);
    ctx.count(counter, changed);
    logger.atFine().log("%s: %d literals encoded", counter.token(), changed);
    return result;
  }

  final void changed() {
    changed++;
  }

  static IntLiteral intLit(long value) {
    return IntLiteral.of(value);
  }

  static IntLiteral intLit(BigInteger value) {
    return new IntLiteral(value);
  }
}
