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

package net.pyveil.obfuscate.flow;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import javax.annotation.Nullable;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.obfuscate.RandomSource;
import net.pyveil.syntax.ComparisonExpression;
import net.pyveil.syntax.FlowStatement;
import net.pyveil.syntax.IfStatement;
import net.pyveil.syntax.IntLiteral;
import net.pyveil.syntax.NodeRewriter;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.Statement;
import net.pyveil.syntax.TokenKind;

/** Base class of the control-restructuring passes. */
abstract class FlowPass extends NodeRewriter {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  final PassContext ctx;
  final RandomSource random;
  private final Counter counter;
  private int changed;

  FlowPass(PassContext ctx, Counter counter) {
    this.ctx = ctx;
    this.random = ctx.random();
    this.counter = counter;
  }

  PyFile run(PyFile file) {
    PyFile result = rewrite(file);
    ctx.count(counter, changed);
    logger.atFine().log("%s: %d rewrites", counter.token(), changed);
    return result;
  }

  final void changed() {
    changed++;
  }

  /**
   * Returns {@code if a == b: <then> [else: <orelse>]}, with a in 100..999 and b 1..50 above it, so
   * the test never holds.
   */
  final IfStatement deadGuard(@Nullable ImmutableList<Statement> orelse) {
    int a = random.nextInt(100, 999);
    int b = a + random.nextInt(1, 50);
    return new IfStatement(
        ComparisonExpression.of(IntLiteral.of(a), TokenKind.EQUALS_EQUALS, IntLiteral.of(b)),
        ImmutableList.of(FlowStatement.pass()),
        orelse);
  }
}
