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

package net.pyveil.obfuscate.indirect;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import net.pyveil.obfuscate.BoundNames;
import net.pyveil.obfuscate.IndirectionMethod;
import net.pyveil.obfuscate.MethodFamily;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.obfuscate.RandomSource;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.Comprehension;
import net.pyveil.syntax.DotExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.IntLiteral;
import net.pyveil.syntax.ListExpression;
import net.pyveil.syntax.NodeRewriter;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.StringLiteral;

/**
 * Base class of the reflective indirection passes. It counts rewrites, skips programs that rebind
 * a builtin the generated shapes depend on, and builds the shared pieces of those shapes.
 */
abstract class IndirectionPass extends NodeRewriter {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  final PassContext ctx;
  final RandomSource random;
  private final Counter counter;
  private int changed;

  IndirectionPass(PassContext ctx, Counter counter) {
    this.ctx = ctx;
    this.random = ctx.random();
    this.counter = counter;
  }

  /** Names of the builtins the generated code calls. A program binding one is left alone. */
  abstract ImmutableSet<String> requiredBuiltins();

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
    logger.atFine().log("%s: %d sites rewritten", counter.token(), changed);
    return result;
  }

  final void changed() {
    changed++;
  }

  /** Picks a method uniformly from the family's pool. */
  final IndirectionMethod pick(MethodFamily family) {
    return random.choose(ctx.config().pool(family));
  }

  static StringLiteral str(String value) {
    return new StringLiteral(value);
  }

  /** Returns {@code __import__('module')}. */
  static CallExpression dunderImport(String module) {
    return CallExpression.of("__import__", str(module));
  }

  /** Returns {@code __import__('module').name}. */
  static DotExpression moduleAttr(String module, String name) {
    return new DotExpression(dunderImport(module), name);
  }

  /**
   * Returns an expression evaluating to {@code name}: the plain literal, {@code
   * ''.join(('n', 'a', ...))}, or {@code ''.join(chr(_c) for _c in (110, 97, ...))}. The join form
   * needs at least two characters and falls back to the plain literal.
   */
  final Expression nameExpression(String name) {
    switch (random.nextInt(0, 2)) {
      case 1:
        if (name.length() > 1) {
          ImmutableList.Builder<Expression> chars = ImmutableList.builder();
          name.codePoints().forEach(c -> chars.add(str(new String(Character.toChars(c)))));
          return CallExpression.of(
              new DotExpression(str(""), "join"), ListExpression.tuple(chars.build()));
        }
        return str(name);
      case 2:
        {
          ImmutableList.Builder<Expression> codes = ImmutableList.builder();
          name.codePoints().forEach(c -> codes.add(IntLiteral.of(c)));
          Comprehension gen =
              new Comprehension(
                  Comprehension.Type.GENERATOR,
                  CallExpression.of("chr", new Identifier("_c")),
                  ImmutableList.of(
                      new Comprehension.For(
                          new Identifier("_c"), ListExpression.tuple(codes.build()))));
          return CallExpression.of(new DotExpression(str(""), "join"), gen);
        }
      default:
        return str(name);
    }
  }

  /** Reports whether an attribute name may be redirected. */
  final boolean isEligibleAttribute(String attr) {
    return !Identifier.isDunder(attr) && !ctx.config().preserveAttrs().contains(attr);
  }
}
