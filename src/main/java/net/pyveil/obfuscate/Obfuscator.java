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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.flow.BranchChainPass;
import net.pyveil.obfuscate.flow.DeadBranchPass;
import net.pyveil.obfuscate.flow.JunkFunctions;
import net.pyveil.obfuscate.flow.LoopPass;
import net.pyveil.obfuscate.indirect.AttributeReadPass;
import net.pyveil.obfuscate.indirect.AttributeWritePass;
import net.pyveil.obfuscate.indirect.BuiltinAliasPass;
import net.pyveil.obfuscate.indirect.CallPass;
import net.pyveil.obfuscate.indirect.ImportPass;
import net.pyveil.obfuscate.literal.BoolEncoder;
import net.pyveil.obfuscate.literal.BytesEncoder;
import net.pyveil.obfuscate.literal.FloatEncoder;
import net.pyveil.obfuscate.literal.IntEncoder;
import net.pyveil.obfuscate.literal.NoneEncoder;
import net.pyveil.obfuscate.literal.StringEncoder;
import net.pyveil.obfuscate.rename.RenameCollector;
import net.pyveil.obfuscate.rename.Renamer;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.Statement;
import net.pyveil.syntax.SyntaxError;

/**
 * The pass orchestrator. It renames bindings, adds inert functions, encodes strings, runs the
 * ordered transforms for the configured number of repetitions, inserts the helpers the passes
 * asked for and finally aliases builtins.
 *
 * <p>Every run owns a fresh {@link PassContext}, so concurrent runs do not interfere.
 */
public final class Obfuscator {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private Obfuscator() {}

  /**
   * Rewrites {@code file} according to {@code config}.
   *
   * @throws SyntaxError.Exception if the file has parse errors
   */
  public static ObfuscationResult obfuscate(PyFile file, ObfuscationConfig config)
      throws SyntaxError.Exception {
    if (!file.ok()) {
      throw new SyntaxError.Exception(file.errors());
    }
    RandomSource random = new RandomSource(config.seed());
    NameGenerator names =
        new NameGenerator(
            ImmutableSet.<String>builder()
                .addAll(NameGenerator.collectIdentifiers(file))
                .addAll(config.preserveNames())
                .build(),
            config.nameStrategy(),
            random);
    PassContext ctx = new PassContext(config, random, names);
    for (String warning : config.riskWarnings()) {
      logger.atWarning().log("%s", warning);
      ctx.warn(warning);
    }

    ImmutableMap<String, String> renameMap = ImmutableMap.of();
    if (config.isEnabled(Transform.RENAME)) {
      renameMap = RenameCollector.collect(file, config.preserveNames(), names);
      file = Renamer.rename(file, renameMap);
      ctx.count(Counter.RENAMED, renameMap.size());
    }
    if (config.junkCount() > 0) {
      file = JunkFunctions.apply(file, ctx);
    }
    if (config.isEnabled(Transform.STRINGS)) {
      file = StringEncoder.apply(file, ctx);
    }
    for (int i = 0; i < config.repetitions(); i++) {
      for (Transform transform : config.order()) {
        if (config.isEnabled(transform)) {
          file = runPass(transform, file, ctx);
        }
      }
    }
    file = insertHelpers(file, ctx);
    if (config.isEnabled(Transform.BUILTINS)) {
      file = BuiltinAliasPass.apply(file, ctx);
    }

    ObfuscationResult result = ObfuscationResult.create(file, renameMap, ctx);
    logger.atFine().log("obfuscated %s: %s", file.getName(), result.stats());
    return result;
  }

  private static PyFile runPass(Transform transform, PyFile file, PassContext ctx) {
    return switch (transform) {
      case IMPORTS -> ImportPass.apply(file, ctx);
      case ATTRS -> AttributeReadPass.apply(file, ctx);
      case SETATTRS -> AttributeWritePass.apply(file, ctx);
      case CALLS -> CallPass.apply(file, ctx);
      case BOOLS -> BoolEncoder.apply(file, ctx);
      case INTS -> IntEncoder.apply(file, ctx);
      case FLOATS -> FloatEncoder.apply(file, ctx);
      case BYTES -> BytesEncoder.apply(file, ctx);
      case NONE -> NoneEncoder.apply(file, ctx);
      case FLOW -> DeadBranchPass.apply(file, ctx);
      case BRANCHES -> BranchChainPass.apply(file, ctx);
      case LOOPS -> LoopPass.apply(file, ctx);
      case RENAME, STRINGS, BUILTINS ->
          throw new IllegalStateException("transform runs outside the pass order: " + transform);
    };
  }

  private static PyFile insertHelpers(PyFile file, PassContext ctx) {
    ImmutableList.Builder<Statement> helpers = ImmutableList.builder();
    if (ctx.stringHelper() != null) {
      helpers.add(Helpers.stringHelper(ctx.stringHelper()));
    }
    if (ctx.callHelper() != null) {
      helpers.add(Helpers.callHelper(ctx.callHelper()));
    }
    ImmutableList<Statement> defs = helpers.build();
    if (defs.isEmpty()) {
      return file;
    }
    ImmutableList<Statement> stmts = file.getStatements();
    return file.withStatements(Blocks.insert(stmts, Blocks.moduleInsertionPoint(stmts), defs));
  }
}
