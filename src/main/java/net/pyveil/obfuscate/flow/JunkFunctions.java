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

import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.List;
import net.pyveil.obfuscate.Blocks;
import net.pyveil.obfuscate.Helpers;
import net.pyveil.obfuscate.ObfuscationConfig;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.obfuscate.RandomSource;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.Statement;

/**
 * Adds {@code junkCount} inert module-level functions named {@code _junk_0}, {@code _junk_1}, ...
 * at the top of the module, at the bottom, or each at a random top-level position.
 */
public final class JunkFunctions {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private JunkFunctions() {}

  public static PyFile apply(PyFile file, PassContext ctx) {
    ObfuscationConfig config = ctx.config();
    RandomSource random = ctx.random();
    List<Statement> stmts = new ArrayList<>(file.getStatements());
    for (int i = 0; i < config.junkCount(); i++) {
      String name = ctx.names().fresh(String.format("_junk_%x", i));
      Statement def = Helpers.inertFunction(name, random.nextInt(100, 9999));
      switch (config.junkPosition()) {
        case TOP -> stmts.add(Blocks.moduleInsertionPoint(stmts), def);
        case BOTTOM -> stmts.add(def);
        case RANDOM ->
            stmts.add(random.nextInt(Blocks.moduleInsertionPoint(stmts), stmts.size()), def);
      }
      ctx.count(Counter.JUNK_FUNCTIONS);
    }
    logger.atFine().log("%d inert functions added", config.junkCount());
    return file.withStatements(stmts);
  }
}
