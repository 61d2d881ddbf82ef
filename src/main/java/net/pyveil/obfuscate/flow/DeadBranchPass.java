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
import net.pyveil.obfuscate.Blocks;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.syntax.DefStatement;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.Statement;

/**
 * Inserts 1 to {@code flowCount} never-taken {@code if a == b: pass} blocks at the start of a
 * function body, after its docstring. Each function is considered once per run, with probability
 * {@code flowRate}.
 */
public final class DeadBranchPass extends FlowPass {

  private DeadBranchPass(PassContext ctx) {
    super(ctx, Counter.FLOW_BLOCKS);
  }

  public static PyFile apply(PyFile file, PassContext ctx) {
    return new DeadBranchPass(ctx).run(file);
  }

  @Override
  public Statement rewrite(DefStatement node) {
    DefStatement def = (DefStatement) super.rewrite(node);
    if (!random.draw(ctx.config().flowRate())) {
      return def;
    }
    int amount = random.nextInt(1, ctx.config().flowCount());
    ImmutableList.Builder<Statement> guards = ImmutableList.builder();
    for (int i = 0; i < amount; i++) {
      guards.add(deadGuard(null));
      changed();
    }
    ImmutableList<Statement> body = def.getBody();
    return def.withBody(Blocks.insert(body, Blocks.afterDocstring(body), guards.build()));
  }
}
