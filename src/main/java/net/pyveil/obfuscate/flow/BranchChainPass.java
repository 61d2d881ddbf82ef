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
import net.pyveil.obfuscate.ConstantFolder;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.syntax.IfStatement;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.Statement;

/**
 * Pushes the else branch of a conditional one level down behind a never-taken guard: {@code else:
 * B} becomes {@code else: if a == b: pass else: B}, which prints as an {@code elif}.
 *
 * <p>Guards are recognized by folding their test, so a guard whose integers were encoded later is
 * still seen. A guard is never extended, and neither is a conditional whose else branch already is
 * one, so repeated runs do not nest without bound.
 */
public final class BranchChainPass extends FlowPass {

  private BranchChainPass(PassContext ctx) {
    super(ctx, Counter.BRANCHES);
  }

  public static PyFile apply(PyFile file, PassContext ctx) {
    return new BranchChainPass(ctx).run(file);
  }

  @Override
  public Statement rewrite(IfStatement node) {
    IfStatement stmt = (IfStatement) super.rewrite(node);
    ImmutableList<Statement> orelse = stmt.getElseBlock();
    if (orelse == null
        || ConstantFolder.isFalseGuard(stmt.getCondition())
        || isGuard(orelse)
        || !random.draw(ctx.config().branchRate())) {
      return stmt;
    }
    changed();
    return new IfStatement(
        stmt.getCondition(), stmt.getThenBlock(), ImmutableList.of(deadGuard(orelse)));
  }

  private static boolean isGuard(ImmutableList<Statement> block) {
    return block.size() == 1
        && block.get(0) instanceof IfStatement inner
        && ConstantFolder.isFalseGuard(inner.getCondition());
  }
}
