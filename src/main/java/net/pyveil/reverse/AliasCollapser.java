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

package net.pyveil.reverse;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import net.pyveil.syntax.AssignmentStatement;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.Statement;

/**
 * Replaces builtin aliases with the builtins they stand for and drops their module-level bindings.
 * Only aliases recorded in the manifest are considered, and only if the file still binds them in
 * one of the three generated forms.
 */
final class AliasCollapser extends Recognizer {

  private final ImmutableMap<String, String> recorded;
  private final Map<String, String> confirmed = new HashMap<>();

  /** @param recorded alias to builtin name */
  AliasCollapser(ImmutableMap<String, String> recorded) {
    this.recorded = recorded;
  }

  @Override
  PyFile run(PyFile file) {
    ImmutableList.Builder<Statement> kept = ImmutableList.builder();
    for (Statement stmt : file.getStatements()) {
      if (!isBinding(stmt)) {
        kept.add(stmt);
      }
    }
    if (confirmed.isEmpty()) {
      return file;
    }
    return rewrite(file.withStatements(kept.build()));
  }

  /** Records and reports a module-level statement binding a recorded alias. */
  private boolean isBinding(Statement stmt) {
    if (!(stmt instanceof AssignmentStatement assign)
        || assign.isAugmented()
        || assign.getType() != null
        || assign.getTargets().size() != 1
        || !(assign.getLHS() instanceof Identifier target)) {
      return false;
    }
    String builtin = recorded.get(target.getName());
    if (builtin == null || confirmed.containsKey(target.getName())) {
      return false;
    }
    if (!bindsBuiltin(assign.getRHS(), builtin)) {
      return false;
    }
    confirmed.put(target.getName(), builtin);
    found();
    return true;
  }

  /**
   * Matches {@code B}, {@code getattr(__import__('builtins'), 'B')} and {@code
   * globals().get('B', B)}.
   */
  private static boolean bindsBuiltin(Expression value, String builtin) {
    if (Shapes.isName(value, builtin)) {
      return true;
    }
    ImmutableList<Expression> args = Shapes.callArgs(value, 2);
    if (args == null) {
      return false;
    }
    Expression fn = ((CallExpression) value).getFunction();
    if (Shapes.isName(fn, "getattr")) {
      return Shapes.isDunderImport(args.get(0), "builtins")
          && builtin.equals(Shapes.stringValue(args.get(1)));
    }
    return Shapes.isScopeGet(fn, "globals")
        && builtin.equals(Shapes.stringValue(args.get(0)))
        && Shapes.isName(args.get(1), builtin);
  }

  @Override
  public Expression rewrite(Identifier node) {
    String builtin = confirmed.get(node.getName());
    if (builtin == null) {
      return node;
    }
    found();
    return new Identifier(builtin);
  }
}
