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
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import net.pyveil.syntax.ClassStatement;
import net.pyveil.syntax.DefStatement;
import net.pyveil.syntax.ExpressionStatement;
import net.pyveil.syntax.FromImportStatement;
import net.pyveil.syntax.Node;
import net.pyveil.syntax.NodeVisitor;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.Statement;

/** Helpers for placing synthesized statements in a block. */
public final class Blocks {

  private Blocks() {}

  /** Reports whether the block starts with a docstring. */
  public static boolean hasDocstring(List<Statement> block) {
    return !block.isEmpty()
        && block.get(0) instanceof ExpressionStatement stmt
        && stmt.isStringLiteral();
  }

  /** Returns the index of the first statement after the docstring, if any. */
  public static int afterDocstring(List<Statement> block) {
    return hasDocstring(block) ? 1 : 0;
  }

  /**
   * Returns the index at which module-level definitions may be inserted: after the docstring and
   * any {@code from __future__} imports, which must stay first.
   */
  public static int moduleInsertionPoint(List<Statement> module) {
    int i = afterDocstring(module);
    while (i < module.size()
        && module.get(i) instanceof FromImportStatement stmt
        && stmt.isFuture()) {
      i++;
    }
    return i;
  }

  /**
   * Returns the docstring literals of a file: the leading string statement of the module and of
   * every function and class body. The set compares nodes by identity.
   */
  public static Set<Node> docstrings(PyFile file) {
    Set<Node> result = Collections.newSetFromMap(new IdentityHashMap<>());
    addDocstring(file.getStatements(), result);
    new NodeVisitor() {
      @Override
      public void visit(DefStatement node) {
        addDocstring(node.getBody(), result);
        super.visit(node);
      }

      @Override
      public void visit(ClassStatement node) {
        addDocstring(node.getBody(), result);
        super.visit(node);
      }
    }.visit(file);
    return result;
  }

  /**
   * Returns the module docstring literal if {@code from __future__} imports follow it, else an
   * empty set. Such a docstring must stay a string statement for the imports to remain first.
   */
  public static Set<Node> pinnedDocstring(PyFile file) {
    ImmutableList<Statement> stmts = file.getStatements();
    if (!hasDocstring(stmts)
        || stmts.size() < 2
        || !(stmts.get(1) instanceof FromImportStatement from)
        || !from.isFuture()) {
      return Set.of();
    }
    return Set.of(((ExpressionStatement) stmts.get(0)).getExpression());
  }

  private static void addDocstring(List<Statement> block, Set<Node> result) {
    if (hasDocstring(block)) {
      result.add(((ExpressionStatement) block.get(0)).getExpression());
    }
  }

  /** Returns a copy of {@code block} with {@code statements} inserted at {@code index}. */
  public static ImmutableList<Statement> insert(
      List<Statement> block, int index, List<? extends Statement> statements) {
    return ImmutableList.<Statement>builder()
        .addAll(block.subList(0, index))
        .addAll(statements)
        .addAll(block.subList(index, block.size()))
        .build();
  }
}
