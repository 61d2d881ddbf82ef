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
import java.util.HashSet;
import java.util.Set;
import java.util.function.Predicate;
import net.pyveil.syntax.DefStatement;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.NodeVisitor;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.Statement;

/** Drops module-level helper functions that nothing refers to any more. */
final class HelperRemover extends Recognizer {

  private final Predicate<String> isHelper;

  HelperRemover(Predicate<String> isHelper) {
    this.isHelper = isHelper;
  }

  @Override
  PyFile run(PyFile file) {
    Set<String> used = new HashSet<>();
    NodeVisitor collector =
        new NodeVisitor() {
          @Override
          public void visit(Identifier id) {
            used.add(id.getName());
          }
        };
    for (Statement stmt : file.getStatements()) {
      if (!isHelperDef(stmt)) {
        collector.visit(stmt);
      }
    }
    ImmutableList.Builder<Statement> kept = ImmutableList.builder();
    for (Statement stmt : file.getStatements()) {
      if (isHelperDef(stmt) && !used.contains(((DefStatement) stmt).getIdentifier().getName())) {
        found();
      } else {
        kept.add(stmt);
      }
    }
    return count() == 0 ? file : file.withStatements(kept.build());
  }

  private boolean isHelperDef(Statement stmt) {
    return stmt instanceof DefStatement def && isHelper.test(def.getIdentifier().getName());
  }
}
