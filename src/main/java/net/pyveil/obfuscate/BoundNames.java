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

import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.pyveil.syntax.AssignmentStatement;
import net.pyveil.syntax.ClassStatement;
import net.pyveil.syntax.Comprehension;
import net.pyveil.syntax.DefStatement;
import net.pyveil.syntax.DelStatement;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.ForStatement;
import net.pyveil.syntax.FromImportStatement;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.ImportAlias;
import net.pyveil.syntax.ImportStatement;
import net.pyveil.syntax.LambdaExpression;
import net.pyveil.syntax.Node;
import net.pyveil.syntax.NodeVisitor;
import net.pyveil.syntax.Parameter;
import net.pyveil.syntax.ScopeStatement;
import net.pyveil.syntax.Statement;
import net.pyveil.syntax.TryStatement;
import net.pyveil.syntax.WithStatement;

/** Static helpers that find the names a program binds. */
public final class BoundNames {

  private BoundNames() {}

  /** Returns every name bound anywhere in {@code node}, in any scope. */
  public static ImmutableSet<String> all(Node node) {
    Collector collector = new Collector(/* descend= */ true);
    collector.visit(node);
    return collector.names.build();
  }

  /**
   * Returns the names bound directly in a block: by its statements and the compound statements
   * nested in it, but not inside nested functions, classes, lambdas or comprehensions.
   */
  public static ImmutableSet<String> inBlock(List<Statement> block) {
    Collector collector = new Collector(/* descend= */ false);
    collector.visitBlock(block);
    return collector.names.build();
  }

  private static final class Collector extends NodeVisitor {
    private final ImmutableSet.Builder<String> names = ImmutableSet.builder();
    private final boolean descend;

    Collector(boolean descend) {
      this.descend = descend;
    }

    private void addTarget(Expression target) {
      for (Identifier id : Identifier.boundIdentifiers(target)) {
        names.add(id.getName());
      }
    }

    @Override
    public void visit(AssignmentStatement node) {
      node.getTargets().forEach(this::addTarget);
      super.visit(node);
    }

    @Override
    public void visit(ForStatement node) {
      addTarget(node.getVars());
      super.visit(node);
    }

    @Override
    public void visit(WithStatement node) {
      for (WithStatement.Item item : node.getItems()) {
        if (item.getTarget() != null) {
          addTarget(item.getTarget());
        }
      }
      super.visit(node);
    }

    @Override
    public void visit(DelStatement node) {
      node.getTargets().forEach(this::addTarget);
      super.visit(node);
    }

    @Override
    public void visit(TryStatement.ExceptHandler node) {
      if (node.getName() != null) {
        names.add(node.getName().getName());
      }
      super.visit(node);
    }

    @Override
    public void visit(ScopeStatement node) {
      node.getNames().forEach(id -> names.add(id.getName()));
    }

    @Override
    public void visit(ImportStatement node) {
      node.getAliases().forEach(a -> names.add(a.getBoundName()));
    }

    @Override
    public void visit(FromImportStatement node) {
      for (ImportAlias alias : node.getAliases()) {
        names.add(alias.getBoundName());
      }
    }

    @Override
    public void visit(DefStatement node) {
      names.add(node.getIdentifier().getName());
      if (descend) {
        super.visit(node);
      }
    }

    @Override
    public void visit(ClassStatement node) {
      names.add(node.getIdentifier().getName());
      if (descend) {
        super.visit(node);
      }
    }

    @Override
    public void visit(Parameter node) {
      if (node.getIdentifier() != null) {
        names.add(node.getIdentifier().getName());
      }
      super.visit(node);
    }

    @Override
    public void visit(LambdaExpression node) {
      if (descend) {
        super.visit(node);
      }
    }

    @Override
    public void visit(Comprehension node) {
      if (descend) {
        super.visit(node);
      }
    }

    @Override
    public void visit(Comprehension.For node) {
      addTarget(node.getVars());
      super.visit(node);
    }
  }
}
