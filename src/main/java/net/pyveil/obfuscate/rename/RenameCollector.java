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

package net.pyveil.obfuscate.rename;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import net.pyveil.obfuscate.BoundNames;
import net.pyveil.obfuscate.Builtins;
import net.pyveil.obfuscate.NameGenerator;
import net.pyveil.syntax.Argument;
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
import net.pyveil.syntax.NodeVisitor;
import net.pyveil.syntax.Parameter;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.ScopeStatement;
import net.pyveil.syntax.TryStatement;
import net.pyveil.syntax.WithStatement;

/**
 * Decides which bindings of a file are renamed and what they become. The result maps each eligible
 * bound name to a fresh name, in order of first binding; the mapping is file-wide, so every
 * occurrence of a renamed name changes together.
 *
 * <p>Names bound directly in a class body define attributes and are never renamed anywhere, since a
 * class body may read the module binding of the same name before shadowing it. A name is also
 * ineligible if it is a keyword, a dunder, a builtin, preserved, bound as the top-level package of
 * an unaliased dotted import, bound by a {@code __future__} import, or used anywhere as a keyword
 * argument name.
 */
public final class RenameCollector extends NodeVisitor {

  enum Scope {
    MODULE,
    FUNCTION,
    CLASS
  }

  private final Set<String> ineligible;
  private final NameGenerator names;
  private final Map<String, String> mapping = new LinkedHashMap<>();
  private final Deque<Scope> scopes = new ArrayDeque<>();

  private RenameCollector(Set<String> ineligible, NameGenerator names) {
    this.ineligible = ineligible;
    this.names = names;
    scopes.push(Scope.MODULE);
  }

  /** Returns the rename map of {@code file}, drawing fresh names from {@code names}. */
  public static ImmutableMap<String, String> collect(
      PyFile file, Set<String> preserve, NameGenerator names) {
    Set<String> ineligible = new HashSet<>(preserve);
    ineligible.addAll(Builtins.NAMES);
    new IneligibleFinder(ineligible).visit(file);
    RenameCollector collector = new RenameCollector(ineligible, names);
    collector.visit(file);
    return ImmutableMap.copyOf(collector.mapping);
  }

  private boolean eligible(String name) {
    return Identifier.isValid(name) && !Identifier.isDunder(name) && !ineligible.contains(name);
  }

  private boolean inClassBody() {
    return scopes.peek() == Scope.CLASS;
  }

  private void bind(String name) {
    if (eligible(name) && !mapping.containsKey(name)) {
      mapping.put(name, names.next());
    }
  }

  /** Binds a name in a store position, unless that position is directly in a class body. */
  private void bindStore(String name) {
    if (!inClassBody()) {
      bind(name);
    }
  }

  private void bindTarget(Expression target) {
    for (Identifier id : Identifier.boundIdentifiers(target)) {
      bindStore(id.getName());
    }
  }

  @Override
  public void visit(DefStatement node) {
    bindStore(node.getIdentifier().getName());
    visitAll(node.getDecorators());
    scopes.push(Scope.FUNCTION);
    visitAll(node.getParameters());
    if (node.getReturnType() != null) {
      visit(node.getReturnType());
    }
    visitBlock(node.getBody());
    scopes.pop();
  }

  @Override
  public void visit(ClassStatement node) {
    bindStore(node.getIdentifier().getName());
    visitAll(node.getDecorators());
    visitAll(node.getBases());
    scopes.push(Scope.CLASS);
    visitBlock(node.getBody());
    scopes.pop();
  }

  @Override
  public void visit(LambdaExpression node) {
    scopes.push(Scope.FUNCTION);
    super.visit(node);
    scopes.pop();
  }

  @Override
  public void visit(Comprehension node) {
    scopes.push(Scope.FUNCTION);
    super.visit(node);
    scopes.pop();
  }

  @Override
  public void visit(Parameter node) {
    if (node.getIdentifier() != null) {
      bind(node.getIdentifier().getName());
    }
    super.visit(node);
  }

  @Override
  public void visit(AssignmentStatement node) {
    node.getTargets().forEach(this::bindTarget);
    super.visit(node);
  }

  @Override
  public void visit(ForStatement node) {
    bindTarget(node.getVars());
    super.visit(node);
  }

  @Override
  public void visit(Comprehension.For node) {
    bindTarget(node.getVars());
    super.visit(node);
  }

  @Override
  public void visit(WithStatement node) {
    for (WithStatement.Item item : node.getItems()) {
      if (item.getTarget() != null) {
        bindTarget(item.getTarget());
      }
    }
    super.visit(node);
  }

  @Override
  public void visit(DelStatement node) {
    node.getTargets().forEach(this::bindTarget);
    super.visit(node);
  }

  @Override
  public void visit(TryStatement.ExceptHandler node) {
    if (node.getName() != null) {
      bindStore(node.getName().getName());
    }
    super.visit(node);
  }

  @Override
  public void visit(ScopeStatement node) {
    node.getNames().forEach(id -> bindStore(id.getName()));
  }

  @Override
  public void visit(ImportStatement node) {
    for (ImportAlias alias : node.getAliases()) {
      bindStore(alias.getBoundName());
    }
  }

  @Override
  public void visit(FromImportStatement node) {
    for (ImportAlias alias : node.getAliases()) {
      bindStore(alias.getBoundName());
    }
  }

  /** Finds names that must keep their spelling whatever binds them. */
  private static final class IneligibleFinder extends NodeVisitor {
    private final Set<String> ineligible;

    IneligibleFinder(Set<String> ineligible) {
      this.ineligible = ineligible;
    }

    @Override
    public void visit(Argument node) {
      if (node instanceof Argument.Keyword) {
        ineligible.add(node.getName());
      }
      super.visit(node);
    }

    @Override
    public void visit(ClassStatement node) {
      ineligible.addAll(BoundNames.inBlock(node.getBody()));
      super.visit(node);
    }

    @Override
    public void visit(ImportStatement node) {
      for (ImportAlias alias : node.getAliases()) {
        if (alias.isDotted() && alias.getAsName() == null) {
          ineligible.add(alias.getBoundName());
        }
      }
    }

    @Override
    public void visit(FromImportStatement node) {
      if (node.isFuture()) {
        for (ImportAlias alias : node.getAliases()) {
          ineligible.add(alias.getBoundName());
        }
      }
    }
  }
}
