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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import javax.annotation.Nullable;
import net.pyveil.obfuscate.BoundNames;
import net.pyveil.syntax.ClassStatement;
import net.pyveil.syntax.Comprehension;
import net.pyveil.syntax.DefStatement;
import net.pyveil.syntax.DictExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.FromImportStatement;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.ImportAlias;
import net.pyveil.syntax.ImportStatement;
import net.pyveil.syntax.LambdaExpression;
import net.pyveil.syntax.Node;
import net.pyveil.syntax.NodeRewriter;
import net.pyveil.syntax.Parameter;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.Statement;

/**
 * Applies a rename map to a file. Definitions, stores and imports directly in a class body keep
 * their names, and so do loads in a class body of names bound in that body; everything else in the
 * map is renamed everywhere.
 *
 * <p>The same rewriter applied with the inverted map undoes a rename.
 */
public final class Renamer extends NodeRewriter {

  /** A scope on the stack; {@code classBound} is set only for class bodies. */
  private record Scope(@Nullable ImmutableSet<String> classBound) {
    boolean isClass() {
      return classBound != null;
    }
  }

  private static final Scope FUNCTION = new Scope(null);

  private final Map<String, String> mapping;
  private final Deque<Scope> scopes = new ArrayDeque<>();

  private Renamer(Map<String, String> mapping) {
    this.mapping = mapping;
    scopes.push(FUNCTION);
  }

  /** Returns {@code file} with every name in {@code mapping} renamed. */
  public static PyFile rename(PyFile file, Map<String, String> mapping) {
    if (mapping.isEmpty()) {
      return file;
    }
    return new Renamer(mapping).rewrite(file);
  }

  private String map(String name) {
    return mapping.getOrDefault(name, name);
  }

  private boolean inClassBody() {
    return scopes.peek().isClass();
  }

  private Identifier renamed(Identifier id) {
    String name = map(id.getName());
    return name.equals(id.getName()) ? id : new Identifier(name);
  }

  @Override
  protected Identifier rewriteBinding(Identifier id) {
    return inClassBody() ? id : renamed(id);
  }

  @Override
  public Expression rewrite(Identifier node) {
    Scope scope = scopes.peek();
    if (scope.isClass() && scope.classBound().contains(node.getName())) {
      return node;
    }
    return renamed(node);
  }

  @Override
  public Statement rewrite(DefStatement node) {
    ImmutableList<Expression> decorators = rewriteAll(node.getDecorators());
    Identifier name = rewriteBinding(node.getIdentifier());
    // Defaults and annotations are evaluated where the function is defined.
    ImmutableList<Parameter> outer = rewriteParameterValues(node.getParameters());
    Expression returnType = rewriteOptional(node.getReturnType());
    scopes.push(FUNCTION);
    ImmutableList<Parameter> params = rewriteParameterNames(outer);
    ImmutableList<Statement> body = rewriteBlock(node.getBody());
    scopes.pop();
    return new DefStatement(decorators, name, params, returnType, body);
  }

  @Override
  public Statement rewrite(ClassStatement node) {
    ImmutableList<Expression> decorators = rewriteAll(node.getDecorators());
    Identifier name = rewriteBinding(node.getIdentifier());
    var bases = rewriteArguments(node.getBases());
    scopes.push(new Scope(BoundNames.inBlock(node.getBody())));
    ImmutableList<Statement> body = rewriteBlock(node.getBody());
    scopes.pop();
    return new ClassStatement(decorators, name, bases, body);
  }

  @Override
  public Expression rewrite(LambdaExpression node) {
    ImmutableList<Parameter> outer = rewriteParameterValues(node.getParameters());
    scopes.push(FUNCTION);
    ImmutableList<Parameter> params = rewriteParameterNames(outer);
    Expression body = rewrite(node.getBody());
    scopes.pop();
    return new LambdaExpression(params, body);
  }

  @Override
  public Expression rewrite(Comprehension node) {
    ImmutableList<Comprehension.Clause> clauses = node.getClauses();
    // The first iterable is evaluated in the enclosing scope.
    Comprehension.For first = (Comprehension.For) clauses.get(0);
    Expression firstIterable = rewrite(first.getIterable());
    scopes.push(FUNCTION);
    ImmutableList.Builder<Comprehension.Clause> newClauses = ImmutableList.builder();
    newClauses.add(new Comprehension.For(rewriteTarget(first.getVars()), firstIterable));
    for (Comprehension.Clause clause : clauses.subList(1, clauses.size())) {
      if (clause instanceof Comprehension.For f) {
        newClauses.add(new Comprehension.For(rewriteTarget(f.getVars()), rewrite(f.getIterable())));
      } else {
        newClauses.add(new Comprehension.If(rewrite(((Comprehension.If) clause).getCondition())));
      }
    }
    Node body = node.getBody();
    Node newBody =
        body instanceof DictExpression.Entry entry ? rewrite(entry) : rewrite((Expression) body);
    scopes.pop();
    return new Comprehension(node.getType(), newBody, newClauses.build());
  }

  @Override
  public Statement rewrite(ImportStatement node) {
    if (inClassBody()) {
      return node;
    }
    ImmutableList.Builder<ImportAlias> aliases = ImmutableList.builder();
    for (ImportAlias alias : node.getAliases()) {
      aliases.add(renameAlias(alias));
    }
    return new ImportStatement(aliases.build());
  }

  @Override
  public Statement rewrite(FromImportStatement node) {
    if (inClassBody() || node.isStar()) {
      return node;
    }
    ImmutableList.Builder<ImportAlias> aliases = ImmutableList.builder();
    for (ImportAlias alias : node.getAliases()) {
      aliases.add(renameAlias(alias));
    }
    return new FromImportStatement(
        node.getModule(), node.getLevel(), aliases.build(), /* isStar= */ false);
  }

  private ImportAlias renameAlias(ImportAlias alias) {
    String bound = alias.getBoundName();
    String target = map(bound);
    if (target.equals(bound) || (alias.isDotted() && alias.getAsName() == null)) {
      return alias;
    }
    // An alias equal to the imported name is dropped, so a rename and its inverse cancel out.
    return alias.withAsName(!alias.isDotted() && target.equals(alias.getName()) ? null : target);
  }

  private ImmutableList<Parameter> rewriteParameterValues(ImmutableList<Parameter> params) {
    ImmutableList.Builder<Parameter> result = ImmutableList.builder();
    for (Parameter p : params) {
      Expression type = rewriteOptional(p.getType());
      Expression defaultValue = rewriteOptional(p.getDefaultValue());
      result.add(p.with(p.getIdentifier(), type, defaultValue));
    }
    return result.build();
  }

  private ImmutableList<Parameter> rewriteParameterNames(ImmutableList<Parameter> params) {
    ImmutableList.Builder<Parameter> result = ImmutableList.builder();
    for (Parameter p : params) {
      Identifier id = p.getIdentifier();
      result.add(
          id == null ? p : p.with(rewriteBinding(id), p.getType(), p.getDefaultValue()));
    }
    return result.build();
  }
}
