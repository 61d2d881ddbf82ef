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

package net.pyveil.obfuscate.indirect;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.TreeSet;
import net.pyveil.obfuscate.Blocks;
import net.pyveil.obfuscate.BoundNames;
import net.pyveil.obfuscate.Builtins;
import net.pyveil.obfuscate.MethodFamily;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.syntax.AssignmentStatement;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.DotExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.NodeVisitor;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.Statement;

/**
 * Gives every builtin the program loads, and never binds, a module-level alias, then replaces
 * loads of the builtin with the alias. Each alias is bound as {@code A = len}, {@code A =
 * getattr(__import__('builtins'), 'len')} or {@code A = globals().get('len', len)}.
 *
 * <p>{@code super} is never aliased: its zero-argument form only works under its own name.
 */
public final class BuiltinAliasPass extends IndirectionPass {

  private static final ImmutableSet<String> NEVER_ALIASED = ImmutableSet.of("super");

  private final Map<String, String> aliases;

  private BuiltinAliasPass(PassContext ctx, Map<String, String> aliases) {
    super(ctx, Counter.BUILTINS);
    this.aliases = aliases;
  }

  /** Runs once over the final tree, after every other pass and the helper insertion. */
  public static PyFile apply(PyFile file, PassContext ctx) {
    ImmutableSet<String> targets = targets(file, ctx);
    if (targets.isEmpty()) {
      return file;
    }
    ImmutableSortedMap.Builder<String, String> aliases = ImmutableSortedMap.naturalOrder();
    for (String builtin : targets) {
      aliases.put(builtin, ctx.names().next());
    }
    ImmutableSortedMap<String, String> table = aliases.buildOrThrow();
    PyFile result = new BuiltinAliasPass(ctx, table).run(file);

    ImmutableList.Builder<Statement> bindings = ImmutableList.builder();
    for (Map.Entry<String, String> e : table.entrySet()) {
      bindings.add(AssignmentStatement.of(e.getValue(), aliasValue(ctx, e.getKey())));
      ctx.addBuiltinAlias(e.getValue(), e.getKey());
    }
    ImmutableList<Statement> stmts = result.getStatements();
    return result.withStatements(
        Blocks.insert(stmts, Blocks.moduleInsertionPoint(stmts), bindings.build()));
  }

  @Override
  ImmutableSet<String> requiredBuiltins() {
    return ImmutableSet.of();
  }

  @Override
  public Expression rewrite(Identifier node) {
    String alias = aliases.get(node.getName());
    if (alias != null && random.draw(ctx.config().builtinRate())) {
      changed();
      return new Identifier(alias);
    }
    return node;
  }

  private static Expression aliasValue(PassContext ctx, String builtin) {
    return switch (ctx.random().choose(ctx.config().pool(MethodFamily.BUILTIN))) {
      case BUILTINS_GETATTR_ALIAS ->
          CallExpression.of("getattr", dunderImport("builtins"), str(builtin));
      case GLOBALS_LOOKUP ->
          CallExpression.of(
              new DotExpression(CallExpression.of("globals"), "get"),
              str(builtin),
              new Identifier(builtin));
      case ALIAS -> new Identifier(builtin);
      default -> throw new IllegalStateException("not a builtin-alias method");
    };
  }

  /** Returns the builtins loaded somewhere in the file and bound nowhere, sorted. */
  private static ImmutableSet<String> targets(PyFile file, PassContext ctx) {
    ImmutableSet<String> bound = BoundNames.all(file);
    TreeSet<String> found = new TreeSet<>();
    new NodeVisitor() {
      @Override
      public void visit(Identifier id) {
        String name = id.getName();
        if (Builtins.isBuiltin(name)
            && !Identifier.isDunder(name)
            && !NEVER_ALIASED.contains(name)
            && !bound.contains(name)
            && !ctx.config().preserveNames().contains(name)) {
          found.add(name);
        }
      }
    }.visit(file);
    return ImmutableSet.copyOf(found);
  }
}
