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
import java.util.List;
import javax.annotation.Nullable;
import net.pyveil.obfuscate.IndirectionMethod;
import net.pyveil.obfuscate.MethodFamily;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.syntax.Argument;
import net.pyveil.syntax.AssignmentStatement;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.ConditionalExpression;
import net.pyveil.syntax.DelStatement;
import net.pyveil.syntax.DotExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.FromImportStatement;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.ImportAlias;
import net.pyveil.syntax.ImportStatement;
import net.pyveil.syntax.ListExpression;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.Statement;

/**
 * Replaces import statements with a dynamic module acquisition:
 *
 * <ul>
 *   <li>{@code import M as X} becomes {@code X = <acquire M>};
 *   <li>{@code from M import a as b, c} becomes {@code _t = <acquire M>}, {@code b = _t.a}, {@code
 *       c = _t.c}, {@code del _t}.
 * </ul>
 *
 * <p>A module is acquired with {@code __import__('importlib').import_module('M')}, {@code
 * getattr(__import__('importlib'), 'import_module')('M')} or {@code __import__('M')}. A from-import
 * has to load the names that are submodules, as the statement does: the last form passes the
 * names as {@code fromlist}, and the {@code import_module} forms extract each name as {@code b =
 * _t.a if hasattr(_t, 'a') else import_module('M.a')}. {@code __import__} returns the top-level
 * package for a dotted name, so a dotted {@code import M as X} uses {@code import_module} instead.
 *
 * <p>Dotted imports without an alias, star imports, relative imports and {@code __future__}
 * imports are left alone.
 */
public final class ImportPass extends IndirectionPass {

  private static final ImmutableSet<String> REQUIRED =
      ImmutableSet.of("getattr", "hasattr", "__import__");

  @Nullable private String moduleTemp;

  private ImportPass(PassContext ctx) {
    super(ctx, Counter.IMPORTS);
  }

  public static PyFile apply(PyFile file, PassContext ctx) {
    return new ImportPass(ctx).run(file);
  }

  @Override
  ImmutableSet<String> requiredBuiltins() {
    return REQUIRED;
  }

  @Override
  protected List<Statement> expand(Statement stmt) {
    if (stmt instanceof ImportStatement imp) {
      return rewriteImport(imp);
    }
    if (stmt instanceof FromImportStatement from) {
      return rewriteFromImport(from);
    }
    return super.expand(stmt);
  }

  private List<Statement> rewriteImport(ImportStatement imp) {
    ImmutableList.Builder<Statement> result = ImmutableList.builder();
    boolean changed = false;
    for (ImportAlias alias : imp.getAliases()) {
      boolean eligible = !alias.isDotted() || alias.getAsName() != null;
      if (eligible && random.draw(ctx.config().importRate())) {
        changed();
        changed = true;
        result.add(
            AssignmentStatement.of(
                alias.getBoundName(),
                acquire(pick(MethodFamily.IMPORT), alias.getName(), null)));
      } else {
        result.add(new ImportStatement(ImmutableList.of(alias)));
      }
    }
    return changed ? result.build() : ImmutableList.of(imp);
  }

  private List<Statement> rewriteFromImport(FromImportStatement from) {
    if (from.isStar()
        || from.isFuture()
        || from.getLevel() > 0
        || !random.draw(ctx.config().importRate())) {
      return ImmutableList.of(from);
    }
    changed();
    String temp = moduleTemp();
    String module = from.getModule();
    IndirectionMethod method = pick(MethodFamily.IMPORT);
    ImmutableList.Builder<Statement> result = ImmutableList.builder();
    result.add(AssignmentStatement.of(temp, acquire(method, module, from.getAliases())));
    for (ImportAlias alias : from.getAliases()) {
      Expression value = new DotExpression(new Identifier(temp), alias.getName());
      if (method != IndirectionMethod.DUNDER_IMPORT) {
        // The attribute exists once the submodule M.a has been imported.
        value =
            new ConditionalExpression(
                value,
                CallExpression.of("hasattr", new Identifier(temp), str(alias.getName())),
                CallExpression.of(importModule(method), str(module + "." + alias.getName())));
      }
      result.add(AssignmentStatement.of(alias.getBoundName(), value));
    }
    result.add(new DelStatement(ImmutableList.of(new Identifier(temp))));
    return result.build();
  }

  /**
   * Returns an expression loading {@code module}. {@code fromNames} lists the aliases of a
   * from-import, or is null for a plain import.
   */
  private static Expression acquire(
      IndirectionMethod method, String module, @Nullable ImmutableList<ImportAlias> fromNames) {
    if (method == IndirectionMethod.DUNDER_IMPORT && fromNames == null && module.contains(".")) {
      method = IndirectionMethod.IMPORTLIB_IMPORT_MODULE;
    }
    return switch (method) {
      case IMPORTLIB_IMPORT_MODULE, GETATTR_IMPORTLIB ->
          CallExpression.of(importModule(method), str(module));
      case DUNDER_IMPORT -> {
        if (fromNames == null) {
          yield dunderImport(module);
        }
        ImmutableList.Builder<Expression> names = ImmutableList.builder();
        for (ImportAlias alias : fromNames) {
          names.add(str(alias.getName()));
        }
        yield new CallExpression(
            new Identifier("__import__"),
            ImmutableList.of(
                new Argument.Positional(str(module)),
                new Argument.Keyword("fromlist", ListExpression.tuple(names.build()))));
      }
      default -> throw new IllegalStateException("not an import method");
    };
  }

  /** Returns the {@code import_module} function, spelled as {@code method} does. */
  private static Expression importModule(IndirectionMethod method) {
    return switch (method) {
      case IMPORTLIB_IMPORT_MODULE -> moduleAttr("importlib", "import_module");
      case GETATTR_IMPORTLIB ->
          CallExpression.of("getattr", dunderImport("importlib"), str("import_module"));
      default -> throw new IllegalStateException("not an import_module method: " + method);
    };
  }

  /** The temporary holding a module during a from-import, chosen once per run. */
  private String moduleTemp() {
    if (moduleTemp == null) {
      moduleTemp = ctx.names().fresh("_mod");
    }
    return moduleTemp;
  }
}
