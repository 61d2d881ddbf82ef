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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;
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
import net.pyveil.syntax.Statement;

/**
 * Turns dynamic module acquisitions back into import statements. A run {@code t = <acquire M>},
 * {@code b = t.a}, ..., {@code del t} becomes {@code from M import a as b, ...}; a lone {@code x =
 * <acquire M>} becomes {@code import M as x}, or {@code import M} when the names agree. An
 * extraction may also take the submodule-loading form {@code b = t.a if hasattr(t, 'a') else
 * import_module('M.a')}.
 */
final class ImportRebuilder extends Recognizer {

  /** A recognized acquisition: the module and, for the fromlist form, the requested names. */
  private record Acquisition(
      String module, @Nullable ImmutableList<String> fromlist, boolean topLevelOnly) {}

  @Override
  public ImmutableList<Statement> rewriteBlock(ImmutableList<Statement> block) {
    ImmutableList<Statement> rewritten = super.rewriteBlock(block);
    ImmutableList.Builder<Statement> result = ImmutableList.builder();
    boolean changed = false;
    int i = 0;
    while (i < rewritten.size()) {
      Statement stmt = rewritten.get(i);
      String target = simpleTarget(stmt);
      Acquisition acq = target == null ? null : acquisition(((AssignmentStatement) stmt).getRHS());
      if (acq != null) {
        int end = fromImportEnd(rewritten, i, target, acq.module());
        if (end > 0) {
          FromImportStatement from =
              fromImport(rewritten.subList(i + 1, end), target, acq);
          if (from != null) {
            found();
            changed = true;
            result.add(from);
            i = end + 1;
            continue;
          }
        }
        ImportStatement imp = plainImport(target, acq);
        if (imp != null) {
          found();
          changed = true;
          result.add(imp);
          i++;
          continue;
        }
      }
      result.add(stmt);
      i++;
    }
    return changed ? result.build() : rewritten;
  }

  /** Returns the name assigned by {@code name = value}, or null. */
  @Nullable
  private static String simpleTarget(Statement stmt) {
    if (stmt instanceof AssignmentStatement assign
        && !assign.isAugmented()
        && assign.getType() == null
        && assign.getTargets().size() == 1
        && assign.getLHS() instanceof Identifier id) {
      return id.getName();
    }
    return null;
  }

  /**
   * Returns the index of the {@code del temp} closing a from-import run that starts at {@code
   * start}, or -1. At least one extraction must precede it.
   */
  private static int fromImportEnd(
      ImmutableList<Statement> block, int start, String temp, String module) {
    int i = start + 1;
    while (i < block.size() && extraction(block.get(i), temp, module) != null) {
      i++;
    }
    if (i == start + 1 || i >= block.size()) {
      return -1;
    }
    return block.get(i) instanceof DelStatement del
            && del.getTargets().size() == 1
            && Shapes.isName(del.getTargets().get(0), temp)
        ? i
        : -1;
  }

  /**
   * Returns the alias for {@code b = temp.a} or {@code b = temp.a if hasattr(temp, 'a') else
   * import_module('module.a')}, or null.
   */
  @Nullable
  private static ImportAlias extraction(Statement stmt, String temp, String module) {
    String bound = simpleTarget(stmt);
    if (bound == null || bound.equals(temp)) {
      return null;
    }
    Expression value = ((AssignmentStatement) stmt).getRHS();
    if (value instanceof ConditionalExpression cond) {
      if (!(cond.getThenCase() instanceof DotExpression dot)
          || !isHasattr(cond.getCondition(), temp, dot.getField())
          || !isImportModuleOf(cond.getElseCase(), module + "." + dot.getField())) {
        return null;
      }
      value = dot;
    }
    if (!(value instanceof DotExpression dot) || !Shapes.isName(dot.getObject(), temp)) {
      return null;
    }
    String name = dot.getField();
    return new ImportAlias(name, name.equals(bound) ? null : bound);
  }

  /** Matches {@code hasattr(temp, 'name')}. */
  private static boolean isHasattr(Expression e, String temp, String name) {
    ImmutableList<Expression> args = Shapes.callArgs(e, 2);
    return args != null
        && Shapes.isName(((CallExpression) e).getFunction(), "hasattr")
        && Shapes.isName(args.get(0), temp)
        && name.equals(Shapes.stringValue(args.get(1)));
  }

  /** Matches an {@code import_module('module')} call in either acquisition spelling. */
  private static boolean isImportModuleOf(Expression e, String module) {
    ImmutableList<Expression> args = Shapes.callArgs(e, 1);
    if (args == null || !module.equals(Shapes.stringValue(args.get(0)))) {
      return false;
    }
    Expression fn = ((CallExpression) e).getFunction();
    return Shapes.isModuleAttr(fn, "importlib", "import_module") || isGetattrImportModule(fn);
  }

  @Nullable
  private static FromImportStatement fromImport(
      ImmutableList<Statement> extractions, String temp, Acquisition acq) {
    if (acq.topLevelOnly()) {
      return null;
    }
    ImmutableList.Builder<ImportAlias> aliases = ImmutableList.builder();
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Statement stmt : extractions) {
      ImportAlias alias = extraction(stmt, temp, acq.module());
      aliases.add(alias);
      names.add(alias.getName());
    }
    if (acq.fromlist() != null && !acq.fromlist().equals(names.build())) {
      return null;
    }
    return new FromImportStatement(acq.module(), 0, aliases.build(), false);
  }

  @Nullable
  private static ImportStatement plainImport(String target, Acquisition acq) {
    if (acq.fromlist() != null || (acq.topLevelOnly() && acq.module().contains("."))) {
      return null;
    }
    String asName = acq.module().equals(target) ? null : target;
    return new ImportStatement(ImmutableList.of(new ImportAlias(acq.module(), asName)));
  }

  /**
   * Matches {@code __import__('importlib').import_module('M')}, {@code
   * getattr(__import__('importlib'), 'import_module')('M')}, {@code __import__('M')} and {@code
   * __import__('M', fromlist=('a', ...))}.
   */
  @Nullable
  private static Acquisition acquisition(Expression e) {
    if (!(e instanceof CallExpression call)) {
      return null;
    }
    Expression fn = call.getFunction();
    ImmutableList<Expression> args = Shapes.callArgs(e, 1);
    if (args != null) {
      String module = moduleName(args.get(0));
      if (module == null) {
        return null;
      }
      if (Shapes.isModuleAttr(fn, "importlib", "import_module") || isGetattrImportModule(fn)) {
        return new Acquisition(module, null, false);
      }
      if (Shapes.isName(fn, "__import__")) {
        return new Acquisition(module, null, true);
      }
      return null;
    }
    // __import__('M', fromlist=(...))
    ImmutableList<Argument> arguments = call.getArguments();
    if (arguments.size() != 2
        || !Shapes.isName(fn, "__import__")
        || !(arguments.get(0) instanceof Argument.Positional)
        || !(arguments.get(1) instanceof Argument.Keyword)
        || !"fromlist".equals(arguments.get(1).getName())
        || !(arguments.get(1).getValue() instanceof ListExpression list)) {
      return null;
    }
    String module = moduleName(arguments.get(0).getValue());
    if (module == null) {
      return null;
    }
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Expression elem : list.getElements()) {
      String name = Shapes.stringValue(elem);
      if (name == null || !Identifier.isValid(name)) {
        return null;
      }
      names.add(name);
    }
    return new Acquisition(module, names.build(), false);
  }

  private static boolean isGetattrImportModule(Expression fn) {
    ImmutableList<Expression> args = Shapes.callArgs(fn, 2);
    return args != null
        && Shapes.isName(((CallExpression) fn).getFunction(), "getattr")
        && Shapes.isDunderImport(args.get(0), "importlib")
        && "import_module".equals(Shapes.stringValue(args.get(1)));
  }

  /** Returns the module named by a string literal, if it is a valid dotted name. */
  @Nullable
  private static String moduleName(Expression e) {
    String module = Shapes.stringValue(e);
    if (module == null) {
      return null;
    }
    for (String part : Splitter.on('.').split(module)) {
      if (!Identifier.isValid(part)) {
        return null;
      }
    }
    return module;
  }
}
