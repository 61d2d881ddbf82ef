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
import net.pyveil.obfuscate.IndirectionMethod;
import net.pyveil.obfuscate.MethodFamily;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.syntax.AssignmentStatement;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.DelStatement;
import net.pyveil.syntax.DotExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.ExpressionStatement;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.LambdaExpression;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.Statement;

/**
 * Replaces {@code obj.name = value} with a call of {@code setattr} and {@code del obj.name} with a
 * call of {@code delattr}, in the direct, {@code __import__('builtins')}-qualified or single-use
 * lambda form.
 *
 * <p>Only plain assignments with exactly one attribute target qualify. A {@code del} qualifies when
 * every target is an eligible attribute; it becomes one call statement per target.
 *
 * <p>The rewritten assignment evaluates the object before the value, where the original evaluated
 * the value first.
 */
public final class AttributeWritePass extends IndirectionPass {

  private static final ImmutableSet<String> REQUIRED =
      ImmutableSet.of("setattr", "delattr", "__import__");

  private final ImmutableList<IndirectionMethod> setters;
  private final ImmutableList<IndirectionMethod> deleters;

  private AttributeWritePass(PassContext ctx) {
    super(ctx, Counter.SETATTRS);
    ImmutableList<IndirectionMethod> pool = ctx.config().pool(MethodFamily.SETATTR);
    ImmutableList<IndirectionMethod> set =
        pool.stream().filter(m -> !m.isDelete()).collect(ImmutableList.toImmutableList());
    ImmutableList<IndirectionMethod> del =
        pool.stream().filter(IndirectionMethod::isDelete).collect(ImmutableList.toImmutableList());
    this.setters = set.isEmpty() ? ImmutableList.of(IndirectionMethod.SETATTR) : set;
    this.deleters = del.isEmpty() ? ImmutableList.of(IndirectionMethod.DELATTR) : del;
  }

  public static PyFile apply(PyFile file, PassContext ctx) {
    return new AttributeWritePass(ctx).run(file);
  }

  @Override
  ImmutableSet<String> requiredBuiltins() {
    return REQUIRED;
  }

  @Override
  protected List<Statement> expand(Statement stmt) {
    if (stmt instanceof AssignmentStatement assign && isSimpleAttributeStore(assign)) {
      DotExpression target = (DotExpression) assign.getLHS();
      if (random.draw(ctx.config().setattrRate())) {
        changed();
        Expression object = rewrite(target.getObject());
        Expression value = rewrite(assign.getRHS());
        return ImmutableList.of(
            new ExpressionStatement(setCall(object, target.getField(), value)));
      }
    } else if (stmt instanceof DelStatement del && isAttributeDelete(del)) {
      if (random.draw(ctx.config().setattrRate())) {
        ImmutableList.Builder<Statement> calls = ImmutableList.builder();
        for (Expression t : del.getTargets()) {
          DotExpression target = (DotExpression) t;
          changed();
          calls.add(
              new ExpressionStatement(delCall(rewrite(target.getObject()), target.getField())));
        }
        return calls.build();
      }
    }
    return super.expand(stmt);
  }

  private boolean isSimpleAttributeStore(AssignmentStatement assign) {
    return assign.getTargets().size() == 1
        && !assign.isAugmented()
        && assign.getType() == null
        && assign.getLHS() instanceof DotExpression dot
        && isEligibleAttribute(dot.getField());
  }

  private boolean isAttributeDelete(DelStatement del) {
    for (Expression target : del.getTargets()) {
      if (!(target instanceof DotExpression dot) || !isEligibleAttribute(dot.getField())) {
        return false;
      }
    }
    return true;
  }

  private Expression setCall(Expression object, String attr, Expression value) {
    return switch (random.choose(setters)) {
      case BUILTINS_SETATTR ->
          CallExpression.of(moduleAttr("builtins", "setattr"), object, str(attr), value);
      case LAMBDA_SETATTR ->
          CallExpression.of(
              LambdaExpression.of(
                  CallExpression.of(
                      "setattr", new Identifier("_o"), new Identifier("_n"), new Identifier("_v")),
                  "_o",
                  "_n",
                  "_v"),
              object,
              str(attr),
              value);
      case SETATTR -> CallExpression.of("setattr", object, str(attr), value);
      default -> throw new IllegalStateException("not a setter");
    };
  }

  private Expression delCall(Expression object, String attr) {
    return switch (random.choose(deleters)) {
      case BUILTINS_DELATTR ->
          CallExpression.of(moduleAttr("builtins", "delattr"), object, str(attr));
      case LAMBDA_DELATTR ->
          CallExpression.of(
              LambdaExpression.of(
                  CallExpression.of("delattr", new Identifier("_o"), new Identifier("_n")),
                  "_o",
                  "_n"),
              object,
              str(attr));
      case DELATTR -> CallExpression.of("delattr", object, str(attr));
      default -> throw new IllegalStateException("not a deleter");
    };
  }
}
