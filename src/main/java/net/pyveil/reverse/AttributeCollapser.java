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
import java.util.List;
import javax.annotation.Nullable;
import net.pyveil.syntax.AssignmentStatement;
import net.pyveil.syntax.BinaryOperatorExpression;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.DelStatement;
import net.pyveil.syntax.DotExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.ExpressionStatement;
import net.pyveil.syntax.Statement;
import net.pyveil.syntax.TokenKind;

/**
 * Turns reflective attribute access back into attribute syntax: the {@code getattr} family into
 * {@code obj.name}, and call statements of the {@code setattr} and {@code delattr} families into
 * assignments and deletions. The name argument must decode to an identifier.
 */
final class AttributeCollapser extends Recognizer {

  @Override
  public Expression rewrite(CallExpression node) {
    Expression e = super.rewrite(node);
    ImmutableList<Expression> args = Shapes.callArgs(e, 2);
    if (args != null && isGetter(((CallExpression) e).getFunction())) {
      return dot(args.get(0), args.get(1), e);
    }
    // __import__('operator').attrgetter(N)(obj)
    args = Shapes.callArgs(e, 1);
    if (args != null) {
      Expression fn = ((CallExpression) e).getFunction();
      ImmutableList<Expression> getterArgs = Shapes.callArgs(fn, 1);
      if (getterArgs != null
          && Shapes.isModuleAttr(((CallExpression) fn).getFunction(), "operator", "attrgetter")) {
        return dot(args.get(0), getterArgs.get(0), e);
      }
    }
    return e;
  }

  private Expression dot(Expression object, Expression nameArg, Expression orig) {
    String name = Shapes.decodeName(nameArg);
    if (name == null) {
      return orig;
    }
    found();
    return new DotExpression(object, name);
  }

  /** Matches the callee of a two-argument attribute read. */
  private static boolean isGetter(Expression fn) {
    if (isPrimitive(fn, "getattr")) {
      return true;
    }
    // globals().get('getattr', getattr)
    if (isScopeLookup(fn, "globals", 2)) {
      return Shapes.isName(((CallExpression) fn).getArguments().get(1).getValue(), "getattr");
    }
    // locals().get('getattr') or getattr
    return fn instanceof BinaryOperatorExpression or
        && or.getOperator() == TokenKind.OR
        && isScopeLookup(or.getX(), "locals", 1)
        && Shapes.isName(or.getY(), "getattr");
  }

  /** Matches {@code scope().get('getattr', ...)} with {@code arity} positional arguments. */
  private static boolean isScopeLookup(Expression e, String scope, int arity) {
    ImmutableList<Expression> args = Shapes.callArgs(e, arity);
    return args != null
        && Shapes.isScopeGet(((CallExpression) e).getFunction(), scope)
        && "getattr".equals(Shapes.stringValue(args.get(0)));
  }

  /**
   * Matches {@code fn}, {@code __import__('builtins').fn} and {@code lambda ...: fn(...)} for a
   * reflection builtin taking {@code arity} arguments.
   */
  private static boolean isPrimitive(Expression callee, String fn) {
    int arity =
        switch (fn) {
          case "setattr" -> 3;
          default -> 2;
        };
    return Shapes.isName(callee, fn)
        || Shapes.isModuleAttr(callee, "builtins", fn)
        || Shapes.isForwardingLambda(callee, fn, arity);
  }

  @Override
  protected List<Statement> expand(Statement stmt) {
    List<Statement> result = super.expand(stmt);
    if (result.size() != 1 || !(result.get(0) instanceof ExpressionStatement exprStmt)) {
      return result;
    }
    Statement restored = restoreStore(exprStmt.getExpression());
    return restored == null ? result : ImmutableList.of(restored);
  }

  @Nullable
  private Statement restoreStore(Expression e) {
    ImmutableList<Expression> args = Shapes.callArgs(e, 3);
    if (args != null && isPrimitive(((CallExpression) e).getFunction(), "setattr")) {
      String name = Shapes.decodeName(args.get(1));
      if (name != null) {
        found();
        return AssignmentStatement.of(new DotExpression(args.get(0), name), args.get(2));
      }
    }
    args = Shapes.callArgs(e, 2);
    if (args != null && isPrimitive(((CallExpression) e).getFunction(), "delattr")) {
      String name = Shapes.decodeName(args.get(1));
      if (name != null) {
        found();
        return new DelStatement(ImmutableList.of(new DotExpression(args.get(0), name)));
      }
    }
    return null;
  }
}
