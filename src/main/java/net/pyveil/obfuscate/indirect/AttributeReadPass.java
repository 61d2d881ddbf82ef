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

import com.google.common.collect.ImmutableSet;
import net.pyveil.obfuscate.MethodFamily;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.syntax.BinaryOperatorExpression;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.DotExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.LambdaExpression;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.TokenKind;

/**
 * Replaces attribute loads {@code obj.name} with a reflective lookup. The method comes from the
 * attribute-read pool:
 *
 * <ul>
 *   <li>{@code getattr(obj, N)}
 *   <li>{@code __import__('builtins').getattr(obj, N)}
 *   <li>{@code __import__('operator').attrgetter(N)(obj)}
 *   <li>{@code (lambda _o, _n: getattr(_o, _n))(obj, N)}
 *   <li>{@code globals().get('getattr', getattr)(obj, N)}
 *   <li>{@code (locals().get('getattr') or getattr)(obj, N)}
 * </ul>
 *
 * where N spells the attribute name in one of the forms of {@link #nameExpression}. Stores and
 * deletes keep their attribute syntax.
 */
public final class AttributeReadPass extends IndirectionPass {

  private static final ImmutableSet<String> REQUIRED =
      ImmutableSet.of("getattr", "globals", "locals", "chr", "__import__");

  private AttributeReadPass(PassContext ctx) {
    super(ctx, Counter.ATTRS);
  }

  public static PyFile apply(PyFile file, PassContext ctx) {
    return new AttributeReadPass(ctx).run(file);
  }

  @Override
  ImmutableSet<String> requiredBuiltins() {
    return REQUIRED;
  }

  @Override
  public Expression rewrite(DotExpression node) {
    Expression object = rewrite(node.getObject());
    String attr = node.getField();
    if (!isEligibleAttribute(attr) || !random.draw(ctx.config().attrRate())) {
      return object == node.getObject() ? node : new DotExpression(object, attr);
    }
    changed();
    Expression name = nameExpression(attr);
    return switch (pick(MethodFamily.ATTR)) {
      case BUILTINS_GETATTR -> CallExpression.of(moduleAttr("builtins", "getattr"), object, name);
      case OPERATOR_ATTRGETTER ->
          CallExpression.of(CallExpression.of(moduleAttr("operator", "attrgetter"), name), object);
      case LAMBDA_GETATTR ->
          CallExpression.of(
              LambdaExpression.of(
                  CallExpression.of("getattr", new Identifier("_o"), new Identifier("_n")),
                  "_o",
                  "_n"),
              object,
              name);
      case GLOBALS_GETATTR ->
          CallExpression.of(
              CallExpression.of(
                  new DotExpression(CallExpression.of("globals"), "get"),
                  str("getattr"),
                  new Identifier("getattr")),
              object,
              name);
      case LOCALS_GETATTR ->
          CallExpression.of(
              new BinaryOperatorExpression(
                  CallExpression.of(
                      new DotExpression(CallExpression.of("locals"), "get"), str("getattr")),
                  TokenKind.OR,
                  new Identifier("getattr")),
              object,
              name);
      case GETATTR -> CallExpression.of("getattr", object, name);
      default -> throw new IllegalStateException("not an attribute-read method");
    };
  }
}
