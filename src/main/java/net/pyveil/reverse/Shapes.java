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
import java.math.BigInteger;
import javax.annotation.Nullable;
import net.pyveil.obfuscate.ConstantFolder;
import net.pyveil.syntax.Argument;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.Comprehension;
import net.pyveil.syntax.DotExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.LambdaExpression;
import net.pyveil.syntax.ListExpression;
import net.pyveil.syntax.Parameter;
import net.pyveil.syntax.StringLiteral;

/**
 * Matchers for the fragments the indirection passes generate. Each returns null or false unless
 * the node has exactly the expected shape.
 */
final class Shapes {

  private static final int MAX_CODE_POINT = Character.MAX_CODE_POINT;

  private Shapes() {}

  static boolean isName(Expression e, String name) {
    return e instanceof Identifier id && id.getName().equals(name);
  }

  @Nullable
  static String stringValue(Expression e) {
    return e instanceof StringLiteral lit ? lit.getValue() : null;
  }

  /** Returns the arguments of a call that has only positional arguments, or null. */
  @Nullable
  static ImmutableList<Expression> positionalArgs(CallExpression call) {
    ImmutableList.Builder<Expression> args = ImmutableList.builder();
    for (Argument arg : call.getArguments()) {
      if (!(arg instanceof Argument.Positional)) {
        return null;
      }
      args.add(arg.getValue());
    }
    return args.build();
  }

  /** Returns the positional arguments if {@code e} is a call with exactly {@code n} of them. */
  @Nullable
  static ImmutableList<Expression> callArgs(Expression e, int n) {
    if (!(e instanceof CallExpression call)) {
      return null;
    }
    ImmutableList<Expression> args = positionalArgs(call);
    return args != null && args.size() == n ? args : null;
  }

  /** Matches {@code __import__('module')}. */
  static boolean isDunderImport(Expression e, String module) {
    ImmutableList<Expression> args = callArgs(e, 1);
    return args != null
        && isName(((CallExpression) e).getFunction(), "__import__")
        && module.equals(stringValue(args.get(0)));
  }

  /** Matches {@code __import__('module').attr}. */
  static boolean isModuleAttr(Expression e, String module, String attr) {
    return e instanceof DotExpression dot
        && dot.getField().equals(attr)
        && isDunderImport(dot.getObject(), module);
  }

  /** Matches {@code globals().get}, {@code locals().get} and the like. */
  static boolean isScopeGet(Expression e, String scopeFunction) {
    return e instanceof DotExpression dot
        && dot.getField().equals("get")
        && callArgs(dot.getObject(), 0) != null
        && isName(((CallExpression) dot.getObject()).getFunction(), scopeFunction);
  }

  /** Returns the names of the parameters if all are plain, else null. */
  @Nullable
  private static ImmutableList<String> plainParams(LambdaExpression lambda) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Parameter p : lambda.getParameters()) {
      if (!(p instanceof Parameter.Mandatory) || p.getType() != null) {
        return null;
      }
      names.add(p.getName());
    }
    return names.build();
  }

  /** Matches {@code lambda p1, ..., pn: fn(p1, ..., pn)}. */
  static boolean isForwardingLambda(Expression e, String fn, int arity) {
    if (!(e instanceof LambdaExpression lambda)) {
      return false;
    }
    ImmutableList<String> params = plainParams(lambda);
    if (params == null || params.size() != arity) {
      return false;
    }
    ImmutableList<Expression> args = callArgs(lambda.getBody(), arity);
    if (args == null || !isName(((CallExpression) lambda.getBody()).getFunction(), fn)) {
      return false;
    }
    for (int i = 0; i < arity; i++) {
      if (!isName(args.get(i), params.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Matches {@code lambda f, a, k: f(*a, **k)}. */
  static boolean isTrampoline(Expression e) {
    if (!(e instanceof LambdaExpression lambda)) {
      return false;
    }
    ImmutableList<String> params = plainParams(lambda);
    return params != null
        && params.size() == 3
        && isSpreadCall(lambda.getBody(), params.get(0), params.get(1), params.get(2));
  }

  /** Matches {@code lambda f: lambda a, k: f(*a, **k)}. */
  static boolean isCurriedTrampoline(Expression e) {
    if (!(e instanceof LambdaExpression outer)) {
      return false;
    }
    ImmutableList<String> outerParams = plainParams(outer);
    if (outerParams == null
        || outerParams.size() != 1
        || !(outer.getBody() instanceof LambdaExpression inner)) {
      return false;
    }
    ImmutableList<String> innerParams = plainParams(inner);
    return innerParams != null
        && innerParams.size() == 2
        && !innerParams.contains(outerParams.get(0))
        && isSpreadCall(
            inner.getBody(), outerParams.get(0), innerParams.get(0), innerParams.get(1));
  }

  // f(*a, **k)
  private static boolean isSpreadCall(Expression e, String f, String a, String k) {
    if (!(e instanceof CallExpression call) || !isName(call.getFunction(), f)) {
      return false;
    }
    ImmutableList<Argument> args = call.getArguments();
    return args.size() == 2
        && args.get(0) instanceof Argument.Star
        && isName(args.get(0).getValue(), a)
        && args.get(1) instanceof Argument.StarStar
        && isName(args.get(1).getValue(), k);
  }

  /**
   * Decodes an attribute name spelled as a literal, as {@code ''.join(('a', 'b'))} or as {@code
   * ''.join(chr(_c) for _c in (97, 98))}. The code points may be encoded integers. Returns null
   * unless the result is a valid identifier.
   */
  @Nullable
  static String decodeName(Expression e) {
    String name = stringValue(e);
    if (name == null) {
      name = decodeJoin(e);
    }
    return name != null && Identifier.isValid(name) ? name : null;
  }

  @Nullable
  private static String decodeJoin(Expression e) {
    ImmutableList<Expression> args = callArgs(e, 1);
    if (args == null
        || !(((CallExpression) e).getFunction() instanceof DotExpression join)
        || !join.getField().equals("join")
        || !"".equals(stringValue(join.getObject()))) {
      return null;
    }
    Expression arg = args.get(0);
    if (arg instanceof ListExpression tuple && tuple.isTuple()) {
      StringBuilder buf = new StringBuilder();
      for (Expression element : tuple.getElements()) {
        String s = stringValue(element);
        if (s == null) {
          return null;
        }
        buf.append(s);
      }
      return buf.toString();
    }
    if (arg instanceof Comprehension gen
        && gen.getType() == Comprehension.Type.GENERATOR
        && gen.getClauses().size() == 1
        && gen.getClauses().get(0) instanceof Comprehension.For loop
        && loop.getVars() instanceof Identifier var
        && loop.getIterable() instanceof ListExpression codes
        && gen.getBody() instanceof Expression body) {
      ImmutableList<Expression> chrArgs = callArgs(body, 1);
      if (chrArgs == null
          || !isName(((CallExpression) body).getFunction(), "chr")
          || !isName(chrArgs.get(0), var.getName())) {
        return null;
      }
      StringBuilder buf = new StringBuilder();
      for (Expression code : codes.getElements()) {
        Integer cp = codePoint(code);
        if (cp == null) {
          return null;
        }
        buf.appendCodePoint(cp);
      }
      return buf.toString();
    }
    return null;
  }

  /** Folds an integer expression to a code point, or null if it is not one. */
  @Nullable
  static Integer codePoint(Expression e) {
    BigInteger value = ConstantFolder.foldInt(e);
    if (value == null
        || value.signum() < 0
        || value.compareTo(BigInteger.valueOf(MAX_CODE_POINT)) > 0) {
      return null;
    }
    return value.intValueExact();
  }
}
