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
import com.google.common.collect.Sets;
import java.util.Set;
import net.pyveil.obfuscate.IndirectionMethod;
import net.pyveil.obfuscate.MethodFamily;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.syntax.Argument;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.ClassStatement;
import net.pyveil.syntax.DefStatement;
import net.pyveil.syntax.DictExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.LambdaExpression;
import net.pyveil.syntax.ListExpression;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.Statement;

/**
 * Routes calls {@code f(a, k=v)} through a trampoline taking the callable, a tuple of positional
 * arguments and a dict of keyword arguments:
 *
 * <ul>
 *   <li>{@code _obf_call(f, (a,), {'k': v})}, with the helper defined once per module;
 *   <li>{@code (lambda _f, _a, _k: _f(*_a, **_k))(f, (a,), {'k': v})};
 *   <li>{@code (lambda _f: lambda _a, _k: _f(*_a, **_k))(f)((a,), {'k': v})};
 *   <li>{@code eval('lambda _f, _a, _k: _f(*_a, **_k)')(f, (a,), {'k': v})}.
 * </ul>
 *
 * <p>Calls that unpack arguments, decorator calls, calls of the generated helpers and calls of
 * builtins that inspect their caller's frame are left alone.
 */
public final class CallPass extends IndirectionPass {

  private static final ImmutableSet<String> FRAME_SENSITIVE =
      ImmutableSet.of("super", "locals", "vars", "dir", "eval", "exec", "globals");

  private static final String EVAL_SOURCE = "lambda _f, _a, _k: _f(*_a, **_k)";

  private final Set<Expression> decorators = Sets.newIdentityHashSet();

  private CallPass(PassContext ctx) {
    super(ctx, Counter.CALLS);
  }

  public static PyFile apply(PyFile file, PassContext ctx) {
    return new CallPass(ctx).run(file);
  }

  @Override
  ImmutableSet<String> requiredBuiltins() {
    return ctx.config().pool(MethodFamily.CALL).contains(IndirectionMethod.BUILTINS_EVAL_CALL)
        ? ImmutableSet.of("eval")
        : ImmutableSet.of();
  }

  @Override
  public Statement rewrite(DefStatement node) {
    decorators.addAll(node.getDecorators());
    return super.rewrite(node);
  }

  @Override
  public Statement rewrite(ClassStatement node) {
    decorators.addAll(node.getDecorators());
    return super.rewrite(node);
  }

  @Override
  public Expression rewrite(CallExpression node) {
    Expression call = super.rewrite(node);
    if (decorators.contains(node) || !isEligible(node)) {
      return call;
    }
    if (!random.draw(ctx.config().callRate())) {
      return call;
    }
    CallExpression rewritten = (CallExpression) call;
    Expression function = rewritten.getFunction();
    ImmutableList.Builder<Expression> positional = ImmutableList.builder();
    ImmutableList.Builder<DictExpression.Entry> keywords = ImmutableList.builder();
    for (Argument arg : rewritten.getArguments()) {
      if (arg instanceof Argument.Keyword) {
        keywords.add(new DictExpression.Entry(str(arg.getName()), arg.getValue()));
      } else {
        positional.add(arg.getValue());
      }
    }
    ListExpression args = ListExpression.tuple(positional.build());
    DictExpression kwargs = new DictExpression(keywords.build());
    changed();
    return switch (pick(MethodFamily.CALL)) {
      case HELPER_WRAP -> CallExpression.of(ctx.useCallHelper(), function, args, kwargs);
      case LAMBDA_WRAP -> CallExpression.of(trampoline("_f", "_a", "_k"), function, args, kwargs);
      case DOUBLE_LAMBDA_WRAP ->
          CallExpression.of(
              CallExpression.of(
                  LambdaExpression.of(trampoline("_a", "_k"), "_f"), function),
              args,
              kwargs);
      case BUILTINS_EVAL_CALL ->
          CallExpression.of(CallExpression.of("eval", str(EVAL_SOURCE)), function, args, kwargs);
      default -> throw new IllegalStateException("not a call method");
    };
  }

  private boolean isEligible(CallExpression node) {
    if (!node.hasOnlySimpleArguments()) {
      return false;
    }
    if (node.getFunction() instanceof Identifier id) {
      String name = id.getName();
      return !FRAME_SENSITIVE.contains(name)
          && !name.equals(ctx.stringHelper())
          && !name.equals(ctx.callHelper());
    }
    return true;
  }

  /** Returns {@code lambda params: _f(*_a, **_k)}. */
  private static LambdaExpression trampoline(String... params) {
    return LambdaExpression.of(
        new CallExpression(
            new Identifier("_f"),
            ImmutableList.of(
                new Argument.Star(new Identifier("_a")),
                new Argument.StarStar(new Identifier("_k")))),
        params);
  }
}
