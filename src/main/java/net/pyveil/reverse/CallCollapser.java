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
import java.util.HashSet;
import java.util.Set;
import java.util.function.Predicate;
import javax.annotation.Nullable;
import net.pyveil.syntax.Argument;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.DictExpression;
import net.pyveil.syntax.Expression;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.ListExpression;
import net.pyveil.syntax.ParserInput;
import net.pyveil.syntax.StarredExpression;
import net.pyveil.syntax.SyntaxError;

/**
 * Turns trampoline calls {@code T(f, (args...), {'k': v, ...})} back into {@code f(args..., k=v)}.
 * T is the call helper, a {@code lambda f, a, k: f(*a, **k)}, the curried {@code (lambda f: lambda
 * a, k: f(*a, **k))(f)} or an {@code eval} of a trampoline's source. A collapsed call is examined
 * again, so wrappers of wrappers unwind in one visit.
 */
final class CallCollapser extends Recognizer {

  private final Predicate<String> isHelper;

  CallCollapser(Predicate<String> isHelper) {
    this.isHelper = isHelper;
  }

  @Override
  public Expression rewrite(CallExpression node) {
    Expression e = super.rewrite(node);
    for (Expression c = collapse(e); c != null; c = collapse(e)) {
      found();
      e = c;
    }
    return e;
  }

  @Nullable
  private Expression collapse(Expression e) {
    if (!(e instanceof CallExpression call)) {
      return null;
    }
    ImmutableList<Expression> args = Shapes.positionalArgs(call);
    if (args == null) {
      return null;
    }
    Expression fn = call.getFunction();
    if (args.size() == 3
        && ((fn instanceof Identifier id && isHelper.test(id.getName()))
            || Shapes.isTrampoline(fn)
            || isEvalTrampoline(fn))) {
      return direct(args.get(0), args.get(1), args.get(2));
    }
    if (args.size() == 2
        && fn instanceof CallExpression curried
        && Shapes.isCurriedTrampoline(curried.getFunction())) {
      ImmutableList<Expression> target = Shapes.positionalArgs(curried);
      if (target != null && target.size() == 1) {
        return direct(target.get(0), args.get(0), args.get(1));
      }
    }
    return null;
  }

  /** Matches {@code eval('<trampoline source>')}. */
  private static boolean isEvalTrampoline(Expression fn) {
    ImmutableList<Expression> args = Shapes.callArgs(fn, 1);
    if (args == null || !Shapes.isName(((CallExpression) fn).getFunction(), "eval")) {
      return false;
    }
    String source = Shapes.stringValue(args.get(0));
    if (source == null) {
      return false;
    }
    try {
      return Shapes.isTrampoline(Expression.parse(ParserInput.fromString(source, "<eval>")));
    } catch (SyntaxError.Exception ex) {
      return false; // some other evaluated code
    }
  }

  /** Builds {@code fn(args..., k=v...)}, or returns null if the packs are not literal. */
  @Nullable
  private static Expression direct(Expression fn, Expression positional, Expression keywords) {
    if (!(positional instanceof ListExpression tuple)
        || !tuple.isTuple()
        || !(keywords instanceof DictExpression dict)) {
      return null;
    }
    ImmutableList.Builder<Argument> args = ImmutableList.builder();
    for (Expression arg : tuple.getElements()) {
      if (arg instanceof StarredExpression) {
        return null;
      }
      args.add(new Argument.Positional(arg));
    }
    Set<String> seen = new HashSet<>();
    for (DictExpression.Entry entry : dict.getEntries()) {
      String name = entry.getKey() == null ? null : Shapes.stringValue(entry.getKey());
      if (name == null || !Identifier.isValid(name) || !seen.add(name)) {
        return null;
      }
      args.add(new Argument.Keyword(name, entry.getValue()));
    }
    return new CallExpression(fn, args.build());
  }
}
