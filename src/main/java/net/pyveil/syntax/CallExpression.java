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

package net.pyveil.syntax;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** Syntax node for a function call expression. */
public final class CallExpression extends Expression {

  private final Expression function;
  private final ImmutableList<Argument> arguments;

  public CallExpression(Expression function, ImmutableList<Argument> arguments) {
    super(Kind.CALL);
    this.function = Preconditions.checkNotNull(function);
    this.arguments = Preconditions.checkNotNull(arguments);
  }

  /** Returns a call {@code function(args...)} with only positional arguments. */
  public static CallExpression of(Expression function, Expression... args) {
    ImmutableList.Builder<Argument> list = ImmutableList.builder();
    for (Expression arg : args) {
      list.add(new Argument.Positional(arg));
    }
    return new CallExpression(function, list.build());
  }

  /** Returns a call {@code name(args...)} with only positional arguments. */
  public static CallExpression of(String name, Expression... args) {
    return of(new Identifier(name), args);
  }

  /** Returns the function that is called. */
  public Expression getFunction() {
    return function;
  }

  /** Returns the list of arguments of the call. */
  public ImmutableList<Argument> getArguments() {
    return arguments;
  }

  /** Reports whether every argument is positional or keyword, with no unpacking. */
  public boolean hasOnlySimpleArguments() {
    for (Argument arg : arguments) {
      if (arg instanceof Argument.Star || arg instanceof Argument.StarStar) {
        return false;
      }
    }
    return true;
  }

  /** Reports whether this is a call of the plain name {@code name}. */
  public boolean isCallOf(String name) {
    return function instanceof Identifier id && id.getName().equals(name);
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
