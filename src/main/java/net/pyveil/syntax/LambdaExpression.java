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

/** A LambdaExpression ({@code lambda params: body}) denotes an anonymous function. */
public final class LambdaExpression extends Expression {

  private final ImmutableList<Parameter> parameters;
  private final Expression body;

  public LambdaExpression(ImmutableList<Parameter> parameters, Expression body) {
    super(Kind.LAMBDA);
    this.parameters = Preconditions.checkNotNull(parameters);
    this.body = Preconditions.checkNotNull(body);
  }

  /** Returns {@code lambda a, b, ...: body} with plain positional parameters. */
  public static LambdaExpression of(Expression body, String... params) {
    ImmutableList.Builder<Parameter> list = ImmutableList.builder();
    for (String name : params) {
      list.add(new Parameter.Mandatory(new Identifier(name), null));
    }
    return new LambdaExpression(list.build(), body);
  }

  public ImmutableList<Parameter> getParameters() {
    return parameters;
  }

  public Expression getBody() {
    return body;
  }

  /** Returns the names of the parameters, skipping bare markers. */
  public ImmutableList<String> getParameterNames() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Parameter p : parameters) {
      if (p.getName() != null) {
        names.add(p.getName());
      }
    }
    return names.build();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
