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
import javax.annotation.Nullable;

/** Syntax node for a 'def' statement, which defines a function. */
public final class DefStatement extends Statement {

  private final ImmutableList<Expression> decorators;
  private final Identifier identifier;
  private final ImmutableList<Parameter> parameters;
  @Nullable private final Expression returnType;
  private final ImmutableList<Statement> body; // non-empty

  public DefStatement(
      ImmutableList<Expression> decorators,
      Identifier identifier,
      ImmutableList<Parameter> parameters,
      @Nullable Expression returnType,
      ImmutableList<Statement> body) {
    super(Kind.DEF);
    Preconditions.checkArgument(!body.isEmpty(), "empty function body");
    this.decorators = Preconditions.checkNotNull(decorators);
    this.identifier = Preconditions.checkNotNull(identifier);
    this.parameters = Preconditions.checkNotNull(parameters);
    this.returnType = returnType;
    this.body = body;
  }

  /** Returns a copy of this definition with a different body. */
  public DefStatement withBody(ImmutableList<Statement> body) {
    return new DefStatement(decorators, identifier, parameters, returnType, body);
  }

  public ImmutableList<Expression> getDecorators() {
    return decorators;
  }

  public Identifier getIdentifier() {
    return identifier;
  }

  public ImmutableList<Parameter> getParameters() {
    return parameters;
  }

  /** Returns the return type annotation, or null if there is none. */
  @Nullable
  public Expression getReturnType() {
    return returnType;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
