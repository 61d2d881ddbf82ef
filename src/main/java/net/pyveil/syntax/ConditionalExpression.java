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

/** Syntax node for an if/else expression, {@code then if cond else els}. */
public final class ConditionalExpression extends Expression {

  private final Expression thenCase;
  private final Expression condition;
  private final Expression elseCase;

  public ConditionalExpression(Expression thenCase, Expression condition, Expression elseCase) {
    super(Kind.CONDITIONAL);
    this.thenCase = Preconditions.checkNotNull(thenCase);
    this.condition = Preconditions.checkNotNull(condition);
    this.elseCase = Preconditions.checkNotNull(elseCase);
  }

  public Expression getThenCase() {
    return thenCase;
  }

  public Expression getCondition() {
    return condition;
  }

  public Expression getElseCase() {
    return elseCase;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
