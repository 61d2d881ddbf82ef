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

/** Syntax node for a while loop, {@code while condition: ...}. */
public final class WhileStatement extends Statement {

  private final Expression condition;
  private final ImmutableList<Statement> body;
  @Nullable private final ImmutableList<Statement> elseBlock;

  public WhileStatement(
      Expression condition,
      ImmutableList<Statement> body,
      @Nullable ImmutableList<Statement> elseBlock) {
    super(Kind.WHILE);
    Preconditions.checkArgument(!body.isEmpty(), "empty loop body");
    this.condition = Preconditions.checkNotNull(condition);
    this.body = body;
    this.elseBlock = elseBlock;
  }

  public Expression getCondition() {
    return condition;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Nullable
  public ImmutableList<Statement> getElseBlock() {
    return elseBlock;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
