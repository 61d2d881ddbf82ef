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

/**
 * Syntax node for an if or elif statement. An {@code elif} is represented as an else block holding
 * a single IfStatement; the printer turns that shape back into {@code elif}.
 */
public final class IfStatement extends Statement {

  private final Expression condition;
  private final ImmutableList<Statement> thenBlock; // non-empty
  @Nullable private final ImmutableList<Statement> elseBlock; // non-empty if non-null

  public IfStatement(
      Expression condition,
      ImmutableList<Statement> thenBlock,
      @Nullable ImmutableList<Statement> elseBlock) {
    super(Kind.IF);
    Preconditions.checkArgument(!thenBlock.isEmpty(), "empty then block");
    Preconditions.checkArgument(elseBlock == null || !elseBlock.isEmpty(), "empty else block");
    this.condition = Preconditions.checkNotNull(condition);
    this.thenBlock = thenBlock;
    this.elseBlock = elseBlock;
  }

  public Expression getCondition() {
    return condition;
  }

  public ImmutableList<Statement> getThenBlock() {
    return thenBlock;
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
