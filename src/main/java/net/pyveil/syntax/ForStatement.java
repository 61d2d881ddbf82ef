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

/** Syntax node for a for loop statement, {@code for vars in iterable: ...}. */
public final class ForStatement extends Statement {

  private final Expression vars;
  private final Expression iterable;
  private final ImmutableList<Statement> body; // non-empty
  @Nullable private final ImmutableList<Statement> elseBlock;

  public ForStatement(
      Expression vars,
      Expression iterable,
      ImmutableList<Statement> body,
      @Nullable ImmutableList<Statement> elseBlock) {
    super(Kind.FOR);
    Preconditions.checkArgument(!body.isEmpty(), "empty loop body");
    this.vars = Preconditions.checkNotNull(vars);
    this.iterable = Preconditions.checkNotNull(iterable);
    this.body = body;
    this.elseBlock = elseBlock;
  }

  /** Returns variables assigned by each iteration. May be a compound target such as (a[b], c.d). */
  public Expression getVars() {
    return vars;
  }

  /** Returns the iterable value. */
  public Expression getIterable() {
    return iterable;
  }

  /** Returns the statements of the loop body. Non-empty. */
  public ImmutableList<Statement> getBody() {
    return body;
  }

  /** Returns the loop-else block, run when the loop finishes without {@code break}, or null. */
  @Nullable
  public ImmutableList<Statement> getElseBlock() {
    return elseBlock;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
