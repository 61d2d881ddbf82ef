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

/** Syntax node for a try statement with its except, else and finally clauses. */
public final class TryStatement extends Statement {

  /** An {@code except [type [as name]]:} clause. */
  public static final class ExceptHandler extends Node {
    @Nullable private final Expression type;
    @Nullable private final Identifier name;
    private final ImmutableList<Statement> body;

    public ExceptHandler(
        @Nullable Expression type, @Nullable Identifier name, ImmutableList<Statement> body) {
      Preconditions.checkArgument(name == null || type != null, "except name without type");
      Preconditions.checkArgument(!body.isEmpty(), "empty except block");
      this.type = type;
      this.name = name;
      this.body = body;
    }

    @Nullable
    public Expression getType() {
      return type;
    }

    @Nullable
    public Identifier getName() {
      return name;
    }

    public ImmutableList<Statement> getBody() {
      return body;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final ImmutableList<Statement> body;
  private final ImmutableList<ExceptHandler> handlers;
  @Nullable private final ImmutableList<Statement> elseBlock;
  @Nullable private final ImmutableList<Statement> finallyBlock;

  public TryStatement(
      ImmutableList<Statement> body,
      ImmutableList<ExceptHandler> handlers,
      @Nullable ImmutableList<Statement> elseBlock,
      @Nullable ImmutableList<Statement> finallyBlock) {
    super(Kind.TRY);
    Preconditions.checkArgument(!body.isEmpty(), "empty try block");
    Preconditions.checkArgument(
        !handlers.isEmpty() || finallyBlock != null, "try without except or finally");
    Preconditions.checkArgument(elseBlock == null || !handlers.isEmpty(), "else without except");
    this.body = body;
    this.handlers = handlers;
    this.elseBlock = elseBlock;
    this.finallyBlock = finallyBlock;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  public ImmutableList<ExceptHandler> getHandlers() {
    return handlers;
  }

  @Nullable
  public ImmutableList<Statement> getElseBlock() {
    return elseBlock;
  }

  @Nullable
  public ImmutableList<Statement> getFinallyBlock() {
    return finallyBlock;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
