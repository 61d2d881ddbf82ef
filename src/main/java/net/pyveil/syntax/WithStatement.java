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

/** Syntax node for {@code with a as b, c: ...}. */
public final class WithStatement extends Statement {

  /** One context manager clause, {@code context [as target]}. */
  public static final class Item {
    private final Expression context;
    @Nullable private final Expression target;

    public Item(Expression context, @Nullable Expression target) {
      this.context = Preconditions.checkNotNull(context);
      this.target = target;
    }

    public Expression getContext() {
      return context;
    }

    @Nullable
    public Expression getTarget() {
      return target;
    }
  }

  private final ImmutableList<Item> items;
  private final ImmutableList<Statement> body;

  public WithStatement(ImmutableList<Item> items, ImmutableList<Statement> body) {
    super(Kind.WITH);
    Preconditions.checkArgument(!items.isEmpty(), "with without items");
    Preconditions.checkArgument(!body.isEmpty(), "empty with block");
    this.items = items;
    this.body = body;
  }

  public ImmutableList<Item> getItems() {
    return items;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
