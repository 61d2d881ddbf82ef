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

/** Syntax node for list and tuple expressions. */
public final class ListExpression extends Expression {

  private final boolean isTuple;
  private final ImmutableList<Expression> elements;

  public ListExpression(boolean isTuple, ImmutableList<Expression> elements) {
    super(Kind.LIST_EXPR);
    this.isTuple = isTuple;
    this.elements = Preconditions.checkNotNull(elements);
  }

  /** Returns a tuple expression of the given elements. */
  public static ListExpression tuple(Iterable<? extends Expression> elements) {
    return new ListExpression(true, ImmutableList.copyOf(elements));
  }

  /** Returns a tuple expression of the given elements. */
  public static ListExpression tuple(Expression... elements) {
    return new ListExpression(true, ImmutableList.copyOf(elements));
  }

  public ImmutableList<Expression> getElements() {
    return elements;
  }

  /** Reports whether this is a tuple expression. */
  public boolean isTuple() {
    return isTuple;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
