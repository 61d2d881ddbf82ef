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
import javax.annotation.Nullable;

/** Syntax node for {@code yield}, {@code yield value} and {@code yield from value}. */
public final class YieldExpression extends Expression {

  @Nullable private final Expression value;
  private final boolean isFrom;

  public YieldExpression(@Nullable Expression value, boolean isFrom) {
    super(Kind.YIELD);
    Preconditions.checkArgument(!isFrom || value != null, "yield from requires a value");
    this.value = value;
    this.isFrom = isFrom;
  }

  @Nullable
  public Expression getValue() {
    return value;
  }

  public boolean isFrom() {
    return isFrom;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
