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

/** Syntax node for dictionary expressions. */
public final class DictExpression extends Expression {

  /**
   * A key/value pair in a dict expression or comprehension. An entry with a null key denotes an
   * unpacking, {@code **value}.
   */
  public static final class Entry extends Node {

    @Nullable private final Expression key;
    private final Expression value;

    public Entry(@Nullable Expression key, Expression value) {
      this.key = key;
      this.value = Preconditions.checkNotNull(value);
    }

    @Nullable
    public Expression getKey() {
      return key;
    }

    public Expression getValue() {
      return value;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final ImmutableList<Entry> entries;

  public DictExpression(ImmutableList<Entry> entries) {
    super(Kind.DICT_EXPR);
    this.entries = Preconditions.checkNotNull(entries);
  }

  public ImmutableList<Entry> getEntries() {
    return entries;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
