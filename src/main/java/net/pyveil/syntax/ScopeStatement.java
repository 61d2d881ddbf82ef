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

/** Syntax node for {@code global a, b} and {@code nonlocal a, b}. */
public final class ScopeStatement extends Statement {

  private final TokenKind scopeKind; // GLOBAL | NONLOCAL
  private final ImmutableList<Identifier> names;

  public ScopeStatement(TokenKind scopeKind, ImmutableList<Identifier> names) {
    super(Kind.SCOPE);
    Preconditions.checkArgument(
        scopeKind == TokenKind.GLOBAL || scopeKind == TokenKind.NONLOCAL,
        "not a scope statement: %s",
        scopeKind);
    Preconditions.checkArgument(!names.isEmpty(), "scope statement without names");
    this.scopeKind = scopeKind;
    this.names = names;
  }

  public TokenKind getScopeKind() {
    return scopeKind;
  }

  public ImmutableList<Identifier> getNames() {
    return names;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
