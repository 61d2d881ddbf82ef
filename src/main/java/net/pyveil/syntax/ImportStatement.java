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

/** Syntax node for {@code import a.b as c, d}. */
public final class ImportStatement extends Statement {

  private final ImmutableList<ImportAlias> aliases;

  public ImportStatement(ImmutableList<ImportAlias> aliases) {
    super(Kind.IMPORT);
    Preconditions.checkArgument(!aliases.isEmpty(), "import without names");
    this.aliases = aliases;
  }

  public ImmutableList<ImportAlias> getAliases() {
    return aliases;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
