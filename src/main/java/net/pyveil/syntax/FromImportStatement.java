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
 * Syntax node for {@code from ..module import a as b, c} and {@code from module import *}.
 *
 * <p>The level counts the leading dots of a relative import; the module is null for {@code from .
 * import x}. A star import has no aliases.
 */
public final class FromImportStatement extends Statement {

  @Nullable private final String module;
  private final int level;
  private final ImmutableList<ImportAlias> aliases;
  private final boolean isStar;

  public FromImportStatement(
      @Nullable String module, int level, ImmutableList<ImportAlias> aliases, boolean isStar) {
    super(Kind.FROM_IMPORT);
    Preconditions.checkArgument(module != null || level > 0, "missing module");
    Preconditions.checkArgument(isStar == aliases.isEmpty(), "star import with names");
    this.module = module;
    this.level = level;
    this.aliases = aliases;
    this.isStar = isStar;
  }

  @Nullable
  public String getModule() {
    return module;
  }

  public int getLevel() {
    return level;
  }

  public ImmutableList<ImportAlias> getAliases() {
    return aliases;
  }

  public boolean isStar() {
    return isStar;
  }

  /** Reports whether this is a {@code from __future__ import} statement. */
  public boolean isFuture() {
    return level == 0 && "__future__".equals(module);
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
