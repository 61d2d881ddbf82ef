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
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * One clause of an import statement: a (possibly dotted) name and an optional {@code as} name.
 */
public final class ImportAlias {

  private final String name;
  @Nullable private final String asName;

  public ImportAlias(String name, @Nullable String asName) {
    this.name = Preconditions.checkNotNull(name);
    this.asName = asName;
  }

  /** Returns the imported name, which may be dotted in an {@code import} statement. */
  public String getName() {
    return name;
  }

  @Nullable
  public String getAsName() {
    return asName;
  }

  public boolean isDotted() {
    return name.indexOf('.') >= 0;
  }

  /** Returns the name this clause binds in the importing scope. */
  public String getBoundName() {
    if (asName != null) {
      return asName;
    }
    int dot = name.indexOf('.');
    return dot < 0 ? name : name.substring(0, dot);
  }

  public ImportAlias withAsName(@Nullable String asName) {
    return new ImportAlias(name, asName);
  }

  @Override
  public boolean equals(Object that) {
    return that instanceof ImportAlias alias
        && name.equals(alias.name)
        && Objects.equals(asName, alias.asName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, asName);
  }

  @Override
  public String toString() {
    return asName == null ? name : name + " as " + asName;
  }
}
