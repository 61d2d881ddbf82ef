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

package net.pyveil.obfuscate;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import javax.annotation.Nullable;
import net.pyveil.syntax.PyFile;

/** The outcome of {@link Obfuscator#obfuscate}. */
@AutoValue
public abstract class ObfuscationResult {

  /** The rewritten tree. */
  public abstract PyFile file();

  /** The rewritten tree, printed. */
  public abstract String output();

  /** Old name to new name, for every renamed binding. */
  public abstract ImmutableMap<String, String> renameMap();

  public abstract ObfuscationStats stats();

  /** The name of the inserted string decoder, or null if none was inserted. */
  @Nullable
  public abstract String stringHelper();

  /** The name of the inserted call trampoline, or null if none was inserted. */
  @Nullable
  public abstract String callHelper();

  /** Alias to builtin name, for every builtin alias defined at module level. */
  public abstract ImmutableMap<String, String> builtinAliases();

  static ObfuscationResult create(
      PyFile file,
      ImmutableMap<String, String> renameMap,
      PassContext ctx) {
    return new AutoValue_ObfuscationResult(
        file,
        file.toString(),
        renameMap,
        ctx.stats(),
        ctx.stringHelper(),
        ctx.callHelper(),
        ctx.builtinAliases());
  }
}
