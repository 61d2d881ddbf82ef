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

import com.google.common.collect.ImmutableList;

/** A family of reflective indirection passes sharing one method pool. */
public enum MethodFamily {
  ATTR("attr"),
  SETATTR("setattr"),
  CALL("call"),
  BUILTIN("builtin"),
  IMPORT("import");

  private final String token;

  MethodFamily(String token) {
    this.token = token;
  }

  public String token() {
    return token;
  }

  /** Returns every method of this family, in canonical order. */
  public ImmutableList<IndirectionMethod> methods() {
    return IndirectionMethod.canonical(this);
  }

  /** Returns the method restored when overrides leave the pool empty. */
  public IndirectionMethod fallback() {
    return methods().get(0);
  }

  @Override
  public String toString() {
    return token;
  }

  public static MethodFamily parse(String token) {
    for (MethodFamily f : values()) {
      if (f.token.equals(token)) {
        return f;
      }
    }
    throw new ConfigException("unknown method family: %s", token);
  }
}
