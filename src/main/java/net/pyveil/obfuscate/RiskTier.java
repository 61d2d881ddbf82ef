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

import static net.pyveil.obfuscate.IndirectionMethod.ALIAS;
import static net.pyveil.obfuscate.IndirectionMethod.BUILTINS_DELATTR;
import static net.pyveil.obfuscate.IndirectionMethod.BUILTINS_GETATTR;
import static net.pyveil.obfuscate.IndirectionMethod.BUILTINS_GETATTR_ALIAS;
import static net.pyveil.obfuscate.IndirectionMethod.BUILTINS_SETATTR;
import static net.pyveil.obfuscate.IndirectionMethod.DELATTR;
import static net.pyveil.obfuscate.IndirectionMethod.DOUBLE_LAMBDA_WRAP;
import static net.pyveil.obfuscate.IndirectionMethod.DUNDER_IMPORT;
import static net.pyveil.obfuscate.IndirectionMethod.GETATTR;
import static net.pyveil.obfuscate.IndirectionMethod.GLOBALS_GETATTR;
import static net.pyveil.obfuscate.IndirectionMethod.HELPER_WRAP;
import static net.pyveil.obfuscate.IndirectionMethod.IMPORTLIB_IMPORT_MODULE;
import static net.pyveil.obfuscate.IndirectionMethod.LAMBDA_GETATTR;
import static net.pyveil.obfuscate.IndirectionMethod.LAMBDA_SETATTR;
import static net.pyveil.obfuscate.IndirectionMethod.LAMBDA_WRAP;
import static net.pyveil.obfuscate.IndirectionMethod.OPERATOR_ATTRGETTER;
import static net.pyveil.obfuscate.IndirectionMethod.SETATTR;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * A named default for the method pools. Each tier maps every family to the methods enabled before
 * allow and deny lists are applied. {@link #HEAVY} lists every method, but risky ones still need an
 * explicit allow.
 */
public enum RiskTier {
  SAFE("safe"),
  MEDIUM("medium"),
  HEAVY("heavy");

  private final String token;

  RiskTier(String token) {
    this.token = token;
  }

  public String token() {
    return token;
  }

  @Override
  public String toString() {
    return token;
  }

  /** Returns this tier's default pool for each family, in canonical order. */
  public ImmutableMap<MethodFamily, ImmutableList<IndirectionMethod>> defaultPools() {
    ImmutableMap.Builder<MethodFamily, ImmutableList<IndirectionMethod>> pools =
        ImmutableMap.builder();
    for (MethodFamily family : MethodFamily.values()) {
      pools.put(family, defaultPool(family));
    }
    return pools.buildOrThrow();
  }

  /** Returns this tier's default pool for one family, in canonical order. */
  public ImmutableList<IndirectionMethod> defaultPool(MethodFamily family) {
    switch (this) {
      case SAFE:
        return switch (family) {
          case ATTR ->
              ImmutableList.of(GETATTR, BUILTINS_GETATTR, OPERATOR_ATTRGETTER, LAMBDA_GETATTR);
          case SETATTR ->
              ImmutableList.of(
                  SETATTR, DELATTR, BUILTINS_SETATTR, BUILTINS_DELATTR, LAMBDA_SETATTR);
          case CALL -> ImmutableList.of(HELPER_WRAP, LAMBDA_WRAP);
          case BUILTIN -> ImmutableList.of(ALIAS, BUILTINS_GETATTR_ALIAS);
          case IMPORT -> ImmutableList.of(IMPORTLIB_IMPORT_MODULE, DUNDER_IMPORT);
        };
      case MEDIUM:
        return switch (family) {
          case ATTR ->
              ImmutableList.of(
                  GETATTR, BUILTINS_GETATTR, OPERATOR_ATTRGETTER, LAMBDA_GETATTR, GLOBALS_GETATTR);
          case CALL -> ImmutableList.of(HELPER_WRAP, LAMBDA_WRAP, DOUBLE_LAMBDA_WRAP);
          default -> family.methods();
        };
      case HEAVY:
        return family.methods();
    }
    throw new AssertionError(this);
  }

  public static RiskTier parse(String token) {
    for (RiskTier t : values()) {
      if (t.token.equals(token)) {
        return t;
      }
    }
    throw new ConfigException("unknown risk tier: %s", token);
  }
}
