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
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;
import java.util.Arrays;

/**
 * One concrete way of expressing a reflective operation indirectly. Each value belongs to exactly
 * one {@link MethodFamily}; the passes that synthesize code switch exhaustively over the values of
 * their family.
 */
public enum IndirectionMethod {
  // attribute read
  GETATTR(MethodFamily.ATTR, "getattr"),
  BUILTINS_GETATTR(MethodFamily.ATTR, "builtins_getattr"),
  OPERATOR_ATTRGETTER(MethodFamily.ATTR, "operator_attrgetter"),
  LAMBDA_GETATTR(MethodFamily.ATTR, "lambda_getattr"),
  GLOBALS_GETATTR(MethodFamily.ATTR, "globals_getattr"),
  LOCALS_GETATTR(MethodFamily.ATTR, "locals_getattr"),

  // attribute write and delete
  SETATTR(MethodFamily.SETATTR, "setattr"),
  DELATTR(MethodFamily.SETATTR, "delattr"),
  BUILTINS_SETATTR(MethodFamily.SETATTR, "builtins_setattr"),
  BUILTINS_DELATTR(MethodFamily.SETATTR, "builtins_delattr"),
  LAMBDA_SETATTR(MethodFamily.SETATTR, "lambda_setattr"),
  LAMBDA_DELATTR(MethodFamily.SETATTR, "lambda_delattr"),

  // call
  HELPER_WRAP(MethodFamily.CALL, "helper_wrap"),
  LAMBDA_WRAP(MethodFamily.CALL, "lambda_wrap"),
  DOUBLE_LAMBDA_WRAP(MethodFamily.CALL, "double_lambda_wrap"),
  BUILTINS_EVAL_CALL(MethodFamily.CALL, "builtins_eval_call", /* risky= */ true),

  // builtin alias
  ALIAS(MethodFamily.BUILTIN, "alias"),
  BUILTINS_GETATTR_ALIAS(MethodFamily.BUILTIN, "builtins_getattr_alias"),
  GLOBALS_LOOKUP(MethodFamily.BUILTIN, "globals_lookup"),

  // import
  IMPORTLIB_IMPORT_MODULE(MethodFamily.IMPORT, "importlib_import_module"),
  DUNDER_IMPORT(MethodFamily.IMPORT, "dunder_import"),
  GETATTR_IMPORTLIB(MethodFamily.IMPORT, "getattr_importlib");

  private static final ImmutableListMultimap<MethodFamily, IndirectionMethod> BY_FAMILY =
      Multimaps.index(Arrays.asList(values()), IndirectionMethod::family);

  private final MethodFamily family;
  private final String token;
  private final boolean risky;

  IndirectionMethod(MethodFamily family, String token) {
    this(family, token, false);
  }

  IndirectionMethod(MethodFamily family, String token, boolean risky) {
    this.family = family;
    this.token = token;
    this.risky = risky;
  }

  public MethodFamily family() {
    return family;
  }

  public String token() {
    return token;
  }

  /**
   * Reports whether this method executes dynamically synthesized code. Risky methods enter a pool
   * only through an explicit allow.
   */
  public boolean isRisky() {
    return risky;
  }

  /** Returns {@code family:method}, the form used in allow and deny lists. */
  public String qualifiedName() {
    return family.token() + ":" + token;
  }

  /** Reports whether this attribute-write method deletes rather than assigns. */
  public boolean isDelete() {
    return this == DELATTR || this == BUILTINS_DELATTR || this == LAMBDA_DELATTR;
  }

  @Override
  public String toString() {
    return token;
  }

  static ImmutableList<IndirectionMethod> canonical(MethodFamily family) {
    return BY_FAMILY.get(family);
  }

  /** Returns the method of the given family with the given token. */
  public static IndirectionMethod parse(MethodFamily family, String token) {
    for (IndirectionMethod m : canonical(family)) {
      if (m.token.equals(token)) {
        return m;
      }
    }
    throw new ConfigException("unknown method %s:%s", family, token);
  }

  /**
   * Parses an allow or deny token, either {@code family:method} or a bare method name. A bare name
   * matches the method of that name in every family.
   */
  public static ImmutableList<IndirectionMethod> parseToken(String token) {
    int colon = token.indexOf(':');
    if (colon >= 0) {
      MethodFamily family = MethodFamily.parse(token.substring(0, colon).strip());
      return ImmutableList.of(parse(family, token.substring(colon + 1).strip()));
    }
    ImmutableList.Builder<IndirectionMethod> result = ImmutableList.builder();
    for (IndirectionMethod m : values()) {
      if (m.token.equals(token)) {
        result.add(m);
      }
    }
    ImmutableList<IndirectionMethod> list = result.build();
    if (list.isEmpty()) {
      throw new ConfigException("unknown method: %s", token);
    }
    return list;
  }
}
