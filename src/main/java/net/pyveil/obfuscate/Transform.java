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

/**
 * A pass family with its own enable flag. Orderable transforms run once per repetition, in the
 * configured order; the others run at a fixed point of the pipeline.
 */
public enum Transform {
  RENAME("rename", false),
  STRINGS("strings", false),
  IMPORTS("imports", true),
  ATTRS("attrs", true),
  SETATTRS("setattrs", true),
  CALLS("calls", true),
  BOOLS("bools", true),
  INTS("ints", true),
  FLOATS("floats", true),
  BYTES("bytes", true),
  NONE("none", true),
  FLOW("flow", true),
  BRANCHES("branches", true),
  LOOPS("loops", true),
  BUILTINS("builtins", false);

  /** The order in which repeated transforms run unless configured otherwise. */
  public static final ImmutableList<Transform> DEFAULT_ORDER =
      ImmutableList.of(
          IMPORTS, ATTRS, SETATTRS, CALLS, BOOLS, INTS, FLOATS, BYTES, NONE, FLOW, BRANCHES, LOOPS);

  private final String token;
  private final boolean orderable;

  Transform(String token, boolean orderable) {
    this.token = token;
    this.orderable = orderable;
  }

  /** Returns the name used on the command line and in manifests. */
  public String token() {
    return token;
  }

  /** Reports whether this transform may appear in a pass order. */
  public boolean isOrderable() {
    return orderable;
  }

  @Override
  public String toString() {
    return token;
  }

  /** Returns the transform with the given token. */
  public static Transform parse(String token) {
    for (Transform t : values()) {
      if (t.token.equals(token)) {
        return t;
      }
    }
    throw new ConfigException("unknown transform: %s", token);
  }

  /** Parses a comma-separated pass order. Blank entries are ignored. */
  public static ImmutableList<Transform> parseOrder(String order) {
    ImmutableList.Builder<Transform> result = ImmutableList.builder();
    for (String part : order.split(",", -1)) {
      if (!part.isBlank()) {
        result.add(parse(part.strip()));
      }
    }
    return result.build();
  }
}
