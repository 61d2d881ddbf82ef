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

package net.pyveil.reverse;

import java.util.function.Predicate;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Decides which names denote a generated helper. A manifest that records the helper's name is
 * trusted exactly; older manifests fall back to the default spelling, which the obfuscator extends
 * with {@code _x} suffixes on collision.
 */
final class HelperNames {

  private static final Pattern STRING_HELPER = Pattern.compile("_obf_str(_x)*");
  private static final Pattern CALL_HELPER = Pattern.compile("_obf_call(_x)*");

  private HelperNames() {}

  static Predicate<String> stringHelper(boolean recorded, @Nullable String name) {
    return matcher(recorded, name, STRING_HELPER);
  }

  static Predicate<String> callHelper(boolean recorded, @Nullable String name) {
    return matcher(recorded, name, CALL_HELPER);
  }

  private static Predicate<String> matcher(
      boolean recorded, @Nullable String name, Pattern fallback) {
    if (recorded) {
      return name == null ? n -> false : name::equals;
    }
    return n -> fallback.matcher(n).matches();
  }
}
