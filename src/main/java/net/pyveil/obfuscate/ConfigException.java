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

import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;

/**
 * Reports an invalid obfuscation configuration: a rate out of range, a malformed pass order, an
 * unknown method, profile or tier name, or an inconsistent combination of options. It is raised
 * before any tree is touched.
 */
public final class ConfigException extends RuntimeException {

  @FormatMethod
  public ConfigException(@FormatString String format, Object... args) {
    super(String.format(format, args));
  }
}
