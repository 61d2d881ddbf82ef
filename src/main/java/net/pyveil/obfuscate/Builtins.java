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

import com.google.common.collect.ImmutableSet;
import com.google.common.io.Resources;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;

/** The names of the Python builtins module, loaded from {@code builtins.txt} on the classpath. */
public final class Builtins {

  private static final String RESOURCE = "builtins.txt";

  /** All builtin names, including {@code True}, {@code False} and {@code None}. */
  public static final ImmutableSet<String> NAMES = load();

  private Builtins() {}

  public static boolean isBuiltin(String name) {
    return NAMES.contains(name);
  }

  private static ImmutableSet<String> load() {
    URL url = Resources.getResource(Builtins.class, RESOURCE);
    try {
      ImmutableSet.Builder<String> names = ImmutableSet.builder();
      for (String line : Resources.readLines(url, StandardCharsets.UTF_8)) {
        line = line.strip();
        if (!line.isEmpty() && !line.startsWith("#")) {
          names.add(line);
        }
      }
      return names.build();
    } catch (IOException e) {
      throw new IllegalStateException("Exception while reading " + RESOURCE, e);
    }
  }
}
