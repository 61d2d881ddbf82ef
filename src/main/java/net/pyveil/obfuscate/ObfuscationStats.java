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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.Map;

/** The per-family rewrite counts and the warnings of one run. */
@AutoValue
public abstract class ObfuscationStats {

  /** A rewrite counter. Tokens are the keys used in manifests. */
  public enum Counter {
    RENAMED("renamed"),
    STRINGS("strings"),
    INTS("ints"),
    FLOATS("floats"),
    BYTES("bytes"),
    NONE("none"),
    BOOLS("bools"),
    FLOW_BLOCKS("flow_blocks"),
    BRANCHES("branches"),
    LOOPS("loops"),
    ATTRS("attrs"),
    SETATTRS("setattrs"),
    CALLS("calls"),
    IMPORTS("imports"),
    BUILTINS("builtins"),
    JUNK_FUNCTIONS("junk_functions");

    private final String token;

    Counter(String token) {
      this.token = token;
    }

    public String token() {
      return token;
    }
  }

  /** The value of every counter, in declaration order. */
  public abstract ImmutableMap<Counter, Integer> counters();

  public abstract ImmutableList<String> warnings();

  public int get(Counter counter) {
    return counters().getOrDefault(counter, 0);
  }

  /** Returns the counters keyed by token, as written to manifests. */
  public ImmutableMap<String, Integer> byToken() {
    ImmutableMap.Builder<String, Integer> result = ImmutableMap.builder();
    counters().forEach((c, n) -> result.put(c.token(), n));
    return result.buildOrThrow();
  }

  public static ObfuscationStats create(Map<Counter, Integer> counters, Iterable<String> warnings) {
    Map<Counter, Integer> all = Maps.newEnumMap(Counter.class);
    for (Counter c : Counter.values()) {
      all.put(c, counters.getOrDefault(c, 0));
    }
    return new AutoValue_ObfuscationStats(
        Maps.immutableEnumMap(all), ImmutableList.copyOf(warnings));
  }

  @Override
  public final String toString() {
    StringBuilder buf = new StringBuilder();
    counters()
        .forEach(
            (c, n) -> {
              if (n > 0) {
                buf.append(buf.length() == 0 ? "" : ", ").append(c.token()).append('=').append(n);
              }
            });
    return buf.length() == 0 ? "no rewrites" : buf.toString();
  }
}
