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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.pyveil.obfuscate.ObfuscationStats.Counter;

/**
 * The mutable state of one obfuscation run, shared by all passes: the config, the random stream,
 * the name generator, the rewrite counters, the warnings and the names of the generated helpers.
 *
 * <p>A PassContext is confined to the thread running the pipeline.
 */
public final class PassContext {

  static final String STRING_HELPER_BASE = "_obf_str";
  static final String CALL_HELPER_BASE = "_obf_call";

  private final ObfuscationConfig config;
  private final RandomSource random;
  private final NameGenerator names;
  private final Map<Counter, Integer> counters = Maps.newEnumMap(Counter.class);
  private final List<String> warnings = new ArrayList<>();
  private final Map<String, String> builtinAliases = new LinkedHashMap<>();

  @Nullable private String stringHelper;
  @Nullable private String callHelper;

  public PassContext(ObfuscationConfig config, RandomSource random, NameGenerator names) {
    this.config = config;
    this.random = random;
    this.names = names;
  }

  public ObfuscationConfig config() {
    return config;
  }

  public RandomSource random() {
    return random;
  }

  public NameGenerator names() {
    return names;
  }

  public void count(Counter counter) {
    count(counter, 1);
  }

  public void count(Counter counter, int n) {
    counters.merge(counter, n, Integer::sum);
  }

  public int get(Counter counter) {
    return counters.getOrDefault(counter, 0);
  }

  public void warn(String warning) {
    warnings.add(warning);
  }

  /** Returns the name of the string decoder, choosing it on first use. */
  public String useStringHelper() {
    if (stringHelper == null) {
      stringHelper = names.freshSuffixed(STRING_HELPER_BASE);
    }
    return stringHelper;
  }

  /** Returns the name of the call trampoline, choosing it on first use. */
  public String useCallHelper() {
    if (callHelper == null) {
      callHelper = names.freshSuffixed(CALL_HELPER_BASE);
    }
    return callHelper;
  }

  /** Returns the string decoder name, or null if no pass needed it. */
  @Nullable
  public String stringHelper() {
    return stringHelper;
  }

  /** Returns the call trampoline name, or null if no pass needed it. */
  @Nullable
  public String callHelper() {
    return callHelper;
  }

  /** Records that {@code alias} stands for the builtin {@code builtin}. */
  public void addBuiltinAlias(String alias, String builtin) {
    builtinAliases.put(alias, builtin);
  }

  /** Returns the alias table, alias to builtin name. */
  public ImmutableMap<String, String> builtinAliases() {
    return ImmutableMap.copyOf(builtinAliases);
  }

  public ObfuscationStats stats() {
    return ObfuscationStats.create(counters, warnings);
  }
}
