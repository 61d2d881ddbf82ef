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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import javax.annotation.Nullable;

/**
 * Builds an {@link ObfuscationConfig} from presets and overrides, applied in this order:
 *
 * <ol>
 *   <li>the level preset (1 to 5), which decides the enabled transforms, repetitions and junk;
 *   <li>the profile preset, whose values win over the level's;
 *   <li>the risk tier (explicit, else the profile's, else safe), which decides the default pools;
 *   <li>allow and deny tokens, then the removal of risky methods that were not explicitly allowed,
 *       then explicit per-family methods;
 *   <li>field overrides, in the order they were added.
 * </ol>
 */
public final class ConfigResolver {

  /** The known profile names. */
  public static final ImmutableSet<String> PROFILES = ImmutableSet.of("balanced", "stealth", "max");

  private int level = 2;
  @Nullable private String profile;
  @Nullable private RiskTier tier;
  private static final Splitter TOKEN_SPLITTER =
      Splitter.on(',').trimResults().omitEmptyStrings();

  private final List<IndirectionMethod> allow = new ArrayList<>();
  private final List<IndirectionMethod> deny = new ArrayList<>();
  private final Map<MethodFamily, ImmutableList<IndirectionMethod>> explicit =
      Maps.newEnumMap(MethodFamily.class);
  private final List<Consumer<ObfuscationConfig.Builder>> overrides = new ArrayList<>();

  public static ConfigResolver create() {
    return new ConfigResolver();
  }

  private ConfigResolver() {}

  @CanIgnoreReturnValue
  public ConfigResolver level(int level) {
    if (level < 1 || level > 5) {
      throw new ConfigException("level must be between 1 and 5, got %d", level);
    }
    this.level = level;
    return this;
  }

  @CanIgnoreReturnValue
  public ConfigResolver profile(@Nullable String profile) {
    if (profile != null && !PROFILES.contains(profile)) {
      throw new ConfigException("unknown profile: %s", profile);
    }
    this.profile = profile;
    return this;
  }

  @CanIgnoreReturnValue
  public ConfigResolver tier(String tier) {
    this.tier = RiskTier.parse(tier);
    return this;
  }

  /**
   * Adds comma-separated allow tokens, each {@code family:method} or a bare method name.
   *
   * @throws ConfigException if a token names no method
   */
  @CanIgnoreReturnValue
  public ConfigResolver allow(String tokens) {
    allow.addAll(parseTokens(tokens));
    return this;
  }

  /**
   * Adds comma-separated deny tokens, each {@code family:method} or a bare method name.
   *
   * @throws ConfigException if a token names no method
   */
  @CanIgnoreReturnValue
  public ConfigResolver deny(String tokens) {
    deny.addAll(parseTokens(tokens));
    return this;
  }

  /** Restricts a family to the given methods, which count as explicitly allowed. */
  @CanIgnoreReturnValue
  public ConfigResolver explicitMethods(MethodFamily family, IndirectionMethod... methods) {
    for (IndirectionMethod m : methods) {
      if (m.family() != family) {
        throw new ConfigException("method %s does not belong to family %s", m, family);
      }
    }
    explicit.put(family, ImmutableList.copyOf(methods));
    return this;
  }

  /** Adds a field override, applied after all presets. */
  @CanIgnoreReturnValue
  public ConfigResolver override(Consumer<ObfuscationConfig.Builder> override) {
    overrides.add(override);
    return this;
  }

  public ObfuscationConfig resolve() {
    ObfuscationConfig.Builder builder = ObfuscationConfig.builder().level(level).profile(profile);
    applyLevel(builder, level);
    RiskTier profileTier = profile == null ? null : applyProfile(builder, profile);
    RiskTier resolvedTier = tier != null ? tier : profileTier != null ? profileTier : RiskTier.SAFE;
    builder.tier(resolvedTier).methods(resolvePools(resolvedTier));
    for (Consumer<ObfuscationConfig.Builder> override : overrides) {
      override.accept(builder);
    }
    return builder.build();
  }

  private ImmutableMap<MethodFamily, ImmutableList<IndirectionMethod>> resolvePools(
      RiskTier tier) {
    Map<MethodFamily, Set<IndirectionMethod>> pools = Maps.newEnumMap(MethodFamily.class);
    for (MethodFamily family : MethodFamily.values()) {
      pools.put(family, new LinkedHashSet<>(tier.defaultPool(family)));
    }
    Set<IndirectionMethod> explicitlyAllowed = new HashSet<>();
    for (IndirectionMethod m : allow) {
      pools.get(m.family()).add(m);
      explicitlyAllowed.add(m);
    }
    for (IndirectionMethod m : deny) {
      pools.get(m.family()).remove(m);
    }
    for (Set<IndirectionMethod> pool : pools.values()) {
      pool.removeIf(m -> m.isRisky() && !explicitlyAllowed.contains(m));
    }
    explicit.forEach((family, methods) -> pools.put(family, new LinkedHashSet<>(methods)));

    ImmutableMap.Builder<MethodFamily, ImmutableList<IndirectionMethod>> result =
        ImmutableMap.builder();
    for (MethodFamily family : MethodFamily.values()) {
      Set<IndirectionMethod> pool = pools.get(family);
      ImmutableList<IndirectionMethod> ordered =
          family.methods().stream().filter(pool::contains).collect(toImmutableList());
      result.put(family, ordered.isEmpty() ? ImmutableList.of(family.fallback()) : ordered);
    }
    return result.buildOrThrow();
  }

  private static void applyLevel(ObfuscationConfig.Builder builder, int level) {
    Set<Transform> enabled = EnumSet.of(Transform.RENAME);
    if (level >= 2) {
      enabled.addAll(EnumSet.of(Transform.STRINGS, Transform.BUILTINS));
    }
    if (level >= 3) {
      enabled.addAll(
          EnumSet.of(
              Transform.INTS, Transform.FLOATS, Transform.NONE, Transform.FLOW,
              Transform.SETATTRS));
    }
    if (level >= 4) {
      enabled.addAll(
          EnumSet.of(
              Transform.BYTES, Transform.BOOLS, Transform.ATTRS, Transform.CALLS,
              Transform.IMPORTS, Transform.BRANCHES));
      builder.repetitions(2).junkCount(1);
    }
    if (level >= 5) {
      enabled.add(Transform.LOOPS);
      builder.junkCount(3);
    }
    builder.transforms(ImmutableSet.copyOf(enabled));
  }

  /** Applies a profile and returns the tier it prefers. */
  private static RiskTier applyProfile(ObfuscationConfig.Builder builder, String profile) {
    switch (profile) {
      case "balanced":
        builder
            .transforms(ImmutableSet.copyOf(EnumSet.allOf(Transform.class)))
            .repetitions(2)
            .junkCount(1)
            .attrRate(0.75)
            .setattrRate(0.8)
            .callRate(0.65)
            .builtinRate(0.9)
            .flowRate(0.75)
            .importRate(0.8)
            .branchRate(0.5)
            .loopRate(0.5)
            .flowCount(1);
        return RiskTier.MEDIUM;
      case "stealth":
        builder
            .transforms(ImmutableSet.copyOf(EnumSet.complementOf(EnumSet.of(Transform.BYTES))))
            .repetitions(1)
            .junkCount(0)
            .attrRate(0.45)
            .setattrRate(0.45)
            .callRate(0.4)
            .builtinRate(0.6)
            .flowRate(0.35)
            .importRate(0.5)
            .branchRate(0.25)
            .loopRate(0.25)
            .flowCount(1);
        return RiskTier.SAFE;
      case "max":
        builder
            .transforms(ImmutableSet.copyOf(EnumSet.allOf(Transform.class)))
            .repetitions(3)
            .junkCount(4)
            .attrRate(1.0)
            .setattrRate(1.0)
            .callRate(1.0)
            .builtinRate(1.0)
            .flowRate(1.0)
            .importRate(1.0)
            .branchRate(1.0)
            .loopRate(1.0)
            .flowCount(2);
        return RiskTier.HEAVY;
      default:
        throw new ConfigException("unknown profile: %s", profile);
    }
  }

  private static ImmutableList<IndirectionMethod> parseTokens(String tokens) {
    ImmutableList.Builder<IndirectionMethod> result = ImmutableList.builder();
    for (String token : TOKEN_SPLITTER.split(tokens)) {
      result.addAll(IndirectionMethod.parseToken(token));
    }
    return result.build();
  }
}
