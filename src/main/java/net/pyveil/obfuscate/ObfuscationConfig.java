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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * ObfuscationConfig is the immutable set of options for one obfuscation run: which transforms are
 * enabled, how often each probabilistic pass fires, the literal encodings, the method pool of each
 * reflective family, the pass schedule and the naming and output options.
 *
 * <p>Configs are normally produced by {@link ConfigResolver}, which applies level and profile
 * presets. {@link #builder} starts from neutral defaults: no transform enabled, every rate 1.0 and
 * the {@link RiskTier#SAFE} pools. {@link Builder#build} validates the combination and throws
 * {@link ConfigException} for an invalid one.
 */
@AutoValue
public abstract class ObfuscationConfig {

  /** Names that renaming never touches, whatever the preserve set says. */
  public static final ImmutableSet<String> ALWAYS_PRESERVED =
      ImmutableSet.of("__name__", "__file__", "__package__", "__spec__");

  /** Attributes that attribute passes leave alone unless configured otherwise. */
  public static final ImmutableSet<String> DEFAULT_PRESERVED_ATTRS =
      ImmutableSet.of(
          "format", "append", "extend", "items", "keys", "values", "read", "write", "close");

  public static final ObfuscationConfig DEFAULT = builder().build();

  /** Encoding of string literals. */
  public enum StringMode {
    MIXED,
    XOR,
    B85,
    REVERSE,
    SPLIT
  }

  /** Encoding of integer literals. */
  public enum IntMode {
    MIXED,
    XOR,
    ARITH,
    SPLIT
  }

  /** Encoding of float literals. */
  public enum FloatMode {
    MIXED,
    HEX,
    STRUCT
  }

  /** Encoding of bytes literals. */
  public enum BytesMode {
    MIXED,
    XOR,
    LIST,
    SPLIT
  }

  /** Encoding of {@code None}. */
  public enum NoneMode {
    MIXED,
    IFEXPR,
    LAMBDA
  }

  /** Encoding of {@code True} and {@code False}. */
  public enum BoolMode {
    MIXED,
    COMPARE,
    XOR
  }

  /** How fresh names are spelled. */
  public enum NameStrategy {
    COUNTER,
    CONFUSABLE
  }

  /** Where inert functions go among the top-level statements. */
  public enum JunkPosition {
    TOP,
    BOTTOM,
    RANDOM
  }

  /** Whether reversal may settle for a partial recovery. */
  public enum ReversalMode {
    BEST_EFFORT,
    STRICT
  }

  public abstract ImmutableSet<Transform> transforms();

  public boolean isEnabled(Transform transform) {
    return transforms().contains(transform);
  }

  // Rates, each in [0, 1].

  public abstract double attrRate();

  public abstract double setattrRate();

  public abstract double callRate();

  public abstract double builtinRate();

  public abstract double importRate();

  public abstract double flowRate();

  public abstract double branchRate();

  public abstract double loopRate();

  // Literal encodings.

  public abstract StringMode stringMode();

  public abstract IntMode intMode();

  public abstract FloatMode floatMode();

  public abstract BytesMode bytesMode();

  public abstract NoneMode noneMode();

  public abstract BoolMode boolMode();

  /** The method pool of each family. Every pool is non-empty and in canonical order. */
  public abstract ImmutableMap<MethodFamily, ImmutableList<IndirectionMethod>> methods();

  public ImmutableList<IndirectionMethod> pool(MethodFamily family) {
    return methods().get(family);
  }

  /** The tier the pools were derived from. */
  public abstract RiskTier tier();

  /** The order in which the repeated transforms run. */
  public abstract ImmutableList<Transform> order();

  /** How many times the ordered transforms run. */
  public abstract int repetitions();

  /** The random seed, or null for a nondeterministic run. */
  @Nullable
  public abstract Long seed();

  public abstract NameStrategy nameStrategy();

  /** Names renaming must keep. Always includes {@link #ALWAYS_PRESERVED}. */
  public abstract ImmutableSet<String> preserveNames();

  /** Attribute names the attribute passes must keep. */
  public abstract ImmutableSet<String> preserveAttrs();

  /** If set, the first string statement of each module, function and class body is kept. */
  public abstract boolean keepDocstrings();

  public abstract int stringChunkMin();

  public abstract int stringChunkMax();

  /** The maximum number of dead branches inserted per function per repetition. */
  public abstract int flowCount();

  /** The number of inert functions to add. */
  public abstract int junkCount();

  public abstract JunkPosition junkPosition();

  /** If set, the manifest carries a verbatim compressed copy of the input. */
  public abstract boolean includeSource();

  public abstract ReversalMode reversalMode();

  /** The level preset this config was resolved from, for the manifest. */
  public abstract int level();

  /** The profile preset this config was resolved from, if any. */
  @Nullable
  public abstract String profile();

  /** Returns a warning for each risky method in a pool. */
  public ImmutableList<String> riskWarnings() {
    ImmutableList.Builder<String> warnings = ImmutableList.builder();
    for (ImmutableList<IndirectionMethod> pool : methods().values()) {
      for (IndirectionMethod m : pool) {
        if (m.isRisky()) {
          warnings.add("risky method enabled: " + m.qualifiedName());
        }
      }
    }
    return warnings.build();
  }

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_ObfuscationConfig.Builder()
        .transforms(ImmutableSet.of())
        .attrRate(1.0)
        .setattrRate(1.0)
        .callRate(1.0)
        .builtinRate(1.0)
        .importRate(1.0)
        .flowRate(1.0)
        .branchRate(1.0)
        .loopRate(1.0)
        .stringMode(StringMode.MIXED)
        .intMode(IntMode.MIXED)
        .floatMode(FloatMode.MIXED)
        .bytesMode(BytesMode.MIXED)
        .noneMode(NoneMode.MIXED)
        .boolMode(BoolMode.MIXED)
        .methods(RiskTier.SAFE.defaultPools())
        .tier(RiskTier.SAFE)
        .order(Transform.DEFAULT_ORDER)
        .repetitions(1)
        .seed(null)
        .nameStrategy(NameStrategy.COUNTER)
        .preserveNames(ImmutableSet.of())
        .preserveAttrs(DEFAULT_PRESERVED_ATTRS)
        .keepDocstrings(false)
        .stringChunkMin(1)
        .stringChunkMax(6)
        .flowCount(1)
        .junkCount(0)
        .junkPosition(JunkPosition.TOP)
        .includeSource(false)
        .reversalMode(ReversalMode.BEST_EFFORT)
        .level(2)
        .profile(null);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link ObfuscationConfig}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder transforms(ImmutableSet<Transform> value);

    abstract ImmutableSet<Transform> transforms();

    /** Adds the given transforms to the enabled set. */
    @CanIgnoreReturnValue
    public Builder enable(Transform... values) {
      Set<Transform> set = EnumSet.noneOf(Transform.class);
      set.addAll(transforms());
      set.addAll(ImmutableList.copyOf(values));
      return transforms(Sets.immutableEnumSet(set));
    }

    /** Removes the given transforms from the enabled set. */
    @CanIgnoreReturnValue
    public Builder disable(Transform... values) {
      Set<Transform> set = EnumSet.noneOf(Transform.class);
      set.addAll(transforms());
      ImmutableList.copyOf(values).forEach(set::remove);
      return transforms(Sets.immutableEnumSet(set));
    }

    public abstract Builder attrRate(double value);

    public abstract Builder setattrRate(double value);

    public abstract Builder callRate(double value);

    public abstract Builder builtinRate(double value);

    public abstract Builder importRate(double value);

    public abstract Builder flowRate(double value);

    public abstract Builder branchRate(double value);

    public abstract Builder loopRate(double value);

    abstract double attrRate();

    abstract double setattrRate();

    abstract double callRate();

    abstract double builtinRate();

    abstract double importRate();

    abstract double flowRate();

    abstract double branchRate();

    abstract double loopRate();

    public abstract Builder stringMode(StringMode value);

    public abstract Builder intMode(IntMode value);

    public abstract Builder floatMode(FloatMode value);

    public abstract Builder bytesMode(BytesMode value);

    public abstract Builder noneMode(NoneMode value);

    public abstract Builder boolMode(BoolMode value);

    public abstract Builder methods(ImmutableMap<MethodFamily, ImmutableList<IndirectionMethod>> v);

    abstract ImmutableMap<MethodFamily, ImmutableList<IndirectionMethod>> methods();

    /** Replaces the pool of one family. */
    @CanIgnoreReturnValue
    public Builder pool(MethodFamily family, IndirectionMethod... pool) {
      ImmutableMap.Builder<MethodFamily, ImmutableList<IndirectionMethod>> result =
          ImmutableMap.builder();
      for (MethodFamily f : MethodFamily.values()) {
        if (f == family) {
          result.put(f, ImmutableList.copyOf(pool));
        } else if (methods().containsKey(f)) {
          result.put(f, methods().get(f));
        }
      }
      return methods(result.buildOrThrow());
    }

    public abstract Builder tier(RiskTier value);

    public abstract Builder order(ImmutableList<Transform> value);

    abstract ImmutableList<Transform> order();

    public abstract Builder repetitions(int value);

    abstract int repetitions();

    public abstract Builder seed(@Nullable Long value);

    public abstract Builder nameStrategy(NameStrategy value);

    public abstract Builder preserveNames(ImmutableSet<String> value);

    abstract ImmutableSet<String> preserveNames();

    public abstract Builder preserveAttrs(ImmutableSet<String> value);

    public abstract Builder keepDocstrings(boolean value);

    public abstract Builder stringChunkMin(int value);

    public abstract Builder stringChunkMax(int value);

    abstract int stringChunkMin();

    abstract int stringChunkMax();

    public abstract Builder flowCount(int value);

    abstract int flowCount();

    public abstract Builder junkCount(int value);

    abstract int junkCount();

    public abstract Builder junkPosition(JunkPosition value);

    public abstract Builder includeSource(boolean value);

    abstract boolean includeSource();

    public abstract Builder reversalMode(ReversalMode value);

    abstract ReversalMode reversalMode();

    public abstract Builder level(int value);

    public abstract Builder profile(@Nullable String value);

    abstract ObfuscationConfig autoBuild();

    /** Validates the options and returns the config. */
    public ObfuscationConfig build() {
      checkRate("attr", attrRate());
      checkRate("setattr", setattrRate());
      checkRate("call", callRate());
      checkRate("builtin", builtinRate());
      checkRate("import", importRate());
      checkRate("flow", flowRate());
      checkRate("branch", branchRate());
      checkRate("loop", loopRate());

      if (order().isEmpty()) {
        throw new ConfigException("pass order is empty");
      }
      Set<Transform> seen = new HashSet<>();
      for (Transform t : order()) {
        if (!t.isOrderable()) {
          throw new ConfigException("transform %s cannot appear in the pass order", t);
        }
        if (!seen.add(t)) {
          throw new ConfigException("duplicate transform in pass order: %s", t);
        }
      }
      if (repetitions() < 1) {
        throw new ConfigException("repetitions must be at least 1, got %d", repetitions());
      }
      if (flowCount() < 1) {
        throw new ConfigException("flow count must be at least 1, got %d", flowCount());
      }
      if (stringChunkMin() < 1) {
        throw new ConfigException("string chunk minimum must be at least 1");
      }
      if (stringChunkMin() > stringChunkMax()) {
        throw new ConfigException(
            "string chunk minimum %d exceeds maximum %d", stringChunkMin(), stringChunkMax());
      }
      if (junkCount() < 0) {
        throw new ConfigException("junk count must not be negative, got %d", junkCount());
      }
      if (reversalMode() == ReversalMode.STRICT && !includeSource()) {
        throw new ConfigException("strict reversal requires the source payload");
      }

      ImmutableMap.Builder<MethodFamily, ImmutableList<IndirectionMethod>> pools =
          ImmutableMap.builder();
      for (MethodFamily family : MethodFamily.values()) {
        ImmutableList<IndirectionMethod> pool = methods().get(family);
        if (pool == null || pool.isEmpty()) {
          pool = ImmutableList.of(family.fallback());
        }
        for (IndirectionMethod m : pool) {
          if (m.family() != family) {
            throw new ConfigException("method %s does not belong to family %s", m, family);
          }
        }
        pools.put(
            family, family.methods().stream().filter(pool::contains).collect(toImmutableList()));
      }
      methods(pools.buildOrThrow());
      preserveNames(
          ImmutableSet.<String>builder()
              .addAll(ALWAYS_PRESERVED)
              .addAll(preserveNames())
              .build());
      return autoBuild();
    }

    private static void checkRate(String name, double rate) {
      if (!(rate >= 0.0 && rate <= 1.0)) {
        throw new ConfigException("%s rate must be within [0, 1], got %s", name, rate);
      }
    }
  }
}
