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

package net.pyveil.manifest;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.pyveil.obfuscate.IndirectionMethod;
import net.pyveil.obfuscate.MethodFamily;
import net.pyveil.obfuscate.ObfuscationConfig;
import net.pyveil.obfuscate.ObfuscationConfig.ReversalMode;
import net.pyveil.obfuscate.Transform;

/**
 * The record of one obfuscation run that reversal needs: the config, the counters, the rename map,
 * the hashes of the input and output text, the warnings, the names of the generated helpers and,
 * optionally, the compressed original text.
 *
 * <p>Instances are built by {@link ManifestBuilder} and read back with {@link #fromJson}. The JSON
 * keys are snake_case.
 */
public final class ObfuscationManifest {

  public static final String FORMAT = "pyveil-manifest-v3";
  static final String FORMAT_V2 = "pyveil-manifest-v2";
  static final String FORMAT_V1 = "pyveil-manifest-v1";

  private static final ImmutableSet<String> READABLE_FORMATS =
      ImmutableSet.of(FORMAT, FORMAT_V2, FORMAT_V1);

  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  @SerializedName("format")
  private String format;

  @SerializedName("created_utc")
  private String createdUtc;

  @SerializedName("config")
  @Nullable
  private ConfigSnapshot config;

  @SerializedName("stats")
  private Map<String, Integer> stats;

  @SerializedName("rename_map")
  private Map<String, String> renameMap;

  @SerializedName("input_sha256")
  private String inputSha256;

  @SerializedName("output_sha256")
  @Nullable
  private String outputSha256;

  @SerializedName("warnings")
  private List<String> warnings;

  @SerializedName("string_helper")
  @Nullable
  private String stringHelper;

  @SerializedName("call_helper")
  @Nullable
  private String callHelper;

  @SerializedName("builtin_aliases")
  @Nullable
  private Map<String, String> builtinAliases;

  @SerializedName("original_source_b85_zlib")
  @Nullable
  private String sourcePayload;

  // For Gson.
  private ObfuscationManifest() {}

  ObfuscationManifest(
      String createdUtc,
      ConfigSnapshot config,
      Map<String, Integer> stats,
      Map<String, String> renameMap,
      String inputSha256,
      String outputSha256,
      List<String> warnings,
      @Nullable String stringHelper,
      @Nullable String callHelper,
      Map<String, String> builtinAliases,
      @Nullable String sourcePayload) {
    this.format = FORMAT;
    this.createdUtc = createdUtc;
    this.config = config;
    this.stats = new LinkedHashMap<>(stats);
    this.renameMap = new LinkedHashMap<>(renameMap);
    this.inputSha256 = inputSha256;
    this.outputSha256 = outputSha256;
    this.warnings = new ArrayList<>(warnings);
    this.stringHelper = stringHelper;
    this.callHelper = callHelper;
    this.builtinAliases = new LinkedHashMap<>(builtinAliases);
    this.sourcePayload = sourcePayload;
  }

  /**
   * Parses a manifest of any readable format.
   *
   * @throws IllegalArgumentException if the text is not JSON of the expected shape or names an
   *     unknown format
   */
  public static ObfuscationManifest fromJson(String json) {
    ObfuscationManifest manifest;
    try {
      manifest = GSON.fromJson(json, ObfuscationManifest.class);
    } catch (JsonParseException ex) {
      throw new IllegalArgumentException("malformed manifest", ex);
    }
    if (manifest == null) {
      throw new IllegalArgumentException("empty manifest");
    }
    if (!READABLE_FORMATS.contains(manifest.format)) {
      throw new IllegalArgumentException("unsupported manifest format: " + manifest.format);
    }
    return manifest;
  }

  public String toJson() {
    return GSON.toJson(this);
  }

  public String format() {
    return format;
  }

  public String createdUtc() {
    return createdUtc;
  }

  /** The config snapshot; absent from v1 manifests. */
  @Nullable
  public ConfigSnapshot config() {
    return config;
  }

  public ImmutableMap<String, Integer> stats() {
    return stats == null ? ImmutableMap.of() : ImmutableMap.copyOf(stats);
  }

  public ImmutableMap<String, String> renameMap() {
    return renameMap == null ? ImmutableMap.of() : ImmutableMap.copyOf(renameMap);
  }

  @Nullable
  public String inputSha256() {
    return inputSha256;
  }

  /** The hash of the text the obfuscator wrote, or null if the manifest has none. */
  @Nullable
  public String outputSha256() {
    return outputSha256;
  }

  public ImmutableList<String> warnings() {
    return warnings == null ? ImmutableList.of() : ImmutableList.copyOf(warnings);
  }

  /** The string decoder's name. Null if none was inserted or the manifest predates v3. */
  @Nullable
  public String stringHelper() {
    return stringHelper;
  }

  /** The call trampoline's name. Null if none was inserted or the manifest predates v3. */
  @Nullable
  public String callHelper() {
    return callHelper;
  }

  /** Reports whether the manifest records helper names and builtin aliases. */
  public boolean hasHelperTables() {
    return FORMAT.equals(format);
  }

  /** Alias to builtin name. Empty if the manifest predates v3. */
  public ImmutableMap<String, String> builtinAliases() {
    return builtinAliases == null ? ImmutableMap.of() : ImmutableMap.copyOf(builtinAliases);
  }

  /** The zlib-compressed, base85-encoded original text, or null. */
  @Nullable
  public String sourcePayload() {
    return sourcePayload;
  }

  /** The config of the run, in JSON-friendly form. */
  public static final class ConfigSnapshot {
    @SerializedName("level")
    private int level;

    @SerializedName("profile")
    @Nullable
    private String profile;

    @SerializedName("tier")
    private String tier;

    @SerializedName("passes")
    private int repetitions;

    @SerializedName("seed")
    @Nullable
    private Long seed;

    @SerializedName("transforms")
    private List<String> transforms;

    @SerializedName("order")
    private List<String> order;

    @SerializedName("rates")
    private Map<String, Double> rates;

    @SerializedName("modes")
    private Map<String, String> modes;

    @SerializedName("methods")
    private Map<String, List<String>> methods;

    @SerializedName("name_strategy")
    private String nameStrategy;

    @SerializedName("keep_docstrings")
    private boolean keepDocstrings;

    @SerializedName("string_chunk_min")
    private int stringChunkMin;

    @SerializedName("string_chunk_max")
    private int stringChunkMax;

    @SerializedName("flow_count")
    private int flowCount;

    @SerializedName("junk_count")
    private int junkCount;

    @SerializedName("junk_position")
    private String junkPosition;

    @SerializedName("include_source")
    private boolean includeSource;

    @SerializedName("reversal_mode")
    @Nullable
    private String reversalMode;

    private ConfigSnapshot() {}

    static ConfigSnapshot of(ObfuscationConfig config) {
      ConfigSnapshot s = new ConfigSnapshot();
      s.level = config.level();
      s.profile = config.profile();
      s.tier = config.tier().token();
      s.repetitions = config.repetitions();
      s.seed = config.seed();
      s.transforms = new ArrayList<>();
      for (Transform t : config.transforms()) {
        s.transforms.add(t.token());
      }
      s.order = new ArrayList<>();
      for (Transform t : config.order()) {
        s.order.add(t.token());
      }
      s.rates = new LinkedHashMap<>();
      s.rates.put("attr_rate", config.attrRate());
      s.rates.put("setattr_rate", config.setattrRate());
      s.rates.put("call_rate", config.callRate());
      s.rates.put("builtin_rate", config.builtinRate());
      s.rates.put("import_rate", config.importRate());
      s.rates.put("flow_rate", config.flowRate());
      s.rates.put("branch_rate", config.branchRate());
      s.rates.put("loop_rate", config.loopRate());
      s.modes = new LinkedHashMap<>();
      s.modes.put("string", lower(config.stringMode()));
      s.modes.put("int", lower(config.intMode()));
      s.modes.put("float", lower(config.floatMode()));
      s.modes.put("bytes", lower(config.bytesMode()));
      s.modes.put("none", lower(config.noneMode()));
      s.modes.put("bool", lower(config.boolMode()));
      s.methods = new LinkedHashMap<>();
      for (MethodFamily family : MethodFamily.values()) {
        List<String> pool = new ArrayList<>();
        for (IndirectionMethod m : config.pool(family)) {
          pool.add(m.token());
        }
        s.methods.put(family.token(), pool);
      }
      s.nameStrategy = lower(config.nameStrategy());
      s.keepDocstrings = config.keepDocstrings();
      s.stringChunkMin = config.stringChunkMin();
      s.stringChunkMax = config.stringChunkMax();
      s.flowCount = config.flowCount();
      s.junkCount = config.junkCount();
      s.junkPosition = lower(config.junkPosition());
      s.includeSource = config.includeSource();
      s.reversalMode = lower(config.reversalMode());
      return s;
    }

    private static String lower(Enum<?> value) {
      return Ascii.toLowerCase(value.name());
    }

    public int level() {
      return level;
    }

    @Nullable
    public Long seed() {
      return seed;
    }

    public ImmutableList<String> order() {
      return order == null ? ImmutableList.of() : ImmutableList.copyOf(order);
    }

    public ImmutableMap<String, List<String>> methods() {
      return methods == null ? ImmutableMap.of() : ImmutableMap.copyOf(methods);
    }

    public boolean includeSource() {
      return includeSource;
    }

    /** The reversal mode the run asked for, or null if unrecorded or unknown. */
    @Nullable
    public ReversalMode reversalMode() {
      if (reversalMode == null) {
        return null;
      }
      for (ReversalMode mode : ReversalMode.values()) {
        if (lower(mode).equals(reversalMode)) {
          return mode;
        }
      }
      return null;
    }
  }
}
