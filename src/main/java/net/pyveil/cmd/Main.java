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

package net.pyveil.cmd;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nullable;
import net.pyveil.manifest.ManifestBuilder;
import net.pyveil.manifest.ObfuscationManifest;
import net.pyveil.obfuscate.ConfigException;
import net.pyveil.obfuscate.ConfigResolver;
import net.pyveil.obfuscate.IndirectionMethod;
import net.pyveil.obfuscate.MethodFamily;
import net.pyveil.obfuscate.ObfuscationConfig;
import net.pyveil.obfuscate.ObfuscationConfig.BoolMode;
import net.pyveil.obfuscate.ObfuscationConfig.BytesMode;
import net.pyveil.obfuscate.ObfuscationConfig.FloatMode;
import net.pyveil.obfuscate.ObfuscationConfig.IntMode;
import net.pyveil.obfuscate.ObfuscationConfig.JunkPosition;
import net.pyveil.obfuscate.ObfuscationConfig.NameStrategy;
import net.pyveil.obfuscate.ObfuscationConfig.NoneMode;
import net.pyveil.obfuscate.ObfuscationConfig.ReversalMode;
import net.pyveil.obfuscate.ObfuscationConfig.StringMode;
import net.pyveil.obfuscate.ObfuscationResult;
import net.pyveil.obfuscate.Obfuscator;
import net.pyveil.obfuscate.Transform;
import net.pyveil.reverse.Deobfuscator;
import net.pyveil.reverse.ReversalException;
import net.pyveil.syntax.ParserInput;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.SyntaxError;

/**
 * Command-line interface for pyveil.
 *
 * <p>Obfuscates one Python file, or with {@code --deobfuscate} reverses one using the manifest of
 * the run that produced it.
 */
public final class Main {

  private static final String USAGE =
      "Usage: pyveil --input=<file.py> --output=<file.py> [--level=N] [--profile=NAME]"
          + " [--tier=NAME] [--seed=N] [--passes=N] [--order=a,b,...] [--allow=...] [--deny=...]"
          + " [--names=counter|confusable] [--emit-map=FILE] [--emit-manifest=FILE]"
          + " [--include-source] [--check] [--explain]\n"
          + "       [--<transform>|--no-<transform>] [--<family>-rate=R]"
          + " [--<family>-method=m,...]\n"
          + "       [--<literal>-mode=NAME] [--keep-docstrings] [--preserve=a,...]"
          + " [--preserve-attrs=a,...]\n"
          + "       [--junk=N] [--junk-pos=top|bottom|random] [--flow-count=N]"
          + " [--string-chunk-min=N] [--string-chunk-max=N]\n"
          + "       pyveil --deobfuscate --manifest=<file.json> --input=<file.py>"
          + " --output=<file.py> [--force] [--strict]";

  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  /** Families whose rate is set by {@code --<family>-rate}. */
  private static final ImmutableSet<String> RATES =
      ImmutableSet.of("attr", "setattr", "call", "builtin", "import", "flow", "branch", "loop");

  /** Literal kinds whose encoding is set by {@code --<kind>-mode}. */
  private static final ImmutableSet<String> MODES =
      ImmutableSet.of("string", "int", "float", "bytes", "none", "bool");

  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  /** CLI options for pyveil. */
  @VisibleForTesting
  static final class Options {
    String input;
    String output;
    @Nullable Integer level;
    @Nullable String profile;
    @Nullable String tier;
    @Nullable Long seed;
    @Nullable Integer passes;
    @Nullable String order;
    @Nullable String allow;
    @Nullable String deny;
    @Nullable String names;
    @Nullable String emitMap;
    @Nullable String emitManifest;
    boolean includeSource;
    boolean check;
    boolean explain;
    boolean keepDocstrings;
    @Nullable String preserve;
    @Nullable String preserveAttrs;
    @Nullable Integer junk;
    @Nullable String junkPos;
    @Nullable Integer flowCount;
    @Nullable Integer stringChunkMin;
    @Nullable Integer stringChunkMax;
    final Map<Transform, Boolean> toggles = Maps.newEnumMap(Transform.class);
    final Map<String, Double> rates = Maps.newLinkedHashMap();
    final Map<String, String> modes = Maps.newLinkedHashMap();
    final Map<MethodFamily, String> methods = Maps.newEnumMap(MethodFamily.class);
    boolean deobfuscate;
    @Nullable String manifest;
    boolean force;
    boolean strict;

    /**
     * Parses the command line.
     *
     * @throws IllegalArgumentException on an unknown option or a malformed number
     */
    static Options parse(String[] args) {
      Options opts = new Options();
      for (String arg : args) {
        if (arg.startsWith("--input=")) {
          opts.input = value(arg);
        } else if (arg.startsWith("--output=")) {
          opts.output = value(arg);
        } else if (arg.startsWith("--level=")) {
          opts.level = Integer.parseInt(value(arg));
        } else if (arg.startsWith("--profile=")) {
          opts.profile = value(arg);
        } else if (arg.startsWith("--tier=")) {
          opts.tier = value(arg);
        } else if (arg.startsWith("--seed=")) {
          opts.seed = Long.parseLong(value(arg));
        } else if (arg.startsWith("--passes=")) {
          opts.passes = Integer.parseInt(value(arg));
        } else if (arg.startsWith("--order=")) {
          opts.order = value(arg);
        } else if (arg.startsWith("--allow=")) {
          opts.allow = value(arg);
        } else if (arg.startsWith("--deny=")) {
          opts.deny = value(arg);
        } else if (arg.startsWith("--names=")) {
          opts.names = value(arg);
        } else if (arg.startsWith("--emit-map=")) {
          opts.emitMap = value(arg);
        } else if (arg.startsWith("--emit-manifest=")) {
          opts.emitManifest = value(arg);
        } else if (arg.equals("--include-source")) {
          opts.includeSource = true;
        } else if (arg.equals("--check")) {
          opts.check = true;
        } else if (arg.equals("--explain")) {
          opts.explain = true;
        } else if (arg.equals("--keep-docstrings")) {
          opts.keepDocstrings = true;
        } else if (arg.startsWith("--preserve=")) {
          opts.preserve = value(arg);
        } else if (arg.startsWith("--preserve-attrs=")) {
          opts.preserveAttrs = value(arg);
        } else if (arg.startsWith("--junk=")) {
          opts.junk = Integer.parseInt(value(arg));
        } else if (arg.startsWith("--junk-pos=")) {
          opts.junkPos = value(arg);
        } else if (arg.startsWith("--flow-count=")) {
          opts.flowCount = Integer.parseInt(value(arg));
        } else if (arg.startsWith("--string-chunk-min=")) {
          opts.stringChunkMin = Integer.parseInt(value(arg));
        } else if (arg.startsWith("--string-chunk-max=")) {
          opts.stringChunkMax = Integer.parseInt(value(arg));
        } else if (arg.equals("--deobfuscate")) {
          opts.deobfuscate = true;
        } else if (arg.startsWith("--manifest=")) {
          opts.manifest = value(arg);
        } else if (arg.equals("--force")) {
          opts.force = true;
        } else if (arg.equals("--strict")) {
          opts.strict = true;
        } else if (!opts.parseFamilyOption(arg)) {
          throw new IllegalArgumentException("unknown option: " + arg);
        }
      }
      return opts;
    }

    private static String value(String arg) {
      return arg.substring(arg.indexOf('=') + 1);
    }

    /**
     * Parses the per-transform toggles and the {@code --<family>-rate}, {@code --<kind>-mode} and
     * {@code --<family>-method} options. Returns false if the argument is none of them.
     */
    private boolean parseFamilyOption(String arg) {
      if (!arg.startsWith("--")) {
        return false;
      }
      int eq = arg.indexOf('=');
      if (eq < 0) {
        boolean on = !arg.startsWith("--no-");
        String token = arg.substring(on ? 2 : 5);
        for (Transform t : Transform.values()) {
          if (t.token().equals(token)) {
            toggles.put(t, on);
            return true;
          }
        }
        return false;
      }
      String key = arg.substring(2, eq);
      int dash = key.lastIndexOf('-');
      if (dash < 0) {
        return false;
      }
      String subject = key.substring(0, dash);
      String value = value(arg);
      switch (key.substring(dash + 1)) {
        case "rate":
          if (!RATES.contains(subject)) {
            return false;
          }
          rates.put(subject, Double.parseDouble(value));
          return true;
        case "mode":
          if (!MODES.contains(subject)) {
            return false;
          }
          modes.put(subject, value);
          return true;
        case "method":
          for (MethodFamily family : MethodFamily.values()) {
            if (family.token().equals(subject)) {
              methods.put(family, value);
              return true;
            }
          }
          return false;
        default:
          return false;
      }
    }

    /** Builds the run configuration the options describe. */
    ObfuscationConfig config() {
      ConfigResolver resolver = ConfigResolver.create();
      if (level != null) {
        resolver.level(level);
      }
      resolver.profile(profile);
      if (tier != null) {
        resolver.tier(tier);
      }
      if (allow != null) {
        resolver.allow(allow);
      }
      if (deny != null) {
        resolver.deny(deny);
      }
      for (Map.Entry<MethodFamily, String> e : methods.entrySet()) {
        MethodFamily family = e.getKey();
        List<IndirectionMethod> pool = new ArrayList<>();
        for (String token : LIST_SPLITTER.split(e.getValue())) {
          pool.add(IndirectionMethod.parse(family, token));
        }
        if (pool.isEmpty()) {
          throw new ConfigException("no methods given for family %s", family);
        }
        resolver.explicitMethods(family, pool.toArray(new IndirectionMethod[0]));
      }
      resolver.override(
          b -> {
            if (seed != null) {
              b.seed(seed);
            }
            if (passes != null) {
              b.repetitions(passes);
            }
            if (order != null) {
              b.order(Transform.parseOrder(order));
            }
            if (names != null) {
              b.nameStrategy(nameStrategy(names));
            }
            if (includeSource) {
              b.includeSource(true);
            }
            if (keepDocstrings) {
              b.keepDocstrings(true);
            }
            toggles.forEach(
                (t, on) -> {
                  if (on) {
                    b.enable(t);
                  } else {
                    b.disable(t);
                  }
                });
            rates.forEach((family, rate) -> applyRate(b, family, rate));
            modes.forEach((kind, mode) -> applyMode(b, kind, mode));
            if (preserve != null) {
              b.preserveNames(ImmutableSet.copyOf(LIST_SPLITTER.split(preserve)));
            }
            if (preserveAttrs != null) {
              b.preserveAttrs(ImmutableSet.copyOf(LIST_SPLITTER.split(preserveAttrs)));
            }
            if (junk != null) {
              b.junkCount(junk);
            }
            if (junkPos != null) {
              b.junkPosition(enumValue(JunkPosition.class, "junk position", junkPos));
            }
            if (flowCount != null) {
              b.flowCount(flowCount);
            }
            if (stringChunkMin != null) {
              b.stringChunkMin(stringChunkMin);
            }
            if (stringChunkMax != null) {
              b.stringChunkMax(stringChunkMax);
            }
          });
      return resolver.resolve();
    }

    private static void applyRate(ObfuscationConfig.Builder b, String family, double rate) {
      switch (family) {
        case "attr":
          b.attrRate(rate);
          break;
        case "setattr":
          b.setattrRate(rate);
          break;
        case "call":
          b.callRate(rate);
          break;
        case "builtin":
          b.builtinRate(rate);
          break;
        case "import":
          b.importRate(rate);
          break;
        case "flow":
          b.flowRate(rate);
          break;
        case "branch":
          b.branchRate(rate);
          break;
        case "loop":
          b.loopRate(rate);
          break;
        default:
          throw new IllegalStateException(family);
      }
    }

    private static void applyMode(ObfuscationConfig.Builder b, String kind, String mode) {
      String what = kind + " mode";
      switch (kind) {
        case "string":
          b.stringMode(enumValue(StringMode.class, what, mode));
          break;
        case "int":
          b.intMode(enumValue(IntMode.class, what, mode));
          break;
        case "float":
          b.floatMode(enumValue(FloatMode.class, what, mode));
          break;
        case "bytes":
          b.bytesMode(enumValue(BytesMode.class, what, mode));
          break;
        case "none":
          b.noneMode(enumValue(NoneMode.class, what, mode));
          break;
        case "bool":
          b.boolMode(enumValue(BoolMode.class, what, mode));
          break;
        default:
          throw new IllegalStateException(kind);
      }
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String what, String token) {
      try {
        return Enum.valueOf(type, token.toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("unknown %s: %s", what, token);
      }
    }

    private static NameStrategy nameStrategy(String token) {
      for (NameStrategy s : NameStrategy.values()) {
        if (s.name().equalsIgnoreCase(token)) {
          return s;
        }
      }
      throw new ConfigException("unknown name strategy: %s", token);
    }
  }

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /** Runs the tool and returns its exit code. */
  @VisibleForTesting
  static int run(String[] args, PrintStream out, PrintStream err) {
    Options opts;
    try {
      opts = Options.parse(args);
    } catch (IllegalArgumentException e) {
      err.println("Error: " + e.getMessage());
      err.println(USAGE);
      return 1;
    }
    if (opts.input == null || opts.output == null || (opts.deobfuscate && opts.manifest == null)) {
      err.println(USAGE);
      return 1;
    }

    Path inputPath = Paths.get(opts.input);
    if (!Files.exists(inputPath)) {
      err.println("Error: Input file does not exist: " + opts.input);
      return 1;
    }

    try {
      String input = Files.readString(inputPath, UTF_8);
      return opts.deobfuscate ? reverse(opts, input, out, err) : obfuscate(opts, input, out, err);
    } catch (IOException e) {
      err.println("Error: " + e.getMessage());
    } catch (ConfigException e) {
      err.println("Error: invalid configuration: " + e.getMessage());
    } catch (SyntaxError.Exception e) {
      err.println(e.describe());
    } catch (ReversalException e) {
      err.println("Error: " + e.getKind() + ": " + e.getMessage());
    }
    return 1;
  }

  private static int obfuscate(Options opts, String input, PrintStream out, PrintStream err)
      throws IOException, SyntaxError.Exception {
    ObfuscationConfig config = opts.config();
    if (opts.explain) {
      out.print(explain(config));
    }
    PyFile file = PyFile.parse(ParserInput.fromString(input, opts.input));
    ObfuscationResult result = Obfuscator.obfuscate(file, config);
    String output = result.output();

    if (opts.check) {
      PyFile reparsed = PyFile.parse(ParserInput.fromString(output, opts.output));
      if (!reparsed.ok()) {
        err.println("Error: output does not parse");
        err.println(new SyntaxError.Exception(reparsed.errors()).describe());
        return 1;
      }
    }

    Files.writeString(Paths.get(opts.output), output, UTF_8);
    out.println("Output written to: " + opts.output);
    if (opts.emitMap != null) {
      Files.writeString(Paths.get(opts.emitMap), GSON.toJson(result.renameMap()) + "\n", UTF_8);
      out.println("Rename map written to: " + opts.emitMap);
    }
    if (opts.emitManifest != null) {
      ObfuscationManifest manifest = ManifestBuilder.build(result, config, input, output);
      Files.writeString(Paths.get(opts.emitManifest), manifest.toJson() + "\n", UTF_8);
      out.println("Manifest written to: " + opts.emitManifest);
    }
    for (String warning : result.stats().warnings()) {
      err.println("Warning: " + warning);
    }
    out.println(result.stats());
    return 0;
  }

  /** Describes the resolved configuration and method pools, one line each. */
  @VisibleForTesting
  static String explain(ObfuscationConfig config) {
    StringBuilder buf = new StringBuilder();
    buf.append(
        String.format(
            Locale.ROOT,
            "Config: level=%d, profile=%s, tier=%s, passes=%d, order=%s, enabled=%s,"
                + " junk=%d@%s, string_mode=%s, int_mode=%s, float_mode=%s, bytes_mode=%s,"
                + " none_mode=%s, bool_mode=%s, attr_rate=%.2f, setattr_rate=%.2f,"
                + " call_rate=%.2f, builtin_rate=%.2f, import_rate=%.2f, flow_rate=%.2f,"
                + " branch_rate=%.2f, loop_rate=%.2f, flow_count=%d, string_chunks=%d-%d,"
                + " keep_docstrings=%s\n",
            config.level(),
            config.profile() == null ? "none" : config.profile(),
            config.tier(),
            config.repetitions(),
            Joiner.on(',').join(config.order()),
            Joiner.on(',').join(config.transforms()),
            config.junkCount(),
            lower(config.junkPosition()),
            lower(config.stringMode()),
            lower(config.intMode()),
            lower(config.floatMode()),
            lower(config.bytesMode()),
            lower(config.noneMode()),
            lower(config.boolMode()),
            config.attrRate(),
            config.setattrRate(),
            config.callRate(),
            config.builtinRate(),
            config.importRate(),
            config.flowRate(),
            config.branchRate(),
            config.loopRate(),
            config.flowCount(),
            config.stringChunkMin(),
            config.stringChunkMax(),
            config.keepDocstrings()));
    List<String> pools = new ArrayList<>();
    for (MethodFamily family : MethodFamily.values()) {
      ImmutableList<IndirectionMethod> pool = config.pool(family);
      pools.add(family + "=[" + Joiner.on(',').join(pool) + "]");
    }
    buf.append("Methods: ").append(Joiner.on(", ").join(pools)).append('\n');
    return buf.toString();
  }

  private static String lower(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }

  private static int reverse(Options opts, String input, PrintStream out, PrintStream err)
      throws IOException, SyntaxError.Exception, ReversalException {
    ObfuscationManifest manifest;
    try {
      manifest = ObfuscationManifest.fromJson(Files.readString(Paths.get(opts.manifest), UTF_8));
    } catch (IllegalArgumentException e) {
      err.println("Error: invalid manifest " + opts.manifest + ": " + e.getMessage());
      return 1;
    }
    Deobfuscator.Result result =
        opts.strict
            ? Deobfuscator.deobfuscate(input, manifest, ReversalMode.STRICT, opts.force)
            : Deobfuscator.deobfuscate(input, manifest, opts.force);
    Files.writeString(Paths.get(opts.output), result.text(), UTF_8);
    out.println("Output written to: " + opts.output + (result.lossless() ? " (verbatim)" : ""));
    for (String warning : result.warnings()) {
      err.println("Warning: " + warning);
    }
    return 0;
  }

  private Main() {}
}
