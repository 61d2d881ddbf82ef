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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import net.pyveil.manifest.ManifestBuilder;
import net.pyveil.manifest.ObfuscationManifest;
import net.pyveil.manifest.SourcePayload;
import net.pyveil.obfuscate.ObfuscationConfig.ReversalMode;
import net.pyveil.obfuscate.rename.Renamer;
import net.pyveil.syntax.ParserInput;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.SyntaxError;

/**
 * Recovers a program from obfuscated text and the manifest of the run that produced it.
 *
 * <p>The verbatim copy of the original is returned whenever the manifest carries one. Otherwise
 * the text is parsed and each reversible rewrite is undone in turn: rename, builtin aliases,
 * encoded strings, call trampolines, reflective attribute access and dynamic imports. Finally,
 * helper functions left without callers are removed. Shapes that do not match exactly are left
 * in place.
 */
public final class Deobfuscator {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Bounds the call and attribute rounds; each round strictly shrinks the tree. */
  private static final int MAX_COLLAPSE_ROUNDS = 32;

  /** The recovered program. */
  @AutoValue
  public abstract static class Result {

    public abstract String text();

    public abstract ImmutableList<String> warnings();

    /** Reports whether {@link #text} is the original program byte for byte. */
    public abstract boolean lossless();

    static Result create(String text, List<String> warnings, boolean lossless) {
      return new AutoValue_Deobfuscator_Result(text, ImmutableList.copyOf(warnings), lossless);
    }
  }

  private Deobfuscator() {}

  /** Reverses {@code text} in the mode the manifest was written with, best effort by default. */
  public static Result deobfuscate(String text, ObfuscationManifest manifest, boolean force)
      throws ReversalException, SyntaxError.Exception {
    ReversalMode mode = null;
    if (manifest.config() != null) {
      mode = manifest.config().reversalMode();
    }
    return deobfuscate(text, manifest, mode == null ? ReversalMode.BEST_EFFORT : mode, force);
  }

  /**
   * Reverses {@code text}.
   *
   * @param force accept text whose hash differs from the one the manifest recorded
   * @throws ReversalException if the hash does not match and {@code force} is false, or if {@code
   *     mode} is strict and the manifest has no usable verbatim copy
   * @throws SyntaxError.Exception if the text does not parse
   */
  public static Result deobfuscate(
      String text, ObfuscationManifest manifest, ReversalMode mode, boolean force)
      throws ReversalException, SyntaxError.Exception {
    List<String> warnings = new ArrayList<>();

    String expected = manifest.outputSha256();
    if (expected != null && !expected.equals(ManifestBuilder.sha256(text))) {
      if (!force) {
        throw new ReversalException(
            ReversalException.Kind.HASH_MISMATCH,
            "text does not match the manifest: expected sha256 %s",
            expected);
      }
      warnings.add("hash mismatch ignored due to force");
    }

    String payload = manifest.sourcePayload();
    if (payload != null) {
      try {
        return Result.create(SourcePayload.decode(payload), warnings, true);
      } catch (IllegalArgumentException e) {
        if (mode == ReversalMode.STRICT) {
          throw new ReversalException(
              ReversalException.Kind.INCOMPLETE, "unreadable source payload: %s", e.getMessage());
        }
        logger.atWarning().withCause(e).log("unreadable source payload");
        warnings.add("unreadable source payload");
      }
    } else if (mode == ReversalMode.STRICT) {
      throw new ReversalException(
          ReversalException.Kind.INCOMPLETE,
          "strict reversal needs a manifest written with the source included");
    }

    PyFile file = PyFile.parseOrThrow(ParserInput.fromString(text, "<obfuscated>"));
    boolean found = false;

    if (!manifest.renameMap().isEmpty()) {
      try {
        file = Renamer.rename(file, ImmutableBiMap.copyOf(manifest.renameMap()).inverse());
        warnings.add("rename-map");
        found = true;
      } catch (IllegalArgumentException e) {
        // Two names were renamed to the same name, so there is no inverse.
        warnings.add("rename map is not invertible");
      }
    }

    if (manifest.hasHelperTables()) {
      AliasCollapser aliases = new AliasCollapser(manifest.builtinAliases());
      file = aliases.run(file);
      found |= report(warnings, "alias-collapse", aliases);
    }

    boolean recorded = manifest.hasHelperTables();
    Predicate<String> isStringHelper = HelperNames.stringHelper(recorded, manifest.stringHelper());
    Predicate<String> isCallHelper = HelperNames.callHelper(recorded, manifest.callHelper());

    LiteralDecoder literals = new LiteralDecoder(isStringHelper);
    file = literals.run(file);
    found |= report(warnings, "literal-decode", literals);

    int calls = 0;
    int attrs = 0;
    for (int round = 0; round < MAX_COLLAPSE_ROUNDS; round++) {
      CallCollapser callCollapser = new CallCollapser(isCallHelper);
      file = callCollapser.run(file);
      AttributeCollapser attrCollapser = new AttributeCollapser();
      file = attrCollapser.run(file);
      calls += callCollapser.count();
      attrs += attrCollapser.count();
      if (callCollapser.count() == 0 && attrCollapser.count() == 0) {
        break;
      }
    }
    found |= report(warnings, "call-collapse", calls);
    found |= report(warnings, "attr-collapse", attrs);

    ImportRebuilder imports = new ImportRebuilder();
    file = imports.run(file);
    found |= report(warnings, "import-rebuild", imports);

    HelperRemover helpers = new HelperRemover(isStringHelper.or(isCallHelper));
    file = helpers.run(file);
    found |= report(warnings, "helper-removal", helpers);

    if (!found) {
      warnings.add("no reversible pattern found");
    }
    logger.atFine().log("reversal finished: %s", warnings);
    return Result.create(file.toString(), warnings, false);
  }

  private static boolean report(List<String> warnings, String token, Recognizer recognizer) {
    return report(warnings, token, recognizer.count());
  }

  private static boolean report(List<String> warnings, String token, int count) {
    if (count == 0) {
      return false;
    }
    warnings.add(token + "=" + count);
    return true;
  }
}
