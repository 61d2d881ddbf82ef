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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.hash.Hashing;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import net.pyveil.obfuscate.ObfuscationConfig;
import net.pyveil.obfuscate.ObfuscationResult;

/** Builds the manifest of an obfuscation run. */
public final class ManifestBuilder {

  private ManifestBuilder() {}

  /** Returns the lowercase hex SHA-256 of the UTF-8 encoding of {@code text}. */
  public static String sha256(String text) {
    return Hashing.sha256().hashString(text, UTF_8).toString();
  }

  /**
   * Builds the manifest of a run.
   *
   * @param input the text that was parsed
   * @param output the text that was written, which reversal will be handed
   */
  public static ObfuscationManifest build(
      ObfuscationResult result,
      ObfuscationConfig config,
      String input,
      String output,
      Instant now) {
    return new ObfuscationManifest(
        DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(now.atOffset(ZoneOffset.UTC)),
        ObfuscationManifest.ConfigSnapshot.of(config),
        result.stats().byToken(),
        result.renameMap(),
        sha256(input),
        sha256(output),
        result.stats().warnings(),
        result.stringHelper(),
        result.callHelper(),
        result.builtinAliases(),
        config.includeSource() ? SourcePayload.encode(input) : null);
  }

  public static ObfuscationManifest build(
      ObfuscationResult result, ObfuscationConfig config, String input, String output) {
    return build(result, config, input, output, Instant.now());
  }
}
