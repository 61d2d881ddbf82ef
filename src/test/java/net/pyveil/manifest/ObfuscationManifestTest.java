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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSet;
import java.time.Instant;
import net.pyveil.obfuscate.ObfuscationConfig;
import net.pyveil.obfuscate.ObfuscationConfig.ReversalMode;
import net.pyveil.obfuscate.ObfuscationResult;
import net.pyveil.obfuscate.Obfuscator;
import net.pyveil.obfuscate.Transform;
import net.pyveil.syntax.ParserInput;
import net.pyveil.syntax.PyFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ObfuscationManifestTest {

  private static final String INPUT = "def area(w, h):\n    return w * h\nprint(area(2, 3))\n";

  private static ObfuscationManifest build(ObfuscationConfig config) throws Exception {
    PyFile file = PyFile.parseOrThrow(ParserInput.fromString(INPUT, "in.py"));
    ObfuscationResult result = Obfuscator.obfuscate(file, config);
    return ManifestBuilder.build(
        result, config, INPUT, result.output(), Instant.parse("2025-03-04T05:06:07Z"));
  }

  private static ObfuscationConfig.Builder config() {
    return ObfuscationConfig.builder()
        .seed(7L)
        .transforms(ImmutableSet.of(Transform.RENAME, Transform.STRINGS, Transform.CALLS));
  }

  @Test
  public void sha256IsLowercaseHex() {
    assertThat(ManifestBuilder.sha256(""))
        .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
  }

  @Test
  public void jsonRoundTripKeepsEveryField() throws Exception {
    ObfuscationManifest manifest = build(config().build());

    ObfuscationManifest read = ObfuscationManifest.fromJson(manifest.toJson());

    assertThat(read.format()).isEqualTo(ObfuscationManifest.FORMAT);
    assertThat(read.createdUtc()).isEqualTo("2025-03-04T05:06:07Z");
    assertThat(read.inputSha256()).isEqualTo(ManifestBuilder.sha256(INPUT));
    assertThat(read.outputSha256()).isEqualTo(manifest.outputSha256());
    assertThat(read.renameMap()).containsExactly("area", "_o0", "w", "_o1", "h", "_o2");
    assertThat(read.stats()).containsEntry("renamed", 3);
    assertThat(read.stats()).containsEntry("calls", 2);
    assertThat(read.callHelper()).isEqualTo(manifest.callHelper());
    assertThat(read.hasHelperTables()).isTrue();
    assertThat(read.sourcePayload()).isNull();
    assertThat(read.config().level()).isEqualTo(2);
    assertThat(read.config().seed()).isEqualTo(7L);
    assertThat(read.config().reversalMode()).isEqualTo(ReversalMode.BEST_EFFORT);
    assertThat(read.config().methods()).containsKey("call");
  }

  @Test
  public void jsonUsesSnakeCaseKeys() throws Exception {
    String json = build(config().build()).toJson();

    assertThat(json).contains("\"format\": \"pyveil-manifest-v3\"");
    assertThat(json).contains("\"rename_map\"");
    assertThat(json).contains("\"input_sha256\"");
    assertThat(json).contains("\"name_strategy\": \"counter\"");
  }

  @Test
  public void includeSourceCarriesThePayload() throws Exception {
    ObfuscationManifest manifest =
        build(config().includeSource(true).reversalMode(ReversalMode.STRICT).build());

    ObfuscationManifest read = ObfuscationManifest.fromJson(manifest.toJson());

    assertThat(SourcePayload.decode(read.sourcePayload())).isEqualTo(INPUT);
    assertThat(read.config().includeSource()).isTrue();
    assertThat(read.config().reversalMode()).isEqualTo(ReversalMode.STRICT);
  }

  @Test
  public void olderFormatsAreReadable() {
    ObfuscationManifest v1 =
        ObfuscationManifest.fromJson(
            "{\"format\": \"pyveil-manifest-v1\", \"rename_map\": {\"a\": \"_o0\"},"
                + " \"input_sha256\": \"00\"}");
    assertThat(v1.config()).isNull();
    assertThat(v1.renameMap()).containsExactly("a", "_o0");
    assertThat(v1.outputSha256()).isNull();
    assertThat(v1.warnings()).isEmpty();
    assertThat(v1.hasHelperTables()).isFalse();

    ObfuscationManifest v2 =
        ObfuscationManifest.fromJson(
            "{\"format\": \"pyveil-manifest-v2\", \"config\": {\"level\": 3,"
                + " \"reversal_mode\": \"sideways\"}}");
    assertThat(v2.config().level()).isEqualTo(3);
    assertThat(v2.config().reversalMode()).isNull();
    assertThat(v2.builtinAliases()).isEmpty();
    assertThat(v2.hasHelperTables()).isFalse();
  }

  @Test
  public void badManifestsAreRejected() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> ObfuscationManifest.fromJson("{\"format\": \"pyveil-manifest-v9\"}"));
    assertThat(e).hasMessageThat().isEqualTo("unsupported manifest format: pyveil-manifest-v9");

    assertThrows(IllegalArgumentException.class, () -> ObfuscationManifest.fromJson("{oops"));
    assertThrows(IllegalArgumentException.class, () -> ObfuscationManifest.fromJson(""));
    assertThrows(IllegalArgumentException.class, () -> ObfuscationManifest.fromJson("{}"));
  }
}
