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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSet;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import net.pyveil.manifest.ManifestBuilder;
import net.pyveil.manifest.ObfuscationManifest;
import net.pyveil.obfuscate.ObfuscationConfig;
import net.pyveil.obfuscate.ObfuscationConfig.ReversalMode;
import net.pyveil.obfuscate.ObfuscationResult;
import net.pyveil.obfuscate.Obfuscator;
import net.pyveil.obfuscate.Transform;
import net.pyveil.syntax.ParserInput;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.SyntaxError;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public final class DeobfuscatorTest {

  private static final String SOURCE =
      String.join(
          "\n",
          "# Box bookkeeping.",
          "import json",
          "from os import path as p, sep",
          "",
          "",
          "class Box:",
          "    def __init__(self, size):",
          "        self.size = size",
          "",
          "    def grow(self, n):",
          "        self.size = self.size + n",
          "        return self.size",
          "",
          "",
          "def describe(box, label='box'):",
          "    text = label + ': ' + str(box.size)",
          "    print(text, p.basename(sep), sep='')",
          "    return json.dumps({'label': label, 'size': box.size})",
          "",
          "",
          "b = Box(2)",
          "b.grow(3)",
          "describe(b)",
          "del b.size",
          "");

  /** The transforms whose rewrites reversal undoes. */
  enum Reversible {
    RENAME(Transform.RENAME),
    STRINGS(Transform.STRINGS),
    ATTRS(Transform.ATTRS),
    SETATTRS(Transform.SETATTRS),
    CALLS(Transform.CALLS),
    IMPORTS(Transform.IMPORTS),
    BUILTINS(Transform.BUILTINS),
    ALL(
        Transform.RENAME,
        Transform.STRINGS,
        Transform.ATTRS,
        Transform.SETATTRS,
        Transform.CALLS,
        Transform.IMPORTS,
        Transform.BUILTINS);

    final ImmutableSet<Transform> transforms;

    Reversible(Transform... transforms) {
      this.transforms = ImmutableSet.copyOf(transforms);
    }
  }

  private static String canonical(String source) throws SyntaxError.Exception {
    return PyFile.parseOrThrow(ParserInput.fromString(source, "in.py")).toString();
  }

  private static ObfuscationConfig.Builder config(ImmutableSet<Transform> transforms) {
    return ObfuscationConfig.builder().seed(99L).transforms(transforms);
  }

  /** The obfuscated text of {@link #SOURCE} and its manifest. */
  private static final class Run {
    final String output;
    final ObfuscationManifest manifest;

    Run(ObfuscationConfig config) throws SyntaxError.Exception {
      PyFile file = PyFile.parseOrThrow(ParserInput.fromString(SOURCE, "in.py"));
      ObfuscationResult result = Obfuscator.obfuscate(file, config);
      this.output = result.output();
      this.manifest = ManifestBuilder.build(result, config, SOURCE, output);
    }
  }

  @Test
  public void reversalRestoresAnEquivalentProgram(
      @TestParameter Reversible reversible, @TestParameter({"1", "2", "3"}) long seed)
      throws Exception {
    ObfuscationConfig config = config(reversible.transforms).seed(seed).build();
    Run run = new Run(config);

    Deobfuscator.Result result = Deobfuscator.deobfuscate(run.output, run.manifest, false);

    assertThat(result.text()).isEqualTo(canonical(SOURCE));
    assertThat(result.lossless()).isFalse();
    assertThat(result.warnings()).doesNotContain("no reversible pattern found");
  }

  private static final String ACCOUNT =
      String.join(
          "\n",
          "from xml import dom",
          "",
          "",
          "class Account:",
          "    def __init__(self):",
          "        self.balance = 0",
          "",
          "    def deposit(self, amount):",
          "        self.balance = self.balance + amount",
          "",
          "    def withdraw(self, amount):",
          "        self.balance = self.balance - amount",
          "",
          "",
          "acct = Account()",
          "acct.deposit(30)",
          "acct.withdraw(7)",
          "print(acct.balance, dom.__name__)",
          "");

  @Test
  public void fullIndirectionOfAnAccountIsUndone(@TestParameter({"1", "2", "3", "4"}) long seed)
      throws Exception {
    ObfuscationConfig config =
        config(
                ImmutableSet.of(
                    Transform.ATTRS, Transform.SETATTRS, Transform.CALLS, Transform.IMPORTS))
            .seed(seed)
            .build();
    PyFile file = PyFile.parseOrThrow(ParserInput.fromString(ACCOUNT, "account.py"));
    ObfuscationResult result = Obfuscator.obfuscate(file, config);
    ObfuscationManifest manifest = ManifestBuilder.build(result, config, ACCOUNT, result.output());

    // Every attribute access and call on the account goes through reflection.
    assertThat(result.output()).doesNotContain(".balance");
    assertThat(result.output()).doesNotContain(".deposit(");
    assertThat(result.output()).doesNotContain(".withdraw(");
    assertThat(result.output()).doesNotContain("from xml import dom");

    Deobfuscator.Result reversed = Deobfuscator.deobfuscate(result.output(), manifest, false);

    assertThat(reversed.text()).isEqualTo(canonical(ACCOUNT));
  }

  @Test
  public void manifestSurvivesJson() throws Exception {
    Run run = new Run(config(Reversible.ALL.transforms).build());
    ObfuscationManifest read = ObfuscationManifest.fromJson(run.manifest.toJson());

    Deobfuscator.Result result = Deobfuscator.deobfuscate(run.output, read, false);

    assertThat(result.text()).isEqualTo(canonical(SOURCE));
  }

  @Test
  public void warningsNameTheUndoneRewrites() throws Exception {
    Run run = new Run(config(ImmutableSet.of(Transform.RENAME, Transform.CALLS)).build());

    Deobfuscator.Result result = Deobfuscator.deobfuscate(run.output, run.manifest, false);

    assertThat(result.warnings()).contains("rename-map");
    assertThat(result.warnings()).contains("call-collapse=7");
  }

  @Test
  public void sourcePayloadIsReturnedVerbatim() throws Exception {
    ObfuscationConfig config =
        config(Reversible.ALL.transforms)
            .includeSource(true)
            .reversalMode(ReversalMode.STRICT)
            .build();
    Run run = new Run(config);

    Deobfuscator.Result result = Deobfuscator.deobfuscate(run.output, run.manifest, false);

    assertThat(result.text()).isEqualTo(SOURCE);
    assertThat(result.lossless()).isTrue();
    assertThat(result.warnings()).isEmpty();
  }

  @Test
  public void hashMismatchIsRefusedUnlessForced() throws Exception {
    Run run = new Run(config(ImmutableSet.of(Transform.RENAME)).build());
    String edited = run.output + "x = 1\n";

    ReversalException e =
        assertThrows(
            ReversalException.class, () -> Deobfuscator.deobfuscate(edited, run.manifest, false));
    assertThat(e.getKind()).isEqualTo(ReversalException.Kind.HASH_MISMATCH);

    Deobfuscator.Result result = Deobfuscator.deobfuscate(edited, run.manifest, true);
    assertThat(result.warnings().get(0)).isEqualTo("hash mismatch ignored due to force");
    assertThat(result.text()).isEqualTo(canonical(SOURCE + "x = 1\n"));
  }

  @Test
  public void strictReversalNeedsThePayload() throws Exception {
    Run run = new Run(config(ImmutableSet.of(Transform.RENAME)).build());

    ReversalException e =
        assertThrows(
            ReversalException.class,
            () ->
                Deobfuscator.deobfuscate(
                    run.output, run.manifest, ReversalMode.STRICT, /* force= */ false));
    assertThat(e.getKind()).isEqualTo(ReversalException.Kind.INCOMPLETE);
  }

  @Test
  public void manifestChoosesTheMode() throws Exception {
    ObfuscationManifest manifest =
        ObfuscationManifest.fromJson(
            "{\"format\": \"pyveil-manifest-v2\", \"config\": {\"reversal_mode\": \"strict\"}}");

    ReversalException e =
        assertThrows(
            ReversalException.class, () -> Deobfuscator.deobfuscate("x = 1\n", manifest, false));
    assertThat(e.getKind()).isEqualTo(ReversalException.Kind.INCOMPLETE);
  }

  @Test
  public void unreadablePayload() throws Exception {
    ObfuscationManifest manifest =
        ObfuscationManifest.fromJson(
            "{\"format\": \"pyveil-manifest-v3\", \"original_source_b85_zlib\": \"00000\"}");

    Deobfuscator.Result result =
        Deobfuscator.deobfuscate("x = 1\n", manifest, ReversalMode.BEST_EFFORT, false);
    assertThat(result.warnings())
        .containsExactly("unreadable source payload", "no reversible pattern found")
        .inOrder();
    assertThat(result.lossless()).isFalse();

    ReversalException e =
        assertThrows(
            ReversalException.class,
            () -> Deobfuscator.deobfuscate("x = 1\n", manifest, ReversalMode.STRICT, false));
    assertThat(e.getKind()).isEqualTo(ReversalException.Kind.INCOMPLETE);
  }

  @Test
  public void plainTextHasNothingToReverse() throws Exception {
    ObfuscationManifest manifest =
        ObfuscationManifest.fromJson("{\"format\": \"pyveil-manifest-v3\"}");

    Deobfuscator.Result result = Deobfuscator.deobfuscate("x = f(1)\n", manifest, false);

    assertThat(result.text()).isEqualTo("x = f(1)\n");
    assertThat(result.warnings()).containsExactly("no reversible pattern found");
  }

  @Test
  public void nonInvertibleRenameMapIsReported() throws Exception {
    ObfuscationManifest manifest =
        ObfuscationManifest.fromJson(
            "{\"format\": \"pyveil-manifest-v3\", \"rename_map\": {\"a\": \"z\", \"b\": \"z\"}}");

    Deobfuscator.Result result = Deobfuscator.deobfuscate("z = 1\n", manifest, false);

    assertThat(result.text()).isEqualTo("z = 1\n");
    assertThat(result.warnings())
        .containsExactly("rename map is not invertible", "no reversible pattern found");
  }

  @Test
  public void olderManifestsFallBackToDefaultHelperNames() throws Exception {
    ObfuscationManifest manifest =
        ObfuscationManifest.fromJson("{\"format\": \"pyveil-manifest-v1\"}");
    String text =
        "def _obf_str_x(mode, payload):\n"
            + "    return payload[::-1]\n"
            + "x = _obf_str_x(2, 'ih')\n";

    Deobfuscator.Result result = Deobfuscator.deobfuscate(text, manifest, false);

    assertThat(result.text()).isEqualTo("x = 'hi'\n");
    assertThat(result.warnings())
        .containsExactly("literal-decode=1", "helper-removal=1")
        .inOrder();
  }

  @Test
  public void unparsableTextIsReported() {
    ObfuscationManifest manifest =
        ObfuscationManifest.fromJson("{\"format\": \"pyveil-manifest-v3\"}");

    assertThrows(
        SyntaxError.Exception.class, () -> Deobfuscator.deobfuscate("def (:\n", manifest, false));
  }
}
