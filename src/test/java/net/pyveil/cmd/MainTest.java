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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import net.pyveil.manifest.ObfuscationManifest;
import net.pyveil.obfuscate.IndirectionMethod;
import net.pyveil.obfuscate.MethodFamily;
import net.pyveil.obfuscate.ObfuscationConfig;
import net.pyveil.obfuscate.ObfuscationConfig.FloatMode;
import net.pyveil.obfuscate.ObfuscationConfig.JunkPosition;
import net.pyveil.obfuscate.ObfuscationConfig.StringMode;
import net.pyveil.obfuscate.Transform;
import net.pyveil.syntax.ParserInput;
import net.pyveil.syntax.PyFile;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MainTest {

  private static final String PROGRAM =
      "def greet(name):\n"
          + "    message = 'Hello, ' + name\n"
          + "    print(message)\n"
          + "    return len(message)\n"
          + "\n"
          + "greet('world')\n";

  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
  private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
  private Path input;

  @Before
  public void writeInput() throws Exception {
    input = tmp.newFile("in.py").toPath();
    Files.writeString(input, PROGRAM, UTF_8);
  }

  private int run(String... args) {
    outBytes.reset();
    errBytes.reset();
    return Main.run(
        args, new PrintStream(outBytes, true, UTF_8), new PrintStream(errBytes, true, UTF_8));
  }

  private String out() {
    return outBytes.toString(UTF_8);
  }

  private String err() {
    return errBytes.toString(UTF_8);
  }

  private String path(String name) {
    return new File(tmp.getRoot(), name).getPath();
  }

  private static String read(String path) throws Exception {
    return Files.readString(Path.of(path), UTF_8);
  }

  @Test
  public void obfuscateWritesOutputMapAndManifest() throws Exception {
    int code =
        run(
            "--input=" + input,
            "--output=" + path("out.py"),
            "--level=3",
            "--seed=5",
            "--check",
            "--emit-map=" + path("map.json"),
            "--emit-manifest=" + path("manifest.json"));

    assertThat(code).isEqualTo(0);
    assertThat(out()).contains("Output written to: " + path("out.py"));
    assertThat(out()).contains("renamed=");
    String output = read(path("out.py"));
    assertThat(PyFile.parse(ParserInput.fromString(output, "out.py")).ok()).isTrue();
    assertThat(output).doesNotContain("Hello");

    Map<String, String> map =
        new Gson()
            .fromJson(read(path("map.json")), new TypeToken<Map<String, String>>() {}.getType());
    assertThat(map).containsKey("greet");
    ObfuscationManifest manifest = ObfuscationManifest.fromJson(read(path("manifest.json")));
    assertThat(manifest.renameMap()).isEqualTo(map);
    assertThat(manifest.config().level()).isEqualTo(3);
  }

  @Test
  public void deobfuscateUndoesTheDefaultLevel() throws Exception {
    assertThat(
            run(
                "--input=" + input,
                "--output=" + path("out.py"),
                "--seed=1",
                "--emit-manifest=" + path("manifest.json")))
        .isEqualTo(0);

    int code =
        run(
            "--deobfuscate",
            "--manifest=" + path("manifest.json"),
            "--input=" + path("out.py"),
            "--output=" + path("back.py"));

    assertThat(code).isEqualTo(0);
    assertThat(out()).isEqualTo("Output written to: " + path("back.py") + "\n");
    assertThat(read(path("back.py")))
        .isEqualTo(PyFile.parseOrThrow(ParserInput.fromString(PROGRAM, "in.py")).toString());
  }

  @Test
  public void includedSourceIsRestoredVerbatim() throws Exception {
    run(
        "--input=" + input,
        "--output=" + path("out.py"),
        "--include-source",
        "--emit-manifest=" + path("manifest.json"));

    int code =
        run(
            "--deobfuscate",
            "--strict",
            "--manifest=" + path("manifest.json"),
            "--input=" + path("out.py"),
            "--output=" + path("back.py"));

    assertThat(code).isEqualTo(0);
    assertThat(out()).contains("(verbatim)");
    assertThat(read(path("back.py"))).isEqualTo(PROGRAM);
  }

  @Test
  public void reversalErrors() throws Exception {
    run("--input=" + input, "--output=" + path("out.py"), "--emit-manifest=" + path("m.json"));
    Files.writeString(Path.of(path("out.py")), "# edited\n", UTF_8, StandardOpenOption.APPEND);

    assertThat(
            run(
                "--deobfuscate",
                "--manifest=" + path("m.json"),
                "--input=" + path("out.py"),
                "--output=" + path("back.py")))
        .isEqualTo(1);
    assertThat(err()).startsWith("Error: HASH_MISMATCH: ");

    assertThat(
            run(
                "--deobfuscate",
                "--force",
                "--manifest=" + path("m.json"),
                "--input=" + path("out.py"),
                "--output=" + path("back.py")))
        .isEqualTo(0);
    assertThat(err()).contains("Warning: hash mismatch ignored due to force");

    assertThat(
            run(
                "--deobfuscate",
                "--strict",
                "--force",
                "--manifest=" + path("m.json"),
                "--input=" + path("out.py"),
                "--output=" + path("back.py")))
        .isEqualTo(1);
    assertThat(err()).startsWith("Error: INCOMPLETE: ");
  }

  @Test
  public void invalidManifest() throws Exception {
    Files.writeString(Path.of(path("m.json")), "{\"format\": \"other\"}", UTF_8);

    int code =
        run(
            "--deobfuscate",
            "--manifest=" + path("m.json"),
            "--input=" + input,
            "--output=" + path("back.py"));

    assertThat(code).isEqualTo(1);
    assertThat(err()).contains("Error: invalid manifest " + path("m.json"));
  }

  @Test
  public void usageErrors() {
    assertThat(run("--input=" + input)).isEqualTo(1);
    assertThat(err()).startsWith("Usage: pyveil");

    assertThat(run("--deobfuscate", "--input=" + input, "--output=" + path("o.py"))).isEqualTo(1);
    assertThat(err()).startsWith("Usage: pyveil");

    assertThat(run("--bogus")).isEqualTo(1);
    assertThat(err()).startsWith("Error: unknown option: --bogus\nUsage: pyveil");

    assertThat(run("--input=" + input, "--output=o.py", "--level=two")).isEqualTo(1);
    assertThat(err()).startsWith("Error: ");
  }

  @Test
  public void missingInput() {
    int code = run("--input=" + path("absent.py"), "--output=" + path("o.py"));

    assertThat(code).isEqualTo(1);
    assertThat(err()).isEqualTo("Error: Input file does not exist: " + path("absent.py") + "\n");
  }

  @Test
  public void configurationErrors() {
    assertThat(run("--input=" + input, "--output=" + path("o.py"), "--level=9")).isEqualTo(1);
    assertThat(err()).startsWith("Error: invalid configuration: level must be between 1 and 5");

    assertThat(run("--input=" + input, "--output=" + path("o.py"), "--names=fancy"))
        .isEqualTo(1);
    assertThat(err()).contains("unknown name strategy: fancy");

    assertThat(run("--input=" + input, "--output=" + path("o.py"), "--order=rename"))
        .isEqualTo(1);
    assertThat(err()).startsWith("Error: invalid configuration: ");
    assertThat(Files.exists(Path.of(path("o.py")))).isFalse();
  }

  @Test
  public void syntaxErrorsAreReported() throws Exception {
    Files.writeString(input, "def broken(:\n", UTF_8);

    assertThat(run("--input=" + input, "--output=" + path("o.py"))).isEqualTo(1);
    assertThat(err()).isNotEmpty();
    assertThat(Files.exists(Path.of(path("o.py")))).isFalse();
  }

  @Test
  public void optionsParse() {
    Main.Options opts =
        Main.Options.parse(
            new String[] {"--input=a.py", "--output=b.py", "--seed=7", "--passes=2", "--strict"});

    assertThat(opts.input).isEqualTo("a.py");
    assertThat(opts.seed).isEqualTo(7L);
    assertThat(opts.passes).isEqualTo(2);
    assertThat(opts.strict).isTrue();
    assertThat(opts.config().repetitions()).isEqualTo(2);
    assertThrows(IllegalArgumentException.class, () -> Main.Options.parse(new String[] {"-x"}));
  }

  @Test
  public void keepDocstringsLeavesThemReadable() throws Exception {
    Files.writeString(
        input, "def greet(name):\n    'Say hello.'\n    print('Hello, ' + name)\n", UTF_8);

    assertThat(run("--input=" + input, "--output=" + path("a.py"), "--seed=3")).isEqualTo(0);
    assertThat(read(path("a.py"))).doesNotContain("Say hello.");

    assertThat(
            run("--input=" + input, "--output=" + path("b.py"), "--seed=3", "--keep-docstrings"))
        .isEqualTo(0);
    String output = read(path("b.py"));
    assertThat(output).contains("Say hello.");
    assertThat(output).doesNotContain("Hello, ");
  }

  @Test
  public void passTogglesOverrideTheLevel() throws Exception {
    assertThat(run("--input=" + input, "--output=" + path("a.py"), "--level=2", "--no-strings"))
        .isEqualTo(0);
    assertThat(read(path("a.py"))).contains("Hello, ");

    assertThat(run("--input=" + input, "--output=" + path("b.py"), "--level=1", "--strings"))
        .isEqualTo(0);
    assertThat(read(path("b.py"))).doesNotContain("Hello, ");
  }

  @Test
  public void modesAndJunkReachTheOutput() throws Exception {
    int code =
        run(
            "--input=" + input,
            "--output=" + path("out.py"),
            "--string-mode=reverse",
            "--junk=2",
            "--junk-pos=bottom",
            "--check");

    assertThat(code).isEqualTo(0);
    assertThat(read(path("out.py"))).contains(",olleH");
    assertThat(out()).contains("junk_functions=2");
  }

  @Test
  public void explainPrintsTheResolvedConfig() throws Exception {
    int code =
        run(
            "--input=" + input,
            "--output=" + path("out.py"),
            "--explain",
            "--level=4",
            "--attr-rate=0.5",
            "--call-method=helper_wrap",
            "--junk=1",
            "--junk-pos=random",
            "--string-chunk-min=2",
            "--string-chunk-max=4");

    assertThat(code).isEqualTo(0);
    assertThat(out()).startsWith("Config: level=4, profile=none, tier=safe, ");
    assertThat(out()).contains("junk=1@random");
    assertThat(out()).contains("attr_rate=0.50");
    assertThat(out()).contains("string_chunks=2-4");
    assertThat(out()).contains("\nMethods: attr=[");
    assertThat(out()).contains("call=[helper_wrap]");
    assertThat(Files.exists(Path.of(path("out.py")))).isTrue();
  }

  @Test
  public void familyOptionsParse() {
    Main.Options opts =
        Main.Options.parse(
            new String[] {
              "--input=a.py",
              "--output=b.py",
              "--level=1",
              "--floats",
              "--no-rename",
              "--flow-rate=0.25",
              "--float-mode=struct",
              "--string-mode=SPLIT",
              "--attr-method=getattr, lambda_getattr",
              "--preserve=main,api_key",
              "--preserve-attrs=run",
              "--junk=3",
              "--junk-pos=top",
              "--flow-count=2",
              "--string-chunk-min=3",
              "--string-chunk-max=3"
            });

    ObfuscationConfig config = opts.config();
    assertThat(config.isEnabled(Transform.FLOATS)).isTrue();
    assertThat(config.isEnabled(Transform.RENAME)).isFalse();
    assertThat(config.flowRate()).isEqualTo(0.25);
    assertThat(config.floatMode()).isEqualTo(FloatMode.STRUCT);
    assertThat(config.stringMode()).isEqualTo(StringMode.SPLIT);
    assertThat(config.pool(MethodFamily.ATTR))
        .containsExactly(IndirectionMethod.GETATTR, IndirectionMethod.LAMBDA_GETATTR);
    assertThat(config.preserveNames()).containsAtLeast("main", "api_key");
    assertThat(config.preserveAttrs()).containsExactly("run");
    assertThat(config.junkCount()).isEqualTo(3);
    assertThat(config.junkPosition()).isEqualTo(JunkPosition.TOP);
    assertThat(config.flowCount()).isEqualTo(2);
    assertThat(config.stringChunkMin()).isEqualTo(3);
    assertThat(config.stringChunkMax()).isEqualTo(3);

    assertThrows(
        IllegalArgumentException.class, () -> Main.Options.parse(new String[] {"--no-bogus"}));
    assertThrows(
        IllegalArgumentException.class, () -> Main.Options.parse(new String[] {"--dict-rate=1"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> Main.Options.parse(new String[] {"--attr-rate=half"}));
  }

  @Test
  public void familyOptionErrors() {
    assertThat(run("--input=" + input, "--output=" + path("o.py"), "--string-mode=rot13"))
        .isEqualTo(1);
    assertThat(err()).startsWith("Error: invalid configuration: unknown string mode: rot13");

    assertThat(run("--input=" + input, "--output=" + path("o.py"), "--attr-rate=1.5"))
        .isEqualTo(1);
    assertThat(err()).contains("attr rate must be within [0, 1]");

    assertThat(run("--input=" + input, "--output=" + path("o.py"), "--attr-method=nope"))
        .isEqualTo(1);
    assertThat(err()).contains("unknown method attr:nope");

    assertThat(run("--input=" + input, "--output=" + path("o.py"), "--junk-pos=middle"))
        .isEqualTo(1);
    assertThat(err()).contains("unknown junk position: middle");
    assertThat(Files.exists(Path.of(path("o.py")))).isFalse();
  }
}
