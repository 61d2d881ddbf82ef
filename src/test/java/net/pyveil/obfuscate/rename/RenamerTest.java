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

package net.pyveil.obfuscate.rename;

import static com.google.common.truth.Truth.assertThat;
import static net.pyveil.obfuscate.PassTesting.parse;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.pyveil.obfuscate.NameGenerator;
import net.pyveil.obfuscate.ObfuscationConfig.NameStrategy;
import net.pyveil.obfuscate.RandomSource;
import net.pyveil.syntax.PyFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link RenameCollector} and {@link Renamer}. */
@RunWith(JUnit4.class)
public final class RenamerTest {

  private static ImmutableMap<String, String> collect(PyFile file, String... preserve) {
    NameGenerator names =
        new NameGenerator(
            NameGenerator.collectIdentifiers(file), NameStrategy.COUNTER, new RandomSource(1L));
    return RenameCollector.collect(file, ImmutableSet.copyOf(preserve), names);
  }

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  @Test
  public void collect_ordersByFirstBinding() throws Exception {
    PyFile file =
        parse(
            "import os", //
            "def area(width, height):",
            "    result = width * height",
            "    return result",
            "total = area(2, 3)");

    assertThat(collect(file))
        .containsExactly(
            "os", "_o0",
            "area", "_o1",
            "width", "_o2",
            "height", "_o3",
            "result", "_o4",
            "total", "_o5")
        .inOrder();
  }

  @Test
  public void collect_skipsIneligibleNames() throws Exception {
    PyFile file =
        parse(
            "import os.path",
            "from __future__ import annotations",
            "__all__ = ['f']",
            "len = 3",
            "def f(key, value):",
            "    return dict(key=value)",
            "keep = 1");

    ImmutableMap<String, String> map = collect(file, "keep");

    assertThat(map.keySet()).containsExactly("f", "value");
  }

  @Test
  public void collect_classBodyBindingsAreAttributes() throws Exception {
    PyFile file =
        parse(
            "class Point:",
            "    origin = 0",
            "    def norm(self):",
            "        squared = self.x * self.x",
            "        return squared");

    assertThat(collect(file).keySet()).containsExactly("Point", "self", "squared");
  }

  @Test
  public void rename_appliesMapEverywhere() throws Exception {
    PyFile file =
        parse(
            "import json as codec",
            "from os import path",
            "def load(name):",
            "    return codec.loads(path.join(name))",
            "data = [load(n) for n in ('a', 'b')]");

    PyFile renamed = Renamer.rename(file, collect(file));

    assertThat(renamed.toString())
        .isEqualTo(
            lines(
                "import json as _o0",
                "from os import path as _o1",
                "def _o2(_o3):",
                "    return _o0.loads(_o1.join(_o3))",
                "_o4 = [_o2(_o5) for _o5 in ('a', 'b')]"));
  }

  @Test
  public void collect_neverRenamesNamesAClassBodyBinds() throws Exception {
    PyFile file =
        parse(
            "size = 2", //
            "class Box:",
            "    size = size * 2",
            "other = size");

    assertThat(collect(file).keySet()).containsExactly("Box", "other");
  }

  @Test
  public void rename_keepsClassAttributesAndTheirLoads() throws Exception {
    PyFile file =
        parse(
            "size = 2",
            "class Box:",
            "    scale = 2",
            "    double = scale * 2",
            "    def grow(self):",
            "        return self.scale + size + scale");

    PyFile renamed =
        Renamer.rename(file, ImmutableMap.of("size", "_s", "self", "_t", "scale", "_c"));

    assertThat(renamed.toString())
        .isEqualTo(
            lines(
                "_s = 2",
                "class Box:",
                "    scale = 2",
                "    double = scale * 2",
                "    def grow(_t):",
                "        return _t.scale + _s + _c"));
  }

  @Test
  public void rename_inverseRestoresTheSource() throws Exception {
    PyFile file =
        parse(
            "import json",
            "from os import path as p",
            "def f(a, *rest, b=1, **kw):",
            "    global counter",
            "    counter = a + b",
            "    with open(p.join(a)) as fh:",
            "        for line in fh:",
            "            try:",
            "                yield json.loads(line)",
            "            except ValueError as err:",
            "                del err",
            "    return lambda x: x + len(rest)");
    ImmutableMap<String, String> map = collect(file);

    PyFile renamed = Renamer.rename(file, map);
    PyFile restored = Renamer.rename(renamed, ImmutableBiMap.copyOf(map).inverse());

    assertThat(renamed.toString()).doesNotContain("counter");
    assertThat(restored.toString()).isEqualTo(file.toString());
  }
}
