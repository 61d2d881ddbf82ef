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

import static com.google.common.truth.Truth.assertThat;
import static net.pyveil.obfuscate.PassTesting.parse;

import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.Set;
import net.pyveil.obfuscate.ObfuscationConfig.NameStrategy;
import net.pyveil.syntax.Identifier;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link NameGenerator}. */
@RunWith(JUnit4.class)
public final class NameGeneratorTest {

  private static NameGenerator generator(NameStrategy strategy, String... used) {
    return new NameGenerator(ImmutableSet.copyOf(used), strategy, new RandomSource(7L));
  }

  @Test
  public void counter_skipsUsedNames() {
    NameGenerator names = generator(NameStrategy.COUNTER, "_o1");

    assertThat(names.next()).isEqualTo("_o0");
    assertThat(names.next()).isEqualTo("_o2");
    assertThat(names.isUsed("_o2")).isTrue();
  }

  @Test
  public void confusable_namesAreValidAndDistinct() {
    NameGenerator names = generator(NameStrategy.CONFUSABLE);
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < 500; i++) {
      String name = names.next();
      assertThat(name).matches("[Il][Il1]{9,}");
      assertThat(Identifier.isValid(name)).isTrue();
      assertThat(seen.add(name)).isTrue();
    }
  }

  @Test
  public void fresh_appendsACounter() {
    NameGenerator names = generator(NameStrategy.COUNTER, "_it");

    assertThat(names.fresh("_it")).isEqualTo("_it_1");
    assertThat(names.fresh("_it")).isEqualTo("_it_2");
    assertThat(names.fresh("_item")).isEqualTo("_item");
  }

  @Test
  public void freshSuffixed_appendsX() {
    NameGenerator names = generator(NameStrategy.COUNTER, "_obf_str", "_obf_str_x");

    assertThat(names.freshSuffixed("_obf_str")).isEqualTo("_obf_str_x_x");
  }

  @Test
  public void collectIdentifiers_includesImportBindings() throws Exception {
    assertThat(
            NameGenerator.collectIdentifiers(
                parse("import os.path", "from a import b as c", "def f(x):", "    return y")))
        .containsExactly("os", "c", "f", "x", "y");
  }
}
