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

package net.pyveil.obfuscate.indirect;

import static com.google.common.truth.Truth.assertThat;
import static net.pyveil.obfuscate.PassTesting.config;
import static net.pyveil.obfuscate.PassTesting.context;
import static net.pyveil.obfuscate.PassTesting.parse;
import static net.pyveil.obfuscate.PassTesting.print;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.pyveil.obfuscate.IndirectionMethod;
import net.pyveil.obfuscate.MethodFamily;
import net.pyveil.obfuscate.ObfuscationConfig;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.obfuscate.Transform;
import net.pyveil.syntax.PyFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BuiltinAliasPassTest {

  private static ObfuscationConfig pool(IndirectionMethod method) {
    return config(Transform.BUILTINS).pool(MethodFamily.BUILTIN, method).build();
  }

  @Test
  public void aliasesAreBoundInSortedOrder() throws Exception {
    PyFile file = parse("print(len(x))");
    PassContext ctx = context(pool(IndirectionMethod.ALIAS), file);

    String out = print(BuiltinAliasPass.apply(file, ctx));

    assertThat(out).isEqualTo("_o0 = len\n_o1 = print\n_o1(_o0(x))");
    assertThat(ctx.builtinAliases()).containsExactly("_o0", "len", "_o1", "print").inOrder();
    assertThat(ctx.get(Counter.BUILTINS)).isEqualTo(2);
  }

  @Test
  public void bindingForms() throws Exception {
    PyFile file = parse("print(x)");

    assertThat(print(BuiltinAliasPass.apply(file, context(pool(IndirectionMethod.ALIAS), file))))
        .startsWith("_o0 = print\n");
    assertThat(
            print(
                BuiltinAliasPass.apply(
                    file, context(pool(IndirectionMethod.BUILTINS_GETATTR_ALIAS), file))))
        .startsWith("_o0 = getattr(__import__('builtins'), 'print')\n");
    assertThat(
            print(
                BuiltinAliasPass.apply(
                    file, context(pool(IndirectionMethod.GLOBALS_LOOKUP), file))))
        .startsWith("_o0 = globals().get('print', print)\n");
  }

  @Test
  public void boundPreservedAndSpecialBuiltinsAreNotAliased() throws Exception {
    PyFile file =
        parse(
            "list = []",
            "class A(B):",
            "  def f(self):",
            "    return super().f(__name__, list, open)");
    ObfuscationConfig config =
        config(Transform.BUILTINS)
            .pool(MethodFamily.BUILTIN, IndirectionMethod.ALIAS)
            .preserveNames(ImmutableSet.of("open"))
            .build();
    PassContext ctx = context(config, file);

    assertThat(print(BuiltinAliasPass.apply(file, ctx))).isEqualTo(print(file));
    assertThat(ctx.builtinAliases()).isEmpty();
  }

  @Test
  public void bindingsFollowTheDocstringAndFutureImports() throws Exception {
    PyFile file = parse("'''Doc.'''", "from __future__ import annotations", "print(1)");
    PassContext ctx = context(pool(IndirectionMethod.ALIAS), file);

    String out = print(BuiltinAliasPass.apply(file, ctx));

    assertThat(out)
        .isEqualTo("'Doc.'\nfrom __future__ import annotations\n_o0 = print\n_o0(1)");
  }

  @Test
  public void zeroRateStillBindsTheTable() throws Exception {
    PyFile file = parse("print(1)");
    ObfuscationConfig config =
        config(Transform.BUILTINS)
            .pool(MethodFamily.BUILTIN, IndirectionMethod.ALIAS)
            .builtinRate(0.0)
            .build();
    PassContext ctx = context(config, file);

    assertThat(print(BuiltinAliasPass.apply(file, ctx))).isEqualTo("_o0 = print\nprint(1)");
    assertThat(ctx.builtinAliases()).isEqualTo(ImmutableMap.of("_o0", "print"));
  }
}
