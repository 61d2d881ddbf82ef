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

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import net.pyveil.obfuscate.IndirectionMethod;
import net.pyveil.obfuscate.MethodFamily;
import net.pyveil.obfuscate.ObfuscationConfig;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.obfuscate.Transform;
import net.pyveil.syntax.PyFile;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public final class AttributeReadPassTest {

  // The three spellings of the attribute name 'size'.
  private static final String SIZE =
      "('size'|''\\.join\\(\\('s', 'i', 'z', 'e'\\)\\)"
          + "|''\\.join\\(\\(chr\\(_c\\) for _c in \\(115, 105, 122, 101\\)\\)\\))";

  private static String rewrite(ObfuscationConfig config, String... lines) throws Exception {
    PyFile file = parse(lines);
    return print(AttributeReadPass.apply(file, context(config, file)));
  }

  @Test
  public void loadIsRewritten(
      @TestParameter({
            "GETATTR",
            "BUILTINS_GETATTR",
            "OPERATOR_ATTRGETTER",
            "LAMBDA_GETATTR",
            "GLOBALS_GETATTR",
            "LOCALS_GETATTR"
          })
          IndirectionMethod method)
      throws Exception {
    ObfuscationConfig config = config(Transform.ATTRS).pool(MethodFamily.ATTR, method).build();

    String out = rewrite(config, "y = box.size");

    String expected =
        switch (method) {
          case GETATTR -> "y = getattr\\(box, " + SIZE + "\\)";
          case BUILTINS_GETATTR ->
              "y = __import__\\('builtins'\\)\\.getattr\\(box, " + SIZE + "\\)";
          case OPERATOR_ATTRGETTER ->
              "y = __import__\\('operator'\\)\\.attrgetter\\(" + SIZE + "\\)\\(box\\)";
          case LAMBDA_GETATTR ->
              "y = \\(lambda _o, _n: getattr\\(_o, _n\\)\\)\\(box, " + SIZE + "\\)";
          case GLOBALS_GETATTR ->
              "y = globals\\(\\)\\.get\\('getattr', getattr\\)\\(box, " + SIZE + "\\)";
          case LOCALS_GETATTR ->
              "y = \\(locals\\(\\)\\.get\\('getattr'\\) or getattr\\)\\(box, " + SIZE + "\\)";
          default -> throw new AssertionError(method);
        };
    assertThat(out).matches(expected);
  }

  @Test
  public void nestedLoadsAreRewrittenInsideOut() throws Exception {
    ObfuscationConfig config =
        config(Transform.ATTRS).pool(MethodFamily.ATTR, IndirectionMethod.GETATTR).build();

    String out = rewrite(config, "y = box.inner.size");

    assertThat(out).startsWith("y = getattr(getattr(box, ");
  }

  @Test
  public void storesAndDeletesKeepTheirSyntax() throws Exception {
    ObfuscationConfig config = config(Transform.ATTRS).build();

    assertThat(rewrite(config, "box.size = 3")).isEqualTo("box.size = 3");
    assertThat(rewrite(config, "del box.size")).isEqualTo("del box.size");
  }

  @Test
  public void dunderAndPreservedAttributesAreKept() throws Exception {
    ObfuscationConfig config = config(Transform.ATTRS).build();

    assertThat(rewrite(config, "y = box.__class__")).isEqualTo("y = box.__class__");
    assertThat(rewrite(config, "names.append(1)")).isEqualTo("names.append(1)");
  }

  @Test
  public void zeroRateRewritesNothing() throws Exception {
    ObfuscationConfig config = config(Transform.ATTRS).attrRate(0.0).build();

    assertThat(rewrite(config, "y = box.size")).isEqualTo("y = box.size");
  }

  @Test
  public void programBindingGetattrIsSkipped() throws Exception {
    PyFile file = parse("def getattr(o, n):", "  return n", "y = box.size");
    PassContext ctx = context(config(Transform.ATTRS).build(), file);

    PyFile out = AttributeReadPass.apply(file, ctx);

    assertThat(out).isSameInstanceAs(file);
    assertThat(ctx.stats().warnings()).containsExactly("attrs skipped: program binds getattr");
    assertThat(ctx.get(Counter.ATTRS)).isEqualTo(0);
  }

  @Test
  public void rewritesAreCounted() throws Exception {
    PyFile file = parse("y = a.b + c.d.e");
    PassContext ctx = context(config(Transform.ATTRS).build(), file);

    AttributeReadPass.apply(file, ctx);

    assertThat(ctx.get(Counter.ATTRS)).isEqualTo(3);
  }
}
