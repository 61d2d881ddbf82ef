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

package net.pyveil.obfuscate.flow;

import static com.google.common.truth.Truth.assertThat;
import static net.pyveil.obfuscate.PassTesting.config;
import static net.pyveil.obfuscate.PassTesting.context;
import static net.pyveil.obfuscate.PassTesting.parse;
import static net.pyveil.obfuscate.PassTesting.print;

import com.google.common.collect.Range;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.obfuscate.Transform;
import net.pyveil.syntax.PyFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DeadBranchPassTest {

  private static final Pattern GUARD = Pattern.compile("if (\\d+) == (\\d+):\n\\s+pass");

  @Test
  public void guardFollowsTheDocstring() throws Exception {
    PyFile file = parse("def f():", "  '''Doc.'''", "  return 1");
    PassContext ctx = context(config(Transform.FLOW).build(), file);

    String out = print(DeadBranchPass.apply(file, ctx));

    assertThat(out)
        .matches("def f\\(\\):\n    'Doc\\.'\n    if \\d{3} == \\d+:\n        pass\n    return 1");
    assertThat(ctx.get(Counter.FLOW_BLOCKS)).isEqualTo(1);
  }

  @Test
  public void guardNeverHolds() throws Exception {
    PyFile file = parse("def f():", "  return 1");
    PassContext ctx = context(config(Transform.FLOW).flowCount(5).build(), file);

    Matcher m = GUARD.matcher(print(DeadBranchPass.apply(file, ctx)));

    int guards = 0;
    while (m.find()) {
      int a = Integer.parseInt(m.group(1));
      int b = Integer.parseInt(m.group(2));
      assertThat(a).isAtLeast(100);
      assertThat(a).isAtMost(999);
      assertThat(b - a).isIn(Range.closed(1, 50));
      guards++;
    }
    assertThat(guards).isAtLeast(1);
    assertThat(guards).isAtMost(5);
    assertThat(ctx.get(Counter.FLOW_BLOCKS)).isEqualTo(guards);
  }

  @Test
  public void everyFunctionIsConsidered() throws Exception {
    PyFile file =
        parse(
            "x = 1",
            "def f():",
            "  def g():",
            "    return 2",
            "  return g",
            "class A:",
            "  def h(self):",
            "    pass");
    PassContext ctx = context(config(Transform.FLOW).build(), file);

    String out = print(DeadBranchPass.apply(file, ctx));

    assertThat(ctx.get(Counter.FLOW_BLOCKS)).isEqualTo(3);
    assertThat(out).startsWith("x = 1\ndef f():\n    if ");
  }

  @Test
  public void zeroRateAddsNothing() throws Exception {
    PyFile file = parse("def f():", "  return 1");
    PassContext ctx = context(config(Transform.FLOW).flowRate(0.0).build(), file);

    assertThat(print(DeadBranchPass.apply(file, ctx))).isEqualTo("def f():\n    return 1");
  }
}
