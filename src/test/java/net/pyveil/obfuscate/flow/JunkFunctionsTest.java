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

import com.google.common.collect.ImmutableList;
import net.pyveil.obfuscate.ObfuscationConfig;
import net.pyveil.obfuscate.ObfuscationConfig.JunkPosition;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.syntax.DefStatement;
import net.pyveil.syntax.ExpressionStatement;
import net.pyveil.syntax.FromImportStatement;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.Statement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class JunkFunctionsTest {

  private static final String[] PROGRAM = {
    "'''Doc.'''", "from __future__ import annotations", "x = 1", "y = 2"
  };

  private static ImmutableList<Statement> apply(JunkPosition position, int count)
      throws Exception {
    PyFile file = parse(PROGRAM);
    ObfuscationConfig config = config().junkCount(count).junkPosition(position).build();
    PassContext ctx = context(config, file);
    ImmutableList<Statement> stmts = JunkFunctions.apply(file, ctx).getStatements();
    assertThat(ctx.get(Counter.JUNK_FUNCTIONS)).isEqualTo(count);
    return stmts;
  }

  private static String name(Statement stmt) {
    return ((DefStatement) stmt).getIdentifier().getName();
  }

  @Test
  public void topPlacesFunctionsAfterTheFutureImports() throws Exception {
    ImmutableList<Statement> stmts = apply(JunkPosition.TOP, 2);

    assertThat(stmts).hasSize(6);
    assertThat(name(stmts.get(2))).isEqualTo("_junk_1");
    assertThat(name(stmts.get(3))).isEqualTo("_junk_0");
  }

  @Test
  public void bottomAppendsInOrder() throws Exception {
    ImmutableList<Statement> stmts = apply(JunkPosition.BOTTOM, 2);

    assertThat(name(stmts.get(4))).isEqualTo("_junk_0");
    assertThat(name(stmts.get(5))).isEqualTo("_junk_1");
  }

  @Test
  public void randomNeverPrecedesTheFutureImports() throws Exception {
    ImmutableList<Statement> stmts = apply(JunkPosition.RANDOM, 3);

    assertThat(stmts).hasSize(7);
    assertThat(stmts.get(0)).isInstanceOf(ExpressionStatement.class);
    assertThat(stmts.get(1)).isInstanceOf(FromImportStatement.class);
  }

  @Test
  public void namesAvoidTheProgram() throws Exception {
    PyFile file = parse("_junk_0 = 1");
    PassContext ctx = context(config().junkCount(1).build(), file);

    ImmutableList<Statement> stmts = JunkFunctions.apply(file, ctx).getStatements();

    assertThat(name(stmts.get(0))).isEqualTo("_junk_0_1");
  }

  @Test
  public void zeroCountAddsNothing() throws Exception {
    assertThat(apply(JunkPosition.TOP, 0)).hasSize(4);
  }
}
