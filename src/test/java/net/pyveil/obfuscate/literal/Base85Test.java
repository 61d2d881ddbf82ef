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

package net.pyveil.obfuscate.literal;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class Base85Test {

  @Test
  public void encodeMatchesPython() {
    assertThat(Base85.encode("hello".getBytes(UTF_8))).isEqualTo("Xk~0{Zv");
    assertThat(Base85.encode("pyveil!".getBytes(UTF_8))).isEqualTo("aCvrRX>1_");
    assertThat(Base85.encode(new byte[4])).isEqualTo("00000");
    assertThat(Base85.encode(new byte[0])).isEmpty();
  }

  @Test
  public void decodeUndoesPartialGroups() {
    assertThat(new String(Base85.decode("Xk~0{Zv"), UTF_8)).isEqualTo("hello");
    assertThat(new String(Base85.decode("aCvrRX>1_"), UTF_8)).isEqualTo("pyveil!");
  }

  @Test
  public void decodeRejectsBadInput() {
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> Base85.decode("ab\"cd"));
    assertThat(e).hasMessageThat().contains("position 2");
    assertThrows(IllegalArgumentException.class, () -> Base85.decode("~~~~~"));
  }
}
