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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourcePayloadTest {

  @Test
  public void encodeThenDecodeIsIdentity() {
    String source = "# -*- coding: utf-8 -*-\nprint('héllo 世界')\n".repeat(50);

    String payload = SourcePayload.encode(source);

    assertThat(payload.length()).isLessThan(source.length());
    assertThat(SourcePayload.decode(payload)).isEqualTo(source);
  }

  @Test
  public void decodesPayloadsWrittenByPython() {
    // base64.b85encode(zlib.compress(b'print("h\xc3\xa9llo")\n', 9))
    assertThat(SourcePayload.decode("c-ku{%FHX#P|7&GGAAcrNs|izHxC8q"))
        .isEqualTo("print(\"héllo\")\n");
  }

  @Test
  public void corruptPayloadsAreRejected() {
    String payload = SourcePayload.encode("x = 1\n");

    assertThrows(IllegalArgumentException.class, () -> SourcePayload.decode("not base85!"));
    assertThrows(
        IllegalArgumentException.class,
        () -> SourcePayload.decode(payload.substring(0, payload.length() - 5)));
    assertThrows(IllegalArgumentException.class, () -> SourcePayload.decode("00000"));
  }
}
