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
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link ConfigResolver}. */
@RunWith(JUnit4.class)
public final class ConfigResolverTest {

  @Test
  public void levels_enableCumulativeTransforms() {
    assertThat(ConfigResolver.create().level(1).resolve().transforms())
        .containsExactly(Transform.RENAME);
    assertThat(ConfigResolver.create().level(2).resolve().transforms())
        .containsExactly(Transform.RENAME, Transform.STRINGS, Transform.BUILTINS);

    ObfuscationConfig five = ConfigResolver.create().level(5).resolve();
    assertThat(five.transforms()).containsExactlyElementsIn(Transform.values());
    assertThat(five.repetitions()).isEqualTo(2);
    assertThat(five.junkCount()).isEqualTo(3);
    assertThat(five.level()).isEqualTo(5);
  }

  @Test
  public void level_outOfRange() {
    ConfigException e =
        assertThrows(ConfigException.class, () -> ConfigResolver.create().level(6));
    assertThat(e).hasMessageThat().contains("between 1 and 5");
  }

  @Test
  public void profile_winsOverLevel() {
    ObfuscationConfig config = ConfigResolver.create().level(1).profile("stealth").resolve();

    assertThat(config.transforms()).doesNotContain(Transform.BYTES);
    assertThat(config.transforms()).contains(Transform.CALLS);
    assertThat(config.attrRate()).isEqualTo(0.45);
    assertThat(config.tier()).isEqualTo(RiskTier.SAFE);
    assertThat(config.profile()).isEqualTo("stealth");
  }

  @Test
  public void profile_choosesTierUnlessExplicit() {
    assertThat(ConfigResolver.create().profile("max").resolve().tier())
        .isEqualTo(RiskTier.HEAVY);
    assertThat(ConfigResolver.create().profile("max").tier("safe").resolve().tier())
        .isEqualTo(RiskTier.SAFE);
  }

  @Test
  public void unknownNames() {
    assertThrows(ConfigException.class, () -> ConfigResolver.create().profile("paranoid"));
    assertThrows(ConfigException.class, () -> ConfigResolver.create().tier("extreme"));
    assertThrows(ConfigException.class, () -> ConfigResolver.create().allow("call:teleport"));
    assertThrows(ConfigException.class, () -> ConfigResolver.create().allow("nope:getattr"));
  }

  @Test
  public void riskyMethodsNeedAnExplicitAllow() {
    ObfuscationConfig heavy = ConfigResolver.create().tier("heavy").resolve();
    assertThat(heavy.pool(MethodFamily.CALL))
        .containsExactly(
            IndirectionMethod.HELPER_WRAP,
            IndirectionMethod.LAMBDA_WRAP,
            IndirectionMethod.DOUBLE_LAMBDA_WRAP)
        .inOrder();
    assertThat(heavy.riskWarnings()).isEmpty();

    ObfuscationConfig allowed =
        ConfigResolver.create().allow("call:builtins_eval_call").resolve();
    assertThat(allowed.pool(MethodFamily.CALL)).contains(IndirectionMethod.BUILTINS_EVAL_CALL);
    assertThat(allowed.riskWarnings())
        .containsExactly("risky method enabled: call:builtins_eval_call");
  }

  @Test
  public void denyRemovesAndBareNamesMatchEveryFamily() {
    ObfuscationConfig config =
        ConfigResolver.create().tier("heavy").deny("getattr, call:lambda_wrap").resolve();

    assertThat(config.pool(MethodFamily.ATTR)).doesNotContain(IndirectionMethod.GETATTR);
    assertThat(config.pool(MethodFamily.CALL)).doesNotContain(IndirectionMethod.LAMBDA_WRAP);
    assertThat(config.pool(MethodFamily.CALL)).contains(IndirectionMethod.HELPER_WRAP);
  }

  @Test
  public void emptyPoolFallsBackToTheFirstMethod() {
    ObfuscationConfig config =
        ConfigResolver.create()
            .deny("import:importlib_import_module,import:dunder_import")
            .resolve();

    assertThat(config.pool(MethodFamily.IMPORT))
        .containsExactly(IndirectionMethod.IMPORTLIB_IMPORT_MODULE);
  }

  @Test
  public void explicitMethodsCollapseTheFamily() {
    ObfuscationConfig config =
        ConfigResolver.create()
            .explicitMethods(MethodFamily.ATTR, IndirectionMethod.LAMBDA_GETATTR)
            .resolve();

    assertThat(config.pool(MethodFamily.ATTR)).containsExactly(IndirectionMethod.LAMBDA_GETATTR);
    assertThrows(
        ConfigException.class,
        () ->
            ConfigResolver.create()
                .explicitMethods(MethodFamily.ATTR, IndirectionMethod.SETATTR));
  }

  @Test
  public void overridesApplyLast() {
    ObfuscationConfig config =
        ConfigResolver.create()
            .profile("max")
            .override(b -> b.attrRate(0.1).repetitions(1))
            .resolve();

    assertThat(config.attrRate()).isEqualTo(0.1);
    assertThat(config.repetitions()).isEqualTo(1);
  }
}
