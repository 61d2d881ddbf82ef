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
public final class CallPassTest {

  private static ObfuscationConfig pool(IndirectionMethod method) {
    return config(Transform.CALLS).pool(MethodFamily.CALL, method).build();
  }

  private static String rewrite(ObfuscationConfig config, String... lines) throws Exception {
    PyFile file = parse(lines);
    return print(CallPass.apply(file, context(config, file)));
  }

  @Test
  public void helperWrap() throws Exception {
    PyFile file = parse("show(a, sep=b)");
    PassContext ctx = context(pool(IndirectionMethod.HELPER_WRAP), file);

    String out = print(CallPass.apply(file, ctx));

    assertThat(out).isEqualTo("_obf_call(show, (a,), {'sep': b})");
    assertThat(ctx.callHelper()).isEqualTo("_obf_call");
  }

  @Test
  public void lambdaWraps() throws Exception {
    assertThat(rewrite(pool(IndirectionMethod.LAMBDA_WRAP), "show(a, sep=b)"))
        .isEqualTo("(lambda _f, _a, _k: _f(*_a, **_k))(show, (a,), {'sep': b})");
    assertThat(rewrite(pool(IndirectionMethod.DOUBLE_LAMBDA_WRAP), "show(a, sep=b)"))
        .isEqualTo("(lambda _f: lambda _a, _k: _f(*_a, **_k))(show)((a,), {'sep': b})");
  }

  @Test
  public void evalWrap() throws Exception {
    assertThat(rewrite(pool(IndirectionMethod.BUILTINS_EVAL_CALL), "show()"))
        .isEqualTo("eval('lambda _f, _a, _k: _f(*_a, **_k)')(show, (), {})");
  }

  @Test
  public void nestedCallsAreWrappedOnce() throws Exception {
    PyFile file = parse("print(len(x))");
    PassContext ctx = context(pool(IndirectionMethod.HELPER_WRAP), file);

    PyFile once = CallPass.apply(file, ctx);
    PyFile twice = CallPass.apply(once, ctx);

    assertThat(print(once)).isEqualTo("_obf_call(print, (_obf_call(len, (x,), {}),), {})");
    assertThat(print(twice)).isEqualTo(print(once));
    assertThat(ctx.get(Counter.CALLS)).isEqualTo(2);
  }

  @Test
  public void methodCallsAreWrapped() throws Exception {
    assertThat(rewrite(pool(IndirectionMethod.HELPER_WRAP), "items.sort(key=f)"))
        .isEqualTo("_obf_call(items.sort, (), {'key': f})");
  }

  @Test
  public void ineligibleCallsAreKept() throws Exception {
    ObfuscationConfig config = pool(IndirectionMethod.HELPER_WRAP);

    assertThat(rewrite(config, "f(*args)")).isEqualTo("f(*args)");
    assertThat(rewrite(config, "f(**kw)")).isEqualTo("f(**kw)");
    assertThat(rewrite(config, "x = locals()")).isEqualTo("x = locals()");
    assertThat(rewrite(config, "x = super()")).isEqualTo("x = super()");
    assertThat(rewrite(config, "exec(code)")).isEqualTo("exec(code)");
  }

  @Test
  public void decoratorCallsAreKept() throws Exception {
    String out =
        rewrite(pool(IndirectionMethod.LAMBDA_WRAP), "@route('/')", "def index():", "  pass");

    assertThat(out).startsWith("@route('/')\ndef index():");
  }

  @Test
  public void zeroRateRewritesNothing() throws Exception {
    ObfuscationConfig config = config(Transform.CALLS).callRate(0.0).build();

    assertThat(rewrite(config, "show(a)")).isEqualTo("show(a)");
  }

  @Test
  public void evalIsRequiredOnlyByTheEvalMethod() throws Exception {
    PyFile file = parse("eval = print", "show(a)");

    PassContext evalCtx = context(pool(IndirectionMethod.BUILTINS_EVAL_CALL), file);
    assertThat(CallPass.apply(file, evalCtx)).isSameInstanceAs(file);
    assertThat(evalCtx.stats().warnings()).containsExactly("calls skipped: program binds eval");

    PassContext lambdaCtx = context(pool(IndirectionMethod.LAMBDA_WRAP), file);
    assertThat(print(CallPass.apply(file, lambdaCtx))).contains("(show, (a,), {})");
  }
}
