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

package net.pyveil.reverse;

import static com.google.common.truth.Truth.assertThat;
import static net.pyveil.obfuscate.PassTesting.parse;
import static net.pyveil.obfuscate.PassTesting.print;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the individual shape recognizers that reversal chains together. */
@RunWith(JUnit4.class)
public final class RecognizersTest {

  private static String run(Recognizer recognizer, String... lines) throws Exception {
    return print(recognizer.run(parse(lines)));
  }

  private static LiteralDecoder literals() {
    return new LiteralDecoder(HelperNames.stringHelper(false, null));
  }

  private static CallCollapser calls() {
    return new CallCollapser(HelperNames.callHelper(false, null));
  }

  @Test
  public void literalDecoder_allModes() throws Exception {
    assertThat(run(literals(), "x = _obf_str(2, 'olleh')")).isEqualTo("x = 'hello'");
    assertThat(run(literals(), "x = _obf_str(1, 'Xk~0{Zv')")).isEqualTo("x = 'hello'");
    assertThat(run(literals(), "x = _obf_str(0, ((1, (105, 100)), (0, (121,))))"))
        .isEqualTo("x = 'hey'");
  }

  @Test
  public void literalDecoder_foldsEncodedIntegers() throws Exception {
    assertThat(run(literals(), "x = _obf_str(3 - 1, 'ba')")).isEqualTo("x = 'ab'");
    assertThat(run(literals(), "x = _obf_str(0, ((2 ^ 3, (104 + 1,)),))")).isEqualTo("x = 'h'");
  }

  @Test
  public void literalDecoder_joinsSplitStrings() throws Exception {
    LiteralDecoder decoder = literals();

    String out = run(decoder, "x = y + (_obf_str(2, 'ba') + _obf_str(2, 'dc'))");

    assertThat(out).isEqualTo("x = y + 'abcd'");
    assertThat(decoder.count()).isEqualTo(2);
  }

  @Test
  public void literalDecoder_leavesOtherCallsAlone() throws Exception {
    LiteralDecoder decoder = literals();

    assertThat(run(decoder, "x = decode(2, 'ba')")).isEqualTo("x = decode(2, 'ba')");
    assertThat(run(decoder, "x = _obf_str(1, 'not base85!')"))
        .isEqualTo("x = _obf_str(1, 'not base85!')");
    assertThat(run(decoder, "x = _obf_str(7, 'ba')")).isEqualTo("x = _obf_str(7, 'ba')");
    assertThat(run(decoder, "x = _obf_str(2, name)")).isEqualTo("x = _obf_str(2, name)");
    assertThat(decoder.count()).isEqualTo(0);
  }

  @Test
  public void literalDecoder_trustsTheRecordedHelperName() throws Exception {
    LiteralDecoder decoder = new LiteralDecoder(HelperNames.stringHelper(true, "_s"));

    assertThat(run(decoder, "x = _s(2, 'ba') + _obf_str(2, 'dc')"))
        .isEqualTo("x = 'ab' + _obf_str(2, 'dc')");
  }

  @Test
  public void callCollapser_everyTrampoline() throws Exception {
    assertThat(run(calls(), "_obf_call(show, (a,), {'sep': b})")).isEqualTo("show(a, sep=b)");
    assertThat(run(calls(), "(lambda _f, _a, _k: _f(*_a, **_k))(show, (a,), {})"))
        .isEqualTo("show(a)");
    assertThat(run(calls(), "(lambda _f: lambda _a, _k: _f(*_a, **_k))(show)((), {'x': 1})"))
        .isEqualTo("show(x=1)");
    assertThat(run(calls(), "eval('lambda _f, _a, _k: _f(*_a, **_k)')(show, (1, 2), {})"))
        .isEqualTo("show(1, 2)");
  }

  @Test
  public void callCollapser_unwindsWrappersOfWrappers() throws Exception {
    CallCollapser collapser = calls();

    String out = run(collapser, "_obf_call(_obf_call, (show, (a,), {}), {})");

    assertThat(out).isEqualTo("show(a)");
    assertThat(collapser.count()).isEqualTo(2);
  }

  @Test
  public void callCollapser_needsLiteralPacks() throws Exception {
    CallCollapser collapser = calls();

    assertThat(run(collapser, "_obf_call(show, args, {})")).isEqualTo("_obf_call(show, args, {})");
    assertThat(run(collapser, "_obf_call(show, (), {'not valid': 1})"))
        .isEqualTo("_obf_call(show, (), {'not valid': 1})");
    assertThat(run(collapser, "(lambda f, a, k: f(a, k))(show, (), {})"))
        .isEqualTo("(lambda f, a, k: f(a, k))(show, (), {})");
    assertThat(collapser.count()).isEqualTo(0);
  }

  @Test
  public void attributeCollapser_everyReadForm() throws Exception {
    String[] forms = {
      "y = getattr(box, 'size')",
      "y = __import__('builtins').getattr(box, 'size')",
      "y = __import__('operator').attrgetter('size')(box)",
      "y = (lambda _o, _n: getattr(_o, _n))(box, 'size')",
      "y = globals().get('getattr', getattr)(box, 'size')",
      "y = (locals().get('getattr') or getattr)(box, 'size')",
      "y = getattr(box, ''.join(('s', 'i', 'z', 'e')))",
      "y = getattr(box, ''.join((chr(_c) for _c in (115, 105, 122, 101))))",
    };
    for (String form : forms) {
      assertThat(run(new AttributeCollapser(), form)).isEqualTo("y = box.size");
    }
  }

  @Test
  public void attributeCollapser_storesAndDeletes() throws Exception {
    assertThat(run(new AttributeCollapser(), "setattr(box, 'size', n + 1)"))
        .isEqualTo("box.size = n + 1");
    assertThat(
            run(new AttributeCollapser(), "(lambda _o, _n, _v: setattr(_o, _n, _v))(box, 'a', 1)"))
        .isEqualTo("box.a = 1");
    assertThat(run(new AttributeCollapser(), "__import__('builtins').delattr(box, 'size')"))
        .isEqualTo("del box.size");
  }

  @Test
  public void attributeCollapser_keepsDynamicAccess() throws Exception {
    AttributeCollapser collapser = new AttributeCollapser();

    assertThat(run(collapser, "y = getattr(box, name)")).isEqualTo("y = getattr(box, name)");
    assertThat(run(collapser, "y = getattr(box, 'size', None)"))
        .isEqualTo("y = getattr(box, 'size', None)");
    assertThat(run(collapser, "y = getattr(box, 'not valid')"))
        .isEqualTo("y = getattr(box, 'not valid')");
    assertThat(run(collapser, "x = setattr(box, 'a', 1)")).isEqualTo("x = setattr(box, 'a', 1)");
    assertThat(collapser.count()).isEqualTo(0);
  }

  @Test
  public void importRebuilder_plainImports() throws Exception {
    assertThat(run(new ImportRebuilder(), "json = __import__('importlib').import_module('json')"))
        .isEqualTo("import json");
    assertThat(
            run(
                new ImportRebuilder(),
                "p = getattr(__import__('importlib'), 'import_module')('os.path')"))
        .isEqualTo("import os.path as p");
    assertThat(run(new ImportRebuilder(), "j = __import__('json')"))
        .isEqualTo("import json as j");
  }

  @Test
  public void importRebuilder_fromImports() throws Exception {
    assertThat(
            run(
                new ImportRebuilder(),
                "_mod = __import__('os', fromlist=('path', 'sep'))",
                "p = _mod.path",
                "sep = _mod.sep",
                "del _mod"))
        .isEqualTo("from os import path as p, sep");
    assertThat(
            run(
                new ImportRebuilder(),
                "def f():",
                "  _mod = __import__('importlib').import_module('a.b')",
                "  c = _mod.c",
                "  del _mod",
                "  return c"))
        .isEqualTo("def f():\n    from a.b import c\n    return c");
  }

  @Test
  public void importRebuilder_submoduleLoadingExtractions() throws Exception {
    ImportRebuilder rebuilder = new ImportRebuilder();

    assertThat(
            run(
                rebuilder,
                "_mod = __import__('importlib').import_module('xml')",
                "dom = _mod.dom if hasattr(_mod, 'dom') else "
                    + "__import__('importlib').import_module('xml.dom')",
                "s = _mod.sax if hasattr(_mod, 'sax') else "
                    + "getattr(__import__('importlib'), 'import_module')('xml.sax')",
                "del _mod"))
        .isEqualTo("from xml import dom, sax as s");
    // The fallback names another module.
    String other =
        "_mod = __import__('importlib').import_module('xml')\n"
            + "dom = _mod.dom if hasattr(_mod, 'dom') else "
            + "__import__('importlib').import_module('html.dom')\n"
            + "del _mod";
    String rebuilt = run(new ImportRebuilder(), other.split("\n"));
    assertThat(rebuilt).doesNotContain("from xml import");
    assertThat(rebuilt).contains("import_module('html.dom')");
    assertThat(rebuilder.count()).isEqualTo(1);
  }

  @Test
  public void importRebuilder_rejectsInconsistentShapes() throws Exception {
    ImportRebuilder rebuilder = new ImportRebuilder();

    // __import__ of a dotted name returns the top-level package.
    assertThat(run(rebuilder, "p = __import__('os.path')")).isEqualTo("p = __import__('os.path')");
    // The fromlist disagrees with the extracted names.
    String mismatch = "_mod = __import__('os', fromlist=('sep',))\np = _mod.path\ndel _mod";
    assertThat(run(rebuilder, mismatch.split("\n"))).isEqualTo(mismatch);
    assertThat(run(rebuilder, "m = __import__('importlib').import_module(name)"))
        .isEqualTo("m = __import__('importlib').import_module(name)");
    assertThat(rebuilder.count()).isEqualTo(0);
  }

  @Test
  public void aliasCollapser_restoresRecordedAliases() throws Exception {
    AliasCollapser collapser =
        new AliasCollapser(ImmutableMap.of("_o0", "len", "_o1", "print", "_o2", "str"));

    String out =
        run(
            collapser,
            "_o0 = len",
            "_o1 = getattr(__import__('builtins'), 'print')",
            "_o2 = globals().get('str', str)",
            "_o1(_o2(_o0(x)))");

    assertThat(out).isEqualTo("print(str(len(x)))");
    assertThat(collapser.count()).isEqualTo(6);
  }

  @Test
  public void aliasCollapser_ignoresUnrecordedOrRebound() throws Exception {
    AliasCollapser collapser = new AliasCollapser(ImmutableMap.of("_o0", "len"));

    assertThat(run(collapser, "_o1 = len", "_o1(x)")).isEqualTo("_o1 = len\n_o1(x)");
    assertThat(run(collapser, "_o0 = max", "_o0(x)")).isEqualTo("_o0 = max\n_o0(x)");
    assertThat(collapser.count()).isEqualTo(0);
  }

  @Test
  public void helperRemover_dropsOnlyUnusedHelpers() throws Exception {
    HelperRemover remover =
        new HelperRemover(
            HelperNames.stringHelper(false, null).or(HelperNames.callHelper(false, null)));

    String out =
        run(
            remover,
            "def _obf_str(mode, payload):",
            "  return payload",
            "def _obf_call_x(fn, args, kwargs):",
            "  return fn(*args, **kwargs)",
            "def helper():",
            "  pass",
            "x = _obf_call_x(helper, (), {})");

    assertThat(out)
        .isEqualTo(
            "def _obf_call_x(fn, args, kwargs):\n"
                + "    return fn(*args, **kwargs)\n"
                + "def helper():\n"
                + "    pass\n"
                + "x = _obf_call_x(helper, (), {})");
    assertThat(remover.count()).isEqualTo(1);
  }
}
