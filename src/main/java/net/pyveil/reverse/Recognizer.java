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

import net.pyveil.syntax.NodeRewriter;
import net.pyveil.syntax.PyFile;

/** A rewriter that undoes one family of shapes and counts the sites it restored. */
abstract class Recognizer extends NodeRewriter {

  private int count;

  final void found() {
    count++;
  }

  final int count() {
    return count;
  }

  /** Rewrites the file, returning it unchanged if no shape matched. */
  PyFile run(PyFile file) {
    return rewrite(file);
  }
}
