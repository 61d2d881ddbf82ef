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

import com.google.errorprone.annotations.FormatMethod;

/** Reports that reversal could not produce the result the caller asked for. */
public final class ReversalException extends Exception {

  /** Why reversal failed. */
  public enum Kind {
    /** The text is not the output the manifest describes. */
    HASH_MISMATCH,
    /** Strict reversal was requested, but only a partial recovery is possible. */
    INCOMPLETE
  }

  private final Kind kind;

  @FormatMethod
  ReversalException(Kind kind, String format, Object... args) {
    super(String.format(format, args));
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
