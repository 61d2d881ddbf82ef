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

package net.pyveil.syntax;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** A SyntaxError represents a syntax error found while scanning or parsing a file. */
public final class SyntaxError {

  private final Location location;
  private final String message;

  public SyntaxError(Location location, String message) {
    this.location = location;
    this.message = message;
  }

  /** Returns the location of the error. */
  public Location location() {
    return location;
  }

  /** Returns a description of the error. */
  public String message() {
    return message;
  }

  /** Returns a string of the form "file.py:1:2: message". */
  @Override
  public String toString() {
    return location + ": " + message;
  }

  /**
   * Returns a string summarizing a non-empty list of errors, of the form "file.py:1:2: message (and
   * N more)".
   */
  public static String summarize(List<SyntaxError> errors) {
    if (errors.isEmpty()) {
      throw new IllegalArgumentException("empty list of errors");
    }
    String first = errors.get(0).toString();
    return errors.size() == 1 ? first : first + " (and " + (errors.size() - 1) + " more)";
  }

  /** An exception that indicates that there was a syntax error. Carries the list of errors. */
  public static final class Exception extends java.lang.Exception {
    private final ImmutableList<SyntaxError> errors;

    /** Constructs an exception from a non-empty list of errors. */
    public Exception(List<SyntaxError> errors) {
      super(summarize(errors));
      this.errors = ImmutableList.copyOf(errors);
    }

    /** Returns an immutable non-empty list of errors. */
    public ImmutableList<SyntaxError> errors() {
      return errors;
    }

    /** Returns one error per line. */
    public String describe() {
      return Joiner.on('\n').join(errors);
    }
  }
}
