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

import com.google.common.base.Preconditions;

/**
 * Syntax node for a string literal. Adjacent literals in the source are concatenated by the
 * parser.
 */
public final class StringLiteral extends Expression {

  private final String value;

  public StringLiteral(String value) {
    super(Kind.STRING_LITERAL);
    this.value = Preconditions.checkNotNull(value);
  }

  /** Returns the value denoted by the string literal */
  public String getValue() {
    return value;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
