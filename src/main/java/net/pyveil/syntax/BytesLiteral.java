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

/** Syntax node for a bytes literal such as {@code b'\x00abc'}. */
public final class BytesLiteral extends Expression {

  private final byte[] value;

  public BytesLiteral(byte[] value) {
    super(Kind.BYTES_LITERAL);
    this.value = value.clone();
  }

  /** Returns a copy of the bytes denoted by the literal. */
  public byte[] getValue() {
    return value.clone();
  }

  public int length() {
    return value.length;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
