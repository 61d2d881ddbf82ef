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
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Syntax node for a formatted string literal, {@code f"text {expr!r:spec} text"}.
 *
 * <p>The literal text between replacement fields is held unescaped; the printer restores the
 * escapes and doubles any braces.
 */
public final class FStringExpression extends Expression {

  /** A piece of an f-string: either literal text or a replacement field. */
  public abstract static class Part {
    private Part() {}
  }

  /** Literal text. */
  public static final class Text extends Part {
    private final String value;

    public Text(String value) {
      this.value = Preconditions.checkNotNull(value);
    }

    public String getValue() {
      return value;
    }
  }

  /** A replacement field {@code {expr!c:spec}}. */
  public static final class Field extends Part {
    private final Expression value;
    private final char conversion; // 0, 's', 'r', or 'a'
    @Nullable private final FStringExpression formatSpec;

    public Field(Expression value, char conversion, @Nullable FStringExpression formatSpec) {
      this.value = Preconditions.checkNotNull(value);
      this.conversion = conversion;
      this.formatSpec = formatSpec;
    }

    public Expression getValue() {
      return value;
    }

    /** Returns the conversion character, or 0 if there is none. */
    public char getConversion() {
      return conversion;
    }

    @Nullable
    public FStringExpression getFormatSpec() {
      return formatSpec;
    }
  }

  private final ImmutableList<Part> parts;

  public FStringExpression(ImmutableList<Part> parts) {
    super(Kind.FSTRING);
    this.parts = Preconditions.checkNotNull(parts);
  }

  public ImmutableList<Part> getParts() {
    return parts;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
