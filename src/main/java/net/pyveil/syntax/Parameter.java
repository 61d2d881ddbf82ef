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
import javax.annotation.Nullable;

/**
 * Syntax node for a parameter in a function (or lambda) definition.
 *
 * <p>Parameters may be of five forms, as in {@code def f(a, b=c, /, *args, d=e, **kwargs)}. They
 * are represented by the subclasses Mandatory, Optional, Slash, Star, and StarStar. A bare {@code
 * *} separator is a Star with no identifier.
 */
public abstract class Parameter extends Node {

  @Nullable private final Identifier id;
  @Nullable private final Expression type;

  private Parameter(@Nullable Identifier id, @Nullable Expression type) {
    this.id = id;
    this.type = type;
  }

  @Nullable
  public String getName() {
    return id != null ? id.getName() : null;
  }

  @Nullable
  public Identifier getIdentifier() {
    return id;
  }

  @Nullable
  public Expression getDefaultValue() {
    return null;
  }

  /** Returns the annotation of this parameter, if any. */
  @Nullable
  public Expression getType() {
    return type;
  }

  /** Returns a copy of this parameter with the given parts replaced. */
  public abstract Parameter with(
      @Nullable Identifier id, @Nullable Expression type, @Nullable Expression defaultValue);

  /**
   * Syntax node for a mandatory parameter, {@code f(id)}. It may be positional or keyword-only
   * depending on its position.
   */
  public static final class Mandatory extends Parameter {
    public Mandatory(Identifier id, @Nullable Expression type) {
      super(Preconditions.checkNotNull(id), type);
    }

    @Override
    public Parameter with(
        @Nullable Identifier id, @Nullable Expression type, @Nullable Expression defaultValue) {
      return new Mandatory(id, type);
    }
  }

  /**
   * Syntax node for an optional parameter, {@code f(id=expr).}. It may be positional or
   * keyword-only depending on its position.
   */
  public static final class Optional extends Parameter {

    private final Expression defaultValue;

    public Optional(Identifier id, @Nullable Expression type, Expression defaultValue) {
      super(Preconditions.checkNotNull(id), type);
      this.defaultValue = Preconditions.checkNotNull(defaultValue);
    }

    @Override
    public Expression getDefaultValue() {
      return defaultValue;
    }

    @Override
    public Parameter with(
        @Nullable Identifier id, @Nullable Expression type, @Nullable Expression defaultValue) {
      return new Optional(id, type, defaultValue);
    }
  }

  /** Syntax node for the positional-only marker, {@code f(a, /)}. */
  public static final class Slash extends Parameter {
    public Slash() {
      super(null, null);
    }

    @Override
    public Parameter with(
        @Nullable Identifier id, @Nullable Expression type, @Nullable Expression defaultValue) {
      return this;
    }
  }

  /** Syntax node for a star parameter, {@code f(*id)} or {@code f(..., *, ...)}. */
  public static final class Star extends Parameter {
    public Star(@Nullable Identifier id, @Nullable Expression type) {
      super(id, type);
    }

    @Override
    public Parameter with(
        @Nullable Identifier id, @Nullable Expression type, @Nullable Expression defaultValue) {
      return new Star(id, type);
    }
  }

  /** Syntax node for a parameter of the form {@code f(**id)}. */
  public static final class StarStar extends Parameter {
    public StarStar(Identifier id, @Nullable Expression type) {
      super(Preconditions.checkNotNull(id), type);
    }

    @Override
    public Parameter with(
        @Nullable Identifier id, @Nullable Expression type, @Nullable Expression defaultValue) {
      return new StarStar(id, type);
    }
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
