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
 * Syntax node for an argument to a function, or a base or keyword in a class statement.
 *
 * <p>Arguments may be of four forms, as in {@code f(expr, id=expr, *expr, **expr)}. These are
 * represented by the subclasses Positional, Keyword, Star, and StarStar.
 */
public abstract class Argument extends Node {

  protected final Expression value;

  private Argument(Expression value) {
    this.value = Preconditions.checkNotNull(value);
  }

  public final Expression getValue() {
    return value;
  }

  /** Return the name of this argument's parameter, or null if it is not a Keyword argument. */
  @Nullable
  public String getName() {
    return null;
  }

  /** Returns a copy of this argument with a different value. */
  public abstract Argument withValue(Expression value);

  /** Syntax node for a positional argument, {@code f(expr)}. */
  public static final class Positional extends Argument {
    public Positional(Expression value) {
      super(value);
    }

    @Override
    public Argument withValue(Expression value) {
      return new Positional(value);
    }
  }

  /** Syntax node for a keyword argument, {@code f(id=expr)}. */
  public static final class Keyword extends Argument {

    private final String name;

    public Keyword(String name, Expression value) {
      super(value);
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public Argument withValue(Expression value) {
      return new Keyword(name, value);
    }
  }

  /** Syntax node for an argument of the form {@code f(*expr)}. */
  public static final class Star extends Argument {
    public Star(Expression value) {
      super(value);
    }

    @Override
    public Argument withValue(Expression value) {
      return new Star(value);
    }
  }

  /** Syntax node for an argument of the form {@code f(**expr)}. */
  public static final class StarStar extends Argument {
    public StarStar(Expression value) {
      super(value);
    }

    @Override
    public Argument withValue(Expression value) {
      return new StarStar(value);
    }
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
