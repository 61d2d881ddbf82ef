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

/**
 * Syntax node for comprehensions and generator expressions.
 *
 * <p>A comprehension contains one or more clauses, e.g. {@code [a+d for a in b if c for d in e]}
 * contains three clauses: "for a in b", "if c", "for d in e". The body of a dict comprehension is a
 * {@link DictExpression.Entry}; otherwise it is an {@link Expression}.
 */
public final class Comprehension extends Expression {

  /** The four comprehension forms. */
  public enum Type {
    LIST,
    SET,
    DICT,
    GENERATOR
  }

  /** A clause in a comprehension. */
  public abstract static class Clause extends Node {
    private Clause() {}
  }

  /** A for clause in a comprehension, e.g. "for a in b" in the example above. */
  public static final class For extends Clause {
    private final Expression vars;
    private final Expression iterable;

    public For(Expression vars, Expression iterable) {
      this.vars = Preconditions.checkNotNull(vars);
      this.iterable = Preconditions.checkNotNull(iterable);
    }

    public Expression getVars() {
      return vars;
    }

    public Expression getIterable() {
      return iterable;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** A if clause in a comprehension, e.g. "if c" in the example above. */
  public static final class If extends Clause {
    private final Expression condition;

    public If(Expression condition) {
      this.condition = Preconditions.checkNotNull(condition);
    }

    public Expression getCondition() {
      return condition;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final Type type;
  private final Node body; // Expression or DictExpression.Entry
  private final ImmutableList<Clause> clauses;

  public Comprehension(Type type, Node body, ImmutableList<Clause> clauses) {
    super(Kind.COMPREHENSION);
    Preconditions.checkArgument(
        (type == Type.DICT) == (body instanceof DictExpression.Entry), "bad comprehension body");
    Preconditions.checkArgument(
        !clauses.isEmpty() && clauses.get(0) instanceof For, "comprehension must start with for");
    this.type = type;
    this.body = body;
    this.clauses = clauses;
  }

  public Type getType() {
    return type;
  }

  /**
   * Returns the loop body: an expression for a list, set or generator comprehension, or a
   * DictExpression.Entry for a dict comprehension.
   */
  public Node getBody() {
    return body;
  }

  public ImmutableList<Clause> getClauses() {
    return clauses;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
