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
 * Syntax node for an assignment statement. Three forms share this node:
 *
 * <ul>
 *   <li>{@code a = b = rhs}: one or more targets and no operator;
 *   <li>{@code lhs op= rhs}: exactly one target and an augmented operator;
 *   <li>{@code lhs: type [= rhs]}: exactly one target, an annotation, and an optional value.
 * </ul>
 */
public final class AssignmentStatement extends Statement {

  private final ImmutableList<Expression> targets;
  @Nullable private final TokenKind op;
  @Nullable private final Expression type;
  @Nullable private final Expression rhs;

  public AssignmentStatement(
      ImmutableList<Expression> targets,
      @Nullable TokenKind op,
      @Nullable Expression type,
      @Nullable Expression rhs) {
    super(Kind.ASSIGNMENT);
    Preconditions.checkArgument(!targets.isEmpty(), "assignment without target");
    Preconditions.checkArgument(op == null || targets.size() == 1, "augmented chain");
    Preconditions.checkArgument(type == null || targets.size() == 1, "annotated chain");
    Preconditions.checkArgument(rhs != null || type != null, "assignment without value");
    this.targets = targets;
    this.op = op;
    this.type = type;
    this.rhs = rhs;
  }

  /** Returns the plain assignment {@code lhs = rhs}. */
  public static AssignmentStatement of(Expression lhs, Expression rhs) {
    return new AssignmentStatement(ImmutableList.of(lhs), null, null, rhs);
  }

  /** Returns the plain assignment {@code name = rhs}. */
  public static AssignmentStatement of(String name, Expression rhs) {
    return of(new Identifier(name), rhs);
  }

  /** Returns the targets, leftmost first. */
  public ImmutableList<Expression> getTargets() {
    return targets;
  }

  /** Returns the sole target. Fails for a chained assignment. */
  public Expression getLHS() {
    Preconditions.checkState(targets.size() == 1, "chained assignment");
    return targets.get(0);
  }

  /**
   * Returns the operator of an augmented assignment, or null for an ordinary or annotated
   * assignment.
   */
  @Nullable
  public TokenKind getOperator() {
    return op;
  }

  /** Reports whether this is an augmented assignment, such as {@code x += y}. */
  public boolean isAugmented() {
    return op != null;
  }

  /** Returns the annotation of an annotated assignment, or null. */
  @Nullable
  public Expression getType() {
    return type;
  }

  /** Returns the right-hand side, which is null only for a bare annotation {@code x: int}. */
  @Nullable
  public Expression getRHS() {
    return rhs;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
