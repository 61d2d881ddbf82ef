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
import com.google.common.collect.ImmutableSet;

/** Syntax node for an identifier. */
public final class Identifier extends Expression {

  /** The reserved words of Python 3. */
  public static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
          "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
          "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return",
          "try", "while", "with", "yield");

  private final String name;

  public Identifier(String name) {
    super(Kind.IDENTIFIER);
    this.name = Preconditions.checkNotNull(name);
  }

  /**
   * Returns the name of the Identifier. If there were parse errors, misparsed regions may be
   * represented as an Identifier for which {@code !isValid(getName())}.
   */
  public String getName() {
    return name;
  }

  /** Reports whether the name is spelled {@code __like_this__}. */
  public static boolean isDunder(String name) {
    return name.length() > 4 && name.startsWith("__") && name.endsWith("__");
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /** Reports whether the string is a valid identifier that is not a reserved word. */
  public static boolean isValid(String name) {
    // Keep consistent with Lexer.scanIdentifier.
    if (name.isEmpty() || KEYWORDS.contains(name)) {
      return false;
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      boolean ok = i == 0 ? Lexer.isIdentifierStart(c) : Lexer.isIdentifierPart(c);
      if (!ok) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns all names bound by an LHS expression.
   *
   * <p>Examples:
   *
   * <ul>
   *   <li>{@code x = ...} binds x.
   *   <li>{@code x, [y, *z] = ..} binds x, y, z.
   *   <li>{@code x[5] = ..} and {@code x.f = ..} do not bind any names.
   * </ul>
   */
  public static ImmutableSet<Identifier> boundIdentifiers(Expression expr) {
    if (expr instanceof Identifier id) {
      return ImmutableSet.of(id);
    }
    ImmutableSet.Builder<Identifier> result = ImmutableSet.builder();
    collectBoundIdentifiers(expr, result);
    return result.build();
  }

  private static void collectBoundIdentifiers(
      Expression lhs, ImmutableSet.Builder<Identifier> result) {
    if (lhs instanceof Identifier id) {
      result.add(id);
    } else if (lhs instanceof ListExpression list) {
      for (Expression element : list.getElements()) {
        collectBoundIdentifiers(element, result);
      }
    } else if (lhs instanceof StarredExpression starred) {
      collectBoundIdentifiers(starred.getValue(), result);
    }
  }
}
