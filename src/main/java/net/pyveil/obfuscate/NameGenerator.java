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

package net.pyveil.obfuscate;

import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.Set;
import net.pyveil.obfuscate.ObfuscationConfig.NameStrategy;
import net.pyveil.syntax.FromImportStatement;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.ImportAlias;
import net.pyveil.syntax.ImportStatement;
import net.pyveil.syntax.Node;
import net.pyveil.syntax.NodeVisitor;

/**
 * Produces identifiers that collide with nothing in the program. Every name it returns, and every
 * name passed to {@link #reserve}, is remembered as used.
 */
public final class NameGenerator {

  private static final String CONFUSABLE_FIRST = "Il";
  private static final String CONFUSABLE_REST = "Il1";
  private static final int CONFUSABLE_LENGTH = 10;

  private final Set<String> used;
  private final NameStrategy strategy;
  private final RandomSource random;
  private int counter;

  public NameGenerator(Set<String> used, NameStrategy strategy, RandomSource random) {
    this.used = new HashSet<>(used);
    this.strategy = strategy;
    this.random = random;
  }

  /** Returns a fresh name spelled according to the strategy. */
  public String next() {
    while (true) {
      String name =
          switch (strategy) {
            case COUNTER -> "_o" + Integer.toHexString(counter++);
            case CONFUSABLE -> confusable();
          };
      if (isAvailable(name)) {
        used.add(name);
        return name;
      }
    }
  }

  private String confusable() {
    // Widen the token as the space fills up.
    int length = CONFUSABLE_LENGTH + counter++ / 64;
    StringBuilder buf = new StringBuilder(length);
    buf.append(CONFUSABLE_FIRST.charAt(random.nextInt(0, CONFUSABLE_FIRST.length() - 1)));
    for (int i = 1; i < length; i++) {
      buf.append(CONFUSABLE_REST.charAt(random.nextInt(0, CONFUSABLE_REST.length() - 1)));
    }
    return buf.toString();
  }

  /** Returns {@code base}, or {@code base_1}, {@code base_2}... if it is taken. */
  public String fresh(String base) {
    String name = base;
    for (int i = 1; !isAvailable(name); i++) {
      name = base + "_" + i;
    }
    used.add(name);
    return name;
  }

  /** Returns {@code base} with {@code _x} appended until it is free, and reserves it. */
  public String freshSuffixed(String base) {
    String name = base;
    while (!isAvailable(name)) {
      name += "_x";
    }
    used.add(name);
    return name;
  }

  public void reserve(String name) {
    used.add(name);
  }

  public boolean isUsed(String name) {
    return used.contains(name);
  }

  private boolean isAvailable(String name) {
    return !used.contains(name) && !Identifier.KEYWORDS.contains(name);
  }

  /** Returns every identifier that a node binds or loads, including definition and import names. */
  public static ImmutableSet<String> collectIdentifiers(Node node) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    new NodeVisitor() {
      @Override
      public void visit(Identifier id) {
        names.add(id.getName());
      }

      @Override
      public void visit(ImportStatement stmt) {
        for (ImportAlias alias : stmt.getAliases()) {
          names.add(alias.getBoundName());
        }
      }

      @Override
      public void visit(FromImportStatement stmt) {
        for (ImportAlias alias : stmt.getAliases()) {
          names.add(alias.getBoundName());
        }
      }
    }.visit(node);
    return names.build();
  }
}
