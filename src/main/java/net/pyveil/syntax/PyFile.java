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
import java.util.List;
import javax.annotation.Nullable;

/**
 * Syntax tree for a Python source file: its top-level statements, the shebang line if present, and
 * any errors found while parsing it.
 */
public final class PyFile extends Node {

  private final String name;
  private final ImmutableList<Statement> statements;
  @Nullable private final String shebang;
  private final ImmutableList<SyntaxError> errors;

  private PyFile(
      String name,
      ImmutableList<Statement> statements,
      @Nullable String shebang,
      ImmutableList<SyntaxError> errors) {
    this.name = Preconditions.checkNotNull(name);
    this.statements = Preconditions.checkNotNull(statements);
    this.shebang = shebang;
    this.errors = errors;
  }

  /** Returns a file with the given statements and no errors. */
  public static PyFile of(String name, List<Statement> statements, @Nullable String shebang) {
    return new PyFile(name, ImmutableList.copyOf(statements), shebang, ImmutableList.of());
  }

  /** Returns a copy of this file with different top-level statements. */
  public PyFile withStatements(List<Statement> statements) {
    return new PyFile(name, ImmutableList.copyOf(statements), shebang, errors);
  }

  /** Returns the apparent file name of the source. */
  public String getName() {
    return name;
  }

  /** Returns an unmodifiable view of the list of statements in this file. */
  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  /** Returns the leading {@code #!} line, without its newline, or null if there is none. */
  @Nullable
  public String getShebang() {
    return shebang;
  }

  /**
   * Returns an unmodifiable view of the list of scanner and parser errors accumulated during
   * parsing.
   */
  public ImmutableList<SyntaxError> errors() {
    return errors;
  }

  /** Returns errors().isEmpty(). */
  public boolean ok() {
    return errors.isEmpty();
  }

  /**
   * Parse the specified file, returning its syntax tree with its errors, if any. The returned tree
   * is never null; after an error it may be incomplete.
   */
  public static PyFile parse(ParserInput input) {
    Parser.ParseResult result = Parser.parseFile(input);
    String shebang = null;
    String content = new String(input.getContent());
    if (content.startsWith("#!")) {
      int eol = content.indexOf('\n');
      shebang = (eol < 0 ? content : content.substring(0, eol)).stripTrailing();
    }
    PyFile file =
        new PyFile(
            input.getFile(), result.statements, shebang, ImmutableList.copyOf(result.errors));
    file.setPosition(result.locs, 0);
    return file;
  }

  /** Like {@link #parse}, but throws if the file contains errors. */
  public static PyFile parseOrThrow(ParserInput input) throws SyntaxError.Exception {
    PyFile file = parse(input);
    if (!file.ok()) {
      throw new SyntaxError.Exception(file.errors());
    }
    return file;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
