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

import java.util.List;

/**
 * A visitor for visiting the nodes of a syntax tree in lexical order (not evaluation order!).
 *
 * <p>Typical usage is for a subclass to just override the {@code visit()} method overloads for the
 * nodes that are relevant to its business logic, and to rely on the default implementations in this
 * class to ensure traversal over the remaining node types. Overriding implementations should
 * remember to traverse children using either {@code super.visit()} on the current node, or explicit
 * calls to {@link #visit(Node)}, {@link #visitAll}, or {@link #visitBlock} on child fields.
 *
 * <p>The visitor does not distinguish loads from stores; subclasses that care inspect the
 * enclosing statement. To transform a tree, use {@link NodeRewriter}.
 */
public class NodeVisitor {

  /** Entrypoint for visiting a node. Clients should avoid calling node-specific overloads. */
  public void visit(Node node) {
    // Double-dispatch pattern.
    node.accept(this);
  }

  // ==== Miscellaneous node types ====

  /**
   * Handles all four Argument node types uniformly. Subclasses should not add an overload for a
   * concrete Argument subclass; it won't be called.
   */
  public void visit(Argument node) {
    visit(node.getValue());
  }

  /** Handles all Parameter node types uniformly. */
  public void visit(Parameter node) {
    if (node.getIdentifier() != null) {
      visit(node.getIdentifier());
    }
    if (node.getType() != null) {
      visit(node.getType());
    }
    if (node.getDefaultValue() != null) {
      visit(node.getDefaultValue());
    }
  }

  public void visit(PyFile node) {
    visitBlock(node.getStatements());
  }

  // ==== Statement nodes ====

  public void visit(AssertStatement node) {
    visit(node.getCondition());
    if (node.getMessage() != null) {
      visit(node.getMessage());
    }
  }

  public void visit(AssignmentStatement node) {
    visitAll(node.getTargets());
    if (node.getType() != null) {
      visit(node.getType());
    }
    if (node.getRHS() != null) {
      visit(node.getRHS());
    }
  }

  public void visit(ClassStatement node) {
    visitAll(node.getDecorators());
    visit(node.getIdentifier());
    visitAll(node.getBases());
    visitBlock(node.getBody());
  }

  public void visit(DefStatement node) {
    visitAll(node.getDecorators());
    visit(node.getIdentifier());
    visitAll(node.getParameters());
    if (node.getReturnType() != null) {
      visit(node.getReturnType());
    }
    visitBlock(node.getBody());
  }

  public void visit(DelStatement node) {
    visitAll(node.getTargets());
  }

  public void visit(ExpressionStatement node) {
    visit(node.getExpression());
  }

  public void visit(FlowStatement node) {}

  public void visit(ForStatement node) {
    visit(node.getVars());
    visit(node.getIterable());
    visitBlock(node.getBody());
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
  }

  public void visit(FromImportStatement node) {}

  public void visit(IfStatement node) {
    visit(node.getCondition());
    visitBlock(node.getThenBlock());
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
  }

  public void visit(ImportStatement node) {}

  public void visit(RaiseStatement node) {
    if (node.getException() != null) {
      visit(node.getException());
    }
    if (node.getCause() != null) {
      visit(node.getCause());
    }
  }

  public void visit(ReturnStatement node) {
    if (node.getResult() != null) {
      visit(node.getResult());
    }
  }

  public void visit(ScopeStatement node) {
    visitAll(node.getNames());
  }

  public void visit(TryStatement node) {
    visitBlock(node.getBody());
    visitAll(node.getHandlers());
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
    if (node.getFinallyBlock() != null) {
      visitBlock(node.getFinallyBlock());
    }
  }

  public void visit(TryStatement.ExceptHandler node) {
    if (node.getType() != null) {
      visit(node.getType());
    }
    if (node.getName() != null) {
      visit(node.getName());
    }
    visitBlock(node.getBody());
  }

  public void visit(WhileStatement node) {
    visit(node.getCondition());
    visitBlock(node.getBody());
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
  }

  public void visit(WithStatement node) {
    for (WithStatement.Item item : node.getItems()) {
      visit(item.getContext());
      if (item.getTarget() != null) {
        visit(item.getTarget());
      }
    }
    visitBlock(node.getBody());
  }

  // ==== Expression nodes ====

  public void visit(BinaryOperatorExpression node) {
    visit(node.getX());
    visit(node.getY());
  }

  public void visit(@SuppressWarnings("unused") BoolLiteral node) {}

  public void visit(@SuppressWarnings("unused") BytesLiteral node) {}

  public void visit(CallExpression node) {
    visit(node.getFunction());
    visitAll(node.getArguments());
  }

  public void visit(ComparisonExpression node) {
    visit(node.getFirst());
    visitAll(node.getOperands());
  }

  public void visit(Comprehension node) {
    // The first iterable is evaluated before the body, but lexical order puts the body first.
    visit(node.getBody());
    for (Comprehension.Clause clause : node.getClauses()) {
      visit(clause);
    }
  }

  public void visit(Comprehension.For node) {
    visit(node.getVars());
    visit(node.getIterable());
  }

  public void visit(Comprehension.If node) {
    visit(node.getCondition());
  }

  public void visit(ConditionalExpression node) {
    visit(node.getThenCase());
    visit(node.getCondition());
    visit(node.getElseCase());
  }

  public void visit(DictExpression node) {
    visitAll(node.getEntries());
  }

  public void visit(DictExpression.Entry node) {
    if (node.getKey() != null) {
      visit(node.getKey());
    }
    visit(node.getValue());
  }

  public void visit(DotExpression node) {
    visit(node.getObject());
  }

  public void visit(Ellipsis node) {}

  public void visit(@SuppressWarnings("unused") FloatLiteral node) {}

  public void visit(FStringExpression node) {
    for (FStringExpression.Part part : node.getParts()) {
      if (part instanceof FStringExpression.Field field) {
        visit(field.getValue());
        if (field.getFormatSpec() != null) {
          visit(field.getFormatSpec());
        }
      }
    }
  }

  public void visit(Identifier node) {}

  public void visit(IndexExpression node) {
    visit(node.getObject());
    visit(node.getKey());
  }

  public void visit(@SuppressWarnings("unused") IntLiteral node) {}

  public void visit(LambdaExpression node) {
    visitAll(node.getParameters());
    visit(node.getBody());
  }

  public void visit(ListExpression node) {
    visitAll(node.getElements());
  }

  public void visit(NoneLiteral node) {}

  public void visit(SetExpression node) {
    visitAll(node.getElements());
  }

  public void visit(SliceExpression node) {
    visit(node.getObject());
    if (node.getStart() != null) {
      visit(node.getStart());
    }
    if (node.getStop() != null) {
      visit(node.getStop());
    }
    if (node.getStep() != null) {
      visit(node.getStep());
    }
  }

  public void visit(StarredExpression node) {
    visit(node.getValue());
  }

  public void visit(@SuppressWarnings("unused") StringLiteral node) {}

  public void visit(UnaryOperatorExpression node) {
    visit(node.getX());
  }

  public void visit(YieldExpression node) {
    if (node.getValue() != null) {
      visit(node.getValue());
    }
  }

  // ==== Helpers for sequences of nodes ====

  /**
   * Visits a sequence of nodes (e.g. a list of arguments).
   *
   * <p>See {@link #visitBlock} for a common case.
   */
  public final void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }

  /** Convenience/readability method for visiting a block of statements (e.g. an if branch). */
  public final void visitBlock(List<Statement> statements) {
    visitAll(statements);
  }
}
