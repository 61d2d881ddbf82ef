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

import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A NodeRewriter transforms a syntax tree bottom-up, returning a new subtree for each node it
 * visits. Nodes are immutable: a rewrite method returns its argument unchanged when nothing below
 * changed, and otherwise returns a freshly built node sharing the unchanged children.
 *
 * <p>Subclasses override the {@code rewrite} overloads for the node types they transform, usually
 * calling {@code super.rewrite(node)} first so that children are transformed before the parent is
 * inspected. Loads and stores are told apart: names and attributes appearing as assignment, loop,
 * {@code with}, {@code del} or comprehension targets go through {@link #rewriteTarget}, and names
 * introduced by definitions, parameters, exception handlers and scope statements go through {@link
 * #rewriteBinding}.
 *
 * <p>A statement may be replaced by any number of statements by overriding {@link #expand}.
 */
public class NodeRewriter {

  public PyFile rewrite(PyFile file) {
    ImmutableList<Statement> statements = rewriteBlock(file.getStatements());
    return statements == file.getStatements() ? file : file.withStatements(statements);
  }

  // ==== Statements ====

  /**
   * Rewrites a block of statements. Each statement is replaced by the result of {@link #expand}.
   * Returns the argument itself if no statement changed.
   */
  public ImmutableList<Statement> rewriteBlock(ImmutableList<Statement> block) {
    ImmutableList.Builder<Statement> result = ImmutableList.builder();
    boolean changed = false;
    for (Statement stmt : block) {
      List<Statement> replacement = expand(stmt);
      if (replacement.size() != 1 || replacement.get(0) != stmt) {
        changed = true;
      }
      result.addAll(replacement);
    }
    if (!changed) {
      return block;
    }
    ImmutableList<Statement> list = result.build();
    return list.isEmpty() ? ImmutableList.of(FlowStatement.pass()) : list;
  }

  @Nullable
  private ImmutableList<Statement> rewriteOptionalBlock(@Nullable ImmutableList<Statement> block) {
    return block == null ? null : rewriteBlock(block);
  }

  /** Returns the statements that replace {@code stmt}. The default rewrites it in place. */
  protected List<Statement> expand(Statement stmt) {
    return ImmutableList.of(rewrite(stmt));
  }

  /** Entrypoint for rewriting a single statement. */
  public Statement rewrite(Statement stmt) {
    return switch (stmt.kind()) {
      case ASSERT -> rewrite((AssertStatement) stmt);
      case ASSIGNMENT -> rewrite((AssignmentStatement) stmt);
      case CLASS -> rewrite((ClassStatement) stmt);
      case DEF -> rewrite((DefStatement) stmt);
      case DEL -> rewrite((DelStatement) stmt);
      case EXPRESSION -> rewrite((ExpressionStatement) stmt);
      case FLOW -> stmt;
      case FOR -> rewrite((ForStatement) stmt);
      case FROM_IMPORT -> rewrite((FromImportStatement) stmt);
      case IF -> rewrite((IfStatement) stmt);
      case IMPORT -> rewrite((ImportStatement) stmt);
      case RAISE -> rewrite((RaiseStatement) stmt);
      case RETURN -> rewrite((ReturnStatement) stmt);
      case SCOPE -> rewrite((ScopeStatement) stmt);
      case TRY -> rewrite((TryStatement) stmt);
      case WHILE -> rewrite((WhileStatement) stmt);
      case WITH -> rewrite((WithStatement) stmt);
    };
  }

  public Statement rewrite(AssertStatement node) {
    Expression condition = rewrite(node.getCondition());
    Expression message = rewriteOptional(node.getMessage());
    if (condition == node.getCondition() && message == node.getMessage()) {
      return node;
    }
    return new AssertStatement(condition, message);
  }

  public Statement rewrite(AssignmentStatement node) {
    ImmutableList<Expression> targets = rewriteTargets(node.getTargets());
    Expression type = rewriteOptional(node.getType());
    Expression rhs = rewriteOptional(node.getRHS());
    if (targets == node.getTargets() && type == node.getType() && rhs == node.getRHS()) {
      return node;
    }
    return new AssignmentStatement(targets, node.getOperator(), type, rhs);
  }

  public Statement rewrite(ClassStatement node) {
    ImmutableList<Expression> decorators = rewriteAll(node.getDecorators());
    Identifier name = rewriteBinding(node.getIdentifier());
    ImmutableList<Argument> bases = rewriteArguments(node.getBases());
    ImmutableList<Statement> body = rewriteBlock(node.getBody());
    if (decorators == node.getDecorators()
        && name == node.getIdentifier()
        && bases == node.getBases()
        && body == node.getBody()) {
      return node;
    }
    return new ClassStatement(decorators, name, bases, body);
  }

  public Statement rewrite(DefStatement node) {
    ImmutableList<Expression> decorators = rewriteAll(node.getDecorators());
    Identifier name = rewriteBinding(node.getIdentifier());
    ImmutableList<Parameter> params = rewriteParameters(node.getParameters());
    Expression returnType = rewriteOptional(node.getReturnType());
    ImmutableList<Statement> body = rewriteBlock(node.getBody());
    if (decorators == node.getDecorators()
        && name == node.getIdentifier()
        && params == node.getParameters()
        && returnType == node.getReturnType()
        && body == node.getBody()) {
      return node;
    }
    return new DefStatement(decorators, name, params, returnType, body);
  }

  public Statement rewrite(DelStatement node) {
    ImmutableList<Expression> targets = rewriteTargets(node.getTargets());
    return targets == node.getTargets() ? node : new DelStatement(targets);
  }

  public Statement rewrite(ExpressionStatement node) {
    Expression expr = rewrite(node.getExpression());
    return expr == node.getExpression() ? node : new ExpressionStatement(expr);
  }

  public Statement rewrite(ForStatement node) {
    Expression vars = rewriteTarget(node.getVars());
    Expression iterable = rewrite(node.getIterable());
    ImmutableList<Statement> body = rewriteBlock(node.getBody());
    ImmutableList<Statement> elseBlock = rewriteOptionalBlock(node.getElseBlock());
    if (vars == node.getVars()
        && iterable == node.getIterable()
        && body == node.getBody()
        && elseBlock == node.getElseBlock()) {
      return node;
    }
    return new ForStatement(vars, iterable, body, elseBlock);
  }

  public Statement rewrite(FromImportStatement node) {
    return node;
  }

  public Statement rewrite(IfStatement node) {
    Expression condition = rewrite(node.getCondition());
    ImmutableList<Statement> thenBlock = rewriteBlock(node.getThenBlock());
    ImmutableList<Statement> elseBlock = rewriteOptionalBlock(node.getElseBlock());
    if (condition == node.getCondition()
        && thenBlock == node.getThenBlock()
        && elseBlock == node.getElseBlock()) {
      return node;
    }
    return new IfStatement(condition, thenBlock, elseBlock);
  }

  public Statement rewrite(ImportStatement node) {
    return node;
  }

  public Statement rewrite(RaiseStatement node) {
    Expression exception = rewriteOptional(node.getException());
    Expression cause = rewriteOptional(node.getCause());
    if (exception == node.getException() && cause == node.getCause()) {
      return node;
    }
    return new RaiseStatement(exception, cause);
  }

  public Statement rewrite(ReturnStatement node) {
    Expression result = rewriteOptional(node.getResult());
    return result == node.getResult() ? node : new ReturnStatement(result);
  }

  public Statement rewrite(ScopeStatement node) {
    ImmutableList.Builder<Identifier> names = ImmutableList.builder();
    boolean changed = false;
    for (Identifier id : node.getNames()) {
      Identifier renamed = rewriteBinding(id);
      changed |= renamed != id;
      names.add(renamed);
    }
    return changed ? new ScopeStatement(node.getScopeKind(), names.build()) : node;
  }

  public Statement rewrite(TryStatement node) {
    ImmutableList<Statement> body = rewriteBlock(node.getBody());
    ImmutableList.Builder<TryStatement.ExceptHandler> handlers = ImmutableList.builder();
    boolean changed = body != node.getBody();
    for (TryStatement.ExceptHandler handler : node.getHandlers()) {
      TryStatement.ExceptHandler h = rewrite(handler);
      changed |= h != handler;
      handlers.add(h);
    }
    ImmutableList<Statement> elseBlock = rewriteOptionalBlock(node.getElseBlock());
    ImmutableList<Statement> finallyBlock = rewriteOptionalBlock(node.getFinallyBlock());
    changed |= elseBlock != node.getElseBlock() || finallyBlock != node.getFinallyBlock();
    return changed ? new TryStatement(body, handlers.build(), elseBlock, finallyBlock) : node;
  }

  public TryStatement.ExceptHandler rewrite(TryStatement.ExceptHandler node) {
    Expression type = rewriteOptional(node.getType());
    Identifier name = node.getName() == null ? null : rewriteBinding(node.getName());
    ImmutableList<Statement> body = rewriteBlock(node.getBody());
    if (type == node.getType() && name == node.getName() && body == node.getBody()) {
      return node;
    }
    return new TryStatement.ExceptHandler(type, name, body);
  }

  public Statement rewrite(WhileStatement node) {
    Expression condition = rewrite(node.getCondition());
    ImmutableList<Statement> body = rewriteBlock(node.getBody());
    ImmutableList<Statement> elseBlock = rewriteOptionalBlock(node.getElseBlock());
    if (condition == node.getCondition()
        && body == node.getBody()
        && elseBlock == node.getElseBlock()) {
      return node;
    }
    return new WhileStatement(condition, body, elseBlock);
  }

  public Statement rewrite(WithStatement node) {
    ImmutableList.Builder<WithStatement.Item> items = ImmutableList.builder();
    boolean changed = false;
    for (WithStatement.Item item : node.getItems()) {
      Expression context = rewrite(item.getContext());
      Expression target = item.getTarget() == null ? null : rewriteTarget(item.getTarget());
      if (context != item.getContext() || target != item.getTarget()) {
        changed = true;
        items.add(new WithStatement.Item(context, target));
      } else {
        items.add(item);
      }
    }
    ImmutableList<Statement> body = rewriteBlock(node.getBody());
    changed |= body != node.getBody();
    return changed ? new WithStatement(items.build(), body) : node;
  }

  // ==== Bindings and targets ====

  /**
   * Rewrites a name introduced by a def, class, parameter, except clause, or global/nonlocal
   * statement. The default returns the identifier unchanged.
   */
  protected Identifier rewriteBinding(Identifier id) {
    return id;
  }

  /**
   * Rewrites an assignment, loop, with, del or comprehension target. Names in the target are
   * treated as bindings; the object and key subexpressions of attribute and index targets are
   * ordinary loads.
   */
  public Expression rewriteTarget(Expression target) {
    switch (target.kind()) {
      case IDENTIFIER:
        return rewriteBinding((Identifier) target);
      case DOT:
        {
          DotExpression dot = (DotExpression) target;
          Expression object = rewrite(dot.getObject());
          return object == dot.getObject() ? dot : new DotExpression(object, dot.getField());
        }
      case INDEX:
        {
          IndexExpression index = (IndexExpression) target;
          Expression object = rewrite(index.getObject());
          Expression key = rewrite(index.getKey());
          if (object == index.getObject() && key == index.getKey()) {
            return index;
          }
          return new IndexExpression(object, key);
        }
      case SLICE:
        return rewrite((SliceExpression) target);
      case LIST_EXPR:
        {
          ListExpression list = (ListExpression) target;
          ImmutableList<Expression> elements = rewriteTargets(list.getElements());
          return elements == list.getElements()
              ? list
              : new ListExpression(list.isTuple(), elements);
        }
      case STARRED:
        {
          StarredExpression starred = (StarredExpression) target;
          Expression value = rewriteTarget(starred.getValue());
          return value == starred.getValue() ? starred : new StarredExpression(value);
        }
      default:
        return rewrite(target);
    }
  }

  private ImmutableList<Expression> rewriteTargets(ImmutableList<Expression> targets) {
    ImmutableList.Builder<Expression> result = ImmutableList.builder();
    boolean changed = false;
    for (Expression target : targets) {
      Expression t = rewriteTarget(target);
      changed |= t != target;
      result.add(t);
    }
    return changed ? result.build() : targets;
  }

  // ==== Expressions ====

  /** Entrypoint for rewriting an expression in load position. */
  public Expression rewrite(Expression expr) {
    return switch (expr.kind()) {
      case BINARY_OPERATOR -> rewrite((BinaryOperatorExpression) expr);
      case BOOL_LITERAL -> rewrite((BoolLiteral) expr);
      case BYTES_LITERAL -> rewrite((BytesLiteral) expr);
      case CALL -> rewrite((CallExpression) expr);
      case COMPARISON -> rewrite((ComparisonExpression) expr);
      case COMPREHENSION -> rewrite((Comprehension) expr);
      case CONDITIONAL -> rewrite((ConditionalExpression) expr);
      case DICT_EXPR -> rewrite((DictExpression) expr);
      case DOT -> rewrite((DotExpression) expr);
      case ELLIPSIS -> expr;
      case FLOAT_LITERAL -> rewrite((FloatLiteral) expr);
      case FSTRING -> rewrite((FStringExpression) expr);
      case IDENTIFIER -> rewrite((Identifier) expr);
      case INDEX -> rewrite((IndexExpression) expr);
      case INT_LITERAL -> rewrite((IntLiteral) expr);
      case LAMBDA -> rewrite((LambdaExpression) expr);
      case LIST_EXPR -> rewrite((ListExpression) expr);
      case NONE_LITERAL -> rewrite((NoneLiteral) expr);
      case SET_EXPR -> rewrite((SetExpression) expr);
      case SLICE -> rewrite((SliceExpression) expr);
      case STARRED -> rewrite((StarredExpression) expr);
      case STRING_LITERAL -> rewrite((StringLiteral) expr);
      case UNARY_OPERATOR -> rewrite((UnaryOperatorExpression) expr);
      case YIELD -> rewrite((YieldExpression) expr);
    };
  }

  @Nullable
  protected final Expression rewriteOptional(@Nullable Expression expr) {
    return expr == null ? null : rewrite(expr);
  }

  /** Rewrites each expression of a list, returning the argument if none changed. */
  public final ImmutableList<Expression> rewriteAll(ImmutableList<Expression> exprs) {
    ImmutableList.Builder<Expression> result = ImmutableList.builder();
    boolean changed = false;
    for (Expression e : exprs) {
      Expression r = rewrite(e);
      changed |= r != e;
      result.add(r);
    }
    return changed ? result.build() : exprs;
  }

  public Expression rewrite(BinaryOperatorExpression node) {
    Expression x = rewrite(node.getX());
    Expression y = rewrite(node.getY());
    if (x == node.getX() && y == node.getY()) {
      return node;
    }
    return new BinaryOperatorExpression(x, node.getOperator(), y);
  }

  public Expression rewrite(BoolLiteral node) {
    return node;
  }

  public Expression rewrite(BytesLiteral node) {
    return node;
  }

  public Expression rewrite(CallExpression node) {
    Expression function = rewrite(node.getFunction());
    ImmutableList<Argument> args = rewriteArguments(node.getArguments());
    if (function == node.getFunction() && args == node.getArguments()) {
      return node;
    }
    return new CallExpression(function, args);
  }

  protected final ImmutableList<Argument> rewriteArguments(ImmutableList<Argument> args) {
    ImmutableList.Builder<Argument> result = ImmutableList.builder();
    boolean changed = false;
    for (Argument arg : args) {
      Expression value = rewrite(arg.getValue());
      if (value != arg.getValue()) {
        changed = true;
        result.add(arg.withValue(value));
      } else {
        result.add(arg);
      }
    }
    return changed ? result.build() : args;
  }

  public Expression rewrite(ComparisonExpression node) {
    Expression first = rewrite(node.getFirst());
    ImmutableList<Expression> operands = rewriteAll(node.getOperands());
    if (first == node.getFirst() && operands == node.getOperands()) {
      return node;
    }
    return new ComparisonExpression(first, node.getOperators(), operands);
  }

  public Expression rewrite(Comprehension node) {
    Node body = node.getBody();
    Node newBody;
    if (body instanceof DictExpression.Entry entry) {
      newBody = rewrite(entry);
    } else {
      newBody = rewrite((Expression) body);
    }
    ImmutableList.Builder<Comprehension.Clause> clauses = ImmutableList.builder();
    boolean changed = newBody != body;
    for (Comprehension.Clause clause : node.getClauses()) {
      Comprehension.Clause c;
      if (clause instanceof Comprehension.For f) {
        Expression vars = rewriteTarget(f.getVars());
        Expression iterable = rewrite(f.getIterable());
        c =
            vars == f.getVars() && iterable == f.getIterable()
                ? f
                : new Comprehension.For(vars, iterable);
      } else {
        Comprehension.If i = (Comprehension.If) clause;
        Expression cond = rewrite(i.getCondition());
        c = cond == i.getCondition() ? i : new Comprehension.If(cond);
      }
      changed |= c != clause;
      clauses.add(c);
    }
    return changed ? new Comprehension(node.getType(), newBody, clauses.build()) : node;
  }

  public Expression rewrite(ConditionalExpression node) {
    Expression thenCase = rewrite(node.getThenCase());
    Expression condition = rewrite(node.getCondition());
    Expression elseCase = rewrite(node.getElseCase());
    if (thenCase == node.getThenCase()
        && condition == node.getCondition()
        && elseCase == node.getElseCase()) {
      return node;
    }
    return new ConditionalExpression(thenCase, condition, elseCase);
  }

  public Expression rewrite(DictExpression node) {
    ImmutableList.Builder<DictExpression.Entry> entries = ImmutableList.builder();
    boolean changed = false;
    for (DictExpression.Entry entry : node.getEntries()) {
      DictExpression.Entry e = rewrite(entry);
      changed |= e != entry;
      entries.add(e);
    }
    return changed ? new DictExpression(entries.build()) : node;
  }

  public DictExpression.Entry rewrite(DictExpression.Entry node) {
    Expression key = rewriteOptional(node.getKey());
    Expression value = rewrite(node.getValue());
    if (key == node.getKey() && value == node.getValue()) {
      return node;
    }
    return new DictExpression.Entry(key, value);
  }

  public Expression rewrite(DotExpression node) {
    Expression object = rewrite(node.getObject());
    return object == node.getObject() ? node : new DotExpression(object, node.getField());
  }

  public Expression rewrite(FloatLiteral node) {
    return node;
  }

  public Expression rewrite(FStringExpression node) {
    ImmutableList.Builder<FStringExpression.Part> parts = ImmutableList.builder();
    boolean changed = false;
    for (FStringExpression.Part part : node.getParts()) {
      if (part instanceof FStringExpression.Field field) {
        Expression value = rewrite(field.getValue());
        FStringExpression spec = field.getFormatSpec();
        FStringExpression newSpec = spec == null ? null : (FStringExpression) rewrite(spec);
        if (value != field.getValue() || newSpec != spec) {
          changed = true;
          parts.add(new FStringExpression.Field(value, field.getConversion(), newSpec));
          continue;
        }
      }
      parts.add(part);
    }
    return changed ? new FStringExpression(parts.build()) : node;
  }

  /** Rewrites an identifier in load position. */
  public Expression rewrite(Identifier node) {
    return node;
  }

  public Expression rewrite(IndexExpression node) {
    Expression object = rewrite(node.getObject());
    Expression key = rewrite(node.getKey());
    if (object == node.getObject() && key == node.getKey()) {
      return node;
    }
    return new IndexExpression(object, key);
  }

  public Expression rewrite(IntLiteral node) {
    return node;
  }

  public Expression rewrite(LambdaExpression node) {
    ImmutableList<Parameter> params = rewriteParameters(node.getParameters());
    Expression body = rewrite(node.getBody());
    if (params == node.getParameters() && body == node.getBody()) {
      return node;
    }
    return new LambdaExpression(params, body);
  }

  protected final ImmutableList<Parameter> rewriteParameters(ImmutableList<Parameter> params) {
    ImmutableList.Builder<Parameter> result = ImmutableList.builder();
    boolean changed = false;
    for (Parameter param : params) {
      Identifier id = param.getIdentifier() == null ? null : rewriteBinding(param.getIdentifier());
      Expression type = rewriteOptional(param.getType());
      Expression defaultValue = rewriteOptional(param.getDefaultValue());
      if (id != param.getIdentifier()
          || type != param.getType()
          || defaultValue != param.getDefaultValue()) {
        changed = true;
        result.add(param.with(id, type, defaultValue));
      } else {
        result.add(param);
      }
    }
    return changed ? result.build() : params;
  }

  public Expression rewrite(ListExpression node) {
    ImmutableList<Expression> elements = rewriteAll(node.getElements());
    return elements == node.getElements() ? node : new ListExpression(node.isTuple(), elements);
  }

  public Expression rewrite(NoneLiteral node) {
    return node;
  }

  public Expression rewrite(SetExpression node) {
    ImmutableList<Expression> elements = rewriteAll(node.getElements());
    return elements == node.getElements() ? node : new SetExpression(elements);
  }

  public Expression rewrite(SliceExpression node) {
    Expression object = rewrite(node.getObject());
    Expression start = rewriteOptional(node.getStart());
    Expression stop = rewriteOptional(node.getStop());
    Expression step = rewriteOptional(node.getStep());
    if (object == node.getObject()
        && start == node.getStart()
        && stop == node.getStop()
        && step == node.getStep()) {
      return node;
    }
    return new SliceExpression(object, start, stop, step, node.hasSecondColon());
  }

  public Expression rewrite(StarredExpression node) {
    Expression value = rewrite(node.getValue());
    return value == node.getValue() ? node : new StarredExpression(value);
  }

  public Expression rewrite(StringLiteral node) {
    return node;
  }

  public Expression rewrite(UnaryOperatorExpression node) {
    Expression x = rewrite(node.getX());
    return x == node.getX() ? node : new UnaryOperatorExpression(node.getOperator(), x);
  }

  public Expression rewrite(YieldExpression node) {
    Expression value = rewriteOptional(node.getValue());
    return value == node.getValue() ? node : new YieldExpression(value, node.isFrom());
  }
}
