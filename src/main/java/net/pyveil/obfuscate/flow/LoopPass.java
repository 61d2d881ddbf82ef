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

package net.pyveil.obfuscate.flow;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import net.pyveil.obfuscate.BoundNames;
import net.pyveil.obfuscate.ConstantFolder;
import net.pyveil.obfuscate.NameGenerator;
import net.pyveil.obfuscate.ObfuscationStats.Counter;
import net.pyveil.obfuscate.PassContext;
import net.pyveil.syntax.AssignmentStatement;
import net.pyveil.syntax.BoolLiteral;
import net.pyveil.syntax.CallExpression;
import net.pyveil.syntax.ClassStatement;
import net.pyveil.syntax.ComparisonExpression;
import net.pyveil.syntax.DefStatement;
import net.pyveil.syntax.FlowStatement;
import net.pyveil.syntax.ForStatement;
import net.pyveil.syntax.Identifier;
import net.pyveil.syntax.IfStatement;
import net.pyveil.syntax.PyFile;
import net.pyveil.syntax.Statement;
import net.pyveil.syntax.TokenKind;
import net.pyveil.syntax.UnaryOperatorExpression;
import net.pyveil.syntax.WhileStatement;

/**
 * Re-encodes loops as {@code while True} loops.
 *
 * <p>{@code while c: B} becomes {@code while True: if not c: break; B}. {@code for t in it: B}
 * becomes
 *
 * <pre>
 * _it = iter(it)
 * _sentinel = object()
 * while True:
 *     _item = next(_it, _sentinel)
 *     if _item is _sentinel:
 *         break
 *     t = _item
 *     B
 * </pre>
 *
 * <p>Loops with an else clause, loops directly in a class body and while loops whose condition is
 * constantly true are kept. The second rule keeps temporaries out of class namespaces; the third
 * makes the pass idempotent. Programs binding {@code iter}, {@code next} or {@code object} are not
 * touched at all.
 */
public final class LoopPass extends FlowPass {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final ImmutableSet<String> REQUIRED = ImmutableSet.of("iter", "next", "object");

  /** One entry per enclosing def or class body; true for a class. */
  private final Deque<Boolean> scopes = new ArrayDeque<>();

  private LoopPass(PassContext ctx) {
    super(ctx, Counter.LOOPS);
  }

  public static PyFile apply(PyFile file, PassContext ctx) {
    return new LoopPass(ctx).run(file);
  }

  @Override
  PyFile run(PyFile file) {
    ImmutableSet<String> bound = BoundNames.all(file);
    for (String name : REQUIRED) {
      if (bound.contains(name)) {
        String warning = "loops skipped: program binds " + name;
        logger.atInfo().log("%s", warning);
        ctx.warn(warning);
        return file;
      }
    }
    return super.run(file);
  }

  @Override
  public Statement rewrite(DefStatement node) {
    scopes.push(false);
    try {
      return super.rewrite(node);
    } finally {
      scopes.pop();
    }
  }

  @Override
  public Statement rewrite(ClassStatement node) {
    scopes.push(true);
    try {
      return super.rewrite(node);
    } finally {
      scopes.pop();
    }
  }

  private boolean inClassBody() {
    return !scopes.isEmpty() && scopes.peek();
  }

  @Override
  public Statement rewrite(WhileStatement node) {
    WhileStatement loop = (WhileStatement) super.rewrite(node);
    if (loop.getElseBlock() != null
        || inClassBody()
        || Boolean.TRUE.equals(ConstantFolder.foldTruth(loop.getCondition()))
        || !random.draw(ctx.config().loopRate())) {
      return loop;
    }
    changed();
    Statement exit =
        new IfStatement(
            new UnaryOperatorExpression(TokenKind.NOT, loop.getCondition()),
            ImmutableList.of(new FlowStatement(TokenKind.BREAK)),
            null);
    return new WhileStatement(
        new BoolLiteral(true),
        ImmutableList.<Statement>builder().add(exit).addAll(loop.getBody()).build(),
        null);
  }

  @Override
  protected List<Statement> expand(Statement stmt) {
    if (!(stmt instanceof ForStatement)) {
      return super.expand(stmt);
    }
    ForStatement loop = (ForStatement) rewrite(stmt);
    if (loop.getElseBlock() != null
        || inClassBody()
        || !random.draw(ctx.config().loopRate())) {
      return ImmutableList.of(loop);
    }
    changed();
    NameGenerator names = ctx.names();
    Identifier iterator = new Identifier(names.fresh("_it"));
    Identifier sentinel = new Identifier(names.fresh("_sentinel"));
    Identifier item = new Identifier(names.fresh("_item"));
    ImmutableList<Statement> body =
        ImmutableList.<Statement>builder()
            .add(AssignmentStatement.of(item, CallExpression.of("next", iterator, sentinel)))
            .add(
                new IfStatement(
                    ComparisonExpression.of(item, TokenKind.IS, sentinel),
                    ImmutableList.of(new FlowStatement(TokenKind.BREAK)),
                    null))
            .add(AssignmentStatement.of(loop.getVars(), item))
            .addAll(loop.getBody())
            .build();
    return ImmutableList.of(
        AssignmentStatement.of(iterator, CallExpression.of("iter", loop.getIterable())),
        AssignmentStatement.of(sentinel, CallExpression.of("object")),
        new WhileStatement(new BoolLiteral(true), body, null));
  }
}
