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

/** A class for flow statements (break, continue, and pass). */
public final class FlowStatement extends Statement {

  private final TokenKind flowKind; // BREAK | CONTINUE | PASS

  public FlowStatement(TokenKind flowKind) {
    super(Kind.FLOW);
    Preconditions.checkArgument(
        flowKind == TokenKind.BREAK || flowKind == TokenKind.CONTINUE || flowKind == TokenKind.PASS,
        "not a flow statement: %s",
        flowKind);
    this.flowKind = flowKind;
  }

  public static FlowStatement pass() {
    return new FlowStatement(TokenKind.PASS);
  }

  public TokenKind getFlowKind() {
    return flowKind;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
