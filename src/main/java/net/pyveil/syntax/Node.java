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
 * A Node is a node in a Python syntax tree.
 *
 * <p>Nodes are immutable. A node produced by the parser records the offset of its first token; a
 * node built by a rewriting pass has no position and reports {@link Location#SYNTHETIC}.
 */
public abstract class Node {

  // Set once, by the parser.
  @Nullable private FileLocations locs;
  private int startOffset = -1;

  Node() {}

  final void setPosition(FileLocations locs, int startOffset) {
    Preconditions.checkState(this.locs == null, "position already set");
    this.locs = Preconditions.checkNotNull(locs);
    this.startOffset = startOffset;
  }

  /** Returns the char offset of the start of this node, or -1 if it was synthesized. */
  public final int getStartOffset() {
    return startOffset;
  }

  /** Reports whether this node was built by a pass rather than read from source. */
  public final boolean isSynthetic() {
    return locs == null;
  }

  /** Returns the location of the start of this node. */
  public final Location getStartLocation() {
    return locs == null ? Location.SYNTHETIC : locs.getLocation(startOffset);
  }

  /**
   * Returns a pretty-printed representation of this syntax tree.
   *
   * <p>This function returns the source form of the node, as produced by {@link NodePrinter}.
   */
  @Override
  public String toString() {
    return NodePrinter.print(this);
  }

  /**
   * Implements the double dispatch by invoking into the node type specific visit method of the
   * {@link NodeVisitor}.
   */
  public abstract void accept(NodeVisitor visitor);
}
