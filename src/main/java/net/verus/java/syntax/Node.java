// Copyright 2026 The Bazel Authors. All rights reserved.
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

package net.verus.java.syntax;

import com.google.common.base.Preconditions;

/**
 * A Node is a node in the concrete syntax tree produced by the parser: either a {@link SyntaxNode}
 * or a {@link Comment}.
 */
public abstract class Node {

  // The locations table of the file containing this node.
  final FileLocations locs;

  Node(FileLocations locs) {
    this.locs = Preconditions.checkNotNull(locs);
  }

  /** Returns the node's start offset, as a char index (zero-based count of UTF-16 codes). */
  public abstract int getStartOffset();

  /** Returns the node's end offset, as a char index (zero-based count of UTF-16 codes). */
  public abstract int getEndOffset();

  /** Returns the location of the start of this node. */
  public final Location getStartLocation() {
    return locs.getLocation(getStartOffset());
  }

  /** Returns the location of the end of this node. */
  public final Location getEndLocation() {
    return locs.getLocation(getEndOffset());
  }

  /** Returns the name of the file containing this node. */
  public final String getFile() {
    return locs.file();
  }

  /**
   * Returns a pretty-printed S-expression representation of this node, for use in tests and
   * debugging.
   */
  @Override
  public String toString() {
    return NodePrinter.printNode(this);
  }

  /**
   * Implements the double dispatch by invoking into the node specific <code>visit</code> method of
   * the {@link NodeVisitor}
   *
   * @param visitor the {@link NodeVisitor} to be invoked.
   */
  public abstract void accept(NodeVisitor visitor);
}
