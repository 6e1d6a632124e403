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

import java.util.List;

/**
 * A visitor for visiting the nodes of a syntax tree in lexical order.
 *
 * <p>Comments are *not* visited by the default traversal, since they are not part of the tree;
 * callers may visit them explicitly from {@link SourceFile#getComments}.
 *
 * <p>A subclass can change the traversal logic by setting {@link #skipAnonymousTokens}.
 *
 * <p>Typical usage is for a subclass to override {@link #visit(SyntaxNode)}, dispatch on {@link
 * SyntaxNode#kind}, and call {@code super.visit(node)} to continue into the children.
 */
public class NodeVisitor {

  /** If set, anonymous {@link NodeKind#TOKEN} leaves such as keywords are not visited. */
  protected boolean skipAnonymousTokens = false;

  /** Entrypoint for visiting a node. */
  public void visit(Node node) {
    // Double-dispatch pattern.
    node.accept(this);
  }

  /** Visits the children of a syntax node in source order. */
  public void visit(SyntaxNode node) {
    for (SyntaxNode child : node.getChildren()) {
      if (skipAnonymousTokens && !child.isNamed()) {
        continue;
      }
      visit(child);
    }
  }

  public void visit(Comment node) {}

  public void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }
}
