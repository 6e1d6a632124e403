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

/**
 * Renders a syntax tree as a one-line S-expression.
 *
 * <p>Each named node prints as {@code (kind child child ...)}. A child labelled with a field is
 * prefixed by {@code field: }. A named leaf prints its text, e.g. {@code (integer_literal "1")},
 * unless the text is just the kind's own name, as in {@code (self)}. Anonymous tokens are printed,
 * as a quoted string, only when they are labelled with a field, e.g. {@code operator: "+"}.
 */
final class NodePrinter {

  private final StringBuilder buf;

  private NodePrinter(StringBuilder buf) {
    this.buf = buf;
  }

  /** Returns the S-expression form of the node. */
  static String printNode(Node node) {
    StringBuilder buf = new StringBuilder();
    new NodePrinter(buf).printNodeInternal(node);
    return buf.toString();
  }

  private void printNodeInternal(Node n) {
    if (n instanceof Comment comment) {
      buf.append(comment.getText());
      return;
    }
    SyntaxNode node = (SyntaxNode) n;
    if (!node.isNamed()) {
      quote(node.getText());
      return;
    }
    buf.append('(').append(node.kind().getName());
    if (node.isLeaf()) {
      if (!node.getText().equals(node.kind().getName())) {
        buf.append(' ');
        quote(node.getText());
      }
    } else {
      for (int i = 0; i < node.getChildren().size(); i++) {
        SyntaxNode child = node.getChildren().get(i);
        String field = node.getFieldName(i);
        if (field == null && !child.isNamed()) {
          continue;
        }
        buf.append(' ');
        if (field != null) {
          buf.append(field).append(": ");
        }
        printNodeInternal(child);
      }
    }
    buf.append(')');
  }

  private void quote(String text) {
    buf.append('"');
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '"':
          buf.append("\\\"");
          break;
        case '\\':
          buf.append("\\\\");
          break;
        case '\n':
          buf.append("\\n");
          break;
        default:
          buf.append(c);
      }
    }
    buf.append('"');
  }
}
