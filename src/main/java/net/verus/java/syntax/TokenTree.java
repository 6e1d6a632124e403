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
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;
import java.util.ArrayList;
import java.util.List;

/**
 * A matched token tree: a balanced, delimited run of tokens, stored as an arena of nodes indexed
 * by small integers.
 *
 * <p>A node is either a group (an opening delimiter, its children, and the matching closing
 * delimiter) or a single leaf token. Node {@link #ROOT} is the outermost group. Token positions
 * are indices into the token list the tree was matched from.
 */
final class TokenTree {

  /** The index of the outermost group. */
  static final int ROOT = 0;

  private static final int NO_CLOSE = -1;

  private final ImmutableIntArray tokens; // node -> index of its (opening) token
  private final ImmutableIntArray closes; // node -> index of its closing token, or NO_CLOSE
  private final ImmutableIntArray depths; // node -> nesting depth; the root is at depth 0
  private final ImmutableList<TokenKind> kinds; // node -> token kind
  private final ImmutableList<ImmutableIntArray> children;

  private TokenTree(
      ImmutableIntArray tokens,
      ImmutableIntArray closes,
      ImmutableIntArray depths,
      ImmutableList<TokenKind> kinds,
      ImmutableList<ImmutableIntArray> children) {
    this.tokens = tokens;
    this.closes = closes;
    this.depths = depths;
    this.kinds = kinds;
    this.children = children;
  }

  /** Returns the number of nodes. */
  int size() {
    return tokens.length();
  }

  /** Returns the token index of a leaf, or of the opening delimiter of a group. */
  int token(int node) {
    return tokens.get(node);
  }

  /** Returns the token index of the closing delimiter of a group. */
  int closeToken(int node) {
    Preconditions.checkArgument(isGroup(node), "node %s is not a group", node);
    return closes.get(node);
  }

  /** Reports whether the node is a delimited group rather than a leaf. */
  boolean isGroup(int node) {
    return closes.get(node) != NO_CLOSE;
  }

  /** Returns the opening delimiter of a group: LPAREN, LBRACKET or LBRACE. */
  TokenKind delimiter(int node) {
    Preconditions.checkArgument(isGroup(node), "node %s is not a group", node);
    return kinds.get(node);
  }

  /** Returns the nesting depth of a node. The root group is at depth 0, its children at 1. */
  int depth(int node) {
    return depths.get(node);
  }

  /** Returns the children of a group, in source order. A leaf has no children. */
  ImmutableIntArray children(int node) {
    return children.get(node);
  }

  /** Accumulates nodes in pre-order. Groups are closed in post-order by {@link #close}. */
  static final class Builder {
    private static final int OPEN = -2;

    private final ImmutableIntArray.Builder tokens = ImmutableIntArray.builder();
    private final List<Integer> closes = new ArrayList<>();
    private final ImmutableIntArray.Builder depths = ImmutableIntArray.builder();
    private final ImmutableList.Builder<TokenKind> kinds = ImmutableList.builder();
    private final List<ImmutableIntArray.Builder> children = new ArrayList<>();

    /**
     * Adds a node for the token at the given index beneath {@code parent}, or as the root if
     * {@code parent} is negative, and returns its node index.
     */
    int add(int parent, int tokenIndex, int depth, TokenKind kind) {
      int node = closes.size();
      tokens.add(tokenIndex);
      depths.add(depth);
      kinds.add(kind);
      closes.add(kind.isOpenDelimiter() ? OPEN : NO_CLOSE);
      children.add(ImmutableIntArray.builder());
      if (parent >= 0) {
        children.get(parent).add(node);
      }
      return node;
    }

    /** Records the closing delimiter of a group. */
    void close(int group, int tokenIndex) {
      Preconditions.checkState(closes.get(group) == OPEN, "node %s is not an open group", group);
      closes.set(group, tokenIndex);
    }

    TokenTree build() {
      ImmutableIntArray.Builder closeArray = ImmutableIntArray.builder(closes.size());
      for (int c : closes) {
        Preconditions.checkState(c != OPEN, "unclosed group");
        closeArray.add(c);
      }
      ImmutableList.Builder<ImmutableIntArray> lists = ImmutableList.builder();
      for (ImmutableIntArray.Builder b : children) {
        lists.add(b.build());
      }
      return new TokenTree(
          tokens.build(), closeArray.build(), depths.build(), kinds.build(), lists.build());
    }
  }
}
