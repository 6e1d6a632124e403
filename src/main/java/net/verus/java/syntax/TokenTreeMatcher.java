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
import java.util.ArrayDeque;
import java.util.Deque;
import javax.annotation.Nullable;

/**
 * Matches the delimiters of a token tree. Macro arguments and macro rule bodies are opaque to the
 * parser, so their only structure is the nesting of {@code ()}, {@code []} and {@code {}}.
 *
 * <p>Matching uses an explicit stack, so nesting depth is bounded by memory rather than by the
 * thread's stack.
 */
final class TokenTreeMatcher {

  private TokenTreeMatcher() {}

  /** The outcome of matching: exactly one of tree and error is non-null. */
  static final class Result {
    @Nullable private final TokenTree tree;
    @Nullable private final SyntaxError error;
    private final int endIndex;

    private Result(@Nullable TokenTree tree, @Nullable SyntaxError error, int endIndex) {
      this.tree = tree;
      this.error = error;
      this.endIndex = endIndex;
    }

    /** Returns the matched tree, or null if the delimiters do not match. */
    @Nullable
    TokenTree tree() {
      return tree;
    }

    /** Returns the delimiter error, or null if the tree was matched. */
    @Nullable
    SyntaxError error() {
      return error;
    }

    /**
     * Returns the index of the first token after the tree. On error, returns the index of the
     * offending closing delimiter or of EOF, which are not consumed.
     */
    int endIndex() {
      return endIndex;
    }
  }

  /**
   * Matches the token tree whose opening delimiter is {@code tokens.get(start)}.
   *
   * <p>On a mismatched or missing closing delimiter, the result holds a {@link
   * SyntaxError.Kind#DELIMITER_MISMATCH} error located at the innermost unclosed opening delimiter.
   */
  static Result match(ImmutableList<Token> tokens, int start, FileLocations locs) {
    Token first = tokens.get(start);
    Preconditions.checkArgument(
        first.kind.isOpenDelimiter(), "not an opening delimiter: %s", first);
    TokenTree.Builder tree = new TokenTree.Builder();
    Deque<Integer> open = new ArrayDeque<>(); // node indices of unclosed groups
    Deque<Token> openers = new ArrayDeque<>(); // their opening delimiters
    for (int i = start; ; i++) {
      Token t = tokens.get(i);
      if (t.kind == TokenKind.EOF) {
        Token opener = openers.peek();
        return error(locs, opener, String.format("unclosed delimiter '%s'", opener.kind), i);
      }
      int parent = open.isEmpty() ? -1 : open.peek();
      if (t.kind.isCloseDelimiter()) {
        int group = open.peek();
        Token opener = openers.peek();
        if (t.kind != opener.kind.closer()) {
          return error(
              locs,
              opener,
              String.format(
                  "mismatched delimiter: '%s' opened here is closed by '%s'", opener.kind, t.kind),
              i);
        }
        tree.close(group, i);
        open.pop();
        openers.pop();
        if (open.isEmpty()) {
          return new Result(tree.build(), null, i + 1);
        }
        continue;
      }
      int node = tree.add(parent, i, open.size(), t.kind);
      if (t.kind.isOpenDelimiter()) {
        open.push(node);
        openers.push(t);
      }
    }
  }

  private static Result error(FileLocations locs, Token opener, String message, int endIndex) {
    return new Result(
        null,
        new SyntaxError(
            locs.getLocation(opener.start), message, SyntaxError.Kind.DELIMITER_MISMATCH),
        endIndex);
  }
}
