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
import javax.annotation.Nullable;

/**
 * A Token is one lexical token: its kind, its half-open offset range, and for literals and
 * identifiers its value.
 *
 * <p>The value is the identifier text (including any {@code r#} prefix) for IDENTIFIER, the content
 * segments for STRING, the content range for RAW_STRING, the offending character for ILLEGAL, and
 * null otherwise.
 */
final class Token {

  final TokenKind kind;
  final int start; // start offset
  final int end; // end offset
  @Nullable final Object value;

  // True if the next token starts exactly at this token's end, with no space or comment between.
  final boolean joint;

  Token(TokenKind kind, int start, int end, @Nullable Object value, boolean joint) {
    Preconditions.checkArgument(start <= end, "bad token range [%s, %s)", start, end);
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.value = value;
    this.joint = joint;
  }

  /** Returns the identifier name; requires {@code kind == IDENTIFIER}. */
  String name() {
    Preconditions.checkState(kind == TokenKind.IDENTIFIER, "not an identifier: %s", kind);
    return (String) value;
  }

  @Override
  public String toString() {
    return value == null || kind != TokenKind.IDENTIFIER ? kind.toString() : (String) value;
  }
}
