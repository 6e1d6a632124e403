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

import javax.annotation.Nullable;

/** Syntax node for a line or block comment. Comments are kept apart from the syntax tree. */
public final class Comment extends Node {

  /** Whether, and to what, a comment is attached as documentation. */
  public enum DocStyle {
    /** A plain comment. */
    NONE,
    /** {@code ///} or {@code /** ... *}{@code /}: documents the item that follows. */
    OUTER,
    /** {@code //!} or {@code /*! ... *}{@code /}: documents the enclosing item. */
    INNER,
  }

  private final int offset;
  private final String text;
  private final boolean block;

  Comment(FileLocations locs, int offset, String text, boolean block) {
    super(locs);
    this.offset = offset;
    this.text = text;
    this.block = block;
  }

  /** Returns the text of the comment, including its delimiters but not the trailing newline. */
  public String getText() {
    return text;
  }

  /** Reports whether this is a (possibly nested) block comment. */
  public boolean isBlock() {
    return block;
  }

  /**
   * Returns the doc style of the comment. {@code ////} and {@code /***}, and the empty block
   * comment {@code /**}{@code /}, are plain comments.
   */
  public DocStyle getDocStyle() {
    if (block) {
      if (text.startsWith("/*!")) {
        return DocStyle.INNER;
      }
      if (text.startsWith("/**") && !text.startsWith("/***") && !text.equals("/**/")) {
        return DocStyle.OUTER;
      }
      return DocStyle.NONE;
    }
    if (text.startsWith("//!")) {
      return DocStyle.INNER;
    }
    if (text.startsWith("///") && !text.startsWith("////")) {
      return DocStyle.OUTER;
    }
    return DocStyle.NONE;
  }

  /**
   * If this is a doc comment, returns the text following its marker, without the closing {@code
   * *}{@code /} of a block comment; otherwise, returns null.
   */
  @Nullable
  public String getDocCommentText() {
    if (getDocStyle() == DocStyle.NONE) {
      return null;
    }
    if (block) {
      int end = text.endsWith("*/") ? text.length() - 2 : text.length();
      return text.substring(3, Math.max(3, end));
    }
    return text.substring(3);
  }

  @Override
  public int getStartOffset() {
    return offset;
  }

  @Override
  public int getEndOffset() {
    return offset + text.length();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return text;
  }
}
