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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A node of the concrete syntax tree.
 *
 * <p>A node has a {@link NodeKind}, a half-open source span, and an ordered list of children.
 * Each child may be labelled with a field name such as {@code left} or {@code body}. Leaves (named
 * leaves such as identifiers and literals, and anonymous {@link NodeKind#TOKEN} leaves) carry
 * their source text instead of children.
 *
 * <p>Trees are immutable once built.
 */
public final class SyntaxNode extends Node {

  private final NodeKind kind;
  private final int start;
  private final int end;
  private final ImmutableList<SyntaxNode> children;
  private final ImmutableList<String> fieldNames; // parallel to children; "" means no field
  @Nullable private final String text; // leaves only

  private SyntaxNode(
      FileLocations locs,
      NodeKind kind,
      int start,
      int end,
      ImmutableList<SyntaxNode> children,
      ImmutableList<String> fieldNames,
      @Nullable String text) {
    super(locs);
    Preconditions.checkArgument(start <= end, "bad node range [%s, %s)", start, end);
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.children = children;
    this.fieldNames = fieldNames;
    this.text = text;
  }

  /** Returns a leaf node with the given text. */
  static SyntaxNode leaf(FileLocations locs, NodeKind kind, int start, int end, String text) {
    Preconditions.checkNotNull(text);
    return new SyntaxNode(locs, kind, start, end, ImmutableList.of(), ImmutableList.of(), text);
  }

  /** Returns a builder for an interior node starting at the given offset. */
  static Builder builder(FileLocations locs, NodeKind kind, int start) {
    return new Builder(locs, kind, start);
  }

  /** Returns the kind of this node. */
  public NodeKind kind() {
    return kind;
  }

  /** Reports whether this node is named, that is, not an anonymous token. */
  public boolean isNamed() {
    return kind.isNamed();
  }

  /** Reports whether this node is a leaf, which has text and no children. */
  public boolean isLeaf() {
    return text != null;
  }

  /** Returns the source text of a leaf, or null for an interior node. */
  @Nullable
  public String getText() {
    return text;
  }

  /** Returns all children, named and anonymous, in source order. */
  public ImmutableList<SyntaxNode> getChildren() {
    return children;
  }

  /** Returns the named children, in source order. */
  public ImmutableList<SyntaxNode> getNamedChildren() {
    ImmutableList.Builder<SyntaxNode> result = ImmutableList.builder();
    for (SyntaxNode child : children) {
      if (child.isNamed()) {
        result.add(child);
      }
    }
    return result.build();
  }

  /** Returns the field name of the ith child, or null if it has none. */
  @Nullable
  public String getFieldName(int i) {
    String name = fieldNames.get(i);
    return name.isEmpty() ? null : name;
  }

  /** Returns the first child labelled with the given field name, or null. */
  @Nullable
  public SyntaxNode getField(String name) {
    for (int i = 0; i < children.size(); i++) {
      if (fieldNames.get(i).equals(name)) {
        return children.get(i);
      }
    }
    return null;
  }

  /** Returns all children labelled with the given field name, in source order. */
  public ImmutableList<SyntaxNode> getFields(String name) {
    ImmutableList.Builder<SyntaxNode> result = ImmutableList.builder();
    for (int i = 0; i < children.size(); i++) {
      if (fieldNames.get(i).equals(name)) {
        result.add(children.get(i));
      }
    }
    return result.build();
  }

  /** Returns the first named child of the given kind, or null. */
  @Nullable
  public SyntaxNode getChild(NodeKind kind) {
    for (SyntaxNode child : children) {
      if (child.kind == kind) {
        return child;
      }
    }
    return null;
  }

  /** Reports whether this node or any of its descendants is an {@link NodeKind#ERROR} node. */
  public boolean hasError() {
    if (kind == NodeKind.ERROR) {
      return true;
    }
    for (SyntaxNode child : children) {
      if (child.hasError()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public int getStartOffset() {
    return start;
  }

  @Override
  public int getEndOffset() {
    return end;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /**
   * Structural equality: same kind, text, fields and children. Spans are compared too, so two
   * trees are equal only if they were parsed from the same text.
   */
  @Override
  public boolean equals(Object other) {
    if (other == this) {
      return true;
    }
    if (!(other instanceof SyntaxNode that)) {
      return false;
    }
    return kind == that.kind
        && start == that.start
        && end == that.end
        && Objects.equals(text, that.text)
        && fieldNames.equals(that.fieldNames)
        && children.equals(that.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, start, end, text, children);
  }

  /** Accumulates the children of an interior node. */
  static final class Builder {
    private final FileLocations locs;
    private NodeKind kind;
    private final int start;
    private final List<SyntaxNode> children = new ArrayList<>();
    private final List<String> fieldNames = new ArrayList<>();

    private Builder(FileLocations locs, NodeKind kind, int start) {
      this.locs = locs;
      this.kind = kind;
      this.start = start;
    }

    NodeKind kind() {
      return kind;
    }

    int start() {
      return start;
    }

    /** Changes the kind of the node under construction, once its trailing part decides it. */
    @CanIgnoreReturnValue
    Builder setKind(NodeKind kind) {
      this.kind = kind;
      return this;
    }

    boolean isEmpty() {
      return children.isEmpty();
    }

    /** Appends an unlabelled child. Null children, from absent optional parts, are ignored. */
    @CanIgnoreReturnValue
    Builder add(@Nullable SyntaxNode child) {
      return add("", child);
    }

    /** Appends a child labelled with a field name. Null children are ignored. */
    @CanIgnoreReturnValue
    Builder add(String field, @Nullable SyntaxNode child) {
      if (child != null) {
        children.add(child);
        fieldNames.add(field);
      }
      return this;
    }

    /** Appends all the children of another node, with their field names. */
    @CanIgnoreReturnValue
    Builder addAll(SyntaxNode node) {
      for (int i = 0; i < node.children.size(); i++) {
        children.add(node.children.get(i));
        fieldNames.add(node.fieldNames.get(i));
      }
      return this;
    }

    /** Builds the node. Its end is the end of the last child, or {@code end} if that is later. */
    SyntaxNode build(int end) {
      int e = Math.max(start, end);
      for (SyntaxNode child : children) {
        e = Math.max(e, child.end);
      }
      return new SyntaxNode(
          locs,
          kind,
          start,
          e,
          ImmutableList.copyOf(children),
          ImmutableList.copyOf(fieldNames),
          null);
    }
  }
}
