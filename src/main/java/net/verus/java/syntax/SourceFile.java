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

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.List;

/**
 * Syntax tree for a Rust or Verus source file.
 *
 * <p>Parsing never fails: a file with syntax errors still has a tree that covers the whole input,
 * with {@link NodeKind#ERROR} nodes where recovery skipped tokens. Callers must check {@link #ok}
 * before relying on the tree's shape.
 */
public final class SourceFile {

  private final SyntaxNode root;
  private final FileOptions options;
  private final ImmutableList<Comment> comments;
  private final FileLocations locs;
  private final List<SyntaxError> errors;

  private SourceFile(
      SyntaxNode root,
      FileOptions options,
      ImmutableList<Comment> comments,
      FileLocations locs,
      List<SyntaxError> errors) {
    this.root = root;
    this.options = options;
    this.comments = comments;
    this.locs = locs;
    this.errors = errors;
  }

  /**
   * Parse the specified file, returning its syntax tree with the errors list populated with any
   * scan or parse errors.
   */
  public static SourceFile parse(ParserInput input, FileOptions options) {
    Parser.ParseResult result = Parser.parseFile(input, options);
    return new SourceFile(result.root, options, result.comments, result.locs, result.errors);
  }

  /** Parse a source file using the base language, without the verification overlay. */
  public static SourceFile parse(ParserInput input) {
    return parse(input, FileOptions.DEFAULT);
  }

  /**
   * Parses the input as a single expression.
   *
   * @throws SyntaxError.Exception if the input is not a well-formed expression, or has tokens
   *     after the expression
   */
  public static SyntaxNode parseExpression(ParserInput input, FileOptions options)
      throws SyntaxError.Exception {
    return Parser.parseExpression(input, options);
  }

  /** Returns the {@code source_file} node at the root of the tree. */
  public SyntaxNode getRoot() {
    return root;
  }

  /** Returns the top-level items and statements of the file. */
  public ImmutableList<SyntaxNode> getStatements() {
    return root.getNamedChildren();
  }

  /** Returns an unmodifiable view of the list of scanner and parser errors. */
  public List<SyntaxError> errors() {
    return Collections.unmodifiableList(errors);
  }

  /** Returns true if there were no errors during scanning and parsing. */
  public boolean ok() {
    return errors.isEmpty();
  }

  /** Returns the comments of the file, in source order. Comments are not part of the tree. */
  public ImmutableList<Comment> getComments() {
    return comments;
  }

  /** Returns the options specified when parsing this file. */
  public FileOptions getOptions() {
    return options;
  }

  /** Returns the name of this file, as specified to the parser. */
  public String getName() {
    return locs.file();
  }

  /** Returns the location of the given char offset within this file. */
  public Location getLocation(int offset) {
    return locs.getLocation(offset);
  }

  @Override
  public String toString() {
    return "<source file " + getName() + ">";
  }
}
