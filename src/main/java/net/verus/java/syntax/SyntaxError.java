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
import java.util.List;

/**
 * A SyntaxError represents a local, recoverable problem found while scanning or parsing a
 * compilation unit. Grammar-construction defects are not SyntaxErrors; see {@link
 * GrammarException}.
 */
public final class SyntaxError {

  /** The broad class of a syntax error. */
  public enum Kind {
    /** No scanner rule could make progress, or a literal or comment was left open. */
    LEXICAL,
    /** The token stream does not match any production at this point. */
    SYNTAX,
    /** A token tree has an unclosed or mismatched delimiter. Located at the opening delimiter. */
    DELIMITER_MISMATCH,
  }

  private final Location location;
  private final String message;
  private final Kind kind;

  public SyntaxError(Location location, String message) {
    this(location, message, Kind.SYNTAX);
  }

  public SyntaxError(Location location, String message, Kind kind) {
    this.location = Preconditions.checkNotNull(location);
    this.message = Preconditions.checkNotNull(message);
    this.kind = Preconditions.checkNotNull(kind);
  }

  /** Returns the location of the error. */
  public Location location() {
    return location;
  }

  /** Returns a description of the error. */
  public String message() {
    return message;
  }

  /** Returns the class of the error. */
  public Kind kind() {
    return kind;
  }

  /** Returns a string of the form {@code "foo.rs:1:2: oops"}. */
  @Override
  public String toString() {
    return location + ": " + message;
  }

  /**
   * A SyntaxError.Exception is an exception holding one or more syntax errors.
   *
   * <p>SyntaxError.Exception is thrown only by the parsing functions that have no result to return
   * when the input is malformed, such as {@link SourceFile#parseExpression}.
   */
  public static final class Exception extends java.lang.Exception {

    private final ImmutableList<SyntaxError> errors;

    /** Construct a SyntaxError from a non-empty list of errors. */
    public Exception(List<SyntaxError> errors) {
      Preconditions.checkArgument(!errors.isEmpty(), "no errors");
      this.errors = ImmutableList.copyOf(errors);
    }

    /** Returns an immutable non-empty list of errors. */
    public ImmutableList<SyntaxError> errors() {
      return errors;
    }

    @Override
    public String getMessage() {
      return errors.get(0).toString();
    }
  }
}
