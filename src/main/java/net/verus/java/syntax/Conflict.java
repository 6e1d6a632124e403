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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A Conflict declares a point where several productions overlap on a bounded lookahead, and names
 * the tokens that settle it.
 *
 * <p>The parser may only keep several interpretations alive at a declared conflict. It does so
 * either by trying each alternative in turn from the same position (see {@code Parser.resolve}),
 * or, where one token of lookahead suffices, by testing whether the next token is one of the
 * resolving tokens. Either way an alternative succeeds only when it reaches a resolving token.
 */
@AutoValue
public abstract class Conflict {

  /** A short name for diagnostics and tests. */
  public abstract String name();

  /** The overlapping productions. All of them must be enabled in any grammar declaring this. */
  public abstract ImmutableSet<NodeKind> productions();

  /** The tokens at which the conflict is settled. Never empty in a valid grammar. */
  public abstract ImmutableSet<TokenKind> resolvingTokens();

  static Conflict create(
      String name, ImmutableSet<NodeKind> productions, ImmutableSet<TokenKind> resolvingTokens) {
    return new AutoValue_Conflict(name, productions, resolvingTokens);
  }

  /** Reports whether any production of this conflict belongs to the verification overlay. */
  public boolean isOverlay() {
    return productions().stream().anyMatch(NodeKind::isOverlay);
  }

  // A parameter is either "pattern: type" or, anonymously, just a type.
  static final Conflict ANONYMOUS_PARAMETER =
      create(
          "anonymous_parameter",
          ImmutableSet.of(NodeKind.PARAMETER, NodeKind.TYPE_IDENTIFIER, NodeKind.IDENTIFIER),
          ImmutableSet.of(TokenKind.COMMA, TokenKind.RPAREN));

  static final Conflict UNIT_TYPE_VS_TUPLE_PATTERN =
      create(
          "unit_type_vs_tuple_pattern",
          ImmutableSet.of(NodeKind.UNIT_TYPE, NodeKind.TUPLE_TYPE, NodeKind.TUPLE_PATTERN),
          ImmutableSet.of(TokenKind.COMMA, TokenKind.RPAREN));

  // a::B { ... } names a type; a::B and a::B(...) name a value.
  static final Conflict SCOPED_IDENTIFIER_VS_SCOPED_TYPE_IDENTIFIER =
      create(
          "scoped_identifier_vs_scoped_type_identifier",
          ImmutableSet.of(NodeKind.SCOPED_IDENTIFIER, NodeKind.SCOPED_TYPE_IDENTIFIER),
          ImmutableSet.of(TokenKind.LBRACE));

  // Closure parameters: |x: T| vs |x|.
  static final Conflict PARAMETERS_VS_PATTERN =
      create(
          "parameters_vs_pattern",
          ImmutableSet.of(NodeKind.CLOSURE_PARAMETERS, NodeKind.PARAMETER),
          ImmutableSet.of(TokenKind.COMMA, TokenKind.PIPE));

  // fn f(Some(x): Option<T>) vs fn f(Fn(A) -> B).
  static final Conflict PARAMETERS_VS_TUPLE_STRUCT_PATTERN =
      create(
          "parameters_vs_tuple_struct_pattern",
          ImmutableSet.of(NodeKind.PARAMETERS, NodeKind.TUPLE_STRUCT_PATTERN),
          ImmutableSet.of(TokenKind.COMMA, TokenKind.RPAREN));

  // [e; n] vs [e, ...], settled by the ';' after the first element.
  static final Conflict ARRAY_EXPRESSION =
      create(
          "array_expression",
          ImmutableSet.of(NodeKind.ARRAY_EXPRESSION),
          ImmutableSet.of(TokenKind.SEMI));

  // pub(crate) vs pub followed by a parenthesized tuple type.
  static final Conflict VISIBILITY_MODIFIER =
      create(
          "visibility_modifier",
          ImmutableSet.of(NodeKind.VISIBILITY_MODIFIER),
          ImmutableSet.of(TokenKind.RPAREN));

  // crate as a visibility vs crate::path.
  static final Conflict VISIBILITY_VS_SCOPED_PATH =
      create(
          "visibility_vs_scoped_path",
          ImmutableSet.of(
              NodeKind.VISIBILITY_MODIFIER,
              NodeKind.SCOPED_IDENTIFIER,
              NodeKind.SCOPED_TYPE_IDENTIFIER),
          ImmutableSet.of(TokenKind.COLON_COLON));

  // #[attr] at statement level is an attribute item; in expression position it belongs to the
  // expression that follows, as in #[trigger] f(x).
  static final Conflict STATEMENT_VS_CALL_EXPRESSION =
      create(
          "statement_vs_call_expression",
          ImmutableSet.of(
              NodeKind.EXPRESSION_STATEMENT, NodeKind.CALL_EXPRESSION, NodeKind.ATTRIBUTE_ITEM),
          ImmutableSet.of(TokenKind.POUND));

  // The expression list of a specification clause ends, possibly after a trailing comma, at the
  // body's '{' or at the ';' of a signature.
  static final Conflict REQUIRES_CLAUSE = clause("requires", NodeKind.REQUIRES_CLAUSE);
  static final Conflict ENSURES_CLAUSE = clause("ensures", NodeKind.ENSURES_CLAUSE);
  static final Conflict RECOMMENDS_CLAUSE = clause("recommends", NodeKind.RECOMMENDS_CLAUSE);
  static final Conflict DECREASES_CLAUSE = clause("decreases", NodeKind.DECREASES_CLAUSE);
  static final Conflict INVARIANT_CLAUSE = clause("invariant", NodeKind.INVARIANT_CLAUSE);
  static final Conflict INVARIANT_ENSURES_CLAUSE =
      clause("invariant_ensures", NodeKind.INVARIANT_ENSURES_CLAUSE);
  static final Conflict INVARIANT_EXCEPT_BREAK_CLAUSE =
      clause("invariant_except_break", NodeKind.INVARIANT_EXCEPT_BREAK_CLAUSE);

  // assert(e) vs assert(e) by ... { }, settled by the identifier 'by'.
  static final Conflict ASSERT_VS_ASSERT_BY =
      create(
          "assert_vs_assert_by",
          ImmutableSet.of(NodeKind.ASSERT_EXPRESSION, NodeKind.ASSERT_BY_BLOCK_EXPRESSION),
          ImmutableSet.of(TokenKind.IDENTIFIER));

  private static Conflict clause(String keyword, NodeKind kind) {
    return create(
        keyword + "_clause",
        ImmutableSet.of(kind),
        ImmutableSet.of(TokenKind.LBRACE, TokenKind.SEMI));
  }

  /** Returns every conflict the standard grammars may declare. */
  static ImmutableList<Conflict> standard() {
    return ImmutableList.of(
        ANONYMOUS_PARAMETER,
        UNIT_TYPE_VS_TUPLE_PATTERN,
        SCOPED_IDENTIFIER_VS_SCOPED_TYPE_IDENTIFIER,
        PARAMETERS_VS_PATTERN,
        PARAMETERS_VS_TUPLE_STRUCT_PATTERN,
        ARRAY_EXPRESSION,
        VISIBILITY_MODIFIER,
        VISIBILITY_VS_SCOPED_PATH,
        STATEMENT_VS_CALL_EXPRESSION,
        REQUIRES_CLAUSE,
        ENSURES_CLAUSE,
        RECOMMENDS_CLAUSE,
        DECREASES_CLAUSE,
        INVARIANT_CLAUSE,
        INVARIANT_ENSURES_CLAUSE,
        INVARIANT_EXCEPT_BREAK_CLAUSE,
        ASSERT_VS_ASSERT_BY);
  }
}
