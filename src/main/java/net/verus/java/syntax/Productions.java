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

import static net.verus.java.syntax.NodeKind.Category.DECLARATION_STATEMENT;
import static net.verus.java.syntax.NodeKind.Category.EXPRESSION;
import static net.verus.java.syntax.NodeKind.Category.LITERAL;
import static net.verus.java.syntax.NodeKind.Category.LITERAL_PATTERN;
import static net.verus.java.syntax.NodeKind.Category.PATTERN;
import static net.verus.java.syntax.NodeKind.Category.TYPE;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.EnumMap;
import java.util.Map;

/**
 * The production table: for each node kind, the symbols its children may be. A symbol is a node
 * kind or a supertype category; a category admits every kind that belongs to it. Anonymous
 * tokens and error nodes may appear anywhere and are not listed.
 */
final class Productions {

  /** A node kind or a supertype category, as it appears on the right side of a production. */
  interface Symbol {}

  private Productions() {}

  // Children that may stand where a simple path is expected.
  private static final Symbol[] SIMPLE_PATH = {
    NodeKind.IDENTIFIER,
    NodeKind.SCOPED_IDENTIFIER,
    NodeKind.SELF,
    NodeKind.SUPER,
    NodeKind.CRATE,
    NodeKind.METAVARIABLE,
  };

  // Results of the pattern parser beyond the PATTERN category.
  private static final Symbol[] PATTERN_LIKE = {
    PATTERN,
    NodeKind.SELF,
    NodeKind.SUPER,
    NodeKind.CRATE,
    NodeKind.METAVARIABLE,
    NodeKind.BRACKETED_TYPE,
    NodeKind.GENERIC_TYPE,
  };

  private static final Symbol[] STATEMENT = {
    DECLARATION_STATEMENT, NodeKind.EXPRESSION_STATEMENT, NodeKind.VERUS_BLOCK,
  };

  private static final Symbol[] LOOP_CLAUSES = {
    NodeKind.INVARIANT_CLAUSE,
    NodeKind.INVARIANT_ENSURES_CLAUSE,
    NodeKind.INVARIANT_EXCEPT_BREAK_CLAUSE,
    NodeKind.ENSURES_CLAUSE,
    NodeKind.DECREASES_CLAUSE,
  };

  private static final Symbol[] CONDITION = {
    EXPRESSION, NodeKind.LET_CONDITION, NodeKind.LET_CHAIN,
  };

  private static final Symbol[] TOKEN_TREE_LEAVES = {
    NodeKind.INTEGER_LITERAL,
    NodeKind.FLOAT_LITERAL,
    NodeKind.CHAR_LITERAL,
    NodeKind.BOOLEAN_LITERAL,
    NodeKind.STRING_LITERAL,
    NodeKind.RAW_STRING_LITERAL,
    NodeKind.IDENTIFIER,
    NodeKind.PRIMITIVE_TYPE,
    NodeKind.MUTABLE_SPECIFIER,
    NodeKind.SELF,
    NodeKind.SUPER,
    NodeKind.CRATE,
    NodeKind.METAVARIABLE,
  };

  private static final Symbol[] FUNCTION_PREFIX = {
    NodeKind.VISIBILITY_MODIFIER,
    NodeKind.PUBLISH,
    NodeKind.FUNCTION_MODIFIERS,
    NodeKind.FUNCTION_MODE,
  };

  private static final Symbol[] FUNCTION_SIGNATURE = {
    NodeKind.IDENTIFIER,
    NodeKind.METAVARIABLE,
    NodeKind.TYPE_PARAMETERS,
    NodeKind.PARAMETERS,
    NodeKind.RETURN_TYPE,
    NodeKind.WHERE_CLAUSE,
    NodeKind.PROVER,
    NodeKind.FN_QUALIFIER,
  };

  /** Returns the standard production table, with or without the verification overlay. */
  static ImmutableMap<NodeKind, ImmutableSet<Symbol>> standard(boolean overlay) {
    Table t = new Table(overlay);

    // Top level and statements
    t.add(NodeKind.SOURCE_FILE, STATEMENT).add(NodeKind.SOURCE_FILE, NodeKind.SHEBANG);
    t.add(NodeKind.SHEBANG);
    t.add(NodeKind.EXPRESSION_STATEMENT, EXPRESSION);
    t.add(NodeKind.EMPTY_STATEMENT);
    t.add(
        NodeKind.LET_DECLARATION,
        NodeKind.MUTABLE_SPECIFIER,
        TYPE,
        EXPRESSION,
        NodeKind.BLOCK);
    t.add(NodeKind.LET_DECLARATION, PATTERN_LIKE);
    t.add(NodeKind.ATTRIBUTE_ITEM, NodeKind.ATTRIBUTE);
    t.add(NodeKind.INNER_ATTRIBUTE_ITEM, NodeKind.ATTRIBUTE);
    t.add(NodeKind.ATTRIBUTE, EXPRESSION, NodeKind.SUPER, NodeKind.CRATE, NodeKind.TOKEN_TREE);

    // Macros and token trees
    t.add(NodeKind.MACRO_DEFINITION, NodeKind.IDENTIFIER, NodeKind.MACRO_RULE);
    t.add(NodeKind.MACRO_RULE, NodeKind.TOKEN_TREE_PATTERN, NodeKind.TOKEN_TREE);
    t.add(NodeKind.MACRO_INVOCATION, SIMPLE_PATH)
        .add(NodeKind.MACRO_INVOCATION, NodeKind.TOKEN_TREE, NodeKind.ATTRIBUTE_ITEM);
    t.add(NodeKind.TOKEN_TREE, TOKEN_TREE_LEAVES)
        .add(NodeKind.TOKEN_TREE, NodeKind.TOKEN_TREE, NodeKind.TOKEN_REPETITION);
    t.add(NodeKind.TOKEN_REPETITION, TOKEN_TREE_LEAVES)
        .add(NodeKind.TOKEN_REPETITION, NodeKind.TOKEN_TREE, NodeKind.TOKEN_REPETITION);
    t.add(NodeKind.TOKEN_TREE_PATTERN, TOKEN_TREE_LEAVES)
        .add(
            NodeKind.TOKEN_TREE_PATTERN,
            NodeKind.TOKEN_TREE_PATTERN,
            NodeKind.TOKEN_REPETITION_PATTERN,
            NodeKind.TOKEN_BINDING_PATTERN);
    t.add(NodeKind.TOKEN_REPETITION_PATTERN, TOKEN_TREE_LEAVES)
        .add(
            NodeKind.TOKEN_REPETITION_PATTERN,
            NodeKind.TOKEN_TREE_PATTERN,
            NodeKind.TOKEN_REPETITION_PATTERN,
            NodeKind.TOKEN_BINDING_PATTERN);
    t.add(NodeKind.TOKEN_BINDING_PATTERN, NodeKind.METAVARIABLE, NodeKind.FRAGMENT_SPECIFIER);
    t.add(NodeKind.FRAGMENT_SPECIFIER);
    t.add(NodeKind.METAVARIABLE);

    // Items
    t.add(
        NodeKind.MOD_ITEM,
        NodeKind.VISIBILITY_MODIFIER,
        NodeKind.IDENTIFIER,
        NodeKind.DECLARATION_LIST);
    t.add(
        NodeKind.FOREIGN_MOD_ITEM,
        NodeKind.VISIBILITY_MODIFIER,
        NodeKind.EXTERN_MODIFIER,
        NodeKind.DECLARATION_LIST);
    t.add(NodeKind.DECLARATION_LIST, DECLARATION_STATEMENT, NodeKind.VERUS_BLOCK);
    t.add(
        NodeKind.STRUCT_ITEM,
        NodeKind.VISIBILITY_MODIFIER,
        NodeKind.DATA_MODE,
        NodeKind.TYPE_IDENTIFIER,
        NodeKind.TYPE_PARAMETERS,
        NodeKind.WHERE_CLAUSE,
        NodeKind.FIELD_DECLARATION_LIST,
        NodeKind.ORDERED_FIELD_DECLARATION_LIST);
    t.add(
        NodeKind.UNION_ITEM,
        NodeKind.VISIBILITY_MODIFIER,
        NodeKind.DATA_MODE,
        NodeKind.TYPE_IDENTIFIER,
        NodeKind.TYPE_PARAMETERS,
        NodeKind.WHERE_CLAUSE,
        NodeKind.FIELD_DECLARATION_LIST);
    t.add(
        NodeKind.ENUM_ITEM,
        NodeKind.VISIBILITY_MODIFIER,
        NodeKind.DATA_MODE,
        NodeKind.TYPE_IDENTIFIER,
        NodeKind.TYPE_PARAMETERS,
        NodeKind.WHERE_CLAUSE,
        NodeKind.ENUM_VARIANT_LIST);
    t.add(NodeKind.ENUM_VARIANT_LIST, NodeKind.ATTRIBUTE_ITEM, NodeKind.ENUM_VARIANT);
    t.add(
        NodeKind.ENUM_VARIANT,
        NodeKind.VISIBILITY_MODIFIER,
        NodeKind.IDENTIFIER,
        NodeKind.FIELD_DECLARATION_LIST,
        NodeKind.ORDERED_FIELD_DECLARATION_LIST,
        EXPRESSION);
    t.add(NodeKind.FIELD_DECLARATION_LIST, NodeKind.ATTRIBUTE_ITEM, NodeKind.FIELD_DECLARATION);
    t.add(
        NodeKind.FIELD_DECLARATION,
        NodeKind.VISIBILITY_MODIFIER,
        NodeKind.DATA_MODE,
        NodeKind.FIELD_IDENTIFIER,
        TYPE);
    t.add(
        NodeKind.ORDERED_FIELD_DECLARATION_LIST,
        NodeKind.ATTRIBUTE_ITEM,
        NodeKind.VISIBILITY_MODIFIER,
        NodeKind.DATA_MODE,
        TYPE);
    t.add(
        NodeKind.EXTERN_CRATE_DECLARATION,
        NodeKind.VISIBILITY_MODIFIER,
        NodeKind.CRATE,
        NodeKind.IDENTIFIER,
        NodeKind.SELF);
    t.add(
        NodeKind.CONST_ITEM,
        NodeKind.VISIBILITY_MODIFIER,
        NodeKind.PUBLISH,
        NodeKind.FUNCTION_MODE,
        NodeKind.IDENTIFIER,
        TYPE,
        EXPRESSION,
        NodeKind.FN_QUALIFIER);
    t.add(
        NodeKind.STATIC_ITEM,
        NodeKind.VISIBILITY_MODIFIER,
        NodeKind.FUNCTION_MODE,
        NodeKind.MUTABLE_SPECIFIER,
        NodeKind.IDENTIFIER,
        TYPE,
        EXPRESSION,
        NodeKind.FN_QUALIFIER);
    t.add(
        NodeKind.TYPE_ITEM,
        NodeKind.VISIBILITY_MODIFIER,
        NodeKind.TYPE_IDENTIFIER,
        NodeKind.TYPE_PARAMETERS,
        NodeKind.WHERE_CLAUSE,
        TYPE);
    t.add(
        NodeKind.ASSOCIATED_TYPE,
        NodeKind.TYPE_IDENTIFIER,
        NodeKind.TYPE_PARAMETERS,
        NodeKind.TRAIT_BOUNDS,
        NodeKind.WHERE_CLAUSE);
    t.add(NodeKind.FUNCTION_ITEM, FUNCTION_PREFIX)
        .add(NodeKind.FUNCTION_ITEM, FUNCTION_SIGNATURE)
        .add(NodeKind.FUNCTION_ITEM, NodeKind.BLOCK);
    t.add(NodeKind.FUNCTION_SIGNATURE_ITEM, FUNCTION_PREFIX)
        .add(NodeKind.FUNCTION_SIGNATURE_ITEM, FUNCTION_SIGNATURE);
    t.add(NodeKind.FUNCTION_MODIFIERS, NodeKind.EXTERN_MODIFIER);
    t.add(NodeKind.EXTERN_MODIFIER, NodeKind.STRING_LITERAL, NodeKind.RAW_STRING_LITERAL);
    t.add(NodeKind.RETURN_TYPE, NodeKind.IDENTIFIER, TYPE);
    t.add(NodeKind.WHERE_CLAUSE, NodeKind.WHERE_PREDICATE);
    t.add(
        NodeKind.WHERE_PREDICATE,
        NodeKind.LIFETIME,
        NodeKind.HIGHER_RANKED_TRAIT_BOUND,
        TYPE,
        NodeKind.TRAIT_BOUNDS);
    t.add(
        NodeKind.IMPL_ITEM,
        NodeKind.TYPE_PARAMETERS,
        TYPE,
        NodeKind.WHERE_CLAUSE,
        NodeKind.DECLARATION_LIST);
    t.add(
        NodeKind.TRAIT_ITEM,
        NodeKind.VISIBILITY_MODIFIER,
        NodeKind.TYPE_IDENTIFIER,
        NodeKind.TYPE_PARAMETERS,
        NodeKind.TRAIT_BOUNDS,
        NodeKind.WHERE_CLAUSE,
        NodeKind.DECLARATION_LIST);
    t.add(
        NodeKind.TRAIT_BOUNDS, NodeKind.LIFETIME, NodeKind.HIGHER_RANKED_TRAIT_BOUND, TYPE);
    t.add(NodeKind.HIGHER_RANKED_TRAIT_BOUND, NodeKind.TYPE_PARAMETERS, TYPE);
    t.add(
        NodeKind.TYPE_PARAMETERS,
        NodeKind.ATTRIBUTE_ITEM,
        NodeKind.METAVARIABLE,
        NodeKind.LIFETIME_PARAMETER,
        NodeKind.CONST_PARAMETER,
        NodeKind.TYPE_PARAMETER);
    t.add(NodeKind.LIFETIME_PARAMETER, NodeKind.LIFETIME, NodeKind.TRAIT_BOUNDS);
    t.add(NodeKind.TYPE_PARAMETER, NodeKind.TYPE_IDENTIFIER, NodeKind.TRAIT_BOUNDS, TYPE);
    t.add(
        NodeKind.CONST_PARAMETER,
        NodeKind.IDENTIFIER,
        TYPE,
        NodeKind.BLOCK,
        NodeKind.NEGATIVE_LITERAL,
        LITERAL);
    t.add(NodeKind.USE_DECLARATION, SIMPLE_PATH)
        .add(
            NodeKind.USE_DECLARATION,
            NodeKind.VISIBILITY_MODIFIER,
            NodeKind.USE_LIST,
            NodeKind.SCOPED_USE_LIST,
            NodeKind.USE_AS_CLAUSE,
            NodeKind.USE_WILDCARD);
    t.add(NodeKind.SCOPED_USE_LIST, SIMPLE_PATH).add(NodeKind.SCOPED_USE_LIST, NodeKind.USE_LIST);
    t.add(NodeKind.USE_LIST, SIMPLE_PATH)
        .add(
            NodeKind.USE_LIST,
            NodeKind.USE_LIST,
            NodeKind.SCOPED_USE_LIST,
            NodeKind.USE_AS_CLAUSE,
            NodeKind.USE_WILDCARD);
    t.add(NodeKind.USE_AS_CLAUSE, SIMPLE_PATH);
    t.add(NodeKind.USE_WILDCARD, SIMPLE_PATH);
    t.add(
        NodeKind.PARAMETERS,
        NodeKind.ATTRIBUTE_ITEM,
        NodeKind.SELF_PARAMETER,
        NodeKind.VARIADIC_PARAMETER,
        NodeKind.PARAMETER,
        TYPE);
    t.add(
        NodeKind.SELF_PARAMETER, NodeKind.LIFETIME, NodeKind.MUTABLE_SPECIFIER, NodeKind.SELF);
    t.add(NodeKind.VARIADIC_PARAMETER, PATTERN_LIKE)
        .add(NodeKind.VARIADIC_PARAMETER, NodeKind.MUTABLE_SPECIFIER);
    t.add(NodeKind.PARAMETER, PATTERN_LIKE)
        .add(NodeKind.PARAMETER, NodeKind.MUTABLE_SPECIFIER, TYPE);
    t.add(NodeKind.VISIBILITY_MODIFIER, SIMPLE_PATH);

    // Types
    t.add(NodeKind.ABSTRACT_TYPE, NodeKind.TYPE_PARAMETERS, TYPE);
    t.add(NodeKind.ARRAY_TYPE, TYPE, EXPRESSION);
    t.add(NodeKind.BOUNDED_TYPE, TYPE, NodeKind.LIFETIME, NodeKind.USE_BOUNDS);
    t.add(NodeKind.BRACKETED_TYPE, TYPE, NodeKind.QUALIFIED_TYPE);
    t.add(
        NodeKind.DYNAMIC_TYPE, NodeKind.HIGHER_RANKED_TRAIT_BOUND, NodeKind.LIFETIME, TYPE);
    t.add(NodeKind.FOR_LIFETIMES, NodeKind.LIFETIME);
    t.add(
        NodeKind.FUNCTION_TYPE,
        NodeKind.FOR_LIFETIMES,
        NodeKind.FUNCTION_MODIFIERS,
        NodeKind.PARAMETERS,
        NodeKind.BRACKETED_TYPE,
        TYPE);
    t.add(NodeKind.GENERIC_TYPE, SIMPLE_PATH)
        .add(NodeKind.GENERIC_TYPE, TYPE, NodeKind.BRACKETED_TYPE, NodeKind.TYPE_ARGUMENTS);
    t.add(NodeKind.LIFETIME, NodeKind.IDENTIFIER);
    t.add(NodeKind.NEVER_TYPE);
    t.add(NodeKind.POINTER_TYPE, NodeKind.MUTABLE_SPECIFIER, TYPE);
    t.add(NodeKind.PRIMITIVE_TYPE);
    t.add(NodeKind.QUALIFIED_TYPE, TYPE);
    t.add(NodeKind.REFERENCE_TYPE, NodeKind.LIFETIME, NodeKind.MUTABLE_SPECIFIER, TYPE);
    t.add(NodeKind.REMOVED_TRAIT_BOUND, TYPE);
    t.add(NodeKind.SCOPED_TYPE_IDENTIFIER, SIMPLE_PATH)
        .add(
            NodeKind.SCOPED_TYPE_IDENTIFIER,
            NodeKind.GENERIC_TYPE,
            NodeKind.BRACKETED_TYPE,
            NodeKind.TYPE_IDENTIFIER);
    t.add(NodeKind.TUPLE_TYPE, TYPE);
    t.add(
        NodeKind.TYPE_ARGUMENTS,
        NodeKind.LIFETIME,
        NodeKind.BLOCK,
        LITERAL,
        NodeKind.NEGATIVE_LITERAL,
        NodeKind.TYPE_BINDING,
        TYPE,
        NodeKind.TRAIT_BOUNDS);
    t.add(NodeKind.TYPE_BINDING, NodeKind.TYPE_IDENTIFIER, TYPE);
    t.add(NodeKind.TYPE_IDENTIFIER);
    t.add(NodeKind.UNIT_TYPE);
    t.add(NodeKind.USE_BOUNDS, NodeKind.LIFETIME, NodeKind.TYPE_IDENTIFIER);
    t.add(NodeKind.MUTABLE_SPECIFIER);

    // Expressions
    t.add(NodeKind.ARGUMENTS, EXPRESSION);
    t.add(NodeKind.ARRAY_EXPRESSION, EXPRESSION);
    t.add(NodeKind.ASSIGNMENT_EXPRESSION, EXPRESSION);
    t.add(NodeKind.ASYNC_BLOCK, NodeKind.BLOCK);
    t.add(NodeKind.AWAIT_EXPRESSION, EXPRESSION);
    t.add(NodeKind.BASE_FIELD_INITIALIZER, EXPRESSION);
    t.add(NodeKind.BINARY_EXPRESSION, EXPRESSION);
    t.add(NodeKind.BLOCK, STATEMENT)
        .add(
            NodeKind.BLOCK,
            NodeKind.LABEL,
            EXPRESSION,
            NodeKind.BIG_AND_EXPRESSION,
            NodeKind.BIG_OR_EXPRESSION);
    t.add(NodeKind.BREAK_EXPRESSION, NodeKind.LABEL, EXPRESSION);
    t.add(NodeKind.CALL_EXPRESSION, EXPRESSION, NodeKind.ARGUMENTS, NodeKind.ATTRIBUTE_ITEM);
    t.add(
        NodeKind.CLOSURE_EXPRESSION,
        NodeKind.TYPE_PARAMETERS,
        NodeKind.CLOSURE_PARAMETERS,
        NodeKind.RETURN_TYPE,
        NodeKind.FN_QUALIFIER,
        EXPRESSION);
    t.add(NodeKind.CLOSURE_PARAMETERS, PATTERN_LIKE)
        .add(NodeKind.CLOSURE_PARAMETERS, NodeKind.ATTRIBUTE_ITEM, NodeKind.PARAMETER);
    t.add(NodeKind.COMPOUND_ASSIGNMENT_EXPR, EXPRESSION);
    t.add(NodeKind.CONST_BLOCK, NodeKind.BLOCK);
    t.add(NodeKind.CONTINUE_EXPRESSION, NodeKind.LABEL);
    t.add(NodeKind.ELSE_CLAUSE, NodeKind.BLOCK, NodeKind.IF_EXPRESSION);
    t.add(
        NodeKind.FIELD_EXPRESSION,
        EXPRESSION,
        NodeKind.FIELD_IDENTIFIER,
        NodeKind.ATTRIBUTE_ITEM);
    t.add(NodeKind.FIELD_IDENTIFIER);
    t.add(NodeKind.FIELD_INITIALIZER, NodeKind.FIELD_IDENTIFIER, EXPRESSION);
    t.add(
        NodeKind.FIELD_INITIALIZER_LIST,
        NodeKind.ATTRIBUTE_ITEM,
        NodeKind.BASE_FIELD_INITIALIZER,
        NodeKind.FIELD_INITIALIZER,
        NodeKind.SHORTHAND_FIELD_INITIALIZER);
    t.add(NodeKind.FOR_EXPRESSION, PATTERN_LIKE)
        .add(NodeKind.FOR_EXPRESSION, LOOP_CLAUSES)
        .add(NodeKind.FOR_EXPRESSION, NodeKind.LABEL, EXPRESSION);
    t.add(NodeKind.GEN_BLOCK, NodeKind.BLOCK);
    t.add(NodeKind.GENERIC_FUNCTION, SIMPLE_PATH)
        .add(
            NodeKind.GENERIC_FUNCTION,
            EXPRESSION,
            NodeKind.BRACKETED_TYPE,
            NodeKind.TYPE_ARGUMENTS);
    t.add(NodeKind.IF_EXPRESSION, CONDITION)
        .add(NodeKind.IF_EXPRESSION, NodeKind.BLOCK, NodeKind.ELSE_CLAUSE);
    t.add(NodeKind.INDEX_EXPRESSION, EXPRESSION, NodeKind.ATTRIBUTE_ITEM);
    t.add(NodeKind.LABEL, NodeKind.IDENTIFIER);
    t.add(NodeKind.LET_CHAIN, EXPRESSION, NodeKind.LET_CONDITION);
    t.add(NodeKind.LET_CONDITION, PATTERN_LIKE).add(NodeKind.LET_CONDITION, EXPRESSION);
    t.add(NodeKind.LOOP_EXPRESSION, LOOP_CLAUSES)
        .add(NodeKind.LOOP_EXPRESSION, NodeKind.LABEL, NodeKind.BLOCK);
    t.add(NodeKind.MATCH_ARM, NodeKind.ATTRIBUTE_ITEM, NodeKind.MATCH_PATTERN, EXPRESSION);
    t.add(NodeKind.MATCH_BLOCK, NodeKind.MATCH_ARM);
    t.add(NodeKind.MATCH_EXPRESSION, EXPRESSION, NodeKind.MATCH_BLOCK);
    t.add(NodeKind.MATCH_PATTERN, PATTERN_LIKE).add(NodeKind.MATCH_PATTERN, CONDITION);
    t.add(NodeKind.PARENTHESIZED_EXPRESSION, EXPRESSION);
    t.add(NodeKind.RANGE_EXPRESSION, EXPRESSION);
    t.add(NodeKind.REFERENCE_EXPRESSION, NodeKind.MUTABLE_SPECIFIER, EXPRESSION);
    t.add(NodeKind.RETURN_EXPRESSION, EXPRESSION);
    t.add(NodeKind.SCOPED_IDENTIFIER, SIMPLE_PATH)
        .add(NodeKind.SCOPED_IDENTIFIER, NodeKind.GENERIC_TYPE, NodeKind.BRACKETED_TYPE);
    t.add(NodeKind.SHORTHAND_FIELD_INITIALIZER, NodeKind.IDENTIFIER);
    t.add(NodeKind.STRUCT_EXPRESSION, TYPE, NodeKind.FIELD_INITIALIZER_LIST);
    t.add(NodeKind.TRY_BLOCK, NodeKind.BLOCK);
    t.add(NodeKind.TRY_EXPRESSION, EXPRESSION);
    t.add(NodeKind.TUPLE_EXPRESSION, EXPRESSION);
    t.add(NodeKind.TYPE_CAST_EXPRESSION, EXPRESSION, TYPE);
    t.add(NodeKind.UNARY_EXPRESSION, EXPRESSION);
    t.add(NodeKind.UNIT_EXPRESSION);
    t.add(NodeKind.UNSAFE_BLOCK, NodeKind.BLOCK);
    t.add(NodeKind.WHILE_EXPRESSION, CONDITION)
        .add(NodeKind.WHILE_EXPRESSION, LOOP_CLAUSES)
        .add(NodeKind.WHILE_EXPRESSION, NodeKind.LABEL, NodeKind.BLOCK);
    t.add(NodeKind.YIELD_EXPRESSION, EXPRESSION);

    // Patterns
    t.add(NodeKind.CAPTURED_PATTERN, PATTERN_LIKE);
    t.add(NodeKind.FIELD_PATTERN, PATTERN_LIKE)
        .add(
            NodeKind.FIELD_PATTERN,
            NodeKind.MUTABLE_SPECIFIER,
            NodeKind.FIELD_IDENTIFIER,
            NodeKind.SHORTHAND_FIELD_IDENTIFIER);
    t.add(NodeKind.GENERIC_PATTERN, SIMPLE_PATH)
        .add(NodeKind.GENERIC_PATTERN, NodeKind.TYPE_ARGUMENTS);
    t.add(NodeKind.MUT_PATTERN, PATTERN_LIKE).add(NodeKind.MUT_PATTERN, NodeKind.MUTABLE_SPECIFIER);
    t.add(NodeKind.OR_PATTERN, PATTERN_LIKE);
    t.add(NodeKind.RANGE_PATTERN, PATTERN_LIKE)
        .add(NodeKind.RANGE_PATTERN, LITERAL_PATTERN, NodeKind.GENERIC_FUNCTION);
    t.add(NodeKind.REF_PATTERN, PATTERN_LIKE);
    t.add(NodeKind.REFERENCE_PATTERN, PATTERN_LIKE)
        .add(NodeKind.REFERENCE_PATTERN, NodeKind.MUTABLE_SPECIFIER);
    t.add(NodeKind.REMAINING_FIELD_PATTERN);
    t.add(NodeKind.SHORTHAND_FIELD_IDENTIFIER);
    t.add(NodeKind.SLICE_PATTERN, PATTERN_LIKE);
    t.add(NodeKind.STRUCT_PATTERN, PATTERN_LIKE)
        .add(
            NodeKind.STRUCT_PATTERN,
            TYPE,
            NodeKind.ATTRIBUTE_ITEM,
            NodeKind.FIELD_PATTERN,
            NodeKind.REMAINING_FIELD_PATTERN);
    t.add(NodeKind.TUPLE_PATTERN, PATTERN_LIKE);
    t.add(NodeKind.TUPLE_STRUCT_PATTERN, PATTERN_LIKE);
    t.add(NodeKind.WILDCARD_PATTERN);

    // Literals and leaves
    t.add(NodeKind.BOOLEAN_LITERAL);
    t.add(NodeKind.CHAR_LITERAL);
    t.add(NodeKind.FLOAT_LITERAL);
    t.add(NodeKind.INTEGER_LITERAL);
    t.add(NodeKind.NEGATIVE_LITERAL, NodeKind.INTEGER_LITERAL, NodeKind.FLOAT_LITERAL);
    t.add(NodeKind.RAW_STRING_LITERAL, NodeKind.STRING_CONTENT);
    t.add(NodeKind.STRING_LITERAL, NodeKind.STRING_CONTENT, NodeKind.ESCAPE_SEQUENCE);
    t.add(NodeKind.STRING_CONTENT);
    t.add(NodeKind.ESCAPE_SEQUENCE);
    t.add(NodeKind.IDENTIFIER);
    t.add(NodeKind.SELF);
    t.add(NodeKind.SUPER);
    t.add(NodeKind.CRATE);

    // Verification overlay
    t.add(NodeKind.VERUS_BLOCK, STATEMENT)
        .add(
            NodeKind.VERUS_BLOCK,
            EXPRESSION,
            NodeKind.BIG_AND_EXPRESSION,
            NodeKind.BIG_OR_EXPRESSION);
    t.add(
        NodeKind.BROADCAST_GROUP,
        NodeKind.VISIBILITY_MODIFIER,
        NodeKind.IDENTIFIER,
        NodeKind.BROADCAST_GROUP_LIST);
    t.add(NodeKind.BROADCAST_GROUP_LIST, SIMPLE_PATH)
        .add(NodeKind.BROADCAST_GROUP_LIST, NodeKind.ATTRIBUTE_ITEM);
    t.add(NodeKind.BROADCAST_USE, SIMPLE_PATH);
    t.add(NodeKind.GLOBAL_ITEM, NodeKind.GLOBAL_SIZEOF, NodeKind.GLOBAL_LAYOUT);
    t.add(NodeKind.GLOBAL_SIZEOF, TYPE, EXPRESSION);
    t.add(NodeKind.GLOBAL_LAYOUT, TYPE, NodeKind.IDENTIFIER, LITERAL);
    t.add(NodeKind.ASSUME_SPECIFICATION_ITEM, SIMPLE_PATH)
        .add(
            NodeKind.ASSUME_SPECIFICATION_ITEM,
            NodeKind.VISIBILITY_MODIFIER,
            NodeKind.TYPE_PARAMETERS,
            EXPRESSION,
            NodeKind.BRACKETED_TYPE,
            NodeKind.PARAMETERS,
            NodeKind.RETURN_TYPE,
            NodeKind.WHERE_CLAUSE,
            NodeKind.FN_QUALIFIER);
    t.add(NodeKind.FUNCTION_MODE);
    t.add(NodeKind.PUBLISH);
    t.add(NodeKind.DATA_MODE);
    t.add(
        NodeKind.FN_QUALIFIER,
        NodeKind.REQUIRES_CLAUSE,
        NodeKind.RECOMMENDS_CLAUSE,
        NodeKind.ENSURES_CLAUSE,
        NodeKind.RETURNS_CLAUSE,
        NodeKind.DECREASES_CLAUSE,
        NodeKind.OPENS_INVARIANTS_CLAUSE,
        NodeKind.NO_UNWIND_CLAUSE);
    for (NodeKind clause :
        new NodeKind[] {
          NodeKind.REQUIRES_CLAUSE,
          NodeKind.ENSURES_CLAUSE,
          NodeKind.RETURNS_CLAUSE,
          NodeKind.RECOMMENDS_CLAUSE,
          NodeKind.DECREASES_CLAUSE,
          NodeKind.INVARIANT_CLAUSE,
          NodeKind.INVARIANT_ENSURES_CLAUSE,
          NodeKind.INVARIANT_EXCEPT_BREAK_CLAUSE,
          NodeKind.OPENS_INVARIANTS_CLAUSE,
          NodeKind.NO_UNWIND_CLAUSE,
        }) {
      t.add(clause, EXPRESSION);
    }
    t.add(NodeKind.PROVER, NodeKind.IDENTIFIER);
    t.add(NodeKind.PROOF_BLOCK, NodeKind.LABEL, NodeKind.BLOCK);
    t.add(NodeKind.BIG_AND_EXPRESSION, EXPRESSION);
    t.add(NodeKind.BIG_OR_EXPRESSION, EXPRESSION);
    t.add(NodeKind.IS_EXPRESSION, EXPRESSION);
    t.add(NodeKind.MATCHES_EXPRESSION, NodeKind.MATCHES_EXPRESSION_WITHOUT_BODY, EXPRESSION);
    t.add(NodeKind.MATCHES_EXPRESSION_WITHOUT_BODY, PATTERN_LIKE)
        .add(NodeKind.MATCHES_EXPRESSION_WITHOUT_BODY, EXPRESSION);
    t.add(NodeKind.VIEW_EXPRESSION, EXPRESSION);
    t.add(NodeKind.ASSERT_EXPRESSION, EXPRESSION);
    t.add(NodeKind.ASSUME_EXPRESSION, EXPRESSION);
    t.add(
        NodeKind.ASSERT_BY_BLOCK_EXPRESSION,
        EXPRESSION,
        NodeKind.PROVER,
        NodeKind.REQUIRES_CLAUSE);
    t.add(NodeKind.ASSERT_FORALL_EXPRESSION, EXPRESSION);
    t.add(
        NodeKind.QUANTIFIER_EXPRESSION,
        NodeKind.CLOSURE_PARAMETERS,
        NodeKind.INNER_ATTRIBUTE_ITEM,
        TYPE,
        EXPRESSION);

    return t.build();
  }

  /** Accumulates productions, leaving out overlay symbols when the overlay is off. */
  private static final class Table {
    private final boolean overlay;
    private final Map<NodeKind, ImmutableSet.Builder<Symbol>> rules = new EnumMap<>(NodeKind.class);

    Table(boolean overlay) {
      this.overlay = overlay;
    }

    @CanIgnoreReturnValue
    Table add(NodeKind kind, Symbol... symbols) {
      if (!overlay && kind.isOverlay()) {
        return this;
      }
      ImmutableSet.Builder<Symbol> rhs = rules.computeIfAbsent(kind, k -> ImmutableSet.builder());
      for (Symbol s : symbols) {
        if (overlay || !(s instanceof NodeKind) || !((NodeKind) s).isOverlay()) {
          rhs.add(s);
        }
      }
      return this;
    }

    ImmutableMap<NodeKind, ImmutableSet<Symbol>> build() {
      ImmutableMap.Builder<NodeKind, ImmutableSet<Symbol>> result = ImmutableMap.builder();
      for (Map.Entry<NodeKind, ImmutableSet.Builder<Symbol>> e : rules.entrySet()) {
        result.put(e.getKey(), e.getValue().build());
      }
      return result.buildOrThrow();
    }
  }
}
