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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableSet;
import java.util.EnumSet;

/**
 * A NodeKind identifies the production that built a {@link SyntaxNode}. Its name is the lower-case
 * form of the constant, e.g. {@code binary_expression}.
 *
 * <p>Each kind may belong to one or more supertype {@link Category categories}. A kind that belongs
 * to a category may appear anywhere that category may.
 */
public enum NodeKind implements Productions.Symbol {
  // ==== Top level and statements ====
  SOURCE_FILE,
  SHEBANG,
  EXPRESSION_STATEMENT,
  EMPTY_STATEMENT(Category.DECLARATION_STATEMENT),
  LET_DECLARATION(Category.DECLARATION_STATEMENT),
  ATTRIBUTE_ITEM(Category.DECLARATION_STATEMENT),
  INNER_ATTRIBUTE_ITEM(Category.DECLARATION_STATEMENT),
  ATTRIBUTE,

  // ==== Macros and token trees ====
  MACRO_DEFINITION(Category.DECLARATION_STATEMENT),
  MACRO_RULE,
  MACRO_INVOCATION(
      Category.DECLARATION_STATEMENT, Category.EXPRESSION, Category.TYPE, Category.PATTERN),
  TOKEN_TREE,
  TOKEN_REPETITION,
  TOKEN_TREE_PATTERN,
  TOKEN_BINDING_PATTERN,
  TOKEN_REPETITION_PATTERN,
  FRAGMENT_SPECIFIER,
  METAVARIABLE(Category.EXPRESSION, Category.TYPE),

  // ==== Items ====
  MOD_ITEM(Category.DECLARATION_STATEMENT),
  FOREIGN_MOD_ITEM(Category.DECLARATION_STATEMENT),
  DECLARATION_LIST,
  STRUCT_ITEM(Category.DECLARATION_STATEMENT),
  UNION_ITEM(Category.DECLARATION_STATEMENT),
  ENUM_ITEM(Category.DECLARATION_STATEMENT),
  ENUM_VARIANT_LIST,
  ENUM_VARIANT,
  FIELD_DECLARATION_LIST,
  FIELD_DECLARATION,
  ORDERED_FIELD_DECLARATION_LIST,
  EXTERN_CRATE_DECLARATION(Category.DECLARATION_STATEMENT),
  CONST_ITEM(Category.DECLARATION_STATEMENT),
  STATIC_ITEM(Category.DECLARATION_STATEMENT),
  TYPE_ITEM(Category.DECLARATION_STATEMENT),
  FUNCTION_ITEM(Category.DECLARATION_STATEMENT),
  FUNCTION_SIGNATURE_ITEM(Category.DECLARATION_STATEMENT),
  FUNCTION_MODIFIERS,
  EXTERN_MODIFIER,
  RETURN_TYPE,
  WHERE_CLAUSE,
  WHERE_PREDICATE,
  IMPL_ITEM(Category.DECLARATION_STATEMENT),
  TRAIT_ITEM(Category.DECLARATION_STATEMENT),
  ASSOCIATED_TYPE(Category.DECLARATION_STATEMENT),
  TRAIT_BOUNDS,
  HIGHER_RANKED_TRAIT_BOUND,
  TYPE_PARAMETERS,
  CONST_PARAMETER,
  TYPE_PARAMETER,
  LIFETIME_PARAMETER,
  USE_DECLARATION(Category.DECLARATION_STATEMENT),
  SCOPED_USE_LIST,
  USE_LIST,
  USE_AS_CLAUSE,
  USE_WILDCARD,
  PARAMETERS,
  SELF_PARAMETER,
  VARIADIC_PARAMETER,
  PARAMETER,
  VISIBILITY_MODIFIER,

  // ==== Types ====
  ABSTRACT_TYPE(Category.TYPE),
  ARRAY_TYPE(Category.TYPE),
  BOUNDED_TYPE(Category.TYPE),
  BRACKETED_TYPE,
  DYNAMIC_TYPE(Category.TYPE),
  FOR_LIFETIMES,
  FUNCTION_TYPE(Category.TYPE),
  GENERIC_TYPE(Category.TYPE),
  LIFETIME,
  NEVER_TYPE(Category.TYPE),
  POINTER_TYPE(Category.TYPE),
  PRIMITIVE_TYPE(Category.TYPE),
  QUALIFIED_TYPE,
  REFERENCE_TYPE(Category.TYPE),
  REMOVED_TRAIT_BOUND(Category.TYPE),
  SCOPED_TYPE_IDENTIFIER(Category.TYPE),
  TUPLE_TYPE(Category.TYPE),
  TYPE_ARGUMENTS,
  TYPE_BINDING,
  TYPE_IDENTIFIER(Category.TYPE),
  UNIT_TYPE(Category.TYPE),
  USE_BOUNDS,
  MUTABLE_SPECIFIER,

  // ==== Expressions ====
  ARGUMENTS,
  ARRAY_EXPRESSION(Category.EXPRESSION),
  ASSIGNMENT_EXPRESSION(Category.EXPRESSION),
  ASYNC_BLOCK(Category.EXPRESSION),
  AWAIT_EXPRESSION(Category.EXPRESSION),
  BASE_FIELD_INITIALIZER,
  BINARY_EXPRESSION(Category.EXPRESSION),
  BLOCK(Category.EXPRESSION),
  BREAK_EXPRESSION(Category.EXPRESSION),
  CALL_EXPRESSION(Category.EXPRESSION),
  CLOSURE_EXPRESSION(Category.EXPRESSION),
  CLOSURE_PARAMETERS,
  COMPOUND_ASSIGNMENT_EXPR(Category.EXPRESSION),
  CONST_BLOCK(Category.EXPRESSION, Category.PATTERN),
  CONTINUE_EXPRESSION(Category.EXPRESSION),
  ELSE_CLAUSE,
  FIELD_EXPRESSION(Category.EXPRESSION),
  FIELD_IDENTIFIER,
  FIELD_INITIALIZER,
  FIELD_INITIALIZER_LIST,
  FOR_EXPRESSION(Category.EXPRESSION),
  GEN_BLOCK(Category.EXPRESSION),
  GENERIC_FUNCTION(Category.EXPRESSION),
  IF_EXPRESSION(Category.EXPRESSION),
  INDEX_EXPRESSION(Category.EXPRESSION),
  LABEL,
  LET_CHAIN,
  LET_CONDITION,
  LOOP_EXPRESSION(Category.EXPRESSION),
  MATCH_ARM,
  MATCH_BLOCK,
  MATCH_EXPRESSION(Category.EXPRESSION),
  MATCH_PATTERN,
  PARENTHESIZED_EXPRESSION(Category.EXPRESSION),
  RANGE_EXPRESSION(Category.EXPRESSION),
  REFERENCE_EXPRESSION(Category.EXPRESSION),
  RETURN_EXPRESSION(Category.EXPRESSION),
  SCOPED_IDENTIFIER(Category.EXPRESSION, Category.PATTERN),
  SHORTHAND_FIELD_INITIALIZER,
  STRUCT_EXPRESSION(Category.EXPRESSION),
  TRY_BLOCK(Category.EXPRESSION),
  TRY_EXPRESSION(Category.EXPRESSION),
  TUPLE_EXPRESSION(Category.EXPRESSION),
  TYPE_CAST_EXPRESSION(Category.EXPRESSION),
  UNARY_EXPRESSION(Category.EXPRESSION),
  UNIT_EXPRESSION(Category.EXPRESSION),
  UNSAFE_BLOCK(Category.EXPRESSION),
  WHILE_EXPRESSION(Category.EXPRESSION),
  YIELD_EXPRESSION(Category.EXPRESSION),

  // ==== Patterns ====
  CAPTURED_PATTERN(Category.PATTERN),
  FIELD_PATTERN,
  GENERIC_PATTERN(Category.PATTERN),
  MUT_PATTERN(Category.PATTERN),
  OR_PATTERN(Category.PATTERN),
  RANGE_PATTERN(Category.PATTERN),
  REF_PATTERN(Category.PATTERN),
  REFERENCE_PATTERN(Category.PATTERN),
  REMAINING_FIELD_PATTERN(Category.PATTERN),
  SHORTHAND_FIELD_IDENTIFIER,
  SLICE_PATTERN(Category.PATTERN),
  STRUCT_PATTERN(Category.PATTERN),
  TUPLE_PATTERN(Category.PATTERN),
  TUPLE_STRUCT_PATTERN(Category.PATTERN),
  WILDCARD_PATTERN(Category.PATTERN),

  // ==== Literals and leaves ====
  BOOLEAN_LITERAL(
      Category.LITERAL, Category.LITERAL_PATTERN, Category.EXPRESSION, Category.PATTERN),
  CHAR_LITERAL(Category.LITERAL, Category.LITERAL_PATTERN, Category.EXPRESSION, Category.PATTERN),
  FLOAT_LITERAL(
      Category.LITERAL, Category.LITERAL_PATTERN, Category.EXPRESSION, Category.PATTERN),
  INTEGER_LITERAL(
      Category.LITERAL, Category.LITERAL_PATTERN, Category.EXPRESSION, Category.PATTERN),
  NEGATIVE_LITERAL(Category.LITERAL_PATTERN, Category.PATTERN),
  RAW_STRING_LITERAL(
      Category.LITERAL, Category.LITERAL_PATTERN, Category.EXPRESSION, Category.PATTERN),
  STRING_LITERAL(
      Category.LITERAL, Category.LITERAL_PATTERN, Category.EXPRESSION, Category.PATTERN),
  STRING_CONTENT,
  ESCAPE_SEQUENCE,
  IDENTIFIER(Category.EXPRESSION, Category.PATTERN),
  SELF(Category.EXPRESSION),
  SUPER,
  CRATE,

  // ==== Verification overlay ====
  VERUS_BLOCK(true),
  BROADCAST_GROUP(true, Category.DECLARATION_STATEMENT),
  BROADCAST_GROUP_LIST(true),
  BROADCAST_USE(true, Category.DECLARATION_STATEMENT),
  GLOBAL_ITEM(true, Category.DECLARATION_STATEMENT),
  GLOBAL_SIZEOF(true),
  GLOBAL_LAYOUT(true),
  ASSUME_SPECIFICATION_ITEM(true, Category.DECLARATION_STATEMENT),
  FUNCTION_MODE(true),
  PUBLISH(true),
  DATA_MODE(true),
  FN_QUALIFIER(true),
  REQUIRES_CLAUSE(true),
  ENSURES_CLAUSE(true),
  RETURNS_CLAUSE(true),
  RECOMMENDS_CLAUSE(true),
  DECREASES_CLAUSE(true),
  INVARIANT_CLAUSE(true),
  INVARIANT_ENSURES_CLAUSE(true),
  INVARIANT_EXCEPT_BREAK_CLAUSE(true),
  OPENS_INVARIANTS_CLAUSE(true),
  NO_UNWIND_CLAUSE(true),
  PROVER(true),
  PROOF_BLOCK(true, Category.EXPRESSION),
  BIG_AND_EXPRESSION(true),
  BIG_OR_EXPRESSION(true),
  IS_EXPRESSION(true, Category.EXPRESSION),
  MATCHES_EXPRESSION(true, Category.EXPRESSION),
  MATCHES_EXPRESSION_WITHOUT_BODY(true, Category.EXPRESSION),
  VIEW_EXPRESSION(true, Category.EXPRESSION),
  ASSERT_EXPRESSION(true, Category.EXPRESSION),
  ASSUME_EXPRESSION(true, Category.EXPRESSION),
  ASSERT_BY_BLOCK_EXPRESSION(true, Category.EXPRESSION),
  ASSERT_FORALL_EXPRESSION(true, Category.EXPRESSION),
  QUANTIFIER_EXPRESSION(true, Category.EXPRESSION),

  // ==== Special ====

  /** A run of tokens skipped during error recovery. */
  ERROR,

  /** An anonymous token: a keyword, operator or punctuation leaf. */
  TOKEN;

  /**
   * A supertype category. Every member kind must be a valid substitute anywhere the category is
   * referenced.
   */
  public enum Category implements Productions.Symbol {
    EXPRESSION,
    TYPE,
    LITERAL,
    LITERAL_PATTERN,
    PATTERN,
    DECLARATION_STATEMENT;

    /** Returns the lower-case name of the category, e.g. {@code expression}. */
    public String getName() {
      return Ascii.toLowerCase(name());
    }
  }

  private final String name;
  private final boolean overlay;
  private final ImmutableSet<Category> categories;

  NodeKind(Category... categories) {
    this(false, categories);
  }

  NodeKind(boolean overlay, Category... categories) {
    this.name = Ascii.toLowerCase(name());
    this.overlay = overlay;
    EnumSet<Category> set = EnumSet.noneOf(Category.class);
    for (Category c : categories) {
      set.add(c);
    }
    this.categories = ImmutableSet.copyOf(set);
  }

  /** Returns the production name, e.g. {@code function_item}. */
  public String getName() {
    return name;
  }

  /** Reports whether this kind belongs to the verification overlay. */
  public boolean isOverlay() {
    return overlay;
  }

  /** Reports whether nodes of this kind are named, that is, not anonymous tokens. */
  public boolean isNamed() {
    return this != TOKEN;
  }

  /** Returns the supertype categories this kind belongs to. */
  public ImmutableSet<Category> categories() {
    return categories;
  }

  /** Reports whether this kind belongs to the given category. */
  public boolean is(Category category) {
    return categories.contains(category);
  }

  @Override
  public String toString() {
    return name;
  }
}
