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

import static com.google.common.truth.Truth.assertThat;
import static net.verus.java.syntax.TestUtils.assertContainsError;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.Iterables;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests of parser. */
@RunWith(TestParameterInjector.class)
public final class ParserTest {

  private FileOptions options = FileOptions.DEFAULT;

  private void setVerus() {
    options = FileOptions.VERUS;
  }

  // Joins the lines, parses them as an expression, and returns the tree.
  private SyntaxNode parseExpression(String... lines) throws SyntaxError.Exception {
    return SourceFile.parseExpression(ParserInput.fromLines(lines), options);
  }

  // Parses the input as an expression and returns the first error it reports.
  private String parseExpressionError(String src) {
    SyntaxError.Exception ex =
        assertThrows(SyntaxError.Exception.class, () -> parseExpression(src));
    return ex.errors().get(0).toString();
  }

  // Parses a file that must be free of errors.
  private SourceFile parseFile(String... lines) {
    SourceFile file = TestUtils.parse(options, lines);
    if (!file.ok()) {
      throw new AssertionError("unexpected errors: " + file.errors());
    }
    return file;
  }

  // Parses a file that consists of exactly one statement.
  private SyntaxNode parseStatement(String... lines) {
    return Iterables.getOnlyElement(parseFile(lines).getStatements());
  }

  private static String tree(SyntaxNode node) {
    return node.toString();
  }

  @Test
  public void testPrecedence() throws Exception {
    assertThat(tree(parseExpression("1+2*3")))
        .isEqualTo(
            "(binary_expression left: (integer_literal \"1\") operator: \"+\" right:"
                + " (binary_expression left: (integer_literal \"2\") operator: \"*\" right:"
                + " (integer_literal \"3\")))");
  }

  @Test
  public void testLeftAssociativity() throws Exception {
    SyntaxNode e = parseExpression("a - b - c");
    assertThat(e.kind()).isEqualTo(NodeKind.BINARY_EXPRESSION);
    assertThat(e.getField("left").kind()).isEqualTo(NodeKind.BINARY_EXPRESSION);
    assertThat(e.getField("right").getText()).isEqualTo("c");
  }

  @Test
  public void testParenthesesOverridePrecedence() throws Exception {
    SyntaxNode e = parseExpression("(1 + 2) * 3");
    assertThat(e.getField("operator").getText()).isEqualTo("*");
    assertThat(e.getField("left").kind()).isEqualTo(NodeKind.PARENTHESIZED_EXPRESSION);
  }

  @Test
  public void testComparisonChainGroupsLeft() throws Exception {
    assertThat(tree(parseExpression("0 <= i < n")))
        .isEqualTo(
            "(binary_expression left: (binary_expression left: (integer_literal \"0\") operator:"
                + " \"<=\" right: (identifier \"i\")) operator: \"<\" right: (identifier \"n\"))");

    SyntaxNode eq = parseExpression("a == b != c");
    assertThat(eq.getField("operator").getText()).isEqualTo("!=");
    assertThat(eq.getField("left").getField("operator").getText()).isEqualTo("==");
  }

  @Test
  public void testRangeChainGroupsLeft() throws Exception {
    SyntaxNode e = parseExpression("a..b..c");
    assertThat(e.kind()).isEqualTo(NodeKind.RANGE_EXPRESSION);
    SyntaxNode inner = e.getNamedChildren().get(0);
    assertThat(inner.kind()).isEqualTo(NodeKind.RANGE_EXPRESSION);
    assertThat(inner.getNamedChildren().get(0).getText()).isEqualTo("a");
    assertThat(inner.getNamedChildren().get(1).getText()).isEqualTo("b");
    assertThat(e.getNamedChildren().get(1).getText()).isEqualTo("c");
  }

  @Test
  public void testShiftIsGluedFromGreaterTokens() throws Exception {
    SyntaxNode e = parseExpression("a >> b");
    assertThat(e.kind()).isEqualTo(NodeKind.BINARY_EXPRESSION);
    assertThat(e.getField("operator").getText()).isEqualTo(">>");
  }

  @Test
  public void testSeparatedGreaterIsNotShift() {
    assertThat(parseExpressionError("a > > b")).contains("syntax error at '>'");
  }

  @Test
  public void testAssignmentIsRightAssociative() throws Exception {
    SyntaxNode e = parseExpression("a = b = c");
    assertThat(e.kind()).isEqualTo(NodeKind.ASSIGNMENT_EXPRESSION);
    assertThat(e.getField("left").getText()).isEqualTo("a");
    assertThat(e.getField("right").kind()).isEqualTo(NodeKind.ASSIGNMENT_EXPRESSION);
  }

  @Test
  public void testCompoundAssignment() throws Exception {
    SyntaxNode e = parseExpression("a += 1");
    assertThat(e.kind()).isEqualTo(NodeKind.COMPOUND_ASSIGNMENT_EXPR);
    assertThat(e.getField("operator").getText()).isEqualTo("+=");
  }

  @Test
  public void testUnaryAndReference() throws Exception {
    SyntaxNode neg = parseExpression("-x * y");
    assertThat(neg.kind()).isEqualTo(NodeKind.BINARY_EXPRESSION);
    assertThat(neg.getField("left").kind()).isEqualTo(NodeKind.UNARY_EXPRESSION);

    SyntaxNode ref = parseExpression("&&x");
    assertThat(ref.kind()).isEqualTo(NodeKind.REFERENCE_EXPRESSION);
    SyntaxNode inner = ref.getField("value");
    assertThat(inner.kind()).isEqualTo(NodeKind.REFERENCE_EXPRESSION);
    assertThat(inner.getField("value").getText()).isEqualTo("x");
  }

  @Test
  public void testPostfixChain() throws Exception {
    assertThat(tree(parseExpression("a.b()?")))
        .isEqualTo(
            "(try_expression (call_expression function: (field_expression value: (identifier"
                + " \"a\") field: (field_identifier \"b\")) arguments: (arguments)))");
  }

  @Test
  public void testTupleFieldAndIndex() throws Exception {
    SyntaxNode field = parseExpression("t.0");
    assertThat(field.kind()).isEqualTo(NodeKind.FIELD_EXPRESSION);
    assertThat(field.getField("field").kind()).isEqualTo(NodeKind.INTEGER_LITERAL);

    assertThat(parseExpression("v[i + 1]").kind()).isEqualTo(NodeKind.INDEX_EXPRESSION);
  }

  @Test
  public void testCast() throws Exception {
    SyntaxNode e = parseExpression("x as u8 + 1");
    assertThat(e.kind()).isEqualTo(NodeKind.BINARY_EXPRESSION);
    SyntaxNode cast = e.getField("left");
    assertThat(cast.kind()).isEqualTo(NodeKind.TYPE_CAST_EXPRESSION);
    assertThat(tree(cast.getField("type"))).isEqualTo("(primitive_type \"u8\")");
  }

  @Test
  public void testRange() throws Exception {
    assertThat(parseExpression("0..n").kind()).isEqualTo(NodeKind.RANGE_EXPRESSION);
    assertThat(parseExpression("..").kind()).isEqualTo(NodeKind.RANGE_EXPRESSION);
  }

  @Test
  public void testStructExpression() throws Exception {
    SyntaxNode e = parseExpression("Point { x: 1, y, ..base }");
    assertThat(e.kind()).isEqualTo(NodeKind.STRUCT_EXPRESSION);
    assertThat(tree(e.getField("name"))).isEqualTo("(type_identifier \"Point\")");
    List<NodeKind> kinds = new ArrayList<>();
    for (SyntaxNode child : e.getField("body").getNamedChildren()) {
      kinds.add(child.kind());
    }
    assertThat(kinds)
        .containsExactly(
            NodeKind.FIELD_INITIALIZER,
            NodeKind.SHORTHAND_FIELD_INITIALIZER,
            NodeKind.BASE_FIELD_INITIALIZER)
        .inOrder();
  }

  @Test
  public void testNoStructLiteralInCondition() throws Exception {
    SyntaxNode e = parseExpression("if a { b } else { c }");
    assertThat(e.kind()).isEqualTo(NodeKind.IF_EXPRESSION);
    assertThat(tree(e.getField("condition"))).isEqualTo("(identifier \"a\")");
    assertThat(e.getField("alternative").kind()).isEqualTo(NodeKind.ELSE_CLAUSE);
  }

  @Test
  public void testLetChain() throws Exception {
    SyntaxNode e = parseExpression("if let Some(x) = y && x > 0 { x } else { 0 }");
    SyntaxNode condition = e.getField("condition");
    assertThat(condition.kind()).isEqualTo(NodeKind.LET_CHAIN);
    assertThat(condition.getNamedChildren().get(0).kind()).isEqualTo(NodeKind.LET_CONDITION);
    assertThat(condition.getNamedChildren().get(1).kind())
        .isEqualTo(NodeKind.BINARY_EXPRESSION);
  }

  @Test
  public void testMatch() throws Exception {
    SyntaxNode e =
        parseExpression(
            "match x {", //
            "  Some(y) if y > 0 => y,",
            "  _ => 0,",
            "}");
    assertThat(e.kind()).isEqualTo(NodeKind.MATCH_EXPRESSION);
    List<SyntaxNode> arms = e.getField("body").getNamedChildren();
    assertThat(arms).hasSize(2);
    assertThat(arms.get(0).kind()).isEqualTo(NodeKind.MATCH_ARM);
    assertThat(arms.get(0).getField("pattern").getField("condition")).isNotNull();
  }

  @Test
  public void testClosure() throws Exception {
    SyntaxNode e = parseExpression("|x, y: u32| x + y");
    assertThat(e.kind()).isEqualTo(NodeKind.CLOSURE_EXPRESSION);
    List<SyntaxNode> params = e.getField("parameters").getNamedChildren();
    assertThat(params.get(0).kind()).isEqualTo(NodeKind.IDENTIFIER);
    assertThat(params.get(1).kind()).isEqualTo(NodeKind.PARAMETER);
    assertThat(e.getField("body").kind()).isEqualTo(NodeKind.BINARY_EXPRESSION);
  }

  @Test
  public void testMacroInvocationArguments() throws Exception {
    assertThat(tree(parseExpression("foo!(a, 1)")))
        .isEqualTo(
            "(macro_invocation macro: (identifier \"foo\") (token_tree (identifier \"a\")"
                + " (integer_literal \"1\")))");
  }

  @Test
  public void testMacroDefinition() {
    SyntaxNode def = parseStatement("macro_rules! m { ($x:expr) => { $x + 1 }; }");
    assertThat(tree(def))
        .isEqualTo(
            "(macro_definition name: (identifier \"m\") (macro_rule left: (token_tree_pattern"
                + " (token_binding_pattern name: (metavariable \"$x\") type: (fragment_specifier"
                + " \"expr\"))) right: (token_tree (metavariable \"$x\") (integer_literal"
                + " \"1\"))))");
  }

  @Test
  public void testUnknownFragmentSpecifier() {
    SourceFile file = TestUtils.parse(options, "macro_rules! m { ($x:bogus) => {}; }");
    assertContainsError(file.errors(), "unknown macro fragment specifier 'bogus'");
  }

  @Test
  public void testFragmentSpecifiers() {
    assertThat(FragmentKind.fromName("pat_param")).isEqualTo(FragmentKind.PAT_PARAM);
    assertThat(FragmentKind.fromName("EXPR")).isNull();
    SyntaxNode def =
        parseStatement("macro_rules! m { ($($i:ident),* ; $t:tt) => { $($i)+* }; }");
    assertThat(def.kind()).isEqualTo(NodeKind.MACRO_DEFINITION);
  }

  @Test
  public void testMissingRepetitionOperator() {
    SourceFile file = TestUtils.parse(options, "macro_rules! m { ($($i:ident)) => {}; }");
    assertContainsError(file.errors(), "expected repetition operator '*', '+' or '?'");
  }

  @Test
  public void testMismatchedDelimiter() {
    SourceFile file = TestUtils.parse(options, "foo!(a];");
    SyntaxError error =
        assertContainsError(
            file.errors(), ":1:5: mismatched delimiter: '(' opened here is closed by ']'");
    assertThat(error.kind()).isEqualTo(SyntaxError.Kind.DELIMITER_MISMATCH);
  }

  @Test
  public void testUnclosedDelimiter() {
    SourceFile file = TestUtils.parse(options, "foo!(a, [b)");
    assertContainsError(file.errors(), "mismatched delimiter: '[' opened here is closed by ')'");

    file = TestUtils.parse(options, "foo!{ a");
    SyntaxError error = assertContainsError(file.errors(), ":1:5: unclosed delimiter '{'");
    assertThat(error.kind()).isEqualTo(SyntaxError.Kind.DELIMITER_MISMATCH);
  }

  @Test
  public void testBraceMacroNeedsNoSemicolon() {
    SyntaxNode stmt = parseStatement("thread_local! { static X: u8 = 1; }");
    assertThat(stmt.kind()).isEqualTo(NodeKind.MACRO_INVOCATION);
  }

  @Test
  public void testExpressionNotAllowedAfterExpression() {
    assertThat(parseExpressionError("1 2"))
        .isEqualTo("<input>:1:3: syntax error at '2': expected end of input");
  }

  @Test
  public void testTopLevelExpressionNeedsSemicolon() {
    SourceFile file = TestUtils.parse(options, "1+2");
    assertContainsError(file.errors(), "syntax error at 'EOF': expected ';'");
  }

  @Test
  public void testUnexpectedCloseBrace() {
    SourceFile file = TestUtils.parse(options, "}");
    assertContainsError(file.errors(), "unexpected '}'");
  }

  @Test
  public void testErrorRecoveryContinuesAtNextStatement() {
    SourceFile file = TestUtils.parse(options, "let x = ;", "let y = 1;");
    assertThat(file.errors()).hasSize(1);
    assertThat(file.getStatements()).hasSize(2);
    assertThat(file.getStatements().get(1).hasError()).isFalse();
    assertThat(file.getRoot().hasError()).isTrue();
  }

  @Test
  public void testErrorRecoverySkipsToSemicolon() {
    SourceFile file = TestUtils.parse(options, "let x = 1 2 3;", "fn f() {}");
    assertContainsError(file.errors(), "syntax error at '2': expected ';'");
    assertThat(file.errors()).hasSize(1);
    assertThat(Iterables.getLast(file.getStatements()).kind()).isEqualTo(NodeKind.FUNCTION_ITEM);
  }

  @Test
  public void testReportedErrorsAreCapped() {
    String[] lines = new String[7];
    for (int i = 0; i < lines.length; i++) {
      lines[i] = "1 2;";
    }
    SourceFile file = TestUtils.parse(options, lines);
    assertThat(file.errors()).hasSize(5);
  }

  @Test
  public void testTreeCoversWholeInputDespiteErrors() {
    String src = "fn f( { }\nstruct S;";
    SourceFile file = TestUtils.parse(options, src);
    assertThat(file.ok()).isFalse();
    assertThat(file.getRoot().getStartOffset()).isEqualTo(0);
    assertThat(file.getRoot().getEndOffset()).isEqualTo(src.length());
  }

  @Test
  public void testLetDeclaration() {
    SyntaxNode let = parseStatement("let v: Vec<Vec<u8>> = make() else { return };");
    assertThat(let.kind()).isEqualTo(NodeKind.LET_DECLARATION);
    assertThat(let.getField("pattern").getText()).isEqualTo("v");
    assertThat(let.getField("type").kind()).isEqualTo(NodeKind.GENERIC_TYPE);
    assertThat(let.getField("value").kind()).isEqualTo(NodeKind.CALL_EXPRESSION);
    assertThat(let.getField("alternative").kind()).isEqualTo(NodeKind.BLOCK);
  }

  @Test
  public void testFunctionItem() {
    SyntaxNode fn = parseStatement("pub fn add<T>(a: T, b: T) -> T where T: Copy { a }");
    assertThat(fn.kind()).isEqualTo(NodeKind.FUNCTION_ITEM);
    assertThat(fn.getField("name").getText()).isEqualTo("add");
    assertThat(fn.getChild(NodeKind.VISIBILITY_MODIFIER)).isNotNull();
    assertThat(fn.getChild(NodeKind.WHERE_CLAUSE)).isNotNull();
    assertThat(fn.getField("parameters").getNamedChildren()).hasSize(2);
    assertThat(fn.getField("body").kind()).isEqualTo(NodeKind.BLOCK);
  }

  @Test
  public void testFunctionSignature() {
    SyntaxNode fn = parseStatement("trait T { fn f(&self) -> u8; }");
    SyntaxNode body = fn.getField("body");
    assertThat(body.getNamedChildren().get(0).kind())
        .isEqualTo(NodeKind.FUNCTION_SIGNATURE_ITEM);
  }

  @Test
  public void testItems() {
    SourceFile file =
        parseFile(
            "use std::collections::{HashMap, HashSet as Set};",
            "mod inner;",
            "struct Point { x: i32, pub y: i32 }",
            "struct Pair(u8, u8);",
            "enum E { A, B(u8), C { x: u8 } = 3 }",
            "type Alias = Vec<u8>;",
            "const N: usize = 4;",
            "static mut COUNT: u32 = 0;",
            "impl<T> Trait for Wrapper<T> { fn get(&self) -> &T { &self.0 } }",
            "extern crate alloc;");
    List<NodeKind> kinds = new ArrayList<>();
    for (SyntaxNode stmt : file.getStatements()) {
      kinds.add(stmt.kind());
    }
    assertThat(kinds)
        .containsExactly(
            NodeKind.USE_DECLARATION,
            NodeKind.MOD_ITEM,
            NodeKind.STRUCT_ITEM,
            NodeKind.STRUCT_ITEM,
            NodeKind.ENUM_ITEM,
            NodeKind.TYPE_ITEM,
            NodeKind.CONST_ITEM,
            NodeKind.STATIC_ITEM,
            NodeKind.IMPL_ITEM,
            NodeKind.EXTERN_CRATE_DECLARATION)
        .inOrder();
  }

  @Test
  public void testAttributes() {
    SourceFile file = parseFile("#![allow(dead_code)]", "#[derive(Debug)]", "struct S;");
    assertThat(file.getStatements().get(0).kind()).isEqualTo(NodeKind.INNER_ATTRIBUTE_ITEM);
    assertThat(file.getStatements().get(1).kind()).isEqualTo(NodeKind.ATTRIBUTE_ITEM);
  }

  @Test
  public void testContextualBaseKeywords() {
    SourceFile file = parseFile("union U { a: u8 }", "let union = 1;");
    assertThat(file.getStatements().get(0).kind()).isEqualTo(NodeKind.UNION_ITEM);
    assertThat(file.getStatements().get(1).kind()).isEqualTo(NodeKind.LET_DECLARATION);
  }

  @Test
  public void testShebang() {
    SourceFile file = parseFile("#!/usr/bin/env run", "fn main() {}");
    assertThat(file.getRoot().getNamedChildren().get(0).kind()).isEqualTo(NodeKind.SHEBANG);
  }

  // ==== Verification overlay ====

  @Test
  public void testImplication() throws Exception {
    setVerus();
    assertThat(tree(parseExpression("x ==> y && z")))
        .isEqualTo(
            "(binary_expression left: (identifier \"x\") operator: \"==>\" right:"
                + " (binary_expression left: (identifier \"y\") operator: \"&&\" right:"
                + " (identifier \"z\")))");
  }

  @Test
  public void testImplicationIsRightAssociative() throws Exception {
    setVerus();
    SyntaxNode e = parseExpression("a ==> b ==> c");
    assertThat(e.getField("left").getText()).isEqualTo("a");
    assertThat(e.getField("right").kind()).isEqualTo(NodeKind.BINARY_EXPRESSION);
  }

  @Test
  public void testImplicationWithoutOverlay() {
    assertThat(parseExpressionError("x ==> y && z"))
        .isEqualTo("<input>:1:5: syntax error at '>': expected expression");
  }

  @Test
  public void testEquivalence() throws Exception {
    setVerus();
    SyntaxNode e = parseExpression("a <==> b || c");
    assertThat(e.getField("operator").getText()).isEqualTo("<==>");
    assertThat(e.getField("right").getField("operator").getText()).isEqualTo("||");
  }

  @Test
  public void testIsAndMatches() throws Exception {
    setVerus();
    SyntaxNode is = parseExpression("x is Some");
    assertThat(is.kind()).isEqualTo(NodeKind.IS_EXPRESSION);
    assertThat(is.getField("variant").getText()).isEqualTo("Some");

    SyntaxNode bare = parseExpression("x matches Some(_)");
    assertThat(bare.kind()).isEqualTo(NodeKind.MATCHES_EXPRESSION_WITHOUT_BODY);

    SyntaxNode body = parseExpression("x matches Some(y) ==> y > 0");
    assertThat(body.kind()).isEqualTo(NodeKind.MATCHES_EXPRESSION);
    assertThat(body.getField("matches").kind())
        .isEqualTo(NodeKind.MATCHES_EXPRESSION_WITHOUT_BODY);
    assertThat(body.getField("body").kind()).isEqualTo(NodeKind.BINARY_EXPRESSION);
  }

  @Test
  public void testViewExpression() throws Exception {
    setVerus();
    SyntaxNode e = parseExpression("v@.len()");
    assertThat(e.kind()).isEqualTo(NodeKind.CALL_EXPRESSION);
    SyntaxNode field = e.getField("function");
    assertThat(field.getField("value").kind()).isEqualTo(NodeKind.VIEW_EXPRESSION);
  }

  @Test
  public void testQuantifier() throws Exception {
    setVerus();
    SyntaxNode e = parseExpression("forall|i: int| 0 <= i ==> f(i)");
    assertThat(e.kind()).isEqualTo(NodeKind.QUANTIFIER_EXPRESSION);
    assertThat(e.getChild(NodeKind.CLOSURE_PARAMETERS)).isNotNull();
    assertThat(e.getField("body").getField("operator").getText()).isEqualTo("==>");
  }

  @Test
  public void testQuantifierOverBoundedRange() throws Exception {
    setVerus();
    SyntaxNode e = parseExpression("forall|i: int| 0 <= i < n ==> a[i] === b[i]");
    SyntaxNode implies = e.getField("body");
    assertThat(implies.getField("operator").getText()).isEqualTo("==>");
    SyntaxNode bounds = implies.getField("left");
    assertThat(bounds.getField("operator").getText()).isEqualTo("<");
    assertThat(bounds.getField("left").getField("operator").getText()).isEqualTo("<=");
    assertThat(implies.getField("right").getField("operator").getText()).isEqualTo("===");
  }

  @Test
  public void testOverlayComparisonChainGroupsLeft() throws Exception {
    setVerus();
    SyntaxNode e = parseExpression("a === b =~= c");
    assertThat(e.getField("operator").getText()).isEqualTo("=~=");
    assertThat(e.getField("left").getField("operator").getText()).isEqualTo("===");
  }

  @Test
  public void testBigConnectives() {
    setVerus();
    SyntaxNode fn =
        parseStatement(
            "spec fn p(a: bool, b: bool, c: bool, d: bool) -> bool {", //
            "  &&& a",
            "  &&& b || c",
            "  &&& f(c &&&d)",
            "}");
    SyntaxNode conj = Iterables.getOnlyElement(fn.getField("body").getNamedChildren());
    assertThat(conj.kind()).isEqualTo(NodeKind.BIG_AND_EXPRESSION);
    List<SyntaxNode> operands = conj.getNamedChildren();
    assertThat(operands).hasSize(3);
    assertThat(operands.get(0).getText()).isEqualTo("a");
    assertThat(operands.get(1).getField("operator").getText()).isEqualTo("||");
    assertThat(conj.getChildren().get(0).getText()).isEqualTo("&&&");

    // Inside the call's parentheses '&&&' is '&&' applied to a reference.
    SyntaxNode arg = operands.get(2).getField("arguments").getNamedChildren().get(0);
    assertThat(arg.getField("operator").getText()).isEqualTo("&&");
    assertThat(arg.getField("right").kind()).isEqualTo(NodeKind.REFERENCE_EXPRESSION);
  }

  @Test
  public void testBigOr() {
    setVerus();
    SyntaxNode fn = parseStatement("spec fn p(a: bool, b: bool) -> bool { ||| a ||| b }");
    SyntaxNode disj = Iterables.getOnlyElement(fn.getField("body").getNamedChildren());
    assertThat(disj.kind()).isEqualTo(NodeKind.BIG_OR_EXPRESSION);
    assertThat(disj.getNamedChildren()).hasSize(2);
  }

  @Test
  public void testMixedBigConnectives() {
    setVerus();
    SourceFile file = TestUtils.parse(options, "spec fn p() -> bool { &&& a ||| b }");
    assertContainsError(file.errors(), "'&&&' and '|||' cannot be mixed without braces");
  }

  @Test
  public void testOverlayWordsAreIdentifiersWithoutOverlay() {
    SourceFile file = parseFile("let forall = requires + ensures;");
    SyntaxNode let = Iterables.getOnlyElement(file.getStatements());
    assertThat(let.getField("pattern").getText()).isEqualTo("forall");
  }

  @Test
  public void testSpecFunction() {
    setVerus();
    SyntaxNode fn =
        parseStatement(
            "proof fn lemma(x: nat)", //
            "    requires x > 0,",
            "    ensures x >= 1,",
            "{",
            "}");
    assertThat(fn.kind()).isEqualTo(NodeKind.FUNCTION_ITEM);
    assertThat(fn.getChild(NodeKind.FUNCTION_MODE)).isNotNull();
    SyntaxNode qualifier = fn.getChild(NodeKind.FN_QUALIFIER);
    assertThat(qualifier).isNotNull();
    assertThat(qualifier.getNamedChildren().get(0).kind()).isEqualTo(NodeKind.REQUIRES_CLAUSE);
    assertThat(qualifier.getNamedChildren().get(1).kind()).isEqualTo(NodeKind.ENSURES_CLAUSE);
  }

  @Test
  public void testRequiresWithoutOverlay() {
    SourceFile file = TestUtils.parse(options, "fn f() requires true {}");
    assertContainsError(file.errors(), "syntax error at 'requires': expected ';'");
  }

  @Test
  public void testAssertBy() {
    setVerus();
    SyntaxNode fn =
        parseStatement(
            "proof fn p() {", //
            "  assert(x) by { lemma(); }",
            "  assert(y);",
            "}");
    List<SyntaxNode> body = fn.getField("body").getNamedChildren();
    assertThat(body.get(0).kind()).isEqualTo(NodeKind.EXPRESSION_STATEMENT);
    assertThat(body.get(0).getNamedChildren().get(0).kind())
        .isEqualTo(NodeKind.ASSERT_BY_BLOCK_EXPRESSION);
    assertThat(body.get(1).getNamedChildren().get(0).kind())
        .isEqualTo(NodeKind.ASSERT_EXPRESSION);
  }

  @Test
  public void testVerusBlock(@TestParameter boolean overlay) {
    options = FileOptions.builder().allowVerusSyntax(overlay).build();
    SyntaxNode stmt = parseStatement("verus! { fn f() {} }");
    assertThat(stmt.kind())
        .isEqualTo(overlay ? NodeKind.VERUS_BLOCK : NodeKind.MACRO_INVOCATION);
  }

  @Test
  public void testBaseProgramParsesTheSameInBothDialects(
      @TestParameter({
            "fn main() { let mut v = Vec::new(); for i in 0..10 { v.push(i * 2); } }",
            "fn main() { if let Some(x) = v.first() { println!(\"{}\", x); } }",
            "fn main() { while v.len() > 1 { v.pop(); } }",
            "fn f() { let b = a &&&c; }",
            "fn f() { let g = a |||b| b; }",
            "fn f() { x.y(|a| a &&&b); }",
            "fn f() -> bool { a &&&b }",
            "fn f() { let r = &&&x; let c = |||x| x; }",
            "fn f() { if 0 <= i < n && (a..b..c) == r { g(x >= y, z >> 1) } }",
          })
          String program) {
    SyntaxNode base = parseFile(program).getRoot();
    setVerus();
    SyntaxNode verus = parseFile(program).getRoot();
    assertThat(verus).isEqualTo(base);
  }
}
