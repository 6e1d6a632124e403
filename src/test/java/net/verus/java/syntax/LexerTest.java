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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of tokenization behavior of the {@link Lexer}. */
@RunWith(JUnit4.class)
public class LexerTest {

  private final List<SyntaxError> errors = new ArrayList<>();

  // Reassign in test case to inject non-default options to the Lexer.
  // Doesn't leak between test cases since each case is its own instance.
  private FileOptions options = FileOptions.DEFAULT;

  /**
   * Create a lexer which takes input from the specified string. Resets the error handler
   * beforehand. Uses the current state of {@link #options}.
   */
  private Lexer createLexer(String input) {
    ParserInput inputSource = ParserInput.fromString(input, "");
    errors.clear();
    return new Lexer(inputSource, options, errors);
  }

  // One token as seen through the lexer's public fields.
  private static class Scanned {
    TokenKind kind;
    int start;
    int end;
    String text;
    Object value;

    @Override
    public String toString() {
      switch (kind) {
        case IDENTIFIER:
        case ILLEGAL:
          return value.toString();
        case INT:
        case FLOAT:
        case CHAR:
        case STRING:
        case RAW_STRING:
          return text;
        default:
          return null;
      }
    }
  }

  private ArrayList<Scanned> allTokens(Lexer lexer) {
    ArrayList<Scanned> result = new ArrayList<>();
    do {
      lexer.nextToken();
      Scanned tok = new Scanned();
      tok.kind = lexer.kind;
      tok.start = lexer.start;
      tok.end = lexer.end;
      tok.text = lexer.bufferSlice(lexer.start, lexer.end);
      tok.value = lexer.value;
      result.add(tok);
    } while (lexer.kind != TokenKind.EOF);
    return result;
  }

  private Scanned[] tokens(String input) {
    ArrayList<Scanned> result = allTokens(createLexer(input));
    return result.toArray(new Scanned[0]);
  }

  /**
   * Returns a string containing the names of the tokens and their associated values. Literals are
   * shown by their source text.
   */
  private static String values(Scanned[] tokens) {
    StringBuilder buffer = new StringBuilder();
    for (Scanned token : tokens) {
      if (buffer.length() > 0) {
        buffer.append(' ');
      }
      buffer.append(token.kind.name());
      String value = token.toString();
      if (value != null) {
        buffer.append('(').append(value).append(')');
      }
    }
    return buffer.toString();
  }

  // Scans src, and asserts that the tokens match wantTokens
  // and that there are no errors.
  private void check(String src, String wantTokens) {
    assertThat(values(tokens(src))).isEqualTo(wantTokens);
    assertThat(errors).isEmpty();
  }

  // Scans src, and asserts that the tokens match wantTokens
  // and the errors match wantErrors.
  // Errors are formatted with a caret ^ under the errant column.
  private void checkErrors(String src, String wantTokens, String... wantErrors) {
    assertThat(values(tokens(src))).isEqualTo(wantTokens);

    List<String> gotErrors = new ArrayList<>();
    for (SyntaxError err : errors) {
      String msg = spaces(err.location().column() - 1) + "^ " + err.message();
      if (err.location().line() != 1) {
        msg = String.format("%s (line %d)", msg, err.location().line());
      }
      gotErrors.add(msg);
    }
    assertThat(gotErrors).isEqualTo(Arrays.asList(wantErrors));
  }

  private static String spaces(int n) {
    return new String(new char[n]).replace('\0', ' ');
  }

  /**
   * Returns a string containing just the half-open position intervals of each token. e.g. "[3,4)
   * [4,9)".
   */
  private static String positions(Scanned[] tokens) {
    StringBuilder buf = new StringBuilder();
    for (Scanned tok : tokens) {
      if (buf.length() > 0) {
        buf.append(' ');
      }
      buf.append('[').append(tok.start).append(',').append(tok.end).append(')');
    }
    return buf.toString();
  }

  @Test
  public void testBasics() throws Exception {
    check("", "EOF");
    check("  \t\n ", "EOF");
    check(
        "fn main() { x }",
        "FN IDENTIFIER(main) LPAREN RPAREN LBRACE IDENTIFIER(x) RBRACE EOF");
    check(
        "let mut v: Vec<u8> = vec![];",
        "LET MUT IDENTIFIER(v) COLON IDENTIFIER(Vec) LESS IDENTIFIER(u8) GREATER EQUALS"
            + " IDENTIFIER(vec) BANG LBRACKET RBRACKET SEMI EOF");
    check(
        "a::b->c=>d",
        "IDENTIFIER(a) COLON_COLON IDENTIFIER(b) RARROW IDENTIFIER(c) FAT_ARROW IDENTIFIER(d) EOF");
  }

  @Test
  public void testPositions() throws Exception {
    assertThat(positions(tokens("ab  cd"))).isEqualTo("[0,2) [4,6) [6,6)");
    assertThat(positions(tokens("x+=1"))).isEqualTo("[0,1) [1,3) [3,4) [4,4)");
  }

  @Test
  public void testKeywordsAndRawIdentifiers() throws Exception {
    check("match r#match r#fn", "MATCH IDENTIFIER(r#match) IDENTIFIER(r#fn) EOF");
    // Contextual words are identifiers to the lexer, with or without the overlay.
    check(
        "union default requires",
        "IDENTIFIER(union) IDENTIFIER(default) IDENTIFIER(requires) EOF");
    options = FileOptions.VERUS;
    check("spec fn ensures", "IDENTIFIER(spec) FN IDENTIFIER(ensures) EOF");
  }

  @Test
  public void testIntegers() throws Exception {
    check(
        "1 0x1F 0o17 0b101 1_000u32 7usize",
        "INT(1) INT(0x1F) INT(0o17) INT(0b101) INT(1_000u32) INT(7usize) EOF");
    checkErrors("0x", "INT(0x) EOF", "^ invalid integer literal: no digits after base prefix");
    checkErrors("1u7", "INT(1u7) EOF", " ^ invalid suffix 'u7' for number literal");
  }

  @Test
  public void testDigitOutsideBase() throws Exception {
    checkErrors("0b102", "INT(0b102) EOF", "    ^ invalid digit '2' for a base 2 literal");
    checkErrors("0o8", "INT(0o8) EOF", "  ^ invalid digit '8' for a base 8 literal");
    checkErrors("0b19_9", "INT(0b19_9) EOF", "   ^ invalid digit '9' for a base 2 literal");
  }

  @Test
  public void testOverlayIntegerSuffixes() throws Exception {
    checkErrors("3int", "INT(3int) EOF", " ^ invalid suffix 'int' for number literal");
    options = FileOptions.VERUS;
    check("3int 4nat", "INT(3int) INT(4nat) EOF");
  }

  @Test
  public void testFloats() throws Exception {
    check(
        "2.5 1e10 1E-3 2.5f32 1.",
        "FLOAT(2.5) FLOAT(1e10) FLOAT(1E-3) FLOAT(2.5f32) FLOAT(1.) EOF");
    checkErrors("2.5u8", "FLOAT(2.5u8) EOF", "   ^ invalid suffix 'u8' for number literal");
  }

  @Test
  public void testNumberBeforeDotIsNotAlwaysFloat() throws Exception {
    // A range.
    check("1..2", "INT(1) DOT_DOT INT(2) EOF");
    // A method call on an integer.
    check("1.foo()", "INT(1) DOT IDENTIFIER(foo) LPAREN RPAREN EOF");
    // Tuple indices: the lexer must not read "0.1" as a float.
    check("x.0.1", "IDENTIFIER(x) DOT INT(0) DOT INT(1) EOF");
  }

  @Test
  public void testStrings() throws Exception {
    check("\"abc\" b\"x\" c\"y\"", "STRING(\"abc\") STRING(b\"x\") STRING(c\"y\") EOF");
    check("\"a\\\"b\"", "STRING(\"a\\\"b\") EOF");
    check("\"multi\nline\"", "STRING(\"multi\nline\") EOF");
    checkErrors("\"abc", "STRING(\"abc) EOF", "^ unclosed string literal");
    checkErrors(
        "\"\\x4\"",
        "STRING(\"\\x4\") EOF",
        " ^ invalid escape sequence: expected two hex digits after \\x");
    checkErrors("\"\\u{}\"", "STRING(\"\\u{}\") EOF", " ^ invalid unicode escape sequence");
  }

  @Test
  public void testStringSegments() throws Exception {
    Lexer lexer = createLexer("\"a\\tbc\"");
    lexer.nextToken();
    assertThat(lexer.kind).isEqualTo(TokenKind.STRING);
    List<String> segments = new ArrayList<>();
    for (Object o : (ImmutableList<?>) lexer.value) {
      Lexer.StringSegment s = (Lexer.StringSegment) o;
      segments.add((s.escape ? "escape:" : "text:") + lexer.bufferSlice(s.start, s.end));
    }
    assertThat(segments).containsExactly("text:a", "escape:\\t", "text:bc").inOrder();
  }

  @Test
  public void testRawStrings() throws Exception {
    check("r\"a\\b\"", "RAW_STRING(r\"a\\b\") EOF");
    check("br\"x\" cr#\"y\"#", "RAW_STRING(br\"x\") RAW_STRING(cr#\"y\"#) EOF");
    check("r##\"a\"#b\"##", "RAW_STRING(r##\"a\"#b\"##) EOF");
  }

  @Test
  public void testRawStringContentSkipsShorterFences() throws Exception {
    Lexer lexer = createLexer("r##\"a\"#b\"## x");
    lexer.nextToken();
    assertThat(lexer.kind).isEqualTo(TokenKind.RAW_STRING);
    Lexer.StringSegment content = (Lexer.StringSegment) lexer.value;
    assertThat(lexer.bufferSlice(content.start, content.end)).isEqualTo("a\"#b");
    lexer.nextToken();
    assertThat(lexer.kind).isEqualTo(TokenKind.IDENTIFIER);
  }

  @Test
  public void testRawStringNeedsExactFence() throws Exception {
    // A closing quote followed by too many '#' does not end the literal.
    checkErrors("r#\"a\"##", "RAW_STRING(r#\"a\"##) EOF", "^ unclosed raw string literal");
    checkErrors("r\"abc", "RAW_STRING(r\"abc) EOF", "^ unclosed raw string literal");
  }

  @Test
  public void testRawStringFenceRecognizers() throws Exception {
    Lexer lexer = createLexer("##\"x\"#");
    Lexer.RawStringFence fence = lexer.scanRawStringStart(0);
    assertThat(fence).isNotNull();
    assertThat(fence.hashes).isEqualTo(2);
    assertThat(createLexer("#ident").scanRawStringStart(0)).isNull();

    Lexer closer = createLexer("\"#");
    assertThat(closer.scanRawStringEnd(new Lexer.RawStringFence(1, 0))).isTrue();
    assertThat(createLexer("\"##").scanRawStringEnd(new Lexer.RawStringFence(1, 0))).isFalse();
    assertThat(createLexer("\"").scanRawStringEnd(new Lexer.RawStringFence(1, 0))).isFalse();
  }

  @Test
  public void testCharsAndLifetimes() throws Exception {
    check("'a' '\\n' b'x'", "CHAR('a') CHAR('\\n') CHAR(b'x') EOF");
    check("'a: loop", "QUOTE IDENTIFIER(a) COLON LOOP EOF");
    check("&'static str", "AMPERSAND QUOTE STATIC IDENTIFIER(str) EOF");
    check("'\u00e9'", "CHAR('\u00e9') EOF");
  }

  @Test
  public void testComments() throws Exception {
    Lexer lexer = createLexer("a // c\nb /* x /* y */ z */ c");
    assertThat(values(allTokens(lexer).toArray(new Scanned[0])))
        .isEqualTo("IDENTIFIER(a) IDENTIFIER(b) IDENTIFIER(c) EOF");
    assertThat(errors).isEmpty();
    ImmutableList<Comment> comments = lexer.getComments();
    assertThat(comments).hasSize(2);
    assertThat(comments.get(0).getText()).isEqualTo("// c");
    assertThat(comments.get(0).isBlock()).isFalse();
    assertThat(comments.get(1).getText()).isEqualTo("/* x /* y */ z */");
    assertThat(comments.get(1).isBlock()).isTrue();
  }

  @Test
  public void testUnclosedBlockComment() throws Exception {
    checkErrors("x /* a /* b */", "IDENTIFIER(x) EOF", "  ^ unclosed block comment");
  }

  @Test
  public void testDocComments() throws Exception {
    Lexer lexer =
        createLexer("/// outer\n//! inner\n//// plain\n/** block */\n/*! iblock */\n/**/");
    allTokens(lexer);
    ImmutableList<Comment> comments = lexer.getComments();
    assertThat(comments).hasSize(6);
    assertThat(comments.get(0).getDocStyle()).isEqualTo(Comment.DocStyle.OUTER);
    assertThat(comments.get(0).getDocCommentText()).isEqualTo(" outer");
    assertThat(comments.get(1).getDocStyle()).isEqualTo(Comment.DocStyle.INNER);
    assertThat(comments.get(2).getDocStyle()).isEqualTo(Comment.DocStyle.NONE);
    assertThat(comments.get(2).getDocCommentText()).isNull();
    assertThat(comments.get(3).getDocStyle()).isEqualTo(Comment.DocStyle.OUTER);
    assertThat(comments.get(3).getDocCommentText()).isEqualTo(" block ");
    assertThat(comments.get(4).getDocStyle()).isEqualTo(Comment.DocStyle.INNER);
    assertThat(comments.get(5).getDocStyle()).isEqualTo(Comment.DocStyle.NONE);
  }

  @Test
  public void testGreaterIsNeverMerged() throws Exception {
    check(">>= >=", "GREATER GREATER EQUALS GREATER EQUALS EOF");
    check("<<= << <=", "LESS_LESS_EQUALS LESS_LESS LESS_EQUALS EOF");
  }

  @Test
  public void testJointFlag() throws Exception {
    ImmutableList<Token> toks = createLexer(">> >").tokenize();
    assertThat(toks).hasSize(4);
    assertThat(toks.get(0).joint).isTrue();
    assertThat(toks.get(1).joint).isFalse();
    assertThat(toks.get(3).kind).isEqualTo(TokenKind.EOF);
  }

  @Test
  public void testOverlayOperators() throws Exception {
    options = FileOptions.VERUS;
    check(
        "a ==> b <==> c <== d",
        "IDENTIFIER(a) IMPLIES IDENTIFIER(b) EQUIV IDENTIFIER(c) EXPLIES IDENTIFIER(d) EOF");
    check(
        "=== !== =~= =~~=",
        "EQUALS_EQUALS_EQUALS NOT_EQUALS_EQUALS EQUALS_TILDE_EQUALS EQUALS_TILDE_TILDE_EQUALS EOF");
  }

  @Test
  public void testBigConnectivesAreTwoJointTokens() throws Exception {
    options = FileOptions.VERUS;
    check("&&& |||", "AMPERSAND_AMPERSAND AMPERSAND PIPE_PIPE PIPE EOF");
    ImmutableList<Token> toks = createLexer("&&&").tokenize();
    assertThat(toks.get(0).joint).isTrue();
    assertThat(toks.get(1).kind).isEqualTo(TokenKind.AMPERSAND);
  }

  @Test
  public void testOverlayOperatorsSplitWithoutOverlay() throws Exception {
    check("a ==> b", "IDENTIFIER(a) EQUALS_EQUALS GREATER IDENTIFIER(b) EOF");
    check("<==>", "LESS_EQUALS FAT_ARROW EOF");
    check("&&& |||", "AMPERSAND_AMPERSAND AMPERSAND PIPE_PIPE PIPE EOF");
    check("===", "EQUALS_EQUALS EQUALS EOF");
    checkErrors("=~=", "EQUALS ILLEGAL(~) EQUALS EOF", " ^ invalid character: '~'");
  }

  @Test
  public void testIllegalCharacter() throws Exception {
    checkErrors(
        "a ` b", "IDENTIFIER(a) ILLEGAL(`) IDENTIFIER(b) EOF", "  ^ invalid character: '`'");
    checkErrors("x\n\\", "IDENTIFIER(x) ILLEGAL(\\) EOF", "^ invalid character: '\\' (line 2)");
  }

  @Test
  public void testShebang() throws Exception {
    check("#!/usr/bin/env run\nfn", "SHEBANG FN EOF");
    // An inner attribute is not a shebang.
    check(
        "#![allow(x)]",
        "POUND BANG LBRACKET IDENTIFIER(allow) LPAREN IDENTIFIER(x) RPAREN RBRACKET EOF");
    check("#! \u000B\t[x]", "POUND BANG LBRACKET IDENTIFIER(x) RBRACKET EOF");
  }

  @Test
  public void testLineNumbers() throws Exception {
    Lexer lexer = createLexer("a\nb\n\n  c");
    List<String> got = new ArrayList<>();
    for (Scanned tok : allTokens(lexer)) {
      if (tok.kind != TokenKind.EOF) {
        got.add(lexer.locs.getLocation(tok.start).toString());
      }
    }
    assertThat(got).containsExactly("<input>:1:1", "<input>:2:1", "<input>:4:3").inOrder();
  }
}
