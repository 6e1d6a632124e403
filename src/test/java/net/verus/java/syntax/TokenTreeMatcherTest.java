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
import static org.junit.Assert.assertThrows;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link TokenTreeMatcher}. */
@RunWith(JUnit4.class)
public final class TokenTreeMatcherTest {

  private Lexer lexer;

  private ImmutableList<Token> tokenize(String input) {
    List<SyntaxError> errors = new ArrayList<>();
    lexer = new Lexer(ParserInput.fromString(input, ""), FileOptions.DEFAULT, errors);
    ImmutableList<Token> tokens = lexer.tokenize();
    assertThat(errors).isEmpty();
    return tokens;
  }

  private TokenTreeMatcher.Result match(String input, int start) {
    return TokenTreeMatcher.match(tokenize(input), start, lexer.locs);
  }

  @Test
  public void testNestedGroups() {
    // Tokens: ( a [ b ] { c } ) EOF
    TokenTreeMatcher.Result result = match("(a [b] {c})", 0);
    assertThat(result.error()).isNull();
    assertThat(result.endIndex()).isEqualTo(9);

    TokenTree tree = result.tree();
    assertThat(tree.size()).isEqualTo(6);
    assertThat(tree.isGroup(TokenTree.ROOT)).isTrue();
    assertThat(tree.delimiter(TokenTree.ROOT)).isEqualTo(TokenKind.LPAREN);
    assertThat(tree.closeToken(TokenTree.ROOT)).isEqualTo(8);
    assertThat(tree.children(TokenTree.ROOT).asList()).containsExactly(1, 2, 4).inOrder();

    assertThat(tree.isGroup(1)).isFalse();
    assertThat(tree.token(1)).isEqualTo(1);
    assertThat(tree.children(1).isEmpty()).isTrue();

    assertThat(tree.delimiter(2)).isEqualTo(TokenKind.LBRACKET);
    assertThat(tree.closeToken(2)).isEqualTo(4);
    assertThat(tree.depth(3)).isEqualTo(2);
    assertThat(tree.delimiter(4)).isEqualTo(TokenKind.LBRACE);
    assertThat(tree.closeToken(4)).isEqualTo(7);
  }

  @Test
  public void testMatchFromMiddle() {
    // Tokens: x ( y ) z EOF
    TokenTreeMatcher.Result result = match("x (y) z", 1);
    assertThat(result.tree().token(TokenTree.ROOT)).isEqualTo(1);
    assertThat(result.endIndex()).isEqualTo(4);
  }

  @Test
  public void testLeafIsNotAGroup() {
    TokenTree tree = match("()", 0).tree();
    assertThat(tree.size()).isEqualTo(1);
    assertThat(tree.children(TokenTree.ROOT).isEmpty()).isTrue();
    assertThrows(IllegalArgumentException.class, () -> match("(a)", 0).tree().delimiter(1));
  }

  @Test
  public void testMismatch() {
    TokenTreeMatcher.Result result = match("{ (a] }", 0);
    assertThat(result.tree()).isNull();
    assertThat(result.error().toString())
        .isEqualTo("<input>:1:3: mismatched delimiter: '(' opened here is closed by ']'");
    assertThat(result.error().kind()).isEqualTo(SyntaxError.Kind.DELIMITER_MISMATCH);
    assertThat(result.endIndex()).isEqualTo(3);
  }

  @Test
  public void testUnclosed() {
    TokenTreeMatcher.Result result = match("[a\n (b)", 0);
    assertThat(result.tree()).isNull();
    assertThat(result.error().toString()).isEqualTo("<input>:1:1: unclosed delimiter '['");
    assertThat(result.endIndex()).isEqualTo(5);
  }

  @Test
  public void testNotAnOpeningDelimiter() {
    assertThrows(IllegalArgumentException.class, () -> match("a ()", 0));
  }

  @Test
  public void testDeepNesting() {
    int depth = 100000;
    String input = Strings.repeat("(", depth) + Strings.repeat(")", depth);
    TokenTreeMatcher.Result result = match(input, 0);
    assertThat(result.error()).isNull();
    assertThat(result.endIndex()).isEqualTo(2 * depth);
    assertThat(result.tree().depth(depth - 1)).isEqualTo(depth - 1);
  }
}
