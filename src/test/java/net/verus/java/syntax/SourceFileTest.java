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
import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link SourceFile}, its comments and locations, and {@link NodeVisitor}. */
@RunWith(JUnit4.class)
public final class SourceFileTest {

  private static final String[] PROGRAM = {
    "//! Crate docs.",
    "use std::fmt;",
    "",
    "/// A point.",
    "struct Point { x: i32, y: i32 }",
    "",
    "fn norm(p: &Point) -> i32 {",
    "  /* squared */ p.x * p.x + p.y * p.y",
    "}",
  };

  @Test
  public void testNameAndLocations() {
    SourceFile file = SourceFile.parse(ParserInput.fromString("fn f() {}\nfn g() {}", "a.rs"));
    assertThat(file.ok()).isTrue();
    assertThat(file.getName()).isEqualTo("a.rs");
    assertThat(file.toString()).isEqualTo("<source file a.rs>");
    assertThat(file.getOptions()).isEqualTo(FileOptions.DEFAULT);

    SyntaxNode g = file.getStatements().get(1);
    assertThat(g.getStartLocation().toString()).isEqualTo("a.rs:2:1");
    assertThat(g.getField("name").getStartLocation().toString()).isEqualTo("a.rs:2:4");
    assertThat(g.getEndLocation().toString()).isEqualTo("a.rs:2:10");
    assertThat(file.getLocation(0)).isEqualTo(new Location("a.rs", 1, 1));
    assertThat(g.getFile()).isEqualTo("a.rs");
  }

  @Test
  public void testErrorLocationInNamedFile() {
    SourceFile file = SourceFile.parse(ParserInput.fromString("fn f() {\n  let = 1;\n}", "b.rs"));
    assertThat(file.ok()).isFalse();
    assertThat(file.errors().get(0).toString()).startsWith("b.rs:2:7: syntax error at '='");
  }

  @Test
  public void testCommentsAreKeptApart() {
    SourceFile file = TestUtils.parse(FileOptions.DEFAULT, PROGRAM);
    assertThat(file.ok()).isTrue();
    assertThat(file.getStatements()).hasSize(3);

    ImmutableList<Comment> comments = file.getComments();
    assertThat(comments).hasSize(3);
    assertThat(comments.get(0).getDocStyle()).isEqualTo(Comment.DocStyle.INNER);
    assertThat(comments.get(0).getDocCommentText()).isEqualTo(" Crate docs.");
    assertThat(comments.get(1).getDocStyle()).isEqualTo(Comment.DocStyle.OUTER);
    assertThat(comments.get(1).getStartLocation().line()).isEqualTo(4);
    assertThat(comments.get(2).isBlock()).isTrue();
    assertThat(comments.get(2).getText()).isEqualTo("/* squared */");
    assertThat(comments.get(2).getDocCommentText()).isNull();
  }

  @Test
  public void testVisitorSeesNamedNodesInOrder() {
    SourceFile file = TestUtils.parse(FileOptions.DEFAULT, "fn f(a: u8) -> u8 { a + 1 }");
    List<String> seen = new ArrayList<>();
    new NodeVisitor() {
      {
        skipAnonymousTokens = true;
      }

      @Override
      public void visit(SyntaxNode node) {
        if (node.isLeaf()) {
          seen.add(node.kind().getName() + ":" + node.getText());
        }
        super.visit(node);
      }
    }.visit(file.getRoot());
    assertThat(seen)
        .containsExactly(
            "identifier:f",
            "identifier:a",
            "primitive_type:u8",
            "primitive_type:u8",
            "identifier:a",
            "integer_literal:1")
        .inOrder();
  }

  @Test
  public void testVisitorSeesAnonymousTokensByDefault() {
    SyntaxNode root = TestUtils.parse(FileOptions.DEFAULT, "x;").getRoot();
    List<String> tokens = new ArrayList<>();
    new NodeVisitor() {
      @Override
      public void visit(SyntaxNode node) {
        if (node.kind() == NodeKind.TOKEN) {
          tokens.add(node.getText());
        }
        super.visit(node);
      }
    }.visit(root);
    assertThat(tokens).containsExactly(";");
  }

  @Test
  public void testVisitorVisitsComments() {
    SourceFile file = TestUtils.parse(FileOptions.DEFAULT, PROGRAM);
    List<String> seen = new ArrayList<>();
    new NodeVisitor() {
      @Override
      public void visit(Comment comment) {
        seen.add(comment.getText());
      }
    }.visitAll(file.getComments());
    assertThat(seen).containsExactly("//! Crate docs.", "/// A point.", "/* squared */").inOrder();
  }

  @Test
  public void testParserInputEncodings() {
    String text = "let s = \"é\";";
    SourceFile utf8 = SourceFile.parse(ParserInput.fromUtf8(text.getBytes(UTF_8), "u.rs"));
    SourceFile latin1 =
        SourceFile.parse(ParserInput.fromLatin1(text.getBytes(ISO_8859_1), "l.rs"));
    assertThat(utf8.ok()).isTrue();
    assertThat(latin1.ok()).isTrue();
    assertThat(utf8.getRoot().getEndOffset()).isEqualTo(text.length());
    assertThat(latin1.getRoot().getEndOffset()).isEqualTo(text.length());

    // Each byte of a multi-byte UTF-8 sequence is one char when read as Latin1.
    SourceFile bytes = SourceFile.parse(ParserInput.fromLatin1(text.getBytes(UTF_8), "b.rs"));
    assertThat(bytes.getRoot().getEndOffset()).isEqualTo(text.length() + 1);
  }

  @Test
  public void testFromCharArray() {
    ParserInput input = ParserInput.fromCharArray("struct S;".toCharArray(), "c.rs");
    assertThat(input.getFile()).isEqualTo("c.rs");
    assertThat(SourceFile.parse(input).getStatements()).hasSize(1);
  }

  @Test
  public void testEmptyFile() {
    SourceFile file = TestUtils.parse(FileOptions.DEFAULT, "");
    assertThat(file.ok()).isTrue();
    assertThat(file.getStatements()).isEmpty();
    assertThat(file.getRoot().toString()).isEqualTo("(source_file)");
  }

  @Test
  public void testConcurrentParsing() throws Exception {
    String[] lines = new String[200];
    for (int i = 0; i < lines.length; i++) {
      lines[i] = "proof fn f" + i + "(x: int) ensures x + " + i + " >= x { }";
    }
    SyntaxNode expected = TestUtils.parse(FileOptions.VERUS, lines).getRoot();

    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<SourceFile>> futures = new ArrayList<>();
      for (int i = 0; i < 32; i++) {
        FileOptions options = i % 2 == 0 ? FileOptions.VERUS : FileOptions.DEFAULT;
        futures.add(executor.submit(() -> TestUtils.parse(options, lines)));
      }
      for (int i = 0; i < futures.size(); i++) {
        SourceFile file = futures.get(i).get(1, TimeUnit.MINUTES);
        if (i % 2 == 0) {
          assertThat(file.ok()).isTrue();
          assertThat(file.getRoot()).isEqualTo(expected);
        } else {
          assertThat(file.ok()).isFalse();
        }
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
