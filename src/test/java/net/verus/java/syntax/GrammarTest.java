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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.verus.java.syntax.PrecedenceTable.Associativity;
import net.verus.java.syntax.PrecedenceTable.Fixity;
import net.verus.java.syntax.PrecedenceTable.Tier;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Grammar} and {@link PrecedenceTable}. */
@RunWith(JUnit4.class)
public final class GrammarTest {

  private static final Grammar BASE = Grammar.of(FileOptions.DEFAULT);
  private static final Grammar VERUS = Grammar.of(FileOptions.VERUS);

  @Test
  public void testGrammarsAreShared() {
    assertThat(Grammar.of(FileOptions.builder().build())).isSameInstanceAs(BASE);
    assertThat(Grammar.of(FileOptions.builder().allowVerusSyntax(true).build()))
        .isSameInstanceAs(VERUS);
    assertThat(BASE).isNotSameInstanceAs(VERUS);
    assertThat(VERUS.options().allowVerusSyntax()).isTrue();
  }

  @Test
  public void testOverlayProductions() {
    assertThat(BASE.isEnabled(NodeKind.VERUS_BLOCK)).isFalse();
    assertThat(VERUS.isEnabled(NodeKind.VERUS_BLOCK)).isTrue();
    assertThat(BASE.productions(NodeKind.VERUS_BLOCK)).isEmpty();
    assertThat(BASE.permits(NodeKind.SOURCE_FILE, NodeKind.VERUS_BLOCK)).isFalse();
    assertThat(VERUS.permits(NodeKind.SOURCE_FILE, NodeKind.VERUS_BLOCK)).isTrue();
  }

  @Test
  public void testPermitsThroughCategories() {
    for (Grammar g : ImmutableList.of(BASE, VERUS)) {
      assertThat(g.permits(NodeKind.BINARY_EXPRESSION, NodeKind.INTEGER_LITERAL)).isTrue();
      assertThat(g.permits(NodeKind.BINARY_EXPRESSION, NodeKind.CALL_EXPRESSION)).isTrue();
      assertThat(g.permits(NodeKind.BINARY_EXPRESSION, NodeKind.FUNCTION_ITEM)).isFalse();
      assertThat(g.permits(NodeKind.BINARY_EXPRESSION, NodeKind.ERROR)).isTrue();
      assertThat(g.permits(NodeKind.BINARY_EXPRESSION, NodeKind.TOKEN)).isTrue();
    }
  }

  @Test
  public void testOverlayConflictsAreOmittedFromBase() {
    assertThat(BASE.hasConflict(Conflict.REQUIRES_CLAUSE)).isFalse();
    assertThat(VERUS.hasConflict(Conflict.REQUIRES_CLAUSE)).isTrue();
    assertThat(BASE.hasConflict(Conflict.ANONYMOUS_PARAMETER)).isTrue();
    for (Conflict c : BASE.conflicts()) {
      assertThat(c.isOverlay()).isFalse();
    }
    assertThat(VERUS.conflicts()).containsAtLeastElementsIn(BASE.conflicts());
  }

  @Test
  public void testContextualKeywords() {
    assertThat(VERUS.isContextualKeyword("requires")).isTrue();
    assertThat(VERUS.isContextualKeyword("forall")).isTrue();
    assertThat(VERUS.isContextualKeyword("foo")).isFalse();
    assertThat(BASE.isContextualKeyword("requires")).isFalse();
  }

  @Test
  public void testStandardPrecedence() {
    PrecedenceTable base = BASE.precedence();
    PrecedenceTable verus = VERUS.precedence();
    assertThat(base.lookup("==>", Fixity.INFIX)).isNull();
    PrecedenceTable.Entry implies = verus.lookup("==>", Fixity.INFIX);
    assertThat(implies.tier()).isEqualTo(Tier.IMPLICATION);
    assertThat(implies.associativity()).isEqualTo(Associativity.RIGHT);
    assertThat(implies.overlay()).isTrue();

    assertThat(base.lookup("-", Fixity.PREFIX).tier()).isEqualTo(Tier.UNARY);
    assertThat(base.lookup("-", Fixity.INFIX).tier()).isEqualTo(Tier.ADDITIVE);
    assertThat(base.lookup("==", Fixity.INFIX).associativity()).isEqualTo(Associativity.LEFT);
    assertThat(base.lookup("..", Fixity.INFIX).associativity()).isEqualTo(Associativity.LEFT);
    assertThat(verus.lookup("===", Fixity.INFIX).associativity()).isEqualTo(Associativity.LEFT);
    assertThat(base.lookup("<==", Fixity.INFIX)).isNull();
    assertThat(verus.lookup("<==", Fixity.INFIX)).isNull();

    assertThat(Tier.RANGE.level()).isLessThan(Tier.IMPLICATION.level());
    assertThat(Tier.IMPLICATION.level()).isLessThan(Tier.OR.level());
    assertThat(verus.tierCount()).isEqualTo(base.tierCount() + 1);
  }

  @Test
  public void testDuplicateOperator() {
    GrammarException ex =
        assertThrows(
            GrammarException.class,
            () ->
                PrecedenceTable.builder()
                    .infix("+", Tier.ADDITIVE, Associativity.LEFT)
                    .infix("+", Tier.ADDITIVE, Associativity.LEFT)
                    .build());
    assertThat(ex).hasMessageThat().contains("operator '+' is declared twice");
  }

  @Test
  public void testSameOperatorWithDifferentFixities() {
    PrecedenceTable table =
        PrecedenceTable.builder()
            .infix("-", Tier.ADDITIVE, Associativity.LEFT)
            .add("-", Fixity.PREFIX, Tier.UNARY, Associativity.NONE, false)
            .build();
    assertThat(table.entries()).hasSize(2);
  }

  @Test
  public void testMixedAssociativityOnTier() {
    GrammarException ex =
        assertThrows(
            GrammarException.class,
            () ->
                PrecedenceTable.builder()
                    .infix("+", Tier.ADDITIVE, Associativity.LEFT)
                    .infix("-", Tier.ADDITIVE, Associativity.RIGHT)
                    .build());
    assertThat(ex).hasMessageThat().contains("share tier ADDITIVE but not associativity");
  }

  @Test
  public void testOverlayOperatorInBaseGrammar() {
    GrammarException ex =
        assertThrows(
            GrammarException.class,
            () ->
                Grammar.create(
                    FileOptions.DEFAULT,
                    PrecedenceTable.standard(true),
                    Productions.standard(false),
                    ImmutableList.of()));
    assertThat(ex)
        .hasMessageThat()
        .isEqualTo("operator '==>' belongs to the verification overlay, which is off");
  }

  @Test
  public void testConflictWithoutResolvingTokens() {
    Conflict c = Conflict.create("empty", ImmutableSet.of(NodeKind.PARAMETER), ImmutableSet.of());
    GrammarException ex =
        assertThrows(
            GrammarException.class,
            () ->
                Grammar.create(
                    FileOptions.DEFAULT,
                    PrecedenceTable.standard(false),
                    Productions.standard(false),
                    ImmutableList.of(c)));
    assertThat(ex).hasMessageThat().isEqualTo("conflict empty has no resolving tokens");
  }

  @Test
  public void testConflictOnDisabledProduction() {
    Conflict c =
        Conflict.create(
            "overlay_only",
            ImmutableSet.of(NodeKind.VERUS_BLOCK),
            ImmutableSet.of(TokenKind.LBRACE));
    GrammarException ex =
        assertThrows(
            GrammarException.class,
            () ->
                Grammar.create(
                    FileOptions.DEFAULT,
                    PrecedenceTable.standard(false),
                    Productions.standard(false),
                    ImmutableList.of(c)));
    assertThat(ex).hasMessageThat().contains("conflict overlay_only names production");
    assertThat(ex).hasMessageThat().contains("which is not enabled");
  }

  @Test
  public void testUnreachableProduction() {
    ImmutableMap<NodeKind, ImmutableSet<Productions.Symbol>> productions =
        ImmutableMap.of(
            NodeKind.SOURCE_FILE, ImmutableSet.of(),
            NodeKind.BLOCK, ImmutableSet.of());
    GrammarException ex =
        assertThrows(
            GrammarException.class,
            () ->
                Grammar.create(
                    FileOptions.DEFAULT,
                    PrecedenceTable.standard(false),
                    productions,
                    ImmutableList.of()));
    assertThat(ex).hasMessageThat().contains("is unreachable from source_file");
  }

  @Test
  public void testMissingSourceFile() {
    ImmutableMap<NodeKind, ImmutableSet<Productions.Symbol>> productions =
        ImmutableMap.of(NodeKind.BLOCK, ImmutableSet.of());
    GrammarException ex =
        assertThrows(
            GrammarException.class,
            () ->
                Grammar.create(
                    FileOptions.DEFAULT,
                    PrecedenceTable.standard(false),
                    productions,
                    ImmutableList.of()));
    assertThat(ex).hasMessageThat().contains("is not enabled");
  }

  @Test
  public void testBaseProductionsHaveNoOverlayKinds() {
    ImmutableMap<NodeKind, ImmutableSet<Productions.Symbol>> productions =
        Productions.standard(false);
    for (NodeKind kind : productions.keySet()) {
      assertThat(kind.isOverlay()).isFalse();
      for (Productions.Symbol symbol : productions.get(kind)) {
        if (symbol instanceof NodeKind) {
          assertThat(((NodeKind) symbol).isOverlay()).isFalse();
        }
      }
    }
    assertThat(Productions.standard(true).keySet())
        .containsAtLeastElementsIn(productions.keySet());
  }
}
