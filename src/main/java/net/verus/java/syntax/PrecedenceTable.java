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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * The operator precedence and associativity table.
 *
 * <p>Each entry places one operator spelling, in one {@link Fixity}, on a {@link Tier}. Tiers are
 * totally ordered by binding power, from {@link Tier#ASSIGN} (loosest) to {@link Tier#CALL}
 * (tightest). Closures are not operators and bind more loosely than every tier: a closure body
 * extends as far to the right as possible.
 *
 * <p>All infix operators on one tier must share one associativity; a table that violates this
 * cannot be built.
 */
public final class PrecedenceTable {

  /** How operators on one tier combine with each other. */
  public enum Associativity {
    /** {@code a op b op c} is {@code (a op b) op c}. */
    LEFT,
    /** {@code a op b op c} is {@code a op (b op c)}. */
    RIGHT,
    /** No left operand to combine with; used by prefix operators. */
    NONE,
  }

  /** Where an operator stands relative to its operands. */
  public enum Fixity {
    PREFIX,
    INFIX,
    POSTFIX,
  }

  /** A precedence level. Declaration order is binding power, loosest first. */
  public enum Tier {
    ASSIGN,
    RANGE,
    IMPLICATION,
    OR,
    AND,
    COMPARISON,
    BIT_OR,
    BIT_XOR,
    BIT_AND,
    SHIFT,
    ADDITIVE,
    MULTIPLICATIVE,
    CAST,
    UNARY,
    TRY,
    FIELD,
    CALL;

    /** Returns the numeric level of the tier. Higher levels bind more tightly. */
    public int level() {
      return ordinal();
    }
  }

  /** One operator of the table. */
  @AutoValue
  public abstract static class Entry {
    public abstract String operator();

    public abstract Fixity fixity();

    public abstract Tier tier();

    public abstract Associativity associativity();

    /** Reports whether the operator exists only in the verification overlay. */
    public abstract boolean overlay();

    static Entry create(
        String operator, Fixity fixity, Tier tier, Associativity associativity, boolean overlay) {
      return new AutoValue_PrecedenceTable_Entry(operator, fixity, tier, associativity, overlay);
    }
  }

  private final ImmutableList<Entry> entries;
  private final ImmutableMap<Fixity, ImmutableMap<String, Entry>> byFixity;

  private PrecedenceTable(
      ImmutableList<Entry> entries, ImmutableMap<Fixity, ImmutableMap<String, Entry>> byFixity) {
    this.entries = entries;
    this.byFixity = byFixity;
  }

  /** Returns all entries, in declaration order. */
  public ImmutableList<Entry> entries() {
    return entries;
  }

  /** Returns the entry for the given operator spelling and fixity, or null if there is none. */
  @Nullable
  public Entry lookup(String operator, Fixity fixity) {
    return byFixity.get(fixity).get(operator);
  }

  /** Returns the number of distinct tiers that have at least one operator. */
  public int tierCount() {
    return (int) entries.stream().map(Entry::tier).distinct().count();
  }

  /**
   * Returns the table of the base language, or of the language with the verification overlay.
   * The overlay adds the implication tier, four comparison operators, and {@code is}, {@code
   * matches} and the postfix view {@code @} on the cast tier.
   */
  static PrecedenceTable standard(boolean overlay) {
    Builder b = builder();
    for (String op :
        new String[] {"=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>="}) {
      b.infix(op, Tier.ASSIGN, Associativity.RIGHT);
    }
    for (String op : new String[] {"..", "..=", "..."}) {
      b.infix(op, Tier.RANGE, Associativity.LEFT);
    }
    if (overlay) {
      b.add("==>", Fixity.INFIX, Tier.IMPLICATION, Associativity.RIGHT, true);
      b.add("<==>", Fixity.INFIX, Tier.IMPLICATION, Associativity.RIGHT, true);
    }
    b.infix("||", Tier.OR, Associativity.LEFT);
    b.infix("&&", Tier.AND, Associativity.LEFT);
    for (String op : new String[] {"==", "!=", "<", "<=", ">", ">="}) {
      b.infix(op, Tier.COMPARISON, Associativity.LEFT);
    }
    if (overlay) {
      for (String op : new String[] {"===", "!==", "=~=", "=~~="}) {
        b.add(op, Fixity.INFIX, Tier.COMPARISON, Associativity.LEFT, true);
      }
    }
    b.infix("|", Tier.BIT_OR, Associativity.LEFT);
    b.infix("^", Tier.BIT_XOR, Associativity.LEFT);
    b.infix("&", Tier.BIT_AND, Associativity.LEFT);
    b.infix("<<", Tier.SHIFT, Associativity.LEFT);
    b.infix(">>", Tier.SHIFT, Associativity.LEFT);
    b.infix("+", Tier.ADDITIVE, Associativity.LEFT);
    b.infix("-", Tier.ADDITIVE, Associativity.LEFT);
    b.infix("*", Tier.MULTIPLICATIVE, Associativity.LEFT);
    b.infix("/", Tier.MULTIPLICATIVE, Associativity.LEFT);
    b.infix("%", Tier.MULTIPLICATIVE, Associativity.LEFT);
    b.infix("as", Tier.CAST, Associativity.LEFT);
    if (overlay) {
      b.add("is", Fixity.INFIX, Tier.CAST, Associativity.LEFT, true);
      b.add("matches", Fixity.INFIX, Tier.CAST, Associativity.LEFT, true);
      b.add("@", Fixity.POSTFIX, Tier.CAST, Associativity.LEFT, true);
    }
    for (String op : new String[] {"-", "*", "!", "&", "&&"}) {
      b.add(op, Fixity.PREFIX, Tier.UNARY, Associativity.NONE, false);
    }
    b.add("?", Fixity.POSTFIX, Tier.TRY, Associativity.LEFT, false);
    b.add(".", Fixity.POSTFIX, Tier.FIELD, Associativity.LEFT, false);
    b.add("(", Fixity.POSTFIX, Tier.CALL, Associativity.LEFT, false);
    b.add("[", Fixity.POSTFIX, Tier.CALL, Associativity.LEFT, false);
    return b.build();
  }

  static Builder builder() {
    return new Builder();
  }

  /** Accumulates entries and validates them on {@link #build}. */
  static final class Builder {
    private final List<Entry> entries = new ArrayList<>();

    private Builder() {}

    @CanIgnoreReturnValue
    Builder infix(String operator, Tier tier, Associativity associativity) {
      return add(operator, Fixity.INFIX, tier, associativity, false);
    }

    @CanIgnoreReturnValue
    Builder add(
        String operator, Fixity fixity, Tier tier, Associativity associativity, boolean overlay) {
      entries.add(Entry.create(operator, fixity, tier, associativity, overlay));
      return this;
    }

    /**
     * Returns the table.
     *
     * @throws GrammarException if an operator is declared twice with the same fixity, or two infix
     *     operators share a tier but not an associativity
     */
    PrecedenceTable build() {
      Map<Tier, Entry> firstOnTier = new EnumMap<>(Tier.class);
      Map<Fixity, Map<String, Entry>> byFixity = new EnumMap<>(Fixity.class);
      for (Fixity f : Fixity.values()) {
        byFixity.put(f, new HashMap<>());
      }
      for (Entry e : entries) {
        Entry previous = byFixity.get(e.fixity()).put(e.operator(), e);
        if (previous != null) {
          throw new GrammarException(
              "operator '%s' is declared twice as %s", e.operator(), e.fixity());
        }
        if (e.fixity() != Fixity.INFIX) {
          continue;
        }
        Entry first = firstOnTier.putIfAbsent(e.tier(), e);
        if (first != null && first.associativity() != e.associativity()) {
          throw new GrammarException(
              "operators '%s' (%s) and '%s' (%s) share tier %s but not associativity",
              first.operator(), first.associativity(), e.operator(), e.associativity(), e.tier());
        }
      }
      ImmutableMap.Builder<Fixity, ImmutableMap<String, Entry>> maps = ImmutableMap.builder();
      for (Fixity f : Fixity.values()) {
        maps.put(f, ImmutableMap.copyOf(byFixity.get(f)));
      }
      return new PrecedenceTable(ImmutableList.copyOf(entries), maps.buildOrThrow());
    }
  }
}
