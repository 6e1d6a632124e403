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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayDeque;
import java.util.EnumSet;
import java.util.Queue;
import java.util.Set;

/**
 * A Grammar is the validated, immutable description of one dialect: its precedence table, its
 * production table, the conflicts the parser may resolve, and its contextual keywords.
 *
 * <p>There are two grammars, one per value of {@link FileOptions#allowVerusSyntax}. Both are built
 * and validated once, on first use, and shared by all parsers and threads.
 */
public final class Grammar {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  // Words that act as keywords only in overlay syntax positions. Elsewhere they are identifiers.
  private static final ImmutableSet<String> OVERLAY_KEYWORDS =
      ImmutableSet.of(
          "spec",
          "proof",
          "exec",
          "ghost",
          "tracked",
          "requires",
          "ensures",
          "returns",
          "decreases",
          "invariant",
          "invariant_ensures",
          "invariant_except_break",
          "recommends",
          "via",
          "when",
          "opens_invariants",
          "by",
          "forall",
          "exists",
          "choose",
          "any",
          "none",
          "broadcast",
          "group",
          "no_unwind",
          "assume_specification",
          "assert",
          "assume",
          "open",
          "closed",
          "checked",
          "global",
          "size_of",
          "layout",
          "is",
          "matches",
          "implies",
          "trigger",
          "verus");

  private static final class Holder {
    static final Grammar BASE = standard(FileOptions.DEFAULT);
    static final Grammar VERUS = standard(FileOptions.VERUS);
  }

  private final FileOptions options;
  private final PrecedenceTable precedence;
  private final ImmutableMap<NodeKind, ImmutableSet<Productions.Symbol>> productions;
  private final ImmutableSet<Conflict> conflicts;
  private final ImmutableSet<String> keywords;

  private Grammar(
      FileOptions options,
      PrecedenceTable precedence,
      ImmutableMap<NodeKind, ImmutableSet<Productions.Symbol>> productions,
      ImmutableSet<Conflict> conflicts) {
    this.options = options;
    this.precedence = precedence;
    this.productions = productions;
    this.conflicts = conflicts;
    this.keywords = options.allowVerusSyntax() ? OVERLAY_KEYWORDS : ImmutableSet.of();
  }

  /** Returns the shared grammar of the dialect selected by the given options. */
  public static Grammar of(FileOptions options) {
    return options.allowVerusSyntax() ? Holder.VERUS : Holder.BASE;
  }

  private static Grammar standard(FileOptions options) {
    boolean overlay = options.allowVerusSyntax();
    ImmutableList.Builder<Conflict> conflicts = ImmutableList.builder();
    for (Conflict c : Conflict.standard()) {
      if (overlay || !c.isOverlay()) {
        conflicts.add(c);
      }
    }
    return create(
        options,
        PrecedenceTable.standard(overlay),
        Productions.standard(overlay),
        conflicts.build());
  }

  /**
   * Validates and returns a grammar.
   *
   * @throws GrammarException if a conflict names a production that is not enabled or has no
   *     resolving tokens, if the precedence table contains overlay operators while the overlay is
   *     off, or if an enabled production cannot be reached from {@code source_file}
   */
  static Grammar create(
      FileOptions options,
      PrecedenceTable precedence,
      ImmutableMap<NodeKind, ImmutableSet<Productions.Symbol>> productions,
      ImmutableList<Conflict> conflicts) {
    boolean overlay = options.allowVerusSyntax();
    for (Conflict c : conflicts) {
      if (c.resolvingTokens().isEmpty()) {
        throw new GrammarException("conflict %s has no resolving tokens", c.name());
      }
      for (NodeKind kind : c.productions()) {
        if (!productions.containsKey(kind)) {
          throw new GrammarException(
              "conflict %s names production %s, which is not enabled", c.name(), kind);
        }
      }
    }
    if (!overlay) {
      for (PrecedenceTable.Entry e : precedence.entries()) {
        if (e.overlay()) {
          throw new GrammarException(
              "operator '%s' belongs to the verification overlay, which is off", e.operator());
        }
      }
    }
    checkReachable(productions);

    Grammar grammar =
        new Grammar(options, precedence, productions, ImmutableSet.copyOf(conflicts));
    logger.atFine().log(
        "built %s grammar: %d precedence tiers, %d productions, %d conflicts",
        overlay ? "verus" : "base",
        precedence.tierCount(),
        productions.size(),
        conflicts.size());
    return grammar;
  }

  // Every enabled kind must be derivable from source_file. Anonymous tokens and error nodes are
  // implicitly permitted everywhere and are exempt.
  private static void checkReachable(
      ImmutableMap<NodeKind, ImmutableSet<Productions.Symbol>> productions) {
    if (!productions.containsKey(NodeKind.SOURCE_FILE)) {
      throw new GrammarException("production %s is not enabled", NodeKind.SOURCE_FILE);
    }
    Set<NodeKind> reached = EnumSet.of(NodeKind.SOURCE_FILE);
    Queue<NodeKind> queue = new ArrayDeque<>();
    queue.add(NodeKind.SOURCE_FILE);
    while (!queue.isEmpty()) {
      NodeKind parent = queue.remove();
      for (Productions.Symbol symbol : productions.get(parent)) {
        for (NodeKind child : expand(symbol, productions)) {
          if (reached.add(child)) {
            queue.add(child);
          }
        }
      }
    }
    for (NodeKind kind : productions.keySet()) {
      if (!reached.contains(kind) && kind != NodeKind.TOKEN && kind != NodeKind.ERROR) {
        throw new GrammarException("production %s is unreachable from source_file", kind);
      }
    }
  }

  // Returns the enabled kinds a symbol stands for.
  private static ImmutableSet<NodeKind> expand(
      Productions.Symbol symbol,
      ImmutableMap<NodeKind, ImmutableSet<Productions.Symbol>> productions) {
    if (symbol instanceof NodeKind) {
      NodeKind kind = (NodeKind) symbol;
      return productions.containsKey(kind) ? ImmutableSet.of(kind) : ImmutableSet.of();
    }
    NodeKind.Category category = (NodeKind.Category) symbol;
    ImmutableSet.Builder<NodeKind> kinds = ImmutableSet.builder();
    for (NodeKind kind : productions.keySet()) {
      if (kind.is(category)) {
        kinds.add(kind);
      }
    }
    return kinds.build();
  }

  /** Returns the options that select this dialect. */
  public FileOptions options() {
    return options;
  }

  /** Returns the precedence table. */
  public PrecedenceTable precedence() {
    return precedence;
  }

  /** Reports whether the given production exists in this dialect. */
  public boolean isEnabled(NodeKind kind) {
    return productions.containsKey(kind) || kind == NodeKind.TOKEN || kind == NodeKind.ERROR;
  }

  /** Returns the declared child symbols of a production, or the empty set if it is disabled. */
  public ImmutableSet<Productions.Symbol> productions(NodeKind kind) {
    ImmutableSet<Productions.Symbol> rhs = productions.get(kind);
    return rhs == null ? ImmutableSet.of() : rhs;
  }

  /**
   * Reports whether a node of kind {@code child} may appear directly beneath a node of kind
   * {@code parent}, either by name or through a category the child belongs to.
   */
  public boolean permits(NodeKind parent, NodeKind child) {
    if (child == NodeKind.TOKEN || child == NodeKind.ERROR) {
      return true;
    }
    ImmutableSet<Productions.Symbol> rhs = productions.get(parent);
    if (rhs == null || !productions.containsKey(child)) {
      return false;
    }
    if (rhs.contains(child)) {
      return true;
    }
    for (NodeKind.Category c : child.categories()) {
      if (rhs.contains(c)) {
        return true;
      }
    }
    return false;
  }

  /** Reports whether the parser may resolve the given conflict in this dialect. */
  public boolean hasConflict(Conflict conflict) {
    return conflicts.contains(conflict);
  }

  /** Returns the declared conflicts. */
  public ImmutableSet<Conflict> conflicts() {
    return conflicts;
  }

  /**
   * Reports whether the word is a contextual keyword of this dialect. Contextual keywords are
   * lexed as identifiers and act as keywords only where the grammar expects them.
   */
  public boolean isContextualKeyword(String word) {
    return keywords.contains(word);
  }
}
