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

/**
 * FileOptions is the set of options that affect the static processing (scanning and parsing) of a
 * single compilation unit. These options select the language accepted by the frontend, in effect
 * the dialect.
 *
 * <p>There is exactly one such option today: whether the Verus verification overlay is compiled
 * into the grammar. The overlay adds specification clauses, ghost and tracked data modes, function
 * modes, quantifiers, proof blocks and a handful of operators on top of the base Rust grammar. With
 * the overlay disabled, the accepted language is exactly the base language.
 *
 * <p>Options are fixed when the {@link Grammar} is built; they never change during a parse.
 */
@AutoValue
public abstract class FileOptions {

  /** The base language, with no verification overlay. */
  public static final FileOptions DEFAULT = builder().build();

  /** The base language plus the Verus verification overlay. */
  public static final FileOptions VERUS = builder().allowVerusSyntax(true).build();

  /**
   * During scanning and parsing, accept the Verus overlay: its operators ({@code ==>}, {@code
   * <==>}, {@code ===}, {@code &&&} and others), its contextual keywords ({@code requires}, {@code
   * spec}, {@code ghost}, {@code forall} and others), and the productions that host them.
   */
  public abstract boolean allowVerusSyntax();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_FileOptions.Builder().allowVerusSyntax(false);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link FileOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder allowVerusSyntax(boolean value);

    public abstract FileOptions build();
  }
}
