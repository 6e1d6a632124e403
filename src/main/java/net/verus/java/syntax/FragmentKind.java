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
import com.google.common.collect.ImmutableMap;
import javax.annotation.Nullable;

/** The fragment specifiers a macro_rules binding such as {@code $x:expr} may name. */
public enum FragmentKind {
  BLOCK,
  EXPR,
  IDENT,
  ITEM,
  LIFETIME,
  LITERAL,
  META,
  PAT,
  PAT_PARAM,
  PATH,
  STMT,
  TT,
  TY,
  VIS;

  private static final ImmutableMap<String, FragmentKind> BY_NAME;

  static {
    ImmutableMap.Builder<String, FragmentKind> b = ImmutableMap.builder();
    for (FragmentKind k : values()) {
      b.put(k.getName(), k);
    }
    BY_NAME = b.buildOrThrow();
  }

  /** Returns the specifier as written in source, e.g. {@code expr}. */
  public String getName() {
    return Ascii.toLowerCase(name());
  }

  /** Returns the fragment kind with the given source name, or null if there is none. */
  @Nullable
  public static FragmentKind fromName(String name) {
    return BY_NAME.get(name);
  }
}
