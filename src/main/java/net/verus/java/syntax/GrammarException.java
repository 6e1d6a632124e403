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

import com.google.errorprone.annotations.FormatMethod;

/**
 * A GrammarException reports a defect in a grammar description, found while it is being
 * constructed: operators that share a tier but not an associativity, a conflict declaration that
 * cannot be resolved, or a production that cannot be reached. No parser can be created from a
 * defective grammar.
 */
public final class GrammarException extends RuntimeException {

  @FormatMethod
  GrammarException(String format, Object... args) {
    super(String.format(format, args));
  }
}
