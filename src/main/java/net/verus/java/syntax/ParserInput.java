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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;

/**
 * The apparent name and contents of a source file, for consumption by the parser. The file name
 * appears in the locations of syntax trees and diagnostics. The contents of one ParserInput form a
 * single compilation unit.
 *
 * <p>The parser reads the contents as UTF-16 code units. Offsets in syntax nodes are indices into
 * this character array.
 */
public final class ParserInput {

  private final String file;
  private final char[] content;

  private ParserInput(char[] content, String file) {
    this.content = Preconditions.checkNotNull(content);
    this.file = Preconditions.checkNotNull(file);
  }

  /** Returns the content of the input source. Callers must not modify the result. */
  char[] getContent() {
    return content;
  }

  /** Returns the apparent file name of the input source. */
  public String getFile() {
    return file;
  }

  /** Returns an input source that reads from a UTF-8 encoded byte array. */
  public static ParserInput fromUtf8(byte[] bytes, String file) {
    return fromString(new String(bytes, UTF_8), file);
  }

  /**
   * Returns an input source that reads from a Latin1-encoded byte array. The caller is free to
   * subsequently mutate the array.
   *
   * <p>This function exists for callers that deliberately treat each byte of their input as a
   * code unit, for example when the bytes of a UTF-8 file must be preserved one-for-one.
   */
  public static ParserInput fromLatin1(byte[] bytes, String file) {
    char[] chars = new char[bytes.length];
    for (int i = 0; i < bytes.length; i++) {
      chars[i] = (char) (0xff & bytes[i]);
    }
    return new ParserInput(chars, file);
  }

  /** Returns an input source that reads from the given string. */
  public static ParserInput fromString(String content, String file) {
    return fromCharArray(content.toCharArray(), file);
  }

  /**
   * Returns an input source that reads from the given char array. The caller must not
   * subsequently modify the array.
   */
  public static ParserInput fromCharArray(char[] content, String file) {
    return new ParserInput(content, file);
  }

  /**
   * Returns an unnamed input source that reads from a list of strings, joined by newlines.
   *
   * <p>Intended for use in tests.
   */
  public static ParserInput fromLines(String... lines) {
    return fromString(Joiner.on("\n").join(lines), "");
  }
}
