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

import com.google.common.base.Preconditions;
import java.util.Objects;

/**
 * A Location denotes a position within a source file, identified by file name, 1-based line and
 * 1-based column. Columns count UTF-16 code units.
 */
public final class Location implements Comparable<Location> {

  private final String file;
  private final int line;
  private final int column;

  public Location(String file, int line, int column) {
    this.file = Preconditions.checkNotNull(file);
    this.line = line;
    this.column = column;
  }

  /** Returns the name of the file containing this location. */
  public String file() {
    return file;
  }

  /** Returns the line number of this location, starting from 1. */
  public int line() {
    return line;
  }

  /** Returns the column number of this location, starting from 1. */
  public int column() {
    return column;
  }

  /** Returns the string form of the location, {@code file:line:column}. */
  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    buf.append(file.isEmpty() ? "<input>" : file);
    if (line != 0) {
      buf.append(':').append(line);
      if (column != 0) {
        buf.append(':').append(column);
      }
    }
    return buf.toString();
  }

  /** Returns a three-valued lexicographical comparison of two Locations. */
  @Override
  public int compareTo(Location that) {
    int cmp = this.file.compareTo(that.file);
    if (cmp != 0) {
      return cmp;
    }
    cmp = Integer.compare(this.line, that.line);
    if (cmp != 0) {
      return cmp;
    }
    return Integer.compare(this.column, that.column);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, line, column);
  }

  @Override
  public boolean equals(Object that) {
    return this == that
        || (that instanceof Location loc
            && this.file.equals(loc.file)
            && this.line == loc.line
            && this.column == loc.column);
  }
}
