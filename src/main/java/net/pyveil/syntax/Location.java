// Copyright 2025 The Bazel Authors. All rights reserved.
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

package net.pyveil.syntax;

import com.google.common.base.Preconditions;
import java.util.Objects;

/**
 * A Location denotes a position within a source file: a file name and a one-based line and column.
 * A column of zero means the column is unknown.
 */
public final class Location implements Comparable<Location> {

  /** The location of nodes that were synthesized rather than parsed. */
  public static final Location SYNTHETIC = new Location("<synthetic>", 0, 0);

  private final String file;
  private final int line;
  private final int column;

  public Location(String file, int line, int column) {
    this.file = Preconditions.checkNotNull(file);
    this.line = line;
    this.column = column;
  }

  public String file() {
    return file;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  @Override
  public int compareTo(Location that) {
    int cmp = file.compareTo(that.file);
    if (cmp != 0) {
      return cmp;
    }
    return Long.compare(((long) line << 32) | column, ((long) that.line << 32) | that.column);
  }

  @Override
  public boolean equals(Object that) {
    return this == that
        || (that instanceof Location loc
            && file.equals(loc.file)
            && line == loc.line
            && column == loc.column);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, line, column);
  }

  /** Formats the location as "file:line:column", omitting the column when unknown. */
  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder().append(file);
    if (line != 0) {
      buf.append(':').append(line);
      if (column != 0) {
        buf.append(':').append(column);
      }
    }
    return buf.toString();
  }
}
