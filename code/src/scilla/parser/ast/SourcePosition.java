/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package scilla.parser.ast;

/**
 * Simple immutable class to record a location in contract source
 */
public class SourcePosition {
  /** Character offset from the start of the source */
  public final int offset;
  /** 1-based line */
  public final int line;
  /** 1-based column */
  public final int column;

  public SourcePosition(int offset, int line, int column) {
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  public static final SourcePosition UNKNOWN = new SourcePosition(-1, 0, 0);

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SourcePosition)) {
      return false;
    }
    SourcePosition other = (SourcePosition)obj;
    return offset == other.offset && line == other.line &&
           column == other.column;
  }

  @Override
  public int hashCode() {
    return (offset * 31 + line) * 31 + column;
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
