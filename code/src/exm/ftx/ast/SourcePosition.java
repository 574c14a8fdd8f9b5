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
package exm.ftx.ast;

/**
 * Simple immutable class to record where a parse tree node sits in the
 * raw source.  Lines are 1-based; columns are 0-based with an exclusive
 * end, or {@link #NO_COLUMN} when the front end only reports lines.
 * @author tga
 *
 */
public class SourcePosition {
  public static final int NO_COLUMN = -1;

  public final int lineBegin;
  public final int colBegin;
  public final int lineEnd;
  public final int colEnd;

  public SourcePosition(int lineBegin, int colBegin, int lineEnd, int colEnd) {
    super();
    assert(lineBegin >= 1 && lineEnd >= lineBegin) : lineBegin + "-" + lineEnd;
    this.lineBegin = lineBegin;
    this.colBegin = colBegin;
    this.lineEnd = lineEnd;
    this.colEnd = colEnd;
  }

  /**
   * Position known only to line granularity
   */
  public static SourcePosition lines(int lineBegin, int lineEnd) {
    return new SourcePosition(lineBegin, NO_COLUMN, lineEnd, NO_COLUMN);
  }

  /**
   * Convert character offsets into the raw text, as reported by
   * token-based front ends, into line/column form.
   * @param text raw source text
   * @param start offset of first character
   * @param stop offset of last character (inclusive)
   */
  public static SourcePosition fromOffsets(String text, int start, int stop) {
    int line = 1;
    int lineStart = 0;
    int lineBegin = -1, colBegin = -1;
    int lastChar = Math.min(stop, text.length() - 1);
    for (int i = 0; i <= lastChar; i++) {
      if (i == start) {
        lineBegin = line;
        colBegin = i - lineStart;
      }
      if (text.charAt(i) == '\n' && i < lastChar) {
        line++;
        lineStart = i + 1;
      }
    }
    if (lineBegin < 0) {
      // Start offset past the end of the text
      return lines(line, line);
    }
    return new SourcePosition(lineBegin, colBegin, line,
                              lastChar - lineStart + 1);
  }

  public boolean hasColumns() {
    return colBegin != NO_COLUMN && colEnd != NO_COLUMN;
  }

  public String toString() {
    if (hasColumns()) {
      return lineBegin + ":" + colBegin + "-" + lineEnd + ":" + colEnd;
    }
    return lineBegin + "-" + lineEnd;
  }
}
