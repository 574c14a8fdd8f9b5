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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.ftx.common.exceptions.FTXRuntimeError;
import exm.ftx.common.util.StringUtil;

/**
 * Maps the position metadata of a parse tree node onto the raw text of
 * the file it was parsed from.
 */
public class SourceRangeExtractor {

  private final String file;
  /** Lines of the raw source, each including its line terminator */
  private final List<String> lines;

  public SourceRangeExtractor(String file, String rawSource) {
    this.file = file;
    this.lines = Collections.unmodifiableList(splitLines(rawSource));
  }

  public static SourceSpan extract(SourcePosition pos, String rawSource,
                                   boolean fullLines) {
    return new SourceRangeExtractor(null, rawSource).extract(pos, fullLines);
  }

  /**
   * @param pos position of the node
   * @param fullLines if true, round the span out to whole lines.  This is
   *      always the case if the position has no column information.
   * @return the span, never null
   */
  public SourceSpan extract(SourcePosition pos, boolean fullLines) {
    if (pos.lineBegin < 1 || pos.lineEnd < pos.lineBegin) {
      throw new FTXRuntimeError("Invalid line range " + pos);
    }
    if (pos.lineEnd > lines.size()) {
      throw new FTXRuntimeError("Position " + pos + " is past the end of "
          + (file == null ? "source" : file) + " with " + lines.size()
          + " lines");
    }
    List<String> range = lines.subList(pos.lineBegin - 1, pos.lineEnd);

    if (fullLines || !pos.hasColumns()) {
      return new SourceSpan(file, StringUtil.concat("", range),
                            pos.lineBegin, pos.lineEnd);
    }

    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < range.size(); i++) {
      String line = range.get(i);
      int begin = (i == 0) ? Math.min(pos.colBegin, line.length()) : 0;
      int end = line.length();
      if (i == range.size() - 1) {
        end = Math.max(begin, Math.min(pos.colEnd, contentLength(line)));
      }
      sb.append(line, begin, end);
    }
    return new SourceSpan(file, StringUtil.trimNewlines(sb.toString()),
                          pos.lineBegin, pos.lineEnd);
  }

  public int lineCount() {
    return lines.size();
  }

  private static int contentLength(String line) {
    int n = line.length();
    while (n > 0 && (line.charAt(n - 1) == '\n' || line.charAt(n - 1) == '\r'))
      n--;
    return n;
  }

  /**
   * Split text into lines, keeping line terminators
   */
  static List<String> splitLines(String text) {
    List<String> result = new ArrayList<String>();
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        result.add(text.substring(start, i + 1));
        start = i + 1;
      }
    }
    if (start < text.length()) {
      result.add(text.substring(start));
    }
    return result;
  }
}
