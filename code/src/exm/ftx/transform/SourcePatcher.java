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
package exm.ftx.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.log4j.Logger;

import exm.ftx.ast.SourceSpan;
import exm.ftx.common.Logging;
import exm.ftx.common.exceptions.FTXRuntimeError;
import exm.ftx.common.util.StringUtil;

/**
 * Replaces whole line ranges of a raw source buffer with new text.
 * Replacements are applied last span first, so line numbers of the
 * remaining spans stay valid.
 */
public class SourcePatcher {

  private static final Logger logger = Logging.getFTXLogger();

  private final String rawSource;
  private final List<Replacement> replacements = new ArrayList<Replacement>();

  public SourcePatcher(String rawSource) {
    this.rawSource = rawSource;
  }

  /**
   * Replace the lines covered by span with text
   * @param span span of a node, from the source this patcher applies to
   * @param text replacement, without trailing newline
   */
  public void replace(SourceSpan span, String text) {
    if (span == null) {
      throw new FTXRuntimeError("Cannot patch node without source span");
    }
    for (Replacement r: replacements) {
      if (span.getStartLine() <= r.span.getEndLine() &&
          r.span.getStartLine() <= span.getEndLine()) {
        throw new FTXRuntimeError("Replacement of " + span +
                                  " overlaps replacement of " + r.span);
      }
    }
    replacements.add(new Replacement(span, text));
  }

  public String apply() {
    List<String> lines = new ArrayList<String>(splitLines(rawSource));
    List<Replacement> sorted = new ArrayList<Replacement>(replacements);
    Collections.sort(sorted, new Comparator<Replacement>() {
      @Override
      public int compare(Replacement a, Replacement b) {
        return b.span.getStartLine() - a.span.getStartLine();
      }
    });
    for (Replacement r: sorted) {
      int begin = r.span.getStartLine() - 1;
      int end = r.span.getEndLine();
      if (begin < 0 || end > lines.size()) {
        throw new FTXRuntimeError("Span " + r.span + " outside source of "
                                  + lines.size() + " lines");
      }
      logger.trace("Replacing lines " + r.span.getStartLine() + "-" +
                   r.span.getEndLine());
      List<String> range = lines.subList(begin, end);
      range.clear();
      range.addAll(splitLines(r.text));
    }
    return StringUtil.concat("\n", lines);
  }

  private static List<String> splitLines(String text) {
    List<String> result = new ArrayList<String>();
    for (String l: text.split("\n", -1)) {
      result.add(l);
    }
    return result;
  }

  private static class Replacement {
    final SourceSpan span;
    final String text;

    Replacement(SourceSpan span, String text) {
      this.span = span;
      this.text = text;
    }
  }
}
