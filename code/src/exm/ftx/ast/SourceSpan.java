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
 * Provenance of an IR node: the file it came from, the range of lines it
 * covers and the raw text of that range.  Immutable.
 */
public class SourceSpan {
  private final String file;
  private final String text;
  private final int startLine;
  private final int endLine;

  public SourceSpan(String file, String text, int startLine, int endLine) {
    assert(text != null);
    assert(startLine <= endLine) : startLine + " > " + endLine;
    this.file = file;
    this.text = text;
    this.startLine = startLine;
    this.endLine = endLine;
  }

  /**
   * @return name of owning file, or null if not known
   */
  public String getFile() {
    return file;
  }

  public String getText() {
    return text;
  }

  public int getStartLine() {
    return startLine;
  }

  public int getEndLine() {
    return endLine;
  }

  public int lineCount() {
    return endLine - startLine + 1;
  }

  @Override
  public String toString() {
    return (file == null ? "<unknown>" : file) + ":" + startLine +
           (endLine != startLine ? "-" + endLine : "");
  }
}
