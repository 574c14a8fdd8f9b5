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

package exm.ftx.common.exceptions;

import exm.ftx.ast.SourceSpan;

/**
 * Represents an error caused by the input program or parse tree.
 * Thus, this should contain good error message information
 * */
public class UserException
extends Exception
{
  public UserException(SourceSpan span, String message)
  {
    this(span == null ? null : span.getFile(),
         span == null ? -1 : span.getStartLine(), message);
  }

  public UserException(String file, int line, String message) {
    super(location(file, line) + message);
  }

  public UserException(String message) {
    super(message);
  }

  private static String location(String file, int line) {
    if (line < 0) {
      return file == null ? "" : file + ": ";
    }
    return (file == null ? "<unknown>" : file) + ":" + line + ": ";
  }

  private static final long serialVersionUID = 1L;
}
