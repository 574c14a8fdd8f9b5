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
package exm.ftx.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.ftx.ast.ParseNode;
import exm.ftx.ast.SourceSpan;
import exm.ftx.common.Logging;

/**
 * Indented log output for tracing the descent of lowering through a
 * parse tree.
 */
public class LogHelper {
  private static final Logger logger = Logging.getFTXLogger();

  public static void logChildren(int indent, ParseNode node) {
    for (ParseNode child: node.children()) {
      trace(indent+2, child.getTag());
    }
  }

  /**
     DEBUG-level with indentation for nice output
   */
  public static void debug(int indent, String msg) {
    log(indent, Level.DEBUG, msg);
  }

  /**
     TRACE-level with indentation for nice output
   */
  public static void trace(int indent, String msg) {
    log(indent, Level.TRACE, msg);
  }

  public static void trace(int indent, SourceSpan span, String msg) {
    log(indent, Level.TRACE, span == null ? "" : span + ": ", msg);
  }

  public static void log(int indent, Level level, String location,
                         String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(256);
    sb.append(location);
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }

  public static void log(int indent, Level level, String msg) {
    log(indent, level, "", msg);
  }

  public static boolean isTraceEnabled() {
    return logger.isTraceEnabled();
  }
}
