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
package exm.ftx.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.Appender;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.ftx.common.exceptions.InvalidOptionException;

public class Logging {
  private static final String FTX_LOGGER_NAME = "exm.ftx";

  private static final String LOG_PATTERN = "%-5p %c{1} %m%n";

  /**
   * Messages already emitted, keyed by level and text.
   */
  private static final Set<String> emitted = new HashSet<String>();

  public static Logger getFTXLogger() {
    return Logger.getLogger(FTX_LOGGER_NAME);
  }

  /**
   * Attach an appender to the FTX logger.
   * @param logfile file to log to, or empty to log to stderr
   * @param trace if true, log at TRACE level, otherwise DEBUG for a log
   *              file and WARN for the console
   * @return the configured logger
   * @throws InvalidOptionException if the log file cannot be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
        throws InvalidOptionException {
    Logger ftxLogger = getFTXLogger();
    Layout layout = new PatternLayout(LOG_PATTERN);
    Appender appender;
    Level level;
    if (logfile != null && logfile.length() > 0) {
      try {
        appender = new FileAppender(layout, logfile, false);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file " +
                                          logfile + ": " + e.getMessage());
      }
      level = trace ? Level.TRACE : Level.DEBUG;
    } else {
      appender = new ConsoleAppender(layout, ConsoleAppender.SYSTEM_ERR);
      level = trace ? Level.TRACE : Level.WARN;
    }
    ftxLogger.removeAllAppenders();
    ftxLogger.addAppender(appender);
    ftxLogger.setLevel(level);
    ftxLogger.setAdditivity(false);
    return ftxLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    synchronized (emitted) {
      return emitted.add(level + ":" + msg);
    }
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getFTXLogger().warn(msg);
    } else {
      Logging.getFTXLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
