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

package exm.vlint.common;

import java.io.IOException;

import org.apache.log4j.Appender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.vlint.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String VLINT_LOGGER_NAME = "exm.vlint";

  private static final String LOG_PATTERN = "%-5p %c{1} %m%n";

  /** Name of the file appender added by setupLogging */
  public static final String FILE_APPENDER_NAME = "vlint-file";

  public static Logger getVLintLogger()
  {
    return Logger.getLogger(VLINT_LOGGER_NAME);
  }

  /**
   * Send VLint log output to a file.
   * @param logfile file to write, or empty to keep the default appenders
   * @param trace if true log at TRACE level, otherwise at DEBUG
   * @return the VLint logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger vlintLogger = getVLintLogger();
    if (logfile == null || logfile.length() == 0) {
      // Even if logging is disabled, this must be valid:
      return vlintLogger;
    }

    // Replace the appender from any earlier call
    Appender previous = vlintLogger.getAppender(FILE_APPENDER_NAME);
    if (previous != null) {
      vlintLogger.removeAppender(previous);
      previous.close();
    }

    try {
      FileAppender appender = new FileAppender(
                      new PatternLayout(LOG_PATTERN), logfile, false);
      appender.setName(FILE_APPENDER_NAME);
      vlintLogger.addAppender(appender);
    } catch (IOException e) {
      vlintLogger.warn("Could not open log file " + logfile + ": " +
                        e.getMessage());
      return vlintLogger;
    }
    vlintLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return vlintLogger;
  }

  /**
   * Set up logging from the vlint.log.* settings
   */
  public static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return setupLogging(logfile, trace);
  }
}
