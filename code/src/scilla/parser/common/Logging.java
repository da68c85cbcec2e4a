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
package scilla.parser.common;

import java.io.IOException;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import scilla.parser.common.exceptions.ScillaRuntimeError;

public class Logging {
  private static final String SCILLA_LOGGER_NAME = "scilla.parser";

  private static final String CONSOLE_PATTERN = "%-5p %m%n";
  private static final String FILE_PATTERN = "%r %-5p %c{1} %m%n";

  public static Logger getScillaLogger() {
    return Logger.getLogger(SCILLA_LOGGER_NAME);
  }

  /**
   * Configure the parser logger.  Warnings always go to stderr.
   * @param logfile if non-empty, also log to this file at DEBUG
   * @param trace log to the file at TRACE instead of DEBUG
   * @return the parser logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger logger = getScillaLogger();
    logger.removeAllAppenders();
    logger.setAdditivity(false);

    ConsoleAppender console = new ConsoleAppender(
                      new PatternLayout(CONSOLE_PATTERN),
                      ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(Level.WARN);
    logger.addAppender(console);

    if (StringUtils.isEmpty(logfile)) {
      logger.setLevel(Level.WARN);
      return logger;
    }

    Layout layout = new PatternLayout(FILE_PATTERN);
    try {
      FileAppender appender = new FileAppender(layout, logfile, false);
      logger.addAppender(appender);
    } catch (IOException e) {
      throw new ScillaRuntimeError("Could not open log file "
                                    + logfile + ": " + e.getMessage());
    }
    logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return logger;
  }
}
