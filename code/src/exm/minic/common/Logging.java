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
package exm.minic.common;

import java.io.IOException;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.minic.common.exceptions.InvalidOptionException;

public class Logging {
  private static final String MINIC_LOGGER_NAME = "exm.minic";

  private static final String FILE_LOG_PATTERN = "%-5p %d{HH:mm:ss} %m%n";

  public static Logger getMiniCLogger() {
    return Logger.getLogger(MINIC_LOGGER_NAME);
  }

  /**
   * Configure the compiler logger.  The console appender comes from
   * log4j.properties; here we only add the optional log file.
   * @param logfile path of log file, empty or null for none
   * @param trace if true, log everything down to TRACE level
   * @return the compiler logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws InvalidOptionException {
    Logger minicLogger = getMiniCLogger();
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(
            new PatternLayout(FILE_LOG_PATTERN), logfile, false);
        appender.setName("minic-logfile");
        minicLogger.removeAppender("minic-logfile");
        minicLogger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file "
                                  + logfile + ": " + e.getMessage());
      }
      minicLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else if (trace) {
      minicLogger.setLevel(Level.TRACE);
    }
    // Even if logging is disabled, this must be valid:
    return minicLogger;
  }
}
