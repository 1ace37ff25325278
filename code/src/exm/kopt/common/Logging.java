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
package exm.kopt.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.kopt.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String KOPT_LOGGER_NAME = "exm.kopt";

  private static final String LOG_PATTERN = "%-5p %c{1}: %m%n";

  /**
   * Messages already emitted, keyed by level and text.
   */
  static final Set<String> emitted = new HashSet<String>();

  public static Logger getKOptLogger()
  {
    return Logger.getLogger(KOPT_LOGGER_NAME);
  }

  /**
   * Send optimizer log output to a file.
   * @param logfile path of log file; null or empty leaves log4j configuration
   *                untouched
   * @param trace if true, log at TRACE level, otherwise DEBUG
   * @return the optimizer logger
   * @throws IOException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws IOException
  {
    Logger koptLogger = getKOptLogger();
    if (logfile == null || logfile.length() == 0) {
      // Even if logging is disabled, this must be valid:
      return koptLogger;
    }

    Layout layout = new PatternLayout(LOG_PATTERN);
    FileAppender appender = new FileAppender(layout, logfile, false);
    koptLogger.addAppender(appender);
    koptLogger.setAdditivity(false);
    koptLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return koptLogger;
  }

  /**
   * Set up logging from {@link Settings#LOG_FILE} and
   * {@link Settings#LOG_TRACE}
   */
  public static Logger setupLogging()
      throws IOException, InvalidOptionException
  {
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Settings.getBoolean(Settings.LOG_TRACE));
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    return emitted.add(level.toString() + ":" + msg);
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getKOptLogger().warn(msg);
    else
      getKOptLogger().debug("Duplicate Warning: " + msg);
  }
}
