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

package exm.tgs.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.tgs.common.exceptions.InvalidOptionException;
import exm.tgs.common.exceptions.TGSRuntimeError;
import exm.tgs.common.util.Pair;

public class Logging
{
  private static final String TGS_LOGGER_NAME = "exm.tgs";

  private static final String LOG_PATTERN = "%-5p %c{1} %m%n";

  /**
   * Messages already emitted.
   */
  static final Set<Pair<Level, String>> emitted =
       new HashSet<Pair<Level, String>>();

  public static Logger getTGSLogger()
  {
    return Logger.getLogger(TGS_LOGGER_NAME);
  }

  /**
   * Direct library logging to a file.
   * @param logfile log file path, or empty to leave appenders as configured
   * @param trace if true, log at TRACE level, otherwise DEBUG
   * @return the library logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger tgsLogger = getTGSLogger();
    if (logfile == null || logfile.length() == 0) {
      // Even if logging is disabled, this must be valid:
      return tgsLogger;
    }

    Layout layout = new PatternLayout(LOG_PATTERN);
    try {
      FileAppender appender = new FileAppender(layout, logfile, false);
      tgsLogger.addAppender(appender);
    } catch (IOException e) {
      throw new TGSRuntimeError("Could not open log file: " + logfile, e);
    }
    tgsLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return tgsLogger;
  }

  /**
   * Read settings from system properties, then set up logging as
   * configured by {@link Settings#LOG_FILE} and {@link Settings#LOG_TRACE}
   * @return the library logger
   * @throws InvalidOptionException if a setting is invalid
   */
  public static Logger setupFromSettings() throws InvalidOptionException
  {
    Settings.initTGSProperties();
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
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getTGSLogger().warn(msg);
    else
      getTGSLogger().debug("Duplicate Warning: " + msg);
  }
}
