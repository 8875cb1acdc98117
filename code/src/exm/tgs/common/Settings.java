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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

import exm.tgs.common.exceptions.InvalidOptionException;

/**
 * General library settings.
 *
 * Defaults are set here and can be overridden by Java system properties
 * with the same key.
 * */
public class Settings
{
  /** Max number of rows a deep variable product may generate */
  public static final String DEEP_PRODUCT_LIMIT = "tgs.deep-product.limit";

  public static final String LOG_FILE = "tgs.log.file";
  public static final String LOG_TRACE = "tgs.log.trace";

  private static final String PREFIX = "tgs.";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(DEEP_PRODUCT_LIMIT, "1024");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initTGSProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    for (String key: System.getProperties().stringPropertyNames()) {
      if (key.startsWith(PREFIX) && get(key) == null) {
        Logging.uniqueWarn("Unknown setting " + key + " ignored");
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop an override so that the default applies again
   * @param key
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    long limit = getLong(DEEP_PRODUCT_LIMIT);
    if (limit <= 0) {
      throw new InvalidOptionException("Expected positive value for " +
                    DEEP_PRODUCT_LIMIT + " but was " + limit);
    }
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = getNonBlank(key);
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = getNonBlank(key);
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = getNonBlank(key);

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }

  private static String getNonBlank(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (StringUtils.isBlank(strVal)) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    return strVal;
  }
}
