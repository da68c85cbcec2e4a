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

import java.util.Properties;

import scilla.parser.common.exceptions.InvalidOptionException;

/**
 * Parser settings, read from Java system properties with defaults.
 */
public class Settings {

  public static final String LOG_FILE = "scilla.log.file";
  public static final String LOG_TRACE = "scilla.log.trace";
  public static final String PRINT_TYPES = "scilla.print.types";
  public static final String INPUT_FILENAME = "scilla.input_filename";

  private static final Properties defaults;
  private static Properties properties;

  static {
    defaults = new Properties();
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(PRINT_TYPES, "true");
    properties = new Properties(defaults);
  }

  /**
   * Override defaults with any values given as system properties,
   * then check that they are well formed.
   * @throws InvalidOptionException
   */
  public static void initProperties() throws InvalidOptionException {
    Properties sysprops = System.getProperties();
    for (String key: defaults.stringPropertyNames()) {
      String val = sysprops.getProperty(key);
      if (val != null) {
        properties.setProperty(key, val);
      }
    }
    getBoolean(LOG_TRACE);
    getBoolean(PRINT_TYPES);
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public static String get(String key) {
    return properties.getProperty(key);
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Unknown setting " + key);
    }
    val = val.trim();
    if (val.equals("true")) {
      return true;
    } else if (val.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for "
                                + key + ": \"" + val + "\"");
    }
  }

  /**
   * Restore all defaults.  Used by tests.
   */
  public static void reset() {
    properties = new Properties(defaults);
  }
}
