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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

import exm.minic.common.exceptions.InvalidOptionException;

/**
 * General MiniC settings
 *
 * Options are passed in as Java properties, e.g. -Dminic.frontend=antlr.
 * Anything not listed here as a default is ignored.
 * */
public class Settings
{
  /** Front end used to parse input: antlr or handwritten */
  public static final String FRONTEND = "minic.frontend";
  /** Parse with both front ends and check the ASTs agree */
  public static final String COMPARE_FRONTENDS = "minic.compare-frontends";

  public static final String INPUT_FILENAME = "minic.input_filename";
  public static final String OUTPUT_FILENAME = "minic.output_filename";

  public static final String LOG_FILE = "minic.log.file";
  public static final String LOG_TRACE = "minic.log.trace";

  public static final String FRONTEND_ANTLR = "antlr";
  public static final String FRONTEND_HANDWRITTEN = "handwritten";

  private static final Properties defaults;
  private static Properties properties;

  static {
    defaults = new Properties();
    // Set defaults here
    defaults.setProperty(FRONTEND, FRONTEND_ANTLR);
    defaults.setProperty(COMPARE_FRONTENDS, "false");
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(OUTPUT_FILENAME, "");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initMiniCProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  /**
   * Drop all values set since startup, leaving only the defaults
   */
  public static void reset() {
    properties = new Properties(defaults);
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public static String get(String key) {
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
  public static void validateProperties() throws InvalidOptionException {
    getBoolean(COMPARE_FRONTENDS);
    getBoolean(LOG_TRACE);
    checkOneOf(FRONTEND, Arrays.asList(FRONTEND_ANTLR, FRONTEND_HANDWRITTEN));
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  private static void checkOneOf(String key, List<String> validVals)
                                          throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    for (String vv: validVals) {
      if (val.equalsIgnoreCase(vv)) {
        return;
      }
    }
    throw new InvalidOptionException("Invalid value for property " + key
        + ": " + val + ".  Expected one of: "
        + StringUtils.join(validVals, ", "));
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String value = properties.getProperty(key);
    if (value == null) {
      throw new InvalidOptionException("Unknown setting " + key);
    }
    value = value.trim();
    if (value.equalsIgnoreCase("true")) {
      return true;
    } else if (value.equalsIgnoreCase("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean setting for " + key
          + ": " + value);
    }
  }
}
