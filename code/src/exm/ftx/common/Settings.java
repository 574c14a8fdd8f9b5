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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

import exm.ftx.common.exceptions.InvalidOptionException;

/**
 * General FTX settings
 *
 * Defaults are set here and can be overridden by Java system properties
 * of the same name.
 * */
public class Settings
{
  /* If true, a name followed by an empty argument list is an error
   * rather than a provisional call */
  public static final String STRICT_CALLS = "ftx.lowering.strict-calls";
  /* Comma-separated names to treat as elementary intrinsics */
  public static final String EXTRA_INTRINSICS = "ftx.lowering.extra-intrinsics";

  public static final String CODEGEN_INDENT = "ftx.codegen.indent";

  public static final String LOG_FILE = "ftx.log.file";
  public static final String LOG_TRACE = "ftx.log.trace";

  /** Indentation width of generated statements, cached at validation */
  public static int CODEGEN_INDENT_WIDTH = 2;

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(STRICT_CALLS, "false");
    defaults.setProperty(EXTRA_INTRINSICS, "");
    defaults.setProperty(CODEGEN_INDENT, "2");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initFTXProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value)
      throws InvalidOptionException {
    properties.setProperty(key, value);
    validateProperties();
  }

  /**
   * Drop any overrides, returning to the defaults.
   */
  public static void reset() {
    properties.clear();
    CODEGEN_INDENT_WIDTH = 2;
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
    getBoolean(STRICT_CALLS);
    getBoolean(LOG_TRACE);
    int indent = getInt(CODEGEN_INDENT);
    if (indent < 0) {
      throw new InvalidOptionException("Indentation width " + CODEGEN_INDENT
          + " must be non-negative, but was " + indent);
    }
    CODEGEN_INDENT_WIDTH = indent;
    for (String name: getList(EXTRA_INTRINSICS)) {
      if (!StringUtils.isAlphanumeric(name.replace("_", ""))) {
        throw new InvalidOptionException("Invalid intrinsic name in " +
                  EXTRA_INTRINSICS + ": '" + name + "'");
      }
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  /**
   * @return trimmed, non-empty entries of a comma-separated property
   */
  public static List<String> getList(String key) {
    List<String> result = new ArrayList<String>();
    String val = properties.getProperty(key);
    if (val == null) {
      return result;
    }
    for (String item: StringUtils.split(val, ',')) {
      String trimmed = item.trim();
      if (trimmed.length() > 0) {
        result.add(trimmed);
      }
    }
    return result;
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

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
}
