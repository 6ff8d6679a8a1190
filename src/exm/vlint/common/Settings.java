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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

import exm.vlint.common.exceptions.InvalidOptionException;

/**
 * General VLint settings.  Defaults are set here and can be overridden
 * with Java system properties of the same name, e.g.
 * -Dvlint.check.latch-inference=false
 */
public class Settings
{
  public static final String CHECK_ASSIGNMENT_STYLE =
                                        "vlint.check.assignment-style";
  public static final String CHECK_MULTI_DRIVER = "vlint.check.multi-driver";
  public static final String CHECK_WIDTH_MISMATCH =
                                        "vlint.check.width-mismatch";
  public static final String CHECK_CONSTANT_OVERFLOW =
                                        "vlint.check.constant-overflow";
  public static final String CHECK_LATCH_INFERENCE =
                                        "vlint.check.latch-inference";
  public static final String CHECK_UNREACHABLE_BLOCK =
                                        "vlint.check.unreachable-block";
  public static final String CHECK_NON_FULL_CASE = "vlint.check.non-full-case";
  public static final String CHECK_UNREACHABLE_FSM_STATE =
                                        "vlint.check.unreachable-fsm-state";
  public static final String CHECK_UNINITIALIZED_REGISTER =
                                        "vlint.check.uninitialized-register";

  /** Substring that marks a parameter as an FSM state constant */
  public static final String FSM_STATE_MARKER = "vlint.fsm.state-marker";

  public static final String LOG_FILE = "vlint.log.file";
  public static final String LOG_TRACE = "vlint.log.trace";

  private static final List<String> CHECK_KEYS = Arrays.asList(
      CHECK_ASSIGNMENT_STYLE, CHECK_MULTI_DRIVER, CHECK_WIDTH_MISMATCH,
      CHECK_CONSTANT_OVERFLOW, CHECK_LATCH_INFERENCE, CHECK_UNREACHABLE_BLOCK,
      CHECK_NON_FULL_CASE, CHECK_UNREACHABLE_FSM_STATE,
      CHECK_UNINITIALIZED_REGISTER);

  private static final Properties defaults;
  private static final Properties properties;

  static {
    defaults = new Properties();
    for (String check: CHECK_KEYS) {
      defaults.setProperty(check, "true");
    }
    defaults.setProperty(FSM_STATE_MARKER, "STATE");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initVLintProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any overrides so that every key has its default value again
   */
  public static void restoreDefaults() {
    properties.clear();
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

  public static List<String> getCheckKeys() {
    return Collections.unmodifiableList(CHECK_KEYS);
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    for (String check: CHECK_KEYS) {
      getBoolean(check);
    }
    getBoolean(LOG_TRACE);

    if (StringUtils.isBlank(get(FSM_STATE_MARKER))) {
      throw new InvalidOptionException("Option " + FSM_STATE_MARKER +
                                       " must not be empty");
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
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
