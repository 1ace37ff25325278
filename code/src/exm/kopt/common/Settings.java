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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

import exm.kopt.common.exceptions.InvalidOptionException;

/**
 * General optimizer settings
 *
 * Defaults are set here and can be overridden from Java system properties
 * with {@link #initKOptProperties()}, or programmatically with
 * {@link #set(String, String)}.
 * */
public class Settings
{
  public static final String OPT_LICM = "kopt.opt.licm";
  public static final String OPT_INTERCHANGE = "kopt.opt.interchange";
  /* Comma separated loop permutation, e.g. "1,0".  Empty for none */
  public static final String OPT_INTERCHANGE_PERM = "kopt.opt.interchange.perm";
  /* Fold loops hoisted to the pre-header that have the same bounds */
  public static final String OPT_FUSE_HOISTED = "kopt.opt.fuse-hoisted";

  /* Namespace of directives we act on, e.g. "#pragma pyop2 ..." */
  public static final String DIRECTIVE_NAMESPACE = "kopt.directive.namespace";

  public static final String LICM_TEMP_PREFIX = "kopt.licm.temp-prefix";
  /* Element type of temporaries if we can't find target's declaration */
  public static final String LICM_DEFAULT_TYPE = "kopt.licm.default-type";

  public static final String LOG_FILE = "kopt.log.file";
  public static final String LOG_TRACE = "kopt.log.trace";

  private static final Properties defaults;
  private static final Properties properties;

  static {
    defaults = new Properties();
    // Set defaults here
    defaults.setProperty(OPT_LICM, "true");
    defaults.setProperty(OPT_INTERCHANGE, "true");
    defaults.setProperty(OPT_INTERCHANGE_PERM, "");
    defaults.setProperty(OPT_FUSE_HOISTED, "true");
    defaults.setProperty(DIRECTIVE_NAMESPACE, "pyop2");
    defaults.setProperty(LICM_TEMP_PREFIX, "LI");
    defaults.setProperty(LICM_DEFAULT_TYPE, "double");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initKOptProperties() throws InvalidOptionException {
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
   * Drop all overrides and go back to defaults
   */
  public static void reset() {
    properties.clear();
  }

  public static List<String> getKeys() {
    List<String> keys = new ArrayList<String>(
                            properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  private static void validateProperties() throws InvalidOptionException {
    getBoolean(OPT_LICM);
    getBoolean(OPT_INTERCHANGE);
    getBoolean(OPT_FUSE_HOISTED);
    getBoolean(LOG_TRACE);
    getPermutation(OPT_INTERCHANGE_PERM);
    if (StringUtils.isBlank(get(LICM_TEMP_PREFIX))) {
      throw new InvalidOptionException("option " + LICM_TEMP_PREFIX +
                                       " must not be empty");
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
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

  /**
   * Parse a comma separated list of integers.  Only checks syntax: whether
   * it is a valid permutation depends on the loop nest.
   * @param key
   * @return the integers, or null if the option is empty
   * @throws InvalidOptionException
   */
  public static int[] getPermutation(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (StringUtils.isBlank(strVal)) {
      return null;
    }
    String[] toks = StringUtils.split(strVal, ',');
    int[] perm = new int[toks.length];
    for (int i = 0; i < toks.length; i++) {
      try {
        perm[i] = Integer.parseInt(toks[i].trim());
      } catch (NumberFormatException e) {
        throw new InvalidOptionException("Invalid loop index in option " +
            key + ": '" + toks[i] + "'");
      }
    }
    return perm;
  }
}
