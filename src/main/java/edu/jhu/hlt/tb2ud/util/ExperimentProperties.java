package edu.jhu.hlt.tb2ud.util;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Splitter;

/**
 * Methods with defaults will return the default if the key is not in this map,
 * and also add the (key, defaultValue) pair to this map, so that printing it
 * afterwards shows every setting a run used.
 *
 * @author travis
 */
public class ExperimentProperties extends java.util.Properties {
  private static final long serialVersionUID = 1L;

  /**
   * Reads "key value key value ..." style main args.
   */
  public static ExperimentProperties init(String[] mainArgs) {
    ExperimentProperties config = new ExperimentProperties();
    config.putAll(mainArgs);
    return config;
  }

  public void putAll(String[] mainArgs) {
    putAll(mainArgs, false);
  }

  public void putAll(String[] mainArgs, boolean allowOverwrites) {
    if (mainArgs.length % 2 != 0)
      throw new IllegalArgumentException("expected key value pairs, got " + mainArgs.length + " args");
    for (int i = 0; i < mainArgs.length; i += 2) {
      Object old = put(mainArgs[i], mainArgs[i+1]);
      if (!allowOverwrites && old != null) {
        throw new RuntimeException(mainArgs[i] + " has two values: "
            + mainArgs[i+1] + " and " + old);
      }
    }
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, String.valueOf(defaultValue));
      return defaultValue;
    }
    return Boolean.parseBoolean(value);
  }

  public File getExistingFile(String key) {
    File f = getFile(key);
    if (!f.isFile())
      throw new RuntimeException(key + "=" + f.getPath() + " is not a file");
    return f;
  }

  public File getFile(String key) {
    return new File(getString(key));
  }

  public String getString(String key, String defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, defaultValue);
      return defaultValue;
    }
    return value;
  }

  public String getString(String key) {
    String value = getProperty(key);
    if (value == null)
      throw new RuntimeException("missing required property: " + key);
    return value;
  }

  /** Comma separated values, trimmed, empty ones dropped */
  public List<String> getList(String key, String defaultValue) {
    String value = getString(key, defaultValue);
    return new ArrayList<>(Splitter.on(',').trimResults().omitEmptyStrings().splitToList(value));
  }
}
