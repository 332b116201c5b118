package partialspan.trace.api;

import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableMap;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves configuration keys against, in order, explicitly supplied properties, system properties
 * ({@code partialspan.<key>}) and environment variables ({@code PARTIALSPAN_<KEY>}).
 */
public final class ConfigProvider {
  private static final Logger log = LoggerFactory.getLogger(ConfigProvider.class);

  static final String PROPERTY_PREFIX = "partialspan.";
  static final String ENV_PREFIX = "PARTIALSPAN_";

  private final Properties overrides;
  private final boolean useSystemSources;

  private ConfigProvider(Properties overrides, boolean useSystemSources) {
    this.overrides = overrides;
    this.useSystemSources = useSystemSources;
  }

  public static ConfigProvider createDefault() {
    return new ConfigProvider(new Properties(), true);
  }

  /** Only the given properties are consulted; keys are given without the property prefix. */
  public static ConfigProvider withPropertiesOverride(Properties properties) {
    return new ConfigProvider(properties, false);
  }

  @Nullable
  public String getString(String key) {
    String value = overrides.getProperty(key);
    if (value == null && useSystemSources) {
      value = systemProperty(PROPERTY_PREFIX + key);
      if (value == null) {
        value = environmentVariable(toEnvVar(key));
      }
    }
    if (value != null) {
      value = value.trim();
      if (value.isEmpty()) {
        value = null;
      }
    }
    return value;
  }

  public String getString(String key, String defaultValue) {
    String value = getString(key);
    return value != null ? value : defaultValue;
  }

  public long getLong(String key, long defaultValue) {
    String value = getString(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      log.warn(
          "Invalid configuration for {}: '{}' is not a number, using {}", key, value, defaultValue);
      return defaultValue;
    }
  }

  /**
   * Parses a {@code key:value,key2:value2} list. Entries without a colon or with an empty key are
   * skipped.
   */
  public Map<String, String> getMap(String key) {
    String value = getString(key);
    if (value == null) {
      return emptyMap();
    }
    Map<String, String> map = new LinkedHashMap<>();
    for (String entry : value.split(",")) {
      int separator = entry.indexOf(':');
      if (separator <= 0) {
        log.debug("Ignoring malformed entry '{}' for {}", entry, key);
        continue;
      }
      String entryKey = entry.substring(0, separator).trim();
      String entryValue = entry.substring(separator + 1).trim();
      if (!entryKey.isEmpty()) {
        map.put(entryKey, entryValue);
      }
    }
    return unmodifiableMap(map);
  }

  static String toEnvVar(String key) {
    return ENV_PREFIX + key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
  }

  @Nullable
  private static String systemProperty(String property) {
    try {
      return System.getProperty(property);
    } catch (SecurityException ignored) {
      return null;
    }
  }

  @Nullable
  private static String environmentVariable(String name) {
    try {
      return System.getenv(name);
    } catch (SecurityException ignored) {
      return null;
    }
  }
}
