package partialspan.trace.api;

import static partialspan.trace.api.ConfigDefaults.DEFAULT_HEARTBEAT_INITIAL_DELAY_MS;
import static partialspan.trace.api.ConfigDefaults.DEFAULT_HEARTBEAT_INTERVAL_MS;
import static partialspan.trace.api.ConfigDefaults.DEFAULT_PROMOTION_TICK_MS;
import static partialspan.trace.api.ConfigDefaults.DEFAULT_SINK_LOGGER_NAME;
import static partialspan.trace.api.ConfigDefaults.DEFAULT_SINK_TYPE;
import static partialspan.trace.api.config.PartialTraceConfig.HEARTBEAT_INITIAL_DELAY_MS;
import static partialspan.trace.api.config.PartialTraceConfig.HEARTBEAT_INTERVAL_MS;
import static partialspan.trace.api.config.PartialTraceConfig.PROMOTION_TICK_MS;
import static partialspan.trace.api.config.PartialTraceConfig.RESOURCE_ATTRIBUTES;
import static partialspan.trace.api.config.PartialTraceConfig.SINK_LOGGER_NAME;
import static partialspan.trace.api.config.PartialTraceConfig.SINK_TYPE;

import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Config reads values with the following priority:
 *
 * <ol>
 *   <li>properties given to {@link #from(Properties)}
 *   <li>system properties
 *   <li>environment variables
 * </ol>
 *
 * <p>System properties are {@link ConfigProvider#PROPERTY_PREFIX}'ed. Environment variables are
 * the same as system property, but uppercased and '.' and '-' are replaced with '_'.
 */
public class Config {
  private static final Logger log = LoggerFactory.getLogger(Config.class);

  private static volatile Config INSTANCE;

  private final long heartbeatIntervalMillis;
  private final long initialHeartbeatDelayMillis;
  private final long promotionTickMillis;
  private final String sinkType;
  private final String sinkLoggerName;
  private final Map<String, String> resourceAttributes;

  private Config(ConfigProvider configProvider) {
    heartbeatIntervalMillis =
        nonNegative(configProvider, HEARTBEAT_INTERVAL_MS, DEFAULT_HEARTBEAT_INTERVAL_MS);
    initialHeartbeatDelayMillis =
        nonNegative(
            configProvider, HEARTBEAT_INITIAL_DELAY_MS, DEFAULT_HEARTBEAT_INITIAL_DELAY_MS);
    promotionTickMillis = nonNegative(configProvider, PROMOTION_TICK_MS, DEFAULT_PROMOTION_TICK_MS);
    sinkType = configProvider.getString(SINK_TYPE, DEFAULT_SINK_TYPE);
    sinkLoggerName = configProvider.getString(SINK_LOGGER_NAME, DEFAULT_SINK_LOGGER_NAME);
    resourceAttributes = configProvider.getMap(RESOURCE_ATTRIBUTES);
  }

  private static long nonNegative(ConfigProvider configProvider, String key, long defaultValue) {
    long value = configProvider.getLong(key, defaultValue);
    if (value < 0) {
      log.warn(
          "Provided {} of {} ms. It should be zero or greater. Setting it to the default value of {} ms.",
          key,
          value,
          defaultValue);
      return defaultValue;
    }
    return value;
  }

  public static Config get() {
    Config config = INSTANCE;
    if (config == null) {
      synchronized (Config.class) {
        config = INSTANCE;
        if (config == null) {
          config = new Config(ConfigProvider.createDefault());
          INSTANCE = config;
        }
      }
    }
    return config;
  }

  /** Builds a config from the given properties only, ignoring system sources. */
  public static Config from(Properties properties) {
    return new Config(ConfigProvider.withPropertiesOverride(properties));
  }

  // Visible for testing
  static Config from(ConfigProvider configProvider) {
    return new Config(configProvider);
  }

  public long getHeartbeatIntervalMillis() {
    return heartbeatIntervalMillis;
  }

  public long getInitialHeartbeatDelayMillis() {
    return initialHeartbeatDelayMillis;
  }

  public long getPromotionTickMillis() {
    return promotionTickMillis;
  }

  public String getSinkType() {
    return sinkType;
  }

  public String getSinkLoggerName() {
    return sinkLoggerName;
  }

  public Map<String, String> getResourceAttributes() {
    return resourceAttributes;
  }

  @Override
  public String toString() {
    return "Config{"
        + "heartbeatIntervalMillis="
        + heartbeatIntervalMillis
        + ", initialHeartbeatDelayMillis="
        + initialHeartbeatDelayMillis
        + ", promotionTickMillis="
        + promotionTickMillis
        + ", sinkType='"
        + sinkType
        + '\''
        + ", sinkLoggerName='"
        + sinkLoggerName
        + '\''
        + ", resourceAttributes="
        + resourceAttributes
        + '}';
  }
}
