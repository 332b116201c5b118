package partialspan.trace.api;

import static partialspan.trace.api.config.PartialTraceConfig.LOGGING_SINK_TYPE;

public final class ConfigDefaults {

  public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 5000;
  public static final long DEFAULT_HEARTBEAT_INITIAL_DELAY_MS = 5000;
  public static final long DEFAULT_PROMOTION_TICK_MS = 5000;

  public static final String DEFAULT_SINK_TYPE = LOGGING_SINK_TYPE;
  public static final String DEFAULT_SINK_LOGGER_NAME = "partialspan.snapshots";

  private ConfigDefaults() {}
}
