package partialspan.trace.api.config;

/**
 * Keys of the partial span settings. Each key is looked up as the system property {@code
 * partialspan.<key>}, then as the environment variable {@code PARTIALSPAN_<KEY>}.
 */
public final class PartialTraceConfig {
  public static final String HEARTBEAT_INTERVAL_MS = "heartbeat.interval.ms";
  public static final String HEARTBEAT_INITIAL_DELAY_MS = "heartbeat.initial-delay.ms";
  public static final String PROMOTION_TICK_MS = "promotion.tick.ms";

  public static final String SINK_TYPE = "sink.type";
  public static final String SINK_LOGGER_NAME = "sink.logger.name";

  public static final String RESOURCE_ATTRIBUTES = "resource.attributes";

  public static final String LOGGING_SINK_TYPE = "logging";
  public static final String PRINTING_SINK_TYPE = "printing";

  private PartialTraceConfig() {}
}
