package partialspan.trace.common.sink;

import static partialspan.trace.api.config.PartialTraceConfig.LOGGING_SINK_TYPE;
import static partialspan.trace.api.config.PartialTraceConfig.PRINTING_SINK_TYPE;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import partialspan.trace.api.Config;

public class LogSinkFactory {
  private static final Logger log = LoggerFactory.getLogger(LogSinkFactory.class);

  private LogSinkFactory() {}

  public static LogSink createLogSink(final Config config) {
    return createLogSink(config, config.getSinkType());
  }

  public static LogSink createLogSink(final Config config, final String configuredType) {
    if (PRINTING_SINK_TYPE.equals(configuredType)) {
      return new PrintingLogSink(System.out);
    }
    if (!LOGGING_SINK_TYPE.equals(configuredType)) {
      log.warn(
          "Unknown partial span sink type '{}', using '{}'", configuredType, LOGGING_SINK_TYPE);
    }
    return new LoggingLogSink(config.getSinkLoggerName());
  }
}
