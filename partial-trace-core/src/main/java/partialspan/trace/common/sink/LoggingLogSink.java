package partialspan.trace.common.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs each snapshot at INFO. The processor puts {@code span.state} and {@code log.body.type} in
 * the MDC for the duration of the call, so a layout or appender can route on them.
 */
public class LoggingLogSink implements LogSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingLogSink.class);

  private final Logger snapshotLogger;

  public LoggingLogSink(final String loggerName) {
    this(LoggerFactory.getLogger(loggerName));
  }

  public LoggingLogSink(final Logger snapshotLogger) {
    this.snapshotLogger = snapshotLogger;
    log.info("Writing partial span snapshots to logger {}", snapshotLogger.getName());
  }

  @Override
  public void write(final String line) {
    snapshotLogger.info(line);
  }

  @Override
  public String toString() {
    return "LoggingLogSink { logger=" + snapshotLogger.getName() + " }";
  }
}
