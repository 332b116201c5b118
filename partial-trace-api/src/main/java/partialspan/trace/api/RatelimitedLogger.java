package partialspan.trace.api;

import static java.util.concurrent.TimeUnit.MINUTES;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import partialspan.trace.api.time.SystemTimeSource;
import partialspan.trace.api.time.TimeSource;

/**
 * Logger that logs message once per given delay if debugging is disabled. If debugging is enabled
 * then it logs every time.
 */
public class RatelimitedLogger {

  private final Logger log;
  private final long delayNanos;
  private final String suffix;
  private final TimeSource timeSource;

  private final AtomicLong previousErrorLogNanos = new AtomicLong();
  private volatile boolean logged;

  public RatelimitedLogger(final Logger log, final long delay, final TimeUnit unit) {
    this(log, delay, unit, SystemTimeSource.INSTANCE);
  }

  public RatelimitedLogger(
      final Logger log, final long delay, final TimeUnit unit, final TimeSource timeSource) {
    this.log = log;
    this.delayNanos = unit.toNanos(delay);
    this.suffix = " (Will not log warnings for " + describe(delay, unit) + ")";
    this.timeSource = timeSource;
  }

  /** @return true if actually logged the message, false otherwise */
  public boolean warn(final String format, final Object... arguments) {
    if (log.isDebugEnabled()) {
      log.warn(format, arguments);
      return true;
    }
    if (log.isWarnEnabled()) {
      final long previous = previousErrorLogNanos.get();
      final long now = timeSource.getNanoTicks();
      if (!logged || now - previous >= delayNanos) {
        if (previousErrorLogNanos.compareAndSet(previous, now)) {
          logged = true;
          log.warn(format + suffix, arguments);
          return true;
        }
      }
    }
    return false;
  }

  private static String describe(long delay, TimeUnit unit) {
    if (unit == MINUTES || unit.toMinutes(delay) * 60 == unit.toSeconds(delay)) {
      long minutes = unit.toMinutes(delay);
      return minutes == 1 ? "1 minute" : minutes + " minutes";
    }
    return delay + " " + unit.name().toLowerCase(Locale.ROOT);
  }
}
