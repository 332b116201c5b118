package partialspan.trace.core;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import partialspan.trace.api.PartialSpan;
import partialspan.trace.api.SpanId;
import partialspan.trace.api.time.TimeSource;

/**
 * A span waiting out its initial heartbeat delay.
 *
 * <p>Entries are never mutated or removed in place. An entry is cancelled by dropping it from the
 * processor's lookup, and equality is identity so that the lookup can tell a stale entry from a
 * newer one for the same {@link SpanId}.
 */
public final class DelayEntry implements Delayed {
  private static final AtomicLong SEQUENCE_GENERATOR = new AtomicLong();

  private final SpanId spanId;
  private final PartialSpan span;
  private final long dueAtNanos;
  private final long sequence;
  private final TimeSource timeSource;

  DelayEntry(SpanId spanId, PartialSpan span, long dueAtNanos, TimeSource timeSource) {
    this.spanId = spanId;
    this.span = span;
    this.dueAtNanos = dueAtNanos;
    this.sequence = SEQUENCE_GENERATOR.getAndIncrement();
    this.timeSource = timeSource;
  }

  public SpanId getSpanId() {
    return spanId;
  }

  public PartialSpan getSpan() {
    return span;
  }

  /** @return the {@link TimeSource#getNanoTicks() tick} at which the span may be promoted */
  public long getDueAtNanos() {
    return dueAtNanos;
  }

  @Override
  public long getDelay(TimeUnit unit) {
    return unit.convert(dueAtNanos - timeSource.getNanoTicks(), NANOSECONDS);
  }

  @Override
  public int compareTo(Delayed other) {
    if (this == other) {
      return 0;
    }
    long order;
    if (other instanceof DelayEntry) {
      DelayEntry that = (DelayEntry) other;
      order = dueAtNanos - that.dueAtNanos;
      if (order == 0) {
        order = sequence - that.sequence;
      }
    } else {
      order = getDelay(NANOSECONDS) - other.getDelay(NANOSECONDS);
    }
    return order < 0 ? -1 : (order > 0 ? 1 : 0);
  }

  @Override
  public String toString() {
    return "DelayEntry{spanId=" + spanId + ", dueAtNanos=" + dueAtNanos + '}';
  }
}
