package partialspan.trace.core;

import partialspan.trace.api.PartialSpan;
import partialspan.trace.api.SpanId;

/**
 * A span past its initial delay that receives periodic heartbeats until it ends.
 *
 * <p>The entry's monitor serializes the heartbeat writes of the heartbeat worker with the end of
 * the span, so no heartbeat is written once {@link #markEnded()} returned.
 */
public final class ReadyEntry {
  private final SpanId spanId;
  private final PartialSpan span;

  // written by the heartbeat worker only
  private volatile long nextHeartbeatAtNanos;
  private volatile int heartbeatCount;

  // guarded by this
  private boolean ended;

  ReadyEntry(SpanId spanId, PartialSpan span, long nextHeartbeatAtNanos) {
    this.spanId = spanId;
    this.span = span;
    this.nextHeartbeatAtNanos = nextHeartbeatAtNanos;
  }

  public SpanId getSpanId() {
    return spanId;
  }

  public PartialSpan getSpan() {
    return span;
  }

  public long getNextHeartbeatAtNanos() {
    return nextHeartbeatAtNanos;
  }

  public int getHeartbeatCount() {
    return heartbeatCount;
  }

  void scheduleNext(long nextHeartbeatAtNanos) {
    this.nextHeartbeatAtNanos = nextHeartbeatAtNanos;
  }

  void onHeartbeat() {
    heartbeatCount++;
  }

  /** Must be called while holding the entry's monitor. */
  boolean isEnded() {
    return ended;
  }

  /** @return true iff this call ended the entry */
  synchronized boolean markEnded() {
    if (ended) {
      return false;
    }
    ended = true;
    return true;
  }

  boolean isDue(long nowNanos) {
    return nowNanos - nextHeartbeatAtNanos >= 0;
  }

  @Override
  public String toString() {
    return "ReadyEntry{spanId="
        + spanId
        + ", nextHeartbeatAtNanos="
        + nextHeartbeatAtNanos
        + ", heartbeatCount="
        + heartbeatCount
        + '}';
  }
}
