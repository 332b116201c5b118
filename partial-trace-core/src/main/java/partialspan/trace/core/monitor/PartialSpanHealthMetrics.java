package partialspan.trace.core.monitor;

import java.util.concurrent.atomic.LongAdder;
import partialspan.trace.core.Signal;

/** Counts processor events, read through {@link #summary()} or the getters. */
public class PartialSpanHealthMetrics extends HealthMetrics {
  private final LongAdder startedSpans = new LongAdder();
  private final LongAdder cancelledSpans = new LongAdder();
  private final LongAdder promotedSpans = new LongAdder();
  private final LongAdder discardedStaleEntries = new LongAdder();
  private final LongAdder heartbeats = new LongAdder();
  private final LongAdder stops = new LongAdder();
  private final LongAdder unknownEnds = new LongAdder();
  private final LongAdder failedHeartbeatSerializations = new LongAdder();
  private final LongAdder failedStopSerializations = new LongAdder();
  private final LongAdder failedHeartbeatWrites = new LongAdder();
  private final LongAdder failedStopWrites = new LongAdder();

  @Override
  public void onStart() {
    startedSpans.increment();
  }

  @Override
  public void onCancel() {
    cancelledSpans.increment();
  }

  @Override
  public void onPromote() {
    promotedSpans.increment();
  }

  @Override
  public void onDiscardStale() {
    discardedStaleEntries.increment();
  }

  @Override
  public void onHeartbeat() {
    heartbeats.increment();
  }

  @Override
  public void onStop() {
    stops.increment();
  }

  @Override
  public void onUnknownEnd() {
    unknownEnds.increment();
  }

  @Override
  public void onFailedSerialize(final Signal signal) {
    if (signal == Signal.STOP) {
      failedStopSerializations.increment();
    } else {
      failedHeartbeatSerializations.increment();
    }
  }

  @Override
  public void onFailedWrite(final Signal signal) {
    if (signal == Signal.STOP) {
      failedStopWrites.increment();
    } else {
      failedHeartbeatWrites.increment();
    }
  }

  public long getStartedSpans() {
    return startedSpans.sum();
  }

  public long getCancelledSpans() {
    return cancelledSpans.sum();
  }

  public long getPromotedSpans() {
    return promotedSpans.sum();
  }

  public long getDiscardedStaleEntries() {
    return discardedStaleEntries.sum();
  }

  public long getHeartbeats() {
    return heartbeats.sum();
  }

  public long getStops() {
    return stops.sum();
  }

  public long getUnknownEnds() {
    return unknownEnds.sum();
  }

  public long getFailedSerializations() {
    return failedHeartbeatSerializations.sum() + failedStopSerializations.sum();
  }

  public long getFailedWrites() {
    return failedHeartbeatWrites.sum() + failedStopWrites.sum();
  }

  @Override
  public String summary() {
    return "startedSpans="
        + startedSpans.sum()
        + "\ncancelledSpans="
        + cancelledSpans.sum()
        + "\npromotedSpans="
        + promotedSpans.sum()
        + "\ndiscardedStaleEntries="
        + discardedStaleEntries.sum()
        + "\nheartbeats="
        + heartbeats.sum()
        + "\nstops="
        + stops.sum()
        + "\nunknownEnds="
        + unknownEnds.sum()
        + "\nfailedHeartbeatSerializations="
        + failedHeartbeatSerializations.sum()
        + "\nfailedStopSerializations="
        + failedStopSerializations.sum()
        + "\nfailedHeartbeatWrites="
        + failedHeartbeatWrites.sum()
        + "\nfailedStopWrites="
        + failedStopWrites.sum();
  }
}
