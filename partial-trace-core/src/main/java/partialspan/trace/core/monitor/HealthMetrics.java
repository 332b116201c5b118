package partialspan.trace.core.monitor;

import partialspan.trace.core.Signal;

/**
 * Callback for monitoring the health of the partial span processor. Provides hooks for the span
 * lifecycle...
 *
 * <ul>
 *   <li>tracking a started span
 *   <li>cancelling it before its initial delay elapsed
 *   <li>promoting it to periodic heartbeats
 *   <li>writing heartbeat and stop snapshots
 *   <li>failing to serialize or write a snapshot
 * </ul>
 */
public abstract class HealthMetrics {
  public static final HealthMetrics NO_OP = new HealthMetrics() {};

  public void onStart() {}

  public void onCancel() {}

  public void onPromote() {}

  public void onDiscardStale() {}

  public void onHeartbeat() {}

  public void onStop() {}

  public void onUnknownEnd() {}

  public void onFailedSerialize(final Signal signal) {}

  public void onFailedWrite(final Signal signal) {}

  /** @return Human-readable summary of the current health metrics. */
  public String summary() {
    return "";
  }
}
