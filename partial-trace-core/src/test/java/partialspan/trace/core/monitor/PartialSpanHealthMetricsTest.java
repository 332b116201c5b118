package partialspan.trace.core.monitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import partialspan.trace.core.Signal;

class PartialSpanHealthMetricsTest {
  private final PartialSpanHealthMetrics metrics = new PartialSpanHealthMetrics();

  @Test
  void countsLifecycleEvents() {
    metrics.onStart();
    metrics.onStart();
    metrics.onCancel();
    metrics.onDiscardStale();
    metrics.onPromote();
    metrics.onHeartbeat();
    metrics.onHeartbeat();
    metrics.onStop();
    metrics.onUnknownEnd();

    assertEquals(2, metrics.getStartedSpans());
    assertEquals(1, metrics.getCancelledSpans());
    assertEquals(1, metrics.getDiscardedStaleEntries());
    assertEquals(1, metrics.getPromotedSpans());
    assertEquals(2, metrics.getHeartbeats());
    assertEquals(1, metrics.getStops());
    assertEquals(1, metrics.getUnknownEnds());
  }

  @Test
  void failuresAreSplitBySignal() {
    metrics.onFailedSerialize(Signal.HEARTBEAT);
    metrics.onFailedSerialize(Signal.STOP);
    metrics.onFailedWrite(Signal.STOP);

    assertEquals(2, metrics.getFailedSerializations());
    assertEquals(1, metrics.getFailedWrites());
    assertTrue(metrics.summary().contains("failedStopSerializations=1"), metrics.summary());
    assertTrue(metrics.summary().contains("failedHeartbeatSerializations=1"));
    assertTrue(metrics.summary().contains("failedStopWrites=1"));
  }

  @Test
  void noOpIgnoresEverything() {
    HealthMetrics.NO_OP.onStart();
    HealthMetrics.NO_OP.onFailedWrite(Signal.STOP);

    assertEquals("", HealthMetrics.NO_OP.summary());
  }
}
