package partialspan.trace.core;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.DelayQueue;
import org.junit.jupiter.api.Test;
import partialspan.trace.api.time.ControllableTimeSource;

class DelayEntryTest {
  private final ControllableTimeSource timeSource = new ControllableTimeSource();

  private DelayEntry entry(long spanId, long dueAtMillis) {
    TestSpan span = TestSpan.root(spanId);
    return new DelayEntry(span.getSpanId(), span, MILLISECONDS.toNanos(dueAtMillis), timeSource);
  }

  @Test
  void delayFollowsTheTimeSource() {
    DelayEntry entry = entry(1, 100);

    assertEquals(100, entry.getDelay(MILLISECONDS));
    timeSource.advance(40, MILLISECONDS);
    assertEquals(60, entry.getDelay(MILLISECONDS));
    timeSource.advance(100, MILLISECONDS);
    assertEquals(-40, entry.getDelay(MILLISECONDS));
  }

  @Test
  void ordersByDueTimeThenByCreation() {
    DelayEntry late = entry(1, 200);
    DelayEntry first = entry(2, 100);
    DelayEntry second = entry(3, 100);

    assertTrue(first.compareTo(late) < 0);
    assertTrue(first.compareTo(second) < 0);
    assertTrue(second.compareTo(first) > 0);
    assertEquals(0, first.compareTo(first));
  }

  @Test
  void delayQueueReleasesEntriesWhenDue() {
    DelayQueue<DelayEntry> queue = new DelayQueue<>();
    DelayEntry late = entry(1, 200);
    DelayEntry early = entry(2, 100);
    queue.offer(late);
    queue.offer(early);

    assertNull(queue.poll());
    timeSource.advance(100, MILLISECONDS);
    assertSame(early, queue.poll());
    assertNull(queue.poll());
    timeSource.set(MILLISECONDS.toNanos(500));
    assertSame(late, queue.poll());
    assertEquals(-300, NANOSECONDS.toMillis(late.getDelay(NANOSECONDS)));
  }
}
