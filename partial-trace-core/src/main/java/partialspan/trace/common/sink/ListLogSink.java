package partialspan.trace.common.sink;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/** List sink used by tests mostly */
public class ListLogSink extends CopyOnWriteArrayList<String> implements LogSink {
  private final Object monitor = new Object();

  @Override
  public void write(final String line) {
    add(line);
    synchronized (monitor) {
      monitor.notifyAll();
    }
  }

  /** @return the lines containing {@code fragment}, in write order */
  public List<String> linesContaining(final String fragment) {
    final List<String> lines = new ArrayList<>();
    for (final String line : this) {
      if (line.contains(fragment)) {
        lines.add(line);
      }
    }
    return lines;
  }

  /**
   * Blocks until at least {@code count} lines match the predicate.
   *
   * @return true if the lines were written before the timeout
   */
  public boolean waitForLines(
      final Predicate<String> predicate, final int count, final long timeout, final TimeUnit unit)
      throws InterruptedException {
    final long deadline = System.nanoTime() + unit.toNanos(timeout);
    while (true) {
      if (countMatching(predicate) >= count) {
        return true;
      }
      final long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        return false;
      }
      final long millis = NANOSECONDS.toMillis(remaining);
      final long nanos = remaining - MILLISECONDS.toNanos(millis);
      synchronized (monitor) {
        if (countMatching(predicate) < count) {
          monitor.wait(millis, (int) nanos);
        }
      }
    }
  }

  private int countMatching(final Predicate<String> predicate) {
    int matching = 0;
    for (final String line : this) {
      if (predicate.test(line)) {
        matching++;
      }
    }
    return matching;
  }

  @Override
  public String toString() {
    return "ListLogSink { size=" + size() + " }";
  }
}
