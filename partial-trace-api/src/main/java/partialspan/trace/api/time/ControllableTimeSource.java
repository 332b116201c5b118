package partialspan.trace.api.time;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import java.util.concurrent.TimeUnit;

public class ControllableTimeSource implements TimeSource {
  private volatile long currentTime = 0;

  public void advance(long nanosIncrement) {
    currentTime += nanosIncrement;
  }

  public void advance(long increment, TimeUnit unit) {
    advance(unit.toNanos(increment));
  }

  public void set(long nanos) {
    currentTime = nanos;
  }

  @Override
  public long getNanoTicks() {
    return currentTime;
  }

  @Override
  public long getCurrentTimeMillis() {
    return NANOSECONDS.toMillis(currentTime);
  }
}
