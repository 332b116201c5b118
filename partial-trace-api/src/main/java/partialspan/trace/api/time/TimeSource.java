package partialspan.trace.api.time;

public interface TimeSource {
  /** Monotonic nanosecond ticks, only meaningful relative to other ticks. */
  long getNanoTicks();

  long getCurrentTimeMillis();
}
