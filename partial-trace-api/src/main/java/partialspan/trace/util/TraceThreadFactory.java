package partialspan.trace.util;

import java.util.concurrent.ThreadFactory;
import org.slf4j.LoggerFactory;

/** A {@link ThreadFactory} implementation that starts all partial span {@link Thread}s as daemons. */
public final class TraceThreadFactory implements ThreadFactory {
  public static final ThreadGroup TRACE_THREAD_GROUP = new ThreadGroup("partial-span");

  public static final long THREAD_JOIN_TIMOUT_MS = 800;

  // known threads
  public enum TraceThread {
    PROMOTION("partial-span-promotion"),
    HEARTBEAT("partial-span-heartbeat");

    public final String threadName;

    TraceThread(final String threadName) {
      this.threadName = threadName;
    }
  }

  private final TraceThread traceThread;

  public TraceThreadFactory(final TraceThread traceThread) {
    this.traceThread = traceThread;
  }

  @Override
  public Thread newThread(final Runnable runnable) {
    return newTraceThread(traceThread, runnable);
  }

  /**
   * Constructs a new {@code Thread} as a daemon with a null ContextClassLoader.
   *
   * @param traceThread the thread to create.
   * @param runnable work to run on the new thread.
   */
  public static Thread newTraceThread(final TraceThread traceThread, final Runnable runnable) {
    final Thread thread = new Thread(TRACE_THREAD_GROUP, runnable, traceThread.threadName);
    thread.setDaemon(true);
    thread.setContextClassLoader(null);
    thread.setUncaughtExceptionHandler(
        (t, e) ->
            LoggerFactory.getLogger(runnable.getClass())
                .error("Uncaught exception {} in {}", e, traceThread.threadName, e));
    return thread;
  }
}
