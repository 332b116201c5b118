package partialspan.trace.core;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static partialspan.trace.api.ConfigDefaults.DEFAULT_HEARTBEAT_INITIAL_DELAY_MS;
import static partialspan.trace.api.ConfigDefaults.DEFAULT_HEARTBEAT_INTERVAL_MS;
import static partialspan.trace.api.ConfigDefaults.DEFAULT_PROMOTION_TICK_MS;
import static partialspan.trace.util.TraceThreadFactory.THREAD_JOIN_TIMOUT_MS;
import static partialspan.trace.util.TraceThreadFactory.TraceThread.HEARTBEAT;
import static partialspan.trace.util.TraceThreadFactory.TraceThread.PROMOTION;
import static partialspan.trace.util.TraceThreadFactory.newTraceThread;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jctools.queues.MessagePassingQueue;
import org.jctools.queues.MpscUnboundedArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import partialspan.trace.api.Config;
import partialspan.trace.api.PartialSpan;
import partialspan.trace.api.RatelimitedLogger;
import partialspan.trace.api.SpanId;
import partialspan.trace.api.time.SystemTimeSource;
import partialspan.trace.api.time.TimeSource;
import partialspan.trace.common.sink.LogSink;
import partialspan.trace.common.snapshot.SnapshotSerializer;
import partialspan.trace.core.monitor.HealthMetrics;

/**
 * Writes periodic heartbeat snapshots of spans that stay open longer than an initial delay, and a
 * final stop snapshot when such a span ends. Spans ending within the initial delay produce no
 * output at all.
 *
 * <p>Started spans wait in a delay queue. The promotion worker moves due spans to the ready
 * entries, skipping the ones ended in the meantime. The heartbeat worker writes a heartbeat for
 * every due ready entry once per heartbeat interval. The two workers run on their own daemon
 * threads; {@link #onStart} and {@link #onEnd} may be called from any thread.
 *
 * <p>Ending a span during its initial delay only drops it from the delay lookup; its queue entry
 * stays in place and is discarded when the promotion worker polls it.
 */
public class PartialSpanProcessor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PartialSpanProcessor.class);

  public static final String SPAN_STATE_MDC_KEY = "span.state";
  public static final String LOG_BODY_TYPE_MDC_KEY = "log.body.type";
  public static final String LOG_BODY_TYPE = "json/v1";

  private static final int HANDOFF_CHUNK_SIZE = 1024;

  private final LogSink logSink;
  private final SnapshotSerializer serializer;
  private final TimeSource timeSource;
  private final HealthMetrics healthMetrics;
  private final RatelimitedLogger failureLogger;

  private final long heartbeatIntervalNanos;
  private final long initialHeartbeatDelayNanos;
  private final long promotionTickNanos;

  private final Map<SpanId, PartialSpan> activeSpans = new ConcurrentHashMap<>();
  // a span id is mapped iff its delay entry may still be promoted
  private final Map<SpanId, DelayEntry> delayedLookup = new ConcurrentHashMap<>();
  private final DelayQueue<DelayEntry> delayQueue = new DelayQueue<>();
  private final Map<SpanId, ReadyEntry> readyEntries = new ConcurrentHashMap<>();
  // promotion worker -> heartbeat worker
  private final MessagePassingQueue<ReadyEntry> promoted =
      new MpscUnboundedArrayQueue<>(HANDOFF_CHUNK_SIZE);
  // heartbeat worker only
  private final PriorityQueue<ReadyEntry> heartbeatSchedule =
      new PriorityQueue<>(
          (a, b) -> Long.signum(a.getNextHeartbeatAtNanos() - b.getNextHeartbeatAtNanos()));

  private final Thread promotionWorker;
  private final Thread heartbeatWorker;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private volatile boolean closed = false;

  /**
   * Creates a processor with the system time source. Call {@link #start()} to run the workers.
   *
   * @param logSink receives the snapshots
   * @param heartbeatIntervalMillis time between two heartbeats of a span, {@code 0} ticks as fast
   *     as possible
   * @param initialHeartbeatDelayMillis how long a span must stay open before it gets heartbeats
   * @param promotionTickMillis time between two runs of the promotion worker
   * @throws NullPointerException if {@code logSink} is null
   * @throws InvalidProcessorArgumentException if a duration is negative
   */
  public PartialSpanProcessor(
      final LogSink logSink,
      final long heartbeatIntervalMillis,
      final long initialHeartbeatDelayMillis,
      final long promotionTickMillis) {
    this(
        builder()
            .logSink(logSink)
            .heartbeatInterval(heartbeatIntervalMillis, MILLISECONDS)
            .initialHeartbeatDelay(initialHeartbeatDelayMillis, MILLISECONDS)
            .promotionTick(promotionTickMillis, MILLISECONDS));
  }

  private PartialSpanProcessor(final Builder builder) {
    validate(builder);
    this.logSink = builder.logSink;
    this.serializer = new SnapshotSerializer(builder.resourceAttributes);
    this.timeSource = builder.timeSource;
    this.healthMetrics = builder.healthMetrics;
    this.failureLogger = new RatelimitedLogger(log, 5, TimeUnit.MINUTES, timeSource);
    this.heartbeatIntervalNanos = builder.heartbeatIntervalNanos;
    this.initialHeartbeatDelayNanos = builder.initialHeartbeatDelayNanos;
    this.promotionTickNanos = builder.promotionTickNanos;
    this.promotionWorker = newTraceThread(PROMOTION, new PromotionWorker());
    this.heartbeatWorker = newTraceThread(HEARTBEAT, new HeartbeatWorker());
  }

  private static void validate(final Builder builder) {
    Objects.requireNonNull(builder.logSink, "logSink");
    Objects.requireNonNull(builder.timeSource, "timeSource");
    Objects.requireNonNull(builder.healthMetrics, "healthMetrics");
    if (builder.heartbeatIntervalNanos < 0) {
      throw new InvalidProcessorArgumentException(
          "heartbeatInterval", "Heartbeat interval must be zero or greater.");
    }
    if (builder.initialHeartbeatDelayNanos < 0) {
      throw new InvalidProcessorArgumentException(
          "initialHeartbeatDelay", "Initial heartbeat delay must be zero or greater.");
    }
    if (builder.promotionTickNanos < 0) {
      throw new InvalidProcessorArgumentException(
          "promotionTick", "Promotion tick must be zero or greater.");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Starts the promotion and heartbeat workers. Subsequent calls do nothing. */
  public void start() {
    if (closed || !started.compareAndSet(false, true)) {
      return;
    }
    promotionWorker.start();
    heartbeatWorker.start();
    log.debug(
        "Started partial span processor with heartbeat interval {} ms, initial delay {} ms, promotion tick {} ms",
        NANOSECONDS.toMillis(heartbeatIntervalNanos),
        NANOSECONDS.toMillis(initialHeartbeatDelayNanos),
        NANOSECONDS.toMillis(promotionTickNanos));
  }

  /**
   * Starts tracking a span. Nothing is written until the initial heartbeat delay elapsed.
   *
   * @param span a started span
   * @throws NullPointerException if {@code span} is null
   */
  public void onStart(final PartialSpan span) {
    Objects.requireNonNull(span, "span");
    if (closed) {
      return;
    }
    final SpanId spanId = span.getSpanId();
    if (activeSpans.putIfAbsent(spanId, span) != null) {
      log.debug("Span {} is already tracked, ignoring duplicate start", spanId);
      return;
    }
    final DelayEntry entry =
        new DelayEntry(
            spanId, span, timeSource.getNanoTicks() + initialHeartbeatDelayNanos, timeSource);
    delayedLookup.put(spanId, entry);
    delayQueue.offer(entry);
    healthMetrics.onStart();
  }

  /**
   * Stops tracking a span. If the span already received heartbeats, its stop snapshot is written
   * before this method returns, and no heartbeat follows it.
   *
   * @param span an ended span
   * @throws NullPointerException if {@code span} is null
   */
  public void onEnd(final PartialSpan span) {
    Objects.requireNonNull(span, "span");
    final SpanId spanId = span.getSpanId();
    final PartialSpan tracked = activeSpans.remove(spanId);

    if (delayedLookup.remove(spanId) != null) {
      // still within the initial delay, the queue entry is discarded on promotion
      healthMetrics.onCancel();
      return;
    }

    final ReadyEntry entry = readyEntries.remove(spanId);
    if (entry == null) {
      if (tracked == null) {
        log.debug("Span {} ended without being tracked", spanId);
        healthMetrics.onUnknownEnd();
      }
      return;
    }
    if (entry.markEnded() && !closed) {
      if (emit(span, Signal.STOP)) {
        healthMetrics.onStop();
      }
    }
  }

  /**
   * Moves the spans whose initial delay elapsed from the delay queue to the ready entries. Entries
   * of spans ended in the meantime are dropped.
   *
   * @return the number of promoted spans
   */
  int promoteDueSpans() {
    int promotedCount = 0;
    DelayEntry delayed;
    while ((delayed = delayQueue.poll()) != null) {
      final SpanId spanId = delayed.getSpanId();
      if (delayedLookup.get(spanId) != delayed) {
        healthMetrics.onDiscardStale();
        continue;
      }
      final ReadyEntry ready = new ReadyEntry(spanId, delayed.getSpan(), timeSource.getNanoTicks());
      // publish before leaving the lookup so a concurrent onEnd sees the span in one of them
      readyEntries.put(spanId, ready);
      if (!delayedLookup.remove(spanId, delayed)) {
        readyEntries.remove(spanId, ready);
        healthMetrics.onDiscardStale();
        continue;
      }
      promoted.offer(ready);
      healthMetrics.onPromote();
      promotedCount++;
    }
    return promotedCount;
  }

  /**
   * Writes a heartbeat for every ready entry that is due and schedules its next one.
   *
   * @return the number of heartbeats written
   */
  int emitDueHeartbeats() {
    promoted.drain(heartbeatSchedule::offer);
    final long now = timeSource.getNanoTicks();
    final List<ReadyEntry> rescheduled = new ArrayList<>();
    int written = 0;
    ReadyEntry entry;
    while (!closed && (entry = heartbeatSchedule.peek()) != null && entry.isDue(now)) {
      heartbeatSchedule.poll();
      if (readyEntries.get(entry.getSpanId()) != entry) {
        // ended since the last heartbeat
        continue;
      }
      synchronized (entry) {
        if (entry.isEnded() || closed) {
          continue;
        }
        if (emit(entry.getSpan(), Signal.HEARTBEAT)) {
          entry.onHeartbeat();
          healthMetrics.onHeartbeat();
          written++;
        }
      }
      entry.scheduleNext(now + heartbeatIntervalNanos);
      rescheduled.add(entry);
    }
    heartbeatSchedule.addAll(rescheduled);
    return written;
  }

  private boolean emit(final PartialSpan span, final Signal signal) {
    final String json;
    try {
      json = serializer.serialize(span, signal);
    } catch (final RuntimeException e) {
      healthMetrics.onFailedSerialize(signal);
      failureLogger.warn(
          "Failed to serialize {} snapshot of span {}", signal, span.getSpanId(), e);
      return false;
    }
    MDC.put(SPAN_STATE_MDC_KEY, signal.spanState());
    MDC.put(LOG_BODY_TYPE_MDC_KEY, LOG_BODY_TYPE);
    try {
      logSink.write(json);
      return true;
    } catch (final RuntimeException e) {
      healthMetrics.onFailedWrite(signal);
      failureLogger.warn("Failed to write {} snapshot of span {}", signal, span.getSpanId(), e);
      return false;
    } finally {
      MDC.remove(SPAN_STATE_MDC_KEY);
      MDC.remove(LOG_BODY_TYPE_MDC_KEY);
    }
  }

  /**
   * Stops both workers and forgets every tracked span. Nothing is written after this method
   * returns.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    promotionWorker.interrupt();
    heartbeatWorker.interrupt();
    try {
      if (started.get()) {
        promotionWorker.join(THREAD_JOIN_TIMOUT_MS);
        heartbeatWorker.join(THREAD_JOIN_TIMOUT_MS);
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    delayQueue.clear();
    delayedLookup.clear();
    readyEntries.clear();
    promoted.clear();
    activeSpans.clear();
    log.debug("Closed partial span processor. Health: {}", healthMetrics.summary());
  }

  public boolean isClosed() {
    return closed;
  }

  // point-in-time copies, for diagnostics and tests

  /** @return the ids of the spans started and not ended yet */
  public Set<SpanId> activeSpanIds() {
    return Collections.unmodifiableSet(new HashSet<>(activeSpans.keySet()));
  }

  /** @return the ids of the spans still waiting for their initial delay to elapse */
  public Set<SpanId> delayedSpanIds() {
    return Collections.unmodifiableSet(new HashSet<>(delayedLookup.keySet()));
  }

  /** @return the physical content of the delay queue, including cancelled entries */
  public List<DelayEntry> delayedEntries() {
    return Collections.unmodifiableList(new ArrayList<>(delayQueue));
  }

  /** @return the spans receiving heartbeats */
  public List<ReadyEntry> readyEntries() {
    return Collections.unmodifiableList(new ArrayList<>(readyEntries.values()));
  }

  private abstract class Worker implements Runnable {
    private final long tickNanos;

    Worker(final long tickNanos) {
      this.tickNanos = tickNanos;
    }

    abstract void tick();

    @Override
    public void run() {
      try {
        while (!closed && !Thread.currentThread().isInterrupted()) {
          try {
            tick();
          } catch (final Throwable e) {
            failureLogger.warn("Unexpected failure in {}", getClass().getSimpleName(), e);
          }
          if (tickNanos == 0) {
            // only used by tests
            Thread.yield();
          } else {
            NANOSECONDS.sleep(tickNanos);
          }
        }
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private final class PromotionWorker extends Worker {
    PromotionWorker() {
      super(promotionTickNanos);
    }

    @Override
    void tick() {
      promoteDueSpans();
    }
  }

  private final class HeartbeatWorker extends Worker {
    HeartbeatWorker() {
      super(heartbeatIntervalNanos);
    }

    @Override
    void tick() {
      emitDueHeartbeats();
    }
  }

  public static final class Builder {
    private LogSink logSink;
    private long heartbeatIntervalNanos = MILLISECONDS.toNanos(DEFAULT_HEARTBEAT_INTERVAL_MS);
    private long initialHeartbeatDelayNanos =
        MILLISECONDS.toNanos(DEFAULT_HEARTBEAT_INITIAL_DELAY_MS);
    private long promotionTickNanos = MILLISECONDS.toNanos(DEFAULT_PROMOTION_TICK_MS);
    private TimeSource timeSource = SystemTimeSource.INSTANCE;
    private HealthMetrics healthMetrics = HealthMetrics.NO_OP;
    private Map<String, ?> resourceAttributes = Collections.emptyMap();

    private Builder() {}

    public Builder logSink(final LogSink logSink) {
      this.logSink = logSink;
      return this;
    }

    public Builder heartbeatInterval(final long interval, final TimeUnit unit) {
      this.heartbeatIntervalNanos = unit.toNanos(interval);
      return this;
    }

    public Builder initialHeartbeatDelay(final long delay, final TimeUnit unit) {
      this.initialHeartbeatDelayNanos = unit.toNanos(delay);
      return this;
    }

    public Builder promotionTick(final long tick, final TimeUnit unit) {
      this.promotionTickNanos = unit.toNanos(tick);
      return this;
    }

    public Builder timeSource(final TimeSource timeSource) {
      this.timeSource = timeSource;
      return this;
    }

    public Builder healthMetrics(final HealthMetrics healthMetrics) {
      this.healthMetrics = healthMetrics;
      return this;
    }

    public Builder resourceAttributes(final Map<String, ?> resourceAttributes) {
      this.resourceAttributes = resourceAttributes;
      return this;
    }

    /** Takes the intervals and resource attributes from the given config. */
    public Builder config(final Config config) {
      return heartbeatInterval(config.getHeartbeatIntervalMillis(), MILLISECONDS)
          .initialHeartbeatDelay(config.getInitialHeartbeatDelayMillis(), MILLISECONDS)
          .promotionTick(config.getPromotionTickMillis(), MILLISECONDS)
          .resourceAttributes(config.getResourceAttributes());
    }

    /** Builds the processor without starting its workers. */
    public PartialSpanProcessor buildUnstarted() {
      return new PartialSpanProcessor(this);
    }

    /** Builds the processor and starts its workers. */
    public PartialSpanProcessor build() {
      final PartialSpanProcessor processor = buildUnstarted();
      processor.start();
      return processor;
    }
  }
}
