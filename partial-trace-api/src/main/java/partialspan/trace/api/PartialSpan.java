package partialspan.trace.api;

import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Read-only view of a span owned by the host tracer.
 *
 * <p>The tracer creates, mutates and ends the span; the partial span processor only reads it. All
 * getters must be safe to call from any thread while the span is still being mutated.
 */
public interface PartialSpan {

  TraceId getTraceId();

  /** Unique among concurrently active spans. */
  SpanId getSpanId();

  /** @return the parent span id, {@link SpanId#ZERO} for a root span */
  SpanId getParentSpanId();

  /** @return the W3C {@code tracestate} header value, empty when there is none */
  String getTraceState();

  int getTraceFlags();

  String getName();

  /** @see SpanKind */
  int getKind();

  long getStartTimeNanos();

  /** @return the end timestamp in epoch nanoseconds, {@code 0} while the span is still open */
  long getEndTimeNanos();

  /** @see StatusCode */
  int getStatusCode();

  @Nullable
  String getStatusDescription();

  /** @return the current attributes, in insertion order */
  Map<String, Object> getAttributes();

  List<SpanEvent> getEvents();

  List<SpanLink> getLinks();

  InstrumentationScope getInstrumentationScope();

  /**
   * Returns a consistent point-in-time view of this span. Implementations backed by expensive
   * accessors should copy their state here once.
   *
   * @return a snapshot of this span
   */
  default PartialSpan snapshot() {
    return this;
  }
}
