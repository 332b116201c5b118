package partialspan.trace.api;

import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A reference from a span to a span of another (or the same) trace. */
public final class SpanLink {
  private final TraceId traceId;
  private final SpanId spanId;
  private final String traceState;
  private final Map<String, Object> attributes;

  private SpanLink(
      TraceId traceId, SpanId spanId, String traceState, Map<String, Object> attributes) {
    this.traceId = traceId;
    this.spanId = spanId;
    this.traceState = traceState;
    this.attributes = attributes;
  }

  public static SpanLink create(
      TraceId traceId, SpanId spanId, String traceState, Map<String, ?> attributes) {
    Objects.requireNonNull(traceId, "traceId");
    Objects.requireNonNull(spanId, "spanId");
    return new SpanLink(
        traceId,
        spanId,
        traceState == null ? "" : traceState,
        attributes.isEmpty() ? emptyMap() : unmodifiableMap(new LinkedHashMap<>(attributes)));
  }

  public TraceId getTraceId() {
    return traceId;
  }

  public SpanId getSpanId() {
    return spanId;
  }

  public String getTraceState() {
    return traceState;
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }
}
