package partialspan.opentelemetry.trace;

import io.opentelemetry.sdk.trace.ReadableSpan;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import partialspan.trace.api.InstrumentationScope;
import partialspan.trace.api.PartialSpan;
import partialspan.trace.api.SpanEvent;
import partialspan.trace.api.SpanId;
import partialspan.trace.api.SpanLink;
import partialspan.trace.api.TraceId;

/**
 * Live view of an OpenTelemetry SDK span. Identity is read straight from the span context; every
 * other getter copies the span data, so callers reading several fields should use {@link
 * #snapshot()}.
 */
public final class OtelPartialSpan implements PartialSpan {
  private final ReadableSpan span;
  private final SpanId spanId;

  public OtelPartialSpan(ReadableSpan span) {
    this.span = span;
    this.spanId = OtelConversions.spanId(span.getSpanContext());
  }

  @Override
  public PartialSpan snapshot() {
    return new OtelSpanSnapshot(span.toSpanData());
  }

  @Override
  public TraceId getTraceId() {
    return OtelConversions.traceId(span.getSpanContext());
  }

  @Override
  public SpanId getSpanId() {
    return spanId;
  }

  @Override
  public SpanId getParentSpanId() {
    return OtelConversions.spanId(span.getParentSpanContext());
  }

  @Override
  public String getTraceState() {
    return OtelConversions.traceState(span.getSpanContext().getTraceState());
  }

  @Override
  public int getTraceFlags() {
    return span.getSpanContext().getTraceFlags().asByte();
  }

  @Override
  public String getName() {
    return span.getName();
  }

  @Override
  public int getKind() {
    return OtelConversions.kind(span.getKind());
  }

  @Override
  public long getStartTimeNanos() {
    return snapshot().getStartTimeNanos();
  }

  @Override
  public long getEndTimeNanos() {
    return span.hasEnded() ? snapshot().getEndTimeNanos() : 0;
  }

  @Override
  public int getStatusCode() {
    return snapshot().getStatusCode();
  }

  @Nullable
  @Override
  public String getStatusDescription() {
    return snapshot().getStatusDescription();
  }

  @Override
  public Map<String, Object> getAttributes() {
    return snapshot().getAttributes();
  }

  @Override
  public List<SpanEvent> getEvents() {
    return snapshot().getEvents();
  }

  @Override
  public List<SpanLink> getLinks() {
    return snapshot().getLinks();
  }

  @Override
  public InstrumentationScope getInstrumentationScope() {
    return OtelConversions.scope(span.getInstrumentationScopeInfo());
  }

  @Override
  public String toString() {
    return "OtelPartialSpan{spanId=" + spanId + ", name=" + span.getName() + '}';
  }
}
