package partialspan.opentelemetry.trace;

import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.LinkData;
import io.opentelemetry.sdk.trace.data.SpanData;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import partialspan.trace.api.InstrumentationScope;
import partialspan.trace.api.PartialSpan;
import partialspan.trace.api.SpanEvent;
import partialspan.trace.api.SpanId;
import partialspan.trace.api.SpanLink;
import partialspan.trace.api.TraceId;

/** Immutable view of the {@link SpanData} copied from an SDK span. */
final class OtelSpanSnapshot implements PartialSpan {
  private final SpanData data;

  OtelSpanSnapshot(SpanData data) {
    this.data = data;
  }

  @Override
  public TraceId getTraceId() {
    return OtelConversions.traceId(data.getSpanContext());
  }

  @Override
  public SpanId getSpanId() {
    return OtelConversions.spanId(data.getSpanContext());
  }

  @Override
  public SpanId getParentSpanId() {
    return OtelConversions.spanId(data.getParentSpanContext());
  }

  @Override
  public String getTraceState() {
    return OtelConversions.traceState(data.getSpanContext().getTraceState());
  }

  @Override
  public int getTraceFlags() {
    return data.getSpanContext().getTraceFlags().asByte();
  }

  @Override
  public String getName() {
    return data.getName();
  }

  @Override
  public int getKind() {
    return OtelConversions.kind(data.getKind());
  }

  @Override
  public long getStartTimeNanos() {
    return data.getStartEpochNanos();
  }

  @Override
  public long getEndTimeNanos() {
    return data.hasEnded() ? data.getEndEpochNanos() : 0;
  }

  @Override
  public int getStatusCode() {
    return OtelConversions.statusCode(data.getStatus().getStatusCode());
  }

  @Nullable
  @Override
  public String getStatusDescription() {
    String description = data.getStatus().getDescription();
    return description == null || description.isEmpty() ? null : description;
  }

  @Override
  public Map<String, Object> getAttributes() {
    return OtelConversions.attributes(data.getAttributes());
  }

  @Override
  public List<SpanEvent> getEvents() {
    List<EventData> events = data.getEvents();
    List<SpanEvent> converted = new ArrayList<>(events.size());
    for (EventData event : events) {
      converted.add(
          SpanEvent.create(
              event.getName(),
              event.getEpochNanos(),
              OtelConversions.attributes(event.getAttributes())));
    }
    return converted;
  }

  @Override
  public List<SpanLink> getLinks() {
    List<LinkData> links = data.getLinks();
    List<SpanLink> converted = new ArrayList<>(links.size());
    for (LinkData link : links) {
      converted.add(
          SpanLink.create(
              OtelConversions.traceId(link.getSpanContext()),
              OtelConversions.spanId(link.getSpanContext()),
              OtelConversions.traceState(link.getSpanContext().getTraceState()),
              OtelConversions.attributes(link.getAttributes())));
    }
    return converted;
  }

  @Override
  public InstrumentationScope getInstrumentationScope() {
    return OtelConversions.scope(data.getInstrumentationScopeInfo());
  }
}
