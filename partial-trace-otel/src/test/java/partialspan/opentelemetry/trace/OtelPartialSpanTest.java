package partialspan.opentelemetry.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import partialspan.trace.api.PartialSpan;
import partialspan.trace.api.SpanEvent;
import partialspan.trace.api.SpanKind;
import partialspan.trace.api.SpanLink;
import partialspan.trace.api.StatusCode;

class OtelPartialSpanTest {
  private final SdkTracerProvider tracerProvider = SdkTracerProvider.builder().build();
  private final Tracer tracer = tracerProvider.get("io.example.jobs", "2.1");

  @AfterEach
  void tearDown() {
    tracerProvider.shutdown();
  }

  @Test
  void mapsIdentityOfRootSpan() {
    Span span = tracer.spanBuilder("root").startSpan();
    OtelPartialSpan partialSpan = new OtelPartialSpan((ReadableSpan) span);

    assertEquals(span.getSpanContext().getSpanId(), partialSpan.getSpanId().toHexString());
    assertEquals(span.getSpanContext().getTraceId(), partialSpan.getTraceId().toHexString());
    assertTrue(partialSpan.getParentSpanId().isZero());
    assertEquals(1, partialSpan.getTraceFlags());
    assertEquals("", partialSpan.getTraceState());
    assertEquals("root", partialSpan.getName());
    assertEquals(SpanKind.INTERNAL, partialSpan.getKind());
    assertEquals("io.example.jobs", partialSpan.getInstrumentationScope().getName());
    assertEquals("2.1", partialSpan.getInstrumentationScope().getVersion());
    span.end();
  }

  @Test
  void mapsChildSpanWithEventsAndLinks() {
    Span parent = tracer.spanBuilder("parent").startSpan();
    SpanContext linked =
        SpanContext.create(
            "0af7651916cd43dd8448eb211c80319c",
            "b7ad6b7169203331",
            TraceFlags.getSampled(),
            TraceState.builder().put("vendor", "value").build());
    Span child =
        tracer
            .spanBuilder("child")
            .setParent(Context.root().with(parent))
            .setSpanKind(io.opentelemetry.api.trace.SpanKind.CONSUMER)
            .addLink(linked, Attributes.of(AttributeKey.stringKey("reason"), "batch"))
            .setAttribute("job.id", 7L)
            .startSpan();
    child.addEvent("retry", Attributes.of(AttributeKey.longKey("attempt"), 2L));

    PartialSpan partialSpan = new OtelPartialSpan((ReadableSpan) child);

    assertEquals(parent.getSpanContext().getSpanId(), partialSpan.getParentSpanId().toHexString());
    assertEquals(SpanKind.CONSUMER, partialSpan.getKind());
    assertEquals(7L, partialSpan.getAttributes().get("job.id"));

    SpanEvent event = partialSpan.getEvents().get(0);
    assertEquals("retry", event.getName());
    assertEquals(2L, event.getAttributes().get("attempt"));

    SpanLink link = partialSpan.getLinks().get(0);
    assertEquals("0af7651916cd43dd8448eb211c80319c", link.getTraceId().toHexString());
    assertEquals("b7ad6b7169203331", link.getSpanId().toHexString());
    assertEquals("vendor=value", link.getTraceState());
    assertEquals("batch", link.getAttributes().get("reason"));

    child.end();
    parent.end();
  }

  @Test
  void mapsStatusAndEndTime() {
    Span span = tracer.spanBuilder("job").startSpan();
    OtelPartialSpan partialSpan = new OtelPartialSpan((ReadableSpan) span);

    assertEquals(StatusCode.UNSET, partialSpan.getStatusCode());
    assertNull(partialSpan.getStatusDescription());
    assertEquals(0, partialSpan.getEndTimeNanos());
    assertTrue(partialSpan.getStartTimeNanos() > 0);

    span.setStatus(io.opentelemetry.api.trace.StatusCode.ERROR, "failed");
    span.end();

    assertEquals(StatusCode.ERROR, partialSpan.getStatusCode());
    assertEquals("failed", partialSpan.getStatusDescription());
    assertTrue(partialSpan.getEndTimeNanos() >= partialSpan.getStartTimeNanos());
  }

  @Test
  void snapshotIsAFrozenCopy() {
    Span span = tracer.spanBuilder("job").setAttribute("step", "load").startSpan();
    OtelPartialSpan partialSpan = new OtelPartialSpan((ReadableSpan) span);

    PartialSpan snapshot = partialSpan.snapshot();
    span.setAttribute("step", "transform");

    assertNotSame(partialSpan, snapshot);
    assertEquals(partialSpan.getSpanId(), snapshot.getSpanId());
    assertEquals("load", snapshot.getAttributes().get("step"));
    assertEquals("transform", partialSpan.getAttributes().get("step"));
    span.end();
  }
}
