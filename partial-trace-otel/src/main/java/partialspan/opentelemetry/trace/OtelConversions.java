package partialspan.opentelemetry.trace;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.sdk.common.InstrumentationScopeInfo;
import java.util.LinkedHashMap;
import java.util.Map;
import partialspan.trace.api.InstrumentationScope;
import partialspan.trace.api.SpanId;
import partialspan.trace.api.SpanKind;
import partialspan.trace.api.StatusCode;
import partialspan.trace.api.TraceId;

final class OtelConversions {
  private OtelConversions() {}

  static TraceId traceId(SpanContext context) {
    return TraceId.fromHex(context.getTraceId());
  }

  static SpanId spanId(SpanContext context) {
    return SpanId.fromHex(context.getSpanId());
  }

  static int kind(io.opentelemetry.api.trace.SpanKind kind) {
    if (kind == null) {
      return SpanKind.UNSPECIFIED;
    }
    switch (kind) {
      case INTERNAL:
        return SpanKind.INTERNAL;
      case SERVER:
        return SpanKind.SERVER;
      case CLIENT:
        return SpanKind.CLIENT;
      case PRODUCER:
        return SpanKind.PRODUCER;
      case CONSUMER:
        return SpanKind.CONSUMER;
      default:
        return SpanKind.UNSPECIFIED;
    }
  }

  static int statusCode(io.opentelemetry.api.trace.StatusCode statusCode) {
    if (statusCode == null) {
      return StatusCode.UNSET;
    }
    switch (statusCode) {
      case OK:
        return StatusCode.OK;
      case ERROR:
        return StatusCode.ERROR;
      default:
        return StatusCode.UNSET;
    }
  }

  /** Encodes the trace state as a W3C {@code tracestate} header value. */
  static String traceState(TraceState traceState) {
    if (traceState == null || traceState.isEmpty()) {
      return "";
    }
    StringBuilder header = new StringBuilder();
    traceState.forEach(
        (key, value) -> {
          if (header.length() > 0) {
            header.append(',');
          }
          header.append(key).append('=').append(value);
        });
    return header.toString();
  }

  static Map<String, Object> attributes(Attributes attributes) {
    Map<String, Object> map = new LinkedHashMap<>();
    if (attributes != null) {
      attributes.forEach((key, value) -> map.put(key.getKey(), value));
    }
    return map;
  }

  static InstrumentationScope scope(InstrumentationScopeInfo scopeInfo) {
    if (scopeInfo == null) {
      return InstrumentationScope.EMPTY;
    }
    return InstrumentationScope.create(
        scopeInfo.getName(), scopeInfo.getVersion(), attributes(scopeInfo.getAttributes()));
  }
}
