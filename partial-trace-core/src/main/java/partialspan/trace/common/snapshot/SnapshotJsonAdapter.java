package partialspan.trace.common.snapshot;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonReader;
import com.squareup.moshi.JsonWriter;
import com.squareup.moshi.Moshi;
import com.squareup.moshi.Types;
import java.io.IOException;
import java.lang.annotation.Annotation;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import partialspan.trace.api.InstrumentationScope;
import partialspan.trace.api.PartialSpan;
import partialspan.trace.api.SpanEvent;
import partialspan.trace.api.SpanKind;
import partialspan.trace.api.SpanLink;
import partialspan.trace.api.StatusCode;

/**
 * Writes a {@link Snapshot} as an OTLP-shaped traces document holding exactly one resource, one
 * scope and one span. Field names are snake_case and identical for every signal, only {@code
 * end_time_unix_nano} depends on it.
 */
class SnapshotJsonAdapter extends JsonAdapter<Snapshot> {
  private final Map<String, ?> resourceAttributes;

  SnapshotJsonAdapter(final Map<String, ?> resourceAttributes) {
    this.resourceAttributes = resourceAttributes;
  }

  public static Factory buildFactory(final Map<String, ?> resourceAttributes) {
    return new Factory() {
      @Override
      public JsonAdapter<?> create(
          final Type type, final Set<? extends Annotation> annotations, final Moshi moshi) {
        final Class<?> rawType = Types.getRawType(type);
        if (rawType.isAssignableFrom(Snapshot.class)) {
          return new SnapshotJsonAdapter(resourceAttributes);
        }
        return null;
      }
    };
  }

  @Override
  public Snapshot fromJson(final JsonReader reader) {
    throw new UnsupportedOperationException();
  }

  @Override
  public void toJson(final JsonWriter writer, final Snapshot snapshot) throws IOException {
    final PartialSpan span = snapshot.getSpan();
    writer.beginObject();
    writer.name("resource_spans");
    writer.beginArray();
    writer.beginObject();
    writer.name("resource");
    writer.beginObject();
    writer.name("attributes");
    writeAttributes(writer, resourceAttributes);
    writer.endObject();
    writer.name("scope_spans");
    writer.beginArray();
    writer.beginObject();
    writer.name("scope");
    writeScope(writer, span.getInstrumentationScope());
    writer.name("spans");
    writer.beginArray();
    writeSpan(writer, span, snapshot);
    writer.endArray();
    writer.endObject();
    writer.endArray();
    writer.endObject();
    writer.endArray();
    writer.endObject();
  }

  private static void writeScope(final JsonWriter writer, final InstrumentationScope scope)
      throws IOException {
    final InstrumentationScope s = scope != null ? scope : InstrumentationScope.EMPTY;
    writer.beginObject();
    writer.name("name");
    writer.value(s.getName());
    writer.name("version");
    writer.value(s.getVersion() != null ? s.getVersion() : "");
    writer.name("attributes");
    writeAttributes(writer, s.getAttributes());
    writer.endObject();
  }

  private static void writeSpan(
      final JsonWriter writer, final PartialSpan span, final Snapshot snapshot)
      throws IOException {
    writer.beginObject();
    writer.name("trace_id");
    writer.value(span.getTraceId().toHexString());
    writer.name("span_id");
    writer.value(span.getSpanId().toHexString());
    writer.name("trace_state");
    writer.value(span.getTraceState() != null ? span.getTraceState() : "");
    writer.name("parent_span_id");
    writer.value(span.getParentSpanId().toHexString());
    writer.name("flags");
    writer.value(span.getTraceFlags() & 0xFF);
    writer.name("name");
    writer.value(span.getName());
    writer.name("kind");
    writer.value(SpanKind.isValid(span.getKind()) ? span.getKind() : SpanKind.UNSPECIFIED);
    writer.name("start_time_unix_nano");
    writer.value(span.getStartTimeNanos());
    if (snapshot.getSignal().includesEndTime()) {
      writer.name("end_time_unix_nano");
      writer.value(span.getEndTimeNanos());
    }
    writer.name("attributes");
    writeAttributes(writer, span.getAttributes());
    writer.name("events");
    writer.beginArray();
    for (final SpanEvent event : span.getEvents()) {
      writer.beginObject();
      writer.name("time_unix_nano");
      writer.value(event.getEpochNanos());
      writer.name("name");
      writer.value(event.getName());
      writer.name("attributes");
      writeAttributes(writer, event.getAttributes());
      writer.endObject();
    }
    writer.endArray();
    writer.name("links");
    writer.beginArray();
    for (final SpanLink link : span.getLinks()) {
      writer.beginObject();
      writer.name("trace_id");
      writer.value(link.getTraceId().toHexString());
      writer.name("span_id");
      writer.value(link.getSpanId().toHexString());
      writer.name("trace_state");
      writer.value(link.getTraceState());
      writer.name("attributes");
      writeAttributes(writer, link.getAttributes());
      writer.endObject();
    }
    writer.endArray();
    writer.name("status");
    writer.beginObject();
    writer.name("code");
    writer.value(StatusCode.toWireName(span.getStatusCode()));
    if (span.getStatusDescription() != null) {
      writer.name("message");
      writer.value(span.getStatusDescription());
    }
    writer.endObject();
    writer.endObject();
  }

  private static void writeAttributes(final JsonWriter writer, final Map<String, ?> attributes)
      throws IOException {
    writer.beginArray();
    for (final Map.Entry<String, ?> entry : attributes.entrySet()) {
      writer.beginObject();
      writer.name("key");
      writer.value(String.valueOf(entry.getKey()));
      writer.name("value");
      writeAnyValue(writer, entry.getValue());
      writer.endObject();
    }
    writer.endArray();
  }

  static void writeAnyValue(final JsonWriter writer, final Object value) throws IOException {
    writer.beginObject();
    if (value instanceof CharSequence) {
      writer.name("string_value");
      writer.value(value.toString());
    } else if (value instanceof Boolean) {
      writer.name("bool_value");
      writer.value(((Boolean) value).booleanValue());
    } else if (isIntegral(value)) {
      writer.name("int_value");
      writer.value(((Number) value).longValue());
    } else if (value instanceof Double || value instanceof Float) {
      final double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        writer.name("string_value");
        writer.value(Double.toString(d));
      } else {
        writer.name("double_value");
        writer.value(d);
      }
    } else if (value != null) {
      writer.name("string_value");
      writer.value(coerceToString(value));
    }
    writer.endObject();
  }

  private static boolean isIntegral(final Object value) {
    return value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte
        || value instanceof AtomicLong
        || value instanceof AtomicInteger;
  }

  private static String coerceToString(final Object value) {
    try {
      return String.valueOf(value);
    } catch (final RuntimeException e) {
      return value.getClass().getName();
    }
  }
}
