package partialspan.trace.api;

import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A timestamped annotation recorded on a span. */
public final class SpanEvent {
  private final String name;
  private final long epochNanos;
  private final Map<String, Object> attributes;

  private SpanEvent(String name, long epochNanos, Map<String, Object> attributes) {
    this.name = name;
    this.epochNanos = epochNanos;
    this.attributes = attributes;
  }

  public static SpanEvent create(String name, long epochNanos, Map<String, ?> attributes) {
    Objects.requireNonNull(name, "name");
    return new SpanEvent(
        name,
        epochNanos,
        attributes.isEmpty() ? emptyMap() : unmodifiableMap(new LinkedHashMap<>(attributes)));
  }

  public String getName() {
    return name;
  }

  public long getEpochNanos() {
    return epochNanos;
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }
}
