package partialspan.trace.api;

import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/** Name, version and attributes of the library that produced a span. */
public final class InstrumentationScope {
  public static final InstrumentationScope EMPTY = new InstrumentationScope("", null, emptyMap());

  private final String name;
  @Nullable private final String version;
  private final Map<String, Object> attributes;

  private InstrumentationScope(
      String name, @Nullable String version, Map<String, Object> attributes) {
    this.name = name;
    this.version = version;
    this.attributes = attributes;
  }

  public static InstrumentationScope create(String name, @Nullable String version) {
    return create(name, version, emptyMap());
  }

  public static InstrumentationScope create(
      String name, @Nullable String version, Map<String, ?> attributes) {
    Objects.requireNonNull(name, "name");
    return new InstrumentationScope(
        name,
        version,
        attributes.isEmpty() ? emptyMap() : unmodifiableMap(new LinkedHashMap<>(attributes)));
  }

  public String getName() {
    return name;
  }

  @Nullable
  public String getVersion() {
    return version;
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }

  @Override
  public String toString() {
    return "InstrumentationScope{name=" + name + ", version=" + version + "}";
  }
}
