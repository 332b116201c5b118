package partialspan.trace.common.snapshot;

import static java.util.Collections.emptyMap;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.Moshi;
import java.util.Map;
import partialspan.trace.api.PartialSpan;
import partialspan.trace.core.Signal;

/** Turns a span into the one-line JSON document written to the log sink. */
public final class SnapshotSerializer {
  private final JsonAdapter<Snapshot> adapter;

  public SnapshotSerializer() {
    this(emptyMap());
  }

  public SnapshotSerializer(final Map<String, ?> resourceAttributes) {
    this.adapter =
        new Moshi.Builder()
            .add(SnapshotJsonAdapter.buildFactory(resourceAttributes))
            .build()
            .adapter(Snapshot.class);
  }

  /**
   * @param span the span, serialized from its {@link PartialSpan#snapshot() snapshot}
   * @param signal why the snapshot is produced
   * @return the JSON document, without line breaks
   */
  public String serialize(final PartialSpan span, final Signal signal) {
    return adapter.toJson(new Snapshot(span.snapshot(), signal));
  }
}
