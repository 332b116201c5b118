package partialspan.trace.common.sink;

/** Receives the serialized snapshots, one JSON document per call. */
@FunctionalInterface
public interface LogSink {

  /**
   * Write one snapshot. Called from producer threads and from the heartbeat worker, possibly
   * concurrently.
   *
   * @param line the JSON document, without a trailing line break
   */
  void write(String line);
}
