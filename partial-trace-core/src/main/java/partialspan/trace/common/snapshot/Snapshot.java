package partialspan.trace.common.snapshot;

import partialspan.trace.api.PartialSpan;
import partialspan.trace.core.Signal;

/** A span state captured for one signal. */
public final class Snapshot {
  private final PartialSpan span;
  private final Signal signal;

  public Snapshot(PartialSpan span, Signal signal) {
    this.span = span;
    this.signal = signal;
  }

  public PartialSpan getSpan() {
    return span;
  }

  public Signal getSignal() {
    return signal;
  }
}
