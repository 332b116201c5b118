package partialspan.trace.core;

/** Why a snapshot of a span was produced. */
public enum Signal {
  /** Not emitted by the processor, kept as an extension point for start snapshots. */
  START("started"),
  /** Periodic snapshot of a span that is still open. */
  HEARTBEAT("heartbeat"),
  /** Final snapshot of a span that received heartbeats. */
  STOP("ended");

  private final String spanState;

  Signal(String spanState) {
    this.spanState = spanState;
  }

  /** @return the value of the {@code span.state} log record attribute */
  public String spanState() {
    return spanState;
  }

  public boolean includesEndTime() {
    return this == STOP;
  }
}
