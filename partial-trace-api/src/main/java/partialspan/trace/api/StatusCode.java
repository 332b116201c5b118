package partialspan.trace.api;

/**
 * Span status codes. Tracers may hand over values outside this set; consumers must treat them as
 * {@link #UNSET}.
 */
public final class StatusCode {
  public static final int UNSET = 0;
  public static final int OK = 1;
  public static final int ERROR = 2;

  private StatusCode() {}

  /** @return the lower case wire name of the status code, {@code "unset"} for unknown values */
  public static String toWireName(int code) {
    switch (code) {
      case OK:
        return "ok";
      case ERROR:
        return "error";
      default:
        return "unset";
    }
  }
}
