package partialspan.trace.api;

/** Span kinds, numbered as in the OTLP {@code SpanKind} enum. */
public final class SpanKind {
  public static final int UNSPECIFIED = 0;
  public static final int INTERNAL = 1;
  public static final int SERVER = 2;
  public static final int CLIENT = 3;
  public static final int PRODUCER = 4;
  public static final int CONSUMER = 5;

  private SpanKind() {}

  public static boolean isValid(int kind) {
    return kind >= UNSPECIFIED && kind <= CONSUMER;
  }
}
