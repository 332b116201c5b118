package partialspan.trace.api;

/**
 * Class encapsulating the unsigned 64-bit id used for span ids.
 *
 * <p>Instances are immutable and usable as hash keys. The hexadecimal representation is generated
 * on demand and cached.
 */
public final class SpanId {

  /** The ZERO span id is not allowed and means no span. */
  public static final SpanId ZERO = new SpanId(0, "0000000000000000");

  private static final int HEX_LENGTH = 16;

  private final long id;

  /** Lower-case, zero-padded, 16 hexadecimal characters. */
  private volatile String hexStr;

  private SpanId(long id, String hexStr) {
    this.id = id;
    this.hexStr = hexStr;
  }

  /**
   * Create a span id from the given {@code long} interpreted as the bits of the unsigned 64-bit id.
   *
   * @param id the bits of the id
   * @return the span id, {@link #ZERO} for {@code 0}
   */
  public static SpanId from(long id) {
    return id == 0 ? ZERO : new SpanId(id, null);
  }

  /**
   * Parse the span id from its hexadecimal representation. Up to 16 hexadecimal characters, upper
   * or lower case.
   *
   * @param s the hexadecimal representation
   * @return the span id
   * @throws NumberFormatException if the given {@link String} is not a valid hexadecimal id
   */
  public static SpanId fromHex(String s) throws NumberFormatException {
    if (s == null) {
      throw new NumberFormatException("s cannot be null");
    }
    if (s.isEmpty() || s.length() > HEX_LENGTH) {
      throw new NumberFormatException("Illegal span id length: " + s.length());
    }
    return from(Long.parseUnsignedLong(s, 16));
  }

  public long toLong() {
    return id;
  }

  /**
   * Returns the zero padded hex representation, in lower case, of the unsigned 64-bit id.
   *
   * @return 16 characters hex String
   */
  public String toHexString() {
    String hex = hexStr;
    if (hex == null) {
      hex = HexStrings.toHexStringPadded(id, HEX_LENGTH);
      hexStr = hex;
    }
    return hex;
  }

  public boolean isZero() {
    return id == 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SpanId)) {
      return false;
    }
    return id == ((SpanId) o).id;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(id);
  }

  @Override
  public String toString() {
    return toHexString();
  }
}
