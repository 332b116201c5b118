package partialspan.trace.api;

/**
 * Class encapsulating the unsigned 128-bit id used for trace ids.
 *
 * <p>{@link #highOrderBits} holds the high-order 64 bits and {@link #lowOrderBits} the low-order
 * 64 bits. A 64-bit trace id is represented with {@link #highOrderBits} set to {@code 0}.
 */
public final class TraceId {
  public static final TraceId ZERO = new TraceId(0, 0, "00000000000000000000000000000000");

  private static final int HEX_LENGTH = 32;

  private final long highOrderBits;
  private final long lowOrderBits;

  /** Lower-case, zero-padded, 32 hexadecimal characters. */
  private volatile String hexStr;

  private TraceId(long highOrderBits, long lowOrderBits, String hexStr) {
    this.highOrderBits = highOrderBits;
    this.lowOrderBits = lowOrderBits;
    this.hexStr = hexStr;
  }

  public static TraceId from(long highOrderBits, long lowOrderBits) {
    if (highOrderBits == 0 && lowOrderBits == 0) {
      return ZERO;
    }
    return new TraceId(highOrderBits, lowOrderBits, null);
  }

  /**
   * Parse the trace id from its hexadecimal representation. Ids of up to 16 characters are read as
   * 64-bit ids, longer ones (up to 32 characters) as 128-bit ids.
   *
   * @param s the hexadecimal representation
   * @return the trace id
   * @throws NumberFormatException if the given {@link String} is not a valid hexadecimal id
   */
  public static TraceId fromHex(String s) throws NumberFormatException {
    if (s == null) {
      throw new NumberFormatException("s cannot be null");
    }
    int length = s.length();
    if (length == 0 || length > HEX_LENGTH) {
      throw new NumberFormatException("Illegal trace id length: " + length);
    }
    if (length <= 16) {
      return from(0, Long.parseUnsignedLong(s, 16));
    }
    int split = length - 16;
    return from(
        Long.parseUnsignedLong(s.substring(0, split), 16),
        Long.parseUnsignedLong(s.substring(split), 16));
  }

  public long toHighOrderLong() {
    return highOrderBits;
  }

  public long toLong() {
    return lowOrderBits;
  }

  /**
   * Returns the zero padded hex representation, in lower case, of the unsigned 128-bit id.
   *
   * @return 32 characters hex String
   */
  public String toHexString() {
    String hex = hexStr;
    if (hex == null) {
      hex =
          HexStrings.toHexStringPadded(highOrderBits, 16)
              + HexStrings.toHexStringPadded(lowOrderBits, 16);
      hexStr = hex;
    }
    return hex;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TraceId)) {
      return false;
    }
    TraceId that = (TraceId) o;
    return highOrderBits == that.highOrderBits && lowOrderBits == that.lowOrderBits;
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(highOrderBits) + Long.hashCode(lowOrderBits);
  }

  @Override
  public String toString() {
    return toHexString();
  }
}
