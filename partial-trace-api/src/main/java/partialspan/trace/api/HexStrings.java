package partialspan.trace.api;

final class HexStrings {
  private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

  private HexStrings() {}

  static String toHexStringPadded(long id, int size) {
    char[] chars = new char[size];
    for (int i = size - 1; i >= 0; i--) {
      chars[i] = HEX_DIGITS[(int) (id & 0xF)];
      id >>>= 4;
    }
    return new String(chars);
  }
}
