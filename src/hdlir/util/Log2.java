package hdlir.util;

public class Log2 {
  public static int log2(int n) {
    if (n <= 0)
      throw new IllegalArgumentException("log2 of non-positive value " + n);
    return 31 - Integer.numberOfLeadingZeros(n);
  }

  public static int clog2(int n) {
    if (n <= 0)
      throw new IllegalArgumentException("clog2 of non-positive value " + n);
    return n == 1 ? 0 : log2(n - 1) + 1;
  }

  /** Number of bits needed to select one of {@code count} elements, at least one. */
  public static int indexWidth(int count) { return Math.max(1, clog2(count)); }
}
