package hdlir.expr;

import hdlir.except.UserException;
import hdlir.except.VarException;
import hdlir.generator.Generator;
import hdlir.stmt.AssignStmt;
import java.util.List;

/** Literal value. Created through {@link hdlir.IRContext#constant(long, int, boolean)} so it lives in the constant scope. */
public class Const extends Var {
  protected long value;

  public Const(Generator generator, long value, int width, boolean isSigned) {
    super(generator, Long.toString(value), width, List.of(1), isSigned, VarType.ConstValue);
    checkRange(value, width, isSigned);
    this.value = value;
    this.isPacked = true;
  }

  /**
   * Whether {@code value} is representable in {@code width} bits. Unsigned values of 64 bits and more use the full
   * {@code long} range as an unsigned number.
   */
  public static boolean fits(long value, int width, boolean isSigned) {
    if (width <= 0)
      return false;
    if (width >= 64)
      return true;
    if (isSigned)
      return value >= minValue(width) && value <= maxValue(width, true);
    return Long.compareUnsigned(value, maxValue(width, false)) <= 0;
  }

  private static long minValue(int width) { return -(1L << (width - 1)); }
  private static long maxValue(int width, boolean isSigned) { return isSigned ? (1L << (width - 1)) - 1 : (1L << width) - 1; }

  protected static void checkRange(long value, int width, boolean isSigned) {
    if (width <= 0)
      throw new UserException(String.format("Constant width has to be positive, got %d", width));
    if (fits(value, width, isSigned))
      return;
    if (isSigned && value < minValue(width))
      throw new UserException(String.format("%d is smaller than the minimum value (%d) given width %d", value, minValue(width), width));
    if (!isSigned && value < 0)
      throw new UserException(String.format("%d is negative but the constant is unsigned", value));
    throw new UserException(String.format("%d is larger than the maximum value (%d) given width %d", value, maxValue(width, isSigned), width));
  }

  public long getValue() { return value; }

  /** @throws UserException if the value does not fit this constant's width */
  public void setValue(long value) {
    checkRange(value, getWidth(), isSigned);
    this.value = value;
  }

  @Override
  public void addSink(AssignStmt stmt) {
    throw new VarException(String.format("const %s is not allowed to be driven by a net", this), this);
  }

  @Override
  public void setIsPacked(boolean isPacked) {
    if (!isPacked)
      throw new UserException("Unable to set const unpacked");
  }

  @Override
  public String handleName(boolean ignoreTop) {
    return toString();
  }

  @Override
  public String handleName(Generator scope) {
    return toString();
  }

  @Override
  public String toString() {
    if (isSigned && value < 0)
      return String.format("-%d'h%X", getWidth(), -value);
    return String.format("%d'h%X", getWidth(), value);
  }
}
