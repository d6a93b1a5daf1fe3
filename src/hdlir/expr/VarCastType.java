package hdlir.expr;

public enum VarCastType {
  Signed,
  Unsigned,
  Clock,
  AsyncReset,
  ClockEnable,
  Reset;

  /** True for casts that mark a 1-bit signal with a special hardware role. */
  public boolean isSignalRole() { return this != Signed && this != Unsigned; }
}
