package hdlir.except;

/** Internal invariant violation. Indicates a caller defect or a bug, never a problem with the circuit description. */
public class InternalException extends IRException {
  private static final long serialVersionUID = 1L;

  public InternalException(String message) { super(message); }
}
