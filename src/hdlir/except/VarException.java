package hdlir.except;

import hdlir.ir.IRNode;
import java.util.Arrays;

/**
 * Structural or semantic error raised by a variable or expression node: width or sign mismatches, illegal slice bounds, illegal
 * assignment targets, failed cast or extension preconditions, unbound function arguments.
 */
public class VarException extends IRException {
  private static final long serialVersionUID = 1L;

  public VarException(String message, IRNode... nodes) { super(message, Arrays.asList(nodes)); }
}
