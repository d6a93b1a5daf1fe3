package hdlir.except;

import hdlir.ir.IRNode;
import java.util.Arrays;

/** Structural error raised by a statement node. */
public class StmtException extends IRException {
  private static final long serialVersionUID = 1L;

  public StmtException(String message, IRNode... nodes) { super(message, Arrays.asList(nodes)); }
}
