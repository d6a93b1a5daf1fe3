package hdlir.except;

import hdlir.ir.IRNode;
import java.util.Arrays;
import java.util.Collection;

/** Error raised at scope level, usually implicating several collaborating nodes. */
public class GeneratorException extends IRException {
  private static final long serialVersionUID = 1L;

  public GeneratorException(String message, IRNode... nodes) { super(message, Arrays.asList(nodes)); }

  public GeneratorException(String message, Collection<? extends IRNode> nodes) { super(message, nodes); }
}
