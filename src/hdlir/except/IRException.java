package hdlir.except;

import hdlir.ir.DiagnosticPrinter;
import hdlir.ir.IRNode;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Base class of all errors raised while building or rewriting the IR.
 * Carries the nodes implicated in the failure; nodes with captured debug locations are handed to {@link DiagnosticPrinter}.
 */
public abstract class IRException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient List<IRNode> nodes;

  protected IRException(String message, Collection<? extends IRNode> nodes) {
    super(message);
    this.nodes = nodes.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    if (!this.nodes.isEmpty())
      DiagnosticPrinter.printNodes(this.nodes);
  }

  protected IRException(String message) { this(message, List.of()); }

  /**
   * Returns the IR nodes implicated in this error.
   * @return read-only list of nodes, possibly empty
   */
  public List<IRNode> getNodes() { return nodes; }
}
