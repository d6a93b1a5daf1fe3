package hdlir.stmt;

import hdlir.except.StmtException;
import hdlir.expr.Port;
import hdlir.expr.Port.PortDirection;
import hdlir.expr.Var;
import hdlir.generator.Generator;
import hdlir.ir.IRVisitor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Instantiates a child generator inside its parent.
 * Input ports map to the signal driving them in the parent, output ports to the signal they drive.
 */
public class ModuleInstantiationStmt extends Stmt {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Generator target;
  private final Generator parentGenerator;
  private final Map<Port, Var> portMapping = new LinkedHashMap<>();
  private final Map<Port, AssignStmt> portStmts = new LinkedHashMap<>();

  /** @throws StmtException if {@code target} is not a child of {@code parent} */
  public ModuleInstantiationStmt(Generator target, Generator parent) {
    super(StatementType.ModuleInstantiation);
    if (target == parent || target.getParentGenerator() != parent)
      throw new StmtException(String.format("%s is not a child generator of %s", target.getName(), parent.getName()), target, parent);
    this.target = target;
    this.parentGenerator = parent;
    for (Port port : target.getPorts().values()) {
      boolean connected = false;
      if (port.getDirection() != PortDirection.Out)
        connected = mapPort(port, port.getSinks(), AssignStmt::getRight);
      if (!connected && port.getDirection() != PortDirection.In)
        connected = mapPort(port, port.getSources(), AssignStmt::getLeft);
      if (!connected)
        logger.warn("Port {} of {} is not connected in {}", port.getName(), target.getName(), parent.handleName());
    }
  }

  private boolean mapPort(Port port, Set<AssignStmt> stmts, Function<AssignStmt, Var> otherSide) {
    for (AssignStmt stmt : stmts) {
      if (stmt.findGeneratorParent().orElse(null) != parentGenerator)
        continue;
      portMapping.put(port, otherSide.apply(stmt));
      portStmts.put(port, stmt);
      return true;
    }
    return false;
  }

  public Generator getTarget() { return target; }
  public Generator getParentGenerator() { return parentGenerator; }
  public Map<Port, Var> getPortMapping() { return Collections.unmodifiableMap(portMapping); }
  /** The assignment each mapped port was connected through. */
  public Map<Port, AssignStmt> getPortStmts() { return Collections.unmodifiableMap(portStmts); }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }
}
