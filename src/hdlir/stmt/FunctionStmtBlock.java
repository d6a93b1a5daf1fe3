package hdlir.stmt;

import hdlir.except.StmtException;
import hdlir.expr.Port;
import hdlir.expr.Port.PortDirection;
import hdlir.expr.Port.PortType;
import hdlir.expr.Var;
import hdlir.generator.Generator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Function body. Ports are owned by the defining generator; the return handler is created by the first return statement.
 */
public class FunctionStmtBlock extends StmtBlock {
  protected final Generator generator;
  protected final String functionName;
  protected final Map<String, Port> ports = new LinkedHashMap<>();
  private final Map<String, Integer> portOrdering = new LinkedHashMap<>();
  private Var functionHandler = null;
  private boolean hasReturnValue = false;

  public FunctionStmtBlock(Generator generator, String functionName) {
    super(StatementBlockType.Function);
    this.generator = generator;
    this.functionName = functionName;
    setParent(generator);
  }

  public Generator getGenerator() { return generator; }
  public String getFunctionName() { return functionName; }
  public boolean isDpi() { return false; }
  public boolean hasReturnValue() { return hasReturnValue; }
  public Var getFunctionHandler() { return functionHandler; }

  public Port input(String portName, int width, boolean isSigned) { return addPort(PortDirection.In, portName, width, isSigned); }

  protected Port addPort(PortDirection direction, String portName, int width, boolean isSigned) {
    if (ports.containsKey(portName))
      throw new StmtException(String.format("%s already exists in function %s", portName, functionName), ports.get(portName), this);
    Port port = new Port(generator, direction, portName, width, List.of(1), PortType.Data, isSigned);
    generator.captureDebug(port);
    ports.put(portName, port);
    return port;
  }

  public Map<String, Port> getPorts() { return Collections.unmodifiableMap(ports); }

  public Port getPort(String portName) {
    Port port = ports.get(portName);
    if (port == null)
      throw new StmtException(String.format("%s not found in function %s", portName, functionName), this);
    return port;
  }

  public Map<String, Integer> getPortOrdering() { return Collections.unmodifiableMap(portOrdering); }

  /** Declares the argument order used when rendering calls. */
  public void setPortOrdering(Map<String, Integer> ordering) {
    for (String portName : ordering.keySet()) {
      if (!ports.containsKey(portName))
        throw new StmtException(String.format("%s not found in function %s", portName, functionName), this);
    }
    portOrdering.clear();
    portOrdering.putAll(ordering);
  }

  /**
   * Creates a return statement; the first one fixes the return type.
   * The statement still has to be added to the function body.
   * @throws StmtException if {@code value} does not match the return type fixed earlier
   */
  public ReturnStmt returnStmt(Var value) {
    if (functionHandler == null) {
      functionHandler = new Var(generator, functionName, value.getWidth(), List.of(1), value.isSigned());
    } else if (functionHandler.getWidth() != value.getWidth() || functionHandler.isSigned() != value.isSigned()) {
      throw new StmtException(String.format("Return value %s does not match the return type of %s", value, functionName), this, value);
    }
    hasReturnValue = true;
    return new ReturnStmt(this, value);
  }
}
