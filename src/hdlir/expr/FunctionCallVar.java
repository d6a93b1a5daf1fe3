package hdlir.expr;

import hdlir.except.StmtException;
import hdlir.except.VarException;
import hdlir.generator.Generator;
import hdlir.stmt.AssignStmt;
import hdlir.stmt.DPIFunctionStmtBlock;
import hdlir.stmt.FunctionStmtBlock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Result of calling a function, used as an operand.
 * A call built in the constant scope is moved to the generator of the first assignment that reads it.
 */
public class FunctionCallVar extends Var {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final FunctionStmtBlock funcDef;
  private final Map<String, Var> args;

  /**
   * @param hasReturn whether the call is used as a value; non-DPI functions then need a return statement
   * @throws VarException if a port is unbound, bound to an unknown name, or bound with a different width or sign
   * @throws StmtException if a value is expected but the function never returns one
   */
  public FunctionCallVar(Generator generator, FunctionStmtBlock funcDef, Map<String, Var> args, boolean hasReturn) {
    super(generator, "", 0, List.of(1), false, VarType.FunctionCall);
    this.funcDef = funcDef;
    this.args = new LinkedHashMap<>(args);
    var ports = funcDef.getPorts();
    for (String argName : args.keySet()) {
      if (!ports.containsKey(argName))
        throw new VarException(String.format("%s is not a port of %s", argName, funcDef.getFunctionName()), funcDef);
    }
    for (Port port : ports.values()) {
      Var arg = args.get(port.getName());
      if (arg == null)
        throw new VarException(String.format("%s is not connected", port.getName()), port);
      if (arg.getWidth() != port.getWidth())
        throw new VarException(String.format("%s's width (%d) doesn't match %s's width (%d)", port.getName(), port.getWidth(), arg, arg.getWidth()),
                               port, arg);
      if (arg.isSigned() != port.isSigned())
        throw new VarException(String.format("%s's sign doesn't match %s's sign", port.getName(), arg), port, arg);
    }
    if (!hasReturn)
      return;
    if (funcDef.isDpi()) {
      int returnWidth = ((DPIFunctionStmtBlock)funcDef).getReturnWidth();
      if (returnWidth > 0)
        varWidth = returnWidth;
      return;
    }
    Var handler = funcDef.getFunctionHandler();
    if (handler == null)
      throw new StmtException(String.format("%s doesn't have return value", funcDef.getFunctionName()), funcDef);
    varWidth = handler.getVarWidth();
    size = new ArrayList<>(handler.getSize());
    isSigned = handler.isSigned();
  }

  public FunctionStmtBlock getFunction() { return funcDef; }
  public Map<String, Var> getArgs() { return Collections.unmodifiableMap(args); }

  @Override
  public void addSource(AssignStmt stmt) {
    for (Var arg : args.values())
      arg.addSource(stmt);
    rehome(stmt);
  }

  private void rehome(AssignStmt stmt) {
    if (generator == null || !generator.isConstScope())
      return;
    Generator target = stmt.getLeft().getGenerator();
    if (target == null || target.isConstScope())
      return;
    generator = target;
    if (!target.hasFunction(funcDef.getFunctionName()))
      target.addFunction(funcDef);
    target.addCallVar(this);
    logger.debug("Moved call of {} to {}", funcDef.getFunctionName(), target.handleName());
  }

  @Override
  public List<Var> operands() {
    return List.copyOf(args.values());
  }

  @Override
  public void replaceOperand(int index, Var operand) {
    String argName = new ArrayList<>(args.keySet()).get(index);
    args.put(argName, operand);
  }

  @Override
  public String toString() {
    Map<String, Integer> ordering = funcDef.getPortOrdering();
    List<String> names = new ArrayList<>(args.keySet());
    if (!ordering.isEmpty())
      names.sort(Comparator.comparing(ordering::get));
    return funcDef.getFunctionName() + " (" + names.stream().map(argName -> args.get(argName).toString()).collect(Collectors.joining(", ")) + ")";
  }
}
