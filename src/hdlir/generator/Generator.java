package hdlir.generator;

import hdlir.IRContext;
import hdlir.except.GeneratorException;
import hdlir.expr.ConditionalExpr;
import hdlir.expr.EnumPort;
import hdlir.expr.EnumType;
import hdlir.expr.EnumVar;
import hdlir.expr.Expr;
import hdlir.expr.ExprOp;
import hdlir.expr.FunctionCallVar;
import hdlir.expr.PackedStruct;
import hdlir.expr.Param;
import hdlir.expr.Port;
import hdlir.expr.Port.PortDirection;
import hdlir.expr.Port.PortType;
import hdlir.expr.PortPackedStruct;
import hdlir.expr.Var;
import hdlir.expr.VarConcat;
import hdlir.expr.VarPackedStruct;
import hdlir.expr.VarSlice;
import hdlir.expr.VarType;
import hdlir.ir.DebugInfo;
import hdlir.ir.IRNode;
import hdlir.ir.IRNodeKind;
import hdlir.ir.IRVisitor;
import hdlir.stmt.AssignStmt;
import hdlir.stmt.CombinationalStmtBlock;
import hdlir.stmt.DPIFunctionStmtBlock;
import hdlir.stmt.FunctionStmtBlock;
import hdlir.stmt.SequentialStmtBlock;
import hdlir.stmt.Stmt;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Owning scope of signals and statements, the hardware module a circuit description is built in.
 * Provides the narrow surface the IR needs: signal creation, the expression factory, the statement list and hierarchical names.
 */
public class Generator extends IRNode {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final IRContext context;
  private final String name;
  private Generator parentGenerator = null;
  private boolean debug = false;

  private final List<Generator> children = new ArrayList<>();
  private final Map<String, Var> vars = new LinkedHashMap<>();
  private final Map<String, Port> ports = new LinkedHashMap<>();
  private final Map<String, Param> params = new LinkedHashMap<>();
  private final Map<String, EnumType> enums = new LinkedHashMap<>();
  private final Map<String, FunctionStmtBlock> functions = new LinkedHashMap<>();
  private final List<FunctionCallVar> callVars = new ArrayList<>();
  private final List<Expr> exprs = new ArrayList<>();
  private final List<Stmt> stmts = new ArrayList<>();

  public Generator(IRContext context, String name) {
    super(IRNodeKind.GeneratorKind);
    this.context = context;
    this.name = name;
  }

  public IRContext getContext() { return context; }
  @Override
  public Optional<IRContext> context() {
    return Optional.ofNullable(context);
  }
  public String getName() { return name; }
  public boolean isDebug() { return debug; }
  public void setDebug(boolean debug) { this.debug = debug; }
  public boolean isConstScope() { return context != null && context.isConstScope(this); }

  public Generator getParentGenerator() { return parentGenerator; }
  @Override
  public IRNode parent() {
    return parentGenerator;
  }

  public List<Generator> getChildGenerators() { return Collections.unmodifiableList(children); }

  public void addChildGenerator(Generator child) {
    if (child == this || child.parentGenerator != null)
      throw new GeneratorException(String.format("%s already has a parent generator", child.getName()), child, this);
    if (child.context != context)
      throw new GeneratorException(String.format("%s belongs to a different context", child.getName()), child, this);
    child.parentGenerator = this;
    children.add(child);
  }

  /** Records the caller location on {@code node} when this generator captures debug information. */
  public void captureDebug(IRNode node) {
    if (debug)
      DebugInfo.capture().ifPresent(node::addDebugLocation);
  }

  // signal creation

  public Var var(String varName, int width) { return var(varName, width, List.of(1), false); }
  public Var var(String varName, int width, int size) { return var(varName, width, List.of(size), false); }
  public Var var(String varName, int width, int size, boolean isSigned) { return var(varName, width, List.of(size), isSigned); }

  public Var var(String varName, int width, List<Integer> size, boolean isSigned) {
    checkUnusedName(varName);
    return addVar(new Var(this, varName, width, size, isSigned));
  }

  public Port port(PortDirection direction, String portName, int width) {
    return port(direction, portName, width, List.of(1), PortType.Data, false);
  }

  public Port port(PortDirection direction, String portName, int width, List<Integer> size, PortType type, boolean isSigned) {
    checkUnusedName(portName);
    return addPort(new Port(this, direction, portName, width, size, type, isSigned));
  }

  public Param parameter(String paramName, int width, boolean isSigned) {
    checkUnusedName(paramName);
    Param param = new Param(this, paramName, width, isSigned);
    captureDebug(param);
    params.put(paramName, param);
    return param;
  }

  public EnumType enumType(String enumName, Map<String, Long> values, int width) {
    if (enums.containsKey(enumName))
      throw new GeneratorException(String.format("Enum %s already exists in %s", enumName, handleName()), this);
    EnumType type = new EnumType(this, enumName, values, width);
    enums.put(enumName, type);
    return type;
  }

  public EnumVar enumVar(String varName, EnumType type) {
    checkUnusedName(varName);
    return addVar(new EnumVar(this, varName, type));
  }

  public EnumPort enumPort(PortDirection direction, String portName, EnumType type) {
    checkUnusedName(portName);
    return addPort(new EnumPort(this, direction, portName, type));
  }

  public VarPackedStruct packedVar(String varName, PackedStruct struct) {
    checkUnusedName(varName);
    return addVar(new VarPackedStruct(this, varName, struct));
  }

  public PortPackedStruct packedPort(PortDirection direction, String portName, PackedStruct struct) {
    checkUnusedName(portName);
    return addPort(new PortPackedStruct(this, direction, portName, struct));
  }

  private <T extends Var> T addVar(T var) {
    captureDebug(var);
    vars.put(var.getName(), var);
    return var;
  }

  private <T extends Port> T addPort(T port) {
    addVar(port);
    ports.put(port.getName(), port);
    return port;
  }

  private void checkUnusedName(String varName) {
    IRNode existing = vars.containsKey(varName) ? vars.get(varName) : params.get(varName);
    if (existing != null)
      throw new GeneratorException(String.format("Variable %s already exists in %s", varName, handleName()), existing, this);
  }

  // lookup

  public Optional<Var> findVar(String varName) { return Optional.ofNullable(vars.containsKey(varName) ? vars.get(varName) : params.get(varName)); }

  public Var getVar(String varName) {
    return findVar(varName).orElseThrow(
        () -> new GeneratorException(String.format("Variable %s does not exist in %s", varName, handleName()), this));
  }

  public Port getPort(String portName) {
    Port port = ports.get(portName);
    if (port == null)
      throw new GeneratorException(String.format("Port %s does not exist in %s", portName, handleName()), this);
    return port;
  }

  public Map<String, Var> getVars() { return Collections.unmodifiableMap(vars); }
  public Map<String, Port> getPorts() { return Collections.unmodifiableMap(ports); }
  public Map<String, Param> getParams() { return Collections.unmodifiableMap(params); }
  public Map<String, EnumType> getEnums() { return Collections.unmodifiableMap(enums); }

  // expression factory

  /** Builds an operator expression; the expression's owning scope follows the operands, not necessarily this generator. */
  public Expr expr(ExprOp op, Var left, Var right) {
    Expr expr = new Expr(op, left, right);
    captureDebug(expr);
    exprs.add(expr);
    return expr;
  }

  public ConditionalExpr conditional(Var condition, Var left, Var right) {
    ConditionalExpr expr = new ConditionalExpr(condition, left, right);
    captureDebug(expr);
    exprs.add(expr);
    return expr;
  }

  // statements

  public List<Stmt> getStmts() { return Collections.unmodifiableList(stmts); }
  public int stmtsCount() { return stmts.size(); }

  /**
   * Appends a top-level statement.
   * @throws GeneratorException if an assignment writes a signal that is neither owned by this generator nor a port of a direct child
   */
  public void addStmt(Stmt stmt) {
    if (stmt instanceof AssignStmt)
      checkSinkReachable((AssignStmt)stmt);
    captureDebug(stmt);
    stmt.setParent(this);
    stmts.add(stmt);
  }

  /** Removes a top-level statement and unregisters every assignment in it from its signals. */
  public void removeStmt(Stmt stmt) {
    if (!stmts.remove(stmt))
      return;
    stmt.unlinkAll();
    stmt.setParent(null);
  }

  public CombinationalStmtBlock combinational() {
    CombinationalStmtBlock block = new CombinationalStmtBlock();
    addStmt(block);
    return block;
  }

  public SequentialStmtBlock sequential() {
    SequentialStmtBlock block = new SequentialStmtBlock();
    addStmt(block);
    return block;
  }

  private void checkSinkReachable(AssignStmt stmt) {
    Deque<Var> pending = new ArrayDeque<>();
    pending.push(stmt.getLeft());
    while (!pending.isEmpty()) {
      Var var = pending.pop();
      if (var instanceof VarSlice) {
        pending.push(((VarSlice)var).getRootParent());
      } else if (var instanceof VarConcat) {
        ((VarConcat)var).getVars().forEach(pending::push);
      } else if (!isReachable(var)) {
        throw new GeneratorException(String.format("%s is not reachable from %s", var.handleName(), handleName()), stmt, var, this);
      }
    }
  }

  private boolean isReachable(Var var) {
    Generator owner = var.getGenerator();
    if (owner == this)
      return true;
    return var.getType() == VarType.PortIO && owner != null && owner.parentGenerator == this;
  }

  // functions

  public FunctionStmtBlock function(String functionName) {
    checkUnusedFunction(functionName);
    FunctionStmtBlock func = new FunctionStmtBlock(this, functionName);
    functions.put(functionName, func);
    return func;
  }

  public DPIFunctionStmtBlock dpiFunction(String functionName) {
    checkUnusedFunction(functionName);
    DPIFunctionStmtBlock func = new DPIFunctionStmtBlock(this, functionName);
    functions.put(functionName, func);
    return func;
  }

  private void checkUnusedFunction(String functionName) {
    if (functions.containsKey(functionName))
      throw new GeneratorException(String.format("Function %s already exists in %s", functionName, handleName()), functions.get(functionName), this);
  }

  public boolean hasFunction(String functionName) { return functions.containsKey(functionName); }

  public FunctionStmtBlock getFunction(String functionName) {
    FunctionStmtBlock func = functions.get(functionName);
    if (func == null)
      throw new GeneratorException(String.format("Function %s does not exist in %s", functionName, handleName()), this);
    return func;
  }

  public Map<String, FunctionStmtBlock> getFunctions() { return Collections.unmodifiableMap(functions); }

  /** Registers a function defined elsewhere, e.g. when a detached call is first used in this generator. */
  public void addFunction(FunctionStmtBlock func) { functions.putIfAbsent(func.getFunctionName(), func); }

  /** Creates a call to one of this generator's functions that is used as an operand. */
  public FunctionCallVar call(String functionName, Map<String, Var> args) {
    FunctionCallVar callVar = new FunctionCallVar(this, getFunction(functionName), args, true);
    captureDebug(callVar);
    callVars.add(callVar);
    return callVar;
  }

  public void addCallVar(FunctionCallVar callVar) { callVars.add(callVar); }
  public List<FunctionCallVar> getCallVars() { return Collections.unmodifiableList(callVars); }

  // names

  /** Hierarchical name, outermost generator first, joined by dots. */
  public String handleName() { return handleName(false); }

  public String handleName(boolean ignoreTop) {
    List<String> names = new ArrayList<>();
    for (Generator gen = this; gen != null; gen = gen.parentGenerator)
      names.add(gen.name);
    if (ignoreTop)
      names.remove(names.size() - 1);
    Collections.reverse(names);
    return String.join(".", names);
  }

  // traversal: statements, functions, then child generators

  @Override
  public int childCount() {
    return stmts.size() + functions.size() + children.size();
  }

  @Override
  public IRNode getChild(int index) {
    if (index < stmts.size())
      return stmts.get(index);
    index -= stmts.size();
    if (index < functions.size())
      return new ArrayList<>(functions.values()).get(index);
    index -= functions.size();
    return children.get(index);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return name;
  }
}
