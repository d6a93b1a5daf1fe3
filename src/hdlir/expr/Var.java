package hdlir.expr;

import hdlir.IRContext;
import hdlir.except.InternalException;
import hdlir.except.UserException;
import hdlir.except.VarException;
import hdlir.generator.Generator;
import hdlir.ir.IRNode;
import hdlir.ir.IRNodeKind;
import hdlir.ir.IRVisitor;
import hdlir.stmt.AssignStmt;
import hdlir.stmt.AssignmentType;
import hdlir.util.SystemVerilogKeywords;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A signal: a named bit vector or array owned by a {@link Generator}.
 * Tracks the assignments writing it (sinks) and reading it (sources), and memoizes the views derived from it
 * (slices, concatenations, extensions and casts), so repeated requests return the same node.
 */
public class Var extends IRNode {
  protected String name;
  protected Generator generator;
  protected int varWidth;
  protected List<Integer> size;
  protected boolean isSigned;
  protected VarType type;
  protected boolean explicitArray = false;
  protected boolean isPacked = false;
  protected Param param = null;

  protected final Set<AssignStmt> sinks = new LinkedHashSet<>();
  protected final Set<AssignStmt> sources = new LinkedHashSet<>();

  // derived views, keyed by bounds (List), index signal (Var) or member name (String)
  protected final Map<Object, VarSlice> slices = new LinkedHashMap<>();
  protected final Set<VarConcat> concatVars = new LinkedHashSet<>();
  protected final Map<Integer, VarExtend> extended = new LinkedHashMap<>();
  protected final Map<VarCastType, VarCasted> casted = new EnumMap<>(VarCastType.class);

  public Var(Generator generator, String name, int varWidth, List<Integer> size, boolean isSigned, VarType type) {
    super(IRNodeKind.VarKind);
    if (generator == null && type != VarType.ConstValue)
      throw new UserException(String.format("module is null for %s", name));
    if (!SystemVerilogKeywords.isValidVariableName(name))
      throw new UserException(String.format("%s is a SystemVerilog keyword", name));
    if (varWidth < 0)
      throw new IllegalArgumentException(String.format("negative width %d for %s", varWidth, name));
    if (size.isEmpty() || size.stream().anyMatch(dim -> dim <= 0))
      throw new IllegalArgumentException(String.format("invalid array size %s for %s", size, name));
    this.generator = generator;
    this.name = name;
    this.varWidth = varWidth;
    this.size = new ArrayList<>(size);
    this.isSigned = isSigned;
    this.type = type;
  }

  public Var(Generator generator, String name, int varWidth, List<Integer> size, boolean isSigned) {
    this(generator, name, varWidth, size, isSigned, VarType.Base);
  }

  public Var(Generator generator, String name, int varWidth, int size, boolean isSigned) {
    this(generator, name, varWidth, List.of(size), isSigned, VarType.Base);
  }

  public String getName() { return name; }
  public Generator getGenerator() { return generator; }
  public VarType getType() { return type; }
  public boolean isSigned() { return isSigned; }
  /** Width of one array element. */
  public int getVarWidth() { return varWidth; }
  public List<Integer> getSize() { return Collections.unmodifiableList(size); }

  /** Total bit count: element width times every array dimension. */
  public int getWidth() {
    int width = varWidth;
    for (int dim : size)
      width *= dim;
    return width;
  }

  /** A single element, i.e. size {@code [1]}. */
  public boolean isScalar() { return size.size() == 1 && size.get(0) == 1; }

  public boolean isExplicitArray() { return explicitArray; }
  /** Treat a scalar as a one-element array when slicing. */
  public void setExplicitArray(boolean explicitArray) { this.explicitArray = explicitArray; }
  public boolean isPacked() { return isPacked; }
  public void setIsPacked(boolean isPacked) { this.isPacked = isPacked; }

  public boolean isEnum() { return false; }
  public EnumType getEnumType() { return null; }

  public boolean isParametrized() { return param != null; }
  public Param getParam() { return param; }

  /**
   * Ties the element width to a parameter; later value changes of the parameter update this signal.
   * @throws VarException if the parameter's current value is not positive
   * @throws UserException if the parameter's current value does not fit a width
   */
  public void setWidthParam(Param param) {
    if (param.getValue() <= 0)
      throw new VarException(String.format("Parameter %s cannot be used as the width of %s, its value is %d", param, name, param.getValue()),
                             this, param);
    if (param.getValue() > Integer.MAX_VALUE)
      throw new UserException(String.format("Parameter %s cannot be used as the width of %s, %d exceeds the largest width (%d)", param, name,
                                            param.getValue(), Integer.MAX_VALUE));
    varWidth = (int)param.getValue();
    this.param = param;
    param.addParamVar(this);
  }

  @Override
  public Optional<IRContext> context() {
    return Optional.ofNullable(generator).map(Generator::getContext);
  }

  protected IRContext requireContext() {
    return context().orElseThrow(() -> new InternalException(String.format("%s has no context to create constants in", name)));
  }

  @Override
  public IRNode parent() {
    return generator;
  }

  // link sets

  public Set<AssignStmt> getSinks() { return Collections.unmodifiableSet(sinks); }
  public Set<AssignStmt> getSources() { return Collections.unmodifiableSet(sources); }

  /** Registers {@code stmt} as writing this signal. Views forward this to the signal they view. */
  public void addSink(AssignStmt stmt) {
    sinks.add(stmt);
    stmt.recordSinkLink(this);
  }

  /** Registers {@code stmt} as reading this signal. Expressions forward this to their operands. */
  public void addSource(AssignStmt stmt) {
    sources.add(stmt);
    stmt.recordSourceLink(this);
  }

  public void removeSink(AssignStmt stmt) { sinks.remove(stmt); }
  public void removeSource(AssignStmt stmt) { sources.remove(stmt); }

  /** Rejects node kinds that can never be written. */
  public void checkSinkKind(Var source) {
    switch (type) {
    case ConstValue:
    case Parameter:
      throw new VarException(String.format("Cannot assign %s to a const %s", source, this), this, source);
    case Expression:
      throw new VarException(String.format("Cannot assign %s to an expression", source), this, source);
    case FunctionCall:
      throw new VarException(String.format("Cannot assign %s to a function call", source), this, source);
    default:
      break;
    }
  }

  /** Checks that {@code source} may be assigned to this signal; enum-typed signals additionally check the enum type. */
  public void checkAssignable(Var source) { checkSinkKind(source); }

  // operators

  public Expr invert() { return generator.expr(ExprOp.UInvert, this, null); }
  public Expr negate() { return generator.expr(ExprOp.UMinus, this, null); }
  public Expr unaryPlus() { return generator.expr(ExprOp.UPlus, this, null); }
  public Expr rOr() { return generator.expr(ExprOp.UOr, this, null); }
  public Expr rAnd() { return generator.expr(ExprOp.UAnd, this, null); }
  public Expr rXor() { return generator.expr(ExprOp.UXor, this, null); }
  public Expr rNot() { return generator.expr(ExprOp.UNot, this, null); }

  public Expr add(Var var) { return generator.expr(ExprOp.Add, this, var); }
  public Expr sub(Var var) { return generator.expr(ExprOp.Minus, this, var); }
  public Expr mul(Var var) { return generator.expr(ExprOp.Multiply, this, var); }
  public Expr div(Var var) { return generator.expr(ExprOp.Divide, this, var); }
  public Expr mod(Var var) { return generator.expr(ExprOp.Mod, this, var); }
  public Expr shr(Var var) { return generator.expr(ExprOp.LogicalShiftRight, this, var); }
  public Expr ashr(Var var) { return generator.expr(ExprOp.SignedShiftRight, this, var); }
  public Expr shl(Var var) { return generator.expr(ExprOp.ShiftLeft, this, var); }
  public Expr or(Var var) { return generator.expr(ExprOp.Or, this, var); }
  public Expr and(Var var) { return generator.expr(ExprOp.And, this, var); }
  public Expr xor(Var var) { return generator.expr(ExprOp.Xor, this, var); }
  public Expr lt(Var var) { return generator.expr(ExprOp.LessThan, this, var); }
  public Expr gt(Var var) { return generator.expr(ExprOp.GreaterThan, this, var); }
  public Expr le(Var var) { return generator.expr(ExprOp.LessEqThan, this, var); }
  public Expr ge(Var var) { return generator.expr(ExprOp.GreaterEqThan, this, var); }
  public Expr eq(Var var) { return generator.expr(ExprOp.Eq, this, var); }
  public Expr neq(Var var) { return generator.expr(ExprOp.Neq, this, var); }

  public Expr add(long value) { return add(constantLike(value)); }
  public Expr sub(long value) { return sub(constantLike(value)); }
  public Expr mul(long value) { return mul(constantLike(value)); }
  public Expr and(long value) { return and(constantLike(value)); }
  public Expr or(long value) { return or(constantLike(value)); }
  public Expr xor(long value) { return xor(constantLike(value)); }
  public Expr lt(long value) { return lt(constantLike(value)); }
  public Expr gt(long value) { return gt(constantLike(value)); }
  public Expr le(long value) { return le(constantLike(value)); }
  public Expr ge(long value) { return ge(constantLike(value)); }
  public Expr eq(long value) { return eq(constantLike(value)); }
  public Expr neq(long value) { return neq(constantLike(value)); }

  /** A constant with this signal's total width and signedness. */
  protected Const constantLike(long value) { return requireContext().constant(value, getWidth(), isSigned); }

  // views

  /**
   * Range slice {@code [high:low]}. Scalars are sliced by bit, arrays by outer index.
   * @throws VarException on inverted or out-of-range bounds
   */
  public VarSlice slice(int high, int low) {
    if (low > high)
      throw new VarException(String.format("low (%d) cannot be larger than high (%d)", low, high), this);
    if (low < 0)
      throw new VarException(String.format("low (%d) cannot be negative", low), this);
    if (isScalar()) {
      if (high >= getWidth())
        throw new VarException(String.format("high (%d) has to be smaller than width (%d)", high, getWidth()), this);
    } else if (high >= size.get(0)) {
      throw new VarException(String.format("high (%d) has to be smaller than size (%d)", high, size.get(0)), this);
    }
    return slices.computeIfAbsent(List.of(high, low), key -> new VarSlice(this, high, low));
  }

  public VarSlice bit(int index) { return slice(index, index); }

  /** Slice indexed by another signal. */
  public VarVarSlice index(Var indexVar) {
    if (indexVar == null)
      throw new InternalException(String.format("Index of %s cannot be null", name));
    return (VarVarSlice)slices.computeIfAbsent(indexVar, key -> new VarVarSlice(this, indexVar));
  }

  /** Concatenation {@code {this, var}}; memoized per operand pair. */
  public VarConcat concat(Var var) {
    for (VarConcat existing : concatVars) {
      List<Var> members = existing.getVars();
      if (existing.getBase() == null && members.size() == 2 && members.get(0) == this && members.get(1) == var)
        return existing;
    }
    VarConcat result = new VarConcat(this, var);
    result.registerMembership();
    return result;
  }

  /** Widens to {@code width} bits; memoized per width. */
  public VarExtend extend(int width) { return extended.computeIfAbsent(width, key -> new VarExtend(this, width)); }

  /** Reinterpreting view; a signed cast of a signed signal is the signal itself. */
  public Var cast(VarCastType castType) {
    if (castType == VarCastType.Signed && isSigned)
      return this;
    return casted.computeIfAbsent(castType, key -> new VarCasted(this, castType));
  }

  /**
   * Checks that {@code other} has this signal's element width, dimensions, array flag, sign and packed layout,
   * so every view of this signal can be rebuilt on it with the same meaning.
   * @throws VarException otherwise
   */
  public void checkSameShape(Var other) {
    if (other.getWidth() != getWidth())
      throw new VarException(String.format("%s's width (%d) doesn't match %s's width (%d)", other.handleName(), other.getWidth(), handleName(),
                                           getWidth()),
                             this, other);
    if (other.varWidth != varWidth || !other.size.equals(size) || other.explicitArray != explicitArray)
      throw new VarException(String.format("%s's shape (%s) doesn't match %s's shape (%s)", other.handleName(), other.shapeString(), handleName(),
                                           shapeString()),
                             this, other);
    if (other.isSigned != isSigned)
      throw new VarException(String.format("%s's sign doesn't match %s's sign", other.handleName(), handleName()), this, other);
    PackedStruct struct = this instanceof PackedVar ? ((PackedVar)this).getPackedStruct() : null;
    PackedStruct otherStruct = other instanceof PackedVar ? ((PackedVar)other).getPackedStruct() : null;
    if (struct != otherStruct)
      throw new VarException(String.format("%s's packed layout doesn't match %s's packed layout", other.handleName(), handleName()), this,
                             other);
  }

  private String shapeString() { return varWidth + " bit " + (explicitArray ? "array " : "") + size; }

  /**
   * Moves every derived view of this signal onto {@code newVar}, re-parenting the views so they resolve through it.
   * Where {@code newVar} already holds a view under the same key, that view is kept: the views derived from the displaced one are merged
   * into it, and the assignments linked to this signal are repointed to it. Expressions outside those assignments keep the displaced view.
   * @throws VarException if the two signals differ in shape
   */
  public void moveLinkedTo(Var newVar) {
    if (newVar == this)
      return;
    checkSameShape(newVar);
    List<AssignStmt> users = new ArrayList<>(sinks);
    for (AssignStmt stmt : sources) {
      if (!sinks.contains(stmt))
        users.add(stmt);
    }
    mergeViews(newVar, users);
  }

  private void mergeViews(Var newVar, List<AssignStmt> users) {
    for (var entry : slices.entrySet())
      mergeView(entry.getValue(), newVar.slices.putIfAbsent(entry.getKey(), entry.getValue()), newVar, users);
    slices.clear();
    for (VarConcat concat : new ArrayList<>(concatVars))
      concat.replaceVar(this, newVar);
    concatVars.clear();
    for (var entry : extended.entrySet())
      mergeView(entry.getValue(), newVar.extended.putIfAbsent(entry.getKey(), entry.getValue()), newVar, users);
    extended.clear();
    for (var entry : casted.entrySet())
      mergeView(entry.getValue(), newVar.casted.putIfAbsent(entry.getKey(), entry.getValue()), newVar, users);
    casted.clear();
  }

  private static void mergeView(Var view, Var kept, Var newVar, List<AssignStmt> users) {
    if (kept == null || kept == view) {
      if (view instanceof VarSlice)
        ((VarSlice)view).setParentVar(newVar);
      else if (view instanceof VarExtend)
        ((VarExtend)view).setParentVar(newVar);
      else
        ((VarCasted)view).setParentVar(newVar);
      return;
    }
    view.mergeViews(kept, users);
    for (AssignStmt stmt : users) {
      if (stmt.getLeft() == view)
        stmt.setLeft(kept);
      else
        replaceNested(stmt.getLeft(), view, kept);
      if (stmt.getRight() == view)
        stmt.setRight(kept);
      else
        replaceNested(stmt.getRight(), view, kept);
    }
  }

  /** Replaces {@code view} by {@code kept} wherever it is an operand inside {@code root}. */
  private static void replaceNested(Var root, Var view, Var kept) {
    Deque<Var> pending = new ArrayDeque<>();
    Set<Var> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    pending.push(root);
    while (!pending.isEmpty()) {
      Var node = pending.pop();
      if (!seen.add(node))
        continue;
      if (node instanceof VarSlice)
        pending.push(((VarSlice)node).getParentVar());
      else if (node instanceof VarCasted)
        pending.push(((VarCasted)node).getParentVar());
      List<Var> operands = node.operands();
      for (int i = 0; i < operands.size(); ++i) {
        if (operands.get(i) == view)
          node.replaceOperand(i, kept);
        else
          pending.push(operands.get(i));
      }
    }
  }

  // assignment

  public AssignStmt assign(Var source) { return assign(source, AssignmentType.Undefined); }

  public AssignStmt assign(long value) { return assign(constantLike(value), AssignmentType.Undefined); }

  /**
   * Creates an assignment writing this signal. The statement is linked to both sides but not added to any scope.
   * @throws VarException if this signal cannot be written or the widths or signs differ
   */
  public AssignStmt assign(Var source, AssignmentType assignType) {
    AssignStmt stmt = new AssignStmt(this, fitConstant(source), assignType);
    if (generator != null)
      generator.captureDebug(stmt);
    return stmt;
  }

  private Var fitConstant(Var source) {
    if (source.getType() != VarType.ConstValue || source.isEnum())
      return source;
    if (source.getWidth() == getWidth() && source.isSigned() == isSigned)
      return source;
    long value = ((Const)source).getValue();
    if (!Const.fits(value, getWidth(), isSigned))
      return source;
    return requireContext().constant(value, getWidth(), isSigned);
  }

  /** Removes {@code stmt} from wherever it was added and unregisters it from every signal. */
  public void unassign(AssignStmt stmt) { stmt.remove(); }

  // names

  /** Fully qualified name through the owning generator's hierarchy. */
  public String handleName() { return handleName(false); }

  public String handleName(boolean ignoreTop) {
    String generatorName = generator == null ? "" : generator.handleName(ignoreTop);
    return generatorName.isEmpty() ? toString() : generatorName + "." + toString();
  }

  /**
   * Name relative to an enclosing scope.
   * @throws VarException if this signal is not reachable from {@code scope}
   */
  public String handleName(Generator scope) {
    String scopeName = scope.handleName();
    String varName = handleName();
    if (!varName.startsWith(scopeName + "."))
      throw new VarException(String.format("%s is not accessible from %s", varName, scopeName), this, scope);
    return varName.substring(scopeName.length() + 1);
  }

  // traversal

  /** Operands of expression-like nodes, empty for plain signals. */
  public List<Var> operands() { return List.of(); }

  public void replaceOperand(int index, Var operand) {
    throw new InternalException(String.format("%s has no operands to replace", this));
  }

  @Override
  public int childCount() {
    return operands().size();
  }

  @Override
  public IRNode getChild(int index) {
    return operands().get(index);
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
