package hdlir.expr;

import hdlir.except.VarException;
import hdlir.stmt.AssignStmt;

/** Widening view {@code width'(parent)}. */
public class VarExtend extends Expr {
  VarExtend(Var parent, int width) {
    super(ExprOp.Extend, parent, null);
    if (width < parent.getWidth())
      throw new VarException(String.format("Cannot extend %s (width=%d) to %d", parent.handleName(), parent.getWidth(), width), parent);
    if (!parent.isScalar() || (parent.isPacked() && !(parent instanceof Const)))
      throw new VarException(String.format("Cannot extend an array (%s)", parent.handleName()), parent);
    this.varWidth = width;
    this.isSigned = parent.isSigned();
  }

  public Var getParentVar() { return left; }

  void setParentVar(Var parent) { left = parent; }

  @Override
  public void addSink(AssignStmt stmt) {
    left.addSink(stmt);
  }

  @Override
  public void addSource(AssignStmt stmt) {
    left.addSource(stmt);
  }
}
