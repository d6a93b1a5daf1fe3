package hdlir.expr;

import hdlir.except.VarException;
import hdlir.ir.IRNode;
import hdlir.stmt.AssignStmt;
import java.util.ArrayList;
import java.util.List;

/**
 * Range view {@code parent[high:low]} over a scalar's bits or an array's outer dimension.
 * {@link #getVarHigh()}/{@link #getVarLow()} give the bit offsets inside the outermost non-slice ancestor.
 */
public class VarSlice extends Var {
  protected Var parentVar;
  protected int high;
  protected int low;
  protected int varHigh;
  protected int varLow;

  public VarSlice(Var parent, int high, int low) {
    super(parent.getGenerator(), "", parent.getVarWidth(), List.of(1), parent.isSigned(), VarType.Slice);
    this.parentVar = parent;
    this.high = high;
    this.low = low;
    int offset = parent instanceof VarSlice ? ((VarSlice)parent).varLow : 0;
    if (parent.isScalar() && parent.isExplicitArray()) {
      if (high != 0 || low != 0)
        throw new VarException(String.format("%s is an explicit array of size 1, only [0] can be selected", parent.handleName()), parent);
      varLow = offset;
      varHigh = offset + varWidth - 1;
    } else if (parent.isScalar()) {
      varWidth = high - low + 1;
      varLow = offset + low;
      varHigh = offset + high;
    } else {
      size = new ArrayList<>(parent.getSize());
      size.set(0, high - low + 1);
      // bits per outer element
      int elementWidth = parent.getVarWidth();
      for (int i = 1; i < parent.getSize().size(); ++i)
        elementWidth *= parent.getSize().get(i);
      varLow = offset + low * elementWidth;
      varHigh = offset + (high + 1) * elementWidth - 1;
    }
  }

  public Var getParentVar() { return parentVar; }
  public int getHigh() { return high; }
  public int getLow() { return low; }
  public int getVarHigh() { return varHigh; }
  public int getVarLow() { return varLow; }
  public boolean isSlicedByVar() { return false; }

  void setParentVar(Var parent) { this.parentVar = parent; }

  /** The outermost ancestor that is not a slice. */
  public Var getRootParent() {
    Var root = parentVar;
    while (root instanceof VarSlice)
      root = ((VarSlice)root).parentVar;
    return root;
  }

  /** The same slice taken from {@code newParent}. */
  public VarSlice sliceVar(Var newParent) { return newParent.slice(high, low); }

  @Override
  public IRNode parent() {
    return parentVar;
  }

  @Override
  public void checkSinkKind(Var source) {
    parentVar.checkSinkKind(source);
  }

  @Override
  public void addSink(AssignStmt stmt) {
    getRootParent().addSink(stmt);
  }

  @Override
  public void addSource(AssignStmt stmt) {
    getRootParent().addSource(stmt);
  }

  protected String parentString() { return parentVar instanceof Expr ? "(" + parentVar + ")" : parentVar.toString(); }

  @Override
  public String toString() {
    if (high == low)
      return String.format("%s[%d]", parentString(), high);
    return String.format("%s[%d:%d]", parentString(), high, low);
  }
}
