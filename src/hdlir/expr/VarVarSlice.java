package hdlir.expr;

import hdlir.except.VarException;
import hdlir.stmt.AssignStmt;
import hdlir.util.Log2;
import java.util.ArrayList;
import java.util.List;

/**
 * Slice selected by another signal: a single bit of a scalar, or one outer element of an array.
 * The index signal is read whenever the slice is read or written.
 */
public class VarVarSlice extends VarSlice {
  private final Var slicedVar;

  public VarVarSlice(Var parent, Var slicedVar) {
    super(parent, 0, 0);
    this.slicedVar = slicedVar;
    int required;
    if (parent.isScalar() && !parent.isExplicitArray()) {
      required = Log2.indexWidth(parent.getVarWidth());
      varWidth = 1;
      size = new ArrayList<>(List.of(1));
      varHigh = 0;
      varLow = 0;
    } else {
      required = Log2.indexWidth(parent.getSize().get(0));
      varWidth = parent.getVarWidth();
      List<Integer> parentSize = parent.getSize();
      size = parentSize.size() > 1 ? new ArrayList<>(parentSize.subList(1, parentSize.size())) : new ArrayList<>(List.of(1));
      varHigh = getWidth() - 1;
      varLow = 0;
    }
    if (slicedVar.getWidth() != required)
      throw new VarException(String.format("Indexing %s requires a %d bit index, %s is %d bits", parent.handleName(), required,
                                           slicedVar.handleName(), slicedVar.getWidth()),
                             parent, slicedVar);
  }

  /** The index signal. */
  public Var getSlicedVar() { return slicedVar; }

  @Override
  public boolean isSlicedByVar() {
    return true;
  }

  @Override
  public VarSlice sliceVar(Var newParent) {
    return newParent.index(slicedVar);
  }

  @Override
  public void addSink(AssignStmt stmt) {
    super.addSink(stmt);
    slicedVar.addSource(stmt);
  }

  @Override
  public void addSource(AssignStmt stmt) {
    super.addSource(stmt);
    slicedVar.addSource(stmt);
  }

  @Override
  public String toString() {
    return String.format("%s[%s]", parentString(), slicedVar);
  }
}
