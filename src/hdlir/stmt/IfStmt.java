package hdlir.stmt;

import hdlir.except.VarException;
import hdlir.expr.Var;
import hdlir.ir.IRNode;
import hdlir.ir.IRVisitor;

public class IfStmt extends Stmt {
  private final Var predicate;
  private final ScopedStmtBlock thenBody = new ScopedStmtBlock();
  private final ScopedStmtBlock elseBody = new ScopedStmtBlock();

  /** @throws VarException if the predicate is not 1 bit wide */
  public IfStmt(Var predicate) {
    super(StatementType.If);
    if (predicate.getWidth() != 1)
      throw new VarException(String.format("Predicate %s can only be 1 bit, got %d", predicate, predicate.getWidth()), predicate);
    this.predicate = predicate;
    thenBody.setParent(this);
    elseBody.setParent(this);
  }

  public Var getPredicate() { return predicate; }
  public ScopedStmtBlock getThenBody() { return thenBody; }
  public ScopedStmtBlock getElseBody() { return elseBody; }

  public IfStmt addThenStmt(Stmt stmt) {
    thenBody.addStmt(stmt);
    return this;
  }

  public IfStmt addElseStmt(Stmt stmt) {
    elseBody.addStmt(stmt);
    return this;
  }

  public void removeThenStmt(Stmt stmt) { thenBody.removeStmt(stmt); }
  public void removeElseStmt(Stmt stmt) { elseBody.removeStmt(stmt); }

  /** Removes {@code stmt} from whichever branch holds it. */
  public void removeStmt(Stmt stmt) {
    thenBody.removeStmt(stmt);
    elseBody.removeStmt(stmt);
  }

  @Override
  public int childCount() {
    return 3;
  }

  @Override
  public IRNode getChild(int index) {
    switch (index) {
    case 0:
      return predicate;
    case 1:
      return thenBody;
    case 2:
      return elseBody;
    default:
      throw new IndexOutOfBoundsException(index);
    }
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }
}
