package hdlir.stmt;

import hdlir.except.StmtException;
import hdlir.expr.Var;
import hdlir.ir.IRNode;
import hdlir.ir.IRVisitor;

public class ReturnStmt extends Stmt {
  private final FunctionStmtBlock funcDef;
  private final Var value;

  public ReturnStmt(FunctionStmtBlock funcDef, Var value) {
    super(StatementType.Return);
    this.funcDef = funcDef;
    this.value = value;
  }

  public FunctionStmtBlock getFunction() { return funcDef; }
  public Var getValue() { return value; }

  @Override
  protected void validateParent(IRNode newParent) {
    for (IRNode node = newParent; node != null; node = node.parent()) {
      if (node == funcDef)
        return;
    }
    throw new StmtException(String.format("Return statement for %s must be inside the function body", funcDef.getFunctionName()), this);
  }

  @Override
  public int childCount() {
    return 1;
  }

  @Override
  public IRNode getChild(int index) {
    if (index != 0)
      throw new IndexOutOfBoundsException(index);
    return value;
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }
}
