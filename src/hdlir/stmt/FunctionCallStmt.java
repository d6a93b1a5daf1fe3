package hdlir.stmt;

import hdlir.expr.FunctionCallVar;
import hdlir.expr.Var;
import hdlir.ir.IRNode;
import hdlir.ir.IRVisitor;
import java.util.Map;

/** Function call whose result, if any, is discarded. */
public class FunctionCallStmt extends Stmt {
  private final FunctionCallVar var;

  public FunctionCallStmt(FunctionStmtBlock funcDef, Map<String, Var> args) {
    super(StatementType.FunctionalCall);
    this.var = new FunctionCallVar(funcDef.getGenerator(), funcDef, args, false);
  }

  public FunctionCallVar getVar() { return var; }

  @Override
  public int childCount() {
    return 1;
  }

  @Override
  public IRNode getChild(int index) {
    if (index != 0)
      throw new IndexOutOfBoundsException(index);
    return var;
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }
}
