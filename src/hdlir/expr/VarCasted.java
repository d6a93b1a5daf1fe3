package hdlir.expr;

import hdlir.except.VarException;
import hdlir.generator.Generator;
import hdlir.ir.IRNode;
import hdlir.stmt.AssignStmt;
import java.util.List;

/** Sign or role reinterpretation of a signal. Has no storage of its own. */
public class VarCasted extends Var {
  protected Var parentVar;
  private final VarCastType castType;

  VarCasted(Var parent, VarCastType castType) {
    super(parent.getGenerator(), "", parent.getWidth(), List.of(1), parent.isSigned(), VarType.BaseCasted);
    this.parentVar = parent;
    this.castType = castType;
    switch (castType) {
    case Signed:
      isSigned = true;
      break;
    case Unsigned:
      isSigned = false;
      break;
    default:
      if (parent.getWidth() != 1)
        throw new VarException(String.format("Can only cast bit width 1 to %s. %s is %d", castType, parent.handleName(), parent.getWidth()),
                               parent);
      break;
    }
  }

  public Var getParentVar() { return parentVar; }
  public VarCastType getCastType() { return castType; }

  void setParentVar(Var parent) { this.parentVar = parent; }

  @Override
  public IRNode parent() {
    return parentVar;
  }

  @Override
  public void checkSinkKind(Var source) {
    throw new VarException(String.format("%s is not allowed to be a sink", this), this, source);
  }

  @Override
  public void addSink(AssignStmt stmt) {
    parentVar.addSink(stmt);
  }

  @Override
  public void addSource(AssignStmt stmt) {
    parentVar.addSource(stmt);
  }

  @Override
  public String handleName(boolean ignoreTop) {
    return wrap(parentVar.handleName(ignoreTop));
  }

  @Override
  public String handleName(Generator scope) {
    return wrap(parentVar.handleName(scope));
  }

  private String wrap(String parentName) {
    switch (castType) {
    case Signed:
      return "signed'(" + parentName + ")";
    case Unsigned:
      return "unsigned'(" + parentName + ")";
    default:
      return parentName;
    }
  }

  @Override
  public String toString() {
    return wrap(parentVar.toString());
  }
}
