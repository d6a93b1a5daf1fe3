package hdlir.expr;

import hdlir.except.VarException;
import hdlir.stmt.AssignStmt;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Concatenation {@code {a, b, ...}}, most significant operand first.
 * Chained concatenations remember the concatenation they extend as their base.
 */
public class VarConcat extends Expr {
  private final List<Var> vars;
  private final VarConcat base;

  VarConcat(Var first, Var second) {
    super(ExprOp.Concat, first, second);
    checkSign(first, second);
    this.vars = new ArrayList<>(List.of(first, second));
    this.base = null;
    this.varWidth = first.getWidth() + second.getWidth();
  }

  VarConcat(VarConcat base, Var next) {
    super(ExprOp.Concat, base, next);
    checkSign(base, next);
    this.vars = new ArrayList<>(base.vars);
    this.vars.add(next);
    this.base = base;
    this.varWidth = base.getWidth() + next.getWidth();
  }

  private void checkSign(Var first, Var second) {
    if (first.isSigned() == second.isSigned())
      return;
    Var signedVar = first.isSigned() ? first : second;
    Var unsignedVar = first.isSigned() ? second : first;
    throw new VarException(String.format("%s is signed but %s is not", signedVar.handleName(), unsignedVar.handleName()), first, second);
  }

  void registerMembership() {
    for (Var var : vars)
      var.concatVars.add(this);
    if (base != null)
      base.concatVars.add(this);
  }

  public List<Var> getVars() { return Collections.unmodifiableList(vars); }
  /** The concatenation this one was chained onto, or null. */
  public VarConcat getBase() { return base; }

  @Override
  public VarConcat concat(Var var) {
    for (VarConcat existing : concatVars) {
      if (existing.base == this && existing.vars.get(existing.vars.size() - 1) == var)
        return existing;
    }
    VarConcat result = new VarConcat(this, var);
    result.registerMembership();
    return result;
  }

  /** Replaces every occurrence of {@code target} with {@code item}, moving the membership along. */
  public void replaceVar(Var target, Var item) {
    for (int i = 0; i < vars.size(); ++i) {
      if (vars.get(i) == target)
        replaceOperand(i, item);
    }
  }

  @Override
  public void replaceOperand(int index, Var operand) {
    Var previous = vars.set(index, operand);
    if (base == null) {
      left = vars.get(0);
      right = vars.get(1);
    } else if (index == vars.size() - 1) {
      right = operand;
    }
    operand.concatVars.add(this);
    if (!vars.contains(previous))
      previous.concatVars.remove(this);
  }

  @Override
  public void checkSinkKind(Var source) {
    for (Var var : vars)
      var.checkSinkKind(source);
  }

  @Override
  public void addSink(AssignStmt stmt) {
    for (Var var : vars)
      var.addSink(stmt);
  }

  @Override
  public void addSource(AssignStmt stmt) {
    for (Var var : vars)
      var.addSource(stmt);
  }

  @Override
  public List<Var> operands() {
    return Collections.unmodifiableList(vars);
  }
}
