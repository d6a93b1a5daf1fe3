package hdlir.expr;

import hdlir.except.InternalException;
import hdlir.except.VarException;
import java.util.List;

/** Ternary {@code condition ? left: right}. */
public class ConditionalExpr extends Expr {
  protected Var condition;

  public ConditionalExpr(Var condition, Var left, Var right) {
    super(ExprOp.Conditional, left, right);
    if (condition == null)
      throw new InternalException("Condition of a ternary operator cannot be null");
    if (condition.getWidth() != 1)
      throw new VarException(String.format("Ternary operator's condition %s has to be a binary value, got width %d", condition,
                                           condition.getWidth()),
                             condition);
    this.condition = condition;
  }

  public Var getCondition() { return condition; }

  @Override
  public List<Var> operands() {
    return List.of(condition, left, right);
  }

  @Override
  public void replaceOperand(int index, Var operand) {
    if (index == 0)
      condition = operand;
    else
      super.replaceOperand(index - 1, operand);
  }
}
