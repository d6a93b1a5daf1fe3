package hdlir.expr;

import hdlir.except.InternalException;
import hdlir.except.VarException;
import hdlir.generator.Generator;
import hdlir.ir.IRVisitor;
import hdlir.stmt.AssignStmt;
import java.util.List;

/**
 * Operator applied to one or two operands.
 * The owning generator is chosen from the operands' generators when the expression is built.
 */
public class Expr extends Var {
  protected ExprOp op;
  protected Var left;
  protected Var right;

  public Expr(ExprOp op, Var left, Var right) {
    super(resolveScope(requireOperand(op, left), right), "", left.getWidth(), List.of(1), right == null ? left.isSigned() : left.isSigned() && right.isSigned(),
          VarType.Expression);
    if (op.isUnary() && right != null)
      throw new InternalException(String.format("%s takes a single operand", op));
    if (!op.isUnary() && right == null)
      throw new InternalException(String.format("%s requires two operands", op));
    if (right != null && op != ExprOp.Concat && left.getWidth() != right.getWidth())
      throw new VarException(String.format("left (%s) width (%d) doesn't match with right (%s) width (%d)", left.handleName(), left.getWidth(),
                                           right.handleName(), right.getWidth()),
                             left, right);
    this.op = op;
    this.left = left;
    this.right = right;
    if (op.isRelational() || op.isReduction())
      varWidth = 1;
  }

  private static Var requireOperand(ExprOp op, Var left) {
    if (left == null)
      throw new InternalException(String.format("left operand of %s cannot be null", op));
    return left;
  }

  /**
   * Picks the generator an expression over {@code left} and {@code right} lives in.
   * Constants never decide the scope. Mixing a child generator's port with a signal of its parent lands in the parent,
   * ports of two sibling generators land in their common parent, anything else in the right operand's generator.
   */
  static Generator resolveScope(Var left, Var right) {
    if (right == null)
      return left.getGenerator();
    Generator leftGen = left.getGenerator();
    Generator rightGen = right.getGenerator();
    if (isConstScope(leftGen))
      return rightGen;
    if (isConstScope(rightGen))
      return leftGen;
    if (leftGen == rightGen)
      return leftGen;
    if (rightGen.getParentGenerator() == leftGen && right.getType() == VarType.PortIO)
      return leftGen;
    if (leftGen.getParentGenerator() == rightGen && left.getType() == VarType.PortIO)
      return rightGen;
    Generator leftParent = leftGen.getParentGenerator();
    if (leftParent != null && leftParent == rightGen.getParentGenerator() && left.getType() == VarType.PortIO &&
        right.getType() == VarType.PortIO)
      return leftParent;
    return rightGen;
  }

  private static boolean isConstScope(Generator generator) { return generator == null || generator.isConstScope(); }

  public ExprOp getOp() { return op; }
  public Var getLeft() { return left; }
  public Var getRight() { return right; }

  @Override
  public void addSink(AssignStmt stmt) {
    throw new VarException(String.format("%s is an expression and cannot be a sink", this), this);
  }

  @Override
  public void addSource(AssignStmt stmt) {
    for (Var operand : operands())
      operand.addSource(stmt);
  }

  @Override
  public List<Var> operands() {
    return right == null ? List.of(left) : List.of(left, right);
  }

  @Override
  public void replaceOperand(int index, Var operand) {
    switch (index) {
    case 0:
      left = operand;
      break;
    case 1:
      if (right == null)
        throw new InternalException(String.format("%s has no right operand", this));
      right = operand;
      break;
    default:
      throw new InternalException(String.format("%s has no operand %d", this, index));
    }
  }

  @Override
  public String handleName(boolean ignoreTop) {
    return ExprRenderer.render(this, var -> var.handleName(ignoreTop));
  }

  @Override
  public String handleName(Generator scope) {
    return ExprRenderer.render(this, var -> var.handleName(scope));
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return ExprRenderer.render(this, Var::toString);
  }
}
