package hdlir.stmt;

import hdlir.IRContext;
import hdlir.except.InternalException;
import hdlir.except.VarException;
import hdlir.expr.Var;
import hdlir.ir.IRNode;
import hdlir.ir.IRVisitor;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * {@code left = right}. Creating it links it into the sink set of every signal it writes and the source set of every signal it reads;
 * {@link #unlink()} undoes exactly those registrations.
 */
public class AssignStmt extends Stmt {
  private Var left;
  private Var right;
  private AssignmentType assignType;

  private final Set<Var> linkedSinks = new LinkedHashSet<>();
  private final Set<Var> linkedSources = new LinkedHashSet<>();

  /**
   * @throws VarException if {@code left} cannot be written, or the width or sign of the two sides differ
   */
  public AssignStmt(Var left, Var right, AssignmentType assignType) {
    super(StatementType.Assign);
    if (left == null || right == null)
      throw new InternalException("Assignment operands cannot be null");
    left.checkAssignable(right);
    if (left.getWidth() != right.getWidth())
      throw new VarException(String.format("assignment width doesn't match: %s (%d) <- %s (%d)", left.handleName(), left.getWidth(),
                                           right.handleName(), right.getWidth()),
                             left, right);
    if (left.isSigned() != right.isSigned())
      throw new VarException(String.format("assignment sign doesn't match: %s (%s) <- %s (%s)", left.handleName(), signName(left),
                                           right.handleName(), signName(right)),
                             left, right);
    this.left = left;
    this.right = right;
    this.assignType = assignType;
    try {
      left.addSink(this);
      right.addSource(this);
    } catch (RuntimeException e) {
      unlink();
      throw e;
    }
  }

  public AssignStmt(Var left, Var right) { this(left, right, AssignmentType.Undefined); }

  private static String signName(Var var) { return var.isSigned() ? "signed" : "unsigned"; }

  public Var getLeft() { return left; }
  public Var getRight() { return right; }
  public AssignmentType getAssignType() { return assignType; }
  public void setAssignType(AssignmentType assignType) { this.assignType = assignType; }

  /** Replaces the sink operand; link sets are maintained by the caller. */
  public void setLeft(Var left) { this.left = left; }
  /** Replaces the source operand; link sets are maintained by the caller. */
  public void setRight(Var right) { this.right = right; }

  /** Called by {@link Var#addSink} for every signal this statement is registered as writing. */
  public void recordSinkLink(Var var) { linkedSinks.add(var); }
  /** Called by {@link Var#addSource} for every signal this statement is registered as reading. */
  public void recordSourceLink(Var var) { linkedSources.add(var); }

  public Set<Var> getLinkedSinks() { return Collections.unmodifiableSet(linkedSinks); }
  public Set<Var> getLinkedSources() { return Collections.unmodifiableSet(linkedSources); }

  /** Removes this statement from every sink and source set it was registered in. */
  public void unlink() {
    for (Var var : linkedSinks)
      var.removeSink(this);
    for (Var var : linkedSources)
      var.removeSource(this);
    linkedSinks.clear();
    linkedSources.clear();
  }

  @Override
  public Optional<IRContext> context() {
    Optional<IRContext> fromParent = super.context();
    return fromParent.isPresent() ? fromParent : left.context();
  }

  @Override
  public int childCount() {
    return 2;
  }

  @Override
  public IRNode getChild(int index) {
    switch (index) {
    case 0:
      return left;
    case 1:
      return right;
    default:
      throw new IndexOutOfBoundsException(index);
    }
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return left + (assignType == AssignmentType.NonBlocking ? " <= " : " = ") + right;
  }
}
