package hdlir.stmt;

import hdlir.IRContext;
import hdlir.except.StmtException;
import hdlir.generator.Generator;
import hdlir.ir.IRNode;
import hdlir.ir.IRNodeKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/** Base of the statement family. The parent is the enclosing block or statement, or a generator for top-level statements. */
public abstract class Stmt extends IRNode {
  private final StatementType type;
  protected IRNode parent = null;

  protected Stmt(StatementType type) {
    super(IRNodeKind.StmtKind);
    this.type = type;
  }

  public StatementType getStatementType() { return type; }

  @Override
  public IRNode parent() {
    return parent;
  }

  public void setParent(IRNode parent) { this.parent = parent; }

  /** Hook for statements restricted to certain parents; called before the statement is added to a block. */
  protected void validateParent(IRNode newParent) {}

  /** The nearest enclosing generator, if the statement is attached to one. */
  public Optional<Generator> findGeneratorParent() {
    IRNode node = parent;
    while (node != null && node.getIRNodeKind() != IRNodeKind.GeneratorKind)
      node = node.parent();
    return Optional.ofNullable((Generator)node);
  }

  /** @throws StmtException if the statement is not attached to a generator */
  public Generator getGeneratorParent() {
    return findGeneratorParent().orElseThrow(() -> new StmtException("Unable to find the generator parent of a statement", this));
  }

  @Override
  public Optional<IRContext> context() {
    return findGeneratorParent().map(Generator::getContext);
  }

  /** Detaches this statement from its parent and unregisters all assignments in it from their signals. */
  public void remove() {
    if (parent instanceof StmtBlock)
      ((StmtBlock)parent).removeStmt(this);
    else if (parent instanceof IfStmt)
      ((IfStmt)parent).removeStmt(this);
    else if (parent instanceof Generator)
      ((Generator)parent).removeStmt(this);
    else
      unlinkAll();
  }

  /** Unregisters every assignment nested in this statement, this one included. */
  public void unlinkAll() {
    for (AssignStmt stmt : collectAssignments(this))
      stmt.unlink();
  }

  /** Every assignment nested in {@code root}, {@code root} included, in pre-order. */
  static List<AssignStmt> collectAssignments(Stmt root) {
    List<AssignStmt> result = new ArrayList<>();
    Deque<Stmt> pending = new ArrayDeque<>();
    pending.push(root);
    while (!pending.isEmpty()) {
      Stmt stmt = pending.pop();
      if (stmt instanceof AssignStmt)
        result.add((AssignStmt)stmt);
      for (int i = stmt.childCount() - 1; i >= 0; --i) {
        IRNode child = stmt.getChild(i);
        if (child instanceof Stmt)
          pending.push((Stmt)child);
      }
    }
    return result;
  }
}
