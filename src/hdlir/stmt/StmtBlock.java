package hdlir.stmt;

import hdlir.except.StmtException;
import hdlir.ir.IRNode;
import hdlir.ir.IRVisitor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered list of statements. Combinational and function blocks make the assignments added to them blocking,
 * sequential blocks make them non-blocking; nested scoped blocks follow the enclosing block.
 */
public abstract class StmtBlock extends Stmt {
  public enum StatementBlockType { Combinational, Sequential, Scope, Function }

  private final StatementBlockType blockType;
  protected final List<Stmt> stmts = new ArrayList<>();

  protected StmtBlock(StatementBlockType blockType) {
    super(StatementType.Block);
    this.blockType = blockType;
  }

  public StatementBlockType getBlockType() { return blockType; }
  public List<Stmt> getStmts() { return Collections.unmodifiableList(stmts); }
  public int size() { return stmts.size(); }
  public boolean isEmpty() { return stmts.isEmpty(); }
  public Stmt get(int index) { return stmts.get(index); }

  /**
   * Appends {@code stmt}.
   * @throws StmtException if an assignment in {@code stmt} has an assignment type this block does not allow
   */
  public void addStmt(Stmt stmt) {
    stmt.validateParent(this);
    enforceAssignmentType(stmt);
    stmt.setParent(this);
    stmts.add(stmt);
  }

  /** Removes {@code stmt} and unregisters the assignments in it. */
  public void removeStmt(Stmt stmt) {
    if (!stmts.remove(stmt))
      return;
    stmt.unlinkAll();
    stmt.setParent(null);
  }

  /** Replaces the statement at {@code index}; the replaced statement is unregistered. */
  public void setChild(int index, Stmt stmt) {
    stmt.validateParent(this);
    enforceAssignmentType(stmt);
    Stmt previous = stmts.set(index, stmt);
    stmt.setParent(this);
    previous.unlinkAll();
    previous.setParent(null);
  }

  public void clear() {
    for (Stmt stmt : stmts) {
      stmt.unlinkAll();
      stmt.setParent(null);
    }
    stmts.clear();
  }

  private void enforceAssignmentType(Stmt stmt) {
    StatementBlockType enclosing = enclosingBlockType();
    if (enclosing == StatementBlockType.Scope)
      return;
    List<AssignStmt> assignments = collectAssignments(stmt);
    AssignmentType forced = enclosing == StatementBlockType.Sequential ? AssignmentType.NonBlocking : AssignmentType.Blocking;
    AssignmentType rejected = enclosing == StatementBlockType.Sequential ? AssignmentType.Blocking : AssignmentType.NonBlocking;
    for (AssignStmt assign : assignments) {
      if (assign.getAssignType() == rejected)
        throw new StmtException(String.format("Cannot add %s assignment %s to a %s block", rejected, assign, enclosing), assign, this);
    }
    for (AssignStmt assign : assignments)
      assign.setAssignType(forced);
  }

  /** Type of the nearest enclosing non-scope block, {@code Scope} if there is none. */
  private StatementBlockType enclosingBlockType() {
    IRNode node = this;
    while (node instanceof Stmt) {
      if (node instanceof StmtBlock && ((StmtBlock)node).blockType != StatementBlockType.Scope)
        return ((StmtBlock)node).blockType;
      node = node.parent();
    }
    return StatementBlockType.Scope;
  }

  @Override
  public int childCount() {
    return stmts.size();
  }

  @Override
  public IRNode getChild(int index) {
    return stmts.get(index);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }
}
