package hdlir.stmt;

/** Body of an if branch or a switch case. */
public class ScopedStmtBlock extends StmtBlock {
  public ScopedStmtBlock() { super(StatementBlockType.Scope); }
}
