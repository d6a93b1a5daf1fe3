package hdlir.stmt;

public class CombinationalStmtBlock extends StmtBlock {
  public CombinationalStmtBlock() { super(StatementBlockType.Combinational); }
}
