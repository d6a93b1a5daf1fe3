package hdlir.stmt;

import hdlir.except.VarException;
import hdlir.expr.Var;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Block triggered by clock or reset edges. */
public class SequentialStmtBlock extends StmtBlock {
  public enum BlockEdgeType { Posedge, Negedge }

  public record EdgeCondition(BlockEdgeType edge, Var signal) {}

  private final List<EdgeCondition> conditions = new ArrayList<>();

  public SequentialStmtBlock() { super(StatementBlockType.Sequential); }

  public List<EdgeCondition> getConditions() { return Collections.unmodifiableList(conditions); }

  /** @throws VarException if {@code signal} is not 1 bit wide */
  public void addCondition(BlockEdgeType edge, Var signal) {
    if (signal.getWidth() != 1)
      throw new VarException(String.format("Sequential block condition %s has to be 1 bit, got width %d", signal, signal.getWidth()), signal,
                             this);
    EdgeCondition condition = new EdgeCondition(edge, signal);
    if (!conditions.contains(condition))
      conditions.add(condition);
  }
}
