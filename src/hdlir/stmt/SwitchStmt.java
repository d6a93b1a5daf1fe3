package hdlir.stmt;

import hdlir.except.VarException;
import hdlir.expr.Const;
import hdlir.expr.Var;
import hdlir.ir.IRNode;
import hdlir.ir.IRVisitor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Case statement over a target signal. The default case is keyed by {@code null}. */
public class SwitchStmt extends Stmt {
  private final Var target;
  private final Map<Const, ScopedStmtBlock> body = new LinkedHashMap<>();

  public SwitchStmt(Var target) {
    super(StatementType.Switch);
    this.target = target;
  }

  public Var getTarget() { return target; }
  public Map<Const, ScopedStmtBlock> getBody() { return Collections.unmodifiableMap(body); }

  public Optional<ScopedStmtBlock> getDefaultCase() { return Optional.ofNullable(body.get(null)); }

  /**
   * Adds {@code stmt} to the case for {@code caseValue}, creating the case on first use.
   * Cases are matched by constant value.
   * @throws VarException if the case constant is wider than the target
   */
  public ScopedStmtBlock addSwitchCase(Const caseValue, Stmt stmt) {
    ScopedStmtBlock block = caseBlock(caseValue);
    block.addStmt(stmt);
    return block;
  }

  public ScopedStmtBlock addSwitchCase(Const caseValue, List<Stmt> stmts) {
    ScopedStmtBlock block = caseBlock(caseValue);
    stmts.forEach(block::addStmt);
    return block;
  }

  private ScopedStmtBlock caseBlock(Const caseValue) {
    if (caseValue != null && caseValue.getWidth() > target.getWidth())
      throw new VarException(String.format("Switch case %s (%d bits) is wider than %s (%d bits)", caseValue, caseValue.getWidth(), target,
                                           target.getWidth()),
                             caseValue, target);
    Const key = findCase(caseValue).orElse(caseValue);
    return body.computeIfAbsent(key, k -> {
      ScopedStmtBlock block = new ScopedStmtBlock();
      block.setParent(this);
      return block;
    });
  }

  private Optional<Const> findCase(Const caseValue) {
    if (caseValue == null)
      return Optional.empty();
    return body.keySet().stream().filter(key -> key != null && key.getValue() == caseValue.getValue()).findFirst();
  }

  public void removeSwitchCase(Const caseValue) {
    Const key = findCase(caseValue).orElse(caseValue);
    ScopedStmtBlock block = body.remove(key);
    if (block != null) {
      block.clear();
      block.setParent(null);
    }
  }

  public void removeSwitchCase(Const caseValue, Stmt stmt) {
    ScopedStmtBlock block = body.get(findCase(caseValue).orElse(caseValue));
    if (block != null)
      block.removeStmt(stmt);
  }

  /** Removes {@code stmt} from every case holding it. */
  public void removeStmt(Stmt stmt) {
    for (ScopedStmtBlock block : body.values())
      block.removeStmt(stmt);
  }

  @Override
  public int childCount() {
    return 1 + body.size();
  }

  @Override
  public IRNode getChild(int index) {
    if (index == 0)
      return target;
    return new ArrayList<>(body.values()).get(index - 1);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }
}
