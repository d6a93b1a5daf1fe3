package hdlir.ir;

import hdlir.expr.Expr;
import hdlir.expr.Var;
import hdlir.generator.Generator;
import hdlir.stmt.AssignStmt;
import hdlir.stmt.FunctionCallStmt;
import hdlir.stmt.IfStmt;
import hdlir.stmt.ModuleInstantiationStmt;
import hdlir.stmt.ReturnStmt;
import hdlir.stmt.StmtBlock;
import hdlir.stmt.SwitchStmt;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Visitor over the IR graph. All visit methods default to no-ops; {@link #walk(IRNode)} performs a pre-order traversal.
 */
public interface IRVisitor {
  default void visit(Generator generator) {}
  default void visit(Var var) {}
  default void visit(Expr expr) { visit((Var)expr); }
  default void visit(AssignStmt stmt) {}
  default void visit(IfStmt stmt) {}
  default void visit(SwitchStmt stmt) {}
  default void visit(StmtBlock block) {}
  default void visit(ReturnStmt stmt) {}
  default void visit(FunctionCallStmt stmt) {}
  default void visit(ModuleInstantiationStmt stmt) {}

  /**
   * Visits {@code root} and every node reachable through child links, each node once, parents before children.
   * Uses an explicit stack, so arbitrarily deep expression chains are fine.
   */
  default void walk(IRNode root) {
    Deque<IRNode> pending = new ArrayDeque<>();
    Set<IRNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    pending.push(root);
    while (!pending.isEmpty()) {
      IRNode node = pending.pop();
      if (!visited.add(node))
        continue;
      node.accept(this);
      for (int i = node.childCount() - 1; i >= 0; --i) {
        IRNode child = node.getChild(i);
        if (child != null)
          pending.push(child);
      }
    }
  }
}
