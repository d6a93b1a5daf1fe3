package hdlir.rewrite;

import hdlir.except.InternalException;
import hdlir.except.VarException;
import hdlir.expr.Expr;
import hdlir.expr.FunctionCallVar;
import hdlir.expr.Var;
import hdlir.expr.VarCasted;
import hdlir.expr.VarExtend;
import hdlir.expr.VarSlice;
import hdlir.expr.VarVarSlice;
import hdlir.generator.Generator;
import hdlir.stmt.AssignStmt;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Moves the writing (sink) or reading (source) side of existing assignments from one signal to another.
 * <p>
 * Within an operand the signal is found directly, at the root of a chain of views (slices, casts, extensions), or anywhere inside an
 * expression tree or function call. Views are rebuilt on the new signal through its memoized factories, innermost first, so they keep
 * their identity guarantees. Expression nodes are updated in place, top-down. All affected statements are checked before any is
 * changed.
 */
public class VarRelocator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * Makes {@code newVar} the sink of every assignment in {@code scope} that writes {@code var}.
   * @param keepConnection add {@code var = newVar} to {@code scope} afterwards
   * @throws VarException if the signals are not plain or port signals, or differ in shape
   * @throws InternalException if {@code var} cannot be located in one of the assignments
   */
  public static void moveSinkTo(Var var, Var newVar, Generator scope, boolean keepConnection) {
    checkRelocatable(var, newVar, scope);
    List<AssignStmt> stmts = stmtsInScope(var.getSinks(), scope);
    for (AssignStmt stmt : stmts) {
      if (new Pass(var, newVar, false).run(stmt.getLeft(), true, false) == 0)
        throw new InternalException(String.format("%s not found in the sink of %s", var.handleName(), stmt));
    }
    for (AssignStmt stmt : stmts) {
      Pass pass = new Pass(var, newVar, true);
      stmt.setLeft(pass.relocate(stmt.getLeft(), true, false));
      var.removeSink(stmt);
      newVar.addSink(stmt);
      scope.captureDebug(stmt);
      if (stmt.getRight().isParametrized() && !newVar.isParametrized())
        newVar.setWidthParam(stmt.getRight().getParam());
    }
    logger.debug("Moved {} sink assignment(s) of {} to {} in {}", stmts.size(), var.handleName(), newVar.handleName(), scope.handleName());
    if (keepConnection) {
      AssignStmt stmt = var.assign(newVar);
      scope.captureDebug(stmt);
      scope.addStmt(stmt);
    }
  }

  /**
   * Makes every assignment in {@code scope} that reads {@code var} read {@code newVar} instead, including uses as a slice index.
   * @param keepConnection add {@code newVar = var} to {@code scope} afterwards
   * @throws VarException if the signals are not plain or port signals, or differ in shape
   * @throws InternalException if {@code var} cannot be located in one of the assignments
   */
  public static void moveSourceTo(Var var, Var newVar, Generator scope, boolean keepConnection) {
    checkRelocatable(var, newVar, scope);
    List<AssignStmt> stmts = stmtsInScope(var.getSources(), scope);
    for (AssignStmt stmt : stmts) {
      Pass pass = new Pass(var, newVar, false);
      if (pass.run(stmt.getRight(), true, true) + pass.run(stmt.getLeft(), false, true) == 0)
        throw new InternalException(String.format("%s not found in the source of %s", var.handleName(), stmt));
    }
    for (AssignStmt stmt : stmts) {
      Pass pass = new Pass(var, newVar, true);
      stmt.setRight(pass.relocate(stmt.getRight(), true, true));
      stmt.setLeft(pass.relocate(stmt.getLeft(), false, true));
      var.removeSource(stmt);
      newVar.addSource(stmt);
      scope.captureDebug(stmt);
      if (stmt.getLeft().isParametrized() && !newVar.isParametrized())
        newVar.setWidthParam(stmt.getLeft().getParam());
    }
    logger.debug("Moved {} source assignment(s) of {} to {} in {}", stmts.size(), var.handleName(), newVar.handleName(), scope.handleName());
    if (keepConnection) {
      AssignStmt stmt = newVar.assign(var);
      scope.captureDebug(stmt);
      scope.addStmt(stmt);
    }
  }

  /**
   * Moves the slices, concatenations, extensions and casts derived from {@code var} onto {@code newVar}.
   * @throws VarException if the signals differ in shape
   */
  public static void mergeIdentity(Var var, Var newVar) { var.moveLinkedTo(newVar); }

  private static void checkRelocatable(Var var, Var newVar, Generator scope) {
    if (var == null || newVar == null || scope == null)
      throw new InternalException("Relocation arguments cannot be null");
    if (var == newVar)
      throw new InternalException(String.format("Cannot relocate %s onto itself", var.handleName()));
    for (Var signal : List.of(var, newVar)) {
      switch (signal.getType()) {
      case Base:
      case PortIO:
        break;
      default:
        throw new VarException("Only base or port variables are allowed.", signal);
      }
    }
    var.checkSameShape(newVar);
  }

  private static List<AssignStmt> stmtsInScope(Set<AssignStmt> stmts, Generator scope) {
    List<AssignStmt> result = new ArrayList<>();
    for (AssignStmt stmt : stmts) {
      if (stmt.findGeneratorParent().orElse(null) == scope)
        result.add(stmt);
    }
    return result;
  }

  private static boolean isView(Var var) { return var instanceof VarSlice || var instanceof VarCasted || var instanceof VarExtend; }

  private static Var viewParent(Var var) {
    if (var instanceof VarSlice)
      return ((VarSlice)var).getParentVar();
    if (var instanceof VarCasted)
      return ((VarCasted)var).getParentVar();
    return ((VarExtend)var).getParentVar();
  }

  private static boolean isContainer(Var var) { return (var instanceof Expr && !(var instanceof VarExtend)) || var instanceof FunctionCallVar; }

  /** Rebuilds {@code view} on top of {@code parent}, using {@code index} for slices selected by a signal. */
  private static Var rewrap(Var view, Var parent, Var index) {
    if (view instanceof VarVarSlice)
      return parent.index(index);
    if (view instanceof VarSlice)
      return ((VarSlice)view).sliceVar(parent);
    if (view instanceof VarCasted)
      return parent.cast(((VarCasted)view).getCastType());
    return parent.extend(((VarExtend)view).getWidth());
  }

  /**
   * One relocation over one operand tree. Without {@code apply}, only counts the occurrences that would be replaced.
   * {@code replaceBase} replaces the signal where it is the value itself, {@code replaceIndex} where it selects a slice.
   */
  private static final class Pass {
    private record Pending(Var node, boolean replaceBase, boolean replaceIndex) {}

    private final Var target;
    private final Var newVar;
    private final boolean apply;
    private final Deque<Pending> pending = new ArrayDeque<>();
    private final Set<Var> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    private int matches = 0;

    Pass(Var target, Var newVar, boolean apply) {
      this.target = target;
      this.newVar = newVar;
      this.apply = apply;
    }

    int run(Var operand, boolean replaceBase, boolean replaceIndex) {
      int before = matches;
      relocate(operand, replaceBase, replaceIndex);
      return matches - before;
    }

    Var relocate(Var operand, boolean replaceBase, boolean replaceIndex) {
      Var replacement = relocateView(operand, replaceBase, replaceIndex);
      while (!pending.isEmpty()) {
        Pending next = pending.pop();
        if (!seen.add(next.node()))
          continue;
        List<Var> operands = next.node().operands();
        for (int i = 0; i < operands.size(); ++i) {
          Var current = operands.get(i);
          Var relocated = relocateView(current, next.replaceBase(), next.replaceIndex());
          if (relocated != current)
            next.node().replaceOperand(i, relocated);
        }
      }
      return replacement;
    }

    private Var relocateView(Var operand, boolean replaceBase, boolean replaceIndex) {
      List<Var> views = new ArrayList<>();
      Var base = operand;
      while (isView(base)) {
        views.add(base);
        base = viewParent(base);
      }
      Var current = base;
      boolean changed = false;
      if (replaceBase && base == target) {
        ++matches;
        current = newVar;
        changed = true;
      } else if (isContainer(base)) {
        pending.push(new Pending(base, replaceBase, replaceIndex));
      }
      // innermost view first
      for (int i = views.size() - 1; i >= 0; --i) {
        Var view = views.get(i);
        Var index = view instanceof VarVarSlice ? ((VarVarSlice)view).getSlicedVar() : null;
        Var newIndex = index;
        if (index != null && replaceIndex)
          newIndex = relocateView(index, true, true);
        if (apply && (changed || newIndex != index)) {
          changed = true;
          current = rewrap(view, current, newIndex);
        } else {
          current = view;
        }
      }
      return apply ? current : operand;
    }
  }
}
