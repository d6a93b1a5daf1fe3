package hdlir.rewrite;

import hdlir.IRContext;
import hdlir.except.InternalException;
import hdlir.except.VarException;
import hdlir.expr.Expr;
import hdlir.expr.FunctionCallVar;
import hdlir.expr.Param;
import hdlir.expr.Port;
import hdlir.expr.Port.PortDirection;
import hdlir.expr.Var;
import hdlir.expr.VarCastType;
import hdlir.expr.VarCasted;
import hdlir.expr.VarConcat;
import hdlir.expr.VarSlice;
import hdlir.generator.Generator;
import hdlir.stmt.AssignStmt;
import hdlir.stmt.FunctionStmtBlock;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

class VarRelocatorTest {
  IRContext context;
  Generator top;
  Var a;
  Var b;
  Var c;
  Var newA;

  @BeforeEach
  void setUp() {
    context = new IRContext();
    top = context.generator("top");
    a = top.var("a", 8);
    b = top.var("b", 8);
    c = top.var("c", 8);
    newA = top.var("a_new", 8);
  }

  private AssignStmt add(AssignStmt stmt) {
    top.addStmt(stmt);
    return stmt;
  }

  @Test
  void testMoveSink() {
    AssignStmt stmt = add(a.assign(b));
    VarRelocator.moveSinkTo(a, newA, top, false);
    Assertions.assertSame(newA, stmt.getLeft());
    Assertions.assertTrue(a.getSinks().isEmpty());
    Assertions.assertTrue(newA.getSinks().contains(stmt));
    Assertions.assertEquals("a_new = b", stmt.toString());
  }

  @Test
  void testMoveSliceSink() {
    Var nibble = top.var("nibble", 4);
    Var pair = top.var("pair", 2);
    AssignStmt sliceStmt = add(a.slice(3, 0).assign(nibble));
    AssignStmt nestedStmt = add(a.slice(7, 4).slice(3, 2).assign(pair));
    VarRelocator.moveSinkTo(a, newA, top, false);
    Assertions.assertSame(newA.slice(3, 0), sliceStmt.getLeft());
    VarSlice nested = (VarSlice)nestedStmt.getLeft();
    Assertions.assertSame(newA.slice(7, 4).slice(3, 2), nested);
    Assertions.assertEquals(6, nested.getVarLow());
    Assertions.assertSame(newA, nested.getRootParent());
    Assertions.assertEquals(2, newA.getSinks().size());
  }

  @Test
  void testMoveSourceInExpression() {
    AssignStmt stmt = add(b.assign(a.add(c).sub(a)));
    VarRelocator.moveSourceTo(a, newA, top, false);
    Assertions.assertEquals("b = (a_new + c) - a_new", stmt.toString());
    Assertions.assertTrue(a.getSources().isEmpty());
    Assertions.assertTrue(newA.getSources().contains(stmt));
    Assertions.assertTrue(c.getSources().contains(stmt));
    Expr root = (Expr)stmt.getRight();
    Assertions.assertSame(newA, root.operands().get(1));
  }

  @Test
  void testMoveCastedSource() {
    Var signed = top.var("s", 8, 1, true);
    AssignStmt stmt = add(signed.assign(a.cast(VarCastType.Signed)));
    VarRelocator.moveSourceTo(a, newA, top, false);
    Assertions.assertSame(newA.cast(VarCastType.Signed), stmt.getRight());
  }

  @Test
  void testMoveIndexSource() {
    Var i = top.var("i", 3);
    Var j = top.var("j", 3);
    Var bit = top.var("bit", 1);
    AssignStmt read = add(bit.assign(b.index(i)));
    AssignStmt write = add(b.index(i).assign(bit));
    VarRelocator.moveSourceTo(i, j, top, false);
    Assertions.assertSame(b.index(j), read.getRight());
    Assertions.assertSame(b.index(j), write.getLeft());
    Assertions.assertTrue(i.getSources().isEmpty());
    Assertions.assertEquals(2, j.getSources().size());
    Assertions.assertTrue(b.getSinks().contains(write));
  }

  @Test
  void testMoveFunctionArgument() {
    FunctionStmtBlock func = top.function("pass");
    Port x = func.input("x", 8, false);
    func.addStmt(func.returnStmt(x));
    FunctionCallVar call = top.call("pass", Map.of("x", a));
    AssignStmt stmt = add(b.assign(call));
    VarRelocator.moveSourceTo(a, newA, top, false);
    Assertions.assertSame(call, stmt.getRight());
    Assertions.assertSame(newA, call.operands().get(0));
  }

  @Test
  void testScopeFilter() {
    Generator child = context.generator("child");
    top.addChildGenerator(child);
    Port in = child.port(PortDirection.In, "in", 8);
    Var internal = child.var("internal", 8);
    AssignStmt inner = internal.assign(in);
    child.addStmt(inner);
    AssignStmt outer = add(b.assign(in));
    VarRelocator.moveSourceTo(in, a, top, false);
    Assertions.assertSame(a, outer.getRight());
    Assertions.assertSame(in, inner.getRight());
    Assertions.assertTrue(in.getSources().contains(inner));
    Assertions.assertFalse(in.getSources().contains(outer));
  }

  @Test
  void testKeepConnection() {
    add(a.assign(b));
    VarRelocator.moveSinkTo(a, newA, top, true);
    Assertions.assertEquals(2, top.stmtsCount());
    AssignStmt link = (AssignStmt)top.getStmts().get(1);
    Assertions.assertSame(a, link.getLeft());
    Assertions.assertSame(newA, link.getRight());

    Var reader = top.var("reader", 8);
    add(reader.assign(c));
    Var newC = top.var("c_new", 8);
    VarRelocator.moveSourceTo(c, newC, top, true);
    link = (AssignStmt)top.getStmts().get(3);
    Assertions.assertSame(newC, link.getLeft());
    Assertions.assertSame(c, link.getRight());
  }

  @Test
  void testWidthParamPickup() {
    Param width = top.parameter("WIDTH", 32, false);
    width.setValue(8);
    Var sized = top.var("sized", 8);
    sized.setWidthParam(width);
    add(a.assign(sized));
    VarRelocator.moveSinkTo(a, newA, top, false);
    Assertions.assertSame(width, newA.getParam());
  }

  @Test
  void testRejectedRelocations() {
    add(a.assign(b));
    Var narrow = top.var("narrow", 4);
    Var signed = top.var("s", 8, 1, true);
    Assertions.assertThrows(VarException.class, () -> VarRelocator.moveSinkTo(a, narrow, top, false));
    Assertions.assertThrows(VarException.class, () -> VarRelocator.moveSinkTo(a, signed, top, false));
    Assertions.assertThrows(VarException.class, () -> VarRelocator.moveSinkTo(a, b.add(c), top, false));
    Assertions.assertThrows(VarException.class, () -> VarRelocator.moveSourceTo(a.slice(3, 0), narrow, top, false));
    Assertions.assertThrows(InternalException.class, () -> VarRelocator.moveSinkTo(a, a, top, false));
    Assertions.assertTrue(newA.getSinks().isEmpty());
    Assertions.assertEquals(1, a.getSinks().size());
  }

  @Test
  void testMergeIdentity() {
    VarSlice slice = a.slice(3, 0);
    Var extended = a.extend(16);
    Var casted = a.cast(VarCastType.Signed);
    VarConcat concat = a.concat(b);
    VarRelocator.mergeIdentity(a, newA);
    Assertions.assertSame(slice, newA.slice(3, 0));
    Assertions.assertSame(newA, slice.getParentVar());
    Assertions.assertSame(extended, newA.extend(16));
    Assertions.assertSame(casted, newA.cast(VarCastType.Signed));
    Assertions.assertSame(newA, concat.getVars().get(0));
    Assertions.assertNotSame(slice, a.slice(3, 0));
    Assertions.assertThrows(VarException.class, () -> VarRelocator.mergeIdentity(b, top.var("narrow", 4)));
  }

  @Test
  void testRejectShapeMismatch() {
    Var nibble = top.var("nibble", 4);
    AssignStmt stmt = add(a.slice(3, 0).assign(nibble));
    Var arr = top.var("arr", 2, 4);
    Assertions.assertEquals(a.getWidth(), arr.getWidth());
    Assertions.assertThrows(VarException.class, () -> VarRelocator.moveSinkTo(a, arr, top, false));
    Assertions.assertSame(a, ((VarSlice)stmt.getLeft()).getParentVar());
    Assertions.assertTrue(arr.getSinks().isEmpty());
    Assertions.assertThrows(VarException.class, () -> VarRelocator.mergeIdentity(a, arr));
    Assertions.assertSame(a, ((VarSlice)stmt.getLeft()).getParentVar());
  }

  @Test
  void testFailedMoveLeavesNoViews() {
    Var nibble = top.var("nibble", 4);
    VarSlice low = a.slice(3, 0);
    AssignStmt kept = add(nibble.assign(low));
    AssignStmt broken = add(b.assign(a.add(c)));
    ((Expr)broken.getRight()).replaceOperand(0, top.var("d", 8));
    Assertions.assertThrows(InternalException.class, () -> VarRelocator.moveSourceTo(a, newA, top, false));
    Assertions.assertSame(low, kept.getRight());
    VarRelocator.mergeIdentity(a, newA);
    Assertions.assertSame(low, newA.slice(3, 0));
    Assertions.assertSame(newA, low.getParentVar());
  }

  @Test
  void testMergeIdentityKeepsExistingViews() {
    VarSlice keptSlice = newA.slice(3, 0);
    Var keptCast = newA.cast(VarCastType.Signed);
    VarSlice old = a.slice(3, 0);
    VarSlice nested = old.bit(0);
    Var oldCast = a.cast(VarCastType.Signed);
    Var nibble = top.var("nibble", 4);
    AssignStmt direct = add(nibble.assign(old));
    Expr sum = old.add(nibble);
    AssignStmt viaExpr = add(top.var("n2", 4).assign(sum));
    AssignStmt viaCast = add(top.var("s", 8, 1, true).assign(oldCast));
    VarRelocator.mergeIdentity(a, newA);
    Assertions.assertSame(keptSlice, newA.slice(3, 0));
    Assertions.assertSame(keptSlice, direct.getRight());
    Assertions.assertSame(sum, viaExpr.getRight());
    Assertions.assertSame(keptSlice, sum.operands().get(0));
    Assertions.assertSame(nested, keptSlice.bit(0));
    Assertions.assertSame(keptSlice, nested.getParentVar());
    Assertions.assertSame(keptCast, newA.cast(VarCastType.Signed));
    Assertions.assertSame(keptCast, viaCast.getRight());
  }

  @RepeatedTest(20)
  void testRandomExpressionSources(RepetitionInfo info) {
    Random random = new Random(info.getCurrentRepetition());
    Var d = top.var("d", 8);
    Var[] leaves = {a, c, d, a.slice(7, 0), a.cast(VarCastType.Unsigned)};
    Var expr = leaves[random.nextInt(leaves.length)];
    int depth = 1 + random.nextInt(12);
    for (int k = 0; k < depth; ++k) {
      Var leaf = leaves[random.nextInt(leaves.length)];
      switch (random.nextInt(4)) {
      case 0:
        expr = expr.add(leaf);
        break;
      case 1:
        expr = leaf.xor(expr);
        break;
      case 2:
        expr = expr.and(leaf).invert();
        break;
      default:
        expr = expr.concat(leaf).slice(11, 4);
        break;
      }
    }
    AssignStmt stmt = add(b.assign(expr));
    boolean readsA = reaches(stmt, a);
    Assertions.assertEquals(readsA, a.getSources().contains(stmt));
    VarRelocator.moveSourceTo(a, newA, top, false);
    Assertions.assertFalse(reaches(stmt, a));
    Assertions.assertEquals(readsA, reaches(stmt, newA));
    Assertions.assertEquals(readsA, newA.getSources().contains(stmt));
    Assertions.assertTrue(a.getSources().isEmpty());
  }

  private static boolean reaches(AssignStmt stmt, Var var) {
    Set<Var> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Deque<Var> pending = new ArrayDeque<>(List.of(stmt.getLeft(), stmt.getRight()));
    while (!pending.isEmpty()) {
      Var next = pending.pop();
      if (!seen.add(next))
        continue;
      if (next instanceof VarSlice || next instanceof VarCasted)
        pending.push((Var)next.parent());
      next.operands().forEach(pending::push);
    }
    return seen.contains(var);
  }
}
