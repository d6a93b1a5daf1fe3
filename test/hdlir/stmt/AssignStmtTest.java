package hdlir.stmt;

import hdlir.IRContext;
import hdlir.except.GeneratorException;
import hdlir.except.VarException;
import hdlir.expr.Const;
import hdlir.expr.Port;
import hdlir.expr.Port.PortDirection;
import hdlir.expr.Var;
import hdlir.expr.VarCastType;
import hdlir.generator.Generator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AssignStmtTest {
  IRContext context;
  Generator top;
  Var a;
  Var b;

  @BeforeEach
  void setUp() {
    context = new IRContext();
    top = context.generator("top");
    a = top.var("a", 8);
    b = top.var("b", 8);
  }

  @Test
  void testRegistration() {
    AssignStmt stmt = a.assign(b);
    Assertions.assertSame(a, stmt.getLeft());
    Assertions.assertSame(b, stmt.getRight());
    Assertions.assertEquals(AssignmentType.Undefined, stmt.getAssignType());
    Assertions.assertTrue(a.getSinks().contains(stmt));
    Assertions.assertTrue(b.getSources().contains(stmt));
    Assertions.assertTrue(a.getSources().isEmpty());
    Assertions.assertEquals("a = b", stmt.toString());
  }

  @Test
  void testIllegalSinks() {
    Const c = context.constant(1, 8, false);
    Assertions.assertThrows(VarException.class, () -> c.assign(a));
    Assertions.assertThrows(VarException.class, () -> a.add(b).assign(a));
    Assertions.assertThrows(VarException.class, () -> a.cast(VarCastType.Signed).assign(top.var("s", 8, 1, true)));
    Assertions.assertThrows(VarException.class, () -> a.extend(16).assign(top.var("w", 16)));
    Assertions.assertTrue(a.getSources().isEmpty());
    Assertions.assertTrue(b.getSources().isEmpty());
  }

  @Test
  void testMismatch() {
    Var narrow = top.var("narrow", 4);
    Var signed = top.var("signed_b", 8, 1, true);
    Assertions.assertThrows(VarException.class, () -> a.assign(narrow));
    Assertions.assertThrows(VarException.class, () -> a.assign(signed));
    Assertions.assertTrue(a.getSinks().isEmpty());
    Assertions.assertTrue(narrow.getSources().isEmpty());
    Assertions.assertTrue(signed.getSources().isEmpty());
  }

  @Test
  void testConstantSource() {
    AssignStmt stmt = a.assign(context.constant(3, 2, false));
    Assertions.assertEquals(8, stmt.getRight().getWidth());
    Assertions.assertEquals("a = 8'h3", stmt.toString());
    Assertions.assertEquals(8, a.assign(200).getRight().getWidth());
    // does not fit a signed 8 bit sink
    Var s = top.var("s", 8, 1, true);
    Assertions.assertThrows(VarException.class, () -> s.assign(context.constant(200, 9, false)));
  }

  @Test
  void testViewRegistration() {
    Var nibble = top.var("nibble", 4);
    AssignStmt sliceStmt = a.slice(3, 0).assign(nibble);
    Assertions.assertTrue(a.getSinks().contains(sliceStmt));
    Assertions.assertTrue(nibble.getSources().contains(sliceStmt));

    Var i = top.var("i", 3);
    Var bit = top.var("bit", 1);
    AssignStmt indexStmt = a.index(i).assign(bit);
    Assertions.assertTrue(a.getSinks().contains(indexStmt));
    Assertions.assertTrue(i.getSources().contains(indexStmt));
    AssignStmt readStmt = bit.assign(b.index(i));
    Assertions.assertTrue(b.getSources().contains(readStmt));
    Assertions.assertTrue(i.getSources().contains(readStmt));

    Var wide = top.var("wide", 16);
    AssignStmt concatStmt = a.concat(b).assign(wide);
    Assertions.assertTrue(a.getSinks().contains(concatStmt));
    Assertions.assertTrue(b.getSinks().contains(concatStmt));
    AssignStmt extendStmt = wide.assign(a.extend(16));
    Assertions.assertTrue(a.getSources().contains(extendStmt));
    AssignStmt castStmt = top.var("s", 8, 1, true).assign(b.cast(VarCastType.Signed));
    Assertions.assertTrue(b.getSources().contains(castStmt));
  }

  @Test
  void testUnassign() {
    Var c = top.var("c", 8);
    AssignStmt stmt = a.assign(b.add(c));
    top.addStmt(stmt);
    Assertions.assertEquals(1, top.stmtsCount());
    a.unassign(stmt);
    Assertions.assertEquals(0, top.stmtsCount());
    Assertions.assertTrue(a.getSinks().isEmpty());
    Assertions.assertTrue(b.getSources().isEmpty());
    Assertions.assertTrue(c.getSources().isEmpty());
  }

  @Test
  void testSinkReachability() {
    Generator child = context.generator("child");
    Generator stranger = context.generator("stranger");
    top.addChildGenerator(child);
    Port in = child.port(PortDirection.In, "in", 8);
    Var internal = child.var("internal", 8);
    top.addStmt(in.assign(a));
    Assertions.assertThrows(GeneratorException.class, () -> top.addStmt(internal.assign(a)));
    Assertions.assertThrows(GeneratorException.class, () -> top.addStmt(stranger.var("x", 8).assign(b)));
    Assertions.assertEquals(1, top.stmtsCount());
  }
}
