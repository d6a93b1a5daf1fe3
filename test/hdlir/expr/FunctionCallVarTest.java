package hdlir.expr;

import hdlir.IRContext;
import hdlir.except.StmtException;
import hdlir.except.VarException;
import hdlir.generator.Generator;
import hdlir.stmt.DPIFunctionStmtBlock;
import hdlir.stmt.FunctionCallStmt;
import hdlir.stmt.FunctionStmtBlock;
import hdlir.stmt.ReturnStmt;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FunctionCallVarTest {
  IRContext context;
  Generator top;
  FunctionStmtBlock add;
  Var x;
  Var y;

  @BeforeEach
  void setUp() {
    context = new IRContext();
    top = context.generator("top");
    add = top.function("add_fn");
    Port a = add.input("a", 8, false);
    Port b = add.input("b", 8, false);
    x = top.var("x", 8);
    y = top.var("y", 8);
    ReturnStmt ret = add.returnStmt(a.add(b));
    add.addStmt(ret);
  }

  private Map<String, Var> args(Var a, Var b) {
    Map<String, Var> result = new LinkedHashMap<>();
    result.put("a", a);
    result.put("b", b);
    return result;
  }

  @Test
  void testCall() {
    FunctionCallVar call = top.call("add_fn", args(x, y));
    Assertions.assertEquals(8, call.getWidth());
    Assertions.assertEquals("add_fn (x, y)", call.toString());
    Assertions.assertEquals(8, add.getFunctionHandler().getWidth());

    add.setPortOrdering(Map.of("b", 0, "a", 1));
    Assertions.assertEquals("add_fn (y, x)", call.toString());

    Var z = top.var("z", 8);
    var stmt = z.assign(call);
    Assertions.assertTrue(x.getSources().contains(stmt));
    Assertions.assertTrue(y.getSources().contains(stmt));
  }

  @Test
  void testArgumentChecks() {
    Assertions.assertThrows(VarException.class, () -> top.call("add_fn", Map.of("a", x)));
    Assertions.assertThrows(VarException.class, () -> top.call("add_fn", args(x, top.var("narrow", 4))));
    Assertions.assertThrows(VarException.class, () -> top.call("add_fn", args(x, top.var("signed_y", 8, 1, true))));
    Map<String, Var> extra = args(x, y);
    extra.put("c", x);
    Assertions.assertThrows(VarException.class, () -> top.call("add_fn", extra));
  }

  @Test
  void testReturnChecks() {
    FunctionStmtBlock noReturn = top.function("no_ret");
    Port a = noReturn.input("a", 8, false);
    Assertions.assertThrows(StmtException.class, () -> top.call("no_ret", Map.of("a", x)));
    // a call statement discards the result
    Assertions.assertEquals(0, new FunctionCallStmt(noReturn, Map.of("a", x)).getVar().getWidth());

    Assertions.assertThrows(StmtException.class, () -> add.returnStmt(top.var("wide", 16)));
    ReturnStmt misplaced = noReturn.returnStmt(a);
    Assertions.assertThrows(StmtException.class, () -> top.combinational().addStmt(misplaced));
    noReturn.addStmt(misplaced);
    Assertions.assertTrue(noReturn.hasReturnValue());
  }

  @Test
  void testDetachedCall() {
    Generator other = context.generator("other");
    FunctionCallVar call = context.call(add, args(x, y));
    Assertions.assertTrue(call.getGenerator().isConstScope());
    Var sink = other.var("sink", 8);
    sink.assign(call);
    Assertions.assertSame(other, call.getGenerator());
    Assertions.assertTrue(other.hasFunction("add_fn"));
    Assertions.assertTrue(other.getCallVars().contains(call));
  }

  @Test
  void testDpiFunction() {
    DPIFunctionStmtBlock dpi = top.dpiFunction("c_hash");
    dpi.input("data", 8, false);
    dpi.output("status", 1, false);
    dpi.setReturnWidth(32);
    Assertions.assertTrue(dpi.isDpi());
    Map<String, Var> args = new LinkedHashMap<>();
    args.put("data", x);
    args.put("status", top.var("status", 1));
    FunctionCallVar call = top.call("c_hash", args);
    Assertions.assertEquals(32, call.getWidth());
  }
}
