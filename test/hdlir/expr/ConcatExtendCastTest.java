package hdlir.expr;

import hdlir.IRContext;
import hdlir.except.VarException;
import hdlir.generator.Generator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConcatExtendCastTest {
  IRContext context;
  Generator top;

  @BeforeEach
  void setUp() {
    context = new IRContext();
    top = context.generator("top");
  }

  @Test
  void testConcat() {
    Var a = top.var("a", 4);
    Var b = top.var("b", 4);
    VarConcat ab = a.concat(b);
    Assertions.assertSame(ab, a.concat(b));
    Assertions.assertNotSame(ab, b.concat(a));
    Assertions.assertEquals(8, ab.getWidth());
    Assertions.assertEquals("{a, b}", ab.toString());

    Var c = top.var("c", 4, 1, true);
    Assertions.assertThrows(VarException.class, () -> a.concat(c));
    Assertions.assertThrows(VarException.class, () -> c.concat(a));
  }

  @Test
  void testChainedConcat() {
    Var a = top.var("a", 4);
    Var b = top.var("b", 2);
    Var c = top.var("c", 1);
    VarConcat abc = a.concat(b).concat(c);
    Assertions.assertSame(abc, a.concat(b).concat(c));
    Assertions.assertEquals(7, abc.getWidth());
    Assertions.assertEquals("{a, b, c}", abc.toString());
    Assertions.assertSame(a.concat(b), abc.getBase());
    Assertions.assertEquals("{a, b} + {a, b}", a.concat(b).add(a.concat(b)).toString());
  }

  @Test
  void testExtend() {
    Var a = top.var("a", 4, 1, true);
    VarExtend same = a.extend(4);
    Assertions.assertEquals(4, same.getWidth());
    VarExtend wide = a.extend(16);
    Assertions.assertEquals(16, wide.getWidth());
    Assertions.assertTrue(wide.isSigned());
    Assertions.assertSame(wide, a.extend(16));
    Assertions.assertSame(a, wide.getParentVar());
    Assertions.assertEquals("16'(a)", wide.toString());
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 7})
  void testExtendNarrower(int width) {
    Var a = top.var("a", 8);
    Assertions.assertThrows(VarException.class, () -> a.extend(width));
  }

  @ParameterizedTest
  @ValueSource(ints = {8, 16, 64})
  void testExtendArray(int width) {
    Var arr = top.var("arr", 4, 2);
    Assertions.assertThrows(VarException.class, () -> arr.extend(width));
  }

  @Test
  void testExtendConstant() {
    Const one = context.constant(1, 1, false);
    Assertions.assertEquals(8, one.extend(8).getWidth());
  }

  @Test
  void testCast() {
    Var s = top.var("s", 8, 1, true);
    Assertions.assertSame(s, s.cast(VarCastType.Signed));

    Var u = top.var("u", 8);
    Var signedU = u.cast(VarCastType.Signed);
    Assertions.assertTrue(signedU.isSigned());
    Assertions.assertSame(signedU, u.cast(VarCastType.Signed));
    Assertions.assertEquals("signed'(u)", signedU.toString());
    Assertions.assertEquals("signed'(top.u)", signedU.handleName());
    Assertions.assertEquals("unsigned'(s)", s.cast(VarCastType.Unsigned).toString());

    Var clk = top.var("clk", 1);
    Var asClock = clk.cast(VarCastType.Clock);
    Assertions.assertEquals(1, asClock.getWidth());
    Assertions.assertEquals("clk", asClock.toString());
    Assertions.assertThrows(VarException.class, () -> u.cast(VarCastType.Clock));
    Assertions.assertThrows(VarException.class, () -> u.cast(VarCastType.AsyncReset));
    Assertions.assertThrows(VarException.class, () -> top.var("arr", 1, 2).cast(VarCastType.Reset));
  }
}
