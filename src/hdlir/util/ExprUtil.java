package hdlir.util;

import hdlir.expr.ConditionalExpr;
import hdlir.expr.Var;
import hdlir.generator.Generator;

public class ExprUtil {
  /**
   * Two-way multiplexer {@code cond ? high: low}, built in the generator the operands resolve to.
   * @throws hdlir.except.VarException if {@code cond} is not 1 bit or the data widths differ
   */
  public static ConditionalExpr mux(Var cond, Var high, Var low) {
    Generator owner = high.getGenerator() != null && !high.getGenerator().isConstScope() ? high.getGenerator() : low.getGenerator();
    return owner.conditional(cond, high, low);
  }

  /** Multiplexer with a constant low input of the high input's width and sign. */
  public static ConditionalExpr mux(Var cond, Var high, long low) {
    return mux(cond, high, high.getGenerator().getContext().constant(low, high.getWidth(), high.isSigned()));
  }
}
