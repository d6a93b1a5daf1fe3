package hdlir.stmt;

import hdlir.expr.Port;
import hdlir.expr.Port.PortDirection;
import hdlir.generator.Generator;

/** Function implemented outside the design through DPI; only its interface is described. */
public class DPIFunctionStmtBlock extends FunctionStmtBlock {
  private int returnWidth = 0;

  public DPIFunctionStmtBlock(Generator generator, String functionName) { super(generator, functionName); }

  @Override
  public boolean isDpi() {
    return true;
  }

  public Port output(String portName, int width, boolean isSigned) { return addPort(PortDirection.Out, portName, width, isSigned); }

  public int getReturnWidth() { return returnWidth; }
  public void setReturnWidth(int returnWidth) { this.returnWidth = returnWidth; }
}
