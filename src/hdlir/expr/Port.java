package hdlir.expr;

import hdlir.except.VarException;
import hdlir.generator.Generator;
import java.util.List;

/** Module port. Clock and reset typed ports are single bit. */
public class Port extends Var {
  public enum PortDirection { In, Out, InOut }
  public enum PortType { Data, Clock, AsyncReset, ClockEnable, Reset }

  private final PortDirection direction;
  private final PortType portType;
  private boolean activeHigh = true;

  public Port(Generator generator, PortDirection direction, String name, int width, List<Integer> size, PortType portType, boolean isSigned) {
    super(generator, name, width, size, isSigned, VarType.PortIO);
    if (portType != PortType.Data && getWidth() != 1)
      throw new VarException(String.format("%s port %s has to be 1 bit, got width %d", portType, name, getWidth()), this);
    this.direction = direction;
    this.portType = portType;
  }

  public Port(Generator generator, PortDirection direction, String name, int width) {
    this(generator, direction, name, width, List.of(1), PortType.Data, false);
  }

  public PortDirection getDirection() { return direction; }
  public PortType getPortType() { return portType; }
  public boolean isActiveHigh() { return activeHigh; }
  public void setActiveHigh(boolean activeHigh) { this.activeHigh = activeHigh; }
}
