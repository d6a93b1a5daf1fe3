package hdlir.expr;

import hdlir.generator.Generator;
import java.util.List;

public class EnumPort extends Port {
  private final EnumType enumType;

  public EnumPort(Generator generator, PortDirection direction, String name, EnumType enumType) {
    super(generator, direction, name, enumType.getWidth(), List.of(1), PortType.Data, false);
    this.enumType = enumType;
  }

  @Override
  public boolean isEnum() {
    return true;
  }

  @Override
  public EnumType getEnumType() {
    return enumType;
  }

  @Override
  public void checkAssignable(Var source) {
    checkSinkKind(source);
    enumType.checkAssignable(this, source);
  }
}
